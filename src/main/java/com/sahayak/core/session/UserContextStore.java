package com.sahayak.core.session;

import com.sahayak.core.model.UserContext;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Last reported UI context per user. In memory only.
 */
@Component
public class UserContextStore {

    private final Map<String, UserContext> contexts = new ConcurrentHashMap<>();

    public void update(String userId, UserContext context) {
        contexts.put(userId, context);
    }

    public UserContext get(String userId) {
        return contexts.getOrDefault(userId, UserContext.empty());
    }

    public void discard(String userId) {
        contexts.remove(userId);
    }

    public boolean has(String userId) {
        return contexts.containsKey(userId);
    }
}
