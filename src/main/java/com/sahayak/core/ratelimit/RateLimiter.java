package com.sahayak.core.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Per-user limits on new connections and inbound messages.
 * <p>
 * Only enforced in the {@code production} environment. When the counter store
 * is unreachable both checks allow the request.
 */
@Component
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    static final String CONNECTION_KEY_PREFIX = "ws_conn_rate:";
    static final String MESSAGE_KEY_PREFIX = "ws_msg_rate:";
    private static final Duration CONNECTION_WINDOW = Duration.ofMinutes(1);
    private static final Duration MESSAGE_WINDOW = Duration.ofSeconds(1);

    private final CounterStore store;
    private final RateLimitProperties properties;
    private final boolean enabled;

    @Autowired
    public RateLimiter(CounterStore store, RateLimitProperties properties,
                       @Value("${sahayak.environment:development}") String environment) {
        this(store, properties, "production".equalsIgnoreCase(environment));
        log.info("Rate limiting {} (environment: {})", enabled ? "enabled" : "disabled", environment);
    }

    RateLimiter(CounterStore store, RateLimitProperties properties, boolean enabled) {
        this.store = store;
        this.properties = properties;
        this.enabled = enabled;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean checkConnection(String userId) {
        return check(CONNECTION_KEY_PREFIX + userId, CONNECTION_WINDOW, properties.getConnectionsPerMinute());
    }

    public boolean checkMessage(String userId) {
        return check(MESSAGE_KEY_PREFIX + userId, MESSAGE_WINDOW, properties.getMessagesPerSecond());
    }

    private boolean check(String key, Duration window, int limit) {
        if (!enabled) {
            return true;
        }
        try {
            return store.increment(key, window) <= limit;
        } catch (RuntimeException e) {
            log.warn("Rate limit check for {} failed, allowing: {}", key, e.getMessage());
            return true;
        }
    }
}
