package com.sahayak.core.ratelimit;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "sahayak.rate-limit")
public class RateLimitProperties {

    private int connectionsPerMinute = 10;
    private int messagesPerSecond = 5;

    /** {@code memory} or {@code redis}. */
    private String store = "memory";

    public int getConnectionsPerMinute() {
        return connectionsPerMinute;
    }

    public void setConnectionsPerMinute(int connectionsPerMinute) {
        this.connectionsPerMinute = connectionsPerMinute;
    }

    public int getMessagesPerSecond() {
        return messagesPerSecond;
    }

    public void setMessagesPerSecond(int messagesPerSecond) {
        this.messagesPerSecond = messagesPerSecond;
    }

    public String getStore() {
        return store;
    }

    public void setStore(String store) {
        this.store = store;
    }
}
