package com.sahayak.core.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link CounterStore}. Counts are per JVM, so limits are not
 * shared between replicas.
 */
public class InMemoryCounterStore implements CounterStore {

    static final int EVICTION_THRESHOLD = 10_000;

    private record Window(Instant expiresAt, long count) {}

    private final Map<String, Window> windows = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCounterStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public long increment(String key, Duration window) {
        Instant now = clock.instant();
        if (windows.size() >= EVICTION_THRESHOLD) {
            evictExpired();
        }
        Window updated = windows.compute(key, (k, existing) -> {
            if (existing == null || !now.isBefore(existing.expiresAt())) {
                return new Window(now.plus(window), 1);
            }
            return new Window(existing.expiresAt(), existing.count() + 1);
        });
        return updated.count();
    }

    /**
     * Drops expired windows.
     */
    void evictExpired() {
        Instant now = clock.instant();
        windows.entrySet().removeIf(e -> !now.isBefore(e.getValue().expiresAt()));
    }

    int size() {
        return windows.size();
    }
}
