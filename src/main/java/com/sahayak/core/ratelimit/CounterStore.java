package com.sahayak.core.ratelimit;

import java.time.Duration;

/**
 * Fixed-window counters backing the rate limiter.
 */
public interface CounterStore {

    /**
     * Increments the counter for {@code key}, starting a new window of length
     * {@code window} if none is open.
     *
     * @return the count within the current window, including this increment
     */
    long increment(String key, Duration window);
}
