package com.sahayak.core.ratelimit;

import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

/**
 * {@link CounterStore} over Redis {@code INCR} + {@code EXPIRE}, shared by every replica.
 */
public class RedisCounterStore implements CounterStore {

    private final StringRedisTemplate redis;

    public RedisCounterStore(StringRedisTemplate redis) {
        this.redis = redis;
    }

    @Override
    public long increment(String key, Duration window) {
        Long count = redis.opsForValue().increment(key);
        if (count == null) {
            throw new IllegalStateException("Redis INCR returned no value for " + key);
        }
        if (count == 1L) {
            redis.expire(key, window);
        }
        return count;
    }

    /**
     * Round-trips a {@code PING}.
     *
     * @return the server reply, {@code PONG} when healthy
     */
    public String ping() {
        return redis.execute((RedisCallback<String>) RedisConnection::ping);
    }
}
