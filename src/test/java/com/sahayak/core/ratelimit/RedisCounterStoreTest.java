package com.sahayak.core.ratelimit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class RedisCounterStoreTest {

    private StringRedisTemplate redis;
    private ValueOperations<String, String> ops;
    private RedisCounterStore store;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redis = mock(StringRedisTemplate.class);
        ops = mock(ValueOperations.class);
        when(redis.opsForValue()).thenReturn(ops);
        store = new RedisCounterStore(redis);
    }

    @Test
    @DisplayName("first increment sets the window expiry")
    void firstIncrementExpires() {
        when(ops.increment("ws_msg_rate:u1")).thenReturn(1L);

        assertEquals(1, store.increment("ws_msg_rate:u1", Duration.ofSeconds(1)));
        verify(redis).expire("ws_msg_rate:u1", Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("later increments leave the expiry alone")
    void laterIncrementsKeepExpiry() {
        when(ops.increment("k")).thenReturn(4L);

        assertEquals(4, store.increment("k", Duration.ofSeconds(1)));
        verify(redis, never()).expire(anyString(), any(Duration.class));
    }

    @Test
    @DisplayName("null reply is treated as a store failure")
    void nullReply() {
        when(ops.increment("k")).thenReturn(null);
        assertThrows(IllegalStateException.class, () -> store.increment("k", Duration.ofSeconds(1)));
    }

    @Test
    @DisplayName("ping returns the server reply")
    @SuppressWarnings("unchecked")
    void ping() {
        when(redis.execute(any(RedisCallback.class))).thenReturn("PONG");
        assertEquals("PONG", store.ping());
    }
}
