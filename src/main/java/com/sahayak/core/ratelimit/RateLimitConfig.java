package com.sahayak.core.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * Selects the {@link CounterStore}: Redis when {@code sahayak.rate-limit.store=redis},
 * otherwise process-local counters.
 */
@Configuration
public class RateLimitConfig {

    private static final Logger log = LoggerFactory.getLogger(RateLimitConfig.class);

    @Bean
    @ConditionalOnProperty(prefix = "sahayak.rate-limit", name = "store", havingValue = "redis")
    public CounterStore redisCounterStore(StringRedisTemplate redis) {
        log.info("Rate limit counters stored in Redis");
        return new RedisCounterStore(redis);
    }

    @Bean
    @ConditionalOnMissingBean(CounterStore.class)
    public CounterStore memoryCounterStore() {
        log.info("Rate limit counters stored in memory (not shared between instances)");
        return new InMemoryCounterStore(Clock.systemUTC());
    }
}
