package com.critter.coordination;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * Selects the coordination store from {@code game.coordination.type}.
 */
@Configuration
@Slf4j
public class CoordinationConfig {

    @Bean
    @ConditionalOnProperty(prefix = "game.coordination", name = "type", havingValue = "redis")
    public CoordinationStore redisCoordinationStore(StringRedisTemplate redisTemplate) {
        log.info("Using Redis coordination store");
        return new RedisCoordinationStore(redisTemplate);
    }

    @Bean
    @ConditionalOnProperty(prefix = "game.coordination", name = "type", havingValue = "memory", matchIfMissing = true)
    public CoordinationStore inMemoryCoordinationStore(Clock clock) {
        log.info("Using in-memory coordination store (single node only)");
        return new InMemoryCoordinationStore(clock);
    }
}
