package com.trackly.backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trackly.backend.repository.InMemoryKeyValueStore;
import com.trackly.backend.repository.KeyValueStore;
import com.trackly.backend.repository.LearnedDataRepository;
import com.trackly.backend.repository.RedisKeyValueStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.RedisTemplate;

/**
 * Configuration for the learned-data store.
 * The backend is picked by {@code pattern-store.backend} (memory or redis).
 */
@Configuration
@Slf4j
public class StoreConfig {

    @Bean
    @ConditionalOnProperty(name = "pattern-store.backend", havingValue = "memory", matchIfMissing = true)
    public KeyValueStore inMemoryKeyValueStore() {
        log.info("🗄️ Pattern store backend: in-memory (learned data is lost on restart)");
        return new InMemoryKeyValueStore();
    }

    @Bean
    @ConditionalOnProperty(name = "pattern-store.backend", havingValue = "redis")
    public KeyValueStore redisKeyValueStore(RedisTemplate<String, String> redisTemplate) {
        log.info("🗄️ Pattern store backend: Redis");
        return new RedisKeyValueStore(redisTemplate);
    }

    @Bean
    public LearnedDataRepository learnedDataRepository(KeyValueStore keyValueStore, ObjectMapper objectMapper) {
        return new LearnedDataRepository(keyValueStore, objectMapper);
    }
}
