package com.trackly.backend.repository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ScanOptions;

import java.util.Optional;

/**
 * Durable backend on Redis. Learned patterns never expire, so values are
 * written without a TTL.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisKeyValueStore implements KeyValueStore {

    private static final long SCAN_BATCH = 500;

    private final RedisTemplate<String, String> redisTemplate;

    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(key));
        } catch (DataAccessException e) {
            log.error("Failed to read from Redis for key: {}", key, e);
            return Optional.empty();
        }
    }

    @Override
    public boolean set(String key, String value) {
        try {
            redisTemplate.opsForValue().set(key, value);
            log.trace("Saved to Redis: key={} (infinite TTL)", key);
            return true;
        } catch (DataAccessException e) {
            log.error("Failed to write to Redis for key: {}", key, e);
            return false;
        }
    }

    @Override
    public long count(String prefix) {
        ScanOptions options = ScanOptions.scanOptions().match(prefix + "*").count(SCAN_BATCH).build();
        long count = 0;
        // incremental cursor, never KEYS on the live keyspace
        try (Cursor<String> cursor = redisTemplate.scan(options)) {
            while (cursor.hasNext()) {
                cursor.next();
                count++;
            }
            return count;
        } catch (DataAccessException e) {
            log.error("Failed to count Redis keys with prefix: {}", prefix, e);
            return 0;
        }
    }
}
