package com.trackly.backend.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trackly.backend.model.HealthStats;
import com.trackly.backend.model.RecentArrival;
import com.trackly.backend.model.TrainPattern;
import com.trackly.backend.util.StoreKeys;
import com.trackly.backend.util.TimeBucket;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Typed access to learned patterns, recent arrivals and learning stats, stored
 * as JSON under the keys defined in {@link StoreKeys}.
 */
@Slf4j
@RequiredArgsConstructor
public class LearnedDataRepository implements LearnedDataWriter {

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;

    @Override
    public Optional<TrainPattern> findPattern(String destination, TimeBucket bucket, String trainNum) {
        return read(StoreKeys.pattern(destination, bucket, trainNum), TrainPattern.class);
    }

    @Override
    public Optional<RecentArrival> findRecentArrival(String destination) {
        return read(StoreKeys.arrival(destination), RecentArrival.class);
    }

    @Override
    public Optional<HealthStats> findStats() {
        return read(StoreKeys.STATS, HealthStats.class);
    }

    @Override
    public boolean savePattern(String destination, TimeBucket bucket, String trainNum, TrainPattern pattern) {
        return write(StoreKeys.pattern(destination, bucket, trainNum), pattern);
    }

    @Override
    public boolean saveRecentArrival(String destination, RecentArrival arrival) {
        return write(StoreKeys.arrival(destination), arrival);
    }

    @Override
    public boolean saveStats(HealthStats stats) {
        return write(StoreKeys.STATS, stats);
    }

    @Override
    public long countPatterns() {
        return store.count(StoreKeys.PATTERN_PREFIX);
    }

    private <T> Optional<T> read(String key, Class<T> valueType) {
        Optional<String> json = store.get(key);
        if (json.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(json.get(), valueType));
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize object for key: {}", key, e);
            return Optional.empty();
        }
    }

    private boolean write(String key, Object value) {
        try {
            return store.set(key, objectMapper.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize object for key: {}", key, e);
            return false;
        }
    }
}
