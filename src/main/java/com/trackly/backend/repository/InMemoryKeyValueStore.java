package com.trackly.backend.repository;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
public class InMemoryKeyValueStore implements KeyValueStore {

    private final Map<String, String> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public boolean set(String key, String value) {
        if (key == null || value == null) {
            log.warn("Refusing to store null key or value (key={})", key);
            return false;
        }
        entries.put(key, value);
        log.trace("Stored in memory: key={}", key);
        return true;
    }

    @Override
    public long count(String prefix) {
        return entries.keySet().stream()
                .filter(key -> key.startsWith(prefix))
                .count();
    }
}
