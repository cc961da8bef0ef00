package com.trackly.backend.repository;

import java.util.Optional;

/**
 * Key-value abstraction behind the learned-data store.
 * Allows plug-and-play backends (in-memory, Redis).
 * <p>
 * Values are opaque JSON text. A {@code set} replaces the whole value of one
 * key, so a concurrent {@code get} sees either the old or the new value.
 */
public interface KeyValueStore {

    /**
     * Get the value stored under a key.
     */
    Optional<String> get(String key);

    /**
     * Store a value, replacing any previous one.
     *
     * @return false if the backend rejected the write
     */
    boolean set(String key, String value);

    /**
     * Count the keys starting with a prefix.
     */
    long count(String prefix);
}
