package com.example.prayer.service.store;

import java.util.Map;
import java.util.Optional;

/**
 * Durable byte-valued key-value storage. Implementations wrap backend failures in
 * {@link com.example.prayer.exception.PersistenceException}.
 */
public interface KeyValueStore {

    Optional<byte[]> get(String key);

    void set(String key, byte[] value);

    void delete(String key);

    /**
     * Whether a read right now is expected to be fast. Callers use this to decide between a
     * blocking load and an asynchronous one.
     */
    default boolean isWarm() {
        return true;
    }

    Map<String, Object> getStats();
}
