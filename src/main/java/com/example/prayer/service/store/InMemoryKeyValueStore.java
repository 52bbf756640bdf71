package com.example.prayer.service.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@Service
@Profile("!redis")
@RequiredArgsConstructor
@Slf4j
public class InMemoryKeyValueStore implements KeyValueStore {

    private final Cache<String, byte[]> keyValueCache;

    @Override
    public Optional<byte[]> get(String key) {
        byte[] value = keyValueCache.getIfPresent(key);
        return value == null ? Optional.empty() : Optional.of(value.clone());
    }

    @Override
    public void set(String key, byte[] value) {
        keyValueCache.put(key, value.clone());
        log.debug("Stored {} bytes in Caffeine under key {}", value.length, key);
    }

    @Override
    public void delete(String key) {
        keyValueCache.invalidate(key);
        log.debug("Removed key {} from Caffeine", key);
    }

    @Override
    public Map<String, Object> getStats() {
        CacheStats stats = keyValueCache.stats();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("backend", "caffeine");
        result.put("entries", keyValueCache.estimatedSize());
        result.put("hitCount", stats.hitCount());
        result.put("missCount", stats.missCount());
        result.put("hitRate", stats.hitRate());
        return result;
    }
}
