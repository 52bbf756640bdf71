package com.example.prayer.service.store;

import com.example.prayer.exception.PersistenceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@Service
@Profile("redis")
@RequiredArgsConstructor
@Slf4j
public class RedisKeyValueStore implements KeyValueStore {

    private final RedisTemplate<String, byte[]> bytesRedisTemplate;

    @Override
    public Optional<byte[]> get(String key) {
        try {
            return Optional.ofNullable(bytesRedisTemplate.opsForValue().get(key));
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to read key " + key + " from Redis", e);
        }
    }

    @Override
    public void set(String key, byte[] value) {
        try {
            bytesRedisTemplate.opsForValue().set(key, value);
            log.debug("Stored {} bytes in Redis under key {}", value.length, key);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to write key " + key + " to Redis", e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            bytesRedisTemplate.delete(key);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to delete key " + key + " from Redis", e);
        }
    }

    @Override
    public boolean isWarm() {
        try {
            String reply = bytesRedisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
            return "PONG".equalsIgnoreCase(reply);
        } catch (DataAccessException e) {
            log.warn("Redis ping failed, treating store as cold: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public Map<String, Object> getStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("backend", "redis");
        try {
            Long size = bytesRedisTemplate.execute((RedisCallback<Long>) connection -> connection.serverCommands().dbSize());
            stats.put("entries", size);
        } catch (DataAccessException e) {
            log.error("Failed to get Redis store stats", e);
            stats.put("error", e.getMessage());
        }
        return stats;
    }
}
