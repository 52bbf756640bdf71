package com.example.prayer.service;

import com.example.prayer.config.AppProperties;
import com.example.prayer.exception.PersistenceException;
import com.example.prayer.exception.PrayerDataException;
import com.example.prayer.model.CacheEntry;
import com.example.prayer.model.Coordinates;
import com.example.prayer.model.DailyTimes;
import com.example.prayer.service.calculation.PrayerCalculator;
import com.example.prayer.service.store.KeyValueStore;
import com.example.prayer.util.Constants;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-day prayer-time cache over the key-value store.
 * <p>
 * Lookups for the same date are serialised on a per-date lock, so concurrent callers wait
 * for one computation and then read its stored result instead of computing again. Stored
 * entries that cannot be read or parsed are treated as misses.
 */
@Service
@Slf4j
public class PrayerScheduleCache {

    private final KeyValueStore keyValueStore;
    private final PrayerCalculator prayerCalculator;
    private final CacheEntryValidator validator;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration entryTimeToLive;

    private final Cache<LocalDate, ReentrantLock> dateLocks = Caffeine.newBuilder().weakValues().build();

    public PrayerScheduleCache(KeyValueStore keyValueStore,
                               PrayerCalculator prayerCalculator,
                               CacheEntryValidator validator,
                               ObjectMapper objectMapper,
                               Clock clock,
                               AppProperties appProperties) {
        this.keyValueStore = keyValueStore;
        this.prayerCalculator = prayerCalculator;
        this.validator = validator;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.entryTimeToLive = appProperties.getCache().getPrayerTimes().getExpireAfterWrite();
    }

    public DailyTimes getOrCompute(LocalDate date, Coordinates location, String method, String legalSchool) {
        ReentrantLock lock = dateLocks.get(date, key -> new ReentrantLock());
        lock.lock();
        try {
            Optional<CacheEntry> stored = readEntry(date);
            if (stored.isPresent() && validator.isServable(stored.get(), location, method, legalSchool)) {
                log.debug("Prayer times cache hit for {}", date);
                return stored.get().getPrayerTimes();
            }
            log.debug("Prayer times cache miss for {} (stored={}), computing", date, stored.isPresent());

            DailyTimes computed = compute(date, location, method, legalSchool);
            writeEntry(date, CacheEntry.create(computed, location, method, legalSchool, clock.instant(), entryTimeToLive));
            return computed;
        } finally {
            lock.unlock();
        }
    }

    public Optional<CacheEntry> peek(LocalDate date) {
        return readEntry(date);
    }

    public void evict(LocalDate date) {
        keyValueStore.delete(cacheKey(date));
        log.info("Evicted cached prayer times for {}", date);
    }

    static String cacheKey(LocalDate date) {
        return Constants.PRAYER_TIMES_KEY_PREFIX + date;
    }

    private DailyTimes compute(LocalDate date, Coordinates location, String method, String legalSchool) {
        DailyTimes computed;
        try {
            computed = prayerCalculator.compute(date, location.getLatitude(), location.getLongitude(), method, legalSchool);
        } catch (PrayerDataException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PrayerDataException("Prayer time calculation failed for " + date, e);
        }
        if (computed == null) {
            throw new PrayerDataException("Calculator returned no prayer times for " + date);
        }
        return computed;
    }

    private Optional<CacheEntry> readEntry(LocalDate date) {
        String key = cacheKey(date);
        Optional<byte[]> bytes;
        try {
            bytes = keyValueStore.get(key);
        } catch (PersistenceException e) {
            log.warn("Could not read cached prayer times for {}: {}", date, e.getMessage());
            return Optional.empty();
        }
        if (bytes.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(bytes.get(), CacheEntry.class));
        } catch (IOException | RuntimeException e) {
            log.warn("Discarding malformed cache entry under {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeEntry(LocalDate date, CacheEntry entry) {
        try {
            keyValueStore.set(cacheKey(date), objectMapper.writeValueAsBytes(entry));
        } catch (JsonProcessingException | PersistenceException e) {
            log.error("Failed to cache prayer times for {}; serving computed times uncached", date, e);
        }
    }
}
