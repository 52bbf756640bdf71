package com.example.prayer.service;

import com.example.prayer.config.AppProperties;
import com.example.prayer.exception.PersistenceException;
import com.example.prayer.model.Settings;
import com.example.prayer.service.store.KeyValueStore;
import com.example.prayer.util.Constants;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Reads and writes the settings blob.
 * <p>
 * Immediate writes retry once after a short delay. Debounced writes coalesce bursts of
 * changes into a single write of the latest state.
 */
@Component
@Slf4j
public class SettingsPersistence {

    private static final int PREVIEW_LENGTH = 100;

    private final KeyValueStore keyValueStore;
    private final ObjectMapper objectMapper;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final Duration debounce;
    private final Retry writeRetry;

    private final AtomicReference<PersistenceException> lastFailure = new AtomicReference<>();

    // Held from reading the value to storing it, so an older snapshot never lands after a newer one.
    private final ReentrantLock writeLock = new ReentrantLock();

    private ScheduledFuture<?> pendingSave;
    private Supplier<Settings> pendingSource;

    public SettingsPersistence(KeyValueStore keyValueStore,
                               ObjectMapper objectMapper,
                               TaskScheduler taskScheduler,
                               Clock clock,
                               RetryRegistry retryRegistry,
                               AppProperties appProperties) {
        this.keyValueStore = keyValueStore;
        this.objectMapper = objectMapper;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.debounce = appProperties.getSettings().getDebounce();
        this.writeRetry = retryRegistry.retry(Constants.SETTINGS_WRITE_RETRY, RetryConfig.custom()
                .maxAttempts(2)
                .waitDuration(appProperties.getSettings().getRetryDelay())
                .retryExceptions(PersistenceException.class)
                .build());
        this.writeRetry.getEventPublisher()
                .onRetry(event -> log.warn("Settings write failed (attempt {}), retrying: {}",
                        event.getNumberOfRetryAttempts(), String.valueOf(event.getLastThrowable())));
    }

    public boolean isStoreWarm() {
        return keyValueStore.isWarm();
    }

    /**
     * Loads stored settings. A missing or unparseable blob is replaced by persisted defaults;
     * a failed read returns defaults without touching the store.
     */
    public Settings load() {
        Optional<byte[]> stored;
        try {
            stored = keyValueStore.get(Constants.SETTINGS_KEY);
        } catch (PersistenceException e) {
            log.error("Error reading stored settings, using defaults", e);
            return Settings.defaults();
        }
        if (stored.isEmpty() || stored.get().length == 0) {
            log.info("No stored settings found, persisting defaults");
            return persistDefaults();
        }
        try {
            Settings loaded = objectMapper.readValue(stored.get(), Settings.class).normalized();
            log.info("Settings loaded: calculationMethod={}, legalSchool={}, {} bytes",
                    loaded.getCalculationMethod(), loaded.getLegalSchool(), stored.get().length);
            return loaded;
        } catch (IOException | RuntimeException e) {
            log.error("Error parsing stored settings, resetting to defaults. preview='{}'", preview(stored.get()), e);
            return persistDefaults();
        }
    }

    public void loadAsync(Consumer<Settings> onLoaded) {
        taskScheduler.schedule(() -> onLoaded.accept(load()), clock.instant());
    }

    /**
     * Writes immediately, replacing any pending debounced write.
     *
     * @throws PersistenceException when the write still fails after the retry
     */
    public void saveNow(Settings settings) {
        writeLock.lock();
        try {
            cancelPendingSave();
            write(settings);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Schedules a write of whatever {@code source} returns once the debounce window passes
     * without another call.
     */
    public synchronized void scheduleSave(Supplier<Settings> source) {
        if (pendingSave != null) {
            pendingSave.cancel(false);
        }
        pendingSource = source;
        pendingSave = taskScheduler.schedule(this::flushPending, clock.instant().plus(debounce));
    }

    public synchronized boolean hasPendingSave() {
        return pendingSource != null;
    }

    /**
     * Cancels the debounce timer and writes any pending change synchronously.
     */
    public void close() {
        writeLock.lock();
        try {
            Supplier<Settings> source;
            synchronized (this) {
                if (pendingSave != null) {
                    pendingSave.cancel(false);
                    pendingSave = null;
                }
                source = pendingSource;
                pendingSource = null;
            }
            if (source != null) {
                log.info("Flushing pending settings write before shutdown");
                write(source.get());
            }
        } finally {
            writeLock.unlock();
        }
    }

    public Optional<PersistenceException> lastFailure() {
        return Optional.ofNullable(lastFailure.get());
    }

    public String toJson(Settings settings) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(settings);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize settings", e);
        }
    }

    /**
     * @throws IllegalArgumentException when the text is not a valid settings document
     */
    public Settings fromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("Settings document is empty");
        }
        try {
            Settings parsed = objectMapper.readValue(json, Settings.class);
            if (parsed == null) {
                throw new IllegalArgumentException("Settings document is null");
            }
            return parsed.normalized();
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed settings document: " + e.getOriginalMessage(), e);
        }
    }

    void flushPending() {
        writeLock.lock();
        try {
            Supplier<Settings> source;
            synchronized (this) {
                source = pendingSource;
                pendingSource = null;
                pendingSave = null;
            }
            if (source == null) {
                return;
            }
            write(source.get());
            log.debug("Debounced settings write completed");
        } catch (PersistenceException e) {
            log.warn("Debounced settings write dropped, next change will retry: {}", e.getMessage());
        } finally {
            writeLock.unlock();
        }
    }

    private void write(Settings settings) {
        byte[] json = serialize(settings);
        writeLock.lock();
        try {
            writeRetry.executeRunnable(() -> keyValueStore.set(Constants.SETTINGS_KEY, json));
            lastFailure.set(null);
            log.debug("Settings saved ({} bytes)", json.length);
        } catch (PersistenceException e) {
            lastFailure.set(e);
            log.error("Settings write failed after retry; in-memory settings remain authoritative", e);
            throw e;
        } finally {
            writeLock.unlock();
        }
    }

    private synchronized void cancelPendingSave() {
        if (pendingSave != null) {
            pendingSave.cancel(false);
            pendingSave = null;
        }
        pendingSource = null;
    }

    private Settings persistDefaults() {
        Settings defaults = Settings.defaults();
        try {
            write(defaults);
        } catch (PersistenceException e) {
            log.warn("Could not persist default settings: {}", e.getMessage());
        }
        return defaults;
    }

    private byte[] serialize(Settings settings) {
        try {
            return objectMapper.writeValueAsBytes(settings);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize settings", e);
        }
    }

    private static String preview(byte[] bytes) {
        String text = new String(bytes, StandardCharsets.UTF_8);
        return text.length() <= PREVIEW_LENGTH ? text : text.substring(0, PREVIEW_LENGTH) + "...";
    }
}
