package com.example.prayer.service;

import com.example.prayer.exception.PersistenceException;
import com.example.prayer.exception.PrayerDataException;
import com.example.prayer.model.PrayerId;
import com.example.prayer.model.Settings;
import com.example.prayer.service.notification.NotificationSink;
import com.example.prayer.util.Constants.PermissionStatus;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Owns the in-memory settings, which stay authoritative even when the store is failing.
 * <p>
 * Settings that change what reminders fire or when are written immediately and trigger a
 * reschedule. Everything else is written through the debounced path.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SettingsService {

    private final SettingsPersistence settingsPersistence;
    private final NotificationOrchestrator notificationOrchestrator;
    private final RemembranceReminderScheduler remembranceReminderScheduler;
    private final NotificationSink notificationSink;

    private final AtomicReference<Settings> state = new AtomicReference<>(Settings.defaults());
    private Disposable permissionSubscription;

    @PostConstruct
    public void initialize() {
        if (settingsPersistence.isStoreWarm()) {
            applyLoaded(settingsPersistence.load());
        } else {
            Settings placeholder = state.get();
            log.warn("Settings store is not warm, serving defaults until the asynchronous load completes");
            settingsPersistence.loadAsync(loaded -> {
                if (state.compareAndSet(placeholder, loaded)) {
                    syncReminders();
                } else {
                    log.info("Settings changed before the asynchronous load completed; keeping local changes");
                }
            });
        }
        permissionSubscription = notificationSink.permissionStatus()
                .subscribe(this::onPermissionStatus,
                        error -> log.error("Permission status stream failed", error));
    }

    public Settings current() {
        return state.get();
    }

    /**
     * Reloads from the store, replacing the in-memory settings.
     */
    public synchronized Settings load() {
        Settings loaded = settingsPersistence.load();
        state.set(loaded);
        return loaded;
    }

    public synchronized void save(Settings settings) {
        Settings normalized = settings.normalized();
        state.set(normalized);
        settingsPersistence.saveNow(normalized);
    }

    /**
     * Applies a change and schedules a debounced write of the resulting state.
     */
    public synchronized Settings updateField(UnaryOperator<Settings> change) {
        Settings updated = state.updateAndGet(current -> change.apply(current).normalized());
        settingsPersistence.scheduleSave(state::get);
        return updated;
    }

    public void updateCalculationMethod(String method) {
        applyCritical("calculationMethod", s -> s.toBuilder().calculationMethod(method).build(), true);
    }

    public void updateLegalSchool(String legalSchool) {
        applyCritical("legalSchool", s -> s.toBuilder().legalSchool(legalSchool).build(), true);
    }

    public void updatePrayerOffset(PrayerId prayer, int minutes) {
        applyCritical("offset." + prayer, s -> s.withOffset(prayer, minutes), true);
    }

    public void updateCallToPrayerSound(String sound) {
        applyCritical("callToPrayerSound", s -> s.toBuilder().callToPrayerSound(sound).build(), true);
    }

    /**
     * @return false when enabling is refused because notification permission was denied
     */
    public boolean updatePrayerNotification(PrayerId prayer, boolean enabled) {
        if (enabled && current().getPermissionStatus() == PermissionStatus.DENIED) {
            log.warn("Refusing to enable {} reminders: notification permission denied", prayer);
            return false;
        }
        applyCritical("notification." + prayer, s -> s.withNotification(prayer, enabled), true);
        return true;
    }

    public boolean updateAllPrayerNotifications(boolean enabled) {
        if (enabled && current().getPermissionStatus() == PermissionStatus.DENIED) {
            log.warn("Refusing to enable all prayer reminders: notification permission denied");
            return false;
        }
        applyCritical("notification.all", s -> s.withAllNotifications(enabled), true);
        return true;
    }

    public void updateRemembranceReminders(boolean enabled) {
        applyCritical("remembranceRemindersEnabled",
                s -> s.toBuilder().remembranceRemindersEnabled(enabled).build(), false);
        syncRemembrance();
    }

    public void updateReminderInterval(int hours) {
        if (hours <= 0) {
            throw new IllegalArgumentException("Reminder interval must be positive: " + hours);
        }
        applyCritical("reminderIntervalHours", s -> s.toBuilder().reminderIntervalHours(hours).build(), false);
        syncRemembrance();
    }

    public synchronized Settings resetToDefaults() {
        Settings defaults = Settings.defaults().toBuilder()
                .permissionStatus(current().getPermissionStatus())
                .build();
        state.set(defaults);
        log.info("Settings reset to defaults");
        PersistenceException failure = saveQuietly(defaults);
        syncReminders();
        rethrowIfFailed(failure);
        return defaults;
    }

    public String exportSettings() {
        return settingsPersistence.toJson(current());
    }

    /**
     * @return false when the document is malformed; current settings are left untouched
     */
    public boolean importSettings(String json) {
        Settings imported;
        try {
            imported = settingsPersistence.fromJson(json);
        } catch (IllegalArgumentException e) {
            log.error("Settings import rejected: {}", e.getMessage());
            return false;
        }
        PersistenceException failure;
        synchronized (this) {
            state.set(imported);
            failure = saveQuietly(imported);
        }
        log.info("Settings imported");
        syncReminders();
        rethrowIfFailed(failure);
        return true;
    }

    /**
     * Rebuilds prayer reminders and makes sure the remembrance timer matches the settings.
     */
    public void rescheduleAll() {
        reschedulePrayers();
        Settings settings = current();
        if (settings.isRemembranceRemindersEnabled() && !remembranceReminderScheduler.isActive()) {
            remembranceReminderScheduler.enable(settings.getReminderIntervalHours());
        }
    }

    public Optional<PersistenceException> lastPersistenceFailure() {
        return settingsPersistence.lastFailure();
    }

    public void teardown() {
        if (permissionSubscription != null) {
            permissionSubscription.dispose();
        }
        settingsPersistence.close();
        log.info("Settings service torn down");
    }

    void onPermissionStatus(PermissionStatus status) {
        if (status == null || status == current().getPermissionStatus()) {
            return;
        }
        log.info("Notification permission status changed to {}", status);
        updateField(s -> s.toBuilder().permissionStatus(status).build());
    }

    private void applyCritical(String name, UnaryOperator<Settings> change, boolean reschedule) {
        PersistenceException failure;
        synchronized (this) {
            Settings previous = state.get();
            Settings updated = change.apply(previous).normalized();
            if (Objects.equals(previous, updated)) {
                log.debug("Setting {} unchanged, skipping save", name);
                return;
            }
            state.set(updated);
            log.info("Critical setting {} changed, saving immediately", name);
            failure = saveQuietly(updated);
        }
        if (reschedule) {
            reschedulePrayers();
        }
        rethrowIfFailed(failure);
    }

    private void applyLoaded(Settings loaded) {
        state.set(loaded);
        syncReminders();
    }

    private void syncReminders() {
        reschedulePrayers();
        syncRemembrance();
    }

    private void syncRemembrance() {
        Settings settings = current();
        if (settings.isRemembranceRemindersEnabled()) {
            remembranceReminderScheduler.enable(settings.getReminderIntervalHours());
        } else {
            remembranceReminderScheduler.disable();
        }
    }

    private void reschedulePrayers() {
        try {
            notificationOrchestrator.recalculateAndReschedule(current());
        } catch (PrayerDataException e) {
            log.warn("Prayer reminders not rescheduled: {}", e.getMessage());
        }
    }

    private PersistenceException saveQuietly(Settings settings) {
        try {
            settingsPersistence.saveNow(settings);
            return null;
        } catch (PersistenceException e) {
            return e;
        }
    }

    private static void rethrowIfFailed(PersistenceException failure) {
        if (failure != null) {
            throw failure;
        }
    }
}
