package com.example.prayer.config;

import com.example.prayer.service.PrayerStatePoller;
import com.example.prayer.service.RemembranceReminderScheduler;
import com.example.prayer.service.SettingsService;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Stops timers and flushes pending settings writes before the scheduler pool shuts down.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ShutdownManager {

    private final PrayerStatePoller prayerStatePoller;
    private final RemembranceReminderScheduler remembranceReminderScheduler;
    private final SettingsService settingsService;

    @PreDestroy
    public void onShutdown() {
        log.info("Initiating graceful shutdown...");
        teardown("PrayerStatePoller", prayerStatePoller::teardown);
        teardown("RemembranceReminderScheduler", remembranceReminderScheduler::teardown);
        teardown("SettingsService", settingsService::teardown);
        log.info("Graceful shutdown completed.");
    }

    private void teardown(String componentName, Runnable action) {
        log.info("Shutting down {}...", componentName);
        try {
            action.run();
        } catch (RuntimeException e) {
            log.error("Shutdown of {} failed", componentName, e);
        }
    }
}
