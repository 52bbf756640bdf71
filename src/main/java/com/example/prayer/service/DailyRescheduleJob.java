package com.example.prayer.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class DailyRescheduleJob {

    private final SettingsService settingsService;

    @Scheduled(cron = "${prayer.reminders.daily-reschedule-cron:0 5 0 * * *}", zone = "${prayer.zone-id:UTC}")
    public void rescheduleForNewDay() {
        log.info("Rescheduling reminders for the new day...");
        try {
            settingsService.rescheduleAll();
        } catch (RuntimeException e) {
            log.error("Daily reminder reschedule failed", e);
        }
    }
}
