package com.example.prayer.service;

import com.example.prayer.exception.PrayerDataException;
import com.example.prayer.model.DailyTimes;
import com.example.prayer.model.PrayerId;
import com.example.prayer.model.ReminderId;
import com.example.prayer.model.Settings;
import com.example.prayer.service.notification.NotificationSink;
import com.example.prayer.service.notification.ReminderRequest;
import com.example.prayer.util.Constants.SoundCategory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * Rebuilds today's prayer reminders from the current settings. Every run cancels the full
 * prayer id range before scheduling, so repeated runs leave exactly one reminder per enabled
 * prayer.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationOrchestrator {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    private final PrayerTimesService prayerTimesService;
    private final NotificationSink notificationSink;
    private final Clock clock;

    public synchronized void recalculateAndReschedule(Settings settings) {
        DailyTimes today;
        try {
            today = prayerTimesService.timesForToday(settings).withOffsets(settings.getOffsets());
        } catch (PrayerDataException e) {
            log.error("Failed to calculate prayer times for reminders. calculationMethod={}, legalSchool={}, enabledPrayers={}",
                    settings.getCalculationMethod(), settings.getLegalSchool(), settings.enabledPrayers(), e);
            throw e;
        }

        notificationSink.cancelAll(ReminderId.prayerReminders());

        int scheduled = 0;
        for (PrayerId prayer : PrayerId.values()) {
            if (schedulePrayerReminder(prayer, today, settings)) {
                scheduled++;
            }
        }
        log.info("Rescheduled prayer reminders for {}: {} scheduled, sound={}",
                today.getDate(), scheduled, settings.getCallToPrayerSound());
    }

    private boolean schedulePrayerReminder(PrayerId prayer, DailyTimes today, Settings settings) {
        Optional<Instant> time = today.timeOf(prayer);
        if (!settings.isNotificationEnabled(prayer) || time.isEmpty()) {
            log.debug("Skipping reminder for {}: enabled={}, timeAvailable={}",
                    prayer, settings.isNotificationEnabled(prayer), time.isPresent());
            return false;
        }
        if (!time.get().isAfter(clock.instant())) {
            log.debug("Skipping reminder for {}: {} has already passed", prayer, time.get());
            return false;
        }
        notificationSink.schedule(buildReminder(prayer, time.get(), settings));
        return true;
    }

    ReminderRequest buildReminder(PrayerId prayer, Instant time, Settings settings) {
        boolean callToPrayer = prayer.getSoundCategory() == SoundCategory.CALL_TO_PRAYER;
        String title = prayer.getDisplayName() + (callToPrayer ? " Adhan" : " Prayer");
        String body = "Time for " + prayer.getDisplayName() + " prayer - " + TIME_FORMAT.format(time.atZone(clock.getZone()));
        return ReminderRequest.builder()
                .id(ReminderId.forPrayer(prayer))
                .title(title)
                .body(body)
                .fireAt(time)
                .soundCategory(prayer.getSoundCategory())
                .soundFile(callToPrayer ? settings.getCallToPrayerSound() : null)
                .build();
    }
}
