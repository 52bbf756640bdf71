package com.example.prayer.service;

import com.example.prayer.config.AppProperties;
import com.example.prayer.model.ReminderId;
import com.example.prayer.service.notification.NotificationSink;
import com.example.prayer.service.notification.ReminderRequest;
import com.example.prayer.util.Constants.SoundCategory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * Recurring remembrance (dhikr) reminder. A single reminder is kept pending at now + interval;
 * when it fires, the timer re-arms the next one.
 */
@Service
@Slf4j
public class RemembranceReminderScheduler {

    static final List<String> PHRASES = List.of(
            "SubhanAllah", "Alhamdulillah", "Allahu Akbar", "La ilaha illallah", "Astaghfirullah");

    private final NotificationSink notificationSink;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final String title;

    private ScheduledFuture<?> nextOccurrence;
    private int intervalHours;
    private long generation;
    private int occurrences;

    public RemembranceReminderScheduler(NotificationSink notificationSink,
                                        TaskScheduler taskScheduler,
                                        Clock clock,
                                        AppProperties appProperties) {
        this.notificationSink = notificationSink;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.title = appProperties.getReminders().getRemembranceTitle();
    }

    public synchronized void enable(int intervalHours) {
        if (intervalHours <= 0) {
            throw new IllegalArgumentException("Reminder interval must be positive: " + intervalHours);
        }
        stop();
        this.intervalHours = intervalHours;
        arm();
        log.info("Remembrance reminders enabled every {}h", intervalHours);
    }

    public synchronized void disable() {
        stop();
        log.info("Remembrance reminders disabled");
    }

    public synchronized boolean isActive() {
        return nextOccurrence != null;
    }

    /**
     * Stops the re-arming timer without touching the pending reminder.
     */
    public synchronized void teardown() {
        cancelTimer();
        intervalHours = 0;
        generation++;
    }

    synchronized void onOccurrence(long scheduledGeneration) {
        if (scheduledGeneration != generation || intervalHours <= 0) {
            return;
        }
        occurrences++;
        arm();
    }

    private void arm() {
        Instant fireAt = clock.instant().plus(Duration.ofHours(intervalHours));
        notificationSink.schedule(ReminderRequest.builder()
                .id(ReminderId.REMEMBRANCE)
                .title(title)
                .body(PHRASES.get(occurrences % PHRASES.size()))
                .fireAt(fireAt)
                .soundCategory(SoundCategory.STANDARD_TONE)
                .build());
        long armedGeneration = ++generation;
        nextOccurrence = taskScheduler.schedule(() -> onOccurrence(armedGeneration), fireAt);
        log.debug("Next remembrance reminder at {}", fireAt);
    }

    private void stop() {
        cancelTimer();
        notificationSink.cancel(ReminderId.REMEMBRANCE);
        intervalHours = 0;
        generation++;
    }

    private void cancelTimer() {
        if (nextOccurrence != null) {
            nextOccurrence.cancel(false);
            nextOccurrence = null;
        }
    }
}
