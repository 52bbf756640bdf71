package com.example.prayer.service;

import com.example.prayer.config.AppProperties;
import com.example.prayer.exception.PrayerDataException;
import com.example.prayer.model.DailyTimes;
import com.example.prayer.model.PrayerState;
import com.example.prayer.model.Settings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Periodically recomputes the current and next prayer from offset-adjusted times and
 * publishes the state only when it changes. A tick that arrives while a refresh is still
 * running is skipped.
 */
@Service
@Slf4j
public class PrayerStatePoller {

    private final SettingsService settingsService;
    private final PrayerTimesService prayerTimesService;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final Duration tickInterval;
    private final boolean enabled;

    private final AtomicBoolean refreshing = new AtomicBoolean();
    private final AtomicReference<PrayerState> state = new AtomicReference<>(PrayerState.unavailable());
    private final Sinks.Many<PrayerState> updates = Sinks.many().replay().latest();

    private ScheduledFuture<?> ticker;

    public PrayerStatePoller(SettingsService settingsService,
                             PrayerTimesService prayerTimesService,
                             TaskScheduler taskScheduler,
                             Clock clock,
                             AppProperties appProperties) {
        this.settingsService = settingsService;
        this.prayerTimesService = prayerTimesService;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.tickInterval = appProperties.getPoller().getTickInterval();
        this.enabled = appProperties.getPoller().isEnabled();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (enabled) {
            start();
        } else {
            log.info("Prayer state poller disabled");
        }
    }

    public synchronized void start() {
        if (ticker != null) {
            return;
        }
        tick();
        ticker = taskScheduler.scheduleAtFixedRate(this::tick, clock.instant().plus(tickInterval), tickInterval);
        log.info("Prayer state poller started, tick interval {}", tickInterval);
    }

    public void tick() {
        if (!refreshing.compareAndSet(false, true)) {
            log.debug("Skipping prayer state tick, refresh still in flight");
            return;
        }
        try {
            refresh();
        } catch (RuntimeException e) {
            log.error("Failed to refresh prayer state, keeping last known state", e);
        } finally {
            refreshing.set(false);
        }
    }

    public PrayerState currentState() {
        return state.get();
    }

    public Flux<PrayerState> updates() {
        return updates.asFlux();
    }

    public synchronized void teardown() {
        if (ticker != null) {
            ticker.cancel(false);
            ticker = null;
        }
        updates.tryEmitComplete();
        log.info("Prayer state poller stopped");
    }

    private void refresh() {
        Settings settings = settingsService.current();
        Instant now = clock.instant();
        LocalDate date = prayerTimesService.today();
        DailyTimes today = prayerTimesService.adjustedTimesFor(date, settings);
        DailyTimes tomorrow = today.allPassed(now) ? tomorrowTimes(date.plusDays(1), settings) : null;
        PrayerState next = PrayerState.of(today, tomorrow, now);
        PrayerState previous = state.getAndSet(next);
        if (!next.equals(previous)) {
            log.debug("Prayer state changed: {}", next);
            updates.tryEmitNext(next);
        }
    }

    private DailyTimes tomorrowTimes(LocalDate date, Settings settings) {
        try {
            return prayerTimesService.adjustedTimesFor(date, settings);
        } catch (PrayerDataException e) {
            log.warn("Prayer times for {} unavailable, estimating the next prayer from today: {}", date, e.getMessage());
            return null;
        }
    }
}
