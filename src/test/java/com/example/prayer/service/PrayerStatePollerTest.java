package com.example.prayer.service;

import com.example.prayer.TestFixtures;
import com.example.prayer.config.AppProperties;
import com.example.prayer.exception.PrayerDataException;
import com.example.prayer.model.DailyTimes;
import com.example.prayer.model.PrayerId;
import com.example.prayer.model.PrayerState;
import com.example.prayer.model.Settings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;

import static com.example.prayer.TestFixtures.TODAY;
import static com.example.prayer.TestFixtures.at;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("PrayerStatePoller Unit Tests")
class PrayerStatePollerTest {

    @Mock
    private SettingsService settingsService;

    @Mock
    private PrayerTimesService prayerTimesService;

    @Mock
    private TaskScheduler taskScheduler;

    @Mock
    private ScheduledFuture<Object> ticker;

    private final MutableClock clock = new MutableClock(at(TODAY, "13:00"));
    private PrayerStatePoller poller;

    @BeforeEach
    void setUp() {
        poller = new PrayerStatePoller(settingsService, prayerTimesService, taskScheduler, clock, new AppProperties());
    }

    private void timesAvailable() {
        Settings settings = Settings.defaults();
        when(settingsService.current()).thenReturn(settings);
        when(prayerTimesService.today()).thenReturn(TODAY);
        when(prayerTimesService.adjustedTimesFor(any(LocalDate.class), eq(settings)))
                .thenAnswer(invocation -> TestFixtures.dailyTimes(invocation.getArgument(0)));
    }

    @Test
    @DisplayName("Publishes the computed state and suppresses identical ticks")
    void publishesOnlyChanges() {
        timesAvailable();

        poller.tick();
        poller.tick();
        clock.set(at(TODAY, "13:30"));
        poller.tick();
        clock.set(at(TODAY, "16:00"));
        poller.tick();
        poller.teardown();

        StepVerifier.create(poller.updates())
                .assertNext(state -> {
                    assertThat(state.getCurrentPrayer()).isEqualTo(PrayerId.ASR);
                    assertThat(state.getNextPrayer()).isEqualTo(PrayerId.MAGHRIB);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Each distinct state is delivered to a live subscriber exactly once")
    void liveSubscriberSeesEachChangeOnce() {
        timesAvailable();

        StepVerifier.create(poller.updates())
                .then(poller::tick)
                .assertNext(state -> {
                    assertThat(state.getCurrentPrayer()).isEqualTo(PrayerId.DHUHR);
                    assertThat(state.getNextPrayer()).isEqualTo(PrayerId.ASR);
                    assertThat(state.getNextPrayerTime()).isEqualTo(at(TODAY, "15:45"));
                })
                .then(poller::tick)
                .then(() -> clock.set(at(TODAY, "21:00")))
                .then(poller::tick)
                .assertNext(state -> {
                    assertThat(state.getCurrentPrayer()).isEqualTo(PrayerId.ISHA);
                    assertThat(state.getNextPrayer()).isEqualTo(PrayerId.FAJR);
                    assertThat(state.isNextPrayerTomorrow()).isTrue();
                    assertThat(state.getNextPrayerTime()).isEqualTo(at(TODAY.plusDays(1), "05:00"));
                })
                .then(poller::teardown)
                .verifyComplete();
    }

    @Test
    @DisplayName("A failing refresh keeps the last published state")
    void failureKeepsLastState() {
        Settings settings = Settings.defaults();
        when(settingsService.current()).thenReturn(settings);
        when(prayerTimesService.today()).thenReturn(TODAY);
        when(prayerTimesService.adjustedTimesFor(TODAY, settings))
                .thenReturn(TestFixtures.dailyTimes(TODAY))
                .thenThrow(new PrayerDataException("calculator down"));

        poller.tick();
        PrayerState before = poller.currentState();
        poller.tick();

        assertThat(poller.currentState()).isEqualTo(before);
        assertThat(before.getCurrentPrayer()).isEqualTo(PrayerId.DHUHR);
    }

    @Test
    @DisplayName("Start runs an immediate refresh and schedules the fixed-rate tick")
    void startSchedulesTicks() {
        timesAvailable();
        doReturn(ticker).when(taskScheduler)
                .scheduleAtFixedRate(any(Runnable.class), any(Instant.class), eq(Duration.ofMinutes(1)));

        poller.start();
        poller.start();
        poller.teardown();

        verify(taskScheduler).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), eq(Duration.ofMinutes(1)));
        verify(ticker).cancel(false);
        assertThat(poller.currentState().getNextPrayer()).isEqualTo(PrayerId.ASR);
    }

    @Test
    @DisplayName("After Isha the next Fajr comes from the following day's times across a clock change")
    void nextFajrUsesFollowingDayAcrossDaylightSaving() {
        // Given
        ZoneId london = ZoneId.of("Europe/London");
        LocalDate lastGmtDay = LocalDate.of(2024, 3, 30);
        LocalDate firstBstDay = lastGmtDay.plusDays(1);
        Settings settings = Settings.defaults();
        when(settingsService.current()).thenReturn(settings);
        when(prayerTimesService.today()).thenReturn(lastGmtDay);
        when(prayerTimesService.adjustedTimesFor(lastGmtDay, settings)).thenReturn(localTimes(lastGmtDay, london));
        when(prayerTimesService.adjustedTimesFor(firstBstDay, settings)).thenReturn(localTimes(firstBstDay, london));
        clock.set(lastGmtDay.atTime(21, 0).atZone(london).toInstant());

        // When
        poller.tick();

        // Then
        PrayerState state = poller.currentState();
        assertThat(state.getNextPrayer()).isEqualTo(PrayerId.FAJR);
        assertThat(state.isNextPrayerTomorrow()).isTrue();
        assertThat(state.getNextPrayerTime()).isEqualTo(Instant.parse("2024-03-31T04:00:00Z"));
        assertThat(state.getNextPrayerTime().atZone(london).toLocalTime()).isEqualTo(LocalTime.of(5, 0));
    }

    @Test
    @DisplayName("Missing times for the following day fall back to today's first slot a day later")
    void followingDayFailureFallsBack() {
        Settings settings = Settings.defaults();
        when(settingsService.current()).thenReturn(settings);
        when(prayerTimesService.today()).thenReturn(TODAY);
        when(prayerTimesService.adjustedTimesFor(TODAY, settings)).thenReturn(TestFixtures.dailyTimes(TODAY));
        when(prayerTimesService.adjustedTimesFor(TODAY.plusDays(1), settings))
                .thenThrow(new PrayerDataException("calculator down"));
        clock.set(at(TODAY, "22:00"));

        poller.tick();

        assertThat(poller.currentState().getNextPrayer()).isEqualTo(PrayerId.FAJR);
        assertThat(poller.currentState().getNextPrayerTime()).isEqualTo(at(TODAY.plusDays(1), "05:00"));
    }

    private static DailyTimes localTimes(LocalDate date, ZoneId zone) {
        Map<PrayerId, Instant> times = new EnumMap<>(PrayerId.class);
        times.put(PrayerId.FAJR, date.atTime(5, 0).atZone(zone).toInstant());
        times.put(PrayerId.DHUHR, date.atTime(12, 30).atZone(zone).toInstant());
        times.put(PrayerId.ISHA, date.atTime(19, 50).atZone(zone).toInstant());
        return new DailyTimes(date, times, null);
    }

    @Test
    @DisplayName("A day without any slot yields the unavailable state")
    void emptyDayIsUnavailable() {
        assertThat(PrayerState.of(new DailyTimes(TODAY, Map.of(), null), clock.instant()))
                .isEqualTo(PrayerState.unavailable());
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void set(Instant instant) {
            this.now = instant;
        }

        @Override
        public ZoneId getZone() {
            return TestFixtures.ZONE;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
