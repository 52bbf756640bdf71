package com.example.prayer.service;

import com.example.prayer.model.Coordinates;
import com.example.prayer.model.DailyTimes;
import com.example.prayer.model.Settings;
import com.example.prayer.service.location.LocationResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;

@Service
@RequiredArgsConstructor
public class PrayerTimesService {

    private final PrayerScheduleCache prayerScheduleCache;
    private final LocationResolver locationResolver;
    private final Clock clock;

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    /**
     * Raw calculated times for the date, before user offsets.
     */
    public DailyTimes timesFor(LocalDate date, Settings settings) {
        Coordinates location = locationResolver.resolve();
        return prayerScheduleCache.getOrCompute(date, location, settings.getCalculationMethod(), settings.getLegalSchool());
    }

    public DailyTimes timesForToday(Settings settings) {
        return timesFor(today(), settings);
    }

    /**
     * Times with the user's per-prayer minute offsets applied.
     */
    public DailyTimes adjustedTimesFor(LocalDate date, Settings settings) {
        return timesFor(date, settings).withOffsets(settings.getOffsets());
    }
}
