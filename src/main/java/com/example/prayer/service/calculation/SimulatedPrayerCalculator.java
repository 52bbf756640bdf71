package com.example.prayer.service.calculation;

import com.example.prayer.config.AppProperties;
import com.example.prayer.exception.PrayerDataException;
import com.example.prayer.model.DailyTimes;
import com.example.prayer.model.LunarDate;
import com.example.prayer.model.PrayerId;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.chrono.HijrahDate;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.EnumMap;
import java.util.Map;

/**
 * A simulated calculator returning the same configured wall-clock times every day.
 * A real deployment would plug an astronomical library in behind {@link PrayerCalculator}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SimulatedPrayerCalculator implements PrayerCalculator {

    private static final String[] HIJRI_MONTHS = {
        "Muharram", "Safar", "Rabi al-Awwal", "Rabi al-Thani", "Jumada al-Awwal", "Jumada al-Thani",
        "Rajab", "Shaban", "Ramadan", "Shawwal", "Dhu al-Qadah", "Dhu al-Hijjah"
    };

    private final AppProperties appProperties;

    @Override
    public DailyTimes compute(LocalDate date, double latitude, double longitude, String method, String legalSchool) {
        if (Double.isNaN(latitude) || Double.isNaN(longitude) || Math.abs(latitude) > 90 || Math.abs(longitude) > 180) {
            throw new PrayerDataException("Invalid coordinates: " + latitude + "," + longitude);
        }
        ZoneId zone = ZoneId.of(appProperties.getZoneId());
        Map<PrayerId, Instant> times = new EnumMap<>(PrayerId.class);
        appProperties.getCalculator().getSimulatedTimes().forEach((prayer, wallClock) -> {
            if (wallClock == null || wallClock.isBlank()) {
                return;
            }
            try {
                times.put(prayer, date.atTime(LocalTime.parse(wallClock.trim())).atZone(zone).toInstant());
            } catch (DateTimeParseException e) {
                throw new PrayerDataException("Invalid configured time for " + prayer + ": " + wallClock, e);
            }
        });
        log.debug("Simulated prayer times for {} at ({}, {}) method={} school={}: {}",
                date, latitude, longitude, method, legalSchool, times);
        return new DailyTimes(date, times, lunarDateOf(date));
    }

    static LunarDate lunarDateOf(LocalDate date) {
        try {
            HijrahDate hijrah = HijrahDate.from(date);
            int month = hijrah.get(ChronoField.MONTH_OF_YEAR);
            return LunarDate.builder()
                    .day(hijrah.get(ChronoField.DAY_OF_MONTH))
                    .month(month)
                    .year(hijrah.get(ChronoField.YEAR))
                    .monthName(HIJRI_MONTHS[month - 1])
                    .build();
        } catch (DateTimeException e) {
            log.debug("No Hijri date available for {}: {}", date, e.getMessage());
            return null;
        }
    }
}
