package com.example.prayer.config;

import com.example.prayer.model.PrayerId;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

@ConfigurationProperties(prefix = "prayer")
@Data
@Validated
public class AppProperties {

    @NotBlank
    private String zoneId = "UTC";

    @Valid
    private final Cache cache = new Cache();
    @Valid
    private final Settings settings = new Settings();
    @Valid
    private final Poller poller = new Poller();
    @Valid
    private final Reminders reminders = new Reminders();
    @Valid
    private final Location location = new Location();
    @Valid
    private final Calculator calculator = new Calculator();

    @Data
    public static class Cache {
        @Valid
        private final PrayerTimes prayerTimes = new PrayerTimes();
        @Valid
        private final LocationFix location = new LocationFix();
        @Valid
        private final Streaks streaks = new Streaks();

        @Data
        public static class PrayerTimes {
            @NotNull
            private Duration expireAfterWrite = Duration.ofHours(24);
        }

        @Data
        public static class LocationFix {
            @NotNull
            private Duration expireAfterWrite = Duration.ofMinutes(5);
        }

        @Data
        public static class Streaks {
            @Positive
            private int maximumSize = 100;
            @NotNull
            private Duration expireAfterWrite = Duration.ofMinutes(5);
        }
    }

    @Data
    public static class Settings {
        @NotNull
        private Duration debounce = Duration.ofMillis(300);
        @NotNull
        private Duration retryDelay = Duration.ofSeconds(1);
    }

    @Data
    public static class Poller {
        private boolean enabled = true;
        @NotNull
        private Duration tickInterval = Duration.ofMinutes(1);
    }

    @Data
    public static class Reminders {
        @NotBlank
        private String dailyRescheduleCron = "0 5 0 * * *";
        @NotBlank
        private String remembranceTitle = "Dhikr Reminder";
    }

    /**
     * Fixed device position. Leaving either coordinate unset makes the location unavailable.
     */
    @Data
    public static class Location {
        private Double latitude;
        private Double longitude;
    }

    @Data
    public static class Calculator {
        /** Local wall-clock times (HH:mm) used by the simulated calculator. */
        private Map<PrayerId, String> simulatedTimes = defaultTimes();

        private static Map<PrayerId, String> defaultTimes() {
            Map<PrayerId, String> times = new EnumMap<>(PrayerId.class);
            times.put(PrayerId.FAJR, "05:00");
            times.put(PrayerId.SUNRISE, "06:30");
            times.put(PrayerId.DHUHR, "12:30");
            times.put(PrayerId.ASR, "15:45");
            times.put(PrayerId.MAGHRIB, "18:20");
            times.put(PrayerId.ISHA, "19:50");
            return times;
        }
    }
}
