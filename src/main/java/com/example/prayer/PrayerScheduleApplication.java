package com.example.prayer;

import com.example.prayer.config.AppProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for the Prayer Schedule Service.
 *
 * Keeps a per-day cache of prayer times, persists user settings and completion history
 * in a key-value store, and keeps local reminders in step with both.
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({
    AppProperties.class
})
public class PrayerScheduleApplication {

    public static void main(String[] args) {
        SpringApplication.run(PrayerScheduleApplication.class, args);
    }
}
