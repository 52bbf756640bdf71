package com.example.prayer.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.time.Instant;

/**
 * A stored day of prayer times together with the parameters it was computed for.
 */
@Value
@Builder
@Jacksonized
public class CacheEntry {
    DailyTimes prayerTimes;
    double latitude;
    double longitude;
    String method;
    String legalSchool;
    Instant cachedAt;
    Instant expiresAt;

    public static CacheEntry create(DailyTimes prayerTimes, Coordinates location, String method,
                                    String legalSchool, Instant now, Duration timeToLive) {
        return CacheEntry.builder()
                .prayerTimes(prayerTimes)
                .latitude(location.getLatitude())
                .longitude(location.getLongitude())
                .method(method)
                .legalSchool(legalSchool)
                .cachedAt(now)
                .expiresAt(now.plus(timeToLive))
                .build();
    }
}
