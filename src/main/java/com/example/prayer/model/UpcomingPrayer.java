package com.example.prayer.model;

import lombok.Value;

import java.time.Instant;

@Value
public class UpcomingPrayer {

    private static final UpcomingPrayer UNAVAILABLE = new UpcomingPrayer(null, null, false);

    PrayerId prayer;
    Instant time;
    boolean tomorrow;

    public static UpcomingPrayer unavailable() {
        return UNAVAILABLE;
    }

    public boolean isAvailable() {
        return prayer != null && time != null;
    }
}
