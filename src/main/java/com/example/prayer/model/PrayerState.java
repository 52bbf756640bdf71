package com.example.prayer.model;

import lombok.Value;

import java.time.Instant;

/**
 * Snapshot of where "now" sits within the day's prayers. {@code currentPrayer} is null
 * before the first slot; the next-prayer fields are null when no slot is available.
 */
@Value
public class PrayerState {

    private static final PrayerState UNAVAILABLE = new PrayerState(null, null, null, false);

    PrayerId currentPrayer;
    PrayerId nextPrayer;
    Instant nextPrayerTime;
    boolean nextPrayerTomorrow;

    public static PrayerState unavailable() {
        return UNAVAILABLE;
    }

    public static PrayerState of(DailyTimes times, Instant now) {
        return of(times, null, now);
    }

    /**
     * @param following the next day's times, used once every slot of {@code times} has passed;
     *                  may be null
     */
    public static PrayerState of(DailyTimes times, DailyTimes following, Instant now) {
        if (times == null || !times.hasAnySlot()) {
            return UNAVAILABLE;
        }
        UpcomingPrayer next = times.nextPrayer(now, following);
        return new PrayerState(
                times.currentPrayer(now).orElse(null),
                next.getPrayer(),
                next.getTime(),
                next.isTomorrow());
    }
}
