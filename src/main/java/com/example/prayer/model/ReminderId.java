package com.example.prayer.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Fixed identifier space for the reminders this service owns. Re-scheduling always
 * reuses these ids, which is what keeps cancel-then-schedule idempotent.
 */
@Getter
@RequiredArgsConstructor
public enum ReminderId {
    FAJR(0),
    SUNRISE(1),
    DHUHR(2),
    ASR(3),
    MAGHRIB(4),
    ISHA(5),
    REMEMBRANCE(9999);

    private static final Set<ReminderId> PRAYER_REMINDERS =
            Collections.unmodifiableSet(EnumSet.range(FAJR, ISHA));

    private final int code;

    public static ReminderId forPrayer(PrayerId prayer) {
        return valueOf(prayer.name());
    }

    public static Set<ReminderId> prayerReminders() {
        return PRAYER_REMINDERS;
    }
}
