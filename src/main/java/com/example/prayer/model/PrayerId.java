package com.example.prayer.model;

import com.example.prayer.util.Constants.SoundCategory;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * The daily prayer slots in chronological order, from pre-dawn to night.
 * Sunrise is tracked for fasting purposes and is not an obligatory prayer.
 */
@Getter
@RequiredArgsConstructor
public enum PrayerId {
    FAJR("Fajr", true, SoundCategory.STANDARD_TONE),
    SUNRISE("Sunrise", false, SoundCategory.STANDARD_TONE),
    DHUHR("Dhuhr", true, SoundCategory.CALL_TO_PRAYER),
    ASR("Asr", true, SoundCategory.CALL_TO_PRAYER),
    MAGHRIB("Maghrib", true, SoundCategory.CALL_TO_PRAYER),
    ISHA("Isha", true, SoundCategory.CALL_TO_PRAYER);

    private final String displayName;
    private final boolean obligatory;
    private final SoundCategory soundCategory;

    public static Set<PrayerId> obligatoryPrayers() {
        EnumSet<PrayerId> prayers = EnumSet.noneOf(PrayerId.class);
        for (PrayerId prayer : values()) {
            if (prayer.obligatory) {
                prayers.add(prayer);
            }
        }
        return prayers;
    }

    /**
     * Case-insensitive lookup, accepting both {@code FAJR} and {@code fajr}.
     */
    public static PrayerId fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Prayer name must not be blank");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(prayer -> prayer.name().equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown prayer: " + value));
    }
}
