package com.example.prayer.model;

import com.example.prayer.util.Constants.PermissionStatus;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * User preferences that drive calculation and reminders. Instances are immutable; every
 * update produces a new, normalised copy with exactly one offset and one toggle per prayer.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Settings {

    public static final String DEFAULT_CALCULATION_METHOD = "Auto";
    public static final String DEFAULT_LEGAL_SCHOOL = "hanafi";
    public static final int DEFAULT_REMINDER_INTERVAL_HOURS = 4;
    public static final String DEFAULT_CALL_TO_PRAYER_SOUND = "makkah_adhan.mp3";

    @Builder.Default
    String calculationMethod = DEFAULT_CALCULATION_METHOD;

    @Builder.Default
    String legalSchool = DEFAULT_LEGAL_SCHOOL;

    Map<PrayerId, Integer> offsets;

    Map<PrayerId, Boolean> notificationsEnabled;

    boolean remembranceRemindersEnabled;

    @Builder.Default
    int reminderIntervalHours = DEFAULT_REMINDER_INTERVAL_HOURS;

    @Builder.Default
    String callToPrayerSound = DEFAULT_CALL_TO_PRAYER_SOUND;

    @Builder.Default
    PermissionStatus permissionStatus = PermissionStatus.NOT_DETERMINED;

    public static Settings defaults() {
        return Settings.builder().build().normalized();
    }

    public Settings normalized() {
        EnumMap<PrayerId, Integer> normalizedOffsets = new EnumMap<>(PrayerId.class);
        EnumMap<PrayerId, Boolean> normalizedToggles = new EnumMap<>(PrayerId.class);
        for (PrayerId prayer : PrayerId.values()) {
            Integer offset = offsets == null ? null : offsets.get(prayer);
            Boolean enabled = notificationsEnabled == null ? null : notificationsEnabled.get(prayer);
            normalizedOffsets.put(prayer, offset == null ? 0 : offset);
            normalizedToggles.put(prayer, enabled == null ? Boolean.TRUE : enabled);
        }
        return toBuilder()
                .calculationMethod(isBlank(calculationMethod) ? DEFAULT_CALCULATION_METHOD : calculationMethod)
                .legalSchool(isBlank(legalSchool) ? DEFAULT_LEGAL_SCHOOL : legalSchool)
                .offsets(Collections.unmodifiableMap(normalizedOffsets))
                .notificationsEnabled(Collections.unmodifiableMap(normalizedToggles))
                .reminderIntervalHours(reminderIntervalHours > 0 ? reminderIntervalHours : DEFAULT_REMINDER_INTERVAL_HOURS)
                .callToPrayerSound(isBlank(callToPrayerSound) ? DEFAULT_CALL_TO_PRAYER_SOUND : callToPrayerSound)
                .permissionStatus(permissionStatus == null ? PermissionStatus.NOT_DETERMINED : permissionStatus)
                .build();
    }

    public int offsetFor(PrayerId prayer) {
        Integer offset = offsets == null ? null : offsets.get(prayer);
        return offset == null ? 0 : offset;
    }

    public boolean isNotificationEnabled(PrayerId prayer) {
        Boolean enabled = notificationsEnabled == null ? null : notificationsEnabled.get(prayer);
        return enabled == null || enabled;
    }

    public Set<PrayerId> enabledPrayers() {
        EnumSet<PrayerId> enabled = EnumSet.noneOf(PrayerId.class);
        for (PrayerId prayer : PrayerId.values()) {
            if (isNotificationEnabled(prayer)) {
                enabled.add(prayer);
            }
        }
        return enabled;
    }

    public Settings withOffset(PrayerId prayer, int minutes) {
        Map<PrayerId, Integer> updated = new EnumMap<>(normalized().getOffsets());
        updated.put(prayer, minutes);
        return toBuilder().offsets(updated).build().normalized();
    }

    public Settings withNotification(PrayerId prayer, boolean enabled) {
        Map<PrayerId, Boolean> updated = new EnumMap<>(normalized().getNotificationsEnabled());
        updated.put(prayer, enabled);
        return toBuilder().notificationsEnabled(updated).build().normalized();
    }

    public Settings withAllNotifications(boolean enabled) {
        Map<PrayerId, Boolean> updated = new EnumMap<>(PrayerId.class);
        for (PrayerId prayer : PrayerId.values()) {
            updated.put(prayer, enabled);
        }
        return toBuilder().notificationsEnabled(updated).build().normalized();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
