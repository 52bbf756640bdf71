package com.example.prayer.util;

public final class Constants {

    private Constants() {}

    public static final String SETTINGS_KEY = "app_settings";
    public static final String PRAYER_TIMES_KEY_PREFIX = "prayer_times_";
    public static final String PRAYER_HISTORY_KEY_PREFIX = "prayer_history_";
    public static final String STREAK_RECORD_KEY = "prayer_streak_record";

    public static final String SETTINGS_WRITE_RETRY = "settingsWrite";

    public enum PermissionStatus {
        NOT_DETERMINED,
        GRANTED,
        DENIED,
        RESTRICTED
    }

    public enum SoundCategory {
        CALL_TO_PRAYER,
        STANDARD_TONE
    }

    public enum CompletionResult {
        RECORDED,
        ALREADY_RECORDED,
        REJECTED_NOT_YET_DUE,
        REJECTED_UNKNOWN_TIME;

        public boolean isAccepted() {
            return this == RECORDED || this == ALREADY_RECORDED;
        }
    }

    public enum TrendDirection {
        IMPROVING,
        DECLINING,
        STABLE
    }
}
