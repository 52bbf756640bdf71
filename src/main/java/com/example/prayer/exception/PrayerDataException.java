package com.example.prayer.exception;

/**
 * Thrown when prayer times cannot be produced for a date, typically because the calculator failed.
 * No retry is attempted; callers decide whether to surface or degrade.
 */
public class PrayerDataException extends RuntimeException {
    public PrayerDataException(String message) {
        super(message);
    }

    public PrayerDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
