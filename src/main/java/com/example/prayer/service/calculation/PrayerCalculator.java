package com.example.prayer.service.calculation;

import com.example.prayer.model.DailyTimes;

import java.time.LocalDate;

/**
 * Astronomical prayer-time calculation for one day at one position.
 */
public interface PrayerCalculator {

    DailyTimes compute(LocalDate date, double latitude, double longitude, String method, String legalSchool);
}
