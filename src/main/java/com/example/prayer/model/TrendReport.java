package com.example.prayer.model;

import com.example.prayer.util.Constants.TrendDirection;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Completion trend over a trailing window of days. {@code slope} is the least-squares slope
 * of the daily completion ratio, per day.
 */
@Value
@Builder
public class TrendReport {
    int days;
    double averageCompletionRate;
    double slope;
    TrendDirection direction;
    int bestDayCount;
    int worstDayCount;
    double averagePrayersPerDay;
    Map<PrayerId, Double> prayerRates;
}
