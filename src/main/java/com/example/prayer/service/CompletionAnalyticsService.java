package com.example.prayer.service;

import com.example.prayer.model.PrayerId;
import com.example.prayer.model.TrendReport;
import com.example.prayer.util.Constants.TrendDirection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Aggregates over the trailing {@code days} days ending today. Rates are relative to the
 * obligatory prayers only.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CompletionAnalyticsService {

    static final double TREND_THRESHOLD = 0.001;
    static final double HIGH_COMPLETION_RATIO = 0.8;

    private static final Set<PrayerId> OBLIGATORY = PrayerId.obligatoryPrayers();

    private final CompletionTracker completionTracker;
    private final Clock clock;

    public Map<PrayerId, Integer> completionCounts(int days) {
        requirePositive(days);
        Map<PrayerId, Integer> counts = new EnumMap<>(PrayerId.class);
        OBLIGATORY.forEach(prayer -> counts.put(prayer, 0));
        for (LocalDate date : window(days)) {
            for (PrayerId prayer : completionTracker.completedOn(date)) {
                if (prayer.isObligatory()) {
                    counts.merge(prayer, 1, Integer::sum);
                }
            }
        }
        return counts;
    }

    public double completionRate(int days) {
        int total = completionCounts(days).values().stream().mapToInt(Integer::intValue).sum();
        return (double) total / (days * OBLIGATORY.size());
    }

    /**
     * Completed flags per obligatory prayer for each day, oldest day first.
     */
    public Map<LocalDate, Map<PrayerId, Boolean>> dailyGrid(int days) {
        requirePositive(days);
        Map<LocalDate, Map<PrayerId, Boolean>> grid = new LinkedHashMap<>();
        for (LocalDate date : window(days)) {
            Set<PrayerId> completed = completionTracker.completedOn(date);
            Map<PrayerId, Boolean> row = new EnumMap<>(PrayerId.class);
            OBLIGATORY.forEach(prayer -> row.put(prayer, completed.contains(prayer)));
            grid.put(date, row);
        }
        return grid;
    }

    public TrendReport analyzeTrends(int days) {
        requirePositive(days);
        List<LocalDate> dates = window(days);
        double[] ratios = new double[dates.size()];
        int[] counts = new int[dates.size()];
        Map<PrayerId, Integer> perPrayer = new EnumMap<>(PrayerId.class);
        OBLIGATORY.forEach(prayer -> perPrayer.put(prayer, 0));

        for (int i = 0; i < dates.size(); i++) {
            Set<PrayerId> completed = EnumSet.noneOf(PrayerId.class);
            completed.addAll(completionTracker.completedOn(dates.get(i)));
            completed.retainAll(OBLIGATORY);
            counts[i] = completed.size();
            ratios[i] = (double) completed.size() / OBLIGATORY.size();
            completed.forEach(prayer -> perPrayer.merge(prayer, 1, Integer::sum));
        }

        double slope = slope(ratios);
        Map<PrayerId, Double> prayerRates = new EnumMap<>(PrayerId.class);
        perPrayer.forEach((prayer, count) -> prayerRates.put(prayer, (double) count / days));

        int best = 0;
        int worst = OBLIGATORY.size();
        int total = 0;
        for (int count : counts) {
            best = Math.max(best, count);
            worst = Math.min(worst, count);
            total += count;
        }
        return TrendReport.builder()
                .days(days)
                .averageCompletionRate(average(ratios))
                .slope(slope)
                .direction(directionOf(slope))
                .bestDayCount(best)
                .worstDayCount(worst)
                .averagePrayersPerDay((double) total / days)
                .prayerRates(prayerRates)
                .build();
    }

    /**
     * Score in [0, 100]: up to 60 for the average rate, +20 when improving or -10 when
     * declining, and up to 20 for the share of days at or above 80% completion.
     */
    public int consistencyScore(int days) {
        TrendReport trend = analyzeTrends(days);
        long highDays = dailyGrid(days).values().stream()
                .filter(row -> row.values().stream().filter(Boolean::booleanValue).count()
                        >= HIGH_COMPLETION_RATIO * OBLIGATORY.size())
                .count();

        double score = trend.getAverageCompletionRate() * 60;
        if (trend.getDirection() == TrendDirection.IMPROVING) {
            score += 20;
        } else if (trend.getDirection() == TrendDirection.DECLINING) {
            score -= 10;
        }
        score += (double) highDays / days * 20;
        return (int) Math.max(0, Math.min(100, Math.round(score)));
    }

    static TrendDirection directionOf(double slope) {
        if (slope > TREND_THRESHOLD) {
            return TrendDirection.IMPROVING;
        }
        if (slope < -TREND_THRESHOLD) {
            return TrendDirection.DECLINING;
        }
        return TrendDirection.STABLE;
    }

    static double slope(double[] values) {
        int n = values.length;
        if (n < 2) {
            return 0;
        }
        double sumX = 0;
        double sumY = 0;
        double sumXY = 0;
        double sumXX = 0;
        for (int x = 0; x < n; x++) {
            sumX += x;
            sumY += values[x];
            sumXY += x * values[x];
            sumXX += (double) x * x;
        }
        return (n * sumXY - sumX * sumY) / (n * sumXX - sumX * sumX);
    }

    private static double average(double[] values) {
        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        return values.length == 0 ? 0 : sum / values.length;
    }

    private List<LocalDate> window(int days) {
        LocalDate today = LocalDate.now(clock);
        List<LocalDate> dates = new ArrayList<>(days);
        for (int offset = days - 1; offset >= 0; offset--) {
            dates.add(today.minusDays(offset));
        }
        return dates;
    }

    private static void requirePositive(int days) {
        if (days <= 0) {
            throw new IllegalArgumentException("days must be positive: " + days);
        }
    }
}
