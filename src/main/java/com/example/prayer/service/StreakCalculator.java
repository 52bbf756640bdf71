package com.example.prayer.service;

import com.example.prayer.model.CompletionRecord;
import com.example.prayer.model.Streak;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;

/**
 * Streak arithmetic over completion records. Records may arrive in any order; a day missing
 * from the input breaks a run just like an incomplete day.
 */
public final class StreakCalculator {

    private StreakCalculator() {}

    public static Streak calculate(Collection<CompletionRecord> records) {
        if (records == null || records.isEmpty()) {
            return Streak.ZERO;
        }
        TreeMap<LocalDate, Boolean> byDate = new TreeMap<>();
        for (CompletionRecord record : records) {
            byDate.merge(record.getDate(), record.isCompleted(), Boolean::logicalOr);
        }
        return new Streak(currentRun(byDate), longestRun(byDate));
    }

    private static int currentRun(TreeMap<LocalDate, Boolean> byDate) {
        int current = 0;
        LocalDate expected = null;
        for (Map.Entry<LocalDate, Boolean> day : byDate.descendingMap().entrySet()) {
            if (!day.getValue() || (expected != null && !day.getKey().equals(expected))) {
                break;
            }
            current++;
            expected = day.getKey().minusDays(1);
        }
        return current;
    }

    private static int longestRun(TreeMap<LocalDate, Boolean> byDate) {
        int longest = 0;
        int run = 0;
        LocalDate previous = null;
        for (Map.Entry<LocalDate, Boolean> day : byDate.entrySet()) {
            if (!day.getValue()) {
                run = 0;
            } else if (run > 0 && day.getKey().equals(previous.plusDays(1))) {
                run++;
            } else {
                run = 1;
            }
            longest = Math.max(longest, run);
            previous = day.getKey();
        }
        return longest;
    }
}
