package com.example.prayer.service;

import com.example.prayer.model.CompletionRecord;
import com.example.prayer.model.PrayerId;
import com.example.prayer.model.Streak;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("StreakCalculator")
class StreakCalculatorTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);

    private static List<CompletionRecord> days(boolean... completed) {
        List<CompletionRecord> records = new ArrayList<>();
        for (int i = 0; i < completed.length; i++) {
            records.add(new CompletionRecord(PrayerId.FAJR, START.plusDays(i), completed[i]));
        }
        return records;
    }

    @Test
    @DisplayName("Empty history has no streak")
    void emptyHistory() {
        assertThat(StreakCalculator.calculate(List.of())).isEqualTo(Streak.ZERO);
        assertThat(StreakCalculator.calculate(null)).isEqualTo(Streak.ZERO);
    }

    @Test
    @DisplayName("A miss breaks the current run but not the longest")
    void missBreaksCurrentRun() {
        assertThat(StreakCalculator.calculate(days(true, true, true, false, true)))
                .isEqualTo(new Streak(1, 3));
    }

    @Test
    @DisplayName("Latest day missed means no current streak")
    void latestDayMissed() {
        assertThat(StreakCalculator.calculate(days(true, true, false)))
                .isEqualTo(new Streak(0, 2));
    }

    @Test
    @DisplayName("Input order does not matter")
    void unorderedInput() {
        List<CompletionRecord> records = days(true, false, true, true, true, true);
        Collections.reverse(records);

        assertThat(StreakCalculator.calculate(records)).isEqualTo(new Streak(4, 4));
    }

    @Test
    @DisplayName("A gap in the dates breaks a run")
    void gapBreaksRun() {
        List<CompletionRecord> records = List.of(
                new CompletionRecord(PrayerId.ASR, START, true),
                new CompletionRecord(PrayerId.ASR, START.plusDays(1), true),
                new CompletionRecord(PrayerId.ASR, START.plusDays(3), true));

        assertThat(StreakCalculator.calculate(records)).isEqualTo(new Streak(1, 2));
    }
}
