package com.example.prayer.service;

import com.example.prayer.exception.PersistenceException;
import com.example.prayer.exception.PrayerDataException;
import com.example.prayer.model.CompletionRecord;
import com.example.prayer.model.PrayerId;
import com.example.prayer.model.Settings;
import com.example.prayer.model.Streak;
import com.example.prayer.service.store.KeyValueStore;
import com.example.prayer.util.Constants;
import com.example.prayer.util.Constants.CompletionResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Per-day completion history, stored as one JSON array of prayer names per date.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CompletionTracker {

    static final int STREAK_WINDOW_DAYS = 365;

    private static final TypeReference<List<PrayerId>> PRAYER_LIST = new TypeReference<>() {};

    private final KeyValueStore keyValueStore;
    private final ObjectMapper objectMapper;
    private final PrayerTimesService prayerTimesService;
    private final SettingsService settingsService;
    private final Clock clock;
    private final Cache<PrayerId, Streak> streakCache;

    /**
     * Records a completion. Past dates are always accepted. Today is accepted only once the
     * prayer's offset-adjusted time has passed, and future dates never are.
     */
    public synchronized CompletionResult markCompleted(PrayerId prayer, LocalDate date) {
        CompletionResult guard = checkDue(prayer, date);
        if (guard != null) {
            log.info("Completion of {} on {} rejected: {}", prayer, date, guard);
            return guard;
        }
        Set<PrayerId> completed = completedOn(date);
        if (!completed.add(prayer)) {
            return CompletionResult.ALREADY_RECORDED;
        }
        writeDay(date, completed);
        streakCache.invalidate(prayer);
        log.info("Recorded completion of {} on {}", prayer, date);
        updateBestDailyStreak();
        return CompletionResult.RECORDED;
    }

    public synchronized boolean unmark(PrayerId prayer, LocalDate date) {
        Set<PrayerId> completed = completedOn(date);
        if (!completed.remove(prayer)) {
            return false;
        }
        writeDay(date, completed);
        streakCache.invalidate(prayer);
        log.info("Removed completion of {} on {}", prayer, date);
        return true;
    }

    public boolean isCompleted(PrayerId prayer, LocalDate date) {
        return completedOn(date).contains(prayer);
    }

    public boolean isCompletedToday(PrayerId prayer) {
        return isCompleted(prayer, today());
    }

    /**
     * Prayers recorded for the date. An unreadable day is treated as having none.
     */
    public Set<PrayerId> completedOn(LocalDate date) {
        String key = historyKey(date);
        Optional<byte[]> bytes;
        try {
            bytes = keyValueStore.get(key);
        } catch (PersistenceException e) {
            log.warn("Could not read completion history for {}: {}", date, e.getMessage());
            return EnumSet.noneOf(PrayerId.class);
        }
        if (bytes.isEmpty()) {
            return EnumSet.noneOf(PrayerId.class);
        }
        try {
            List<PrayerId> prayers = objectMapper.readValue(bytes.get(), PRAYER_LIST);
            EnumSet<PrayerId> result = EnumSet.noneOf(PrayerId.class);
            if (prayers != null) {
                prayers.stream().filter(p -> p != null).forEach(result::add);
            }
            return result;
        } catch (IOException e) {
            log.warn("Ignoring malformed completion history under {}: '{}'", key,
                    new String(bytes.get(), StandardCharsets.UTF_8));
            return EnumSet.noneOf(PrayerId.class);
        }
    }

    /**
     * One record per day from {@code from} to {@code to}, both inclusive, oldest first.
     */
    public List<CompletionRecord> records(PrayerId prayer, LocalDate from, LocalDate to) {
        List<CompletionRecord> records = new ArrayList<>();
        for (LocalDate date = from; !date.isAfter(to); date = date.plusDays(1)) {
            records.add(new CompletionRecord(prayer, date, isCompleted(prayer, date)));
        }
        return records;
    }

    public Streak computeStreak(List<CompletionRecord> records) {
        return StreakCalculator.calculate(records);
    }

    /**
     * Streak for one prayer over the last year. An unfinished today does not break the
     * current run; it only extends it once recorded.
     */
    public Streak currentStreak(PrayerId prayer) {
        return streakCache.get(prayer, this::loadStreak);
    }

    /**
     * Consecutive days, ending today or yesterday, on which every obligatory prayer was recorded.
     */
    public int dailyStreak() {
        LocalDate day = today();
        if (!allObligatoryCompleted(day)) {
            day = day.minusDays(1);
        }
        int streak = 0;
        while (streak < STREAK_WINDOW_DAYS && allObligatoryCompleted(day)) {
            streak++;
            day = day.minusDays(1);
        }
        return streak;
    }

    public int bestDailyStreak() {
        try {
            return keyValueStore.get(Constants.STREAK_RECORD_KEY)
                    .map(bytes -> new String(bytes, StandardCharsets.UTF_8).trim())
                    .filter(text -> text.matches("\\d+"))
                    .map(Integer::parseInt)
                    .orElse(0);
        } catch (PersistenceException e) {
            log.warn("Could not read best streak record: {}", e.getMessage());
            return 0;
        }
    }

    private Streak loadStreak(PrayerId prayer) {
        LocalDate today = today();
        LocalDate end = isCompleted(prayer, today) ? today : today.minusDays(1);
        return computeStreak(records(prayer, today.minusDays(STREAK_WINDOW_DAYS - 1L), end));
    }

    private boolean allObligatoryCompleted(LocalDate date) {
        return completedOn(date).containsAll(PrayerId.obligatoryPrayers());
    }

    private void updateBestDailyStreak() {
        int streak = dailyStreak();
        if (streak <= bestDailyStreak()) {
            return;
        }
        try {
            keyValueStore.set(Constants.STREAK_RECORD_KEY, String.valueOf(streak).getBytes(StandardCharsets.UTF_8));
            log.info("New best daily streak: {} days", streak);
        } catch (PersistenceException e) {
            log.warn("Could not store best daily streak of {} days: {}", streak, e.getMessage());
        }
    }

    private CompletionResult checkDue(PrayerId prayer, LocalDate date) {
        LocalDate today = today();
        if (date.isAfter(today)) {
            return CompletionResult.REJECTED_NOT_YET_DUE;
        }
        if (date.isBefore(today)) {
            return null;
        }
        Settings settings = settingsService.current();
        Optional<Instant> due;
        try {
            due = prayerTimesService.adjustedTimesFor(date, settings).timeOf(prayer);
        } catch (PrayerDataException e) {
            log.warn("Cannot verify completion of {} on {}: {}", prayer, date, e.getMessage());
            return CompletionResult.REJECTED_UNKNOWN_TIME;
        }
        if (due.isEmpty()) {
            return CompletionResult.REJECTED_UNKNOWN_TIME;
        }
        return due.get().isAfter(clock.instant()) ? CompletionResult.REJECTED_NOT_YET_DUE : null;
    }

    private void writeDay(LocalDate date, Set<PrayerId> completed) {
        try {
            keyValueStore.set(historyKey(date), objectMapper.writeValueAsBytes(new ArrayList<>(completed)));
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize completion history for " + date, e);
        }
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }

    static String historyKey(LocalDate date) {
        return Constants.PRAYER_HISTORY_KEY_PREFIX + date;
    }
}
