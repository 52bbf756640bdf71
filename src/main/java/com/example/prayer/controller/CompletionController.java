package com.example.prayer.controller;

import com.example.prayer.dto.CompletionResponse;
import com.example.prayer.model.PrayerId;
import com.example.prayer.model.Streak;
import com.example.prayer.model.TrendReport;
import com.example.prayer.service.CompletionAnalyticsService;
import com.example.prayer.service.CompletionTracker;
import com.example.prayer.util.Constants.CompletionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/prayer/completions")
@RequiredArgsConstructor
@Slf4j
public class CompletionController {

    private final CompletionTracker completionTracker;
    private final CompletionAnalyticsService analyticsService;
    private final Clock clock;

    @PostMapping("/{prayer}")
    public ResponseEntity<CompletionResponse> markCompleted(
            @PathVariable PrayerId prayer,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        LocalDate day = date != null ? date : LocalDate.now(clock);
        log.info("Marking {} completed on {}", prayer, day);
        CompletionResult result = completionTracker.markCompleted(prayer, day);
        HttpStatus status = result.isAccepted() ? HttpStatus.OK : HttpStatus.CONFLICT;
        return ResponseEntity.status(status).body(new CompletionResponse(prayer, day, result));
    }

    @DeleteMapping("/{prayer}")
    public ResponseEntity<Void> unmark(
            @PathVariable PrayerId prayer,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        LocalDate day = date != null ? date : LocalDate.now(clock);
        log.info("Removing completion of {} on {}", prayer, day);
        return completionTracker.unmark(prayer, day)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @GetMapping("/{prayer}/streak")
    public ResponseEntity<Streak> getStreak(@PathVariable PrayerId prayer) {
        return ResponseEntity.ok(completionTracker.currentStreak(prayer));
    }

    @GetMapping("/daily-streak")
    public ResponseEntity<Map<String, Integer>> getDailyStreak() {
        Map<String, Integer> body = new LinkedHashMap<>();
        body.put("current", completionTracker.dailyStreak());
        body.put("best", completionTracker.bestDailyStreak());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<PrayerId, Integer>> getStats(@RequestParam(defaultValue = "7") int days) {
        log.info("Retrieving completion counts for the last {} days", days);
        return ResponseEntity.ok(analyticsService.completionCounts(days));
    }

    @GetMapping("/trends")
    public ResponseEntity<TrendReport> getTrends(@RequestParam(defaultValue = "30") int days) {
        log.info("Retrieving completion trends for the last {} days", days);
        return ResponseEntity.ok(analyticsService.analyzeTrends(days));
    }

    @GetMapping("/consistency")
    public ResponseEntity<Map<String, Integer>> getConsistency(@RequestParam(defaultValue = "30") int days) {
        return ResponseEntity.ok(Map.of("score", analyticsService.consistencyScore(days)));
    }
}
