package com.example.prayer.controller;

import com.example.prayer.dto.TodayTimesResponse;
import com.example.prayer.model.DailyTimes;
import com.example.prayer.model.PrayerState;
import com.example.prayer.model.Settings;
import com.example.prayer.service.PrayerStatePoller;
import com.example.prayer.service.PrayerTimesService;
import com.example.prayer.service.SettingsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;

import java.time.LocalDate;

@RestController
@RequestMapping("/api/prayer")
@RequiredArgsConstructor
@Slf4j
public class PrayerTimesController {

    private final PrayerTimesService prayerTimesService;
    private final SettingsService settingsService;
    private final PrayerStatePoller prayerStatePoller;

    @GetMapping("/times")
    public ResponseEntity<TodayTimesResponse> getTimes(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        LocalDate day = date != null ? date : prayerTimesService.today();
        Settings settings = settingsService.current();
        log.info("Retrieving prayer times for {}", day);
        DailyTimes times = prayerTimesService.timesFor(day, settings);
        DailyTimes adjusted = times.withOffsets(settings.getOffsets());
        return ResponseEntity.ok(TodayTimesResponse.builder()
                .date(times.getDate())
                .lunarDate(times.getLunarDate())
                .times(times.getTimes())
                .adjustedTimes(adjusted.getTimes())
                .build());
    }

    @GetMapping("/state")
    public ResponseEntity<PrayerState> getState() {
        return ResponseEntity.ok(prayerStatePoller.currentState());
    }

    @GetMapping(value = "/state/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<PrayerState>> streamState() {
        log.info("Prayer state stream subscriber connected");
        return prayerStatePoller.updates()
                .map(state -> ServerSentEvent.<PrayerState>builder()
                        .event("prayer-state")
                        .data(state)
                        .build());
    }

    @PostMapping("/reminders/reschedule")
    public ResponseEntity<Void> rescheduleReminders() {
        log.info("Manual reminder reschedule requested");
        settingsService.rescheduleAll();
        return ResponseEntity.accepted().build();
    }
}
