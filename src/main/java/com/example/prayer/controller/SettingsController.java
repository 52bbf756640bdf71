package com.example.prayer.controller;

import com.example.prayer.dto.OffsetUpdateRequest;
import com.example.prayer.dto.RemembranceUpdateRequest;
import com.example.prayer.dto.ToggleRequest;
import com.example.prayer.dto.ValueUpdateRequest;
import com.example.prayer.model.PrayerId;
import com.example.prayer.model.Settings;
import com.example.prayer.service.SettingsService;
import com.example.prayer.service.notification.PermissionStatusReporter;
import com.example.prayer.util.Constants.PermissionStatus;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Locale;

@RestController
@RequestMapping("/api/prayer/settings")
@RequiredArgsConstructor
@Slf4j
public class SettingsController {

    private final SettingsService settingsService;
    private final PermissionStatusReporter permissionStatusReporter;

    @GetMapping
    public ResponseEntity<Settings> getSettings() {
        return ResponseEntity.ok(settingsService.current());
    }

    @PutMapping("/calculation-method")
    public ResponseEntity<Settings> updateCalculationMethod(@Valid @RequestBody ValueUpdateRequest request) {
        log.info("Updating calculation method to {}", request.getValue());
        settingsService.updateCalculationMethod(request.getValue());
        return ResponseEntity.ok(settingsService.current());
    }

    @PutMapping("/legal-school")
    public ResponseEntity<Settings> updateLegalSchool(@Valid @RequestBody ValueUpdateRequest request) {
        log.info("Updating legal school to {}", request.getValue());
        settingsService.updateLegalSchool(request.getValue());
        return ResponseEntity.ok(settingsService.current());
    }

    @PutMapping("/offsets/{prayer}")
    public ResponseEntity<Settings> updateOffset(@PathVariable PrayerId prayer,
                                                 @Valid @RequestBody OffsetUpdateRequest request) {
        log.info("Updating {} offset to {} minutes", prayer, request.getMinutes());
        settingsService.updatePrayerOffset(prayer, request.getMinutes());
        return ResponseEntity.ok(settingsService.current());
    }

    @PutMapping("/notifications/{prayer}")
    public ResponseEntity<Settings> updateNotification(@PathVariable PrayerId prayer,
                                                       @Valid @RequestBody ToggleRequest request) {
        log.info("Setting {} reminders enabled={}", prayer, request.getEnabled());
        if (!settingsService.updatePrayerNotification(prayer, request.getEnabled())) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(settingsService.current());
        }
        return ResponseEntity.ok(settingsService.current());
    }

    @PutMapping("/notifications")
    public ResponseEntity<Settings> updateAllNotifications(@Valid @RequestBody ToggleRequest request) {
        log.info("Setting all prayer reminders enabled={}", request.getEnabled());
        if (!settingsService.updateAllPrayerNotifications(request.getEnabled())) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(settingsService.current());
        }
        return ResponseEntity.ok(settingsService.current());
    }

    @PutMapping("/remembrance")
    public ResponseEntity<Settings> updateRemembrance(@Valid @RequestBody RemembranceUpdateRequest request) {
        log.info("Updating remembrance reminders: enabled={}, intervalHours={}", request.getEnabled(), request.getIntervalHours());
        if (request.getIntervalHours() != null) {
            settingsService.updateReminderInterval(request.getIntervalHours());
        }
        settingsService.updateRemembranceReminders(request.getEnabled());
        return ResponseEntity.ok(settingsService.current());
    }

    @PutMapping("/sound")
    public ResponseEntity<Settings> updateSound(@Valid @RequestBody ValueUpdateRequest request) {
        log.info("Updating call-to-prayer sound to {}", request.getValue());
        settingsService.updateCallToPrayerSound(request.getValue());
        return ResponseEntity.ok(settingsService.current());
    }

    /**
     * Simulates the device reporting a new notification permission status.
     */
    @PutMapping("/permission")
    public ResponseEntity<Void> updatePermission(@Valid @RequestBody ValueUpdateRequest request) {
        PermissionStatus status = PermissionStatus.valueOf(request.getValue().trim().toUpperCase(Locale.ROOT));
        log.info("Device reported notification permission {}", status);
        permissionStatusReporter.updatePermissionStatus(status);
        return ResponseEntity.accepted().build();
    }

    @GetMapping(value = "/export", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> exportSettings() {
        return ResponseEntity.ok(settingsService.exportSettings());
    }

    @PostMapping(value = "/import", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Settings> importSettings(@RequestBody String json) {
        log.info("Importing settings document ({} chars)", json.length());
        if (!settingsService.importSettings(json)) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(settingsService.current());
    }

    @PostMapping("/reset")
    public ResponseEntity<Settings> resetSettings() {
        log.info("Resetting settings to defaults");
        return ResponseEntity.ok(settingsService.resetToDefaults());
    }
}
