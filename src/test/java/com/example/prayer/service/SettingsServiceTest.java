package com.example.prayer.service;

import com.example.prayer.exception.PersistenceException;
import com.example.prayer.exception.PrayerDataException;
import com.example.prayer.model.PrayerId;
import com.example.prayer.model.Settings;
import com.example.prayer.service.notification.NotificationSink;
import com.example.prayer.util.Constants.PermissionStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.function.Consumer;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SettingsService Unit Tests")
class SettingsServiceTest {

    @Mock
    private SettingsPersistence settingsPersistence;

    @Mock
    private NotificationOrchestrator notificationOrchestrator;

    @Mock
    private RemembranceReminderScheduler remembranceReminderScheduler;

    @Mock
    private NotificationSink notificationSink;

    @InjectMocks
    private SettingsService settingsService;

    @Captor
    private ArgumentCaptor<Settings> settingsCaptor;

    @Captor
    private ArgumentCaptor<Supplier<Settings>> sourceCaptor;

    @Test
    @DisplayName("Warm store: settings are loaded synchronously and reminders scheduled")
    void initializeLoadsSynchronously() {
        // Given
        Settings stored = Settings.defaults().toBuilder().legalSchool("shafi").build();
        when(settingsPersistence.isStoreWarm()).thenReturn(true);
        when(settingsPersistence.load()).thenReturn(stored);
        when(notificationSink.permissionStatus()).thenReturn(Flux.never());

        // When
        settingsService.initialize();

        // Then
        assertThat(settingsService.current()).isEqualTo(stored);
        verify(notificationOrchestrator).recalculateAndReschedule(stored);
        verify(remembranceReminderScheduler).disable();
    }

    @Test
    @DisplayName("Cold store: defaults are served until the asynchronous load completes")
    void initializeLoadsAsynchronously() {
        Settings stored = Settings.defaults().toBuilder()
                .remembranceRemindersEnabled(true).reminderIntervalHours(6).build();
        when(settingsPersistence.isStoreWarm()).thenReturn(false);
        when(notificationSink.permissionStatus()).thenReturn(Flux.never());
        ArgumentCaptor<Consumer<Settings>> callback = ArgumentCaptor.forClass(Consumer.class);

        settingsService.initialize();

        assertThat(settingsService.current()).isEqualTo(Settings.defaults());
        verify(settingsPersistence).loadAsync(callback.capture());

        callback.getValue().accept(stored);

        assertThat(settingsService.current()).isEqualTo(stored);
        verify(remembranceReminderScheduler).enable(6);
    }

    @Test
    @DisplayName("Critical update saves immediately and reschedules reminders")
    void criticalUpdateSavesAndReschedules() {
        settingsService.updatePrayerOffset(PrayerId.ASR, 10);

        verify(settingsPersistence).saveNow(settingsCaptor.capture());
        assertThat(settingsCaptor.getValue().offsetFor(PrayerId.ASR)).isEqualTo(10);
        verify(notificationOrchestrator).recalculateAndReschedule(settingsCaptor.getValue());
        assertThat(settingsService.current().offsetFor(PrayerId.ASR)).isEqualTo(10);
    }

    @Test
    @DisplayName("Setting a value to what it already is does nothing")
    void unchangedValueIsNoOp() {
        settingsService.updateCalculationMethod(Settings.DEFAULT_CALCULATION_METHOD);

        verifyNoInteractions(settingsPersistence, notificationOrchestrator);
    }

    @Test
    @DisplayName("Enabling a prayer reminder is refused while permission is denied")
    void enablingRefusedWhenDenied() {
        settingsService.updateField(s -> s.toBuilder()
                .permissionStatus(PermissionStatus.DENIED)
                .build()
                .withNotification(PrayerId.FAJR, false));

        boolean accepted = settingsService.updatePrayerNotification(PrayerId.FAJR, true);

        assertThat(accepted).isFalse();
        assertThat(settingsService.current().isNotificationEnabled(PrayerId.FAJR)).isFalse();
        verify(settingsPersistence, never()).saveNow(any());
        assertThat(settingsService.updatePrayerNotification(PrayerId.DHUHR, false)).isTrue();
    }

    @Test
    @DisplayName("Persistence failure surfaces after memory and reminders are updated")
    void persistenceFailureSurfaces() {
        doThrow(new PersistenceException("store down")).when(settingsPersistence).saveNow(any());

        assertThatThrownBy(() -> settingsService.updateLegalSchool("shafi"))
                .isInstanceOf(PersistenceException.class);

        assertThat(settingsService.current().getLegalSchool()).isEqualTo("shafi");
        verify(notificationOrchestrator).recalculateAndReschedule(settingsService.current());
    }

    @Test
    @DisplayName("Reschedule failure does not fail the settings update")
    void rescheduleFailureIsContained() {
        doThrow(new PrayerDataException("calculator down"))
                .when(notificationOrchestrator).recalculateAndReschedule(any());

        settingsService.updateCallToPrayerSound("alaqsa_adhan.mp3");

        assertThat(settingsService.current().getCallToPrayerSound()).isEqualTo("alaqsa_adhan.mp3");
        verify(settingsPersistence).saveNow(any());
    }

    @Test
    @DisplayName("Non-critical updates go through the debounced path")
    void nonCriticalUpdatesAreDebounced() {
        settingsService.updateField(s -> s.toBuilder().permissionStatus(PermissionStatus.GRANTED).build());

        verify(settingsPersistence).scheduleSave(sourceCaptor.capture());
        assertThat(sourceCaptor.getValue().get().getPermissionStatus()).isEqualTo(PermissionStatus.GRANTED);
        verify(settingsPersistence, never()).saveNow(any());
    }

    @Test
    @DisplayName("Permission status changes from the device are stored")
    void permissionStatusStream() {
        Sinks.Many<PermissionStatus> permissions = Sinks.many().replay().latest();
        when(settingsPersistence.isStoreWarm()).thenReturn(true);
        when(settingsPersistence.load()).thenReturn(Settings.defaults());
        when(notificationSink.permissionStatus()).thenReturn(permissions.asFlux());
        settingsService.initialize();

        permissions.tryEmitNext(PermissionStatus.DENIED);

        assertThat(settingsService.current().getPermissionStatus()).isEqualTo(PermissionStatus.DENIED);
        verify(settingsPersistence).scheduleSave(any());
    }

    @Test
    @DisplayName("Remembrance toggles drive the recurring reminder")
    void remembranceToggle() {
        settingsService.updateReminderInterval(2);
        settingsService.updateRemembranceReminders(true);

        verify(remembranceReminderScheduler).enable(2);

        settingsService.updateRemembranceReminders(false);

        verify(remembranceReminderScheduler, times(2)).disable();
    }

    @Test
    @DisplayName("Malformed import is rejected and leaves settings unchanged")
    void malformedImport() {
        when(settingsPersistence.fromJson("garbage")).thenThrow(new IllegalArgumentException("Malformed"));

        assertThat(settingsService.importSettings("garbage")).isFalse();
        assertThat(settingsService.current()).isEqualTo(Settings.defaults());
        verify(settingsPersistence, never()).saveNow(any());
    }

    @Test
    @DisplayName("Valid import replaces and persists settings")
    void validImport() {
        Settings imported = Settings.defaults().toBuilder().calculationMethod("Egyptian").build();
        when(settingsPersistence.fromJson("{...}")).thenReturn(imported);

        assertThat(settingsService.importSettings("{...}")).isTrue();

        assertThat(settingsService.current()).isEqualTo(imported);
        verify(settingsPersistence).saveNow(imported);
        verify(notificationOrchestrator).recalculateAndReschedule(imported);
    }

    @Test
    @DisplayName("Teardown flushes pending writes")
    void teardownFlushes() {
        settingsService.teardown();

        verify(settingsPersistence).close();
    }
}
