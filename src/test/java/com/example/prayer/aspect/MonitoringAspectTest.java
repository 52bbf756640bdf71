package com.example.prayer.aspect;

import com.example.prayer.model.PrayerId;
import com.example.prayer.service.CompletionTracker;
import com.example.prayer.service.PrayerTimesService;
import com.example.prayer.service.SettingsService;
import com.example.prayer.service.store.KeyValueStore;
import com.example.prayer.model.Streak;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.aop.aspectj.annotation.AspectJProxyFactory;

import java.util.Optional;

import static com.example.prayer.TestFixtures.TODAY;
import static com.example.prayer.TestFixtures.clockAt;
import static com.example.prayer.TestFixtures.objectMapper;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class MonitoringAspectTest {

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final KeyValueStore keyValueStore = mock(KeyValueStore.class);

    private CompletionTracker tracker;

    @BeforeEach
    void setUp() {
        CompletionTracker target = new CompletionTracker(
                keyValueStore,
                objectMapper(),
                mock(PrayerTimesService.class),
                mock(SettingsService.class),
                clockAt(TODAY, "12:00"),
                Caffeine.newBuilder().<PrayerId, Streak>build());
        AspectJProxyFactory factory = new AspectJProxyFactory(target);
        factory.setProxyTargetClass(true);
        factory.addAspect(new MonitoringAspect(meterRegistry));
        tracker = factory.getProxy();
    }

    @Test
    void successfulCallIsTimedAndCounted() {
        when(keyValueStore.get(anyString())).thenReturn(Optional.empty());

        assertThat(tracker.isCompleted(PrayerId.FAJR, TODAY)).isFalse();

        assertThat(meterRegistry.get("prayer.completion.calls")
                .tag("class", "CompletionTracker")
                .tag("method", "isCompleted")
                .tag("status", "success")
                .counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("prayer.completion.latency")
                .tag("method", "isCompleted")
                .timer().count()).isEqualTo(1L);
    }

    @Test
    void failureIsTaggedAndRethrown() {
        when(keyValueStore.get(anyString())).thenThrow(new IllegalStateException("boom"));

        assertThatThrownBy(() -> tracker.isCompleted(PrayerId.ASR, TODAY))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("boom");

        assertThat(meterRegistry.get("prayer.completion.calls")
                .tag("method", "isCompleted")
                .tag("status", "error")
                .counter().count()).isEqualTo(1.0);
    }
}
