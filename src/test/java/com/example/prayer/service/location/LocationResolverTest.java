package com.example.prayer.service.location;

import com.example.prayer.exception.LocationServiceException;
import com.example.prayer.model.Coordinates;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("LocationResolver Unit Tests")
class LocationResolverTest {

    private static final Coordinates CAIRO = new Coordinates(30.0444, 31.2357);

    @Mock
    private LocationSource locationSource;

    private LocationResolver resolver;

    @BeforeEach
    void setUp() {
        Cache<String, Coordinates> cache = Caffeine.newBuilder().build();
        resolver = new LocationResolver(locationSource, cache);
    }

    @Test
    @DisplayName("Resolved location is cached")
    void resolvedLocationIsCached() {
        when(locationSource.getCoordinates()).thenReturn(CAIRO);

        assertThat(resolver.resolve()).isEqualTo(CAIRO);
        assertThat(resolver.resolve()).isEqualTo(CAIRO);

        verify(locationSource, times(1)).getCoordinates();
    }

    @Test
    @DisplayName("Source failure falls back to the Kaaba without caching the fallback")
    void failureFallsBackToKaaba() {
        when(locationSource.getCoordinates())
                .thenThrow(new LocationServiceException("GPS off", new IllegalStateException("no fix")))
                .thenReturn(CAIRO);

        assertThat(resolver.resolve()).isEqualTo(LocationResolver.KAABA);
        assertThat(resolver.resolve()).isEqualTo(CAIRO);
    }

    @Test
    @DisplayName("Invalidation forces a fresh lookup")
    void invalidate() {
        when(locationSource.getCoordinates()).thenReturn(CAIRO);

        resolver.resolve();
        resolver.invalidate();
        resolver.resolve();

        verify(locationSource, times(2)).getCoordinates();
    }
}
