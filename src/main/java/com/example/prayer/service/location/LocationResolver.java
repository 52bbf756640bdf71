package com.example.prayer.service.location;

import com.example.prayer.exception.LocationServiceException;
import com.example.prayer.model.Coordinates;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Resolves the device position through a short-lived cache, falling back to the Kaaba
 * when the source fails. The fallback is never cached so the next call retries the source.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LocationResolver {

    public static final Coordinates KAABA = new Coordinates(21.422487, 39.826206);

    private static final String CURRENT_LOCATION = "current";

    private final LocationSource locationSource;
    private final Cache<String, Coordinates> locationCache;

    public Coordinates resolve() {
        Coordinates cached = locationCache.getIfPresent(CURRENT_LOCATION);
        if (cached != null) {
            return cached;
        }
        try {
            Coordinates coordinates = locationSource.getCoordinates();
            locationCache.put(CURRENT_LOCATION, coordinates);
            log.debug("Resolved device location {}", coordinates);
            return coordinates;
        } catch (LocationServiceException e) {
            log.warn("Location unavailable, falling back to the Kaaba: {}", e.getMessage());
            return KAABA;
        }
    }

    public void invalidate() {
        locationCache.invalidateAll();
    }
}
