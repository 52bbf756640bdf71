package com.example.prayer.service;

import com.example.prayer.model.CacheEntry;
import com.example.prayer.model.Coordinates;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Objects;

/**
 * Decides whether a stored entry may be served for a request. Both checks are pure apart
 * from reading the clock.
 */
@Component
@RequiredArgsConstructor
public class CacheEntryValidator {

    /** Maximum per-axis drift, in degrees, before a stored entry is considered for another place. */
    public static final double POSITION_TOLERANCE = 0.001;

    private final Clock clock;

    public boolean matchesParameters(CacheEntry entry, Coordinates location, String method, String legalSchool) {
        if (entry == null || location == null) {
            return false;
        }
        return Math.abs(entry.getLatitude() - location.getLatitude()) < POSITION_TOLERANCE
                && Math.abs(entry.getLongitude() - location.getLongitude()) < POSITION_TOLERANCE
                && Objects.equals(entry.getMethod(), method)
                && Objects.equals(entry.getLegalSchool(), legalSchool);
    }

    public boolean isValid(CacheEntry entry) {
        return entry != null
                && entry.getExpiresAt() != null
                && clock.instant().isBefore(entry.getExpiresAt());
    }

    public boolean isServable(CacheEntry entry, Coordinates location, String method, String legalSchool) {
        return isValid(entry) && matchesParameters(entry, location, method, legalSchool);
    }
}
