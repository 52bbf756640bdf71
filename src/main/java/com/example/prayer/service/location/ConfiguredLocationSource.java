package com.example.prayer.service.location;

import com.example.prayer.config.AppProperties;
import com.example.prayer.exception.LocationServiceException;
import com.example.prayer.model.Coordinates;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ConfiguredLocationSource implements LocationSource {

    private final AppProperties appProperties;

    @Override
    public Coordinates getCoordinates() {
        AppProperties.Location location = appProperties.getLocation();
        if (location.getLatitude() == null || location.getLongitude() == null) {
            throw new LocationServiceException("No device location configured (prayer.location.latitude/longitude)");
        }
        return new Coordinates(location.getLatitude(), location.getLongitude());
    }
}
