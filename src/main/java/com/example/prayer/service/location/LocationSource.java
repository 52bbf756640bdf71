package com.example.prayer.service.location;

import com.example.prayer.exception.LocationServiceException;
import com.example.prayer.model.Coordinates;

public interface LocationSource {

    /**
     * @throws LocationServiceException when no position can be obtained
     */
    Coordinates getCoordinates();
}
