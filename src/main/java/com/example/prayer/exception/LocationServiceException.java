package com.example.prayer.exception;

/**
 * Thrown by a location source when no position is available. The underlying cause is always kept.
 */
public class LocationServiceException extends RuntimeException {
    public LocationServiceException(String message) {
        super(message);
    }

    public LocationServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
