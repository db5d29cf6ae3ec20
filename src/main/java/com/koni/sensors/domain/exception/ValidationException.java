package com.koni.sensors.domain.exception;

/**
 * A reading or a test-data request is outside the values the board and the API accept
 * (ADC ranges, VOC range, seed hours and interval, record limit).
 * Mapped to 400 Bad Request; never reaches the store.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
