package com.koni.sensors.domain.exception;

/**
 * Exception thrown when a stored document does not have the shape of a sensor reading.
 * This is a data problem, not a transient one, so it is never retried.
 */
public class DocumentValidationException extends SensorStoreException {

    public DocumentValidationException(String message) {
        super(message);
    }

    public DocumentValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
