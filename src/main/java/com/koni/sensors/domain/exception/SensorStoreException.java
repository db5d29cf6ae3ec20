package com.koni.sensors.domain.exception;

/**
 * Base type for failures raised while talking to the sensor reading store.
 * The web layer turns any of these into a 500-class response carrying the message.
 */
public class SensorStoreException extends RuntimeException {

    public SensorStoreException(String message) {
        super(message);
    }

    public SensorStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
