package com.koni.sensors.domain.exception;

/**
 * Exception thrown when the store cannot be reached while connecting,
 * e.g. network, authentication or liveness probe failures.
 * The connection manager does not retry it; a later call starts a fresh attempt.
 */
public class StoreConnectionException extends SensorStoreException {

    public StoreConnectionException(String message) {
        super(message);
    }

    public StoreConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
