package com.koni.sensors.domain.exception;

/**
 * Exception signalling that collection statistics could not be read,
 * usually because the collection does not exist yet.
 * Callers recover from it with an empty statistics snapshot.
 */
public class StatsUnavailableException extends SensorStoreException {

    public StatsUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
