package com.koni.sensors.domain.exception;

/**
 * Exception thrown when required store configuration is missing,
 * typically the MongoDB connection string.
 * This is fatal for the calling operation and is never retried.
 */
public class ConfigurationException extends SensorStoreException {

    public ConfigurationException(String message) {
        super(message);
    }
}
