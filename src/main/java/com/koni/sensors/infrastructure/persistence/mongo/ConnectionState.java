package com.koni.sensors.infrastructure.persistence.mongo;

/**
 * Lifecycle state of the store connection.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED
}
