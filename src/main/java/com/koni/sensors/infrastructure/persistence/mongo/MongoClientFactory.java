package com.koni.sensors.infrastructure.persistence.mongo;

import com.mongodb.client.MongoClient;

/**
 * Opens {@link MongoClient} instances for the connection manager.
 */
@FunctionalInterface
public interface MongoClientFactory {

    /**
     * Creates a new client. The driver connects in the background; callers probe liveness themselves.
     *
     * @throws IllegalArgumentException if the connection string is malformed
     */
    MongoClient create(MongoConnectionSettings settings);
}
