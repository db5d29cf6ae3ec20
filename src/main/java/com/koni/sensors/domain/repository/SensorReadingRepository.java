package com.koni.sensors.domain.repository;

import com.koni.sensors.domain.model.SensorReading;
import com.koni.sensors.domain.model.StoreStats;

import java.util.List;

/**
 * Repository interface for sensor reading persistence.
 * Part of the domain layer; the MongoDB adapter in the infrastructure layer implements it.
 *
 * Every operation is safe to call from concurrent request threads: connection
 * lifecycle is handled behind this interface.
 */
public interface SensorReadingRepository {

    /**
     * Stores one reading. The store assigns the identifier and the UTC timestamp
     * (time of insert); any id or timestamp on the argument is ignored.
     *
     * @param reading the reading to store
     * @return the new identifier as a string
     * @throws IllegalArgumentException if reading is null
     */
    String insert(SensorReading reading);

    /**
     * Stores readings that already carry their own timestamps (back-dated history).
     *
     * @param readings readings with non-null timestamps
     * @return the number of readings written
     */
    int insertAll(List<SensorReading> readings);

    /**
     * Returns every stored reading, most recent first.
     * All-or-nothing: a malformed document fails the whole call.
     *
     * @return readings ordered by timestamp descending, possibly empty
     * @throws com.koni.sensors.domain.exception.DocumentValidationException if a stored document is malformed
     */
    List<SensorReading> findAllNewestFirst();

    /**
     * Deletes every stored reading.
     *
     * @return the number of readings removed
     */
    long deleteAll();

    /**
     * Returns a descriptive snapshot of the collection. Never fails because the
     * collection is missing; an empty snapshot is returned instead.
     */
    StoreStats stats();
}
