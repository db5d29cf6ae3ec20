package com.koni.sensors.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Best-effort descriptive snapshot of the sensor reading collection.
 */
@Getter
@Builder
@ToString
public class StoreStats {

    private final String database;
    private final String collection;
    private final long documentCount;
    private final long sizeBytes;
    private final boolean exists;
    private final List<String> indexes;

    /**
     * Snapshot used when statistics cannot be read, e.g. the collection was never created.
     */
    public static StoreStats empty(String database, String collection) {
        return StoreStats.builder()
                .database(database)
                .collection(collection)
                .documentCount(0)
                .sizeBytes(0)
                .exists(false)
                .indexes(List.of())
                .build();
    }
}
