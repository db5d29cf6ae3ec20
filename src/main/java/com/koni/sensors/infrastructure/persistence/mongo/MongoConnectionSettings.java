package com.koni.sensors.infrastructure.persistence.mongo;

import lombok.Builder;
import lombok.Getter;

/**
 * Connection settings for the sensor reading store.
 * The URL may be blank; that is only reported when a connection is first needed.
 */
@Getter
@Builder
public class MongoConnectionSettings {

    public static final String DEFAULT_DATABASE = "embedded-statistics-tracking-dev";
    public static final String DEFAULT_COLLECTION = "sensor_readings";

    private final String url;

    @Builder.Default
    private final String database = DEFAULT_DATABASE;

    @Builder.Default
    private final String collection = DEFAULT_COLLECTION;

    @Builder.Default
    private final long serverSelectionTimeoutMs = 5000;

    @Builder.Default
    private final long connectTimeoutMs = 5000;

    public boolean hasUrl() {
        return url != null && !url.isBlank();
    }
}
