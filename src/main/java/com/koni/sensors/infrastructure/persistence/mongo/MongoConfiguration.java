package com.koni.sensors.infrastructure.persistence.mongo;

import com.koni.sensors.infrastructure.lifecycle.LifecycleExecutionContextProvider;
import com.koni.sensors.infrastructure.observability.SensorMetrics;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the single process-wide {@link MongoConnectionManager} and its collaborators.
 *
 * Configuration:
 * - sensors.mongodb.url (MONGODB_URL): connection string, required at first use
 * - sensors.mongodb.database (MONGODB_DB_NAME): database name
 * - sensors.mongodb.collection: collection holding the readings
 * - sensors.mongodb.server-selection-timeout-ms / connect-timeout-ms: driver timeouts
 */
@Configuration
public class MongoConfiguration {

    @Bean
    public MongoConnectionSettings mongoConnectionSettings(
            @Value("${sensors.mongodb.url:}") String url,
            @Value("${sensors.mongodb.database:" + MongoConnectionSettings.DEFAULT_DATABASE + "}") String database,
            @Value("${sensors.mongodb.collection:" + MongoConnectionSettings.DEFAULT_COLLECTION + "}") String collection,
            @Value("${sensors.mongodb.server-selection-timeout-ms:5000}") long serverSelectionTimeoutMs,
            @Value("${sensors.mongodb.connect-timeout-ms:5000}") long connectTimeoutMs) {
        return MongoConnectionSettings.builder()
                .url(url)
                .database(database)
                .collection(collection)
                .serverSelectionTimeoutMs(serverSelectionTimeoutMs)
                .connectTimeoutMs(connectTimeoutMs)
                .build();
    }

    @Bean
    public MongoClientFactory mongoClientFactory() {
        return new DriverMongoClientFactory();
    }

    @Bean
    public LifecycleExecutionContextProvider executionContextProvider() {
        return new LifecycleExecutionContextProvider();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Connects lazily on first use; closed when the application context shuts down.
     */
    @Bean(destroyMethod = "disconnect")
    public MongoConnectionManager mongoConnectionManager(MongoConnectionSettings settings,
                                                         MongoClientFactory mongoClientFactory,
                                                         LifecycleExecutionContextProvider executionContextProvider,
                                                         SensorMetrics sensorMetrics,
                                                         Clock clock) {
        return new MongoConnectionManager(settings, mongoClientFactory, executionContextProvider, sensorMetrics, clock);
    }
}
