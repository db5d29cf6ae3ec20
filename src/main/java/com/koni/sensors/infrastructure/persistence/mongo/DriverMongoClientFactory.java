package com.koni.sensors.infrastructure.persistence.mongo;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;

import java.util.concurrent.TimeUnit;

/**
 * {@link MongoClientFactory} backed by the MongoDB synchronous driver.
 */
public class DriverMongoClientFactory implements MongoClientFactory {

    private static final String APPLICATION_NAME = "sensor-tracking";

    @Override
    public MongoClient create(MongoConnectionSettings settings) {
        MongoClientSettings clientSettings = MongoClientSettings.builder()
                .applyConnectionString(new ConnectionString(settings.getUrl()))
                .applicationName(APPLICATION_NAME)
                .applyToClusterSettings(cluster -> cluster
                        .serverSelectionTimeout(settings.getServerSelectionTimeoutMs(), TimeUnit.MILLISECONDS))
                .applyToSocketSettings(socket -> socket
                        .connectTimeout((int) settings.getConnectTimeoutMs(), TimeUnit.MILLISECONDS))
                .build();
        return MongoClients.create(clientSettings);
    }
}
