package com.koni.sensors.infrastructure.persistence.mongo;

import com.koni.sensors.domain.exception.DocumentValidationException;
import com.koni.sensors.domain.exception.StatsUnavailableException;
import com.koni.sensors.domain.model.SensorReading;
import com.koni.sensors.domain.model.StoreStats;
import com.koni.sensors.domain.repository.SensorReadingRepository;
import com.koni.sensors.infrastructure.observability.SensorMetrics;
import com.mongodb.MongoException;
import com.mongodb.client.model.Sorts;
import com.mongodb.client.result.InsertOneResult;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.bson.BsonValue;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * MongoDB adapter for {@link SensorReadingRepository}.
 *
 * Every operation follows the same policy:
 * 1. ask the {@link MongoConnectionManager} for a live connection,
 * 2. run the store call,
 * 3. if the call failed because the connection's execution context is stale, invalidate the
 *    connection and run steps 1-2 once more. A second failure propagates unchanged.
 *
 * Step 3 is driven by the injected Resilience4j {@link Retry} (two attempts, retrying only on
 * errors accepted by {@link StaleContextDetector}).
 */
@Slf4j
@Component
public class MongoSensorReadingRepositoryAdapter implements SensorReadingRepository {

    private final MongoConnectionManager connectionManager;
    private final Retry staleContextRetry;
    private final StaleContextDetector staleContextDetector;
    private final SensorReadingDocumentMapper mapper;
    private final SensorMetrics metrics;
    private final Clock clock;

    public MongoSensorReadingRepositoryAdapter(MongoConnectionManager connectionManager,
                                               Retry staleContextRetry,
                                               StaleContextDetector staleContextDetector,
                                               SensorReadingDocumentMapper mapper,
                                               SensorMetrics metrics,
                                               Clock clock) {
        this.connectionManager = connectionManager;
        this.staleContextRetry = staleContextRetry;
        this.staleContextDetector = staleContextDetector;
        this.mapper = mapper;
        this.metrics = metrics;
        this.clock = clock;

        registerRetryEventListeners();
    }

    @Override
    public String insert(SensorReading reading) {
        if (reading == null) {
            throw new IllegalArgumentException("SensorReading cannot be null");
        }

        // BSON dates carry millisecond precision
        Instant timestamp = Instant.now(clock).truncatedTo(ChronoUnit.MILLIS);
        String id = execute("insert", handle -> {
            Document document = mapper.toDocument(reading, timestamp);
            InsertOneResult result = handle.collection().insertOne(document);
            return insertedId(result, document);
        });

        metrics.recordStored(1);
        log.debug("Sensor reading stored: id={}, timestamp={}", id, timestamp);
        return id;
    }

    @Override
    public int insertAll(List<SensorReading> readings) {
        if (readings == null) {
            throw new IllegalArgumentException("Readings cannot be null");
        }
        if (readings.isEmpty()) {
            return 0;
        }
        for (SensorReading reading : readings) {
            if (reading.getTimestamp() == null) {
                throw new IllegalArgumentException("Readings stored in bulk must carry a timestamp");
            }
        }

        int inserted = execute("insertAll", handle -> {
            List<Document> documents = new ArrayList<>(readings.size());
            for (SensorReading reading : readings) {
                documents.add(mapper.toDocument(reading, reading.getTimestamp().truncatedTo(ChronoUnit.MILLIS)));
            }
            return handle.collection().insertMany(documents).getInsertedIds().size();
        });

        metrics.recordStored(inserted);
        log.info("Stored {} back-dated sensor readings", inserted);
        return inserted;
    }

    @Override
    public List<SensorReading> findAllNewestFirst() {
        List<Document> documents = execute("findAll", handle -> handle.collection()
                .find()
                .sort(Sorts.descending(SensorReadingDocumentMapper.TIMESTAMP))
                .into(new ArrayList<>()));

        List<SensorReading> readings = new ArrayList<>(documents.size());
        for (Document document : documents) {
            try {
                readings.add(mapper.fromDocument(document));
            } catch (DocumentValidationException e) {
                log.error("Stored document does not match the sensor reading shape: {}", document.toJson(), e);
                throw e;
            }
        }

        log.debug("Retrieved {} sensor readings", readings.size());
        return readings;
    }

    @Override
    public long deleteAll() {
        long deleted = execute("deleteAll", handle -> handle.collection()
                .deleteMany(new Document())
                .getDeletedCount());

        metrics.recordCleared(deleted);
        log.info("Deleted {} sensor readings", deleted);
        return deleted;
    }

    @Override
    public StoreStats stats() {
        String database = connectionManager.settings().getDatabase();
        String collection = connectionManager.settings().getCollection();

        return execute("stats", handle -> {
            try {
                long count = handle.collection().countDocuments();
                Document collStats = collectionStats(handle, collection);
                long size = longValue(collStats.get("size"));
                // connect prepares the collection and its indexes, so a store that never held data
                // still has them; report it as not existing
                if (count == 0 && size == 0) {
                    return StoreStats.empty(database, collection);
                }
                return StoreStats.builder()
                        .database(database)
                        .collection(collection)
                        .documentCount(count)
                        .sizeBytes(size)
                        .exists(true)
                        .indexes(indexNames(collStats))
                        .build();
            } catch (StatsUnavailableException e) {
                log.info("Collection statistics unavailable for {}: {}", collection, e.getMessage());
                return StoreStats.empty(database, collection);
            }
        });
    }

    /**
     * Runs one store call under the ensure-connected / retry-once-on-stale-context policy.
     */
    private <T> T execute(String operation, Function<ConnectionHandle, T> call) {
        Supplier<T> attempt = () -> {
            ConnectionHandle handle = connectionManager.ensureConnected();
            try {
                return call.apply(handle);
            } catch (RuntimeException e) {
                if (staleContextDetector.test(e)) {
                    log.warn("Store operation '{}' hit a stale execution context: {}", operation, e.getMessage());
                    connectionManager.invalidate(handle);
                }
                throw e;
            }
        };
        return metrics.recordOperationTime(Retry.decorateSupplier(staleContextRetry, attempt));
    }

    private Document collectionStats(ConnectionHandle handle, String collection) {
        try {
            return handle.database().runCommand(new Document("collStats", collection));
        } catch (MongoException e) {
            if (staleContextDetector.test(e)) {
                throw e;
            }
            throw new StatsUnavailableException("collStats failed for " + collection + ": " + e.getMessage(), e);
        }
    }

    private static List<String> indexNames(Document collStats) {
        Object indexSizes = collStats.get("indexSizes");
        if (indexSizes instanceof Document) {
            return new ArrayList<>(((Document) indexSizes).keySet());
        }
        return List.of();
    }

    private static long longValue(Object value) {
        return value instanceof Number ? ((Number) value).longValue() : 0L;
    }

    private static String insertedId(InsertOneResult result, Document document) {
        BsonValue insertedId = result.getInsertedId();
        if (insertedId != null && insertedId.isObjectId()) {
            return insertedId.asObjectId().getValue().toHexString();
        }
        Object generated = document.get(SensorReadingDocumentMapper.ID);
        if (generated == null) {
            throw new MongoException("Store did not report an identifier for the inserted reading");
        }
        return generated instanceof ObjectId
                ? ((ObjectId) generated).toHexString()
                : generated.toString();
    }

    /**
     * Logs stale-context retries for observability.
     */
    private void registerRetryEventListeners() {
        staleContextRetry.getEventPublisher()
                .onRetry(event -> {
                    metrics.recordStaleContextRetry();
                    log.warn("Retrying store operation after stale execution context (attempt {}): {}",
                            event.getNumberOfRetryAttempts(),
                            event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown");
                })
                .onError(event -> log.error("Store operation failed after {} attempts: {}",
                        event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
    }
}
