package com.koni.sensors.infrastructure.persistence.mongo;

import com.koni.sensors.domain.exception.ConfigurationException;
import com.koni.sensors.domain.exception.StoreConnectionException;
import com.koni.sensors.infrastructure.lifecycle.ExecutionContext;
import com.koni.sensors.infrastructure.lifecycle.ExecutionContextProvider;
import com.koni.sensors.infrastructure.observability.SensorMetrics;
import com.mongodb.MongoCommandException;
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Indexes;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the single MongoDB connection of the process and its lifecycle.
 *
 * <p>States: {@link ConnectionState#DISCONNECTED}, {@link ConnectionState#CONNECTING},
 * {@link ConnectionState#CONNECTED}. The connection is opened lazily by
 * {@link #ensureConnected()}:
 *
 * <ul>
 *   <li>Fast path: a handle exists and is bound to the current, open execution context.
 *       Returned without locking and without any network call.
 *   <li>Slow path: the {@link ConnectionLock} of the current context is acquired (a lock left
 *       over from another context is replaced, never awaited), the state is checked again
 *       because another caller may have connected in the meantime, and only then the connect
 *       sequence runs: open client, ping, ensure collection and timestamp index.
 * </ul>
 *
 * <p>A handle whose execution context was closed or replaced is discarded before use and a
 * fresh connection is made. A failed connect leaves the manager disconnected and the error
 * goes to the caller that ran the sequence; callers that were waiting on the lock try again
 * themselves.
 *
 * <p>The handle is published atomically and only this class mutates it, so callers see either
 * no connection or a complete one.
 */
@Slf4j
public class MongoConnectionManager {

    static final String TIMESTAMP_FIELD = "timestamp";

    private static final int NAMESPACE_EXISTS = 48;
    private static final Document PING = new Document("ping", 1);

    private final MongoConnectionSettings settings;
    private final MongoClientFactory clientFactory;
    private final ExecutionContextProvider contextProvider;
    private final SensorMetrics metrics;
    private final Clock clock;

    private final AtomicReference<ConnectionHandle> handle = new AtomicReference<>();
    private final AtomicReference<ConnectionLock> connectionLock = new AtomicReference<>();
    private final AtomicInteger connecting = new AtomicInteger();

    public MongoConnectionManager(MongoConnectionSettings settings,
                                  MongoClientFactory clientFactory,
                                  ExecutionContextProvider contextProvider,
                                  SensorMetrics metrics,
                                  Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
        this.contextProvider = Objects.requireNonNull(contextProvider, "contextProvider");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Returns a live connection, connecting first if needed. Idempotent and safe under
     * concurrent callers: at most one caller per execution context runs the connect sequence.
     *
     * <p>A connect that finishes after its execution context was closed or replaced is
     * thrown away and the call starts over in the current context.
     *
     * @return the connection bound to the current execution context
     * @throws ConfigurationException if no connection string is configured
     * @throws StoreConnectionException if connecting or the liveness probe fails
     */
    public ConnectionHandle ensureConnected() {
        while (true) {
            ExecutionContext context = contextProvider.current();

            ConnectionHandle current = handle.get();
            if (current != null && current.isBoundTo(context)) {
                return current;
            }
            if (current != null) {
                discardStale(current, context);
            }

            ConnectionHandle connected = connectUnderLock(context);
            if (connected != null) {
                return connected;
            }
            log.info("Execution context {} ended while connecting, retrying in the current context", context.id());
        }
    }

    /**
     * Slow path: runs the connect sequence holding the lock of the given context.
     *
     * @return the published handle, or {@code null} if the context ended before it could be published
     */
    private ConnectionHandle connectUnderLock(ExecutionContext context) {
        ConnectionLock lock = lockFor(context);
        lock.lock();
        try {
            ConnectionHandle current = handle.get();
            if (current != null && current.isBoundTo(context)) {
                log.debug("Connection established by a concurrent caller (context {})", context.id());
                return current;
            }
            if (current != null) {
                discardStale(current, context);
            }

            connecting.incrementAndGet();
            try {
                return publish(connect(context));
            } finally {
                connecting.decrementAndGet();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Installs a freshly connected handle unless its context is no longer the current one.
     * A handle from another, still current context wins over the fresh one.
     */
    private ConnectionHandle publish(ConnectionHandle fresh) {
        while (true) {
            ExecutionContext now = contextProvider.current();
            if (!fresh.isBoundTo(now)) {
                log.info("Discarding connection made in ended context {}", fresh.contextId());
                closeQuietly(fresh.client());
                return null;
            }

            ConnectionHandle existing = handle.get();
            if (existing != null && existing.isBoundTo(now)) {
                closeQuietly(fresh.client());
                return existing;
            }
            if (handle.compareAndSet(existing, fresh)) {
                if (existing != null) {
                    closeQuietly(existing.client());
                }
                return fresh;
            }
        }
    }

    /**
     * Runs the liveness probe against the store, connecting first if needed.
     *
     * @return the server's reply to {@code ping}
     */
    public Document ping() {
        return ensureConnected().database().runCommand(PING);
    }

    /**
     * Drops the given handle after a store call reported a stale execution context.
     * Does nothing if the handle was already replaced. The next {@link #ensureConnected()}
     * connects again.
     *
     * <p>The client is not closed here: the stale error already means the driver considers it
     * closed, and other threads may still be finishing calls on it.
     *
     * @param failed the handle the failing call was made with
     */
    public void invalidate(ConnectionHandle failed) {
        if (failed != null && handle.compareAndSet(failed, null)) {
            log.warn("Invalidated MongoDB connection after stale execution context (context {})",
                    failed.contextId());
        }
    }

    /**
     * Closes the connection, if any, and clears all state. Close failures are logged, not thrown.
     */
    public void disconnect() {
        ConnectionHandle current = handle.getAndSet(null);
        connectionLock.set(null);
        if (current != null) {
            closeQuietly(current.client());
            log.info("Disconnected from MongoDB");
        }
    }

    public ConnectionState state() {
        if (handle.get() != null) {
            return ConnectionState.CONNECTED;
        }
        return connecting.get() > 0 ? ConnectionState.CONNECTING : ConnectionState.DISCONNECTED;
    }

    public MongoConnectionSettings settings() {
        return settings;
    }

    private ConnectionHandle connect(ExecutionContext context) {
        if (!settings.hasUrl()) {
            throw new ConfigurationException("MONGODB_URL environment variable is not set");
        }

        MongoClient client;
        try {
            client = clientFactory.create(settings);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid MongoDB connection string: " + e.getMessage());
        } catch (RuntimeException e) {
            metrics.recordConnectFailure();
            throw new StoreConnectionException("Failed to connect to MongoDB: " + e.getMessage(), e);
        }

        try {
            MongoDatabase database = client.getDatabase(settings.getDatabase());
            database.runCommand(PING);
            prepareCollection(database);

            ConnectionHandle connected = new ConnectionHandle(
                    client, database, settings.getCollection(), context, Instant.now(clock));
            metrics.recordConnect();
            log.info("Connected to MongoDB database: {} (context {})", settings.getDatabase(), context.id());
            return connected;
        } catch (RuntimeException e) {
            closeQuietly(client);
            metrics.recordConnectFailure();
            log.error("MongoDB connect sequence failed: database={}, error={}", settings.getDatabase(), e.getMessage());
            throw new StoreConnectionException("Failed to connect to MongoDB: " + e.getMessage(), e);
        }
    }

    /**
     * Creates the collection and its timestamp index when missing. "Already exists" counts as
     * success; a failed index build is logged and ignored since reads work without it.
     */
    private void prepareCollection(MongoDatabase database) {
        String collection = settings.getCollection();
        List<String> existing = database.listCollectionNames().into(new ArrayList<>());
        if (!existing.contains(collection)) {
            try {
                database.createCollection(collection);
                log.info("Created collection {}", collection);
            } catch (MongoCommandException e) {
                if (e.getErrorCode() != NAMESPACE_EXISTS) {
                    throw e;
                }
                log.debug("Collection {} created concurrently", collection);
            }
        }

        try {
            database.getCollection(collection).createIndex(Indexes.ascending(TIMESTAMP_FIELD));
        } catch (MongoException e) {
            log.warn("Could not create index on {}.{}: {}", collection, TIMESTAMP_FIELD, e.getMessage());
        }
    }

    private void discardStale(ConnectionHandle stale, ExecutionContext context) {
        if (handle.compareAndSet(stale, null)) {
            log.info("Execution context changed ({} -> {}), reconnecting to MongoDB",
                    stale.contextId(), context.id());
            closeQuietly(stale.client());
        }
    }

    private ConnectionLock lockFor(ExecutionContext context) {
        return connectionLock.updateAndGet(lock -> {
            if (lock != null && lock.isBoundTo(context)) {
                return lock;
            }
            if (lock != null) {
                log.debug("Replacing connection lock of context {}", lock.contextId());
            }
            return new ConnectionLock(context.id());
        });
    }

    private void closeQuietly(MongoClient client) {
        try {
            client.close();
        } catch (RuntimeException e) {
            log.warn("Error while closing MongoDB client: {}", e.getMessage());
        }
    }
}
