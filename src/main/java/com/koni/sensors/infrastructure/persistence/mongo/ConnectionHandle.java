package com.koni.sensors.infrastructure.persistence.mongo;

import com.koni.sensors.infrastructure.lifecycle.ExecutionContext;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import org.bson.Document;

import java.time.Instant;
import java.util.Objects;

/**
 * Live connection to the store: client, selected database and the execution
 * context the client was created in.
 *
 * Immutable and published as a whole, so readers never see a client without its database.
 * Only {@link MongoConnectionManager} creates handles and owns the client.
 */
public final class ConnectionHandle {

    private final MongoClient client;
    private final MongoDatabase database;
    private final String collectionName;
    private final ExecutionContext context;
    private final Instant connectedAt;

    ConnectionHandle(MongoClient client,
                     MongoDatabase database,
                     String collectionName,
                     ExecutionContext context,
                     Instant connectedAt) {
        this.client = Objects.requireNonNull(client, "client");
        this.database = Objects.requireNonNull(database, "database");
        this.collectionName = Objects.requireNonNull(collectionName, "collectionName");
        this.context = Objects.requireNonNull(context, "context");
        this.connectedAt = Objects.requireNonNull(connectedAt, "connectedAt");
    }

    public MongoDatabase database() {
        return database;
    }

    public MongoCollection<Document> collection() {
        return database.getCollection(collectionName);
    }

    public String contextId() {
        return context.id();
    }

    public Instant connectedAt() {
        return connectedAt;
    }

    MongoClient client() {
        return client;
    }

    /**
     * True while the context this handle was created in is still open and still the current one.
     */
    boolean isBoundTo(ExecutionContext current) {
        return !context.isClosed() && context.id().equals(current.id());
    }

    @Override
    public String toString() {
        return "ConnectionHandle{database=" + database.getName()
                + ", collection=" + collectionName
                + ", context=" + context.id()
                + ", connectedAt=" + connectedAt + '}';
    }
}
