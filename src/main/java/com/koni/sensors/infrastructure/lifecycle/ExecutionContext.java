package com.koni.sensors.infrastructure.lifecycle;

/**
 * Execution environment that store connections and their locks are bound to.
 *
 * A connection created in one context must not be trusted once that context is
 * closed or has been replaced by another one (serverless freeze/thaw,
 * checkpoint/restore, application context restart).
 */
public interface ExecutionContext {

    /**
     * Opaque identifier, unique for the lifetime of the process.
     */
    String id();

    /**
     * Whether this context has been torn down.
     */
    boolean isClosed();
}
