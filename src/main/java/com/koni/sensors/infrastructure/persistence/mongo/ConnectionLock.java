package com.koni.sensors.infrastructure.persistence.mongo;

import com.koni.sensors.infrastructure.lifecycle.ExecutionContext;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutual exclusion for the connect sequence, bound to the execution context it was created in.
 * A lock from a previous context is never awaited; the manager replaces it instead.
 */
final class ConnectionLock {

    private final ReentrantLock lock = new ReentrantLock();
    private final String contextId;

    ConnectionLock(String contextId) {
        this.contextId = contextId;
    }

    boolean isBoundTo(ExecutionContext context) {
        return contextId.equals(context.id());
    }

    void lock() {
        lock.lock();
    }

    void unlock() {
        lock.unlock();
    }

    String contextId() {
        return contextId;
    }
}
