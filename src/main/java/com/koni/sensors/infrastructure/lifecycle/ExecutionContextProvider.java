package com.koni.sensors.infrastructure.lifecycle;

/**
 * Source of the execution context the calling code is running in.
 */
@FunctionalInterface
public interface ExecutionContextProvider {

    /**
     * Returns the live execution context. Never returns a closed context.
     */
    ExecutionContext current();
}
