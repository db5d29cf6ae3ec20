package com.koni.sensors.infrastructure.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Component for tracking sensor ingestion and store connection metrics.
 * Provides counters and timers for monitoring system behavior.
 */
@Slf4j
@Component
public class SensorMetrics {

    private final Counter readingsStored;
    private final Counter readingsCleared;
    private final Counter storeConnects;
    private final Counter storeConnectFailures;
    private final Counter staleContextRetries;
    private final Timer operationTime;

    public SensorMetrics(MeterRegistry registry) {
        this.readingsStored = Counter.builder("sensors.readings.stored.total")
                .description("Total sensor readings written to the store")
                .register(registry);

        this.readingsCleared = Counter.builder("sensors.readings.cleared.total")
                .description("Total sensor readings deleted from the store")
                .register(registry);

        this.storeConnects = Counter.builder("sensors.store.connects.total")
                .description("Total successful store connect sequences")
                .register(registry);

        this.storeConnectFailures = Counter.builder("sensors.store.connect.failures.total")
                .description("Total failed store connect sequences")
                .register(registry);

        this.staleContextRetries = Counter.builder("sensors.store.stale_context.retries.total")
                .description("Total store operations retried after a stale execution context")
                .register(registry);

        this.operationTime = Timer.builder("sensors.store.operation.time")
                .description("Time spent in store operations, including reconnects")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    /**
     * Add to the counter of stored readings.
     */
    public void recordStored(long count) {
        readingsStored.increment(count);
        log.debug("Stored readings counter incremented by {}", count);
    }

    /**
     * Add to the counter of deleted readings.
     */
    public void recordCleared(long count) {
        readingsCleared.increment(count);
        log.debug("Cleared readings counter incremented by {}", count);
    }

    public void recordConnect() {
        storeConnects.increment();
    }

    public void recordConnectFailure() {
        storeConnectFailures.increment();
    }

    public void recordStaleContextRetry() {
        staleContextRetries.increment();
        log.debug("Stale context retry counter incremented");
    }

    /**
     * Record the time taken by a store operation.
     *
     * @param operation The operation to time
     * @param <T> The return type of the operation
     * @return The result of the operation
     */
    public <T> T recordOperationTime(Supplier<T> operation) {
        return operationTime.record(operation);
    }
}
