package com.koni.sensors.infrastructure.observability;

import com.koni.sensors.tags.UnitTest;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for SensorMetrics.
 * Tests counter increments, timer recording, and metric names.
 */
@UnitTest
class SensorMetricsTest {

    private MeterRegistry meterRegistry;
    private SensorMetrics sensorMetrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        sensorMetrics = new SensorMetrics(meterRegistry);
    }

    @Test
    void shouldRegisterAllMetricsOnStartup() {
        assertThat(meterRegistry.find("sensors.readings.stored.total").counter()).isNotNull();
        assertThat(meterRegistry.find("sensors.readings.cleared.total").counter()).isNotNull();
        assertThat(meterRegistry.find("sensors.store.connects.total").counter()).isNotNull();
        assertThat(meterRegistry.find("sensors.store.connect.failures.total").counter()).isNotNull();
        assertThat(meterRegistry.find("sensors.store.stale_context.retries.total").counter()).isNotNull();
        assertThat(meterRegistry.find("sensors.store.operation.time").timer()).isNotNull();
    }

    @Test
    void shouldAddStoredAndClearedCounts() {
        // When
        sensorMetrics.recordStored(1);
        sensorMetrics.recordStored(288);
        sensorMetrics.recordCleared(289);

        // Then
        assertThat(meterRegistry.find("sensors.readings.stored.total").counter().count()).isEqualTo(289.0);
        assertThat(meterRegistry.find("sensors.readings.cleared.total").counter().count()).isEqualTo(289.0);
    }

    @Test
    void shouldCountConnectsFailuresAndRetries() {
        // When
        sensorMetrics.recordConnect();
        sensorMetrics.recordConnect();
        sensorMetrics.recordConnectFailure();
        sensorMetrics.recordStaleContextRetry();

        // Then
        Counter connects = meterRegistry.find("sensors.store.connects.total").counter();
        assertThat(connects.count()).isEqualTo(2.0);
        assertThat(meterRegistry.find("sensors.store.connect.failures.total").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.find("sensors.store.stale_context.retries.total").counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldTimeOperationAndReturnItsResult() {
        // When
        String result = sensorMetrics.recordOperationTime(() -> "done");

        // Then
        Timer timer = meterRegistry.find("sensors.store.operation.time").timer();
        assertThat(result).isEqualTo("done");
        assertThat(timer.count()).isEqualTo(1);
    }
}
