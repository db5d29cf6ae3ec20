package com.koni.sensors.infrastructure.resilience;

import com.koni.sensors.infrastructure.persistence.mongo.StaleContextDetector;
import com.koni.sensors.tags.UnitTest;
import com.mongodb.MongoTimeoutException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the stale context retry configuration.
 * Verifies the attempt budget and which errors are retried.
 */
@UnitTest
class StaleContextRetryConfigurationTest {

    private StaleContextRetryConfiguration configuration;
    private Retry retry;

    @BeforeEach
    void setUp() {
        configuration = new StaleContextRetryConfiguration();
        StaleContextDetector detector = configuration.staleContextDetector();
        RetryConfig config = configuration.staleContextRetryConfig(detector, 1);
        retry = configuration.staleContextRetry(configuration.retryRegistry(config));
    }

    @Test
    void shouldUseTwoAttempts() {
        assertThat(retry.getName()).isEqualTo(StaleContextRetryConfiguration.STALE_CONTEXT_RETRY);
        assertThat(retry.getRetryConfig().getMaxAttempts()).isEqualTo(2);
    }

    @Test
    void shouldRetryStaleContextErrorOnce() {
        // Given
        AtomicInteger attempts = new AtomicInteger();
        Supplier<String> call = Retry.decorateSupplier(retry, () -> {
            if (attempts.incrementAndGet() == 1) {
                throw new IllegalStateException("state should be: open");
            }
            return "ok";
        });

        // When / Then
        assertThat(call.get()).isEqualTo("ok");
        assertThat(attempts.get()).isEqualTo(2);
    }

    @Test
    void shouldGiveUpAfterSecondStaleContextError() {
        // Given
        AtomicInteger attempts = new AtomicInteger();
        Supplier<String> call = Retry.decorateSupplier(retry, () -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("state should be: open");
        });

        // When / Then
        assertThatThrownBy(call::get).isInstanceOf(IllegalStateException.class);
        assertThat(attempts.get()).isEqualTo(2);
    }

    @Test
    void shouldNotRetryOtherErrors() {
        // Given
        AtomicInteger attempts = new AtomicInteger();
        Supplier<String> call = Retry.decorateSupplier(retry, () -> {
            attempts.incrementAndGet();
            throw new MongoTimeoutException("Timed out");
        });

        // When / Then
        assertThatThrownBy(call::get).isInstanceOf(MongoTimeoutException.class);
        assertThat(attempts.get()).isEqualTo(1);
    }
}
