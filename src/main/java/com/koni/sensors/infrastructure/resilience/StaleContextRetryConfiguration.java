package com.koni.sensors.infrastructure.resilience;

import com.koni.sensors.infrastructure.persistence.mongo.StaleContextDetector;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration for the retry applied to store operations.
 * A store call that fails because its connection belongs to a stale execution context is
 * retried exactly once, after the connection was invalidated and re-established.
 */
@Configuration
public class StaleContextRetryConfiguration {

    public static final String STALE_CONTEXT_RETRY = "mongo-stale-context";
    public static final int MAX_ATTEMPTS = 2;

    @Bean
    public StaleContextDetector staleContextDetector() {
        return new StaleContextDetector();
    }

    /**
     * Creates the RetryConfig for stale execution contexts.
     *
     * Configuration:
     * - Max attempts: 2 (the original call plus one retry)
     * - Wait between attempts: sensors.mongodb.stale-retry.wait-ms (default 50ms)
     * - Retried errors: only those recognised by the StaleContextDetector;
     *   everything else propagates on the first failure
     *
     * @param staleContextDetector classifier for stale context errors
     * @param waitMs pause before the retry in milliseconds
     * @return RetryConfig with the stale context policy
     */
    @Bean
    public RetryConfig staleContextRetryConfig(StaleContextDetector staleContextDetector,
                                               @Value("${sensors.mongodb.stale-retry.wait-ms:50}") long waitMs) {
        return RetryConfig.custom()
                .maxAttempts(MAX_ATTEMPTS)
                .waitDuration(Duration.ofMillis(waitMs))
                .retryOnException(staleContextDetector)
                .build();
    }

    @Bean
    public RetryRegistry retryRegistry(RetryConfig staleContextRetryConfig) {
        return RetryRegistry.of(staleContextRetryConfig);
    }

    @Bean
    public Retry staleContextRetry(RetryRegistry retryRegistry) {
        return retryRegistry.retry(STALE_CONTEXT_RETRY);
    }
}
