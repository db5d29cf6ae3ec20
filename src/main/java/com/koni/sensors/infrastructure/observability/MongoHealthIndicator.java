package com.koni.sensors.infrastructure.observability;

import com.koni.sensors.infrastructure.persistence.mongo.MongoConnectionManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for MongoDB connectivity.
 *
 * Runs the liveness probe through the connection manager, so a health check also
 * establishes (or re-establishes) the lazy connection.
 * Returns UP if the ping succeeds, DOWN if configuration is missing or the store is unreachable.
 */
@Slf4j
@Component("mongo")
@RequiredArgsConstructor
public class MongoHealthIndicator implements HealthIndicator {

    private final MongoConnectionManager connectionManager;

    @Override
    public Health health() {
        try {
            Document reply = connectionManager.ping();
            Object ok = reply.get("ok");

            if (ok instanceof Number && ((Number) ok).doubleValue() == 1.0) {
                log.debug("MongoDB health check passed: database={}", connectionManager.settings().getDatabase());

                return Health.up()
                        .withDetail("database", connectionManager.settings().getDatabase())
                        .withDetail("collection", connectionManager.settings().getCollection())
                        .withDetail("state", connectionManager.state().name())
                        .build();
            }

            log.error("MongoDB health check failed: ping returned {}", reply.toJson());
            return Health.down()
                    .withDetail("error", "PingFailed")
                    .withDetail("message", "ping did not return ok: 1")
                    .build();

        } catch (Exception e) {
            log.error("MongoDB health check failed", e);

            return Health.down()
                    .withDetail("error", e.getClass().getSimpleName())
                    .withDetail("message", String.valueOf(e.getMessage()))
                    .withDetail("state", connectionManager.state().name())
                    .build();
        }
    }
}
