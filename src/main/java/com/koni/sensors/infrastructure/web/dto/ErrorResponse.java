package com.koni.sensors.infrastructure.web.dto;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.time.Instant;

/**
 * Error body returned by every endpoint: {@code {status, error, message, timestamp}}.
 * {@code message} is the failure's own message, e.g. "MONGODB_URL environment variable is not set".
 */
@Getter
public class ErrorResponse {

    private final int status;
    private final String error;
    private final String message;
    private final Instant timestamp;

    public ErrorResponse(HttpStatus status, String message) {
        this.status = status.value();
        this.error = status.getReasonPhrase();
        this.message = message;
        this.timestamp = Instant.now();
    }
}
