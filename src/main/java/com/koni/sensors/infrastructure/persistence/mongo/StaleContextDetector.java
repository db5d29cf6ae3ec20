package com.koni.sensors.infrastructure.persistence.mongo;

import java.util.Locale;
import java.util.function.Predicate;

/**
 * Recognises failures caused by calling the store through a connection whose execution
 * context was torn down.
 *
 * <p>The driver has no dedicated exception type for this. A call on a closed client fails
 * with {@code IllegalStateException("state should be: open")}, a closed pool with
 * "... pool was closed"; the check therefore matches messages along the cause chain.
 */
public class StaleContextDetector implements Predicate<Throwable> {

    private static final int MAX_CAUSE_DEPTH = 10;

    private static final String[] STALE_KEYWORDS = {
            "state should be: open",
            "server session pool is open",
            "mongoclient has been closed",
            "the client has been closed",
            "pool was closed",
            "connection pool has been closed",
            "event loop is closed",
            "attached to a different loop"
    };

    @Override
    public boolean test(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (matches(current.getMessage())) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    private static boolean matches(String message) {
        if (message == null) {
            return false;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        for (String keyword : STALE_KEYWORDS) {
            if (normalized.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
