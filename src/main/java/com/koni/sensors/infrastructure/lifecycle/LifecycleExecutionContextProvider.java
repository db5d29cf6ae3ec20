package com.koni.sensors.infrastructure.lifecycle;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tracks execution contexts as generations of the application lifecycle.
 *
 * A generation opens when the application context starts and closes when it stops.
 * Spring stops and restarts lifecycle beans around a JVM checkpoint/restore and on
 * context restarts, so connections created before a freeze are recognisable as stale
 * after the thaw.
 *
 * {@link #current()} always hands out a live generation: asking for the current
 * context after the previous one was closed opens the next generation.
 */
@Slf4j
public class LifecycleExecutionContextProvider implements ExecutionContextProvider, SmartLifecycle {

    private final AtomicLong generations = new AtomicLong();
    private final AtomicReference<Generation> current = new AtomicReference<>();

    @Override
    public ExecutionContext current() {
        Generation generation = current.get();
        if (generation != null && !generation.isClosed()) {
            return generation;
        }
        return openIfClosed();
    }

    @Override
    public void start() {
        Generation generation = (Generation) current();
        log.info("Execution context started: {}", generation.id());
    }

    @Override
    public void stop() {
        Generation generation = current.get();
        if (generation != null && !generation.isClosed()) {
            generation.close();
            log.info("Execution context closed: {}", generation.id());
        }
    }

    @Override
    public boolean isRunning() {
        Generation generation = current.get();
        return generation != null && !generation.isClosed();
    }

    /**
     * Started before and stopped after the web server and other lifecycle beans.
     */
    @Override
    public int getPhase() {
        return Integer.MIN_VALUE + 1000;
    }

    /**
     * Opens the next generation at most once per closed one. Numbers are only taken by the
     * winner, so concurrent callers never skip a generation id.
     */
    private synchronized Generation openIfClosed() {
        Generation generation = current.get();
        if (generation != null && !generation.isClosed()) {
            return generation;
        }
        Generation next = open();
        current.set(next);
        return next;
    }

    private Generation open() {
        return new Generation("generation-" + generations.incrementAndGet());
    }

    private static final class Generation implements ExecutionContext {

        private final String id;
        private volatile boolean closed;

        private Generation(String id) {
            this.id = id;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public boolean isClosed() {
            return closed;
        }

        private void close() {
            closed = true;
        }

        @Override
        public String toString() {
            return id + (closed ? " (closed)" : "");
        }
    }
}
