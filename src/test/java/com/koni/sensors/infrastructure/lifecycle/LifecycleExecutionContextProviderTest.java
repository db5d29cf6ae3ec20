package com.koni.sensors.infrastructure.lifecycle;

import com.koni.sensors.tags.UnitTest;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for LifecycleExecutionContextProvider.
 */
@UnitTest
class LifecycleExecutionContextProviderTest {

    private final LifecycleExecutionContextProvider provider = new LifecycleExecutionContextProvider();

    @Test
    void shouldKeepTheSameContextWhileRunning() {
        // Given
        provider.start();

        // When
        ExecutionContext first = provider.current();
        ExecutionContext second = provider.current();

        // Then
        assertThat(provider.isRunning()).isTrue();
        assertThat(second).isSameAs(first);
        assertThat(first.id()).isEqualTo("generation-1");
        assertThat(first.isClosed()).isFalse();
    }

    @Test
    void shouldCloseContextOnStop() {
        // Given
        provider.start();
        ExecutionContext context = provider.current();

        // When
        provider.stop();

        // Then
        assertThat(context.isClosed()).isTrue();
        assertThat(provider.isRunning()).isFalse();
    }

    @Test
    void shouldOpenNewGenerationAfterRestart() {
        // Given
        provider.start();
        ExecutionContext before = provider.current();

        // When
        provider.stop();
        provider.start();
        ExecutionContext after = provider.current();

        // Then
        assertThat(after.id()).isEqualTo("generation-2");
        assertThat(after.isClosed()).isFalse();
        assertThat(before.isClosed()).isTrue();
    }

    @Test
    void shouldNeverHandOutClosedContext() {
        // Given
        provider.start();
        provider.stop();

        // When
        ExecutionContext context = provider.current();

        // Then
        assertThat(context.isClosed()).isFalse();
        assertThat(context.id()).isEqualTo("generation-2");
    }

    @Test
    void shouldOpenExactlyOneGenerationWhenManyCallersFindTheContextClosed() throws Exception {
        // Given
        provider.start();
        provider.stop();
        int callers = 32;
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ExecutionContext>> results = new ArrayList<>();

        try {
            for (int i = 0; i < callers; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return provider.current();
                }));
            }

            // When
            start.countDown();

            // Then
            Set<String> ids = new HashSet<>();
            for (Future<ExecutionContext> result : results) {
                ids.add(result.get(5, TimeUnit.SECONDS).id());
            }
            assertThat(ids).containsExactly("generation-2");
        } finally {
            executor.shutdownNow();
        }

        // And the next restart continues the sequence without gaps
        provider.stop();
        assertThat(provider.current().id()).isEqualTo("generation-3");
    }

    @Test
    void shouldOpenContextOnDemandBeforeStart() {
        assertThat(provider.current().id()).isEqualTo("generation-1");
    }

    @Test
    void shouldStartBeforeOtherLifecycleBeans() {
        assertThat(provider.getPhase()).isLessThan(0);
    }
}
