package com.example.linkservice.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Verifies MDC (correlation ID) propagation onto the edge sync executor.
 *
 * The executor under test is built by {@link AsyncConfig#edgeSyncExecutor}, so it carries
 * the same {@link CorrelationIdTaskDecorator} as production. With a single core thread every task
 * reuses one worker, which makes context leaks between tasks observable.
 */
class CorrelationIdPropagationTest {

    private static final String MDC_KEY = "correlationId";

    private ThreadPoolTaskExecutor edgeSyncExecutor;

    @BeforeEach
    void setUp() {
        edgeSyncExecutor = new AsyncConfig().edgeSyncExecutor(1, 1, 10, "test-edge-");
    }

    @AfterEach
    void tearDown() {
        MDC.clear();
        edgeSyncExecutor.shutdown();
    }

    @Test
    void shouldPropagateMdcAcrossAsyncBoundary() throws ExecutionException, InterruptedException {
        // ARRANGE: request thread carries a correlation ID
        String correlationId = UUID.randomUUID().toString();
        MDC.put(MDC_KEY, correlationId);

        // ACT
        CompletableFuture<String> future = CompletableFuture.supplyAsync(() -> MDC.get(MDC_KEY), edgeSyncExecutor);

        // ASSERT
        assertEquals(correlationId, future.get(),
            "Correlation ID must reach the worker thread through the task decorator");
    }

    @Test
    void shouldRunOnWorkerThread() throws ExecutionException, InterruptedException {
        CompletableFuture<String> future = CompletableFuture.supplyAsync(
            () -> Thread.currentThread().getName(), edgeSyncExecutor);

        assertTrue(future.get().startsWith("test-edge-"));
    }

    @Test
    void shouldNotLeakContextIntoNextTask() throws ExecutionException, InterruptedException {
        // ARRANGE: first task runs with a correlation ID
        MDC.put(MDC_KEY, "first-request");
        CompletableFuture.runAsync(() -> { }, edgeSyncExecutor).get();

        // ACT: second task is submitted from a thread with no MDC
        MDC.clear();
        CompletableFuture<String> future = CompletableFuture.supplyAsync(() -> MDC.get(MDC_KEY), edgeSyncExecutor);

        // ASSERT: the pooled worker was cleaned up
        assertNull(future.get(), "Worker thread must not keep a stale correlation ID");
    }

    @Test
    void shouldIsolateSequentialCorrelationIds() throws ExecutionException, InterruptedException {
        MDC.put(MDC_KEY, "request-a");
        CompletableFuture<String> first = CompletableFuture.supplyAsync(() -> MDC.get(MDC_KEY), edgeSyncExecutor);

        MDC.put(MDC_KEY, "request-b");
        CompletableFuture<String> second = CompletableFuture.supplyAsync(() -> MDC.get(MDC_KEY), edgeSyncExecutor);

        assertEquals("request-a", first.get());
        assertEquals("request-b", second.get());
    }

    @Test
    void shouldCarryOnlyTheCorrelationId() throws ExecutionException, InterruptedException {
        MDC.put(MDC_KEY, "request-c");
        MDC.put("userId", "user-1");

        CompletableFuture<String> future = CompletableFuture.supplyAsync(
            () -> MDC.get(MDC_KEY) + "|" + MDC.get("userId"), edgeSyncExecutor);

        assertEquals("request-c|null", future.get());
    }

    @Test
    void shouldRestoreCallerContextWhenDecoratedTaskRunsInline() {
        // A decorated task run on the submitting thread must leave that thread's MDC intact
        MDC.put(MDC_KEY, "submitter");
        Runnable decorated = new CorrelationIdTaskDecorator().decorate(() -> MDC.put(MDC_KEY, "changed-by-task"));

        decorated.run();

        assertEquals("submitter", MDC.get(MDC_KEY));
    }
}
