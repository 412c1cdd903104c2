package com.example.linkservice.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Async configuration for the edge sync executor.
 *
 * CRITICAL: Without this configuration, Spring uses SimpleAsyncTaskExecutor
 * which creates unbounded threads.
 *
 * The executor runs the startup sync and the single-key write-through calls made after
 * link mutations. Both are fire-and-forget, so the pool stays small:
 * - Core pool: 1 thread
 * - Max pool: 2 threads
 * - Queue: 10 tasks
 * - Rejection: AbortPolicy (callers catch RejectedExecutionException and log it)
 */
@Configuration
@EnableAsync
@Slf4j
public class AsyncConfig {

    public static final String EDGE_SYNC_EXECUTOR = "edgeSyncExecutor";

    @Bean(name = EDGE_SYNC_EXECUTOR)
    public ThreadPoolTaskExecutor edgeSyncExecutor(
            @Value("${edge-sync.async.core-pool-size:1}") int corePoolSize,
            @Value("${edge-sync.async.max-pool-size:2}") int maxPoolSize,
            @Value("${edge-sync.async.queue-capacity:10}") int queueCapacity,
            @Value("${edge-sync.async.thread-name-prefix:edge-sync-}") String threadNamePrefix) {

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(threadNamePrefix);

        // A full queue must not block the request thread that triggered a write-through
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        // Correlation IDs follow the task onto the worker thread
        executor.setTaskDecorator(new CorrelationIdTaskDecorator());

        executor.initialize();

        log.info("✅ Initialized edgeSyncExecutor - core={}, max={}, queue={}, prefix='{}'",
                corePoolSize, maxPoolSize, queueCapacity, threadNamePrefix);

        return executor;
    }
}
