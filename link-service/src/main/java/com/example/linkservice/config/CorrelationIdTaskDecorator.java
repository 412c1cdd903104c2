package com.example.linkservice.config;

import com.example.linkservice.security.CorrelationIdFilter;
import org.slf4j.MDC;
import org.springframework.core.task.TaskDecorator;

/**
 * Carries the submitting thread's correlation ID (an inbound X-Request-ID or an EDGE-SYNC id)
 * onto the edge sync executor thread that runs the task.
 *
 * Only the correlation ID crosses the boundary. The worker's own value is put back afterwards,
 * or removed if it had none, so pooled threads never log a write-through under a stale ID.
 */
public class CorrelationIdTaskDecorator implements TaskDecorator {

    @Override
    public Runnable decorate(Runnable runnable) {
        // Read on the submitting thread, before the task is queued
        String correlationId = MDC.get(CorrelationIdFilter.MDC_KEY);

        return () -> {
            String workerCorrelationId = MDC.get(CorrelationIdFilter.MDC_KEY);
            putOrRemove(correlationId);
            try {
                runnable.run();
            } finally {
                putOrRemove(workerCorrelationId);
            }
        };
    }

    private static void putOrRemove(String correlationId) {
        if (correlationId != null) {
            MDC.put(CorrelationIdFilter.MDC_KEY, correlationId);
        } else {
            MDC.remove(CorrelationIdFilter.MDC_KEY);
        }
    }
}
