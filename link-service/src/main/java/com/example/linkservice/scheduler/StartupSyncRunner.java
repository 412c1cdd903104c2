package com.example.linkservice.scheduler;

import com.example.linkservice.config.AsyncConfig;
import com.example.linkservice.dto.SyncResultDto;
import com.example.linkservice.service.EdgeSyncOrchestrator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Best-effort edge sync once per process start.
 *
 * Runs on the edge sync executor after the application is ready, so it never delays
 * readiness, and every failure is logged and dropped.
 */
@Component
@Slf4j
public class StartupSyncRunner {

    private final EdgeSyncOrchestrator edgeSyncOrchestrator;
    private final TaskExecutor edgeSyncExecutor;
    private final boolean enabled;

    public StartupSyncRunner(EdgeSyncOrchestrator edgeSyncOrchestrator,
                             @Qualifier(AsyncConfig.EDGE_SYNC_EXECUTOR) TaskExecutor edgeSyncExecutor,
                             @Value("${edge-sync.startup-sync-enabled:true}") boolean enabled) {
        this.edgeSyncOrchestrator = edgeSyncOrchestrator;
        this.edgeSyncExecutor = edgeSyncExecutor;
        this.enabled = enabled;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!enabled) {
            log.info("Startup edge sync disabled");
            return;
        }

        try {
            edgeSyncExecutor.execute(this::runStartupSync);
        } catch (RuntimeException e) {
            log.warn("⚠️ Startup edge sync could not be scheduled: {}", e.getMessage());
        }
    }

    void runStartupSync() {
        try {
            SyncResultDto result = edgeSyncOrchestrator.performSync();
            if (result.hasError()) {
                log.warn("⚠️ Startup edge sync did not complete: {}", result.getError());
            } else {
                log.info("Startup edge sync: synced={}, failed={}, skipped={}",
                        result.getSynced(), result.getFailed(), result.isSkipped());
            }
        } catch (Exception e) {
            log.error("❌ Startup edge sync failed: {}", e.getMessage(), e);
        }
    }
}
