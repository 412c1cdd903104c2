package com.example.linkservice.scheduler;

import com.example.linkservice.config.ShedLockConfig;
import com.example.linkservice.dto.SyncResultDto;
import com.example.linkservice.service.EdgeSyncOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * In-process trigger for deployments without an external cron caller.
 *
 * Disabled by default. @SchedulerLock keeps multiple replicas from syncing on the same tick;
 * the scheduler only delegates, the sync engine decides whether anything needs writing.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "edge-sync.scheduler.enabled", havingValue = "true")
public class EdgeSyncScheduler {

    private final EdgeSyncOrchestrator edgeSyncOrchestrator;

    /**
     * Default: every 15 minutes.
     */
    @Scheduled(cron = "${edge-sync.scheduler.cron:0 */15 * * * *}")
    @SchedulerLock(
            name = ShedLockConfig.EDGE_SYNC_LOCK,
            lockAtMostFor = ShedLockConfig.EDGE_SYNC_LOCK_AT_MOST_FOR,
            lockAtLeastFor = ShedLockConfig.EDGE_SYNC_LOCK_AT_LEAST_FOR
    )
    public void syncEdgeCache() {
        String correlationId = "SCHEDULER-EDGE-" + UUID.randomUUID().toString().substring(0, 8);
        MDC.put("correlationId", correlationId);

        try {
            log.info("=== Starting scheduled edge sync: correlationId={} ===", correlationId);
            SyncResultDto result = edgeSyncOrchestrator.performSync();
            log.info("=== Completed scheduled edge sync: synced={}, failed={}, skipped={}, error={} ===",
                    result.getSynced(), result.getFailed(), result.isSkipped(), result.getError());
        } catch (Exception e) {
            log.error("Error in scheduled edge sync: {}", e.getMessage(), e);
        } finally {
            MDC.remove("correlationId");
        }
    }
}
