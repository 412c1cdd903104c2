package com.example.linkservice.metrics;

import com.example.linkservice.dto.SyncStatus;
import com.example.linkservice.service.EdgeCacheDirtyTracker;
import com.example.linkservice.service.SyncHistoryBuffer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Metrics component for Prometheus monitoring of edge cache sync.
 *
 * Exposes:
 * - edge_sync_attempts_total: Counter of sync attempts by status (success, error, skipped)
 * - edge_sync_entries_total: Counter of cache entries written, by outcome (synced, failed)
 * - edge_sync_duration_seconds: Timer for non-skipped sync attempts
 * - edge_sync_dirty: Gauge, 1 while the edge cache may be stale
 * - edge_sync_history_size: Gauge, number of entries in the in-memory history
 *
 * Access metrics: http://localhost:8085/actuator/prometheus
 */
@Component
@Slf4j
public class EdgeSyncMetrics {

    private final Map<SyncStatus, Counter> attemptCounters = new EnumMap<>(SyncStatus.class);
    private final Counter syncedEntriesCounter;
    private final Counter failedEntriesCounter;
    private final Counter writeThroughFailureCounter;
    private final Timer syncTimer;

    public EdgeSyncMetrics(MeterRegistry meterRegistry,
                           EdgeCacheDirtyTracker dirtyTracker,
                           SyncHistoryBuffer historyBuffer) {
        for (SyncStatus status : SyncStatus.values()) {
            attemptCounters.put(status, Counter.builder("edge_sync_attempts_total")
                    .description("Edge cache sync attempts")
                    .tag("status", status.jsonValue())
                    .register(meterRegistry));
        }

        this.syncedEntriesCounter = Counter.builder("edge_sync_entries_total")
                .description("Cache entries processed by edge sync")
                .tag("outcome", "synced")
                .register(meterRegistry);

        this.failedEntriesCounter = Counter.builder("edge_sync_entries_total")
                .tag("outcome", "failed")
                .register(meterRegistry);

        this.writeThroughFailureCounter = Counter.builder("edge_write_through_failures_total")
                .description("Single-key edge cache writes that failed after a link mutation")
                .register(meterRegistry);

        this.syncTimer = Timer.builder("edge_sync_duration_seconds")
                .description("Duration of edge cache sync attempts")
                .register(meterRegistry);

        Gauge.builder("edge_sync_dirty", dirtyTracker, tracker -> tracker.isDirty() ? 1 : 0)
                .description("1 while the edge cache may be stale")
                .register(meterRegistry);

        Gauge.builder("edge_sync_history_size", historyBuffer, SyncHistoryBuffer::size)
                .description("Entries in the in-memory sync history")
                .register(meterRegistry);
    }

    public void recordSkipped() {
        attemptCounters.get(SyncStatus.SKIPPED).increment();
    }

    /**
     * Record an attempt that failed before any write (authoritative store fetch failure).
     */
    public void recordFetchFailure(long durationMs) {
        attemptCounters.get(SyncStatus.ERROR).increment();
        syncTimer.record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Record a completed attempt. Any failed entry marks the whole attempt as an error.
     */
    public void recordCompleted(int synced, int failed, long durationMs) {
        attemptCounters.get(failed > 0 ? SyncStatus.ERROR : SyncStatus.SUCCESS).increment();
        syncedEntriesCounter.increment(synced);
        failedEntriesCounter.increment(failed);
        syncTimer.record(durationMs, TimeUnit.MILLISECONDS);
        log.debug("Recorded edge sync: synced={}, failed={}, duration={}ms", synced, failed, durationMs);
    }

    public void recordWriteThroughFailure() {
        writeThroughFailureCounter.increment();
    }
}
