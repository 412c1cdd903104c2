package com.example.linkservice.service;

import com.example.linkservice.client.edge.EdgeStoreClient;
import com.example.linkservice.dto.BulkPutResult;
import com.example.linkservice.dto.EdgeCacheEntry;
import com.example.linkservice.dto.RedirectRecord;
import com.example.linkservice.dto.SyncHistoryEntry;
import com.example.linkservice.dto.SyncResultDto;
import com.example.linkservice.metrics.EdgeSyncMetrics;
import com.example.linkservice.repository.LinkRepository;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Sync engine: reconciles the edge cache with the full snapshot of the link table.
 *
 * CRITICAL DESIGN:
 * - Never throws; configuration absence, fetch failure and partial writes are all in the result
 * - Full snapshot every time the cache is dirty, no per-record diffing
 * - Edge writes are idempotent overwrites keyed by slug, so a failed attempt is retried by
 *   simply running the next full sync
 * - The dirty flag is cleared only by an attempt with zero failed entries
 * - Correlation ID "EDGE-SYNC-xxxxxxxx" unless the caller already has one
 *
 * Concurrent attempts are tolerated by default: both read the snapshot, both write it and both
 * append history. With edge-sync.coalesce-concurrent=true a caller arriving while an attempt is
 * in flight waits for that attempt and shares its result.
 */
@Service
@Slf4j
public class EdgeSyncOrchestrator {

    static final String FETCH_FAILED_MESSAGE = "Failed to fetch records from source";
    static final String NOT_CONFIGURED_MESSAGE = "Edge store not configured";
    private static final String MDC_KEY = "correlationId";

    private final LinkRepository linkRepository;
    private final EdgeStoreClient edgeStoreClient;
    private final EdgeLinkMapper edgeLinkMapper;
    private final EdgeCacheDirtyTracker dirtyTracker;
    private final SyncHistoryBuffer historyBuffer;
    private final EdgeSyncMetrics metrics;
    private final boolean coalesceConcurrent;

    private final AtomicReference<CompletableFuture<SyncResultDto>> inFlight = new AtomicReference<>();

    public EdgeSyncOrchestrator(LinkRepository linkRepository,
                                EdgeStoreClient edgeStoreClient,
                                EdgeLinkMapper edgeLinkMapper,
                                EdgeCacheDirtyTracker dirtyTracker,
                                SyncHistoryBuffer historyBuffer,
                                EdgeSyncMetrics metrics,
                                @Value("${edge-sync.coalesce-concurrent:false}") boolean coalesceConcurrent) {
        this.linkRepository = linkRepository;
        this.edgeStoreClient = edgeStoreClient;
        this.edgeLinkMapper = edgeLinkMapper;
        this.dirtyTracker = dirtyTracker;
        this.historyBuffer = historyBuffer;
        this.metrics = metrics;
        this.coalesceConcurrent = coalesceConcurrent;
    }

    /**
     * Run one sync attempt, skipping it when the edge cache is known to be in sync.
     * Called by the cron endpoint, the startup hook, the scheduler and the health query.
     */
    public SyncResultDto performSync() {
        if (!coalesceConcurrent) {
            return withCorrelationId(() -> execute(false));
        }

        CompletableFuture<SyncResultDto> attempt = new CompletableFuture<>();
        CompletableFuture<SyncResultDto> running = inFlight.compareAndExchange(null, attempt);
        if (running != null) {
            log.info("Edge sync already in flight, waiting for its result");
            return running.join();
        }

        try {
            SyncResultDto result = withCorrelationId(() -> execute(false));
            inFlight.compareAndSet(attempt, null);
            attempt.complete(result);
            return result;
        } catch (RuntimeException e) {
            inFlight.compareAndSet(attempt, null);
            attempt.completeExceptionally(e);
            throw e;
        }
    }

    /**
     * Run one sync attempt regardless of the dirty flag. Used by the operator sync.
     */
    public SyncResultDto performFullSync() {
        return withCorrelationId(() -> execute(true));
    }

    private SyncResultDto execute(boolean force) {
        if (!edgeStoreClient.isConfigured()) {
            log.warn("⚠️ Edge sync not attempted: {}", NOT_CONFIGURED_MESSAGE);
            return SyncResultDto.notConfigured(NOT_CONFIGURED_MESSAGE);
        }

        if (!force && !dirtyTracker.isDirty()) {
            log.info("Edge cache clean, sync skipped");
            historyBuffer.record(SyncHistoryEntry.skipped());
            metrics.recordSkipped();
            return SyncResultDto.skippedClean();
        }

        long startTime = System.currentTimeMillis();
        // Sampled before the snapshot: mutations after this point keep the cache dirty
        long observedMutations = dirtyTracker.mutationCount();

        List<RedirectRecord> records;
        try {
            records = linkRepository.findAllRedirectRecords();
        } catch (RuntimeException e) {
            long duration = System.currentTimeMillis() - startTime;
            log.error("❌ Edge sync failed: could not fetch redirect records: {}", e.getMessage(), e);
            historyBuffer.record(SyncHistoryEntry.fetchFailed(FETCH_FAILED_MESSAGE, duration));
            metrics.recordFetchFailure(duration);
            return SyncResultDto.fetchFailed(FETCH_FAILED_MESSAGE, duration);
        }

        log.info("Starting edge sync: {} records, batch size {}", records.size(), edgeStoreClient.getMaxBatchSize());

        BulkPutResult written;
        try {
            List<EdgeCacheEntry> entries = edgeLinkMapper.toCacheEntries(records);
            written = edgeStoreClient.bulkPut(entries);
        } catch (RuntimeException e) {
            log.error("❌ Edge write phase aborted, counting {} entries as failed: {}",
                    records.size(), e.getMessage(), e);
            written = new BulkPutResult(0, records.size());
        }

        long duration = System.currentTimeMillis() - startTime;
        int synced = written.successCount();
        int failed = written.failedCount();

        historyBuffer.record(SyncHistoryEntry.completed(synced, failed, duration));
        metrics.recordCompleted(synced, failed, duration);

        if (failed == 0) {
            dirtyTracker.clearIfUnchangedSince(observedMutations);
            log.info("✅ Edge sync completed: synced={}, duration={}ms", synced, duration);
        } else {
            log.warn("⚠️ Edge sync PARTIAL_FAILURE: synced={}, failed={}, duration={}ms; cache stays dirty",
                    synced, failed, duration);
        }

        return SyncResultDto.completed(synced, failed, duration);
    }

    private SyncResultDto withCorrelationId(Supplier<SyncResultDto> attempt) {
        if (MDC.get(MDC_KEY) != null) {
            return attempt.get();
        }

        String correlationId = "EDGE-SYNC-" + UUID.randomUUID().toString().substring(0, 8);
        MDC.put(MDC_KEY, correlationId);
        try {
            return attempt.get();
        } finally {
            MDC.remove(MDC_KEY);
        }
    }
}
