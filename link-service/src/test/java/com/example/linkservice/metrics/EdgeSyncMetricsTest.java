package com.example.linkservice.metrics;

import com.example.linkservice.dto.SyncHistoryEntry;
import com.example.linkservice.service.EdgeCacheDirtyTracker;
import com.example.linkservice.service.SyncHistoryBuffer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class EdgeSyncMetricsTest {

    private SimpleMeterRegistry registry;
    private EdgeCacheDirtyTracker dirtyTracker;
    private SyncHistoryBuffer historyBuffer;
    private EdgeSyncMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        dirtyTracker = new EdgeCacheDirtyTracker();
        historyBuffer = new SyncHistoryBuffer();
        metrics = new EdgeSyncMetrics(registry, dirtyTracker, historyBuffer);
    }

    private double attempts(String status) {
        return registry.get("edge_sync_attempts_total").tag("status", status).counter().count();
    }

    @Test
    void countsAttemptsByStatus() {
        metrics.recordCompleted(5, 0, 100);
        metrics.recordCompleted(4, 1, 120);
        metrics.recordSkipped();
        metrics.recordFetchFailure(30);

        assertThat(attempts("success")).isEqualTo(1.0);
        assertThat(attempts("error")).isEqualTo(2.0);
        assertThat(attempts("skipped")).isEqualTo(1.0);
        assertThat(registry.get("edge_sync_entries_total").tag("outcome", "synced").counter().count()).isEqualTo(9.0);
        assertThat(registry.get("edge_sync_entries_total").tag("outcome", "failed").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("edge_sync_duration_seconds").timer().count()).isEqualTo(3);
    }

    @Test
    void statusTagsIgnoreDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            SimpleMeterRegistry turkish = new SimpleMeterRegistry();
            new EdgeSyncMetrics(turkish, dirtyTracker, historyBuffer).recordSkipped();

            assertThat(turkish.get("edge_sync_attempts_total").tag("status", "skipped").counter().count())
                    .isEqualTo(1.0);
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void gaugesFollowSharedState() {
        assertThat(registry.get("edge_sync_dirty").gauge().value()).isEqualTo(1.0);

        dirtyTracker.clear();
        historyBuffer.record(SyncHistoryEntry.skipped());
        historyBuffer.record(SyncHistoryEntry.skipped());

        assertThat(registry.get("edge_sync_dirty").gauge().value()).isZero();
        assertThat(registry.get("edge_sync_history_size").gauge().value()).isEqualTo(2.0);
    }
}
