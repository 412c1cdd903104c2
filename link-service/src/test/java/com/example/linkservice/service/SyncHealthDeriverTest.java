package com.example.linkservice.service;

import com.example.linkservice.dto.HealthStatus;
import com.example.linkservice.dto.SyncHistoryEntry;
import com.example.linkservice.dto.SyncStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SyncHealthDeriverTest {

    private static SyncHistoryEntry success(String timestamp, int total) {
        return SyncHistoryEntry.builder()
                .timestamp(timestamp)
                .status(SyncStatus.SUCCESS)
                .synced(total)
                .total(total)
                .durationMs(12)
                .build();
    }

    @Test
    void emptyHistory() {
        HealthStatus health = SyncHealthDeriver.deriveHealth(List.of());

        assertThat(health.history()).isEmpty();
        assertThat(health.lastSyncTime()).isNull();
        assertThat(health.approxCacheSize()).isNull();
        assertThat(health.successRatePercent()).isNull();
    }

    @Test
    @DisplayName("Last sync comes from the newest success even behind newer error and skipped entries")
    void lastSuccessBehindNewerFailures() {
        List<SyncHistoryEntry> history = List.of(
                SyncHistoryEntry.skipped(),
                SyncHistoryEntry.fetchFailed("Failed to fetch records from source", 40),
                success("2026-03-01T10:00:00Z", 120),
                success("2026-03-01T09:00:00Z", 100));

        HealthStatus health = SyncHealthDeriver.deriveHealth(history);

        assertThat(health.lastSyncTime()).isEqualTo("2026-03-01T10:00:00Z");
        assertThat(health.approxCacheSize()).isEqualTo(120);
        assertThat(health.successRatePercent()).isEqualTo(50);
        assertThat(health.history()).containsExactlyElementsOf(history);
    }

    @Test
    @DisplayName("Skipped attempts lower the success rate")
    void skippedCountsAgainstRate() {
        List<SyncHistoryEntry> history = List.of(
                SyncHistoryEntry.skipped(),
                SyncHistoryEntry.skipped(),
                success("2026-03-01T10:00:00Z", 5));

        HealthStatus health = SyncHealthDeriver.deriveHealth(history);

        assertThat(health.successRatePercent()).isEqualTo(33);
    }

    @Test
    void noSuccessAtAll() {
        HealthStatus health = SyncHealthDeriver.deriveHealth(List.of(SyncHistoryEntry.completed(1, 2, 30)));

        assertThat(health.lastSyncTime()).isNull();
        assertThat(health.approxCacheSize()).isNull();
        assertThat(health.successRatePercent()).isZero();
    }

    @Test
    void roundsHalfUp() {
        // 2 of 3 = 66.67%
        List<SyncHistoryEntry> history = List.of(
                success("2026-03-01T10:00:00Z", 1),
                success("2026-03-01T09:00:00Z", 1),
                SyncHistoryEntry.skipped());

        assertThat(SyncHealthDeriver.deriveHealth(history).successRatePercent()).isEqualTo(67);
    }
}
