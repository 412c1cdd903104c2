package com.example.linkservice.service;

import com.example.linkservice.dto.HealthStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Health query behind the dashboard's sync status panel.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SyncHealthService {

    private final SyncHistoryBuffer historyBuffer;
    private final EdgeSyncOrchestrator edgeSyncOrchestrator;

    /**
     * Derive health from the history. A fresh instance has no history yet, so one sync is run
     * first and the dashboard never starts out empty.
     */
    public HealthStatus getHealth() {
        if (historyBuffer.isEmpty()) {
            log.info("Sync history empty, running one edge sync before reporting health");
            edgeSyncOrchestrator.performSync();
        }
        return SyncHealthDeriver.deriveHealth(historyBuffer.list());
    }
}
