package com.example.linkservice.controller;

import com.example.linkservice.client.edge.EdgeStoreClient;
import com.example.linkservice.dto.SyncResultDto;
import com.example.linkservice.dto.SyncTriggerResponse;
import com.example.linkservice.exception.ServiceUnavailableException;
import com.example.linkservice.exception.SyncFailedException;
import com.example.linkservice.security.CronSecretVerifier;
import com.example.linkservice.service.EdgeSyncOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Endpoint called by the external scheduler to reconcile the edge cache.
 */
@RestController
@RequestMapping("/api/cron")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Edge Sync", description = "Cron-triggered edge cache synchronization")
public class CronSyncController {

    private final CronSecretVerifier cronSecretVerifier;
    private final EdgeStoreClient edgeStoreClient;
    private final EdgeSyncOrchestrator edgeSyncOrchestrator;

    /**
     * Skipped syncs and partial write failures both answer 200; the counts carry the outcome.
     */
    @PostMapping("/sync-edge")
    @Operation(summary = "Sync the edge cache with the link table")
    public ResponseEntity<SyncTriggerResponse> syncEdge(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestParam(value = "secret", required = false) String secret) {

        cronSecretVerifier.verify(authorization, secret);

        if (!edgeStoreClient.isConfigured()) {
            throw new ServiceUnavailableException("EDGE_STORE_NOT_CONFIGURED", "Edge store not configured");
        }

        SyncResultDto result = edgeSyncOrchestrator.performSync();
        if (result.hasError()) {
            throw new SyncFailedException(result.getError());
        }

        log.info("Cron edge sync: synced={}, failed={}, total={}, skipped={}, duration={}ms",
                result.getSynced(), result.getFailed(), result.getTotal(), result.isSkipped(), result.getDurationMs());
        return ResponseEntity.ok(SyncTriggerResponse.from(result));
    }
}
