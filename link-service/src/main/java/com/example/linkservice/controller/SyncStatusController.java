package com.example.linkservice.controller;

import com.example.linkservice.dto.HealthStatus;
import com.example.linkservice.service.SyncHealthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/internal/edge-sync")
@RequiredArgsConstructor
@Tag(name = "Edge Sync", description = "Cron-triggered edge cache synchronization")
public class SyncStatusController {

    private final SyncHealthService syncHealthService;

    @GetMapping("/health")
    @Operation(summary = "Recent sync history with derived health")
    public ResponseEntity<HealthStatus> health() {
        return ResponseEntity.ok(syncHealthService.getHealth());
    }
}
