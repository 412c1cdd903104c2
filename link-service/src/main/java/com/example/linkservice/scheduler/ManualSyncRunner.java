package com.example.linkservice.scheduler;

import com.example.linkservice.client.edge.EdgeStoreClient;
import com.example.linkservice.dto.EdgeLinkPayload;
import com.example.linkservice.dto.RedirectRecord;
import com.example.linkservice.dto.SyncResultDto;
import com.example.linkservice.repository.LinkRepository;
import com.example.linkservice.service.EdgeLinkMapper;
import com.example.linkservice.service.EdgeSyncOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * One-shot operator sync, run with the "manual-sync" profile:
 *
 * <pre>
 * java -jar link-service.jar --spring.profiles.active=manual-sync [--dry-run]
 * </pre>
 *
 * Pushes the full snapshot regardless of the dirty flag. With --dry-run it only reads the
 * snapshot and prints a sample. Exit code 0 on success, 1 otherwise.
 * A successful sync is followed by a read-back of the newest live link, which only logs.
 */
@Component
@Profile(ManualSyncRunner.PROFILE)
@RequiredArgsConstructor
@Slf4j
public class ManualSyncRunner implements ApplicationRunner, ExitCodeGenerator {

    public static final String PROFILE = "manual-sync";
    static final String DRY_RUN_OPTION = "dry-run";
    static final int SAMPLE_SIZE = 5;

    private final EdgeSyncOrchestrator edgeSyncOrchestrator;
    private final EdgeStoreClient edgeStoreClient;
    private final LinkRepository linkRepository;
    private final EdgeLinkMapper edgeLinkMapper;

    private int exitCode = 1;

    @Override
    public void run(ApplicationArguments args) {
        boolean dryRun = args.containsOption(DRY_RUN_OPTION);
        log.info("Manual edge sync starting{}", dryRun ? " (dry run)" : "");

        if (!edgeStoreClient.isConfigured()) {
            log.error("❌ Edge store not configured. Set edge-store.account-id, edge-store.namespace-id and edge-store.api-token.");
            exitCode = 1;
            return;
        }

        exitCode = dryRun ? dryRun() : fullSync();
    }

    private int dryRun() {
        List<RedirectRecord> records;
        try {
            records = linkRepository.findAllRedirectRecords();
        } catch (RuntimeException e) {
            log.error("❌ Could not read redirect records: {}", e.getMessage(), e);
            return 1;
        }

        log.info("Dry run: {} links would be written to the edge store", records.size());
        records.stream()
                .limit(SAMPLE_SIZE)
                .forEach(record -> log.info("  {} -> {}", record.slug(), record.targetUrl()));
        if (records.size() > SAMPLE_SIZE) {
            log.info("  ... and {} more", records.size() - SAMPLE_SIZE);
        }
        return 0;
    }

    private int fullSync() {
        SyncResultDto result = edgeSyncOrchestrator.performFullSync();
        if (result.hasError()) {
            log.error("❌ Manual edge sync failed: {}", result.getError());
            return 1;
        }

        log.info("Manual edge sync: synced={}, failed={}, total={}, duration={}ms",
                result.getSynced(), result.getFailed(), result.getTotal(), result.getDurationMs());
        if (result.getFailed() > 0) {
            log.warn("⚠️ {} entries failed to sync", result.getFailed());
            return 1;
        }
        spotCheck();
        return 0;
    }

    private void spotCheck() {
        try {
            linkRepository.findFirstByDeletedAtIsNullOrderByIdDesc().ifPresent(link -> {
                EdgeLinkPayload expected = edgeLinkMapper.toPayload(link);
                Optional<EdgeLinkPayload> stored = edgeStoreClient.get(link.getSlug());
                if (stored.isPresent() && stored.get().equals(expected)) {
                    log.info("Spot check passed for slug={}", link.getSlug());
                } else {
                    // Edge reads are eventually consistent, so a fresh write may not be visible yet
                    log.warn("⚠️ Spot check mismatch for slug={}: expected={}, stored={}",
                            link.getSlug(), expected, stored.orElse(null));
                }
            });
        } catch (RuntimeException e) {
            log.warn("⚠️ Spot check skipped: {}", e.getMessage());
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
