package com.example.linkservice.service;

import com.example.linkservice.client.edge.EdgeStoreClient;
import com.example.linkservice.config.AsyncConfig;
import com.example.linkservice.dto.CreateLinkRequest;
import com.example.linkservice.dto.UpdateLinkRequest;
import com.example.linkservice.entity.Link;
import com.example.linkservice.exception.LinkNotFoundException;
import com.example.linkservice.exception.SlugAlreadyExistsException;
import com.example.linkservice.metrics.EdgeSyncMetrics;
import com.example.linkservice.repository.LinkRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.util.StringUtils;

import java.util.concurrent.RejectedExecutionException;

/**
 * Mutations of short links, the upstream collaborator of the edge sync.
 *
 * CRITICAL DESIGN:
 * - Every create, update and delete marks the edge cache dirty once its transaction commits
 * - The changed key is then written through to the edge store on the edge sync executor;
 *   a lost write-through is repaired by the next full sync because the cache is already dirty
 * - Edge calls never run inside the database transaction
 */
@Service
@Slf4j
public class LinkService {

    private final LinkRepository linkRepository;
    private final SlugPolicy slugPolicy;
    private final EdgeCacheDirtyTracker dirtyTracker;
    private final EdgeStoreClient edgeStoreClient;
    private final EdgeLinkMapper edgeLinkMapper;
    private final EdgeSyncMetrics metrics;
    private final TaskExecutor edgeSyncExecutor;

    public LinkService(LinkRepository linkRepository,
                       SlugPolicy slugPolicy,
                       EdgeCacheDirtyTracker dirtyTracker,
                       EdgeStoreClient edgeStoreClient,
                       EdgeLinkMapper edgeLinkMapper,
                       EdgeSyncMetrics metrics,
                       @Qualifier(AsyncConfig.EDGE_SYNC_EXECUTOR) TaskExecutor edgeSyncExecutor) {
        this.linkRepository = linkRepository;
        this.slugPolicy = slugPolicy;
        this.dirtyTracker = dirtyTracker;
        this.edgeStoreClient = edgeStoreClient;
        this.edgeLinkMapper = edgeLinkMapper;
        this.metrics = metrics;
        this.edgeSyncExecutor = edgeSyncExecutor;
    }

    @Transactional
    public Link create(CreateLinkRequest request) {
        String slug = StringUtils.hasText(request.slug())
                ? slugPolicy.normalize(request.slug())
                : slugPolicy.generateUnique(linkRepository::existsBySlug);

        if (linkRepository.existsBySlug(slug)) {
            throw new SlugAlreadyExistsException(slug);
        }

        Link link = linkRepository.save(Link.builder()
                .userId(request.userId())
                .slug(slug)
                .originalUrl(request.targetUrl())
                .expiresAt(request.expiresAt())
                .build());

        log.info("Created link id={} slug={}", link.getId(), link.getSlug());
        afterCommit(() -> {
            dirtyTracker.markDirty();
            writeThrough(link.getSlug(), link);
        });
        return link;
    }

    /**
     * Apply the non-null fields of the request. A slug change removes the old key from the edge cache.
     */
    @Transactional
    public Link update(Long linkId, UpdateLinkRequest request) {
        Link link = linkRepository.findByIdAndDeletedAtIsNull(linkId)
                .orElseThrow(() -> new LinkNotFoundException(linkId));

        String previousSlug = link.getSlug();
        if (StringUtils.hasText(request.slug())) {
            String slug = slugPolicy.normalize(request.slug());
            if (!slug.equals(previousSlug)) {
                if (linkRepository.existsBySlug(slug)) {
                    throw new SlugAlreadyExistsException(slug);
                }
                link.setSlug(slug);
            }
        }
        if (StringUtils.hasText(request.targetUrl())) {
            link.setOriginalUrl(request.targetUrl());
        }
        if (request.clearExpiry()) {
            link.setExpiresAt(null);
        } else if (request.expiresAt() != null) {
            link.setExpiresAt(request.expiresAt());
        }

        Link saved = linkRepository.save(link);
        log.info("Updated link id={} slug={}", saved.getId(), saved.getSlug());

        afterCommit(() -> {
            dirtyTracker.markDirty();
            if (!previousSlug.equals(saved.getSlug())) {
                deleteThrough(previousSlug);
            }
            writeThrough(saved.getSlug(), saved);
        });
        return saved;
    }

    /**
     * Soft delete. The slug stays reserved by the deleted row.
     */
    @Transactional
    public void delete(Long linkId) {
        Link link = linkRepository.findByIdAndDeletedAtIsNull(linkId)
                .orElseThrow(() -> new LinkNotFoundException(linkId));

        link.softDelete();
        linkRepository.save(link);
        log.info("Deleted link id={} slug={}", link.getId(), link.getSlug());

        String slug = link.getSlug();
        afterCommit(() -> {
            dirtyTracker.markDirty();
            deleteThrough(slug);
        });
    }

    private void writeThrough(String slug, Link link) {
        submit("put", slug, () -> edgeStoreClient.put(slug, edgeLinkMapper.toPayload(link)));
    }

    private void deleteThrough(String slug) {
        submit("delete", slug, () -> edgeStoreClient.delete(slug));
    }

    private void submit(String operation, String slug, EdgeCall call) {
        if (!edgeStoreClient.isConfigured()) {
            return;
        }
        try {
            edgeSyncExecutor.execute(() -> {
                try {
                    if (!call.run()) {
                        metrics.recordWriteThroughFailure();
                    }
                } catch (RuntimeException e) {
                    log.warn("⚠️ Edge write-through {} failed for slug={}: {}", operation, slug, e.getMessage());
                    metrics.recordWriteThroughFailure();
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("⚠️ Edge write-through {} rejected for slug={}, next full sync will repair it", operation, slug);
            metrics.recordWriteThroughFailure();
        }
    }

    private static void afterCommit(Runnable action) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            action.run();
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                action.run();
            }
        });
    }

    @FunctionalInterface
    private interface EdgeCall {
        boolean run();
    }
}
