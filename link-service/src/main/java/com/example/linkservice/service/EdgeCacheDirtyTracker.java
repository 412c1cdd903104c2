package com.example.linkservice.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide flag: "has the link table changed since the last fully successful edge sync?"
 *
 * Starts dirty so the first sync after a deploy always runs in full.
 *
 * Mutators call {@link #markDirty()} after their transaction commits. The sync engine samples
 * {@link #mutationCount()} before reading the snapshot and clears through
 * {@link #clearIfUnchangedSince(long)}, so a mutation that lands mid-sync keeps the flag set
 * for the next run.
 */
@Component
@Slf4j
public class EdgeCacheDirtyTracker {

    private final AtomicBoolean dirty = new AtomicBoolean(true);
    private final AtomicLong mutationCount = new AtomicLong();
    private final Object lock = new Object();

    /**
     * Mark the edge cache as stale. Called for every create, update and delete.
     */
    public void markDirty() {
        synchronized (lock) {
            mutationCount.incrementAndGet();
            dirty.set(true);
        }
    }

    public boolean isDirty() {
        return dirty.get();
    }

    /**
     * Unconditionally mark the edge cache as in sync.
     */
    public void clear() {
        dirty.set(false);
    }

    /**
     * Number of markDirty() calls so far. Sampled by the sync engine before it reads the snapshot.
     */
    public long mutationCount() {
        return mutationCount.get();
    }

    /**
     * Clear the flag only if no mutation happened after {@code observedMutationCount} was sampled.
     *
     * @return true if the flag was cleared
     */
    public boolean clearIfUnchangedSince(long observedMutationCount) {
        synchronized (lock) {
            if (mutationCount.get() != observedMutationCount) {
                log.info("Link table changed during sync (mutations {} -> {}), keeping edge cache dirty",
                        observedMutationCount, mutationCount.get());
                return false;
            }
            dirty.set(false);
            return true;
        }
    }
}
