package com.example.linkservice.service;

import com.example.linkservice.dto.SyncHistoryEntry;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded, newest-first log of the last {@value #CAPACITY} sync attempts.
 *
 * In-memory only: the log is empty after every restart. It feeds the health view
 * and is never persisted.
 */
@Component
public class SyncHistoryBuffer {

    public static final int CAPACITY = 50;

    private final Deque<SyncHistoryEntry> entries = new ArrayDeque<>(CAPACITY);
    private final ReentrantLock lock = new ReentrantLock();

    /**
     * Prepend an entry, evicting the oldest ones beyond capacity.
     */
    public void record(SyncHistoryEntry entry) {
        lock.lock();
        try {
            entries.addFirst(entry);
            while (entries.size() > CAPACITY) {
                entries.removeLast();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Snapshot of the log, newest first. The returned list is a copy owned by the caller.
     */
    public List<SyncHistoryEntry> list() {
        lock.lock();
        try {
            return new ArrayList<>(entries);
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        lock.lock();
        try {
            return entries.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop all entries. Administrative and test use only.
     */
    public void reset() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }
}
