/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.raft;

import com.geastalt.kv.node.raft.storage.RaftStorage;
import com.geastalt.kv.node.raft.storage.Snapshot;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Raft log: the entries after the latest snapshot, held in memory and written through
 * to {@link RaftStorage}. Indices are 1-based and continue across compaction.
 * Thread-safe with read-write locking for concurrent access.
 */
@Slf4j
public class RaftLog {

    private final RaftStorage storage;
    private final List<LogEntry> entries = new ArrayList<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private volatile Snapshot snapshot;

    public RaftLog(RaftStorage storage) {
        this.storage = storage;
    }

    /**
     * Reloads the snapshot and the entries after it from storage.
     */
    public void restore() {
        lock.writeLock().lock();
        try {
            snapshot = storage.loadSnapshot().orElse(null);
            entries.clear();
            entries.addAll(storage.loadEntries());
            log.info("Restored Raft log: snapshot index {}, last index {}", getSnapshotIndex(), getLastIndex());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Appends an entry to the log.
     *
     * @param entry The entry to append, indexed one past the current last index
     * @return The index of the appended entry
     */
    public long append(LogEntry entry) {
        appendAll(List.of(entry));
        return entry.index();
    }

    /**
     * Appends multiple contiguous entries to the log.
     *
     * @param newEntries The entries to append
     */
    public void appendAll(List<LogEntry> newEntries) {
        if (newEntries.isEmpty()) {
            return;
        }
        lock.writeLock().lock();
        try {
            long expected = getLastIndex() + 1;
            if (newEntries.get(0).index() != expected) {
                throw new IllegalStateException("Log gap: expected index " + expected
                        + " but got " + newEntries.get(0).index());
            }
            storage.append(newEntries);
            entries.addAll(newEntries);
            log.debug("Appended {} entries, last index: {}",
                    newEntries.size(), newEntries.get(newEntries.size() - 1).index());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Gets an entry at the specified index.
     *
     * @param index The log index (1-based)
     * @return The entry if held; compacted entries are absent
     */
    public Optional<LogEntry> get(long index) {
        lock.readLock().lock();
        try {
            long offset = getSnapshotIndex();
            if (index <= offset || index > offset + entries.size()) {
                return Optional.empty();
            }
            return Optional.of(entries.get((int) (index - offset - 1)));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Gets up to {@code maxEntries} entries starting at startIndex.
     */
    public List<LogEntry> getFrom(long startIndex, int maxEntries) {
        lock.readLock().lock();
        try {
            long offset = getSnapshotIndex();
            if (startIndex <= offset || startIndex > offset + entries.size()) {
                return Collections.emptyList();
            }
            int from = (int) (startIndex - offset - 1);
            int to = Math.min(entries.size(), from + maxEntries);
            return new ArrayList<>(entries.subList(from, to));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Gets the index of the last entry, counting compacted entries.
     */
    public long getLastIndex() {
        lock.readLock().lock();
        try {
            return getSnapshotIndex() + entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Gets the term of the last entry.
     */
    public long getLastTerm() {
        lock.readLock().lock();
        try {
            if (entries.isEmpty()) {
                return getSnapshotTerm();
            }
            return entries.get(entries.size() - 1).term();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Gets the term at a specific index, 0 when unknown.
     */
    public long getTermAt(long index) {
        lock.readLock().lock();
        try {
            if (snapshot != null && index == snapshot.lastIndex()) {
                return snapshot.lastTerm();
            }
            return get(index).map(LogEntry::term).orElse(0L);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Checks if the log contains an entry at the given index with the given term.
     * Compacted indices only hold committed entries and always match.
     */
    public boolean containsEntry(long index, long term) {
        lock.readLock().lock();
        try {
            if (index == 0) {
                return true;
            }
            long snapshotIndex = getSnapshotIndex();
            if (index < snapshotIndex) {
                return true;
            }
            if (index == snapshotIndex) {
                return snapshot.lastTerm() == term;
            }
            return get(index).map(e -> e.term() == term).orElse(false);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Truncates the log from the specified index (inclusive).
     * Used when conflicting entries are detected.
     *
     * @param fromIndex The index to truncate from
     */
    public void truncateFrom(long fromIndex) {
        lock.writeLock().lock();
        try {
            long offset = getSnapshotIndex();
            if (fromIndex <= offset) {
                throw new IllegalStateException("Cannot truncate compacted index " + fromIndex);
            }
            if (fromIndex > offset + entries.size()) {
                return;
            }
            storage.truncateFrom(fromIndex);
            var removed = entries.subList((int) (fromIndex - offset - 1), entries.size());
            log.debug("Truncating {} entries from index {}", removed.size(), fromIndex);
            removed.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Replaces the prefix up to {@code newSnapshot.lastIndex()} with the snapshot.
     * The index must already be in the log.
     */
    public void compact(Snapshot newSnapshot) {
        lock.writeLock().lock();
        try {
            long offset = getSnapshotIndex();
            if (newSnapshot.lastIndex() <= offset) {
                return;
            }
            int drop = (int) Math.min(entries.size(), newSnapshot.lastIndex() - offset);
            List<LogEntry> retained = new ArrayList<>(entries.subList(drop, entries.size()));
            storage.saveSnapshot(newSnapshot, retained);
            entries.clear();
            entries.addAll(retained);
            snapshot = newSnapshot;
            log.info("Compacted log through index {}, {} entries retained", newSnapshot.lastIndex(), retained.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Installs a snapshot received from the leader. Entries following it are kept
     * when the log agrees with the snapshot's last entry; otherwise the log is discarded.
     */
    public void installSnapshot(Snapshot newSnapshot) {
        lock.writeLock().lock();
        try {
            List<LogEntry> retained = new ArrayList<>();
            var existing = get(newSnapshot.lastIndex());
            if (existing.isPresent() && existing.get().term() == newSnapshot.lastTerm()) {
                long offset = getSnapshotIndex();
                int keepFrom = (int) (newSnapshot.lastIndex() - offset);
                retained.addAll(entries.subList(keepFrom, entries.size()));
            }
            storage.saveSnapshot(newSnapshot, retained);
            entries.clear();
            entries.addAll(retained);
            snapshot = newSnapshot;
            log.info("Installed snapshot through index {}, {} entries retained", newSnapshot.lastIndex(), retained.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * The latest membership configuration in the log, whether committed or not,
     * falling back to the snapshot's.
     */
    public ConfigurationAt latestConfiguration() {
        return configurationAt(Long.MAX_VALUE);
    }

    /**
     * The configuration in force at {@code index}: the last CONFIGURATION entry at or
     * before it, or the snapshot's configuration.
     */
    public ConfigurationAt configurationAt(long index) {
        lock.readLock().lock();
        try {
            for (int i = entries.size() - 1; i >= 0; i--) {
                var entry = entries.get(i);
                if (entry.index() <= index && entry.type() == LogEntryType.CONFIGURATION) {
                    return new ConfigurationAt(entry.index(), entry.getConfiguration());
                }
            }
            if (snapshot != null) {
                return new ConfigurationAt(snapshot.lastIndex(), snapshot.configuration());
            }
            return new ConfigurationAt(0, ClusterConfiguration.EMPTY);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Snapshot> getSnapshot() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(snapshot);
        } finally {
            lock.readLock().unlock();
        }
    }

    public long getSnapshotIndex() {
        return snapshot == null ? 0 : snapshot.lastIndex();
    }

    public long getSnapshotTerm() {
        return snapshot == null ? 0 : snapshot.lastTerm();
    }

    /**
     * Checks if the log holds neither entries nor a snapshot.
     */
    public boolean isEmpty() {
        lock.readLock().lock();
        try {
            return entries.isEmpty() && snapshot == null;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * A configuration together with the log index that introduced it.
     */
    public record ConfigurationAt(long index, ClusterConfiguration configuration) {
    }
}
