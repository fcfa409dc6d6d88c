/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.raft.storage;

import com.geastalt.kv.node.raft.LogEntry;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Volatile storage for nodes without a data directory. State is lost on restart.
 */
public class MemoryRaftStorage implements RaftStorage {

    private PersistentMeta meta = PersistentMeta.EMPTY;
    private final List<LogEntry> entries = new ArrayList<>();
    private Snapshot snapshot;

    @Override
    public synchronized PersistentMeta loadMeta() {
        return meta;
    }

    @Override
    public synchronized void saveMeta(PersistentMeta meta) {
        this.meta = meta;
    }

    @Override
    public synchronized List<LogEntry> loadEntries() {
        return new ArrayList<>(entries);
    }

    @Override
    public synchronized void append(List<LogEntry> newEntries) {
        entries.addAll(newEntries);
    }

    @Override
    public synchronized void truncateFrom(long fromIndex) {
        entries.removeIf(e -> e.index() >= fromIndex);
    }

    @Override
    public synchronized Optional<Snapshot> loadSnapshot() {
        return Optional.ofNullable(snapshot);
    }

    @Override
    public synchronized void saveSnapshot(Snapshot snapshot, List<LogEntry> retained) {
        this.snapshot = snapshot;
        entries.clear();
        entries.addAll(retained);
    }

    @Override
    public void close() {
    }
}
