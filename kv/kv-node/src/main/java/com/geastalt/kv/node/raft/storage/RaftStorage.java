/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.raft.storage;

import com.geastalt.kv.node.raft.LogEntry;

import java.util.List;
import java.util.Optional;

/**
 * Durable home of a node's Raft state: term and vote, the log suffix after the
 * latest snapshot, and the snapshot itself. Calls return once the change is durable.
 */
public interface RaftStorage extends AutoCloseable {

    PersistentMeta loadMeta();

    void saveMeta(PersistentMeta meta);

    /**
     * Log entries following the latest snapshot, in index order.
     */
    List<LogEntry> loadEntries();

    void append(List<LogEntry> entries);

    /**
     * Drops every entry with index at or above {@code fromIndex}.
     */
    void truncateFrom(long fromIndex);

    Optional<Snapshot> loadSnapshot();

    /**
     * Stores a snapshot and replaces the log with {@code retained}, the entries after it.
     */
    void saveSnapshot(Snapshot snapshot, List<LogEntry> retained);

    @Override
    void close();
}
