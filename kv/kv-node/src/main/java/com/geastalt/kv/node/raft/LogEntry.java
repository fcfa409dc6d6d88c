/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.raft;

import java.util.Objects;

/**
 * Represents an entry in the Raft log. Immutable once appended.
 */
public record LogEntry(
        long index,
        long term,
        LogEntryType type,
        byte[] data
) {
    public LogEntry {
        Objects.requireNonNull(type, "type must not be null");
        if (index < 0) {
            throw new IllegalArgumentException("index must be non-negative");
        }
        if (term < 0) {
            throw new IllegalArgumentException("term must be non-negative");
        }
        if (data == null) {
            data = new byte[0];
        }
    }

    /**
     * Creates a no-op entry (used for leader commitment).
     */
    public static LogEntry noop(long index, long term) {
        return new LogEntry(index, term, LogEntryType.NOOP, new byte[0]);
    }

    /**
     * Creates a key-value command entry.
     */
    public static LogEntry command(long index, long term, KvCommand command) {
        return new LogEntry(index, term, LogEntryType.COMMAND, command.serialize());
    }

    /**
     * Creates a membership configuration entry.
     */
    public static LogEntry configuration(long index, long term, ClusterConfiguration configuration) {
        return new LogEntry(index, term, LogEntryType.CONFIGURATION, configuration.serialize());
    }

    /**
     * Deserializes the command data.
     */
    public KvCommand getCommand() {
        return KvCommand.deserialize(data);
    }

    /**
     * Deserializes the configuration data.
     */
    public ClusterConfiguration getConfiguration() {
        return ClusterConfiguration.deserialize(data);
    }

    @Override
    public String toString() {
        return "LogEntry{index=" + index + ", term=" + term + ", type=" + type + ", size=" + data.length + "}";
    }
}
