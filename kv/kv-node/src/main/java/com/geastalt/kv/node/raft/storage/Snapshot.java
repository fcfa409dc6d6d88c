/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.raft.storage;

import com.geastalt.kv.node.raft.ClusterConfiguration;

/**
 * Point-in-time image of the state machine covering log entries up to {@code lastIndex},
 * together with the membership configuration in force at that index.
 */
public record Snapshot(
        long lastIndex,
        long lastTerm,
        ClusterConfiguration configuration,
        byte[] data
) {
    public Snapshot {
        configuration = configuration == null ? ClusterConfiguration.EMPTY : configuration;
        data = data == null ? new byte[0] : data;
    }

    @Override
    public String toString() {
        return "Snapshot{lastIndex=" + lastIndex + ", lastTerm=" + lastTerm
                + ", members=" + configuration.size() + ", size=" + data.length + "}";
    }
}
