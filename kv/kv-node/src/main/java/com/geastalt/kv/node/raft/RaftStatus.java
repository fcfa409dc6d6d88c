/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.raft;

/**
 * Point-in-time view of a node's consensus state.
 */
public record RaftStatus(
        String nodeId,
        RaftState state,
        long term,
        String leaderId,
        ClusterConfiguration configuration,
        long commitIndex,
        long appliedIndex,
        long lastLogIndex,
        long snapshotIndex,
        MembershipPhase membership
) {
    /**
     * Members of the latest configuration other than this node.
     */
    public int numPeers() {
        return (int) configuration.members().stream()
                .filter(m -> !m.id().equals(nodeId))
                .count();
    }
}
