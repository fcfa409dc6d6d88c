/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Read-only consensus status of a node.
 * {@code state} is one of "Leader", "Follower", "Candidate".
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record RaftStatusView(
        String nodeId,
        String state,
        long term,
        String leaderId,
        @JsonAlias("num_peers") int numPeers,
        @JsonAlias("latest_configuration") List<MemberView> latestConfiguration,
        long commitIndex,
        long appliedIndex,
        long lastLogIndex,
        long lastSnapshotIndex,
        String membership
) {
    public static final String LEADER = "Leader";

    @JsonIgnore
    public boolean isLeader() {
        return LEADER.equals(state);
    }
}
