/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.raft;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;

/**
 * One member of a cluster configuration: its id, Raft (gRPC) address and suffrage.
 */
public record ClusterMember(String id, String address, Suffrage suffrage) {

    public ClusterMember {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(address, "address must not be null");
        if (suffrage == null) {
            suffrage = Suffrage.VOTER;
        }
    }

    public static ClusterMember voter(String id, String address) {
        return new ClusterMember(id, address, Suffrage.VOTER);
    }

    @JsonIgnore
    public boolean isVoter() {
        return suffrage == Suffrage.VOTER;
    }
}
