/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Body of {@code /raft/join}: the member id and its Raft (gRPC) address.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JoinRequest(
        @JsonAlias({"memberID", "nodeid", "node_id", "nodeId"}) String memberId,
        @JsonAlias("addr") String address
) {
}
