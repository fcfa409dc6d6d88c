/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.router.service;

import com.geastalt.kv.api.RaftStatusView;
import com.geastalt.kv.model.KvResult;
import com.geastalt.kv.router.config.NodeEndpoint;

/**
 * Outcome of asking one node for its Raft status.
 */
public record NodeProbe(NodeEndpoint node, KvResult<RaftStatusView> status) {

    public boolean reachable() {
        return status.isSuccess();
    }

    public boolean reportsLeader() {
        return status.isSuccess() && status.getValue().isLeader();
    }

    public long term() {
        return status.isSuccess() ? status.getValue().term() : -1;
    }
}
