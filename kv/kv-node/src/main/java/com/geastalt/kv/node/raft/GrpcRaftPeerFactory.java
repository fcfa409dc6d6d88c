/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.raft;

import com.geastalt.kv.node.config.RaftConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Creates gRPC clients for cluster members.
 */
@Component
@RequiredArgsConstructor
public class GrpcRaftPeerFactory implements RaftPeerFactory {

    private final RaftConfig raftConfig;

    @Override
    public RaftNode.RaftPeer create(String nodeId, String address) {
        return new RaftPeerClient(nodeId, address, raftConfig.getRpcTimeoutMs());
    }
}
