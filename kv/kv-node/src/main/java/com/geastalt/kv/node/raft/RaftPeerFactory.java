/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.raft;

/**
 * Creates transport clients for cluster members as they appear in configurations.
 */
@FunctionalInterface
public interface RaftPeerFactory {

    RaftNode.RaftPeer create(String nodeId, String address);
}
