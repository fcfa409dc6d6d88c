/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.raft;

/**
 * Receives leadership changes of the local {@link RaftNode}.
 * Called on the node's event thread, never while the node holds its state lock.
 */
@FunctionalInterface
public interface LeadershipListener {

    void onLeadershipChange(LeadershipEvent event);
}
