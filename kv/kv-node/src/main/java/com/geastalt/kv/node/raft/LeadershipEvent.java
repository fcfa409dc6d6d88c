/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.raft;

/**
 * Raised when this node gains or loses Raft leadership.
 */
public record LeadershipEvent(String nodeId, long term, boolean leader) {
}
