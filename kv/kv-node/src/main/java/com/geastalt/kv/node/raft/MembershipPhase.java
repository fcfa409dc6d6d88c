/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.raft;

/**
 * Where a node stands in the join protocol.
 */
public enum MembershipPhase {
    /**
     * No configuration yet and startup has not decided how to obtain one.
     */
    UNBOOTSTRAPPED,

    /**
     * Self-bootstrapped a one-member group and has not yet admitted anyone.
     */
    BOOTSTRAPPED,

    /**
     * Waiting for a leader to add this node; never campaigns.
     */
    AWAITING_JOIN,

    /**
     * Listed in the latest configuration.
     */
    MEMBER,

    /**
     * Was a member and has been removed from the latest configuration.
     */
    REMOVED
}
