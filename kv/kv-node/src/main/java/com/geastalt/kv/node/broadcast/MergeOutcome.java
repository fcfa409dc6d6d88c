/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.broadcast;

/**
 * Result of merging an announcement into the known-peers map.
 */
public enum MergeOutcome {
    /** A previously unknown shard was stored. */
    ADDED,
    /** A known shard moved to a new address. */
    CHANGED,
    /** The stored address already matched. */
    UNCHANGED,
    /** The announcement carried an older term than the stored one. */
    STALE,
    /** The map is full. */
    REJECTED;

    /**
     * Whether the update should be passed on to other peers.
     */
    public boolean shouldPropagate() {
        return this == ADDED || this == CHANGED;
    }
}
