/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.broadcast;

import java.time.Instant;

/**
 * Last known HTTP address of a shard, with the leader term it was announced for.
 */
public record PeerAddress(String shardId, String address, long term, Instant updatedAt) {
}
