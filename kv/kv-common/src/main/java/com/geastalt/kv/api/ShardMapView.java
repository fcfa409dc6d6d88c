/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.api;

import java.util.Map;

/**
 * Shard layout as seen by one node.
 */
public record ShardMapView(int shardCount, Map<String, String> shards) {
}
