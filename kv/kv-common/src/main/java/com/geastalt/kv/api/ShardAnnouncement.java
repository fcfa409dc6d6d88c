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
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Body of {@code /newleader} and {@code /addshard}: a shard and the address it
 * was last seen leading at. {@code term} orders announcements and may be absent
 * for manual registrations.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ShardAnnouncement(
        @JsonAlias({"shardID", "shard_id", "shard"}) String shardId,
        @JsonAlias({"addr", "shardAddress"}) String address,
        Long term
) {
}
