/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.router.service;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Router status report: the leader guess, the cluster size and every node's health.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RouterStatus(
        String leaderId,
        String leaderAddress,
        int shardCount,
        List<NodeHealth> nodes
) {
}
