/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.web;

import com.geastalt.kv.api.ApiResponse;
import com.geastalt.kv.api.ShardAnnouncement;
import com.geastalt.kv.api.ShardMapView;
import com.geastalt.kv.node.broadcast.LeaderBroadcaster;
import com.geastalt.kv.node.broadcast.MergeOutcome;
import com.geastalt.kv.node.service.KvService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Shard map and leader announcement endpoints. Announcements are idempotent.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class ClusterController {

    private final KvService kvService;
    private final LeaderBroadcaster leaderBroadcaster;

    @GetMapping("/config")
    public ResponseEntity<ApiResponse<ShardMapView>> config() {
        return ResponseMapper.ok(ApiResponse.ok(kvService.shardMap()));
    }

    @PostMapping("/newleader")
    public ResponseEntity<ApiResponse<MergeOutcome>> newLeader(@RequestBody ShardAnnouncement body,
                                                               HttpServletRequest request) {
        log.debug("New leader announcement: {}", body);
        return announce(body, request);
    }

    @PostMapping("/addshard")
    public ResponseEntity<ApiResponse<MergeOutcome>> addShard(@RequestBody ShardAnnouncement body,
                                                              HttpServletRequest request) {
        log.debug("Add shard announcement: {}", body);
        return announce(body, request);
    }

    private ResponseEntity<ApiResponse<MergeOutcome>> announce(ShardAnnouncement body, HttpServletRequest request) {
        var result = leaderBroadcaster.accept(body);
        if (result.isSuccess()) {
            return ResponseMapper.ok(ApiResponse.ok(result.getValue()));
        }
        return ResponseMapper.failure(result.getError(), request);
    }
}
