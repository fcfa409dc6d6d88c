/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.web;

import com.geastalt.kv.api.ApiResponse;
import com.geastalt.kv.api.JoinRequest;
import com.geastalt.kv.api.LeaveRequest;
import com.geastalt.kv.api.MemberView;
import com.geastalt.kv.api.RaftStatusView;
import com.geastalt.kv.node.service.KvService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Raft membership and status endpoints.
 */
@RestController
@RequestMapping("/raft")
@RequiredArgsConstructor
public class RaftController {

    private final KvService kvService;

    @PostMapping("/join")
    public ResponseEntity<ApiResponse<List<MemberView>>> join(@RequestBody JoinRequest body,
                                                              HttpServletRequest request) {
        var result = kvService.join(body);
        if (result.isSuccess()) {
            return ResponseMapper.ok(ApiResponse.ok(result.getValue(), "Member " + body.memberId() + " joined"));
        }
        return ResponseMapper.failure(result.getError(), request);
    }

    @PostMapping("/leave")
    public ResponseEntity<ApiResponse<List<MemberView>>> leave(@RequestBody LeaveRequest body,
                                                               HttpServletRequest request) {
        var result = kvService.leave(body.memberId());
        if (result.isSuccess()) {
            return ResponseMapper.ok(ApiResponse.ok(result.getValue(), "Member " + body.memberId() + " removed"));
        }
        return ResponseMapper.failure(result.getError(), request);
    }

    @GetMapping("/status")
    public ResponseEntity<ApiResponse<RaftStatusView>> status() {
        return ResponseMapper.ok(ApiResponse.ok(kvService.status()));
    }
}
