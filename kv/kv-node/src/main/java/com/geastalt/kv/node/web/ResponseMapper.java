/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.web;

import com.geastalt.kv.api.ApiResponse;
import com.geastalt.kv.model.KvError;
import com.geastalt.kv.model.KvStatus;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.net.URI;

/**
 * Maps errors onto HTTP replies. A NOT_LEADER error with a known leader address
 * becomes a 307 pointing at the same path on the leader.
 */
final class ResponseMapper {

    private ResponseMapper() {
    }

    static <T> ResponseEntity<ApiResponse<T>> ok(ApiResponse<T> body) {
        return ResponseEntity.ok(body);
    }

    static <T> ResponseEntity<ApiResponse<T>> failure(KvError error, HttpServletRequest request) {
        if (error.status() == KvStatus.NOT_LEADER && error.leaderAddress().isPresent()) {
            return ResponseEntity.status(HttpStatus.TEMPORARY_REDIRECT)
                    .location(redirectTarget(error.leaderAddress().get(), request))
                    .body(ApiResponse.failure(error));
        }
        return ResponseEntity.status(error.status().httpStatus())
                .body(ApiResponse.failure(error));
    }

    static URI redirectTarget(String leaderAddress, HttpServletRequest request) {
        String base = leaderAddress.endsWith("/")
                ? leaderAddress.substring(0, leaderAddress.length() - 1)
                : leaderAddress;
        String query = request.getQueryString();
        return URI.create(base + request.getRequestURI() + (query != null ? "?" + query : ""));
    }
}
