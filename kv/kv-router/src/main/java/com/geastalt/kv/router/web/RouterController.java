/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.router.web;

import com.geastalt.kv.api.ApiResponse;
import com.geastalt.kv.api.KeyValue;
import com.geastalt.kv.api.KeyValueRequest;
import com.geastalt.kv.model.KvError;
import com.geastalt.kv.router.service.RouterStatus;
import com.geastalt.kv.router.service.ShardRouter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Client-facing key-value API. Same request and reply shapes as a node, but
 * never redirects: the router follows leadership itself.
 */
@RestController
@RequiredArgsConstructor
public class RouterController {

    static final String REQUEST_ID_HEADER = "X-Request-Id";

    private final ShardRouter shardRouter;

    @RequestMapping(value = "/put", method = {RequestMethod.PUT, RequestMethod.POST})
    public ResponseEntity<ApiResponse<KeyValue>> put(
            @RequestParam(required = false) String key,
            @RequestParam(required = false) String value,
            @RequestParam(required = false) String val,
            @RequestBody(required = false) KeyValueRequest body,
            @RequestHeader(value = REQUEST_ID_HEADER, required = false) String requestIdHeader) {

        String effectiveKey = firstNonNull(key, body != null ? body.key() : null);
        String effectiveValue = firstNonNull(value, val, body != null ? body.value() : null);
        String requestId = firstNonNull(body != null ? body.requestId() : null, requestIdHeader);

        var result = shardRouter.put(effectiveKey, effectiveValue, requestId);
        if (result.isSuccess()) {
            return ResponseEntity.ok(ApiResponse.ok(result.getValue()));
        }
        return failure(result.getError());
    }

    @GetMapping("/get")
    public ResponseEntity<ApiResponse<Void>> get(
            @RequestParam(required = false) String key,
            @RequestBody(required = false) KeyValueRequest body) {

        var result = shardRouter.get(firstNonNull(key, body != null ? body.key() : null));
        if (result.isSuccess()) {
            var entry = result.getValue();
            return ResponseEntity.ok(ApiResponse.value(entry.key(), entry.value()));
        }
        return failure(result.getError());
    }

    @RequestMapping(value = "/delete", method = {RequestMethod.DELETE, RequestMethod.POST})
    public ResponseEntity<ApiResponse<Void>> delete(
            @RequestParam(required = false) String key,
            @RequestBody(required = false) KeyValueRequest body,
            @RequestHeader(value = REQUEST_ID_HEADER, required = false) String requestIdHeader) {

        String effectiveKey = firstNonNull(key, body != null ? body.key() : null);
        String requestId = firstNonNull(body != null ? body.requestId() : null, requestIdHeader);

        var result = shardRouter.delete(effectiveKey, requestId);
        if (result.isSuccess()) {
            return ResponseEntity.ok(ApiResponse.ok());
        }
        return failure(result.getError());
    }

    @GetMapping("/status")
    public ResponseEntity<ApiResponse<RouterStatus>> status() {
        return ResponseEntity.ok(ApiResponse.ok(shardRouter.status(), "Router status retrieved successfully"));
    }

    private static <T> ResponseEntity<ApiResponse<T>> failure(KvError error) {
        return ResponseEntity.status(error.status().httpStatus()).body(ApiResponse.failure(error));
    }

    private static String firstNonNull(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null) {
                return candidate;
            }
        }
        return null;
    }
}
