/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.web;

import com.geastalt.kv.api.ApiResponse;
import com.geastalt.kv.api.KeyValue;
import com.geastalt.kv.api.KeyValueRequest;
import com.geastalt.kv.node.service.KvService;
import com.geastalt.kv.node.service.LeaderForwarder;
import jakarta.servlet.http.HttpServletRequest;
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
 * Key-value endpoints. Key and value come from query parameters or a JSON body.
 */
@RestController
@RequiredArgsConstructor
public class KvController {

    static final String REQUEST_ID_HEADER = "X-Request-Id";

    private final KvService kvService;

    @RequestMapping(value = "/put", method = {RequestMethod.PUT, RequestMethod.POST})
    public ResponseEntity<ApiResponse<KeyValue>> put(
            @RequestParam(required = false) String key,
            @RequestParam(required = false) String value,
            @RequestParam(required = false) String val,
            @RequestBody(required = false) KeyValueRequest body,
            @RequestHeader(value = REQUEST_ID_HEADER, required = false) String requestIdHeader,
            HttpServletRequest request) {

        String effectiveKey = firstNonNull(key, body != null ? body.key() : null);
        String effectiveValue = firstNonNull(value, val, body != null ? body.value() : null);
        String requestId = firstNonNull(body != null ? body.requestId() : null, requestIdHeader);

        var result = kvService.put(effectiveKey, effectiveValue, requestId);
        if (result.isSuccess()) {
            return ResponseMapper.ok(ApiResponse.ok(result.getValue()));
        }
        return ResponseMapper.failure(result.getError(), request);
    }

    @GetMapping("/get")
    public ResponseEntity<ApiResponse<Void>> get(
            @RequestParam(required = false) String key,
            @RequestBody(required = false) KeyValueRequest body,
            @RequestHeader(value = LeaderForwarder.FORWARDED_HEADER, required = false) String forwardedFrom,
            HttpServletRequest request) {

        String effectiveKey = firstNonNull(key, body != null ? body.key() : null);

        var result = kvService.get(effectiveKey, forwardedFrom != null);
        if (result.isSuccess()) {
            var entry = result.getValue();
            return ResponseMapper.ok(ApiResponse.value(entry.key(), entry.value()));
        }
        return ResponseMapper.failure(result.getError(), request);
    }

    @RequestMapping(value = "/delete", method = {RequestMethod.DELETE, RequestMethod.POST})
    public ResponseEntity<ApiResponse<Void>> delete(
            @RequestParam(required = false) String key,
            @RequestBody(required = false) KeyValueRequest body,
            @RequestHeader(value = REQUEST_ID_HEADER, required = false) String requestIdHeader,
            HttpServletRequest request) {

        String effectiveKey = firstNonNull(key, body != null ? body.key() : null);
        String requestId = firstNonNull(body != null ? body.requestId() : null, requestIdHeader);

        var result = kvService.delete(effectiveKey, requestId);
        if (result.isSuccess()) {
            return ResponseMapper.ok(ApiResponse.ok());
        }
        return ResponseMapper.failure(result.getError(), request);
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
