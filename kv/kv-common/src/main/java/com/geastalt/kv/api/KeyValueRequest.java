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
 * Body of a put, get or delete request.
 * {@code requestId} is an optional idempotency token for writes.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record KeyValueRequest(
        String key,
        @JsonAlias("val") String value,
        @JsonAlias({"request_id", "idempotencyKey"}) String requestId
) {
    public static KeyValueRequest of(String key, String value) {
        return new KeyValueRequest(key, value, null);
    }
}
