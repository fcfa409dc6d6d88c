/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.geastalt.kv.model.KvError;
import com.geastalt.kv.model.KvStatus;

import java.util.Optional;

/**
 * JSON envelope returned by every node and router endpoint.
 * Absent fields are omitted from the serialized form.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ApiResponse<T>(
        boolean success,
        T data,
        String key,
        String value,
        String message,
        String error,
        KvStatus code,
        String leaderId,
        String leaderAddress
) {

    public static <T> ApiResponse<T> ok() {
        return new ApiResponse<>(true, null, null, null, null, null, null, null, null);
    }

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null, null, null, null, null, null, null);
    }

    public static <T> ApiResponse<T> ok(T data, String message) {
        return new ApiResponse<>(true, data, null, null, message, null, null, null, null);
    }

    /**
     * Successful GET reply: {@code {success, key, value}}.
     */
    public static <T> ApiResponse<T> value(String key, String value) {
        return new ApiResponse<>(true, null, key, value, null, null, null, null, null);
    }

    public static <T> ApiResponse<T> failure(KvError error) {
        return new ApiResponse<>(
                false, null, null, null, null,
                error.message(),
                error.status(),
                error.leaderId().orElse(null),
                error.leaderAddress().orElse(null));
    }

    public static <T> ApiResponse<T> failure(KvStatus status, String message) {
        return failure(new KvError(status, message));
    }

    /**
     * Rebuilds the error carried by a failed envelope. Envelopes without a code
     * are reported as {@link KvStatus#ERROR}.
     */
    @JsonIgnore
    public KvError toError() {
        KvStatus status = code != null ? code : KvStatus.ERROR;
        String text = error != null ? error : (message != null ? message : status.name());
        return new KvError(status, text,
                Optional.ofNullable(leaderId),
                Optional.ofNullable(leaderAddress));
    }
}
