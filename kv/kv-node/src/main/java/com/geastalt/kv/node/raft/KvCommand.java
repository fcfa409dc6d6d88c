/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.raft;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Objects;

/**
 * A key-value operation carried by a COMMAND log entry.
 * {@code requestId} is an optional client token used to de-duplicate retried writes.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record KvCommand(
        Operation operation,
        String key,
        String value,
        String requestId
) {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public enum Operation {
        PUT,
        GET,
        DEL
    }

    public KvCommand {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(key, "key must not be null");
    }

    public static KvCommand put(String key, String value, String requestId) {
        return new KvCommand(Operation.PUT, key, value, requestId);
    }

    public static KvCommand get(String key) {
        return new KvCommand(Operation.GET, key, null, null);
    }

    public static KvCommand delete(String key, String requestId) {
        return new KvCommand(Operation.DEL, key, null, requestId);
    }

    /**
     * Serializes this command to bytes.
     */
    public byte[] serialize() {
        try {
            return MAPPER.writeValueAsBytes(this);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize command", e);
        }
    }

    /**
     * Deserializes a command from bytes.
     */
    public static KvCommand deserialize(byte[] data) {
        if (data == null || data.length == 0) {
            return null;
        }
        try {
            return MAPPER.readValue(data, KvCommand.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to deserialize command", e);
        }
    }
}
