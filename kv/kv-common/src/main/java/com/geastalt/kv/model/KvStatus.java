/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.model;

/**
 * Represents the status of a key-value or cluster operation.
 */
public enum KvStatus {
    /**
     * Operation completed successfully.
     */
    OK(200),

    /**
     * Missing or malformed key, value or member data. Rejected before consensus.
     */
    INVALID_REQUEST(400),

    /**
     * Key not present in the store.
     */
    NOT_FOUND(404),

    /**
     * This node is not the Raft leader.
     */
    NOT_LEADER(503),

    /**
     * Commit did not complete in time. The operation may still have been applied.
     */
    TIMEOUT(504),

    /**
     * Join or leave attempted incorrectly.
     */
    MEMBERSHIP_ERROR(409),

    /**
     * Another node could not be reached.
     */
    UNREACHABLE(502),

    /**
     * No node reported itself as leader within the retry budget.
     */
    NO_LEADER(503),

    /**
     * Internal error occurred.
     */
    ERROR(500);

    private final int httpStatus;

    KvStatus(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    /**
     * HTTP status code used when this status is returned over HTTP.
     */
    public int httpStatus() {
        return httpStatus;
    }

    /**
     * Checks if this status represents a successful operation.
     */
    public boolean isSuccess() {
        return this == OK;
    }

    /**
     * Checks if a router may retry the operation against another node.
     * Timeouts are excluded since the outcome of the original attempt is unknown.
     */
    public boolean isRetryable() {
        return this == NOT_LEADER || this == UNREACHABLE || this == NO_LEADER;
    }
}
