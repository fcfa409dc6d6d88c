/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Represents an error that occurred during a key-value or cluster operation.
 * Leader hints are carried on {@link KvStatus#NOT_LEADER} errors when known.
 */
public record KvError(
        KvStatus status,
        String message,
        Optional<String> leaderId,
        Optional<String> leaderAddress
) {
    public static final String KEY_NOT_FOUND = "Key not found";

    public KvError {
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(leaderId, "leaderId optional must not be null");
        Objects.requireNonNull(leaderAddress, "leaderAddress optional must not be null");
    }

    /**
     * Creates an error with just status and message.
     */
    public KvError(KvStatus status, String message) {
        this(status, message, Optional.empty(), Optional.empty());
    }

    /**
     * Creates an error for a rejected request.
     */
    public static KvError invalidRequest(String message) {
        return new KvError(KvStatus.INVALID_REQUEST, message);
    }

    /**
     * Creates an error for an absent key.
     */
    public static KvError keyNotFound() {
        return new KvError(KvStatus.NOT_FOUND, KEY_NOT_FOUND);
    }

    /**
     * Creates an error for not being the leader.
     */
    public static KvError notLeader(String leaderId, String leaderAddress) {
        return new KvError(
                KvStatus.NOT_LEADER,
                "This node is not the leader. Current leader: " + (leaderId != null ? leaderId : "unknown"),
                Optional.ofNullable(leaderId),
                Optional.ofNullable(leaderAddress)
        );
    }

    /**
     * Creates an error for a commit that did not finish in time.
     */
    public static KvError timeout(String operation) {
        return new KvError(
                KvStatus.TIMEOUT,
                "Consensus timeout during " + operation + "; outcome unknown, the operation may have been applied"
        );
    }

    /**
     * Creates an error for a leader that stepped down before its entry committed.
     */
    public static KvError leadershipLost(long index) {
        return new KvError(
                KvStatus.TIMEOUT,
                "Leadership lost before entry " + index + " committed; outcome unknown"
        );
    }

    /**
     * Creates an error for a rejected membership change.
     */
    public static KvError membership(String message) {
        return new KvError(KvStatus.MEMBERSHIP_ERROR, message);
    }

    /**
     * Creates an error for a peer that could not be reached.
     */
    public static KvError unreachable(String address, String reason) {
        return new KvError(
                KvStatus.UNREACHABLE,
                "Cannot connect to " + address + ": " + reason
        );
    }

    /**
     * Creates an error for a router that found no leader.
     */
    public static KvError noLeader(int attempts) {
        return new KvError(
                KvStatus.NO_LEADER,
                String.format("No leader available after %d discovery attempts", attempts)
        );
    }

    /**
     * Creates a generic error.
     */
    public static KvError error(String message) {
        return new KvError(KvStatus.ERROR, message);
    }
}
