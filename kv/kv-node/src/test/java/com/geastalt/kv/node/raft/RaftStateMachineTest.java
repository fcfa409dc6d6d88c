/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.raft;

import com.geastalt.kv.api.KeyValue;
import com.geastalt.kv.model.KvStatus;
import com.geastalt.kv.node.config.RaftConfig;
import com.geastalt.kv.node.service.KvStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RaftStateMachine.
 */
class RaftStateMachineTest {

    private KvStore kvStore;
    private RaftStateMachine stateMachine;
    private long nextIndex;

    @BeforeEach
    void setUp() {
        var config = new RaftConfig();
        config.setDedupWindow(3);
        kvStore = new KvStore();
        stateMachine = new RaftStateMachine(kvStore, config);
        nextIndex = 1;
    }

    private Object apply(KvCommand command) {
        var result = stateMachine.apply(LogEntry.command(nextIndex++, 1, command));
        return result.isSuccess() ? result.getValue() : result.getError().status();
    }

    @Test
    @DisplayName("Should apply put, get and delete commands in order")
    void shouldApplyCommandsInOrder() {
        assertEquals(new KeyValue("user1", "john_doe"), apply(KvCommand.put("user1", "john_doe", null)));
        assertEquals(new KeyValue("user1", "john_doe"), apply(KvCommand.get("user1")));
        assertEquals(new KeyValue("user1", "john_doe"), apply(KvCommand.delete("user1", null)));
        assertEquals(KvStatus.NOT_FOUND, apply(KvCommand.get("user1")));
        assertEquals(4, stateMachine.getLastAppliedIndex());
    }

    @Test
    @DisplayName("Should skip entries at or below the last applied index")
    void shouldSkipAlreadyAppliedEntries() {
        stateMachine.apply(LogEntry.command(1, 1, KvCommand.put("k", "v1", null)));
        stateMachine.apply(LogEntry.command(1, 1, KvCommand.put("k", "v2", null)));

        assertEquals("v1", kvStore.get("k").getValue().value());
        assertEquals(1, stateMachine.getLastAppliedIndex());
    }

    @Test
    @DisplayName("Configuration and no-op entries should advance the applied index only")
    void shouldAdvanceOnNonCommandEntries() {
        var config = ClusterConfiguration.of(ClusterMember.voter("1", "a:1"));

        var result = stateMachine.apply(LogEntry.configuration(1, 1, config));
        stateMachine.apply(LogEntry.noop(2, 1));

        assertEquals(config, result.getValue());
        assertEquals(2, stateMachine.getLastAppliedIndex());
        assertEquals(0, kvStore.size());
    }

    @Test
    @DisplayName("A repeated request id should return the remembered outcome")
    void shouldDeduplicateRepeatedRequest() {
        kvStore.put("k", "v");

        var first = apply(KvCommand.delete("k", "req-1"));
        var retry = apply(KvCommand.delete("k", "req-1"));

        assertEquals(new KeyValue("k", "v"), first);
        assertEquals(first, retry);
        assertEquals(KvStatus.NOT_FOUND, apply(KvCommand.delete("k", "req-2")));
    }

    @Test
    @DisplayName("A retried put should not overwrite a later write")
    void retriedPutShouldNotOverwriteLaterWrite() {
        apply(KvCommand.put("k", "first", "req-a"));
        apply(KvCommand.put("k", "second", "req-b"));
        apply(KvCommand.put("k", "first", "req-a"));

        assertEquals("second", kvStore.get("k").getValue().value());
    }

    @Test
    @DisplayName("Requests without an id should be applied every time")
    void shouldApplyRequestsWithoutId() {
        kvStore.put("k", "v");

        apply(KvCommand.delete("k", null));

        assertEquals(KvStatus.NOT_FOUND, apply(KvCommand.delete("k", null)));
    }

    @Test
    @DisplayName("Request window should forget the oldest ids")
    void shouldForgetOldestRequestIds() {
        apply(KvCommand.put("k", "v0", "r0"));
        apply(KvCommand.put("k", "v1", "r1"));
        apply(KvCommand.put("k", "v2", "r2"));
        apply(KvCommand.put("k", "v3", "r3"));

        // r0 fell out of the window and is applied again
        apply(KvCommand.put("k", "v0", "r0"));

        assertEquals("v0", kvStore.get("k").getValue().value());
    }

    @Test
    @DisplayName("Snapshot and restore should carry the store and the request window")
    void shouldRoundTripSnapshot() {
        apply(KvCommand.put("a", "1", "req-a"));
        apply(KvCommand.put("b", "2", null));
        byte[] data = stateMachine.snapshot();

        var otherStore = new KvStore();
        var other = new RaftStateMachine(otherStore, new RaftConfig());
        otherStore.put("stale", "x");
        other.restore(data, 2);

        assertEquals(Map.of("a", "1", "b", "2"), otherStore.snapshot());
        assertEquals(2, other.getLastAppliedIndex());

        otherStore.put("a", "changed");
        other.apply(LogEntry.command(3, 1, KvCommand.put("a", "1", "req-a")));
        assertEquals("changed", otherStore.get("a").getValue().value());
    }

    @Test
    @DisplayName("Restoring an empty snapshot should clear the store")
    void shouldRestoreEmptySnapshot() {
        kvStore.put("a", "1");

        stateMachine.restore(new byte[0], 5);

        assertEquals(0, kvStore.size());
        assertEquals(5, stateMachine.getLastAppliedIndex());
    }
}
