/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for KvResult.
 */
class KvResultTest {

    @Test
    @DisplayName("Success exposes its value and OK status")
    void successExposesValue() {
        var result = KvResult.success("john_doe");

        assertTrue(result.isSuccess());
        assertEquals("john_doe", result.getValue());
        assertEquals(KvStatus.OK, result.status());
        assertThrows(IllegalStateException.class, result::getError);
    }

    @Test
    @DisplayName("Failure exposes its error and the error's status")
    void failureExposesError() {
        var result = KvResult.<String>failure(KvError.keyNotFound());

        assertFalse(result.isSuccess());
        assertEquals(KvStatus.NOT_FOUND, result.status());
        assertEquals(KvError.KEY_NOT_FOUND, result.getError().message());
        assertThrows(IllegalStateException.class, result::getValue);
    }

    @Test
    @DisplayName("Should map only successes")
    void mapTransformsOnlySuccesses() {
        KvResult<Integer> ok = KvResult.success(2);
        KvResult<Integer> failed = KvResult.failure(KvStatus.ERROR, "boom");

        assertEquals(4, ok.map(v -> v * 2).getValue());
        assertSame(failed.getError(), failed.map(v -> v * 2).getError());
    }

    @Test
    @DisplayName("Should match statuses and retryability")
    void statusMatching() {
        var unreachable = KvResult.<String>failure(KvError.unreachable("http://node2:8012", "refused"));

        assertTrue(unreachable.is(KvStatus.UNREACHABLE));
        assertFalse(unreachable.is(KvStatus.NOT_LEADER));
        assertTrue(unreachable.isRetryable());
        assertFalse(KvResult.<String>failure(KvError.timeout("put")).isRetryable());
        assertFalse(KvResult.success("v").isRetryable());
    }

    @Test
    @DisplayName("Should expose the leader address only on NOT_LEADER failures")
    void leaderAddressFromNotLeader() {
        var redirected = KvResult.<String>failure(KvError.notLeader("1", "http://node1:8011"));

        assertEquals(Optional.of("http://node1:8011"), redirected.leaderAddress());
        assertEquals(Optional.empty(), KvResult.<String>failure(KvError.notLeader(null, null)).leaderAddress());
        assertEquals(Optional.empty(), KvResult.<String>failure(KvError.keyNotFound()).leaderAddress());
        assertEquals(Optional.empty(), KvResult.success("v").leaderAddress());
    }

    @Test
    @DisplayName("Should recover only failures of the named status")
    void recoverByStatus() {
        var notLeader = KvResult.<String>failure(KvError.notLeader("1", null));
        var notFound = KvResult.<String>failure(KvError.keyNotFound());

        assertEquals("forwarded", notLeader.recover(KvStatus.NOT_LEADER, e -> KvResult.success("forwarded")).getValue());
        assertSame(notFound, notFound.recover(KvStatus.NOT_LEADER, e -> KvResult.success("forwarded")));
        assertEquals("v", KvResult.success("v").recover(KvStatus.NOT_LEADER, e -> KvResult.success("x")).getValue());
    }
}
