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
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for KvStatus.
 */
class KvStatusTest {

    @ParameterizedTest
    @CsvSource({
            "OK, 200",
            "INVALID_REQUEST, 400",
            "NOT_FOUND, 404",
            "MEMBERSHIP_ERROR, 409",
            "NOT_LEADER, 503",
            "NO_LEADER, 503",
            "UNREACHABLE, 502",
            "TIMEOUT, 504",
            "ERROR, 500"
    })
    @DisplayName("Should map each status to its HTTP code")
    void shouldMapHttpStatus(KvStatus status, int httpStatus) {
        assertEquals(httpStatus, status.httpStatus());
    }

    @Test
    @DisplayName("Only leadership and connectivity failures should be retryable")
    void shouldMarkRetryableStatuses() {
        var retryable = EnumSet.of(KvStatus.NOT_LEADER, KvStatus.UNREACHABLE, KvStatus.NO_LEADER);

        for (KvStatus status : KvStatus.values()) {
            assertEquals(retryable.contains(status), status.isRetryable(), status.name());
        }
        assertFalse(KvStatus.TIMEOUT.isRetryable());
    }

    @Test
    @DisplayName("Only OK should count as success")
    void shouldReportSuccess() {
        assertTrue(KvStatus.OK.isSuccess());
        assertFalse(KvStatus.NOT_FOUND.isSuccess());
    }
}
