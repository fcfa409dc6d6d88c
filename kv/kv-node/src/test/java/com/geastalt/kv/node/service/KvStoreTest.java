/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.service;

import com.geastalt.kv.model.KvError;
import com.geastalt.kv.model.KvStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for KvStore.
 */
class KvStoreTest {

    private KvStore kvStore;

    @BeforeEach
    void setUp() {
        kvStore = new KvStore();
    }

    @Test
    @DisplayName("Should store and read back a value")
    void shouldStoreAndReadValue() {
        var put = kvStore.put("user1", "john_doe");
        assertTrue(put.isSuccess());
        assertEquals("john_doe", put.getValue().value());

        var get = kvStore.get("user1");
        assertTrue(get.isSuccess());
        assertEquals("user1", get.getValue().key());
        assertEquals("john_doe", get.getValue().value());
    }

    @Test
    @DisplayName("Should replace the value of an existing key")
    void shouldReplaceExistingValue() {
        kvStore.put("k", "v1");
        kvStore.put("k", "v2");

        assertEquals("v2", kvStore.get("k").getValue().value());
        assertEquals(1, kvStore.size());
    }

    @Test
    @DisplayName("Should report NOT_FOUND for a missing key without changing state")
    void shouldReportMissingKey() {
        kvStore.put("present", "x");

        var get = kvStore.get("absent");
        var delete = kvStore.delete("absent");

        assertEquals(KvStatus.NOT_FOUND, get.status());
        assertEquals(KvError.KEY_NOT_FOUND, get.getError().message());
        assertEquals(KvStatus.NOT_FOUND, delete.status());
        assertEquals(Map.of("present", "x"), kvStore.snapshot());
    }

    @Test
    @DisplayName("Should delete a key and return the removed pair")
    void shouldDeleteKey() {
        kvStore.put("k", "v");

        var delete = kvStore.delete("k");

        assertTrue(delete.isSuccess());
        assertEquals("v", delete.getValue().value());
        assertEquals(KvStatus.NOT_FOUND, kvStore.get("k").status());
    }

    @Test
    @DisplayName("Should replace all contents wholesale")
    void shouldReplaceAllContents() {
        kvStore.put("old", "1");

        kvStore.replaceAll(Map.of("a", "1", "b", "2"));

        assertEquals(Map.of("a", "1", "b", "2"), kvStore.snapshot());
        assertEquals(KvStatus.NOT_FOUND, kvStore.get("old").status());
    }

    @Test
    @DisplayName("Snapshot should be a copy")
    void snapshotShouldBeCopy() {
        kvStore.put("a", "1");
        var copy = kvStore.snapshot();

        kvStore.put("b", "2");

        assertEquals(1, copy.size());
    }
}
