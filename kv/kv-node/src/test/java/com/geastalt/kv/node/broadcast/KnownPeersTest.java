/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.broadcast;

import com.geastalt.kv.node.config.NodeConfig;
import com.geastalt.kv.node.config.RaftConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for KnownPeers.
 */
class KnownPeersTest {

    private NodeConfig nodeConfig;
    private RaftConfig raftConfig;

    @BeforeEach
    void setUp() {
        nodeConfig = new NodeConfig();
        nodeConfig.setAdvertiseHttpAddress("http://node1:8011");
        nodeConfig.setPeers("2=http://node2:8012, 3=http://node3:8013");
        raftConfig = new RaftConfig();
        raftConfig.setNodeId("1");
    }

    @Test
    @DisplayName("Should seed from static configuration including itself")
    void shouldSeedFromConfiguration() {
        var peers = new KnownPeers(nodeConfig, raftConfig);

        assertEquals("1", peers.selfShardId());
        assertEquals(Map.of(
                "1", "http://node1:8011",
                "2", "http://node2:8012",
                "3", "http://node3:8013"), peers.addresses());
    }

    @Test
    @DisplayName("Should skip malformed peer entries")
    void shouldSkipMalformedPeers() {
        nodeConfig.setPeers("2=http://node2:8012,garbage,=http://x:1,4=node4:8014");

        var peers = new KnownPeers(nodeConfig, raftConfig);

        assertEquals(Set.of("1", "2"), peers.addresses().keySet());
    }

    @Test
    @DisplayName("Should refuse to start when the shard id differs from the node id")
    void shouldRejectMismatchedShardId() {
        nodeConfig.setShardId("shard-a");

        var e = assertThrows(IllegalStateException.class, () -> new KnownPeers(nodeConfig, raftConfig));

        assertTrue(e.getMessage().contains("shard-a"));
    }

    @Test
    @DisplayName("Should accept a shard id equal to the node id")
    void shouldAcceptMatchingShardId() {
        nodeConfig.setShardId("1");

        var peers = new KnownPeers(nodeConfig, raftConfig);

        assertEquals("1", peers.selfShardId());
        assertEquals(Optional.of("http://node1:8011"), peers.get("1").map(PeerAddress::address));
    }

    @Test
    @DisplayName("Should merge by term")
    void shouldMergeByTerm() {
        var peers = new KnownPeers(nodeConfig, raftConfig);

        assertEquals(MergeOutcome.ADDED, peers.merge("4", "http://node4:8014", 1L));
        assertEquals(MergeOutcome.UNCHANGED, peers.merge("4", "http://node4:8014", 1L));
        assertEquals(MergeOutcome.CHANGED, peers.merge("4", "http://node4b:8014", 3L));
        assertEquals(MergeOutcome.STALE, peers.merge("4", "http://node4:8014", 2L));
        assertEquals("http://node4b:8014", peers.get("4").orElseThrow().address());
        assertEquals(3, peers.get("4").orElseThrow().term());
    }

    @Test
    @DisplayName("Same address with a newer term should record the term without a change")
    void shouldRecordNewerTermForSameAddress() {
        var peers = new KnownPeers(nodeConfig, raftConfig);

        assertEquals(MergeOutcome.UNCHANGED, peers.merge("2", "http://node2:8012", 5L));
        assertEquals(5, peers.get("2").orElseThrow().term());
        assertEquals(MergeOutcome.STALE, peers.merge("2", "http://other:8012", 4L));
    }

    @Test
    @DisplayName("Manual registration without a term should repair an entry and keep its term")
    void manualRegistrationShouldOverrideAddress() {
        var peers = new KnownPeers(nodeConfig, raftConfig);
        peers.merge("2", "http://node2:8012", 3L);

        assertEquals(MergeOutcome.CHANGED, peers.merge("2", "http://node2-new:8012", null));

        var stored = peers.get("2").orElseThrow();
        assertEquals("http://node2-new:8012", stored.address());
        assertEquals(3L, stored.term());
        assertEquals(MergeOutcome.UNCHANGED, peers.merge("2", "http://node2-new:8012", null));
        assertEquals(MergeOutcome.STALE, peers.merge("2", "http://node2:8012", 2L));
    }

    @Test
    @DisplayName("Manual registration of a new shard should start at term zero")
    void manualRegistrationOfNewShard() {
        var peers = new KnownPeers(nodeConfig, raftConfig);

        assertEquals(MergeOutcome.ADDED, peers.merge("9", "http://node9:8019", null));
        assertEquals(0L, peers.get("9").orElseThrow().term());
    }

    @Test
    @DisplayName("Should reject new shards when full")
    void shouldRejectWhenFull() {
        nodeConfig.setMaxKnownPeers(3);
        var peers = new KnownPeers(nodeConfig, raftConfig);

        assertEquals(MergeOutcome.REJECTED, peers.merge("4", "http://node4:8014", 1L));
        assertEquals(MergeOutcome.CHANGED, peers.merge("3", "http://node3b:8013", 1L));
        assertEquals(3, peers.size());
    }

    @Test
    @DisplayName("Others should exclude itself and the given shards")
    void othersShouldExcludeSelf() {
        var peers = new KnownPeers(nodeConfig, raftConfig);

        var others = peers.others(Set.of("3"));

        assertEquals(1, others.size());
        assertEquals("2", others.get(0).shardId());
    }
}
