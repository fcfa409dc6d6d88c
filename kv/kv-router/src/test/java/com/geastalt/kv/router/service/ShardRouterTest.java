/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.router.service;

import com.geastalt.kv.api.KeyValue;
import com.geastalt.kv.model.KvError;
import com.geastalt.kv.model.KvResult;
import com.geastalt.kv.model.KvStatus;
import com.geastalt.kv.router.config.RouterConfig;
import com.geastalt.kv.router.support.FakeNodeClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ShardRouter.
 */
class ShardRouterTest {

    private static final String N1 = "http://n1:8011";
    private static final String N2 = "http://n2:8012";
    private static final String N3 = "http://n3:8013";

    private FakeNodeClient cluster;
    private LeaderDiscovery discovery;
    private ShardRouter router;

    @BeforeEach
    void setUp() {
        cluster = new FakeNodeClient();
        cluster.leaderAddress = N2;

        var config = new RouterConfig();
        config.setMaxRetries(3);
        config.setBackoffMs(0);

        discovery = new LeaderDiscovery(FakeNodeClient.NODES, cluster, Runnable::run);
        router = new ShardRouter(discovery, cluster, config);
    }

    @Test
    @DisplayName("Should discover the leader once and reuse the guess")
    void shouldDiscoverOnceAndReuseGuess() {
        var first = router.put("user1", "john_doe", null);
        var second = router.put("user2", "jane", null);

        assertTrue(first.isSuccess());
        assertTrue(second.isSuccess());
        assertEquals(1, discovery.rounds());
        assertEquals(3, cluster.callsStartingWith("status").size());
        assertEquals(2, cluster.callsStartingWith("put " + N2).size());
        assertEquals("john_doe", cluster.store.get("user1"));
    }

    @Test
    @DisplayName("Stale guess pointing at a follower should cost exactly one discovery round")
    void staleGuessShouldTriggerOneDiscoveryRound() {
        cluster.leaderAddress = N1;
        router.put("warmup", "x", null);
        assertEquals(N1, discovery.cachedLeader().orElseThrow().address());

        cluster.leaderAddress = N3;
        cluster.calls.clear();

        var result = router.put("user1", "john_doe", null);

        assertTrue(result.isSuccess());
        assertEquals(new KeyValue("user1", "john_doe"), result.getValue());
        assertEquals(2, discovery.rounds());
        var puts = cluster.callsStartingWith("put");
        assertEquals(2, puts.size());
        assertTrue(puts.get(0).startsWith("put " + N1));
        assertTrue(puts.get(1).startsWith("put " + N3));
        assertEquals(N3, discovery.cachedLeader().orElseThrow().address());
    }

    @Test
    @DisplayName("Unreachable cached leader should fail over")
    void unreachableLeaderShouldFailOver() {
        router.put("warmup", "x", null);
        cluster.unreachable.add(N2);
        cluster.leaderAddress = N1;

        var result = router.delete("warmup", null);

        assertTrue(result.isSuccess());
        assertFalse(cluster.store.containsKey("warmup"));
    }

    @Test
    @DisplayName("Retries of one write should reuse its request id")
    void retriesShouldReuseRequestId() {
        cluster.leaderAddress = N1;
        router.put("warmup", "x", null);
        cluster.leaderAddress = N3;
        cluster.calls.clear();

        router.put("user1", "john_doe", null);

        List<String> ids = cluster.callsStartingWith("put").stream()
                .map(call -> call.substring(call.lastIndexOf(' ') + 1))
                .distinct()
                .toList();
        assertEquals(1, ids.size());
        assertNotEquals("null", ids.get(0));
    }

    @Test
    @DisplayName("Client request id should be passed through")
    void clientRequestIdShouldPassThrough() {
        router.put("k", "v", "client-42");

        assertEquals(List.of("put " + N2 + " client-42"), cluster.callsStartingWith("put"));
    }

    @Test
    @DisplayName("Should give up with NO_LEADER after the retry budget")
    void shouldGiveUpWithoutLeader() {
        cluster.leaderAddress = null;

        var result = router.put("k", "v", null);

        assertEquals(KvStatus.NO_LEADER, result.status());
        assertEquals(3, discovery.rounds());
        assertTrue(cluster.callsStartingWith("put").isEmpty());
        assertTrue(discovery.cachedLeader().isEmpty());
    }

    @Test
    @DisplayName("Timeout should surface without a retry")
    void timeoutShouldNotBeRetried() {
        cluster.nextWriteResult = KvResult.failure(KvError.timeout("PUT"));

        var result = router.put("k", "v", null);

        assertEquals(KvStatus.TIMEOUT, result.status());
        assertTrue(result.getError().message().contains("outcome unknown"));
        assertEquals(1, cluster.callsStartingWith("put").size());
    }

    @Test
    @DisplayName("Missing key on delete should be returned directly")
    void notFoundShouldBeTerminal() {
        var result = router.delete("absent", null);

        assertEquals(KvStatus.NOT_FOUND, result.status());
        assertEquals(1, cluster.callsStartingWith("delete").size());
    }

    @Test
    @DisplayName("Invalid input should be rejected before any node is contacted")
    void invalidInputShouldBeRejectedLocally() {
        assertEquals(KvStatus.INVALID_REQUEST, router.put(" ", "v", null).status());
        assertEquals(KvStatus.INVALID_REQUEST, router.put("k", null, null).status());
        assertEquals(KvStatus.INVALID_REQUEST, router.get(null).status());
        assertEquals(KvStatus.INVALID_REQUEST, router.delete("", null).status());
        assertTrue(cluster.calls.isEmpty());
    }

    @Test
    @DisplayName("Reads should rotate across nodes")
    void readsShouldRoundRobin() {
        cluster.store.put("user1", "john_doe");

        for (int i = 0; i < 3; i++) {
            assertEquals("john_doe", router.get("user1").getValue().value());
        }

        assertEquals(List.of("get " + N1, "get " + N2, "get " + N3), cluster.callsStartingWith("get"));
        assertEquals(0, discovery.rounds());
    }

    @Test
    @DisplayName("Read should move past an unreachable node")
    void readShouldSkipUnreachableNode() {
        cluster.store.put("k", "v");
        cluster.unreachable.add(N1);

        var result = router.get("k");

        assertTrue(result.isSuccess());
        assertEquals(List.of("get " + N1, "get " + N2), cluster.callsStartingWith("get"));
    }

    @Test
    @DisplayName("Read refused by a follower should go to the leader")
    void refusedReadShouldGoToLeader() {
        cluster.store.put("k", "v");
        cluster.followersServeReads = false;
        cluster.leaderAddress = N3;

        var result = router.get("k");

        assertTrue(result.isSuccess());
        assertEquals(List.of("get " + N1, "get " + N3), cluster.callsStartingWith("get"));
        assertEquals(1, discovery.rounds());
    }

    @Test
    @DisplayName("Read with every node down should be UNREACHABLE")
    void readWithAllNodesDown() {
        FakeNodeClient.NODES.forEach(node -> cluster.unreachable.add(node.address()));

        assertEquals(KvStatus.UNREACHABLE, router.get("k").status());
        assertEquals(3, cluster.callsStartingWith("get").size());
    }

    @Test
    @DisplayName("Status should report node health and the newest leader")
    void statusShouldReportHealth() {
        cluster.staleLeaders.add(N1);
        cluster.unreachable.add(N3);

        var status = router.status();

        assertEquals("2", status.leaderId());
        assertEquals(N2, status.leaderAddress());
        assertEquals(3, status.shardCount());
        assertEquals(3, status.nodes().size());
        assertTrue(status.nodes().get(0).reachable());
        assertEquals(1L, status.nodes().get(0).term());
        assertFalse(status.nodes().get(2).reachable());
        assertNotNull(status.nodes().get(2).error());
    }
}
