/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.web;

import com.geastalt.kv.api.ShardAnnouncement;
import com.geastalt.kv.node.broadcast.KnownPeers;
import com.geastalt.kv.node.broadcast.LeaderBroadcaster;
import com.geastalt.kv.node.broadcast.PeerAddress;
import com.geastalt.kv.node.broadcast.PeerNotifier;
import com.geastalt.kv.node.config.NodeConfig;
import com.geastalt.kv.node.config.RaftConfig;
import com.geastalt.kv.node.service.KvService;
import com.geastalt.kv.node.service.LeaderForwarder;
import com.geastalt.kv.node.support.StubRaftNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Web layer tests for ClusterController.
 */
class ClusterControllerTest {

    private final List<String> delivered = new CopyOnWriteArrayList<>();
    private KnownPeers knownPeers;
    private LeaderBroadcaster broadcaster;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        var raftConfig = new RaftConfig();
        raftConfig.setNodeId("1");
        var nodeConfig = new NodeConfig();
        nodeConfig.setAdvertiseHttpAddress("http://node1:8011");
        nodeConfig.setPeers("2=http://node2:8012");
        nodeConfig.setBroadcastThreads(1);

        knownPeers = new KnownPeers(nodeConfig, raftConfig);
        var notifier = new PeerNotifier() {
            @Override
            public boolean notifyNewLeader(PeerAddress target, ShardAnnouncement announcement) {
                delivered.add("newleader:" + target.shardId());
                return true;
            }

            @Override
            public boolean notifyAddShard(PeerAddress target, ShardAnnouncement announcement) {
                delivered.add("addshard:" + target.shardId() + ":" + announcement.shardId());
                return true;
            }
        };
        broadcaster = new LeaderBroadcaster(nodeConfig, knownPeers, notifier);
        var kvService = new KvService(StubRaftNode.create("1"), raftConfig, nodeConfig, knownPeers,
                new LeaderForwarder(RestClient.create(), raftConfig));

        mockMvc = MockMvcBuilders.standaloneSetup(new ClusterController(kvService, broadcaster))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @AfterEach
    void tearDown() {
        broadcaster.shutdown();
    }

    @Test
    @DisplayName("Config should list live members with HTTP addresses")
    void configShouldListMembers() throws Exception {
        mockMvc.perform(get("/config"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.shardCount").value(2))
                .andExpect(jsonPath("$.data.shards['1']").value("http://node1:8011"))
                .andExpect(jsonPath("$.data.shards['2']").value("http://node2:8012"));
    }

    @Test
    @DisplayName("New leader announcement should update the map and ignore an older one")
    void newLeaderShouldUpdateMap() throws Exception {
        mockMvc.perform(post("/newleader")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"shardID\":\"3\",\"address\":\"http://node3:8013\",\"term\":2}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").value("ADDED"));
        mockMvc.perform(post("/newleader")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"shardID\":\"3\",\"addr\":\"http://old3:8013\",\"term\":1}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").value("STALE"));
        mockMvc.perform(post("/addshard")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"shardID\":\"3\",\"addr\":\"http://node3:8013\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").value("UNCHANGED"));

        assertEquals("http://node3:8013", knownPeers.get("3").orElseThrow().address());
        broadcaster.shutdown();
        assertEquals(List.of("addshard:2:3"), delivered);
    }

    @Test
    @DisplayName("Manual add shard should repair an entry learned at a higher term")
    void addShardShouldRepairStaleEntry() throws Exception {
        mockMvc.perform(post("/newleader")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"shardID\":\"3\",\"address\":\"http://node3:8013\",\"term\":3}"))
                .andExpect(status().isOk());
        mockMvc.perform(post("/addshard")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"shardID\":\"3\",\"shardAddress\":\"http://node3-new:8013\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").value("CHANGED"));

        var stored = knownPeers.get("3").orElseThrow();
        assertEquals("http://node3-new:8013", stored.address());
        assertEquals(3L, stored.term());
        broadcaster.shutdown();
        assertEquals(List.of("addshard:2:3", "addshard:2:3"), delivered);
    }

    @Test
    @DisplayName("Announcement without an address should be 400")
    void incompleteAnnouncementShouldBeBadRequest() throws Exception {
        mockMvc.perform(post("/addshard")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"shardID\":\"3\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));
    }
}
