/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.web;

import com.geastalt.kv.model.KvError;
import com.geastalt.kv.model.KvResult;
import com.geastalt.kv.node.broadcast.KnownPeers;
import com.geastalt.kv.node.config.NodeConfig;
import com.geastalt.kv.node.config.RaftConfig;
import com.geastalt.kv.node.raft.KvCommand;
import com.geastalt.kv.node.service.KvService;
import com.geastalt.kv.node.service.LeaderForwarder;
import com.geastalt.kv.node.support.StubRaftNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.client.RestClient;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Web layer tests for KvController.
 */
class KvControllerTest {

    private StubRaftNode raftNode;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        var raftConfig = new RaftConfig();
        raftConfig.setNodeId("2");
        var nodeConfig = new NodeConfig();
        nodeConfig.setAdvertiseHttpAddress("http://node2:8012");
        nodeConfig.setPeers("1=http://node1:8011");

        raftNode = StubRaftNode.create("2");
        var kvService = new KvService(raftNode, raftConfig, nodeConfig,
                new KnownPeers(nodeConfig, raftConfig),
                new LeaderForwarder(RestClient.create(), raftConfig));

        mockMvc = MockMvcBuilders.standaloneSetup(new KvController(kvService))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("PUT with query parameters should store the value")
    void putWithQueryParameters() throws Exception {
        mockMvc.perform(put("/put").param("key", "user1").param("value", "john_doe"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.key").value("user1"))
                .andExpect(jsonPath("$.data.value").value("john_doe"));

        assertEquals("john_doe", raftNode.store.get("user1").getValue().value());
    }

    @Test
    @DisplayName("POST with a JSON body should accept val as the value")
    void postWithJsonBody() throws Exception {
        mockMvc.perform(post("/put")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"key\":\"k\",\"val\":\"v\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.value").value("v"));
    }

    @Test
    @DisplayName("Request id header should reach the command")
    void requestIdHeaderShouldReachCommand() throws Exception {
        mockMvc.perform(put("/put").param("key", "k").param("value", "v").header("X-Request-Id", "abc"))
                .andExpect(status().isOk());

        assertEquals(KvCommand.put("k", "v", "abc"), raftNode.commands.get(0));
    }

    @Test
    @DisplayName("GET should return key and value at the top level")
    void getShouldReturnValue() throws Exception {
        raftNode.store.put("user1", "john_doe");

        mockMvc.perform(get("/get").param("key", "user1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.key").value("user1"))
                .andExpect(jsonPath("$.value").value("john_doe"))
                .andExpect(jsonPath("$.data").doesNotExist());
    }

    @Test
    @DisplayName("GET of a missing key should be 404")
    void getMissingKey() throws Exception {
        mockMvc.perform(get("/get").param("key", "absent"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("Key not found"))
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("DELETE should remove the key")
    void deleteShouldRemoveKey() throws Exception {
        raftNode.store.put("k", "v");

        mockMvc.perform(delete("/delete").param("key", "k"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));
        mockMvc.perform(post("/delete").contentType(MediaType.APPLICATION_JSON).content("{\"key\":\"k\"}"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Follower should redirect writes to a known leader")
    void followerShouldRedirect() throws Exception {
        raftNode.leader = false;
        raftNode.knownLeaderId = "1";

        mockMvc.perform(post("/put?key=k&value=v"))
                .andExpect(status().isTemporaryRedirect())
                .andExpect(header().string("Location", "http://node1:8011/put?key=k&value=v"))
                .andExpect(jsonPath("$.code").value("NOT_LEADER"))
                .andExpect(jsonPath("$.leaderId").value("1"))
                .andExpect(jsonPath("$.leaderAddress").value("http://node1:8011"));
    }

    @Test
    @DisplayName("Follower without a known leader should answer 503")
    void followerWithoutLeaderShouldBeUnavailable() throws Exception {
        raftNode.leader = false;

        mockMvc.perform(put("/put").param("key", "k").param("value", "v"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("NOT_LEADER"))
                .andExpect(header().doesNotExist("Location"));
    }

    @Test
    @DisplayName("Forwarded reads on a follower should redirect instead of forwarding again")
    void forwardedReadShouldRedirect() throws Exception {
        raftNode.leader = false;
        raftNode.knownLeaderId = "1";

        mockMvc.perform(get("/get").param("key", "k").header(LeaderForwarder.FORWARDED_HEADER, "3"))
                .andExpect(status().isTemporaryRedirect());
    }

    @Test
    @DisplayName("Consensus timeout should be 504 with an outcome-unknown message")
    void timeoutShouldBeGatewayTimeout() throws Exception {
        raftNode.nextResult = KvResult.failure(KvError.timeout("PUT"));

        mockMvc.perform(put("/put").param("key", "k").param("value", "v"))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.code").value("TIMEOUT"));
    }

    @Test
    @DisplayName("Missing key and malformed JSON should be 400")
    void invalidRequestsShouldBeBadRequest() throws Exception {
        mockMvc.perform(put("/put").param("value", "v"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));
        mockMvc.perform(post("/put").contentType(MediaType.APPLICATION_JSON).content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));
    }
}
