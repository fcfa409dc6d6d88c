/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.router.client;

import com.geastalt.kv.api.KeyValue;
import com.geastalt.kv.model.KvStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

/**
 * Tests for HttpNodeClient against a mock HTTP server.
 */
class HttpNodeClientTest {

    private static final String NODE = "http://node1:8011";

    private MockRestServiceServer server;
    private HttpNodeClient client;

    @BeforeEach
    void setUp() {
        var builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new HttpNodeClient(builder.build());
    }

    @Test
    @DisplayName("Put should send a JSON body carrying the request id")
    void putShouldSendJsonBody() {
        server.expect(requestTo(NODE + "/put"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpNodeClient.REQUEST_ID_HEADER, "r-1"))
                .andExpect(content().json("{\"key\":\"user1\",\"value\":\"john_doe\",\"requestId\":\"r-1\"}"))
                .andRespond(withSuccess("{\"success\":true,\"data\":{\"key\":\"user1\",\"value\":\"john_doe\"}}",
                        MediaType.APPLICATION_JSON));

        var result = client.put(NODE, "user1", "john_doe", "r-1");

        assertEquals(new KeyValue("user1", "john_doe"), result.getValue());
        server.verify();
    }

    @Test
    @DisplayName("Redirect should read as NOT_LEADER with the leader's address")
    void redirectShouldBeNotLeader() {
        server.expect(requestTo(NODE + "/put"))
                .andRespond(withStatus(HttpStatus.TEMPORARY_REDIRECT)
                        .location(URI.create("http://node2:8012/put"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"success\":false,\"code\":\"NOT_LEADER\",\"error\":\"not leader\","
                                + "\"leaderId\":\"2\",\"leaderAddress\":\"http://node2:8012\"}"));

        var result = client.put(NODE, "k", "v", "r-1");

        assertEquals(KvStatus.NOT_LEADER, result.status());
        assertEquals("2", result.getError().leaderId().orElseThrow());
        assertEquals("http://node2:8012", result.getError().leaderAddress().orElseThrow());
    }

    @Test
    @DisplayName("Bodiless redirect should take the leader address from Location")
    void bodilessRedirectShouldUseLocation() {
        server.expect(requestTo(NODE + "/delete?key=k"))
                .andExpect(method(HttpMethod.DELETE))
                .andRespond(withStatus(HttpStatus.TEMPORARY_REDIRECT)
                        .location(URI.create("http://node3:8013/delete?key=k")));

        var result = client.delete(NODE, "k", "r-2");

        assertEquals(KvStatus.NOT_LEADER, result.status());
        assertEquals("http://node3:8013", result.getError().leaderAddress().orElseThrow());
    }

    @Test
    @DisplayName("Get should read key and value from the top level")
    void getShouldReadTopLevelFields() {
        server.expect(requestTo(NODE + "/get?key=user1"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("{\"success\":true,\"key\":\"user1\",\"value\":\"john_doe\"}",
                        MediaType.APPLICATION_JSON));

        assertEquals(new KeyValue("user1", "john_doe"), client.get(NODE, "user1").getValue());
    }

    @Test
    @DisplayName("Error replies should keep their status")
    void errorRepliesShouldKeepStatus() {
        server.expect(requestTo(NODE + "/get?key=absent"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"success\":false,\"error\":\"Key not found\",\"code\":\"NOT_FOUND\"}"));
        server.expect(requestTo(NODE + "/put"))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"success\":false,\"error\":\"not leader\",\"code\":\"NOT_LEADER\"}"));

        assertEquals(KvStatus.NOT_FOUND, client.get(NODE, "absent").status());
        assertEquals(KvStatus.NOT_LEADER, client.put(NODE, "k", "v", "r").status());
    }

    @Test
    @DisplayName("Connection failure should be UNREACHABLE")
    void connectionFailureShouldBeUnreachable() {
        server.expect(requestTo(NODE + "/raft/status"))
                .andRespond(withException(new IOException("Connection refused")));

        var result = client.status(NODE);

        assertEquals(KvStatus.UNREACHABLE, result.status());
        assertTrue(result.getError().message().contains(NODE));
    }

    @Test
    @DisplayName("Status should parse the Raft status view")
    void statusShouldParseView() {
        server.expect(requestTo(NODE + "/raft/status"))
                .andRespond(withSuccess("{\"success\":true,\"data\":{\"nodeId\":\"1\",\"state\":\"Leader\","
                                + "\"term\":4,\"leaderId\":\"1\",\"numPeers\":2,\"latestConfiguration\":["
                                + "{\"id\":\"1\",\"address\":\"node1:18011\",\"suffrage\":\"VOTER\"}],"
                                + "\"commitIndex\":9,\"membership\":\"MEMBER\"}}",
                        MediaType.APPLICATION_JSON));

        var status = client.status(NODE).getValue();

        assertTrue(status.isLeader());
        assertEquals(4, status.term());
        assertEquals(1, status.latestConfiguration().size());
    }
}
