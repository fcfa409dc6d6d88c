/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.service;

import com.geastalt.kv.api.ApiResponse;
import com.geastalt.kv.api.KeyValue;
import com.geastalt.kv.model.KvError;
import com.geastalt.kv.model.KvResult;
import com.geastalt.kv.node.config.RaftConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Forwards read requests to the current Raft leader over HTTP.
 * Forwarded requests are marked so the receiving node never forwards them again.
 */
@Slf4j
@Component
public class LeaderForwarder {

    public static final String FORWARDED_HEADER = "X-Kv-Forwarded-From";

    private final RestClient restClient;
    private final String nodeId;

    public LeaderForwarder(RestClient restClient, RaftConfig raftConfig) {
        this.restClient = restClient;
        this.nodeId = raftConfig.getNodeId();
    }

    /**
     * Forwards a GET to the leader at the given HTTP address.
     */
    public KvResult<KeyValue> forwardGet(String leaderAddress, String key) {
        log.debug("Forwarding get for key {} to leader at {}", key, leaderAddress);
        try {
            ApiResponse<?> response = restClient.get()
                    .uri(leaderAddress + "/get?key={key}", key)
                    .accept(MediaType.APPLICATION_JSON)
                    .header(FORWARDED_HEADER, nodeId)
                    .exchange((request, reply) -> reply.bodyTo(ApiResponse.class));

            if (response == null) {
                return KvResult.failure(KvError.error("Empty reply from leader at " + leaderAddress));
            }
            if (response.success()) {
                return KvResult.success(new KeyValue(response.key() != null ? response.key() : key, response.value()));
            }
            return KvResult.failure(response.toError());
        } catch (RestClientException e) {
            log.warn("Failed to forward get to leader at {}: {}", leaderAddress, e.getMessage());
            return KvResult.failure(KvError.unreachable(leaderAddress, e.getMessage()));
        }
    }
}
