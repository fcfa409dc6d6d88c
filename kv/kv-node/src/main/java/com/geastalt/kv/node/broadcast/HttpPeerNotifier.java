/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.broadcast;

import com.geastalt.kv.api.ShardAnnouncement;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Posts shard announcements to the peer's HTTP API. Failures are logged and dropped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HttpPeerNotifier implements PeerNotifier {

    static final String NEW_LEADER_PATH = "/newleader";
    static final String ADD_SHARD_PATH = "/addshard";

    private final RestClient restClient;

    @Override
    public boolean notifyNewLeader(PeerAddress target, ShardAnnouncement announcement) {
        return post(target, NEW_LEADER_PATH, announcement);
    }

    @Override
    public boolean notifyAddShard(PeerAddress target, ShardAnnouncement announcement) {
        return post(target, ADD_SHARD_PATH, announcement);
    }

    private boolean post(PeerAddress target, String path, ShardAnnouncement announcement) {
        try {
            restClient.post()
                    .uri(target.address() + path)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(announcement)
                    .retrieve()
                    .toBodilessEntity();
            log.debug("Sent {} for shard {} to {} at {}", path, announcement.shardId(), target.shardId(), target.address());
            return true;
        } catch (RestClientException e) {
            log.warn("Failed to send {} for shard {} to {} at {}: {}",
                    path, announcement.shardId(), target.shardId(), target.address(), e.getMessage());
            return false;
        }
    }
}
