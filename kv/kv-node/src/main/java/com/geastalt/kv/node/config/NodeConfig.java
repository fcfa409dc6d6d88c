/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.config;

import lombok.Data;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * HTTP-side configuration of a node: its shard identity, public address and
 * the statically known peers used to seed leader broadcasts.
 */
@Slf4j
@Configuration
@ConfigurationProperties(prefix = "kv.node")
@Getter
@Setter
public class NodeConfig {

    /**
     * Shard id announced to peers. Must equal {@code kv.raft.node-id} when set.
     */
    private String shardId;

    /**
     * Base URL at which clients and peers reach this node's HTTP API.
     */
    private String advertiseHttpAddress;

    /**
     * Comma-separated list of peers in format: shardId=baseUrl,shardId=baseUrl
     * Example: 2=http://localhost:8012,3=http://localhost:8013
     */
    private String peers;

    private long httpTimeoutMs = 1000;
    private boolean forwardReads = true;
    private int maxKnownPeers = 64;
    private int broadcastThreads = 2;

    /**
     * Parses the configured peers, skipping malformed entries.
     */
    public List<PeerNode> getPeerNodes() {
        List<PeerNode> nodes = new ArrayList<>();
        if (peers == null || peers.isBlank()) {
            return nodes;
        }

        for (String peerSpec : peers.split(",")) {
            String trimmed = peerSpec.trim();
            if (trimmed.isEmpty()) continue;

            int eq = trimmed.indexOf('=');
            if (eq <= 0 || eq == trimmed.length() - 1) {
                log.warn("Invalid peer spec '{}' - expected format: shardId=baseUrl", trimmed);
                continue;
            }
            String url = trimmed.substring(eq + 1).trim();
            if (!url.startsWith("http://") && !url.startsWith("https://")) {
                log.warn("Invalid peer URL in spec '{}' - expected http(s)://host:port", trimmed);
                continue;
            }
            PeerNode node = new PeerNode();
            node.setShardId(trimmed.substring(0, eq).trim());
            node.setAddress(url);
            nodes.add(node);
        }
        return nodes;
    }

    @Data
    public static class PeerNode {
        /**
     * Shard id announced to peers. Must equal {@code kv.raft.node-id} when set.
     */
    private String shardId;
        private String address;
    }
}
