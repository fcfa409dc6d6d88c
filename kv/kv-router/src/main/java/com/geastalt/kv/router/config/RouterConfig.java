/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.router.config;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Router configuration: the nodes to route to and the retry policy.
 */
@Slf4j
@Configuration
@ConfigurationProperties(prefix = "kv.router")
@Getter
@Setter
public class RouterConfig {

    /**
     * Comma-separated list of nodes in format: id=baseUrl,id=baseUrl
     * Entries without an id are numbered by position.
     * Example: 1=http://localhost:8011,2=http://localhost:8012
     */
    private String nodes;

    /**
     * Discovery rounds attempted before a write fails with NO_LEADER.
     */
    private int maxRetries = 3;

    /**
     * Base backoff between discovery rounds, multiplied by the attempt number.
     */
    private long backoffMs = 200;

    private long connectTimeoutMs = 1000;
    private long requestTimeoutMs = 2000;
    private int discoveryThreads = 4;

    /**
     * Parses the configured nodes, skipping malformed entries.
     */
    public List<NodeEndpoint> getNodeEndpoints() {
        List<NodeEndpoint> endpoints = new ArrayList<>();
        if (nodes == null || nodes.isBlank()) {
            return endpoints;
        }

        int position = 0;
        for (String nodeSpec : nodes.split(",")) {
            String trimmed = nodeSpec.trim();
            if (trimmed.isEmpty()) continue;
            position++;

            int eq = trimmed.indexOf('=');
            String id = eq > 0 ? trimmed.substring(0, eq).trim() : String.valueOf(position);
            String url = eq >= 0 ? trimmed.substring(eq + 1).trim() : trimmed;
            if (!url.startsWith("http://") && !url.startsWith("https://")) {
                log.warn("Invalid node spec '{}' - expected format: id=http(s)://host:port", trimmed);
                continue;
            }
            endpoints.add(new NodeEndpoint(id, stripTrailingSlash(url)));
        }
        return endpoints;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
