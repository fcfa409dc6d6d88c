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
import com.geastalt.kv.router.client.NodeClient;
import com.geastalt.kv.router.config.NodeEndpoint;
import com.geastalt.kv.router.config.RouterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Routes client operations to the nodes.
 *
 * <p>Writes go to the leader. When the leader guess is missing or wrong the
 * router runs a discovery round and retries there, backing off between rounds
 * that find no leader. Every write carries one request id for all of its
 * attempts so a node applies it at most once.
 *
 * <p>Reads go round-robin to any reachable node, since every node answers reads
 * through consensus. A node that cannot serve the read sends it down the
 * leader path instead.
 */
@Slf4j
@Service
public class ShardRouter {

    private final LeaderDiscovery discovery;
    private final NodeClient nodeClient;
    private final int maxRetries;
    private final long backoffMs;
    private final AtomicInteger nextReader = new AtomicInteger();

    public ShardRouter(LeaderDiscovery discovery, NodeClient nodeClient, RouterConfig routerConfig) {
        this.discovery = discovery;
        this.nodeClient = nodeClient;
        this.maxRetries = Math.max(1, routerConfig.getMaxRetries());
        this.backoffMs = Math.max(0, routerConfig.getBackoffMs());
    }

    public KvResult<KeyValue> put(String key, String value, String requestId) {
        if (!KeyValue.isValidKey(key)) {
            return KvResult.failure(KvError.invalidRequest("Missing or invalid key"));
        }
        if (value == null) {
            return KvResult.failure(KvError.invalidRequest("Missing value"));
        }
        String id = requestId != null ? requestId : newRequestId();
        log.debug("Routing put: key={}, requestId={}", key, id);
        return viaLeader("PUT", node -> nodeClient.put(node.address(), key, value, id));
    }

    public KvResult<KeyValue> delete(String key, String requestId) {
        if (!KeyValue.isValidKey(key)) {
            return KvResult.failure(KvError.invalidRequest("Missing or invalid key"));
        }
        String id = requestId != null ? requestId : newRequestId();
        log.debug("Routing delete: key={}, requestId={}", key, id);
        return viaLeader("DELETE", node -> nodeClient.delete(node.address(), key, id));
    }

    public KvResult<KeyValue> get(String key) {
        if (!KeyValue.isValidKey(key)) {
            return KvResult.failure(KvError.invalidRequest("Missing or invalid key"));
        }
        List<NodeEndpoint> nodes = discovery.nodes();
        if (nodes.isEmpty()) {
            return KvResult.failure(KvError.error("No nodes configured"));
        }

        int start = Math.floorMod(nextReader.getAndIncrement(), nodes.size());
        KvResult<KeyValue> last = null;
        for (int i = 0; i < nodes.size(); i++) {
            var node = nodes.get((start + i) % nodes.size());
            last = nodeClient.get(node.address(), key);
            if (last.is(KvStatus.UNREACHABLE)) {
                log.debug("Node {} unreachable for get, trying next", node.id());
                continue;
            }
            if (last.is(KvStatus.NOT_LEADER)) {
                log.debug("Node {} could not serve get, routing to leader", node.id());
                return viaLeader("GET", leader -> nodeClient.get(leader.address(), key));
            }
            return last;
        }
        log.warn("No node reachable for get of key {}", key);
        return last;
    }

    public RouterStatus status() {
        var probes = discovery.probe();
        var leader = LeaderDiscovery.selectLeader(probes);
        int shardCount = leader
                .map(probe -> probe.status().getValue())
                .filter(status -> status.latestConfiguration() != null)
                .map(status -> status.latestConfiguration().size())
                .orElse(discovery.nodes().size());
        return new RouterStatus(
                leader.map(probe -> probe.node().id()).orElse(null),
                leader.map(probe -> probe.node().address()).orElse(null),
                shardCount,
                probes.stream().map(NodeHealth::from).toList());
    }

    private KvResult<KeyValue> viaLeader(String operation, Function<NodeEndpoint, KvResult<KeyValue>> call) {
        var cached = discovery.cachedLeader();
        if (cached.isPresent()) {
            var result = call.apply(cached.get());
            if (!result.isRetryable()) {
                return finish(operation, result);
            }
            log.debug("{} against cached leader {} failed with {}", operation, cached.get().id(), result.status());
            discovery.invalidate(cached.get());
        }

        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            var leader = discovery.discover();
            if (leader.isPresent()) {
                var result = call.apply(leader.get());
                if (!result.isRetryable()) {
                    return finish(operation, result);
                }
                log.debug("{} against discovered leader {} failed with {}", operation, leader.get().id(), result.status());
                discovery.invalidate(leader.get());
            }
            if (attempt < maxRetries && !backoff(attempt)) {
                break;
            }
        }

        log.warn("{} failed: no leader after {} discovery rounds", operation, maxRetries);
        return KvResult.failure(KvError.noLeader(maxRetries));
    }

    private KvResult<KeyValue> finish(String operation, KvResult<KeyValue> result) {
        if (result.is(KvStatus.TIMEOUT)) {
            log.warn("{} timed out at the leader, outcome unknown: {}", operation, result.getError().message());
        }
        return result;
    }

    private boolean backoff(int attempt) {
        if (backoffMs == 0) {
            return true;
        }
        try {
            Thread.sleep(backoffMs * attempt);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static String newRequestId() {
        return UUID.randomUUID().toString();
    }
}
