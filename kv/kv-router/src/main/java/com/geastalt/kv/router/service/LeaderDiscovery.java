/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.router.service;

import com.geastalt.kv.model.KvError;
import com.geastalt.kv.model.KvResult;
import com.geastalt.kv.router.client.NodeClient;
import com.geastalt.kv.router.config.NodeEndpoint;
import com.geastalt.kv.router.config.RouterConfig;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Finds the current leader by asking every node for its Raft status and keeps
 * the last answer as the leader guess.
 *
 * <p>The guess is shared by all request threads without locking. A stale guess
 * costs the caller one NOT_LEADER reply and a fresh discovery round.
 */
@Slf4j
@Component
public class LeaderDiscovery {

    private final List<NodeEndpoint> nodes;
    private final NodeClient nodeClient;
    private final Executor executor;
    private final AtomicReference<NodeEndpoint> leader = new AtomicReference<>();
    private final AtomicLong rounds = new AtomicLong();

    @Autowired
    public LeaderDiscovery(RouterConfig routerConfig, NodeClient nodeClient) {
        this(routerConfig.getNodeEndpoints(), nodeClient, newExecutor(routerConfig.getDiscoveryThreads()));
    }

    LeaderDiscovery(List<NodeEndpoint> nodes, NodeClient nodeClient, Executor executor) {
        this.nodes = List.copyOf(nodes);
        this.nodeClient = nodeClient;
        this.executor = executor;
        log.info("Routing across {} nodes: {}", this.nodes.size(), this.nodes);
    }

    private static ExecutorService newExecutor(int threads) {
        var factory = new CustomizableThreadFactory("kv-discovery-");
        factory.setDaemon(true);
        return Executors.newFixedThreadPool(Math.max(1, threads), factory);
    }

    public List<NodeEndpoint> nodes() {
        return nodes;
    }

    public Optional<NodeEndpoint> cachedLeader() {
        return Optional.ofNullable(leader.get());
    }

    /**
     * Drops the leader guess if it still points at the given node.
     */
    public void invalidate(NodeEndpoint stale) {
        var previous = leader.getAndUpdate(current -> stale.equals(current) ? null : current);
        if (stale.equals(previous)) {
            log.debug("Dropped leader guess {}", stale);
        }
    }

    /**
     * Number of discovery rounds run since startup.
     */
    public long rounds() {
        return rounds.get();
    }

    /**
     * Asks every node for its status in parallel.
     */
    public List<NodeProbe> probe() {
        List<CompletableFuture<NodeProbe>> futures = nodes.stream()
                .map(node -> CompletableFuture
                        .supplyAsync(() -> new NodeProbe(node, nodeClient.status(node.address())), executor)
                        .exceptionally(e -> new NodeProbe(node,
                                KvResult.failure(KvError.unreachable(node.address(), e.getMessage())))))
                .toList();
        return futures.stream()
                .map(CompletableFuture::join)
                .toList();
    }

    /**
     * Runs one discovery round. The node reporting Leader with the highest term
     * becomes the new guess; when no node does, the guess is cleared.
     */
    public Optional<NodeEndpoint> discover() {
        rounds.incrementAndGet();
        var found = selectLeader(probe()).map(NodeProbe::node);
        var previous = leader.getAndSet(found.orElse(null));

        if (found.isEmpty()) {
            log.warn("Leader discovery found no leader among {} nodes", nodes.size());
        } else if (!found.get().equals(previous)) {
            log.info("Discovered leader {} at {}", found.get().id(), found.get().address());
        }
        return found;
    }

    /**
     * Picks the node claiming leadership in the highest term. During a handover
     * two nodes may both claim it; the older term is stale.
     */
    public static Optional<NodeProbe> selectLeader(List<NodeProbe> probes) {
        return probes.stream()
                .filter(NodeProbe::reportsLeader)
                .max(Comparator.comparingLong(NodeProbe::term));
    }

    @PreDestroy
    public void shutdown() {
        if (executor instanceof ExecutorService service) {
            service.shutdownNow();
        }
    }
}
