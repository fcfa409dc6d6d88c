/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.broadcast;

import com.geastalt.kv.api.ShardAnnouncement;
import com.geastalt.kv.model.KvError;
import com.geastalt.kv.model.KvResult;
import com.geastalt.kv.node.config.NodeConfig;
import com.geastalt.kv.node.raft.LeadershipEvent;
import com.geastalt.kv.node.raft.LeadershipListener;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Announces this node to its known peers when it becomes leader, and merges and
 * re-broadcasts announcements received from other nodes.
 */
@Slf4j
@Component
public class LeaderBroadcaster implements LeadershipListener {

    private final NodeConfig nodeConfig;
    private final KnownPeers knownPeers;
    private final PeerNotifier notifier;
    private final Executor executor;

    @Autowired
    public LeaderBroadcaster(NodeConfig nodeConfig, KnownPeers knownPeers, PeerNotifier notifier) {
        this(nodeConfig, knownPeers, notifier, newExecutor(nodeConfig.getBroadcastThreads()));
    }

    LeaderBroadcaster(NodeConfig nodeConfig, KnownPeers knownPeers, PeerNotifier notifier, Executor executor) {
        this.nodeConfig = nodeConfig;
        this.knownPeers = knownPeers;
        this.notifier = notifier;
        this.executor = executor;
    }

    private static ExecutorService newExecutor(int threads) {
        var factory = new CustomizableThreadFactory("kv-broadcast-");
        factory.setDaemon(true);
        return Executors.newFixedThreadPool(Math.max(1, threads), factory);
    }

    @Override
    public void onLeadershipChange(LeadershipEvent event) {
        if (!event.leader()) {
            log.info("Node {} is no longer leader (term {})", event.nodeId(), event.term());
            return;
        }

        String selfShard = knownPeers.selfShardId();
        String selfAddress = nodeConfig.getAdvertiseHttpAddress();
        if (selfAddress == null || selfAddress.isBlank()) {
            log.warn("No kv.node.advertise-http-address configured, skipping leader broadcast");
            return;
        }

        knownPeers.merge(selfShard, selfAddress, event.term());
        var announcement = new ShardAnnouncement(selfShard, selfAddress, event.term());
        var targets = knownPeers.others(Set.of());
        log.info("Broadcasting leadership of shard {} (term {}) to {} peer(s)", selfShard, event.term(), targets.size());

        for (var target : targets) {
            dispatch(() -> notifier.notifyNewLeader(target, announcement));
        }
    }

    /**
     * Merges an announcement received on /newleader or /addshard and, when it
     * taught this node something new, passes it on via /addshard.
     */
    public KvResult<MergeOutcome> accept(ShardAnnouncement announcement) {
        if (announcement == null || isBlank(announcement.shardId()) || isBlank(announcement.address())) {
            return KvResult.failure(KvError.invalidRequest("shardId and address are required"));
        }

        var outcome = knownPeers.merge(announcement.shardId(), announcement.address(), announcement.term());
        if (outcome.shouldPropagate()) {
            var targets = knownPeers.others(Set.of(announcement.shardId()));
            log.debug("Propagating shard {} to {} peer(s)", announcement.shardId(), targets.size());
            for (var target : targets) {
                dispatch(() -> notifier.notifyAddShard(target, announcement));
            }
        }
        return KvResult.success(outcome);
    }

    private void dispatch(Runnable task) {
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            log.warn("Dropping broadcast, executor rejected task: {}", e.getMessage());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @PreDestroy
    public void shutdown() {
        if (executor instanceof ExecutorService service) {
            service.shutdown();
            try {
                if (!service.awaitTermination(2, TimeUnit.SECONDS)) {
                    service.shutdownNow();
                }
            } catch (InterruptedException e) {
                service.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }
}
