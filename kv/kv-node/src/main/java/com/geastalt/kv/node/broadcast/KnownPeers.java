/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.broadcast;

import com.geastalt.kv.node.config.NodeConfig;
import com.geastalt.kv.node.config.RaftConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Best-effort map from shard id to HTTP address, seeded from static configuration
 * and updated by leader announcements. Never replicated; always a hint.
 */
@Slf4j
@Component
public class KnownPeers {

    private final Map<String, PeerAddress> peers = new ConcurrentHashMap<>();
    private final String selfShardId;
    private final int maxPeers;
    private final Clock clock;

    public KnownPeers(NodeConfig nodeConfig, RaftConfig raftConfig) {
        this(nodeConfig, raftConfig, Clock.systemUTC());
    }

    KnownPeers(NodeConfig nodeConfig, RaftConfig raftConfig, Clock clock) {
        this.clock = clock;
        this.maxPeers = nodeConfig.getMaxKnownPeers();
        this.selfShardId = raftConfig.getNodeId();
        String configuredShardId = nodeConfig.getShardId();
        if (configuredShardId != null && !configuredShardId.isBlank()
                && !configuredShardId.equals(selfShardId)) {
            // leader hints are looked up by Raft node id
            throw new IllegalStateException("kv.node.shard-id '" + configuredShardId
                    + "' must match kv.raft.node-id '" + selfShardId + "'");
        }

        String selfAddress = nodeConfig.getAdvertiseHttpAddress();
        if (selfAddress != null && !selfAddress.isBlank()) {
            peers.put(selfShardId, new PeerAddress(selfShardId, selfAddress, 0, clock.instant()));
        }
        for (var peer : nodeConfig.getPeerNodes()) {
            if (peers.size() >= maxPeers) {
                log.warn("Known peers limit {} reached, ignoring configured peer {}", maxPeers, peer.getShardId());
                continue;
            }
            peers.putIfAbsent(peer.getShardId(),
                    new PeerAddress(peer.getShardId(), peer.getAddress(), 0, clock.instant()));
        }
        log.info("Known peers seeded for shard {}: {}", selfShardId, addresses());
    }

    public String selfShardId() {
        return selfShardId;
    }

    /**
     * Merges an announcement. Accepted when its term is at least the stored term.
     * An announcement without a term is a manual registration: its address is
     * applied unconditionally and the stored term is kept.
     */
    public synchronized MergeOutcome merge(String shardId, String address, Long term) {
        var existing = peers.get(shardId);

        if (existing == null) {
            if (peers.size() >= maxPeers) {
                log.warn("Known peers limit {} reached, rejecting shard {} at {}", maxPeers, shardId, address);
                return MergeOutcome.REJECTED;
            }
            long initialTerm = term != null ? term : 0L;
            peers.put(shardId, new PeerAddress(shardId, address, initialTerm, clock.instant()));
            log.info("Learned shard {} at {} (term {})", shardId, address, initialTerm);
            return MergeOutcome.ADDED;
        }

        long announcedTerm = term != null ? term : existing.term();
        if (announcedTerm < existing.term()) {
            log.debug("Ignoring stale announcement for shard {}: term {} < {}", shardId, announcedTerm, existing.term());
            return MergeOutcome.STALE;
        }

        if (existing.address().equals(address)) {
            if (announcedTerm > existing.term()) {
                peers.put(shardId, new PeerAddress(shardId, address, announcedTerm, clock.instant()));
            }
            return MergeOutcome.UNCHANGED;
        }

        peers.put(shardId, new PeerAddress(shardId, address, announcedTerm, clock.instant()));
        log.info("Shard {} moved from {} to {} (term {})", shardId, existing.address(), address, announcedTerm);
        return MergeOutcome.CHANGED;
    }

    public Optional<PeerAddress> get(String shardId) {
        if (shardId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(peers.get(shardId));
    }

    /**
     * Known peers other than this node and the given shards.
     */
    public List<PeerAddress> others(Set<String> excludedShardIds) {
        return peers.values().stream()
                .filter(peer -> !peer.shardId().equals(selfShardId))
                .filter(peer -> !excludedShardIds.contains(peer.shardId()))
                .sorted((a, b) -> a.shardId().compareTo(b.shardId()))
                .toList();
    }

    /**
     * Shard id to address, sorted by shard id.
     */
    public Map<String, String> addresses() {
        var result = new TreeMap<String, String>();
        peers.values().forEach(peer -> result.put(peer.shardId(), peer.address()));
        return result;
    }

    public int size() {
        return peers.size();
    }
}
