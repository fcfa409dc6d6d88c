/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.service;

import com.geastalt.kv.api.JoinRequest;
import com.geastalt.kv.api.KeyValue;
import com.geastalt.kv.api.MemberView;
import com.geastalt.kv.api.RaftStatusView;
import com.geastalt.kv.api.ShardMapView;
import com.geastalt.kv.model.KvError;
import com.geastalt.kv.model.KvResult;
import com.geastalt.kv.model.KvStatus;
import com.geastalt.kv.node.broadcast.KnownPeers;
import com.geastalt.kv.node.broadcast.PeerAddress;
import com.geastalt.kv.node.config.NodeConfig;
import com.geastalt.kv.node.config.RaftConfig;
import com.geastalt.kv.node.raft.ClusterConfiguration;
import com.geastalt.kv.node.raft.ClusterMember;
import com.geastalt.kv.node.raft.KvCommand;
import com.geastalt.kv.node.raft.RaftNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Key-value and cluster operations of a node. Data operations go through Raft;
 * NOT_LEADER failures carry the leader's HTTP address when it is known.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KvService {

    private final RaftNode raftNode;
    private final RaftConfig raftConfig;
    private final NodeConfig nodeConfig;
    private final KnownPeers knownPeers;
    private final LeaderForwarder leaderForwarder;

    public KvResult<KeyValue> put(String key, String value, String requestId) {
        log.debug("Put request: key={}, requestId={}", key, requestId);
        if (!KeyValue.isValidKey(key)) {
            return KvResult.failure(KvError.invalidRequest("Missing or invalid key"));
        }
        if (value == null) {
            return KvResult.failure(KvError.invalidRequest("Missing value"));
        }
        return execute(KvCommand.put(key, value, requestId));
    }

    /**
     * Reads a key through Raft. A follower forwards the read to the leader once,
     * unless the request was itself forwarded.
     */
    public KvResult<KeyValue> get(String key, boolean forwarded) {
        log.debug("Get request: key={}, forwarded={}", key, forwarded);
        if (!KeyValue.isValidKey(key)) {
            return KvResult.failure(KvError.invalidRequest("Missing or invalid key"));
        }

        var result = execute(KvCommand.get(key));
        if (forwarded || !nodeConfig.isForwardReads()) {
            return result;
        }
        return result.leaderAddress()
                .map(leader -> leaderForwarder.forwardGet(leader, key))
                .orElse(result);
    }

    public KvResult<KeyValue> delete(String key, String requestId) {
        log.debug("Delete request: key={}, requestId={}", key, requestId);
        if (!KeyValue.isValidKey(key)) {
            return KvResult.failure(KvError.invalidRequest("Missing or invalid key"));
        }
        return execute(KvCommand.delete(key, requestId));
    }

    /**
     * Adds a voting member. Only the leader accepts joins.
     */
    public KvResult<List<MemberView>> join(JoinRequest request) {
        if (request == null || isBlank(request.memberId()) || isBlank(request.address())) {
            return KvResult.failure(KvError.invalidRequest("memberId and address are required"));
        }
        log.info("Join request: member={}, address={}", request.memberId(), request.address());
        var result = await(raftNode.addVoter(request.memberId(), request.address(), raftConfig.getApplyTimeoutMs()), "join");
        return withLeaderHint(result).map(ignored -> members(raftNode.getConfiguration()));
    }

    /**
     * Removes a member. Only the leader accepts leaves.
     */
    public KvResult<List<MemberView>> leave(String memberId) {
        if (isBlank(memberId)) {
            return KvResult.failure(KvError.invalidRequest("memberId is required"));
        }
        log.info("Leave request: member={}", memberId);
        var result = await(raftNode.removeServer(memberId, raftConfig.getApplyTimeoutMs()), "leave");
        return withLeaderHint(result).map(ignored -> members(raftNode.getConfiguration()));
    }

    public RaftStatusView status() {
        var status = raftNode.getStatus();
        return new RaftStatusView(
                status.nodeId(),
                status.state().displayName(),
                status.term(),
                status.leaderId(),
                status.numPeers(),
                members(status.configuration()),
                status.commitIndex(),
                status.appliedIndex(),
                status.lastLogIndex(),
                status.snapshotIndex(),
                status.membership().name());
    }

    /**
     * Shard map built from live membership, falling back to the known-peers map
     * when this node has no configuration yet.
     */
    public ShardMapView shardMap() {
        var configuration = raftNode.getConfiguration();
        if (configuration.isEmpty()) {
            var known = knownPeers.addresses();
            return new ShardMapView(known.size(), known);
        }

        var shards = new LinkedHashMap<String, String>();
        for (var member : configuration.members()) {
            shards.put(member.id(), knownPeers.get(member.id())
                    .map(PeerAddress::address)
                    .orElse(member.address()));
        }
        return new ShardMapView(shards.size(), shards);
    }

    @SuppressWarnings("unchecked")
    private KvResult<KeyValue> execute(KvCommand command) {
        var result = await(raftNode.apply(command, raftConfig.getApplyTimeoutMs()), command.operation().name());
        return withLeaderHint((KvResult<KeyValue>) result);
    }

    private KvResult<?> await(CompletableFuture<KvResult<?>> future, String operation) {
        return future
                .exceptionally(e -> {
                    log.error("Raft {} failed unexpectedly: {}", operation, e.getMessage(), e);
                    return KvResult.failure(KvError.error(operation + " failed: " + e.getMessage()));
                })
                .join();
    }

    private <T> KvResult<T> withLeaderHint(KvResult<T> result) {
        return result.recover(KvStatus.NOT_LEADER, error -> {
            Optional<String> leaderId = error.leaderId();
            String leaderAddress = leaderId.flatMap(knownPeers::get)
                    .map(PeerAddress::address)
                    .orElse(null);
            return KvResult.failure(KvError.notLeader(leaderId.orElse(null), leaderAddress));
        });
    }

    private static List<MemberView> members(ClusterConfiguration configuration) {
        return configuration.members().stream()
                .map(KvService::toView)
                .toList();
    }

    private static MemberView toView(ClusterMember member) {
        return new MemberView(member.id(), member.address(), member.suffrage().name());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
