/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.raft;

import com.geastalt.kv.node.raft.generated.AppendEntriesRequest;
import com.geastalt.kv.node.raft.generated.InstallSnapshotRequest;
import com.geastalt.kv.node.raft.generated.RaftServiceGrpc;
import com.geastalt.kv.node.raft.generated.VoteRequest;
import com.google.protobuf.ByteString;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.StatusRuntimeException;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.TimeUnit;

/**
 * gRPC client implementation of RaftPeer for communicating with peer nodes.
 */
@Slf4j
public class RaftPeerClient implements RaftNode.RaftPeer {

    private final String nodeId;
    private final String address;
    private final ManagedChannel channel;
    private final long rpcTimeoutMs;

    public RaftPeerClient(String nodeId, String address, long rpcTimeoutMs) {
        this(nodeId, address, ManagedChannelBuilder.forTarget(address)
                .usePlaintext()
                .keepAliveTime(30, TimeUnit.SECONDS)
                .keepAliveTimeout(10, TimeUnit.SECONDS)
                .build(), rpcTimeoutMs);
        log.info("Creating Raft peer client for {} at {}", nodeId, address);
    }

    RaftPeerClient(String nodeId, String address, ManagedChannel channel, long rpcTimeoutMs) {
        this.nodeId = nodeId;
        this.address = address;
        this.channel = channel;
        this.rpcTimeoutMs = rpcTimeoutMs;
    }

    @Override
    public String nodeId() {
        return nodeId;
    }

    @Override
    public RaftNode.VoteResponse requestVote(RaftNode.VoteRequest request) {
        try {
            var protoRequest = VoteRequest.newBuilder()
                    .setTerm(request.term())
                    .setCandidateId(request.candidateId())
                    .setLastLogIndex(request.lastLogIndex())
                    .setLastLogTerm(request.lastLogTerm())
                    .build();

            var response = stub().requestVote(protoRequest);

            return new RaftNode.VoteResponse(
                    response.getTerm(),
                    response.getVoteGranted(),
                    response.getVoterId()
            );
        } catch (StatusRuntimeException e) {
            throw new RaftRpcException("Vote request to " + nodeId + " failed: " + e.getStatus(), e);
        }
    }

    @Override
    public RaftNode.AppendEntriesResponse appendEntries(RaftNode.AppendEntriesRequest request) {
        try {
            var protoRequest = AppendEntriesRequest.newBuilder()
                    .setTerm(request.term())
                    .setLeaderId(request.leaderId())
                    .setPrevLogIndex(request.prevLogIndex())
                    .setPrevLogTerm(request.prevLogTerm())
                    .setLeaderCommit(request.leaderCommit())
                    .addAllEntries(request.entries().stream().map(RaftProtoMapper::toProto).toList())
                    .build();

            var response = stub().appendEntries(protoRequest);

            return new RaftNode.AppendEntriesResponse(
                    response.getTerm(),
                    response.getSuccess(),
                    response.getMatchIndex(),
                    response.getFollowerId()
            );
        } catch (StatusRuntimeException e) {
            throw new RaftRpcException("Append entries to " + nodeId + " failed: " + e.getStatus(), e);
        }
    }

    @Override
    public RaftNode.InstallSnapshotResponse installSnapshot(RaftNode.InstallSnapshotRequest request) {
        try {
            var protoRequest = InstallSnapshotRequest.newBuilder()
                    .setTerm(request.term())
                    .setLeaderId(request.leaderId())
                    .setLastIncludedIndex(request.lastIncludedIndex())
                    .setLastIncludedTerm(request.lastIncludedTerm())
                    .addAllConfiguration(RaftProtoMapper.toProto(request.configuration()))
                    .setData(ByteString.copyFrom(request.data()))
                    .build();

            var response = stub().installSnapshot(protoRequest);

            return new RaftNode.InstallSnapshotResponse(response.getTerm(), response.getFollowerId());
        } catch (StatusRuntimeException e) {
            throw new RaftRpcException("Install snapshot on " + nodeId + " failed: " + e.getStatus(), e);
        }
    }

    private RaftServiceGrpc.RaftServiceBlockingStub stub() {
        // Apply fresh deadline for each request
        return RaftServiceGrpc.newBlockingStub(channel)
                .withDeadlineAfter(rpcTimeoutMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        log.info("Shutting down Raft peer client for {}", nodeId);
        try {
            channel.shutdown().awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            channel.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public String toString() {
        return "RaftPeerClient{nodeId='" + nodeId + "', address=" + address + "}";
    }
}
