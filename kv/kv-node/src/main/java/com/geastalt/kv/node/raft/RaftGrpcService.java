/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.raft;

import com.geastalt.kv.node.raft.generated.AppendEntriesRequest;
import com.geastalt.kv.node.raft.generated.AppendEntriesResponse;
import com.geastalt.kv.node.raft.generated.InstallSnapshotRequest;
import com.geastalt.kv.node.raft.generated.InstallSnapshotResponse;
import com.geastalt.kv.node.raft.generated.RaftServiceGrpc;
import com.geastalt.kv.node.raft.generated.VoteRequest;
import com.geastalt.kv.node.raft.generated.VoteResponse;
import com.geastalt.kv.node.raft.storage.StorageException;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.devh.boot.grpc.server.service.GrpcService;

import java.util.List;

/**
 * gRPC service for handling Raft consensus RPCs from peer nodes.
 */
@Slf4j
@GrpcService
@RequiredArgsConstructor
public class RaftGrpcService extends RaftServiceGrpc.RaftServiceImplBase {

    private final RaftNode raftNode;

    @Override
    public void requestVote(VoteRequest request, StreamObserver<VoteResponse> responseObserver) {
        log.debug("Received vote request from {} for term {}", request.getCandidateId(), request.getTerm());

        var internalRequest = new RaftNode.VoteRequest(
                request.getTerm(),
                request.getCandidateId(),
                request.getLastLogIndex(),
                request.getLastLogTerm()
        );

        try {
            var internalResponse = raftNode.handleVoteRequest(internalRequest);

            responseObserver.onNext(VoteResponse.newBuilder()
                    .setTerm(internalResponse.term())
                    .setVoteGranted(internalResponse.voteGranted())
                    .setVoterId(internalResponse.voterId())
                    .build());
            responseObserver.onCompleted();
        } catch (StorageException e) {
            fail(responseObserver, "vote request", e);
        }
    }

    @Override
    public void appendEntries(AppendEntriesRequest request, StreamObserver<AppendEntriesResponse> responseObserver) {
        log.debug("Received append entries from {} for term {}, {} entries",
                request.getLeaderId(), request.getTerm(), request.getEntriesCount());

        try {
            List<LogEntry> entries = request.getEntriesList().stream()
                    .map(RaftProtoMapper::fromProto)
                    .toList();

            var internalRequest = new RaftNode.AppendEntriesRequest(
                    request.getTerm(),
                    request.getLeaderId(),
                    request.getPrevLogIndex(),
                    request.getPrevLogTerm(),
                    entries,
                    request.getLeaderCommit()
            );

            var internalResponse = raftNode.handleAppendEntries(internalRequest);

            responseObserver.onNext(AppendEntriesResponse.newBuilder()
                    .setTerm(internalResponse.term())
                    .setSuccess(internalResponse.success())
                    .setMatchIndex(internalResponse.matchIndex())
                    .setFollowerId(internalResponse.followerId())
                    .build());
            responseObserver.onCompleted();
        } catch (StorageException | IllegalStateException e) {
            fail(responseObserver, "append entries", e);
        }
    }

    @Override
    public void installSnapshot(InstallSnapshotRequest request,
                                StreamObserver<InstallSnapshotResponse> responseObserver) {
        log.debug("Received snapshot from {} through index {}",
                request.getLeaderId(), request.getLastIncludedIndex());

        var internalRequest = new RaftNode.InstallSnapshotRequest(
                request.getTerm(),
                request.getLeaderId(),
                request.getLastIncludedIndex(),
                request.getLastIncludedTerm(),
                RaftProtoMapper.fromProto(request.getConfigurationList()),
                request.getData().toByteArray()
        );

        try {
            var internalResponse = raftNode.handleInstallSnapshot(internalRequest);

            responseObserver.onNext(InstallSnapshotResponse.newBuilder()
                    .setTerm(internalResponse.term())
                    .setFollowerId(internalResponse.followerId())
                    .build());
            responseObserver.onCompleted();
        } catch (StorageException | IllegalStateException e) {
            fail(responseObserver, "install snapshot", e);
        }
    }

    private void fail(StreamObserver<?> responseObserver, String operation, RuntimeException e) {
        log.error("Failed to handle {}: {}", operation, e.getMessage(), e);
        responseObserver.onError(Status.INTERNAL
                .withDescription(operation + " failed: " + e.getMessage())
                .asRuntimeException());
    }
}
