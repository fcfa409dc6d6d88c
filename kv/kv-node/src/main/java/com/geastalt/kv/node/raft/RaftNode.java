/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.raft;

import com.geastalt.kv.model.KvError;
import com.geastalt.kv.model.KvResult;
import com.geastalt.kv.node.config.RaftConfig;
import com.geastalt.kv.node.raft.storage.PersistentMeta;
import com.geastalt.kv.node.raft.storage.RaftStorage;
import com.geastalt.kv.node.raft.storage.Snapshot;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Raft consensus node implementation.
 * Handles leader election, log replication, membership changes, snapshots and
 * state machine application. All state transitions happen under a single lock;
 * peer RPCs run outside it on a separate pool.
 */
@Slf4j
@Component
public class RaftNode {

    private final RaftConfig config;
    private final RaftLog raftLog;
    private final RaftStateMachine stateMachine;
    private final RaftStorage storage;
    private final RaftPeerFactory peerFactory;
    private final String nodeId;

    // Persistent state
    private final AtomicLong currentTerm = new AtomicLong(0);
    private final AtomicReference<String> votedFor = new AtomicReference<>(null);

    // Volatile state
    private volatile RaftState state = RaftState.FOLLOWER;
    private volatile String leaderId = null;
    private volatile long commitIndex = 0;
    private volatile long lastLeaderContactNanos = 0;
    private volatile MembershipPhase membershipPhase = MembershipPhase.UNBOOTSTRAPPED;

    // Latest configuration in the log, committed or not
    private volatile ClusterConfiguration configuration = ClusterConfiguration.EMPTY;
    private volatile long configurationIndex = 0;

    // Replication progress per member, maintained on every node for elections
    private final Map<String, PeerProgress> peers = new ConcurrentHashMap<>();

    // Pending operations waiting for commit, keyed by log index
    private final Map<Long, PendingOperation> pendingOperations = new ConcurrentHashMap<>();
    private final List<LeadershipListener> leadershipListeners = new CopyOnWriteArrayList<>();

    // Thread management
    private ScheduledThreadPoolExecutor scheduler;
    private ExecutorService rpcExecutor;
    private ExecutorService eventExecutor;
    private ScheduledFuture<?> electionTimer;
    private ScheduledFuture<?> heartbeatTimer;
    private final ReentrantLock stateLock = new ReentrantLock();
    private volatile boolean stopped = false;

    public RaftNode(RaftConfig config, RaftLog raftLog, RaftStateMachine stateMachine,
                    RaftStorage storage, RaftPeerFactory peerFactory) {
        this.config = config;
        this.raftLog = raftLog;
        this.stateMachine = stateMachine;
        this.storage = storage;
        this.peerFactory = peerFactory;
        this.nodeId = config.getNodeId();
    }

    @PostConstruct
    public void init() {
        scheduler = new ScheduledThreadPoolExecutor(2, threadFactory("raft-timer-"));
        scheduler.setRemoveOnCancelPolicy(true);
        rpcExecutor = Executors.newCachedThreadPool(threadFactory("raft-rpc-"));
        eventExecutor = Executors.newSingleThreadExecutor(threadFactory("raft-events-"));
        restoreState();
        log.info("Raft node {} initialized as FOLLOWER at term {} (waiting for cluster setup)",
                nodeId, currentTerm.get());
    }

    private static CustomizableThreadFactory threadFactory(String prefix) {
        var factory = new CustomizableThreadFactory(prefix);
        factory.setDaemon(true);
        return factory;
    }

    private void restoreState() {
        stateLock.lock();
        try {
            var meta = storage.loadMeta();
            currentTerm.set(meta.currentTerm());
            votedFor.set(meta.votedFor().orElse(null));

            raftLog.restore();
            raftLog.getSnapshot().ifPresent(snapshot -> {
                stateMachine.restore(snapshot.data(), snapshot.lastIndex());
                commitIndex = snapshot.lastIndex();
            });
            refreshConfiguration();
            if (configuration.contains(nodeId)) {
                membershipPhase = MembershipPhase.MEMBER;
            }
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Creates a one-member group containing only this node. Refused when the node
     * already has Raft state, so a restarted node never bootstraps twice.
     */
    public KvResult<ClusterConfiguration> bootstrap() {
        stateLock.lock();
        try {
            if (currentTerm.get() > 0 || !raftLog.isEmpty()) {
                return KvResult.failure(KvError.membership(
                        "Node " + nodeId + " already has Raft state; refusing to bootstrap"));
            }

            var initial = ClusterConfiguration.of(ClusterMember.voter(nodeId, config.getAdvertiseAddress()));
            currentTerm.set(1);
            persistMeta();
            raftLog.append(LogEntry.configuration(1, 1, initial));
            refreshConfiguration();
            membershipPhase = MembershipPhase.BOOTSTRAPPED;
            log.info("Raft node {} bootstrapped a single-member group at {}", nodeId, config.getAdvertiseAddress());
            return KvResult.success(initial);
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Marks a node without configuration as waiting for a leader to add it.
     */
    public void awaitJoin() {
        stateLock.lock();
        try {
            if (membershipPhase == MembershipPhase.UNBOOTSTRAPPED && configuration.isEmpty()) {
                membershipPhase = MembershipPhase.AWAITING_JOIN;
                log.info("Raft node {} awaiting join by a leader", nodeId);
            }
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Starts the Raft election process.
     * Called by RaftClusterInitializer after the membership phase is settled.
     */
    public void startElectionProcess() {
        stateLock.lock();
        try {
            resetElectionTimer();
        } finally {
            stateLock.unlock();
        }
        log.info("Raft node {} election process started with {} peer(s)", nodeId, peers.size());
    }

    @PreDestroy
    public void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        stateLock.lock();
        try {
            cancelTimers();
            failPendingOperations();
        } finally {
            stateLock.unlock();
        }
        shutdown(scheduler);
        shutdown(rpcExecutor);
        shutdown(eventExecutor);
        peers.values().forEach(progress -> closePeer(progress.peer));
        peers.clear();
        log.info("Raft node {} stopped", nodeId);
    }

    private void shutdown(ExecutorService executor) {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public void addLeadershipListener(LeadershipListener listener) {
        leadershipListeners.add(listener);
    }

    /**
     * Submits a key-value command to the Raft log.
     * Returns a future that completes when the command is committed and applied, with
     * NOT_LEADER when this node is not the leader, or with TIMEOUT when the outcome is unknown.
     */
    public CompletableFuture<KvResult<?>> apply(KvCommand command, long timeoutMs) {
        return submit(
                (index, term) -> LogEntry.command(index, term, command),
                command.operation().name(),
                timeoutMs);
    }

    /**
     * Adds a voting member through a committed configuration entry.
     * Adding an identical (id, address) pair again succeeds without a new entry.
     */
    public CompletableFuture<KvResult<?>> addVoter(String memberId, String address, long timeoutMs) {
        stateLock.lock();
        try {
            if (state != RaftState.LEADER) {
                return CompletableFuture.completedFuture(KvResult.failure(notLeaderError()));
            }
            var existing = configuration.find(memberId);
            if (existing.isPresent()) {
                if (existing.get().address().equals(address)) {
                    log.debug("Member {} at {} already present, join is a no-op", memberId, address);
                    return CompletableFuture.completedFuture(KvResult.success(configuration));
                }
                return CompletableFuture.completedFuture(KvResult.failure(KvError.membership(
                        "Member " + memberId + " already exists with address " + existing.get().address())));
            }
            var byAddress = configuration.findByAddress(address);
            if (byAddress.isPresent()) {
                return CompletableFuture.completedFuture(KvResult.failure(KvError.membership(
                        "Address " + address + " is already used by member " + byAddress.get().id())));
            }
            if (configurationIndex > commitIndex) {
                return CompletableFuture.completedFuture(KvResult.failure(changeInProgress()));
            }

            var updated = configuration.withMember(ClusterMember.voter(memberId, address));
            log.info("Adding voter {} at {}", memberId, address);
            return submit((index, term) -> LogEntry.configuration(index, term, updated), "join", timeoutMs);
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Removes a member through a committed configuration entry.
     */
    public CompletableFuture<KvResult<?>> removeServer(String memberId, long timeoutMs) {
        stateLock.lock();
        try {
            if (state != RaftState.LEADER) {
                return CompletableFuture.completedFuture(KvResult.failure(notLeaderError()));
            }
            if (!configuration.contains(memberId)) {
                return CompletableFuture.completedFuture(KvResult.failure(KvError.membership(
                        "Member " + memberId + " is not in the configuration")));
            }
            if (configuration.size() == 1) {
                return CompletableFuture.completedFuture(KvResult.failure(KvError.membership(
                        "Cannot remove the last member of the group")));
            }
            if (configurationIndex > commitIndex) {
                return CompletableFuture.completedFuture(KvResult.failure(changeInProgress()));
            }

            var updated = configuration.without(memberId);
            log.info("Removing member {}", memberId);
            return submit((index, term) -> LogEntry.configuration(index, term, updated), "leave", timeoutMs);
        } finally {
            stateLock.unlock();
        }
    }

    private CompletableFuture<KvResult<?>> submit(EntryFactory entryFactory, String operation, long timeoutMs) {
        stateLock.lock();
        try {
            if (state != RaftState.LEADER) {
                return CompletableFuture.completedFuture(KvResult.failure(notLeaderError()));
            }

            long term = currentTerm.get();
            long index = raftLog.getLastIndex() + 1;
            var entry = entryFactory.create(index, term);

            raftLog.append(entry);
            log.debug("Leader appended {} at index {} term {}", entry.type(), index, term);

            var future = new CompletableFuture<KvResult<?>>();
            pendingOperations.put(index, new PendingOperation(term, future));
            future.whenComplete((result, error) -> pendingOperations.remove(index));

            if (entry.type() == LogEntryType.CONFIGURATION) {
                refreshConfiguration();
            }

            // Trigger immediate replication
            replicateToFollowers();

            return future.completeOnTimeout(
                    KvResult.failure(KvError.timeout(operation)), timeoutMs, TimeUnit.MILLISECONDS);
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Handles a vote request from a candidate.
     */
    public VoteResponse handleVoteRequest(VoteRequest request) {
        stateLock.lock();
        try {
            long term = currentTerm.get();

            // Deny if term is old
            if (request.term() < term) {
                return new VoteResponse(term, false, nodeId);
            }

            // Leader stickiness: ignore candidates while a live leader is known
            if (hasActiveLeader() && !request.candidateId().equals(leaderId)) {
                log.debug("Rejecting vote for {} in term {}: leader {} is active",
                        request.candidateId(), request.term(), leaderId);
                return new VoteResponse(term, false, nodeId);
            }

            // If request term is higher, step down
            if (request.term() > term) {
                stepDown(request.term());
                term = request.term();
            }

            // Check if we can vote for this candidate
            String voted = votedFor.get();
            boolean canVote = (voted == null || voted.equals(request.candidateId()));

            // Check if candidate's log is at least as up-to-date
            boolean logOk = request.lastLogTerm() > raftLog.getLastTerm() ||
                    (request.lastLogTerm() == raftLog.getLastTerm() &&
                            request.lastLogIndex() >= raftLog.getLastIndex());

            if (canVote && logOk) {
                votedFor.set(request.candidateId());
                persistMeta();
                resetElectionTimer();
                log.info("Voting for {} in term {}", request.candidateId(), term);
                return new VoteResponse(term, true, nodeId);
            }

            return new VoteResponse(term, false, nodeId);
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Handles an append entries request from leader.
     */
    public AppendEntriesResponse handleAppendEntries(AppendEntriesRequest request) {
        stateLock.lock();
        try {
            long term = currentTerm.get();

            // Deny if term is old
            if (request.term() < term) {
                return new AppendEntriesResponse(term, false, raftLog.getLastIndex(), nodeId);
            }

            if (request.term() > term || state != RaftState.FOLLOWER) {
                stepDown(request.term());
                term = request.term();
            }

            // Valid leader, reset election timer
            acceptLeader(request.leaderId());

            // Check log consistency; matchIndex carries a hint for the leader's next probe
            long lastIndex = raftLog.getLastIndex();
            if (request.prevLogIndex() > lastIndex) {
                return new AppendEntriesResponse(term, false, lastIndex, nodeId);
            }
            if (!raftLog.containsEntry(request.prevLogIndex(), request.prevLogTerm())) {
                log.debug("Log inconsistency at index {}", request.prevLogIndex());
                return new AppendEntriesResponse(term, false,
                        Math.min(request.prevLogIndex() - 1, lastIndex), nodeId);
            }

            boolean configurationTouched = false;
            List<LogEntry> toAppend = new ArrayList<>();
            for (var entry : request.entries()) {
                if (entry.index() <= raftLog.getSnapshotIndex()) {
                    continue;
                }
                if (toAppend.isEmpty()) {
                    var existing = raftLog.get(entry.index());
                    if (existing.isPresent()) {
                        if (existing.get().term() == entry.term()) {
                            continue;
                        }
                        // Remove conflicting entries
                        raftLog.truncateFrom(entry.index());
                        configurationTouched = true;
                    }
                }
                toAppend.add(entry);
                configurationTouched |= entry.type() == LogEntryType.CONFIGURATION;
            }
            raftLog.appendAll(toAppend);
            if (configurationTouched) {
                refreshConfiguration();
            }

            // Update commit index
            long lastNewIndex = request.prevLogIndex() + request.entries().size();
            long newCommit = Math.min(request.leaderCommit(), lastNewIndex);
            if (newCommit > commitIndex) {
                commitIndex = newCommit;
                applyCommittedEntries();
            }

            return new AppendEntriesResponse(term, true, lastNewIndex, nodeId);
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Handles a snapshot sent by a leader to a follower that fell behind the compacted log.
     */
    public InstallSnapshotResponse handleInstallSnapshot(InstallSnapshotRequest request) {
        stateLock.lock();
        try {
            long term = currentTerm.get();
            if (request.term() < term) {
                return new InstallSnapshotResponse(term, nodeId);
            }
            if (request.term() > term || state != RaftState.FOLLOWER) {
                stepDown(request.term());
                term = request.term();
            }
            acceptLeader(request.leaderId());

            if (request.lastIncludedIndex() <= stateMachine.getLastAppliedIndex()) {
                log.debug("Ignoring snapshot through {}, already applied {}",
                        request.lastIncludedIndex(), stateMachine.getLastAppliedIndex());
                return new InstallSnapshotResponse(term, nodeId);
            }

            var snapshot = new Snapshot(request.lastIncludedIndex(), request.lastIncludedTerm(),
                    request.configuration(), request.data());
            raftLog.installSnapshot(snapshot);
            stateMachine.restore(snapshot.data(), snapshot.lastIndex());
            commitIndex = Math.max(commitIndex, snapshot.lastIndex());
            refreshConfiguration();
            log.info("Installed snapshot from leader {} through index {}", request.leaderId(), snapshot.lastIndex());
            return new InstallSnapshotResponse(term, nodeId);
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Compacts the log up to the last applied entry.
     */
    public void takeSnapshot() {
        stateLock.lock();
        try {
            long applied = stateMachine.getLastAppliedIndex();
            if (applied <= raftLog.getSnapshotIndex()) {
                return;
            }
            var snapshot = new Snapshot(
                    applied,
                    raftLog.getTermAt(applied),
                    raftLog.configurationAt(applied).configuration(),
                    stateMachine.snapshot());
            raftLog.compact(snapshot);
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Checks if this node is the leader.
     */
    public boolean isLeader() {
        return state == RaftState.LEADER;
    }

    /**
     * Gets the current leader ID.
     */
    public Optional<String> getLeaderId() {
        return Optional.ofNullable(leaderId);
    }

    public String getNodeId() {
        return nodeId;
    }

    /**
     * Gets the current state.
     */
    public RaftState getState() {
        return state;
    }

    /**
     * Gets the current term.
     */
    public long getCurrentTerm() {
        return currentTerm.get();
    }

    public long getCommitIndex() {
        return commitIndex;
    }

    public ClusterConfiguration getConfiguration() {
        return configuration;
    }

    public MembershipPhase getMembershipPhase() {
        return membershipPhase;
    }

    public RaftStatus getStatus() {
        stateLock.lock();
        try {
            return new RaftStatus(
                    nodeId,
                    state,
                    currentTerm.get(),
                    leaderId,
                    configuration,
                    commitIndex,
                    stateMachine.getLastAppliedIndex(),
                    raftLog.getLastIndex(),
                    raftLog.getSnapshotIndex(),
                    membershipPhase);
        } finally {
            stateLock.unlock();
        }
    }

    private void acceptLeader(String newLeaderId) {
        if (!newLeaderId.equals(leaderId)) {
            log.info("Following leader {} in term {}", newLeaderId, currentTerm.get());
        }
        leaderId = newLeaderId;
        lastLeaderContactNanos = System.nanoTime();
        resetElectionTimer();
    }

    private boolean hasActiveLeader() {
        if (state == RaftState.LEADER) {
            return true;
        }
        long contact = lastLeaderContactNanos;
        return leaderId != null && contact != 0
                && System.nanoTime() - contact < TimeUnit.MILLISECONDS.toNanos(config.getElectionTimeoutMs());
    }

    private void resetElectionTimer() {
        if (scheduler == null || stopped) {
            return;
        }
        if (electionTimer != null) {
            electionTimer.cancel(false);
        }

        long timeout = config.getElectionTimeoutMs() +
                ThreadLocalRandom.current().nextLong(config.getElectionTimeoutMs());

        electionTimer = scheduler.schedule(
                this::startElection,
                timeout,
                TimeUnit.MILLISECONDS
        );
    }

    private void startElection() {
        stateLock.lock();
        try {
            if (state == RaftState.LEADER || stopped) {
                return;
            }
            if (!configuration.isVoter(nodeId)) {
                // Not (yet) a voter: never campaign
                resetElectionTimer();
                return;
            }

            state = RaftState.CANDIDATE;
            long term = currentTerm.incrementAndGet();
            votedFor.set(nodeId);
            leaderId = null;
            persistMeta();

            log.info("Starting election for term {}", term);

            // Count votes (including self-vote)
            int votesNeeded = configuration.getQuorumSize();
            var votesReceived = new AtomicInteger(1);

            // Check if self-vote is sufficient (single node cluster)
            if (votesReceived.get() >= votesNeeded) {
                becomeLeader();
                return;
            }

            var request = new VoteRequest(
                    term,
                    nodeId,
                    raftLog.getLastIndex(),
                    raftLog.getLastTerm()
            );

            for (var voter : configuration.getVoters()) {
                var progress = peers.get(voter.id());
                if (progress == null) {
                    continue;
                }
                submitRpc(() -> {
                    try {
                        var response = progress.peer.requestVote(request);
                        handleVoteResponse(response, term, votesReceived, votesNeeded);
                    } catch (RuntimeException e) {
                        log.warn("Failed to request vote from {}: {}", voter.id(), e.getMessage());
                    }
                });
            }

            // Set election timeout for next round
            resetElectionTimer();
        } finally {
            stateLock.unlock();
        }
    }

    private void handleVoteResponse(VoteResponse response, long electionTerm,
                                    AtomicInteger votesReceived, int votesNeeded) {
        stateLock.lock();
        try {
            // Step down if higher term discovered
            if (response.term() > currentTerm.get()) {
                stepDown(response.term());
                return;
            }

            // Ignore stale responses
            if (currentTerm.get() != electionTerm || state != RaftState.CANDIDATE) {
                return;
            }

            if (response.voteGranted()) {
                int votes = votesReceived.incrementAndGet();
                log.debug("Received vote from {}, total: {}/{}", response.voterId(), votes, votesNeeded);

                if (votes >= votesNeeded) {
                    becomeLeader();
                }
            }
        } finally {
            stateLock.unlock();
        }
    }

    private void becomeLeader() {
        state = RaftState.LEADER;
        leaderId = nodeId;

        log.info("Node {} became leader for term {}", nodeId, currentTerm.get());

        // Initialize leader state
        long lastIndex = raftLog.getLastIndex();
        for (var progress : peers.values()) {
            progress.nextIndex = lastIndex + 1;
            progress.matchIndex = 0;
        }

        // Append no-op entry to commit previous term's entries
        raftLog.append(LogEntry.noop(lastIndex + 1, currentTerm.get()));

        if (electionTimer != null) {
            electionTimer.cancel(false);
        }
        if (heartbeatTimer != null) {
            heartbeatTimer.cancel(false);
        }
        heartbeatTimer = scheduler.scheduleAtFixedRate(
                this::replicateToFollowers,
                0,
                config.getHeartbeatIntervalMs(),
                TimeUnit.MILLISECONDS
        );

        fireLeadershipEvent(true);
    }

    private void stepDown(long newTerm) {
        boolean wasLeader = state == RaftState.LEADER;
        if (newTerm > currentTerm.get()) {
            currentTerm.set(newTerm);
            votedFor.set(null);
            leaderId = null;
            persistMeta();
        }
        state = RaftState.FOLLOWER;

        if (heartbeatTimer != null) {
            heartbeatTimer.cancel(false);
            heartbeatTimer = null;
        }

        if (wasLeader) {
            leaderId = null;
            failPendingOperations();
            fireLeadershipEvent(false);
            log.info("Stepped down to follower, term {}", currentTerm.get());
        }
        resetElectionTimer();
    }

    private void replicateToFollowers() {
        if (state != RaftState.LEADER || stopped) {
            return;
        }
        for (var progress : peers.values()) {
            replicateTo(progress);
        }

        // Commit may advance without peers when this node is the only voter
        stateLock.lock();
        try {
            if (state == RaftState.LEADER) {
                updateCommitIndex();
            }
        } finally {
            stateLock.unlock();
        }
    }

    private void replicateTo(PeerProgress progress) {
        // At most one replication call in flight per peer
        if (!progress.inFlight.compareAndSet(false, true)) {
            return;
        }
        boolean submitted = submitRpc(() -> {
            boolean more = false;
            try {
                more = replicateToPeer(progress);
            } catch (RuntimeException e) {
                log.warn("Failed to replicate to {}: {}", progress.peer.nodeId(), e.getMessage());
            } finally {
                progress.inFlight.set(false);
            }
            if (more && state == RaftState.LEADER && peers.get(progress.peer.nodeId()) == progress) {
                replicateTo(progress);
            }
        });
        if (!submitted) {
            progress.inFlight.set(false);
        }
    }

    /**
     * Sends one AppendEntries or InstallSnapshot call to a peer.
     *
     * @return whether the peer still has entries to receive
     */
    private boolean replicateToPeer(PeerProgress progress) {
        long term;
        AppendEntriesRequest appendRequest = null;
        InstallSnapshotRequest snapshotRequest = null;

        stateLock.lock();
        try {
            if (state != RaftState.LEADER) {
                return false;
            }
            term = currentTerm.get();
            long next = progress.nextIndex;
            var snapshot = raftLog.getSnapshot();
            if (snapshot.isPresent() && next <= snapshot.get().lastIndex()) {
                var s = snapshot.get();
                snapshotRequest = new InstallSnapshotRequest(term, nodeId, s.lastIndex(), s.lastTerm(),
                        s.configuration(), s.data());
            } else {
                long prevIndex = next - 1;
                appendRequest = new AppendEntriesRequest(
                        term,
                        nodeId,
                        prevIndex,
                        raftLog.getTermAt(prevIndex),
                        raftLog.getFrom(next, config.getMaxEntriesPerAppend()),
                        commitIndex
                );
            }
        } finally {
            stateLock.unlock();
        }

        if (snapshotRequest != null) {
            log.info("Sending snapshot through index {} to {}", snapshotRequest.lastIncludedIndex(), progress.peer.nodeId());
            var response = progress.peer.installSnapshot(snapshotRequest);
            stateLock.lock();
            try {
                if (response.term() > currentTerm.get()) {
                    stepDown(response.term());
                    return false;
                }
                if (currentTerm.get() != term || state != RaftState.LEADER) {
                    return false;
                }
                progress.matchIndex = Math.max(progress.matchIndex, snapshotRequest.lastIncludedIndex());
                progress.nextIndex = progress.matchIndex + 1;
                updateCommitIndex();
                return progress.nextIndex <= raftLog.getLastIndex();
            } finally {
                stateLock.unlock();
            }
        }

        var response = progress.peer.appendEntries(appendRequest);

        stateLock.lock();
        try {
            if (response.term() > currentTerm.get()) {
                stepDown(response.term());
                return false;
            }
            if (currentTerm.get() != term || state != RaftState.LEADER) {
                return false;
            }

            if (response.success()) {
                progress.matchIndex = Math.max(progress.matchIndex, response.matchIndex());
                progress.nextIndex = progress.matchIndex + 1;

                // Check if we can advance commit index
                updateCommitIndex();
                return progress.nextIndex <= raftLog.getLastIndex();
            }

            // Back off next index, using the follower's hint when it is lower
            progress.nextIndex = Math.max(1, Math.min(progress.nextIndex - 1, response.matchIndex() + 1));
            return true;
        } finally {
            stateLock.unlock();
        }
    }

    private void updateCommitIndex() {
        var voters = configuration.getVoters();
        if (voters.isEmpty()) {
            return;
        }

        // Find the highest index replicated to a majority of voters
        List<Long> matched = new ArrayList<>();
        for (var voter : voters) {
            if (voter.id().equals(nodeId)) {
                matched.add(raftLog.getLastIndex());
            } else {
                var progress = peers.get(voter.id());
                matched.add(progress == null ? 0L : progress.matchIndex);
            }
        }
        matched.sort(Comparator.reverseOrder());
        long newCommitIndex = matched.get(configuration.getQuorumSize() - 1);

        // Only commit entries from current term
        if (newCommitIndex > commitIndex &&
                raftLog.getTermAt(newCommitIndex) == currentTerm.get()) {
            commitIndex = newCommitIndex;
            applyCommittedEntries();
        }
    }

    private void applyCommittedEntries() {
        boolean removedSelf = false;

        while (stateMachine.getLastAppliedIndex() < commitIndex) {
            long index = stateMachine.getLastAppliedIndex() + 1;
            var entry = raftLog.get(index);
            if (entry.isEmpty()) {
                log.error("Committed entry {} is missing from the log", index);
                break;
            }

            var result = stateMachine.apply(entry.get());

            if (entry.get().type() == LogEntryType.CONFIGURATION
                    && index == configurationIndex
                    && state == RaftState.LEADER
                    && !configuration.contains(nodeId)) {
                removedSelf = true;
            }

            var pending = pendingOperations.remove(index);
            if (pending != null) {
                if (pending.term == entry.get().term()) {
                    pending.future.complete(result);
                } else {
                    pending.future.complete(KvResult.failure(KvError.leadershipLost(index)));
                }
            }
        }

        if (removedSelf) {
            log.info("Node {} removed from the configuration, stepping down", nodeId);
            stepDown(currentTerm.get());
        }

        long threshold = config.getSnapshotThreshold();
        if (threshold > 0 && stateMachine.getLastAppliedIndex() - raftLog.getSnapshotIndex() >= threshold) {
            takeSnapshot();
        }
    }

    private void refreshConfiguration() {
        var latest = raftLog.latestConfiguration();
        boolean changed = !latest.configuration().equals(configuration);
        configuration = latest.configuration();
        configurationIndex = latest.index();
        if (changed) {
            log.info("Configuration at index {}: {}", configurationIndex, configuration.members());
        }

        syncPeers();
        updateMembershipPhase();
    }

    private void syncPeers() {
        for (var member : configuration.members()) {
            if (member.id().equals(nodeId) || peers.containsKey(member.id())) {
                continue;
            }
            var progress = new PeerProgress(peerFactory.create(member.id(), member.address()));
            progress.nextIndex = raftLog.getLastIndex() + 1;
            peers.put(member.id(), progress);
            log.info("Added Raft peer: {} at {}", member.id(), member.address());
        }

        for (var id : List.copyOf(peers.keySet())) {
            if (!configuration.contains(id)) {
                var removed = peers.remove(id);
                closePeer(removed.peer);
                log.info("Removed Raft peer: {}", id);
            }
        }
    }

    private void updateMembershipPhase() {
        if (configuration.isEmpty()) {
            return;
        }
        if (configuration.contains(nodeId)) {
            if (membershipPhase == MembershipPhase.BOOTSTRAPPED && configuration.size() == 1) {
                return;
            }
            if (membershipPhase != MembershipPhase.MEMBER) {
                log.info("Node {} is now a member of a {}-node group", nodeId, configuration.size());
            }
            membershipPhase = MembershipPhase.MEMBER;
        } else if (membershipPhase == MembershipPhase.MEMBER || membershipPhase == MembershipPhase.BOOTSTRAPPED) {
            log.warn("Node {} is no longer in the configuration", nodeId);
            membershipPhase = MembershipPhase.REMOVED;
        }
    }

    private void failPendingOperations() {
        for (var entry : pendingOperations.entrySet()) {
            entry.getValue().future.complete(KvResult.failure(KvError.leadershipLost(entry.getKey())));
        }
        pendingOperations.clear();
    }

    private void fireLeadershipEvent(boolean leader) {
        var event = new LeadershipEvent(nodeId, currentTerm.get(), leader);
        try {
            eventExecutor.execute(() -> {
                for (var listener : leadershipListeners) {
                    try {
                        listener.onLeadershipChange(event);
                    } catch (RuntimeException e) {
                        log.warn("Leadership listener failed for {}: {}", event, e.getMessage(), e);
                    }
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Leadership event {} dropped during shutdown", event);
        }
    }

    private boolean submitRpc(Runnable task) {
        try {
            rpcExecutor.execute(task);
            return true;
        } catch (RejectedExecutionException e) {
            log.debug("Raft RPC rejected, node is stopping");
            return false;
        }
    }

    private void cancelTimers() {
        if (electionTimer != null) {
            electionTimer.cancel(false);
        }
        if (heartbeatTimer != null) {
            heartbeatTimer.cancel(false);
        }
    }

    private void closePeer(RaftPeer peer) {
        try {
            peer.close();
        } catch (RuntimeException e) {
            log.warn("Error closing peer client {}: {}", peer.nodeId(), e.getMessage());
        }
    }

    private void persistMeta() {
        storage.saveMeta(new PersistentMeta(currentTerm.get(), Optional.ofNullable(votedFor.get())));
    }

    private KvError notLeaderError() {
        return KvError.notLeader(leaderId, null);
    }

    private static KvError changeInProgress() {
        return KvError.membership("Another configuration change is still being committed");
    }

    @FunctionalInterface
    private interface EntryFactory {
        LogEntry create(long index, long term);
    }

    private static final class PeerProgress {
        private final RaftPeer peer;
        private final AtomicBoolean inFlight = new AtomicBoolean(false);
        private volatile long nextIndex = 1;
        private volatile long matchIndex = 0;

        private PeerProgress(RaftPeer peer) {
            this.peer = peer;
        }
    }

    private record PendingOperation(long term, CompletableFuture<KvResult<?>> future) {
    }

    // Record types for internal communication
    public record VoteRequest(long term, String candidateId, long lastLogIndex, long lastLogTerm) {}
    public record VoteResponse(long term, boolean voteGranted, String voterId) {}
    public record AppendEntriesRequest(long term, String leaderId, long prevLogIndex,
                                       long prevLogTerm, List<LogEntry> entries, long leaderCommit) {}
    public record AppendEntriesResponse(long term, boolean success, long matchIndex, String followerId) {}
    public record InstallSnapshotRequest(long term, String leaderId, long lastIncludedIndex, long lastIncludedTerm,
                                         ClusterConfiguration configuration, byte[] data) {}
    public record InstallSnapshotResponse(long term, String followerId) {}

    /**
     * Interface for communicating with Raft peers.
     */
    public interface RaftPeer extends AutoCloseable {
        String nodeId();
        VoteResponse requestVote(VoteRequest request);
        AppendEntriesResponse appendEntries(AppendEntriesRequest request);
        InstallSnapshotResponse installSnapshot(InstallSnapshotRequest request);

        @Override
        default void close() {
        }
    }
}
