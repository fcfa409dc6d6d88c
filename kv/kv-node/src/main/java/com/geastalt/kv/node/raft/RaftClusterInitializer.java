/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.raft;

import com.geastalt.kv.node.config.RaftConfig;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Settles the membership phase on startup and starts elections.
 * The designated node bootstraps a one-member group; every other node waits
 * for a leader to add it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RaftClusterInitializer {

    private final RaftConfig raftConfig;
    private final RaftNode raftNode;
    private final List<LeadershipListener> leadershipListeners;

    @PostConstruct
    public void initializeCluster() {
        leadershipListeners.forEach(raftNode::addLeadershipListener);

        if (raftNode.getMembershipPhase() == MembershipPhase.MEMBER) {
            log.info("Node {} restarted as a member of a {}-member group",
                    raftNode.getNodeId(), raftNode.getConfiguration().size());
        } else if (raftConfig.isBootstrap()) {
            var result = raftNode.bootstrap();
            if (result.isSuccess()) {
                log.info("Bootstrapped group with configuration {}", result.getValue());
            } else {
                log.warn("Bootstrap skipped: {}", result.getError().message());
            }
        } else {
            log.info("Node {} not designated to bootstrap - waiting to be joined", raftNode.getNodeId());
            raftNode.awaitJoin();
        }

        raftNode.startElectionProcess();
    }
}
