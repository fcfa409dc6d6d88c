/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the Raft consensus participant hosted by this node.
 */
@Configuration
@ConfigurationProperties(prefix = "kv.raft")
@Getter
@Setter
public class RaftConfig {

    private String nodeId;

    /**
     * host:port at which peers reach this node's Raft gRPC service.
     */
    private String advertiseAddress;

    /**
     * Whether this node self-bootstraps a one-member group. Exactly one node of a
     * group may set it; every other node waits to be joined.
     */
    private boolean bootstrap = false;

    private long electionTimeoutMs = 300;
    private long heartbeatIntervalMs = 75;
    private long applyTimeoutMs = 500;
    private long rpcTimeoutMs = 1000;
    private int maxEntriesPerAppend = 256;

    /**
     * Applied entries between snapshots.
     */
    private long snapshotThreshold = 1024;

    /**
     * Directory for the WAL, metadata and snapshots. Empty keeps Raft state in memory.
     */
    private String dataDir = "";

    /**
     * Number of write request ids remembered for de-duplication.
     */
    private int dedupWindow = 1000;
}
