/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Main application class for a replicated key-value node.
 *
 * <p>Each node hosts one Raft participant and the key-value state machine it drives:
 * <ul>
 *   <li>Raft consensus over gRPC for leader election and log replication</li>
 *   <li>An HTTP API for reads, writes, membership changes and status</li>
 *   <li>Leader announcements pushed to known peers on every leadership change</li>
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties
public class KvNodeApplication {

    public static void main(String[] args) {
        SpringApplication.run(KvNodeApplication.class, args);
    }
}
