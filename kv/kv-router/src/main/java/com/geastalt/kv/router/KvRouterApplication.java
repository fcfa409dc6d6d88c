/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.router;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Router in front of the key-value nodes.
 *
 * <p>Provides:
 * <ul>
 *   <li>Leader discovery by polling each node's Raft status</li>
 *   <li>Write routing to the current leader with bounded retries</li>
 *   <li>Round-robin reads across reachable nodes</li>
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties
public class KvRouterApplication {

    public static void main(String[] args) {
        SpringApplication.run(KvRouterApplication.class, args);
    }
}
