/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.raft;

/**
 * A Raft RPC to a peer failed in transport.
 */
public class RaftRpcException extends RuntimeException {

    public RaftRpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
