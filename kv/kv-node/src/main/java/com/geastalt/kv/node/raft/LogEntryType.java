/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.raft;

/**
 * Types of Raft log entries.
 */
public enum LogEntryType {
    /**
     * No operation, appended by a new leader to commit entries of earlier terms.
     */
    NOOP,

    /**
     * A key-value command for the state machine.
     */
    COMMAND,

    /**
     * A new cluster membership configuration.
     */
    CONFIGURATION
}
