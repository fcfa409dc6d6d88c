/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.raft.storage;

import java.util.Optional;

/**
 * Term and vote that must survive a restart.
 */
public record PersistentMeta(long currentTerm, Optional<String> votedFor) {

    public static final PersistentMeta EMPTY = new PersistentMeta(0, Optional.empty());

    public PersistentMeta {
        votedFor = votedFor == null ? Optional.empty() : votedFor;
    }
}
