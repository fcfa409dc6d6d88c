/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.broadcast;

import com.geastalt.kv.api.ShardAnnouncement;

/**
 * One-way delivery of shard announcements to a peer node.
 */
public interface PeerNotifier {

    /**
     * Tells a peer that the announced shard has a new leader.
     *
     * @return whether the peer acknowledged the announcement
     */
    boolean notifyNewLeader(PeerAddress target, ShardAnnouncement announcement);

    /**
     * Passes a newly learned shard on to a peer.
     *
     * @return whether the peer acknowledged the announcement
     */
    boolean notifyAddShard(PeerAddress target, ShardAnnouncement announcement);
}
