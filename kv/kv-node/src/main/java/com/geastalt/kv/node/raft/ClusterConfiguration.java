/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.raft;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered cluster membership as committed through the Raft log.
 * Instances are immutable; changes produce a new configuration.
 */
public record ClusterConfiguration(List<ClusterMember> members) {

    public static final ClusterConfiguration EMPTY = new ClusterConfiguration(List.of());

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public ClusterConfiguration {
        members = members == null ? List.of() : List.copyOf(members);
    }

    public static ClusterConfiguration of(ClusterMember... members) {
        return new ClusterConfiguration(List.of(members));
    }

    @JsonIgnore
    public boolean isEmpty() {
        return members.isEmpty();
    }

    public int size() {
        return members.size();
    }

    public Optional<ClusterMember> find(String id) {
        return members.stream().filter(m -> m.id().equals(id)).findFirst();
    }

    public Optional<ClusterMember> findByAddress(String address) {
        return members.stream().filter(m -> m.address().equals(address)).findFirst();
    }

    public boolean contains(String id) {
        return find(id).isPresent();
    }

    public boolean isVoter(String id) {
        return find(id).map(ClusterMember::isVoter).orElse(false);
    }

    @JsonIgnore
    public List<ClusterMember> getVoters() {
        return members.stream().filter(ClusterMember::isVoter).toList();
    }

    /**
     * Number of votes needed for a majority of the voters.
     */
    @JsonIgnore
    public int getQuorumSize() {
        return getVoters().size() / 2 + 1;
    }

    /**
     * Returns a configuration with the member appended, or replacing an existing one with the same id.
     */
    public ClusterConfiguration withMember(ClusterMember member) {
        List<ClusterMember> updated = new ArrayList<>();
        boolean replaced = false;
        for (var existing : members) {
            if (existing.id().equals(member.id())) {
                updated.add(member);
                replaced = true;
            } else {
                updated.add(existing);
            }
        }
        if (!replaced) {
            updated.add(member);
        }
        return new ClusterConfiguration(updated);
    }

    public ClusterConfiguration without(String id) {
        return new ClusterConfiguration(members.stream().filter(m -> !m.id().equals(id)).toList());
    }

    public byte[] serialize() {
        try {
            return MAPPER.writeValueAsBytes(this);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize configuration", e);
        }
    }

    public static ClusterConfiguration deserialize(byte[] data) {
        if (data == null || data.length == 0) {
            return EMPTY;
        }
        try {
            return MAPPER.readValue(data, ClusterConfiguration.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to deserialize configuration", e);
        }
    }
}
