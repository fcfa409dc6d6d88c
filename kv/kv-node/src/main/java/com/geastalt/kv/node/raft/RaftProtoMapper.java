/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.raft;

import com.geastalt.kv.node.raft.generated.ClusterMemberProto;
import com.geastalt.kv.node.raft.generated.LogEntryProto;
import com.geastalt.kv.node.raft.generated.LogEntryTypeProto;
import com.geastalt.kv.node.raft.generated.SuffrageProto;
import com.google.protobuf.ByteString;

import java.util.List;

/**
 * Conversions between Raft domain types and their protobuf messages.
 */
final class RaftProtoMapper {

    private RaftProtoMapper() {
    }

    static LogEntryProto toProto(LogEntry entry) {
        LogEntryTypeProto type = switch (entry.type()) {
            case NOOP -> LogEntryTypeProto.LOG_ENTRY_TYPE_NOOP;
            case COMMAND -> LogEntryTypeProto.LOG_ENTRY_TYPE_COMMAND;
            case CONFIGURATION -> LogEntryTypeProto.LOG_ENTRY_TYPE_CONFIGURATION;
        };

        return LogEntryProto.newBuilder()
                .setIndex(entry.index())
                .setTerm(entry.term())
                .setType(type)
                .setData(ByteString.copyFrom(entry.data()))
                .build();
    }

    static LogEntry fromProto(LogEntryProto proto) {
        LogEntryType type = switch (proto.getType()) {
            case LOG_ENTRY_TYPE_COMMAND -> LogEntryType.COMMAND;
            case LOG_ENTRY_TYPE_CONFIGURATION -> LogEntryType.CONFIGURATION;
            case LOG_ENTRY_TYPE_NOOP -> LogEntryType.NOOP;
            default -> throw new IllegalStateException(
                    "Unknown type " + proto.getTypeValue() + " for log entry " + proto.getIndex());
        };

        return new LogEntry(
                proto.getIndex(),
                proto.getTerm(),
                type,
                proto.getData().toByteArray()
        );
    }

    static List<ClusterMemberProto> toProto(ClusterConfiguration configuration) {
        return configuration.members().stream()
                .map(member -> ClusterMemberProto.newBuilder()
                        .setId(member.id())
                        .setAddress(member.address())
                        .setSuffrage(member.isVoter() ? SuffrageProto.SUFFRAGE_VOTER : SuffrageProto.SUFFRAGE_NONVOTER)
                        .build())
                .toList();
    }

    static ClusterConfiguration fromProto(List<ClusterMemberProto> members) {
        return new ClusterConfiguration(members.stream()
                .map(proto -> new ClusterMember(
                        proto.getId(),
                        proto.getAddress(),
                        proto.getSuffrage() == SuffrageProto.SUFFRAGE_NONVOTER ? Suffrage.NONVOTER : Suffrage.VOTER))
                .toList());
    }
}
