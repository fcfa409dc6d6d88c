/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.raft;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.geastalt.kv.api.KeyValue;
import com.geastalt.kv.model.KvError;
import com.geastalt.kv.model.KvResult;
import com.geastalt.kv.model.KvStatus;
import com.geastalt.kv.node.config.RaftConfig;
import com.geastalt.kv.node.service.KvStore;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raft state machine applying committed log entries to the key-value store.
 * <p>
 * Writes carrying a request id are remembered in a bounded window; a repeated id
 * returns the remembered outcome instead of being applied again.
 */
@Slf4j
@Component
public class RaftStateMachine {

    private final KvStore kvStore;
    private final ObjectMapper mapper = new ObjectMapper();
    private final Map<String, RequestOutcome> appliedRequests;

    @Getter
    private volatile long lastAppliedIndex = 0;

    public RaftStateMachine(KvStore kvStore, RaftConfig raftConfig) {
        this.kvStore = kvStore;
        int window = raftConfig.getDedupWindow();
        this.appliedRequests = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, RequestOutcome> eldest) {
                return size() > window;
            }
        };
    }

    /**
     * Applies a committed log entry to the state machine.
     *
     * @param entry The entry to apply
     * @return The operation result; configuration entries yield their configuration
     */
    public synchronized KvResult<?> apply(LogEntry entry) {
        if (entry.index() <= lastAppliedIndex) {
            log.debug("Skipping already applied entry at index {}", entry.index());
            return KvResult.success(null);
        }

        log.debug("Applying entry {} of type {}", entry.index(), entry.type());

        KvResult<?> result = switch (entry.type()) {
            case COMMAND -> applyCommand(entry);
            case CONFIGURATION -> KvResult.success(entry.getConfiguration());
            case NOOP -> KvResult.success(null);
        };

        lastAppliedIndex = entry.index();
        return result;
    }

    private KvResult<KeyValue> applyCommand(LogEntry entry) {
        KvCommand command;
        try {
            command = entry.getCommand();
        } catch (IllegalStateException e) {
            log.error("Undecodable command at index {}: {}", entry.index(), e.getMessage());
            return KvResult.failure(KvError.error("Invalid command data"));
        }
        if (command == null) {
            return KvResult.failure(KvError.error("Invalid command data"));
        }

        String requestId = command.requestId();
        if (requestId != null && command.operation() != KvCommand.Operation.GET) {
            var previous = appliedRequests.get(requestId);
            if (previous != null) {
                log.debug("Request {} already applied, returning remembered outcome", requestId);
                return previous.toResult();
            }
        }

        KvResult<KeyValue> result = switch (command.operation()) {
            case PUT -> kvStore.put(command.key(), command.value());
            case GET -> kvStore.get(command.key());
            case DEL -> kvStore.delete(command.key());
        };

        if (requestId != null && command.operation() != KvCommand.Operation.GET) {
            appliedRequests.put(requestId, RequestOutcome.of(requestId, command.key(), result));
        }
        return result;
    }

    /**
     * Serializes the full store and the request window.
     */
    public synchronized byte[] snapshot() {
        try {
            return mapper.writeValueAsBytes(new SnapshotState(
                    kvStore.snapshot(), new ArrayList<>(appliedRequests.values())));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize state machine snapshot", e);
        }
    }

    /**
     * Replaces the in-memory state wholesale with a snapshot taken at {@code lastIncludedIndex}.
     */
    public synchronized void restore(byte[] data, long lastIncludedIndex) {
        SnapshotState state;
        try {
            state = data.length == 0
                    ? new SnapshotState(Map.of(), List.of())
                    : mapper.readValue(data, SnapshotState.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read state machine snapshot", e);
        }
        kvStore.replaceAll(state.entries() == null ? Map.of() : state.entries());
        appliedRequests.clear();
        if (state.requests() != null) {
            state.requests().forEach(r -> appliedRequests.put(r.requestId(), r));
        }
        lastAppliedIndex = lastIncludedIndex;
        log.info("State machine restored at index {} with {} keys", lastIncludedIndex, kvStore.size());
    }

    record SnapshotState(Map<String, String> entries, List<RequestOutcome> requests) {
    }

    /**
     * Remembered outcome of a de-duplicated write.
     */
    record RequestOutcome(String requestId, KvStatus status, String key, String value, String error) {

        static RequestOutcome of(String requestId, String key, KvResult<KeyValue> result) {
            if (result.isSuccess()) {
                return new RequestOutcome(requestId, KvStatus.OK, key, result.getValue().value(), null);
            }
            return new RequestOutcome(requestId, result.status(), key, null, result.getError().message());
        }

        KvResult<KeyValue> toResult() {
            if (status == KvStatus.OK) {
                return KvResult.success(new KeyValue(key, value));
            }
            return KvResult.failure(status, error);
        }
    }
}
