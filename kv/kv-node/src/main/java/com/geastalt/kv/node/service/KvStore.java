/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.service;

import com.geastalt.kv.api.KeyValue;
import com.geastalt.kv.model.KvError;
import com.geastalt.kv.model.KvResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-memory key-value map behind the replicated state machine.
 * Mutated only by committed log entries; readable concurrently by status handlers.
 */
@Slf4j
@Component
public class KvStore {

    private final Map<String, String> entries = new ConcurrentHashMap<>();

    public KvResult<KeyValue> put(String key, String value) {
        entries.put(key, value);
        log.debug("Stored key {}", key);
        return KvResult.success(new KeyValue(key, value));
    }

    public KvResult<KeyValue> get(String key) {
        String value = entries.get(key);
        if (value == null) {
            return KvResult.failure(KvError.keyNotFound());
        }
        return KvResult.success(new KeyValue(key, value));
    }

    public KvResult<KeyValue> delete(String key) {
        String removed = entries.remove(key);
        if (removed == null) {
            return KvResult.failure(KvError.keyNotFound());
        }
        log.debug("Deleted key {}", key);
        return KvResult.success(new KeyValue(key, removed));
    }

    public int size() {
        return entries.size();
    }

    /**
     * Copy of the current contents.
     */
    public Map<String, String> snapshot() {
        return new HashMap<>(entries);
    }

    /**
     * Replaces the whole contents.
     */
    public void replaceAll(Map<String, String> contents) {
        entries.clear();
        entries.putAll(contents);
        log.info("Key-value store replaced with {} entries", contents.size());
    }
}
