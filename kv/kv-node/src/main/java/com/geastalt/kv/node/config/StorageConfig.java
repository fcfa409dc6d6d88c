/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.config;

import com.geastalt.kv.node.raft.RaftLog;
import com.geastalt.kv.node.raft.storage.FileRaftStorage;
import com.geastalt.kv.node.raft.storage.MemoryRaftStorage;
import com.geastalt.kv.node.raft.storage.RaftStorage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Wires Raft persistence. A blank data directory keeps all state in memory.
 */
@Slf4j
@Configuration
public class StorageConfig {

    @Bean(destroyMethod = "close")
    public RaftStorage raftStorage(RaftConfig raftConfig) {
        String dataDir = raftConfig.getDataDir();
        if (dataDir == null || dataDir.isBlank()) {
            log.warn("No kv.raft.data-dir configured - Raft state is kept in memory only");
            return new MemoryRaftStorage();
        }
        log.info("Persisting Raft state under {}", dataDir);
        return new FileRaftStorage(Path.of(dataDir));
    }

    @Bean
    public RaftLog raftLog(RaftStorage raftStorage) {
        return new RaftLog(raftStorage);
    }
}
