/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.node.raft.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.geastalt.kv.node.raft.LogEntry;
import com.geastalt.kv.node.raft.LogEntryType;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.zip.CRC32C;

/**
 * File-backed Raft storage.
 * <pre>
 * data/
 *  ├─ meta.dat        currentTerm + votedFor (atomic replace)
 *  ├─ raft.log        append-only WAL of APPEND and TRUNCATE records
 *  ├─ snapshot.json   latest snapshot (atomic replace)
 *  └─ raft.lock       held for the lifetime of the instance
 * </pre>
 * A WAL record is MAGIC(4) VERSION(2) TYPE(1) INDEX(8) TERM(8) PAYLOAD_LEN(4) PAYLOAD CRC32C(4).
 * An APPEND payload is the entry type ordinal followed by the entry data.
 * Replay stops at the first torn or corrupt record and cuts the file there.
 */
@Slf4j
public class FileRaftStorage implements RaftStorage {

    private static final int MAGIC = 0x4B565246;
    private static final short VERSION = 1;
    private static final byte TYPE_TRUNCATE = 1;
    private static final byte TYPE_APPEND = 2;
    private static final int HEADER_SIZE = 4 + 2 + 1 + 8 + 8 + 4;
    private static final int CRC_SIZE = 4;
    private static final int MAX_PAYLOAD = 64 * 1024 * 1024;

    private static final String META_FILE = "meta.dat";
    private static final String LOG_FILE = "raft.log";
    private static final String SNAPSHOT_FILE = "snapshot.json";
    private static final String LOCK_FILE = "raft.lock";

    private final Path dataDir;
    private final boolean syncEnabled;
    private final ObjectMapper mapper = new ObjectMapper();

    private FileChannel logChannel;
    private FileChannel lockChannel;
    private FileLock exclusiveLock;
    private boolean closed;

    public FileRaftStorage(Path dataDir) {
        this(dataDir, true);
    }

    public FileRaftStorage(Path dataDir, boolean syncEnabled) {
        this.dataDir = dataDir;
        this.syncEnabled = syncEnabled;
        try {
            Files.createDirectories(dataDir);
            lockChannel = FileChannel.open(dataDir.resolve(LOCK_FILE),
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            try {
                exclusiveLock = lockChannel.tryLock();
            } catch (OverlappingFileLockException e) {
                exclusiveLock = null;
            }
            if (exclusiveLock == null) {
                lockChannel.close();
                throw new StorageException("Data directory " + dataDir + " is in use by another process");
            }
            logChannel = openLog();
            log.info("Raft storage opened at {} (fsync {})", dataDir, syncEnabled ? "on" : "off");
        } catch (IOException e) {
            throw new StorageException("Failed to open Raft storage at " + dataDir, e);
        }
    }

    // Metadata

    @Override
    public synchronized PersistentMeta loadMeta() {
        Path metaPath = dataDir.resolve(META_FILE);
        if (!Files.exists(metaPath)) {
            return PersistentMeta.EMPTY;
        }
        try {
            byte[] all = Files.readAllBytes(metaPath);
            ByteBuffer buf = ByteBuffer.wrap(all);
            long term = buf.getLong();
            int voteLen = buf.getInt();
            if (voteLen < 0 || voteLen > all.length - 8 - 4 - CRC_SIZE) {
                throw new StorageException("Corrupt " + META_FILE + ": invalid vote length " + voteLen);
            }
            byte[] voteBytes = new byte[voteLen];
            buf.get(voteBytes);
            int expectedCrc = buf.getInt();

            CRC32C crc = new CRC32C();
            crc.update(all, 0, 8 + 4 + voteLen);
            if ((int) crc.getValue() != expectedCrc) {
                throw new StorageException("Corrupt " + META_FILE + ": CRC mismatch");
            }

            Optional<String> votedFor = voteLen == 0
                    ? Optional.empty()
                    : Optional.of(new String(voteBytes, StandardCharsets.UTF_8));
            log.info("Loaded Raft metadata: term={}, votedFor={}", term, votedFor.orElse("(none)"));
            return new PersistentMeta(term, votedFor);
        } catch (IOException e) {
            throw new StorageException("Failed to read " + META_FILE, e);
        }
    }

    @Override
    public synchronized void saveMeta(PersistentMeta meta) {
        byte[] voteBytes = meta.votedFor()
                .map(s -> s.getBytes(StandardCharsets.UTF_8))
                .orElse(new byte[0]);

        ByteBuffer buf = ByteBuffer.allocate(8 + 4 + voteBytes.length + CRC_SIZE);
        buf.putLong(meta.currentTerm());
        buf.putInt(voteBytes.length);
        buf.put(voteBytes);
        CRC32C crc = new CRC32C();
        crc.update(buf.array(), 0, 8 + 4 + voteBytes.length);
        buf.putInt((int) crc.getValue());
        buf.flip();

        replaceAtomically(META_FILE, buf);
        log.debug("Saved Raft metadata: term={}, votedFor={}", meta.currentTerm(), meta.votedFor().orElse("(none)"));
    }

    // Log

    @Override
    public synchronized List<LogEntry> loadEntries() {
        long snapshotIndex = loadSnapshot().map(Snapshot::lastIndex).orElse(0L);
        List<LogEntry> entries = new ArrayList<>();
        int appends = 0;
        int truncates = 0;
        try {
            long fileSize = logChannel.size();
            long pos = 0;
            ByteBuffer header = ByteBuffer.allocate(HEADER_SIZE);

            while (true) {
                header.clear();
                if (logChannel.read(header, pos) < HEADER_SIZE) {
                    break;
                }
                header.flip();
                int magic = header.getInt();
                short version = header.getShort();
                byte type = header.get();
                long index = header.getLong();
                long term = header.getLong();
                int payloadLen = header.getInt();

                if (magic != MAGIC || version != VERSION || payloadLen < 0 || payloadLen > MAX_PAYLOAD) {
                    log.warn("Invalid WAL record header at position {}", pos);
                    break;
                }

                ByteBuffer payload = ByteBuffer.allocate(payloadLen);
                if (logChannel.read(payload, pos + HEADER_SIZE) < payloadLen) {
                    break;
                }
                payload.flip();
                ByteBuffer crcBuf = ByteBuffer.allocate(CRC_SIZE);
                if (logChannel.read(crcBuf, pos + HEADER_SIZE + payloadLen) < CRC_SIZE) {
                    break;
                }
                crcBuf.flip();

                CRC32C crc = new CRC32C();
                header.rewind();
                crc.update(header);
                crc.update(payload.duplicate());
                if ((int) crc.getValue() != crcBuf.getInt()) {
                    log.warn("WAL CRC mismatch at position {}", pos);
                    break;
                }

                if (type == TYPE_TRUNCATE) {
                    entries.removeIf(e -> e.index() >= index);
                    truncates++;
                } else if (type == TYPE_APPEND) {
                    entries.add(decodeEntry(index, term, payload));
                    appends++;
                } else {
                    log.warn("Unknown WAL record type {} at position {}", type, pos);
                    break;
                }
                pos += HEADER_SIZE + payloadLen + CRC_SIZE;
            }

            if (pos < fileSize) {
                log.warn("Truncating torn WAL tail: {} bytes removed", fileSize - pos);
                logChannel.truncate(pos);
            }
            logChannel.position(pos);
        } catch (IOException e) {
            throw new StorageException("Failed to replay " + LOG_FILE, e);
        }

        entries.removeIf(e -> e.index() <= snapshotIndex);
        log.info("WAL replay complete: {} entries recovered ({} appends, {} truncates)",
                entries.size(), appends, truncates);
        return entries;
    }

    @Override
    public synchronized void append(List<LogEntry> entries) {
        if (entries.isEmpty()) {
            return;
        }
        try {
            for (var entry : entries) {
                writeRecord(logChannel, TYPE_APPEND, entry.index(), entry.term(), encodePayload(entry));
            }
            sync(logChannel);
        } catch (IOException e) {
            throw new StorageException("Failed to append entries to " + LOG_FILE, e);
        }
    }

    @Override
    public synchronized void truncateFrom(long fromIndex) {
        try {
            writeRecord(logChannel, TYPE_TRUNCATE, fromIndex, 0L, new byte[0]);
            sync(logChannel);
            log.debug("WAL truncate record written from index {}", fromIndex);
        } catch (IOException e) {
            throw new StorageException("Failed to write truncate record", e);
        }
    }

    // Snapshot

    @Override
    public synchronized Optional<Snapshot> loadSnapshot() {
        Path path = dataDir.resolve(SNAPSHOT_FILE);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(path.toFile(), Snapshot.class));
        } catch (IOException e) {
            throw new StorageException("Failed to read " + SNAPSHOT_FILE, e);
        }
    }

    @Override
    public synchronized void saveSnapshot(Snapshot snapshot, List<LogEntry> retained) {
        try {
            replaceAtomically(SNAPSHOT_FILE, ByteBuffer.wrap(mapper.writeValueAsBytes(snapshot)));

            Path tmp = dataDir.resolve(LOG_FILE + ".tmp");
            try (FileChannel ch = FileChannel.open(tmp, StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                for (var entry : retained) {
                    writeRecord(ch, TYPE_APPEND, entry.index(), entry.term(), encodePayload(entry));
                }
                sync(ch);
            }
            logChannel.close();
            Files.move(tmp, dataDir.resolve(LOG_FILE), StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
            logChannel = openLog();
            log.info("Saved {} and compacted WAL to {} entries", snapshot, retained.size());
        } catch (IOException e) {
            throw new StorageException("Failed to save snapshot", e);
        }
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            logChannel.close();
            if (exclusiveLock != null && exclusiveLock.isValid()) {
                exclusiveLock.release();
            }
            lockChannel.close();
        } catch (IOException e) {
            log.warn("Error closing Raft storage at {}: {}", dataDir, e.getMessage());
        }
        log.info("Raft storage closed at {}", dataDir);
    }

    private FileChannel openLog() throws IOException {
        FileChannel ch = FileChannel.open(dataDir.resolve(LOG_FILE),
                StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
        ch.position(ch.size());
        return ch;
    }

    private void writeRecord(FileChannel ch, byte type, long index, long term, byte[] payload) throws IOException {
        ByteBuffer buf = ByteBuffer.allocate(HEADER_SIZE + payload.length + CRC_SIZE);
        buf.putInt(MAGIC);
        buf.putShort(VERSION);
        buf.put(type);
        buf.putLong(index);
        buf.putLong(term);
        buf.putInt(payload.length);
        buf.put(payload);
        CRC32C crc = new CRC32C();
        crc.update(buf.array(), 0, HEADER_SIZE + payload.length);
        buf.putInt((int) crc.getValue());
        buf.flip();
        while (buf.hasRemaining()) {
            ch.write(buf);
        }
    }

    private void replaceAtomically(String fileName, ByteBuffer content) {
        Path tmp = dataDir.resolve(fileName + ".tmp");
        try {
            try (FileChannel ch = FileChannel.open(tmp, StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                while (content.hasRemaining()) {
                    ch.write(content);
                }
                sync(ch);
            }
            Files.move(tmp, dataDir.resolve(fileName), StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StorageException("Failed to write " + fileName, e);
        }
    }

    private void sync(FileChannel ch) throws IOException {
        if (syncEnabled) {
            ch.force(true);
        }
    }

    private static byte[] encodePayload(LogEntry entry) {
        byte[] payload = new byte[1 + entry.data().length];
        payload[0] = (byte) entry.type().ordinal();
        System.arraycopy(entry.data(), 0, payload, 1, entry.data().length);
        return payload;
    }

    private static LogEntry decodeEntry(long index, long term, ByteBuffer payload) {
        LogEntryType type = LogEntryType.values()[payload.get()];
        byte[] data = new byte[payload.remaining()];
        payload.get(data);
        return new LogEntry(index, term, type, data);
    }
}
