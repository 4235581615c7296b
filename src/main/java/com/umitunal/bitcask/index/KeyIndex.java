/*
 * Copyright (c) 2023-2025 Umit Unal
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.umitunal.bitcask.index;

import com.umitunal.bitcask.exception.MalformedRecordException;
import com.umitunal.bitcask.location.LocationRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory index mapping each key to the location of its latest value.
 *
 * <p>The index is persisted as a single binary snapshot:</p>
 * <pre>
 * magic (int) | version (int) | count (int)
 * count x [ keyLength (int) | key (UTF-8) | segmentId (int) | offset (long) | length (int) ]
 * </pre>
 */
public class KeyIndex {
    private static final Logger logger = LoggerFactory.getLogger(KeyIndex.class);

    static final int MAGIC = 0x4B494458; // "KIDX"
    static final int VERSION = 1;

    private final Map<String, LocationRecord> entries = new ConcurrentHashMap<>();

    /** Lookup the location of a key */
    public LocationRecord get(String key) {
        return entries.get(key);
    }

    /**
     * Insert or update the location of a key.
     *
     * @return the location the key pointed to before, or null
     */
    public LocationRecord put(String key, LocationRecord record) {
        return entries.put(key, record);
    }

    /**
     * Remove a key from the index (not from disk).
     *
     * @return the location the key pointed to, or null if it was absent
     */
    public LocationRecord remove(String key) {
        return entries.remove(key);
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    public int size() {
        return entries.size();
    }

    public List<String> keys() {
        return new ArrayList<>(entries.keySet());
    }

    /**
     * Replaces the content of this index with a snapshot file. A missing or empty file
     * leaves the index empty.
     *
     * @param path the snapshot file
     * @throws IOException if the file cannot be read
     * @throws MalformedRecordException if the file is not a complete snapshot
     */
    public void loadFromFile(Path path) throws IOException {
        entries.clear();
        long fileSize = Files.exists(path) ? Files.size(path) : 0;
        if (fileSize == 0) {
            logger.debug("Key index snapshot {} is absent or empty, starting empty", path);
            return;
        }

        try (DataInputStream in = new DataInputStream(new BufferedInputStream(Files.newInputStream(path)))) {
            int magic = in.readInt();
            if (magic != MAGIC) {
                throw new MalformedRecordException("Not a key index snapshot: " + path);
            }
            int version = in.readInt();
            if (version != VERSION) {
                throw new MalformedRecordException("Unsupported key index snapshot version " + version + ": " + path);
            }
            int count = in.readInt();
            for (int i = 0; i < count; i++) {
                int keyLength = in.readInt();
                if (keyLength < 0 || keyLength > fileSize) {
                    entries.clear();
                    throw new MalformedRecordException("Key length " + keyLength + " out of range in key index snapshot: " + path);
                }
                byte[] keyBytes = new byte[keyLength];
                in.readFully(keyBytes);
                String key = new String(keyBytes, StandardCharsets.UTF_8);
                int segmentId = in.readInt();
                long offset = in.readLong();
                int length = in.readInt();
                entries.put(key, new LocationRecord(segmentId, offset, length));
            }
        } catch (EOFException e) {
            entries.clear();
            throw new MalformedRecordException("Truncated key index snapshot: " + path, e);
        } catch (IllegalArgumentException e) {
            entries.clear();
            throw new MalformedRecordException("Invalid location in key index snapshot: " + path, e);
        }
        logger.info("Loaded {} keys from {}", entries.size(), path);
    }

    /**
     * Writes a snapshot of this index, replacing the file atomically.
     *
     * @param path the snapshot file
     * @throws IOException if the file cannot be written
     */
    public void saveToFile(Path path) throws IOException {
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        // Copy first so the count matches the entries actually written
        List<Map.Entry<String, LocationRecord>> snapshot = new ArrayList<>(entries.entrySet());
        try (DataOutputStream out = new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(tmp)))) {
            out.writeInt(MAGIC);
            out.writeInt(VERSION);
            out.writeInt(snapshot.size());
            for (Map.Entry<String, LocationRecord> entry : snapshot) {
                byte[] keyBytes = entry.getKey().getBytes(StandardCharsets.UTF_8);
                LocationRecord record = entry.getValue();
                out.writeInt(keyBytes.length);
                out.write(keyBytes);
                out.writeInt(record.segmentId());
                out.writeLong(record.offset());
                out.writeInt(record.length());
            }
        }
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        logger.debug("Saved {} keys to {}", snapshot.size(), path);
    }
}
