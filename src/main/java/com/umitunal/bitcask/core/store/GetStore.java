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

package com.umitunal.bitcask.core.store;

import com.umitunal.bitcask.index.KeyIndex;
import com.umitunal.bitcask.location.LocationRecord;
import com.umitunal.bitcask.location.LocationSet;
import com.umitunal.bitcask.segment.AppendLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;

/**
 * Class that encapsulates the get operation logic for the Bitcask store.
 */
public final class GetStore {
    private static final Logger logger = LoggerFactory.getLogger(GetStore.class);

    private final AppendLog appendLog;
    private final KeyIndex keyIndex;
    private final LocationSet locationSet;
    private final ReadWriteLock lock;

    /**
     * Creates a new GetStore with the specified dependencies.
     *
     * @param appendLog the data segment values are read from
     * @param keyIndex the key index
     * @param locationSet the set of live locations used to corroborate index entries
     * @param lock the store lock; gets take the read lock
     */
    public GetStore(AppendLog appendLog, KeyIndex keyIndex, LocationSet locationSet, ReadWriteLock lock) {
        if (appendLog == null) throw new IllegalArgumentException("appendLog cannot be null");
        if (keyIndex == null) throw new IllegalArgumentException("keyIndex cannot be null");
        if (locationSet == null) throw new IllegalArgumentException("locationSet cannot be null");
        if (lock == null) throw new IllegalArgumentException("lock cannot be null");

        this.appendLog = appendLog;
        this.keyIndex = keyIndex;
        this.locationSet = locationSet;
        this.lock = lock;
    }

    /**
     * Gets a value by key.
     *
     * @param key the key
     * @return the value, or null if the key is unknown or its location is not live
     * @throws IOException if the value cannot be read from the segment
     */
    public byte[] get(String key) throws IOException {
        lock.readLock().lock();
        try {
            LocationRecord record = keyIndex.get(key);
            if (record == null) {
                return null;
            }

            Optional<LocationRecord> live = locationSet.search(record);
            if (live.isEmpty()) {
                logger.debug("Location {} of key '{}' is not live, treating as deleted", record, key);
                return null;
            }

            return appendLog.read(record.offset(), record.length());
        } finally {
            lock.readLock().unlock();
        }
    }
}
