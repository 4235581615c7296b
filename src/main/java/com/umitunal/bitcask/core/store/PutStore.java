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
import com.umitunal.bitcask.segment.SegmentMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.locks.ReadWriteLock;

/**
 * Class that encapsulates the put operation logic for the Bitcask store.
 */
public final class PutStore {
    private static final Logger logger = LoggerFactory.getLogger(PutStore.class);

    private final AppendLog appendLog;
    private final KeyIndex keyIndex;
    private final LocationSet locationSet;
    private final SegmentMetadata metadata;
    private final ReadWriteLock lock;

    /**
     * Creates a new PutStore with the specified dependencies.
     *
     * @param appendLog the data segment values are appended to
     * @param keyIndex the key index
     * @param locationSet the set of live locations
     * @param metadata the segment metadata to keep current
     * @param lock the store lock; puts take the write lock
     */
    public PutStore(AppendLog appendLog, KeyIndex keyIndex, LocationSet locationSet,
                    SegmentMetadata metadata, ReadWriteLock lock) {
        if (appendLog == null) throw new IllegalArgumentException("appendLog cannot be null");
        if (keyIndex == null) throw new IllegalArgumentException("keyIndex cannot be null");
        if (locationSet == null) throw new IllegalArgumentException("locationSet cannot be null");
        if (metadata == null) throw new IllegalArgumentException("metadata cannot be null");
        if (lock == null) throw new IllegalArgumentException("lock cannot be null");

        this.appendLog = appendLog;
        this.keyIndex = keyIndex;
        this.locationSet = locationSet;
        this.metadata = metadata;
        this.lock = lock;
    }

    /**
     * Appends a value to the segment and points the key at it.
     *
     * <p>If the key already had a value, the old byte range is left in the segment
     * and in the location set; it is never reclaimed.</p>
     *
     * @param key the key
     * @param value the value
     * @return the location the value was written to
     * @throws IOException if the value cannot be appended
     */
    public LocationRecord put(String key, byte[] value) throws IOException {
        lock.writeLock().lock();
        try {
            long offset = appendLog.append(value);
            LocationRecord record = new LocationRecord(appendLog.getSegmentId(), offset, value.length);
            metadata.advanceTo(offset + value.length);

            locationSet.insert(record);
            LocationRecord previous = keyIndex.put(key, record);
            if (previous != null) {
                logger.debug("Key '{}' moved from {} to {}", key, previous, record);
            }
            return record;
        } finally {
            lock.writeLock().unlock();
        }
    }
}
