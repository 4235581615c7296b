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

import com.umitunal.bitcask.core.backgroundservice.TombstoneService;
import com.umitunal.bitcask.index.KeyIndex;
import com.umitunal.bitcask.location.LocationRecord;
import com.umitunal.bitcask.location.LocationSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.locks.ReadWriteLock;

/**
 * Class that encapsulates the delete operation logic for the Bitcask store.
 *
 * <p>A delete only updates the two indexes. The bytes of the value stay in the segment
 * until the {@link TombstoneService} overwrites them.</p>
 */
public final class DeleteStore {
    private static final Logger logger = LoggerFactory.getLogger(DeleteStore.class);

    private final KeyIndex keyIndex;
    private final LocationSet locationSet;
    private final TombstoneService tombstoneService;
    private final ReadWriteLock lock;

    /**
     * Creates a new DeleteStore with the specified dependencies.
     *
     * @param keyIndex the key index
     * @param locationSet the set of live locations
     * @param tombstoneService the worker that erases deleted values
     * @param lock the store lock; deletes take the write lock
     */
    public DeleteStore(KeyIndex keyIndex, LocationSet locationSet,
                       TombstoneService tombstoneService, ReadWriteLock lock) {
        if (keyIndex == null) throw new IllegalArgumentException("keyIndex cannot be null");
        if (locationSet == null) throw new IllegalArgumentException("locationSet cannot be null");
        if (tombstoneService == null) throw new IllegalArgumentException("tombstoneService cannot be null");
        if (lock == null) throw new IllegalArgumentException("lock cannot be null");

        this.keyIndex = keyIndex;
        this.locationSet = locationSet;
        this.tombstoneService = tombstoneService;
        this.lock = lock;
    }

    /**
     * Deletes a key and schedules its value for erasure.
     *
     * @param key the key
     * @return the location of the deleted value, or null if the key was absent
     */
    public LocationRecord delete(String key) {
        lock.writeLock().lock();
        try {
            LocationRecord record = keyIndex.remove(key);
            if (record == null) {
                return null;
            }

            if (!locationSet.delete(record)) {
                logger.warn("Location {} of deleted key '{}' was not in the location set", record, key);
            }
            tombstoneService.enqueue(record);
            return record;
        } finally {
            lock.writeLock().unlock();
        }
    }
}
