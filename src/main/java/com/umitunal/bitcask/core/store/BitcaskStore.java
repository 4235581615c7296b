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

import com.umitunal.bitcask.api.Storage;
import com.umitunal.bitcask.config.BitcaskStoreConfig;
import com.umitunal.bitcask.core.backgroundservice.CheckpointService;
import com.umitunal.bitcask.core.backgroundservice.TombstoneService;
import com.umitunal.bitcask.exception.StorageException;
import com.umitunal.bitcask.index.KeyIndex;
import com.umitunal.bitcask.location.LocationRecord;
import com.umitunal.bitcask.location.LocationSet;
import com.umitunal.bitcask.segment.AppendLog;
import com.umitunal.bitcask.segment.AppendLogImpl;
import com.umitunal.bitcask.segment.SegmentMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bitcask-style storage engine over a single append-only data segment.
 *
 * <p>Values are appended to the segment file. A {@link KeyIndex} maps each key to the location
 * of its latest value, and an independently persisted {@link LocationSet} records which
 * locations are live. Reads look the key up, check the location against the location set and
 * read the bytes from the segment.</p>
 *
 * <p>Deletes drop the key from both indexes immediately and queue the location for a
 * {@link TombstoneService}, which overwrites the bytes in the background. A
 * {@link CheckpointService} periodically writes the metadata and both indexes to disk;
 * on construction they are loaded back. Writes made after the last checkpoint are lost
 * on a crash.</p>
 *
 * <p>Puts and deletes take the write lock of a single {@link ReentrantReadWriteLock};
 * gets, key listings and checkpoints take its read lock.</p>
 */
public class BitcaskStore implements Storage {
    private static final Logger logger = LoggerFactory.getLogger(BitcaskStore.class);

    private final BitcaskStoreConfig config;

    // Files
    private final Path metadataPath;
    private final Path locationSetPath;
    private final Path keyIndexPath;

    // Core components
    private final AppendLog appendLog;
    private final SegmentMetadata metadata;
    private final LocationSet locationSet;
    private final KeyIndex keyIndex;

    // Concurrency control
    private final ReadWriteLock lock;
    private final Object checkpointMonitor = new Object();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    // Background services
    private final TombstoneService tombstoneService;
    private final CheckpointService checkpointService;

    // Operation stores
    private final PutStore putStore;
    private final GetStore getStore;
    private final DeleteStore deleteStore;

    /**
     * Opens a store in the given directory with default settings.
     *
     * @param dataDirectory the directory holding the database files
     */
    public BitcaskStore(String dataDirectory) {
        this(BitcaskStoreConfig.getDefault().withDataDirectory(dataDirectory));
    }

    /**
     * Opens a store with the specified configuration, recovering any state
     * persisted by a previous checkpoint.
     *
     * @param config the configuration for this store
     * @throws StorageException if the directory or its files cannot be opened
     * @throws com.umitunal.bitcask.exception.MalformedRecordException if persisted state is corrupt
     */
    public BitcaskStore(BitcaskStoreConfig config) {
        this(config, openSegment(config));
    }

    /**
     * Opens a store over an already opened segment. The store takes ownership of the segment.
     *
     * @param config the configuration for this store
     * @param appendLog the data segment
     */
    BitcaskStore(BitcaskStoreConfig config, AppendLog appendLog) {
        this.config = config;
        this.appendLog = appendLog;

        Path dir = Paths.get(config.dataDirectory());
        this.metadataPath = dir.resolve(BitcaskStoreConfig.METADATA_FILE);
        this.locationSetPath = dir.resolve(BitcaskStoreConfig.LOCATION_SET_FILE);
        this.keyIndexPath = dir.resolve(BitcaskStoreConfig.KEY_INDEX_FILE);

        this.locationSet = new LocationSet(config.recordsPerLine());
        this.keyIndex = new KeyIndex();

        try {
            this.metadata = SegmentMetadata.load(metadataPath);
            recover();
        } catch (IOException | RuntimeException e) {
            closeQuietly();
            if (e instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new StorageException("Cannot recover store in " + dir, e);
        }

        this.lock = new ReentrantReadWriteLock();

        // Initialize background services
        this.tombstoneService = new TombstoneService(appendLog, config);
        this.checkpointService = new CheckpointService(this, config);

        // Initialize operation stores
        this.putStore = new PutStore(appendLog, keyIndex, locationSet, metadata, lock);
        this.getStore = new GetStore(appendLog, keyIndex, locationSet, lock);
        this.deleteStore = new DeleteStore(keyIndex, locationSet, tombstoneService, lock);

        // Start background services
        tombstoneService.start();
        checkpointService.start();

        logger.info("BitcaskStore initialized with data directory: " + config.dataDirectory());
    }

    private static AppendLog openSegment(BitcaskStoreConfig config) {
        Path dir = Paths.get(config.dataDirectory());
        try {
            Files.createDirectories(dir);
            return new AppendLogImpl(dir.resolve(config.segmentFileName()), config.segmentId(), config.fillerByte());
        } catch (IOException e) {
            throw new StorageException("Cannot open store in " + dir, e);
        }
    }

    //--------------------------------------------------------------------------
    // Recovery
    //--------------------------------------------------------------------------

    /**
     * Loads the location set and the key index written by the last checkpoint, and reconciles
     * the recorded write position with the real end of the segment.
     */
    private void recover() throws IOException {
        locationSet.loadFromFile(locationSetPath);
        keyIndex.loadFromFile(keyIndexPath);

        long segmentSize = appendLog.size();
        if (segmentSize != metadata.getFileOffset()) {
            logger.warn("Segment {} is {} bytes but metadata recorded offset {}; writes after the last checkpoint "
                    + "are not indexed", appendLog.getPath(), segmentSize, metadata.getFileOffset());
            metadata.advanceTo(segmentSize);
        }

        logger.info("Recovered {} keys and {} live locations, next write offset {}",
                keyIndex.size(), locationSet.size(), metadata.getFileOffset());
    }

    //--------------------------------------------------------------------------
    // Core Operations (put, get, delete)
    //--------------------------------------------------------------------------

    @Override
    public void put(String key, byte[] value) {
        ensureOpen();
        validateKey(key);
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }

        try {
            putStore.put(key, value);
        } catch (IOException e) {
            logger.error("Error appending value for key '" + key + "'", e);
            throw new StorageException("Failed to put key '" + key + "'", e);
        }
    }

    @Override
    public byte[] get(String key) {
        ensureOpen();
        validateKey(key);

        try {
            return getStore.get(key);
        } catch (IOException e) {
            logger.error("Error reading value for key '" + key + "'", e);
            throw new StorageException("Failed to get key '" + key + "'", e);
        }
    }

    @Override
    public boolean delete(String key) {
        ensureOpen();
        validateKey(key);

        LocationRecord removed = deleteStore.delete(key);
        return removed != null;
    }

    //--------------------------------------------------------------------------
    // Query Operations (containsKey, size, listKeys)
    //--------------------------------------------------------------------------

    @Override
    public boolean containsKey(String key) {
        ensureOpen();
        validateKey(key);

        lock.readLock().lock();
        try {
            return keyIndex.containsKey(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int size() {
        ensureOpen();
        lock.readLock().lock();
        try {
            return keyIndex.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<String> listKeys() {
        ensureOpen();
        lock.readLock().lock();
        try {
            return keyIndex.keys();
        } finally {
            lock.readLock().unlock();
        }
    }

    //--------------------------------------------------------------------------
    // Persistence
    //--------------------------------------------------------------------------

    @Override
    public void checkpoint() {
        ensureOpen();
        writeCheckpoint();
    }

    /**
     * Forces the deletion worker to erase every queued location now, on the calling thread.
     * This is useful for testing and before inspecting the segment file directly.
     */
    public void processTombstones() {
        tombstoneService.executeNow();
    }

    /**
     * Gets the number of deleted locations still waiting for erasure.
     * This method is used for testing purposes.
     *
     * @return the number of queued tombstones
     */
    public int getPendingTombstoneCount() {
        return tombstoneService.pendingCount();
    }

    /**
     * Gets the location the key index currently holds for a key.
     * This method is used for testing purposes.
     *
     * @param key the key
     * @return the location, or null if the key is absent
     */
    public LocationRecord getLocation(String key) {
        return keyIndex.get(key);
    }

    public Path getSegmentPath() {
        return appendLog.getPath();
    }

    private void writeCheckpoint() {
        synchronized (checkpointMonitor) {
            lock.readLock().lock();
            try {
                try {
                    appendLog.sync();
                } catch (IOException e) {
                    // index files are written regardless
                    logger.warn("Could not sync segment " + appendLog.getPath() + " before checkpoint", e);
                }
                metadata.save(metadataPath);
                locationSet.saveToFile(locationSetPath);
                keyIndex.saveToFile(keyIndexPath);
                logger.info("Checkpoint written: {} keys, {} live locations, offset {}",
                        keyIndex.size(), locationSet.size(), metadata.getFileOffset());
            } catch (IOException e) {
                logger.error("Error writing checkpoint to " + config.dataDirectory(), e);
                throw new StorageException("Checkpoint failed", e);
            } finally {
                lock.readLock().unlock();
            }
        }
    }

    //--------------------------------------------------------------------------
    // Lifecycle
    //--------------------------------------------------------------------------

    /**
     * Stops both background services, erases any tombstones still queued, writes a final
     * checkpoint and closes the segment. Calling it again has no effect. Callers must not
     * issue operations concurrently with or after shutdown.
     */
    @Override
    public void shutdown() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        checkpointService.shutdown();
        tombstoneService.shutdown();
        tombstoneService.executeNow();

        try {
            writeCheckpoint();
        } finally {
            closeQuietly();
        }
        logger.info("BitcaskStore shutdown completed");
    }

    private void closeQuietly() {
        try {
            appendLog.close();
        } catch (IOException e) {
            logger.warn("Error closing segment " + appendLog.getPath(), e);
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("BitcaskStore in " + config.dataDirectory() + " is shut down");
        }
    }

    private static void validateKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("key cannot be null or empty");
        }
    }
}
