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

package com.umitunal.bitcask.core.backgroundservice;

import com.umitunal.bitcask.config.BitcaskStoreConfig;
import com.umitunal.bitcask.location.LocationRecord;
import com.umitunal.bitcask.segment.AppendLog;

import java.io.IOException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Background service that physically erases the values of deleted keys.
 *
 * <p>Deleted locations are queued in FIFO order. The worker thread takes them one at a time
 * and overwrites the byte range with the filler byte. Waiting on an empty queue is bounded by
 * the configured poll timeout so the stop flag is checked regularly.</p>
 *
 * <p>The queue lives in memory only: locations still queued when the process dies are never
 * erased, although they are already gone from both indexes.</p>
 */
public class TombstoneService extends AbstractBackgroundService {

    private final BlockingQueue<LocationRecord> queue = new LinkedBlockingQueue<>();
    private final AppendLog appendLog;
    private final BitcaskStoreConfig config;
    private final AtomicLong erased = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    /**
     * Creates a new tombstone service.
     *
     * @param appendLog the segment whose byte ranges are erased
     * @param config the store configuration
     */
    public TombstoneService(AppendLog appendLog, BitcaskStoreConfig config) {
        super("Tombstone");
        this.appendLog = appendLog;
        this.config = config;
    }

    @Override
    public void start() {
        executorService.execute(this::pollLoop);
        logger.info(serviceName + " service started, polling every " + config.tombstonePollTimeoutMillis() + " ms");
    }

    /**
     * Schedules a deleted location for erasure.
     *
     * @param record the location to erase
     */
    public void enqueue(LocationRecord record) {
        queue.add(record);
    }

    /**
     * Erases everything queued right now on the calling thread.
     */
    @Override
    protected void doExecute() {
        LocationRecord record;
        while ((record = queue.poll()) != null) {
            erase(record);
        }
    }

    public int pendingCount() {
        return queue.size();
    }

    public long erasedCount() {
        return erased.get();
    }

    public long failedCount() {
        return failed.get();
    }

    private void pollLoop() {
        while (!stopping.get()) {
            try {
                LocationRecord record = queue.poll(config.tombstonePollTimeoutMillis(), TimeUnit.MILLISECONDS);
                if (record != null) {
                    erase(record);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
        logger.debug(serviceName + " worker stopped with " + queue.size() + " locations pending");
    }

    private void erase(LocationRecord record) {
        if (record.segmentId() != appendLog.getSegmentId()) {
            logger.warn("Skipping erasure of {}: segment {} is not open", record, record.segmentId());
            failed.incrementAndGet();
            return;
        }
        try {
            appendLog.erase(record.offset(), record.length());
            erased.incrementAndGet();
            logger.debug("Erased {}", record);
        } catch (IOException e) {
            failed.incrementAndGet();
            logger.error("Failed to erase " + record, e);
        }
    }
}
