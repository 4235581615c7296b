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

import com.umitunal.bitcask.api.Storage;
import com.umitunal.bitcask.config.BitcaskStoreConfig;

import java.util.concurrent.TimeUnit;

/**
 * Background service that periodically persists the store's metadata and indexes.
 * A failed checkpoint is logged and retried at the next interval.
 */
public class CheckpointService extends AbstractBackgroundService {

    private final Storage storage;
    private final BitcaskStoreConfig config;

    /**
     * Creates a new checkpoint service.
     *
     * @param storage the storage to checkpoint
     * @param config the store configuration
     */
    public CheckpointService(Storage storage, BitcaskStoreConfig config) {
        super("Checkpoint");
        this.storage = storage;
        this.config = config;
    }

    @Override
    public void start() {
        scheduleTask(config.checkpointIntervalSeconds(), config.checkpointIntervalSeconds(), TimeUnit.SECONDS);
    }

    @Override
    protected void doExecute() {
        storage.checkpoint();
    }
}
