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

package com.umitunal.bitcask.config;

/**
 * Configuration record for BitcaskStore.
 * This record encapsulates all configuration parameters for a BitcaskStore instance.
 *
 * @param dataDirectory directory holding the data segment, metadata and index files
 * @param segmentId id of the single data segment, the data file is named {@code db-<segmentId>}
 * @param checkpointIntervalSeconds interval in seconds between periodic checkpoints
 * @param tombstonePollTimeoutMillis how long the deletion worker waits on an empty queue
 *                                   before re-checking for shutdown
 * @param fillerByte byte written over the value of a deleted key
 * @param recordsPerLine number of location records written per line of the location set file
 */
public record BitcaskStoreConfig(
    String dataDirectory,
    int segmentId,
    int checkpointIntervalSeconds,
    long tombstonePollTimeoutMillis,
    byte fillerByte,
    int recordsPerLine
) {

    public static final String METADATA_FILE = "db.meta";
    public static final String LOCATION_SET_FILE = "db_hash_idx.idx";
    public static final String KEY_INDEX_FILE = "keys.idx";
    public static final String SEGMENT_FILE_PREFIX = "db-";

    /**
     * Creates a new BitcaskStoreConfig with the specified parameters.
     * Validates that all parameters are valid.
     *
     * @throws IllegalArgumentException if any parameter is invalid
     */
    public BitcaskStoreConfig {
        if (dataDirectory == null || dataDirectory.isEmpty()) {
            throw new IllegalArgumentException("dataDirectory must not be null or empty");
        }
        if (segmentId < 0) {
            throw new IllegalArgumentException("segmentId must not be negative");
        }
        if (checkpointIntervalSeconds <= 0) {
            throw new IllegalArgumentException("checkpointIntervalSeconds must be positive");
        }
        if (tombstonePollTimeoutMillis <= 0) {
            throw new IllegalArgumentException("tombstonePollTimeoutMillis must be positive");
        }
        if (recordsPerLine <= 0) {
            throw new IllegalArgumentException("recordsPerLine must be positive");
        }
    }

    /**
     * Creates a default configuration with:
     * - "./bitcask_db" data directory
     * - segment 1 (data file {@code db-1})
     * - 60 seconds checkpoint interval
     * - 1 second tombstone poll timeout
     * - space as filler byte
     * - 40 location records per line
     *
     * @return a default configuration
     */
    public static BitcaskStoreConfig getDefault() {
        return new BitcaskStoreConfig("./bitcask_db", 1, 60, 1000, (byte) ' ', 40);
    }

    /**
     * Creates a new configuration with a custom data directory.
     *
     * @param dataDirectory directory holding the database files
     * @return a new configuration with the specified data directory
     */
    public BitcaskStoreConfig withDataDirectory(String dataDirectory) {
        return new BitcaskStoreConfig(dataDirectory, segmentId, checkpointIntervalSeconds,
                tombstonePollTimeoutMillis, fillerByte, recordsPerLine);
    }

    /**
     * Creates a new configuration with a custom checkpoint interval.
     *
     * @param checkpointIntervalSeconds interval in seconds between periodic checkpoints
     * @return a new configuration with the specified checkpoint interval
     */
    public BitcaskStoreConfig withCheckpointIntervalSeconds(int checkpointIntervalSeconds) {
        return new BitcaskStoreConfig(dataDirectory, segmentId, checkpointIntervalSeconds,
                tombstonePollTimeoutMillis, fillerByte, recordsPerLine);
    }

    /**
     * Creates a new configuration with a custom tombstone poll timeout.
     *
     * @param tombstonePollTimeoutMillis bounded wait of the deletion worker in milliseconds
     * @return a new configuration with the specified poll timeout
     */
    public BitcaskStoreConfig withTombstonePollTimeoutMillis(long tombstonePollTimeoutMillis) {
        return new BitcaskStoreConfig(dataDirectory, segmentId, checkpointIntervalSeconds,
                tombstonePollTimeoutMillis, fillerByte, recordsPerLine);
    }

    /**
     * Creates a new configuration with a custom filler byte.
     *
     * @param fillerByte byte written over erased values
     * @return a new configuration with the specified filler byte
     */
    public BitcaskStoreConfig withFillerByte(byte fillerByte) {
        return new BitcaskStoreConfig(dataDirectory, segmentId, checkpointIntervalSeconds,
                tombstonePollTimeoutMillis, fillerByte, recordsPerLine);
    }

    /**
     * Creates a new configuration with a custom number of location records per line.
     *
     * @param recordsPerLine records written before a line break in the location set file
     * @return a new configuration with the specified line width
     */
    public BitcaskStoreConfig withRecordsPerLine(int recordsPerLine) {
        return new BitcaskStoreConfig(dataDirectory, segmentId, checkpointIntervalSeconds,
                tombstonePollTimeoutMillis, fillerByte, recordsPerLine);
    }

    /**
     * @return the file name of the data segment
     */
    public String segmentFileName() {
        return SEGMENT_FILE_PREFIX + segmentId;
    }
}
