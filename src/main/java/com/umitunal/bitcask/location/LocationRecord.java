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

package com.umitunal.bitcask.location;

import com.umitunal.bitcask.exception.MalformedRecordException;

/**
 * Location of a value inside a data segment: a contiguous byte range.
 *
 * <p>{@link #equals(Object)} is full structural equality. The location set uses the weaker
 * {@link #sameSegmentAndLength(LocationRecord)} comparison, which ignores the offset.</p>
 *
 * @param segmentId id of the data segment holding the bytes
 * @param offset position of the first byte in the segment
 * @param length number of bytes
 */
public record LocationRecord(int segmentId, long offset, int length) {

    private static final char SEPARATOR = ':';

    public LocationRecord {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        if (length < 0) {
            throw new IllegalArgumentException("length must not be negative");
        }
    }

    /**
     * Compares only the segment id and the length of two records.
     * Two distinct values of equal size in the same segment compare equal.
     *
     * @param other the record to compare with
     * @return true if both records have the same segment id and length
     */
    public boolean sameSegmentAndLength(LocationRecord other) {
        return other != null && segmentId == other.segmentId && length == other.length;
    }

    /**
     * @return the {@code segmentId:offset:length} form of this record
     */
    public String serialize() {
        return segmentId + String.valueOf(SEPARATOR) + offset + SEPARATOR + length;
    }

    /**
     * Parses the {@code segmentId:offset:length} form of a record.
     *
     * @param text the serialized record
     * @return the parsed record
     * @throws MalformedRecordException if the text is not three colon separated, non-negative integers
     */
    public static LocationRecord parse(String text) {
        if (text == null) {
            throw new MalformedRecordException("Location record is null");
        }
        String[] parts = text.split(String.valueOf(SEPARATOR), -1);
        if (parts.length != 3) {
            throw new MalformedRecordException("Malformed location record: '" + text + "'");
        }
        try {
            return new LocationRecord(
                    Integer.parseInt(parts[0].trim()),
                    Long.parseLong(parts[1].trim()),
                    Integer.parseInt(parts[2].trim()));
        } catch (IllegalArgumentException e) {
            // NumberFormatException included
            throw new MalformedRecordException("Malformed location record: '" + text + "'", e);
        }
    }

    @Override
    public String toString() {
        return "LocationRecord{" +
                "segmentId=" + segmentId +
                ", offset=" + offset +
                ", length=" + length +
                '}';
    }
}
