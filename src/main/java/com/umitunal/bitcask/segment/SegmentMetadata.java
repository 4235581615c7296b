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

package com.umitunal.bitcask.segment;

import com.umitunal.bitcask.exception.MalformedRecordException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Size and next write position of the data segment, persisted as a small JSON object:
 *
 * <pre>
 * {"db_file_size": 3, "db_file_offset": 2048}
 * </pre>
 *
 * <p>{@code db_file_size} is stored in {@value #SIZE_UNIT}-byte units and scaled back to bytes
 * on load; {@code db_file_offset} is stored in bytes.</p>
 */
public final class SegmentMetadata {
    private static final Logger logger = LoggerFactory.getLogger(SegmentMetadata.class);

    public static final int SIZE_UNIT = 1024;

    private static final String SIZE_FIELD = "db_file_size";
    private static final String OFFSET_FIELD = "db_file_offset";

    private volatile long fileSize;
    private volatile long fileOffset;

    public SegmentMetadata() {
        this(0, 0);
    }

    public SegmentMetadata(long fileSize, long fileOffset) {
        this.fileSize = fileSize;
        this.fileOffset = fileOffset;
    }

    public long getFileSize() {
        return fileSize;
    }

    public long getFileOffset() {
        return fileOffset;
    }

    /**
     * Records that the segment now ends at {@code nextOffset}.
     *
     * @param nextOffset the next write position, which is also the segment size
     */
    public void advanceTo(long nextOffset) {
        this.fileOffset = nextOffset;
        this.fileSize = nextOffset;
    }

    /**
     * @return the JSON form, with the size expressed in {@value #SIZE_UNIT}-byte units
     */
    public String toJson() {
        return "{\"" + SIZE_FIELD + "\": " + (fileSize / SIZE_UNIT) +
                ", \"" + OFFSET_FIELD + "\": " + fileOffset + "}";
    }

    /**
     * Parses the JSON form.
     *
     * @param json the JSON text
     * @return the metadata, with the size scaled back to bytes
     * @throws MalformedRecordException if a field is missing or not an integer
     */
    public static SegmentMetadata fromJson(String json) {
        long sizeUnits = readField(json, SIZE_FIELD);
        long offset = readField(json, OFFSET_FIELD);
        return new SegmentMetadata(sizeUnits * SIZE_UNIT, offset);
    }

    /**
     * Loads metadata from a file. A missing or blank file yields empty metadata.
     *
     * @param path the metadata file
     * @return the loaded metadata
     * @throws IOException if the file cannot be read
     */
    public static SegmentMetadata load(Path path) throws IOException {
        if (!Files.exists(path)) {
            return new SegmentMetadata();
        }
        String content = Files.readString(path, StandardCharsets.UTF_8);
        if (content.isBlank()) {
            return new SegmentMetadata();
        }
        SegmentMetadata metadata = fromJson(content);
        logger.debug("Loaded segment metadata from {}: {}", path, metadata);
        return metadata;
    }

    /**
     * Writes the metadata to a file, replacing it atomically.
     *
     * @param path the metadata file
     * @throws IOException if the file cannot be written
     */
    public void save(Path path) throws IOException {
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, toJson(), StandardCharsets.UTF_8);
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private static long readField(String json, String field) {
        Matcher matcher = Pattern.compile("\"" + field + "\"\\s*:\\s*(-?\\d+)").matcher(json);
        if (!matcher.find()) {
            throw new MalformedRecordException("Segment metadata has no integer field '" + field + "': " + json);
        }
        try {
            return Long.parseLong(matcher.group(1));
        } catch (NumberFormatException e) {
            throw new MalformedRecordException("Segment metadata field '" + field + "' is out of range: " + json, e);
        }
    }

    @Override
    public String toString() {
        return "SegmentMetadata{" +
                "fileSize=" + fileSize +
                ", fileOffset=" + fileOffset +
                '}';
    }
}
