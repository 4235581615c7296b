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

import com.umitunal.bitcask.radix.MatchResult;
import com.umitunal.bitcask.radix.RadixTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Set of live value locations, stored as serialized {@link LocationRecord}s in a {@link RadixTree}.
 *
 * <p>The tree does not expose an iteration order, so the serialized forms are also kept in an
 * unordered set that is only used when the set is written to disk.</p>
 *
 * <p>File format: serialized records separated by commas, with a line break after every
 * {@code recordsPerLine} records. Empty fields are ignored when loading.</p>
 *
 * <p>Not thread-safe; the store guards it with its read/write lock.</p>
 */
public class LocationSet {
    private static final Logger logger = LoggerFactory.getLogger(LocationSet.class);

    private final RadixTree tree;
    private final Set<String> inserted;
    private final int recordsPerLine;

    /**
     * Creates an empty location set.
     *
     * @param recordsPerLine number of records written per line by {@link #saveToFile(Path)}
     */
    public LocationSet(int recordsPerLine) {
        if (recordsPerLine <= 0) {
            throw new IllegalArgumentException("recordsPerLine must be positive");
        }
        this.tree = new RadixTree();
        this.inserted = new HashSet<>();
        this.recordsPerLine = recordsPerLine;
    }

    /**
     * Marks a location as live.
     *
     * @param record the location to add
     */
    public void insert(LocationRecord record) {
        String serialized = record.serialize();
        tree.insert(serialized);
        inserted.add(serialized);
    }

    /**
     * Coarse liveness check for a location.
     *
     * <p>The serialized query is matched against the root of the tree and every non-empty
     * fragment of the match is parsed back into a record. The first candidate with the same
     * segment id and length as the query is returned. This is not an exact point lookup;
     * use {@link #contains(LocationRecord)} for that.</p>
     *
     * @param record the location to check
     * @return the corroborating record, or empty if no fragment corroborates the query
     * @throws com.umitunal.bitcask.exception.MalformedRecordException if a fragment is not a record
     */
    public Optional<LocationRecord> search(LocationRecord record) {
        MatchResult match = tree.match(record.serialize());
        for (String fragment : match.nonEmptyFragments()) {
            LocationRecord candidate = LocationRecord.parse(fragment);
            if (record.sameSegmentAndLength(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Exact membership test against the tree.
     *
     * @param record the location to look up
     * @return true if exactly this location is live
     */
    public boolean contains(LocationRecord record) {
        return tree.find(record.serialize());
    }

    /**
     * Removes a location.
     *
     * @param record the location to remove
     * @return true if the location was live
     */
    public boolean delete(LocationRecord record) {
        String serialized = record.serialize();
        inserted.remove(serialized);
        if (tree.find(serialized)) {
            return tree.delete(serialized);
        }
        return false;
    }

    public int size() {
        return inserted.size();
    }

    public boolean isEmpty() {
        return inserted.isEmpty();
    }

    /**
     * Adds every record stored in a location set file. A missing or empty file adds nothing.
     *
     * @param path the file to read
     * @throws IOException if the file cannot be read
     * @throws com.umitunal.bitcask.exception.MalformedRecordException if a field is not a record
     */
    public void loadFromFile(Path path) throws IOException {
        if (!Files.exists(path)) {
            logger.debug("Location set file {} does not exist, starting empty", path);
            return;
        }

        int loaded = 0;
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                for (String field : line.strip().split(",")) {
                    if (field.isBlank()) {
                        continue;
                    }
                    insert(LocationRecord.parse(field.strip()));
                    loaded++;
                }
            }
        }
        logger.info("Loaded {} location records from {}", loaded, path);
    }

    /**
     * Rewrites a location set file with the current content of this set.
     * The content is written to a sibling temporary file first and then moved over the target.
     *
     * @param path the file to write
     * @throws IOException if the file cannot be written
     */
    public void saveToFile(Path path) throws IOException {
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        int written = 0;
        try (BufferedWriter writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
            for (String serialized : inserted) {
                writer.write(serialized);
                writer.write(',');
                written++;
                if (written % recordsPerLine == 0) {
                    writer.newLine();
                }
            }
        }
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        logger.debug("Saved {} location records to {}", written, path);
    }
}
