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

import java.io.IOException;
import java.nio.file.Path;

/**
 * Interface for the single append-only data segment.
 * Values are written back to back; the file only ever grows.
 */
public interface AppendLog extends AutoCloseable {

    /**
     * Gets the path of the segment file.
     *
     * @return the path of the segment file
     */
    Path getPath();

    /**
     * Gets the id of the segment.
     *
     * @return the segment id
     */
    int getSegmentId();

    /**
     * Appends bytes at the end of the segment. Concurrent appends never interleave.
     *
     * @param value the bytes to append
     * @return the offset at which the first byte was written
     * @throws IOException if an I/O error occurs
     */
    long append(byte[] value) throws IOException;

    /**
     * Reads exactly {@code length} bytes starting at {@code offset}.
     *
     * @param offset the position of the first byte
     * @param length the number of bytes to read
     * @return the bytes read
     * @throws IOException if the segment ends before {@code length} bytes could be read
     */
    byte[] read(long offset, int length) throws IOException;

    /**
     * Overwrites a byte range with the filler byte. The file size does not change.
     *
     * @param offset the position of the first byte
     * @param length the number of bytes to overwrite
     * @throws IOException if the range extends past the end of the segment or an I/O error occurs
     */
    void erase(long offset, int length) throws IOException;

    /**
     * Gets the current size of the segment, which is also the next write position.
     *
     * @return the size in bytes
     * @throws IOException if an I/O error occurs
     */
    long size() throws IOException;

    /**
     * Forces written content to the storage device.
     *
     * @throws IOException if an I/O error occurs
     */
    void sync() throws IOException;

    /**
     * Closes the segment and releases resources.
     *
     * @throws IOException if an I/O error occurs
     */
    @Override
    void close() throws IOException;
}
