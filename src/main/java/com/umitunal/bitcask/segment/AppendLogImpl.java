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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedByInterruptException;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;

/**
 * Implementation of the AppendLog interface on top of a {@link FileChannel}.
 *
 * <p>All I/O is positional, so reads and erasures run concurrently with appends without
 * moving a shared file pointer. Appends are serialized on this instance.</p>
 *
 * <p>A {@code FileChannel} is closed for every thread when a thread blocked in, or entering,
 * one of its I/O methods is interrupted. The interrupted caller gets the
 * {@link ClosedByInterruptException}; the channel is then reopened, and other callers whose
 * operation was cut short retry once on the new channel. Only {@link #close()} closes the
 * segment for good.</p>
 */
public class AppendLogImpl implements AppendLog {
    private static final Logger logger = LoggerFactory.getLogger(AppendLogImpl.class);

    private final Path path;
    private final int segmentId;
    private final byte fillerByte;
    private final Object appendLock = new Object();
    private final Object channelLock = new Object();

    private volatile FileChannel channel;
    private volatile boolean closed;

    /**
     * Opens a segment file, creating it if it does not exist.
     *
     * @param path the path to the segment file
     * @param segmentId the id of the segment
     * @param fillerByte the byte written by {@link #erase(long, int)}
     * @throws IOException if an I/O error occurs
     */
    public AppendLogImpl(Path path, int segmentId, byte fillerByte) throws IOException {
        this(path, segmentId, fillerByte, openChannel(path));
    }

    /**
     * Creates a segment over an already opened channel.
     *
     * @param path the path to the segment file
     * @param segmentId the id of the segment
     * @param fillerByte the byte written by {@link #erase(long, int)}
     * @param channel a readable and writable channel on the segment file
     */
    AppendLogImpl(Path path, int segmentId, byte fillerByte, FileChannel channel) {
        this.path = path;
        this.segmentId = segmentId;
        this.fillerByte = fillerByte;
        this.channel = channel;
        logger.debug("Opened segment file: " + path);
    }

    @Override
    public Path getPath() {
        return path;
    }

    @Override
    public int getSegmentId() {
        return segmentId;
    }

    @Override
    public long append(byte[] value) throws IOException {
        synchronized (appendLock) {
            return withChannel(ch -> {
                long offset = ch.size();
                writeFully(ch, ByteBuffer.wrap(value), offset);
                return offset;
            });
        }
    }

    @Override
    public byte[] read(long offset, int length) throws IOException {
        return withChannel(ch -> {
            ByteBuffer buffer = ByteBuffer.allocate(length);
            long position = offset;
            while (buffer.hasRemaining()) {
                int read = ch.read(buffer, position);
                if (read < 0) {
                    throw new EOFException("Short read from " + path + ": expected " + length +
                            " bytes at offset " + offset + " but segment ends after " + (position - offset));
                }
                position += read;
            }
            return buffer.array();
        });
    }

    @Override
    public void erase(long offset, int length) throws IOException {
        withChannel(ch -> {
            long size = ch.size();
            if (offset + length > size) {
                throw new IOException("Cannot erase " + length + " bytes at offset " + offset +
                        ", segment " + path + " is only " + size + " bytes long");
            }
            byte[] filler = new byte[length];
            Arrays.fill(filler, fillerByte);
            writeFully(ch, ByteBuffer.wrap(filler), offset);
            return null;
        });
    }

    @Override
    public long size() throws IOException {
        return withChannel(FileChannel::size);
    }

    @Override
    public void sync() throws IOException {
        withChannel(ch -> {
            ch.force(false);
            return null;
        });
    }

    @Override
    public void close() throws IOException {
        synchronized (channelLock) {
            closed = true;
            if (channel.isOpen()) {
                channel.close();
                logger.debug("Closed segment file: " + path);
            }
        }
    }

    private <T> T withChannel(ChannelOperation<T> operation) throws IOException {
        FileChannel current = currentChannel();
        try {
            return operation.apply(current);
        } catch (ClosedByInterruptException e) {
            reopen(current);
            throw e;
        } catch (ClosedChannelException e) {
            // closed under us by another thread's interrupt
            reopen(current);
            return operation.apply(currentChannel());
        }
    }

    private FileChannel currentChannel() throws ClosedChannelException {
        if (closed) {
            throw new ClosedChannelException();
        }
        return channel;
    }

    private void reopen(FileChannel stale) throws IOException {
        synchronized (channelLock) {
            if (closed) {
                throw new ClosedChannelException();
            }
            if (channel == stale && !stale.isOpen()) {
                channel = openChannel(path);
                logger.warn("Segment file " + path + " was closed by an interrupted thread, reopened it");
            }
        }
    }

    private static FileChannel openChannel(Path path) throws IOException {
        return FileChannel.open(path, StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
    }

    private static void writeFully(FileChannel ch, ByteBuffer buffer, long position) throws IOException {
        long at = position;
        while (buffer.hasRemaining()) {
            at += ch.write(buffer, at);
        }
    }

    @Override
    public String toString() {
        return "AppendLog{" +
                "path=" + path +
                ", segmentId=" + segmentId +
                '}';
    }

    @FunctionalInterface
    private interface ChannelOperation<T> {
        T apply(FileChannel channel) throws IOException;
    }
}
