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

import com.umitunal.bitcask.config.BitcaskStoreConfig;
import com.umitunal.bitcask.exception.MalformedRecordException;
import com.umitunal.bitcask.exception.StorageException;
import com.umitunal.bitcask.index.KeyIndex;
import com.umitunal.bitcask.location.LocationRecord;
import com.umitunal.bitcask.segment.AppendLog;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.channels.ClosedByInterruptException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class BitcaskStoreTest {

    @TempDir
    Path tempDir;

    private BitcaskStoreConfig config;
    private BitcaskStore store;

    @BeforeEach
    void setUp() {
        config = BitcaskStoreConfig.getDefault()
                .withDataDirectory(tempDir.toString())
                .withTombstonePollTimeoutMillis(50);
        store = new BitcaskStore(config);
    }

    @AfterEach
    void tearDown() {
        store.shutdown();
    }

    @Test
    void testPutAndGet() {
        store.put("key1", bytes("value1"));
        store.put("key2", bytes("value2"));

        assertArrayEquals(bytes("value1"), store.get("key1"));
        assertArrayEquals(bytes("value2"), store.get("key2"));
        assertNull(store.get("missing"));
        assertEquals(2, store.size());
        assertTrue(store.containsKey("key1"));
    }

    @Test
    void testOverwriteReturnsLatestValue() {
        store.put("key", bytes("first"));
        store.put("key", bytes("second, longer"));

        assertArrayEquals(bytes("second, longer"), store.get("key"));
        assertEquals(1, store.size());
        assertEquals(new LocationRecord(1, 5, 14), store.getLocation("key"));
    }

    @Test
    void testValuesAreAppendedContiguously() throws IOException {
        store.put("a", bytes("hello"));
        store.put("b", bytes("world"));

        assertEquals(new LocationRecord(1, 0, 5), store.getLocation("a"));
        assertEquals(new LocationRecord(1, 5, 5), store.getLocation("b"));
        assertEquals("helloworld", Files.readString(store.getSegmentPath(), StandardCharsets.UTF_8));
    }

    @Test
    void testEmptyValue() {
        store.put("empty", new byte[0]);
        assertArrayEquals(new byte[0], store.get("empty"));
        assertTrue(store.delete("empty"));
        assertNull(store.get("empty"));
    }

    @Test
    void testDelete() {
        store.put("key", bytes("value"));

        assertTrue(store.delete("key"));
        assertNull(store.get("key"));
        assertFalse(store.containsKey("key"));
        assertFalse(store.delete("key"));
        assertEquals(0, store.size());
    }

    @Test
    void testDeleteDoesNotAffectPrefixKeys() {
        store.put("a", bytes("1"));
        store.put("ab", bytes("22"));
        store.put("abc", bytes("333"));

        assertArrayEquals(bytes("1"), store.get("a"));
        assertArrayEquals(bytes("22"), store.get("ab"));
        assertArrayEquals(bytes("333"), store.get("abc"));

        assertTrue(store.delete("ab"));

        assertArrayEquals(bytes("1"), store.get("a"));
        assertNull(store.get("ab"));
        assertArrayEquals(bytes("333"), store.get("abc"));
    }

    @Test
    void testDeletedValueIsErased() throws IOException {
        store.put("a", bytes("keep"));
        store.put("b", bytes("secret"));
        store.put("c", bytes("tail"));

        store.delete("b");
        store.processTombstones();

        assertEquals(0, store.getPendingTombstoneCount());
        assertEquals("keep      tail", awaitSegmentContent("keep      tail"));
        assertArrayEquals(bytes("tail"), store.get("c"));
    }

    @Test
    void testBackgroundWorkerErasesDeletedValue() throws IOException {
        store.put("a", bytes("secret"));
        store.delete("a");

        assertEquals("      ", awaitSegmentContent("      "));
    }

    @Test
    void testDataSurvivesShutdownAndReopen() {
        store.put("k1", bytes("v1"));
        store.put("k2", bytes("v2"));
        store.put("k3", bytes("v3"));
        store.delete("k2");
        store.shutdown();

        store = new BitcaskStore(config);

        assertArrayEquals(bytes("v1"), store.get("k1"));
        assertNull(store.get("k2"));
        assertArrayEquals(bytes("v3"), store.get("k3"));
        assertEquals(2, store.size());
    }

    @Test
    void testCheckpointWritesAllFiles() throws IOException {
        store.put("key", bytes("value"));
        store.checkpoint();

        assertTrue(Files.exists(tempDir.resolve(BitcaskStoreConfig.KEY_INDEX_FILE)));
        assertEquals("1:0:5,", Files.readString(tempDir.resolve(BitcaskStoreConfig.LOCATION_SET_FILE)).strip());
        assertEquals("{\"db_file_size\": 0, \"db_file_offset\": 5}",
                Files.readString(tempDir.resolve(BitcaskStoreConfig.METADATA_FILE)));
    }

    @Test
    void testCheckpointedStateIsVisibleToSecondInstance() {
        store.put("key", bytes("value"));
        store.checkpoint();

        BitcaskStore other = new BitcaskStore(config.withCheckpointIntervalSeconds(3600));
        try {
            assertArrayEquals(bytes("value"), other.get("key"));
        } finally {
            other.shutdown();
        }
    }

    @Test
    void testWritesAfterCheckpointAreNotIndexedOnRecovery() throws IOException {
        store.put("key", bytes("value"));
        store.checkpoint();

        // simulate data appended by a process that crashed before its next checkpoint
        Files.writeString(store.getSegmentPath(), "valueorphan", StandardCharsets.UTF_8);

        BitcaskStore other = new BitcaskStore(config);
        try {
            assertArrayEquals(bytes("value"), other.get("key"));
            other.put("new", bytes("x"));
            assertEquals(new LocationRecord(1, 11, 1), other.getLocation("new"));
        } finally {
            other.shutdown();
        }
    }

    @Test
    void testInterruptedReaderDoesNotBreakOtherCallers() throws Exception {
        store.put("key", bytes("value"));

        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread reader = new Thread(() -> {
            Thread.currentThread().interrupt();
            try {
                store.get("key");
            } catch (StorageException e) {
                failure.set(e.getCause());
            }
        });
        reader.start();
        reader.join();

        assertInstanceOf(ClosedByInterruptException.class, failure.get());
        assertArrayEquals(bytes("value"), store.get("key"));
        store.put("other", bytes("x"));
        assertArrayEquals(bytes("x"), store.get("other"));
        assertDoesNotThrow(() -> store.checkpoint());
    }

    @Test
    void testCheckpointWritesIndexesWhenSyncFails() throws IOException {
        Path dir = Files.createDirectories(tempDir.resolve("sync-fails"));
        AppendLog failingLog = mock(AppendLog.class);
        when(failingLog.getSegmentId()).thenReturn(1);
        doThrow(new IOException("fsync failed")).when(failingLog).sync();

        BitcaskStore other = new BitcaskStore(config.withDataDirectory(dir.toString()), failingLog);
        try {
            other.put("key", bytes("value"));
            assertDoesNotThrow(() -> other.checkpoint());
        } finally {
            other.shutdown();
        }

        assertEquals("1:0:5,", Files.readString(dir.resolve(BitcaskStoreConfig.LOCATION_SET_FILE)).strip());
        assertTrue(Files.exists(dir.resolve(BitcaskStoreConfig.METADATA_FILE)));
        KeyIndex saved = new KeyIndex();
        saved.loadFromFile(dir.resolve(BitcaskStoreConfig.KEY_INDEX_FILE));
        assertEquals(new LocationRecord(1, 0, 5), saved.get("key"));
        verify(failingLog).close();
    }

    @Test
    void testCorruptKeyIndexFailsOpen() throws IOException {
        store.put("key", bytes("value"));
        store.shutdown();
        Files.writeString(tempDir.resolve(BitcaskStoreConfig.KEY_INDEX_FILE), "garbage");

        assertThrows(MalformedRecordException.class, () -> new BitcaskStore(config));
    }

    @Test
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> store.put(null, bytes("v")));
        assertThrows(IllegalArgumentException.class, () -> store.put("", bytes("v")));
        assertThrows(IllegalArgumentException.class, () -> store.put("key", null));
        assertThrows(IllegalArgumentException.class, () -> store.get(null));
        assertThrows(IllegalArgumentException.class, () -> store.delete(""));
        assertThrows(IllegalArgumentException.class, () -> store.containsKey(null));
    }

    @Test
    void testOperationsAfterShutdownFail() {
        store.shutdown();

        assertThrows(IllegalStateException.class, () -> store.put("key", bytes("value")));
        assertThrows(IllegalStateException.class, () -> store.get("key"));
        assertThrows(IllegalStateException.class, () -> store.delete("key"));
        assertThrows(IllegalStateException.class, () -> store.checkpoint());
        store.shutdown();
    }

    @Test
    void testListKeys() {
        store.put("a", bytes("1"));
        store.put("b", bytes("2"));
        store.put("c", bytes("3"));
        store.delete("b");

        assertEquals(Set.of("a", "c"), new HashSet<>(store.listKeys()));
    }

    @Test
    void testConcurrentWritersAndReaders() throws Exception {
        int threads = 8;
        int perThread = 200;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int thread = t;
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < perThread; i++) {
                        String key = "t" + thread + "-k" + i;
                        store.put(key, bytes("value-" + key));
                        assertArrayEquals(bytes("value-" + key), store.get(key));
                        if (i % 3 == 0) {
                            assertTrue(store.delete(key));
                        }
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        int expected = threads * (perThread - (perThread + 2) / 3);
        assertEquals(expected, store.size());
        for (int t = 0; t < threads; t++) {
            for (int i = 0; i < perThread; i++) {
                String key = "t" + t + "-k" + i;
                if (i % 3 == 0) {
                    assertNull(store.get(key));
                } else {
                    assertArrayEquals(bytes("value-" + key), store.get(key));
                }
            }
        }
    }

    // the worker may have taken the location off the queue and still be writing
    private String awaitSegmentContent(String expected) throws IOException {
        long deadline = System.currentTimeMillis() + 5000;
        String content = Files.readString(store.getSegmentPath(), StandardCharsets.UTF_8);
        while (!content.equals(expected) && System.currentTimeMillis() < deadline) {
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            content = Files.readString(store.getSegmentPath(), StandardCharsets.UTF_8);
        }
        return content;
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
