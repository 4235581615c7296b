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


package com.umitunal.bitcask.protocol;

import com.umitunal.bitcask.api.Storage;
import com.umitunal.bitcask.exception.StorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CommandProcessorTest {

    @Mock
    private Storage mockStorage;

    private CommandProcessor processor;

    @BeforeEach
    void setUp() {
        processor = new CommandProcessor(mockStorage);
    }

    @Test
    void testSet() {
        assertEquals("OK", processor.process("SET name alice"));
        verify(mockStorage).put("name", "alice".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void testCommandIsCaseInsensitiveAndSpacesCollapse() {
        assertEquals("OK", processor.process("  set   name    alice  "));
        verify(mockStorage).put("name", "alice".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void testGet() {
        when(mockStorage.get("name")).thenReturn("alice".getBytes(StandardCharsets.UTF_8));
        assertEquals("alice", processor.process("GET name"));
    }

    @Test
    void testGetMissingKey() {
        when(mockStorage.get("missing")).thenReturn(null);
        assertEquals("Error: Key not found", processor.process("get missing"));
    }

    @Test
    void testDelete() {
        assertEquals("OK", processor.process("DELETE name"));
        verify(mockStorage).delete("name");
    }

    @Test
    void testDeleteOfMissingKeyIsOk() {
        when(mockStorage.delete("missing")).thenReturn(false);
        assertEquals("OK", processor.process("DELETE missing"));
    }

    @Test
    void testWrongArity() {
        assertEquals("Error: SET command : SET <key> <value>", processor.process("SET name"));
        assertEquals("Error: SET command : SET <key> <value>", processor.process("SET name alice smith"));
        assertEquals("Error: GET command: GET <key>", processor.process("GET"));
        assertEquals("Error: GET command: GET <key>", processor.process("GET a b"));
        assertEquals("Error: DELETE command : DELETE <key>", processor.process("DELETE"));
        verifyNoInteractions(mockStorage);
    }

    @Test
    void testInvalidCommand() {
        assertEquals("Error: Invalid command", processor.process("PUT a b"));
        assertEquals("Error: Invalid command", processor.process(""));
        assertEquals("Error: Invalid command", processor.process("    "));
        assertEquals("Error: Invalid command", processor.process(null));
        verifyNoInteractions(mockStorage);
    }

    @Test
    void testStorageFailureBecomesErrorLine() {
        doThrow(new StorageException("Failed to put key 'a'")).when(mockStorage).put(eq("a"), any(byte[].class));
        assertEquals("Error: Failed to put key 'a'", processor.process("SET a b"));
    }

    @Test
    void testShutDownStorageBecomesErrorLine() {
        when(mockStorage.get("a")).thenThrow(new IllegalStateException("store is shut down"));
        assertEquals("Error: store is shut down", processor.process("GET a"));
    }

    @Test
    void testConstructorRejectsNull() {
        assertThrows(IllegalArgumentException.class, () -> new CommandProcessor(null));
    }
}
