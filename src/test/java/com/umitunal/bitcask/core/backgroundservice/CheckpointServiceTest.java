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
import com.umitunal.bitcask.exception.StorageException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CheckpointServiceTest {

    @Mock
    private Storage mockStorage;

    private CheckpointService checkpointService;

    @BeforeEach
    void setUp() {
        BitcaskStoreConfig config = BitcaskStoreConfig.getDefault().withCheckpointIntervalSeconds(1);
        checkpointService = new CheckpointService(mockStorage, config);
    }

    @AfterEach
    void tearDown() {
        checkpointService.shutdown();
    }

    @Test
    void testExecuteNowCheckpoints() {
        checkpointService.executeNow();
        verify(mockStorage).checkpoint();
    }

    @Test
    void testCheckpointFailureIsNotPropagated() {
        doThrow(new StorageException("disk full")).when(mockStorage).checkpoint();

        assertDoesNotThrow(() -> checkpointService.executeNow());
        verify(mockStorage).checkpoint();
    }

    @Test
    void testScheduledCheckpointRuns() {
        checkpointService.start();
        verify(mockStorage, timeout(3000).atLeastOnce()).checkpoint();
    }

    @Test
    void testShutdown() throws InterruptedException {
        checkpointService.start();
        checkpointService.shutdown();

        assertTrue(checkpointService.isStopping());
        assertTrue(checkpointService.awaitTermination(1, TimeUnit.SECONDS));
    }
}
