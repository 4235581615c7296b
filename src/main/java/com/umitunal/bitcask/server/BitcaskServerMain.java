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

package com.umitunal.bitcask.server;

import com.umitunal.bitcask.config.BitcaskStoreConfig;
import com.umitunal.bitcask.core.store.BitcaskStore;
import com.umitunal.bitcask.protocol.CommandProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Launcher for the TCP server.
 *
 * <p>Reads the system properties {@code bitcask.dir} (default {@code bitcask_db}),
 * {@code bitcask.host} (default {@code 127.0.0.1}) and {@code bitcask.port} (default 9090).
 * On JVM shutdown the server is closed and the store is checkpointed and shut down.</p>
 */
public final class BitcaskServerMain {
    private static final Logger logger = LoggerFactory.getLogger(BitcaskServerMain.class);

    private BitcaskServerMain() {
    }

    public static void main(String[] args) throws IOException, InterruptedException {
        String dir = System.getProperty("bitcask.dir", "bitcask_db");
        String host = System.getProperty("bitcask.host", "127.0.0.1");
        int port = Integer.getInteger("bitcask.port", 9090);

        BitcaskStore store = new BitcaskStore(BitcaskStoreConfig.getDefault().withDataDirectory(dir));
        BitcaskServer server = new BitcaskServer(new CommandProcessor(store), host, port);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received, stopping server");
            server.close();
            store.shutdown();
        }, "BitcaskServer-shutdown"));

        server.start();
        server.awaitTermination();
    }
}
