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

import com.umitunal.bitcask.protocol.CommandProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Line-oriented TCP front end. Each accepted connection is served by its own thread, which
 * reads one command per line and writes one response line per command until the client
 * disconnects.
 *
 * <p>The server does not own the storage behind its {@link CommandProcessor}; closing the
 * server leaves the storage open.</p>
 */
public class BitcaskServer implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(BitcaskServer.class);

    private final CommandProcessor processor;
    private final String host;
    private final int port;
    private final ExecutorService connectionPool;
    private final Set<Socket> clients = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private ServerSocket serverSocket;
    private Thread acceptThread;

    /**
     * @param processor executes the commands read from clients
     * @param host the address to bind
     * @param port the port to bind, 0 for an ephemeral port
     */
    public BitcaskServer(CommandProcessor processor, String host, int port) {
        if (processor == null) throw new IllegalArgumentException("processor cannot be null");
        this.processor = processor;
        this.host = host;
        this.port = port;

        AtomicInteger connectionCounter = new AtomicInteger();
        this.connectionPool = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "BitcaskServer-connection-" + connectionCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Binds the server socket and starts accepting connections.
     *
     * @throws IOException if the socket cannot be bound
     */
    public synchronized void start() throws IOException {
        if (serverSocket != null) {
            throw new IllegalStateException("Server already started");
        }
        serverSocket = new ServerSocket(port, 1024, InetAddress.getByName(host));
        acceptThread = new Thread(this::acceptLoop, "BitcaskServer-accept");
        acceptThread.start();
        logger.info("Running TCP server on {}:{}", host, getPort());
    }

    /**
     * @return the bound port, which differs from the configured one when that was 0
     */
    public int getPort() {
        return serverSocket != null ? serverSocket.getLocalPort() : port;
    }

    /**
     * Blocks until the server has been closed.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    public void awaitTermination() throws InterruptedException {
        Thread thread = acceptThread;
        if (thread != null) {
            thread.join();
        }
    }

    private void acceptLoop() {
        while (!closed.get()) {
            try {
                Socket client = serverSocket.accept();
                clients.add(client);
                connectionPool.execute(() -> serve(client));
            } catch (SocketException e) {
                if (!closed.get()) {
                    logger.error("Server socket failed", e);
                }
                return;
            } catch (IOException e) {
                logger.warn("Error accepting connection", e);
            }
        }
    }

    private void serve(Socket client) {
        String remote = String.valueOf(client.getRemoteSocketAddress());
        logger.debug("Client connected: {}", remote);
        try (client;
             BufferedReader in = new BufferedReader(new InputStreamReader(client.getInputStream(), StandardCharsets.UTF_8));
             BufferedWriter out = new BufferedWriter(new OutputStreamWriter(client.getOutputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = in.readLine()) != null) {
                logger.debug("Received from {}: {}", remote, line);
                out.write(processor.process(line));
                out.write('\n');
                out.flush();
            }
        } catch (IOException e) {
            if (!closed.get()) {
                logger.warn("Connection to {} failed", remote, e);
            }
        } finally {
            clients.remove(client);
            logger.debug("Client disconnected: {}", remote);
        }
    }

    /**
     * Stops accepting connections and closes every open client connection.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            if (serverSocket != null) {
                serverSocket.close();
            }
        } catch (IOException e) {
            logger.warn("Error closing server socket", e);
        }
        for (Socket client : clients) {
            try {
                client.close();
            } catch (IOException e) {
                logger.warn("Error closing client connection", e);
            }
        }
        connectionPool.shutdown();
        try {
            if (!connectionPool.awaitTermination(5, TimeUnit.SECONDS)) {
                connectionPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            connectionPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Server shut down");
    }
}
