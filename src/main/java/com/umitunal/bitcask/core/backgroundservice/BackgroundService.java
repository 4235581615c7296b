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

import java.util.concurrent.TimeUnit;

/**
 * Interface for background services in the Bitcask store.
 * Each service owns a single dedicated thread.
 */
public interface BackgroundService {

    /**
     * Starts the background service on its thread.
     */
    void start();

    /**
     * Executes the service's task immediately on the calling thread.
     */
    void executeNow();

    /**
     * Signals the service to stop and waits a bounded time for its thread to finish.
     */
    void shutdown();

    /**
     * Waits for the background service to terminate.
     *
     * @param timeout the maximum time to wait
     * @param unit the time unit of the timeout argument
     * @return true if the service terminated, false if the timeout elapsed before termination
     * @throws InterruptedException if interrupted while waiting
     */
    boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Stops the service and interrupts its thread.
     */
    void shutdownNow();

    /**
     * @return true once {@link #shutdown()} or {@link #shutdownNow()} has been called
     */
    boolean isStopping();
}
