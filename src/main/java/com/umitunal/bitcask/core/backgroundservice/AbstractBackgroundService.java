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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Abstract base class for background services in the Bitcask store.
 * Provides a single named worker thread, periodic scheduling and a cooperative stop flag.
 */
public abstract class AbstractBackgroundService implements BackgroundService {

    protected final Logger logger;
    protected final ScheduledExecutorService executorService;
    protected final String serviceName;
    protected final AtomicBoolean stopping = new AtomicBoolean(false);

    /**
     * Creates a new background service with the specified name.
     *
     * @param serviceName the name of the service, used for logging and thread naming
     */
    protected AbstractBackgroundService(String serviceName) {
        this.serviceName = serviceName;
        this.logger = LoggerFactory.getLogger(this.getClass());

        this.executorService = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "BitcaskStore-" + serviceName);
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Schedules the service's task to run periodically.
     *
     * @param initialDelay delay before first execution
     * @param period time between executions
     * @param timeUnit the time unit of the initialDelay and period parameters
     */
    protected void scheduleTask(long initialDelay, long period, TimeUnit timeUnit) {
        executorService.scheduleAtFixedRate(
            this::executeTask,
            initialDelay,
            period,
            timeUnit
        );
        logger.info(serviceName + " service scheduled to run every " + period + " " +
                    timeUnit.toString().toLowerCase());
    }

    /**
     * Executes the service's task and handles any exceptions.
     * This method is called by the scheduler.
     */
    private void executeTask() {
        if (stopping.get()) {
            return;
        }
        try {
            executeNow();
        } catch (Exception e) {
            logger.error("Error during " + serviceName + " execution", e);
        }
    }

    @Override
    public void executeNow() {
        try {
            logger.debug(serviceName + " service executing");
            doExecute();
            logger.debug(serviceName + " service completed");
        } catch (Exception e) {
            logger.error("Error during " + serviceName + " execution", e);
        }
    }

    /**
     * Implements the actual task logic.
     * This method should be implemented by subclasses.
     */
    protected abstract void doExecute();

    @Override
    public void shutdown() {
        logger.info(serviceName + " service shutting down");
        stopping.set(true);
        executorService.shutdown();

        try {
            if (!executorService.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn(serviceName + " service did not terminate in time, forcing shutdown");
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            logger.warn(serviceName + " service shutdown interrupted, forcing shutdown");
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return executorService.awaitTermination(timeout, unit);
    }

    @Override
    public void shutdownNow() {
        logger.info(serviceName + " service shutting down now");
        stopping.set(true);
        executorService.shutdownNow();
    }

    @Override
    public boolean isStopping() {
        return stopping.get();
    }
}
