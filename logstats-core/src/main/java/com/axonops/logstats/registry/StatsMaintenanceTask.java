/*
 * Copyright 2025 AxonOps
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.axonops.logstats.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background thread that periodically emits the log summary and prunes stale dynamic counters.
 *
 * Runs as a daemon thread at low priority so it never keeps the JVM alive.
 *
 * @since 1.0.0
 */
final class StatsMaintenanceTask {
    private static final Logger logger = LoggerFactory.getLogger(StatsMaintenanceTask.class);

    private final StatsRegistry registry;
    private final StatsConfig config;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Thread thread;

    StatsMaintenanceTask(StatsRegistry registry, StatsConfig config) {
        this.registry = registry;
        this.config = config;
    }

    /**
     * Starts the maintenance thread.
     */
    void start() {
        if (running.compareAndSet(false, true)) {
            thread = new Thread(this::run, "LogStats-Maintenance");
            thread.setDaemon(true);
            thread.setPriority(Thread.MIN_PRIORITY);
            thread.start();

            logger.info("LogStats: Maintenance thread started - logFrequency: {}s, pruneInterval: {}s, lifetime: {}s",
                config.logFrequencySeconds(), config.pruneIntervalSeconds(), config.lifetimeSeconds());
        }
    }

    /**
     * Stops the maintenance thread gracefully.
     */
    void stop() {
        if (running.compareAndSet(true, false)) {
            logger.info("LogStats: Stopping maintenance thread");

            Thread t = thread;
            if (t != null) {
                t.interrupt();
                try {
                    t.join(5000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }

            logger.info("LogStats: Maintenance thread stopped");
        }
    }

    /**
     * Main loop.
     *
     * Wakes every maintenanceTickSeconds, then runs whichever of the log summary and the prune
     * sweep is due.
     */
    private void run() {
        logger.debug("LogStats: Maintenance thread running");

        long tickMs = config.maintenanceTickSeconds() * 1000;
        long logIntervalMs = config.logFrequencySeconds() * 1000;
        long pruneIntervalMs = config.pruneIntervalSeconds() * 1000;

        long lastLog = System.currentTimeMillis();
        long lastPrune = lastLog;

        while (running.get()) {
            try {
                Thread.sleep(tickMs);

                long now = System.currentTimeMillis();

                if (logIntervalMs > 0 && now - lastLog >= logIntervalMs) {
                    registry.generateLog();
                    lastLog = now;
                }

                if (now - lastPrune >= pruneIntervalMs) {
                    PruneResult result = registry.pruneOldCounters(config.lifetimeSeconds());
                    logger.debug("LogStats: Prune sweep complete - dropped: {}", result.dropped());
                    lastPrune = now;
                }

            } catch (InterruptedException e) {
                logger.debug("LogStats: Maintenance thread interrupted");
                break;
            } catch (Exception e) {
                logger.error("LogStats: Error in maintenance thread", e);
                // Continue running despite errors
            }
        }

        logger.debug("LogStats: Maintenance thread exiting");
    }

    /**
     * Checks if the maintenance thread is running.
     */
    boolean isRunning() {
        return running.get() && thread != null && thread.isAlive();
    }
}
