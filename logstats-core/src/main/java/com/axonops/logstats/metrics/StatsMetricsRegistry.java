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
package com.axonops.logstats.metrics;

import java.util.function.Supplier;

/**
 * Self-instrumentation hook of the statistics registry.
 *
 * <p>The registry reports its own housekeeping (prune sweeps, admission rejections, export
 * latency) through this interface so it can run with or without a Dropwizard Metrics dependency
 * on the application side. See {@link MetricNames} for the names reported.
 *
 * <p><strong>Thread Safety:</strong> All implementations must be thread-safe.
 *
 * @since 1.0.0
 */
public interface StatsMetricsRegistry {

    /**
     * Increment a counter by 1.
     *
     * @param name metric name (e.g., "prune.sweeps.total.count")
     */
    void incrementCounter(String name);

    /**
     * Increment a counter by a specific delta.
     *
     * @param name metric name
     * @param delta amount to increment (must be non-negative)
     */
    void incrementCounter(String name, long delta);

    /**
     * Record a timer measurement in nanoseconds.
     *
     * @param name metric name (e.g., "prune.latency")
     * @param durationNanos duration in nanoseconds
     */
    void recordTimer(String name, long durationNanos);

    /**
     * Register a gauge that computes its value on-demand. Replaces any gauge with the same name.
     *
     * @param name metric name (e.g., "registry.records.current.count")
     * @param valueSupplier function that returns the current value, must not block
     */
    void registerGauge(String name, Supplier<Number> valueSupplier);

    /**
     * Remove a previously registered gauge. No-op if absent.
     *
     * @param name metric name to remove
     */
    void removeGauge(String name);
}
