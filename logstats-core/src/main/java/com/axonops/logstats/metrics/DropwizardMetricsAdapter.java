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

import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Dropwizard Metrics adapter for the statistics registry's self-instrumentation.
 *
 * <p>Wraps a Dropwizard {@link MetricRegistry} and delegates all metric operations to it, so the
 * registry's housekeeping shows up next to the host application's own metrics.
 *
 * <p><strong>Usage:</strong>
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * StatsConfig config = StatsConfig.builder()
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "com.myapp.logstats"))
 *     .build();
 * }</pre>
 *
 * @since 1.0.0
 */
public final class DropwizardMetricsAdapter implements StatsMetricsRegistry {
    private static final Logger logger = LoggerFactory.getLogger(DropwizardMetricsAdapter.class);

    private final MetricRegistry registry;
    private final String prefix;

    /**
     * Creates adapter with default metric prefix: {@code com.axonops.logstats}
     *
     * @param registry the Dropwizard MetricRegistry to register metrics with
     * @throws NullPointerException if registry is null
     */
    public DropwizardMetricsAdapter(MetricRegistry registry) {
        this(registry, "com.axonops.logstats");
    }

    /**
     * Creates adapter with custom metric prefix.
     *
     * <p>With prefix {@code "com.myapp.stats"} the record gauge appears as
     * {@code com.myapp.stats.registry.records.current.count}.
     *
     * @param registry the Dropwizard MetricRegistry to register metrics with
     * @param prefix the metric name prefix
     * @throws NullPointerException if registry or prefix is null
     */
    public DropwizardMetricsAdapter(MetricRegistry registry, String prefix) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.prefix = Objects.requireNonNull(prefix, "prefix cannot be null");
    }

    @Override
    public void incrementCounter(String name) {
        registry.counter(metricName(name)).inc();
    }

    @Override
    public void incrementCounter(String name, long delta) {
        registry.counter(metricName(name)).inc(delta);
    }

    @Override
    public void recordTimer(String name, long durationNanos) {
        registry.timer(metricName(name)).update(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Registers a gauge, replacing any gauge already registered under the same name.
     */
    @Override
    public void registerGauge(String name, Supplier<Number> valueSupplier) {
        String fullName = metricName(name);

        // StatsRegistry.reinit registers its gauges again on the same adapter; the new supplier wins
        if (registry.remove(fullName)) {
            logger.debug("LogStats: Replacing gauge {}", fullName);
        }
        registry.register(fullName, (Gauge<Number>) valueSupplier::get);
    }

    @Override
    public void removeGauge(String name) {
        registry.remove(metricName(name));
    }

    private String metricName(String name) {
        return MetricRegistry.name(prefix, name);
    }
}
