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
package com.axonops.logstats.dropwizard;

import com.axonops.logstats.metrics.DropwizardMetricsAdapter;
import com.axonops.logstats.registry.StatsConfig;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Convenience factory for {@link StatsConfig} with Dropwizard Metrics integration.
 *
 * <p>Wires the registry's self-instrumentation (prune sweeps, export latency, record count)
 * into an application's {@link MetricRegistry}, and optionally exposes that registry through JMX.
 *
 * <p><strong>Usage Examples:</strong>
 * <pre>{@code
 * // Application that already owns a MetricRegistry:
 * StatsConfig config = StatsMetricsConfig.withMetrics(appRegistry, "com.myapp.logstats");
 * StatsRegistry stats = new StatsRegistry(config);
 *
 * // Keep other settings and only add metrics:
 * StatsConfig tuned = StatsMetricsConfig.withMetrics(
 *     StatsConfig.builder().statsLevel(3), appRegistry, "com.myapp.logstats", false);
 * }</pre>
 *
 * @since 1.0.0
 */
public final class StatsMetricsConfig {
    private static final Logger logger = LoggerFactory.getLogger(StatsMetricsConfig.class);
    private static volatile JmxReporter jmxReporter;

    public static final String DEFAULT_PREFIX = "com.axonops.logstats";

    private StatsMetricsConfig() {
        // Utility class
    }

    /**
     * Creates StatsConfig with Dropwizard Metrics integration and automatic JMX.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @return configuration with metrics enabled and all other settings at their defaults
     */
    public static StatsConfig withMetrics(MetricRegistry registry, String metricPrefix) {
        return withMetrics(registry, metricPrefix, true);
    }

    /**
     * Creates StatsConfig with Dropwizard Metrics integration.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @param enableJmx whether to automatically set up JMX exposure
     * @return configuration with metrics enabled and all other settings at their defaults
     */
    public static StatsConfig withMetrics(MetricRegistry registry, String metricPrefix, boolean enableJmx) {
        return withMetrics(StatsConfig.builder(), registry, metricPrefix, enableJmx);
    }

    /**
     * Creates StatsConfig with Dropwizard Metrics using default prefix {@value #DEFAULT_PREFIX}.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @return configuration with metrics enabled
     */
    public static StatsConfig withMetrics(MetricRegistry registry) {
        return withMetrics(registry, DEFAULT_PREFIX, true);
    }

    /**
     * Completes a partially configured builder with Dropwizard Metrics integration.
     *
     * @param builder builder carrying the other settings
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @param enableJmx whether to automatically set up JMX exposure
     * @return configuration built from {@code builder} with metrics enabled
     */
    public static StatsConfig withMetrics(
            StatsConfig.Builder builder, MetricRegistry registry, String metricPrefix, boolean enableJmx) {
        Objects.requireNonNull(builder, "builder cannot be null");
        Objects.requireNonNull(registry, "registry cannot be null");
        Objects.requireNonNull(metricPrefix, "metricPrefix cannot be null");

        if (enableJmx) {
            ensureJmxReporter(registry);
        }

        return builder
            .metricsRegistry(new DropwizardMetricsAdapter(registry, metricPrefix))
            .build();
    }

    /** True if a JmxReporter was started by this factory and not yet stopped. */
    public static boolean isJmxReporterRunning() {
        return jmxReporter != null;
    }

    /**
     * Ensures JmxReporter is registered for the given MetricRegistry.
     *
     * <p>Idempotent: only one reporter is ever created.
     *
     * @param registry the MetricRegistry to expose via JMX
     */
    private static synchronized void ensureJmxReporter(MetricRegistry registry) {
        if (jmxReporter == null) {
            try {
                logger.info("LogStats: Registering JmxReporter for metrics");
                jmxReporter = JmxReporter.forRegistry(registry).build();
                jmxReporter.start();
                logger.info("LogStats: JmxReporter started - metrics available via JMX");
            } catch (Exception e) {
                // Not fatal - registry may already have JMX exposure
                logger.warn("LogStats: Failed to start JmxReporter (may already be configured)", e);
            }
        }
    }

    /**
     * Stops the JmxReporter started by this factory, if any.
     */
    public static synchronized void shutdown() {
        if (jmxReporter != null) {
            logger.info("LogStats: Stopping JmxReporter");
            jmxReporter.stop();
            jmxReporter = null;
        }
    }
}
