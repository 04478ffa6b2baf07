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

import com.axonops.logstats.event.Slf4jStatsEventSink;
import com.axonops.logstats.event.StatsEventSink;
import com.axonops.logstats.metrics.NoOpMetricsRegistry;
import com.axonops.logstats.metrics.StatsMetricsRegistry;
import java.time.Clock;
import java.util.Objects;

/**
 * Configuration of a {@link StatsRegistry}.
 *
 * <p>Immutable configuration using Java 17 records. Installed when the registry is created and
 * replaced as a whole by {@link StatsRegistry#reinit(StatsConfig)}.
 *
 * <h2>Stats Level</h2>
 *
 * <p>Every registration names the level it requires; it only succeeds if {@code statsLevel} is
 * numerically greater or equal. Levels in use:
 *
 * <ul>
 *   <li><b>0</b> - sources, destinations and other always-on counters
 *   <li><b>1</b> - per-host and per-instance counters
 *   <li><b>2</b> - dynamic per-sender counters
 *   <li><b>3</b> - severity/facility aggregates and other expensive counters
 * </ul>
 *
 * <h2>Dynamic Counter Lifetime</h2>
 *
 * <p>Dynamic counters are kept while referenced. Once orphaned, they are pruned when their
 * stamp is at least {@code lifetimeSeconds} old. The maintenance task runs a sweep every
 * {@code pruneIntervalSeconds}.
 *
 * <h2>Log Summary</h2>
 *
 * <p>Every {@code logFrequencySeconds} the maintenance task sends the {@code "Log statistics"}
 * event to {@code eventSink}. Zero disables the periodic summary.
 *
 * <pre>{@code
 * StatsConfig config = StatsConfig.builder()
 *     .statsLevel(2)
 *     .lifetimeSeconds(300)
 *     .logFrequencySeconds(0)     // no periodic summary
 *     .build();
 * StatsRegistry registry = new StatsRegistry(config);
 * }</pre>
 *
 * @param statsLevel active stats level (must be ≥ 0)
 * @param lifetimeSeconds age after which an orphaned dynamic counter is pruned (must be > 0)
 * @param logFrequencySeconds interval of the periodic log summary, 0 disables it
 * @param pruneIntervalSeconds how often the maintenance task prunes (must be > 0)
 * @param maintenanceTickSeconds how often the maintenance thread wakes up (must be > 0 and ≤
 *     pruneIntervalSeconds)
 * @param eventSink receives log summaries and prune notices
 * @param clock wall clock used for staleness checks
 * @param metricsRegistry self-instrumentation (use {@link NoOpMetricsRegistry} to disable)
 * @since 1.0.0
 * @see StatsRegistry
 */
public record StatsConfig(
    int statsLevel,
    long lifetimeSeconds,
    long logFrequencySeconds,
    long pruneIntervalSeconds,
    long maintenanceTickSeconds,
    StatsEventSink eventSink,
    Clock clock,
    StatsMetricsRegistry metricsRegistry) {

  /**
   * Default configuration: level 0, 10 minute lifetime and summary interval, prune every minute,
   * SLF4J event sink, system clock, metrics disabled.
   */
  public static final StatsConfig DEFAULT =
      new StatsConfig(
          0, // Only always-on counters
          600, // Orphaned dynamic counters live 10 minutes
          600, // Log summary every 10 minutes
          60, // Prune every minute
          5, // Maintenance thread tick
          Slf4jStatsEventSink.INSTANCE,
          Clock.systemUTC(),
          NoOpMetricsRegistry.INSTANCE // Metrics disabled (zero overhead)
          );

  /** Compact constructor with validation. */
  public StatsConfig {
    Objects.requireNonNull(eventSink, "eventSink cannot be null");
    Objects.requireNonNull(clock, "clock cannot be null");
    Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");

    if (statsLevel < 0) {
      throw new IllegalArgumentException("statsLevel must be non-negative");
    }
    if (lifetimeSeconds <= 0) {
      throw new IllegalArgumentException("lifetimeSeconds must be positive");
    }
    if (logFrequencySeconds < 0) {
      throw new IllegalArgumentException("logFrequencySeconds must be non-negative (0 disables)");
    }
    if (pruneIntervalSeconds <= 0) {
      throw new IllegalArgumentException("pruneIntervalSeconds must be positive");
    }
    if (maintenanceTickSeconds <= 0) {
      throw new IllegalArgumentException("maintenanceTickSeconds must be positive");
    }
    if (maintenanceTickSeconds > pruneIntervalSeconds) {
      throw new IllegalArgumentException(
          "maintenanceTickSeconds ("
              + maintenanceTickSeconds
              + "s) must be <= pruneIntervalSeconds ("
              + pruneIntervalSeconds
              + "s)");
    }
  }

  /** True if a registration requiring {@code level} is admitted by this configuration. */
  public boolean admits(int level) {
    return statsLevel >= level;
  }

  /**
   * Creates a builder starting from {@link #DEFAULT}.
   *
   * @return new builder with default values
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Creates a builder initialised from this configuration. */
  public Builder toBuilder() {
    return new Builder()
        .statsLevel(statsLevel)
        .lifetimeSeconds(lifetimeSeconds)
        .logFrequencySeconds(logFrequencySeconds)
        .pruneIntervalSeconds(pruneIntervalSeconds)
        .maintenanceTickSeconds(maintenanceTickSeconds)
        .eventSink(eventSink)
        .clock(clock)
        .metricsRegistry(metricsRegistry);
  }

  /** Builder for {@link StatsConfig}. All fields start with the values of {@link #DEFAULT}. */
  public static class Builder {
    private int statsLevel = 0;
    private long lifetimeSeconds = 600;
    private long logFrequencySeconds = 600;
    private long pruneIntervalSeconds = 60;
    private long maintenanceTickSeconds = 5;
    private StatsEventSink eventSink = Slf4jStatsEventSink.INSTANCE;
    private Clock clock = Clock.systemUTC();
    private StatsMetricsRegistry metricsRegistry = NoOpMetricsRegistry.INSTANCE;

    /**
     * Set the active stats level.
     *
     * @param level stats level (must be ≥ 0)
     * @return this builder
     */
    public Builder statsLevel(int level) {
      this.statsLevel = level;
      return this;
    }

    /**
     * Set the lifetime of orphaned dynamic counters.
     *
     * <p><b>Default: 600 seconds</b>
     *
     * @param seconds lifetime in seconds (must be > 0)
     * @return this builder
     */
    public Builder lifetimeSeconds(long seconds) {
      this.lifetimeSeconds = seconds;
      return this;
    }

    /**
     * Set the interval of the periodic log summary.
     *
     * <p><b>Default: 600 seconds</b>. Zero disables the summary.
     *
     * @param seconds interval in seconds (must be ≥ 0)
     * @return this builder
     */
    public Builder logFrequencySeconds(long seconds) {
      this.logFrequencySeconds = seconds;
      return this;
    }

    /**
     * Set how often the maintenance task prunes.
     *
     * <p><b>Default: 60 seconds</b>
     *
     * @param seconds interval in seconds (must be > 0)
     * @return this builder
     */
    public Builder pruneIntervalSeconds(long seconds) {
      this.pruneIntervalSeconds = seconds;
      return this;
    }

    /**
     * Set how often the maintenance thread wakes up to check its schedules.
     *
     * <p><b>Default: 5 seconds</b>
     *
     * @param seconds tick in seconds (must be > 0 and ≤ pruneIntervalSeconds)
     * @return this builder
     */
    public Builder maintenanceTickSeconds(long seconds) {
      this.maintenanceTickSeconds = seconds;
      return this;
    }

    /**
     * Set the receiver of log summaries and prune notices.
     *
     * @param eventSink event sink (must not be null)
     * @return this builder
     * @throws NullPointerException if eventSink is null
     */
    public Builder eventSink(StatsEventSink eventSink) {
      this.eventSink = Objects.requireNonNull(eventSink, "eventSink cannot be null");
      return this;
    }

    /**
     * Set the clock used for staleness checks.
     *
     * @param clock clock (must not be null)
     * @return this builder
     * @throws NullPointerException if clock is null
     */
    public Builder clock(Clock clock) {
      this.clock = Objects.requireNonNull(clock, "clock cannot be null");
      return this;
    }

    /**
     * Set metrics registry for self-instrumentation.
     *
     * <p><b>Default: {@link NoOpMetricsRegistry}</b>. Use {@link
     * com.axonops.logstats.metrics.DropwizardMetricsAdapter} for Dropwizard Metrics integration.
     *
     * @param metricsRegistry metrics implementation (must not be null)
     * @return this builder
     * @throws NullPointerException if metricsRegistry is null
     */
    public Builder metricsRegistry(StatsMetricsRegistry metricsRegistry) {
      this.metricsRegistry =
          Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
      return this;
    }

    /**
     * Build immutable configuration.
     *
     * @return validated immutable configuration
     * @throws IllegalArgumentException if configuration is invalid
     */
    public StatsConfig build() {
      return new StatsConfig(
          statsLevel,
          lifetimeSeconds,
          logFrequencySeconds,
          pruneIntervalSeconds,
          maintenanceTickSeconds,
          eventSink,
          clock,
          metricsRegistry);
    }
  }
}
