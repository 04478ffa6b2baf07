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

/**
 * Metric name constants for the registry's self-instrumentation.
 *
 * <p>Names follow the {@code <area>.<object>.<kind>.<unit>} convention, so with the default
 * prefix a Dropwizard registry holds e.g. {@code com.axonops.logstats.prune.sweeps.total.count}.
 *
 * <h2>Gauges</h2>
 *
 * <ul>
 *   <li>{@link #REGISTRY_RECORDS} - counter records currently held, orphaned ones included
 *   <li>{@link #REGISTRY_STATS_LEVEL} - the active stats level
 * </ul>
 *
 * <h2>Counters</h2>
 *
 * <ul>
 *   <li>{@link #REGISTRATIONS_REJECTED} - registrations refused because the stats level was too
 *       low. A high rate is normal when verbose counters are disabled.
 *   <li>{@link #PRUNE_SWEEPS} and {@link #PRUNE_RECORDS_DROPPED}
 *   <li>{@link #LOG_SUMMARIES} and {@link #CSV_EXPORTS}
 * </ul>
 *
 * <h2>Timers</h2>
 *
 * <p>{@link #PRUNE_LATENCY}, {@link #LOG_EXPORT_LATENCY} and {@link #CSV_EXPORT_LATENCY} measure
 * time spent holding the registry lock.
 *
 * @since 1.0.0
 */
public final class MetricNames {

  private MetricNames() {
    // Constants only
  }

  /** Number of counter records in the registry (Gauge). */
  public static final String REGISTRY_RECORDS = "registry.records.current.count";

  /** Active stats level (Gauge). */
  public static final String REGISTRY_STATS_LEVEL = "registry.stats_level.current";

  /** Registrations refused by the stats level (Counter). */
  public static final String REGISTRATIONS_REJECTED = "registry.registrations.rejected.total.count";

  /** Completed prune sweeps (Counter). */
  public static final String PRUNE_SWEEPS = "prune.sweeps.total.count";

  /** Dynamic records removed by pruning (Counter). */
  public static final String PRUNE_RECORDS_DROPPED = "prune.records.dropped.total.count";

  /** Duration of a prune sweep (Timer). */
  public static final String PRUNE_LATENCY = "prune.latency";

  /** Log summaries generated (Counter). */
  public static final String LOG_SUMMARIES = "export.log.total.count";

  /** Duration of log summary generation (Timer). */
  public static final String LOG_EXPORT_LATENCY = "export.log.latency";

  /** CSV documents generated (Counter). */
  public static final String CSV_EXPORTS = "export.csv.total.count";

  /** Duration of CSV generation (Timer). */
  public static final String CSV_EXPORT_LATENCY = "export.csv.latency";
}
