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

import com.axonops.logstats.api.StatsComponent;
import com.axonops.logstats.api.StatsContractViolationException;
import com.axonops.logstats.api.StatsCounterItem;
import com.axonops.logstats.api.StatsSource;
import com.axonops.logstats.event.StatsEvent;
import com.axonops.logstats.event.StatsTag;
import com.axonops.logstats.export.StatsCsvFormatter;
import com.axonops.logstats.export.StatsLogFormatter;
import com.axonops.logstats.metrics.MetricNames;
import com.axonops.logstats.metrics.StatsMetricsRegistry;
import java.time.Duration;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of statistics counters.
 *
 * <p>Producers (sources, destinations, filters) register named counters through a {@link
 * StatsLock}, keep the returned {@link StatsCounterItem} handles and update them lock-free. The
 * registry walks all records only to export them ({@link #generateLog()}, {@link #generateCsv()})
 * and to prune stale dynamic counters ({@link #pruneOldCounters(long)}).
 *
 * <p>Each counter record is identified by:
 *
 * <ul>
 *   <li><b>source</b> - the component owning it (see {@link
 *       com.axonops.logstats.api.StatsSource}), e.g. {@code src.file} or {@code center}
 *   <li><b>id</b> - the configuration item it belongs to, e.g. the name of a source
 *   <li><b>instance</b> - a distinguisher within the item: the client address of a TCP source,
 *       the expanded file name of a file destination, or empty
 * </ul>
 *
 * <p>and holds one counter per {@link com.axonops.logstats.api.StatsCounterType}.
 *
 * <p><b>Threading:</b> counter values are atomic and can be changed from any thread without the
 * lock. Registration, unregistration, pruning and export hold one registry-wide {@link
 * ReentrantLock}; {@link #lock()} exposes it so callers can batch several registrations under one
 * acquisition.
 *
 * <p><b>Lifecycle:</b> create with a {@link StatsConfig}, optionally {@link #start()} the
 * maintenance thread, apply configuration changes with {@link #reinit(StatsConfig)}, {@link
 * #shutdown()} when done.
 *
 * @since 1.0.0
 */
public final class StatsRegistry implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(StatsRegistry.class);

  /** Message of the periodic log summary event. */
  public static final String LOG_STATISTICS_MESSAGE = "Log statistics";

  /** Message of the NOTICE event sent after every prune sweep. */
  public static final String PRUNE_FINISHED_MESSAGE = "Pruning stats-counters have finished";

  private final ReentrantLock globalLock = new ReentrantLock();

  // Structural changes only under globalLock, the concurrent map keeps size() safe for gauges
  private final ConcurrentHashMap<CounterKey, CounterRecord> counters = new ConcurrentHashMap<>();

  private final PriorityCounters priorityCounters = new PriorityCounters();

  private final AtomicLong pruneSweeps = new AtomicLong(0);
  private final AtomicLong prunedRecords = new AtomicLong(0);

  private volatile StatsConfig config;
  private StatsMaintenanceTask maintenanceTask;

  /**
   * Creates a registry and applies {@code config}, including the severity/facility counters if
   * its stats level enables them. The maintenance thread is not started.
   *
   * @param config the configuration
   */
  public StatsRegistry(StatsConfig config) {
    this.config = Objects.requireNonNull(config, "config cannot be null");
    registerRegistryMetrics(config.metricsRegistry());
    applyPriorityCounters();

    logger.debug(
        "LogStats: Registry initialized - statsLevel: {}, lifetime: {}s, logFrequency: {}s",
        config.statsLevel(),
        config.lifetimeSeconds(),
        config.logFrequencySeconds());
  }

  /** Creates a registry with {@link StatsConfig#DEFAULT}. */
  public StatsRegistry() {
    this(StatsConfig.DEFAULT);
  }

  public StatsConfig getConfig() {
    return config;
  }

  /**
   * Acquires the registry lock.
   *
   * @return a guard to run lifecycle operations with; close it to release the lock
   */
  public StatsLock lock() {
    return new StatsLock(this);
  }

  /** True if a counter requiring {@code level} would be registered. */
  public boolean checkLevel(int level) {
    return config.admits(level);
  }

  /**
   * Installs a new configuration.
   *
   * <p>Registers the severity/facility counters when the new stats level enables them and
   * unregisters them otherwise. Registering again while already registered only adds references.
   * A running maintenance thread is restarted with the new intervals.
   *
   * @param newConfig the new configuration
   * @throws StatsContractViolationException if the calling thread holds a {@link StatsLock}
   */
  public synchronized void reinit(StatsConfig newConfig) {
    Objects.requireNonNull(newConfig, "newConfig cannot be null");
    requireLockNotHeld("reinit");
    StatsConfig oldConfig = this.config;

    logger.info(
        "LogStats: Reinitializing registry - statsLevel: {} -> {}",
        oldConfig.statsLevel(),
        newConfig.statsLevel());

    boolean restart = maintenanceTask != null && maintenanceTask.isRunning();
    stopMaintenance();

    if (oldConfig.metricsRegistry() != newConfig.metricsRegistry()) {
      removeRegistryMetrics(oldConfig.metricsRegistry());
    }
    this.config = newConfig;
    registerRegistryMetrics(newConfig.metricsRegistry());
    applyPriorityCounters();

    if (restart) {
      startMaintenance();
    }
  }

  /** Starts the maintenance thread (periodic log summary and pruning). Idempotent. */
  public synchronized void start() {
    requireLockNotHeld("start");
    if (maintenanceTask != null && maintenanceTask.isRunning()) {
      return;
    }
    startMaintenance();
  }

  /** True if the maintenance thread is running. */
  public synchronized boolean isMaintenanceRunning() {
    return maintenanceTask != null && maintenanceTask.isRunning();
  }

  /** Stops the maintenance thread. Records stay in place. */
  public synchronized void shutdown() {
    requireLockNotHeld("shutdown");
    logger.info("LogStats: Shutting down registry");
    stopMaintenance();
  }

  @Override
  public void close() {
    shutdown();
  }

  /**
   * Removes orphaned dynamic counters whose stamp is at least {@code lifetimeSeconds} old.
   *
   * <p>Static counters are never pruned, neither are counters with an outstanding registration
   * or without a stamp. After the sweep a NOTICE event carrying {@code dropped} and {@code
   * oldest-timestamp} goes to the event sink.
   *
   * @param lifetimeSeconds age, in seconds, at which an orphaned dynamic counter expires
   * @return number of dropped records and the oldest dropped stamp
   */
  public PruneResult pruneOldCounters(long lifetimeSeconds) {
    StatsConfig cfg = config;
    long start = System.nanoTime();
    long cutoff = cfg.clock().instant().getEpochSecond() - lifetimeSeconds;

    int dropped = 0;
    long oldest = 0;
    try (StatsLock lock = lock()) {
      Iterator<CounterRecord> it = counters.values().iterator();
      while (it.hasNext()) {
        CounterRecord record = it.next();
        if (record.isExpired(cutoff)) {
          long stamp = record.stamp();
          if (dropped == 0 || stamp < oldest) {
            oldest = stamp;
          }
          dropped++;
          it.remove();
          logger.trace("LogStats: Pruned counter {}", record.key());
        }
      }
    }

    pruneSweeps.incrementAndGet();
    prunedRecords.addAndGet(dropped);

    StatsMetricsRegistry metrics = cfg.metricsRegistry();
    metrics.incrementCounter(MetricNames.PRUNE_SWEEPS);
    metrics.incrementCounter(MetricNames.PRUNE_RECORDS_DROPPED, dropped);
    metrics.recordTimer(MetricNames.PRUNE_LATENCY, System.nanoTime() - start);

    cfg.eventSink()
        .send(
            new StatsEvent(
                StatsEvent.Severity.NOTICE,
                PRUNE_FINISHED_MESSAGE,
                List.of(StatsTag.of("dropped", dropped), StatsTag.of("oldest-timestamp", oldest))));
    return new PruneResult(dropped, oldest);
  }

  /**
   * Same as {@link #pruneOldCounters(long)} with a {@link Duration}, truncated to seconds.
   *
   * @param lifetime age at which an orphaned dynamic counter expires
   * @return number of dropped records and the oldest dropped stamp
   */
  public PruneResult pruneOldCounters(Duration lifetime) {
    return pruneOldCounters(lifetime.getSeconds());
  }

  /**
   * Counts a message in the severity and facility counters. Lock-free; does nothing unless the
   * stats level enables these counters.
   *
   * @param pri packed syslog priority ({@code facility << 3 | severity})
   */
  public void incrementPriority(int pri) {
    priorityCounters.increment(pri);
  }

  /**
   * Builds the {@code "Log statistics"} event, one tag per live counter, and sends it to the
   * event sink.
   *
   * @return the event that was sent
   */
  public StatsEvent generateLog() {
    StatsConfig cfg = config;
    long start = System.nanoTime();

    StatsEvent event;
    try (StatsLock lock = lock()) {
      event = StatsLogFormatter.format(LOG_STATISTICS_MESSAGE, counters.values());
    }

    cfg.metricsRegistry().incrementCounter(MetricNames.LOG_SUMMARIES);
    cfg.metricsRegistry().recordTimer(MetricNames.LOG_EXPORT_LATENCY, System.nanoTime() - start);
    cfg.eventSink().send(event);
    return event;
  }

  /**
   * Renders all live counters as CSV, header line included.
   *
   * @return the CSV document
   */
  public String generateCsv() {
    StatsConfig cfg = config;
    long start = System.nanoTime();

    String csv;
    try (StatsLock lock = lock()) {
      csv = StatsCsvFormatter.format(counters.values());
    }

    cfg.metricsRegistry().incrementCounter(MetricNames.CSV_EXPORTS);
    cfg.metricsRegistry().recordTimer(MetricNames.CSV_EXPORT_LATENCY, System.nanoTime() - start);
    return csv;
  }

  /** Gets registry statistics snapshot. */
  public RegistryStatistics getStatistics() {
    try (StatsLock lock = lock()) {
      int dynamic = 0;
      int orphaned = 0;
      int live = 0;
      for (CounterRecord record : counters.values()) {
        if (record.isDynamic()) {
          dynamic++;
        }
        if (record.isOrphaned()) {
          orphaned++;
        }
        live += Integer.bitCount(record.liveMask());
      }
      return new RegistryStatistics(
          counters.size(),
          dynamic,
          orphaned,
          live,
          config.statsLevel(),
          pruneSweeps.get(),
          prunedRecords.get());
    }
  }

  /** Number of records currently held. */
  public int size() {
    return counters.size();
  }

  ReentrantLock globalLock() {
    return globalLock;
  }

  CounterRecord findOrCreate(CounterKey key) {
    requireLockHeld();
    CounterRecord record = counters.get(key);
    if (record == null) {
      // Rejects keys the exporters cannot name before anything is stored
      StatsComponent.of(key.source());
      if (StatsSource.isGroup(key.source())
          && !StatsSource.isSource(key.source())
          && !StatsSource.isDestination(key.source())) {
        throw new StatsContractViolationException("Group counter without direction: " + key);
      }
      record = new CounterRecord(key);
      counters.put(key, record);
      logger.trace("LogStats: Created counter {}", key);
    }
    return record;
  }

  CounterRecord find(CounterKey key) {
    requireLockHeld();
    return counters.get(key);
  }

  Collection<CounterRecord> records() {
    requireLockHeld();
    return counters.values();
  }

  void recordRejection() {
    config.metricsRegistry().incrementCounter(MetricNames.REGISTRATIONS_REJECTED);
  }

  PriorityCounters priorityCounters() {
    return priorityCounters;
  }

  /** True if {@code record} is the record currently stored under its key. */
  boolean contains(CounterRecord record) {
    requireLockHeld();
    return counters.get(record.key()) == record;
  }

  // The monitor is taken before the global lock here; a guard held across these calls can deadlock
  private void requireLockNotHeld(String operation) {
    if (globalLock.isHeldByCurrentThread()) {
      throw new StatsContractViolationException(
          operation + " called while holding the stats lock");
    }
  }

  private void requireLockHeld() {
    if (!globalLock.isHeldByCurrentThread()) {
      throw new StatsContractViolationException("Stats lock is not held by the calling thread");
    }
  }

  private void applyPriorityCounters() {
    try (StatsLock lock = lock()) {
      if (checkLevel(PriorityCounters.STATS_LEVEL)) {
        priorityCounters.register(lock);
      } else {
        priorityCounters.unregister(lock);
      }
    }
  }

  private void startMaintenance() {
    maintenanceTask = new StatsMaintenanceTask(this, config);
    maintenanceTask.start();
  }

  private void stopMaintenance() {
    if (maintenanceTask != null) {
      maintenanceTask.stop();
      maintenanceTask = null;
    }
  }

  private void registerRegistryMetrics(StatsMetricsRegistry metrics) {
    metrics.registerGauge(MetricNames.REGISTRY_RECORDS, counters::size);
    metrics.registerGauge(MetricNames.REGISTRY_STATS_LEVEL, () -> config.statsLevel());
    logger.debug("LogStats: Metrics registered - registry gauges");
  }

  private void removeRegistryMetrics(StatsMetricsRegistry metrics) {
    metrics.removeGauge(MetricNames.REGISTRY_RECORDS);
    metrics.removeGauge(MetricNames.REGISTRY_STATS_LEVEL);
  }
}
