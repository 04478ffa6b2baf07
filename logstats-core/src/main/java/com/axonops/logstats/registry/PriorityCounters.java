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

import com.axonops.logstats.api.StatsCounterItem;
import com.axonops.logstats.api.StatsCounterType;
import com.axonops.logstats.api.StatsSource;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Per-severity and per-facility PROCESSED counters.
 *
 * <p>Slots are populated by {@link StatsRegistry#reinit} under the registry lock and read without
 * it by {@link #increment(int)}, the hot path for every received message.
 *
 * @since 1.0.0
 */
final class PriorityCounters {

  /** Stats level that enables these counters. */
  static final int STATS_LEVEL = 3;

  /** LOG_DEBUG (7) + 1. */
  static final int SEVERITY_MAX = 0x7 + 1;

  /** LOG_LOCAL7 (23) + 1, plus one slot collecting every larger facility. */
  static final int FACILITY_MAX = 23 + 1 + 1;

  static final int SEVERITY_SOURCE = StatsSource.SEVERITY | StatsSource.SOURCE;
  static final int FACILITY_SOURCE = StatsSource.FACILITY | StatsSource.SOURCE;
  static final String OTHER_FACILITY = "other";

  private static final int PRI_MASK = 0x07;
  private static final int FACILITY_MASK = 0x03f8;

  private final AtomicReferenceArray<StatsCounterItem> severityCounters =
      new AtomicReferenceArray<>(SEVERITY_MAX);
  private final AtomicReferenceArray<StatsCounterItem> facilityCounters =
      new AtomicReferenceArray<>(FACILITY_MAX);

  /** Registers every slot. Re-registering an already populated slot only adds a reference. */
  void register(StatsLock lock) {
    for (int i = 0; i < SEVERITY_MAX; i++) {
      severityCounters.set(
          i,
          lock.registerCounter(
              STATS_LEVEL, SEVERITY_SOURCE, null, Integer.toString(i), StatsCounterType.PROCESSED));
    }
    for (int i = 0; i < FACILITY_MAX; i++) {
      facilityCounters.set(
          i,
          lock.registerCounter(
              STATS_LEVEL, FACILITY_SOURCE, null, facilityInstance(i), StatsCounterType.PROCESSED));
    }
  }

  /** Unregisters every populated slot and clears it. */
  void unregister(StatsLock lock) {
    for (int i = 0; i < SEVERITY_MAX; i++) {
      lock.unregisterCounter(
          SEVERITY_SOURCE,
          null,
          Integer.toString(i),
          StatsCounterType.PROCESSED,
          severityCounters.getAndSet(i, null));
    }
    for (int i = 0; i < FACILITY_MAX; i++) {
      lock.unregisterCounter(
          FACILITY_SOURCE,
          null,
          facilityInstance(i),
          StatsCounterType.PROCESSED,
          facilityCounters.getAndSet(i, null));
    }
  }

  /**
   * Counts one message of priority {@code pri}.
   *
   * @param pri packed priority, facility in bits 3-9 and severity in bits 0-2
   */
  void increment(int pri) {
    StatsCounterItem.increment(severityCounters.get(pri & PRI_MASK));

    int facility = (pri & FACILITY_MASK) >> 3;
    if (facility > FACILITY_MAX - 1) {
      // Large facilities are collected in the last slot
      facility = FACILITY_MAX - 1;
    }
    StatsCounterItem.increment(facilityCounters.get(facility));
  }

  StatsCounterItem severity(int severity) {
    return severityCounters.get(severity);
  }

  StatsCounterItem facility(int facility) {
    return facilityCounters.get(facility);
  }

  static String facilityInstance(int slot) {
    return slot == FACILITY_MAX - 1 ? OTHER_FACILITY : Integer.toString(slot);
  }
}
