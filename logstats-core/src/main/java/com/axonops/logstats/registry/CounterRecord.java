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

import com.axonops.logstats.api.StatsContractViolationException;
import com.axonops.logstats.api.StatsCounterItem;
import com.axonops.logstats.api.StatsCounterType;

/**
 * One registry entry: a counter slot per {@link StatsCounterType}, plus bookkeeping.
 *
 * <p>Bookkeeping fields (reference count, live mask, dynamic flag) are guarded by the registry
 * lock and only change through {@link StatsLock}. Counter values are independent of that lock.
 *
 * <p>A {@code CounterRecord} obtained from {@link StatsLock#registerDynamicCounter} doubles as the
 * "family handle" used to attach further counter types without another key lookup.
 *
 * @since 1.0.0
 */
public final class CounterRecord {

  private final CounterKey key;
  private final StatsCounterItem[] counters;

  // Guarded by the registry lock
  private int refCount;
  private int liveMask;
  private boolean dynamic;

  CounterRecord(CounterKey key) {
    this.key = key;
    StatsCounterType[] types = StatsCounterType.values();
    this.counters = new StatsCounterItem[types.length];
    for (int i = 0; i < types.length; i++) {
      counters[i] = new StatsCounterItem();
    }
  }

  public CounterKey key() {
    return key;
  }

  public int source() {
    return key.source();
  }

  public String id() {
    return key.id();
  }

  public String instance() {
    return key.instance();
  }

  /** Number of outstanding registrations. */
  public int refCount() {
    return refCount;
  }

  public boolean isDynamic() {
    return dynamic;
  }

  public boolean isOrphaned() {
    return refCount == 0;
  }

  /** True if {@code type} has ever been registered on this record. */
  public boolean isLive(StatsCounterType type) {
    return (liveMask & type.mask()) != 0;
  }

  public int liveMask() {
    return liveMask;
  }

  public CounterState state() {
    if (dynamic) {
      return CounterState.DYNAMIC;
    }
    return refCount == 0 ? CounterState.ORPHANED : CounterState.ACTIVE;
  }

  /**
   * Returns the counter slot for {@code type}, or {@code null} if that type is not live.
   *
   * @param type counter type
   * @return the slot, identical to the handle handed out at registration
   */
  public StatsCounterItem counter(StatsCounterType type) {
    return isLive(type) ? counters[type.ordinal()] : null;
  }

  /** Current value of {@code type}, 0 if the type is not live. */
  public long value(StatsCounterType type) {
    return StatsCounterItem.get(counter(type));
  }

  StatsCounterItem activate(StatsCounterType type) {
    liveMask |= type.mask();
    return counters[type.ordinal()];
  }

  void retain() {
    refCount++;
  }

  void release() {
    if (refCount == 0) {
      throw new StatsContractViolationException("Reference count underflow on " + key);
    }
    refCount--;
  }

  void markDynamic() {
    dynamic = true;
  }

  /** True if {@code counter} is the live slot for {@code type} on this record. */
  boolean owns(StatsCounterType type, StatsCounterItem counter) {
    return isLive(type) && counters[type.ordinal()] == counter;
  }

  /** True if this record is dynamic, orphaned and its stamp is at or before {@code cutoff}. */
  boolean isExpired(long cutoff) {
    if (!dynamic) {
      // Bounded by configuration, never pruned
      return false;
    }
    if (refCount > 0) {
      return false;
    }
    if (!isLive(StatsCounterType.STAMP)) {
      return false;
    }
    return counters[StatsCounterType.STAMP.ordinal()].get() <= cutoff;
  }

  long stamp() {
    return counters[StatsCounterType.STAMP.ordinal()].get();
  }

  @Override
  public String toString() {
    return "CounterRecord{"
        + key
        + ", refCount="
        + refCount
        + ", dynamic="
        + dynamic
        + ", liveMask=0x"
        + Integer.toHexString(liveMask)
        + '}';
  }
}
