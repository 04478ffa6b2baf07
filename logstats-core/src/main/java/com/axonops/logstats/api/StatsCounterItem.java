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

package com.axonops.logstats.api;

import java.util.concurrent.atomic.AtomicLong;

/**
 * A single statistics counter value.
 *
 * <p>Handles to counter items are returned by the registration methods of {@link
 * com.axonops.logstats.registry.StatsLock}. Once a caller holds a handle, all mutations are
 * lock-free and thread-safe; the registry lock is never needed to change a value.
 *
 * <p>Registration returns {@code null} when the configured stats level disables a counter. The
 * static helpers on this class ({@link #increment(StatsCounterItem)} and friends) accept such a
 * {@code null} handle and do nothing, so call sites never need to branch on the stats level.
 *
 * @since 1.0.0
 */
public final class StatsCounterItem {

  private final AtomicLong value = new AtomicLong(0);

  /** Creates a counter item with value zero. Only the registry allocates items. */
  public StatsCounterItem() {}

  /** Atomically adds one. */
  public void inc() {
    value.incrementAndGet();
  }

  /** Atomically subtracts one. */
  public void dec() {
    value.decrementAndGet();
  }

  /**
   * Atomically adds {@code delta}.
   *
   * @param delta amount to add, may be negative
   */
  public void add(long delta) {
    value.addAndGet(delta);
  }

  /**
   * Overwrites the value. Used for {@link StatsCounterType#STAMP} counters.
   *
   * @param newValue the new value
   */
  public void set(long newValue) {
    value.set(newValue);
  }

  /** Returns the current value. */
  public long get() {
    return value.get();
  }

  /** Increments {@code counter} if it is registered. */
  public static void increment(StatsCounterItem counter) {
    if (counter != null) {
      counter.inc();
    }
  }

  /** Decrements {@code counter} if it is registered. */
  public static void decrement(StatsCounterItem counter) {
    if (counter != null) {
      counter.dec();
    }
  }

  /** Adds {@code delta} to {@code counter} if it is registered. */
  public static void add(StatsCounterItem counter, long delta) {
    if (counter != null) {
      counter.add(delta);
    }
  }

  /** Sets {@code counter} to {@code newValue} if it is registered. */
  public static void set(StatsCounterItem counter, long newValue) {
    if (counter != null) {
      counter.set(newValue);
    }
  }

  /**
   * Reads {@code counter}.
   *
   * @return the value, or 0 for an unregistered ({@code null}) counter
   */
  public static long get(StatsCounterItem counter) {
    return counter != null ? counter.get() : 0;
  }

  @Override
  public String toString() {
    return Long.toString(value.get());
  }
}
