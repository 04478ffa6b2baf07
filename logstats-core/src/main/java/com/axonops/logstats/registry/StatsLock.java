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
import java.util.Collection;
import java.util.Collections;
import java.util.Objects;

/**
 * Scoped hold of the registry's global lock, and the only way to register or unregister
 * counters.
 *
 * <p>Obtained from {@link StatsRegistry#lock()} and released by {@link #close()}. Several
 * lifecycle calls can be batched under one acquisition:
 *
 * <pre>{@code
 * StatsCounterItem processed;
 * StatsCounterItem dropped;
 * try (StatsLock lock = registry.lock()) {
 *   processed = lock.registerCounter(0, StatsSource.FILE | StatsSource.DESTINATION, "d_file",
 *       "/var/log/messages", StatsCounterType.PROCESSED);
 *   dropped = lock.registerCounter(0, StatsSource.FILE | StatsSource.DESTINATION, "d_file",
 *       "/var/log/messages", StatsCounterType.DROPPED);
 * }
 * StatsCounterItem.increment(processed);   // lock-free
 * }</pre>
 *
 * <p>A guard belongs to the thread that acquired it. Using it from another thread, or after it
 * was closed, throws {@link StatsContractViolationException}.
 *
 * <p>{@link StatsRegistry#reinit}, {@link StatsRegistry#start()} and {@link
 * StatsRegistry#shutdown()} must not be called while a guard is held; they throw {@link
 * StatsContractViolationException} if they are.
 *
 * @since 1.0.0
 */
public final class StatsLock implements AutoCloseable {

  private final StatsRegistry registry;
  private final Thread owner;
  private boolean released;

  StatsLock(StatsRegistry registry) {
    this.registry = registry;
    registry.globalLock().lock();
    this.owner = Thread.currentThread();
  }

  /**
   * Registers a general purpose counter.
   *
   * <p>Every user of a shared counter registers it with the same key; each registration adds a
   * reference and each returns the identical handle. The record outlives its last reference
   * until pruning, so its value keeps being exported.
   *
   * @param level stats level required for this counter
   * @param source source bitmask, see {@link com.axonops.logstats.api.StatsSource}
   * @param id id of the configuration item, {@code null} means empty
   * @param instance instance within the item, {@code null} means empty
   * @param type counter type
   * @return the counter handle, or {@code null} if {@code level} is above the active stats level
   * @throws StatsContractViolationException if the key belongs to a dynamic counter, or names the
   *     group component without a direction flag
   * @throws IllegalArgumentException if the source names an unknown component
   */
  public StatsCounterItem registerCounter(
      int level, int source, String id, String instance, StatsCounterType type) {
    ensureHeld();
    Objects.requireNonNull(type, "type cannot be null");

    if (!registry.checkLevel(level)) {
      registry.recordRejection();
      return null;
    }

    CounterRecord record = registry.findOrCreate(CounterKey.of(source, id, instance));
    if (record.isDynamic()) {
      throw new StatsContractViolationException(
          "Static registration of dynamic counter " + record.key());
    }
    record.retain();
    return record.activate(type);
  }

  /**
   * Registers a counter whose key was discovered at runtime, e.g. one per client address.
   *
   * <p>The record becomes dynamic for good, which makes it eligible for pruning once orphaned and
   * stale. The returned {@link DynamicRegistration#family()} lets the caller attach more types
   * through {@link #registerAssociatedCounter} without another key lookup.
   *
   * @param level stats level required for this counter
   * @param source source bitmask
   * @param id id of the configuration item, {@code null} means empty
   * @param instance instance within the item, {@code null} means empty
   * @param type counter type
   * @return the registration, {@link DynamicRegistration#REJECTED} if the level is too low
   * @throws StatsContractViolationException if a referenced static counter uses the same key
   */
  public DynamicRegistration registerDynamicCounter(
      int level, int source, String id, String instance, StatsCounterType type) {
    ensureHeld();
    Objects.requireNonNull(type, "type cannot be null");

    if (!registry.checkLevel(level)) {
      registry.recordRejection();
      return DynamicRegistration.REJECTED;
    }

    CounterRecord record = registry.findOrCreate(CounterKey.of(source, id, instance));
    // A record without references counts as new, it just hasn't been pruned yet
    boolean created = record.isOrphaned();
    if (!created && !record.isDynamic()) {
      throw new StatsContractViolationException(
          "Dynamic registration of static counter " + record.key());
    }

    record.retain();
    record.markDynamic();
    return new DynamicRegistration(record, record.activate(type), created);
  }

  /**
   * Registers another counter type on a dynamic record obtained from {@link
   * #registerDynamicCounter}.
   *
   * @param family the dynamic record, may be {@code null} if that registration was rejected
   * @param type counter type to add
   * @return the counter handle, or {@code null} if {@code family} is {@code null}
   * @throws StatsContractViolationException if {@code family} is not dynamic or was pruned
   */
  public StatsCounterItem registerAssociatedCounter(CounterRecord family, StatsCounterType type) {
    ensureHeld();
    Objects.requireNonNull(type, "type cannot be null");

    if (family == null) {
      return null;
    }
    if (!family.isDynamic()) {
      throw new StatsContractViolationException(
          "Associated registration on static counter " + family.key());
    }
    requireRegistered(family);

    StatsCounterItem counter = family.activate(type);
    family.retain();
    return counter;
  }

  /**
   * Creates (if needed) and increments a dynamic PROCESSED counter without keeping a handle.
   *
   * <p>If {@code timestamp} is non-negative, the STAMP counter of the same record is set to it.
   * Both registrations are released before returning, so the record is left orphaned with its
   * values intact, ready to be exported or pruned.
   *
   * @param level stats level required for this counter
   * @param source source bitmask
   * @param id id of the configuration item, {@code null} means empty
   * @param instance instance within the item, {@code null} means empty
   * @param timestamp Unix time in seconds for the STAMP counter, negative to skip it
   */
  public void registerAndIncrementDynamicCounter(
      int level, int source, String id, String instance, long timestamp) {
    DynamicRegistration registration =
        registerDynamicCounter(level, source, id, instance, StatsCounterType.PROCESSED);
    CounterRecord family = registration.family();
    StatsCounterItem.increment(registration.counter());

    if (timestamp >= 0) {
      StatsCounterItem stamp = registerAssociatedCounter(family, StatsCounterType.STAMP);
      StatsCounterItem.set(stamp, timestamp);
      unregisterDynamicCounter(family, StatsCounterType.STAMP, stamp);
    }
    unregisterDynamicCounter(family, StatsCounterType.PROCESSED, registration.counter());
  }

  /**
   * Releases a registration made by {@link #registerCounter}.
   *
   * <p>The record stays in the registry even when its last reference goes away. The caller should
   * drop its handle afterwards.
   *
   * @param source source bitmask used at registration
   * @param id id used at registration
   * @param instance instance used at registration
   * @param type counter type used at registration
   * @param counter the handle returned at registration; {@code null} is a no-op
   * @throws StatsContractViolationException if {@code counter} is not the registered handle
   */
  public void unregisterCounter(
      int source, String id, String instance, StatsCounterType type, StatsCounterItem counter) {
    ensureHeld();
    Objects.requireNonNull(type, "type cannot be null");

    if (counter == null) {
      return;
    }

    CounterKey key = CounterKey.of(source, id, instance);
    CounterRecord record = registry.find(key);
    if (record == null || !record.owns(type, counter)) {
      throw new StatsContractViolationException(
          "Unregistering unknown " + type.tagName() + " counter of " + key);
    }
    record.release();
  }

  /**
   * Releases a registration made by {@link #registerDynamicCounter} or {@link
   * #registerAssociatedCounter}.
   *
   * @param family the dynamic record; {@code null} is a no-op
   * @param type counter type
   * @param counter handle returned for {@code type}
   * @throws StatsContractViolationException if {@code family} was pruned or {@code counter} is not
   *     its slot for {@code type}
   */
  public void unregisterDynamicCounter(
      CounterRecord family, StatsCounterType type, StatsCounterItem counter) {
    ensureHeld();
    Objects.requireNonNull(type, "type cannot be null");

    if (family == null) {
      return;
    }
    requireRegistered(family);
    if (!family.owns(type, counter)) {
      throw new StatsContractViolationException(
          "Unregistering unknown " + type.tagName() + " counter of " + family.key());
    }
    family.release();
  }

  /** Looks up the record of a key, {@code null} if absent. */
  public CounterRecord find(int source, String id, String instance) {
    return find(CounterKey.of(source, id, instance));
  }

  /** Looks up the record of a key, {@code null} if absent. */
  public CounterRecord find(CounterKey key) {
    ensureHeld();
    return registry.find(key);
  }

  /** Read-only view of all records, valid while this guard is held. */
  public Collection<CounterRecord> records() {
    ensureHeld();
    return Collections.unmodifiableCollection(registry.records());
  }

  /** Number of records in the registry. */
  public int size() {
    ensureHeld();
    return registry.records().size();
  }

  /** True while this guard holds the lock on the calling thread. */
  public boolean isHeld() {
    return !released && Thread.currentThread() == owner;
  }

  /** Releases the lock. Idempotent on the owning thread. */
  @Override
  public void close() {
    if (released) {
      return;
    }
    if (Thread.currentThread() != owner) {
      throw new StatsContractViolationException(
          "Stats lock released by " + Thread.currentThread().getName() + ", owned by "
              + owner.getName());
    }
    released = true;
    registry.globalLock().unlock();
  }

  private void requireRegistered(CounterRecord family) {
    if (!registry.contains(family)) {
      throw new StatsContractViolationException("Counter record was pruned: " + family.key());
    }
  }

  private void ensureHeld() {
    if (!isHeld()) {
      throw new StatsContractViolationException("Stats lock is not held by the calling thread");
    }
  }
}
