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

/**
 * Result of {@link StatsLock#registerDynamicCounter}.
 *
 * @param family the record, to pass to {@link StatsLock#registerAssociatedCounter} and {@link
 *     StatsLock#unregisterDynamicCounter}; {@code null} if the stats level rejected the
 *     registration
 * @param counter handle of the requested counter type; {@code null} when rejected
 * @param created true if the record did not exist, or existed without any registration
 * @since 1.0.0
 */
public record DynamicRegistration(CounterRecord family, StatsCounterItem counter, boolean created) {

  /** Returned when the stats level is too low for the requested counter. */
  public static final DynamicRegistration REJECTED = new DynamicRegistration(null, null, false);

  public boolean isRejected() {
    return family == null;
  }
}
