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

/**
 * Thrown when a caller breaks the registration contract of the statistics registry.
 *
 * <p>Examples: unregistering a handle that is not the one stored for the given key and type,
 * mixing static and dynamic registration on one key, registering an associated counter on a
 * non-dynamic record, or calling a lifecycle method through a lock guard that is no longer held.
 * These indicate a bug in the caller and are never retried or swallowed.
 *
 * @since 1.0.0
 */
public final class StatsContractViolationException extends StatsException {

  public StatsContractViolationException(String message) {
    super("LogStats: Contract violation: " + message);
  }
}
