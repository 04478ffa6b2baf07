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
package com.axonops.logstats.event;

/**
 * Receives the events produced by the statistics registry.
 *
 * <p>The registry calls {@link #send(StatsEvent)} after releasing its lock, so implementations
 * may block or log freely. Implementations must be thread-safe: the maintenance thread and
 * application threads may both emit events.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface StatsEventSink {

  /**
   * Delivers an event.
   *
   * @param event the event, never null
   */
  void send(StatsEvent event);
}
