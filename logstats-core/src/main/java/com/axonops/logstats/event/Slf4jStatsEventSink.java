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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default event sink, writes every event through SLF4J.
 *
 * <p>Both severities map to INFO; the rendered line is {@link StatsEvent#render()}.
 *
 * @since 1.0.0
 */
public final class Slf4jStatsEventSink implements StatsEventSink {

  /** Singleton instance logging to the {@code com.axonops.logstats.events} logger. */
  public static final Slf4jStatsEventSink INSTANCE =
      new Slf4jStatsEventSink(LoggerFactory.getLogger("com.axonops.logstats.events"));

  private final Logger logger;

  public Slf4jStatsEventSink(Logger logger) {
    this.logger = logger;
  }

  @Override
  public void send(StatsEvent event) {
    if (logger.isInfoEnabled()) {
      logger.info("LogStats: {}", event.render());
    }
  }
}
