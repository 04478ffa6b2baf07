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
package com.axonops.logstats.export;

import com.axonops.logstats.api.StatsCounterType;
import com.axonops.logstats.event.StatsEvent;
import com.axonops.logstats.event.StatsTag;
import com.axonops.logstats.registry.CounterRecord;
import java.util.ArrayList;
import java.util.List;

/**
 * Formats counter records as tags of the periodic log summary.
 *
 * <p>Each live counter becomes one tag named after its type, with a value such as {@code
 * src.file(s_local,/var/log/messages)=42} or {@code source(s_net)=7}. The comma between id and
 * instance only appears when both are non-empty.
 *
 * <p>Callers must hold the registry lock while records are iterated.
 *
 * @since 1.0.0
 */
public final class StatsLogFormatter {

  private StatsLogFormatter() {
    // Utility class
  }

  /**
   * Builds an INFO event carrying one tag per live counter.
   *
   * @param message event message
   * @param records records to format
   * @return the event
   */
  public static StatsEvent format(String message, Iterable<CounterRecord> records) {
    List<StatsTag> tags = new ArrayList<>();
    for (CounterRecord record : records) {
      appendTags(record, tags);
    }
    return new StatsEvent(StatsEvent.Severity.INFO, message, tags);
  }

  static void appendTags(CounterRecord record, List<StatsTag> tags) {
    if (record.liveMask() == 0) {
      return;
    }
    String sourceName = SourceNames.describe(record.source());
    for (StatsCounterType type : StatsCounterType.values()) {
      if (record.isLive(type)) {
        tags.add(new StatsTag(type.tagName(), formatValue(sourceName, record, type)));
      }
    }
  }

  static String formatValue(String sourceName, CounterRecord record, StatsCounterType type) {
    String id = record.id();
    String instance = record.instance();
    return sourceName
        + '('
        + id
        + (!id.isEmpty() && !instance.isEmpty() ? "," : "")
        + instance
        + ")="
        + record.value(type);
  }
}
