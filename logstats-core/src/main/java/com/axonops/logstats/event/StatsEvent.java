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

import java.util.List;
import java.util.Objects;

/**
 * A structured event produced by the registry: the periodic log summary or a prune notice.
 *
 * @param severity how important the event is
 * @param message human readable message, e.g. {@code "Log statistics"}
 * @param tags name/value pairs attached to the message, in emission order
 * @since 1.0.0
 */
public record StatsEvent(Severity severity, String message, List<StatsTag> tags) {

  /** Event severity. */
  public enum Severity {
    NOTICE,
    INFO
  }

  public StatsEvent {
    Objects.requireNonNull(severity, "severity cannot be null");
    Objects.requireNonNull(message, "message cannot be null");
    tags = List.copyOf(tags);
  }

  /**
   * Returns the value of the first tag named {@code name}.
   *
   * @return the value, or {@code null} if the event has no such tag
   */
  public String tagValue(String name) {
    for (StatsTag tag : tags) {
      if (tag.name().equals(name)) {
        return tag.value();
      }
    }
    return null;
  }

  /** Renders the event as {@code message; name='value', name='value'}. */
  public String render() {
    StringBuilder sb = new StringBuilder(message);
    for (int i = 0; i < tags.size(); i++) {
      sb.append(i == 0 ? "; " : ", ");
      StatsTag tag = tags.get(i);
      sb.append(tag.name()).append("='").append(tag.value()).append('\'');
    }
    return sb.toString();
  }
}
