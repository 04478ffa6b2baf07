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

import java.util.Objects;

/**
 * Name/value pair attached to a {@link StatsEvent}.
 *
 * @since 1.0.0
 */
public record StatsTag(String name, String value) {

  public StatsTag {
    Objects.requireNonNull(name, "name cannot be null");
    Objects.requireNonNull(value, "value cannot be null");
  }

  public static StatsTag of(String name, long value) {
    return new StatsTag(name, Long.toString(value));
  }
}
