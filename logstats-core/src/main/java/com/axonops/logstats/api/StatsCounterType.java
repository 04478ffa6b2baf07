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
 * Kinds of counter held by every counter record.
 *
 * <p>Declaration order is export order. {@link #STAMP} is not a tally: it holds the Unix time (in
 * seconds) of the last update and drives the staleness check of dynamic counters.
 *
 * @since 1.0.0
 */
public enum StatsCounterType {
  DROPPED("dropped"),
  PROCESSED("processed"),
  STORED("stored"),
  SUPPRESSED("suppressed"),
  STAMP("stamp");

  private final String tagName;

  StatsCounterType(String tagName) {
    this.tagName = tagName;
  }

  /** Name used as tag in the log summary and as the Type column in CSV output. */
  public String tagName() {
    return tagName;
  }

  /** Bit of this type in a record's live mask. */
  public int mask() {
    return 1 << ordinal();
  }
}
