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
 * Components that own counters. The ordinal of each constant is the component index stored in
 * the low byte of a source bitmask (see {@link StatsSource}).
 *
 * @since 1.0.0
 */
public enum StatsComponent {
  NONE("none"),
  FILE("file"),
  PIPE("pipe"),
  TCP("tcp"),
  UDP("udp"),
  TCP6("tcp6"),
  UDP6("udp6"),
  UNIX_STREAM("unix-stream"),
  UNIX_DGRAM("unix-dgram"),
  SYSLOG("syslog"),
  NETWORK("network"),
  INTERNAL("internal"),
  LOGSTORE("logstore"),
  PROGRAM("program"),
  SQL("sql"),
  SUN_STREAMS("sun-streams"),
  USERTTY("usertty"),
  GROUP("group"),
  CENTER("center"),
  HOST("host"),
  GLOBAL("global"),
  MONGODB("mongodb"),
  CLASS("class"),
  RULE_ID("rule_id"),
  TAG("tag"),
  SEVERITY("severity"),
  FACILITY("facility"),
  SENDER("sender"),
  SMTP("smtp"),
  AMQP("amqp"),
  STOMP("stomp"),
  REDIS("redis"),
  SNMP("snmp");

  private static final StatsComponent[] VALUES = values();

  private final String displayName;

  StatsComponent(String displayName) {
    this.displayName = displayName;
  }

  /** Name as it appears in exported statistics. */
  public String displayName() {
    return displayName;
  }

  /** Component index, the value to OR into a source bitmask. */
  public int index() {
    return ordinal();
  }

  /**
   * Resolves the component of a source bitmask.
   *
   * @param source source bitmask
   * @return the component selected by {@code source & SOURCE_MASK}
   * @throws IllegalArgumentException if the index is not a known component
   */
  public static StatsComponent of(int source) {
    int index = source & StatsSource.SOURCE_MASK;
    if (index >= VALUES.length) {
      throw new IllegalArgumentException("Unknown stats component index: " + index);
    }
    return VALUES[index];
  }
}
