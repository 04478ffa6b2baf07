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
 * Source bitmask constants.
 *
 * <p>A counter's source is an {@code int} made of a component index in the low byte and an
 * optional direction flag:
 *
 * <pre>{@code
 * int fileSource = StatsSource.FILE | StatsSource.SOURCE;        // exported as "src.file"
 * int sqlDest = StatsSource.SQL | StatsSource.DESTINATION;       // exported as "dst.sql"
 * int center = StatsSource.CENTER;                               // exported as "center"
 * }</pre>
 *
 * <p>The registry compares sources as opaque integers.
 *
 * @since 1.0.0
 */
public final class StatsSource {

  public static final int SOURCE = 0x0100;
  public static final int DESTINATION = 0x0200;
  public static final int SOURCE_MASK = 0xff;

  public static final int NONE = StatsComponent.NONE.index();
  public static final int FILE = StatsComponent.FILE.index();
  public static final int PIPE = StatsComponent.PIPE.index();
  public static final int TCP = StatsComponent.TCP.index();
  public static final int UDP = StatsComponent.UDP.index();
  public static final int TCP6 = StatsComponent.TCP6.index();
  public static final int UDP6 = StatsComponent.UDP6.index();
  public static final int UNIX_STREAM = StatsComponent.UNIX_STREAM.index();
  public static final int UNIX_DGRAM = StatsComponent.UNIX_DGRAM.index();
  public static final int SYSLOG = StatsComponent.SYSLOG.index();
  public static final int NETWORK = StatsComponent.NETWORK.index();
  public static final int INTERNAL = StatsComponent.INTERNAL.index();
  public static final int LOGSTORE = StatsComponent.LOGSTORE.index();
  public static final int PROGRAM = StatsComponent.PROGRAM.index();
  public static final int SQL = StatsComponent.SQL.index();
  public static final int SUN_STREAMS = StatsComponent.SUN_STREAMS.index();
  public static final int USERTTY = StatsComponent.USERTTY.index();
  public static final int GROUP = StatsComponent.GROUP.index();
  public static final int CENTER = StatsComponent.CENTER.index();
  public static final int HOST = StatsComponent.HOST.index();
  public static final int GLOBAL = StatsComponent.GLOBAL.index();
  public static final int MONGODB = StatsComponent.MONGODB.index();
  public static final int CLASS = StatsComponent.CLASS.index();
  public static final int RULE_ID = StatsComponent.RULE_ID.index();
  public static final int TAG = StatsComponent.TAG.index();
  public static final int SEVERITY = StatsComponent.SEVERITY.index();
  public static final int FACILITY = StatsComponent.FACILITY.index();
  public static final int SENDER = StatsComponent.SENDER.index();
  public static final int SMTP = StatsComponent.SMTP.index();
  public static final int AMQP = StatsComponent.AMQP.index();
  public static final int STOMP = StatsComponent.STOMP.index();
  public static final int REDIS = StatsComponent.REDIS.index();
  public static final int SNMP = StatsComponent.SNMP.index();

  private StatsSource() {
    // Constants only
  }

  /** True if the source carries the {@link #SOURCE} direction flag. */
  public static boolean isSource(int source) {
    return (source & SOURCE) != 0;
  }

  /** True if the source carries the {@link #DESTINATION} direction flag. */
  public static boolean isDestination(int source) {
    return (source & DESTINATION) != 0;
  }

  /** True if the component of the source is {@link StatsComponent#GROUP}. */
  public static boolean isGroup(int source) {
    return (source & SOURCE_MASK) == GROUP;
  }
}
