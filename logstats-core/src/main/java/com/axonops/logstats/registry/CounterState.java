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

/**
 * Exported state of a counter record.
 *
 * <p>A record is {@link #ACTIVE} while at least one registration holds it and {@link #ORPHANED}
 * once every registration has been released; only pruning removes an orphaned record. Dynamic
 * records always report {@link #DYNAMIC}, whatever their reference count.
 *
 * @since 1.0.0
 */
public enum CounterState {
  DYNAMIC('d'),
  ORPHANED('o'),
  ACTIVE('a');

  private final char code;

  CounterState(char code) {
    this.code = code;
  }

  /** Single character used in the State column of CSV output. */
  public char code() {
    return code;
  }
}
