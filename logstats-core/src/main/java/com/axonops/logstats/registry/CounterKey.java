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
 * Identity of a counter record: the owning component, the configuration item id and the
 * instance within that item.
 *
 * <p>{@code id} and {@code instance} are never null once a key exists; {@link #of(int, String,
 * String)} maps absent values to the empty string. Equality is structural over all three fields.
 *
 * @param source source bitmask, compared as an opaque integer
 * @param id configuration item id, e.g. the name of a source
 * @param instance distinguishes counters of one item, e.g. a client address or a file name
 * @since 1.0.0
 */
public record CounterKey(int source, String id, String instance) {

  public CounterKey {
    if (id == null) {
      id = "";
    }
    if (instance == null) {
      instance = "";
    }
  }

  public static CounterKey of(int source, String id, String instance) {
    return new CounterKey(source, id, instance);
  }

  @Override
  public String toString() {
    return "0x" + Integer.toHexString(source) + "(" + id + "," + instance + ")";
  }
}
