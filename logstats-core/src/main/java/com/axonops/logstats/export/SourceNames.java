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

import com.axonops.logstats.api.StatsComponent;
import com.axonops.logstats.api.StatsContractViolationException;
import com.axonops.logstats.api.StatsSource;

/** Display names of counter sources, shared by the exporters. */
final class SourceNames {

  private SourceNames() {
    // Utility class
  }

  /**
   * Returns {@code source}/{@code destination} for group counters and {@code src.<component>},
   * {@code dst.<component>} or the bare component name for everything else.
   *
   * @throws StatsContractViolationException for a group counter with no direction flag
   */
  static String describe(int source) {
    if (StatsSource.isGroup(source)) {
      if (StatsSource.isSource(source)) {
        return "source";
      } else if (StatsSource.isDestination(source)) {
        return "destination";
      }
      throw new StatsContractViolationException(
          "Group counter without direction: 0x" + Integer.toHexString(source));
    }

    String prefix;
    if (StatsSource.isSource(source)) {
      prefix = "src.";
    } else if (StatsSource.isDestination(source)) {
      prefix = "dst.";
    } else {
      prefix = "";
    }
    return prefix + StatsComponent.of(source).displayName();
  }
}
