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
import com.axonops.logstats.registry.CounterRecord;
import com.axonops.logstats.util.TextEscaper;

/**
 * Formats counter records as a semicolon separated document.
 *
 * <pre>
 * SourceName;SourceId;SourceInstance;State;Type;Number
 * src.file;s_local;/var/log/messages;a;processed;42
 * src.tcp;;10.0.0.1;d;processed;7
 * </pre>
 *
 * <p>State is {@code d} for dynamic counters, {@code o} for orphaned and {@code a} for active
 * ones. Id, instance and type are escaped by {@link #escapeField(String)}.
 *
 * <p>Callers must hold the registry lock while records are iterated.
 *
 * @since 1.0.0
 */
public final class StatsCsvFormatter {

  public static final String HEADER = "SourceName;SourceId;SourceInstance;State;Type;Number";

  private static final char SEPARATOR = ';';

  private StatsCsvFormatter() {
    // Utility class
  }

  /**
   * Renders the header line followed by one line per live counter. Every line ends with
   * {@code \n}.
   *
   * @param records records to format
   * @return the CSV document
   */
  public static String format(Iterable<CounterRecord> records) {
    StringBuilder csv = new StringBuilder(1024);
    csv.append(HEADER).append('\n');
    for (CounterRecord record : records) {
      appendRows(record, csv);
    }
    return csv.toString();
  }

  static void appendRows(CounterRecord record, StringBuilder csv) {
    if (record.liveMask() == 0) {
      return;
    }
    String sourceName = SourceNames.describe(record.source());
    String id = escapeField(record.id());
    String instance = escapeField(record.instance());
    char state = record.state().code();

    for (StatsCounterType type : StatsCounterType.values()) {
      if (record.isLive(type)) {
        csv.append(sourceName)
            .append(SEPARATOR)
            .append(id)
            .append(SEPARATOR)
            .append(instance)
            .append(SEPARATOR)
            .append(state)
            .append(SEPARATOR)
            .append(escapeField(type.tagName()))
            .append(SEPARATOR)
            .append(record.value(type))
            .append('\n');
      }
    }
  }

  /**
   * Escapes one field.
   *
   * <p>A non-empty field containing {@code ;} or a newline, or starting with a double quote, is
   * wrapped in double quotes and its double quotes are escaped with a backslash. The result then
   * goes through {@link TextEscaper#escapeControlCharacters(String)}.
   *
   * @param field raw value
   * @return escaped value
   */
  public static String escapeField(String field) {
    if (field.isEmpty() || !hasSpecialCharacter(field)) {
      return TextEscaper.escapeControlCharacters(field);
    }

    StringBuilder quoted = new StringBuilder(field.length() * 2);
    quoted.append('"');
    for (int i = 0; i < field.length(); i++) {
      char c = field.charAt(i);
      if (c == '"') {
        quoted.append('\\');
      }
      quoted.append(c);
    }
    quoted.append('"');
    return TextEscaper.escapeControlCharacters(quoted.toString());
  }

  private static boolean hasSpecialCharacter(String field) {
    return field.indexOf(SEPARATOR) >= 0 || field.indexOf('\n') >= 0 || field.charAt(0) == '"';
  }
}
