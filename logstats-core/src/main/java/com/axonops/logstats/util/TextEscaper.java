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
package com.axonops.logstats.util;

/**
 * Escapes text for line-oriented output.
 *
 * <p>ISO control characters are rendered as {@code \xNN} (two lowercase hex digits); everything
 * else is passed through. The result never contains a line break.
 *
 * @since 1.0.0
 */
public final class TextEscaper {

  private static final char[] HEX = "0123456789abcdef".toCharArray();

  private TextEscaper() {
    // Utility class
  }

  /**
   * Escapes control characters in {@code text}.
   *
   * @param text input, must not be null
   * @return {@code text} itself if nothing needed escaping, otherwise the escaped copy
   */
  public static String escapeControlCharacters(String text) {
    int first = firstControlCharacter(text);
    if (first < 0) {
      return text;
    }

    StringBuilder sb = new StringBuilder(text.length() + 16);
    sb.append(text, 0, first);
    for (int i = first; i < text.length(); i++) {
      char c = text.charAt(i);
      if (Character.isISOControl(c)) {
        sb.append("\\x").append(HEX[(c >> 4) & 0xf]).append(HEX[c & 0xf]);
      } else {
        sb.append(c);
      }
    }
    return sb.toString();
  }

  private static int firstControlCharacter(String text) {
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (Character.isISOControl(c)) {
        return i;
      }
    }
    return -1;
  }
}
