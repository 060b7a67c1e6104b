/*
 * Copyright 2025 The Modelgen Authors
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

package org.modelgen.util;

import com.google.common.base.Preconditions;

/** Static-only string helpers. */
public class StringUtil {

  /**
   * Given a double-quoted string literal (including the quotes), returns its contents with
   * backslash escapes ({@code \"}, {@code \\}, {@code \n}, {@code \t}) resolved.
   */
  public static String unescape(String quoted) {
    Preconditions.checkArgument(
        quoted.length() >= 2 && quoted.startsWith("\"") && quoted.endsWith("\""),
        "Not a string literal: %s",
        quoted);
    StringBuilder sb = new StringBuilder(quoted.length() - 2);
    for (int i = 1; i < quoted.length() - 1; i++) {
      char c = quoted.charAt(i);
      if (c == '\\' && i + 1 < quoted.length() - 1) {
        char next = quoted.charAt(++i);
        switch (next) {
          case 'n' -> sb.append('\n');
          case 't' -> sb.append('\t');
          default -> sb.append(next);
        }
      } else {
        sb.append(c);
      }
    }
    return sb.toString();
  }

  /** Returns {@code s} as a double-quoted CSV field, doubling any embedded quotes. */
  public static String csvQuote(String s) {
    return "\"" + s.replace("\"", "\"\"") + "\"";
  }

  private StringUtil() {}
}
