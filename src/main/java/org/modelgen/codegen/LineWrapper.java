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

package org.modelgen.codegen;

/**
 * A statics-only class that breaks overlong lines.
 *
 * <p>A line is broken at the last legal break character at or before the column limit; the break
 * character starts the continuation line, which is indented by {@link #CONTINUATION}. Embedded
 * newlines that fall within the limit are kept.
 */
public class LineWrapper {

  /** Printed after each inserted line break. */
  public static final String CONTINUATION = "\n   ";

  /**
   * Returns {@code line} with line breaks inserted so that no piece is longer than {@code limit}.
   * If {@code limit} is zero the line is returned unchanged.
   *
   * @param addNewline if true, a newline is appended to the result
   * @param commaOk if true, commas are legal break characters
   * @throws CodegenError if some piece of the line has no legal break point within the limit
   */
  public static String wrap(String line, int limit, boolean addNewline, boolean commaOk) {
    StringBuilder out = new StringBuilder(line.length() + 16);
    if (limit == 0) {
      out.append(line);
      return addNewline ? out.append('\n').toString() : out.toString();
    }
    String rest = line;
    for (; ; ) {
      if (rest.length() <= limit) {
        out.append(rest);
        if (addNewline) {
          out.append('\n');
        }
        return out.toString();
      }
      int newline = rest.indexOf('\n');
      if (newline >= 0 && newline <= limit) {
        out.append(rest, 0, newline + 1);
        rest = rest.substring(newline + 1);
        continue;
      }
      int end = limit;
      while (end > 0 && !isBreak(rest.charAt(end), commaOk)) {
        end--;
      }
      if (end == 0) {
        throw CodegenError.unwrappable(line);
      }
      out.append(rest, 0, end).append(CONTINUATION);
      rest = rest.substring(end);
    }
  }

  /** True if a line may be broken in front of {@code c}. */
  static boolean isBreak(char c, boolean commaOk) {
    return switch (c) {
      case ' ', '\t', '\n', '\r', '\f', '\u000B', '+', '-', '*', '/', '=', '^' -> true;
      case ',' -> commaOk;
      default -> false;
    };
  }

  private LineWrapper() {}
}
