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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(JUnitParamsRunner.class)
public class StringUtilTest {

  private static Object[] literals() {
    return new Object[] {
      new Object[] {"\"\"", ""},
      new Object[] {"\"plain\"", "plain"},
      new Object[] {"\"say \\\"hi\\\"\"", "say \"hi\""},
      new Object[] {"\"a\\\\b\"", "a\\b"},
      new Object[] {"\"two\\nlines\"", "two\nlines"},
      new Object[] {"\"tab\\there\"", "tab\there"},
    };
  }

  @Test
  @Parameters(method = "literals")
  public void unescape(String literal, String expected) {
    assertThat(StringUtil.unescape(literal)).isEqualTo(expected);
  }

  @Test
  public void unescapeRequiresQuotes() {
    assertThrows(IllegalArgumentException.class, () -> StringUtil.unescape("bare"));
  }

  @Test
  public void csvQuote() {
    assertThat(StringUtil.csvQuote("x(r)")).isEqualTo("\"x(r)\"");
    assertThat(StringUtil.csvQuote("6\" pipe")).isEqualTo("\"6\"\" pipe\"");
  }
}
