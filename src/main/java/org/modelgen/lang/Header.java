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

package org.modelgen.lang;

import com.google.common.collect.ImmutableList;
import org.modelgen.model.Symbol;

/**
 * The kinds of TABLO header, selected by the first letter of a symbol's first attribute. Each
 * kind determines the logical file a symbol is read from and how it counts towards the closure.
 */
enum Header {
  IMPL_ENDOGENOUS('A', "impl", Closure.ENDOGENOUS),
  IMPL_EXOGENOUS('B', "impl", Closure.EXOGENOUS),
  ADDPAR('C', "addpar", Closure.PARAMETER),
  INTER('I', "inter", Closure.ENDOGENOUS),
  KALMAN('K', "kalman", Closure.EXOGENOUS),
  MAKE('M', "make", Closure.EXOGENOUS),
  ENDOG('N', "endog", Closure.ENDOGENOUS),
  IOTABLE('O', "iotable", Closure.ENDOGENOUS),
  PARAM('P', "param", Closure.PARAMETER),
  EXTRA('T', "extra", Closure.ENDOGENOUS),
  EXOG('X', "exog", Closure.EXOGENOUS),
  /** No attribute, or one whose first letter isn't listed above. */
  OTHER('\0', "other", Closure.UNDETERMINED);

  enum Closure {
    ENDOGENOUS,
    EXOGENOUS,
    PARAMETER,
    UNDETERMINED
  }

  /** The order in which the info report lists each closure's header kinds. */
  static final ImmutableList<Header> REPORT_ORDER =
      ImmutableList.of(
          ENDOG,
          INTER,
          IOTABLE,
          EXTRA,
          IMPL_ENDOGENOUS,
          EXOG,
          KALMAN,
          MAKE,
          IMPL_EXOGENOUS,
          OTHER);

  final char letter;
  final String fileName;
  final Closure closure;

  Header(char letter, String fileName, Closure closure) {
    this.letter = letter;
    this.fileName = fileName;
    this.closure = closure;
  }

  /** Returns the header kind of the given symbol. */
  static Header of(Symbol symbol) {
    if (symbol.attributes.isEmpty() || symbol.attributes.get(0).isEmpty()) {
      return OTHER;
    }
    char first = symbol.attributes.get(0).charAt(0);
    for (Header h : values()) {
      if (h.letter == first) {
        return h;
      }
    }
    return OTHER;
  }
}
