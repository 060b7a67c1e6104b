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

package org.modelgen.model;

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/** One (possibly indexed) equation of a model. */
public final class Equation {
  /** The left-hand side; every node in it has {@link Node#lhs} set. */
  public final Node lhs;

  public final Node rhs;

  /** The index sets the equation ranges over, outermost first. */
  public final ImmutableList<String> sets;

  /** True if the equation refers to a symbol that was never declared. */
  public final boolean hasUndeclared;

  /** False if the equation is not valid under the current treatment of time. */
  public final boolean timeOk;

  public final @Nullable String label;

  /** Sequential equation number, starting from 1 in declaration order. */
  public final int number;

  /**
   * The number of scalar equations this equation expands to: the product of the sizes of its sets,
   * or 0 if it refers to undeclared symbols.
   */
  public final int scalarCount;

  Equation(
      Node lhs,
      Node rhs,
      ImmutableList<String> sets,
      boolean hasUndeclared,
      boolean timeOk,
      @Nullable String label,
      int number,
      int scalarCount) {
    this.lhs = lhs;
    this.rhs = rhs;
    this.sets = sets;
    this.hasUndeclared = hasUndeclared;
    this.timeOk = timeOk;
    this.label = label;
    this.number = number;
    this.scalarCount = scalarCount;
  }

  /** True if the left-hand side is a single variable reference. */
  public boolean isLvalue() {
    return lhs.isReference();
  }

  /**
   * Returns the name of the first symbol referenced on the left-hand side, or null if there is
   * none.
   */
  public @Nullable String lhsName() {
    String[] result = new String[1];
    lhs.forEachReference(
        n -> {
          if (result[0] == null) {
            result[0] = n.text;
          }
        });
    return result[0];
  }

  @Override
  public String toString() {
    return lhs + " = " + rhs;
  }
}
