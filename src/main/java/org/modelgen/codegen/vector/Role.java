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

package org.modelgen.codegen.vector;

import org.modelgen.codegen.CodegenError;
import org.modelgen.codegen.SymbolContext;

/**
 * The six contexts in which a symbol can be referenced: on the left- or right-hand side of an
 * equation, lagged one period, contemporaneous, or led one period.
 */
public enum Role {
  LHS_LAG(true, -1, "LHS in lag()"),
  LHS_CUR(true, 0, "LHS without lag() or lead()"),
  LHS_LEAD(true, 1, "LHS in lead()"),
  RHS_LAG(false, -1, "RHS in lag()"),
  RHS_CUR(false, 0, "RHS without lag() or lead()"),
  RHS_LEAD(false, 1, "RHS in lead()");

  public final boolean lhs;
  public final int dt;

  /** Used in error messages. */
  public final String description;

  Role(boolean lhs, int dt, String description) {
    this.lhs = lhs;
    this.dt = dt;
    this.description = description;
  }

  /** Returns the context a reference in this role would have. */
  public SymbolContext context() {
    return new SymbolContext(lhs, dt);
  }

  /**
   * Returns the role corresponding to the given reference context.
   *
   * @throws CodegenError if the reference is lagged or led more than once
   */
  public static Role of(SymbolContext context) {
    if (context.dt() < -1) {
      throw CodegenError.of(CodegenError.Kind.CONTEXT, "lag(lag(var)) cannot be used here");
    } else if (context.dt() > 1) {
      throw CodegenError.of(CodegenError.Kind.CONTEXT, "lead(lead(var)) cannot be used here");
    }
    return values()[1 + context.dt() + (context.lhs() ? 0 : 3)];
  }
}
