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
 * Where a symbol reference appears: on which side of its equation, and how far it has been shifted
 * by enclosing {@code lag()} (negative) or {@code lead()} (positive) wrappers.
 */
public record SymbolContext(boolean lhs, int dt) {

  /** The context of an unshifted right-hand-side reference. */
  public static final SymbolContext RHS = new SymbolContext(false, 0);

  /** The context of an unshifted left-hand-side reference. */
  public static final SymbolContext LHS = new SymbolContext(true, 0);
}
