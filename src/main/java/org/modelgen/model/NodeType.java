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

/** The syntactic construct represented by a {@link Node}. */
public enum NodeType {
  /** No node; used as the parent type of a top-level expression. */
  NUL(""),
  ADD("+"),
  SUB("-"),
  MUL("*"),
  DVD("/"),
  /** Unary minus; only the right child is present. */
  NEG("-"),
  POW("^"),
  LOG("log"),
  EXP("exp"),
  /** Summation over a set; the left child names the set, the right child is the body. */
  SUM("sum"),
  /** Product over a set; the left child names the set, the right child is the body. */
  PRD("prod"),
  /** A reference to a set, parameter or variable. */
  NAM(""),
  /** A numeric literal. */
  NUM(""),
  /** A subscript list, represented as a chain of right children. */
  LST(""),
  LAG("lag"),
  LED("lead"),
  /** A name reference together with its subscript list. */
  DOM(""),
  EQU("=");

  /** The operator or function text used when a node of this type is built without explicit text. */
  public final String defaultText;

  NodeType(String defaultText) {
    this.defaultText = defaultText;
  }

  /** True for the two iterated forms, summation and product. */
  public boolean isReduction() {
    return this == SUM || this == PRD;
  }

  /** True for the time-shift wrappers. */
  public boolean isTimeShift() {
    return this == LAG || this == LED;
  }

  /** True for the single-argument functions, log and exp. */
  public boolean isFunction() {
    return this == LOG || this == EXP;
  }

  /** True for leaves that print as their own text (names and numbers). */
  public boolean isAtom() {
    return this == NAM || this == NUM;
  }
}
