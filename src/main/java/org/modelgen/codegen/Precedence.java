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

import java.util.EnumSet;
import org.modelgen.model.NodeType;

/**
 * A statics-only class that decides whether a node must be parenthesized, given the type of its
 * parent.
 *
 * <p>In principle the parentheses wouldn't be needed if every target language obeyed the usual
 * precedence rules, but we add them wherever a reader could plausibly misparse the result.
 */
public class Precedence {

  /**
   * There are two variants of the table. They differ in how functions and time shifts are treated:
   * the compact printer renders those nodes with their operand immediately following the function
   * name, so the operand must always be parenthesized, while {@code show_node} adds its own
   * brackets and unwraps lag/lead.
   */
  public enum Mode {
    /** The table used by the compact printer ({@link Printer}). */
    COMPACT,
    /** The table used by {@code show_node} when generating equations. */
    FULL
  }

  /** Types that never need parentheses below a negation. */
  private static final EnumSet<NodeType> NEG_OK =
      EnumSet.of(
          NodeType.NAM,
          NodeType.NUM,
          NodeType.MUL,
          NodeType.LOG,
          NodeType.EXP,
          NodeType.POW,
          NodeType.SUM,
          NodeType.PRD);

  /** Types that never need parentheses below a division. */
  private static final EnumSet<NodeType> DVD_OK =
      EnumSet.of(
          NodeType.NAM,
          NodeType.NUM,
          NodeType.POW,
          NodeType.SUM,
          NodeType.PRD,
          NodeType.LOG,
          NodeType.EXP);

  /** Types that never need parentheses below a power. */
  private static final EnumSet<NodeType> POW_OK =
      EnumSet.of(
          NodeType.NAM,
          NodeType.NUM,
          NodeType.LOG,
          NodeType.EXP,
          NodeType.SUM,
          NodeType.PRD);

  private static final EnumSet<NodeType> TIME_SHIFTS = EnumSet.of(NodeType.LAG, NodeType.LED);

  /**
   * Returns true if a node of type {@code child} must be wrapped in parentheses when it appears as
   * an operand of a node of type {@code parent}.
   *
   * @throws CodegenError if {@code parent} can never be the parent of another node
   */
  public static boolean needsParens(NodeType parent, NodeType child, Mode mode) {
    boolean full = (mode == Mode.FULL);
    return switch (parent) {
      case NUL, ADD, SUB -> child == NodeType.NEG;
      case MUL ->
          child == NodeType.ADD
              || child == NodeType.SUB
              || child == NodeType.DVD
              || child == NodeType.NEG;
      case NEG -> !(NEG_OK.contains(child) || (full && TIME_SHIFTS.contains(child)));
      case DVD -> !(DVD_OK.contains(child) || (full && TIME_SHIFTS.contains(child)));
      case POW -> !(POW_OK.contains(child) || (full && TIME_SHIFTS.contains(child)));
      // In the compact form the operand is printed right after the function name.
      case LOG, EXP, LAG, LED -> !full;
      case EQU, SUM, PRD, DOM, NAM, NUM -> false;
      case LST ->
          throw CodegenError.invariant("Invalid state reached in precedence table: %s", parent);
    };
  }

  /**
   * Returns true if the compact printer should insert a comma between a node of type {@code
   * parent} and its {@code child}; this only happens for adjacent names and numbers.
   */
  public static boolean needsComma(NodeType parent, NodeType child) {
    return parent.isAtom() && child.isAtom();
  }

  private Precedence() {}
}
