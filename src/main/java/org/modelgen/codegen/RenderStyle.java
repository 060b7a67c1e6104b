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
 * The tokens a language substitutes into the generic equation renderer ({@link NodeRenderer}).
 *
 * @param parenOpen inserted before an operand that needs parentheses
 * @param parenClose inserted after an operand that needs parentheses
 * @param sumOpen opens an unrolled sum or product
 * @param sumClose closes an unrolled sum or product
 * @param productTermOpen inserted before each term of an unrolled product
 * @param productTermClose inserted after each term of an unrolled product
 * @param powerOp the exponentiation operator
 * @param lineBreak inserted before an operator whose operands are too wide
 * @param normalizedOpen joins the two sides of a normalized equation
 * @param normalizedClose ends a normalized equation
 */
public record RenderStyle(
    String parenOpen,
    String parenClose,
    String sumOpen,
    String sumClose,
    String productTermOpen,
    String productTermClose,
    String powerOp,
    String lineBreak,
    String normalizedOpen,
    String normalizedClose) {

  /** The tokens used unless a language overrides {@link Backend#style}. */
  public static final RenderStyle DEFAULT =
      new RenderStyle("(", ")", "(", ")", "(", ")", "^", " \n        ", " - (", ")");

  /** Returns a copy of this style with a different power operator. */
  public RenderStyle withPowerOp(String powerOp) {
    return new RenderStyle(
        parenOpen,
        parenClose,
        sumOpen,
        sumClose,
        productTermOpen,
        productTermClose,
        powerOp,
        lineBreak,
        normalizedOpen,
        normalizedClose);
  }

  /** Returns a copy of this style with a different line break. */
  public RenderStyle withLineBreak(String lineBreak) {
    return new RenderStyle(
        parenOpen,
        parenClose,
        sumOpen,
        sumClose,
        productTermOpen,
        productTermClose,
        powerOp,
        lineBreak,
        normalizedOpen,
        normalizedClose);
  }
}
