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

import java.util.List;
import org.jspecify.annotations.Nullable;
import org.modelgen.model.Equation;
import org.modelgen.model.Node;
import org.modelgen.model.NodeType;
import org.modelgen.model.Symbol;

/**
 * The hooks through which a target language shapes its output. Every hook has a default; a
 * language overrides only the ones it needs.
 *
 * <p>A Backend instance is used for a single {@link Pass}, so implementations may keep per-pass
 * bookkeeping (counters, allocation tables) in instance fields. Hooks that can recurse (such as
 * {@link #showNode}) must call back through the Pass or the Backend rather than calling the
 * default implementation classes directly, so that overrides take effect at every level.
 *
 * <p>{@link #writeFile} drives the pass: {@link #beginFile}, then {@link #declare} for every set,
 * parameter and variable (in that order), then for each equation {@link #beginBlock}, one {@link
 * #showEq} per generated statement and {@link #endBlock}, and finally {@link #endFile}.
 */
public interface Backend {

  /**
   * Called once before the pass's streams are opened; a language uses this to choose the
   * equation and summation styles and any other options it requires.
   */
  default void setup(Options options) {}

  /** Writes any header the language requires. */
  default void beginFile(Pass pass, String baseName) {}

  /** Writes any trailer the language requires; nothing is written after this. */
  default void endFile(Pass pass) {}

  /** Records a symbol in the language's bookkeeping. */
  default void declare(Pass pass, Symbol symbol) {}

  /** Called before the statements generated for {@code eq}. */
  default void beginBlock(Pass pass, Equation eq) {}

  /** Called after the statements generated for {@code eq}. */
  default void endBlock(Pass pass, Equation eq) {}

  /** Called before each statement. */
  default void beginEqn(Pass pass, Equation eq) {}

  /** Called after each statement. */
  default void endEqn(Pass pass, Equation eq) {
    pass.print(" ;\n\n");
  }

  /**
   * Returns the text that opens a function (log, exp) or a vector-form sum or product.
   *
   * @param arg the bound set of a sum or product; null for other functions
   */
  default String beginFunc(Pass pass, String func, @Nullable String arg) {
    return (arg == null) ? func + "(" : func + "(" + arg + ",";
  }

  /** Returns the text that closes a function opened by {@link #beginFunc}. */
  default String endFunc(Pass pass) {
    return ")";
  }

  /**
   * Returns the text for a reference to a parameter or variable.
   *
   * @param subs the reference's subscripts, already bound to the current subscript tuple
   */
  default String showSymbol(Pass pass, String name, List<String> subs, SymbolContext context) {
    String result = subs.isEmpty() ? name : name + "(" + String.join(",", subs) + ")";
    for (int dt = context.dt(); dt < 0; dt++) {
      result = "lag(" + result + ")";
    }
    for (int dt = context.dt(); dt > 0; dt--) {
      result = "lead(" + result + ")";
    }
    return result;
  }

  /**
   * Returns the text for {@code node} as an operand of a node of type {@code parent}.
   *
   * @param sets the index sets in scope
   * @param subs the elements currently bound to {@code sets} (empty in vector form)
   */
  default String showNode(
      Pass pass, NodeType parent, @Nullable Node node, List<String> sets, List<String> subs) {
    return NodeRenderer.render(pass, parent, node, sets, subs);
  }

  /** Writes one statement for {@code eq} with the given subscript binding. */
  default void showEq(Pass pass, Equation eq, List<String> sets, List<String> subs) {
    Generator.showEq(pass, eq, sets, subs);
  }

  /**
   * Writes {@code line} to the code stream, breaking it if it is longer than the line length.
   *
   * @param addNewline if true, the line is terminated
   * @param commaOk if true, the line may be broken at commas
   */
  default void wrapWrite(Pass pass, String line, boolean addNewline, boolean commaOk) {
    pass.print(LineWrapper.wrap(line, pass.options().lineLength(), addNewline, commaOk));
  }

  /** Runs the whole pass. */
  default void writeFile(Pass pass, String baseName) {
    Generator.writeFile(pass, baseName);
  }

  /**
   * Returns true if no statements should be generated for {@code eq}. By default equations that
   * refer to undeclared symbols or fail their time check are skipped.
   */
  default boolean skip(Equation eq) {
    return eq.hasUndeclared || !eq.timeOk;
  }

  /** Returns the compact form of an expression, used for declarations and trace messages. */
  default String spprint(NodeType parent, @Nullable Node node, @Nullable String indent) {
    return Printer.DEFAULT.render(parent, node, indent);
  }

  /** Returns the tokens used by the generic equation renderer. */
  default RenderStyle style() {
    return RenderStyle.DEFAULT;
  }
}
