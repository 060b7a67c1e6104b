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

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.modelgen.model.Equation;
import org.modelgen.model.Model;
import org.modelgen.model.NodeType;
import org.modelgen.model.Symbol;
import org.modelgen.model.SymbolKind;
import org.modelgen.util.Cartesian;

/** Runs generation passes; also provides the default {@code write_file} and {@code show_eq}. */
public class Generator {

  /**
   * Generates {@code model} with a fresh backend, writing the code stream with suffix {@code
   * codeSuffix} and the info stream through {@code sink}. The backend's {@link Backend#setup} is
   * called before anything is written.
   *
   * @throws CodegenError if generation fails; the partial output should be discarded
   */
  public static void run(
      Model model,
      Backend backend,
      Options options,
      OutputSink sink,
      String baseName,
      String codeSuffix) {
    backend.setup(options);
    try (Pass pass = new Pass(model, options, backend, sink, codeSuffix)) {
      pass.debugf("generating %s%s (%s)", baseName, codeSuffix, options);
      backend.writeFile(pass, baseName);
    }
  }

  /** The default {@link Backend#writeFile}. */
  static void writeFile(Pass pass, String baseName) {
    Backend backend = pass.backend();
    Options options = pass.options();
    Model model = pass.model();
    pass.debugf("write_file");
    backend.beginFile(pass, baseName);
    if (!options.isEquationStyleSet()) {
      throw CodegenError.of(CodegenError.Kind.CONFIGURATION, "Equation style has not been set");
    }
    if (!options.isSumStyleSet()) {
      throw CodegenError.of(CodegenError.Kind.CONFIGURATION, "Summation style has not been set");
    }
    pass.debugf(
        "   eqn style: scalar=%s vector=%s",
        options.isEquationScalar(),
        options.isEquationVector());
    pass.debugf("   sum style: scalar=%s vector=%s", options.isSumScalar(), options.isSumVector());
    for (SymbolKind kind : SymbolKind.values()) {
      for (Symbol symbol : model.symbols(kind)) {
        backend.declare(pass, symbol);
      }
    }
    pass.debugf("after declares");
    for (Equation eq : model.equations()) {
      if (backend.skip(eq)) {
        pass.debugf("skipping equation %d", eq.number);
        continue;
      }
      backend.beginBlock(pass, eq);
      if (options.isEquationVector()) {
        backend.showEq(pass, eq, eq.sets, ImmutableList.of());
      } else {
        int remaining = eq.scalarCount;
        for (List<String> subs : Cartesian.of(elements(model, eq.sets))) {
          backend.showEq(pass, eq, eq.sets, subs);
          remaining--;
        }
        if (remaining != 0) {
          throw CodegenError.of(
              CodegenError.Kind.COUNT_MISMATCH,
              "Incorrect number of equations written for equation %d (expected %d, wrote %d)",
              eq.number,
              eq.scalarCount,
              eq.scalarCount - remaining);
        }
      }
      backend.endBlock(pass, eq);
    }
    pass.debugf("after equations");
    backend.endFile(pass);
  }

  private static ImmutableList<ImmutableList<String>> elements(Model model, List<String> sets) {
    return sets.stream().map(model::elements).collect(ImmutableList.toImmutableList());
  }

  /** The default {@link Backend#showEq}. */
  static void showEq(Pass pass, Equation eq, List<String> sets, List<String> subs) {
    Backend backend = pass.backend();
    RenderStyle style = backend.style();
    String lstr = pass.showNode(NodeType.NUL, eq.lhs, sets, subs);
    String rstr = pass.showNode(NodeType.NUL, eq.rhs, sets, subs);
    backend.beginEqn(pass, eq);
    String all =
        pass.options().isNormalized()
            ? lstr + style.normalizedOpen() + rstr + style.normalizedClose()
            : lstr + " = " + rstr;
    int limit = pass.options().lineLength();
    if (limit == 0 || all.length() <= limit) {
      pass.print(all);
    } else {
      String[] pieces = all.split("\n", -1);
      for (int i = 0; i < pieces.length - 1; i++) {
        backend.wrapWrite(pass, pieces[i], true, false);
      }
      backend.wrapWrite(pass, pieces[pieces.length - 1], false, false);
    }
    backend.endEqn(pass, eq);
  }

  private Generator() {}
}
