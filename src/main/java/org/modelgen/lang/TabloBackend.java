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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.modelgen.codegen.Backend;
import org.modelgen.codegen.CodegenError;
import org.modelgen.codegen.Options;
import org.modelgen.codegen.Pass;
import org.modelgen.codegen.SymbolContext;
import org.modelgen.model.Equation;
import org.modelgen.model.Model;
import org.modelgen.model.Symbol;
import org.modelgen.model.SymbolKind;

/**
 * Generates a GEMPACK TABLO program: declarations of sets, coefficients, variables and files,
 * followed by one vector-form {@code equation} (or, in calc mode, {@code formula}) per model
 * equation.
 *
 * <p>Each set is given a short index name for use in {@code (all,i,set)} qualifiers and sums.
 * Parameters are read from the logical file {@code param}; variables are read from a file chosen
 * by the first letter of their header attribute (see {@link Header}).
 *
 * <p>In calc mode only symbols that are actually used are declared, variables become coefficients,
 * each equation must have a single variable on its left-hand side, and the computed values are
 * written to the file {@code calc} at the end.
 */
public class TabloBackend implements Backend {

  /** The line length used unless one is given explicitly. */
  public static final int LINE_LENGTH = 75;

  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z][A-Za-z0-9_]*");

  private final boolean calc;

  /** The index name and time flag of each declared set, in declaration order. */
  private final Map<String, TabSet> tabSets = new LinkedHashMap<>();

  /** Sets used by some declared parameter or variable (or their supersets). */
  private final Set<String> usedSets = new HashSet<>();

  /** The variables computed by formulas, in calc mode. */
  private final List<String> calcVars = new ArrayList<>();

  private int numEqns;
  private int numScalarEqns;
  private int numVars;
  private int numPars;

  private static class TabSet {
    String index;
    final boolean isTime;

    TabSet(String index, boolean isTime) {
      this.index = index;
      this.isTime = isTime;
    }
  }

  public TabloBackend(boolean calc) {
    this.calc = calc;
  }

  @Override
  public void setup(Options options) {
    options
        .setEquationStyle(Options.Style.VECTOR)
        .setSumStyle(Options.Style.VECTOR)
        .setDefaultLineLength(LINE_LENGTH);
  }

  @Override
  public void beginFile(Pass pass, String baseName) {
    if (!calc) {
      pass.print("equation    (default=levels)       ;\n");
      pass.print("equation    (default=add_homotopy) ;\n");
      pass.print("variable    (default=levels)       ;\n");
    } else {
      pass.print("formula     (default=initial)      ;\n");
    }
    pass.print("coefficient (default=parameter)    ;\n");
    pass.print("\n");
  }

  @Override
  public void declare(Pass pass, Symbol symbol) {
    switch (symbol.kind) {
      case SET -> {
        Model model = pass.model();
        boolean isTime = symbol.name.equals("time") || model.isSubset(symbol.name, "time");
        tabSets.put(symbol.name, new TabSet(symbol.name.substring(0, 1), isTime));
      }
      case VARIABLE -> numVars++;
      case PARAMETER -> numPars++;
    }
  }

  /** True if the symbol should be declared. */
  private boolean isShown(Symbol symbol) {
    if (!calc) {
      return true;
    }
    return symbol.used || (symbol.is(SymbolKind.SET) && usedSets.contains(symbol.name));
  }

  /** True if the symbol's initial values must be read from a file. */
  private boolean needsRead(Pass pass, Symbol symbol) {
    if (calc) {
      return !symbol.attributes.isEmpty()
          && !pass.model().equationsReferencing(symbol.name, false).isEmpty();
    }
    if (symbol.attributes.isEmpty()) {
      throw CodegenError.semantic("Header required for symbol: %s", symbol.name);
    }
    return true;
  }

  private void markUsed(Model model, String set) {
    usedSets.add(set);
    for (String sup : model.immediateSupersets(set)) {
      markUsed(model, sup);
    }
  }

  /** Returns a reference to {@code name} with the given subscripts. */
  private String tabloVar(Pass pass, String name, List<String> subs, int dt) {
    if (subs.isEmpty()) {
      return name;
    }
    List<String> indexes = new ArrayList<>();
    for (String s : subs) {
      TabSet ts = pass.model().isSet(s) ? tabSets.get(s) : null;
      if (ts == null) {
        // An element label
        indexes.add("\"" + s + "\"");
      } else if (ts.isTime && dt != 0) {
        indexes.add(String.format("%s%+d", ts.index, dt));
      } else {
        indexes.add(ts.index);
      }
    }
    return name + "(" + String.join(",", indexes) + ")";
  }

  /** Returns the {@code (all,i,set) } qualifiers for the given sets. */
  private String qualifier(Pass pass, List<String> sets) {
    StringBuilder sb = new StringBuilder();
    for (String s : sets) {
      if (pass.model().isSet(s)) {
        sb.append("(all,").append(tabSet(s).index).append(',').append(s).append(") ");
      }
    }
    return sb.toString();
  }

  private TabSet tabSet(String name) {
    TabSet result = tabSets.get(name);
    if (result == null) {
      throw CodegenError.invariant("Undeclared set %s", name);
    }
    return result;
  }

  private void writeDecls(Pass pass) {
    Model model = pass.model();
    // Make each set's index unique
    Set<String> sofar = new HashSet<>();
    for (TabSet ts : tabSets.values()) {
      char first = ts.index.charAt(0);
      for (int n = 1; model.lookup(ts.index) != null || sofar.contains(ts.index); n++) {
        ts.index = first + Integer.toString(n);
      }
      sofar.add(ts.index);
    }
    List<Symbol> sets = model.symbols(SymbolKind.SET);
    List<Symbol> pars = model.symbols(SymbolKind.PARAMETER);
    List<Symbol> vars = model.symbols(SymbolKind.VARIABLE);
    for (Symbol s : pars) {
      if (isShown(s)) {
        s.domain.forEach(set -> markUsed(model, set));
      }
    }
    for (Symbol s : vars) {
      if (isShown(s)) {
        s.domain.forEach(set -> markUsed(model, set));
      }
    }

    for (Symbol s : sets) {
      if (isShown(s)) {
        String time = tabSet(s.name).isTime ? "(intertemporal) " : "";
        String stmt =
            "set " + time + s.name + " (" + String.join(",", s.elements) + ") ;";
        writeWrapped(pass, stmt, true, true);
      }
    }
    if (!sets.isEmpty()) {
      pass.print("\n");
    }

    int numSubsets = 0;
    for (Symbol s : sets) {
      if (isShown(s)) {
        for (String sup : model.immediateSupersets(s.name)) {
          pass.printf("subset %s is subset of %s ;\n", s.name, sup);
          numSubsets++;
        }
      }
    }
    if (numSubsets != 0) {
      pass.print("\n");
    }

    for (Symbol s : pars) {
      if (isShown(s)) {
        String stmt =
            "coefficient " + qualifier(pass, s.domain) + tabloVar(pass, s.name, s.domain, 0) + " ;";
        writeWrapped(pass, stmt, true, false);
      }
    }
    if (!pars.isEmpty()) {
      pass.print("\n");
      pass.print("file param ;\n\n");
    }
    int nextHeader = 0;
    for (Symbol s : pars) {
      if (isShown(s)) {
        String header =
            (s.attributes.size() == 1)
                ? s.attributes.get(0)
                : String.format("H%03d", nextHeader++);
        String stmt =
            String.format(
                "read %s\n   %s from file param header \"%s\" ;",
                qualifier(pass, s.domain),
                tabloVar(pass, s.name, s.domain, 0),
                header);
        writeWrapped(pass, stmt, true, false);
      }
    }
    if (!pars.isEmpty()) {
      pass.print("\n");
    }

    Set<String> files = new LinkedHashSet<>();
    for (Symbol s : vars) {
      if (isShown(s)) {
        String stmt =
            (calc ? "coefficient " : "variable ")
                + qualifier(pass, s.domain)
                + tabloVar(pass, s.name, s.domain, 0)
                + " ;";
        writeWrapped(pass, stmt, true, false);
        if (needsRead(pass, s)) {
          files.add(Header.of(s).fileName);
        }
      }
    }
    pass.print("\n");
    if (!files.isEmpty()) {
      files.forEach(f -> pass.printf("file %s ;\n", f));
      pass.print("\n");
    }

    for (Symbol s : vars) {
      if (isShown(s) && needsRead(pass, s)) {
        String stmt =
            String.format(
                "read %s\n   %s from file %s header \"%s\" ;",
                qualifier(pass, s.domain),
                tabloVar(pass, s.name, s.domain, 0),
                Header.of(s).fileName,
                s.attributes.get(0));
        writeWrapped(pass, stmt, true, false);
      }
    }
  }

  @Override
  public void beginBlock(Pass pass, Equation eq) {
    if (numEqns == 0) {
      writeDecls(pass);
    }
    numEqns++;
    numScalarEqns += eq.scalarCount;
    String qual = qualifier(pass, eq.sets);
    if (!calc) {
      String name = equationName(eq);
      pass.printf("\nequation %s %s\n   ", name, qual);
    } else if (!eq.isLvalue()) {
      throw CodegenError.semantic(
          "LHS of equation %d in calc mode is not a variable: %s", eq.number, eq.lhs);
    } else {
      pass.printf("\nformula %s\n   ", qual);
      calcVars.add(eq.lhsName());
    }
  }

  /** Equations are named by their label if it is a valid identifier. */
  private String equationName(Equation eq) {
    @Nullable String label = eq.label;
    return (label != null && IDENTIFIER.matcher(label).matches()) ? label : "EQN" + numEqns;
  }

  @Override
  public void endEqn(Pass pass, Equation eq) {
    pass.print(" ;\n");
  }

  @Override
  public String beginFunc(Pass pass, String func, @Nullable String arg) {
    if (func.equals("sum") || func.equals("prod")) {
      return func + "(" + tabSet(arg).index + "," + arg + ",";
    } else if (arg != null) {
      throw CodegenError.invariant("Unexpected function call %s(%s,...)", func, arg);
    }
    return func.equals("log") ? "loge(" : func + "(";
  }

  @Override
  public String showSymbol(Pass pass, String name, List<String> subs, SymbolContext context) {
    return tabloVar(pass, name, subs, context.dt());
  }

  @Override
  public void endFile(Pass pass) {
    Model model = pass.model();
    if (numEqns == 0) {
      writeDecls(pass);
    }
    Map<Header, Integer> counts = new LinkedHashMap<>();
    for (Header h : Header.values()) {
      counts.put(h, 0);
    }
    int unused = 0;
    for (Symbol v : model.symbols(SymbolKind.VARIABLE)) {
      if (!v.used) {
        unused++;
      } else {
        counts.merge(Header.of(v), v.size, Integer::sum);
      }
    }

    if (calc) {
      pass.print("\nfile (new) calc ;\n\n");
      for (String name : calcVars) {
        Symbol s = model.lookup(name);
        if (s != null && s.attributes.size() == 1) {
          String stmt =
              String.format(
                  "write %s\n   %s to file calc header \"%s\" ;",
                  qualifier(pass, s.domain),
                  tabloVar(pass, s.name, s.domain, 0),
                  s.attributes.get(0));
          writeWrapped(pass, stmt, true, false);
        }
      }
      pass.print("\n");
    }

    pass.info("\nVector information:\n");
    pass.infof("\n   Equations: %d\n", numEqns);
    pass.infof("   Variables, Used: %d\n", numVars - unused);
    pass.infof("   Variables, Unused: %d\n", unused);
    pass.infof("   Parameters: %d\n", numPars);

    pass.info("\nTime information:\n");
    pass.infof("\n   Periods used: %d\n", model.isSet("time") ? model.elements("time").size() : 0);

    int numEndog = 0;
    int numExog = 0;
    int numOther = 0;
    for (Header h : Header.values()) {
      switch (h.closure) {
        case ENDOGENOUS -> numEndog += counts.get(h);
        case EXOGENOUS -> numExog += counts.get(h);
        case UNDETERMINED -> numOther += counts.get(h);
        case PARAMETER -> {}
      }
    }

    pass.info("\nScalar information:\n");
    pass.infof("\n   Equations: %d\n", numScalarEqns);
    pass.infof("\n   Endogenous variables: %d\n", numEndog);
    reportTypes(pass, counts, Header.Closure.ENDOGENOUS);

    int diff = numScalarEqns - numEndog;
    pass.info("\n   Closure:\n");
    if (diff == 0) {
      pass.info("      Equations and variables match\n");
    } else if (diff > 0) {
      pass.infof("      Excess equations: %d\n", diff);
    } else {
      pass.infof("      Excess variables: %d\n", -diff);
    }

    pass.infof("\n   Exogenous variables: %d\n", numExog);
    reportTypes(pass, counts, Header.Closure.EXOGENOUS);

    pass.infof("\n   Undetermined variables: %d\n", numOther);
    reportTypes(pass, counts, Header.Closure.UNDETERMINED);
    for (Symbol v : model.symbols(SymbolKind.VARIABLE)) {
      if (v.used && Header.of(v) == Header.OTHER) {
        pass.infof("      %-13s: %d\n", v.name, v.size);
      }
    }
  }

  private static void reportTypes(Pass pass, Map<Header, Integer> counts, Header.Closure closure) {
    for (Header h : Header.REPORT_ORDER) {
      if (h.closure == closure) {
        pass.infof("      Type %s: %d\n", h.fileName, counts.get(h));
      }
    }
  }

  private void writeWrapped(Pass pass, String line, boolean addNewline, boolean commaOk) {
    pass.backend().wrapWrite(pass, line, addNewline, commaOk);
  }
}
