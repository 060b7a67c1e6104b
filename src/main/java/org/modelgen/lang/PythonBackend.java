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

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.modelgen.codegen.Backend;
import org.modelgen.codegen.CodegenError;
import org.modelgen.codegen.Options;
import org.modelgen.codegen.Pass;
import org.modelgen.codegen.RenderStyle;
import org.modelgen.codegen.SymbolContext;
import org.modelgen.codegen.vector.Allocation;
import org.modelgen.codegen.vector.Role;
import org.modelgen.codegen.vector.VarType;
import org.modelgen.codegen.vector.VectorAllocator;
import org.modelgen.model.Equation;
import org.modelgen.model.Model;
import org.modelgen.model.Symbol;
import org.modelgen.model.SymbolKind;
import org.modelgen.util.Cartesian;
import org.modelgen.util.StringUtil;

/**
 * Generates a Python function that evaluates every scalar equation of the model over flat numpy
 * vectors.
 *
 * <p>Each parameter and variable is assigned slots in the vectors chosen by its type, which a
 * variable declares with exactly one attribute tag:
 *
 * <pre>
 *   tag  LHS                   RHS
 *   ---  --------------------  -----------------------------------------
 *   end  z1l                   z1r (same slots as z1l)
 *   ets  zel                   zer, lead() in exz (same slots as zel)
 *   exo  --                    exo
 *   cos  lead() in j1l         yjr (same slots as j1l)
 *   sta  lead() in x1l         yxr (same slots as x1l)
 *   stl  x1l                   lag() in yxr, x1r (same slots as x1l)
 *   par  --                    par
 * </pre>
 *
 * Parameters are always of type {@code par}. Using a symbol in any other context is an error.
 *
 * <p>Besides the code and info streams, a pass writes {@code _varinfo.csv} (one line per symbol)
 * and {@code _varmap.csv} (one line per scalar element and vector it occupies). The model must be
 * square: the number of scalar equations must equal the number of used endogenous slots.
 */
public class PythonBackend implements Backend {

  /** The index of the first slot of each vector. */
  public static final int ORIGIN = 0;

  public static final String VARINFO_SUFFIX = "_varinfo.csv";
  public static final String VARMAP_SUFFIX = "_varmap.csv";

  private static final RenderStyle STYLE =
      RenderStyle.DEFAULT.withPowerOp("**").withLineBreak(" \\\n        ");

  /** The vectors passed to the generated function. */
  enum MsgVector {
    Z1L(null),
    ZEL(null),
    J1L(null),
    X1L(null),
    Z1R(Z1L),
    ZER(ZEL),
    YJR(J1L),
    YXR(X1L),
    EXO(null),
    EXZ(ZEL),
    PAR(null),
    X1R(X1L);

    /** If non-null, each symbol's slots in this vector start where its slots in driver do. */
    final @Nullable MsgVector driver;

    MsgVector(@Nullable MsgVector driver) {
      this.driver = driver;
    }

    /** The name of the corresponding Python argument. */
    String pyName() {
      return Ascii.toLowerCase(name());
    }
  }

  /** The vectors whose slots hold endogenous values; their total size must match the equations. */
  private static final ImmutableList<MsgVector> ENDOGENOUS =
      ImmutableList.of(MsgVector.Z1L, MsgVector.ZEL, MsgVector.J1L, MsgVector.X1L);

  static final VarType<MsgVector> PAR_TYPE =
      VarType.<MsgVector>named("par").put(Role.RHS_CUR, MsgVector.PAR).build();

  static final ImmutableList<VarType<MsgVector>> TYPES =
      ImmutableList.of(
          VarType.<MsgVector>named("end")
              .put(Role.LHS_CUR, MsgVector.Z1L)
              .put(Role.RHS_CUR, MsgVector.Z1R)
              .build(),
          VarType.<MsgVector>named("ets")
              .put(Role.LHS_CUR, MsgVector.ZEL)
              .put(Role.RHS_CUR, MsgVector.ZER)
              .put(Role.RHS_LEAD, MsgVector.EXZ)
              .build(),
          VarType.<MsgVector>named("exo").put(Role.RHS_CUR, MsgVector.EXO).build(),
          VarType.<MsgVector>named("cos")
              .put(Role.LHS_LEAD, MsgVector.J1L)
              .put(Role.RHS_CUR, MsgVector.YJR)
              .build(),
          VarType.<MsgVector>named("sta")
              .put(Role.LHS_LEAD, MsgVector.X1L)
              .put(Role.RHS_CUR, MsgVector.YXR)
              .build(),
          VarType.<MsgVector>named("stl")
              .put(Role.LHS_CUR, MsgVector.X1L)
              .put(Role.RHS_LAG, MsgVector.YXR)
              .put(Role.RHS_CUR, MsgVector.X1R)
              .build(),
          PAR_TYPE);

  private final VectorAllocator<MsgVector> allocator =
      new VectorAllocator<>(MsgVector.class, v -> v.driver, ORIGIN);

  private int nextBlock = 1;
  private int nextScalar = 1;

  @Override
  public void setup(Options options) {
    options.setEquationStyle(Options.Style.SCALAR).setSumStyle(Options.Style.SCALAR);
  }

  @Override
  public RenderStyle style() {
    return STYLE;
  }

  @Override
  public void beginFile(Pass pass, String baseName) {
    pass.openAux(VARMAP_SUFFIX);
    pass.openAux(VARINFO_SUFFIX);
    pass.print("import numpy as np\n");
    pass.print("from math import exp\n");
    pass.print("from math import log\n");
    pass.print("\n\n");
    pass.print(
        "def msgproc(x1l:np.ndarray, j1l:np.ndarray, zel:np.ndarray, z1l:np.ndarray,"
            + " x1r:np.ndarray, j1r:np.ndarray, z1r:np.ndarray, zer:np.ndarray, yjr:np.ndarray,"
            + " yxr:np.ndarray, exo:np.ndarray, exz:np.ndarray, par:np.ndarray):\n");
    pass.print("\n");
  }

  /** Returns the type of a parameter or variable. */
  static VarType<MsgVector> typeOf(Symbol symbol) {
    if (symbol.is(SymbolKind.PARAMETER)) {
      return PAR_TYPE;
    }
    VarType<MsgVector> result = null;
    for (VarType<MsgVector> type : TYPES) {
      if (symbol.hasAttribute(type.name)) {
        if (result != null) {
          throw CodegenError.semantic("Multiple variable types for variable: %s", symbol.name);
        }
        result = type;
      }
    }
    if (result == null) {
      throw CodegenError.semantic("No type declared for variable %s", symbol.name);
    }
    return result;
  }

  @Override
  public void declare(Pass pass, Symbol symbol) {
    if (symbol.is(SymbolKind.SET)) {
      return;
    }
    if (symbol.size < 1) {
      throw CodegenError.invariant("Symbol %s has no elements", symbol.name);
    }
    VarType<MsgVector> type = typeOf(symbol);
    Allocation<MsgVector> allocation = allocator.allocate(symbol, type);
    pass.debugf("declare: %s has %d elements -> %s", symbol.name, symbol.size, allocation);
    String domain = symbol.domain.isEmpty() ? "" : "(" + String.join(",", symbol.domain) + ")";
    pass.auxf(
        VARINFO_SUFFIX,
        "%s,%d,%s,%s,%s\n",
        StringUtil.csvQuote(symbol.name + domain),
        symbol.size,
        type.name,
        StringUtil.csvQuote(symbol.description),
        StringUtil.csvQuote(String.join(",", symbol.attributes)));
    writeVarmap(pass, allocation);
  }

  /** Writes one line for each scalar element of the symbol and each vector it occupies. */
  private static void writeVarmap(Pass pass, Allocation<MsgVector> allocation) {
    Model model = pass.model();
    Symbol symbol = allocation.symbol;
    List<List<String>> tuples = new ArrayList<>();
    Cartesian.of(symbol.domain.stream().map(model::elements).toList()).forEach(tuples::add);
    for (Role role : Role.values()) {
      if (allocation.slotIfPresent(role) == null) {
        continue;
      }
      for (List<String> subs : tuples) {
        Allocation.Slot<MsgVector> slot = allocation.slot(role, subs, model);
        String element =
            subs.isEmpty() ? symbol.name : symbol.name + "(" + String.join(",", subs) + ")";
        String vector = slot.vector().pyName();
        pass.auxf(
            VARMAP_SUFFIX,
            "%s,%s,%s,%d\n",
            StringUtil.csvQuote(element),
            StringUtil.csvQuote(vector + "[" + slot.offset() + "]"),
            vector,
            slot.offset());
      }
    }
  }

  @Override
  public void beginBlock(Pass pass, Equation eq) {
    int block = nextBlock++;
    int start = nextScalar;
    int count = eq.scalarCount;
    nextScalar += count;
    pass.printf("    # Equation block %d\n", block);
    if (!eq.isLvalue()) {
      throw CodegenError.semantic("LHS of equation %d is not a variable: %s", eq.number, eq.lhs);
    }
    if (!eq.sets.isEmpty()) {
      pass.printf("    #    Defined over sets (%s)\n", String.join(",", eq.sets));
    }
    if (count != 0) {
      pass.printf(
          "    #    Scalar equations %d-%d (%d total)\n\n", start, start + count - 1, count);
    } else {
      pass.print("    #    Contains undeclared symbols\n");
    }
  }

  @Override
  public void beginEqn(Pass pass, Equation eq) {
    pass.print("    ");
  }

  @Override
  public void endEqn(Pass pass, Equation eq) {
    pass.print("\n\n");
  }

  @Override
  public String showSymbol(Pass pass, String name, List<String> subs, SymbolContext context) {
    Allocation<MsgVector> allocation = allocator.get(name);
    if (allocation == null) {
      throw CodegenError.semantic("Name not in variable list: %s", name);
    }
    Allocation.Slot<MsgVector> slot = allocation.slot(Role.of(context), subs, pass.model());
    return slot.vector().pyName() + "[" + slot.offset() + "]";
  }

  @Override
  public void endFile(Pass pass) {
    pass.print("\n# END OF MSGPROC function declaration\n");
    int numEqns = nextScalar - 1;
    int numEndog = 0;
    for (MsgVector v : ENDOGENOUS) {
      numEndog += allocator.size(v);
    }
    pass.info("\nLength of MSGPROC Vectors:\n\n");
    for (MsgVector v : MsgVector.values()) {
      if (v.driver == null) {
        pass.infof("   %s has %d elements\n", v.pyName(), allocator.size(v));
      }
    }
    int unused = 0;
    for (Symbol s : pass.model().symbols(SymbolKind.VARIABLE)) {
      if (s.hasAttribute("end") && !s.used) {
        unused += s.size;
      }
    }
    pass.info("\n");
    pass.infof("Equation Count: %d\n", numEqns);
    pass.infof("Endogenous Variables, Used:   %d\n", numEndog - unused);
    pass.infof("Endogenous Variables, Total:  %d\n", numEndog);
    if (numEqns != numEndog - unused) {
      String err = "Counts of equations and endogenous variables do not match.";
      pass.infof("\nFatal Error:\n   %s\n", err);
      throw CodegenError.of(
          CodegenError.Kind.COUNT_MISMATCH,
          "%s (%d equations, %d endogenous)",
          err,
          numEqns,
          numEndog - unused);
    }
  }
}
