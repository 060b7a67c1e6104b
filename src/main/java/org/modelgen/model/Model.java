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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.math.IntMath;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.modelgen.codegen.CodegenError;

/**
 * A parsed and validated model: its symbols (in declaration order within each kind), its equations
 * (in declaration order), and the set queries that code generation needs.
 *
 * <p>A Model is immutable once built; use a {@link Builder} to create one.
 */
public final class Model {
  private final ImmutableMap<String, Symbol> symbols;
  private final ImmutableMap<String, ImmutableList<String>> supersets;
  private final ImmutableList<Equation> equations;

  private Model(
      ImmutableMap<String, Symbol> symbols,
      ImmutableMap<String, ImmutableList<String>> supersets,
      ImmutableList<Equation> equations) {
    this.symbols = symbols;
    this.supersets = supersets;
    this.equations = equations;
  }

  /** Returns the symbol with the given name, or null if there is none. */
  public @Nullable Symbol lookup(String name) {
    return symbols.get(name);
  }

  /** Returns all symbols of the given kind, in declaration order. */
  public ImmutableList<Symbol> symbols(SymbolKind kind) {
    return symbols.values().stream()
        .filter(s -> s.is(kind))
        .collect(ImmutableList.toImmutableList());
  }

  public ImmutableList<Equation> equations() {
    return equations;
  }

  /** True if {@code name} is a declared set. */
  public boolean isSet(String name) {
    Symbol s = symbols.get(name);
    return s != null && s.is(SymbolKind.SET);
  }

  /** Returns the elements of the given set; throws if there is no such set. */
  public ImmutableList<String> elements(String set) {
    return set(set).elements;
  }

  /**
   * Returns the product of the sizes of the given sets (1 for an empty list).
   *
   * @throws CodegenError if the product does not fit in an int
   */
  public int size(List<String> sets) {
    int result = 1;
    for (String s : sets) {
      result = multiplySize(result, elements(s).size(), sets);
    }
    return result;
  }

  private static int multiplySize(int size, int factor, List<String> sets) {
    try {
      return IntMath.checkedMultiply(size, factor);
    } catch (ArithmeticException e) {
      throw new CodegenError(
          CodegenError.Kind.SEMANTIC,
          String.format("Domain too large: (%s)", String.join(",", sets)),
          e);
    }
  }

  /** Returns the zero-based position of {@code element} in {@code set}, or -1 if absent. */
  public int indexOf(String set, String element) {
    return elements(set).indexOf(element);
  }

  /** Returns the sets that were declared as immediate supersets of {@code set}. */
  public ImmutableList<String> immediateSupersets(String set) {
    return supersets.getOrDefault(set, ImmutableList.of());
  }

  /** True if {@code sub} was declared (directly or transitively) as a subset of {@code sup}. */
  public boolean isSubset(String sub, String sup) {
    for (String s : immediateSupersets(sub)) {
      if (s.equals(sup) || isSubset(s, sup)) {
        return true;
      }
    }
    return false;
  }

  /** True if {@code label} is an element of some set and is not itself a symbol name. */
  public boolean isElement(String label) {
    if (symbols.containsKey(label)) {
      return false;
    }
    return symbols.values().stream()
        .anyMatch(s -> s.is(SymbolKind.SET) && s.elements.contains(label));
  }

  /**
   * Returns the equations that refer to {@code name} on their left-hand side (if {@code lhs} is
   * true) or right-hand side.
   */
  public ImmutableList<Equation> equationsReferencing(String name, boolean lhs) {
    ImmutableList.Builder<Equation> result = ImmutableList.builder();
    for (Equation eq : equations) {
      if (references(lhs ? eq.lhs : eq.rhs, name)) {
        result.add(eq);
      }
    }
    return result.build();
  }

  private static boolean references(Node node, String name) {
    boolean[] found = new boolean[1];
    node.forEachReference(n -> found[0] |= n.text.equals(name));
    return found[0];
  }

  private Symbol set(String name) {
    Symbol s = symbols.get(name);
    Preconditions.checkArgument(s != null && s.is(SymbolKind.SET), "Undeclared set: %s", name);
    return s;
  }

  /** Accumulates the declarations and equations of a Model. */
  public static class Builder {
    private final Map<String, PendingSymbol> pending = new LinkedHashMap<>();
    private final Map<String, ImmutableList<String>> supersets = new LinkedHashMap<>();
    private final List<PendingEquation> equations = new ArrayList<>();

    /** Declares a set with the given elements. */
    @CanIgnoreReturnValue
    public Builder addSet(String name, List<String> elements, String description) {
      return addSet(name, elements, description, ImmutableList.of());
    }

    /** Declares a set that is a subset of each of {@code supersets}. */
    @CanIgnoreReturnValue
    public Builder addSet(
        String name, List<String> elements, String description, List<String> supersets) {
      declare(
          new PendingSymbol(
              name,
              SymbolKind.SET,
              ImmutableList.of(),
              ImmutableList.copyOf(elements),
              ImmutableList.of(),
              description));
      if (!supersets.isEmpty()) {
        this.supersets.put(name, ImmutableList.copyOf(supersets));
      }
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addParameter(
        String name, List<String> domain, List<String> attributes, String description) {
      return declare(
          new PendingSymbol(
              name,
              SymbolKind.PARAMETER,
              ImmutableList.copyOf(domain),
              ImmutableList.of(),
              ImmutableList.copyOf(attributes),
              description));
    }

    @CanIgnoreReturnValue
    public Builder addVariable(
        String name, List<String> domain, List<String> attributes, String description) {
      return declare(
          new PendingSymbol(
              name,
              SymbolKind.VARIABLE,
              ImmutableList.copyOf(domain),
              ImmutableList.of(),
              ImmutableList.copyOf(attributes),
              description));
    }

    /** Adds an unlabeled equation over the given sets. */
    @CanIgnoreReturnValue
    public Builder addEquation(Node lhs, Node rhs, String... sets) {
      return addEquation(null, lhs, rhs, ImmutableList.copyOf(sets), false, true);
    }

    /** Adds an equation. Equations are numbered in the order they are added. */
    @CanIgnoreReturnValue
    public Builder addEquation(
        @Nullable String label,
        Node lhs,
        Node rhs,
        List<String> sets,
        boolean hasUndeclared,
        boolean timeOk) {
      equations.add(
          new PendingEquation(
              label, lhs.asLhs(), rhs, ImmutableList.copyOf(sets), hasUndeclared, timeOk));
      return this;
    }

    /** True if a symbol with this name has been declared. */
    public boolean isDeclared(String name) {
      return pending.containsKey(name);
    }

    /** True if a set with this name has been declared. */
    public boolean isSet(String name) {
      PendingSymbol s = pending.get(name);
      return s != null && s.kind == SymbolKind.SET;
    }

    /** True if {@code label} is an element of some previously declared set. */
    public boolean isElement(String label) {
      return pending.values().stream()
          .anyMatch(s -> s.kind == SymbolKind.SET && s.elements.contains(label));
    }

    @CanIgnoreReturnValue
    private Builder declare(PendingSymbol symbol) {
      Preconditions.checkArgument(
          !pending.containsKey(symbol.name), "Multiple declarations of %s", symbol.name);
      pending.put(symbol.name, symbol);
      return this;
    }

    public Model build() {
      // Find every name referenced by an equation, so that we can set Symbol.used.
      Set<String> used = new HashSet<>();
      for (PendingEquation eq : equations) {
        eq.lhs.forEachReference(n -> used.add(n.text));
        eq.rhs.forEachReference(n -> used.add(n.text));
      }
      ImmutableMap.Builder<String, Symbol> symbols = ImmutableMap.builder();
      for (PendingSymbol s : pending.values()) {
        int size = 1;
        for (String set : s.domain) {
          PendingSymbol setSymbol = pending.get(set);
          Preconditions.checkArgument(
              setSymbol != null && setSymbol.kind == SymbolKind.SET,
              "%s is declared over undeclared set %s",
              s.name,
              set);
          size = multiplySize(size, setSymbol.elements.size(), s.domain);
        }
        if (s.kind == SymbolKind.SET) {
          size = s.elements.size();
        }
        symbols.put(
            s.name,
            new Symbol(
                s.name,
                s.kind,
                s.domain,
                s.elements,
                s.attributes,
                s.description,
                used.contains(s.name),
                size));
      }
      Model partial =
          new Model(symbols.buildOrThrow(), ImmutableMap.copyOf(supersets), ImmutableList.of());
      ImmutableList.Builder<Equation> eqs = ImmutableList.builder();
      int number = 1;
      for (PendingEquation eq : equations) {
        int count = eq.hasUndeclared ? 0 : partial.size(eq.sets);
        eqs.add(
            new Equation(
                eq.lhs, eq.rhs, eq.sets, eq.hasUndeclared, eq.timeOk, eq.label, number++, count));
      }
      return new Model(partial.symbols, partial.supersets, eqs.build());
    }

    private record PendingSymbol(
        String name,
        SymbolKind kind,
        ImmutableList<String> domain,
        ImmutableList<String> elements,
        ImmutableList<String> attributes,
        String description) {}

    private record PendingEquation(
        @Nullable String label,
        Node lhs,
        Node rhs,
        ImmutableList<String> sets,
        boolean hasUndeclared,
        boolean timeOk) {}
  }
}
