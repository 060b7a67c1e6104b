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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.modelgen.codegen.CodegenError;
import org.modelgen.model.Model;
import org.modelgen.model.Symbol;
import org.modelgen.util.Cartesian;

/**
 * Where one symbol's elements live: for each allowed {@link Role}, the vector and the offset of the
 * symbol's first element. The symbol's elements occupy consecutive slots in the order of its
 * domain's Cartesian expansion.
 *
 * @param <V> the enum of vectors
 */
public final class Allocation<V extends Enum<V>> {

  /** A vector and an offset within it. */
  public record Slot<V extends Enum<V>>(V vector, int offset) {}

  public final Symbol symbol;
  public final VarType<V> type;
  private final ImmutableMap<Role, Slot<V>> slots;

  Allocation(Symbol symbol, VarType<V> type, ImmutableMap<Role, Slot<V>> slots) {
    this.symbol = symbol;
    this.type = type;
    this.slots = slots;
  }

  /** Returns the slot for the given role, or null if the symbol's type doesn't allow it. */
  public @Nullable Slot<V> slotIfPresent(Role role) {
    return slots.get(role);
  }

  /**
   * Returns the slot for the given role.
   *
   * @throws CodegenError if the symbol's type doesn't allow the role
   */
  public Slot<V> slot(Role role) {
    Slot<V> result = slots.get(role);
    if (result == null) {
      throw CodegenError.of(
          CodegenError.Kind.CONTEXT,
          "Invalid context for variable %s\n   Type '%s' on %s",
          symbol.name,
          type.name,
          role.description);
    }
    return result;
  }

  /**
   * Returns the slot holding the element of this symbol identified by {@code subs}.
   *
   * @throws CodegenError if the role isn't allowed or {@code subs} isn't a tuple of elements of the
   *     symbol's domain
   */
  public Slot<V> slot(Role role, List<String> subs, Model model) {
    Slot<V> base = slot(role);
    ImmutableList<ImmutableList<String>> factors =
        symbol.domain.stream().map(model::elements).collect(ImmutableList.toImmutableList());
    int index = Cartesian.of(factors).indexOf(subs);
    if (index < 0) {
      throw CodegenError.semantic(
          "Subscripts (%s) are not in the domain of %s (%s)",
          String.join(",", subs),
          symbol.name,
          String.join(",", symbol.domain));
    }
    return new Slot<>(base.vector(), base.offset() + index);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(symbol.name).append(" (").append(type.name).append(")");
    for (Role role : Role.values()) {
      Slot<V> s = slots.get(role);
      sb.append(' ');
      if (s == null) {
        sb.append("--");
      } else {
        sb.append(s.vector()).append('[').append(s.offset()).append(']');
      }
    }
    return sb.toString();
  }
}
