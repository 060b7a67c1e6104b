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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;
import org.modelgen.codegen.CodegenError;
import org.modelgen.model.Symbol;

/**
 * Assigns each symbol a contiguous range of slots in the vectors its {@link VarType} uses.
 *
 * <p>Some vectors are driven by another: a symbol's range in a dependent vector starts at the same
 * offset as its range in the driver, and allocating it doesn't advance the dependent vector's
 * counter. For each symbol the roles are processed in {@link Role} order, and a driver vector must
 * be reached before any vector that depends on it.
 *
 * @param <V> the enum of vectors
 */
public class VectorAllocator<V extends Enum<V>> {
  private final Class<V> vectorClass;
  private final Function<V, @Nullable V> driverOf;
  private final int origin;

  /** The next free offset in each vector. */
  private final EnumMap<V, Integer> next;

  private final Map<String, Allocation<V>> allocations = new LinkedHashMap<>();

  /**
   * @param vectorClass the enum of vectors
   * @param driverOf returns the vector that drives the given vector, or null (or the vector itself)
   *     if it is independent
   * @param origin the offset of the first slot in each vector
   */
  public VectorAllocator(Class<V> vectorClass, Function<V, @Nullable V> driverOf, int origin) {
    this.vectorClass = vectorClass;
    this.driverOf = driverOf;
    this.origin = origin;
    this.next = new EnumMap<>(vectorClass);
    for (V v : vectorClass.getEnumConstants()) {
      next.put(v, origin);
    }
  }

  /**
   * Reserves slots for {@code symbol}, which must not have been allocated already.
   *
   * @throws CodegenError if a dependent vector is reached before its driver
   */
  public Allocation<V> allocate(Symbol symbol, VarType<V> type) {
    if (allocations.containsKey(symbol.name)) {
      throw CodegenError.invariant("Multiple definitions of %s", symbol.name);
    }
    int count = symbol.size;
    Map<V, Integer> driverStarts = new EnumMap<>(vectorClass);
    Map<Role, Allocation.Slot<V>> slots = new EnumMap<>(Role.class);
    for (Role role : Role.values()) {
      V vector = type.vector(role);
      if (vector == null) {
        continue;
      }
      V driver = driverOf.apply(vector);
      int start;
      if (driver == null || driver == vector) {
        start = next.get(vector);
        next.put(vector, start + count);
        driverStarts.put(vector, start);
      } else {
        Integer driverStart = driverStarts.get(driver);
        if (driverStart == null) {
          throw CodegenError.of(
              CodegenError.Kind.ORDERING,
              "%s without %s (allocating %s)",
              vector,
              driver,
              symbol.name);
        }
        start = driverStart;
      }
      slots.put(role, new Allocation.Slot<>(vector, start));
    }
    Allocation<V> result = new Allocation<>(symbol, type, Maps.immutableEnumMap(slots));
    allocations.put(symbol.name, result);
    return result;
  }

  /** Returns the allocation for the named symbol, or null if it has none. */
  public @Nullable Allocation<V> get(String name) {
    return allocations.get(name);
  }

  /** Returns the number of slots allocated in the given vector. */
  public int size(V vector) {
    return next.get(vector) - origin;
  }

  /** Returns the number of slots allocated in each vector. */
  public ImmutableMap<V, Integer> sizes() {
    Map<V, Integer> result = new EnumMap<>(next);
    result.replaceAll((v, n) -> n - origin);
    return Maps.immutableEnumMap(result);
  }
}
