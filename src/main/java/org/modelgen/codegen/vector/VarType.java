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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.EnumMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A variable type maps each {@link Role} to the vector that holds references in that role, or to
 * nothing if a symbol of this type may not be referenced that way.
 *
 * @param <V> the enum of vectors
 */
public final class VarType<V extends Enum<V>> {
  public final String name;
  private final ImmutableMap<Role, V> vectors;

  private VarType(String name, ImmutableMap<Role, V> vectors) {
    this.name = name;
    this.vectors = vectors;
  }

  /** Returns a Builder for a VarType with the given name. */
  public static <V extends Enum<V>> Builder<V> named(String name) {
    return new Builder<>(name);
  }

  /** Returns the vector used for the given role, or null if the role is not allowed. */
  public @Nullable V vector(Role role) {
    return vectors.get(role);
  }

  @Override
  public String toString() {
    return name;
  }

  /** Accumulates the role mapping of a VarType. */
  public static class Builder<V extends Enum<V>> {
    private final String name;
    private final Map<Role, V> vectors = new EnumMap<>(Role.class);

    private Builder(String name) {
      this.name = name;
    }

    @CanIgnoreReturnValue
    public Builder<V> put(Role role, V vector) {
      Preconditions.checkArgument(vectors.put(role, vector) == null, "Duplicate role %s", role);
      return this;
    }

    public VarType<V> build() {
      return new VarType<>(name, Maps.immutableEnumMap(vectors));
    }
  }
}
