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

import com.google.common.collect.ImmutableList;

/**
 * A declared set, parameter or variable.
 *
 * <p>For a set, {@link #elements} lists its members and {@link #domain} is empty. For a parameter
 * or variable, {@link #domain} lists the sets it is declared over and {@link #elements} is empty.
 * Symbols are never modified during generation; backends that need per-symbol bookkeeping keep
 * their own tables keyed by name.
 */
public final class Symbol {
  public final String name;
  public final SymbolKind kind;
  public final ImmutableList<String> domain;
  public final ImmutableList<String> elements;
  public final ImmutableList<String> attributes;
  public final String description;

  /** True if the symbol is referenced by at least one equation. */
  public final boolean used;

  /** The number of scalar instances: the product of the domain set sizes (1 if unsubscripted). */
  public final int size;

  Symbol(
      String name,
      SymbolKind kind,
      ImmutableList<String> domain,
      ImmutableList<String> elements,
      ImmutableList<String> attributes,
      String description,
      boolean used,
      int size) {
    this.name = name;
    this.kind = kind;
    this.domain = domain;
    this.elements = elements;
    this.attributes = attributes;
    this.description = description;
    this.used = used;
    this.size = size;
  }

  public boolean is(SymbolKind kind) {
    return this.kind == kind;
  }

  /** True if {@code attribute} is one of this symbol's attribute tags (case-insensitive). */
  public boolean hasAttribute(String attribute) {
    return attributes.stream().anyMatch(attribute::equalsIgnoreCase);
  }

  @Override
  public String toString() {
    return domain.isEmpty() ? name : name + "(" + String.join(",", domain) + ")";
  }
}
