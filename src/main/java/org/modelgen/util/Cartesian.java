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

package org.modelgen.util;

import com.google.common.collect.ImmutableList;
import com.google.common.math.IntMath;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * The cartesian product of an ordered list of element lists, as a lazily computed sequence of
 * subscript tuples.
 *
 * <p>Tuples are produced in nested-loop order with the first list outermost, so the last list
 * varies fastest. Each call to {@link #iterator} starts again from the first tuple. An empty list
 * of lists has exactly one (empty) tuple; if any of the lists is empty there are no tuples.
 */
public final class Cartesian implements Iterable<ImmutableList<String>> {
  private final ImmutableList<ImmutableList<String>> factors;

  private Cartesian(ImmutableList<ImmutableList<String>> factors) {
    this.factors = factors;
  }

  /** Returns the product of the given element lists. */
  public static Cartesian of(List<? extends List<String>> factors) {
    return new Cartesian(
        factors.stream().map(ImmutableList::copyOf).collect(ImmutableList.toImmutableList()));
  }

  /**
   * The number of tuples this product will yield.
   *
   * @throws ArithmeticException if the count does not fit in an int
   */
  public int size() {
    int result = 1;
    for (ImmutableList<String> f : factors) {
      result = IntMath.checkedMultiply(result, f.size());
    }
    return result;
  }

  /** The length of each tuple. */
  public int arity() {
    return factors.size();
  }

  /**
   * Returns the zero-based position of {@code tuple} in iteration order, or -1 if some element is
   * not in the corresponding list.
   */
  public int indexOf(List<String> tuple) {
    if (tuple.size() != factors.size()) {
      return -1;
    }
    int result = 0;
    for (int i = 0; i < factors.size(); i++) {
      int j = factors.get(i).indexOf(tuple.get(i));
      if (j < 0) {
        return -1;
      }
      result = result * factors.get(i).size() + j;
    }
    return result;
  }

  @Override
  public Iterator<ImmutableList<String>> iterator() {
    return new Odometer();
  }

  /** Steps through the tuples by incrementing the rightmost position that hasn't wrapped. */
  private class Odometer implements Iterator<ImmutableList<String>> {
    private final int[] positions = new int[factors.size()];
    private boolean done = factors.stream().anyMatch(List::isEmpty);

    @Override
    public boolean hasNext() {
      return !done;
    }

    @Override
    public ImmutableList<String> next() {
      if (done) {
        throw new NoSuchElementException();
      }
      ImmutableList.Builder<String> tuple = ImmutableList.builderWithExpectedSize(positions.length);
      for (int i = 0; i < positions.length; i++) {
        tuple.add(factors.get(i).get(positions[i]));
      }
      advance();
      return tuple.build();
    }

    private void advance() {
      for (int i = positions.length - 1; i >= 0; i--) {
        if (++positions[i] < factors.get(i).size()) {
          return;
        }
        positions[i] = 0;
      }
      // Every position wrapped (or there were none), so that was the last tuple.
      done = true;
    }
  }
}
