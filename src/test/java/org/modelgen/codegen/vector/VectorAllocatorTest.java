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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.modelgen.codegen.CodegenError;
import org.modelgen.model.Model;
import org.modelgen.model.Symbol;

@RunWith(JUnit4.class)
public class VectorAllocatorTest {

  /** Two independent vectors and two that share their drivers' offsets. */
  enum Vec {
    LEFT(null),
    RIGHT(null),
    LEFT_COPY(LEFT),
    RIGHT_COPY(RIGHT);

    final @Nullable Vec driver;

    Vec(@Nullable Vec driver) {
      this.driver = driver;
    }
  }

  private static final VarType<Vec> PLAIN =
      VarType.<Vec>named("plain")
          .put(Role.LHS_CUR, Vec.LEFT)
          .put(Role.RHS_CUR, Vec.LEFT_COPY)
          .put(Role.RHS_LAG, Vec.RIGHT)
          .build();

  private static final VarType<Vec> RHS_ONLY =
      VarType.<Vec>named("rhs").put(Role.RHS_CUR, Vec.RIGHT).build();

  /** Uses a dependent vector in a role that comes before its driver's. */
  private static final VarType<Vec> BACKWARDS =
      VarType.<Vec>named("backwards")
          .put(Role.LHS_CUR, Vec.RIGHT_COPY)
          .put(Role.RHS_CUR, Vec.RIGHT)
          .build();

  private static final Model MODEL =
      new Model.Builder()
          .addSet("r", ImmutableList.of("r1", "r2", "r3"), "")
          .addSet("s", ImmutableList.of("s1", "s2"), "")
          .addVariable("x", ImmutableList.of("r"), ImmutableList.of(), "")
          .addVariable("y", ImmutableList.of("r", "s"), ImmutableList.of(), "")
          .addVariable("z", ImmutableList.of(), ImmutableList.of(), "")
          .build();

  private static Symbol symbol(String name) {
    return MODEL.lookup(name);
  }

  private static VectorAllocator<Vec> newAllocator(int origin) {
    return new VectorAllocator<>(Vec.class, v -> v.driver, origin);
  }

  @Test
  public void consecutiveRanges() {
    VectorAllocator<Vec> allocator = newAllocator(0);
    Allocation<Vec> x = allocator.allocate(symbol("x"), PLAIN);
    Allocation<Vec> y = allocator.allocate(symbol("y"), PLAIN);
    assertThat(x.slot(Role.LHS_CUR)).isEqualTo(new Allocation.Slot<>(Vec.LEFT, 0));
    assertThat(y.slot(Role.LHS_CUR)).isEqualTo(new Allocation.Slot<>(Vec.LEFT, 3));
    assertThat(y.slot(Role.RHS_LAG)).isEqualTo(new Allocation.Slot<>(Vec.RIGHT, 3));
    assertThat(allocator.size(Vec.LEFT)).isEqualTo(9);
    assertThat(allocator.size(Vec.RIGHT)).isEqualTo(9);
  }

  @Test
  public void dependentVectorFollowsDriver() {
    VectorAllocator<Vec> allocator = newAllocator(0);
    allocator.allocate(symbol("z"), RHS_ONLY);
    Allocation<Vec> y = allocator.allocate(symbol("y"), PLAIN);
    assertThat(y.slot(Role.RHS_CUR)).isEqualTo(new Allocation.Slot<>(Vec.LEFT_COPY, 0));
    assertThat(y.slot(Role.RHS_LAG)).isEqualTo(new Allocation.Slot<>(Vec.RIGHT, 1));
    // Dependent vectors never advance
    assertThat(allocator.size(Vec.LEFT_COPY)).isEqualTo(0);
    assertThat(allocator.sizes())
        .containsExactly(Vec.LEFT, 6, Vec.RIGHT, 7, Vec.LEFT_COPY, 0, Vec.RIGHT_COPY, 0);
  }

  @Test
  public void origin() {
    VectorAllocator<Vec> allocator = newAllocator(1);
    allocator.allocate(symbol("x"), PLAIN);
    Allocation<Vec> z = allocator.allocate(symbol("z"), PLAIN);
    assertThat(z.slot(Role.LHS_CUR).offset()).isEqualTo(4);
    assertThat(allocator.size(Vec.LEFT)).isEqualTo(4);
  }

  @Test
  public void elementSlots() {
    VectorAllocator<Vec> allocator = newAllocator(0);
    allocator.allocate(symbol("x"), PLAIN);
    Allocation<Vec> y = allocator.allocate(symbol("y"), PLAIN);
    assertThat(y.slot(Role.LHS_CUR, ImmutableList.of("r1", "s1"), MODEL).offset()).isEqualTo(3);
    assertThat(y.slot(Role.LHS_CUR, ImmutableList.of("r2", "s2"), MODEL).offset()).isEqualTo(6);
    assertThat(y.slot(Role.RHS_CUR, ImmutableList.of("r3", "s2"), MODEL))
        .isEqualTo(new Allocation.Slot<>(Vec.LEFT_COPY, 8));
    CodegenError e =
        assertThrows(
            CodegenError.class,
            () -> y.slot(Role.LHS_CUR, ImmutableList.of("r", "s"), MODEL));
    assertThat(e.kind).isEqualTo(CodegenError.Kind.SEMANTIC);
  }

  @Test
  public void roleNotAllowedByType() {
    Allocation<Vec> z = newAllocator(0).allocate(symbol("z"), RHS_ONLY);
    assertThat(z.slotIfPresent(Role.LHS_CUR)).isNull();
    CodegenError e = assertThrows(CodegenError.class, () -> z.slot(Role.LHS_CUR));
    assertThat(e.kind).isEqualTo(CodegenError.Kind.CONTEXT);
    assertThat(e.msg)
        .isEqualTo("Invalid context for variable z\n   Type 'rhs' on LHS without lag() or lead()");
  }

  @Test
  public void dependentBeforeDriver() {
    CodegenError e =
        assertThrows(CodegenError.class, () -> newAllocator(0).allocate(symbol("x"), BACKWARDS));
    assertThat(e.kind).isEqualTo(CodegenError.Kind.ORDERING);
    assertThat(e.msg).isEqualTo("RIGHT_COPY without RIGHT (allocating x)");
  }

  @Test
  public void eachSymbolOnce() {
    VectorAllocator<Vec> allocator = newAllocator(0);
    allocator.allocate(symbol("x"), PLAIN);
    assertThrows(CodegenError.class, () -> allocator.allocate(symbol("x"), RHS_ONLY));
    assertThat(allocator.get("x").type).isSameInstanceAs(PLAIN);
    assertThat(allocator.get("y")).isNull();
  }
}
