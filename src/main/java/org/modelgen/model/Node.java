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
import java.util.List;
import java.util.function.Consumer;
import org.jspecify.annotations.Nullable;
import org.modelgen.codegen.Printer;

/**
 * An immutable node in an expression tree.
 *
 * <p>Children are exclusively owned: the static factories never share a subtree between two
 * parents, and the transforming methods ({@link #shiftTime}, {@link #asLhs}) return fresh copies.
 *
 * <p>A few shapes are worth knowing about:
 *
 * <ul>
 *   <li>A subscripted reference such as {@code Y(r)} is a {@link NodeType#DOM} node whose left
 *       child is the {@link NodeType#NAM} node (with {@link #domain} {@code [r]}) and whose right
 *       child is an {@link NodeType#LST} node listing the subscripts.
 *   <li>{@link NodeType#SUM} and {@link NodeType#PRD} have a {@code NAM} left child naming the
 *       bound set.
 *   <li>{@link NodeType#NEG}, {@link NodeType#LOG}, {@link NodeType#EXP}, {@link NodeType#LAG} and
 *       {@link NodeType#LED} only have a right child.
 * </ul>
 */
public final class Node {
  public final NodeType type;
  public final @Nullable Node left;
  public final @Nullable Node right;

  /** Operator or function text for interior nodes; identifier or literal text for leaves. */
  public final String text;

  /** For {@code NAM} nodes, the subscripts as written (set names or element labels). */
  public final ImmutableList<String> domain;

  /** True if this node appears on the left-hand side of an equation. */
  public final boolean lhs;

  /** The time offset of this node; nonzero only inside lag() or lead(). */
  public final int dt;

  private Node(
      NodeType type,
      @Nullable Node left,
      @Nullable Node right,
      String text,
      ImmutableList<String> domain,
      boolean lhs,
      int dt) {
    this.type = type;
    this.left = left;
    this.right = right;
    this.text = text;
    this.domain = domain;
    this.lhs = lhs;
    this.dt = dt;
  }

  private static Node of(NodeType type, @Nullable Node left, @Nullable Node right, String text) {
    return new Node(type, left, right, text, ImmutableList.of(), false, 0);
  }

  /** Returns an unsubscripted name reference. */
  public static Node name(String name) {
    return of(NodeType.NAM, null, null, name);
  }

  /** Returns a numeric literal, printed exactly as given. */
  public static Node number(String literal) {
    return of(NodeType.NUM, null, null, literal);
  }

  /** Returns a reference to {@code name}, subscripted by the given set names or element labels. */
  public static Node ref(String name, String... subscripts) {
    return ref(name, ImmutableList.copyOf(subscripts));
  }

  /** Returns a reference to {@code name}, subscripted by the given set names or element labels. */
  public static Node ref(String name, List<String> subscripts) {
    if (subscripts.isEmpty()) {
      return name(name);
    }
    Node nam = new Node(NodeType.NAM, null, null, name, ImmutableList.copyOf(subscripts), false, 0);
    return of(NodeType.DOM, nam, list(subscripts), "");
  }

  /** Returns an {@code LST} node whose right chain holds the given items. */
  public static Node list(List<String> items) {
    Node chain = null;
    for (int i = items.size() - 1; i >= 0; i--) {
      chain = of(NodeType.NAM, null, chain, items.get(i));
    }
    return of(NodeType.LST, null, chain, "");
  }

  /** Returns a binary operation using the type's default operator text. */
  public static Node binary(NodeType type, Node left, Node right) {
    return binary(type, type.defaultText, left, right);
  }

  /** Returns a binary operation with explicit operator text. */
  public static Node binary(NodeType type, String text, Node left, Node right) {
    Preconditions.checkNotNull(left);
    Preconditions.checkNotNull(right);
    return of(type, left, right, text);
  }

  public static Node add(Node left, Node right) {
    return binary(NodeType.ADD, left, right);
  }

  public static Node sub(Node left, Node right) {
    return binary(NodeType.SUB, left, right);
  }

  public static Node mul(Node left, Node right) {
    return binary(NodeType.MUL, left, right);
  }

  public static Node div(Node left, Node right) {
    return binary(NodeType.DVD, left, right);
  }

  public static Node pow(Node left, Node right) {
    return binary(NodeType.POW, left, right);
  }

  public static Node neg(Node operand) {
    return of(NodeType.NEG, null, Preconditions.checkNotNull(operand), NodeType.NEG.defaultText);
  }

  public static Node log(Node operand) {
    return of(NodeType.LOG, null, Preconditions.checkNotNull(operand), NodeType.LOG.defaultText);
  }

  public static Node exp(Node operand) {
    return of(NodeType.EXP, null, Preconditions.checkNotNull(operand), NodeType.EXP.defaultText);
  }

  /** Returns {@code sum(set, body)}. */
  public static Node sum(String set, Node body) {
    return of(NodeType.SUM, name(set), Preconditions.checkNotNull(body), NodeType.SUM.defaultText);
  }

  /** Returns {@code prod(set, body)}. */
  public static Node prod(String set, Node body) {
    return of(NodeType.PRD, name(set), Preconditions.checkNotNull(body), NodeType.PRD.defaultText);
  }

  /** Returns {@code lag(operand)}; every node inside has its time offset decreased by one. */
  public static Node lag(Node operand) {
    return of(NodeType.LAG, null, operand.shiftTime(-1), NodeType.LAG.defaultText);
  }

  /** Returns {@code lead(operand)}; every node inside has its time offset increased by one. */
  public static Node lead(Node operand) {
    return of(NodeType.LED, null, operand.shiftTime(1), NodeType.LED.defaultText);
  }

  /** Returns a copy of this tree with every time offset adjusted by {@code delta}. */
  public Node shiftTime(int delta) {
    return new Node(
        type,
        (left == null) ? null : left.shiftTime(delta),
        (right == null) ? null : right.shiftTime(delta),
        text,
        domain,
        lhs,
        dt + delta);
  }

  /** Returns a copy of this tree with every node marked as part of a left-hand side. */
  public Node asLhs() {
    return new Node(
        type,
        (left == null) ? null : left.asLhs(),
        (right == null) ? null : right.asLhs(),
        text,
        domain,
        true,
        dt);
  }

  /**
   * Calls {@code visitor} with each {@code NAM} node that refers to a symbol, in left-to-right
   * order. Subscript lists and the bound-set names of sums and products are skipped.
   */
  public void forEachReference(Consumer<Node> visitor) {
    switch (type) {
      case NAM -> visitor.accept(this);
      case DOM -> left.forEachReference(visitor);
      case LST -> {}
      case SUM, PRD -> right.forEachReference(visitor);
      default -> {
        if (left != null) {
          left.forEachReference(visitor);
        }
        if (right != null) {
          right.forEachReference(visitor);
        }
      }
    }
  }

  /**
   * Returns true if this node is a (possibly subscripted, possibly lagged or led) reference to a
   * single symbol.
   */
  public boolean isReference() {
    return switch (type) {
      case NAM -> true;
      case DOM -> left.isReference();
      case LAG, LED -> right.isReference();
      default -> false;
    };
  }

  /** If {@link #isReference} is true, returns the underlying {@code NAM} node. */
  public Node referencedName() {
    Preconditions.checkState(isReference(), "Not a reference: %s", this);
    return switch (type) {
      case DOM -> left.referencedName();
      case LAG, LED -> right.referencedName();
      default -> this;
    };
  }

  /** Returns this node in the compact, unwrapped form used for messages and debugging. */
  @Override
  public String toString() {
    return Printer.DEFAULT.render(NodeType.NUL, this, null);
  }
}
