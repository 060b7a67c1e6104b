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

package org.modelgen.codegen;

import org.jspecify.annotations.Nullable;
import org.modelgen.model.Node;
import org.modelgen.model.NodeType;

/**
 * Renders an expression tree as text, following the {@link Precedence.Mode#COMPACT} precedence
 * table. Names are printed as written (no subscript substitution), so this is the form used in
 * messages, in declarations, and by {@link Node#toString}.
 *
 * <p>If an indent string is given, a line break followed by the indent is inserted in front of an
 * operator whenever its operands are too wide (more than {@link #WRAP_TOTAL} characters together,
 * or more than {@link #WRAP_SIDE} characters either one).
 */
public class Printer {
  /** Break before an operator if the operands together are wider than this. */
  public static final int WRAP_TOTAL = 70;

  /** Break before an operator if either operand is wider than this. */
  public static final int WRAP_SIDE = 40;

  /** Prints with plain parentheses. */
  public static final Printer DEFAULT = new Printer("(", ")", "(", ")");

  private final String open;
  private final String close;
  private final String listOpen;
  private final String listClose;

  /**
   * @param open inserted before an expression that needs parentheses
   * @param close inserted after an expression that needs parentheses
   * @param listOpen inserted before the elements of a subscript list
   * @param listClose inserted after the elements of a subscript list
   */
  public Printer(String open, String close, String listOpen, String listClose) {
    this.open = open;
    this.close = close;
    this.listOpen = listOpen;
    this.listClose = listClose;
  }

  /** Returns true if operands of these widths should be separated by a line break. */
  static boolean tooWide(String left, String right) {
    return left.length() + right.length() > WRAP_TOTAL
        || left.length() > WRAP_SIDE
        || right.length() > WRAP_SIDE;
  }

  /**
   * Returns the text for {@code cur} as it must appear as an operand of a node of type {@code
   * parent}.
   *
   * @param indent if null or empty, no line breaks are inserted
   */
  public String render(NodeType parent, @Nullable Node cur, @Nullable String indent) {
    if (cur == null) {
      return "";
    }
    boolean parens = Precedence.needsParens(parent, cur.type, Precedence.Mode.COMPACT);
    String comma = Precedence.needsComma(parent, cur.type) ? "," : "";
    switch (cur.type) {
      case SUM, PRD -> {
        String body = render(cur.type, cur.right, indent);
        return cur.text + "(" + cur.left.text + "," + body + ")";
      }
      case LST -> {
        return renderList(cur);
      }
      default -> {}
    }
    String lstr = render(cur.type, cur.left, indent);
    String rstr = render(cur.type, cur.right, indent);
    String cr = "";
    if (indent != null && !indent.isEmpty() && tooWide(lstr, rstr)) {
      cr = "\n" + indent;
    }
    if (wrapRight(cur)) {
      rstr = "(" + rstr + ")";
    }
    String chunk = lstr + comma + cr + cur.text + rstr;
    return parens ? open + chunk + close : chunk;
  }

  /** Returns the elements of a subscript list, comma-separated and bracketed. */
  private String renderList(Node list) {
    StringBuilder sb = new StringBuilder(listOpen);
    for (Node item = list.right; item != null; item = item.right) {
      sb.append(item.text);
      if (item.right != null) {
        sb.append(',');
      }
    }
    return sb.append(listClose).toString();
  }

  /**
   * True if {@code cur} is a subtraction whose right operand is itself an addition or subtraction;
   * that operand is always parenthesized so that re-parsing the output preserves associativity.
   */
  static boolean wrapRight(Node cur) {
    return cur.type == NodeType.SUB
        && cur.right != null
        && (cur.right.type == NodeType.ADD || cur.right.type == NodeType.SUB);
  }
}
