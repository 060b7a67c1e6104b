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

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.modelgen.model.Node;
import org.modelgen.model.NodeType;

/**
 * The default implementation of {@link Backend#showNode}: renders an equation's expression tree
 * with subscripts bound, using the {@link Precedence.Mode#FULL} precedence table and the tokens of
 * the backend's {@link RenderStyle}.
 *
 * <p>Sums and products are either unrolled over the elements of their bound set ({@link
 * Options#isSumScalar}) or emitted as a single function call framed by {@link Backend#beginFunc}
 * and {@link Backend#endFunc}. Lag and lead wrappers are not printed here; the time offset they
 * imply is already recorded on the wrapped nodes and is rendered by {@link Backend#showSymbol}.
 */
public class NodeRenderer {

  /** Precedes each term of an unrolled sum or product. */
  static final String TERM_BREAK = "\n      ";

  public static String render(
      Pass pass, NodeType parent, @Nullable Node cur, List<String> sets, List<String> subs) {
    if (cur == null) {
      return "";
    }
    Backend backend = pass.backend();
    boolean parens = Precedence.needsParens(parent, cur.type, Precedence.Mode.FULL);
    switch (cur.type) {
      case NAM -> {
        ImmutableList<String> bound = Subscripts.resolve(cur.domain, sets, subs);
        return backend.showSymbol(pass, cur.text, bound, new SymbolContext(cur.lhs, cur.dt));
      }
      case LAG, LED -> {
        return pass.showNode(cur.type, cur.right, sets, subs);
      }
      case DOM -> {
        return pass.showNode(cur.type, cur.left, sets, subs);
      }
      case LST -> throw CodegenError.invariant("Unexpected subscript list in show_node: %s", cur);
      case SUM, PRD -> {
        return pass.options().isSumScalar()
            ? unrolled(pass, cur, sets, subs)
            : functional(pass, cur, sets, subs);
      }
      default -> {}
    }
    RenderStyle style = backend.style();
    boolean isFunc = false;
    String lstr;
    String endFunc = "";
    String op;
    switch (cur.type) {
      case LOG, EXP -> {
        isFunc = true;
        lstr = backend.beginFunc(pass, cur.text, null);
        endFunc = backend.endFunc(pass);
        op = "";
      }
      case POW -> {
        lstr = pass.showNode(cur.type, cur.left, sets, subs);
        op = style.powerOp();
      }
      default -> {
        lstr = pass.showNode(cur.type, cur.left, sets, subs);
        op = cur.text;
      }
    }
    String rstr = pass.showNode(cur.type, cur.right, sets, subs);
    String cr = Printer.tooWide(lstr, rstr) ? style.lineBreak() : "";
    if (Printer.wrapRight(cur)) {
      rstr = "(" + rstr + ")";
    }
    boolean wrap = parens && !isFunc;
    return (wrap ? style.parenOpen() : "")
        + lstr
        + cr
        + op
        + rstr
        + (wrap ? style.parenClose() : "")
        + endFunc;
  }

  /** Expands a sum or product into one term per element of its bound set. */
  private static String unrolled(Pass pass, Node cur, List<String> sets, List<String> subs) {
    RenderStyle style = pass.backend().style();
    String bound = cur.left.text;
    pass.debugf("scalar sum or product: %s", pass.backend().spprint(NodeType.NUL, cur, null));
    boolean product = (cur.type == NodeType.PRD);
    String op = product ? "*" : "+";
    String lpar = product ? style.productTermOpen() : "";
    String rpar = product ? style.productTermClose() : "";
    List<String> augSets = Subscripts.append(sets, bound);
    List<String> outer = Subscripts.pad(subs, sets);
    StringBuilder buf = new StringBuilder(style.sumOpen());
    String thisOp = " ";
    for (String element : pass.model().elements(bound)) {
      String term = pass.showNode(cur.type, cur.right, augSets, Subscripts.append(outer, element));
      buf.append(TERM_BREAK).append(thisOp).append(lpar).append(term).append(rpar);
      thisOp = op;
    }
    return buf.append(style.sumClose()).toString();
  }

  /**
   * Emits a sum or product as a single function over its bound set. The bound set is added to the
   * sets in scope but no element is bound to it, so references keep the set name.
   */
  private static String functional(Pass pass, Node cur, List<String> sets, List<String> subs) {
    Backend backend = pass.backend();
    String bound = cur.left.text;
    pass.debugf("vector sum or product: %s", backend.spprint(NodeType.NUL, cur, null));
    String begin = backend.beginFunc(pass, cur.text, bound);
    String body = pass.showNode(cur.type, cur.right, Subscripts.append(sets, bound), subs);
    return begin + body + backend.endFunc(pass);
  }

  private NodeRenderer() {}
}
