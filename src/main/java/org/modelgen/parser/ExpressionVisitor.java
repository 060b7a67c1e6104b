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

package org.modelgen.parser;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Function;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.modelgen.model.Model;
import org.modelgen.model.Node;
import org.modelgen.model.NodeType;
import org.modelgen.parser.ModelFileParser.ElementContext;
import org.modelgen.parser.ModelFileParser.FunctionExpressionContext;
import org.modelgen.parser.ModelFileParser.NegExpressionContext;
import org.modelgen.parser.ModelFileParser.NumberExpressionContext;
import org.modelgen.parser.ModelFileParser.ParenExpressionContext;
import org.modelgen.parser.ModelFileParser.PowerExpressionContext;
import org.modelgen.parser.ModelFileParser.ProductExpressionContext;
import org.modelgen.parser.ModelFileParser.ReduceExpressionContext;
import org.modelgen.parser.ModelFileParser.RefExpressionContext;
import org.modelgen.parser.ModelFileParser.ShiftExpressionContext;
import org.modelgen.parser.ModelFileParser.SumExpressionContext;
import org.modelgen.util.StringUtil;

/**
 * Converts the two sides of one equation into {@link Node} trees.
 *
 * <p>As it goes it records which sets are used as free subscripts (those become the sets the
 * equation ranges over, in order of first use) and whether any undeclared name was referenced.
 *
 * <p>Visiting a node type that doesn't have an explicit visit* method throws an AssertionError
 * rather than silently returning null.
 */
class ExpressionVisitor extends ModelFileBaseVisitor<Node> {

  private final Model.Builder declarations;

  /** The sets bound by the enclosing sums and products, innermost first. */
  private final Deque<String> bound = new ArrayDeque<>();

  private final Set<String> freeSets = new LinkedHashSet<>();
  private boolean hasUndeclared;

  /** The node currently being visited. */
  private ParseTree currentNode;

  ExpressionVisitor(Model.Builder declarations) {
    this.declarations = declarations;
  }

  /** The sets used as subscripts outside any sum or product binding them. */
  ImmutableList<String> freeSets() {
    return ImmutableList.copyOf(freeSets);
  }

  boolean hasUndeclared() {
    return hasUndeclared;
  }

  @Override
  protected final Node defaultResult() {
    throw new AssertionError();
  }

  @Override
  public final Node visit(ParseTree tree) {
    return visitWithCurrentNode(tree, super::visit);
  }

  /**
   * Calls {@code visitor} with the given node, binding {@link #currentNode} for the duration of the
   * call.
   */
  @CanIgnoreReturnValue
  Node visitWithCurrentNode(ParseTree node, Function<ParseTree, Node> visitor) {
    ParseTree prevNode = currentNode;
    currentNode = node;
    Node result = visitor.apply(node);
    currentNode = prevNode;
    return result;
  }

  @Override
  public Node visitParenExpression(ParenExpressionContext ctx) {
    return visit(ctx.expression());
  }

  @Override
  public Node visitNumberExpression(NumberExpressionContext ctx) {
    return Node.number(ctx.NUMBER().getText());
  }

  @Override
  public Node visitRefExpression(RefExpressionContext ctx) {
    String name = ctx.ID().getText();
    if (!declarations.isDeclared(name)) {
      hasUndeclared = true;
    }
    ImmutableList.Builder<String> subs = ImmutableList.builder();
    for (ElementContext element : ctx.element()) {
      subs.add(subscript(element));
    }
    return Node.ref(name, subs.build());
  }

  /** Returns the set name or element label written as a subscript. */
  private String subscript(ElementContext element) {
    if (element.STRING() != null) {
      return StringUtil.unescape(element.STRING().getText());
    } else if (element.NUMBER() != null) {
      return element.NUMBER().getText();
    }
    String id = element.ID().getText();
    if (declarations.isSet(id)) {
      if (!bound.contains(id)) {
        freeSets.add(id);
      }
    } else if (!declarations.isElement(id)) {
      throw ParseError.at(element.start, "'%s' is neither a set nor an element", id);
    }
    return id;
  }

  @Override
  public Node visitReduceExpression(ReduceExpressionContext ctx) {
    String set = ctx.ID().getText();
    if (!declarations.isSet(set)) {
      throw error("'%s' is not a set", set);
    }
    bound.push(set);
    Node body = visit(ctx.expression());
    bound.pop();
    return ctx.op.getText().equals("sum") ? Node.sum(set, body) : Node.prod(set, body);
  }

  @Override
  public Node visitFunctionExpression(FunctionExpressionContext ctx) {
    Node arg = visit(ctx.expression());
    return ctx.func.getText().equals("log") ? Node.log(arg) : Node.exp(arg);
  }

  @Override
  public Node visitShiftExpression(ShiftExpressionContext ctx) {
    Node arg = visit(ctx.expression());
    return ctx.shift.getText().equals("lag") ? Node.lag(arg) : Node.lead(arg);
  }

  @Override
  public Node visitNegExpression(NegExpressionContext ctx) {
    return Node.neg(visit(ctx.expression()));
  }

  @Override
  public Node visitPowerExpression(PowerExpressionContext ctx) {
    return Node.pow(visit(ctx.expression(0)), visit(ctx.expression(1)));
  }

  @Override
  public Node visitProductExpression(ProductExpressionContext ctx) {
    NodeType type = ctx.op.getText().equals("*") ? NodeType.MUL : NodeType.DVD;
    return Node.binary(type, visit(ctx.expression(0)), visit(ctx.expression(1)));
  }

  @Override
  public Node visitSumExpression(SumExpressionContext ctx) {
    NodeType type = ctx.op.getText().equals("+") ? NodeType.ADD : NodeType.SUB;
    return Node.binary(type, visit(ctx.expression(0)), visit(ctx.expression(1)));
  }

  /** Returns the first token of the current node. */
  Token currentToken() {
    return ((ParserRuleContext) currentNode).start;
  }

  /** Returns a {@link ParseError} pointing at the current node. */
  @FormatMethod
  ParseError error(String fmt, Object... fmtArgs) {
    return ParseError.at(currentToken(), fmt, fmtArgs);
  }
}
