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

package org.modelgen.lang;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.modelgen.codegen.Backend;
import org.modelgen.codegen.CodegenError;
import org.modelgen.codegen.Options;
import org.modelgen.codegen.Pass;
import org.modelgen.codegen.Printer;
import org.modelgen.codegen.RenderStyle;
import org.modelgen.codegen.SymbolContext;
import org.modelgen.model.Equation;
import org.modelgen.model.Model;
import org.modelgen.model.Node;
import org.modelgen.model.NodeType;
import org.modelgen.model.Symbol;
import org.modelgen.model.SymbolKind;

/**
 * Generates an HTML page documenting the model: tables of sets, variables and parameters followed
 * by each equation in vector form, typeset with MathJax. Every symbol has an anchor, and
 * references to it link there.
 *
 * <p>Unlike the other languages, equations that refer to undeclared symbols are still shown.
 */
public class HtmlBackend implements Backend {

  private static final Printer PRINTER = new Printer("{(", ")}", "{(", ")}");

  private static final RenderStyle STYLE =
      new RenderStyle(
          "{(",
          ")}",
          "{\\left(",
          "\\right)}",
          "{\\left(",
          "\\right)}",
          "^",
          " \n        ",
          " - \\left(",
          "\\right)");

  private static final String CSS =
      "a:link { color:blue; } "
          + "body { margin-left:2em; margin-top:2em; margin-right:2em; } "
          + "td { padding-left: 1em; padding-right: 1em; } "
          + "th { text-align: left; padding-left: 1em; padding-right: 1em; } "
          + "div.heading { margin-top: 2em; font-weight: bold; font-size: 120%; } "
          + "div.dblock { margin-top: 0em; margin-left: 0em; margin-right: 0em; } "
          + "div.eblock { margin-top: 1em; overflow-x: scroll;  } "
          + "div.eqn { margin-top: 1em; margin-left: 2em;} ";

  private static final String NBSP = "&nbsp;";

  /** The index name and time flag of each declared set. */
  private final Map<String, IndexedSet> indexedSets = new LinkedHashMap<>();

  private int nextBlock = 1;
  private boolean declsWritten;

  private static class IndexedSet {
    String index;
    final boolean isTime;

    IndexedSet(String index, boolean isTime) {
      this.index = index;
      this.isTime = isTime;
    }
  }

  @Override
  public void setup(Options options) {
    options.setEquationStyle(Options.Style.VECTOR).setSumStyle(Options.Style.VECTOR);
  }

  @Override
  public boolean skip(Equation eq) {
    return false;
  }

  @Override
  public RenderStyle style() {
    return STYLE;
  }

  @Override
  public String spprint(NodeType parent, @Nullable Node node, @Nullable String indent) {
    return PRINTER.render(parent, node, indent);
  }

  @Override
  public void beginFile(Pass pass, String baseName) {
    pass.print("<html>\n<head>\n");
    pass.printf("<title>%s</title>\n", baseName);
    pass.printf("<style type='text/css'>\n%s</style>\n", CSS);
    pass.print(
        "<script>MathJax = { jax: ['input/tex', 'output/svg'], tex: { tags: 'ams', packages:"
            + " {'[+]': ['textmacros']} }, svg: { displayAlign: 'left' }, loader: {load:"
            + " ['[tex]/textmacros']} };</script>");
    pass.print(
        "<script type='text/javascript' id='MathJax-script' async"
            + " src='https://cdn.jsdelivr.net/npm/mathjax@3/es5/tex-svg.js'></script>\n");
    pass.print("</head>\n<body>\n");
    pass.printf("<h1>%s</h1>\n", baseName);
  }

  @Override
  public void endFile(Pass pass) {
    if (!declsWritten) {
      writeDecls(pass);
    }
    pass.print("</div>\n</body>\n</html>\n");
  }

  @Override
  public void declare(Pass pass, Symbol symbol) {
    if (symbol.is(SymbolKind.SET)) {
      boolean isTime = symbol.name.equals("time") || pass.model().isSubset(symbol.name, "time");
      indexedSets.put(symbol.name, new IndexedSet(symbol.name.substring(0, 1), isTime));
    }
  }

  private static String escape(String name) {
    return name.replace("_", "\\_");
  }

  private static String anchor(String target) {
    return "<a href='#" + target + "'>" + target + "</a>";
  }

  /** Returns the items as comma-separated links, or {@code ifEmpty}. */
  private static String links(List<String> targets, String ifEmpty) {
    if (targets.isEmpty()) {
      return ifEmpty;
    }
    return targets.stream().map(HtmlBackend::anchor).collect(Collectors.joining(", "));
  }

  /** Returns links to the equations that refer to {@code name} on the given side. */
  private static String equationLinks(Model model, String name, boolean lhs) {
    List<String> numbers =
        model.equationsReferencing(name, lhs).stream()
            .map(eq -> Integer.toString(eq.number))
            .collect(Collectors.toList());
    return links(numbers, "none");
  }

  private String htmlVar(Pass pass, String name, List<String> subs, int dt) {
    if (subs.isEmpty()) {
      return "\\href{#" + name + "}{" + escape(name) + "}";
    }
    StringBuilder indexes = new StringBuilder();
    for (String s : subs) {
      if (indexes.length() != 0) {
        indexes.append(',');
      }
      IndexedSet is = pass.model().isSet(s) ? indexedSets.get(s) : null;
      if (is == null) {
        indexes.append("\\text{").append(s).append('}');
      } else if (is.isTime && dt != 0) {
        indexes.append(String.format("%s%+d", is.index, dt));
      } else {
        indexes.append(is.index);
      }
    }
    return "\\href{#" + name + "}{" + escape(name) + "(" + indexes + ")}";
  }

  private String qualifier(Pass pass, List<String> sets) {
    StringBuilder sb = new StringBuilder();
    for (String s : sets) {
      IndexedSet is = indexedSets.get(s);
      if (is == null) {
        continue;
      }
      if (sb.length() != 0) {
        sb.append(", ");
      }
      sb.append("<i>").append(is.index).append("</i> in <b>").append(anchor(s)).append("</b>");
    }
    return sb.toString();
  }

  private void writeDecls(Pass pass) {
    declsWritten = true;
    Model model = pass.model();
    Set<String> sofar = new HashSet<>();
    for (IndexedSet is : indexedSets.values()) {
      char first = is.index.charAt(0);
      for (int n = 1; model.lookup(is.index) != null || sofar.contains(is.index); n++) {
        is.index = first + Integer.toString(n);
      }
      sofar.add(is.index);
    }

    pass.print("<div class=\"heading\">Sets:</div>\n");
    tableStart(pass, model.symbols(SymbolKind.SET), "Name<th>Elements<th>Description");
    for (Symbol s : model.symbols(SymbolKind.SET)) {
      String elements = s.elements.isEmpty() ? NBSP : String.join(", ", s.elements);
      pass.printf(
          "<tr><td><a id='%s'><b>%s</b></a><td>%s<td>%s</tr>\n",
          s.name, s.name, elements, description(s));
    }
    pass.print("</table>\n</div>\n");

    pass.print("<div class=\"heading\">Variables:</div>\n");
    tableStart(
        pass,
        model.symbols(SymbolKind.VARIABLE),
        "Name<th>Domain<th>Description<th>Attributes<th>LHS<th>RHS");
    for (Symbol s : model.symbols(SymbolKind.VARIABLE)) {
      pass.printf(
          "<tr><td><a id='%s'><b>%s</b></a><td>%s<td>%s<td>%s<td>%s<td>%s</tr>\n",
          s.name,
          s.name,
          links(s.domain, NBSP),
          description(s),
          String.join(",", s.attributes),
          equationLinks(model, s.name, true),
          equationLinks(model, s.name, false));
    }
    pass.print("</table>\n</div>\n");

    pass.print("<div class=\"heading\">Parameters:</div>\n");
    tableStart(pass, model.symbols(SymbolKind.PARAMETER), "Name<th>Domain<th>Description");
    for (Symbol s : model.symbols(SymbolKind.PARAMETER)) {
      pass.printf(
          "<tr><td><a id='%s'><b>%s</b></a><td><b>%s</b><td>%s</tr>\n",
          s.name, s.name, links(s.domain, NBSP), description(s));
    }
    pass.print("</table>\n</div>\n");

    pass.print("<div class=\"heading\">Equations:</div>\n");
    pass.print("<div class=\"dblock\">\n");
  }

  private static void tableStart(Pass pass, List<Symbol> symbols, String headings) {
    // An empty table gets only its closing tags.
    if (!symbols.isEmpty()) {
      pass.print("<div class=\"dblock\">\n");
      pass.print("<table class=\"dec\" border=1 cellspacing=0>\n");
      pass.printf("<tr><th>%s</tr>\n", headings);
    }
  }

  private static String description(Symbol s) {
    return s.description.isEmpty() ? NBSP : s.description;
  }

  @Override
  public void beginBlock(Pass pass, Equation eq) {
    if (!declsWritten) {
      writeDecls(pass);
    }
    int block = nextBlock++;
    String lhsName = eq.lhsName();
    if (lhsName == null) {
      lhsName = "Not a variable";
    }
    pass.printf("<a id='%d'/>", block);
    if (eq.label != null) {
      pass.printf(
          "Equation %d: <a href='#%s'>%s</a>: %s<br>\n", eq.number, lhsName, lhsName, eq.label);
    } else {
      pass.printf("Equation %d: <a href='#%s'>%s</a><br>\n", eq.number, lhsName, lhsName);
    }
    switch (eq.scalarCount) {
      case 0 -> pass.print("Contains undeclared symbols<br>\n");
      case 1 -> {}
      default ->
          pass.printf("For %s (%d total):<br>\n", qualifier(pass, eq.sets), eq.scalarCount);
    }
    pass.print("<div class=\"eblock\">\n<div class=\"eqn\"> \\[ ");
  }

  @Override
  public void endEqn(Pass pass, Equation eq) {
    pass.print(" \\]\n</div>\n</div>\n");
  }

  @Override
  public String beginFunc(Pass pass, String func, @Nullable String arg) {
    if (func.equals("sum") || func.equals("prod")) {
      IndexedSet is = (arg == null) ? null : indexedSets.get(arg);
      if (is == null) {
        throw CodegenError.invariant("%s over undeclared set %s", func, arg);
      }
      return String.format(
          "\\%s_{%s \\; \\text{in} \\; \\href{#%s}{%s}} { \\left(",
          func, is.index, arg, escape(arg));
    } else if (arg != null) {
      throw CodegenError.invariant("Unexpected function call %s(%s,...)", func, arg);
    }
    return func.equals("log") ? "ln{ \\left(" : func + "{ \\left(";
  }

  @Override
  public String endFunc(Pass pass) {
    return "\\right) }";
  }

  @Override
  public String showSymbol(Pass pass, String name, List<String> subs, SymbolContext context) {
    String result = htmlVar(pass, name, subs, context.dt());
    for (int dt = context.dt(); dt < 0; dt++) {
      result = "lag({" + result + "})";
    }
    for (int dt = context.dt(); dt > 0; dt--) {
      result = "lead({" + result + "})";
    }
    return result;
  }

  /** Divisions are typeset as fractions; everything else is rendered normally. */
  @Override
  public String showNode(
      Pass pass, NodeType parent, @Nullable Node node, List<String> sets, List<String> subs) {
    if (node != null && node.type == NodeType.DVD) {
      String num = pass.showNode(NodeType.DVD, node.left, sets, subs);
      String den = pass.showNode(NodeType.DVD, node.right, sets, subs);
      return "\\frac{" + num + "}{" + den + "}";
    }
    return Backend.super.showNode(pass, parent, node, sets, subs);
  }
}
