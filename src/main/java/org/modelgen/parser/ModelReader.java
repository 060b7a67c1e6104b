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
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.jspecify.annotations.Nullable;
import org.modelgen.model.Model;
import org.modelgen.model.Node;
import org.modelgen.parser.ModelFileParser.DescriptionContext;
import org.modelgen.parser.ModelFileParser.ElementContext;
import org.modelgen.parser.ModelFileParser.EquationContext;
import org.modelgen.parser.ModelFileParser.IdListContext;
import org.modelgen.parser.ModelFileParser.SetDeclContext;
import org.modelgen.parser.ModelFileParser.StatementContext;
import org.modelgen.parser.ModelFileParser.SymbolDeclContext;
import org.modelgen.parser.ModelFileParser.UnitContext;
import org.modelgen.util.StringUtil;

/**
 * Reads a {@link Model} from the textual model format defined by {@code ModelFile.g4}.
 *
 * <p>Names must be declared before they are used as sets or subscripts. An equation that refers to
 * an undeclared parameter or variable is still read, but is marked as having undeclared symbols.
 */
public final class ModelReader {

  // Static methods only
  private ModelReader() {}

  public static Model read(Path file) throws IOException {
    return read(CharStreams.fromPath(file));
  }

  public static Model read(String text) {
    return read(CharStreams.fromString(text));
  }

  public static Model read(CharStream input) {
    Model.Builder builder = new Model.Builder();
    for (StatementContext statement : parse(input).statement()) {
      if (statement.setDecl() != null) {
        addSet(builder, statement.setDecl());
      } else if (statement.symbolDecl() != null) {
        addSymbol(builder, statement.symbolDecl());
      } else {
        addEquation(builder, statement.equation());
      }
    }
    return builder.build();
  }

  /** Parses a model file without interpreting it. */
  static UnitContext parse(CharStream input) {
    // Throw ParseErrors in response to parsing errors.
    BaseErrorListener errorListener =
        new BaseErrorListener() {
          @Override
          public void syntaxError(
              Recognizer<?, ?> recognizer,
              Object offendingSymbol,
              int lineNum,
              int charPositionInLine,
              String msg,
              RecognitionException e) {
            throw new ParseError(msg, lineNum, charPositionInLine);
          }
        };
    ModelFileLexer lexer = new ModelFileLexer(input);
    lexer.removeErrorListeners();
    lexer.addErrorListener(errorListener);
    ModelFileParser parser = new ModelFileParser(new CommonTokenStream(lexer));
    parser.removeErrorListeners();
    parser.addErrorListener(errorListener);
    return parser.unit();
  }

  private static void addSet(Model.Builder builder, SetDeclContext ctx) {
    String name = ctx.name.getText();
    checkNew(builder, ctx.name);
    List<String> supersets = ids(ctx.supersets);
    for (String s : supersets) {
      if (!builder.isSet(s)) {
        throw ParseError.at(ctx.supersets.start, "Undeclared set %s", s);
      }
    }
    ImmutableList.Builder<String> elements = ImmutableList.builder();
    if (ctx.elementList() != null) {
      for (ElementContext element : ctx.elementList().element()) {
        elements.add(
            element.STRING() != null
                ? StringUtil.unescape(element.STRING().getText())
                : element.getText());
      }
    }
    builder.addSet(name, elements.build(), description(ctx.description()), supersets);
  }

  private static void addSymbol(Model.Builder builder, SymbolDeclContext ctx) {
    String name = ctx.name.getText();
    checkNew(builder, ctx.name);
    List<String> domain = ids(ctx.domain);
    for (String s : domain) {
      if (!builder.isSet(s)) {
        throw ParseError.at(ctx.domain.start, "Undeclared set %s", s);
      }
    }
    List<String> attributes = ids(ctx.attributes);
    String description = description(ctx.description());
    if (ctx.kind.getText().equals("parameter")) {
      builder.addParameter(name, domain, attributes, description);
    } else {
      builder.addVariable(name, domain, attributes, description);
    }
  }

  private static void addEquation(Model.Builder builder, EquationContext ctx) {
    ExpressionVisitor visitor = new ExpressionVisitor(builder);
    Node lhs = visitor.visit(ctx.lhs);
    Node rhs = visitor.visit(ctx.rhs);
    String label = (ctx.label == null) ? null : StringUtil.unescape(ctx.label.getText());
    builder.addEquation(label, lhs, rhs, visitor.freeSets(), visitor.hasUndeclared(), true);
  }

  private static void checkNew(Model.Builder builder, Token name) {
    if (builder.isDeclared(name.getText())) {
      throw ParseError.at(name, "Multiple declarations of %s", name.getText());
    }
  }

  private static ImmutableList<String> ids(@Nullable IdListContext ctx) {
    if (ctx == null) {
      return ImmutableList.of();
    }
    return ctx.ID().stream().map(TerminalNode::getText).collect(ImmutableList.toImmutableList());
  }

  private static String description(@Nullable DescriptionContext ctx) {
    return (ctx == null) ? "" : StringUtil.unescape(ctx.STRING().getText());
  }
}
