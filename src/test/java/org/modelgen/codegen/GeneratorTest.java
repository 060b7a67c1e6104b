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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.modelgen.model.Equation;
import org.modelgen.model.Model;
import org.modelgen.model.Node;
import org.modelgen.model.Symbol;

/** Runs complete generation passes with backends that keep the default hooks. */
@RunWith(JUnit4.class)
public class GeneratorTest {

  private static final ImmutableList<String> REGIONS = ImmutableList.of("regions");

  /** A backend with the default hooks and the given styles. */
  private static class Defaults implements Backend {
    final Options.Style equationStyle;
    final Options.Style sumStyle;

    Defaults(Options.Style equationStyle, Options.Style sumStyle) {
      this.equationStyle = equationStyle;
      this.sumStyle = sumStyle;
    }

    @Override
    public void setup(Options options) {
      options.setEquationStyle(equationStyle).setSumStyle(sumStyle);
    }
  }

  private static final Backend SCALAR = new Defaults(Options.Style.SCALAR, Options.Style.SCALAR);
  private static final Backend VECTOR = new Defaults(Options.Style.VECTOR, Options.Style.VECTOR);

  /** Returns a builder declaring {@code regions = {usa, jpn}}, parameters a, b and variable y. */
  private static Model.Builder twoRegions() {
    return new Model.Builder()
        .addSet("regions", ImmutableList.of("usa", "jpn"), "Regions")
        .addParameter("a", REGIONS, ImmutableList.of(), "")
        .addParameter("b", REGIONS, ImmutableList.of(), "")
        .addVariable("y", REGIONS, ImmutableList.of(), "")
        .addVariable("total", ImmutableList.of(), ImmutableList.of(), "");
  }

  /** {@code y(regions) = a(regions) + b(regions)} */
  private static Model additive() {
    return twoRegions()
        .addEquation(
            Node.ref("y", "regions"),
            Node.add(Node.ref("a", "regions"), Node.ref("b", "regions")),
            "regions")
        .build();
  }

  private static String generate(Model model, Backend backend, Options options) {
    OutputSink.InMemory sink = OutputSink.inMemory();
    Generator.run(model, backend, options, sink, "test", ".txt");
    return sink.contents(".txt");
  }

  private static String generate(Model model, Backend backend) {
    return generate(model, backend, new Options());
  }

  @Test
  public void scalarEquationsAreExpandedOverTheirSets() {
    assertThat(generate(additive(), SCALAR))
        .isEqualTo("y(usa) = a(usa)+b(usa) ;\n\ny(jpn) = a(jpn)+b(jpn) ;\n\n");
  }

  @Test
  public void vectorEquationsAreWrittenOnce() {
    assertThat(generate(additive(), VECTOR))
        .isEqualTo("y(regions) = a(regions)+b(regions) ;\n\n");
  }

  @Test
  public void normalized() {
    assertThat(generate(additive(), SCALAR, new Options().setNormalized(true)))
        .startsWith("y(usa) - (a(usa)+b(usa)) ;\n\n");
  }

  @Test
  public void streams() {
    OutputSink.InMemory sink = OutputSink.inMemory();
    Generator.run(additive(), SCALAR, new Options(), sink, "test", ".txt");
    assertThat(sink.suffixes()).containsExactly(".txt", Pass.INFO_SUFFIX);
    assertThat(sink.contents(Pass.INFO_SUFFIX)).isEmpty();
  }

  @Test
  public void scalarSumIsUnrolled() {
    Model model =
        twoRegions()
            .addEquation(Node.name("total"), Node.sum("regions", Node.ref("y", "regions")))
            .build();
    assertThat(generate(model, SCALAR))
        .isEqualTo("total = (\n       y(usa)\n      +y(jpn)) ;\n\n");
  }

  @Test
  public void scalarProductTermsAreBracketed() {
    Model model =
        twoRegions()
            .addEquation(Node.name("total"), Node.prod("regions", Node.ref("y", "regions")))
            .build();
    assertThat(generate(model, SCALAR))
        .isEqualTo("total = (\n       (y(usa))\n      *(y(jpn))) ;\n\n");
  }

  @Test
  public void vectorSumIsAFunction() {
    Model model =
        twoRegions()
            .addEquation(Node.name("total"), Node.sum("regions", Node.ref("y", "regions")))
            .build();
    assertThat(generate(model, VECTOR)).isEqualTo("total = sum(regions,y(regions)) ;\n\n");
  }

  @Test
  public void sumInsideIndexedEquation() {
    // y(r) = a(r) * sum(regions, b(regions)) with the equation's own set left bound
    Model model =
        twoRegions()
            .addEquation(
                Node.ref("y", "regions"),
                Node.mul(Node.ref("a", "regions"), Node.sum("regions", Node.ref("b", "regions"))),
                "regions")
            .build();
    assertThat(generate(model, SCALAR))
        .startsWith("y(usa) = a(usa)*(\n       b(usa)\n      +b(jpn)) ;\n\n");
  }

  @Test
  public void timeShiftsAreRenderedBySymbol() {
    Model model =
        twoRegions()
            .addEquation(
                Node.ref("y", "regions"),
                Node.add(
                    Node.lag(Node.ref("y", "regions")), Node.lead(Node.lead(Node.name("total")))),
                "regions")
            .build();
    assertThat(generate(model, SCALAR)).startsWith("y(usa) = lag(y(usa))+lead(lead(total)) ;");
  }

  @Test
  public void longStatementsAreWrapped() {
    assertThat(generate(additive(), SCALAR, new Options().setLineLength(20)))
        .startsWith("y(usa) = a(usa)\n   +b(usa) ;\n\n");
  }

  @Test
  public void unwrappableStatement() {
    CodegenError e =
        assertThrows(
            CodegenError.class, () -> generate(additive(), SCALAR, new Options().setLineLength(5)));
    assertThat(e.kind).isEqualTo(CodegenError.Kind.UNWRAPPABLE_LINE);
  }

  @Test
  public void equationsWithUndeclaredSymbolsAreSkipped() {
    Model model =
        twoRegions()
            .addEquation(
                null,
                Node.ref("y", "regions"),
                Node.ref("z", "regions"),
                REGIONS,
                /* hasUndeclared= */ true,
                /* timeOk= */ true)
            .addEquation(Node.name("total"), Node.number("1"))
            .build();
    assertThat(generate(model, SCALAR)).isEqualTo("total = 1 ;\n\n");
  }

  @Test
  public void stylesMustBeSet() {
    Backend unconfigured = new Backend() {};
    CodegenError e = assertThrows(CodegenError.class, () -> generate(additive(), unconfigured));
    assertThat(e.kind).isEqualTo(CodegenError.Kind.CONFIGURATION);
    assertThat(e.msg).isEqualTo("Equation style has not been set");

    Backend halfConfigured =
        new Backend() {
          @Override
          public void setup(Options options) {
            options.setEquationStyle(Options.Style.SCALAR);
          }
        };
    e = assertThrows(CodegenError.class, () -> generate(additive(), halfConfigured));
    assertThat(e.msg).isEqualTo("Summation style has not been set");
  }

  @Test
  public void scalarCountMustMatch() {
    // An equation with undeclared symbols expects no scalar equations; writing it anyway fails.
    Model model =
        twoRegions()
            .addEquation(
                null,
                Node.ref("y", "regions"),
                Node.ref("z", "regions"),
                REGIONS,
                /* hasUndeclared= */ true,
                /* timeOk= */ true)
            .build();
    Backend noSkip =
        new Defaults(Options.Style.SCALAR, Options.Style.SCALAR) {
          @Override
          public boolean skip(Equation eq) {
            return false;
          }
        };
    CodegenError e = assertThrows(CodegenError.class, () -> generate(model, noSkip));
    assertThat(e.kind).isEqualTo(CodegenError.Kind.COUNT_MISMATCH);
    assertThat(e.msg)
        .isEqualTo(
            "Incorrect number of equations written for equation 1 (expected 0, wrote 2)");
  }

  @Test
  public void hooksAreCalledInOrder() {
    List<String> calls = new ArrayList<>();
    Backend recorder =
        new Defaults(Options.Style.SCALAR, Options.Style.SCALAR) {
          @Override
          public void beginFile(Pass pass, String baseName) {
            calls.add("beginFile " + baseName);
          }

          @Override
          public void declare(Pass pass, Symbol symbol) {
            calls.add("declare " + symbol.name);
          }

          @Override
          public void beginBlock(Pass pass, Equation eq) {
            calls.add("beginBlock " + eq.number);
          }

          @Override
          public void beginEqn(Pass pass, Equation eq) {
            calls.add("beginEqn");
          }

          @Override
          public void endBlock(Pass pass, Equation eq) {
            calls.add("endBlock " + eq.number);
          }

          @Override
          public void endFile(Pass pass) {
            calls.add("endFile");
          }
        };
    generate(additive(), recorder);
    assertThat(calls)
        .containsExactly(
            "beginFile test",
            "declare regions",
            "declare a",
            "declare b",
            "declare y",
            "declare total",
            "beginBlock 1",
            "beginEqn",
            "beginEqn",
            "endBlock 1",
            "endFile")
        .inOrder();
  }
}
