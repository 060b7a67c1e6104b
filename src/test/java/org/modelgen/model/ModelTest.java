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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.stream.IntStream;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.modelgen.codegen.CodegenError;

@RunWith(JUnit4.class)
public class ModelTest {

  private static Model.Builder regions() {
    return new Model.Builder()
        .addSet("world", ImmutableList.of("usa", "jpn", "chn", "eur"), "")
        .addSet("regions", ImmutableList.of("usa", "jpn", "chn"), "", ImmutableList.of("world"))
        .addSet("asia", ImmutableList.of("jpn", "chn"), "Asia", ImmutableList.of("regions"))
        .addSet("goods", ImmutableList.of("ag", "man"), "");
  }

  @Test
  public void sizes() {
    Model model =
        regions()
            .addVariable("trade", ImmutableList.of("regions", "goods"), ImmutableList.of(), "")
            .addVariable("total", ImmutableList.of(), ImmutableList.of(), "")
            .build();
    assertThat(model.size(ImmutableList.of())).isEqualTo(1);
    assertThat(model.size(ImmutableList.of("asia", "goods"))).isEqualTo(4);
    assertThat(model.lookup("trade").size).isEqualTo(6);
    assertThat(model.lookup("total").size).isEqualTo(1);
    assertThat(model.lookup("goods").size).isEqualTo(2);
    assertThat(model.indexOf("regions", "chn")).isEqualTo(2);
    assertThat(model.indexOf("regions", "eur")).isEqualTo(-1);
  }

  private static Model.Builder fourLargeSets() {
    ImmutableList<String> elements =
        IntStream.range(0, 1000).mapToObj(i -> "e" + i).collect(ImmutableList.toImmutableList());
    return new Model.Builder()
        .addSet("a", elements, "")
        .addSet("b", elements, "")
        .addSet("c", elements, "")
        .addSet("d", elements, "");
  }

  @Test
  public void oversizedProductIsAnError() {
    Model model = fourLargeSets().build();
    assertThat(model.size(ImmutableList.of("a", "b", "c"))).isEqualTo(1_000_000_000);
    CodegenError e =
        assertThrows(CodegenError.class, () -> model.size(ImmutableList.of("a", "b", "c", "d")));
    assertThat(e.kind).isEqualTo(CodegenError.Kind.SEMANTIC);
    assertThat(e.msg).isEqualTo("Domain too large: (a,b,c,d)");
  }

  @Test
  public void oversizedSymbolIsAnError() {
    Model.Builder builder =
        fourLargeSets()
            .addVariable("x", ImmutableList.of("a", "b", "c", "d"), ImmutableList.of(), "");
    CodegenError e = assertThrows(CodegenError.class, builder::build);
    assertThat(e.msg).isEqualTo("Domain too large: (a,b,c,d)");
  }

  @Test
  public void subsets() {
    Model model = regions().build();
    assertThat(model.immediateSupersets("asia")).containsExactly("regions");
    assertThat(model.isSubset("asia", "world")).isTrue();
    assertThat(model.isSubset("world", "asia")).isFalse();
    assertThat(model.isSubset("goods", "world")).isFalse();
  }

  @Test
  public void elements() {
    Model model =
        regions()
            .addParameter("jpn", ImmutableList.of(), ImmutableList.of(), "Shadows an element")
            .build();
    assertThat(model.isElement("usa")).isTrue();
    assertThat(model.isElement("regions")).isFalse();
    assertThat(model.isElement("jpn")).isFalse();
    assertThat(model.isSet("asia")).isTrue();
    assertThat(model.isSet("jpn")).isFalse();
    assertThat(model.symbols(SymbolKind.SET)).hasSize(4);
    assertThat(model.symbols(SymbolKind.PARAMETER)).hasSize(1);
  }

  @Test
  public void equations() {
    Model model =
        regions()
            .addVariable("x", ImmutableList.of("regions"), ImmutableList.of(), "")
            .addVariable("y", ImmutableList.of("regions"), ImmutableList.of(), "")
            .addVariable("z", ImmutableList.of(), ImmutableList.of(), "")
            .addEquation(Node.ref("x", "regions"), Node.ref("y", "regions"), "regions")
            .addEquation(Node.name("z"), Node.sum("asia", Node.ref("x", "asia")))
            .addEquation(
                "undeclared",
                Node.ref("y", "regions"),
                Node.name("w"),
                ImmutableList.of("regions"),
                true,
                true)
            .build();
    assertThat(model.equations()).hasSize(3);
    assertThat(model.equations().get(0).scalarCount).isEqualTo(3);
    assertThat(model.equations().get(1).scalarCount).isEqualTo(1);
    assertThat(model.equations().get(2).scalarCount).isEqualTo(0);
    assertThat(model.equations().get(2).number).isEqualTo(3);

    assertThat(model.equationsReferencing("x", true)).containsExactly(model.equations().get(0));
    assertThat(model.equationsReferencing("x", false)).containsExactly(model.equations().get(1));
    assertThat(model.equationsReferencing("y", true)).containsExactly(model.equations().get(2));
    // The bound set of a sum is not a reference.
    assertThat(model.equationsReferencing("asia", false)).isEmpty();

    assertThat(model.lookup("x").used).isTrue();
    assertThat(model.lookup("z").used).isTrue();
    assertThat(model.lookup("asia").used).isFalse();
  }

  @Test
  public void duplicateDeclaration() {
    Model.Builder builder = regions();
    assertThrows(
        IllegalArgumentException.class,
        () -> builder.addVariable("goods", ImmutableList.of(), ImmutableList.of(), ""));
  }

  @Test
  public void undeclaredDomain() {
    Model.Builder builder =
        regions().addVariable("x", ImmutableList.of("nowhere"), ImmutableList.of(), "");
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class, builder::build);
    assertThat(e).hasMessageThat().isEqualTo("x is declared over undeclared set nowhere");
  }
}
