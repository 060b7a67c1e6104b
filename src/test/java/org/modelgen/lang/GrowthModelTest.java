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

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.io.Resources;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.io.IOException;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.modelgen.codegen.OutputSink;
import org.modelgen.codegen.Pass;

/** Generates a small but complete model in every language. */
@RunWith(TestParameterInjector.class)
public class GrowthModelTest {

  private static String source() throws IOException {
    return Resources.toString(Resources.getResource(GrowthModelTest.class, "growth.mdl"), UTF_8);
  }

  @Test
  public void generates(@TestParameter Language language) throws IOException {
    OutputSink.InMemory sink = LanguageRunner.run(language, source());
    assertThat(sink.suffixes()).containsAtLeast(language.codeSuffix, Pass.INFO_SUFFIX);
    assertThat(sink.contents(language.codeSuffix)).isNotEmpty();
  }

  @Test
  public void pythonModelIsSquare() throws IOException {
    String info = LanguageRunner.run(Language.PYTHON, source()).contents(Pass.INFO_SUFFIX);
    assertThat(info).contains("Equation Count: 8\n");
    assertThat(info).contains("Endogenous Variables, Used:   8\n");
  }

  @Test
  public void tabloNamesEquationsByLabel() throws IOException {
    String code = LanguageRunner.code(Language.TABLO, source());
    assertThat(code).contains("\nequation output (all,r,regions) \n");
    assertThat(code).contains("\nequation accumulation (all,r,regions) \n");
  }

  @Test
  public void htmlShowsEveryEquation() throws IOException {
    String html = LanguageRunner.code(Language.HTML, source());
    for (int i = 1; i <= 4; i++) {
      assertThat(html).contains("<a id='" + i + "'/>Equation " + i + ": ");
    }
  }

  @Test
  public void defaultUnrollsEveryRegion() throws IOException {
    String code = LanguageRunner.code(Language.DEFAULT, source());
    assertThat(code).contains("inv(usa) = gdp(usa)-con(usa) ;\n\n");
    assertThat(code).contains("inv(jpn) = gdp(jpn)-con(jpn) ;\n\n");
  }
}
