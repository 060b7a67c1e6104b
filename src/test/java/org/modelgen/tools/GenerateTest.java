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

package org.modelgen.tools;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.modelgen.codegen.CodegenError;
import org.modelgen.codegen.Options;
import org.modelgen.lang.Language;
import org.modelgen.lang.PythonBackend;

@RunWith(JUnit4.class)
public class GenerateTest {

  @Rule public final TemporaryFolder tmp = new TemporaryFolder();

  private static final String MODEL =
      "set r = { a, b } ;\n"
          + "parameter p(r) ;\n"
          + "variable x(r) [end] ;\n"
          + "x(r) = 2 * p(r) ;\n";

  private Path writeModel() throws IOException {
    Path file = tmp.getRoot().toPath().resolve("small.mdl");
    Files.writeString(file, MODEL, UTF_8);
    return file;
  }

  @Test
  public void defaultBase() {
    assertThat(Generate.defaultBase(Path.of("dir", "model.mdl")))
        .isEqualTo(Path.of("dir", "model"));
    assertThat(Generate.defaultBase(Path.of("model.v2.mdl"))).isEqualTo(Path.of("model.v2"));
    assertThat(Generate.defaultBase(Path.of("model"))).isEqualTo(Path.of("model"));
    assertThat(Generate.defaultBase(Path.of(".model"))).isEqualTo(Path.of(".model"));
  }

  @Test
  public void generateDefault() throws IOException {
    Path model = writeModel();
    Path base = Generate.defaultBase(model);
    Generate.generate(Language.DEFAULT, model, base, new Options());
    Path code = tmp.getRoot().toPath().resolve("small.txt");
    assertThat(Files.readString(code, UTF_8)).isEqualTo("x(a) = 2*p(a) ;\n\nx(b) = 2*p(b) ;\n\n");
    assertThat(Files.exists(tmp.getRoot().toPath().resolve("small.info"))).isTrue();
  }

  @Test
  public void generatePythonWritesAuxiliaryFiles() throws IOException {
    Path model = writeModel();
    Path base = tmp.getRoot().toPath().resolve("out");
    Generate.generate(Language.PYTHON, model, base, new Options());
    Path dir = tmp.getRoot().toPath();
    assertThat(Files.readString(dir.resolve("out.py"), UTF_8)).contains("    z1l[1] = 2*par[1]");
    assertThat(Files.readString(dir.resolve("out" + PythonBackend.VARINFO_SUFFIX), UTF_8))
        .isEqualTo("\"p(r)\",2,par,\"\",\"\"\n\"x(r)\",2,end,\"\",\"end\"\n");
    assertThat(Files.exists(dir.resolve("out" + PythonBackend.VARMAP_SUFFIX))).isTrue();
  }

  @Test
  public void missingModelFile() {
    Path missing = tmp.getRoot().toPath().resolve("missing.mdl");
    assertThrows(
        NoSuchFileException.class,
        () -> Generate.generate(Language.DEFAULT, missing, missing, new Options()));
  }

  @Test
  public void generationErrorsPropagate() throws IOException {
    Path file = tmp.getRoot().toPath().resolve("untyped.mdl");
    Files.writeString(file, "variable v ;\nv = 1 ;\n", UTF_8);
    CodegenError e =
        assertThrows(
            CodegenError.class,
            () -> Generate.generate(Language.PYTHON, file, file, new Options()));
    assertThat(e.kind).isEqualTo(CodegenError.Kind.SEMANTIC);
  }
}
