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

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.stream.Collectors;
import org.modelgen.codegen.CodegenError;
import org.modelgen.codegen.Generator;
import org.modelgen.codegen.Options;
import org.modelgen.codegen.OutputSink;
import org.modelgen.lang.Language;
import org.modelgen.model.Model;
import org.modelgen.parser.ModelReader;
import org.modelgen.parser.ParseError;

/**
 * A command-line tool that reads a model file and generates it in one language.
 *
 * <p>The line length, normalized mode and debug tracing can be set with the {@code
 * modelgen.lineLength}, {@code modelgen.normalized} and {@code modelgen.debug} system properties.
 */
public class Generate {
  private Generate() {}

  private static void checkUsage(boolean condition) {
    if (!condition) {
      String languages =
          Arrays.stream(Language.values()).map(l -> l.id).collect(Collectors.joining("|"));
      System.err.printf("Use: generate <%s> <modelFile> [<outputBase>]\n", languages);
      System.exit(1);
    }
  }

  /** Returns {@code file} with any extension removed from its last component. */
  static Path defaultBase(Path file) {
    String name = file.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return (dot > 0) ? file.resolveSibling(name.substring(0, dot)) : file;
  }

  /**
   * Reads the model in {@code modelFile} and generates it in {@code language}, writing files whose
   * names start with {@code base}.
   */
  static void generate(Language language, Path modelFile, Path base, Options options)
      throws IOException {
    Model model = ModelReader.read(modelFile);
    String baseName = base.getFileName().toString();
    Generator.run(
        model,
        language.newBackend(),
        options,
        OutputSink.toFiles(base),
        baseName,
        language.codeSuffix);
  }

  public static void main(String[] args) throws IOException {
    checkUsage(args.length == 2 || args.length == 3);
    Language language = Language.forId(args[0]);
    checkUsage(language != null);
    Path modelFile = Path.of(args[1]);
    Path base = (args.length == 3) ? Path.of(args[2]) : defaultBase(modelFile);
    try {
      generate(language, modelFile, base, Options.fromSystemProperties());
    } catch (NoSuchFileException e) {
      System.err.printf("Can't read %s\n", e.getFile());
      System.exit(1);
    } catch (ParseError e) {
      System.err.printf("%s: %s\n", modelFile, e.getMessage());
      System.exit(1);
    } catch (CodegenError e) {
      System.err.printf("Generating %s failed: %s\n", language.id, e.getMessage());
      System.exit(1);
    }
  }
}
