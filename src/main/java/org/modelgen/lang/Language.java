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

import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;
import org.modelgen.codegen.Backend;
import org.modelgen.codegen.Options;

/** The languages that can be generated, with the suffix of each one's code stream. */
public enum Language {
  DEFAULT(
      "default", ".txt", () -> new GenericBackend(Options.Style.SCALAR, Options.Style.SCALAR)),
  TABLO("tablo", ".tab", () -> new TabloBackend(false)),
  TABLO_CALC("tablo-calc", ".tab", () -> new TabloBackend(true)),
  HTML("html", ".html", HtmlBackend::new),
  PYTHON("python", ".py", PythonBackend::new);

  /** The name used to select this language on the command line. */
  public final String id;

  public final String codeSuffix;
  private final Supplier<Backend> factory;

  Language(String id, String codeSuffix, Supplier<Backend> factory) {
    this.id = id;
    this.codeSuffix = codeSuffix;
    this.factory = factory;
  }

  /** Returns a new Backend for this language; each generation pass needs its own. */
  public Backend newBackend() {
    return factory.get();
  }

  /** Returns the language with the given id, or null if there is none. */
  public static @Nullable Language forId(String id) {
    for (Language language : values()) {
      if (language.id.equals(id)) {
        return language;
      }
    }
    return null;
  }
}
