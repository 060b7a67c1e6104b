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

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.FormatMethod;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.modelgen.model.Model;
import org.modelgen.model.Node;
import org.modelgen.model.NodeType;

/**
 * The state of one generation pass: the model being generated, the options in effect, the backend
 * doing the work, and the output streams.
 *
 * <p>Every pass has a code stream (whose suffix is chosen by the language) and an info stream
 * ({@code .info}) for diagnostics; backends may open additional auxiliary streams. All streams are
 * opened through an {@link OutputSink} and are closed by {@link #close}, which should be called on
 * every exit path (a Pass is usually created in a try-with-resources statement).
 */
public final class Pass implements AutoCloseable {

  /** The suffix of the diagnostic stream. */
  public static final String INFO_SUFFIX = ".info";

  private final Model model;
  private final Options options;
  private final Backend backend;
  private final OutputSink sink;
  private final Writer code;
  private final Writer info;
  private final Map<String, Writer> aux = new LinkedHashMap<>();
  private boolean closed;

  public Pass(Model model, Options options, Backend backend, OutputSink sink, String codeSuffix) {
    this.model = model;
    this.options = options;
    this.backend = backend;
    this.sink = sink;
    this.code = open(codeSuffix);
    Writer info;
    try {
      info = sink.open(INFO_SUFFIX);
    } catch (IOException e) {
      closeQuietly(code, e);
      throw ioError(INFO_SUFFIX, e);
    }
    this.info = info;
  }

  public Model model() {
    return model;
  }

  public Options options() {
    return options;
  }

  public Backend backend() {
    return backend;
  }

  /** Renders {@code node} using this pass's backend; see {@link Backend#showNode}. */
  public String showNode(
      NodeType parent, @Nullable Node node, List<String> sets, List<String> subs) {
    return backend.showNode(this, parent, node, sets, subs);
  }

  /** Writes {@code s} to the code stream. */
  public void print(String s) {
    write(code, s);
  }

  @FormatMethod
  public void printf(String fmt, Object... args) {
    write(code, String.format(fmt, args));
  }

  /** Writes {@code s} to the info stream. */
  public void info(String s) {
    write(info, s);
  }

  @FormatMethod
  public void infof(String fmt, Object... args) {
    write(info, String.format(fmt, args));
  }

  /** Opens an auxiliary stream; it will be closed along with the others. */
  public void openAux(String suffix) {
    Preconditions.checkState(!closed);
    Preconditions.checkArgument(!aux.containsKey(suffix), "Stream %s already open", suffix);
    aux.put(suffix, open(suffix));
  }

  /** Writes to a previously-opened auxiliary stream. */
  @FormatMethod
  public void auxf(String suffix, String fmt, Object... args) {
    Writer w = aux.get(suffix);
    Preconditions.checkArgument(w != null, "Stream %s was not opened", suffix);
    write(w, String.format(fmt, args));
  }

  /** If debugging is enabled, prints a trace message on System.err. */
  @FormatMethod
  public void debugf(String fmt, Object... args) {
    if (options.isDebug()) {
      System.err.printf(fmt + "\n", args);
    }
  }

  private Writer open(String suffix) {
    try {
      return sink.open(suffix);
    } catch (IOException e) {
      throw ioError(suffix, e);
    }
  }

  private void write(Writer w, String s) {
    Preconditions.checkState(!closed, "Pass is closed");
    try {
      w.write(s);
    } catch (IOException e) {
      throw new CodegenError(CodegenError.Kind.IO, "Write failed: " + e.getMessage(), e);
    }
  }

  private CodegenError ioError(String suffix, IOException e) {
    return new CodegenError(
        CodegenError.Kind.IO,
        String.format("Could not create %s%s: %s", sink, suffix, e.getMessage()),
        e);
  }

  private static void closeQuietly(Writer w, IOException pending) {
    try {
      w.close();
    } catch (IOException e) {
      pending.addSuppressed(e);
    }
  }

  /** Closes all streams; the first failure is reported after every stream has been closed. */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    IOException failure = null;
    for (Writer w : allStreams()) {
      try {
        w.close();
      } catch (IOException e) {
        if (failure == null) {
          failure = e;
        } else {
          failure.addSuppressed(e);
        }
      }
    }
    if (failure != null) {
      throw new CodegenError(
          CodegenError.Kind.IO, "Close failed: " + failure.getMessage(), failure);
    }
  }

  private List<Writer> allStreams() {
    List<Writer> result = new ArrayList<>(aux.values());
    result.add(code);
    result.add(info);
    return result;
  }
}
