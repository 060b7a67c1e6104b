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
import com.google.common.collect.ImmutableSet;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Supplies the output streams of a generation pass. Each stream is identified by a suffix (such as
 * {@code ".py"}, {@code ".info"} or {@code "_varmap.csv"}) that is appended to the pass's base
 * name.
 */
public abstract class OutputSink {

  /** Opens a new stream for the given suffix; the caller is responsible for closing it. */
  public abstract Writer open(String suffix) throws IOException;

  /** Returns a sink that writes {@code <base><suffix>} files. */
  public static OutputSink toFiles(Path base) {
    return new ToFiles(base);
  }

  /** Returns a sink that keeps each stream in memory. */
  public static InMemory inMemory() {
    return new InMemory();
  }

  private static class ToFiles extends OutputSink {
    final Path base;

    ToFiles(Path base) {
      this.base = base;
    }

    @Override
    public Writer open(String suffix) throws IOException {
      Path path = base.resolveSibling(base.getFileName() + suffix);
      return Files.newBufferedWriter(path, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
      return base.toString();
    }
  }

  /** An OutputSink whose streams can be read back after the pass. */
  public static class InMemory extends OutputSink {
    private final Map<String, StringWriter> streams = new LinkedHashMap<>();

    @Override
    public Writer open(String suffix) {
      StringWriter result = new StringWriter();
      Preconditions.checkState(
          streams.putIfAbsent(suffix, result) == null, "Stream %s opened twice", suffix);
      return result;
    }

    /** Returns the suffixes of all streams opened so far, in order. */
    public ImmutableSet<String> suffixes() {
      return ImmutableSet.copyOf(streams.keySet());
    }

    /** Returns everything written to the stream with the given suffix. */
    public String contents(String suffix) {
      StringWriter stream = streams.get(suffix);
      Preconditions.checkArgument(stream != null, "No stream %s", suffix);
      return stream.toString();
    }
  }
}
