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

import com.google.errorprone.annotations.FormatMethod;

/**
 * All problems detected during code generation throw a CodegenError. None of them are recoverable:
 * the generation pass is abandoned and its output should be discarded.
 */
public class CodegenError extends RuntimeException {

  /** What went wrong, broadly. */
  public enum Kind {
    /** An operator type with no entry in the precedence table; the tree is corrupt. */
    INVARIANT,
    /** A required generation option was never set. */
    CONFIGURATION,
    /** Generated equation or variable counts don't reconcile. */
    COUNT_MISMATCH,
    /** A dependent vector role was processed before its driver. */
    ORDERING,
    /** A variable was used in a context its type doesn't allow. */
    CONTEXT,
    /** A line is too long and has nowhere to break. */
    UNWRAPPABLE_LINE,
    /** The model is unsuitable for the selected language (missing type tags, etc.). */
    SEMANTIC,
    /** Writing the output failed. */
    IO
  }

  public final Kind kind;
  public final String msg;

  public CodegenError(Kind kind, String msg) {
    super(msg);
    this.kind = kind;
    this.msg = msg;
  }

  public CodegenError(Kind kind, String msg, Throwable cause) {
    super(msg, cause);
    this.kind = kind;
    this.msg = msg;
  }

  @Override
  public String getMessage() {
    return String.format("%s: %s", kind, msg);
  }

  /** Returns a new CodegenError of the given kind. */
  @FormatMethod
  public static CodegenError of(Kind kind, String fmt, Object... fmtArgs) {
    return new CodegenError(kind, String.format(fmt, fmtArgs));
  }

  /** Returns a new INVARIANT CodegenError. */
  @FormatMethod
  public static CodegenError invariant(String fmt, Object... fmtArgs) {
    return of(Kind.INVARIANT, fmt, fmtArgs);
  }

  /** Returns a new SEMANTIC CodegenError. */
  @FormatMethod
  public static CodegenError semantic(String fmt, Object... fmtArgs) {
    return of(Kind.SEMANTIC, fmt, fmtArgs);
  }

  /** Returns a new "Could not wrap long line" CodegenError. */
  static CodegenError unwrappable(String line) {
    return of(Kind.UNWRAPPABLE_LINE, "Could not wrap long line:\n%s", line);
  }
}
