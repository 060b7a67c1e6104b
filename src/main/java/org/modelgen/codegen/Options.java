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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.jspecify.annotations.Nullable;

/**
 * The settings for one generation pass.
 *
 * <p>The equation style and summation style have no defaults: each language must choose them in
 * {@link Backend#setup} or {@link Backend#beginFile}, and a pass fails if either is still unset
 * when the declarations start.
 */
public class Options {

  /** How indexed equations, or sums and products, are generated. */
  public enum Style {
    /** Unroll over every element of the index sets. */
    SCALAR,
    /** Emit one functional form and leave iteration to the target. */
    VECTOR
  }

  /** The line length used when none is given. */
  public static final int DEFAULT_LINE_LENGTH = 80;

  private @Nullable Style equationStyle;
  private @Nullable Style sumStyle;
  private boolean normalized;
  private int lineLength = DEFAULT_LINE_LENGTH;
  private boolean lineLengthSet;
  private boolean debug;

  /**
   * Returns Options initialized from the {@code modelgen.lineLength}, {@code modelgen.normalized}
   * and {@code modelgen.debug} system properties (the styles are left unset).
   */
  public static Options fromSystemProperties() {
    Options result = new Options();
    String lineLength = System.getProperty("modelgen.lineLength");
    if (lineLength != null) {
      result.setLineLength(Integer.parseInt(lineLength.trim()));
    }
    result.setNormalized(Boolean.parseBoolean(System.getProperty("modelgen.normalized", "false")));
    result.setDebug(Boolean.parseBoolean(System.getProperty("modelgen.debug", "false")));
    return result;
  }

  @CanIgnoreReturnValue
  public Options setEquationStyle(Style style) {
    this.equationStyle = Preconditions.checkNotNull(style);
    return this;
  }

  @CanIgnoreReturnValue
  public Options setSumStyle(Style style) {
    this.sumStyle = Preconditions.checkNotNull(style);
    return this;
  }

  /** If true, equations are written as {@code lhs - (rhs)} instead of {@code lhs = rhs}. */
  @CanIgnoreReturnValue
  public Options setNormalized(boolean normalized) {
    this.normalized = normalized;
    return this;
  }

  /** Sets the column limit for wrapped output; 0 disables wrapping. */
  @CanIgnoreReturnValue
  public Options setLineLength(int lineLength) {
    Preconditions.checkArgument(lineLength >= 0, "Negative line length: %s", lineLength);
    this.lineLength = lineLength;
    this.lineLengthSet = true;
    return this;
  }

  /** Sets the line length unless {@link #setLineLength} has already been called. */
  @CanIgnoreReturnValue
  public Options setDefaultLineLength(int lineLength) {
    if (!lineLengthSet) {
      setLineLength(lineLength);
    }
    return this;
  }

  /** If true, the progress of each pass is traced on System.err. */
  @CanIgnoreReturnValue
  public Options setDebug(boolean debug) {
    this.debug = debug;
    return this;
  }

  public boolean isEquationStyleSet() {
    return equationStyle != null;
  }

  public boolean isSumStyleSet() {
    return sumStyle != null;
  }

  public boolean isEquationVector() {
    return equationStyle == Style.VECTOR;
  }

  public boolean isEquationScalar() {
    return equationStyle == Style.SCALAR;
  }

  public boolean isSumVector() {
    return sumStyle == Style.VECTOR;
  }

  public boolean isSumScalar() {
    return sumStyle == Style.SCALAR;
  }

  public boolean isNormalized() {
    return normalized;
  }

  public int lineLength() {
    return lineLength;
  }

  public boolean isDebug() {
    return debug;
  }

  @Override
  public String toString() {
    return String.format(
        "eqn=%s sum=%s normalized=%s lineLength=%s",
        equationStyle,
        sumStyle,
        normalized,
        lineLength);
  }
}
