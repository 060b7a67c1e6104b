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

import org.modelgen.codegen.Backend;
import org.modelgen.codegen.Options;

/**
 * A language with every hook left at its default. The equation and summation styles are chosen by
 * the caller.
 */
public class GenericBackend implements Backend {
  private final Options.Style equationStyle;
  private final Options.Style sumStyle;

  public GenericBackend(Options.Style equationStyle, Options.Style sumStyle) {
    this.equationStyle = equationStyle;
    this.sumStyle = sumStyle;
  }

  @Override
  public void setup(Options options) {
    options.setEquationStyle(equationStyle).setSumStyle(sumStyle);
  }
}
