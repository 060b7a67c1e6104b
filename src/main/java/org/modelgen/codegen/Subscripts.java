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

import com.google.common.collect.ImmutableList;
import java.util.List;

/** A statics-only class that binds a reference's subscripts to the current subscript tuple. */
public class Subscripts {

  /**
   * Returns the subscripts to use for a reference whose subscripts were written as {@code
   * written}.
   *
   * <p>{@code sets} lists the index sets in scope (the equation's sets followed by the bound set of
   * each enclosing sum or product) and {@code subs} the elements currently bound to them; {@code
   * subs} may be shorter than {@code sets} (it is empty when equations are generated in vector
   * form). Each written subscript that names an entry of {@code sets} is replaced by the element
   * bound to the last such entry, if there is one; anything else is kept as written.
   */
  public static ImmutableList<String> resolve(
      List<String> written, List<String> sets, List<String> subs) {
    if (written.isEmpty() || subs.isEmpty()) {
      return ImmutableList.copyOf(written);
    }
    ImmutableList.Builder<String> result = ImmutableList.builderWithExpectedSize(written.size());
    for (String s : written) {
      int i = sets.lastIndexOf(s);
      result.add((i >= 0 && i < subs.size()) ? subs.get(i) : s);
    }
    return result.build();
  }

  /** Returns a copy of {@code list} with {@code item} appended. */
  static ImmutableList<String> append(List<String> list, String item) {
    return ImmutableList.<String>builderWithExpectedSize(list.size() + 1)
        .addAll(list)
        .add(item)
        .build();
  }

  /**
   * If {@code subs} binds fewer entries than {@code sets} holds, returns it extended with the
   * unbound set names (which resolve to themselves); otherwise returns {@code subs}.
   */
  static List<String> pad(List<String> subs, List<String> sets) {
    if (subs.size() >= sets.size()) {
      return subs;
    }
    return ImmutableList.<String>builderWithExpectedSize(sets.size())
        .addAll(subs)
        .addAll(sets.subList(subs.size(), sets.size()))
        .build();
  }

  private Subscripts() {}
}
