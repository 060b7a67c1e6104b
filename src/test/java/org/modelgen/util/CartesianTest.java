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

package org.modelgen.util;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.IntStream;
import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(JUnitParamsRunner.class)
public class CartesianTest {

  private static final Cartesian REGIONS_BY_YEARS =
      Cartesian.of(
          ImmutableList.of(ImmutableList.of("usa", "jpn", "row"), ImmutableList.of("1", "2")));

  private static List<List<String>> tuples(Cartesian product) {
    List<List<String>> result = new ArrayList<>();
    product.forEach(result::add);
    return result;
  }

  @Test
  public void lastFactorVariesFastest() {
    assertThat(tuples(REGIONS_BY_YEARS))
        .containsExactly(
            ImmutableList.of("usa", "1"),
            ImmutableList.of("usa", "2"),
            ImmutableList.of("jpn", "1"),
            ImmutableList.of("jpn", "2"),
            ImmutableList.of("row", "1"),
            ImmutableList.of("row", "2"))
        .inOrder();
    assertThat(REGIONS_BY_YEARS.size()).isEqualTo(6);
    assertThat(REGIONS_BY_YEARS.arity()).isEqualTo(2);
  }

  @Test
  public void noFactorsYieldsOneEmptyTuple() {
    Cartesian empty = Cartesian.of(ImmutableList.of());
    assertThat(tuples(empty)).containsExactly(ImmutableList.of());
    assertThat(empty.size()).isEqualTo(1);
    assertThat(empty.indexOf(ImmutableList.of())).isEqualTo(0);
  }

  @Test
  public void emptyFactorYieldsNothing() {
    Cartesian product =
        Cartesian.of(ImmutableList.of(ImmutableList.of("a", "b"), ImmutableList.of()));
    assertThat(tuples(product)).isEmpty();
    assertThat(product.size()).isEqualTo(0);
  }

  @Test
  public void sizeOverflowIsDetected() {
    ImmutableList<String> thousand =
        IntStream.range(0, 1000)
            .mapToObj(Integer::toString)
            .collect(ImmutableList.toImmutableList());
    Cartesian product = Cartesian.of(ImmutableList.of(thousand, thousand, thousand, thousand));
    assertThrows(ArithmeticException.class, product::size);
    assertThat(product.arity()).isEqualTo(4);
  }

  @Test
  public void iterationRestarts() {
    Iterator<ImmutableList<String>> first = REGIONS_BY_YEARS.iterator();
    first.next();
    first.next();
    assertThat(REGIONS_BY_YEARS.iterator().next()).containsExactly("usa", "1").inOrder();
    assertThat(tuples(REGIONS_BY_YEARS)).hasSize(6);
  }

  @Test
  public void exhaustedIteratorThrows() {
    Iterator<ImmutableList<String>> it =
        Cartesian.of(ImmutableList.of(ImmutableList.of("only"))).iterator();
    it.next();
    assertFalse(it.hasNext());
    assertThrows(NoSuchElementException.class, it::next);
  }

  @Test
  @Parameters({
    "usa, 1, 0",
    "usa, 2, 1",
    "jpn, 1, 2",
    "row, 2, 5",
    "eur, 1, -1",
    "usa, 3, -1"
  })
  public void indexOf(String region, String year, int expected) {
    assertThat(REGIONS_BY_YEARS.indexOf(ImmutableList.of(region, year))).isEqualTo(expected);
  }

  @Test
  public void indexOfMatchesIterationOrder() {
    int i = 0;
    for (List<String> tuple : REGIONS_BY_YEARS) {
      assertThat(REGIONS_BY_YEARS.indexOf(tuple)).isEqualTo(i++);
    }
  }

  @Test
  public void indexOfWrongArity() {
    assertThat(REGIONS_BY_YEARS.indexOf(ImmutableList.of("usa"))).isEqualTo(-1);
  }
}
