/*
 * Copyright 2026 The Closure Compiler Authors.
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

package com.google.javascript.gas.compiler;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableSet;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class UniqueNameGeneratorTest {

  @Test
  public void testTempNamesSkipLoopLetters() {
    UniqueNameGenerator generator = new UniqueNameGenerator(ImmutableSet.of());
    StringBuilder names = new StringBuilder();
    for (int i = 0; i < 14; i++) {
      names.append(generator.getTempName()).append(' ');
    }
    assertThat(names.toString().trim())
        .isEqualTo("_a _b _c _d _e _f _g _h _j _k _l _m _o _p");
  }

  @Test
  public void testTempNamesAfterTheAlphabet() {
    UniqueNameGenerator generator = new UniqueNameGenerator(ImmutableSet.of());
    String last = null;
    for (int i = 0; i < 25; i++) {
      last = generator.getTempName();
    }
    assertThat(last).isEqualTo("_0");
  }

  @Test
  public void testTempNamesAvoidReservedNames() {
    UniqueNameGenerator generator = new UniqueNameGenerator(ImmutableSet.of("_a", "_c"));
    assertThat(generator.getTempName()).isEqualTo("_b");
    assertThat(generator.getTempName()).isEqualTo("_d");
  }

  @Test
  public void testLoopCounter() {
    UniqueNameGenerator generator = new UniqueNameGenerator(ImmutableSet.of());
    assertThat(generator.getLoopCounterName()).isEqualTo("_i");
    assertThat(generator.getLoopCounterName()).isEqualTo("_a");
    assertThat(generator.getTempName()).isEqualTo("_b");
  }

  @Test
  public void testUniqueNames() {
    UniqueNameGenerator generator = new UniqueNameGenerator(ImmutableSet.of("m_2"));
    assertThat(generator.getUniqueName("m")).isEqualTo("m_1");
    assertThat(generator.getUniqueName("m")).isEqualTo("m_3");
    assertThat(generator.getUniqueName("n")).isEqualTo("n_1");
  }

  @Test
  public void testAliases() {
    UniqueNameGenerator generator = new UniqueNameGenerator(ImmutableSet.of("_super"));
    assertThat(generator.getAlias("_this")).isEqualTo("_this");
    assertThat(generator.getAlias("_this")).isEqualTo("_this");
    assertThat(generator.getAlias("_super")).isEqualTo("_super_1");
    assertThat(generator.getAlias("_super")).isEqualTo("_super_1");
  }

  @Test
  public void testReserve() {
    UniqueNameGenerator generator = new UniqueNameGenerator(ImmutableSet.of());
    assertThat(generator.isTaken("x")).isFalse();
    generator.reserve("x");
    assertThat(generator.isTaken("x")).isTrue();
    assertThat(generator.getAlias("x")).isEqualTo("x_1");
  }
}
