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

package com.google.javascript.gas;

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ReleaseInfoTest {

  @Test
  public void testBanner() {
    ReleaseInfo info = ReleaseInfo.create("gas-transpiler", "2.3.1", "1.0.0");
    assertThat(info.getBanner())
        .isEqualTo("// Compiled using gas-transpiler 2.3.1 (Compiler 1.0.0)");
  }

  @Test
  public void testLoad() {
    ReleaseInfo info = ReleaseInfo.load();
    assertThat(info.name()).isEqualTo("gas-transpiler");
    assertThat(info.version()).isEqualTo("1.0.0");
    assertThat(info.compilerVersion()).isEqualTo("1.0.0");
  }

  @Test
  public void testDefaultTranspilerUsesBundledRelease() {
    assertThat(new GasTranspiler().transform("f();"))
        .isEqualTo("// Compiled using gas-transpiler 1.0.0 (Compiler 1.0.0)\nf();\n");
  }
}
