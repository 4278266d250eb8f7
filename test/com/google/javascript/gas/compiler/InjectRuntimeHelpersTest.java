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

import com.google.common.collect.ImmutableList;
import com.google.javascript.gas.ast.Node;
import com.google.javascript.gas.ast.SourceFile;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class InjectRuntimeHelpersTest extends CompilerTestCase {

  private List<String> libraries = ImmutableList.of();

  @Override
  protected CompilerPass getProcessor(Compiler compiler) {
    for (String library : libraries) {
      compiler.ensureLibraryInjected(library);
    }
    return new InjectRuntimeHelpers(compiler);
  }

  @Test
  public void testNothingRequired() {
    testSame("f();");
  }

  @Test
  public void testExportStar() {
    libraries = ImmutableList.of("export_star");
    test(
        """
        "use strict";
        f();
        """,
        """
        "use strict";
        function __export(m) {
            for (var p in m) if (!exports.hasOwnProperty(p)) exports[p] = m[p];
        }
        f();
        """);
  }

  @Test
  public void testHelpersKeepTheirOrder() {
    libraries = ImmutableList.of("export_star", "extends");
    Compiler compiler = new Compiler(new TestErrorManager());
    compiler.initOptions(getOptions());
    Node root = compiler.parse(SourceFile.fromCode("testcode.ts", "f();"));
    getProcessor(compiler).process(root);
    String code = compiler.toSource(root, SubstitutionChain.empty());

    assertThat(code).startsWith("var __extends = ");
    assertThat(code.indexOf("function __export(m)")).isGreaterThan(0);
    assertThat(code).endsWith("f();\n");
  }

  @Test
  public void testDecoratorHelpers() {
    libraries = ImmutableList.of("param", "decorate");
    Compiler compiler = new Compiler(new TestErrorManager());
    compiler.initOptions(getOptions());
    Node root = compiler.parse(SourceFile.fromCode("testcode.ts", "f();"));
    getProcessor(compiler).process(root);
    String code = compiler.toSource(root, SubstitutionChain.empty());

    assertThat(code).startsWith("var __decorate = ");
    assertThat(code.indexOf("var __param = ")).isGreaterThan(code.indexOf("Reflect.decorate"));
    assertThat(code).doesNotContain("__extends");
  }

  @Test
  public void testHelperCommentsAreDropped() {
    libraries = ImmutableList.of("extends");
    Compiler compiler = new Compiler(new TestErrorManager());
    compiler.initOptions(getOptions());
    Node root = compiler.parse(SourceFile.fromCode("testcode.ts", "f();"));
    getProcessor(compiler).process(root);
    String code = compiler.toSource(root, SubstitutionChain.empty());

    assertThat(code).doesNotContain("Copyright");
    assertThat(code).doesNotContain("@fileoverview");
  }
}
