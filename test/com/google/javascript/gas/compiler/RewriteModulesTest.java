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
import static com.google.javascript.gas.compiler.RewriteModules.EXPORT_ASSIGNMENT_IN_ES_MODULE;

import com.google.javascript.gas.compiler.CompilerOptions.ModuleKind;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class RewriteModulesTest extends CompilerTestCase {

  @Override
  protected CompilerPass getProcessor(Compiler compiler) {
    return new RewriteModules(compiler);
  }

  private void enableEsModules() {
    setOptions(getOptions().toBuilder().setModule(ModuleKind.ES2015).build());
  }

  @Test
  public void testNamedImport() {
    test(
        """
        import {a} from "./m";
        f(a);
        """,
        """
        exports.__esModule = true;
        var m_1 = require("./m");
        f(m_1.a);
        """);
  }

  @Test
  public void testDefaultAndNamespaceImports() {
    test(
        """
        import d from "./lib/foo-bar";
        import * as ns from "./n";
        f(d, ns.x);
        """,
        """
        exports.__esModule = true;
        var foo_bar_1 = require("./lib/foo-bar");
        var ns = require("./n");
        f(foo_bar_1["default"], ns.x);
        """);
  }

  @Test
  public void testUnusedImportIsElided() {
    test(
        """
        import {a} from "./m";
        f();
        """,
        """
        exports.__esModule = true;
        f();
        """);
  }

  @Test
  public void testSideEffectImport() {
    test(
        "import \"./polyfill\";",
        """
        exports.__esModule = true;
        require("./polyfill");
        """);
  }

  @Test
  public void testLocalShadowsImport() {
    test(
        """
        import {a} from "./m";
        function g(a) { return a; }
        f(a);
        """,
        """
        exports.__esModule = true;
        var m_1 = require("./m");
        function g(a) { return a; }
        f(m_1.a);
        """);
  }

  @Test
  public void testExportedVariable() {
    test(
        """
        export const pi = 3.14;
        log(pi);
        """,
        """
        exports.__esModule = true;
        exports.pi = 3.14;
        log(exports.pi);
        """);
  }

  @Test
  public void testExportedFunction() {
    test(
        "export function f() {}",
        """
        exports.__esModule = true;
        function f() {}
        exports.f = f;
        """);
  }

  @Test
  public void testExportDefaultExpression() {
    test(
        "export default 3.14;",
        """
        exports.__esModule = true;
        var _default = 3.14;
        exports["default"] = _default;
        """);
  }

  @Test
  public void testExportDefaultAnonymousFunction() {
    test(
        "export default function() {}",
        """
        exports.__esModule = true;
        function default_1() {}
        exports["default"] = default_1;
        """);
  }

  @Test
  public void testExportSpecs() {
    test(
        """
        const x = 1;
        export {x as y};
        """,
        """
        exports.__esModule = true;
        const x = 1;
        exports.y = x;
        """);
  }

  @Test
  public void testExportFrom() {
    test(
        "export {a, b as c} from \"./m\";",
        """
        exports.__esModule = true;
        exports.a = require("./m").a;
        exports.c = require("./m").b;
        """);
  }

  @Test
  public void testExportStar() {
    test(
        "export * from \"./m\";",
        """
        exports.__esModule = true;
        __export(require("./m"));
        """);
    assertThat(getLastCompiler().getRequiredLibraries()).containsExactly("export_star");
  }

  @Test
  public void testExportAssignment() {
    test("export = foo;", "module.exports = foo;");
  }

  @Test
  public void testUseStrictIsAdded() {
    setOptions(getOptions().toBuilder().setNoImplicitUseStrict(false).build());
    test(
        "export const a = 1;",
        """
        "use strict";
        exports.__esModule = true;
        exports.a = 1;
        """);
  }

  @Test
  public void testImportAliasInScript() {
    test("import c = A.b;\nf(c);", "var c = A.b;\nf(c);");
  }

  @Test
  public void testUnusedImportAliasIsElided() {
    test("import c = A.b;\nf();", "f();");
  }

  @Test
  public void testScriptIsLeftAlone() {
    testSame("var exports = 1;\nf(exports);");
  }

  @Test
  public void testEsModuleKeepsUsedBindings() {
    enableEsModules();
    test(
        """
        import {a, b} from "./m";
        var c = f(a);
        export {c};
        """,
        """
        import { a } from "./m";
        var c = f(a);
        export { c };
        """);
  }

  @Test
  public void testEsModuleRejectsExportAssignment() {
    enableEsModules();
    testError("export = foo;", EXPORT_ASSIGNMENT_IN_ES_MODULE);
  }

  @Test
  public void testModuleBaseName() {
    assertThat(RewriteModules.getModuleBaseName("./lib/foo-bar")).isEqualTo("foo_bar");
    assertThat(RewriteModules.getModuleBaseName("lodash")).isEqualTo("lodash");
    assertThat(RewriteModules.getModuleBaseName("./2d/")).isEqualTo("_2d");
    assertThat(RewriteModules.getModuleBaseName("/")).isEqualTo("module");
  }
}
