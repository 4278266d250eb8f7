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
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import com.google.common.io.Resources;
import com.google.javascript.gas.compiler.CompileRequest;
import com.google.javascript.gas.compiler.CompilerOptions;
import com.google.javascript.gas.compiler.CompilerOptions.LanguageMode;
import com.google.javascript.gas.compiler.CompilerOptions.ModuleKind;
import com.google.javascript.gas.compiler.EmitException;
import com.google.javascript.gas.compiler.ParseException;
import com.google.javascript.gas.compiler.Result;
import java.io.IOException;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** End-to-end tests of {@link GasTranspiler}. */
@RunWith(JUnit4.class)
public final class GasTranspilerTest {

  private static final String BANNER =
      "// Compiled using gas-transpiler 1.0.0 (Compiler 1.0.0)\n";

  private static final String PREAMBLE =
      "var exports = exports || {};\nvar module = module || { exports: exports };\n";

  private final GasTranspiler transpiler =
      new GasTranspiler(ReleaseInfo.create("gas-transpiler", "1.0.0", "1.0.0"));

  /** Transpiles {@code testdata/name.ts} and compares the output with {@code name.js}. */
  private void assertTranspilesFixture(String name) throws IOException {
    String source =
        Resources.toString(Resources.getResource(getClass(), "testdata/" + name + ".ts"), UTF_8);
    String expected =
        Resources.toString(Resources.getResource(getClass(), "testdata/" + name + ".js"), UTF_8);
    assertThat(transpiler.transform(source)).isEqualTo(expected);
  }

  @Test
  public void testImportAliasesFixture() throws IOException {
    assertTranspilesFixture("import_aliases");
  }

  @Test
  public void testExportConstantsFixture() throws IOException {
    assertTranspilesFixture("export_constants");
  }

  @Test
  public void testScriptWithoutModuleSyntax() {
    assertThat(transpiler.transform("const a = 1;")).isEqualTo(BANNER + "var a = 1;\n");
  }

  @Test
  public void testScriptWithTypes() {
    assertThat(transpiler.transform("let n: number = 1;\nf(n as any);"))
        .isEqualTo(BANNER + "var n = 1;\nf(n);\n");
  }

  @Test
  public void testLoweringAloneAddsNoPreamble() {
    String source =
        """
        function greet(name: string) {
          return `Hi ${name}`;
        }
        class Animal {
          speak() { return greet("animal"); }
        }
        class Dog extends Animal {}
        """;
    String output = transpiler.transform(source);
    assertThat(output).startsWith(BANNER + "var __extends = ");
    assertThat(output).contains("return \"Hi \" + name;");
    assertThat(output).contains("Animal.prototype.speak = function");
    assertThat(output).doesNotContain("var exports");
    assertThat(output).doesNotContain("var module");
  }

  @Test
  public void testExportedConstant() {
    assertThat(transpiler.transform("export const pi = 3.141592;"))
        .isEqualTo(BANNER + PREAMBLE + "exports.pi = 3.141592;\n");
  }

  @Test
  public void testExportedConstantKeepsSpelling() {
    assertThat(transpiler.transform("export const pi = 3.141592;\nlog(pi);"))
        .isEqualTo(BANNER + PREAMBLE + "exports.pi = 3.141592;\nlog(pi);\n");
  }

  @Test
  public void testDefaultExport() {
    String output = transpiler.transform("export default 3.141592;");
    assertThat(output).isEqualTo(BANNER + PREAMBLE + "var _default = 3.141592;\n");
    assertThat(output).doesNotContain("exports[\"default\"]");
  }

  @Test
  public void testModuleMarkerIsSuppressed() {
    assertThat(transpiler.transform("export const a = 1;")).doesNotContain("__esModule");
  }

  @Test
  public void testImportIsCommentedOut() {
    assertThat(transpiler.transform("import {a} from \"./m\";\nf(a);"))
        .isEqualTo(BANNER + PREAMBLE + "//import {a} from \"./m\";\nf(a);\n");
  }

  @Test
  public void testImportAliasIsCommentedOut() {
    String source =
        """
        // next statement will be ignored
        import ContentAlignment
        = GoogleAppsScript.Slides.ContentAlignment;
        // now resume with next statement
        f();
        """;
    assertThat(transpiler.transform(source))
        .isEqualTo(
            BANNER
                + "// next statement will be ignored\n"
                + "//import ContentAlignment\\n= GoogleAppsScript.Slides.ContentAlignment;\n"
                + "// now resume with next statement\n"
                + "f();\n");
  }

  @Test
  public void testExportFromIsCommentedOut() {
    assertThat(transpiler.transform("export { foo, bar }\n  from \"file\";\nvar x = 1;"))
        .isEqualTo(
            BANNER + PREAMBLE + "//export { foo, bar }\\n  from \"file\";\nvar x = 1;\n");
  }

  @Test
  public void testExportStarIsCommentedOut() {
    String output = transpiler.transform("export * from 'file';");
    assertThat(output).contains("//export * from 'file';\n");
    assertThat(output).doesNotContain("__export");
    assertThat(output).doesNotContain("require");
  }

  @Test
  public void testUserWrittenExports() {
    assertThat(transpiler.transform("module.exports.foo = {};"))
        .isEqualTo(BANNER + PREAMBLE + "module.exports.foo = {};\n");
  }

  @Test
  public void testObjectLiteralKeyNamedExports() {
    assertThat(transpiler.transform("var o = { exports: 1 };"))
        .isEqualTo(BANNER + PREAMBLE + "var o = { exports: 1 };\n");
  }

  @Test
  public void testDecoratedClass() {
    String output = transpiler.transform("function d(t) {}\n@d class C {}");
    assertThat(output).startsWith(BANNER + "var __decorate = ");
    assertThat(output).contains("C = __decorate([d], C);\n");
    assertThat(output).doesNotContain("var exports");
  }

  @Test
  public void testDecoratorsCanBeTurnedOff() {
    assertThrows(
        EmitException.class,
        () ->
            transpiler.transform(
                "@d class C {}", "{\"compilerOptions\": {\"experimentalDecorators\": false}}"));
  }

  @Test
  public void testCallerOptions() {
    String options = "{\"compilerOptions\": {\"removeComments\": true, \"newLine\": \"crlf\"}}";
    String output = transpiler.transform("// gone\nf();", options);
    assertThat(output).isEqualTo(BANNER + "f();\r\n");
  }

  @Test
  public void testRemoveCommentsKeepsCommentedOutImports() {
    String output =
        transpiler.transform(
            "// gone\nimport C = A.b;\nf(C);", "{\"compilerOptions\": {\"removeComments\": true}}");
    assertThat(output).isEqualTo(BANNER + "//import C = A.b;\nf(C);\n");
  }

  @Test
  public void testUseStrictWhenRequested() {
    String output =
        transpiler.transform(
            "export const a = 1;", "{\"compilerOptions\": {\"noImplicitUseStrict\": false}}");
    assertThat(output).startsWith(BANNER + PREAMBLE);
    assertThat(output).contains("\"use strict\";\n");
  }

  @Test
  public void testMandatoryOptionsWin() {
    TranspileOptions options =
        TranspileOptions.fromJson(
            """
            {
              "compilerOptions": {"target": "ES5", "module": "ES2015", "isolatedModules": false},
              "transformers": {"before": []}
            }
            """);

    CompileRequest request = GasTranspiler.createRequest(options);

    CompilerOptions compilerOptions = request.options();
    assertThat(compilerOptions.target()).isEqualTo(LanguageMode.ECMASCRIPT3);
    assertThat(compilerOptions.module()).isEqualTo(ModuleKind.NONE);
    assertThat(compilerOptions.isolatedModules()).isTrue();
    assertThat(compilerOptions.noImplicitUseStrict()).isTrue();
    assertThat(compilerOptions.experimentalDecorators()).isTrue();
    assertThat(request.transformers().before()).hasSize(3);
    assertThat(request.transformers().substitutions()).hasSize(3);
    assertThat(request.transformers().after()).hasSize(1);
  }

  @Test
  public void testMandatoryTargetWinsInOutput() {
    String output =
        transpiler.transform("f(a.default);", "{\"compilerOptions\": {\"target\": \"ES5\"}}");
    assertThat(output).isEqualTo(BANNER + "f(a[\"default\"]);\n");
  }

  @Test
  public void testCompile() {
    Result result = transpiler.compile("export const pi = 3.141592;", TranspileOptions.empty());
    assertThat(result.outputText()).isEqualTo(PREAMBLE + "exports.pi = 3.141592;\n");
    assertThat(result.root().getFirstChild().isVar()).isTrue();
  }

  @Test
  public void testRepeatedCallsGiveTheSameOutput() {
    String source = "import {a} from \"./m\";\nexport default a;";
    assertThat(transpiler.transform(source)).isEqualTo(transpiler.transform(source));
  }

  @Test
  public void testParseError() {
    assertThrows(ParseException.class, () -> transpiler.transform("var = ;"));
  }

  @Test
  public void testExportDefaultOfConstDeclaration() {
    assertThrows(
        ParseException.class, () -> transpiler.transform("export default const pi = 3.141592;"));
  }

  @Test
  public void testEmitError() {
    assertThrows(EmitException.class, () -> transpiler.transform("async function f() {}"));
  }

  @Test
  public void testInvalidOptions() {
    assertThrows(IllegalArgumentException.class, () -> transpiler.transform("f();", "{"));
  }
}
