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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableMap;
import com.google.javascript.gas.ast.IR;
import com.google.javascript.gas.ast.Node;
import com.google.javascript.gas.ast.SourceFile;
import com.google.javascript.gas.ast.Token;
import com.google.javascript.gas.compiler.CompilerOptions.LanguageMode;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CompilerTest {

  private static final CompilerOptions OPTIONS =
      CompilerOptions.builder()
          .setTarget(LanguageMode.ECMASCRIPT3)
          .setNoImplicitUseStrict(true)
          .build();

  private static Result compile(String js, CompileRequest request) {
    Compiler compiler = new Compiler(new CompilerTestCase.TestErrorManager());
    return compiler.compile(SourceFile.fromCode("input.ts", js), request);
  }

  private static CompileRequest.Builder request() {
    return CompileRequest.builder().setOptions(OPTIONS);
  }

  @Test
  public void testCompile() {
    Result result = compile("let x: number = 1;\nf(x);", request().build());
    assertThat(result.outputText()).isEqualTo("var x = 1;\nf(x);\n");
    assertThat(result.root().isScript()).isTrue();
    assertThat(result.warnings()).isEmpty();
  }

  @Test
  public void testRenamedDependencies() {
    CompileRequest request =
        request().setRenamedDependencies(ImmutableMap.of("./m", "./lib/m")).build();
    Result result = compile("import {a} from \"./m\";\nf(a);", request);
    assertThat(result.outputText())
        .isEqualTo("exports.__esModule = true;\nvar m_1 = require(\"./lib/m\");\nf(m_1.a);\n");
  }

  @Test
  public void testTransformersRunAroundLowering() {
    List<String> seen = new ArrayList<>();
    Transformers transformers =
        Transformers.builder()
            .addBefore(
                root -> {
                  seen.add("before " + root.getFirstChild().getToken());
                  return root;
                })
            .addAfter(
                root -> {
                  seen.add("after " + root.getFirstChild().getToken());
                  return root;
                })
            .build();
    compile("const x = 1;", request().setTransformers(transformers).build());
    assertThat(seen).containsExactly("before CONST", "after VAR").inOrder();
  }

  @Test
  public void testTransformMayReplaceTheScript() {
    Transformers transformers =
        Transformers.builder()
            .addAfter(
                root -> {
                  Node script = IR.script();
                  script.addChildToBack(IR.exprResult(IR.call(IR.name("g"))));
                  return script;
                })
            .build();
    Result result = compile("f();", request().setTransformers(transformers).build());
    assertThat(result.outputText()).isEqualTo("g();\n");
  }

  @Test
  public void testSubstitutionsRunWhilePrinting() {
    Transformers transformers =
        Transformers.builder()
            .addSubstitution(
                SubstitutionHook.of(
                    Token.NAME, n -> n.getString().equals("x") ? IR.name("y") : n))
            .build();
    Result result = compile("f(x);", request().setTransformers(transformers).build());
    assertThat(result.outputText()).isEqualTo("f(y);\n");
    assertThat(result.root().getFirstChild().getFirstChild().getSecondChild().getString())
        .isEqualTo("x");
  }

  @Test
  public void testRuntimeHelpersAreInjected() {
    Result result = compile("class A extends B {}", request().build());
    assertThat(result.outputText()).startsWith("var __extends = ");
    assertThat(result.outputText()).contains("__extends(A, _super);");
  }

  @Test
  public void testParseError() {
    ParseException e =
        assertThrows(ParseException.class, () -> compile("var = ;", request().build()));
    assertThat(e.getErrors()).isNotEmpty();
    assertThat(e.getMessage()).contains("input.ts");
  }

  @Test
  public void testEmitError() {
    EmitException e =
        assertThrows(
            EmitException.class, () -> compile("async function f() {}", request().build()));
    assertThat(e.getErrors()).hasSize(1);
    assertThat(e.getErrors().get(0).type())
        .isEqualTo(ReportUntranspilableFeatures.UNTRANSPILABLE_FEATURE_PRESENT);
  }

  @Test
  public void testCompilesOnce() {
    Compiler compiler = new Compiler(new CompilerTestCase.TestErrorManager());
    compiler.compile(SourceFile.fromCode("a.ts", "f();"), CompileRequest.empty());
    assertThrows(
        IllegalStateException.class,
        () -> compiler.compile(SourceFile.fromCode("b.ts", "g();"), CompileRequest.empty()));
  }

  @Test
  public void testIsolatedModulesKeepsConstEnums() {
    Compiler compiler = new Compiler(new CompilerTestCase.TestErrorManager());
    compiler.initOptions(OPTIONS.toBuilder().setIsolatedModules(true).build());
    assertThat(compiler.getLoweringPasses().stream().anyMatch(RewriteConstEnums.class::isInstance))
        .isFalse();

    Compiler inlining = new Compiler(new CompilerTestCase.TestErrorManager());
    inlining.initOptions(OPTIONS);
    assertThat(inlining.getLoweringPasses().stream().anyMatch(RewriteConstEnums.class::isInstance))
        .isTrue();
  }

  @Test
  public void testReleaseVersion() {
    assertThat(Compiler.getReleaseVersion()).isEqualTo("1.0.0");
  }
}
