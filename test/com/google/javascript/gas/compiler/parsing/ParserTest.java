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

package com.google.javascript.gas.compiler.parsing;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.javascript.gas.ast.Node;
import com.google.javascript.gas.ast.Node.Prop;
import com.google.javascript.gas.ast.SourceFile;
import com.google.javascript.gas.ast.Token;
import com.google.javascript.gas.compiler.BasicErrorManager;
import com.google.javascript.gas.compiler.CheckLevel;
import com.google.javascript.gas.compiler.CodePrinter;
import com.google.javascript.gas.compiler.JSError;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ParserTest {

  private CollectingErrorManager errorManager;

  @Before
  public void setUp() {
    errorManager = new CollectingErrorManager();
  }

  private Node parse(String code) {
    Node root = Parser.parse(SourceFile.fromCode("input.ts", code), errorManager);
    assertThat(errorManager.getErrors()).isEmpty();
    assertThat(root).isNotNull();
    return root;
  }

  private JSError parseError(String code) {
    Node root = Parser.parse(SourceFile.fromCode("input.ts", code), errorManager);
    assertThat(root).isNull();
    ImmutableList<JSError> errors = errorManager.getErrors();
    assertThat(errors).hasSize(1);
    assertThat(errors.get(0).type()).isEqualTo(Parser.PARSE_ERROR);
    return errors.get(0);
  }

  private String print(String code) {
    return new CodePrinter.Builder(parse(code)).build();
  }

  /** Asserts that TypeScript source prints like the JavaScript it erases to. */
  private void assertErasesTo(String ts, String js) {
    assertThat(print(ts)).isEqualTo(print(js));
  }

  @Test
  public void testTypeDeclarationsAreErased() {
    assertErasesTo(
        """
        interface Point { x: number; y: number }
        type Id = string | number;
        declare var host: any;
        declare function log(message: string): void;
        var p = 1;
        """,
        "var p = 1;");
  }

  @Test
  public void testAnnotationsAreErased() {
    assertErasesTo(
        "let x: Map<string, number[]> = y as any;\nvar z = w! satisfies object;",
        "let x = y;\nvar z = w;");
  }

  @Test
  public void testFunctionSignatures() {
    assertErasesTo(
        """
        function f(a: string): void;
        function f<T>(this: Window, a: T, b?: number, ...rest: any[]): T { return a; }
        """,
        "function f(a, b, ...rest) { return a; }");
  }

  @Test
  public void testGenericCall() {
    assertErasesTo("f<string>(x);\nvar c = a < b;", "f(x);\nvar c = a < b;");
  }

  @Test
  public void testClassMembers() {
    assertErasesTo(
        """
        abstract class A<T> implements I {
          private n: number = 1;
          abstract m(): void;
          get(key: string): T { return this.n; }
        }
        """,
        """
        class A {
          n = 1;
          get(key) { return this.n; }
        }
        """);
  }

  @Test
  public void testParameterProperties() {
    Node root = parse("class A { constructor(private readonly x: number, y) {} }");
    Node params =
        root.getFirstChild().getLastChild().getFirstChild().getFirstChild().getSecondChild();
    assertThat(params.isParamList()).isTrue();
    assertThat(params.getFirstChild().getBooleanProp(Prop.PARAMETER_PROPERTY)).isTrue();
    assertThat(params.getSecondChild().getBooleanProp(Prop.PARAMETER_PROPERTY)).isFalse();
  }

  @Test
  public void testArrowFunctions() {
    Node root = parse("var f = (a: number, b) => a;\nvar g = (a);\nvar h = async x => x;");
    Node f = root.getFirstChild().getFirstChild().getFirstChild();
    assertThat(f.isArrowFunction()).isTrue();
    assertThat(f.getSecondChild().getChildCount()).isEqualTo(2);
    Node g = root.getSecondChild().getFirstChild().getFirstChild();
    assertThat(g.isName()).isTrue();
    Node h = root.getLastChild().getFirstChild().getFirstChild();
    assertThat(h.isArrowFunction()).isTrue();
    assertThat(h.isAsyncFunction()).isTrue();
  }

  @Test
  public void testEnums() {
    Node root = parse("enum E { A, 'b c' = 2 }\nconst enum C { X }");
    Node e = root.getFirstChild();
    assertThat(e.getToken()).isEqualTo(Token.ENUM);
    assertThat(e.getBooleanProp(Prop.CONST_ENUM)).isFalse();
    Node members = e.getSecondChild();
    assertThat(members.getChildCount()).isEqualTo(2);
    assertThat(members.getFirstChild().hasChildren()).isFalse();
    assertThat(members.getSecondChild().getString()).isEqualTo("b c");
    assertThat(members.getSecondChild().isQuotedString()).isTrue();
    assertThat(root.getSecondChild().getBooleanProp(Prop.CONST_ENUM)).isTrue();
  }

  @Test
  public void testModuleSyntax() {
    assertThat(parse("var a;").isModuleScript()).isFalse();
    assertThat(parse("export const a = 1;").isModuleScript()).isTrue();
    assertThat(parse("import \"./polyfill\";").isModuleScript()).isTrue();
    assertThat(parse("namespace N { export var a = 1; }").isModuleScript()).isFalse();
    assertThat(parse("import c = A.b;").isModuleScript()).isFalse();
    assertThat(parse("import c = require(\"./c\");").isModuleScript()).isTrue();
  }

  @Test
  public void testTypeOnlyImports() {
    Node root = parse("import type { T } from \"./t\";\nimport { type U, v } from \"./u\";");
    assertThat(root.getFirstChild().isTypeOnly()).isTrue();
    Node specs = root.getSecondChild().getSecondChild();
    assertThat(root.getSecondChild().isTypeOnly()).isFalse();
    assertThat(specs.getChildCount()).isEqualTo(1);
  }

  @Test
  public void testComments() {
    Node root = parse("// lead\nf(); // trail\nfunction g() {\n  // only\n}\n/* end */");
    Node call = root.getFirstChild();
    assertThat(call.getLeadingComments()).hasSize(1);
    assertThat(call.getLeadingComments().get(0).text()).isEqualTo("// lead");
    assertThat(call.getTrailingComments().get(0).text()).isEqualTo("// trail");
    Node body = root.getSecondChild().getLastChild();
    assertThat(body.getDanglingComments().get(0).text()).isEqualTo("// only");
    assertThat(root.getDanglingComments().get(0).text()).isEqualTo("/* end */");
  }

  @Test
  public void testSourcePositions() {
    Node root = parse("var a;\n  f(a);");
    Node call = root.getSecondChild();
    assertThat(call.getLineno()).isEqualTo(2);
    assertThat(call.getCharno()).isEqualTo(2);
    assertThat(call.getSourceFileName()).isEqualTo("input.ts");
  }

  @Test
  public void testSyntaxError() {
    JSError error = parseError("var a = 1;\nvar = ;");
    assertThat(error.sourceName()).isEqualTo("input.ts");
    assertThat(error.lineno()).isEqualTo(2);
  }

  @Test
  public void testUnterminatedString() {
    JSError error = parseError("var s = 'abc");
    assertThat(error.description()).contains("Unterminated string literal");
  }

  private static final class CollectingErrorManager extends BasicErrorManager {
    @Override
    public void println(CheckLevel level, JSError error) {}

    @Override
    protected void printSummary() {}
  }
}
