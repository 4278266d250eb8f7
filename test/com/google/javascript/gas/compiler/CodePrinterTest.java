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

import com.google.javascript.gas.ast.IR;
import com.google.javascript.gas.ast.Node;
import com.google.javascript.gas.ast.SourceFile;
import com.google.javascript.gas.compiler.CompilerOptions.LanguageMode;
import com.google.javascript.gas.compiler.CompilerOptions.NewLineKind;
import com.google.javascript.gas.compiler.parsing.Parser;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CodePrinterTest {

  private static Node parse(String js) {
    Node root =
        Parser.parse(
            SourceFile.fromCode("testcode.js", js), new CompilerTestCase.TestErrorManager());
    assertThat(root).isNotNull();
    return root;
  }

  private static String print(Node root, CompilerOptions options) {
    return new CodePrinter.Builder(root).setCompilerOptions(options).build();
  }

  private static void assertPrint(String js, String expected) {
    assertThat(print(parse(js), CompilerOptions.empty())).isEqualTo(expected);
  }

  private static Node script(Node... statements) {
    Node script = IR.script();
    for (Node statement : statements) {
      script.addChildToBack(statement);
    }
    return script;
  }

  @Test
  public void testOneStatementPerLine() {
    assertPrint("var a=1;f(a);", "var a = 1;\nf(a);\n");
  }

  @Test
  public void testBlocksAreIndented() {
    assertPrint(
        "if(a){f()}else{g()}",
        """
        if (a) {
            f();
        } else {
            g();
        }
        """);
  }

  @Test
  public void testControlBodiesAreBraced() {
    assertPrint(
        "while(a)b();",
        """
        while (a) {
            b();
        }
        """);
  }

  @Test
  public void testEmptyBlock() {
    assertPrint("if(a){}", "if (a) { }\n");
  }

  @Test
  public void testObjectLiterals() {
    assertPrint("var o={a:1};var e={};", "var o = { a: 1 };\nvar e = {};\n");
  }

  @Test
  public void testSourceStringsKeepTheirQuotes() {
    assertPrint("f('a');", "f('a');\n");
  }

  @Test
  public void testGeneratedStrings() {
    Node root =
        script(
            IR.exprResult(IR.call(IR.name("f"), IR.string("it's"))),
            IR.exprResult(IR.call(IR.name("f"), IR.string("say \"hi\""))));
    assertThat(print(root, CompilerOptions.empty())).isEqualTo("f(\"it's\");\nf('say \"hi\"');\n");
  }

  @Test
  public void testKeywordPropertiesAreQuotedForEs3() {
    Node es3 = script(IR.exprResult(IR.getprop(IR.name("exports"), "default")));
    assertThat(print(es3, CompilerOptions.empty())).isEqualTo("exports[\"default\"];\n");

    Node es5 = script(IR.exprResult(IR.getprop(IR.name("exports"), "default")));
    CompilerOptions options =
        CompilerOptions.builder().setTarget(LanguageMode.ECMASCRIPT5).build();
    assertThat(print(es5, options)).isEqualTo("exports.default;\n");
  }

  @Test
  public void testCrlf() {
    CompilerOptions options = CompilerOptions.builder().setNewLine(NewLineKind.CRLF).build();
    assertThat(print(parse("f();g();"), options)).isEqualTo("f();\r\ng();\r\n");
  }

  @Test
  public void testComments() {
    assertPrint("// lead\nf(); // trail\n", "// lead\nf(); // trail\n");
  }

  @Test
  public void testRemoveComments() {
    CompilerOptions options = CompilerOptions.builder().setRemoveComments(true).build();
    assertThat(print(parse("// lead\nf(); // trail\n"), options)).isEqualTo("f();\n");
  }

  @Test
  public void testNotEmittedPlaceholders() {
    Node commented = IR.notEmitted(IR.empty());
    commented.setSyntheticComment("import x from \"m\";");
    Node silent = IR.notEmitted(IR.empty());
    Node root = script(commented, silent, IR.exprResult(IR.call(IR.name("f"))));

    assertThat(print(root, CompilerOptions.empty())).isEqualTo("//import x from \"m\";\nf();\n");
  }

  @Test
  public void testEmptyScript() {
    assertPrint("", "");
  }
}
