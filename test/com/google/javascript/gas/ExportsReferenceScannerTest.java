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
import static com.google.javascript.gas.NodeFiltersTest.parse;

import com.google.javascript.gas.ast.Node;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ExportsReferenceScannerTest {

  @Test
  public void testNoReference() {
    ExportsReferenceScanner.ScanResult result =
        ExportsReferenceScanner.scan(parse("var a = 1;\nf(a, \"exports\");"));
    assertThat(result.referencesExports()).isFalse();
    assertThat(result.firstReference()).isNull();
  }

  @Test
  public void testName() {
    Node root = parse("var a = 1;\nexports.a = a;");
    Node reference = ExportsReferenceScanner.scan(root).firstReference();
    assertThat(reference).isNotNull();
    assertThat(reference.isName()).isTrue();
    assertThat(reference.getString()).isEqualTo("exports");
  }

  @Test
  public void testPropertyName() {
    Node reference = ExportsReferenceScanner.scan(parse("module.exports = 3.14;")).firstReference();
    assertThat(reference).isNotNull();
    assertThat(reference.isGetProp()).isTrue();
  }

  @Test
  public void testObjectLiteralKey() {
    Node reference =
        ExportsReferenceScanner.scan(parse("var o = { exports: 1 };")).firstReference();
    assertThat(reference).isNotNull();
    assertThat(reference.isStringKey()).isTrue();
  }

  @Test
  public void testQuotedObjectLiteralKey() {
    Node root = parse("var o = { \"exports\": 1 };");
    assertThat(ExportsReferenceScanner.scan(root).referencesExports()).isFalse();
  }

  @Test
  public void testStopsAtFirstReferenceInPreorder() {
    Node root = parse("function f() {\n  return exports;\n}\nexports.b = 1;");
    Node reference = ExportsReferenceScanner.scan(root).firstReference();
    assertThat(reference.getParent().isReturn()).isTrue();
  }

  @Test
  public void testNestedReference() {
    Node root = parse("if (a) {\n  for (;;) {\n    g(function () { return exports; });\n  }\n}");
    assertThat(ExportsReferenceScanner.scan(root).referencesExports()).isTrue();
  }
}
