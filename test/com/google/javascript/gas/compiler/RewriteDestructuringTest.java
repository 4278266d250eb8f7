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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class RewriteDestructuringTest extends CompilerTestCase {

  @Override
  protected CompilerPass getProcessor(Compiler compiler) {
    return new RewriteDestructuring(compiler);
  }

  @Test
  public void testObjectPatternFromName() {
    test("var {a, b: c} = o;", "var a = o.a, c = o.b;");
  }

  @Test
  public void testObjectPatternFromExpressionUsesTemp() {
    test("var {a, b} = f();", "var _a = f(), a = _a.a, b = _a.b;");
  }

  @Test
  public void testSingleElementNeedsNoTemp() {
    test("var {a} = f();", "var a = f().a;");
  }

  @Test
  public void testNestedPatterns() {
    test("var {a, b: [c]} = f();", "var _a = f(), a = _a.a, c = _a.b[0];");
  }

  @Test
  public void testArrayPatternWithHole() {
    test("var [x, , y] = arr;", "var x = arr[0], y = arr[2];");
  }

  @Test
  public void testArrayRest() {
    test("var [first, ...rest] = arr;", "var first = arr[0], rest = arr.slice(1);");
  }

  @Test
  public void testDefaultValue() {
    test("var {a = 1} = o;", "var _a = o.a, a = _a === void 0 ? 1 : _a;");
  }

  @Test
  public void testLetAndConstKeepTheirKind() {
    test("let [a, b] = pair;", "let a = pair[0], b = pair[1];");
    test("const {x} = point;", "const x = point.x;");
  }

  @Test
  public void testOtherDeclaratorsAreKept() {
    test("var n = 1, {a} = o, m;", "var n = 1, a = o.a, m;");
  }

  @Test
  public void testCatchParameter() {
    test(
        "try { f(); } catch ({message}) { log(message); }",
        "try { f(); } catch (_a) { var message = _a.message; log(message); }");
  }

  @Test
  public void testPlainDeclarationsAreLeftAlone() {
    testSame("var a = 1, b;");
  }
}
