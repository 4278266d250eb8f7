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

import static com.google.javascript.gas.compiler.TranspilationUtil.CANNOT_CONVERT;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class RewriteSpreadTest extends CompilerTestCase {

  @Override
  protected CompilerPass getProcessor(Compiler compiler) {
    return new RewriteSpread(compiler);
  }

  @Test
  public void testArrayLiteral() {
    test("var c = [...a];", "var c = a.slice();");
    test("var c = [1, ...a];", "var c = [1].concat(a);");
    test("var c = [...a, ...b];", "var c = a.concat(b);");
    test("var c = [1, ...a, 2, 3];", "var c = [1].concat(a, [2, 3]);");
  }

  @Test
  public void testArrayLiteralWithoutSpread() {
    testSame("var c = [1, 2];");
  }

  @Test
  public void testFunctionCall() {
    test("f(...a);", "f.apply(void 0, a);");
    test("f(1, ...a);", "f.apply(void 0, [1].concat(a));");
  }

  @Test
  public void testMethodCall() {
    test("o.m(...a);", "o.m.apply(o, a);");
    test("o[k](1, ...a);", "o[k].apply(o, [1].concat(a));");
  }

  @Test
  public void testMethodCallOnComplexReceiver() {
    test(
        "f().m(...a);",
        """
        var _a;
        (_a = f()).m.apply(_a, a);
        """);
  }

  @Test
  public void testTemporariesShareOneDeclaration() {
    test(
        """
        function g() {
          f().m(...a);
          h().n(...b);
        }
        """,
        """
        function g() {
          var _a, _b;
          (_a = f()).m.apply(_a, a);
          (_b = h()).n.apply(_b, b);
        }
        """);
  }

  @Test
  public void testNestedSpread() {
    test("f(...[...a]);", "f.apply(void 0, a.slice());");
  }

  @Test
  public void testSuperCall() {
    testError(
        "class C extends B { constructor() { super(...args); } }", CANNOT_CONVERT);
  }
}
