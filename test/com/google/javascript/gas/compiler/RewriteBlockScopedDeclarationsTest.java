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
public final class RewriteBlockScopedDeclarationsTest extends CompilerTestCase {

  @Override
  protected CompilerPass getProcessor(Compiler compiler) {
    return new RewriteBlockScopedDeclarations(compiler);
  }

  @Test
  public void testTopLevelDeclarations() {
    test("let x = 1; const y = 2;", "var x = 1; var y = 2;");
  }

  @Test
  public void testBlockDeclarationWithoutConflict() {
    test("if (c) { let y = 2; f(y); }", "if (c) { var y = 2; f(y); }");
  }

  @Test
  public void testShadowingDeclarationIsRenamed() {
    test(
        """
        let x = 1;
        if (c) {
          let x = 2;
          f(x);
        }
        f(x);
        """,
        """
        var x = 1;
        if (c) {
          var x_1 = 2;
          f(x_1);
        }
        f(x);
        """);
  }

  @Test
  public void testSiblingBlocksWithTheSameName() {
    test(
        """
        if (a) { let t = 1; f(t); }
        if (b) { let t = 2; g(t); }
        """,
        """
        if (a) { var t = 1; f(t); }
        if (b) { var t_1 = 2; g(t_1); }
        """);
  }

  @Test
  public void testShadowingInsideFunction() {
    test(
        """
        function f() {
          let a = 1;
          {
            let a = 2;
            g(a);
          }
          return a;
        }
        """,
        """
        function f() {
          var a = 1;
          {
            var a_1 = 2;
            g(a_1);
          }
          return a;
        }
        """);
  }

  @Test
  public void testLoopDeclarations() {
    test(
        "for (let i = 0; i < 3; i++) { let v; f(i, v); }",
        "for (var i = 0; i < 3; i++) { var v = void 0; f(i, v); }");
  }

  @Test
  public void testLetOutsideLoopIsNotInitialized() {
    test("let v; f(v);", "var v; f(v);");
  }

  @Test
  public void testOptionalCatchBinding() {
    test("try { f(); } catch { g(); }", "try { f(); } catch (_a) { g(); }");
  }

  @Test
  public void testVarIsLeftAlone() {
    testSame("var x = 1; if (c) { var x = 2; }");
  }
}
