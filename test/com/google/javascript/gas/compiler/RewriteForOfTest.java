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
public final class RewriteForOfTest extends CompilerTestCase {

  @Override
  protected CompilerPass getProcessor(Compiler compiler) {
    return new RewriteForOf(compiler);
  }

  @Test
  public void testVarDeclaration() {
    test(
        "for (var x of xs) { f(x); }",
        """
        for (var _i = 0, xs_1 = xs; _i < xs_1.length; _i++) {
          var x = xs_1[_i];
          f(x);
        }
        """);
  }

  @Test
  public void testConstDeclarationIsKept() {
    test(
        "for (const x of xs) f(x);",
        """
        for (var _i = 0, xs_1 = xs; _i < xs_1.length; _i++) {
          const x = xs_1[_i];
          f(x);
        }
        """);
  }

  @Test
  public void testAssignmentTarget() {
    test(
        "for (x of xs) { f(x); }",
        """
        for (var _i = 0, xs_1 = xs; _i < xs_1.length; _i++) {
          x = xs_1[_i];
          f(x);
        }
        """);
  }

  @Test
  public void testComplexIterable() {
    test(
        "for (var x of f()) { g(x); }",
        """
        for (var _i = 0, _a = f(); _i < _a.length; _i++) {
          var x = _a[_i];
          g(x);
        }
        """);
  }

  @Test
  public void testDestructuringDeclaration() {
    test(
        "for (const [k, v] of entries) { f(k, v); }",
        """
        for (var _i = 0, entries_1 = entries; _i < entries_1.length; _i++) {
          const [k, v] = entries_1[_i];
          f(k, v);
        }
        """);
  }

  @Test
  public void testNestedLoopsUseDistinctCounters() {
    test(
        "for (var x of xs) { for (var y of ys) { f(x, y); } }",
        """
        for (var _a = 0, xs_1 = xs; _a < xs_1.length; _a++) {
          var x = xs_1[_a];
          for (var _i = 0, ys_1 = ys; _i < ys_1.length; _i++) {
            var y = ys_1[_i];
            f(x, y);
          }
        }
        """);
  }
}
