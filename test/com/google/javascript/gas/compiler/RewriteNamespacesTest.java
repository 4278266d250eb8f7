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
public final class RewriteNamespacesTest extends CompilerTestCase {

  @Override
  protected CompilerPass getProcessor(Compiler compiler) {
    return new RewriteNamespaces(compiler);
  }

  @Test
  public void testExportedMembers() {
    test(
        """
        namespace N {
          export const x = 1;
          function f() { return x; }
          export function g() {}
        }
        """,
        """
        var N;
        (function(N) {
          N.x = 1;
          function f() { return N.x; }
          function g() {}
          N.g = g;
        })(N || (N = {}));
        """);
  }

  @Test
  public void testMergedNamespacesDeclareOnce() {
    test(
        """
        namespace N { export const a = 1; }
        namespace N { export const b = 2; }
        """,
        """
        var N;
        (function(N) { N.a = 1; })(N || (N = {}));
        (function(N) { N.b = 2; })(N || (N = {}));
        """);
  }

  @Test
  public void testNestedNamespace() {
    test(
        """
        namespace Outer {
          export namespace Inner {
            export const v = 1;
          }
        }
        """,
        """
        var Outer;
        (function(Outer) {
          var Inner;
          (function(Inner) { Inner.v = 1; })(Inner = Outer.Inner || (Outer.Inner = {}));
        })(Outer || (Outer = {}));
        """);
  }

  @Test
  public void testParameterAvoidsMemberWithTheSameName() {
    test(
        """
        namespace N {
          var N = 1;
          export const x = N;
        }
        """,
        """
        var N;
        (function(N_1) {
          var N = 1;
          N_1.x = N;
        })(N || (N = {}));
        """);
  }

  @Test
  public void testExportedNamespaceInModule() {
    test(
        "export namespace N { export const a = 1; }",
        """
        var N;
        (function(N) { N.a = 1; })(N = exports.N || (exports.N = {}));
        """);
  }
}
