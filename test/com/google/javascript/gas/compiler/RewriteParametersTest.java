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
public final class RewriteParametersTest extends CompilerTestCase {

  @Override
  protected CompilerPass getProcessor(Compiler compiler) {
    return new RewriteParameters(compiler);
  }

  @Test
  public void testDefaultValue() {
    test(
        "function f(a, b = 1) { return a + b; }",
        """
        function f(a, b) {
          if (b === void 0) {
            b = 1;
          }
          return a + b;
        }
        """);
  }

  @Test
  public void testDefaultValueAfterDirective() {
    test(
        "function f(a = []) { 'use strict'; return a; }",
        """
        function f(a) {
          'use strict';
          if (a === void 0) {
            a = [];
          }
          return a;
        }
        """);
  }

  @Test
  public void testRest() {
    test(
        "function f(a, ...rest) { return rest; }",
        """
        function f(a) {
          var rest = [];
          for (var _i = 1; _i < arguments.length; _i++) {
            rest[_i - 1] = arguments[_i];
          }
          return rest;
        }
        """);
  }

  @Test
  public void testRestOnly() {
    test(
        "function f(...args) { g(args); }",
        """
        function f() {
          var args = [];
          for (var _i = 0; _i < arguments.length; _i++) {
            args[_i] = arguments[_i];
          }
          g(args);
        }
        """);
  }

  @Test
  public void testDestructuredParameter() {
    test(
        "function f({a, b}) { return a + b; }",
        """
        function f(_a) {
          var {a, b} = _a;
          return a + b;
        }
        """);
  }

  @Test
  public void testDestructuredParameterWithDefault() {
    test(
        "function f([x, y] = []) { return x; }",
        """
        function f(_a) {
          if (_a === void 0) {
            _a = [];
          }
          var [x, y] = _a;
          return x;
        }
        """);
  }

  @Test
  public void testSimpleParametersAreLeftAlone() {
    testSame("function f(a, b) { return a; }");
  }
}
