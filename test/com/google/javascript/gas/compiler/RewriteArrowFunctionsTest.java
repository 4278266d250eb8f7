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
public final class RewriteArrowFunctionsTest extends CompilerTestCase {

  @Override
  protected CompilerPass getProcessor(Compiler compiler) {
    return new RewriteArrowFunctions(compiler);
  }

  @Test
  public void testExpressionBody() {
    test("var f = (x) => x * 2;", "var f = function(x) { return x * 2; };");
  }

  @Test
  public void testBlockBody() {
    test(
        "var f = (a, b) => { log(a); return b; };",
        "var f = function(a, b) { log(a); return b; };");
  }

  @Test
  public void testObjectLiteralBody() {
    test("var f = () => ({ a: 1 });", "var f = function() { return { a: 1 }; };");
  }

  @Test
  public void testThisInFunction() {
    test(
        """
        function f() {
          return () => this.x;
        }
        """,
        """
        function f() {
          var _this = this;
          return function() { return _this.x; };
        }
        """);
  }

  @Test
  public void testThisSharesOneAliasPerScope() {
    test(
        """
        var a = () => this;
        var b = () => this.y;
        """,
        """
        var _this = this;
        var a = function() { return _this; };
        var b = function() { return _this.y; };
        """);
  }

  @Test
  public void testNestedArrowsUseTheOuterFunctionThis() {
    test(
        """
        function f() {
          return () => () => this;
        }
        """,
        """
        function f() {
          var _this = this;
          return function() { return function() { return _this; }; };
        }
        """);
  }

  @Test
  public void testThisAliasAfterDirective() {
    test(
        """
        "use strict";
        var g = () => this;
        """,
        """
        "use strict";
        var _this = this;
        var g = function() { return _this; };
        """);
  }

  @Test
  public void testThisAliasAvoidsTakenName() {
    test(
        """
        var _this = 1;
        var g = () => this;
        """,
        """
        var _this_1 = this;
        var _this = 1;
        var g = function() { return _this_1; };
        """);
  }

  @Test
  public void testThisInsideFunctionExpressionIsLeftAlone() {
    test(
        "var g = () => function() { return this; };",
        "var g = function() { return function() { return this; }; };");
  }
}
