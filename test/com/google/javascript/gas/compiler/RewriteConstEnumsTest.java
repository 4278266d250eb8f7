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

import static com.google.javascript.gas.compiler.RewriteConstEnums.CONST_ENUM_NOT_ACCESSED;
import static com.google.javascript.gas.compiler.RewriteConstEnums.CONST_ENUM_NOT_CONSTANT;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class RewriteConstEnumsTest extends CompilerTestCase {

  @Override
  protected CompilerPass getProcessor(Compiler compiler) {
    return new RewriteConstEnums(compiler);
  }

  @Test
  public void testMembersAreInlined() {
    test(
        """
        const enum Dir { Up = 1, Down }
        var a = Dir.Down;
        var b = Dir["Up"];
        """,
        """
        var a = 2;
        var b = 1;
        """);
  }

  @Test
  public void testStringMember() {
    test(
        """
        const enum Key { Enter = "enter" }
        f(Key.Enter);
        """,
        "f(\"enter\");");
  }

  @Test
  public void testOtherNamesAreLeftAlone() {
    test("const enum D { A }\nvar a = E.A;", "var a = E.A;");
  }

  @Test
  public void testConstEnumObjectCannotBeUsed() {
    testError("const enum E { A }\nf(E);", CONST_ENUM_NOT_ACCESSED);
  }

  @Test
  public void testMemberWithoutConstantValue() {
    testError("const enum E { A = g() }\nf(E.A);", CONST_ENUM_NOT_CONSTANT);
  }
}
