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
import static com.google.javascript.gas.compiler.ReportUntranspilableFeatures.UNTRANSPILABLE_FEATURE_PRESENT;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ReportUntranspilableFeaturesTest extends CompilerTestCase {

  @Override
  protected CompilerPass getProcessor(Compiler compiler) {
    return new ReportUntranspilableFeatures(compiler);
  }

  @Test
  public void testAsyncFunction() {
    testError("async function f() {}", UNTRANSPILABLE_FEATURE_PRESENT);
  }

  @Test
  public void testGenerator() {
    testError("function* f() { yield 1; }", UNTRANSPILABLE_FEATURE_PRESENT);
  }

  @Test
  public void testAccessors() {
    testError("var o = { get x() { return 1; } };", UNTRANSPILABLE_FEATURE_PRESENT);
    testError("class C { set x(v) {} }", UNTRANSPILABLE_FEATURE_PRESENT);
  }

  @Test
  public void testComputedProperty() {
    testError("var o = { [k]: 1 };", UNTRANSPILABLE_FEATURE_PRESENT);
  }

  @Test
  public void testObjectSpreadAndRest() {
    testError("var o = { ...p };", UNTRANSPILABLE_FEATURE_PRESENT);
    testError("var { a, ...rest } = o;", UNTRANSPILABLE_FEATURE_PRESENT);
  }

  @Test
  public void testTaggedTemplate() {
    testError("tag`a${b}`;", UNTRANSPILABLE_FEATURE_PRESENT);
  }

  @Test
  public void testDestructuringAssignment() {
    testError("[a, b] = [b, a];", UNTRANSPILABLE_FEATURE_PRESENT);
  }

  @Test
  public void testSpreadInNew() {
    testError("new C(...args);", UNTRANSPILABLE_FEATURE_PRESENT);
  }

  @Test
  public void testArgumentsInArrow() {
    testError("function f() { return () => arguments[0]; }", UNTRANSPILABLE_FEATURE_PRESENT);
  }

  @Test
  public void testSuperOutsideDerivedClass() {
    testError("class C { m() { return super.m(); } }", UNTRANSPILABLE_FEATURE_PRESENT);
  }

  @Test
  public void testSupportedFeaturesAreNotReported() {
    testSame("class C extends B { m() { return super.m(); } }");
    testSame("var f = (a, ...rest) => a + rest.length;");
    testSame("var s = `a${b}`;");
    testSame("for (const x of xs) { }");
    testSame("var { a, b: [c] } = o;");
  }

  @Test
  public void testMessageNamesFeatureAndTarget() {
    testError("async function f() {}", UNTRANSPILABLE_FEATURE_PRESENT);
    JSError error = getLastCompiler().getErrorManager().getErrors().get(0);
    assertThat(error.description()).isEqualTo("Cannot convert async functions to ES3.");
    assertThat(error.lineno()).isEqualTo(1);
  }

  @Test
  public void testDecoratorsNeedExperimentalDecorators() {
    testError("@d class C {}", UNTRANSPILABLE_FEATURE_PRESENT);
  }

  @Test
  public void testDecoratorsOnClassesAndMembers() {
    setOptions(getOptions().toBuilder().setExperimentalDecorators(true).build());
    testSame("@d class C { @log m(@inject x) {} @prop p; }");
  }

  @Test
  public void testParameterDecoratorOutsideClass() {
    setOptions(getOptions().toBuilder().setExperimentalDecorators(true).build());
    testError("function f(@d x) {}", UNTRANSPILABLE_FEATURE_PRESENT);
  }

  @Test
  public void testFeatureInsideDecorator() {
    setOptions(getOptions().toBuilder().setExperimentalDecorators(true).build());
    testError("@register(async function () {}) class C {}", UNTRANSPILABLE_FEATURE_PRESENT);
  }
}
