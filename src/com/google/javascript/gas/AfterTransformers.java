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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.javascript.gas.ast.IR;
import com.google.javascript.gas.ast.Node;
import com.google.javascript.gas.ast.Token;
import com.google.javascript.gas.compiler.SubstitutionHook;
import java.util.function.Predicate;

/**
 * Factories for the substitution hooks the transpiler hands to the printer. They see the lowered
 * tree, after the compiler has added statements such as the module marker.
 */
public final class AfterTransformers {

  private AfterTransformers() {}

  /**
   * Returns a hook that prints nothing in place of each node of kind {@code token} matching
   * {@code filter}. The comments of a suppressed statement are kept.
   */
  public static SubstitutionHook suppress(Token token, Predicate<Node> filter) {
    checkNotNull(filter);
    return SubstitutionHook.of(token, n -> filter.test(n) ? createPlaceholder(n) : n);
  }

  /** Suppresses the statements lowered from {@code export ... from} declarations. */
  public static SubstitutionHook suppressExportFrom() {
    return suppress(Token.EXPR_RESULT, NodeFilters::isLoweredExportFrom);
  }

  /** Suppresses the {@code exports.__esModule = true;} statement inserted by the compiler. */
  public static SubstitutionHook suppressModuleMarker() {
    return suppress(Token.EXPR_RESULT, NodeFilters::isModuleMarker);
  }

  /** Suppresses {@code exports["default"] = name;} statements. */
  public static SubstitutionHook suppressDefaultExport() {
    return suppress(Token.EXPR_RESULT, NodeFilters::isDefaultExportAssignment);
  }

  private static Node createPlaceholder(Node statement) {
    Node placeholder = IR.notEmitted(statement).srcref(statement);
    placeholder.setLeadingComments(statement.getLeadingComments());
    placeholder.setTrailingComments(statement.getTrailingComments());
    return placeholder;
  }
}
