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

import com.google.javascript.gas.ast.Node;

/** Util functions for the lowering passes */
final class TranspilationUtil {

  private TranspilationUtil() {} // prevent instantiation

  static final DiagnosticType CANNOT_CONVERT =
      DiagnosticType.error("JSC_CANNOT_CONVERT", "This code cannot be converted. {0}");

  static void cannotConvert(Compiler compiler, Node n, String message) {
    compiler.report(JSError.make(n, CANNOT_CONVERT, message));
  }

  /** Whether a SCRIPT or function body is in strict mode because of a directive. */
  static boolean hasUseStrictDirective(Node scopeBody) {
    for (Node child = scopeBody.getFirstChild(); child != null; child = child.getNext()) {
      if (!NodeUtil.isDirective(child)) {
        return false;
      }
      if (child.getFirstChild().getString().equals("use strict")) {
        return true;
      }
    }
    return false;
  }
}
