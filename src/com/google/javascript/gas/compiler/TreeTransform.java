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

/**
 * A whole-tree rewrite handed to the compiler with a {@link CompileRequest}. Before transforms see
 * the parsed SCRIPT, after transforms see the lowered one.
 */
@FunctionalInterface
public interface TreeTransform {

  /**
   * Rewrites the tree rooted at a SCRIPT node.
   *
   * @return the SCRIPT to continue with, usually {@code root} itself
   */
  Node transform(Node root);
}
