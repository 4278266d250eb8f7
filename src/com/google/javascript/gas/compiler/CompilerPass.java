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
 * Interface for classes that can lower or check a parsed script.
 *
 * <p>Class has single function "process", which is passed the SCRIPT node of the parsed tree.
 *
 * <p>Use this class to support testing with CompilerTestCase
 */
public interface CompilerPass {

  /**
   * Process the script rooted at root. Can modify the contents of the tree.
   *
   * @param root the SCRIPT node
   */
  void process(Node root);
}
