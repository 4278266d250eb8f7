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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.javascript.gas.ast.Node;
import com.google.javascript.gas.ast.Token;
import java.util.function.UnaryOperator;

/**
 * A rewrite applied by the code printer to each node of one kind just before the node is printed.
 *
 * <p>A hook returns either its argument or a replacement to print instead. The printed tree is not
 * modified.
 */
public interface SubstitutionHook {

  /** The kind of node this hook is offered. */
  Token token();

  /** Returns the node to print in place of {@code node}. */
  Node substitute(Node node);

  /** Creates a hook from a token and a function. */
  static SubstitutionHook of(Token token, UnaryOperator<Node> substitution) {
    checkNotNull(token);
    checkNotNull(substitution);
    return new SubstitutionHook() {
      @Override
      public Token token() {
        return token;
      }

      @Override
      public Node substitute(Node node) {
        return substitution.apply(node);
      }

      @Override
      public String toString() {
        return "SubstitutionHook(" + token + ")";
      }
    };
  }
}
