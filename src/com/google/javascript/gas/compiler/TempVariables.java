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

import com.google.common.collect.ImmutableList;
import com.google.javascript.gas.ast.IR;
import com.google.javascript.gas.ast.Node;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Declares the temporaries a pass introduces, as one {@code var _a, _b;} statement at the top of
 * each function or script that uses them.
 */
final class TempVariables {
  private final UniqueNameGenerator nameGenerator;
  private final Map<Node, Node> declarations = new IdentityHashMap<>();

  TempVariables(UniqueNameGenerator nameGenerator) {
    this.nameGenerator = nameGenerator;
  }

  /** Declares a new temporary in the scope of {@code use} and returns a reference to it. */
  Node declare(Node use) {
    String name = nameGenerator.getTempName();
    Node scopeBody = NodeUtil.getEnclosingHoistScopeBody(use);
    Node declaration = declarations.get(scopeBody);
    if (declaration == null) {
      declaration = IR.var(IR.name(name));
      NodeUtil.addToFrontOfScope(scopeBody, ImmutableList.of(declaration));
      declarations.put(scopeBody, declaration);
    } else {
      declaration.addChildToBack(IR.name(name));
    }
    return IR.name(name);
  }
}
