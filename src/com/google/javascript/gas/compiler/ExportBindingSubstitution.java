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
import com.google.javascript.gas.ast.Token;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Prints a reference to an exported or imported name as the property access that holds its value,
 * e.g. {@code x} as {@code exports.x} or {@code foo_1.x}.
 *
 * <p>The lowering passes record these replacements as export bindings on the node whose scope they
 * cover. A reference uses the binding of the nearest such node, unless a function or catch clause
 * in between declares the same name.
 */
final class ExportBindingSubstitution implements SubstitutionHook {
  private final Map<Node, Set<String>> declaredNames = new IdentityHashMap<>();

  @Override
  public Token token() {
    return Token.NAME;
  }

  @Override
  public Node substitute(Node name) {
    String string = name.getString();
    if (string.isEmpty() || NodeUtil.isDeclarationName(name)) {
      return name;
    }
    for (Node n = name; n != null; n = n.getParent()) {
      Node replacement = n.getExportBindings().get(string);
      if (replacement != null) {
        return replacement.cloneTree().srcrefTree(name);
      }
      if (n != name && declares(n, string)) {
        return name;
      }
    }
    return name;
  }

  private boolean declares(Node n, String name) {
    if (n.isFunction()) {
      return declaredNames.computeIfAbsent(n, NodeUtil::getHoistedNames).contains(name);
    }
    if (n.isCatch()) {
      return n.getFirstChild().matchesName(name);
    }
    return false;
  }
}
