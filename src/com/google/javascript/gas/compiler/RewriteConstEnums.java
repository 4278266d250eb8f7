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
import com.google.javascript.gas.ast.Node.Prop;
import com.google.javascript.gas.ast.Token;
import com.google.javascript.gas.compiler.NodeTraversal.AbstractPostOrderCallback;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Replaces every access to a member of a {@code const enum} with the member's value and removes
 * the declaration. Only possible when the whole program is compiled at once, since another file
 * can not see the inlined values.
 */
public final class RewriteConstEnums extends AbstractPostOrderCallback implements CompilerPass {

  static final DiagnosticType CONST_ENUM_NOT_CONSTANT =
      DiagnosticType.error(
          "JSC_CONST_ENUM_NOT_CONSTANT",
          "Member {0} of const enum {1} does not have a constant value.");

  static final DiagnosticType CONST_ENUM_NOT_ACCESSED =
      DiagnosticType.error(
          "JSC_CONST_ENUM_NOT_ACCESSED",
          "Const enum {0} can only be used in property or index access expressions.");

  private final Compiler compiler;
  private final Map<String, Map<String, @Nullable Object>> constEnums = new HashMap<>();

  RewriteConstEnums(Compiler compiler) {
    this.compiler = checkNotNull(compiler);
  }

  @Override
  public void process(Node root) {
    List<Node> declarations = new ArrayList<>();
    NodeUtil.visitPreOrder(
        root,
        n -> {
          if (n.isEnum() && n.getBooleanProp(Prop.CONST_ENUM)) {
            declarations.add(n);
          }
        });
    if (declarations.isEmpty()) {
      return;
    }
    for (Node declaration : declarations) {
      String name = declaration.getFirstChild().getString();
      constEnums
          .computeIfAbsent(name, k -> new HashMap<>())
          .putAll(RewriteEnums.computeMemberValues(declaration));
      Node statement = declaration.getParent().isExport() ? declaration.getParent() : declaration;
      statement.detach();
    }
    NodeTraversal.traverse(compiler, root, this);
  }

  @Override
  public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
    if (!n.isName() || !constEnums.containsKey(n.getString()) || parent == null) {
      return;
    }
    String enumName = n.getString();
    String member;
    if (parent.isGetProp() && n.isFirstChildOf(parent)) {
      member = parent.getString();
    } else if (parent.getToken() == Token.GETELEM
        && n.isFirstChildOf(parent)
        && parent.getSecondChild().isStringLit()) {
      member = parent.getSecondChild().getString();
    } else {
      if (!NodeUtil.isDeclarationName(n)) {
        t.report(n, CONST_ENUM_NOT_ACCESSED, enumName);
      }
      return;
    }
    Map<String, @Nullable Object> values = constEnums.get(enumName);
    Object value = values.get(member);
    if (value == null) {
      t.report(parent, CONST_ENUM_NOT_CONSTANT, member, enumName);
      return;
    }
    parent.replaceWith(RewriteEnums.createValueNode(value).srcref(parent));
  }
}
