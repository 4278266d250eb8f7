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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.javascript.gas.ast.IR;
import com.google.javascript.gas.ast.Node;
import com.google.javascript.gas.ast.Token;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Lowers namespace declarations to an object filled in by an immediately invoked function:
 *
 * <pre>
 *   var N;
 *   (function (N) {
 *       N.x = 1;
 *       function f() { }
 *       N.f = f;
 *   })(N || (N = {}));
 * </pre>
 *
 * Inside the function, references to an exported variable print as the property of the namespace
 * object. Nested namespaces are lowered first, so that each one is a plain statement of its
 * parent by the time the parent is lowered.
 */
public final class RewriteNamespaces implements CompilerPass {
  private final Compiler compiler;

  RewriteNamespaces(Compiler compiler) {
    this.compiler = checkNotNull(compiler);
  }

  @Override
  public void process(Node root) {
    List<Node> namespaces = new ArrayList<>();
    NodeUtil.visitPreOrder(
        root,
        n -> {
          if (n.isNamespace()) {
            namespaces.add(n);
          }
        });
    for (Node namespace : Lists.reverse(namespaces)) {
      visitNamespace(namespace);
    }
  }

  private void visitNamespace(Node namespace) {
    Node parent = namespace.getParent();
    Node statement = parent.isExport() ? parent : namespace;
    Node nameNode = namespace.getFirstChild();
    String name = nameNode.getString();
    Node elements = namespace.getSecondChild();

    Node body = IR.block();
    body.addChildrenToBack(elements.detachChildren());
    body.setDanglingComments(elements.getDanglingComments());
    Set<String> declared = new LinkedHashSet<>();
    for (Node child : body.children()) {
      Node declaration = child.isExport() ? child.getFirstChild() : child;
      if (declaration.isNameDeclaration()) {
        for (Node lhs : declaration.children()) {
          NodeUtil.collectLhsNames(lhs, declared);
        }
      } else if (declaration.isFunction() || declaration.isClass()) {
        declared.add(declaration.getFirstChild().getString());
      }
    }
    String paramName =
        declared.contains(name) ? compiler.getUniqueNameGenerator().getUniqueName(name) : name;
    Node function = IR.anonymousFunction(IR.paramList(IR.name(paramName)), body);
    for (Node child = body.getFirstChild(); child != null; ) {
      Node next = child.getNext();
      if (child.isExport()) {
        visitExportedMember(function, paramName, child);
      }
      child = next;
    }

    List<Node> statements = new ArrayList<>();
    if (!NodeUtil.isNameDeclaredBefore(statement, name)) {
      Node var = IR.var(IR.name(name)).srcref(nameNode);
      if (statement.isExport()
          && !RewriteEnums.isNamespaceMember(statement)
          && !compiler.isModuleLoweringEnabled()) {
        // export var N;
        var = new Node(Token.EXPORT, var).srcref(statement);
      }
      statements.add(var);
    }
    Node iife = IR.exprResult(IR.call(function, createContainerArgument(statement, name)));
    statements.add(iife.srcref(namespace));
    statements.get(0).takeCommentsFrom(statement);
    for (Node lowered : statements) {
      lowered.setOriginalNode(statement);
    }
    statement.replaceWith(statements);
  }

  /**
   * Returns {@code N || (N = {})}, or {@code N = container.N || (container.N = {})} when the
   * namespace is exported from a module or from its parent namespace.
   */
  private Node createContainerArgument(Node statement, String name) {
    Node container = null;
    if (statement.isExport()) {
      if (RewriteEnums.isNamespaceMember(statement)) {
        container = IR.name(statement.getParent().getParent().getFirstChild().getString());
      } else if (compiler.isModuleLoweringEnabled()) {
        container = IR.name("exports");
      }
    }
    if (container == null) {
      return IR.or(IR.name(name), IR.assign(IR.name(name), IR.objectlit()));
    }
    Node initialized =
        IR.or(
            IR.getprop(container, name),
            IR.assign(IR.getprop(container.cloneNode(), name), IR.objectlit()));
    return IR.assign(IR.name(name), initialized);
  }

  private void visitExportedMember(Node function, String namespace, Node export) {
    Node declaration = export.getFirstChild();
    List<Node> statements = new ArrayList<>();
    switch (declaration.getToken()) {
      case VAR:
      case LET:
      case CONST:
        //   export const x = 1;
        for (Node lhs : declaration.childList()) {
          if (lhs.isName()) {
            String name = lhs.getString();
            function.addExportBinding(name, IR.getprop(IR.name(namespace), name));
            if (lhs.hasChildren()) {
              Node init = lhs.removeFirstChild();
              statements.add(
                  IR.exprResult(IR.assign(IR.getprop(IR.name(namespace), name), init))
                      .srcref(lhs));
            }
          } else {
            Set<String> names = new LinkedHashSet<>();
            NodeUtil.collectLhsNames(lhs, names);
            statements.add(new Node(declaration.getToken(), lhs.detach()).srcref(declaration));
            for (String name : names) {
              statements.add(createMemberAssignment(namespace, name));
            }
          }
        }
        break;
      case FUNCTION:
      case CLASS:
        //   export function f() {}
        statements.add(declaration.detach());
        statements.add(
            createMemberAssignment(namespace, declaration.getFirstChild().getString())
                .srcref(export));
        break;
      default:
        throw new IllegalStateException("Unexpected export in namespace " + declaration);
    }
    if (statements.isEmpty()) {
      export.detach();
      return;
    }
    statements.get(0).takeCommentsFrom(export);
    export.replaceWith(ImmutableList.copyOf(statements));
  }

  /** {@code N.name = name;} */
  private static Node createMemberAssignment(String namespace, String name) {
    return IR.exprResult(IR.assign(IR.getprop(IR.name(namespace), name), IR.name(name)));
  }
}
