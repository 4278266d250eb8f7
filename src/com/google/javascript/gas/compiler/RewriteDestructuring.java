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

import com.google.javascript.gas.ast.IR;
import com.google.javascript.gas.ast.Node;
import com.google.javascript.gas.ast.Token;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Lowers destructuring patterns in variable declarations and catch clauses to one declarator per
 * bound name, e.g. {@code var {a, b: [c]} = f();} to {@code var _a = f(), a = _a.a, c = _a.b[0];}.
 * A value read more than once is held in a temporary first.
 */
public final class RewriteDestructuring implements NodeTraversal.Callback, CompilerPass {
  private final Compiler compiler;
  private final UniqueNameGenerator nameGenerator;

  RewriteDestructuring(Compiler compiler) {
    this.compiler = checkNotNull(compiler);
    this.nameGenerator = compiler.getUniqueNameGenerator();
  }

  @Override
  public void process(Node root) {
    NodeTraversal.traverse(compiler, root, this);
  }

  @Override
  public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
    if (n.isCatch() && n.getFirstChild().isDestructuringPattern()) {
      //   catch ({message}) {}   becomes   catch (_a) { var {message} = _a; }
      Node pattern = n.getFirstChild();
      String temp = nameGenerator.getTempName();
      pattern.replaceWith(IR.name(temp).srcref(pattern));
      n.getLastChild().addChildToFront(IR.var(pattern, IR.name(temp)).srcref(pattern));
    }
    return true;
  }

  @Override
  public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
    if (!n.isNameDeclaration()) {
      return;
    }
    for (Node lhs : n.childList()) {
      if (!lhs.isDestructuringLhs()) {
        continue;
      }
      if (!lhs.hasTwoChildren()) {
        TranspilationUtil.cannotConvert(
            compiler, lhs, "A destructuring declaration must have an initializer.");
        return;
      }
      Node pattern = lhs.removeFirstChild();
      Node value = lhs.removeFirstChild();
      List<Node> declarators = new ArrayList<>();
      destructure(pattern, value, declarators);
      for (Node declarator : declarators) {
        declarator.insertBefore(lhs);
      }
      lhs.detach();
    }
  }

  private void destructure(Node pattern, Node value, List<Node> declarators) {
    if (countElements(pattern) > 1 && !value.isName()) {
      value = declareTemp(value, declarators);
    }
    if (pattern.isObjectPattern()) {
      for (Node property : pattern.childList()) {
        Node target = property.removeFirstChild();
        Node access = IR.getprop(value.cloneTree(), property.getString()).srcref(property);
        bind(target, access, declarators);
      }
    } else {
      int index = 0;
      for (Node element : pattern.childList()) {
        if (element.isIterRest()) {
          //   rest = arr.slice(2)
          Node slice =
              IR.call(IR.getprop(value.cloneTree(), "slice"), IR.number(index)).srcref(element);
          bind(element.removeFirstChild(), slice, declarators);
        } else if (!element.isEmpty()) {
          Node access = IR.getelem(value.cloneTree(), IR.number(index)).srcref(element);
          bind(element.detach(), access, declarators);
        }
        index++;
      }
    }
  }

  /** Declares {@code target}, which may be a pattern or have a default value. */
  private void bind(Node target, Node value, List<Node> declarators) {
    switch (target.getToken()) {
      case NAME:
        target.detachChildren();
        target.addChildToBack(value);
        declarators.add(target);
        break;
      case DEFAULT_VALUE:
        {
          //   _a === void 0 ? 1 : _a
          Node temp = declareTemp(value, declarators);
          Node defaultValue = target.getLastChild().detach();
          Node isUndefined = IR.sheq(temp.cloneNode(), IR.undefined());
          bind(
              target.removeFirstChild(),
              IR.hook(isUndefined, defaultValue, temp.cloneNode()),
              declarators);
          break;
        }
      case OBJECT_PATTERN:
      case ARRAY_PATTERN:
        destructure(target, value, declarators);
        break;
      default:
        throw new IllegalStateException("Unexpected destructuring target " + target);
    }
  }

  private Node declareTemp(Node value, List<Node> declarators) {
    Node temp = IR.name(nameGenerator.getTempName());
    Node declarator = temp.cloneNode();
    declarator.addChildToBack(value);
    declarators.add(declarator);
    return temp;
  }

  private static int countElements(Node pattern) {
    int count = 0;
    for (Node element : pattern.children()) {
      if (element.getToken() != Token.EMPTY) {
        count++;
      }
    }
    return count;
  }
}
