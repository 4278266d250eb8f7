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
import com.google.javascript.gas.compiler.NodeTraversal.AbstractPostOrderCallback;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Lowers default, rest and destructured parameters to statements at the top of the function body:
 *
 * <pre>
 *   function f(a, b = 1, {c}, ...rest) {}
 * </pre>
 *
 * becomes
 *
 * <pre>
 *   function f(a, b, _a) {
 *       if (b === void 0) {
 *           b = 1;
 *       }
 *       var {c} = _a;
 *       var rest = [];
 *       for (var _i = 3; _i < arguments.length; _i++) {
 *           rest[_i - 3] = arguments[_i];
 *       }
 *   }
 * </pre>
 */
public final class RewriteParameters extends AbstractPostOrderCallback implements CompilerPass {
  private final Compiler compiler;
  private final UniqueNameGenerator nameGenerator;

  RewriteParameters(Compiler compiler) {
    this.compiler = checkNotNull(compiler);
    this.nameGenerator = compiler.getUniqueNameGenerator();
  }

  @Override
  public void process(Node root) {
    NodeTraversal.traverse(compiler, root, this);
  }

  @Override
  public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
    if (n.isFunction()) {
      visitParamList(n.getSecondChild(), n.getLastChild());
    }
  }

  private void visitParamList(Node paramList, Node body) {
    List<Node> prologue = new ArrayList<>();
    Node rest = null;
    int index = 0;
    for (Node param : paramList.childList()) {
      if (param.isIterRest()) {
        rest = param;
        break;
      }
      if (param.isDefaultValue()) {
        //   if (b === void 0) { b = 1; }
        Node defaultValue = param.getLastChild().detach();
        Node target = param.removeFirstChild();
        Node name = target.isName() ? target : IR.name(nameGenerator.getTempName()).srcref(target);
        param.replaceWith(name);
        prologue.add(createDefaultCheck(name, defaultValue));
        if (name != target) {
          prologue.add(createPatternDeclaration(target, name.getString()));
        }
      } else if (param.isDestructuringPattern()) {
        //   var {c} = _a;
        String temp = nameGenerator.getTempName();
        param.replaceWith(IR.name(temp).srcref(param));
        prologue.add(createPatternDeclaration(param, temp));
      }
      index++;
    }
    if (rest != null) {
      prologue.addAll(createRestCopy(rest.detach(), index));
    }
    if (prologue.isEmpty()) {
      return;
    }
    Node insertionPoint = getPrologueEnd(body);
    for (Node statement : prologue) {
      if (insertionPoint == null) {
        body.addChildToFront(statement);
      } else {
        statement.insertAfter(insertionPoint);
      }
      insertionPoint = statement;
    }
  }

  private static Node createDefaultCheck(Node name, Node defaultValue) {
    Node isUndefined = IR.sheq(IR.name(name.getString()), IR.undefined());
    Node assign = IR.exprResult(IR.assign(IR.name(name.getString()), defaultValue));
    return IR.ifNode(isUndefined, IR.block(assign.srcref(defaultValue))).srcref(name);
  }

  private static Node createPatternDeclaration(Node pattern, String source) {
    return IR.var(pattern, IR.name(source)).srcref(pattern);
  }

  /**
   * Copies the remaining arguments into an array:
   *
   * <pre>
   *   var rest = [];
   *   for (var _i = 1; _i < arguments.length; _i++) {
   *       rest[_i - 1] = arguments[_i];
   *   }
   * </pre>
   */
  private List<Node> createRestCopy(Node rest, int index) {
    List<Node> statements = new ArrayList<>();
    Node target = rest.getFirstChild();
    String restName = target.isName() ? target.getString() : nameGenerator.getTempName();
    String counter = nameGenerator.getLoopCounterName();

    statements.add(IR.var(IR.name(restName), IR.arraylit()).srcref(rest));
    Node element =
        index == 0 ? IR.name(counter) : IR.sub(IR.name(counter), IR.number(index));
    Node copy =
        IR.exprResult(
            IR.assign(
                IR.getelem(IR.name(restName), element),
                IR.getelem(IR.name("arguments"), IR.name(counter))));
    Node loop =
        IR.forNode(
            IR.var(IR.name(counter), IR.number(index)),
            IR.lt(IR.name(counter), IR.getprop(IR.name("arguments"), "length")),
            IR.inc(IR.name(counter), true),
            IR.block(copy));
    statements.add(loop.srcref(rest));
    if (!target.isName()) {
      statements.add(createPatternDeclaration(target.detach(), restName));
    }
    return statements;
  }

  /**
   * Returns the last statement that must stay ahead of the parameter statements: directives and
   * the {@code var _this = this;} alias of arrow functions. Null if there is none.
   */
  private static @Nullable Node getPrologueEnd(Node body) {
    Node end = null;
    for (Node child = body.getFirstChild(); child != null; child = child.getNext()) {
      if (NodeUtil.isDirective(child) || isThisAlias(child)) {
        end = child;
      } else {
        break;
      }
    }
    return end;
  }

  private static boolean isThisAlias(Node n) {
    return n.getToken() == Token.VAR
        && n.hasOneChild()
        && n.getFirstChild().hasOneChild()
        && n.getFirstChild().getFirstChild().isThis();
  }
}
