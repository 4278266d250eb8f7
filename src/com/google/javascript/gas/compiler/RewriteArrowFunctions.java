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
import com.google.javascript.gas.ast.IR;
import com.google.javascript.gas.ast.Node;
import com.google.javascript.gas.ast.Node.Prop;
import com.google.javascript.gas.compiler.NodeTraversal.AbstractPostOrderCallback;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Converts arrow functions to function expressions. An arrow function that uses {@code this} reads
 * it from a {@code var _this = this;} declared at the top of the enclosing function or script.
 */
public final class RewriteArrowFunctions extends AbstractPostOrderCallback
    implements CompilerPass {
  private final Compiler compiler;
  private final Set<Node> scopesWithThisAlias = Collections.newSetFromMap(new IdentityHashMap<>());

  RewriteArrowFunctions(Compiler compiler) {
    this.compiler = checkNotNull(compiler);
  }

  @Override
  public void process(Node root) {
    NodeTraversal.traverse(compiler, root, this);
  }

  @Override
  public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
    if (n.isFunction() && n.isArrowFunction()) {
      visitArrowFunction(n);
    }
  }

  private void visitArrowFunction(Node arrowFunction) {
    Node body = arrowFunction.getLastChild();
    if (!body.isBlock()) {
      //   (x) => x * 2   becomes   function (x) { return x * 2; }
      Node expr = body.detach();
      Node block = IR.block(IR.returnNode(expr).srcref(expr)).srcref(expr);
      arrowFunction.addChildToBack(block);
      body = block;
    }

    List<Node> thisNodes = new ArrayList<>();
    NodeUtil.findInFunction(body, Node::isThis, thisNodes);
    if (!thisNodes.isEmpty()) {
      String thisName = compiler.getUniqueNameGenerator().getAlias("_this");
      Node scopeBody = NodeUtil.getEnclosingHoistScopeBody(arrowFunction);
      if (scopesWithThisAlias.add(scopeBody)) {
        Node alias = IR.var(IR.name(thisName), IR.thisNode());
        NodeUtil.addToFrontOfScope(scopeBody, ImmutableList.of(alias));
      }
      for (Node thisNode : thisNodes) {
        thisNode.replaceWith(IR.name(thisName).srcref(thisNode));
      }
    }
    arrowFunction.putBooleanProp(Prop.ARROW_FN, false);
  }
}
