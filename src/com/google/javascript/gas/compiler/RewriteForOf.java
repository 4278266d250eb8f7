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
import com.google.javascript.gas.compiler.NodeTraversal.AbstractPostOrderCallback;
import org.jspecify.annotations.Nullable;

/**
 * Converts for-of loops, which are assumed to iterate over an array or another array-like object,
 * to indexed for loops:
 *
 * <pre>
 *   for (var _i = 0, items_1 = items; _i < items_1.length; _i++) {
 *       var item = items_1[_i];
 *       ...
 *   }
 * </pre>
 */
public final class RewriteForOf extends AbstractPostOrderCallback implements CompilerPass {
  private final Compiler compiler;
  private final UniqueNameGenerator nameGenerator;

  RewriteForOf(Compiler compiler) {
    this.compiler = checkNotNull(compiler);
    this.nameGenerator = compiler.getUniqueNameGenerator();
  }

  @Override
  public void process(Node root) {
    NodeTraversal.traverse(compiler, root, this);
  }

  @Override
  public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
    if (n.isForOf()) {
      visitForOf(n);
    }
  }

  private void visitForOf(Node forOf) {
    Node variable = forOf.getFirstChild().detach();
    Node iterable = forOf.getFirstChild().detach();
    Node body = forOf.getLastChild().detach();

    String counter = nameGenerator.getLoopCounterName();
    String array =
        iterable.isName()
            ? nameGenerator.getUniqueName(iterable.getString())
            : nameGenerator.getTempName();

    Node element = IR.getelem(IR.name(array), IR.name(counter));
    Node assignment;
    if (variable.isNameDeclaration()) {
      //   var item = items_1[_i];
      //   const [a, b] = items_1[_i];
      variable.getOnlyChild().addChildToBack(element);
      assignment = variable;
    } else {
      //   item = items_1[_i];
      assignment = IR.exprResult(IR.assign(variable, element)).srcref(variable);
    }

    if (!body.isBlock()) {
      body = IR.block(body).srcref(body);
    }
    body.addChildToFront(assignment);

    Node init = IR.var(IR.name(counter), IR.number(0));
    init.addChildToBack(IR.name(array));
    init.getLastChild().addChildToBack(iterable);
    Node condition = IR.lt(IR.name(counter), IR.getprop(IR.name(array), "length"));
    Node loop = IR.forNode(init, condition, IR.inc(IR.name(counter), true), body);
    loop.srcref(forOf).takeCommentsFrom(forOf);
    forOf.replaceWith(loop);
  }
}
