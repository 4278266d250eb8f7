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
 * Lowers spread in array literals and call arguments.
 *
 * <pre>
 *   [a, ...b]      becomes   [a].concat(b)
 *   [...b]         becomes   b.slice()
 *   f(...b)        becomes   f.apply(void 0, b)
 *   o.m(a, ...b)   becomes   o.m.apply(o, [a].concat(b))
 * </pre>
 */
public final class RewriteSpread extends NodeTraversal.AbstractPostOrderCallback
    implements CompilerPass {
  private final Compiler compiler;
  private final TempVariables temps;

  RewriteSpread(Compiler compiler) {
    this.compiler = checkNotNull(compiler);
    this.temps = new TempVariables(compiler.getUniqueNameGenerator());
  }

  @Override
  public void process(Node root) {
    NodeTraversal.traverse(compiler, root, this);
  }

  @Override
  public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
    if (n.isArrayLit() && hasSpread(n)) {
      Node replacement = concatenate(n.detachChildren(), true).srcrefTree(n);
      n.replaceWith(replacement);
    } else if (n.isCall() && hasSpread(n)) {
      visitCall(n);
    }
  }

  private void visitCall(Node call) {
    Node callee = call.getFirstChild();
    List<Node> args = call.detachChildren();
    args.remove(0);
    Node receiver;
    if (callee.isGetProp() || callee.getToken() == Token.GETELEM) {
      Node object = callee.getFirstChild();
      if (NodeUtil.isSimpleOperand(object)) {
        receiver = object.cloneTree();
      } else {
        //   f().m(...a)   becomes   (_a = f()).m.apply(_a, a)
        Node temp = temps.declare(call);
        object.replaceWith(IR.assign(temp.cloneNode(), object.cloneTree()).srcref(object));
        receiver = temp;
      }
    } else if (callee.isSuper()) {
      TranspilationUtil.cannotConvert(compiler, call, "Spread in a super call is not supported.");
      return;
    } else {
      receiver = IR.undefined();
    }
    callee.detach();
    Node apply = IR.call(IR.getprop(callee, "apply"), receiver, concatenate(args, false));
    call.replaceWith(apply.srcrefTree(call));
  }

  /**
   * Builds one array out of elements and spreads. A copy is made of a lone spread only when
   * {@code copy} is set.
   */
  private static Node concatenate(List<Node> elements, boolean copy) {
    List<Node> parts = new ArrayList<>();
    List<Node> run = new ArrayList<>();
    for (Node element : elements) {
      if (element.isIterSpread()) {
        if (!run.isEmpty()) {
          parts.add(IR.arraylit(run));
          run = new ArrayList<>();
        }
        parts.add(element.removeFirstChild());
      } else {
        run.add(element);
      }
    }
    if (!run.isEmpty()) {
      parts.add(IR.arraylit(run));
    }
    Node first = parts.get(0);
    if (parts.size() == 1) {
      return copy ? IR.call(IR.getprop(first, "slice")) : first;
    }
    Node concat = IR.call(IR.getprop(first, "concat"));
    for (Node part : parts.subList(1, parts.size())) {
      concat.addChildToBack(part);
    }
    return concat;
  }

  private static boolean hasSpread(Node n) {
    for (Node child = n.getFirstChild(); child != null; child = child.getNext()) {
      if (child.isIterSpread()) {
        return true;
      }
    }
    return false;
  }
}
