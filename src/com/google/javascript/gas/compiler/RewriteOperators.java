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
import org.jspecify.annotations.Nullable;

/**
 * Lowers the ES2016+ operators: exponentiation, nullish coalescing, optional chaining and the
 * logical assignment operators. An operand that is evaluated more than once is first stored in a
 * temporary.
 */
public final class RewriteOperators extends NodeTraversal.AbstractPostOrderCallback
    implements CompilerPass {
  private final Compiler compiler;
  private final TempVariables temps;

  RewriteOperators(Compiler compiler) {
    this.compiler = checkNotNull(compiler);
    this.temps = new TempVariables(compiler.getUniqueNameGenerator());
  }

  @Override
  public void process(Node root) {
    NodeTraversal.traverse(compiler, root, this);
  }

  @Override
  public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
    switch (n.getToken()) {
      case EXPONENT:
        replace(n, pow(n.removeFirstChild(), n.removeFirstChild()));
        break;
      case COALESCE:
        visitCoalesce(n);
        break;
      case ASSIGN_EXPONENT:
      case ASSIGN_OR:
      case ASSIGN_AND:
      case ASSIGN_COALESCE:
        visitCompoundAssign(n);
        break;
      case OPTCHAIN_GETPROP:
      case OPTCHAIN_GETELEM:
      case OPTCHAIN_CALL:
        if (isEndOfOptionalChain(n)) {
          visitOptionalChain(n);
        }
        break;
      default:
        break;
    }
  }

  /** {@code a ?? b} becomes {@code a !== null && a !== void 0 ? a : b}. */
  private void visitCoalesce(Node n) {
    Node left = n.getFirstChild();
    Node first;
    Node ref;
    if (left.isName() || left.isThis()) {
      first = left.detach();
      ref = left.cloneNode();
    } else {
      ref = temps.declare(n);
      first = IR.assign(ref.cloneNode(), left.detach());
    }
    Node right = n.removeFirstChild();
    replace(n, IR.hook(isNotNullish(first, ref), ref.cloneNode(), right));
  }

  private void visitCompoundAssign(Node n) {
    Token op = n.getToken();
    Node target = n.getFirstChild();
    Node value = n.getLastChild().detach();
    if (!target.isName() && !target.isGetProp() && target.getToken() != Token.GETELEM) {
      TranspilationUtil.cannotConvert(compiler, n, "Invalid assignment target.");
      return;
    }
    // The first use of the target stores any temporaries the later uses read.
    Node later = target.cloneTree();
    Node first = prepareTarget(n, target.detach(), later);
    Node replacement;
    switch (op) {
      case ASSIGN_EXPONENT:
        //   x **= y   becomes   x = Math.pow(x, y)
        replacement = IR.assign(first, pow(later, value));
        break;
      case ASSIGN_OR:
        //   x ||= y   becomes   x || (x = y)
        replacement = IR.or(first, IR.assign(later, value));
        break;
      case ASSIGN_AND:
        replacement = IR.and(first, IR.assign(later, value));
        break;
      case ASSIGN_COALESCE:
        {
          //   x ??= y   becomes   x !== null && x !== void 0 ? x : (x = y)
          Node ref;
          if (first.isName()) {
            ref = first.cloneNode();
          } else {
            ref = temps.declare(n);
            first = IR.assign(ref.cloneNode(), first);
          }
          replacement =
              IR.hook(isNotNullish(first, ref), ref.cloneNode(), IR.assign(later, value));
          break;
        }
      default:
        throw new IllegalStateException("Unexpected operator " + op);
    }
    replace(n, replacement);
  }

  /**
   * Stores the parts of a property target that are not simple operands in temporaries. Returns
   * the target with the temporaries assigned, and rewrites {@code later} to read them.
   */
  private Node prepareTarget(Node use, Node target, Node later) {
    if (target.isName()) {
      return target;
    }
    Node object = target.getFirstChild();
    if (!NodeUtil.isSimpleOperand(object)) {
      Node temp = temps.declare(use);
      later.getFirstChild().replaceWith(temp.cloneNode());
      object.replaceWith(IR.assign(temp, object.cloneTree()));
    }
    if (target.getToken() == Token.GETELEM) {
      Node index = target.getLastChild();
      if (!NodeUtil.isSimpleOperand(index)) {
        Node temp = temps.declare(use);
        later.getLastChild().replaceWith(temp.cloneNode());
        index.replaceWith(IR.assign(temp, index.cloneTree()));
      }
    }
    return target;
  }

  private static boolean isOptionalChainNode(Node n) {
    switch (n.getToken()) {
      case OPTCHAIN_GETPROP:
      case OPTCHAIN_GETELEM:
      case OPTCHAIN_CALL:
        return true;
      default:
        return false;
    }
  }

  /** Whether the chain that {@code n} belongs to does not continue into its parent. */
  private static boolean isEndOfOptionalChain(Node n) {
    Node parent = n.getParent();
    return parent == null
        || !isOptionalChainNode(parent)
        || !n.isFirstChildOf(parent)
        || parent.isOptionalChainStart();
  }

  /**
   * Lowers a whole optional chain, e.g. {@code a?.b.c} to {@code a === null || a === void 0 ?
   * void 0 : a.b.c}.
   */
  private void visitOptionalChain(Node end) {
    Node start = end;
    while (true) {
      convertToPlainAccess(start);
      if (start.isOptionalChainStart()) {
        break;
      }
      start = start.getFirstChild();
    }
    start.putBooleanProp(Node.Prop.START_OF_OPT_CHAIN, false);

    Node placeholder = IR.empty();
    end.replaceWith(placeholder);
    Node receiver = start.getFirstChild();
    Node test;
    if (start.isCall() && (receiver.isGetProp() || receiver.getToken() == Token.GETELEM)) {
      //   o.m?.(x)   becomes   (_a = o.m) === null || _a === void 0 ? void 0 : _a.call(o, x)
      Node object = receiver.getFirstChild();
      Node thisArg;
      if (NodeUtil.isSimpleOperand(object)) {
        thisArg = object.cloneTree();
      } else {
        thisArg = temps.declare(placeholder);
        object.replaceWith(IR.assign(thisArg.cloneNode(), object.cloneTree()));
      }
      Node callee = temps.declare(placeholder);
      test = isNullish(IR.assign(callee.cloneNode(), receiver.detach()), callee);
      start.addChildToFront(IR.getprop(callee.cloneNode(), "call"));
      thisArg.insertAfter(start.getFirstChild());
    } else if (receiver.isName() || receiver.isThis()) {
      test = isNullish(receiver.cloneTree(), receiver);
    } else {
      Node temp = temps.declare(placeholder);
      Node value = receiver.cloneTree();
      receiver.replaceWith(temp.cloneNode());
      test = isNullish(IR.assign(temp.cloneNode(), value), temp);
    }
    Node hook = IR.hook(test, IR.undefined(), end);
    placeholder.replaceWith(hook.srcrefTree(end));
  }

  private static void convertToPlainAccess(Node n) {
    switch (n.getToken()) {
      case OPTCHAIN_GETPROP:
        n.setToken(Token.GETPROP);
        break;
      case OPTCHAIN_GETELEM:
        n.setToken(Token.GETELEM);
        break;
      case OPTCHAIN_CALL:
        n.setToken(Token.CALL);
        break;
      default:
        throw new IllegalStateException("Not an optional chain: " + n);
    }
  }

  /** {@code first === null || ref === void 0} */
  private static Node isNullish(Node first, Node ref) {
    return IR.or(
        IR.sheq(first, IR.nullNode()), IR.sheq(ref.cloneNode(), IR.undefined()));
  }

  /** {@code first !== null && ref !== void 0} */
  private static Node isNotNullish(Node first, Node ref) {
    return IR.and(
        IR.shne(first, IR.nullNode()), IR.shne(ref.cloneNode(), IR.undefined()));
  }

  private static Node pow(Node base, Node exponent) {
    return IR.call(IR.getprop(IR.name("Math"), "pow"), base, exponent);
  }

  private static void replace(Node original, Node replacement) {
    original.replaceWith(replacement.srcrefTree(original));
  }
}
