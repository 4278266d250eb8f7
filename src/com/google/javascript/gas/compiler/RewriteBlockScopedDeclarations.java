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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Converts {@code let} and {@code const} to {@code var}.
 *
 * <p>A declaration in a nested block whose name is also used elsewhere in its function is renamed
 * first, so that hoisting it does not capture other references:
 *
 * <pre>
 *   let x = 1;
 *   if (c) {
 *     let x = 2;
 *   }
 * </pre>
 *
 * becomes {@code var x = 1; if (c) { var x_1 = 2; }}. A {@code let} without an initializer
 * inside a loop body is initialized to {@code void 0} so that every iteration starts fresh. An
 * optional catch binding gets a temporary name.
 */
public final class RewriteBlockScopedDeclarations implements CompilerPass {
  private final Compiler compiler;
  private final UniqueNameGenerator nameGenerator;

  RewriteBlockScopedDeclarations(Compiler compiler) {
    this.compiler = checkNotNull(compiler);
    this.nameGenerator = compiler.getUniqueNameGenerator();
  }

  @Override
  public void process(Node root) {
    List<Node> scopeRoots = new ArrayList<>();
    NodeUtil.visitPreOrder(
        root,
        n -> {
          if (n.isScript() || n.isFunction()) {
            scopeRoots.add(n);
          }
        });
    for (Node scopeRoot : scopeRoots) {
      renameShadowingDeclarations(scopeRoot);
    }
    NodeUtil.visitPreOrder(root, this::lower);
  }

  private void lower(Node n) {
    if (n.isLet() || n.isConst()) {
      if (n.isLet() && isInLoopBody(n)) {
        for (Node name : n.children()) {
          if (name.isName() && !name.hasChildren()) {
            name.addChildToBack(IR.undefined().srcref(name));
          }
        }
      }
      n.setToken(Token.VAR);
    } else if (n.isCatch() && n.getFirstChild().isEmpty()) {
      n.getFirstChild().replaceWith(IR.name(nameGenerator.getTempName()).srcref(n));
    }
  }

  private void renameShadowingDeclarations(Node scopeRoot) {
    Node scopeBody = scopeRoot.isScript() ? scopeRoot : scopeRoot.getLastChild();
    if (!scopeBody.isBlock() && !scopeBody.isScript()) {
      return;
    }
    List<Node> blocks = new ArrayList<>();
    collectBlockScopes(scopeBody, blocks);
    Set<String> claimed = new LinkedHashSet<>();
    for (Node block : blocks) {
      for (Node declaration : getBlockScopedDeclarations(block)) {
        Set<String> names = new LinkedHashSet<>();
        for (Node lhs : declaration.children()) {
          NodeUtil.collectLhsNames(lhs, names);
        }
        for (String name : names) {
          if (claimed.contains(name) || isUsedOutside(scopeRoot, block, name)) {
            String newName = nameGenerator.getUniqueName(name);
            renameAll(block, name, newName);
            claimed.add(newName);
          } else {
            claimed.add(name);
          }
        }
      }
    }
  }

  /** Collects the blocks and loops below a scope body, outermost first. */
  private static void collectBlockScopes(Node n, List<Node> blocks) {
    for (Node child = n.getFirstChild(); child != null; child = child.getNext()) {
      if (child.isFunction()) {
        continue;
      }
      if ((child.isBlock() || isLoop(child)) && !getBlockScopedDeclarations(child).isEmpty()) {
        blocks.add(child);
      }
      collectBlockScopes(child, blocks);
    }
  }

  private static List<Node> getBlockScopedDeclarations(Node block) {
    List<Node> declarations = new ArrayList<>();
    if (isLoop(block)) {
      Node init = block.getFirstChild();
      if (init.isLet() || init.isConst()) {
        declarations.add(init);
      }
      return declarations;
    }
    for (Node child = block.getFirstChild(); child != null; child = child.getNext()) {
      if (child.isLet() || child.isConst()) {
        declarations.add(child);
      }
    }
    return declarations;
  }

  /**
   * Whether {@code name} appears outside {@code block}, other than as a reference to a different
   * block-scoped declaration.
   */
  private static boolean isUsedOutside(Node scopeRoot, Node block, String name) {
    return NodeUtil.has(
        scopeRoot,
        n ->
            n.isName()
                && n.getString().equals(name)
                && !isBoundInOtherBlock(n, block, scopeRoot),
        n -> n != block);
  }

  private static boolean isBoundInOtherBlock(Node nameNode, Node block, Node scopeRoot) {
    String name = nameNode.getString();
    Node scopeBody = scopeRoot.isScript() ? scopeRoot : scopeRoot.getLastChild();
    for (Node n = nameNode.getParent(); n != null && n != scopeBody; n = n.getParent()) {
      if ((n.isBlock() || isLoop(n)) && !block.isDescendantOf(n)) {
        for (Node declaration : getBlockScopedDeclarations(n)) {
          Set<String> names = new LinkedHashSet<>();
          for (Node lhs : declaration.children()) {
            NodeUtil.collectLhsNames(lhs, names);
          }
          if (names.contains(name)) {
            return true;
          }
        }
      }
    }
    return false;
  }

  private static void renameAll(Node root, String name, String newName) {
    NodeUtil.visitPreOrder(
        root,
        n -> {
          if (n.isName() && n.getString().equals(name)) {
            n.setString(newName);
          }
        });
  }

  private static boolean isInLoopBody(Node declaration) {
    for (Node n = declaration.getParent(); n != null; n = n.getParent()) {
      if (n.isFunction() || n.isScript()) {
        return false;
      }
      if ((isLoop(n) || n.getToken() == Token.WHILE || n.getToken() == Token.DO)
          && declaration.getParent() != n) {
        return true;
      }
    }
    return false;
  }

  private static boolean isLoop(Node n) {
    switch (n.getToken()) {
      case FOR:
      case FOR_IN:
      case FOR_OF:
        return true;
      default:
        return false;
    }
  }
}
