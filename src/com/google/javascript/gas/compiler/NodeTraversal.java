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
import org.jspecify.annotations.Nullable;

/**
 * Walks a tree, offering each node to a {@link Callback} before its children (to decide whether
 * to descend) and after them (to rewrite it).
 */
public class NodeTraversal {
  private final Compiler compiler;
  private final Callback callback;

  /** Receives the nodes of a traversal. */
  public interface Callback {
    /**
     * Called before the children of {@code n}. Returning false skips both the children and the
     * call to {@link #visit} for {@code n}.
     */
    boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent);

    /**
     * Called after the children of {@code n}. The callback may replace or detach {@code n}, but not
     * its ancestors.
     */
    void visit(NodeTraversal t, Node n, @Nullable Node parent);
  }

  /** A callback that descends everywhere and only acts in {@link #visit}. */
  public abstract static class AbstractPostOrderCallback implements Callback {
    @Override
    public final boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
      return true;
    }
  }

  /** A callback that only acts in {@link #shouldTraverse}. */
  public abstract static class AbstractPreOrderCallback implements Callback {
    @Override
    public final void visit(NodeTraversal t, Node n, @Nullable Node parent) {}
  }

  private NodeTraversal(Compiler compiler, Callback callback) {
    this.compiler = checkNotNull(compiler);
    this.callback = checkNotNull(callback);
  }

  /** Walks the subtree rooted at {@code root}. */
  public static void traverse(Compiler compiler, Node root, Callback callback) {
    new NodeTraversal(compiler, callback).walk(root, root.getParent());
  }

  private void walk(Node n, @Nullable Node parent) {
    if (!callback.shouldTraverse(this, n, parent)) {
      return;
    }
    Node child = n.getFirstChild();
    while (child != null) {
      // Read ahead: the visit may replace the child.
      Node next = child.getNext();
      walk(child, n);
      child = next;
    }
    callback.visit(this, n, parent);
  }

  /** Reports a diagnostic at {@code n}. */
  public void report(Node n, DiagnosticType type, String... arguments) {
    compiler.report(JSError.make(n, type, arguments));
  }
}
