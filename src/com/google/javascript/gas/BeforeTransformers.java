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

package com.google.javascript.gas;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.javascript.gas.ast.IR;
import com.google.javascript.gas.ast.Node;
import com.google.javascript.gas.compiler.TreeTransform;
import java.util.function.Predicate;

/** Factories for the transforms the transpiler runs on the parsed input, before lowering. */
public final class BeforeTransformers {

  private BeforeTransformers() {}

  /**
   * Returns a transform that replaces every node matching {@code filter} with a placeholder that
   * prints as a line comment holding the node's source. Children of a replaced node are not
   * visited.
   */
  public static TreeTransform commentOut(Predicate<Node> filter) {
    checkNotNull(filter);
    return new TreeTransform() {
      @Override
      public Node transform(Node root) {
        commentOutMatches(root, filter);
        return root;
      }

      @Override
      public String toString() {
        return "commentOut(" + filter + ")";
      }
    };
  }

  private static void commentOutMatches(Node n, Predicate<Node> filter) {
    for (Node child = n.getFirstChild(); child != null; ) {
      Node next = child.getNext();
      if (filter.test(child)) {
        child.replaceWith(createCommentedStatement(child));
      } else {
        commentOutMatches(child, filter);
      }
      child = next;
    }
  }

  /**
   * Creates the placeholder for a statement. The comment is the statement's source text with each
   * line break written as the two characters {@code \n}, so that it stays on one line.
   */
  static Node createCommentedStatement(Node statement) {
    String text = statement.getSourceText();
    checkState(text != null, "No source text for %s", statement);
    Node placeholder = IR.notEmitted(statement).srcref(statement);
    placeholder.setSyntheticComment(escapeLineBreaks(text));
    placeholder.setLeadingComments(statement.getLeadingComments());
    placeholder.setTrailingComments(statement.getTrailingComments());
    return placeholder;
  }

  static String escapeLineBreaks(String text) {
    return text.replace("\r\n", "\\n").replace("\n", "\\n").replace("\r", "\\n");
  }

  /**
   * Returns a transform that flags every node matching {@code filter} so that the printer's
   * substitutions leave it alone, unless the node names an enum declaration.
   */
  public static TreeTransform noSubstitution(Predicate<Node> filter) {
    checkNotNull(filter);
    return new TreeTransform() {
      @Override
      public Node transform(Node root) {
        markNoSubstitution(root, filter);
        return root;
      }

      @Override
      public String toString() {
        return "noSubstitution(" + filter + ")";
      }
    };
  }

  private static void markNoSubstitution(Node n, Predicate<Node> filter) {
    Node parent = n.getParent();
    if (filter.test(n) && !(parent != null && parent.isEnum())) {
      n.setNoSubstitution(true);
    }
    for (Node child = n.getFirstChild(); child != null; child = child.getNext()) {
      markNoSubstitution(child, filter);
    }
  }
}
