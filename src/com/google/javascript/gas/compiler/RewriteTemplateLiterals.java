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
 * Converts untagged template literals to string concatenation, e.g. {@code `a${x}b`} to {@code "a"
 * + x + "b"}. Tagged templates are reported by {@link ReportUntranspilableFeatures}.
 */
public final class RewriteTemplateLiterals extends NodeTraversal.AbstractPostOrderCallback
    implements CompilerPass {
  private final Compiler compiler;

  RewriteTemplateLiterals(Compiler compiler) {
    this.compiler = checkNotNull(compiler);
  }

  @Override
  public void process(Node root) {
    NodeTraversal.traverse(compiler, root, this);
  }

  @Override
  public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
    if (n.getToken() == Token.TEMPLATELIT) {
      n.replaceWith(concatenate(n).srcrefTree(n));
    }
  }

  private static Node concatenate(Node template) {
    List<Node> operands = new ArrayList<>();
    for (Node part : template.childList()) {
      if (part.getToken() == Token.TEMPLATELIT_SUB) {
        operands.add(part.removeFirstChild());
      } else if (!part.getString().isEmpty()) {
        operands.add(IR.string(part.getString()));
      }
    }
    if (operands.isEmpty()) {
      return IR.string("");
    }
    // The first or second operand must be a string for + to concatenate.
    if (!operands.get(0).isStringLit()
        && (operands.size() == 1 || !operands.get(1).isStringLit())) {
      operands.add(0, IR.string(""));
    }
    Node result = operands.get(0);
    for (Node operand : operands.subList(1, operands.size())) {
      result = IR.add(result, operand);
    }
    return result;
  }
}
