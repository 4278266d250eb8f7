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
import com.google.common.collect.ImmutableSet;
import com.google.javascript.gas.ast.Node;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Inserts the runtime helpers that earlier passes asked for, such as {@code __extends}, at the top
 * of the script. Helpers keep the order of {@link #LIBRARIES}.
 */
public final class InjectRuntimeHelpers implements CompilerPass {
  private static final Logger logger = Logger.getLogger(InjectRuntimeHelpers.class.getName());

  /** The bundled helpers, by resource name. */
  static final ImmutableSet<String> LIBRARIES =
      ImmutableSet.of("extends", "decorate", "param", "export_star");

  private final Compiler compiler;

  InjectRuntimeHelpers(Compiler compiler) {
    this.compiler = checkNotNull(compiler);
  }

  @Override
  public void process(Node root) {
    Set<String> required = compiler.getRequiredLibraries();
    List<Node> helpers = new ArrayList<>();
    for (String library : LIBRARIES) {
      if (required.contains(library)) {
        logger.log(Level.FINE, "Injecting runtime library {0}", library);
        helpers.addAll(load(library));
      }
    }
    if (!helpers.isEmpty()) {
      NodeUtil.addToFrontOfScope(root, helpers);
    }
  }

  private ImmutableList<Node> load(String library) {
    Node script = compiler.parseRuntimeLibrary(library);
    NodeUtil.visitPreOrder(script, InjectRuntimeHelpers::markSynthetic);
    return ImmutableList.copyOf(script.detachChildren());
  }

  /** Helpers print without their comments and without source ranges of their own file. */
  private static void markSynthetic(Node n) {
    n.setSourceRange(Node.NO_POSITION, Node.NO_POSITION);
    n.setLeadingComments(ImmutableList.of());
    n.setTrailingComments(ImmutableList.of());
    n.setDanglingComments(ImmutableList.of());
  }
}
