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

import com.google.common.collect.ImmutableList;
import com.google.javascript.gas.ast.IR;
import com.google.javascript.gas.ast.Node;
import com.google.javascript.gas.compiler.TreeTransform;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Declares {@code exports} and {@code module} at the top of a script that refers to
 * {@code exports}, since the Apps Script host has neither:
 *
 * <pre>
 * var exports = exports || {};
 * var module = module || { exports: exports };
 * </pre>
 */
public final class ExportPreambleInjector implements TreeTransform {
  private static final Logger logger = Logger.getLogger(ExportPreambleInjector.class.getName());

  @Override
  public Node transform(Node root) {
    ExportsReferenceScanner.ScanResult result = ExportsReferenceScanner.scan(root);
    if (result.referencesExports()) {
      logger.log(Level.FINE, "Injecting export preamble for {0}", root.getSourceFileName());
      root.addChildrenToFront(createPreamble());
    }
    return root;
  }

  /** Builds the two preamble statements. */
  static ImmutableList<Node> createPreamble() {
    String exports = ExportsReferenceScanner.EXPORTS;
    Node exportsVar = IR.var(IR.name(exports), IR.or(IR.name(exports), IR.objectlit()));
    Node moduleObject = IR.objectlit(IR.stringKey(exports, IR.name(exports)));
    Node moduleVar = IR.var(IR.name("module"), IR.or(IR.name("module"), moduleObject));
    return ImmutableList.of(exportsVar, moduleVar);
  }

  @Override
  public String toString() {
    return "ExportPreambleInjector";
  }
}
