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

import com.google.auto.value.AutoValue;
import com.google.javascript.gas.ast.Node;
import java.util.ArrayDeque;
import java.util.Deque;
import org.jspecify.annotations.Nullable;

/** Looks for an identifier named {@code exports} in a tree. */
final class ExportsReferenceScanner {
  static final String EXPORTS = "exports";

  private ExportsReferenceScanner() {}

  /** Scans a tree in preorder, stopping at the first occurrence. */
  static ScanResult scan(Node root) {
    Deque<Node> pending = new ArrayDeque<>();
    pending.push(root);
    while (!pending.isEmpty()) {
      Node n = pending.pop();
      if (EXPORTS.equals(NodeFilters.getIdentifierText(n))) {
        return ScanResult.found(n);
      }
      for (Node child = n.getLastChild(); child != null; child = child.getPrevious()) {
        pending.push(child);
      }
    }
    return ScanResult.notFound();
  }

  /** The outcome of a scan. */
  @AutoValue
  abstract static class ScanResult {
    /** The first {@code exports} identifier in preorder, if any. */
    abstract @Nullable Node firstReference();

    boolean referencesExports() {
      return firstReference() != null;
    }

    static ScanResult found(Node reference) {
      return new AutoValue_ExportsReferenceScanner_ScanResult(reference);
    }

    static ScanResult notFound() {
      return new AutoValue_ExportsReferenceScanner_ScanResult(null);
    }
  }
}
