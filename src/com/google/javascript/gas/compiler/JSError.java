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

import com.google.common.base.Strings;
import com.google.javascript.gas.ast.Node;
import org.jspecify.annotations.Nullable;

/**
 * A problem found in a source file.
 *
 * @param type the kind of problem
 * @param description the message, with the arguments of the type's pattern filled in
 * @param sourceName the file the problem is in, if known
 * @param lineno one-based line, or -1
 * @param charno zero-based column, or -1
 * @param node the node the problem was found at, if any
 */
public record JSError(
    DiagnosticType type,
    String description,
    @Nullable String sourceName,
    int lineno,
    int charno,
    @Nullable Node node) {
  private static final int UNKNOWN = -1;

  public JSError {
    checkNotNull(type);
    checkNotNull(description);
  }

  /** Reports a problem with no position. */
  public static JSError make(DiagnosticType type, String... arguments) {
    return new JSError(type, type.formatMessage(arguments), null, UNKNOWN, UNKNOWN, null);
  }

  /** Reports a problem at a position of a file. */
  public static JSError make(
      String sourceName, int lineno, int charno, DiagnosticType type, String... arguments) {
    return new JSError(type, type.formatMessage(arguments), sourceName, lineno, charno, null);
  }

  /** Reports a problem at the position of a node. */
  public static JSError make(Node n, DiagnosticType type, String... arguments) {
    return new JSError(
        type,
        type.formatMessage(arguments),
        n.getSourceFileName(),
        n.getLineno(),
        n.getCharno(),
        n);
  }

  /** The level this error is reported at unless overridden. */
  public CheckLevel defaultLevel() {
    return type.level();
  }

  /**
   * Formats the error as {@code input.ts:3:4: ERROR - [JSC_KEY] Message.}, leaving out the parts
   * of the position that are unknown.
   *
   * @return the message, or null if {@code level} is off
   */
  public @Nullable String format(CheckLevel level) {
    if (!level.isOn()) {
      return null;
    }
    StringBuilder sb = new StringBuilder();
    if (!Strings.isNullOrEmpty(sourceName)) {
      sb.append(sourceName);
      if (lineno != UNKNOWN) {
        sb.append(':').append(lineno);
        if (charno != UNKNOWN) {
          sb.append(':').append(charno);
        }
      }
      sb.append(": ");
    }
    return sb.append(level)
        .append(" - [")
        .append(type.key())
        .append("] ")
        .append(description)
        .toString();
  }

  @Override
  public String toString() {
    return type.key() + ". " + description + " at " + Strings.nullToEmpty(sourceName)
        + ":" + lineno + ":" + charno;
  }
}
