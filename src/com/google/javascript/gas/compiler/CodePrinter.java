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

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.javascript.gas.ast.Node;
import java.util.List;

/** CodePrinter prints out JS code in a readable form, one statement per line. */
public final class CodePrinter {
  private CodePrinter() {}

  static class PrettyCodePrinter extends CodeConsumer {
    static final String INDENT = "    ";

    private final StringBuilder code = new StringBuilder(1024);
    private final String lineTerminator;
    private int lineLength = 0;
    private int indent = 0;

    PrettyCodePrinter(String lineTerminator) {
      this.lineTerminator = lineTerminator;
    }

    String getCode() {
      return code.toString();
    }

    @Override
    char getLastChar() {
      return code.length() > 0 ? code.charAt(code.length() - 1) : '\0';
    }

    /** Appends a string to the code, indenting it if it starts a line. */
    @Override
    void append(String str) {
      if (str.isEmpty()) {
        return;
      }
      if (lineLength == 0) {
        for (int i = 0; i < indent; i++) {
          code.append(INDENT);
          lineLength += INDENT.length();
        }
      }
      code.append(str);
      lineLength += str.length();
    }

    /** Adds a line terminator, unless the current line is still empty. */
    @Override
    void startNewLine() {
      if (lineLength > 0) {
        code.append(lineTerminator);
        lineLength = 0;
      }
    }

    @Override
    void appendBlockStart() {
      maybeInsertSpace();
      append("{");
      indent++;
    }

    @Override
    void appendBlockEnd() {
      endLine();
      indent--;
      append("}");
    }

    @Override
    void listSeparator() {
      append(", ");
    }

    @Override
    void beginCaseBody() {
      super.beginCaseBody();
      indent++;
      endLine();
    }

    @Override
    void endCaseBody() {
      super.endCaseBody();
      endLine();
      indent--;
    }

    @Override
    void appendOp(String op, boolean binOp) {
      if (getLastChar() != ' ' && binOp && op.charAt(0) != ',') {
        append(" ");
      }
      append(op);
      if (binOp) {
        append(" ");
      }
    }

    @Override
    void maybeInsertSpace() {
      if (lineLength > 0 && getLastChar() != ' ') {
        append(" ");
      }
    }

    /**
     * Re-indents the continuation lines of a block comment to the current indentation, keeping the
     * leading star of a JSDoc-style line aligned under the opening star.
     */
    @Override
    void addComment(String text) {
      List<String> lines = Splitter.on('\n').splitToList(text);
      append(CharMatcher.is('\r').trimTrailingFrom(lines.get(0)));
      for (String line : lines.subList(1, lines.size())) {
        startNewLine();
        String trimmed = CharMatcher.whitespace().trimFrom(line);
        append(trimmed.startsWith("*") ? " " + trimmed : trimmed);
      }
    }

    @Override
    void endFile() {
      startNewLine();
    }
  }

  /** Builds the text of a tree. */
  public static final class Builder {
    private final Node root;
    private CompilerOptions options = CompilerOptions.empty();
    private SubstitutionChain substitutions = SubstitutionChain.empty();

    /**
     * Sets the root node from which to generate the source code.
     *
     * @param node The root node.
     */
    public Builder(Node node) {
      root = checkNotNull(node);
    }

    /** Sets the output options from compiler options. */
    public Builder setCompilerOptions(CompilerOptions options) {
      this.options = checkNotNull(options);
      return this;
    }

    /** Sets the hooks that may replace nodes as they are printed. */
    public Builder setSubstitutions(SubstitutionChain substitutions) {
      this.substitutions = checkNotNull(substitutions);
      return this;
    }

    /** Generates the source code and returns it. Every line ends with a line terminator. */
    public String build() {
      PrettyCodePrinter printer = new PrettyCodePrinter(options.getNewLine().getTerminator());
      CodeGenerator generator = new CodeGenerator(printer, options, substitutions);
      generator.add(root);
      printer.endFile();
      return printer.getCode();
    }
  }
}
