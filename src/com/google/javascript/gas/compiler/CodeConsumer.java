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

/**
 * Abstracted consumer of the CodeGenerator output.
 *
 * <p>A statement is printed without its line terminator. The generator ends the line once the
 * statement and its trailing comments are out, so nested blocks never leave blank lines.
 *
 * @see CodeGenerator
 * @see CodePrinter
 */
abstract class CodeConsumer {

  /** Retrieve the last character of the last string sent to append. */
  abstract char getLastChar();

  /**
   * Appends a string to the code.
   *
   * <p>Do not directly append newlines with this method. Instead use {@link #startNewLine}.
   */
  abstract void append(String str);

  void appendBlockStart() {
    append("{");
  }

  void appendBlockEnd() {
    append("}");
  }

  void startNewLine() {}

  void endLine() {
    startNewLine();
  }

  void beginBlock() {
    appendBlockStart();
    endLine();
  }

  void endBlock() {
    appendBlockEnd();
  }

  /** Prints a block with no statements and no comments. */
  void emptyBlock() {
    maybeInsertSpace();
    append("{ }");
  }

  void listSeparator() {
    add(",");
  }

  /** Adds the semicolon of a simple statement. */
  void endStatement() {
    append(";");
  }

  void beginCaseBody() {
    append(":");
  }

  void endCaseBody() {}

  /** Prints a comment, which must not contain a line break unless it is a block comment. */
  void addComment(String text) {
    append(text);
  }

  void add(String newcode) {
    if (newcode.isEmpty()) {
      return;
    }

    char c = newcode.charAt(0);
    if ((isWordChar(c) || c == '\\') && isWordChar(getLastChar())) {
      // need space to separate. This is not pretty printing.
      // For example: "return foo;"
      append(" ");
    }

    append(newcode);
  }

  void appendOp(String op, boolean binOp) {
    append(op);
  }

  void addOp(String op, boolean binOp) {
    char first = op.charAt(0);
    char prev = getLastChar();

    if ((first == '+' || first == '-') && prev == first) {
      // This is not pretty printing. This is to prevent misparsing of
      // things like "x + ++y" or "x++ + ++y"
      append(" ");
    } else if (Character.isLetter(first) && isWordChar(prev)) {
      // Make sure there is a space after e.g. instanceof , typeof
      append(" ");
    } else if (prev == '-' && first == '>') {
      // Make sure that we don't emit -->
      append(" ");
    }

    appendOp(op, binOp);
  }

  /**
   * Adds a number literal. A negative number is handed over as a NEG node, so only the "- -4"
   * ambiguity of a literal that already starts with a minus needs a space.
   */
  void addNumber(String number) {
    if (number.startsWith("-") && getLastChar() == '-') {
      append(" ");
    }
    add(number);
  }

  void maybeInsertSpace() {}

  static boolean isWordChar(char ch) {
    return ch == '_' || ch == '$' || Character.isLetterOrDigit(ch);
  }

  /** Called when we're at the end of a file. */
  void endFile() {}
}
