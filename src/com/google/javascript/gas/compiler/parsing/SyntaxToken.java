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

package com.google.javascript.gas.compiler.parsing;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.javascript.gas.ast.Comment;
import org.jspecify.annotations.Nullable;

/**
 * A lexical token.
 *
 * @param kind What sort of token this is.
 * @param text The source text of the token; punctuators and identifiers are compared on it.
 * @param value The cooked value of string and template tokens, or the pattern of a regexp.
 * @param number The numeric value of a NUMBER token.
 * @param start Offset of the first character.
 * @param end Offset just past the last character.
 * @param newlineBefore Whether a line terminator separates this token from the previous one.
 * @param comments Comments between the previous token and this one.
 */
record SyntaxToken(
    Kind kind,
    String text,
    @Nullable String value,
    double number,
    int start,
    int end,
    boolean newlineBefore,
    ImmutableList<Comment> comments) {

  enum Kind {
    EOF,
    IDENTIFIER,
    PRIVATE_NAME,
    NUMBER,
    BIGINT,
    STRING,
    NO_SUBSTITUTION_TEMPLATE,
    TEMPLATE_HEAD,
    TEMPLATE_MIDDLE,
    TEMPLATE_TAIL,
    REGEXP,
    PUNCTUATOR,
  }

  SyntaxToken {
    requireNonNull(kind, "kind");
    requireNonNull(text, "text");
    requireNonNull(comments, "comments");
  }

  /** Whether this is the given punctuator. */
  boolean is(String punctuator) {
    return kind == Kind.PUNCTUATOR && text.equals(punctuator);
  }

  /** Whether this is an identifier, or a keyword, spelled {@code name}. */
  boolean isIdentifier(String name) {
    return kind == Kind.IDENTIFIER && text.equals(name);
  }

  boolean isIdentifierName() {
    return kind == Kind.IDENTIFIER;
  }

  @Override
  public String toString() {
    return kind == Kind.EOF ? "end of input" : "'" + text + "'";
  }
}
