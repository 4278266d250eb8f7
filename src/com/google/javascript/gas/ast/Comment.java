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

package com.google.javascript.gas.ast;

import static java.util.Objects.requireNonNull;

/**
 * A source comment kept with the node it is attached to.
 *
 * @param text The comment exactly as written, including its delimiters.
 * @param style Whether the comment is a line or a block comment.
 * @param start Offset of the first character of the comment, or -1 if synthetic.
 * @param end Offset just past the last character of the comment, or -1 if synthetic.
 */
public record Comment(String text, Style style, int start, int end) {

  /** Comment delimiters. */
  public enum Style {
    LINE,
    BLOCK
  }

  public Comment {
    requireNonNull(text, "text");
    requireNonNull(style, "style");
  }
}
