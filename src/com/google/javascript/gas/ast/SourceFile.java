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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.Immutable;

/** A named piece of source text handed to the compiler. */
@Immutable
public final class SourceFile {
  /** Name used for sources given as plain strings. */
  public static final String DEFAULT_NAME = "input.ts";

  private final String name;
  private final String code;

  private SourceFile(String name, String code) {
    this.name = checkNotNull(name);
    this.code = checkNotNull(code);
  }

  public static SourceFile fromCode(String name, String code) {
    return new SourceFile(name, code);
  }

  public static SourceFile fromCode(String code) {
    return new SourceFile(DEFAULT_NAME, code);
  }

  public String getName() {
    return name;
  }

  public String getCode() {
    return code;
  }

  /** Returns the text between two offsets. */
  public String getText(int start, int end) {
    checkArgument(0 <= start && start <= end && end <= code.length(), "[%s, %s)", start, end);
    return code.substring(start, end);
  }

  @Override
  public String toString() {
    return name;
  }
}
