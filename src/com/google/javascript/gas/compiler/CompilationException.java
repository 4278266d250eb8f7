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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;

/** Thrown when a source cannot be compiled. Carries every error reported before giving up. */
public class CompilationException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final ImmutableList<JSError> errors;

  CompilationException(ImmutableList<JSError> errors) {
    super(describe(errors));
    checkArgument(!errors.isEmpty(), "No errors to report");
    this.errors = errors;
  }

  /** Returns the errors, the first one being the cause of the message. */
  public ImmutableList<JSError> getErrors() {
    return errors;
  }

  private static String describe(ImmutableList<JSError> errors) {
    if (errors.isEmpty()) {
      return "";
    }
    String first = errors.get(0).format(CheckLevel.ERROR);
    return errors.size() == 1 ? first : first + " (and " + (errors.size() - 1) + " more)";
  }
}
