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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.javascript.gas.ast.Node;

/** Compilation results */
@AutoValue
public abstract class Result {

  /** The printed code. Every line, the last one included, ends with a line terminator. */
  public abstract String outputText();

  /** The SCRIPT the output was printed from. */
  public abstract Node root();

  public abstract ImmutableList<JSError> warnings();

  public static Result create(String outputText, Node root, ImmutableList<JSError> warnings) {
    return new AutoValue_Result(outputText, root, warnings);
  }
}
