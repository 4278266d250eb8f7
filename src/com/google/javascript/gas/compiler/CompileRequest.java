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
import com.google.common.collect.ImmutableMap;

/**
 * Everything the {@link Compiler} needs to know about one compilation besides the source: the
 * options, the module specifiers to rewrite and the caller's transformers.
 *
 * <p>Some settings are not options because the compiler always behaves one way. They are listed
 * here as constants.
 */
@AutoValue
public abstract class CompileRequest {

  /** Module specifiers are never resolved to files; each source is compiled on its own. */
  public static final boolean NO_RESOLVE = true;

  /** No library declaration files are loaded. */
  public static final boolean NO_LIB = true;

  /** The compiler emits code, never declaration files only. */
  public static final boolean EMIT_DECLARATION_ONLY = false;

  public abstract CompilerOptions options();

  /** Module specifiers to replace in {@code require} calls, keyed by the original specifier. */
  public abstract ImmutableMap<String, String> renamedDependencies();

  public abstract Transformers transformers();

  public abstract Builder toBuilder();

  public static Builder builder() {
    return new AutoValue_CompileRequest.Builder()
        .setOptions(CompilerOptions.empty())
        .setRenamedDependencies(ImmutableMap.of())
        .setTransformers(Transformers.empty());
  }

  /** A request with no options, renames or transformers. */
  public static CompileRequest empty() {
    return builder().build();
  }

  /** Builder for {@link CompileRequest}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setOptions(CompilerOptions options);

    public abstract Builder setRenamedDependencies(ImmutableMap<String, String> renames);

    public abstract Builder setTransformers(Transformers transformers);

    public abstract CompileRequest build();
  }
}
