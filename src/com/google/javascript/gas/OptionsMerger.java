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

import com.google.common.collect.ImmutableMap;
import com.google.javascript.gas.compiler.CompileRequest;
import com.google.javascript.gas.compiler.CompilerOptions;
import com.google.javascript.gas.compiler.Transformers;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Merges layers of configuration into one {@link CompileRequest}. Layers are applied left to
 * right, each one overriding the layers before it:
 *
 * <ul>
 *   <li>a compiler option that a layer sets replaces the earlier value, an unset one keeps it
 *   <li>module renames are merged key by key
 *   <li>transformer lists are concatenated
 * </ul>
 *
 * <p>The transpiler merges its defaults, the caller's options and its mandatory settings, in that
 * order, so that mandatory settings always win.
 */
public final class OptionsMerger {

  private OptionsMerger() {}

  /** Merges {@code layers} onto {@code base}, in order. */
  public static CompileRequest merge(CompileRequest base, CompileRequest... layers) {
    CompileRequest result = base;
    for (CompileRequest layer : layers) {
      result =
          CompileRequest.builder()
              .setOptions(mergeCompilerOptions(result.options(), layer.options()))
              .setRenamedDependencies(
                  mergeRenamedDependencies(
                      result.renamedDependencies(), layer.renamedDependencies()))
              .setTransformers(mergeTransformers(result.transformers(), layer.transformers()))
              .build();
    }
    return result;
  }

  /** Returns the layer a caller's options contribute. */
  public static CompileRequest toLayer(TranspileOptions options) {
    return CompileRequest.builder()
        .setOptions(options.compilerOptions())
        .setRenamedDependencies(options.renamedDependencies())
        .build();
  }

  /** Each option {@code override} sets replaces the one in {@code base}. */
  public static CompilerOptions mergeCompilerOptions(
      CompilerOptions base, CompilerOptions override) {
    CompilerOptions.Builder merged = base.toBuilder();
    if (override.target() != null) {
      merged.setTarget(override.target());
    }
    if (override.module() != null) {
      merged.setModule(override.module());
    }
    if (override.isolatedModules() != null) {
      merged.setIsolatedModules(override.isolatedModules());
    }
    if (override.noImplicitUseStrict() != null) {
      merged.setNoImplicitUseStrict(override.noImplicitUseStrict());
    }
    if (override.experimentalDecorators() != null) {
      merged.setExperimentalDecorators(override.experimentalDecorators());
    }
    if (override.removeComments() != null) {
      merged.setRemoveComments(override.removeComments());
    }
    if (override.newLine() != null) {
      merged.setNewLine(override.newLine());
    }
    return merged.build();
  }

  /** Keeps the entries of both maps; {@code override} wins for a key present in both. */
  public static ImmutableMap<String, String> mergeRenamedDependencies(
      Map<String, String> base, Map<String, String> override) {
    Map<String, String> merged = new LinkedHashMap<>(base);
    merged.putAll(override);
    return ImmutableMap.copyOf(merged);
  }

  /** Appends each list of {@code more} to the matching list of {@code base}. */
  public static Transformers mergeTransformers(Transformers base, Transformers more) {
    Transformers.Builder merged = base.toBuilder();
    merged.beforeBuilder().addAll(more.before());
    merged.afterBuilder().addAll(more.after());
    merged.substitutionsBuilder().addAll(more.substitutions());
    return merged.build();
  }
}
