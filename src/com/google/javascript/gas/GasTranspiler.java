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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.annotations.VisibleForTesting;
import com.google.javascript.gas.ast.SourceFile;
import com.google.javascript.gas.compiler.CompileRequest;
import com.google.javascript.gas.compiler.Compiler;
import com.google.javascript.gas.compiler.CompilerOptions;
import com.google.javascript.gas.compiler.CompilerOptions.LanguageMode;
import com.google.javascript.gas.compiler.CompilerOptions.ModuleKind;
import com.google.javascript.gas.compiler.ParseException;
import com.google.javascript.gas.compiler.Result;
import com.google.javascript.gas.compiler.Transformers;

/**
 * Transpiles a TypeScript or JavaScript file into a script that runs in Google Apps Script.
 *
 * <p>Besides lowering the code to ES3, the transpiler:
 *
 * <ul>
 *   <li>comments out import declarations and {@code export ... from} declarations, which editors
 *       add for namespaces the host provides globally
 *   <li>keeps the spelling of every identifier, so that references to exported variables are not
 *       rewritten to {@code exports.x}
 *   <li>drops the {@code exports.__esModule} marker and {@code exports["default"] = x;}
 *   <li>declares {@code exports} and {@code module} when the output refers to {@code exports}
 * </ul>
 *
 * <p>Example:
 *
 * <pre>{@code
 * String code = new GasTranspiler().transform("export const pi = 3.141592;");
 * }</pre>
 *
 * <p>A GasTranspiler holds no state between calls and can be shared between threads.
 */
public final class GasTranspiler {

  /** Options used unless the caller overrides them. */
  public static final CompilerOptions DEFAULT_OPTIONS =
      CompilerOptions.builder()
          .setTarget(LanguageMode.ECMASCRIPT3)
          .setNoImplicitUseStrict(true)
          .setExperimentalDecorators(true)
          .build();

  /**
   * Options the caller cannot override. Together with {@link CompileRequest#NO_RESOLVE}, {@link
   * CompileRequest#NO_LIB} and {@link CompileRequest#EMIT_DECLARATION_ONLY}, each file is
   * compiled on its own to an ES3 script without module syntax.
   */
  public static final CompilerOptions MANDATORY_OPTIONS =
      CompilerOptions.builder()
          .setTarget(LanguageMode.ECMASCRIPT3)
          .setModule(ModuleKind.NONE)
          .setIsolatedModules(true)
          .build();

  private final ReleaseInfo releaseInfo;

  public GasTranspiler() {
    this(ReleaseInfo.load());
  }

  public GasTranspiler(ReleaseInfo releaseInfo) {
    this.releaseInfo = checkNotNull(releaseInfo);
  }

  /** Transpiles a source with the default options. */
  public String transform(String source) {
    return transform(source, TranspileOptions.empty());
  }

  /**
   * Transpiles a source with options given as JSON.
   *
   * @throws IllegalArgumentException if the options are invalid
   */
  public String transform(String source, String optionsJson) {
    return transform(source, TranspileOptions.fromJson(optionsJson));
  }

  /**
   * Transpiles a source. The output starts with a banner line naming the transpiler and compiler
   * versions.
   *
   * @throws ParseException if the source cannot be parsed
   * @throws com.google.javascript.gas.compiler.EmitException if the source uses a construct that
   *     cannot be written in ES3
   */
  public String transform(String source, TranspileOptions options) {
    Result result = compile(source, options);
    return releaseInfo.getBanner() + "\n" + result.outputText();
  }

  /** Transpiles a source, returning the output without a banner along with its tree. */
  public Result compile(String source, TranspileOptions options) {
    checkNotNull(source);
    CompileRequest request = createRequest(options);
    return new Compiler().compile(SourceFile.fromCode(source), request);
  }

  /**
   * Merges the defaults, the caller's options and the mandatory settings, in that order. The
   * transformers are created anew for each request.
   */
  @VisibleForTesting
  static CompileRequest createRequest(TranspileOptions options) {
    return OptionsMerger.merge(
        CompileRequest.empty(),
        CompileRequest.builder().setOptions(DEFAULT_OPTIONS).build(),
        OptionsMerger.toLayer(options),
        createMandatoryLayer());
  }

  private static CompileRequest createMandatoryLayer() {
    Transformers transformers =
        Transformers.builder()
            .addBefore(BeforeTransformers.noSubstitution(NodeFilters::isIdentifier))
            .addBefore(BeforeTransformers.commentOut(NodeFilters::isExportFrom))
            .addBefore(BeforeTransformers.commentOut(NodeFilters::isImport))
            .addSubstitution(AfterTransformers.suppressModuleMarker())
            .addSubstitution(AfterTransformers.suppressDefaultExport())
            .addSubstitution(AfterTransformers.suppressExportFrom())
            .addAfter(new ExportPreambleInjector())
            .build();
    return CompileRequest.builder()
        .setOptions(MANDATORY_OPTIONS)
        .setTransformers(transformers)
        .build();
  }
}
