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
import static com.google.common.base.Preconditions.checkState;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.io.CharStreams;
import com.google.javascript.gas.ast.Node;
import com.google.javascript.gas.ast.SourceFile;
import com.google.javascript.gas.compiler.CompilerOptions.ModuleKind;
import com.google.javascript.gas.compiler.parsing.Parser;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.ResourceBundle;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Compiler (and the other classes in this package) does the following:
 *
 * <ul>
 *   <li>parses a TypeScript or JavaScript source, erasing its types
 *   <li>runs the caller's before transforms
 *   <li>lowers module syntax and every construct newer than ES3
 *   <li>runs the caller's after transforms
 *   <li>prints the result, letting substitution hooks replace nodes as they are printed
 * </ul>
 *
 * <p>A Compiler compiles a single source and is then discarded.
 */
public class Compiler {
  private static final Logger logger = Logger.getLogger("com.google.javascript.gas");

  private static final String CONFIG_RESOURCE = "com.google.javascript.gas.compiler.CompilerConfig";

  /** Directory of the runtime helpers, relative to this class. */
  static final String RUNTIME_LIB_DIR = "js/";

  private final ErrorManager errorManager;

  private CompilerOptions options = CompilerOptions.empty();
  private ImmutableMap<String, String> renamedDependencies = ImmutableMap.of();
  private @Nullable UniqueNameGenerator nameGenerator;
  private final Set<String> requiredLibraries = new LinkedHashSet<>();
  private boolean used = false;

  /** Creates a Compiler that logs its diagnostics to the compiler logger. */
  public Compiler() {
    this(new LoggerErrorManager(logger));
  }

  public Compiler(ErrorManager errorManager) {
    this.errorManager = checkNotNull(errorManager);
  }

  /**
   * Compiles a source.
   *
   * @throws ParseException if the source has a syntax error
   * @throws EmitException if the source uses a construct that cannot be written in the output
   *     language
   */
  public Result compile(SourceFile input, CompileRequest request) {
    checkState(!used, "A Compiler compiles a single source");
    used = true;
    initOptions(request.options());
    renamedDependencies = request.renamedDependencies();

    Node root = parse(input);
    root = applyTransforms(root, request.transformers().before(), "before");
    lower(root);
    root = applyTransforms(root, request.transformers().after(), "after");

    SubstitutionChain substitutions =
        getBuiltinSubstitutions().thenAll(request.transformers().substitutions());
    String code = toSource(root, substitutions);
    errorManager.generateReport();
    return Result.create(code, root, errorManager.getWarnings());
  }

  void initOptions(CompilerOptions options) {
    this.options = checkNotNull(options);
  }

  public CompilerOptions getOptions() {
    return options;
  }

  public ErrorManager getErrorManager() {
    return errorManager;
  }

  /** Returns the replacement specifier for a module, or the specifier itself. */
  String getRenamedDependency(String specifier) {
    return renamedDependencies.getOrDefault(specifier, specifier);
  }

  UniqueNameGenerator getUniqueNameGenerator() {
    checkState(nameGenerator != null, "Nothing was parsed yet");
    return nameGenerator;
  }

  /** Reports a diagnostic at its default level. */
  public void report(JSError error) {
    CheckLevel level = error.defaultLevel();
    if (level.isOn()) {
      errorManager.report(level, error);
    }
  }

  /**
   * Parses the source into a SCRIPT.
   *
   * @throws ParseException if the source has a syntax error
   */
  Node parse(SourceFile input) {
    Node root = Parser.parse(input, errorManager);
    if (root == null || errorManager.hasHaltingErrors()) {
      errorManager.generateReport();
      throw new ParseException(errorManager.getErrors());
    }
    nameGenerator = new UniqueNameGenerator(NodeUtil.collectNames(root));
    return root;
  }

  private static Node applyTransforms(Node root, List<TreeTransform> transforms, String stage) {
    for (TreeTransform transform : transforms) {
      logger.log(Level.FINE, "Running {0} transform {1}", new Object[] {stage, transform});
      root = checkNotNull(transform.transform(root), "%s returned no tree", transform);
      checkState(root.isScript(), "%s did not return a SCRIPT", transform);
    }
    return root;
  }

  /**
   * Runs the lowering passes.
   *
   * @throws EmitException as soon as a pass reports an error
   */
  void lower(Node root) {
    for (CompilerPass pass : getLoweringPasses()) {
      logger.log(Level.FINE, "Running pass {0}", pass.getClass().getSimpleName());
      pass.process(root);
      if (errorManager.hasHaltingErrors()) {
        errorManager.generateReport();
        throw new EmitException(errorManager.getErrors());
      }
    }
  }

  ImmutableList<CompilerPass> getLoweringPasses() {
    ImmutableList.Builder<CompilerPass> passes = ImmutableList.builder();
    passes.add(new ReportUntranspilableFeatures(this));
    passes.add(new RewriteModules(this));
    if (!options.isIsolatedModules()) {
      passes.add(new RewriteConstEnums(this));
    }
    passes.add(new RewriteEnums(this));
    passes.add(new RewriteNamespaces(this));
    passes.add(new RewriteClasses(this));
    passes.add(new RewriteArrowFunctions(this));
    passes.add(new RewriteParameters(this));
    passes.add(new RewriteForOf(this));
    passes.add(new RewriteDestructuring(this));
    passes.add(new RewriteSpread(this));
    passes.add(new RewriteTemplateLiterals(this));
    passes.add(new RewriteOperators(this));
    passes.add(new RewriteBlockScopedDeclarations(this));
    passes.add(new InjectRuntimeHelpers(this));
    return passes.build();
  }

  /** The substitutions every compilation starts with. */
  SubstitutionChain getBuiltinSubstitutions() {
    return SubstitutionChain.empty().then(new ExportBindingSubstitution());
  }

  String toSource(Node root, SubstitutionChain substitutions) {
    return new CodePrinter.Builder(root)
        .setCompilerOptions(options)
        .setSubstitutions(substitutions)
        .build();
  }

  boolean isModuleLoweringEnabled() {
    return options.getModuleKind() == ModuleKind.NONE;
  }

  /** Records that the output needs a runtime helper, such as {@code extends}. */
  void ensureLibraryInjected(String resourceName) {
    checkState(
        InjectRuntimeHelpers.LIBRARIES.contains(resourceName), "Unknown library %s", resourceName);
    requiredLibraries.add(resourceName);
  }

  ImmutableSet<String> getRequiredLibraries() {
    return ImmutableSet.copyOf(requiredLibraries);
  }

  /** Parses a runtime helper bundled with the compiler. */
  Node parseRuntimeLibrary(String resourceName) {
    String path = RUNTIME_LIB_DIR + resourceName + ".js";
    String code = loadTextResource(path);
    Node script = Parser.parse(SourceFile.fromCode(path, code), errorManager);
    checkState(script != null, "Cannot parse runtime library %s", path);
    return script;
  }

  private static String loadTextResource(String path) {
    InputStream input = Compiler.class.getResourceAsStream(path);
    if (input == null) {
      throw new IllegalStateException("No such resource: " + path);
    }
    try (InputStreamReader reader = new InputStreamReader(input, UTF_8)) {
      return CharStreams.toString(reader);
    } catch (IOException e) {
      throw new IllegalStateException(e);
    }
  }

  /** Returns the compiler version, filtered into a resource at build time. */
  public static String getReleaseVersion() {
    ResourceBundle config = ResourceBundle.getBundle(CONFIG_RESOURCE);
    return config.getString("compiler.version");
  }
}
