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

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.javascript.gas.ast.IR;
import com.google.javascript.gas.ast.Node;
import com.google.javascript.gas.ast.Token;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Rewrites the import and export declarations of a module.
 *
 * <p>When modules are lowered, the script becomes a CommonJS module:
 *
 * <pre>
 *   import {a} from "./m";         var m_1 = require("./m");   (a prints as m_1.a)
 *   export const pi = 3.14;        exports.pi = 3.14;          (pi prints as exports.pi)
 *   export function f() {}         function f() {}
 *                                  exports.f = f;
 *   export default 1;              var _default = 1;
 *                                  exports["default"] = _default;
 *   export * from "./m";           __export(require("./m"));
 * </pre>
 *
 * A synthetic {@code exports.__esModule = true;} statement is inserted first. Otherwise the module
 * syntax is kept, minus the parts that only name types or unused imports.
 *
 * <p>{@code import x = ...} aliases become variables in every script. Exported enums and
 * namespaces are left to {@link RewriteEnums} and {@link RewriteNamespaces}.
 */
public final class RewriteModules implements CompilerPass {
  private static final Logger logger = Logger.getLogger(RewriteModules.class.getName());

  static final DiagnosticType EXPORT_ASSIGNMENT_IN_ES_MODULE =
      DiagnosticType.error(
          "JSC_EXPORT_ASSIGNMENT_IN_ES_MODULE",
          "Export assignment cannot be used when targeting ECMAScript modules.");

  static final DiagnosticType IMPORT_REQUIRE_IN_ES_MODULE =
      DiagnosticType.error(
          "JSC_IMPORT_REQUIRE_IN_ES_MODULE",
          "Import assignment cannot be used when targeting ECMAScript modules.");

  private static final CharMatcher IDENTIFIER_PART =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.inRange('0', '9'))
          .or(CharMatcher.is('_'))
          .precomputed();

  private final Compiler compiler;
  private final UniqueNameGenerator nameGenerator;

  /** Names read anywhere in the script, computed before anything is rewritten. */
  private Set<String> referencedNames = new HashSet<>();

  RewriteModules(Compiler compiler) {
    this.compiler = checkNotNull(compiler);
    this.nameGenerator = compiler.getUniqueNameGenerator();
  }

  @Override
  public void process(Node root) {
    checkState(root.isScript(), root);
    referencedNames = collectReferencedNames(root);
    rewriteImportAliases(root);
    if (!root.isModuleScript()) {
      return;
    }
    if (compiler.isModuleLoweringEnabled()) {
      rewriteToCommonJs(root);
    } else {
      rewriteEsModule(root);
    }
  }

  // ==========================================================================
  // Name usage

  private static Set<String> collectReferencedNames(Node root) {
    Set<String> names = new HashSet<>();
    collectReferencedNames(root, names);
    return names;
  }

  /** Decorators are kept beside the tree until classes are lowered, so they are visited here. */
  private static void collectReferencedNames(Node root, Set<String> names) {
    NodeUtil.visitPreOrder(
        root,
        n -> {
          if (n.isName() && isReference(n)) {
            names.add(n.getString());
          }
          for (Node decorator : n.getDecorators()) {
            collectReferencedNames(decorator, names);
          }
        });
  }

  private static boolean isReference(Node name) {
    Node parent = name.getParent();
    if (parent == null || name.getString().isEmpty() || NodeUtil.isDeclarationName(name)) {
      return false;
    }
    switch (parent.getToken()) {
      case IMPORT:
      case IMPORT_SPEC:
        return false;
      case EXPORT_SPEC:
        // export {a as b}, but not export {a as b} from "m".
        return name.isFirstChildOf(parent) && parent.getGrandparent().hasOneChild();
      case EXPORT:
        return !parent.isExportAllFrom();
      default:
        return true;
    }
  }

  private boolean isReferenced(String name) {
    return referencedNames.contains(name);
  }

  // ==========================================================================
  // import x = ...

  private void rewriteImportAliases(Node root) {
    List<Node> aliases = new ArrayList<>();
    NodeUtil.visitPreOrder(
        root,
        n -> {
          if (n.isImportEquals()) {
            aliases.add(n);
          }
        });
    for (Node alias : aliases) {
      visitImportEquals(alias);
    }
  }

  private void visitImportEquals(Node importEquals) {
    Node parent = importEquals.getParent();
    boolean exported = parent.isExport();
    Node statement = exported ? parent : importEquals;
    Node name = importEquals.getFirstChild();
    Node target = importEquals.getLastChild();
    if (importEquals.isTypeOnly() || (!exported && !isReferenced(name.getString()))) {
      logger.log(Level.FINE, "Eliding unused import alias {0}", name.getString());
      statement.detach();
      return;
    }
    if (target.isCall()) {
      if (!compiler.isModuleLoweringEnabled()) {
        compiler.report(JSError.make(importEquals, IMPORT_REQUIRE_IN_ES_MODULE));
        return;
      }
      target = createRequireCall(target.getLastChild());
    } else {
      target = target.detach();
    }
    Node var = IR.var(name.detach(), target).srcref(importEquals);
    var.takeCommentsFrom(importEquals);
    importEquals.replaceWith(var);
  }

  // ==========================================================================
  // CommonJS

  private void rewriteToCommonJs(Node script) {
    boolean hasExportAssignment = false;
    for (Node child = script.getFirstChild(); child != null; ) {
      Node next = child.getNext();
      switch (child.getToken()) {
        case IMPORT:
          visitImport(script, child);
          break;
        case EXPORT:
          visitExport(script, child);
          break;
        case EXPORT_ASSIGN:
          visitExportAssignment(child);
          hasExportAssignment = true;
          break;
        default:
          break;
      }
      child = next;
    }
    if (!hasExportAssignment) {
      NodeUtil.addToFrontOfScope(script, ImmutableList.of(createEsModuleMarker()));
    }
    if (compiler.getOptions().shouldEmitUseStrict()
        && !TranspilationUtil.hasUseStrictDirective(script)) {
      script.addChildToFront(IR.exprResult(IR.string("use strict")));
    }
  }

  /** Creates {@code exports.__esModule = true;}, with no source position. */
  static Node createEsModuleMarker() {
    return IR.exprResult(
        IR.assign(IR.getprop(IR.name("exports"), "__esModule"), IR.trueNode()));
  }

  private void visitImport(Node script, Node importDecl) {
    Node defaultBinding = importDecl.getFirstChild();
    Node namedBindings = importDecl.getSecondChild();
    Node source = importDecl.getLastChild();
    if (importDecl.isTypeOnly()) {
      importDecl.detach();
      return;
    }
    if (defaultBinding.isEmpty() && namedBindings.isEmpty()) {
      // import "m";
      replaceStatement(importDecl, IR.exprResult(createRequireCall(source)));
      return;
    }
    if (!isImportUsed(importDecl)) {
      logger.log(Level.FINE, "Eliding unused import of {0}", source.getString());
      importDecl.detach();
      return;
    }

    String moduleVar;
    if (namedBindings.getToken() == Token.IMPORT_STAR) {
      moduleVar = namedBindings.getString();
    } else {
      moduleVar = nameGenerator.getUniqueName(getModuleBaseName(source.getString()));
    }
    if (defaultBinding.isName()) {
      script.addExportBinding(
          defaultBinding.getString(), IR.getprop(IR.name(moduleVar), "default"));
    }
    if (namedBindings.getToken() == Token.IMPORT_SPECS) {
      for (Node spec : namedBindings.children()) {
        Node imported = spec.getFirstChild();
        String local = spec.getSecondChild().getString();
        script.addExportBinding(local, createPropertyAccess(IR.name(moduleVar), imported));
      }
    }
    replaceStatement(importDecl, IR.var(IR.name(moduleVar), createRequireCall(source)));
  }

  private boolean isImportUsed(Node importDecl) {
    Node defaultBinding = importDecl.getFirstChild();
    if (defaultBinding.isName() && isReferenced(defaultBinding.getString())) {
      return true;
    }
    Node namedBindings = importDecl.getSecondChild();
    if (namedBindings.getToken() == Token.IMPORT_STAR) {
      return isReferenced(namedBindings.getString());
    }
    for (Node spec : namedBindings.children()) {
      if (isReferenced(spec.getSecondChild().getString())) {
        return true;
      }
    }
    return false;
  }

  private void visitExport(Node script, Node export) {
    if (export.isTypeOnly()) {
      export.detach();
      return;
    }
    if (export.isExportAllFrom()) {
      visitExportStar(export);
    } else if (export.isExportDefault()) {
      visitExportDefault(export);
    } else if (export.getFirstChild().getToken() == Token.EXPORT_SPECS) {
      if (export.hasTwoChildren()) {
        visitExportFrom(export);
      } else {
        visitExportSpecs(script, export);
      }
    } else {
      visitExportDeclaration(script, export);
    }
  }

  private void visitExportStar(Node export) {
    Node binding = export.getFirstChild();
    Node require = createRequireCall(export.getLastChild());
    Node statement;
    if (binding.isEmpty()) {
      // export * from "m";
      compiler.ensureLibraryInjected("export_star");
      statement = IR.exprResult(IR.call(IR.name("__export"), require));
    } else {
      // export * as ns from "m";
      statement = IR.exprResult(IR.assign(createExportsAccess(binding), require));
    }
    replaceStatement(export, statement);
  }

  private void visitExportFrom(Node export) {
    //   export {x, y as z} from "m";
    List<Node> statements = new ArrayList<>();
    for (Node spec : export.getFirstChild().children()) {
      Node require = createRequireCall(export.getLastChild());
      Node value = createPropertyAccess(require, spec.getFirstChild());
      statements.add(IR.exprResult(IR.assign(createExportsAccess(spec.getSecondChild()), value)));
    }
    replaceStatement(export, statements);
  }

  private void visitExportSpecs(Node script, Node export) {
    //   export {a, b as c};
    Set<String> values = NodeUtil.getHoistedNames(script);
    List<Node> statements = new ArrayList<>();
    for (Node spec : export.getFirstChild().children()) {
      Node local = spec.getFirstChild();
      if (!local.isName() || !values.contains(local.getString())) {
        // Only names a type.
        continue;
      }
      statements.add(
          IR.exprResult(
              IR.assign(createExportsAccess(spec.getSecondChild()), local.cloneNode())));
    }
    replaceStatement(export, statements);
  }

  private void visitExportDefault(Node export) {
    Node declaration = export.getFirstChild();
    List<Node> statements = new ArrayList<>();
    Node value;
    if (declaration.isFunction() || declaration.isClass()) {
      //   export default function f() {}
      //   export default class {}
      Node name = declaration.getFirstChild();
      if (!name.isName() || name.getString().isEmpty()) {
        Node generated = IR.name(nameGenerator.getUniqueName("default"));
        name.replaceWith(generated);
        name = generated;
      }
      statements.add(declaration.detach());
      value = name.cloneNode();
    } else if (declaration.isName()) {
      //   export default x;
      value = declaration.detach();
    } else {
      //   export default <expression>;
      String temp = nameGenerator.getAlias("_default");
      statements.add(IR.var(IR.name(temp), declaration.detach()).srcref(export));
      value = IR.name(temp);
    }
    statements.add(
        IR.exprResult(IR.assign(IR.getprop(IR.name("exports"), "default"), value))
            .srcref(export));
    replaceStatement(export, statements);
  }

  private void visitExportDeclaration(Node script, Node export) {
    Node declaration = export.getFirstChild();
    switch (declaration.getToken()) {
      case VAR:
      case LET:
      case CONST:
        visitExportNameDeclaration(script, export, declaration);
        break;
      case FUNCTION:
      case CLASS:
        {
          //   export function f() {}
          Node name = declaration.getFirstChild();
          Node assign =
              IR.exprResult(IR.assign(createExportsAccess(name), name.cloneNode()))
                  .srcref(export);
          replaceStatement(export, ImmutableList.of(declaration.detach(), assign));
          break;
        }
      case ENUM:
      case NAMESPACE:
        // Lowered along with the declaration.
        break;
      default:
        throw new IllegalStateException("Unexpected export " + declaration);
    }
  }

  private void visitExportNameDeclaration(Node script, Node export, Node declaration) {
    //   export const pi = 3.14, e;
    //   export let {a, b} = o;
    List<Node> statements = new ArrayList<>();
    for (Node lhs : declaration.childList()) {
      if (lhs.isName()) {
        String name = lhs.getString();
        script.addExportBinding(name, IR.getprop(IR.name("exports"), name));
        if (lhs.hasChildren()) {
          Node init = lhs.removeFirstChild();
          statements.add(
              IR.exprResult(IR.assign(IR.getprop(IR.name("exports"), name), init)).srcref(lhs));
        }
      } else {
        Set<String> names = new LinkedHashSet<>();
        NodeUtil.collectLhsNames(lhs, names);
        statements.add(new Node(declaration.getToken(), lhs.detach()).srcref(declaration));
        for (String name : names) {
          statements.add(
              IR.exprResult(IR.assign(IR.getprop(IR.name("exports"), name), IR.name(name))));
        }
      }
    }
    replaceStatement(export, statements);
  }

  private void visitExportAssignment(Node exportAssign) {
    //   export = x;
    Node value = exportAssign.removeFirstChild();
    replaceStatement(
        exportAssign, IR.exprResult(IR.assign(IR.getprop(IR.name("module"), "exports"), value)));
  }

  // ==========================================================================
  // ES2015 modules

  private void rewriteEsModule(Node script) {
    Set<String> values = NodeUtil.getHoistedNames(script);
    for (Node child = script.getFirstChild(); child != null; ) {
      Node next = child.getNext();
      if (child.isImport()) {
        elideUnusedImportBindings(child);
      } else if (child.isExport()) {
        elideTypeOnlyExports(child, values);
      } else if (child.getToken() == Token.EXPORT_ASSIGN) {
        compiler.report(JSError.make(child, EXPORT_ASSIGNMENT_IN_ES_MODULE));
      }
      child = next;
    }
  }

  private void elideUnusedImportBindings(Node importDecl) {
    if (importDecl.isTypeOnly()) {
      importDecl.detach();
      return;
    }
    Node source = importDecl.getLastChild();
    String renamed = compiler.getRenamedDependency(source.getString());
    if (!renamed.equals(source.getString())) {
      source.replaceWith(IR.string(renamed).srcref(source));
    }
    Node defaultBinding = importDecl.getFirstChild();
    Node namedBindings = importDecl.getSecondChild();
    if (defaultBinding.isEmpty() && namedBindings.isEmpty()) {
      // import "m";
      return;
    }
    if (defaultBinding.isName() && !isReferenced(defaultBinding.getString())) {
      defaultBinding.replaceWith(IR.empty());
    }
    if (namedBindings.getToken() == Token.IMPORT_STAR && !isReferenced(namedBindings.getString())) {
      namedBindings.replaceWith(IR.empty());
    } else if (namedBindings.getToken() == Token.IMPORT_SPECS) {
      for (Node spec : namedBindings.childList()) {
        if (!isReferenced(spec.getSecondChild().getString())) {
          spec.detach();
        }
      }
      if (!namedBindings.hasChildren()) {
        namedBindings.replaceWith(IR.empty());
      }
    }
    if (importDecl.getFirstChild().isEmpty() && importDecl.getSecondChild().isEmpty()) {
      importDecl.detach();
    }
  }

  private void elideTypeOnlyExports(Node export, Set<String> values) {
    if (export.isTypeOnly()) {
      export.detach();
      return;
    }
    Node specs = export.getFirstChild();
    if (export.isExportAllFrom() || export.hasTwoChildren()) {
      Node source = export.getLastChild();
      String renamed = compiler.getRenamedDependency(source.getString());
      if (!renamed.equals(source.getString())) {
        source.replaceWith(IR.string(renamed).srcref(source));
      }
      return;
    }
    if (specs.getToken() != Token.EXPORT_SPECS || !specs.hasChildren()) {
      return;
    }
    for (Node spec : specs.childList()) {
      Node local = spec.getFirstChild();
      if (!local.isName() || !values.contains(local.getString())) {
        spec.detach();
      }
    }
    if (!specs.hasChildren()) {
      export.detach();
    }
  }

  // ==========================================================================
  // Helpers

  private Node createRequireCall(Node source) {
    String specifier = compiler.getRenamedDependency(source.getString());
    return IR.call(IR.name("require"), IR.string(specifier));
  }

  /** Returns {@code exports.name} for an export name, which may be a string. */
  private static Node createExportsAccess(Node exportName) {
    return createPropertyAccess(IR.name("exports"), exportName);
  }

  private static Node createPropertyAccess(Node object, Node propertyName) {
    String name = propertyName.getString();
    return IR.getprop(object, name);
  }

  /**
   * Derives a variable name from a module specifier, e.g. {@code foo_bar} for {@code
   * "./lib/foo-bar"}.
   */
  static String getModuleBaseName(String specifier) {
    String path = CharMatcher.is('/').trimTrailingFrom(specifier);
    String base = path.substring(path.lastIndexOf('/') + 1);
    if (base.isEmpty()) {
      return "module";
    }
    base = IDENTIFIER_PART.negate().replaceFrom(base, '_');
    if (CharMatcher.inRange('0', '9').matches(base.charAt(0))) {
      base = "_" + base;
    }
    return base;
  }

  private static void replaceStatement(Node original, Node replacement) {
    replaceStatement(original, ImmutableList.of(replacement));
  }

  /** Replaces a module declaration with its lowered statements, moving its comments along. */
  private static void replaceStatement(Node original, List<Node> replacements) {
    if (replacements.isEmpty()) {
      original.detach();
      return;
    }
    for (Node replacement : replacements) {
      replacement.setOriginalNode(original);
      if (replacement.isSynthetic()) {
        replacement.srcref(original);
      }
    }
    replacements.get(0).takeCommentsFrom(original);
    original.replaceWith(replacements);
  }
}
