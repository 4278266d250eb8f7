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

import com.google.javascript.gas.ast.Node;
import com.google.javascript.gas.compiler.NodeTraversal.AbstractPostOrderCallback;
import org.jspecify.annotations.Nullable;

/**
 * Looks for features that no lowering pass can express in the output language and reports an error
 * for each occurrence. Runs before any lowering so that the other passes only see shapes they
 * support.
 */
public final class ReportUntranspilableFeatures extends AbstractPostOrderCallback
    implements CompilerPass {

  static final DiagnosticType UNTRANSPILABLE_FEATURE_PRESENT =
      DiagnosticType.error("JSC_UNTRANSPILABLE", "Cannot convert {0} to {1}.");

  /** The constructs reported by this pass. */
  enum Feature {
    ASYNC_FUNCTIONS("async functions"),
    GENERATORS("generators"),
    ACCESSORS("getters and setters"),
    COMPUTED_PROPERTIES("computed property names"),
    OBJECT_SPREAD("object spread"),
    OBJECT_REST("object rest"),
    TAGGED_TEMPLATES("tagged template literals"),
    NEW_TARGET("new.target"),
    PRIVATE_NAMES("private names"),
    DECORATORS("decorators"),
    BIGINT("bigint literals"),
    SUPER_OUTSIDE_DERIVED_CLASS("super outside of a derived class method"),
    DESTRUCTURING_ASSIGNMENT("destructuring assignments"),
    NEW_WITH_SPREAD("spread arguments to new"),
    STATIC_BLOCKS("class static blocks"),
    DYNAMIC_IMPORT("dynamic import"),
    IMPORT_META("import.meta"),
    FOR_AWAIT_OF("for-await-of loops"),
    ARGUMENTS_IN_ARROW("the arguments object inside an arrow function");

    private final String description;

    Feature(String description) {
      this.description = description;
    }

    @Override
    public String toString() {
      return description;
    }
  }

  private final Compiler compiler;

  ReportUntranspilableFeatures(Compiler compiler) {
    this.compiler = checkNotNull(compiler);
  }

  @Override
  public void process(Node root) {
    NodeTraversal.traverse(compiler, root, this);
  }

  private void reportUntranspilable(Feature feature, Node node) {
    compiler.report(
        JSError.make(
            node,
            UNTRANSPILABLE_FEATURE_PRESENT,
            feature.toString(),
            compiler.getOptions().getLanguageOut().getName()));
  }

  @Override
  public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
    if (!n.getDecorators().isEmpty()) {
      if (!compiler.getOptions().isExperimentalDecoratorsEnabled() || !isDecoratable(n)) {
        reportUntranspilable(Feature.DECORATORS, n);
      }
      for (Node decorator : n.getDecorators()) {
        NodeTraversal.traverse(compiler, decorator, this);
      }
    }
    switch (n.getToken()) {
      case FUNCTION:
        if (n.isAsyncFunction()) {
          reportUntranspilable(Feature.ASYNC_FUNCTIONS, n);
        }
        if (n.isGeneratorFunction()) {
          reportUntranspilable(Feature.GENERATORS, n);
        }
        break;
      case GETTER_DEF:
      case SETTER_DEF:
        reportUntranspilable(Feature.ACCESSORS, n);
        break;
      case COMPUTED_PROP:
        reportUntranspilable(Feature.COMPUTED_PROPERTIES, n);
        break;
      case OBJECT_SPREAD:
        reportUntranspilable(Feature.OBJECT_SPREAD, n);
        break;
      case OBJECT_REST:
        reportUntranspilable(Feature.OBJECT_REST, n);
        break;
      case TAGGED_TEMPLATELIT:
        reportUntranspilable(Feature.TAGGED_TEMPLATES, n);
        break;
      case NEW_TARGET:
        reportUntranspilable(Feature.NEW_TARGET, n);
        break;
      case BIGINT:
        reportUntranspilable(Feature.BIGINT, n);
        break;
      case DYNAMIC_IMPORT:
        reportUntranspilable(Feature.DYNAMIC_IMPORT, n);
        break;
      case IMPORT_META:
        reportUntranspilable(Feature.IMPORT_META, n);
        break;
      case FOR_AWAIT_OF:
        reportUntranspilable(Feature.FOR_AWAIT_OF, n);
        break;
      case MEMBER_FUNCTION_DEF:
      case MEMBER_FIELD_DEF:
      case GETPROP:
      case OPTCHAIN_GETPROP:
        if (n.getString().startsWith("#")) {
          reportUntranspilable(Feature.PRIVATE_NAMES, n);
        }
        break;
      case BLOCK:
        if (n.isStaticMember()) {
          reportUntranspilable(Feature.STATIC_BLOCKS, n);
        }
        break;
      case SUPER:
        if (!isInDerivedClassMethod(n)) {
          reportUntranspilable(Feature.SUPER_OUTSIDE_DERIVED_CLASS, n);
        }
        break;
      case NEW:
        for (Node arg = n.getSecondChild(); arg != null; arg = arg.getNext()) {
          if (arg.isIterSpread()) {
            reportUntranspilable(Feature.NEW_WITH_SPREAD, n);
            break;
          }
        }
        break;
      case NAME:
        if (n.getString().equals("arguments") && isInArrowFunction(n)) {
          reportUntranspilable(Feature.ARGUMENTS_IN_ARROW, n);
        }
        break;
      case ASSIGN:
        if (isLiteralTarget(n.getFirstChild())) {
          reportUntranspilable(Feature.DESTRUCTURING_ASSIGNMENT, n);
        }
        break;
      case FOR_IN:
      case FOR_OF:
        if (isLiteralTarget(n.getFirstChild())) {
          reportUntranspilable(Feature.DESTRUCTURING_ASSIGNMENT, n);
        }
        break;
      default:
        break;
    }
  }

  /**
   * Whether {@link RewriteClasses} can lower the decorators of a node: a class, a method or field,
   * or a parameter of a constructor or method.
   */
  private static boolean isDecoratable(Node n) {
    switch (n.getToken()) {
      case CLASS:
      case MEMBER_FUNCTION_DEF:
      case MEMBER_FIELD_DEF:
        return true;
      default:
        break;
    }
    Node paramList = n.getParent();
    if (paramList != null && paramList.isDefaultValue()) {
      paramList = paramList.getParent();
    }
    if (paramList == null || !paramList.isParamList()) {
      return false;
    }
    Node member = paramList.getGrandparent();
    return member != null && member.isMemberFunctionDef();
  }

  private static boolean isLiteralTarget(Node n) {
    return n.isArrayLit() || n.isObjectLit() || n.isDestructuringPattern();
  }

  private static boolean isInArrowFunction(Node n) {
    Node function = NodeUtil.getEnclosingFunction(n);
    return function != null && function.isArrowFunction();
  }

  /**
   * Whether a {@code super} belongs to a constructor or method of a class with an {@code extends}
   * clause, looking through arrow functions.
   */
  private static boolean isInDerivedClassMethod(Node superNode) {
    Node function = superNode.getParent();
    while (function != null && (!function.isFunction() || function.isArrowFunction())) {
      if (function.isClass()) {
        // A field initializer.
        return false;
      }
      function = function.getParent();
    }
    if (function == null) {
      return false;
    }
    Node member = function.getParent();
    if (member == null || !member.isMemberFunctionDef()) {
      return false;
    }
    Node classNode = member.getGrandparent();
    return classNode != null && classNode.isClass() && !classNode.getSecondChild().isEmpty();
  }
}
