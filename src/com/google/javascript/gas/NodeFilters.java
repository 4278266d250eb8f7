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

import com.google.javascript.gas.ast.Node;
import com.google.javascript.gas.ast.Token;
import com.google.javascript.gas.compiler.NodeUtil;
import org.jspecify.annotations.Nullable;

/**
 * Predicates over AST nodes that decide which statements the transpiler comments out, suppresses
 * or marks. Each is a pure function of the node and its subtree.
 */
public final class NodeFilters {

  private NodeFilters() {}

  /**
   * Whether a node is an import declaration: {@code import ... from "m"}, {@code import "m"} or
   * {@code import x = y}, including an exported {@code export import x = y}.
   */
  public static boolean isImport(Node n) {
    switch (n.getToken()) {
      case IMPORT:
      case IMPORT_EQUALS:
        return true;
      case EXPORT:
        return n.hasOneChild() && n.getFirstChild().isImportEquals();
      default:
        return false;
    }
  }

  /**
   * Whether a node is an export declaration with a {@code from} clause, such as {@code export *
   * from "m"} or {@code export { a } from "m"}.
   */
  public static boolean isExportFrom(Node n) {
    return n.isExport()
        && !n.isExportDefault()
        && n.hasTwoChildren()
        && n.getLastChild().isStringLit();
  }

  /**
   * Whether a node is a statement the compiler produced from an {@code export ... from}
   * declaration, such as {@code exports.a = require("m").a;}.
   */
  public static boolean isLoweredExportFrom(Node n) {
    if (!n.isExprResult()) {
      return false;
    }
    Node original = n.getOriginalNode();
    return original != null && isExportFrom(original);
  }

  /**
   * Whether a node is an identifier occurrence: a variable name, the name of a property access
   * such as {@code exports} in {@code module.exports}, or an unquoted property key such as
   * {@code exports} in {@code { exports: 1 }}.
   */
  public static boolean isIdentifier(Node n) {
    return getIdentifierText(n) != null;
  }

  /** Returns the identifier a node spells, or null if it is not an identifier occurrence. */
  public static @Nullable String getIdentifierText(Node n) {
    switch (n.getToken()) {
      case NAME:
        return n.getString().isEmpty() ? null : n.getString();
      case GETPROP:
      case OPTCHAIN_GETPROP:
        return n.getString();
      case STRING_KEY:
      case MEMBER_FUNCTION_DEF:
      case MEMBER_FIELD_DEF:
      case GETTER_DEF:
      case SETTER_DEF:
        String key = n.getString();
        return !n.isQuotedString() && NodeUtil.isValidPropertyName(key, true) ? key : null;
      default:
        return null;
    }
  }

  /**
   * Whether a node is the {@code exports.__esModule = true;} statement inserted by the compiler.
   *
   * <p>The statement must have the shape of the marker and carry the sentinel source range of a
   * compiler-built node, so that a marker written by the user is kept.
   */
  public static boolean isModuleMarker(Node n) {
    if (!n.isExprResult() || !n.isSynthetic()) {
      return false;
    }
    Node assign = n.getFirstChild();
    return assign.isAssign()
        && isExportsProperty(assign.getFirstChild(), "__esModule")
        && assign.getLastChild().getToken() == Token.TRUE;
  }

  /**
   * Whether a node is a default export assignment, {@code exports["default"] = name;}. The match
   * is structural only, because the compiler writes this statement from user code.
   */
  public static boolean isDefaultExportAssignment(Node n) {
    if (!n.isExprResult()) {
      return false;
    }
    Node assign = n.getFirstChild();
    return assign.isAssign()
        && isExportsProperty(assign.getFirstChild(), "default")
        && assign.getLastChild().isName();
  }

  /** Whether {@code n} is {@code exports.<property>}. */
  private static boolean isExportsProperty(Node n, String property) {
    return n.isGetProp()
        && n.getString().equals(property)
        && n.getFirstChild().isName()
        && n.getFirstChild().getString().equals("exports");
  }
}
