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

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableSet;
import com.google.javascript.gas.ast.Node;
import com.google.javascript.gas.ast.Token;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Predicate;
import org.jspecify.annotations.Nullable;

/** NodeUtil contains generally useful AST utilities. */
public final class NodeUtil {

  private NodeUtil() {}

  /** Words that cannot be used as identifiers, nor as property names in ECMAScript 3. */
  private static final ImmutableSet<String> KEYWORDS =
      ImmutableSet.of(
          "break", "case", "catch", "class", "const", "continue", "debugger", "default", "delete",
          "do", "else", "enum", "export", "extends", "false", "finally", "for", "function", "if",
          "import", "in", "instanceof", "new", "null", "return", "super", "switch", "this",
          "throw", "true", "try", "typeof", "var", "void", "while", "with");

  private static final ImmutableSet<Token> IS_STATEMENT_PARENT =
      ImmutableSet.of(
          Token.SCRIPT, Token.BLOCK, Token.LABEL, Token.NAMESPACE_ELEMENTS);

  private static final CharMatcher WORD_CHARS =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.inRange('0', '9'))
          .or(CharMatcher.anyOf("_$"));

  /**
   * The comma operator has the lowest precedence, 0, followed by the assignment operators ({@code
   * =}, {@code &=}, {@code +=}, etc.) which have precedence of 1, and so on.
   */
  public static int precedence(Token type) {
    switch (type) {
      case COMMA:
        return 0;
      case ASSIGN_BITOR:
      case ASSIGN_BITXOR:
      case ASSIGN_BITAND:
      case ASSIGN_LSH:
      case ASSIGN_RSH:
      case ASSIGN_URSH:
      case ASSIGN_ADD:
      case ASSIGN_SUB:
      case ASSIGN_MUL:
      case ASSIGN_EXPONENT:
      case ASSIGN_DIV:
      case ASSIGN_MOD:
      case ASSIGN_OR:
      case ASSIGN_AND:
      case ASSIGN_COALESCE:
      case ASSIGN:
        return 1;
      case YIELD:
        return 2;
      case HOOK:
        return 3; // ?: operator
      case OR:
        return 4;
      case AND:
        return 5;
      case COALESCE:
        return 6;
      case BITOR:
        return 7;
      case BITXOR:
        return 8;
      case BITAND:
        return 9;
      case EQ:
      case NE:
      case SHEQ:
      case SHNE:
        return 10;
      case LT:
      case GT:
      case LE:
      case GE:
      case INSTANCEOF:
      case IN:
        return 11;
      case LSH:
      case RSH:
      case URSH:
        return 12;
      case SUB:
      case ADD:
        return 13;
      case MUL:
      case MOD:
      case DIV:
        return 14;

      case EXPONENT:
        return 15;

      case AWAIT:
      case NEW:
      case DELPROP:
      case TYPEOF:
      case VOID:
      case NOT:
      case BITNOT:
      case POS:
      case NEG:
        return 16; // Unary operators

      case INC:
      case DEC:
        return 17; // Update operators

      case CALL:
      case GETELEM:
      case GETPROP:
      case OPTCHAIN_CALL:
      case OPTCHAIN_GETELEM:
      case OPTCHAIN_GETPROP:
      case NEW_TARGET:
      case IMPORT_META:
        // Data values
      case ARRAYLIT:
      case ARRAY_PATTERN:
      case DEFAULT_VALUE:
      case DESTRUCTURING_LHS:
      case EMPTY:
      case FALSE:
      case FUNCTION:
      case CLASS:
      case NAME:
      case NULL:
      case NUMBER:
      case BIGINT:
      case OBJECTLIT:
      case OBJECT_PATTERN:
      case REGEXP:
      case ITER_REST:
      case OBJECT_REST:
      case ITER_SPREAD:
      case OBJECT_SPREAD:
      case STRINGLIT:
      case STRING_KEY:
      case THIS:
      case SUPER:
      case TRUE:
      case TAGGED_TEMPLATELIT:
      case TEMPLATELIT:
      case DYNAMIC_IMPORT:
        return 18;
      default:
        throw new IllegalStateException("Unknown precedence for " + type);
    }
  }

  /**
   * Converts an operator's token value (see {@link Token}) to a string representation.
   *
   * @param operator the operator's token value to convert
   * @return the string representation or {@code null} if the token value is not an operator
   */
  public static @Nullable String opToStr(Token operator) {
    switch (operator) {
      case COMMA:
        return ",";
      case BITOR:
        return "|";
      case OR:
        return "||";
      case COALESCE:
        return "??";
      case BITXOR:
        return "^";
      case AND:
        return "&&";
      case BITAND:
        return "&";
      case SHEQ:
        return "===";
      case EQ:
        return "==";
      case NOT:
        return "!";
      case NE:
        return "!=";
      case SHNE:
        return "!==";
      case LSH:
        return "<<";
      case IN:
        return "in";
      case LE:
        return "<=";
      case LT:
        return "<";
      case URSH:
        return ">>>";
      case RSH:
        return ">>";
      case GE:
        return ">=";
      case GT:
        return ">";
      case MUL:
        return "*";
      case DIV:
        return "/";
      case MOD:
        return "%";
      case EXPONENT:
        return "**";
      case BITNOT:
        return "~";
      case ADD:
      case POS:
        return "+";
      case SUB:
      case NEG:
        return "-";
      case ASSIGN:
        return "=";
      case ASSIGN_BITOR:
        return "|=";
      case ASSIGN_BITXOR:
        return "^=";
      case ASSIGN_BITAND:
        return "&=";
      case ASSIGN_LSH:
        return "<<=";
      case ASSIGN_RSH:
        return ">>=";
      case ASSIGN_URSH:
        return ">>>=";
      case ASSIGN_ADD:
        return "+=";
      case ASSIGN_SUB:
        return "-=";
      case ASSIGN_MUL:
        return "*=";
      case ASSIGN_EXPONENT:
        return "**=";
      case ASSIGN_DIV:
        return "/=";
      case ASSIGN_MOD:
        return "%=";
      case ASSIGN_OR:
        return "||=";
      case ASSIGN_AND:
        return "&&=";
      case ASSIGN_COALESCE:
        return "??=";
      case VOID:
        return "void";
      case TYPEOF:
        return "typeof";
      case DELPROP:
        return "delete";
      case INSTANCEOF:
        return "instanceof";
      default:
        return null;
    }
  }

  /**
   * Converts an operator's token value to a string representation or fails.
   *
   * @throws IllegalStateException if the token value is not an operator
   */
  static String opToStrNoFail(Token operator) {
    String res = opToStr(operator);
    if (res == null) {
      throw new IllegalStateException("Unknown op " + operator);
    }
    return res;
  }

  /**
   * Returns true if the operator is an assignment type operator, including the logical
   * assignments.
   */
  public static boolean isAssignmentOp(Node n) {
    switch (n.getToken()) {
      case ASSIGN:
      case ASSIGN_BITOR:
      case ASSIGN_BITXOR:
      case ASSIGN_BITAND:
      case ASSIGN_LSH:
      case ASSIGN_RSH:
      case ASSIGN_URSH:
      case ASSIGN_ADD:
      case ASSIGN_SUB:
      case ASSIGN_MUL:
      case ASSIGN_EXPONENT:
      case ASSIGN_DIV:
      case ASSIGN_MOD:
      case ASSIGN_OR:
      case ASSIGN_AND:
      case ASSIGN_COALESCE:
        return true;
      default:
        return false;
    }
  }

  // ==========================================================================
  // Names

  /** Whether {@code name} is a reserved word of the language. */
  public static boolean isKeyword(String name) {
    return KEYWORDS.contains(name);
  }

  /** Determines whether the given name is a valid variable name. */
  public static boolean isValidSimpleName(String name) {
    return !name.isEmpty()
        && !Character.isDigit(name.charAt(0))
        && WORD_CHARS.matchesAllOf(name)
        && !isKeyword(name);
  }

  /**
   * Determines whether the given name can appear on the right side of the dot operator. Reserved
   * words cannot, in ES3.
   */
  public static boolean isValidPropertyName(String name, boolean keywordsAsProperties) {
    if (isValidSimpleName(name)) {
      return true;
    }
    return keywordsAsProperties
        && isKeyword(name)
        && WORD_CHARS.matchesAllOf(name);
  }

  /** Returns every NAME spelled anywhere in the tree, used to avoid collisions. */
  public static Set<String> collectNames(Node root) {
    Set<String> names = new LinkedHashSet<>();
    visitPreOrder(
        root,
        n -> {
          if ((n.isName() || n.getToken() == Token.IMPORT_STAR) && !n.getString().isEmpty()) {
            names.add(n.getString());
          }
        });
    return names;
  }

  /**
   * Returns the names declared directly in a function's scope, or in a script: parameters,
   * {@code var} declarations and function declarations, not looking into nested functions.
   */
  public static Set<String> getHoistedNames(Node scopeRoot) {
    checkArgument(scopeRoot.isFunction() || scopeRoot.isScript(), scopeRoot);
    Set<String> names = new LinkedHashSet<>();
    Node body = scopeRoot;
    if (scopeRoot.isFunction()) {
      Node name = scopeRoot.getFirstChild();
      if (!name.getString().isEmpty() && !isFunctionDeclaration(scopeRoot)) {
        // A named function expression binds its own name.
        names.add(name.getString());
      }
      for (Node param : scopeRoot.getSecondChild().children()) {
        collectLhsNames(param, names);
      }
      body = scopeRoot.getLastChild();
    }
    collectHoistedNames(body, names);
    return names;
  }

  private static void collectHoistedNames(Node n, Set<String> names) {
    for (Node child = n.getFirstChild(); child != null; child = child.getNext()) {
      switch (child.getToken()) {
        case FUNCTION:
          if (isFunctionDeclaration(child)) {
            names.add(child.getFirstChild().getString());
          }
          continue;
        case CLASS:
          if (child.getFirstChild().isName() && isStatementParent(n)) {
            names.add(child.getFirstChild().getString());
          }
          continue;
        case VAR:
        case LET:
        case CONST:
          for (Node lhs : child.children()) {
            collectLhsNames(lhs, names);
          }
          break;
        case ENUM:
        case NAMESPACE:
          names.add(child.getFirstChild().getString());
          continue;
        case IMPORT_SPEC:
          names.add(child.getSecondChild().getString());
          continue;
        case IMPORT_STAR:
          names.add(child.getString());
          continue;
        case IMPORT:
          if (child.getFirstChild().isName()) {
            names.add(child.getFirstChild().getString());
          }
          break;
        case IMPORT_EQUALS:
          names.add(child.getFirstChild().getString());
          continue;
        default:
          break;
      }
      collectHoistedNames(child, names);
    }
  }

  /** Adds the names bound by a declaration target: a NAME, pattern or default value. */
  public static void collectLhsNames(Node lhs, Set<String> names) {
    switch (lhs.getToken()) {
      case NAME:
        if (!lhs.getString().isEmpty()) {
          names.add(lhs.getString());
        }
        break;
      case DESTRUCTURING_LHS:
      case DEFAULT_VALUE:
      case ITER_REST:
      case OBJECT_REST:
        collectLhsNames(lhs.getFirstChild(), names);
        break;
      case ARRAY_PATTERN:
        for (Node element : lhs.children()) {
          collectLhsNames(element, names);
        }
        break;
      case OBJECT_PATTERN:
        for (Node property : lhs.children()) {
          if (property.isStringKey() || property.getToken() == Token.COMPUTED_PROP) {
            collectLhsNames(property.getLastChild(), names);
          } else {
            collectLhsNames(property, names);
          }
        }
        break;
      default:
        break;
    }
  }

  /**
   * Whether a NAME node is the binding of a declaration rather than a reference: a variable,
   * parameter, function, class or catch binding.
   */
  public static boolean isDeclarationName(Node name) {
    Node parent = name.getParent();
    if (parent == null) {
      return false;
    }
    switch (parent.getToken()) {
      case VAR:
      case LET:
      case CONST:
      case PARAM_LIST:
      case ITER_REST:
      case OBJECT_REST:
      case ARRAY_PATTERN:
        return true;
      case CATCH:
      case IMPORT_EQUALS:
      case FUNCTION:
      case CLASS:
      case ENUM:
      case NAMESPACE:
        return name.isFirstChildOf(parent);
      case DEFAULT_VALUE:
        return name.isFirstChildOf(parent) && isDeclarationTarget(parent);
      case STRING_KEY:
        return parent.getParent() != null && parent.getParent().isObjectPattern();
      default:
        return false;
    }
  }

  private static boolean isDeclarationTarget(Node n) {
    Node parent = n.getParent();
    return parent != null
        && (parent.isParamList()
            || parent.isArrayPattern()
            || (parent.isStringKey() && parent.getParent().isObjectPattern()));
  }

  // ==========================================================================
  // Statements and scopes

  public static boolean isStatementParent(Node parent) {
    return IS_STATEMENT_PARENT.contains(parent.getToken());
  }

  /** Whether a FUNCTION node is a function declaration, not an expression. */
  public static boolean isFunctionDeclaration(Node n) {
    if (!n.isFunction() || n.getFirstChild().getString().isEmpty()) {
      return false;
    }
    Node parent = n.getParent();
    return parent != null && (isStatementParent(parent) || parent.isExport());
  }

  /** Whether a CLASS node is a class declaration, not an expression. */
  public static boolean isClassDeclaration(Node n) {
    if (!n.isClass() || !n.getFirstChild().isName()) {
      return false;
    }
    Node parent = n.getParent();
    return parent != null && (isStatementParent(parent) || parent.isExport());
  }

  public static @Nullable Node getEnclosingNode(Node n, Predicate<Node> pred) {
    Node curr = n;
    while (curr != null && !pred.test(curr)) {
      curr = curr.getParent();
    }
    return curr;
  }

  /** Finds the function containing the given node. */
  public static @Nullable Node getEnclosingFunction(Node n) {
    return getEnclosingNode(n, Node::isFunction);
  }

  /**
   * Returns the statement list that holds the {@code var} declarations of the given node's scope:
   * the body of the nearest non-arrow function, or the script.
   */
  public static Node getEnclosingHoistScopeBody(Node n) {
    for (Node curr = n.getParent(); curr != null; curr = curr.getParent()) {
      if (curr.isFunction() && !curr.isArrowFunction() && curr.getLastChild().isBlock()) {
        return curr.getLastChild();
      }
      if (curr.isScript()) {
        return curr;
      }
    }
    throw new IllegalStateException("Not attached to a script: " + n);
  }

  /**
   * Whether a statement earlier in the same statement list declares {@code name}, so that a
   * merged enum or namespace must not declare it again.
   */
  public static boolean isNameDeclaredBefore(Node statement, String name) {
    for (Node prev = statement.getPrevious(); prev != null; prev = prev.getPrevious()) {
      Node declaration = prev.isExport() ? prev.getFirstChild() : prev;
      Set<String> names = new LinkedHashSet<>();
      switch (declaration.getToken()) {
        case VAR:
        case LET:
        case CONST:
          for (Node lhs : declaration.children()) {
            collectLhsNames(lhs, names);
          }
          break;
        case FUNCTION:
        case CLASS:
        case ENUM:
        case NAMESPACE:
          if (declaration.getFirstChild().isName()) {
            names.add(declaration.getFirstChild().getString());
          }
          break;
        default:
          break;
      }
      if (names.contains(name)) {
        return true;
      }
    }
    return false;
  }

  /** Whether a statement is a directive, such as {@code "use strict";}. */
  public static boolean isDirective(Node n) {
    return n.isExprResult()
        && n.getFirstChild().isStringLit()
        && n.getParent() != null
        && (n.getParent().isScript() || n.getParent().getParent().isFunction())
        && isInDirectivePrologue(n);
  }

  private static boolean isInDirectivePrologue(Node n) {
    for (Node prev = n.getPrevious(); prev != null; prev = prev.getPrevious()) {
      if (!prev.isExprResult() || !prev.getFirstChild().isStringLit()) {
        return false;
      }
    }
    return true;
  }

  /** Inserts statements at the top of a script or function body, after any directives. */
  public static void addToFrontOfScope(Node scopeBody, List<Node> statements) {
    checkArgument(scopeBody.isScript() || scopeBody.isBlock(), scopeBody);
    Node after = null;
    for (Node child = scopeBody.getFirstChild(); child != null; child = child.getNext()) {
      if (!isDirective(child)) {
        break;
      }
      after = child;
    }
    for (Node statement : statements) {
      if (after == null) {
        scopeBody.addChildToFront(statement);
      } else {
        statement.insertAfter(after);
      }
      after = statement;
    }
  }

  /** Visits every node of a tree in preorder. */
  public static void visitPreOrder(Node root, Consumer<Node> visitor) {
    visitor.accept(root);
    for (Node child = root.getFirstChild(); child != null; child = child.getNext()) {
      visitPreOrder(child, visitor);
    }
  }

  /** Whether the tree contains a node matching the predicate. */
  public static boolean has(Node root, Predicate<Node> pred, Predicate<Node> traverseChildren) {
    if (pred.test(root)) {
      return true;
    }
    if (!traverseChildren.test(root)) {
      return false;
    }
    for (Node child = root.getFirstChild(); child != null; child = child.getNext()) {
      if (has(child, pred, traverseChildren)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Collects the descendants of {@code root} that match, looking into arrow functions but not into
   * other functions.
   */
  public static void findInFunction(Node root, Predicate<Node> pred, List<Node> results) {
    for (Node child = root.getFirstChild(); child != null; child = child.getNext()) {
      if (pred.test(child)) {
        results.add(child);
      }
      if (!child.isFunction() || child.isArrowFunction()) {
        findInFunction(child, pred, results);
      }
    }
  }

  /** Whether an expression can be evaluated twice without side effects or a changed value. */
  public static boolean isSimpleOperand(Node n) {
    switch (n.getToken()) {
      case NAME:
      case THIS:
      case NUMBER:
      case STRINGLIT:
      case TRUE:
      case FALSE:
      case NULL:
        return true;
      default:
        return false;
    }
  }

  // ==========================================================================
  // Numbers

  /**
   * Formats a number the way ECMAScript's {@code Number.prototype.toString} does, e.g. {@code
   * 1e21}, {@code 100}, {@code 0.001} or {@code 1e-7}.
   */
  public static String numberToString(double d) {
    if (Double.isNaN(d)) {
      return "NaN";
    }
    if (Double.isInfinite(d)) {
      return d > 0 ? "Infinity" : "-Infinity";
    }
    if (d == 0) {
      return "0";
    }
    if (d < 0) {
      return "-" + numberToString(-d);
    }

    String s = Double.toString(d);
    int exponent = 0;
    int e = s.indexOf('E');
    if (e >= 0) {
      exponent = Integer.parseInt(s.substring(e + 1));
      s = s.substring(0, e);
    }
    int dot = s.indexOf('.');
    String digits = s.substring(0, dot) + s.substring(dot + 1);
    // Position of the decimal point relative to the first digit.
    int n = dot + exponent;
    int leadingZeros = 0;
    while (leadingZeros < digits.length() - 1 && digits.charAt(leadingZeros) == '0') {
      leadingZeros++;
    }
    digits = CharMatcher.is('0').trimTrailingFrom(digits.substring(leadingZeros));
    n -= leadingZeros;
    int k = digits.length();

    if (k <= n && n <= 21) {
      return digits + "0".repeat(n - k);
    }
    if (0 < n && n <= 21) {
      return digits.substring(0, n) + "." + digits.substring(n);
    }
    if (-6 < n && n <= 0) {
      return "0." + "0".repeat(-n) + digits;
    }
    int shown = n - 1;
    String sign = shown >= 0 ? "+" : "-";
    String mantissa = k == 1 ? digits : digits.charAt(0) + "." + digits.substring(1);
    return mantissa + "e" + sign + Math.abs(shown);
  }
}
