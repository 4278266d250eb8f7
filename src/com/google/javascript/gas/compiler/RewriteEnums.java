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

import com.google.javascript.gas.ast.IR;
import com.google.javascript.gas.ast.Node;
import com.google.javascript.gas.ast.Token;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Lowers enum declarations to an object filled in by an immediately invoked function:
 *
 * <pre>
 *   var Color;
 *   (function (Color) {
 *       Color[Color["Red"] = 0] = "Red";
 *       Color["Blue"] = "blue";
 *   })(Color || (Color = {}));
 * </pre>
 *
 * Member initializers are folded to constants where possible, and a member without an initializer
 * continues the numbering of the member before it.
 */
public final class RewriteEnums implements CompilerPass {

  static final DiagnosticType ENUM_MEMBER_NEEDS_INITIALIZER =
      DiagnosticType.error(
          "JSC_ENUM_MEMBER_NEEDS_INITIALIZER", "Enum member must have initializer.");

  private final Compiler compiler;

  RewriteEnums(Compiler compiler) {
    this.compiler = checkNotNull(compiler);
  }

  @Override
  public void process(Node root) {
    List<Node> enums = new ArrayList<>();
    NodeUtil.visitPreOrder(
        root,
        n -> {
          if (n.isEnum()) {
            enums.add(n);
          }
        });
    for (Node enumNode : enums) {
      visitEnum(enumNode);
    }
  }

  private void visitEnum(Node enumNode) {
    Node parent = enumNode.getParent();
    boolean exported = parent.isExport();
    Node statement = exported ? parent : enumNode;
    Node nameNode = enumNode.getFirstChild();
    String name = nameNode.getString();

    Node body = IR.block();
    Map<String, @Nullable Object> values = new LinkedHashMap<>();
    Object previous = -1.0;
    for (Node member : enumNode.getSecondChild().childList()) {
      Object value = null;
      Node memberStatement;
      String memberName = member.getString();
      if (member.hasChildren()) {
        Node init = member.removeFirstChild();
        value = evaluate(init, values, name);
        if (value == null) {
          Node expr = qualifyMemberReferences(init, values, name);
          memberStatement = createReverseMappedMember(name, memberName, expr);
        } else {
          memberStatement = createMember(name, memberName, value);
        }
      } else if (previous instanceof Double) {
        value = (Double) previous + 1;
        memberStatement = createMember(name, memberName, value);
      } else {
        compiler.report(JSError.make(member, ENUM_MEMBER_NEEDS_INITIALIZER));
        return;
      }
      values.put(memberName, value);
      previous = value;
      memberStatement.srcref(member);
      memberStatement.takeCommentsFrom(member);
      body.addChildToBack(memberStatement);
    }
    body.setDanglingComments(enumNode.getSecondChild().getDanglingComments());

    List<Node> statements = new ArrayList<>();
    if (!NodeUtil.isNameDeclaredBefore(statement, name)) {
      Node var = IR.var(IR.name(name)).srcref(nameNode);
      if (exported && !isNamespaceMember(statement) && !compiler.isModuleLoweringEnabled()) {
        // export var Color;
        var = new Node(Token.EXPORT, var).srcref(statement);
      }
      statements.add(var);
    }
    Node function = IR.anonymousFunction(IR.paramList(IR.name(name)), body);
    Node iife = IR.exprResult(IR.call(function, createContainerArgument(statement, nameNode)));
    statements.add(iife.srcref(enumNode));
    statements.get(0).takeCommentsFrom(statement);
    for (Node lowered : statements) {
      lowered.setOriginalNode(statement);
    }
    statement.replaceWith(statements);
  }

  /**
   * Returns the argument of the function that fills in the object: {@code Color || (Color = {})},
   * or {@code Color = exports.Color || (exports.Color = {})} for an exported enum.
   */
  private Node createContainerArgument(Node statement, Node nameNode) {
    String name = nameNode.getString();
    if (!statement.isExport()) {
      return IR.or(IR.name(name), IR.assign(IR.name(name), IR.objectlit()));
    }
    Node container;
    if (isNamespaceMember(statement)) {
      String namespace = statement.getParent().getParent().getFirstChild().getString();
      container = IR.getprop(IR.name(namespace), name);
    } else if (compiler.isModuleLoweringEnabled()) {
      // A copy of the declared name that prints as the exported property.
      container = nameNode.cloneNode();
      container.addExportBinding(name, IR.getprop(IR.name("exports"), name));
    } else {
      return IR.or(IR.name(name), IR.assign(IR.name(name), IR.objectlit()));
    }
    Node initialized = IR.or(container, IR.assign(copyContainer(container), IR.objectlit()));
    return IR.assign(IR.name(name), initialized);
  }

  private static Node copyContainer(Node container) {
    Node copy = container.cloneTree();
    for (Map.Entry<String, Node> binding : container.getExportBindings().entrySet()) {
      copy.addExportBinding(binding.getKey(), binding.getValue().cloneTree());
    }
    return copy;
  }

  static boolean isNamespaceMember(Node statement) {
    Node parent = statement.getParent();
    return parent != null && parent.getToken() == Token.NAMESPACE_ELEMENTS;
  }

  /** {@code E[E["A"] = 0] = "A";} or {@code E["A"] = "a";} */
  private static Node createMember(String enumName, String memberName, Object value) {
    if (value instanceof String) {
      Node member = IR.getelem(IR.name(enumName), IR.string(memberName));
      return IR.exprResult(IR.assign(member, IR.string((String) value)));
    }
    return createReverseMappedMember(enumName, memberName, createNumber((Double) value));
  }

  private static Node createReverseMappedMember(String enumName, String memberName, Node value) {
    Node forward = IR.assign(IR.getelem(IR.name(enumName), IR.string(memberName)), value);
    return IR.exprResult(
        IR.assign(IR.getelem(IR.name(enumName), forward), IR.string(memberName)));
  }

  static Node createNumber(double value) {
    if (value < 0 || (value == 0 && 1 / value < 0)) {
      return new Node(Token.NEG, IR.number(-value));
    }
    return IR.number(value);
  }

  /** Rewrites references to earlier members, e.g. {@code A} to {@code E.A}. */
  private static Node qualifyMemberReferences(
      Node init, Map<String, @Nullable Object> members, String enumName) {
    if (init.isName() && members.containsKey(init.getString())) {
      return IR.getprop(IR.name(enumName), init.getString()).srcref(init);
    }
    List<Node> names = new ArrayList<>();
    NodeUtil.visitPreOrder(
        init,
        n -> {
          if (n.isName()
              && members.containsKey(n.getString())
              && !NodeUtil.isDeclarationName(n)
              && !n.getParent().isStringKey()) {
            names.add(n);
          }
        });
    for (Node name : names) {
      name.replaceWith(IR.getprop(IR.name(enumName), name.getString()).srcref(name));
    }
    return init;
  }

  // ==========================================================================
  // Constant folding

  /**
   * Computes the value of every member of an enum declaration, or null for a member whose value is
   * not a compile-time constant.
   */
  static Map<String, @Nullable Object> computeMemberValues(Node enumNode) {
    checkState(enumNode.isEnum(), enumNode);
    String enumName = enumNode.getFirstChild().getString();
    Map<String, @Nullable Object> values = new LinkedHashMap<>();
    Object previous = -1.0;
    for (Node member : enumNode.getSecondChild().children()) {
      Object value;
      if (member.hasChildren()) {
        value = evaluate(member.getFirstChild(), values, enumName);
      } else {
        value = previous instanceof Double ? (Double) previous + 1 : null;
      }
      values.put(member.getString(), value);
      previous = value;
    }
    return values;
  }

  /** Returns the value of a constant expression as a Double or a String, or null. */
  static @Nullable Object evaluate(
      Node n, Map<String, @Nullable Object> members, String enumName) {
    switch (n.getToken()) {
      case NUMBER:
        return n.getDouble();
      case STRINGLIT:
        return n.getString();
      case TEMPLATELIT:
        if (n.hasOneChild() && n.getFirstChild().getToken() == Token.TEMPLATELIT_STRING) {
          return n.getFirstChild().getString();
        }
        return n.hasChildren() ? null : "";
      case NAME:
        return members.get(n.getString());
      case GETPROP:
        if (n.getFirstChild().matchesName(enumName)) {
          return members.get(n.getString());
        }
        return null;
      case GETELEM:
        if (n.getFirstChild().matchesName(enumName) && n.getSecondChild().isStringLit()) {
          return members.get(n.getSecondChild().getString());
        }
        return null;
      case POS:
      case NEG:
      case BITNOT:
        {
          Object operand = evaluate(n.getFirstChild(), members, enumName);
          if (!(operand instanceof Double)) {
            return null;
          }
          double d = (Double) operand;
          switch (n.getToken()) {
            case POS:
              return d;
            case NEG:
              return -d;
            default:
              return (double) ~toInt32(d);
          }
        }
      default:
        break;
    }
    if (n.getChildCount() != 2 || NodeUtil.isAssignmentOp(n)) {
      return null;
    }
    Object left = evaluate(n.getFirstChild(), members, enumName);
    Object right = evaluate(n.getSecondChild(), members, enumName);
    if (left == null || right == null) {
      return null;
    }
    if (n.isAdd() && (left instanceof String || right instanceof String)) {
      return toJsString(left) + toJsString(right);
    }
    if (!(left instanceof Double) || !(right instanceof Double)) {
      return null;
    }
    return foldBinaryOperator(n.getToken(), (Double) left, (Double) right);
  }

  private static @Nullable Double foldBinaryOperator(Token op, double l, double r) {
    switch (op) {
      case ADD:
        return l + r;
      case SUB:
        return l - r;
      case MUL:
        return l * r;
      case DIV:
        return l / r;
      case MOD:
        return l % r;
      case EXPONENT:
        return Math.pow(l, r);
      case BITOR:
        return (double) (toInt32(l) | toInt32(r));
      case BITAND:
        return (double) (toInt32(l) & toInt32(r));
      case BITXOR:
        return (double) (toInt32(l) ^ toInt32(r));
      case LSH:
        return (double) (toInt32(l) << (toInt32(r) & 0x1f));
      case RSH:
        return (double) (toInt32(l) >> (toInt32(r) & 0x1f));
      case URSH:
        return (double) ((toInt32(l) & 0xffffffffL) >>> (toInt32(r) & 0x1f));
      default:
        return null;
    }
  }

  private static int toInt32(double d) {
    if (Double.isNaN(d) || Double.isInfinite(d)) {
      return 0;
    }
    double truncated = d < 0 ? Math.ceil(d) : Math.floor(d);
    return (int) (long) (truncated % 4294967296.0);
  }

  private static String toJsString(Object value) {
    return value instanceof Double ? NodeUtil.numberToString((Double) value) : (String) value;
  }

  /** Returns the folded value as an expression. */
  static Node createValueNode(Object value) {
    return value instanceof String ? IR.string((String) value) : createNumber((Double) value);
  }
}
