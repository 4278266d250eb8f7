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

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.javascript.gas.ast.IR;
import com.google.javascript.gas.ast.Node;
import com.google.javascript.gas.ast.Node.Prop;
import com.google.javascript.gas.ast.Token;
import com.google.javascript.gas.compiler.NodeTraversal.AbstractPostOrderCallback;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;

/**
 * Converts classes to constructor functions. A class becomes a function invoked right away that
 * defines the constructor, assigns the methods to its prototype and returns it:
 *
 * <pre>
 *   var Dog = (function (_super) {
 *       __extends(Dog, _super);
 *       function Dog(name) {
 *           var _this = _super.call(this, name) || this;
 *           _this.tricks = [];
 *           return _this;
 *       }
 *       Dog.prototype.speak = function () {
 *           return _super.prototype.speak.call(this);
 *       };
 *       return Dog;
 *   })(Animal);
 * </pre>
 *
 * Instance fields and parameter properties are assigned in the constructor, after the call to the
 * superclass constructor. Static fields are assigned to the constructor.
 *
 * <p>Decorators are applied with {@code __decorate} before the constructor is returned: those of
 * instance members first, then those of static members, then those of the class, which replace the
 * constructor. A parameter decorator is wrapped in {@code __param(index, decorator)} and applied
 * with the decorators of its method, or of the class for a constructor parameter.
 *
 * <pre>
 *   var Service = (function () {
 *       function Service(store) {
 *       }
 *       Service.prototype.run = function () {};
 *       __decorate([log], Service.prototype, "run", null);
 *       Service = __decorate([injectable, __param(0, inject("store"))], Service);
 *       return Service;
 *   })();
 * </pre>
 */
public final class RewriteClasses extends AbstractPostOrderCallback implements CompilerPass {
  private final Compiler compiler;
  private final UniqueNameGenerator nameGenerator;

  RewriteClasses(Compiler compiler) {
    this.compiler = checkNotNull(compiler);
    this.nameGenerator = compiler.getUniqueNameGenerator();
  }

  @Override
  public void process(Node root) {
    NodeTraversal.traverse(compiler, root, this);
  }

  @Override
  public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
    if (n.isClass()) {
      visitClass(n);
    }
  }

  private void visitClass(Node classNode) {
    boolean isDeclaration = NodeUtil.isClassDeclaration(classNode);
    String className = getClassName(classNode);
    Node superClass = classNode.getSecondChild();
    boolean isDerived = !superClass.isEmpty();
    String superName = isDerived ? nameGenerator.getAlias("_super") : null;

    Node constructor = null;
    List<Node> instanceInitializers = new ArrayList<>();
    List<Node> memberStatements = new ArrayList<>();
    List<Node> instanceDecorations = new ArrayList<>();
    List<Node> staticDecorations = new ArrayList<>();
    for (Node member : classNode.getLastChild().childList()) {
      if (isConstructor(member)) {
        constructor = member.getOnlyChild().detach();
        continue;
      }
      boolean isStatic = member.isStaticMember();
      Node decoration = createMemberDecoration(className, member);
      if (decoration != null) {
        (isStatic ? staticDecorations : instanceDecorations).add(decoration);
      }
      Node owner =
          isStatic ? IR.name(className) : IR.getprop(IR.name(className), "prototype");
      if (member.isMemberFunctionDef()) {
        //   C.prototype.m = function () {...};
        Node function = member.getOnlyChild().detach();
        if (isDerived) {
          rewriteSuperReferences(function.getLastChild(), superName, isStatic);
        }
        Node statement =
            IR.exprResult(IR.assign(IR.getprop(owner, member.getString()), function));
        memberStatements.add(statement.srcref(member).takeCommentsFrom(member));
      } else if (member.getToken() == Token.MEMBER_FIELD_DEF && member.hasChildren()) {
        Node init = member.removeFirstChild();
        if (isStatic) {
          //   C.count = 0;
          init = replaceThis(init, () -> IR.name(className));
          Node statement = IR.exprResult(IR.assign(IR.getprop(owner, member.getString()), init));
          memberStatements.add(statement.srcref(member).takeCommentsFrom(member));
        } else {
          //   this.legs = 4;
          Node statement =
              IR.exprResult(IR.assign(IR.getprop(IR.thisNode(), member.getString()), init));
          instanceInitializers.add(statement.srcref(member).takeCommentsFrom(member));
        }
      }
    }

    boolean hasExplicitConstructor = constructor != null;
    List<Node> classDecorators = takeDecorators(classNode);
    if (hasExplicitConstructor) {
      classDecorators.addAll(takeParameterDecorators(constructor));
    }
    if (constructor == null) {
      constructor = IR.function(IR.name(className), IR.paramList(), IR.block());
      constructor.srcref(classNode);
    } else {
      constructor.getFirstChild().replaceWith(IR.name(className));
    }
    instanceInitializers.addAll(0, createParameterPropertyAssignments(constructor));
    if (isDerived) {
      rewriteDerivedConstructor(
          constructor, hasExplicitConstructor, superName, instanceInitializers);
    } else {
      NodeUtil.addToFrontOfScope(constructor.getLastChild(), instanceInitializers);
    }

    Node body = IR.block();
    if (isDerived) {
      compiler.ensureLibraryInjected("extends");
      body.addChildToBack(
          IR.exprResult(IR.call(IR.name("__extends"), IR.name(className), IR.name(superName))));
    }
    body.addChildToBack(constructor);
    body.addChildrenToBack(memberStatements);
    body.addChildrenToBack(instanceDecorations);
    body.addChildrenToBack(staticDecorations);
    if (!classDecorators.isEmpty()) {
      //   C = __decorate([d], C);
      Node decorate = createDecorateCall(classDecorators, IR.name(className));
      Node reassign = IR.exprResult(IR.assign(IR.name(className), decorate));
      body.addChildToBack(reassign.srcref(classNode));
    }
    body.addChildToBack(IR.returnNode(IR.name(className)));
    body.setDanglingComments(classNode.getLastChild().getDanglingComments());

    Node params = isDerived ? IR.paramList(IR.name(superName)) : IR.paramList();
    Node iife =
        isDerived
            ? IR.call(IR.anonymousFunction(params, body), superClass.detach())
            : IR.call(IR.anonymousFunction(params, body));
    iife.srcref(classNode);

    if (isDeclaration) {
      Node declaration = IR.declaration(IR.name(className), iife, Token.LET).srcref(classNode);
      declaration.takeCommentsFrom(classNode);
      declaration.setOriginalNode(classNode);
      classNode.replaceWith(declaration);
    } else {
      classNode.replaceWith(iife);
    }
  }

  private String getClassName(Node classNode) {
    Node name = classNode.getFirstChild();
    if (name.isName()) {
      return name.getString();
    }
    Node parent = classNode.getParent();
    if (parent.isName() && !parent.getString().isEmpty()) {
      //   var A = class {};
      return parent.getString();
    }
    return nameGenerator.getUniqueName("class");
  }

  private static boolean isConstructor(Node member) {
    return member.isMemberFunctionDef()
        && !member.isStaticMember()
        && member.getString().equals("constructor");
  }

  /**
   * Returns {@code __decorate([d], C.prototype, "m", null);} for a method with decorators on itself
   * or its parameters, the same call ending in {@code void 0} for a decorated field, or null.
   */
  private @Nullable Node createMemberDecoration(String className, Node member) {
    List<Node> decorators = takeDecorators(member);
    if (member.isMemberFunctionDef()) {
      decorators.addAll(takeParameterDecorators(member.getOnlyChild()));
    }
    if (decorators.isEmpty()) {
      return null;
    }
    Node target =
        member.isStaticMember()
            ? IR.name(className)
            : IR.getprop(IR.name(className), "prototype");
    Node descriptor = member.isMemberFunctionDef() ? IR.nullNode() : IR.undefined();
    Node decorate =
        createDecorateCall(decorators, target, IR.string(member.getString()), descriptor);
    return IR.exprResult(decorate).srcref(member);
  }

  private Node createDecorateCall(List<Node> decorators, Node... arguments) {
    compiler.ensureLibraryInjected("decorate");
    Node call = IR.call(IR.name("__decorate"), IR.arraylit(decorators));
    for (Node argument : arguments) {
      call.addChildToBack(argument);
    }
    return call;
  }

  /** Detaches the expressions of the decorators of {@code n}. */
  private static List<Node> takeDecorators(Node n) {
    List<Node> expressions = new ArrayList<>();
    for (Node decorator : n.getDecorators()) {
      expressions.add(decorator.getOnlyChild().detach());
    }
    n.setDecorators(ImmutableList.of());
    return expressions;
  }

  /** Returns {@code __param(i, d)} for each decorator of the parameters of {@code function}. */
  private List<Node> takeParameterDecorators(Node function) {
    List<Node> decorators = new ArrayList<>();
    int index = 0;
    for (Node param : function.getSecondChild().children()) {
      Node target = param.isDefaultValue() ? param.getFirstChild() : param;
      for (Node decorator : takeDecorators(target)) {
        compiler.ensureLibraryInjected("param");
        decorators.add(IR.call(IR.name("__param"), IR.number(index), decorator));
      }
      index++;
    }
    return decorators;
  }

  /** Returns {@code this.x = x;} for each parameter declared {@code public x}. */
  private static List<Node> createParameterPropertyAssignments(Node constructor) {
    List<Node> assignments = new ArrayList<>();
    for (Node param : constructor.getSecondChild().children()) {
      Node name = param.isDefaultValue() ? param.getFirstChild() : param;
      if (name.isName() && name.getBooleanProp(Prop.PARAMETER_PROPERTY)) {
        String property = name.getString();
        assignments.add(
            IR.exprResult(IR.assign(IR.getprop(IR.thisNode(), property), IR.name(property)))
                .srcref(name));
      }
    }
    return assignments;
  }

  /**
   * Makes a subclass constructor call the superclass constructor and return the object it created:
   * {@code this} becomes {@code _this}, which holds the result of {@code super(...)}.
   */
  private void rewriteDerivedConstructor(
      Node constructor,
      boolean hasExplicitConstructor,
      String superName,
      List<Node> initializers) {
    Node body = constructor.getLastChild();
    String thisName = nameGenerator.getAlias("_this");
    rewriteSuperReferences(body, superName, false);

    List<Node> superCalls = new ArrayList<>();
    NodeUtil.findInFunction(body, n -> n.isCall() && n.getFirstChild().isSuper(), superCalls);

    if (superCalls.isEmpty()) {
      if (hasExplicitConstructor) {
        // Only valid when the constructor throws before using this.
        NodeUtil.addToFrontOfScope(body, initializers);
      } else if (initializers.isEmpty()) {
        //   return _super !== null && _super.apply(this, arguments) || this;
        body.addChildToBack(IR.returnNode(createImplicitSuperCall(superName)));
      } else {
        //   var _this = _super !== null && _super.apply(this, arguments) || this;
        Node var = IR.var(IR.name(thisName), createImplicitSuperCall(superName));
        body.addChildToBack(var);
        for (Node initializer : initializers) {
          body.addChildToBack(replaceThis(initializer, () -> IR.name(thisName)));
        }
        body.addChildToBack(IR.returnNode(IR.name(thisName)));
      }
      return;
    }

    Node firstCall = superCalls.get(0);
    Node firstStatement = firstCall.getParent();
    boolean declaresThis = firstStatement.isExprResult() && firstStatement.getParent() == body;
    Node anchor = firstStatement;
    while (anchor.getParent() != body) {
      anchor = anchor.getParent();
    }
    insertAfter(anchor, initializers);
    replaceThis(body, () -> IR.name(thisName));

    for (Node call : superCalls) {
      call.getFirstChild().detach();
      List<Node> args = call.detachChildren();
      Node superCall = IR.call(IR.getprop(IR.name(superName), "call"), IR.thisNode());
      for (Node arg : args) {
        superCall.addChildToBack(arg);
      }
      superCall.srcref(call);
      Node result = IR.or(superCall, IR.thisNode());
      if (call == firstCall && declaresThis) {
        Node var = IR.var(IR.name(thisName), result).srcref(firstStatement);
        var.takeCommentsFrom(firstStatement);
        firstStatement.replaceWith(var);
      } else {
        call.replaceWith(IR.assign(IR.name(thisName), result));
      }
    }
    if (!declaresThis) {
      NodeUtil.addToFrontOfScope(body, ImmutableList.of(IR.var(IR.name(thisName))));
    }

    List<Node> returns = new ArrayList<>();
    NodeUtil.findInFunction(body, n -> n.isReturn() && !n.hasChildren(), returns);
    for (Node ret : returns) {
      ret.addChildToBack(IR.name(thisName));
    }
    Node last = body.getLastChild();
    if (last == null || (!last.isReturn() && last.getToken() != Token.THROW)) {
      body.addChildToBack(IR.returnNode(IR.name(thisName)));
    }
  }

  /** {@code _super !== null && _super.apply(this, arguments) || this} */
  private static Node createImplicitSuperCall(String superName) {
    Node apply =
        IR.call(IR.getprop(IR.name(superName), "apply"), IR.thisNode(), IR.name("arguments"));
    Node notNull = IR.shne(IR.name(superName), IR.nullNode());
    return IR.or(IR.and(notNull, apply), IR.thisNode());
  }

  /**
   * Rewrites {@code super.m(...)} to {@code _super.prototype.m.call(this, ...)} and other property
   * accesses on {@code super} to accesses on the superclass or its prototype.
   */
  private static void rewriteSuperReferences(Node body, String superName, boolean isStatic) {
    List<Node> supers = new ArrayList<>();
    NodeUtil.findInFunction(body, Node::isSuper, supers);
    for (Node superNode : supers) {
      Node access = superNode.getParent();
      if (access.isCall()) {
        // A super(...) call, handled with the constructor.
        continue;
      }
      Node owner =
          isStatic ? IR.name(superName) : IR.getprop(IR.name(superName), "prototype");
      superNode.replaceWith(owner.srcrefTree(superNode));
      Node parent = access.getParent();
      if (parent.isCall() && access.isFirstChildOf(parent)) {
        Node target = access.detach();
        Node callee = IR.getprop(target, "call");
        parent.addChildToFront(callee);
        IR.thisNode().insertAfter(callee);
      }
    }
  }

  private static void insertAfter(Node anchor, List<Node> statements) {
    Node previous = anchor;
    for (Node statement : statements) {
      statement.insertAfter(previous);
      previous = statement;
    }
  }

  /**
   * Replaces {@code this} in a tree, including arrow functions but not other functions, and
   * returns the new root.
   */
  @CanIgnoreReturnValue
  private static Node replaceThis(Node root, Supplier<Node> replacement) {
    if (root.isThis()) {
      return replacement.get().srcref(root);
    }
    List<Node> thisNodes = new ArrayList<>();
    NodeUtil.findInFunction(root, Node::isThis, thisNodes);
    for (Node thisNode : thisNodes) {
      thisNode.replaceWith(replacement.get().srcref(thisNode));
    }
    return root;
  }
}
