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

package com.google.javascript.gas.ast;

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import java.util.List;

/** An AST construction helper class. Every node it builds has the synthetic source range. */
public class IR {

  private IR() {}

  public static Node empty() {
    return new Node(Token.EMPTY);
  }

  public static Node script() {
    return new Node(Token.SCRIPT);
  }

  public static Node function(Node name, Node params, Node body) {
    checkState(name.isName());
    checkState(params.isParamList());
    checkState(body.isBlock());
    return new Node(Token.FUNCTION, name, params, body);
  }

  /** Builds a function expression with no name. */
  public static Node anonymousFunction(Node params, Node body) {
    return function(name(""), params, body);
  }

  public static Node paramList() {
    return new Node(Token.PARAM_LIST);
  }

  public static Node paramList(Node... params) {
    Node paramList = paramList();
    for (Node param : params) {
      checkState(param.isName() || param.isIterRest());
      paramList.addChildToBack(param);
    }
    return paramList;
  }

  public static Node block() {
    return new Node(Token.BLOCK);
  }

  public static Node block(Node stmt) {
    checkState(mayBeStatement(stmt), "Block node cannot contain %s", stmt.getToken());
    return new Node(Token.BLOCK, stmt);
  }

  public static Node block(Node... stmts) {
    return block(List.of(stmts));
  }

  public static Node block(List<Node> stmts) {
    Node block = block();
    for (Node stmt : stmts) {
      checkState(mayBeStatement(stmt), "Block node cannot contain %s", stmt.getToken());
      block.addChildToBack(stmt);
    }
    return block;
  }

  public static Node var(Node lhs, Node value) {
    return declaration(lhs, value, Token.VAR);
  }

  public static Node var(Node lhs) {
    return declaration(lhs, Token.VAR);
  }

  public static Node declaration(Node lhs, Token type) {
    checkState(lhs.isName() || lhs.isDestructuringLhs(), lhs);
    return new Node(type, lhs);
  }

  public static Node declaration(Node lhs, Node value, Token type) {
    if (lhs.isName()) {
      checkState(!lhs.hasChildren());
    } else {
      checkState(lhs.isDestructuringPattern());
      lhs = new Node(Token.DESTRUCTURING_LHS, lhs);
    }
    checkState(mayBeExpression(value), "%s can't be an initializer", value);
    lhs.addChildToBack(value);
    return new Node(type, lhs);
  }

  public static Node returnNode() {
    return new Node(Token.RETURN);
  }

  public static Node returnNode(Node expr) {
    checkState(mayBeExpression(expr));
    return new Node(Token.RETURN, expr);
  }

  public static Node exprResult(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.EXPR_RESULT, expr);
  }

  public static Node ifNode(Node cond, Node then) {
    checkState(mayBeExpression(cond));
    checkState(then.isBlock());
    return new Node(Token.IF, cond, then);
  }

  public static Node forNode(Node init, Node cond, Node incr, Node body) {
    checkState(init.isVar() || init.isEmpty() || mayBeExpression(init));
    checkState(cond.isEmpty() || mayBeExpression(cond));
    checkState(incr.isEmpty() || mayBeExpression(incr));
    checkState(body.isBlock());
    Node r = new Node(Token.FOR, init, cond, incr);
    r.addChildToBack(body);
    return r;
  }

  public static Node call(Node target, Node... args) {
    Node call = new Node(Token.CALL, target);
    for (Node arg : args) {
      checkState(mayBeExpression(arg) || arg.isIterSpread(), arg);
      call.addChildToBack(arg);
    }
    return call;
  }

  public static Node name(String name) {
    return Node.newString(Token.NAME, name);
  }

  public static Node getprop(Node target, String prop, String... moreProps) {
    checkState(mayBeExpression(target), target);
    Node result = Node.newString(Token.GETPROP, prop);
    result.addChildToBack(target);
    for (String moreProp : moreProps) {
      Node next = Node.newString(Token.GETPROP, moreProp);
      next.addChildToBack(result);
      result = next;
    }
    return result;
  }

  public static Node getelem(Node target, Node elem) {
    checkState(mayBeExpression(elem));
    return new Node(Token.GETELEM, target, elem);
  }

  public static Node assign(Node target, Node expr) {
    checkState(
        target.isName() || target.isGetProp() || target.getToken() == Token.GETELEM, target);
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.ASSIGN, target, expr);
  }

  public static Node hook(Node cond, Node trueval, Node falseval) {
    checkState(mayBeExpression(cond));
    checkState(mayBeExpression(trueval));
    checkState(mayBeExpression(falseval));
    return new Node(Token.HOOK, cond, trueval, falseval);
  }

  public static Node and(Node expr1, Node expr2) {
    return binaryOp(Token.AND, expr1, expr2);
  }

  public static Node or(Node expr1, Node expr2) {
    return binaryOp(Token.OR, expr1, expr2);
  }

  public static Node lt(Node expr1, Node expr2) {
    return binaryOp(Token.LT, expr1, expr2);
  }

  public static Node sheq(Node expr1, Node expr2) {
    return binaryOp(Token.SHEQ, expr1, expr2);
  }

  public static Node shne(Node expr1, Node expr2) {
    return binaryOp(Token.SHNE, expr1, expr2);
  }

  public static Node voidNode(Node expr1) {
    return unaryOp(Token.VOID, expr1);
  }

  /** Builds {@code void 0}, the ES3 spelling of undefined. */
  public static Node undefined() {
    return voidNode(number(0));
  }

  public static Node inc(Node exp, boolean isPost) {
    Node inc = unaryOp(Token.INC, exp);
    inc.putBooleanProp(Node.Prop.INCRDECR, isPost);
    return inc;
  }

  public static Node add(Node expr1, Node expr2) {
    return binaryOp(Token.ADD, expr1, expr2);
  }

  public static Node sub(Node expr1, Node expr2) {
    return binaryOp(Token.SUB, expr1, expr2);
  }

  public static Node objectlit(Node... propdefs) {
    Node objectlit = new Node(Token.OBJECTLIT);
    for (Node propdef : propdefs) {
      checkState(propdef.isStringKey());
      checkState(propdef.hasOneChild());
      objectlit.addChildToBack(propdef);
    }
    return objectlit;
  }

  public static Node arraylit(Node... exprs) {
    return arraylit(List.of(exprs));
  }

  public static Node arraylit(List<Node> exprs) {
    Node arraylit = new Node(Token.ARRAYLIT);
    for (Node expr : exprs) {
      checkState(mayBeExpression(expr) || expr.isEmpty(), expr);
      arraylit.addChildToBack(expr);
    }
    return arraylit;
  }

  public static Node string(String s) {
    return Node.newString(s);
  }

  public static Node stringKey(String s, Node value) {
    checkState(mayBeExpression(value));
    Node stringKey = Node.newString(Token.STRING_KEY, s);
    stringKey.addChildToBack(value);
    return stringKey;
  }

  public static Node number(double d) {
    return Node.newNumber(d);
  }

  public static Node thisNode() {
    return new Node(Token.THIS);
  }

  public static Node trueNode() {
    return new Node(Token.TRUE);
  }

  public static Node nullNode() {
    return new Node(Token.NULL);
  }

  /** Builds a statement that prints nothing but an optional {@code //text} line comment. */
  public static Node notEmitted(Node original) {
    Node placeholder = new Node(Token.NOT_EMITTED);
    placeholder.setOriginalNode(original);
    return placeholder;
  }

  private static Node binaryOp(Token token, Node expr1, Node expr2) {
    checkState(mayBeExpression(expr1), expr1);
    checkState(mayBeExpression(expr2), expr2);
    return new Node(token, expr1, expr2);
  }

  private static Node unaryOp(Token token, Node expr) {
    checkState(mayBeExpression(expr));
    return new Node(token, expr);
  }

  /**
   * Whether a detached node can stand as a statement. FUNCTION and EMPTY are accepted in both
   * positions.
   */
  public static boolean mayBeStatement(Node n) {
    return STATEMENTS.contains(n.getToken());
  }

  /**
   * Whether a detached node can be used as an expression. FUNCTION and CLASS are accepted in both
   * positions.
   */
  public static boolean mayBeExpression(Node n) {
    return EXPRESSIONS.contains(n.getToken());
  }

  private static final ImmutableSet<Token> STATEMENTS =
      Sets.immutableEnumSet(
          Token.EMPTY,
          Token.FUNCTION,
          Token.BLOCK,
          Token.BREAK,
          Token.CLASS,
          Token.CONST,
          Token.CONTINUE,
          Token.DEBUGGER,
          Token.DO,
          Token.ENUM,
          Token.EXPORT,
          Token.EXPORT_ASSIGN,
          Token.EXPR_RESULT,
          Token.FOR,
          Token.FOR_IN,
          Token.FOR_OF,
          Token.FOR_AWAIT_OF,
          Token.IF,
          Token.IMPORT,
          Token.IMPORT_EQUALS,
          Token.LABEL,
          Token.LET,
          Token.NAMESPACE,
          Token.NOT_EMITTED,
          Token.RETURN,
          Token.SWITCH,
          Token.THROW,
          Token.TRY,
          Token.VAR,
          Token.WHILE,
          Token.WITH);

  private static final ImmutableSet<Token> EXPRESSIONS =
      Sets.immutableEnumSet(
          Token.FUNCTION,
          Token.CLASS,
          Token.ADD,
          Token.AND,
          Token.ARRAYLIT,
          Token.ASSIGN,
          Token.ASSIGN_BITOR,
          Token.ASSIGN_BITXOR,
          Token.ASSIGN_BITAND,
          Token.ASSIGN_LSH,
          Token.ASSIGN_RSH,
          Token.ASSIGN_URSH,
          Token.ASSIGN_ADD,
          Token.ASSIGN_SUB,
          Token.ASSIGN_MUL,
          Token.ASSIGN_EXPONENT,
          Token.ASSIGN_DIV,
          Token.ASSIGN_MOD,
          Token.ASSIGN_OR,
          Token.ASSIGN_AND,
          Token.ASSIGN_COALESCE,
          Token.AWAIT,
          Token.BIGINT,
          Token.BITAND,
          Token.BITOR,
          Token.BITNOT,
          Token.BITXOR,
          Token.CALL,
          Token.COALESCE,
          Token.COMMA,
          Token.DEC,
          Token.DELPROP,
          Token.DIV,
          Token.DYNAMIC_IMPORT,
          Token.EQ,
          Token.EXPONENT,
          Token.FALSE,
          Token.GE,
          Token.GETPROP,
          Token.GETELEM,
          Token.GT,
          Token.HOOK,
          Token.IMPORT_META,
          Token.IN,
          Token.INC,
          Token.INSTANCEOF,
          Token.LE,
          Token.LSH,
          Token.LT,
          Token.MOD,
          Token.MUL,
          Token.NAME,
          Token.NE,
          Token.NEG,
          Token.NEW,
          Token.NEW_TARGET,
          Token.NOT,
          Token.NUMBER,
          Token.NULL,
          Token.OBJECTLIT,
          Token.OPTCHAIN_CALL,
          Token.OPTCHAIN_GETELEM,
          Token.OPTCHAIN_GETPROP,
          Token.OR,
          Token.POS,
          Token.REGEXP,
          Token.RSH,
          Token.SHEQ,
          Token.SHNE,
          Token.STRINGLIT,
          Token.SUB,
          Token.SUPER,
          Token.TEMPLATELIT,
          Token.TAGGED_TEMPLATELIT,
          Token.THIS,
          Token.TYPEOF,
          Token.TRUE,
          Token.URSH,
          Token.VOID,
          Token.YIELD);
}
