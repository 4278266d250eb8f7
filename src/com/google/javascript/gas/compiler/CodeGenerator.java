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

import static com.google.common.base.Preconditions.checkState;

import com.google.javascript.gas.ast.Comment;
import com.google.javascript.gas.ast.Node;
import com.google.javascript.gas.ast.Token;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * CodeGenerator generates codes from a parse tree, sending it to the specified CodeConsumer.
 *
 * <p>Every node is offered to the {@link SubstitutionChain} before it is printed, and the node the
 * chain returns is printed in its place.
 */
public class CodeGenerator {
  private static final Pattern DECIMAL_LITERAL =
      Pattern.compile("(?:[0-9]+\\.?[0-9]*|\\.[0-9]+)(?:[eE][+-]?[0-9]+)?");
  private static final Pattern HEX_LITERAL = Pattern.compile("0[xX][0-9a-fA-F]+");

  private final CodeConsumer cc;
  private final boolean quoteKeywordProperties;
  private final boolean preserveComments;
  private final SubstitutionChain substitutions;

  // Strings printed more than once, such as property names, are escaped once.
  private final Map<String, String> escapedJsStrings = new HashMap<>();

  CodeGenerator(CodeConsumer consumer, CompilerOptions options, SubstitutionChain substitutions) {
    this.cc = consumer;
    this.quoteKeywordProperties = options.getLanguageOut().quotesKeywordProperties();
    this.preserveComments = options.shouldPreserveComments();
    this.substitutions = substitutions;
  }

  protected void add(String str) {
    cc.add(str);
  }

  protected void add(Node n) {
    add(n, Context.OTHER);
  }

  protected void add(Node n, Context context) {
    addSubstituted(substitutions.substitute(n), context);
  }

  private void addSubstituted(Node n, Context context) {
    Token type = n.getToken();
    String opstr = NodeUtil.opToStr(type);
    int childCount = n.getChildCount();
    Node first = n.getFirstChild();
    Node last = n.getLastChild();

    // Handle all binary operators
    if (opstr != null && first != last) {
      checkState(
          childCount == 2,
          "Bad binary operator \"%s\": expected 2 arguments but got %s",
          opstr,
          childCount);
      int p = NodeUtil.precedence(type);

      // For right-hand-side of operations, only pass context if it's
      // the IN_FOR_INIT_CLAUSE one.
      Context rhsContext = getContextForNoInOperator(context);

      boolean needsParens =
          (context == Context.START_OF_EXPR || context.atArrowFunctionBody())
              && first.isObjectPattern();
      if (n.isAssign() && needsParens) {
        add("(");
      }

      if (NodeUtil.isAssignmentOp(n) || type == Token.EXPONENT) {
        // Assignment operators and '**' are the only right-associative binary operators
        addExpr(first, p + 1, context);
        cc.addOp(opstr, true);
        addExpr(last, p, rhsContext);
      } else {
        unrollBinaryOperator(n, type, opstr, context, rhsContext, p, p + 1);
      }

      if (n.isAssign() && needsParens) {
        add(")");
      }
      return;
    }

    switch (type) {
      case SCRIPT:
        for (Node c = first; c != null; c = c.getNext()) {
          addStatement(c);
        }
        addDanglingComments(n);
        break;

      case BLOCK:
        if (n.isStaticMember()) {
          add("static");
        }
        if (isEmptyBlock(n)) {
          cc.emptyBlock();
          break;
        }
        cc.beginBlock();
        for (Node c = first; c != null; c = c.getNext()) {
          addStatement(c);
        }
        addDanglingComments(n);
        cc.endBlock();
        break;

      case NOT_EMITTED:
        addNotEmitted(n);
        break;

      case EMPTY:
        if (context == Context.STATEMENT) {
          cc.endStatement();
        }
        break;

      case EXPR_RESULT:
        checkState(childCount == 1, n);
        addExpr(first, 0, Context.START_OF_EXPR);
        cc.endStatement();
        break;

      case VAR:
      case LET:
      case CONST:
        add(keywordOf(type) + " ");
        addList(first, false, getContextForNoInOperator(context), ",");
        if (context == Context.STATEMENT) {
          cc.endStatement();
        }
        break;

      case DESTRUCTURING_LHS:
        add(first);
        if (first != last) {
          cc.addOp("=", true);
          addExpr(last, 1, getContextForNoInOperator(context));
        }
        break;

      case NAME:
        add(n.getString());
        if (first != null) {
          checkState(childCount == 1, n);
          cc.addOp("=", true);
          addExpr(first, 1, getContextForNoInOperator(context));
        }
        break;

      case LABEL_NAME:
        add(n.getString());
        break;

      case IF:
        checkState(childCount == 2 || childCount == 3, n);
        add("if (");
        add(first);
        add(")");
        addNonEmptyStatement(first.getNext());
        if (childCount == 3) {
          cc.maybeInsertSpace();
          add("else");
          if (last.getToken() == Token.IF) {
            cc.maybeInsertSpace();
            add(last, Context.STATEMENT);
          } else {
            addNonEmptyStatement(last);
          }
        }
        break;

      case FOR:
        checkState(childCount == 4, n);
        add("for (");
        if (first.isNameDeclaration()) {
          add(first, Context.IN_FOR_INIT_CLAUSE);
        } else {
          addExpr(first, 0, Context.IN_FOR_INIT_CLAUSE);
        }
        add(";");
        if (!first.getNext().isEmpty()) {
          cc.maybeInsertSpace();
          add(first.getNext());
        }
        add(";");
        if (!first.getNext().getNext().isEmpty()) {
          cc.maybeInsertSpace();
          add(first.getNext().getNext());
        }
        add(")");
        addNonEmptyStatement(last);
        break;

      case FOR_IN:
      case FOR_OF:
      case FOR_AWAIT_OF:
        checkState(childCount == 3, n);
        add(type == Token.FOR_AWAIT_OF ? "for await (" : "for (");
        if (first.isNameDeclaration()) {
          add(first, Context.IN_FOR_INIT_CLAUSE);
        } else {
          addExpr(first, NodeUtil.precedence(Token.ASSIGN), Context.IN_FOR_INIT_CLAUSE);
        }
        cc.addOp(type == Token.FOR_IN ? "in" : "of", true);
        addExpr(first.getNext(), type == Token.FOR_IN ? 0 : 1, Context.OTHER);
        add(")");
        addNonEmptyStatement(last);
        break;

      case DO:
        checkState(childCount == 2, n);
        add("do");
        addNonEmptyStatement(first);
        cc.maybeInsertSpace();
        add("while (");
        add(last);
        add(")");
        cc.endStatement();
        break;

      case WHILE:
        checkState(childCount == 2, n);
        add("while (");
        add(first);
        add(")");
        addNonEmptyStatement(last);
        break;

      case WITH:
        checkState(childCount == 2, n);
        add("with (");
        add(first);
        add(")");
        addNonEmptyStatement(last);
        break;

      case SWITCH:
        add("switch (");
        add(first);
        add(")");
        cc.maybeInsertSpace();
        cc.beginBlock();
        for (Node c = first.getNext(); c != null; c = c.getNext()) {
          addCase(c);
        }
        cc.endBlock();
        break;

      case BREAK:
      case CONTINUE:
        add(type == Token.BREAK ? "break" : "continue");
        if (first != null) {
          add(" ");
          add(first);
        }
        cc.endStatement();
        break;

      case RETURN:
        add("return");
        if (first != null) {
          add(" ");
          add(first);
        }
        cc.endStatement();
        break;

      case THROW:
        checkState(childCount == 1, n);
        add("throw ");
        add(first);
        cc.endStatement();
        break;

      case DEBUGGER:
        add("debugger");
        cc.endStatement();
        break;

      case TRY:
        {
          checkState(childCount >= 2 && childCount <= 3, n);
          add("try");
          add(first);

          // second child contains the catch block, or nothing if there
          // isn't a catch block
          Node catchblock = first.getNext().getFirstChild();
          if (catchblock != null) {
            add(catchblock);
          }

          if (childCount == 3) {
            cc.maybeInsertSpace();
            add("finally");
            add(last);
          }
          break;
        }

      case CATCH:
        checkState(childCount == 2, n);
        cc.maybeInsertSpace();
        add("catch");
        if (!first.isEmpty()) {
          add(" (");
          add(first);
          add(")");
        }
        add(last);
        break;

      case LABEL:
        checkState(childCount == 2, n);
        add(first);
        add(":");
        cc.maybeInsertSpace();
        add(last, Context.STATEMENT);
        break;

      case FUNCTION:
        checkState(childCount == 3, n);
        if (n.isArrowFunction()) {
          addArrowFunction(n, first, last, context);
        } else {
          addFunction(n, first, last, context);
        }
        break;

      case PARAM_LIST:
        add("(");
        addList(first);
        add(")");
        break;

      case DEFAULT_VALUE:
        add(first);
        cc.addOp("=", true);
        addExpr(last, 1, Context.OTHER);
        break;

      case ITER_REST:
      case OBJECT_REST:
        add("...");
        add(first);
        break;

      case ITER_SPREAD:
      case OBJECT_SPREAD:
        add("...");
        addExpr(first, NodeUtil.precedence(Token.ASSIGN), Context.OTHER);
        break;

      case ARRAYLIT:
      case ARRAY_PATTERN:
        add("[");
        addArrayList(first);
        add("]");
        break;

      case OBJECTLIT:
      case OBJECT_PATTERN:
        {
          boolean needsParens =
              type == Token.OBJECTLIT
                  && (context == Context.START_OF_EXPR || context.atArrowFunctionBody());
          if (needsParens) {
            add("(");
          }
          if (first == null) {
            add("{}");
          } else {
            add("{ ");
            for (Node c = first; c != null; c = c.getNext()) {
              if (c != first) {
                cc.listSeparator();
              }
              add(c);
            }
            add(" }");
          }
          if (needsParens) {
            add(")");
          }
          break;
        }

      case STRING_KEY:
        addStringKey(n);
        break;

      case GETTER_DEF:
      case SETTER_DEF:
        add(type == Token.GETTER_DEF ? "get " : "set ");
        addPropertyName(n);
        addFunctionSignatureAndBody(first);
        break;

      case MEMBER_FUNCTION_DEF:
        if (first.isAsyncFunction()) {
          add("async ");
        }
        if (first.isGeneratorFunction()) {
          add("*");
        }
        addPropertyName(n);
        addFunctionSignatureAndBody(first);
        break;

      case MEMBER_FIELD_DEF:
        addPropertyName(n);
        if (first != null) {
          cc.addOp("=", true);
          addExpr(first, 1, Context.OTHER);
        }
        cc.endStatement();
        break;

      case COMPUTED_PROP:
        add("[");
        addExpr(first, 1, Context.OTHER);
        add("]");
        if (n.getParent() != null && n.getParent().getToken() == Token.CLASS_MEMBERS) {
          if (last.isFunction()) {
            addFunctionSignatureAndBody(last);
          } else {
            if (!last.isEmpty()) {
              cc.addOp("=", true);
              addExpr(last, 1, Context.OTHER);
            }
            cc.endStatement();
          }
        } else {
          add(":");
          cc.maybeInsertSpace();
          addExpr(last, 1, Context.OTHER);
        }
        break;

      case CLASS:
        {
          checkState(childCount == 3, n);
          boolean classNeedsParens = (context == Context.START_OF_EXPR);
          if (classNeedsParens) {
            add("(");
          }
          add("class");
          if (!first.isEmpty()) {
            add(" ");
            add(first);
          }
          if (!first.getNext().isEmpty()) {
            add(" extends ");
            addExpr(first.getNext(), NodeUtil.precedence(Token.CALL), Context.OTHER);
          }
          add(last);
          if (classNeedsParens) {
            add(")");
          }
          break;
        }

      case CLASS_MEMBERS:
        cc.maybeInsertSpace();
        if (first == null && !hasPrintedComments(n.getDanglingComments())) {
          add("{ }");
          break;
        }
        cc.beginBlock();
        for (Node c = first; c != null; c = c.getNext()) {
          addLeadingComments(c);
          if (c.isStaticMember() && !c.isBlock()) {
            add("static ");
          }
          add(c);
          addTrailingComments(c);
          cc.endLine();
        }
        addDanglingComments(n);
        cc.endBlock();
        break;

      case GETPROP:
      case OPTCHAIN_GETPROP:
        {
          checkState(childCount == 1, n);
          if (first.isNumber()) {
            add("(");
            add(first);
            add(")");
          } else {
            addExpr(first, NodeUtil.precedence(type), context);
          }
          String prop = n.getString();
          boolean optional = type == Token.OPTCHAIN_GETPROP && n.isOptionalChainStart();
          if (NodeUtil.isValidPropertyName(prop, !quoteKeywordProperties)) {
            add(optional ? "?." : ".");
            add(prop);
          } else {
            add(optional ? "?.[" : "[");
            add(jsString(prop));
            add("]");
          }
          break;
        }

      case GETELEM:
      case OPTCHAIN_GETELEM:
        checkState(childCount == 2, n);
        addExpr(first, NodeUtil.precedence(type), context);
        add(type == Token.OPTCHAIN_GETELEM && n.isOptionalChainStart() ? "?.[" : "[");
        add(first.getNext());
        add("]");
        break;

      case CALL:
      case OPTCHAIN_CALL:
        if (first.isFunction() && !first.isArrowFunction()) {
          // An immediately invoked function expression.
          add("(");
          add(first);
          add(")");
        } else {
          addExpr(first, NodeUtil.precedence(type), context);
        }
        add(type == Token.OPTCHAIN_CALL && n.isOptionalChainStart() ? "?.(" : "(");
        addList(first.getNext());
        add(")");
        break;

      case NEW:
        {
          add("new ");
          int precedence = NodeUtil.precedence(type);
          // If the callee contains a CALL, claim higher precedence to force parentheses.
          if (NodeUtil.has(first, Node::isCall, c -> !c.isFunction())) {
            precedence = NodeUtil.precedence(Token.CALL) + 1;
          }
          addExpr(first, precedence, Context.OTHER);
          add("(");
          addList(first.getNext());
          add(")");
          break;
        }

      case TAGGED_TEMPLATELIT:
        addExpr(first, NodeUtil.precedence(Token.CALL), context);
        add(last);
        break;

      case TEMPLATELIT:
        cc.add("`");
        for (Node c = first; c != null; c = c.getNext()) {
          if (c.getToken() == Token.TEMPLATELIT_SUB) {
            cc.append("${");
            add(c.getFirstChild());
            cc.append("}");
          } else {
            cc.append(c.getRawString());
          }
        }
        cc.append("`");
        break;

      case HOOK:
        {
          checkState(childCount == 3, n);
          int p = NodeUtil.precedence(type);
          Context rhsContext = getContextForNoInOperator(context);
          addExpr(first, p + 1, context);
          cc.addOp("?", true);
          addExpr(first.getNext(), 1, rhsContext);
          cc.addOp(":", true);
          addExpr(last, 1, rhsContext);
          break;
        }

      case NOT:
      case BITNOT:
      case POS:
      case NEG:
        // All of these unary operators are right-associative
        checkState(childCount == 1, n);
        cc.addOp(NodeUtil.opToStrNoFail(type), false);
        addExpr(first, NodeUtil.precedence(type), Context.OTHER);
        break;

      case TYPEOF:
      case VOID:
      case DELPROP:
      case AWAIT:
        checkState(childCount == 1, n);
        add((type == Token.AWAIT ? "await" : NodeUtil.opToStrNoFail(type)) + " ");
        addExpr(first, NodeUtil.precedence(type), Context.OTHER);
        break;

      case YIELD:
        add("yield");
        if (first != null) {
          add(" ");
          addExpr(first, NodeUtil.precedence(type), Context.OTHER);
        }
        break;

      case INC:
      case DEC:
        {
          checkState(childCount == 1, n);
          String o = type == Token.INC ? "++" : "--";
          if (n.isPostfix()) {
            addExpr(first, NodeUtil.precedence(type), context);
            cc.addOp(o, false);
          } else {
            cc.addOp(o, false);
            add(first);
          }
          break;
        }

      case NUMBER:
        checkState(childCount == 0, n);
        cc.addNumber(numberToSource(n));
        break;

      case BIGINT:
      case REGEXP:
        add(n.getString());
        break;

      case STRINGLIT:
        checkState(childCount == 0, n);
        String literal = stringFromSource(n);
        add(literal != null ? literal : jsString(n.getString()));
        break;

      case NULL:
        add("null");
        break;

      case THIS:
        add("this");
        break;

      case SUPER:
        add("super");
        break;

      case TRUE:
        add("true");
        break;

      case FALSE:
        add("false");
        break;

      case NEW_TARGET:
        add("new.target");
        break;

      case IMPORT_META:
        add("import.meta");
        break;

      case DYNAMIC_IMPORT:
        add("import(");
        addExpr(first, 1, Context.OTHER);
        add(")");
        break;

      case IMPORT:
        addImport(n);
        break;

      case IMPORT_SPECS:
      case EXPORT_SPECS:
        add("{ ");
        for (Node c = first; c != null; c = c.getNext()) {
          if (c != first) {
            cc.listSeparator();
          }
          add(c);
        }
        add(" }");
        break;

      case IMPORT_SPEC:
      case EXPORT_SPEC:
        add(first.getString());
        if (!first.getString().equals(last.getString())) {
          add(" as ");
          add(last.getString());
        }
        break;

      case IMPORT_STAR:
        add("* as ");
        add(n.getString());
        break;

      case EXPORT:
        addExport(n, first, last);
        break;

      default:
        throw new IllegalStateException("Cannot print " + type + "\n" + n.toStringTree());
    }
  }

  // ==========================================================================
  // Statements and comments

  /**
   * Prints a statement of a statement list with its comments, ending its line. A statement that a
   * substitution hook turns into a {@code NOT_EMITTED} node takes no line unless it has a comment.
   */
  private void addStatement(Node statement) {
    Node n = substitutions.substitute(statement);
    addLeadingComments(n);
    addSubstituted(n, Context.STATEMENT);
    addTrailingComments(n);
    cc.endLine();
  }

  private void addNotEmitted(Node n) {
    String text = n.getSyntheticComment();
    if (text != null) {
      cc.startNewLine();
      cc.addComment("//" + text);
    }
  }

  private void addLeadingComments(Node n) {
    if (!preserveComments) {
      return;
    }
    for (Comment comment : n.getLeadingComments()) {
      cc.startNewLine();
      cc.addComment(comment.text());
      cc.endLine();
    }
  }

  private void addTrailingComments(Node n) {
    if (!preserveComments) {
      return;
    }
    for (Comment comment : n.getTrailingComments()) {
      cc.maybeInsertSpace();
      cc.addComment(comment.text());
    }
  }

  private void addDanglingComments(Node n) {
    if (!preserveComments) {
      return;
    }
    for (Comment comment : n.getDanglingComments()) {
      cc.startNewLine();
      cc.addComment(comment.text());
      cc.endLine();
    }
  }

  private boolean hasPrintedComments(Iterable<Comment> comments) {
    return preserveComments && comments.iterator().hasNext();
  }

  private boolean isEmptyBlock(Node block) {
    return !block.hasChildren() && !hasPrintedComments(block.getDanglingComments());
  }

  /**
   * Adds the body of a control statement, always as a braced block so that each statement is
   * printed on its own line.
   */
  private void addNonEmptyStatement(Node n) {
    if (n.isBlock()) {
      add(n, Context.STATEMENT);
    } else if (n.isEmpty()) {
      cc.emptyBlock();
    } else {
      cc.maybeInsertSpace();
      cc.beginBlock();
      addStatement(n);
      cc.endBlock();
    }
  }

  private void addCase(Node caseNode) {
    addLeadingComments(caseNode);
    if (caseNode.getToken() == Token.CASE) {
      add("case ");
      add(caseNode.getFirstChild());
    } else {
      checkState(caseNode.getToken() == Token.DEFAULT_CASE, caseNode);
      add("default");
    }
    Node caseBody = caseNode.getLastChild();
    checkState(caseBody.isBlock(), caseBody);
    cc.beginCaseBody();
    for (Node c = caseBody.getFirstChild(); c != null; c = c.getNext()) {
      addStatement(c);
    }
    cc.endCaseBody();
  }

  // ==========================================================================
  // Functions

  private static boolean arrowFunctionNeedsParens(Node n) {
    Node parent = n.getParent();
    if (parent == null) {
      return false;
    } else if (NodeUtil.opToStr(parent.getToken()) != null
        || parent.getToken() == Token.INC
        || parent.getToken() == Token.DEC
        || parent.getToken() == Token.TAGGED_TEMPLATELIT
        || parent.isGetProp()) {
      return true;
    } else if (parent.getToken() == Token.GETELEM
        || parent.isCall()
        || parent.getToken() == Token.HOOK) {
      return n.isFirstChildOf(parent);
    } else {
      return false;
    }
  }

  private void addArrowFunction(Node n, Node first, Node last, Context context) {
    checkState(first.getString().isEmpty(), first);
    boolean funcNeedsParens = arrowFunctionNeedsParens(n);
    if (funcNeedsParens) {
      add("(");
    }
    if (n.isAsyncFunction()) {
      add("async ");
    }
    add(first.getNext()); // param list
    cc.addOp("=>", true);
    if (last.isBlock()) {
      add(last);
    } else {
      // Blockless arrow function bodies have lower precedence than anything other than commas.
      addExpr(last, NodeUtil.precedence(Token.COMMA) + 1, getContextForArrowFunctionBody(context));
    }
    if (funcNeedsParens) {
      add(")");
    }
  }

  private void addFunction(Node n, Node first, Node last, Context context) {
    boolean funcNeedsParens = (context == Context.START_OF_EXPR);
    if (funcNeedsParens) {
      add("(");
    }
    add(n.isAsyncFunction() ? "async function" : "function");
    if (n.isGeneratorFunction()) {
      add("*");
    }
    add(" ");
    add(first);
    add(first.getNext()); // param list
    add(last);
    if (funcNeedsParens) {
      add(")");
    }
  }

  /** Adds the parameters and body of a method, getter or setter. */
  private void addFunctionSignatureAndBody(Node function) {
    checkState(function.isFunction(), function);
    add(function.getSecondChild());
    add(function.getLastChild());
  }

  // ==========================================================================
  // Modules

  private void addImport(Node n) {
    Node defaultBinding = n.getFirstChild();
    Node bindings = defaultBinding.getNext();
    Node source = n.getLastChild();
    add("import ");
    if (!defaultBinding.isEmpty()) {
      add(defaultBinding);
      if (!bindings.isEmpty()) {
        cc.listSeparator();
      }
    }
    if (!bindings.isEmpty()) {
      add(bindings);
    }
    if (!defaultBinding.isEmpty() || !bindings.isEmpty()) {
      add(" from ");
    }
    add(source);
    cc.endStatement();
  }

  private void addExport(Node n, Node first, Node last) {
    add("export ");
    if (n.isExportAllFrom()) {
      add("*");
      if (!first.isEmpty()) {
        add(" as ");
        add(first.getString());
      }
      add(" from ");
      add(last);
      cc.endStatement();
    } else if (n.isExportDefault()) {
      add("default ");
      if (NodeUtil.isFunctionDeclaration(first)
          || first.isClass()
          || (first.isFunction() && !first.isArrowFunction())) {
        add(first, Context.STATEMENT);
      } else {
        addExpr(first, 1, Context.OTHER);
        cc.endStatement();
      }
    } else if (first.getToken() == Token.EXPORT_SPECS) {
      add(first);
      if (first != last) {
        add(" from ");
        add(last);
      }
      cc.endStatement();
    } else {
      add(first, Context.STATEMENT);
    }
  }

  // ==========================================================================
  // Expressions

  /**
   * We could use addList recursively here, but sometimes we produce very deeply nested operators
   * and run out of stack space, so we just unroll the recursion when possible.
   *
   * <p>We assume nodes are left-recursive.
   */
  private void unrollBinaryOperator(
      Node n,
      Token op,
      String opStr,
      Context context,
      Context rhsContext,
      int leftPrecedence,
      int rightPrecedence) {
    Node firstNonOperator = n.getFirstChild();
    while (firstNonOperator.getToken() == op) {
      firstNonOperator = firstNonOperator.getFirstChild();
    }

    addExpr(firstNonOperator, leftPrecedence, context);

    Node current = firstNonOperator;
    do {
      current = current.getParent();
      cc.addOp(opStr, true);
      addExpr(current.getSecondChild(), rightPrecedence, rhsContext);
    } while (current != n);
  }

  private void addExpr(Node node, int minPrecedence, Context context) {
    Node n = substitutions.substitute(node);
    if (opRequiresParentheses(n, minPrecedence, context)) {
      add("(");
      addSubstituted(n, Context.OTHER);
      add(")");
    } else {
      addSubstituted(n, context);
    }
  }

  private static boolean opRequiresParentheses(Node n, int minPrecedence, Context context) {
    if (context.inForInInitClause() && n.getToken() == Token.IN) {
      // make sure this operator 'in' isn't confused with the for-loop 'in'
      return true;
    } else if (isUnaryOperator(n) && isFirstOperandOfExponentiationExpression(n)) {
      // Unary operators are higher precedence than '**', but
      // ExponentiationExpression cannot expand to
      //     UnaryExpression ** ExponentiationExpression
      return true;
    } else {
      return NodeUtil.precedence(n.getToken()) < minPrecedence;
    }
  }

  private static boolean isUnaryOperator(Node n) {
    switch (n.getToken()) {
      case NOT:
      case BITNOT:
      case POS:
      case NEG:
      case TYPEOF:
      case VOID:
      case DELPROP:
      case AWAIT:
        return true;
      default:
        return false;
    }
  }

  private static boolean isFirstOperandOfExponentiationExpression(Node n) {
    Node parent = n.getParent();
    return parent != null && parent.getToken() == Token.EXPONENT && parent.getFirstChild() == n;
  }

  void addList(@Nullable Node firstInList) {
    addList(firstInList, true, Context.OTHER, ",");
  }

  void addList(
      @Nullable Node firstInList,
      boolean isArrayOrFunctionArgument,
      Context lhsContext,
      String separator) {
    for (Node n = firstInList; n != null; n = n.getNext()) {
      boolean isFirst = n == firstInList;
      if (isFirst) {
        addExpr(n, isArrayOrFunctionArgument ? 1 : 0, lhsContext);
      } else {
        cc.addOp(separator, true);
        addExpr(n, isArrayOrFunctionArgument ? 1 : 0, getContextForNoInOperator(lhsContext));
      }
    }
  }

  /**
   * This function adds a comma-separated list as is specified by an ARRAYLIT node. A trailing hole
   * needs its own comma.
   */
  void addArrayList(@Nullable Node firstInList) {
    boolean lastWasEmpty = false;
    for (Node n = firstInList; n != null; n = n.getNext()) {
      if (n != firstInList) {
        cc.listSeparator();
      }
      addExpr(n, 1, Context.OTHER);
      lastWasEmpty = n.isEmpty();
    }

    if (lastWasEmpty) {
      add(",");
    }
  }

  void addStringKey(Node n) {
    checkState(n.hasOneChild(), n);
    addPropertyName(n);
    add(":");
    cc.maybeInsertSpace();
    addExpr(n.getFirstChild(), 1, Context.OTHER);
  }

  /** Adds the name of an object literal property or class member. */
  private void addPropertyName(Node n) {
    String key = n.getString();
    // Object literal property names don't have to be quoted if they are not JavaScript keywords.
    boolean mustBeQuoted =
        n.isQuotedString() || !NodeUtil.isValidPropertyName(key, !quoteKeywordProperties);
    if (!mustBeQuoted || key.startsWith("#")) {
      add(key);
    } else if (!n.isQuotedString() && isSimpleNumber(key)) {
      add(key);
    } else {
      add(jsString(key));
    }
  }

  static boolean isSimpleNumber(String s) {
    int len = s.length();
    if (len == 0) {
      return false;
    }
    for (int index = 0; index < len; index++) {
      char c = s.charAt(index);
      if (c < '0' || c > '9') {
        return false;
      }
    }
    return len == 1 || s.charAt(0) != '0';
  }

  // ==========================================================================
  // Literals

  /**
   * Returns the number as written in the source when it is a decimal or hex literal with the
   * node's value, or its canonical form otherwise.
   */
  private static String numberToSource(Node n) {
    double value = n.getDouble();
    String text = n.isSynthetic() ? null : n.getSourceText();
    if (text != null) {
      if (DECIMAL_LITERAL.matcher(text).matches() && !isLegacyOctal(text)) {
        if (Double.parseDouble(text) == value) {
          return text;
        }
      } else if (HEX_LITERAL.matcher(text).matches()) {
        try {
          if (Long.parseLong(text.substring(2), 16) == value) {
            return text;
          }
        } catch (NumberFormatException e) {
          // Too long for a long. The canonical form is used.
        }
      }
    }
    return NodeUtil.numberToString(value);
  }

  private static boolean isLegacyOctal(String text) {
    return text.length() > 1 && text.charAt(0) == '0' && Character.isDigit(text.charAt(1));
  }

  /** Returns a string literal exactly as written in the source, or null for a built string. */
  private static @Nullable String stringFromSource(Node n) {
    if (n.isSynthetic()) {
      return null;
    }
    String text = n.getSourceText();
    if (text == null || text.length() < 2) {
      return null;
    }
    char quote = text.charAt(0);
    if ((quote != '"' && quote != '\'') || text.charAt(text.length() - 1) != quote) {
      return null;
    }
    return text;
  }

  /** Outputs a JS string, using the optimal (single/double) quote character */
  private String jsString(String s) {
    return escapedJsStrings.computeIfAbsent(s, CodeGenerator::quote);
  }

  private static String quote(String s) {
    int singleq = 0;
    int doubleq = 0;

    // could count the quotes and pick the optimal quote character
    for (int i = 0; i < s.length(); i++) {
      switch (s.charAt(i)) {
        case '"':
          doubleq++;
          break;
        case '\'':
          singleq++;
          break;
        default: // skip non-quote characters
      }
    }

    String doublequote;
    String singlequote;
    char quote;
    if (singleq < doubleq) {
      // more double quotes so enclose in single quotes.
      quote = '\'';
      doublequote = "\"";
      singlequote = "\\\'";
    } else {
      // more single quotes so escape the doubles
      quote = '\"';
      doublequote = "\\\"";
      singlequote = "\'";
    }

    return quote + strEscape(s, doublequote, singlequote) + quote;
  }

  /** Helper to escape JavaScript string. */
  private static String strEscape(String s, String doublequoteEscape, String singlequoteEscape) {
    StringBuilder sb = new StringBuilder(s.length() + 2);
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '\0':
          sb.append("\\0");
          break;
        case '\u000B':
          sb.append("\\v");
          break;
        // From the SingleEscapeCharacter grammar production.
        case '\b':
          sb.append("\\b");
          break;
        case '\f':
          sb.append("\\f");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\"':
          sb.append(doublequoteEscape);
          break;
        case '\'':
          sb.append(singlequoteEscape);
          break;

        // From LineTerminators (ES5 Section 7.3, Table 3)
        case '\u2028':
          sb.append("\\u2028");
          break;
        case '\u2029':
          sb.append("\\u2029");
          break;

        default:
          if (c > 0x1f && c < 0x7f) {
            sb.append(c);
          } else {
            // Other characters can be misinterpreted by some JS parsers,
            // or perhaps mangled by proxies along the way,
            // so we play it safe and Unicode escape them.
            appendHexJavaScriptRepresentation(sb, c);
          }
      }
    }
    return sb.toString();
  }

  private static void appendHexJavaScriptRepresentation(StringBuilder sb, char c) {
    sb.append("\\u");
    String hex = Integer.toHexString(c);
    for (int i = hex.length(); i < 4; i++) {
      sb.append('0');
    }
    sb.append(hex);
  }

  private static String keywordOf(Token declaration) {
    switch (declaration) {
      case VAR:
        return "var";
      case LET:
        return "let";
      case CONST:
        return "const";
      default:
        throw new IllegalArgumentException(declaration.toString());
    }
  }

  /**
   * Information on the current context. Used for disambiguating special cases. For example, a "{"
   * could indicate the start of an object literal or a block, depending on the current context.
   */
  public enum Context {
    STATEMENT,
    START_OF_EXPR,
    // Are we inside the init clause of a for loop?  If so, the containing
    // expression can't contain an in operator.  Pass this context flag down
    // until we reach expressions which no longer have the limitation.
    IN_FOR_INIT_CLAUSE(
        /* inForInitClause= */ true, /* atStartOfArrowFnBody= */ false),
    // Handle object literals at the start of a non-block arrow function body.
    // This is only important when the first token after the "=>" is "{".
    START_OF_ARROW_FN_BODY(
        /* inForInitClause= */ false, /* atStartOfArrowFnBody= */ true),
    START_OF_ARROW_FN_IN_FOR_INIT(
        /* inForInitClause= */ true, /* atStartOfArrowFnBody= */ true),
    OTHER; // nothing special to watch out for.

    private final boolean inForInitClause;
    private final boolean atArrowFnBody;

    Context() {
      this(false, false);
    }

    Context(boolean inForInitClause, boolean atStartOfArrowFnBody) {
      this.inForInitClause = inForInitClause;
      this.atArrowFnBody = atStartOfArrowFnBody;
    }

    public boolean inForInInitClause() {
      return inForInitClause;
    }

    public boolean atArrowFunctionBody() {
      return atArrowFnBody;
    }
  }

  /**
   * If we're in a IN_FOR_INIT_CLAUSE, we can't permit in operators in the expression. Pass on the
   * IN_FOR_INIT_CLAUSE flag through subexpressions.
   */
  private static Context getContextForNoInOperator(Context context) {
    return (context.inForInInitClause() ? context : Context.OTHER);
  }

  /**
   * If we're at the start of an arrow function body, we need parentheses around object literals.
   * We also must also pass the IN_FOR_INIT_CLAUSE flag into subexpressions.
   */
  private static Context getContextForArrowFunctionBody(Context context) {
    return context.inForInInitClause()
        ? Context.START_OF_ARROW_FN_IN_FOR_INIT
        : Context.START_OF_ARROW_FN_BODY;
  }
}
