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

package com.google.javascript.gas.compiler.parsing;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.javascript.gas.ast.Comment;
import com.google.javascript.gas.ast.IR;
import com.google.javascript.gas.ast.Node;
import com.google.javascript.gas.ast.Node.Prop;
import com.google.javascript.gas.ast.SourceFile;
import com.google.javascript.gas.ast.Token;
import com.google.javascript.gas.compiler.CheckLevel;
import com.google.javascript.gas.compiler.DiagnosticType;
import com.google.javascript.gas.compiler.ErrorManager;
import com.google.javascript.gas.compiler.JSError;
import com.google.javascript.gas.compiler.NodeUtil;
import com.google.javascript.gas.compiler.parsing.Scanner.ParseError;
import com.google.javascript.gas.compiler.parsing.SyntaxToken.Kind;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;

/**
 * A recursive descent parser for TypeScript and JavaScript.
 *
 * <p>Type annotations, casts, generics and declarations that have no runtime meaning
 * ({@code interface}, {@code type}, {@code declare}, overload signatures, abstract members) are
 * erased while parsing, so the tree only holds what will be emitted. Comments are attached to
 * the statements, class members and enum members they precede or trail; comments inside
 * expressions are dropped.
 *
 * <p>Ambiguous constructs (arrow function heads, generic calls) are parsed speculatively: the
 * parser saves its position, tries one reading and rewinds if it fails.
 */
public final class Parser {

  public static final DiagnosticType PARSE_ERROR =
      DiagnosticType.error("JSC_PARSE_ERROR", "Parse error. {0}");

  private static final ImmutableSet<String> RESERVED_WORDS =
      ImmutableSet.of(
          "break", "case", "catch", "class", "const", "continue", "debugger", "default", "delete",
          "do", "else", "enum", "export", "extends", "false", "finally", "for", "function", "if",
          "import", "in", "instanceof", "new", "null", "return", "super", "switch", "this",
          "throw", "true", "try", "typeof", "var", "void", "while", "with");

  private static final ImmutableSet<String> MODIFIERS =
      ImmutableSet.of(
          "public", "private", "protected", "readonly", "static", "abstract", "override",
          "declare", "accessor");

  private static final ImmutableMap<String, Token> ASSIGNMENT_OPERATORS =
      ImmutableMap.<String, Token>builder()
          .put("=", Token.ASSIGN)
          .put("|=", Token.ASSIGN_BITOR)
          .put("^=", Token.ASSIGN_BITXOR)
          .put("&=", Token.ASSIGN_BITAND)
          .put("<<=", Token.ASSIGN_LSH)
          .put(">>=", Token.ASSIGN_RSH)
          .put(">>>=", Token.ASSIGN_URSH)
          .put("+=", Token.ASSIGN_ADD)
          .put("-=", Token.ASSIGN_SUB)
          .put("*=", Token.ASSIGN_MUL)
          .put("/=", Token.ASSIGN_DIV)
          .put("%=", Token.ASSIGN_MOD)
          .put("**=", Token.ASSIGN_EXPONENT)
          .put("||=", Token.ASSIGN_OR)
          .put("&&=", Token.ASSIGN_AND)
          .put("??=", Token.ASSIGN_COALESCE)
          .buildOrThrow();

  private record BinaryOperator(Token token, int precedence) {}

  private static final int RELATIONAL_PRECEDENCE = 8;

  private static final ImmutableMap<String, BinaryOperator> BINARY_OPERATORS =
      ImmutableMap.<String, BinaryOperator>builder()
          .put("??", new BinaryOperator(Token.COALESCE, 1))
          .put("||", new BinaryOperator(Token.OR, 2))
          .put("&&", new BinaryOperator(Token.AND, 3))
          .put("|", new BinaryOperator(Token.BITOR, 4))
          .put("^", new BinaryOperator(Token.BITXOR, 5))
          .put("&", new BinaryOperator(Token.BITAND, 6))
          .put("==", new BinaryOperator(Token.EQ, 7))
          .put("!=", new BinaryOperator(Token.NE, 7))
          .put("===", new BinaryOperator(Token.SHEQ, 7))
          .put("!==", new BinaryOperator(Token.SHNE, 7))
          .put("<", new BinaryOperator(Token.LT, RELATIONAL_PRECEDENCE))
          .put(">", new BinaryOperator(Token.GT, RELATIONAL_PRECEDENCE))
          .put("<=", new BinaryOperator(Token.LE, RELATIONAL_PRECEDENCE))
          .put(">=", new BinaryOperator(Token.GE, RELATIONAL_PRECEDENCE))
          .put("instanceof", new BinaryOperator(Token.INSTANCEOF, RELATIONAL_PRECEDENCE))
          .put("in", new BinaryOperator(Token.IN, RELATIONAL_PRECEDENCE))
          .put("<<", new BinaryOperator(Token.LSH, 9))
          .put(">>", new BinaryOperator(Token.RSH, 9))
          .put(">>>", new BinaryOperator(Token.URSH, 9))
          .put("+", new BinaryOperator(Token.ADD, 10))
          .put("-", new BinaryOperator(Token.SUB, 10))
          .put("*", new BinaryOperator(Token.MUL, 11))
          .put("/", new BinaryOperator(Token.DIV, 11))
          .put("%", new BinaryOperator(Token.MOD, 11))
          .put("**", new BinaryOperator(Token.EXPONENT, 12))
          .buildOrThrow();

  /** A property name as written in an object literal, class body or pattern. */
  private record PropertyName(
      String key, boolean quoted, boolean identifier, @Nullable Node computed, int start) {}

  /** Everything needed to rewind the parser to an earlier token. */
  private record State(
      int position,
      SyntaxToken token,
      int prevEnd,
      int commentCursor,
      boolean sawModuleSyntax) {}

  private final SourceFile file;
  private final Scanner scanner;

  private SyntaxToken token;
  // End offset of the last consumed token.
  private int prevEnd;
  // Comments that start before this offset have been attached or dropped.
  private int commentCursor;
  private boolean sawModuleSyntax;
  // Greater than zero inside namespace bodies and ambient declarations.
  private int declarationDepth;
  private boolean inAsync;
  private boolean inGenerator;
  // Set while parsing the class of an export default.
  private boolean classNameOptional;

  private Parser(SourceFile file) {
    this.file = file;
    this.scanner = new Scanner(file);
    this.token = new SyntaxToken(Kind.EOF, "", null, 0, 0, 0, true, ImmutableList.of());
  }

  /**
   * Parses a source file into a SCRIPT node.
   *
   * @return the script, or null if the source has a syntax error, which is then reported to
   *     {@code errorManager}
   */
  public static @Nullable Node parse(SourceFile file, ErrorManager errorManager) {
    Parser parser = new Parser(file);
    try {
      return parser.parseScript();
    } catch (ParseError e) {
      errorManager.report(
          CheckLevel.ERROR,
          JSError.make(
              file.getName(),
              parser.scanner.lineOf(e.offset),
              parser.scanner.columnOf(e.offset),
              PARSE_ERROR,
              e.getMessage()));
      return null;
    }
  }

  private Node parseScript() {
    token = scanner.next();
    Node script = new Node(Token.SCRIPT);
    script.setSourceFile(file);
    parseStatementList(script);
    if (token.kind() != Kind.EOF) {
      throw unexpected("Declaration or statement expected");
    }
    script.putBooleanProp(Prop.ES6_MODULE, sawModuleSyntax);
    script.setSourceRange(0, file.getCode().length());
    script.setLinenoCharno(1, 0);
    return script;
  }

  // ==========================================================================
  // Token navigation

  @CanIgnoreReturnValue
  private SyntaxToken advance() {
    SyntaxToken consumed = token;
    prevEnd = consumed.end();
    token = scanner.next();
    return consumed;
  }

  private boolean at(String punctuator) {
    return token.is(punctuator);
  }

  private boolean eat(String punctuator) {
    if (token.is(punctuator)) {
      advance();
      return true;
    }
    return false;
  }

  @CanIgnoreReturnValue
  private SyntaxToken expect(String punctuator) {
    if (!token.is(punctuator)) {
      throw unexpected("'" + punctuator + "' expected");
    }
    return advance();
  }

  private void expectKeyword(String keyword) {
    if (!token.isIdentifier(keyword)) {
      throw unexpected("'" + keyword + "' expected");
    }
    advance();
  }

  private boolean atBindingIdentifier() {
    return isBindingIdentifier(token);
  }

  private static boolean isBindingIdentifier(SyntaxToken t) {
    return t.kind() == Kind.IDENTIFIER && !RESERVED_WORDS.contains(t.text());
  }

  private String expectBindingIdentifier() {
    if (!atBindingIdentifier()) {
      throw unexpected("Identifier expected");
    }
    return advance().text();
  }

  private String expectIdentifierName() {
    if (token.kind() != Kind.IDENTIFIER && token.kind() != Kind.PRIVATE_NAME) {
      throw unexpected("Identifier expected");
    }
    return advance().text();
  }

  private SyntaxToken peek() {
    State state = mark();
    try {
      advance();
      return token;
    } finally {
      reset(state);
    }
  }

  private void consumeSemicolon() {
    if (eat(";")) {
      return;
    }
    if (at("}") || token.kind() == Kind.EOF || token.newlineBefore()) {
      return;
    }
    throw unexpected("';' expected");
  }

  private ParseError unexpected(String message) {
    return scanner.error(token.start(), message + ", found " + token);
  }

  private State mark() {
    return new State(scanner.getPosition(), token, prevEnd, commentCursor, sawModuleSyntax);
  }

  private void reset(State state) {
    scanner.setPosition(state.position());
    token = state.token();
    prevEnd = state.prevEnd();
    commentCursor = state.commentCursor();
    sawModuleSyntax = state.sawModuleSyntax();
  }

  /** Runs {@code parse}, rewinding and returning null if it throws a parse error. */
  private <T> @Nullable T speculate(Supplier<T> parse) {
    State state = mark();
    try {
      return parse.get();
    } catch (ParseError e) {
      reset(state);
      return null;
    }
  }

  @CanIgnoreReturnValue
  private Node finish(Node node, int start) {
    node.setSourceRange(start, prevEnd);
    node.setLinenoCharno(scanner.lineOf(start), scanner.columnOf(start));
    return node;
  }

  private void markModuleSyntax() {
    if (declarationDepth == 0) {
      sawModuleSyntax = true;
    }
  }

  // ==========================================================================
  // Comments

  private ImmutableList<Comment> takeLeadingComments() {
    ImmutableList.Builder<Comment> taken = ImmutableList.builder();
    for (Comment comment : token.comments()) {
      if (comment.start() >= commentCursor) {
        taken.add(comment);
      }
    }
    commentCursor = Math.max(commentCursor, token.start());
    return taken.build();
  }

  /** Takes the comments that sit on the line where the last consumed token ends. */
  private ImmutableList<Comment> takeTrailingComments() {
    ImmutableList.Builder<Comment> taken = ImmutableList.builder();
    int line = scanner.lineOf(Math.max(prevEnd - 1, 0));
    for (Comment comment : token.comments()) {
      if (comment.start() < commentCursor) {
        continue;
      }
      if (scanner.lineOf(comment.start()) != line) {
        break;
      }
      taken.add(comment);
      commentCursor = comment.end();
    }
    return taken.build();
  }

  // ==========================================================================
  // Statements

  private boolean atStatementListEnd() {
    return token.kind() == Kind.EOF
        || at("}")
        || token.isIdentifier("case")
        || token.isIdentifier("default");
  }

  private void parseStatementList(Node parent) {
    while (!atStatementListEnd()) {
      ImmutableList<Comment> leading = takeLeadingComments();
      Node statement = parseStatement();
      ImmutableList<Comment> trailing = takeTrailingComments();
      if (statement != null) {
        statement.setLeadingComments(leading);
        statement.setTrailingComments(trailing);
        parent.addChildToBack(statement);
      }
    }
    if (at("}") || token.kind() == Kind.EOF) {
      parent.setDanglingComments(takeLeadingComments());
    }
  }

  private Node parseEmbeddedStatement() {
    int start = token.start();
    Node statement = parseStatement();
    return statement != null ? statement : finish(new Node(Token.EMPTY), start);
  }

  /** Parses a statement, returning null for declarations that are erased. */
  private @Nullable Node parseStatement() {
    int start = token.start();
    if (token.kind() == Kind.PUNCTUATOR) {
      switch (token.text()) {
        case "{":
          return parseBlock();
        case ";":
          advance();
          return finish(new Node(Token.EMPTY), start);
        case "@":
          return parseDecoratedStatement(start);
        default:
          return parseExpressionStatement(start);
      }
    }
    if (token.kind() != Kind.IDENTIFIER) {
      return parseExpressionStatement(start);
    }
    switch (token.text()) {
      case "var":
        return parseVariableStatement(Token.VAR, start);
      case "let":
        if (isLetDeclaration()) {
          return parseVariableStatement(Token.LET, start);
        }
        break;
      case "const":
        if (peek().isIdentifier("enum")) {
          advance();
          return parseEnumDeclaration(start, true);
        }
        return parseVariableStatement(Token.CONST, start);
      case "function":
        return parseFunctionDeclaration(start, false);
      case "async":
        {
          SyntaxToken next = peek();
          if (next.isIdentifier("function") && !next.newlineBefore()) {
            return parseFunctionDeclaration(start, false);
          }
          break;
        }
      case "class":
        return parseClass(start, false, ImmutableList.of());
      case "abstract":
        {
          SyntaxToken next = peek();
          if (next.isIdentifier("class") && !next.newlineBefore()) {
            advance();
            return parseClass(start, false, ImmutableList.of());
          }
          break;
        }
      case "if":
        return parseIfStatement(start);
      case "for":
        return parseForStatement(start);
      case "while":
        {
          advance();
          Node condition = parseParenthesizedExpression();
          Node body = parseEmbeddedStatement();
          return finish(new Node(Token.WHILE, condition, body), start);
        }
      case "do":
        {
          advance();
          Node body = parseEmbeddedStatement();
          expectKeyword("while");
          Node condition = parseParenthesizedExpression();
          eat(";");
          return finish(new Node(Token.DO, body, condition), start);
        }
      case "switch":
        return parseSwitchStatement(start);
      case "try":
        return parseTryStatement(start);
      case "return":
        {
          advance();
          Node returnNode = new Node(Token.RETURN);
          if (!at(";") && !at("}") && token.kind() != Kind.EOF && !token.newlineBefore()) {
            returnNode.addChildToBack(parseExpression(false));
          }
          consumeSemicolon();
          return finish(returnNode, start);
        }
      case "break":
      case "continue":
        {
          Token jump = advance().text().equals("break") ? Token.BREAK : Token.CONTINUE;
          Node node = new Node(jump);
          if (atBindingIdentifier() && !token.newlineBefore()) {
            int labelStart = token.start();
            node.addChildToBack(
                finish(Node.newString(Token.LABEL_NAME, advance().text()), labelStart));
          }
          consumeSemicolon();
          return finish(node, start);
        }
      case "throw":
        {
          advance();
          if (token.newlineBefore()) {
            throw unexpected("Line break not permitted here");
          }
          Node value = parseExpression(false);
          consumeSemicolon();
          return finish(new Node(Token.THROW, value), start);
        }
      case "debugger":
        advance();
        consumeSemicolon();
        return finish(new Node(Token.DEBUGGER), start);
      case "with":
        {
          advance();
          Node object = parseParenthesizedExpression();
          Node body = parseEmbeddedStatement();
          return finish(new Node(Token.WITH, object, body), start);
        }
      case "import":
        {
          SyntaxToken next = peek();
          if (next.is("(") || next.is(".")) {
            break;
          }
          return parseImportDeclaration(start);
        }
      case "export":
        return parseExportDeclaration(start);
      case "enum":
        return parseEnumDeclaration(start, false);
      case "namespace":
      case "module":
        {
          SyntaxToken next = peek();
          if (!next.newlineBefore()
              && (next.kind() == Kind.IDENTIFIER
                  || (next.kind() == Kind.STRING && token.isIdentifier("module")))) {
            return parseNamespaceDeclaration(start);
          }
          break;
        }
      case "declare":
        {
          SyntaxToken next = peek();
          if (next.kind() == Kind.IDENTIFIER && !next.newlineBefore()) {
            advance();
            parseAmbientDeclaration();
            return null;
          }
          break;
        }
      case "interface":
        {
          SyntaxToken next = peek();
          if (isBindingIdentifier(next) && !next.newlineBefore()) {
            skipInterfaceDeclaration();
            return null;
          }
          break;
        }
      case "type":
        {
          SyntaxToken next = peek();
          if (isBindingIdentifier(next) && !next.newlineBefore()) {
            skipTypeAliasDeclaration();
            return null;
          }
          break;
        }
      default:
        if (atBindingIdentifier() && peek().is(":")) {
          return parseLabeledStatement(start);
        }
        break;
    }
    return parseExpressionStatement(start);
  }

  private boolean isLetDeclaration() {
    SyntaxToken next = peek();
    return next.is("[") || next.is("{") || isBindingIdentifier(next);
  }

  private Node parseExpressionStatement(int start) {
    Node expr = parseExpression(false);
    consumeSemicolon();
    return finish(IR.exprResult(expr), start);
  }

  private Node parseLabeledStatement(int start) {
    Node label = finish(Node.newString(Token.LABEL_NAME, advance().text()), start);
    expect(":");
    Node statement = parseEmbeddedStatement();
    return finish(new Node(Token.LABEL, label, statement), start);
  }

  private Node parseBlock() {
    int start = token.start();
    expect("{");
    Node block = new Node(Token.BLOCK);
    parseStatementList(block);
    expect("}");
    return finish(block, start);
  }

  private Node parseParenthesizedExpression() {
    expect("(");
    Node expr = parseExpression(false);
    expect(")");
    return expr;
  }

  private Node parseVariableStatement(Token declarationToken, int start) {
    Node declaration = parseVariableDeclarations(declarationToken, false);
    consumeSemicolon();
    return finish(declaration, start);
  }

  private Node parseVariableDeclarations(Token declarationToken, boolean inForInit) {
    int start = token.start();
    advance();
    Node declaration = new Node(declarationToken);
    do {
      int targetStart = token.start();
      Node target = parseBindingTarget();
      eat("!");
      skipTypeAnnotationIfPresent();
      Node init = eat("=") ? parseAssignment(inForInit) : null;
      if (target.isName()) {
        if (init != null) {
          target.addChildToBack(init);
          finish(target, targetStart);
        }
        declaration.addChildToBack(target);
      } else {
        if (init == null && !inForInit) {
          throw scanner.error(targetStart, "A destructuring declaration must have an initializer");
        }
        Node lhs =
            init == null
                ? new Node(Token.DESTRUCTURING_LHS, target)
                : new Node(Token.DESTRUCTURING_LHS, target, init);
        declaration.addChildToBack(finish(lhs, targetStart));
      }
    } while (eat(","));
    return finish(declaration, start);
  }

  private Node parseIfStatement(int start) {
    advance();
    Node condition = parseParenthesizedExpression();
    Node thenBranch = parseEmbeddedStatement();
    Node ifNode = new Node(Token.IF, condition, thenBranch);
    if (token.isIdentifier("else")) {
      advance();
      ifNode.addChildToBack(parseEmbeddedStatement());
    }
    return finish(ifNode, start);
  }

  private Node parseForStatement(int start) {
    advance();
    boolean isAwait = false;
    if (token.isIdentifier("await")) {
      advance();
      isAwait = true;
    }
    expect("(");
    int initStart = token.start();
    Node init;
    if (at(";")) {
      init = new Node(Token.EMPTY);
    } else if (token.isIdentifier("var")) {
      init = parseVariableDeclarations(Token.VAR, true);
    } else if (token.isIdentifier("let") && isLetDeclaration()) {
      init = parseVariableDeclarations(Token.LET, true);
    } else if (token.isIdentifier("const")) {
      init = parseVariableDeclarations(Token.CONST, true);
    } else {
      init = parseExpression(true);
    }
    if (token.isIdentifier("of")) {
      advance();
      Node iterable = parseAssignment(false);
      expect(")");
      Node body = parseEmbeddedStatement();
      Token loop = isAwait ? Token.FOR_AWAIT_OF : Token.FOR_OF;
      return finish(new Node(loop, init, iterable, body), start);
    }
    if (token.isIdentifier("in")) {
      advance();
      Node object = parseExpression(false);
      expect(")");
      Node body = parseEmbeddedStatement();
      return finish(new Node(Token.FOR_IN, init, object, body), start);
    }
    if (init.isEmpty()) {
      finish(init, initStart);
    }
    expect(";");
    Node condition = at(";") ? new Node(Token.EMPTY) : parseExpression(false);
    expect(";");
    Node increment = at(")") ? new Node(Token.EMPTY) : parseExpression(false);
    expect(")");
    Node body = parseEmbeddedStatement();
    Node forNode = new Node(Token.FOR);
    forNode.addChildToBack(init);
    forNode.addChildToBack(condition);
    forNode.addChildToBack(increment);
    forNode.addChildToBack(body);
    return finish(forNode, start);
  }

  private Node parseSwitchStatement(int start) {
    advance();
    Node discriminant = parseParenthesizedExpression();
    expect("{");
    Node switchNode = new Node(Token.SWITCH, discriminant);
    while (!at("}")) {
      ImmutableList<Comment> leading = takeLeadingComments();
      int caseStart = token.start();
      Node caseNode;
      if (token.isIdentifier("case")) {
        advance();
        Node test = parseExpression(false);
        expect(":");
        caseNode = new Node(Token.CASE, test);
      } else if (token.isIdentifier("default")) {
        advance();
        expect(":");
        caseNode = new Node(Token.DEFAULT_CASE);
      } else {
        throw unexpected("'case' or 'default' expected");
      }
      Node body = new Node(Token.BLOCK);
      body.putBooleanProp(Prop.SYNTHETIC, true);
      parseStatementList(body);
      caseNode.addChildToBack(body);
      caseNode.setLeadingComments(leading);
      switchNode.addChildToBack(finish(caseNode, caseStart));
    }
    expect("}");
    return finish(switchNode, start);
  }

  private Node parseTryStatement(int start) {
    advance();
    Node tryBlock = parseBlock();
    Node catchBlock = new Node(Token.BLOCK);
    boolean hasHandler = false;
    if (token.isIdentifier("catch")) {
      int catchStart = token.start();
      advance();
      Node param;
      if (eat("(")) {
        param = parseBindingTarget();
        skipTypeAnnotationIfPresent();
        expect(")");
      } else {
        param = new Node(Token.EMPTY);
      }
      Node body = parseBlock();
      catchBlock.addChildToBack(finish(new Node(Token.CATCH, param, body), catchStart));
      hasHandler = true;
    }
    Node tryNode = new Node(Token.TRY, tryBlock, catchBlock);
    if (token.isIdentifier("finally")) {
      advance();
      tryNode.addChildToBack(parseBlock());
      hasHandler = true;
    }
    if (!hasHandler) {
      throw unexpected("'catch' or 'finally' expected");
    }
    return finish(tryNode, start);
  }

  private @Nullable Node parseDecoratedStatement(int start) {
    List<Node> decorators = parseDecorators();
    Node statement = parseStatement();
    Node decorated = statement;
    if (decorated != null && decorated.isExport() && decorated.hasChildren()) {
      decorated = decorated.getFirstChild();
    }
    if (decorated == null || !decorated.isClass()) {
      throw scanner.error(start, "Decorators are not valid here");
    }
    decorated.setDecorators(decorators);
    return statement;
  }

  private List<Node> parseDecorators() {
    List<Node> decorators = new ArrayList<>();
    while (at("@")) {
      int start = token.start();
      advance();
      Node expr = parseLeftHandSide();
      decorators.add(finish(new Node(Token.DECORATOR, expr), start));
    }
    return decorators;
  }

  // ==========================================================================
  // Functions and classes

  private @Nullable Node parseFunctionDeclaration(int start, boolean nameOptional) {
    boolean isAsync = false;
    if (token.isIdentifier("async")) {
      advance();
      isAsync = true;
    }
    expectKeyword("function");
    boolean isGenerator = eat("*");
    int nameStart = token.start();
    Node name;
    if (atBindingIdentifier()) {
      name = finish(IR.name(advance().text()), nameStart);
    } else if (nameOptional) {
      name = IR.name("");
    } else {
      throw unexpected("Identifier expected");
    }
    skipTypeParametersIfPresent();
    Node params = parseFormalParameters();
    skipTypeAnnotationIfPresent();
    if (!at("{")) {
      // An overload signature or an ambient declaration.
      consumeSemicolon();
      return null;
    }
    Node body = parseFunctionBody(isAsync, isGenerator);
    return finish(newFunction(name, params, body, isAsync, isGenerator), start);
  }

  private Node parseFunctionExpression(int start, boolean isAsync) {
    expectKeyword("function");
    boolean isGenerator = eat("*");
    int nameStart = token.start();
    Node name =
        atBindingIdentifier() ? finish(IR.name(advance().text()), nameStart) : IR.name("");
    skipTypeParametersIfPresent();
    Node params = parseFormalParameters();
    skipTypeAnnotationIfPresent();
    Node body = parseFunctionBody(isAsync, isGenerator);
    return finish(newFunction(name, params, body, isAsync, isGenerator), start);
  }

  private static Node newFunction(
      Node name, Node params, Node body, boolean isAsync, boolean isGenerator) {
    Node function = new Node(Token.FUNCTION, name, params, body);
    function.putBooleanProp(Prop.ASYNC_FN, isAsync);
    function.putBooleanProp(Prop.GENERATOR_FN, isGenerator);
    return function;
  }

  private Node parseFunctionBody(boolean isAsync, boolean isGenerator) {
    boolean savedAsync = inAsync;
    boolean savedGenerator = inGenerator;
    inAsync = isAsync;
    inGenerator = isGenerator;
    try {
      return parseBlock();
    } finally {
      inAsync = savedAsync;
      inGenerator = savedGenerator;
    }
  }

  private Node parseFormalParameters() {
    int start = token.start();
    expect("(");
    Node params = new Node(Token.PARAM_LIST);
    while (!at(")")) {
      Node param = parseParameter();
      if (param != null) {
        params.addChildToBack(param);
      }
      if (!eat(",")) {
        break;
      }
    }
    expect(")");
    return finish(params, start);
  }

  private @Nullable Node parseParameter() {
    int start = token.start();
    List<Node> decorators = parseDecorators();
    boolean isProperty = false;
    while (token.kind() == Kind.IDENTIFIER
        && MODIFIERS.contains(token.text())
        && startsBindingTarget(peek())) {
      advance();
      isProperty = true;
    }
    if (token.isIdentifier("this")) {
      SyntaxToken next = peek();
      if (next.is(":") || next.is(",") || next.is(")")) {
        advance();
        skipTypeAnnotationIfPresent();
        return null;
      }
    }
    if (eat("...")) {
      Node target = parseBindingTarget();
      eat("?");
      skipTypeAnnotationIfPresent();
      return finish(new Node(Token.ITER_REST, target), start);
    }
    Node target = parseBindingTarget();
    eat("?");
    skipTypeAnnotationIfPresent();
    target.putBooleanProp(Prop.PARAMETER_PROPERTY, isProperty);
    target.setDecorators(decorators);
    if (eat("=")) {
      Node defaultValue = parseAssignment(false);
      return finish(new Node(Token.DEFAULT_VALUE, target, defaultValue), start);
    }
    return target;
  }

  private static boolean startsBindingTarget(SyntaxToken t) {
    return isBindingIdentifier(t) || t.is("[") || t.is("{");
  }

  /**
   * Parses the rest of a method after its name: type parameters, parameters, return type and
   * body.
   *
   * @return the FUNCTION, or null for a signature without a body when {@code requireBody} is
   *     false
   */
  private @Nullable Node parseMethod(
      int start, boolean isAsync, boolean isGenerator, boolean requireBody) {
    skipTypeParametersIfPresent();
    Node params = parseFormalParameters();
    skipTypeAnnotationIfPresent();
    if (!at("{")) {
      if (requireBody) {
        throw unexpected("'{' expected");
      }
      consumeSemicolon();
      return null;
    }
    Node body = parseFunctionBody(isAsync, isGenerator);
    return finish(newFunction(IR.name(""), params, body, isAsync, isGenerator), start);
  }

  private Node parseClass(int start, boolean isExpression, List<Node> decorators) {
    expectKeyword("class");
    Node name;
    if (atBindingIdentifier()
        && !token.isIdentifier("implements")
        && !token.isIdentifier("extends")) {
      int nameStart = token.start();
      name = finish(IR.name(advance().text()), nameStart);
    } else {
      name = new Node(Token.EMPTY);
    }
    skipTypeParametersIfPresent();
    Node superClass = new Node(Token.EMPTY);
    if (token.isIdentifier("extends")) {
      advance();
      superClass = parseLeftHandSide();
      if (at("<")) {
        skipTypeArguments();
      }
    }
    if (token.isIdentifier("implements")) {
      advance();
      do {
        parseType();
      } while (eat(","));
    }
    Node members = parseClassMembers();
    Node classNode = new Node(Token.CLASS, name, superClass, members);
    classNode.setDecorators(decorators);
    if (!isExpression && name.isEmpty() && !classNameOptional) {
      throw scanner.error(start, "A class declaration must have a name");
    }
    return finish(classNode, start);
  }

  private Node parseClassMembers() {
    int start = token.start();
    expect("{");
    Node members = new Node(Token.CLASS_MEMBERS);
    boolean savedClassNameOptional = classNameOptional;
    classNameOptional = false;
    try {
      while (!at("}")) {
        ImmutableList<Comment> leading = takeLeadingComments();
        if (eat(";")) {
          continue;
        }
        Node member = parseClassMember();
        ImmutableList<Comment> trailing = takeTrailingComments();
        if (member != null) {
          member.setLeadingComments(leading);
          member.setTrailingComments(trailing);
          members.addChildToBack(member);
        }
      }
      members.setDanglingComments(takeLeadingComments());
    } finally {
      classNameOptional = savedClassNameOptional;
    }
    expect("}");
    return finish(members, start);
  }

  private @Nullable Node parseClassMember() {
    int start = token.start();
    List<Node> decorators = parseDecorators();
    boolean isStatic = false;
    boolean isErased = false;
    while (token.kind() == Kind.IDENTIFIER
        && MODIFIERS.contains(token.text())
        && isModifierFollowedByName()) {
      switch (advance().text()) {
        case "static" -> isStatic = true;
        case "abstract", "declare" -> isErased = true;
        default -> {}
      }
    }
    if (isStatic && at("{")) {
      // A static initialization block; kept so that it can be reported.
      Node block = parseFunctionBody(false, false);
      block.setStaticMember(true);
      return block;
    }
    if (at("[") && isIndexSignature()) {
      skipBalanced();
      skipTypeAnnotationIfPresent();
      consumeSemicolon();
      return null;
    }
    boolean isAsync = false;
    boolean isGenerator = false;
    String accessor = null;
    if (token.isIdentifier("async")) {
      SyntaxToken next = peek();
      if (!next.newlineBefore() && (startsPropertyName(next) || next.is("*"))) {
        advance();
        isAsync = true;
      }
    }
    if (eat("*")) {
      isGenerator = true;
    }
    if ((token.isIdentifier("get") || token.isIdentifier("set")) && startsPropertyName(peek())) {
      accessor = advance().text();
    }
    PropertyName name = parsePropertyName();
    eat("?");
    if (accessor != null || isAsync || isGenerator || at("(") || at("<")) {
      Node function = parseMethod(start, isAsync, isGenerator, false);
      if (function == null || isErased) {
        return null;
      }
      Token kind =
          accessor == null
              ? Token.MEMBER_FUNCTION_DEF
              : accessor.equals("get") ? Token.GETTER_DEF : Token.SETTER_DEF;
      Node member = newMember(kind, name, function);
      member.setStaticMember(isStatic);
      member.setDecorators(decorators);
      return finish(member, start);
    }
    eat("!");
    skipTypeAnnotationIfPresent();
    Node init = eat("=") ? parseAssignment(false) : null;
    consumeSemicolon();
    if (isErased) {
      return null;
    }
    Node field;
    if (name.computed() != null) {
      field = new Node(Token.COMPUTED_PROP, name.computed(), init != null ? init : IR.empty());
    } else {
      field = Node.newString(Token.MEMBER_FIELD_DEF, name.key());
      if (name.quoted()) {
        field.setQuotedString();
      }
      if (init != null) {
        field.addChildToBack(init);
      }
    }
    field.setStaticMember(isStatic);
    field.setDecorators(decorators);
    return finish(field, start);
  }

  private boolean isModifierFollowedByName() {
    SyntaxToken next = peek();
    return startsPropertyName(next) || next.is("*") || next.is("{") || next.is("@");
  }

  private boolean isIndexSignature() {
    State state = mark();
    try {
      advance();
      if (token.kind() != Kind.IDENTIFIER) {
        return false;
      }
      advance();
      return at(":");
    } finally {
      reset(state);
    }
  }

  private static boolean startsPropertyName(SyntaxToken t) {
    return switch (t.kind()) {
      case IDENTIFIER, PRIVATE_NAME, STRING, NUMBER, BIGINT -> true;
      case PUNCTUATOR -> t.is("[");
      default -> false;
    };
  }

  private PropertyName parsePropertyName() {
    int start = token.start();
    switch (token.kind()) {
      case IDENTIFIER:
        return new PropertyName(advance().text(), false, true, null, start);
      case PRIVATE_NAME:
        return new PropertyName(advance().text(), false, false, null, start);
      case STRING:
        return new PropertyName(requireNonNull(advance().value()), true, false, null, start);
      case NUMBER:
        return new PropertyName(
            NodeUtil.numberToString(advance().number()), false, false, null, start);
      case BIGINT:
        return new PropertyName(advance().text(), false, false, null, start);
      default:
        if (eat("[")) {
          Node key = parseAssignment(false);
          expect("]");
          return new PropertyName("", false, false, key, start);
        }
        throw unexpected("Property name expected");
    }
  }

  /** Builds a member keyed by {@code name}, or a COMPUTED_PROP for a computed name. */
  private static Node newMember(Token kind, PropertyName name, Node value) {
    if (name.computed() != null) {
      return new Node(Token.COMPUTED_PROP, name.computed(), value);
    }
    Node member = Node.newString(kind, name.key());
    if (name.quoted()) {
      member.setQuotedString();
    }
    member.addChildToBack(value);
    return member;
  }

  // ==========================================================================
  // Modules

  private Node parseModuleSpecifier() {
    int start = token.start();
    if (token.kind() != Kind.STRING) {
      throw unexpected("String literal expected");
    }
    return finish(IR.string(requireNonNull(advance().value())), start);
  }

  /** Parses an identifier name or string that names an import or export. */
  private Node parseModuleExportName() {
    int start = token.start();
    if (token.kind() == Kind.STRING) {
      return finish(IR.name(requireNonNull(advance().value())), start);
    }
    return finish(IR.name(expectIdentifierName()), start);
  }

  private void skipImportAttributes() {
    if ((token.isIdentifier("with") || token.isIdentifier("assert"))
        && !token.newlineBefore()
        && peek().is("{")) {
      advance();
      skipBalanced();
    }
  }

  private Node parseImportDeclaration(int start) {
    advance();
    boolean typeOnly = false;
    if (token.isIdentifier("type")) {
      SyntaxToken next = peek();
      if (next.is("{")
          || next.is("*")
          || (isBindingIdentifier(next) && !next.isIdentifier("from"))) {
        advance();
        typeOnly = true;
      }
    }
    if (token.kind() == Kind.STRING) {
      Node source = parseModuleSpecifier();
      skipImportAttributes();
      consumeSemicolon();
      markModuleSyntax();
      return finish(new Node(Token.IMPORT, IR.empty(), IR.empty(), source), start);
    }
    Node defaultBinding = IR.empty();
    Node namedBindings = IR.empty();
    boolean hasDefault = atBindingIdentifier();
    if (hasDefault) {
      Node name = parseBindingIdentifier();
      if (at("=")) {
        return parseImportEquals(start, name, typeOnly);
      }
      defaultBinding = name;
    }
    if (!hasDefault || eat(",")) {
      int bindingsStart = token.start();
      if (eat("*")) {
        expectKeyword("as");
        namedBindings =
            finish(Node.newString(Token.IMPORT_STAR, expectBindingIdentifier()), bindingsStart);
      } else if (at("{")) {
        namedBindings = parseImportSpecifiers();
      } else {
        throw unexpected("'{' or '*' expected");
      }
    }
    expectKeyword("from");
    Node source = parseModuleSpecifier();
    skipImportAttributes();
    consumeSemicolon();
    markModuleSyntax();
    Node importNode = new Node(Token.IMPORT, defaultBinding, namedBindings, source);
    importNode.putBooleanProp(Prop.TYPE_ONLY, typeOnly);
    return finish(importNode, start);
  }

  private Node parseImportEquals(int start, Node name, boolean typeOnly) {
    expect("=");
    Node target;
    int targetStart = token.start();
    if (token.isIdentifier("require") && peek().is("(")) {
      Node require = finish(IR.name(advance().text()), targetStart);
      expect("(");
      Node specifier = parseModuleSpecifier();
      expect(")");
      target = finish(IR.call(require, specifier), targetStart);
      markModuleSyntax();
    } else {
      target = parseEntityName();
    }
    consumeSemicolon();
    Node importEquals = new Node(Token.IMPORT_EQUALS, name, target);
    importEquals.putBooleanProp(Prop.TYPE_ONLY, typeOnly);
    return finish(importEquals, start);
  }

  private Node parseEntityName() {
    int start = token.start();
    Node name = finish(IR.name(expectBindingIdentifier()), start);
    while (eat(".")) {
      name = finish(IR.getprop(name, expectIdentifierName()), start);
    }
    return name;
  }

  private Node parseImportSpecifiers() {
    int start = token.start();
    expect("{");
    Node specs = new Node(Token.IMPORT_SPECS);
    while (!at("}")) {
      int specStart = token.start();
      boolean typeOnly = isTypeModifierOnSpecifier();
      if (typeOnly) {
        advance();
      }
      Node imported = parseModuleExportName();
      Node local;
      if (token.isIdentifier("as")) {
        advance();
        local = parseBindingIdentifier();
      } else {
        local = imported.cloneNode();
        local.setSourceRange(imported.getSourceStart(), imported.getSourceEnd());
        local.srcref(imported);
      }
      if (!typeOnly) {
        specs.addChildToBack(finish(new Node(Token.IMPORT_SPEC, imported, local), specStart));
      }
      if (!eat(",")) {
        break;
      }
    }
    expect("}");
    return finish(specs, start);
  }

  private boolean isTypeModifierOnSpecifier() {
    if (!token.isIdentifier("type")) {
      return false;
    }
    SyntaxToken next = peek();
    return (next.kind() == Kind.IDENTIFIER || next.kind() == Kind.STRING)
        && !next.isIdentifier("as");
  }

  private @Nullable Node parseExportDeclaration(int start) {
    advance();
    markModuleSyntax();
    if (eat("=")) {
      Node value = parseAssignment(false);
      consumeSemicolon();
      return finish(new Node(Token.EXPORT_ASSIGN, value), start);
    }
    if (token.isIdentifier("as")) {
      // export as namespace Lib;
      advance();
      expectKeyword("namespace");
      expectBindingIdentifier();
      consumeSemicolon();
      return null;
    }
    if (token.isIdentifier("default")) {
      advance();
      return parseExportDefault(start);
    }
    boolean typeOnly = false;
    if (token.isIdentifier("type")) {
      SyntaxToken next = peek();
      if (next.is("{") || next.is("*")) {
        advance();
        typeOnly = true;
      }
    }
    if (eat("*")) {
      Node binding = IR.empty();
      if (token.isIdentifier("as")) {
        advance();
        binding = parseModuleExportName();
      }
      expectKeyword("from");
      Node source = parseModuleSpecifier();
      skipImportAttributes();
      consumeSemicolon();
      Node export = new Node(Token.EXPORT, binding, source);
      export.putBooleanProp(Prop.EXPORT_ALL_FROM, true);
      export.putBooleanProp(Prop.TYPE_ONLY, typeOnly);
      return finish(export, start);
    }
    if (at("{")) {
      Node specs = parseExportSpecifiers();
      Node export = new Node(Token.EXPORT, specs);
      if (token.isIdentifier("from")) {
        advance();
        export.addChildToBack(parseModuleSpecifier());
        skipImportAttributes();
      }
      consumeSemicolon();
      export.putBooleanProp(Prop.TYPE_ONLY, typeOnly);
      return finish(export, start);
    }
    if (token.isIdentifier("declare")) {
      advance();
      parseAmbientDeclaration();
      return null;
    }
    if (token.isIdentifier("import")) {
      Node importEquals = parseImportDeclaration(token.start());
      if (!importEquals.isImportEquals()) {
        throw scanner.error(start, "Declaration expected");
      }
      return finish(new Node(Token.EXPORT, importEquals), start);
    }
    List<Node> decorators = parseDecorators();
    Node declaration = parseStatement();
    if (declaration == null) {
      return null;
    }
    switch (declaration.getToken()) {
      case VAR, LET, CONST, FUNCTION, ENUM, NAMESPACE -> {}
      case CLASS -> declaration.setDecorators(decorators);
      default -> throw scanner.error(declaration.getSourceStart(), "Declaration expected");
    }
    return finish(new Node(Token.EXPORT, declaration), start);
  }

  private @Nullable Node parseExportDefault(int start) {
    int declarationStart = token.start();
    Node declaration;
    SyntaxToken next = peek();
    if (token.isIdentifier("function")
        || (token.isIdentifier("async") && next.isIdentifier("function"))) {
      declaration = parseFunctionDeclaration(declarationStart, true);
      if (declaration == null) {
        return null;
      }
    } else if (token.isIdentifier("class")
        || at("@")
        || (token.isIdentifier("abstract") && next.isIdentifier("class"))) {
      List<Node> decorators = parseDecorators();
      if (token.isIdentifier("abstract")) {
        advance();
      }
      boolean saved = classNameOptional;
      classNameOptional = true;
      try {
        declaration = parseClass(declarationStart, false, decorators);
      } finally {
        classNameOptional = saved;
      }
    } else if (token.isIdentifier("interface") && isBindingIdentifier(next)) {
      skipInterfaceDeclaration();
      return null;
    } else {
      declaration = parseAssignment(false);
      consumeSemicolon();
    }
    Node export = new Node(Token.EXPORT, declaration);
    export.putBooleanProp(Prop.EXPORT_DEFAULT, true);
    return finish(export, start);
  }

  private Node parseExportSpecifiers() {
    int start = token.start();
    expect("{");
    Node specs = new Node(Token.EXPORT_SPECS);
    while (!at("}")) {
      int specStart = token.start();
      boolean typeOnly = isTypeModifierOnSpecifier();
      if (typeOnly) {
        advance();
      }
      Node local = parseModuleExportName();
      Node exported;
      if (token.isIdentifier("as")) {
        advance();
        exported = parseModuleExportName();
      } else {
        exported = local.cloneNode();
        exported.setSourceRange(local.getSourceStart(), local.getSourceEnd());
        exported.srcref(local);
      }
      if (!typeOnly) {
        specs.addChildToBack(finish(new Node(Token.EXPORT_SPEC, local, exported), specStart));
      }
      if (!eat(",")) {
        break;
      }
    }
    expect("}");
    return finish(specs, start);
  }

  // ==========================================================================
  // TypeScript declarations

  private Node parseEnumDeclaration(int start, boolean isConst) {
    expectKeyword("enum");
    Node name = parseBindingIdentifier();
    int membersStart = token.start();
    expect("{");
    Node members = new Node(Token.ENUM_MEMBERS);
    while (!at("}")) {
      ImmutableList<Comment> leading = takeLeadingComments();
      int memberStart = token.start();
      Node member;
      if (token.kind() == Kind.STRING) {
        member = Node.newString(Token.STRING_KEY, requireNonNull(advance().value()));
        member.setQuotedString();
      } else if (token.kind() == Kind.IDENTIFIER) {
        member = Node.newString(Token.STRING_KEY, advance().text());
      } else {
        throw unexpected("Enum member name expected");
      }
      if (eat("=")) {
        member.addChildToBack(parseAssignment(false));
      }
      member.setLeadingComments(leading);
      members.addChildToBack(finish(member, memberStart));
      boolean more = eat(",");
      member.setTrailingComments(takeTrailingComments());
      if (!more) {
        break;
      }
    }
    members.setDanglingComments(takeLeadingComments());
    expect("}");
    Node enumNode = new Node(Token.ENUM, name, finish(members, membersStart));
    enumNode.putBooleanProp(Prop.CONST_ENUM, isConst);
    return finish(enumNode, start);
  }

  private @Nullable Node parseNamespaceDeclaration(int start) {
    advance();
    if (token.kind() == Kind.STRING) {
      // An ambient module declaration.
      advance();
      if (at("{")) {
        parseNamespaceBody();
      } else {
        consumeSemicolon();
      }
      return null;
    }
    List<Node> names = new ArrayList<>();
    names.add(parseBindingIdentifier());
    while (eat(".")) {
      names.add(parseBindingIdentifier());
    }
    Node body = parseNamespaceBody();
    if (!body.hasChildren()) {
      // Nothing but types; there is no object to create.
      return null;
    }
    Node namespace = null;
    for (int i = names.size() - 1; i >= 0; i--) {
      Node name = names.get(i);
      Node elements = body;
      if (namespace != null) {
        Node export = new Node(Token.EXPORT, namespace);
        export.setSourceRange(namespace.getSourceStart(), namespace.getSourceEnd());
        elements = new Node(Token.NAMESPACE_ELEMENTS, export);
        elements.setSourceRange(namespace.getSourceStart(), namespace.getSourceEnd());
      }
      int namespaceStart = i == 0 ? start : name.getSourceStart();
      namespace = finish(new Node(Token.NAMESPACE, name, elements), namespaceStart);
    }
    return namespace;
  }

  private Node parseNamespaceBody() {
    int start = token.start();
    declarationDepth++;
    boolean savedAsync = inAsync;
    boolean savedGenerator = inGenerator;
    inAsync = false;
    inGenerator = false;
    try {
      expect("{");
      Node elements = new Node(Token.NAMESPACE_ELEMENTS);
      parseStatementList(elements);
      expect("}");
      return finish(elements, start);
    } finally {
      declarationDepth--;
      inAsync = savedAsync;
      inGenerator = savedGenerator;
    }
  }

  /** Parses and discards the declaration after {@code declare}. */
  private void parseAmbientDeclaration() {
    declarationDepth++;
    try {
      if (token.isIdentifier("global")) {
        advance();
        parseNamespaceBody();
      } else {
        parseStatement();
      }
    } finally {
      declarationDepth--;
    }
  }

  private void skipInterfaceDeclaration() {
    advance();
    expectBindingIdentifier();
    skipTypeParametersIfPresent();
    if (token.isIdentifier("extends")) {
      advance();
      do {
        parseType();
      } while (eat(","));
    }
    if (!at("{")) {
      throw unexpected("'{' expected");
    }
    skipBalanced();
  }

  private void skipTypeAliasDeclaration() {
    advance();
    expectBindingIdentifier();
    skipTypeParametersIfPresent();
    expect("=");
    parseType();
    consumeSemicolon();
  }

  // ==========================================================================
  // Patterns

  private Node parseBindingIdentifier() {
    int start = token.start();
    return finish(IR.name(expectBindingIdentifier()), start);
  }

  private Node parseBindingTarget() {
    if (at("[")) {
      return parseArrayPattern();
    }
    if (at("{")) {
      return parseObjectPattern();
    }
    return parseBindingIdentifier();
  }

  private Node parseBindingElement() {
    int start = token.start();
    Node target = parseBindingTarget();
    if (eat("=")) {
      Node defaultValue = parseAssignment(false);
      return finish(new Node(Token.DEFAULT_VALUE, target, defaultValue), start);
    }
    return target;
  }

  private Node parseArrayPattern() {
    int start = token.start();
    expect("[");
    Node pattern = new Node(Token.ARRAY_PATTERN);
    while (!at("]")) {
      if (at(",")) {
        int holeStart = token.start();
        advance();
        pattern.addChildToBack(finish(IR.empty(), holeStart));
        continue;
      }
      int elementStart = token.start();
      if (eat("...")) {
        Node target = parseBindingTarget();
        pattern.addChildToBack(finish(new Node(Token.ITER_REST, target), elementStart));
      } else {
        pattern.addChildToBack(parseBindingElement());
      }
      if (!eat(",")) {
        break;
      }
    }
    expect("]");
    return finish(pattern, start);
  }

  private Node parseObjectPattern() {
    int start = token.start();
    expect("{");
    Node pattern = new Node(Token.OBJECT_PATTERN);
    while (!at("}")) {
      int propertyStart = token.start();
      if (eat("...")) {
        Node target = parseBindingIdentifier();
        pattern.addChildToBack(finish(new Node(Token.OBJECT_REST, target), propertyStart));
      } else {
        PropertyName name = parsePropertyName();
        Node value;
        if (eat(":")) {
          value = parseBindingElement();
        } else {
          if (!name.identifier() || RESERVED_WORDS.contains(name.key())) {
            throw unexpected("':' expected");
          }
          value = finish(IR.name(name.key()), propertyStart);
          if (eat("=")) {
            Node defaultValue = parseAssignment(false);
            value = finish(new Node(Token.DEFAULT_VALUE, value, defaultValue), propertyStart);
          }
        }
        pattern.addChildToBack(finish(newMember(Token.STRING_KEY, name, value), propertyStart));
      }
      if (!eat(",")) {
        break;
      }
    }
    expect("}");
    return finish(pattern, start);
  }

  // ==========================================================================
  // Expressions

  private Node parseExpression(boolean noIn) {
    int start = token.start();
    Node expr = parseAssignment(noIn);
    while (eat(",")) {
      Node next = parseAssignment(noIn);
      expr = finish(new Node(Token.COMMA, expr, next), start);
    }
    return expr;
  }

  private Node parseAssignment(boolean noIn) {
    int start = token.start();
    if (token.isIdentifier("yield") && inGenerator) {
      return parseYield(noIn);
    }
    Node arrow = tryParseArrowFunction(noIn);
    if (arrow != null) {
      return arrow;
    }
    Node left = parseConditional(noIn);
    Token assignment =
        token.kind() == Kind.PUNCTUATOR ? ASSIGNMENT_OPERATORS.get(token.text()) : null;
    if (assignment == null) {
      return left;
    }
    advance();
    Node right = parseAssignment(noIn);
    return finish(new Node(assignment, left, right), start);
  }

  private Node parseYield(boolean noIn) {
    int start = token.start();
    advance();
    Node yield = new Node(Token.YIELD);
    eat("*");
    if (!token.newlineBefore() && startsExpression()) {
      yield.addChildToBack(parseAssignment(noIn));
    }
    return finish(yield, start);
  }

  private boolean startsExpression() {
    if (token.kind() == Kind.EOF) {
      return false;
    }
    if (token.kind() != Kind.PUNCTUATOR) {
      return !token.isIdentifier("in") && !token.isIdentifier("of");
    }
    return switch (token.text()) {
      case ")", "]", "}", ",", ";", ":", "?" -> false;
      default -> true;
    };
  }

  private @Nullable Node tryParseArrowFunction(boolean noIn) {
    int start = token.start();
    State state = mark();
    boolean isAsync = false;
    if (token.isIdentifier("async")) {
      SyntaxToken next = peek();
      if (!next.newlineBefore()
          && (next.is("(") || next.is("<") || isBindingIdentifier(next))) {
        advance();
        isAsync = true;
      }
    }
    Node params = null;
    if (atBindingIdentifier()) {
      SyntaxToken next = peek();
      if (next.is("=>") && !next.newlineBefore()) {
        int paramStart = token.start();
        Node param = parseBindingIdentifier();
        params = finish(new Node(Token.PARAM_LIST, param), paramStart);
        advance();
      }
    } else if (at("(") || at("<")) {
      params = speculate(this::parseArrowHead);
    }
    if (params == null) {
      reset(state);
      return null;
    }
    Node body;
    if (at("{")) {
      body = parseFunctionBody(isAsync, false);
    } else {
      boolean savedAsync = inAsync;
      boolean savedGenerator = inGenerator;
      inAsync = isAsync;
      inGenerator = false;
      try {
        body = parseAssignment(noIn);
      } finally {
        inAsync = savedAsync;
        inGenerator = savedGenerator;
      }
    }
    Node function = newFunction(IR.name(""), params, body, isAsync, false);
    function.putBooleanProp(Prop.ARROW_FN, true);
    return finish(function, start);
  }

  /** Parses {@code <T>(params): ReturnType =>}, returning the parameters. */
  private Node parseArrowHead() {
    skipTypeParametersIfPresent();
    Node params = parseFormalParameters();
    skipTypeAnnotationIfPresent();
    if (!at("=>") || token.newlineBefore()) {
      throw unexpected("'=>' expected");
    }
    advance();
    return params;
  }

  private Node parseConditional(boolean noIn) {
    int start = token.start();
    Node condition = parseBinary(0, noIn);
    if (!eat("?")) {
      return condition;
    }
    Node thenExpr = parseAssignment(false);
    expect(":");
    Node elseExpr = parseAssignment(noIn);
    return finish(new Node(Token.HOOK, condition, thenExpr, elseExpr), start);
  }

  private Node parseBinary(int minPrecedence, boolean noIn) {
    int start = token.start();
    Node left = parseUnary();
    while (true) {
      if (at(">")) {
        token = scanner.rescanGreater(token);
      }
      if ((token.isIdentifier("as") || token.isIdentifier("satisfies"))
          && !token.newlineBefore()
          && RELATIONAL_PRECEDENCE >= minPrecedence) {
        advance();
        if (token.isIdentifier("const")) {
          advance();
        } else {
          parseType();
        }
        continue;
      }
      BinaryOperator operator = binaryOperatorAt(noIn);
      if (operator == null || operator.precedence() < minPrecedence) {
        return left;
      }
      advance();
      // ** is the only right associative binary operator.
      int rightPrecedence =
          operator.token() == Token.EXPONENT ? operator.precedence() : operator.precedence() + 1;
      Node right = parseBinary(rightPrecedence, noIn);
      left = finish(new Node(operator.token(), left, right), start);
    }
  }

  private @Nullable BinaryOperator binaryOperatorAt(boolean noIn) {
    if (token.kind() != Kind.PUNCTUATOR && token.kind() != Kind.IDENTIFIER) {
      return null;
    }
    if (noIn && token.isIdentifier("in")) {
      return null;
    }
    return BINARY_OPERATORS.get(token.text());
  }

  private Node parseUnary() {
    int start = token.start();
    Token unary = null;
    if (token.kind() == Kind.PUNCTUATOR) {
      unary =
          switch (token.text()) {
            case "!" -> Token.NOT;
            case "~" -> Token.BITNOT;
            case "+" -> Token.POS;
            case "-" -> Token.NEG;
            case "++" -> Token.INC;
            case "--" -> Token.DEC;
            default -> null;
          };
    } else if (token.kind() == Kind.IDENTIFIER) {
      unary =
          switch (token.text()) {
            case "typeof" -> Token.TYPEOF;
            case "void" -> Token.VOID;
            case "delete" -> Token.DELPROP;
            default -> null;
          };
      if (unary == null && token.isIdentifier("await") && inAsync) {
        unary = Token.AWAIT;
      }
    }
    if (unary != null) {
      advance();
      Node operand = parseUnary();
      return finish(new Node(unary, operand), start);
    }
    if (at("<")) {
      // <T>expr type assertion.
      skipTypeArguments();
      return parseUnary();
    }
    Node expr = parseLeftHandSide();
    if ((at("++") || at("--")) && !token.newlineBefore()) {
      Token update = advance().text().equals("++") ? Token.INC : Token.DEC;
      Node postfix = new Node(update, expr);
      postfix.putBooleanProp(Prop.INCRDECR, true);
      return finish(postfix, start);
    }
    return expr;
  }

  private Node parseLeftHandSide() {
    int start = token.start();
    Node expr;
    if (token.isIdentifier("new")) {
      expr = parseNew();
    } else if (token.isIdentifier("super")) {
      advance();
      expr = finish(new Node(Token.SUPER), start);
    } else if (token.isIdentifier("import") && peek().is("(")) {
      advance();
      expect("(");
      Node specifier = parseAssignment(false);
      if (eat(",") && !at(")")) {
        parseAssignment(false);
        eat(",");
      }
      expect(")");
      expr = finish(new Node(Token.DYNAMIC_IMPORT, specifier), start);
    } else if (token.isIdentifier("import") && peek().is(".")) {
      advance();
      advance();
      expectKeyword("meta");
      expr = finish(new Node(Token.IMPORT_META), start);
    } else {
      expr = parsePrimary();
    }
    return parseCallTail(expr, start, true);
  }

  private Node parseNew() {
    int start = token.start();
    advance();
    if (eat(".")) {
      expectKeyword("target");
      return finish(new Node(Token.NEW_TARGET), start);
    }
    int calleeStart = token.start();
    Node callee = token.isIdentifier("new") ? parseNew() : parsePrimary();
    callee = parseCallTail(callee, calleeStart, false);
    Node newNode = new Node(Token.NEW, callee);
    if (at("(")) {
      parseArguments(newNode);
    }
    return finish(newNode, start);
  }

  private void parseArguments(Node call) {
    expect("(");
    while (!at(")")) {
      int argStart = token.start();
      if (eat("...")) {
        Node spread = parseAssignment(false);
        call.addChildToBack(finish(new Node(Token.ITER_SPREAD, spread), argStart));
      } else {
        call.addChildToBack(parseAssignment(false));
      }
      if (!eat(",")) {
        break;
      }
    }
    expect(")");
  }

  private Node parseCallTail(Node expr, int start, boolean allowCalls) {
    boolean inOptionalChain = false;
    while (true) {
      if (eat(".")) {
        Token kind = inOptionalChain ? Token.OPTCHAIN_GETPROP : Token.GETPROP;
        Node getprop = Node.newString(kind, expectIdentifierName());
        getprop.addChildToBack(expr);
        expr = finish(getprop, start);
      } else if (allowCalls && at("?.")) {
        advance();
        inOptionalChain = true;
        if (at("<")) {
          skipTypeArguments();
        }
        if (at("(")) {
          Node call = new Node(Token.OPTCHAIN_CALL, expr);
          parseArguments(call);
          expr = call;
        } else if (eat("[")) {
          Node index = parseExpression(false);
          expect("]");
          expr = new Node(Token.OPTCHAIN_GETELEM, expr, index);
        } else {
          Node getprop = Node.newString(Token.OPTCHAIN_GETPROP, expectIdentifierName());
          getprop.addChildToBack(expr);
          expr = getprop;
        }
        expr.putBooleanProp(Prop.START_OF_OPT_CHAIN, true);
        finish(expr, start);
      } else if (eat("[")) {
        Node index = parseExpression(false);
        expect("]");
        Token kind = inOptionalChain ? Token.OPTCHAIN_GETELEM : Token.GETELEM;
        expr = finish(new Node(kind, expr, index), start);
      } else if (allowCalls && at("(")) {
        Node call = new Node(inOptionalChain ? Token.OPTCHAIN_CALL : Token.CALL, expr);
        parseArguments(call);
        expr = finish(call, start);
      } else if (token.kind() == Kind.NO_SUBSTITUTION_TEMPLATE
          || token.kind() == Kind.TEMPLATE_HEAD) {
        if (inOptionalChain) {
          throw unexpected("Tagged templates are not permitted in an optional chain");
        }
        Node template = parseTemplateLiteral();
        expr = finish(new Node(Token.TAGGED_TEMPLATELIT, expr, template), start);
      } else if (at("!") && !token.newlineBefore()) {
        // Non-null assertion.
        advance();
      } else if (at("<") && speculate(this::parseTypeArgumentsOfCall) != null) {
        continue;
      } else {
        return expr;
      }
    }
  }

  /** Skips {@code <T>} when a call or template follows, as in {@code f<T>(x)}. */
  private Boolean parseTypeArgumentsOfCall() {
    skipTypeArguments();
    if (!at("(") && token.kind() != Kind.NO_SUBSTITUTION_TEMPLATE
        && token.kind() != Kind.TEMPLATE_HEAD) {
      throw unexpected("'(' expected");
    }
    return true;
  }

  private Node parsePrimary() {
    int start = token.start();
    switch (token.kind()) {
      case NUMBER:
        return finish(Node.newNumber(advance().number()), start);
      case BIGINT:
        return finish(Node.newString(Token.BIGINT, advance().text()), start);
      case STRING:
        return finish(IR.string(requireNonNull(advance().value())), start);
      case NO_SUBSTITUTION_TEMPLATE:
      case TEMPLATE_HEAD:
        return parseTemplateLiteral();
      case IDENTIFIER:
        return parseIdentifierExpression(start);
      case PUNCTUATOR:
        switch (token.text()) {
          case "(":
            return parseParenthesizedExpression();
          case "[":
            return parseArrayLiteral();
          case "{":
            return parseObjectLiteral();
          case "/":
          case "/=":
            {
              SyntaxToken regexp = scanner.rescanSlashAsRegex(token);
              token = regexp;
              advance();
              return finish(Node.newString(Token.REGEXP, regexp.text()), start);
            }
          default:
            throw unexpected("Expression expected");
        }
      default:
        throw unexpected("Expression expected");
    }
  }

  private Node parseIdentifierExpression(int start) {
    switch (token.text()) {
      case "function":
        return parseFunctionExpression(start, false);
      case "async":
        {
          SyntaxToken next = peek();
          if (next.isIdentifier("function") && !next.newlineBefore()) {
            advance();
            return parseFunctionExpression(start, true);
          }
          break;
        }
      case "class":
        return parseClass(start, true, ImmutableList.of());
      case "this":
        advance();
        return finish(new Node(Token.THIS), start);
      case "null":
        advance();
        return finish(new Node(Token.NULL), start);
      case "true":
        advance();
        return finish(new Node(Token.TRUE), start);
      case "false":
        advance();
        return finish(new Node(Token.FALSE), start);
      default:
        break;
    }
    if (RESERVED_WORDS.contains(token.text())) {
      throw unexpected("Expression expected");
    }
    return finish(IR.name(advance().text()), start);
  }

  private Node parseTemplateLiteral() {
    int start = token.start();
    Node template = new Node(Token.TEMPLATELIT);
    SyntaxToken part = advance();
    template.addChildToBack(newTemplateString(part));
    while (part.kind() != Kind.NO_SUBSTITUTION_TEMPLATE && part.kind() != Kind.TEMPLATE_TAIL) {
      int subStart = token.start();
      Node expr = parseExpression(false);
      template.addChildToBack(finish(new Node(Token.TEMPLATELIT_SUB, expr), subStart));
      if (!at("}")) {
        throw unexpected("'}' expected");
      }
      token = scanner.rescanTemplateContinuation(token);
      part = advance();
      template.addChildToBack(newTemplateString(part));
    }
    return finish(template, start);
  }

  private Node newTemplateString(SyntaxToken part) {
    Node string = Node.newTemplateLitString(requireNonNull(part.value()), part.text());
    string.setSourceRange(part.start(), part.end());
    string.setLinenoCharno(scanner.lineOf(part.start()), scanner.columnOf(part.start()));
    return string;
  }

  private Node parseArrayLiteral() {
    int start = token.start();
    expect("[");
    Node array = new Node(Token.ARRAYLIT);
    while (!at("]")) {
      if (at(",")) {
        int holeStart = token.start();
        advance();
        array.addChildToBack(finish(IR.empty(), holeStart));
        continue;
      }
      int elementStart = token.start();
      if (eat("...")) {
        Node spread = parseAssignment(false);
        array.addChildToBack(finish(new Node(Token.ITER_SPREAD, spread), elementStart));
      } else {
        array.addChildToBack(parseAssignment(false));
      }
      if (!eat(",")) {
        break;
      }
    }
    expect("]");
    return finish(array, start);
  }

  private Node parseObjectLiteral() {
    int start = token.start();
    expect("{");
    Node object = new Node(Token.OBJECTLIT);
    while (!at("}")) {
      object.addChildToBack(parseObjectMember());
      if (!eat(",")) {
        break;
      }
    }
    expect("}");
    return finish(object, start);
  }

  private Node parseObjectMember() {
    int start = token.start();
    if (eat("...")) {
      Node spread = parseAssignment(false);
      return finish(new Node(Token.OBJECT_SPREAD, spread), start);
    }
    boolean isAsync = false;
    boolean isGenerator = false;
    String accessor = null;
    if (token.isIdentifier("async")) {
      SyntaxToken next = peek();
      if (!next.newlineBefore() && (startsPropertyName(next) || next.is("*"))) {
        advance();
        isAsync = true;
      }
    }
    if (eat("*")) {
      isGenerator = true;
    }
    if ((token.isIdentifier("get") || token.isIdentifier("set")) && startsPropertyName(peek())) {
      accessor = advance().text();
    }
    PropertyName name = parsePropertyName();
    if (accessor != null || isAsync || isGenerator || at("(") || at("<")) {
      Node function = requireNonNull(parseMethod(start, isAsync, isGenerator, true));
      Token kind =
          accessor == null
              ? Token.STRING_KEY
              : accessor.equals("get") ? Token.GETTER_DEF : Token.SETTER_DEF;
      return finish(newMember(kind, name, function), start);
    }
    if (eat(":")) {
      Node value = parseAssignment(false);
      return finish(newMember(Token.STRING_KEY, name, value), start);
    }
    if (!name.identifier() || RESERVED_WORDS.contains(name.key())) {
      throw unexpected("':' expected");
    }
    Node value = finish(IR.name(name.key()), start);
    if (eat("=")) {
      // Only valid when the literal turns out to be an assignment pattern.
      Node defaultValue = parseAssignment(false);
      value = finish(new Node(Token.DEFAULT_VALUE, value, defaultValue), start);
    }
    return finish(newMember(Token.STRING_KEY, name, value), start);
  }

  // ==========================================================================
  // Types, which are parsed only to be skipped

  private void skipTypeAnnotationIfPresent() {
    if (eat(":")) {
      parseType();
    }
  }

  private void parseType() {
    if (isStartOfFunctionType()) {
      parseFunctionType();
      return;
    }
    parseUnionType();
    if (token.isIdentifier("extends") && !token.newlineBefore()) {
      // A conditional type.
      advance();
      parseUnionType();
      expect("?");
      parseType();
      expect(":");
      parseType();
    }
  }

  private boolean isStartOfFunctionType() {
    if (at("<") || token.isIdentifier("new")) {
      return true;
    }
    if (token.isIdentifier("abstract") && peek().isIdentifier("new")) {
      return true;
    }
    if (!at("(")) {
      return false;
    }
    State state = mark();
    try {
      skipBalanced();
      return at("=>");
    } catch (ParseError e) {
      return false;
    } finally {
      reset(state);
    }
  }

  private void parseFunctionType() {
    if (token.isIdentifier("abstract")) {
      advance();
    }
    if (token.isIdentifier("new")) {
      advance();
    }
    skipTypeParametersIfPresent();
    if (!at("(")) {
      throw unexpected("'(' expected");
    }
    skipBalanced();
    expect("=>");
    parseType();
  }

  private void parseUnionType() {
    eat("|");
    parseIntersectionType();
    while (eat("|")) {
      parseIntersectionType();
    }
  }

  private void parseIntersectionType() {
    eat("&");
    parseTypeOperator();
    while (eat("&")) {
      parseTypeOperator();
    }
  }

  private void parseTypeOperator() {
    if ((token.isIdentifier("keyof") || token.isIdentifier("unique")
            || token.isIdentifier("readonly"))
        && startsType(peek())) {
      advance();
      parseTypeOperator();
      return;
    }
    if (token.isIdentifier("infer") && isBindingIdentifier(peek())) {
      advance();
      advance();
      return;
    }
    parsePrimaryType();
    while (at("[") && !token.newlineBefore()) {
      advance();
      if (!at("]")) {
        parseType();
      }
      expect("]");
    }
  }

  private static boolean startsType(SyntaxToken t) {
    return switch (t.kind()) {
      case IDENTIFIER, STRING, NUMBER, BIGINT, NO_SUBSTITUTION_TEMPLATE, TEMPLATE_HEAD -> true;
      case PUNCTUATOR -> t.is("(") || t.is("[") || t.is("{") || t.is("<") || t.is("-");
      default -> false;
    };
  }

  private void parsePrimaryType() {
    switch (token.kind()) {
      case STRING, NUMBER, BIGINT, NO_SUBSTITUTION_TEMPLATE -> advance();
      case TEMPLATE_HEAD -> {
        advance();
        while (true) {
          parseType();
          if (!at("}")) {
            throw unexpected("'}' expected");
          }
          token = scanner.rescanTemplateContinuation(token);
          if (advance().kind() == Kind.TEMPLATE_TAIL) {
            break;
          }
        }
      }
      case PUNCTUATOR -> {
        switch (token.text()) {
          case "-" -> {
            advance();
            if (token.kind() != Kind.NUMBER && token.kind() != Kind.BIGINT) {
              throw unexpected("Number expected");
            }
            advance();
          }
          case "(" -> {
            advance();
            parseType();
            expect(")");
          }
          case "[", "{" -> skipBalanced();
          default -> throw unexpected("Type expected");
        }
      }
      case IDENTIFIER -> parseTypeReference();
      default -> throw unexpected("Type expected");
    }
  }

  private void parseTypeReference() {
    if (token.isIdentifier("typeof")) {
      advance();
      if (token.isIdentifier("import")) {
        parseImportType();
        return;
      }
      expectIdentifierName();
      while (eat(".")) {
        expectIdentifierName();
      }
      if (at("<") && !token.newlineBefore()) {
        skipTypeArguments();
      }
      return;
    }
    if (token.isIdentifier("import") && peek().is("(")) {
      parseImportType();
      return;
    }
    if (token.isIdentifier("asserts")) {
      SyntaxToken next = peek();
      if (next.kind() == Kind.IDENTIFIER && !next.newlineBefore() && !next.isIdentifier("is")) {
        advance();
        advance();
        if (token.isIdentifier("is") && !token.newlineBefore()) {
          advance();
          parseType();
        }
        return;
      }
    }
    advance();
    if (token.isIdentifier("is") && !token.newlineBefore()) {
      // A type predicate, x is T.
      advance();
      parseType();
      return;
    }
    while (eat(".")) {
      expectIdentifierName();
    }
    if (at("<") && !token.newlineBefore()) {
      skipTypeArguments();
    }
  }

  private void parseImportType() {
    advance();
    expect("(");
    parseModuleSpecifier();
    expect(")");
    while (eat(".")) {
      expectIdentifierName();
    }
    if (at("<")) {
      skipTypeArguments();
    }
  }

  private void skipTypeArguments() {
    expect("<");
    if (!at(">")) {
      parseType();
      while (eat(",")) {
        parseType();
      }
    }
    expect(">");
  }

  private void skipTypeParametersIfPresent() {
    if (!eat("<")) {
      return;
    }
    while (!at(">")) {
      while ((token.isIdentifier("const") || token.isIdentifier("in")
              || token.isIdentifier("out"))
          && peek().kind() == Kind.IDENTIFIER) {
        advance();
      }
      expectIdentifierName();
      if (token.isIdentifier("extends")) {
        advance();
        parseType();
      }
      if (eat("=")) {
        parseType();
      }
      if (!eat(",")) {
        break;
      }
    }
    expect(">");
  }

  /** Skips a bracketed run of tokens starting at an opening {@code (}, {@code [} or {@code {}. */
  private void skipBalanced() {
    Deque<String> closers = new ArrayDeque<>();
    do {
      SyntaxToken t = token;
      if (t.kind() == Kind.EOF) {
        throw unexpected("'" + closers.peek() + "' expected");
      }
      if (t.is("{")) {
        closers.push("}");
      } else if (t.is("(")) {
        closers.push(")");
      } else if (t.is("[")) {
        closers.push("]");
      } else if (t.kind() == Kind.TEMPLATE_HEAD) {
        closers.push("${");
      } else if (t.is("}") && "${".equals(closers.peek())) {
        token = scanner.rescanTemplateContinuation(t);
        if (token.kind() == Kind.TEMPLATE_TAIL) {
          closers.pop();
        }
      } else if (t.is("}") || t.is(")") || t.is("]")) {
        if (!t.text().equals(closers.peek())) {
          throw unexpected("'" + closers.peek() + "' expected");
        }
        closers.pop();
      } else if (closers.isEmpty()) {
        throw unexpected("'{' expected");
      }
      advance();
    } while (!closers.isEmpty());
  }
}
