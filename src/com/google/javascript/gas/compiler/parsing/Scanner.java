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

import com.google.common.collect.ImmutableList;
import com.google.javascript.gas.ast.Comment;
import com.google.javascript.gas.ast.SourceFile;
import com.google.javascript.gas.compiler.parsing.SyntaxToken.Kind;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Breaks TypeScript and JavaScript source text into tokens, keeping the comments it skips.
 *
 * <p>Some tokens depend on the grammar: a {@code /} may start a regular expression, a {@code }}
 * may continue a template and a {@code >} may be part of a shift operator. The scanner always
 * produces the short form and the parser asks for a rescan where the grammar calls for the other.
 */
final class Scanner {
  // Longest first, so that the first match is the longest.
  private static final String[] PUNCTUATORS = {
    "...", "===", "!==", "**=", "<<=", "&&=", "||=", "??=",
    "=>", "==", "!=", "<=", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "++", "--",
    "**", "<<", "&&", "||", "??", "?.",
    "{", "}", "(", ")", "[", "]", ";", ",", "<", ">", "+", "-", "*", "/", "%", "&", "|", "^",
    "!", "~", "?", ":", "=", ".", "@", "#",
  };

  private final SourceFile file;
  private final String source;
  private final int[] lineStarts;

  private int pos;

  Scanner(SourceFile file) {
    this.file = file;
    this.source = file.getCode();
    this.lineStarts = computeLineStarts(source);
  }

  SourceFile getFile() {
    return file;
  }

  String getSource() {
    return source;
  }

  int getPosition() {
    return pos;
  }

  void setPosition(int pos) {
    this.pos = pos;
  }

  /** One-based line of an offset. */
  int lineOf(int offset) {
    int index = Arrays.binarySearch(lineStarts, offset);
    return index >= 0 ? index + 1 : -index - 1;
  }

  /** Zero-based column of an offset. */
  int columnOf(int offset) {
    return offset - lineStarts[lineOf(offset) - 1];
  }

  private static int[] computeLineStarts(String source) {
    List<Integer> starts = new ArrayList<>();
    starts.add(0);
    for (int i = 0; i < source.length(); i++) {
      char c = source.charAt(i);
      if (c == '\r' && i + 1 < source.length() && source.charAt(i + 1) == '\n') {
        i++;
        starts.add(i + 1);
      } else if (isLineTerminator(c)) {
        starts.add(i + 1);
      }
    }
    return starts.stream().mapToInt(Integer::intValue).toArray();
  }

  static boolean isLineTerminator(char c) {
    return c == '\n' || c == '\r' || c == '\u2028' || c == '\u2029';
  }

  static boolean isIdentifierStart(int c) {
    return c == '$' || c == '_' || Character.isUnicodeIdentifierStart(c);
  }

  static boolean isIdentifierPart(int c) {
    return c == '$' || c == '_' || c == '\u200c' || c == '\u200d'
        || Character.isUnicodeIdentifierPart(c) && !Character.isIdentifierIgnorable(c);
  }

  /** Scans the next token, collecting the comments in front of it. */
  SyntaxToken next() {
    ImmutableList.Builder<Comment> comments = ImmutableList.builder();
    boolean newlineBefore = skipTrivia(comments);
    ImmutableList<Comment> commentList = comments.build();
    int start = pos;
    if (pos >= source.length()) {
      return new SyntaxToken(Kind.EOF, "", null, 0, start, start, newlineBefore, commentList);
    }
    char c = source.charAt(pos);
    if (isIdentifierStart(source.codePointAt(pos)) || c == '\\') {
      String name = scanIdentifierName();
      return new SyntaxToken(
          Kind.IDENTIFIER, name, null, 0, start, pos, newlineBefore, commentList);
    }
    if (c == '#' && pos + 1 < source.length() && isIdentifierStart(source.codePointAt(pos + 1))) {
      pos++;
      String name = "#" + scanIdentifierName();
      return new SyntaxToken(
          Kind.PRIVATE_NAME, name, null, 0, start, pos, newlineBefore, commentList);
    }
    if (isDigit(c) || (c == '.' && pos + 1 < source.length() && isDigit(source.charAt(pos + 1)))) {
      return scanNumber(newlineBefore, commentList);
    }
    if (c == '"' || c == '\'') {
      String value = scanString(c);
      return new SyntaxToken(
          Kind.STRING, source.substring(start, pos), value, 0, start, pos, newlineBefore,
          commentList);
    }
    if (c == '`') {
      pos++;
      return scanTemplate(start, true, newlineBefore, commentList);
    }
    for (String punctuator : PUNCTUATORS) {
      if (source.startsWith(punctuator, pos)) {
        // a?.5:1 is a conditional, not an optional chain.
        if (punctuator.equals("?.")
            && pos + 2 < source.length()
            && isDigit(source.charAt(pos + 2))) {
          continue;
        }
        pos += punctuator.length();
        return new SyntaxToken(
            Kind.PUNCTUATOR, punctuator, null, 0, start, pos, newlineBefore, commentList);
      }
    }
    throw error(start, "Unexpected character '" + c + "'");
  }

  /**
   * Rescans a {@code /} or {@code /=} token as a regular expression literal. The value of the
   * returned token is the full literal, e.g. {@code /a+/g}.
   */
  SyntaxToken rescanSlashAsRegex(SyntaxToken slash) {
    pos = slash.start() + 1;
    boolean inClass = false;
    while (true) {
      if (pos >= source.length() || isLineTerminator(source.charAt(pos))) {
        throw error(slash.start(), "Unterminated regular expression literal");
      }
      char c = source.charAt(pos++);
      if (c == '\\') {
        if (pos >= source.length() || isLineTerminator(source.charAt(pos))) {
          throw error(slash.start(), "Unterminated regular expression literal");
        }
        pos++;
      } else if (c == '[') {
        inClass = true;
      } else if (c == ']') {
        inClass = false;
      } else if (c == '/' && !inClass) {
        break;
      }
    }
    while (pos < source.length() && isIdentifierPart(source.codePointAt(pos))) {
      pos++;
    }
    String literal = source.substring(slash.start(), pos);
    return new SyntaxToken(
        Kind.REGEXP, literal, literal, 0, slash.start(), pos, slash.newlineBefore(),
        slash.comments());
  }

  /** Rescans a {@code }} that closes a template substitution as the rest of the template. */
  SyntaxToken rescanTemplateContinuation(SyntaxToken closeBrace) {
    pos = closeBrace.start() + 1;
    return scanTemplate(
        closeBrace.start(), false, closeBrace.newlineBefore(), closeBrace.comments());
  }

  /** Merges a {@code >} with the characters after it into a shift or comparison operator. */
  SyntaxToken rescanGreater(SyntaxToken greater) {
    int start = greater.start();
    for (String op : new String[] {">>>=", ">>>", ">>=", ">>", ">="}) {
      if (source.startsWith(op, start)) {
        pos = start + op.length();
        return new SyntaxToken(
            Kind.PUNCTUATOR, op, null, 0, start, pos, greater.newlineBefore(),
            greater.comments());
      }
    }
    return greater;
  }

  private boolean skipTrivia(ImmutableList.Builder<Comment> comments) {
    boolean newline = pos == 0;
    while (pos < source.length()) {
      char c = source.charAt(pos);
      if (isLineTerminator(c)) {
        newline = true;
        pos++;
      } else if (c == ' ' || c == '\t' || c == '\u000b' || c == '\f' || c == '\u00a0'
          || c == '\ufeff' || Character.getType(c) == Character.SPACE_SEPARATOR) {
        pos++;
      } else if (source.startsWith("//", pos)) {
        int start = pos;
        while (pos < source.length() && !isLineTerminator(source.charAt(pos))) {
          pos++;
        }
        comments.add(new Comment(source.substring(start, pos), Comment.Style.LINE, start, pos));
      } else if (source.startsWith("/*", pos)) {
        int start = pos;
        int close = source.indexOf("*/", pos + 2);
        if (close < 0) {
          throw error(start, "Unterminated comment");
        }
        pos = close + 2;
        String text = source.substring(start, pos);
        if (text.chars().anyMatch(ch -> isLineTerminator((char) ch))) {
          newline = true;
        }
        comments.add(new Comment(text, Comment.Style.BLOCK, start, pos));
      } else if (pos == 0 && source.startsWith("#!")) {
        while (pos < source.length() && !isLineTerminator(source.charAt(pos))) {
          pos++;
        }
      } else {
        break;
      }
    }
    return newline;
  }

  private String scanIdentifierName() {
    StringBuilder name = new StringBuilder();
    while (pos < source.length()) {
      int c = source.codePointAt(pos);
      if (c == '\\') {
        if (!source.startsWith("\\u", pos)) {
          throw error(pos, "Invalid escape in identifier");
        }
        pos += 2;
        name.appendCodePoint(scanUnicodeEscapeBody(pos - 2));
      } else if (name.length() == 0 ? isIdentifierStart(c) : isIdentifierPart(c)) {
        name.appendCodePoint(c);
        pos += Character.charCount(c);
      } else {
        break;
      }
    }
    return name.toString();
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private SyntaxToken scanNumber(boolean newlineBefore, ImmutableList<Comment> comments) {
    int start = pos;
    double value;
    boolean bigint = false;
    char c = source.charAt(pos);
    char radixChar = pos + 1 < source.length() ? Character.toLowerCase(source.charAt(pos + 1)) : 0;
    if (c == '0' && (radixChar == 'x' || radixChar == 'o' || radixChar == 'b')) {
      int radix = radixChar == 'x' ? 16 : radixChar == 'o' ? 8 : 2;
      pos += 2;
      String digits = scanDigits(radix);
      if (digits.isEmpty()) {
        throw error(start, "Digit expected");
      }
      value = new BigInteger(digits, radix).doubleValue();
      if (pos < source.length() && source.charAt(pos) == 'n') {
        pos++;
        bigint = true;
      }
    } else if (c == '0' && pos + 1 < source.length() && isDigit(source.charAt(pos + 1))) {
      pos++;
      String digits = scanDigits(10);
      if (digits.chars().allMatch(d -> d < '8')) {
        value = new BigInteger(digits, 8).doubleValue();
      } else {
        value = Double.parseDouble(digits);
      }
    } else {
      StringBuilder text = new StringBuilder(scanDigits(10));
      if (pos < source.length() && source.charAt(pos) == 'n') {
        pos++;
        bigint = true;
        value = Double.parseDouble(text.toString());
      } else {
        if (pos < source.length() && source.charAt(pos) == '.') {
          pos++;
          text.append('.').append(scanDigits(10));
        }
        if (pos < source.length() && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
          pos++;
          text.append('e');
          if (pos < source.length() && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
            text.append(source.charAt(pos++));
          }
          String exponent = scanDigits(10);
          if (exponent.isEmpty()) {
            throw error(start, "Digit expected");
          }
          text.append(exponent);
        }
        String literal = text.toString();
        value = Double.parseDouble(literal.startsWith(".") ? "0" + literal : literal);
      }
    }
    if (pos < source.length() && isIdentifierStart(source.codePointAt(pos))) {
      throw error(pos, "An identifier or keyword cannot immediately follow a numeric literal");
    }
    return new SyntaxToken(
        bigint ? Kind.BIGINT : Kind.NUMBER, source.substring(start, pos), null, value, start, pos,
        newlineBefore, comments);
  }

  private String scanDigits(int radix) {
    StringBuilder digits = new StringBuilder();
    while (pos < source.length()) {
      char c = source.charAt(pos);
      if (c == '_' && digits.length() > 0) {
        pos++;
      } else if (Character.digit(c, radix) >= 0) {
        digits.append(c);
        pos++;
      } else {
        break;
      }
    }
    return digits.toString();
  }

  private String scanString(char quote) {
    int start = pos;
    pos++;
    StringBuilder value = new StringBuilder();
    while (true) {
      if (pos >= source.length() || source.charAt(pos) == '\n' || source.charAt(pos) == '\r') {
        throw error(start, "Unterminated string literal");
      }
      char c = source.charAt(pos++);
      if (c == quote) {
        return value.toString();
      } else if (c == '\\') {
        scanEscape(value, false);
      } else {
        value.append(c);
      }
    }
  }

  private void scanEscape(StringBuilder value, boolean inTemplate) {
    if (pos >= source.length()) {
      throw error(pos, "Unexpected end of input");
    }
    int escapeStart = pos - 1;
    char c = source.charAt(pos++);
    switch (c) {
      case 'n' -> value.append('\n');
      case 't' -> value.append('\t');
      case 'r' -> value.append('\r');
      case 'b' -> value.append('\b');
      case 'f' -> value.append('\f');
      case 'v' -> value.append('\u000b');
      case 'x' -> {
        if (pos + 2 > source.length()) {
          throw error(escapeStart, "Hexadecimal digit expected");
        }
        value.append((char) parseHex(source.substring(pos, pos + 2), escapeStart));
        pos += 2;
      }
      case 'u' -> value.appendCodePoint(scanUnicodeEscapeBody(escapeStart));
      case '\r' -> {
        if (pos < source.length() && source.charAt(pos) == '\n') {
          pos++;
        }
      }
      case '\n', '\u2028', '\u2029' -> {}
      default -> {
        if (c >= '0' && c <= '7') {
          if (c == '0' && (pos >= source.length() || !isDigit(source.charAt(pos)))) {
            value.append('\0');
            return;
          }
          if (inTemplate) {
            throw error(escapeStart, "Octal escape sequences are not allowed in templates");
          }
          int code = c - '0';
          int limit = c <= '3' ? 2 : 1;
          for (int i = 0; i < limit && pos < source.length(); i++) {
            char d = source.charAt(pos);
            if (d < '0' || d > '7') {
              break;
            }
            code = code * 8 + (d - '0');
            pos++;
          }
          value.append((char) code);
        } else {
          value.append(c);
        }
      }
    }
  }

  private int scanUnicodeEscapeBody(int escapeStart) {
    if (pos < source.length() && source.charAt(pos) == '{') {
      int close = source.indexOf('}', pos);
      if (close < 0) {
        throw error(escapeStart, "Unterminated Unicode escape sequence");
      }
      int codePoint = parseHex(source.substring(pos + 1, close), escapeStart);
      pos = close + 1;
      return codePoint;
    }
    if (pos + 4 > source.length()) {
      throw error(escapeStart, "Hexadecimal digit expected");
    }
    int codeUnit = parseHex(source.substring(pos, pos + 4), escapeStart);
    pos += 4;
    return codeUnit;
  }

  private int parseHex(String digits, int offset) {
    try {
      int value = Integer.parseInt(digits, 16);
      if (digits.isEmpty() || value > Character.MAX_CODE_POINT || digits.startsWith("+")
          || digits.startsWith("-")) {
        throw error(offset, "Invalid escape sequence");
      }
      return value;
    } catch (NumberFormatException e) {
      throw error(offset, "Hexadecimal digit expected");
    }
  }

  /** Scans template characters up to and including the closing backtick or {@code ${}. */
  private SyntaxToken scanTemplate(
      int start, boolean head, boolean newlineBefore, ImmutableList<Comment> comments) {
    StringBuilder cooked = new StringBuilder();
    StringBuilder raw = new StringBuilder();
    while (true) {
      if (pos >= source.length()) {
        throw error(start, "Unterminated template literal");
      }
      char c = source.charAt(pos);
      if (c == '`') {
        pos++;
        return templateToken(
            head ? Kind.NO_SUBSTITUTION_TEMPLATE : Kind.TEMPLATE_TAIL, start, cooked, raw,
            newlineBefore, comments);
      } else if (c == '$' && source.startsWith("${", pos)) {
        pos += 2;
        return templateToken(
            head ? Kind.TEMPLATE_HEAD : Kind.TEMPLATE_MIDDLE, start, cooked, raw, newlineBefore,
            comments);
      } else if (c == '\\') {
        int escapeStart = pos;
        pos++;
        scanEscape(cooked, true);
        raw.append(source, escapeStart, pos);
      } else if (c == '\r') {
        // Line terminators in templates are normalized to \n.
        pos++;
        if (pos < source.length() && source.charAt(pos) == '\n') {
          pos++;
        }
        cooked.append('\n');
        raw.append('\n');
      } else {
        pos++;
        cooked.append(c);
        raw.append(c);
      }
    }
  }

  private SyntaxToken templateToken(
      Kind kind,
      int start,
      StringBuilder cooked,
      StringBuilder raw,
      boolean newlineBefore,
      ImmutableList<Comment> comments) {
    // The raw text rides in the text slot; the source slice is not needed for templates.
    return new SyntaxToken(
        kind, raw.toString(), cooked.toString(), 0, start, pos, newlineBefore, comments);
  }

  ParseError error(int offset, String message) {
    return new ParseError(message, offset);
  }

  /** A syntax error at a source offset. */
  static final class ParseError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    final int offset;

    ParseError(String message, int offset) {
      super(message);
      this.offset = offset;
    }
  }
}
