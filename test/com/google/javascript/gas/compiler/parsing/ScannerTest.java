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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.javascript.gas.ast.Comment;
import com.google.javascript.gas.ast.SourceFile;
import com.google.javascript.gas.compiler.parsing.Scanner.ParseError;
import com.google.javascript.gas.compiler.parsing.SyntaxToken.Kind;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ScannerTest {

  private static Scanner scanner(String code) {
    return new Scanner(SourceFile.fromCode("testcode.ts", code));
  }

  private static List<SyntaxToken> scan(String code) {
    Scanner scanner = scanner(code);
    List<SyntaxToken> tokens = new ArrayList<>();
    SyntaxToken token;
    do {
      token = scanner.next();
      tokens.add(token);
    } while (token.kind() != Kind.EOF);
    return tokens;
  }

  private static List<String> texts(String code) {
    List<String> texts = new ArrayList<>();
    for (SyntaxToken token : scan(code)) {
      if (token.kind() != Kind.EOF) {
        texts.add(token.text());
      }
    }
    return texts;
  }

  @Test
  public void testStatement() {
    List<SyntaxToken> tokens = scan("var a = 0x1F;");
    assertThat(tokens).hasSize(6);
    assertThat(tokens.get(0).isIdentifier("var")).isTrue();
    assertThat(tokens.get(1).isIdentifier("a")).isTrue();
    assertThat(tokens.get(2).is("=")).isTrue();
    assertThat(tokens.get(3).kind()).isEqualTo(Kind.NUMBER);
    assertThat(tokens.get(3).number()).isEqualTo(31.0);
    assertThat(tokens.get(3).text()).isEqualTo("0x1F");
    assertThat(tokens.get(4).is(";")).isTrue();
    assertThat(tokens.get(5).kind()).isEqualTo(Kind.EOF);
  }

  @Test
  public void testLongestPunctuatorWins() {
    assertThat(texts("a ??= b ** c")).containsExactly("a", "??=", "b", "**", "c").inOrder();
    assertThat(texts("a!==b")).containsExactly("a", "!==", "b").inOrder();
  }

  @Test
  public void testConditionalIsNotOptionalChain() {
    assertThat(texts("a?.5:1")).containsExactly("a", "?", ".5", ":", "1").inOrder();
    assertThat(texts("a?.b")).containsExactly("a", "?.", "b").inOrder();
  }

  @Test
  public void testNumbers() {
    assertThat(scan("1_000").get(0).number()).isEqualTo(1000.0);
    assertThat(scan("010").get(0).number()).isEqualTo(8.0);
    assertThat(scan("1.5e2").get(0).number()).isEqualTo(150.0);
    assertThat(scan("0b101").get(0).number()).isEqualTo(5.0);
    assertThat(scan("10n").get(0).kind()).isEqualTo(Kind.BIGINT);
  }

  @Test
  public void testIdentifierAfterNumber() {
    assertThrows(ParseError.class, () -> scan("3in"));
  }

  @Test
  public void testStrings() {
    SyntaxToken token = scan("'a\\nb\\x41\\u0042\\u{43}'").get(0);
    assertThat(token.kind()).isEqualTo(Kind.STRING);
    assertThat(token.value()).isEqualTo("a\nbABC");
    assertThat(token.text()).isEqualTo("'a\\nb\\x41\\u0042\\u{43}'");
  }

  @Test
  public void testUnterminatedString() {
    ParseError e = assertThrows(ParseError.class, () -> scan("'abc\n'"));
    assertThat(e).hasMessageThat().isEqualTo("Unterminated string literal");
    assertThat(e.offset).isEqualTo(0);
  }

  @Test
  public void testTemplates() {
    Scanner scanner = scanner("`a${b}c`");
    SyntaxToken head = scanner.next();
    assertThat(head.kind()).isEqualTo(Kind.TEMPLATE_HEAD);
    assertThat(head.value()).isEqualTo("a");
    assertThat(scanner.next().isIdentifier("b")).isTrue();
    SyntaxToken tail = scanner.rescanTemplateContinuation(scanner.next());
    assertThat(tail.kind()).isEqualTo(Kind.TEMPLATE_TAIL);
    assertThat(tail.value()).isEqualTo("c");

    SyntaxToken plain = scan("`x\\ty`").get(0);
    assertThat(plain.kind()).isEqualTo(Kind.NO_SUBSTITUTION_TEMPLATE);
    assertThat(plain.value()).isEqualTo("x\ty");
    assertThat(plain.text()).isEqualTo("x\\ty");
  }

  @Test
  public void testCommentsRideOnTheNextToken() {
    List<SyntaxToken> tokens = scan("a // one\n/* two */ b");
    SyntaxToken b = tokens.get(1);
    assertThat(b.newlineBefore()).isTrue();
    assertThat(b.comments()).hasSize(2);
    assertThat(b.comments().get(0).text()).isEqualTo("// one");
    assertThat(b.comments().get(0).style()).isEqualTo(Comment.Style.LINE);
    assertThat(b.comments().get(1).text()).isEqualTo("/* two */");
    assertThat(b.comments().get(1).style()).isEqualTo(Comment.Style.BLOCK);
    assertThat(tokens.get(0).newlineBefore()).isTrue();
  }

  @Test
  public void testShebangIsSkipped() {
    assertThat(texts("#!/usr/bin/env node\nf()")).containsExactly("f", "(", ")").inOrder();
  }

  @Test
  public void testRegexRescan() {
    Scanner scanner = scanner("/a+\\//g");
    SyntaxToken slash = scanner.next();
    assertThat(slash.is("/")).isTrue();
    SyntaxToken regex = scanner.rescanSlashAsRegex(slash);
    assertThat(regex.kind()).isEqualTo(Kind.REGEXP);
    assertThat(regex.value()).isEqualTo("/a+\\//g");
  }

  @Test
  public void testPositions() {
    Scanner scanner = scanner("a\r\nbc\nd");
    assertThat(scanner.lineOf(0)).isEqualTo(1);
    assertThat(scanner.lineOf(4)).isEqualTo(2);
    assertThat(scanner.columnOf(4)).isEqualTo(1);
    assertThat(scanner.lineOf(6)).isEqualTo(3);
    assertThat(scanner.columnOf(6)).isEqualTo(0);
  }
}
