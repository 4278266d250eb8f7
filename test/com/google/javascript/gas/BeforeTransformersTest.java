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

import static com.google.common.truth.Truth.assertThat;
import static com.google.javascript.gas.NodeFiltersTest.parse;

import com.google.javascript.gas.ast.Node;
import com.google.javascript.gas.compiler.TreeTransform;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class BeforeTransformersTest {

  private static final TreeTransform COMMENT_OUT_IMPORTS =
      BeforeTransformers.commentOut(NodeFilters::isImport);

  @Test
  public void testCommentOut() {
    Node root = parse("import {a} from \"./m\";\nf(a);");
    Node importDecl = root.getFirstChild();

    assertThat(COMMENT_OUT_IMPORTS.transform(root)).isSameInstanceAs(root);

    Node placeholder = root.getFirstChild();
    assertThat(placeholder.isNotEmitted()).isTrue();
    assertThat(placeholder.getSyntheticComment()).isEqualTo("import {a} from \"./m\";");
    assertThat(placeholder.getOriginalNode()).isSameInstanceAs(importDecl);
    assertThat(placeholder.getLineno()).isEqualTo(1);
    assertThat(root.getSecondChild().isExprResult()).isTrue();
  }

  @Test
  public void testCommentOut_keepsSiblings() {
    Node root = parse("var a;\nimport C = A.b;\nimport D = A.d;\nf(C);");
    COMMENT_OUT_IMPORTS.transform(root);

    assertThat(root.getChildCount()).isEqualTo(4);
    assertThat(root.getFirstChild().isVar()).isTrue();
    assertThat(root.getSecondChild().getSyntheticComment()).isEqualTo("import C = A.b;");
    assertThat(root.getChildAtIndex(2).getSyntheticComment()).isEqualTo("import D = A.d;");
    assertThat(root.getLastChild().isExprResult()).isTrue();
  }

  @Test
  public void testCommentOut_nested() {
    Node root = parse("namespace N {\n  import C = A.b;\n  var x = C;\n}");
    COMMENT_OUT_IMPORTS.transform(root);

    Node elements = root.getFirstChild().getLastChild();
    assertThat(elements.getFirstChild().isNotEmitted()).isTrue();
    assertThat(elements.getFirstChild().getSyntheticComment()).isEqualTo("import C = A.b;");
    assertThat(elements.getSecondChild().isVar()).isTrue();
  }

  @Test
  public void testCommentOut_multiline() {
    Node root = parse("export { foo, bar }\n  from \"file\";");
    BeforeTransformers.commentOut(NodeFilters::isExportFrom).transform(root);

    assertThat(root.getFirstChild().getSyntheticComment())
        .isEqualTo("export { foo, bar }\\n  from \"file\";");
  }

  @Test
  public void testCommentOut_keepsComments() {
    Node root = parse("// next statement will be ignored\nimport C = A.b; // alias\nf(C);");
    COMMENT_OUT_IMPORTS.transform(root);

    Node placeholder = root.getFirstChild();
    assertThat(placeholder.getLeadingComments()).hasSize(1);
    assertThat(placeholder.getTrailingComments()).hasSize(1);
  }

  @Test
  public void testCommentOut_noMatch() {
    Node root = parse("var a = require(\"m\");");
    Node var = root.getFirstChild();
    COMMENT_OUT_IMPORTS.transform(root);
    assertThat(root.getFirstChild()).isSameInstanceAs(var);
  }

  @Test
  public void testEscapeLineBreaks() {
    assertThat(BeforeTransformers.escapeLineBreaks("a\nb")).isEqualTo("a\\nb");
    assertThat(BeforeTransformers.escapeLineBreaks("a\r\nb")).isEqualTo("a\\nb");
    assertThat(BeforeTransformers.escapeLineBreaks("a\rb")).isEqualTo("a\\nb");
    assertThat(BeforeTransformers.escapeLineBreaks("a\n\nb")).isEqualTo("a\\n\\nb");
    assertThat(BeforeTransformers.escapeLineBreaks("ab")).isEqualTo("ab");
  }

  @Test
  public void testNoSubstitution() {
    Node root = parse("var a = b.c;");
    BeforeTransformers.noSubstitution(NodeFilters::isIdentifier).transform(root);

    Node var = root.getFirstChild();
    Node a = var.getFirstChild();
    Node getprop = a.getFirstChild();
    assertThat(var.isNoSubstitution()).isFalse();
    assertThat(a.isNoSubstitution()).isTrue();
    assertThat(getprop.isNoSubstitution()).isTrue();
    assertThat(getprop.getFirstChild().isNoSubstitution()).isTrue();
  }

  @Test
  public void testNoSubstitution_enumName() {
    Node root = parse("enum E { A = 1 }\nvar x = E.A;");
    BeforeTransformers.noSubstitution(NodeFilters::isIdentifier).transform(root);

    Node enumName = root.getFirstChild().getFirstChild();
    assertThat(enumName.isName()).isTrue();
    assertThat(enumName.isNoSubstitution()).isFalse();

    Node reference = root.getSecondChild().getFirstChild().getFirstChild().getFirstChild();
    assertThat(reference.getString()).isEqualTo("E");
    assertThat(reference.isNoSubstitution()).isTrue();
  }
}
