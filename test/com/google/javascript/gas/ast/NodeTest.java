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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class NodeTest {

  private static Node call(String name) {
    return IR.exprResult(IR.call(IR.name(name)));
  }

  @Test
  public void testChildren() {
    Node block = IR.block();
    Node a = call("a");
    Node b = call("b");
    block.addChildToBack(a);
    block.addChildToBack(b);
    block.addChildToFront(call("first"));

    assertThat(block.getChildCount()).isEqualTo(3);
    assertThat(block.getSecondChild()).isSameInstanceAs(a);
    assertThat(block.getLastChild()).isSameInstanceAs(b);
    assertThat(a.getPrevious()).isSameInstanceAs(block.getFirstChild());
    assertThat(b.getNext()).isNull();
    assertThat(b.getParent()).isSameInstanceAs(block);
    assertThat(block.getIndexOfChild(b)).isEqualTo(2);
  }

  @Test
  public void testDetach() {
    Node block = IR.block();
    Node a = call("a");
    Node b = call("b");
    block.addChildToBack(a);
    block.addChildToBack(b);

    a.detach();
    assertThat(a.hasParent()).isFalse();
    assertThat(block.getFirstChild()).isSameInstanceAs(b);
    assertThat(b.getPrevious()).isNull();
    assertThrows(IllegalStateException.class, a::detach);
  }

  @Test
  public void testReplaceWithList() {
    Node block = IR.block();
    Node old = call("old");
    block.addChildToBack(call("a"));
    block.addChildToBack(old);
    block.addChildToBack(call("z"));

    Node x = call("x");
    Node y = call("y");
    old.replaceWith(ImmutableList.of(x, y));

    assertThat(block.getChildCount()).isEqualTo(4);
    assertThat(block.getChildAtIndex(1)).isSameInstanceAs(x);
    assertThat(block.getChildAtIndex(2)).isSameInstanceAs(y);
    assertThat(old.hasParent()).isFalse();
  }

  @Test
  public void testInsertAfter() {
    Node block = IR.block();
    Node a = call("a");
    block.addChildToBack(a);
    Node b = call("b");
    b.insertAfter(a);
    assertThat(a.getNext()).isSameInstanceAs(b);
  }

  @Test
  public void testCloneTree() {
    Node original = IR.exprResult(IR.call(IR.name("f"), IR.name("x")));
    original.setSyntheticComment("note");
    Node clone = original.cloneTree();

    assertThat(clone).isNotSameInstanceAs(original);
    assertThat(clone.getFirstChild().getSecondChild().getString()).isEqualTo("x");
    assertThat(clone.getSyntheticComment()).isEqualTo("note");
    assertThat(clone.hasParent()).isFalse();
  }

  @Test
  public void testQualifiedNames() {
    Node abc = IR.getprop(IR.name("a"), "b", "c");
    assertThat(abc.getQualifiedName()).isEqualTo("a.b.c");
    assertThat(abc.matchesQualifiedName("a.b.c")).isTrue();
    assertThat(IR.name("a").matchesName("a")).isTrue();
    assertThat(IR.call(IR.name("f")).isQualifiedName()).isFalse();
  }

  @Test
  public void testComments() {
    Comment lead = new Comment("// lead", Comment.Style.LINE, 0, 7);
    Node from = call("a");
    from.setLeadingComments(ImmutableList.of(lead));
    Node to = call("b");
    to.takeCommentsFrom(from);

    assertThat(to.getLeadingComments()).containsExactly(lead);
    assertThat(from.getLeadingComments()).isEmpty();
  }

  @Test
  public void testExportBindingsKeepTheFirstReplacement() {
    Node script = IR.script();
    Node first = IR.getprop(IR.name("exports"), "a");
    script.addExportBinding("a", first);
    script.addExportBinding("a", IR.getprop(IR.name("m_1"), "a"));

    assertThat(script.getExportBindings()).containsExactly("a", first);
  }

  @Test
  public void testSyntheticNodes() {
    Node name = IR.name("a");
    assertThat(name.isSynthetic()).isTrue();
    name.setSourceRange(3, 4);
    assertThat(name.isSynthetic()).isFalse();
    name.setLinenoCharno(2, 5);
    Node copy = IR.name("b").srcref(name);
    assertThat(copy.getLineno()).isEqualTo(2);
    assertThat(copy.getCharno()).isEqualTo(5);
  }
}
