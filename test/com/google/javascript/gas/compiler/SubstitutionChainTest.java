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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.javascript.gas.ast.IR;
import com.google.javascript.gas.ast.Node;
import com.google.javascript.gas.ast.Token;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SubstitutionChainTest {

  private static SubstitutionHook rename(String from, String to) {
    return SubstitutionHook.of(Token.NAME, n -> n.getString().equals(from) ? IR.name(to) : n);
  }

  @Test
  public void testEmpty() {
    Node name = IR.name("a");
    assertThat(SubstitutionChain.empty().substitute(name)).isSameInstanceAs(name);
    assertThat(SubstitutionChain.empty().isEnabled(Token.NAME)).isFalse();
  }

  @Test
  public void testHooksSeeEarlierResults() {
    SubstitutionChain chain =
        SubstitutionChain.empty().then(rename("a", "b")).then(rename("b", "c"));
    assertThat(chain.substitute(IR.name("a")).getString()).isEqualTo("c");
    assertThat(chain.substitute(IR.name("b")).getString()).isEqualTo("c");
  }

  @Test
  public void testOrderMatters() {
    SubstitutionChain chain =
        SubstitutionChain.empty().then(rename("b", "c")).then(rename("a", "b"));
    assertThat(chain.substitute(IR.name("a")).getString()).isEqualTo("b");
  }

  @Test
  public void testOnlyMatchingTokens() {
    SubstitutionChain chain =
        SubstitutionChain.empty()
            .then(SubstitutionHook.of(Token.STRINGLIT, n -> IR.string("replaced")));
    Node name = IR.name("a");
    assertThat(chain.substitute(name)).isSameInstanceAs(name);
    assertThat(chain.substitute(IR.string("x")).getString()).isEqualTo("replaced");
    assertThat(chain.isEnabled(Token.STRINGLIT)).isTrue();
    assertThat(chain.isEnabled(Token.NAME)).isFalse();
  }

  @Test
  public void testNoSubstitutionFlag() {
    SubstitutionChain chain = SubstitutionChain.empty().then(rename("a", "b"));
    Node name = IR.name("a");
    name.setNoSubstitution(true);
    assertThat(chain.substitute(name)).isSameInstanceAs(name);
  }

  @Test
  public void testThenAllKeepsExistingHooks() {
    SubstitutionHook first = rename("a", "b");
    SubstitutionHook second = rename("x", "y");
    SubstitutionChain chain = SubstitutionChain.empty().then(first);
    SubstitutionChain longer = chain.thenAll(ImmutableList.of(second));
    assertThat(chain.getHooks()).containsExactly(first);
    assertThat(longer.getHooks()).containsExactly(first, second).inOrder();
  }

  @Test
  public void testHookInPrinter() {
    Node root = IR.script();
    root.addChildToBack(IR.exprResult(IR.call(IR.name("f"), IR.name("a"))));
    String code =
        new CodePrinter.Builder(root)
            .setSubstitutions(SubstitutionChain.empty().then(rename("a", "b")))
            .build();
    assertThat(code).isEqualTo("f(b);\n");
  }
}
