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
import com.google.errorprone.annotations.Immutable;
import com.google.javascript.gas.ast.Node;
import com.google.javascript.gas.ast.Token;
import java.util.List;

/**
 * An ordered sequence of {@link SubstitutionHook}s. Each hook whose token matches the node being
 * printed sees the result of the hooks before it, so adding a hook composes with the existing ones
 * instead of replacing them.
 */
@Immutable
public final class SubstitutionChain {
  private static final SubstitutionChain EMPTY = new SubstitutionChain(ImmutableList.of());

  @SuppressWarnings("Immutable") // hooks are stateless functions
  private final ImmutableList<SubstitutionHook> hooks;

  private SubstitutionChain(ImmutableList<SubstitutionHook> hooks) {
    this.hooks = hooks;
  }

  public static SubstitutionChain empty() {
    return EMPTY;
  }

  public static SubstitutionChain of(List<SubstitutionHook> hooks) {
    return new SubstitutionChain(ImmutableList.copyOf(hooks));
  }

  /** Returns a chain that runs {@code hook} after every hook of this one. */
  public SubstitutionChain then(SubstitutionHook hook) {
    checkNotNull(hook);
    return new SubstitutionChain(
        ImmutableList.<SubstitutionHook>builder().addAll(hooks).add(hook).build());
  }

  /** Returns a chain that runs the given hooks, in order, after every hook of this one. */
  public SubstitutionChain thenAll(List<SubstitutionHook> more) {
    return new SubstitutionChain(
        ImmutableList.<SubstitutionHook>builder().addAll(hooks).addAll(more).build());
  }

  public ImmutableList<SubstitutionHook> getHooks() {
    return hooks;
  }

  /** Whether any hook is interested in nodes of the given kind. */
  public boolean isEnabled(Token token) {
    for (SubstitutionHook hook : hooks) {
      if (hook.token() == token) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns the node to print for {@code node}. A node flagged {@code NO_SUBSTITUTION} is returned
   * as is.
   */
  public Node substitute(Node node) {
    if (node.isNoSubstitution()) {
      return node;
    }
    Node current = node;
    for (SubstitutionHook hook : hooks) {
      if (hook.token() == current.getToken()) {
        current = checkNotNull(hook.substitute(current), "%s returned null", hook);
      }
    }
    return current;
  }
}
