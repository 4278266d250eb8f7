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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** The caller supplied rewrites of a compilation, in the order they run. */
@AutoValue
public abstract class Transformers {

  /** Transforms of the parsed input, run before lowering. */
  public abstract ImmutableList<TreeTransform> before();

  /** Transforms of the lowered tree, run before printing. */
  public abstract ImmutableList<TreeTransform> after();

  /** Hooks run by the printer after the compiler's own substitutions. */
  public abstract ImmutableList<SubstitutionHook> substitutions();

  public abstract Builder toBuilder();

  public static Builder builder() {
    return new AutoValue_Transformers.Builder();
  }

  public static Transformers empty() {
    return builder().build();
  }

  public boolean isEmpty() {
    return before().isEmpty() && after().isEmpty() && substitutions().isEmpty();
  }

  /** Builder for {@link Transformers}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setBefore(Iterable<? extends TreeTransform> before);

    public abstract ImmutableList.Builder<TreeTransform> beforeBuilder();

    public abstract Builder setAfter(Iterable<? extends TreeTransform> after);

    public abstract ImmutableList.Builder<TreeTransform> afterBuilder();

    public abstract Builder setSubstitutions(Iterable<? extends SubstitutionHook> substitutions);

    public abstract ImmutableList.Builder<SubstitutionHook> substitutionsBuilder();

    public Builder addBefore(TreeTransform transform) {
      beforeBuilder().add(transform);
      return this;
    }

    public Builder addAfter(TreeTransform transform) {
      afterBuilder().add(transform);
      return this;
    }

    public Builder addSubstitution(SubstitutionHook hook) {
      substitutionsBuilder().add(hook);
      return this;
    }

    public abstract Transformers build();
  }
}
