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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Generates the names of compiler-introduced variables for one script.
 *
 * <p>Generated names never collide with a name spelled in the script or with an earlier generated
 * name. There are three kinds:
 *
 * <ul>
 *   <li>temporaries, {@code _a}, {@code _b}, ... (skipping {@code _i} and {@code _n});
 *   <li>derived names, {@code foo_1}, {@code foo_2}, ... for a variable standing for {@code foo};
 *   <li>aliases such as {@code _this}, which keep their spelling when it is free and are shared by
 *       every scope of the script.
 * </ul>
 */
public final class UniqueNameGenerator {
  private final Set<String> taken;
  private final Multiset<String> counter = HashMultiset.create();
  private final Map<String, String> aliases = new HashMap<>();
  private int nextTemp = 0;

  public UniqueNameGenerator(Set<String> reservedNames) {
    this.taken = new HashSet<>(reservedNames);
  }

  /** Returns a fresh temporary name. */
  public String getTempName() {
    while (true) {
      String name = tempName(nextTemp++);
      if (taken.add(name)) {
        return name;
      }
    }
  }

  private static String tempName(int index) {
    // 24 letters, a-z without i and n, then numbers.
    if (index < 24) {
      char c = (char) ('a' + index);
      if (c >= 'i') {
        c++;
      }
      if (c >= 'n') {
        c++;
      }
      return "_" + c;
    }
    return "_" + (index - 24);
  }

  /** Returns a name for a loop index, {@code _i} when it is free. */
  public String getLoopCounterName() {
    if (taken.add("_i")) {
      return "_i";
    }
    return getTempName();
  }

  /** Returns {@code base_1}, {@code base_2}, ..., whichever is free first. */
  public String getUniqueName(String base) {
    checkArgument(!base.isEmpty());
    while (true) {
      String name = base + "_" + (counter.add(base, 1) + 1);
      if (taken.add(name)) {
        return name;
      }
    }
  }

  /**
   * Returns the script-wide alias for {@code base}: {@code base} itself when the script does not
   * use it, a derived name otherwise. Repeated calls return the same name.
   */
  public String getAlias(String base) {
    String alias = aliases.get(base);
    if (alias == null) {
      alias = taken.add(base) ? base : getUniqueName(base);
      aliases.put(base, alias);
    }
    return alias;
  }

  /** Whether a name is spelled in the script or was generated. */
  public boolean isTaken(String name) {
    return taken.contains(name);
  }

  /** Marks a name as used, e.g. one introduced by a rewrite. */
  public void reserve(String name) {
    taken.add(name);
  }
}
