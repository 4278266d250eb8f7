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

import com.google.auto.value.AutoValue;
import com.google.javascript.gas.compiler.Compiler;
import java.util.ResourceBundle;

/** Name and version of the transpiler and of the compiler it runs. */
@AutoValue
public abstract class ReleaseInfo {
  private static final String CONFIG_RESOURCE = "com.google.javascript.gas.TranspilerConfig";

  public abstract String name();

  public abstract String version();

  public abstract String compilerVersion();

  public static ReleaseInfo create(String name, String version, String compilerVersion) {
    return new AutoValue_ReleaseInfo(name, version, compilerVersion);
  }

  /** Reads the release metadata bundled with the transpiler. */
  public static ReleaseInfo load() {
    ResourceBundle config = ResourceBundle.getBundle(CONFIG_RESOURCE);
    return create(
        config.getString("transpiler.name"),
        config.getString("transpiler.version"),
        Compiler.getReleaseVersion());
  }

  /** The comment that starts every output, without a line terminator. */
  public String getBanner() {
    return String.format(
        "// Compiled using %s %s (Compiler %s)", name(), version(), compilerVersion());
  }
}
