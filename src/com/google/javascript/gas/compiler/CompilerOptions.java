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
import org.jspecify.annotations.Nullable;

/**
 * Compiler options.
 *
 * <p>Every option is nullable: an unset option takes the compiler's default when the options are
 * used, and is left alone when several layers of options are merged. The {@code get*} accessors
 * return the effective value.
 */
@AutoValue
public abstract class CompilerOptions {

  /** Default for {@link #isolatedModules()}. */
  static final boolean DEFAULT_ISOLATED_MODULES = false;

  /** When set, the output uses this language version. */
  public abstract @Nullable LanguageMode target();

  /** How module syntax is emitted. */
  public abstract @Nullable ModuleKind module();

  /**
   * Whether each file is compiled on its own. A {@code const enum} can only be inlined when this is
   * false.
   */
  public abstract @Nullable Boolean isolatedModules();

  /** Whether a module is emitted without a {@code "use strict"} prologue. */
  public abstract @Nullable Boolean noImplicitUseStrict();

  /**
   * Whether decorators on classes, class members and constructor or method parameters are lowered
   * to calls of {@code __decorate}. When false, a decorator is an error.
   */
  public abstract @Nullable Boolean experimentalDecorators();

  /** Whether source comments are dropped from the output. */
  public abstract @Nullable Boolean removeComments();

  /** Line terminator of the output. */
  public abstract @Nullable NewLineKind newLine();

  public abstract Builder toBuilder();

  public static Builder builder() {
    return new AutoValue_CompilerOptions.Builder();
  }

  /** Returns options with nothing set. */
  public static CompilerOptions empty() {
    return builder().build();
  }

  public LanguageMode getLanguageOut() {
    LanguageMode target = target();
    return target != null ? target : LanguageMode.ECMASCRIPT3;
  }

  public ModuleKind getModuleKind() {
    ModuleKind module = module();
    return module != null ? module : ModuleKind.NONE;
  }

  public boolean isIsolatedModules() {
    Boolean isolatedModules = isolatedModules();
    return isolatedModules != null ? isolatedModules : DEFAULT_ISOLATED_MODULES;
  }

  public boolean shouldEmitUseStrict() {
    Boolean noImplicitUseStrict = noImplicitUseStrict();
    return noImplicitUseStrict == null || !noImplicitUseStrict;
  }

  public boolean isExperimentalDecoratorsEnabled() {
    Boolean experimentalDecorators = experimentalDecorators();
    return experimentalDecorators != null && experimentalDecorators;
  }

  public boolean shouldPreserveComments() {
    Boolean removeComments = removeComments();
    return removeComments == null || !removeComments;
  }

  public NewLineKind getNewLine() {
    NewLineKind newLine = newLine();
    return newLine != null ? newLine : NewLineKind.LF;
  }

  /** Builder for {@link CompilerOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setTarget(@Nullable LanguageMode target);

    public abstract Builder setModule(@Nullable ModuleKind module);

    public abstract Builder setIsolatedModules(@Nullable Boolean isolatedModules);

    public abstract Builder setNoImplicitUseStrict(@Nullable Boolean noImplicitUseStrict);

    public abstract Builder setExperimentalDecorators(@Nullable Boolean experimentalDecorators);

    public abstract Builder setRemoveComments(@Nullable Boolean removeComments);

    public abstract Builder setNewLine(@Nullable NewLineKind newLine);

    public abstract CompilerOptions build();
  }

  /** The language versions the printer can write. */
  public enum LanguageMode {
    ECMASCRIPT3("ES3"),
    ECMASCRIPT5("ES5");

    private final String name;

    LanguageMode(String name) {
      this.name = name;
    }

    /** Whether property names that are keywords must be quoted, e.g. {@code exports["default"]}. */
    public boolean quotesKeywordProperties() {
      return this == ECMASCRIPT3;
    }

    /** Returns the TypeScript spelling of this target, e.g. {@code ES3}. */
    public String getName() {
      return name;
    }

    /** Looks up a target by its TypeScript spelling, ignoring case. */
    public static LanguageMode fromString(String value) {
      for (LanguageMode mode : values()) {
        if (mode.name.equalsIgnoreCase(value) || mode.name().equalsIgnoreCase(value)) {
          return mode;
        }
      }
      throw new IllegalArgumentException("Unknown target: " + value);
    }
  }

  /** How import and export declarations are emitted. */
  public enum ModuleKind {
    /** Modules are lowered to {@code require} calls and assignments to {@code exports}. */
    NONE("None"),
    /** Module syntax is printed unchanged. */
    ES2015("ES2015");

    private final String name;

    ModuleKind(String name) {
      this.name = name;
    }

    public String getName() {
      return name;
    }

    public static ModuleKind fromString(String value) {
      for (ModuleKind kind : values()) {
        if (kind.name.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
          return kind;
        }
      }
      throw new IllegalArgumentException("Unknown module kind: " + value);
    }
  }

  /** Line terminators. */
  public enum NewLineKind {
    LF("lf", "\n"),
    CRLF("crlf", "\r\n");

    private final String name;
    private final String terminator;

    NewLineKind(String name, String terminator) {
      this.name = name;
      this.terminator = terminator;
    }

    public String getName() {
      return name;
    }

    public String getTerminator() {
      return terminator;
    }

    public static NewLineKind fromString(String value) {
      for (NewLineKind kind : values()) {
        if (kind.name.equalsIgnoreCase(value)) {
          return kind;
        }
      }
      throw new IllegalArgumentException("Unknown newLine: " + value);
    }
  }
}
