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
import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.google.javascript.gas.compiler.CompilerOptions;
import com.google.javascript.gas.compiler.CompilerOptions.LanguageMode;
import com.google.javascript.gas.compiler.CompilerOptions.ModuleKind;
import com.google.javascript.gas.compiler.CompilerOptions.NewLineKind;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The options a caller may pass to the transpiler: compiler options and module renames. Anything
 * else a caller supplies is ignored, and settings the transpiler requires override the caller's.
 *
 * <p>Options are built with {@link #builder()} or parsed from JSON that uses the TypeScript
 * spelling:
 *
 * <pre>{@code
 * {
 *   "compilerOptions": {"target": "ES3", "removeComments": true, "newLine": "crlf"},
 *   "renamedDependencies": {"lodash": "LodashGS"}
 * }
 * }</pre>
 */
@AutoValue
public abstract class TranspileOptions {
  private static final Logger logger = Logger.getLogger(TranspileOptions.class.getName());

  static final String COMPILER_OPTIONS = "compilerOptions";
  static final String RENAMED_DEPENDENCIES = "renamedDependencies";

  public abstract CompilerOptions compilerOptions();

  public abstract ImmutableMap<String, String> renamedDependencies();

  public static Builder builder() {
    return new AutoValue_TranspileOptions.Builder()
        .setCompilerOptions(CompilerOptions.empty())
        .setRenamedDependencies(ImmutableMap.of());
  }

  /** Options that override nothing. */
  public static TranspileOptions empty() {
    return builder().build();
  }

  /**
   * Parses options from a JSON object. Unknown keys are dropped.
   *
   * @throws IllegalArgumentException if the JSON is malformed, is not an object, or gives an
   *     option a value of the wrong kind
   */
  public static TranspileOptions fromJson(String json) {
    JsonElement element;
    try {
      element = JsonParser.parseString(json);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException("Malformed transpile options: " + e.getMessage(), e);
    }
    if (element.isJsonNull()) {
      return empty();
    }
    JsonObject object = asObject(element, "transpile options");
    Builder builder = builder();
    for (Map.Entry<String, JsonElement> entry : object.entrySet()) {
      String key = entry.getKey();
      JsonElement value = entry.getValue();
      if (value.isJsonNull()) {
        continue;
      }
      switch (key) {
        case COMPILER_OPTIONS:
          builder.setCompilerOptions(parseCompilerOptions(asObject(value, key)));
          break;
        case RENAMED_DEPENDENCIES:
          builder.setRenamedDependencies(parseRenamedDependencies(asObject(value, key)));
          break;
        default:
          logger.log(Level.FINE, "Dropping unrecognized transpile option ''{0}''", key);
          break;
      }
    }
    return builder.build();
  }

  private static CompilerOptions parseCompilerOptions(JsonObject object) {
    CompilerOptions.Builder options = CompilerOptions.builder();
    for (Map.Entry<String, JsonElement> entry : object.entrySet()) {
      String key = entry.getKey();
      JsonElement value = entry.getValue();
      if (value.isJsonNull()) {
        continue;
      }
      switch (key) {
        case "target":
          options.setTarget(LanguageMode.fromString(asString(value, key)));
          break;
        case "module":
          options.setModule(ModuleKind.fromString(asString(value, key)));
          break;
        case "isolatedModules":
          options.setIsolatedModules(asBoolean(value, key));
          break;
        case "noImplicitUseStrict":
          options.setNoImplicitUseStrict(asBoolean(value, key));
          break;
        case "experimentalDecorators":
          options.setExperimentalDecorators(asBoolean(value, key));
          break;
        case "removeComments":
          options.setRemoveComments(asBoolean(value, key));
          break;
        case "newLine":
          options.setNewLine(NewLineKind.fromString(asString(value, key)));
          break;
        default:
          logger.log(Level.FINE, "Dropping unrecognized compiler option ''{0}''", key);
          break;
      }
    }
    return options.build();
  }

  private static ImmutableMap<String, String> parseRenamedDependencies(JsonObject object) {
    ImmutableMap.Builder<String, String> renames = ImmutableMap.builder();
    for (Map.Entry<String, JsonElement> entry : object.entrySet()) {
      renames.put(entry.getKey(), asString(entry.getValue(), entry.getKey()));
    }
    return renames.buildOrThrow();
  }

  private static JsonObject asObject(JsonElement value, String key) {
    if (!value.isJsonObject()) {
      throw new IllegalArgumentException("Expected an object for " + key + ", found " + value);
    }
    return value.getAsJsonObject();
  }

  private static String asString(JsonElement value, String key) {
    JsonPrimitive primitive = value.isJsonPrimitive() ? value.getAsJsonPrimitive() : null;
    if (primitive == null || !primitive.isString()) {
      throw new IllegalArgumentException("Expected a string for " + key + ", found " + value);
    }
    return primitive.getAsString();
  }

  private static boolean asBoolean(JsonElement value, String key) {
    JsonPrimitive primitive = value.isJsonPrimitive() ? value.getAsJsonPrimitive() : null;
    if (primitive == null || !primitive.isBoolean()) {
      throw new IllegalArgumentException("Expected a boolean for " + key + ", found " + value);
    }
    return primitive.getAsBoolean();
  }

  /** Builder for {@link TranspileOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setCompilerOptions(CompilerOptions compilerOptions);

    public abstract Builder setRenamedDependencies(Map<String, String> renamedDependencies);

    public abstract TranspileOptions build();
  }
}
