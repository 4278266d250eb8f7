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

import com.google.errorprone.annotations.Immutable;
import java.text.MessageFormat;

/**
 * A kind of problem the compiler reports, identified by its key. The message is a {@link
 * MessageFormat} pattern filled in by {@link JSError#make}.
 */
@Immutable
public final class DiagnosticType {
  private final String key;
  private final CheckLevel level;
  private final String messagePattern;

  private DiagnosticType(String key, CheckLevel level, String messagePattern) {
    this.key = checkNotNull(key);
    this.level = checkNotNull(level);
    this.messagePattern = checkNotNull(messagePattern);
  }

  public static DiagnosticType error(String key, String messagePattern) {
    return new DiagnosticType(key, CheckLevel.ERROR, messagePattern);
  }

  public static DiagnosticType warning(String key, String messagePattern) {
    return new DiagnosticType(key, CheckLevel.WARNING, messagePattern);
  }

  /** The key printed with each error, e.g. {@code JSC_PARSE_ERROR}. */
  public String key() {
    return key;
  }

  /** The level errors of this type are reported at. */
  public CheckLevel level() {
    return level;
  }

  String formatMessage(String... arguments) {
    return new MessageFormat(messagePattern).format(arguments);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof DiagnosticType && ((DiagnosticType) other).key.equals(key);
  }

  @Override
  public int hashCode() {
    return key.hashCode();
  }

  @Override
  public String toString() {
    return key;
  }
}
