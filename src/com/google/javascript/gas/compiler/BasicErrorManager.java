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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * Keeps errors and warnings in report order. Subclasses decide where {@link #generateReport()}
 * writes them.
 */
public abstract class BasicErrorManager implements ErrorManager {
  private final List<JSError> errors = new ArrayList<>();
  private final List<JSError> warnings = new ArrayList<>();

  @Override
  public void report(CheckLevel level, JSError error) {
    switch (level) {
      case ERROR -> errors.add(error);
      case WARNING -> warnings.add(error);
      case OFF -> {}
    }
  }

  @Override
  public void generateReport() {
    for (JSError error : errors) {
      println(CheckLevel.ERROR, error);
    }
    for (JSError warning : warnings) {
      println(CheckLevel.WARNING, warning);
    }
    printSummary();
  }

  @Override
  public int getErrorCount() {
    return errors.size();
  }

  @Override
  public int getWarningCount() {
    return warnings.size();
  }

  @Override
  public ImmutableList<JSError> getErrors() {
    return ImmutableList.copyOf(errors);
  }

  @Override
  public ImmutableList<JSError> getWarnings() {
    return ImmutableList.copyOf(warnings);
  }

  /** Writes one diagnostic of the report. */
  public abstract void println(CheckLevel level, JSError error);

  /** Writes the counts that end the report. */
  protected abstract void printSummary();
}
