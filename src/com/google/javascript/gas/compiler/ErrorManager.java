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

/**
 * The error manager is in charge of storing, organizing and displaying errors and warnings
 * reported while compiling one source.
 */
public interface ErrorManager {

  /**
   * Reports an error. The errors will be displayed by the {@link #generateReport()} at the
   * discretion of the implementation.
   *
   * @param level the reporting level
   * @param error the error to report
   */
  void report(CheckLevel level, JSError error);

  /**
   * Writes a report to an implementation-specific medium. The compiler calls this method after any
   * and all errors have been reported.
   */
  void generateReport();

  /** Gets the number of errors. */
  int getErrorCount();

  /** Gets the number of warnings. */
  int getWarningCount();

  /** Gets all the errors, in the order they were reported. */
  ImmutableList<JSError> getErrors();

  /** Gets all the warnings, in the order they were reported. */
  ImmutableList<JSError> getWarnings();

  /** Whether any reported error should stop the compilation. */
  default boolean hasHaltingErrors() {
    return getErrorCount() > 0;
  }
}
