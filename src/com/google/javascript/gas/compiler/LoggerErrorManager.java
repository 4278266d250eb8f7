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

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Collects diagnostics and, when the compiler asks for a report, logs errors at {@code SEVERE}
 * and warnings at {@code WARNING}.
 */
public class LoggerErrorManager extends BasicErrorManager {
  private final Logger logger;

  public LoggerErrorManager(Logger logger) {
    this.logger = checkNotNull(logger);
  }

  @Override
  public void println(CheckLevel level, JSError error) {
    if (level.isOn()) {
      logger.log(level == CheckLevel.ERROR ? Level.SEVERE : Level.WARNING, error.format(level));
    }
  }

  @Override
  protected void printSummary() {
    int errors = getErrorCount();
    int warnings = getWarningCount();
    logger.log(
        errors + warnings == 0 ? Level.FINE : Level.WARNING,
        "{0} error(s), {1} warning(s)",
        new Object[] {errors, warnings});
  }
}
