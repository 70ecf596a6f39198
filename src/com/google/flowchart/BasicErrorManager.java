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

package com.google.flowchart;

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * An error manager that keeps every distinct error and warning in the order it was reported.
 *
 * <p>This error manager does not produce any output, but subclasses override the {@link
 * #println(CheckLevel, FlowchartError)} method to generate custom output.
 */
public abstract class BasicErrorManager implements ErrorManager {

  private final Set<ErrorWithLevel> messages = new LinkedHashSet<>();
  private int errorCount = 0;
  private int warningCount = 0;

  @Override
  public void report(CheckLevel level, FlowchartError error) {
    if (messages.add(new ErrorWithLevel(error, level))) {
      if (level == CheckLevel.ERROR) {
        errorCount++;
      } else if (level == CheckLevel.WARNING) {
        warningCount++;
      }
    }
  }

  @Override
  public void generateReport() {
    for (ErrorWithLevel message : messages) {
      println(message.level, message.error);
    }
    printSummary();
  }

  /**
   * Print a message with a trailing new line. This method is called by the {@link
   * #generateReport()} method when generating messages.
   */
  public abstract void println(CheckLevel level, FlowchartError error);

  /** Print the summary of the build: number of errors and warnings. */
  protected abstract void printSummary();

  @Override
  public int getErrorCount() {
    return errorCount;
  }

  @Override
  public int getWarningCount() {
    return warningCount;
  }

  @Override
  public ImmutableList<FlowchartError> getErrors() {
    return toList(CheckLevel.ERROR);
  }

  @Override
  public ImmutableList<FlowchartError> getWarnings() {
    return toList(CheckLevel.WARNING);
  }

  private ImmutableList<FlowchartError> toList(CheckLevel level) {
    ImmutableList.Builder<FlowchartError> errors = ImmutableList.builder();
    for (ErrorWithLevel p : messages) {
      if (p.level == level) {
        errors.add(p.error);
      }
    }
    return errors.build();
  }

  /** A reported error together with the level it was reported at. */
  static final class ErrorWithLevel {
    final FlowchartError error;
    final CheckLevel level;

    ErrorWithLevel(FlowchartError error, CheckLevel level) {
      this.error = error;
      this.level = level;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof ErrorWithLevel)) {
        return false;
      }
      ErrorWithLevel that = (ErrorWithLevel) o;
      return level == that.level && error.equals(that.error);
    }

    @Override
    public int hashCode() {
      return Objects.hash(error, level);
    }
  }
}
