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

import static java.util.Objects.requireNonNull;

import com.google.flowchart.ast.Node;
import org.jspecify.annotations.Nullable;

/**
 * Description of a problem found while building a flowchart.
 *
 * @param type A type of the error.
 * @param description Description of the error.
 * @param sourceName Name of the source, when known.
 * @param lineno One-indexed line number of the error location, or -1.
 * @param node Node where the problem occurred.
 */
public record FlowchartError(
    DiagnosticType type,
    String description,
    @Nullable String sourceName,
    int lineno,
    @Nullable Node node) {
  public FlowchartError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
  }

  /**
   * Creates a FlowchartError with no source information
   *
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static FlowchartError make(DiagnosticType type, Object... arguments) {
    return new FlowchartError(type, type.format(arguments), null, -1, null);
  }

  /**
   * Creates a FlowchartError at a given node
   *
   * @param n Determines the line of the error
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static FlowchartError make(Node n, DiagnosticType type, Object... arguments) {
    return new FlowchartError(type, type.format(arguments), null, n.getLineno(), n);
  }

  /** Creates a FlowchartError for a named source, e.g. an input file that failed to parse. */
  public static FlowchartError make(
      String sourceName, int lineno, DiagnosticType type, Object... arguments) {
    return new FlowchartError(type, type.format(arguments), sourceName, lineno, null);
  }

  /** The level this error is reported at unless an option says otherwise. */
  public CheckLevel defaultLevel() {
    return type.defaultLevel();
  }

  /** Formats the error the way it is logged: {@code source:line: LEVEL - description}. */
  public String format(CheckLevel level) {
    StringBuilder sb = new StringBuilder();
    if (sourceName != null) {
      sb.append(sourceName);
      if (lineno > 0) {
        sb.append(':').append(lineno);
      }
      sb.append(": ");
    } else if (lineno > 0) {
      sb.append("line ").append(lineno).append(": ");
    }
    sb.append(level).append(" - [").append(type.key()).append("] ").append(description);
    return sb.toString();
  }

  @Override
  public String toString() {
    return type.key()
        + ". "
        + description
        + " at "
        + (sourceName == null ? "(unknown source)" : sourceName)
        + " line "
        + (lineno != -1 ? String.valueOf(lineno) : "(unknown line)");
  }
}
