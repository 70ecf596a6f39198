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

package com.google.flowchart.parsing;

import org.jspecify.annotations.Nullable;

/** Thrown when an input cannot be turned into a syntax tree. */
public class AstParseException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String sourceName;
  private final int lineno;

  public AstParseException(String sourceName, int lineno, String message) {
    this(sourceName, lineno, message, null);
  }

  public AstParseException(
      String sourceName, int lineno, String message, @Nullable Throwable cause) {
    super(message, cause);
    this.sourceName = sourceName;
    this.lineno = lineno;
  }

  public String getSourceName() {
    return sourceName;
  }

  /** One-based line of the problem, or -1 when unknown. */
  public int getLineno() {
    return lineno;
  }
}
