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

import java.text.MessageFormat;

/**
 * A kind of problem that building a flowchart can run into.
 *
 * @param key Identifier shown in reports, e.g. {@code FLOWCHART_PARSE_ERROR}.
 * @param pattern {@link MessageFormat} pattern for the description. Avoid apostrophes, which
 *     MessageFormat treats as quotes.
 * @param defaultLevel Level used unless an option overrides it.
 */
public record DiagnosticType(String key, String pattern, CheckLevel defaultLevel) {
  public DiagnosticType {
    requireNonNull(key, "key");
    requireNonNull(pattern, "pattern");
    requireNonNull(defaultLevel, "defaultLevel");
  }

  public static DiagnosticType error(String key, String pattern) {
    return new DiagnosticType(key, pattern, CheckLevel.ERROR);
  }

  public static DiagnosticType warning(String key, String pattern) {
    return new DiagnosticType(key, pattern, CheckLevel.WARNING);
  }

  String format(Object... arguments) {
    return MessageFormat.format(pattern, arguments);
  }

  @Override
  public String toString() {
    return key;
  }
}
