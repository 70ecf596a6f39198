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

package com.google.flowchart.graph;

/**
 * The visual category of a flowchart node, encoded as the pair of delimiters that wrap its label
 * in the diagram markup.
 */
public enum Shape {
  /** A plain step. */
  PROCESS("[", "]"),
  /** Reading input or printing output. */
  INPUT_OUTPUT("[/", "/]"),
  /** A two-way branch on a condition. */
  DECISION("{", "}"),
  /** The head of a {@code for} or {@code while} loop. */
  LOOP_HEADER("{{", "}}"),
  /** A statement that leaves the current path, such as {@code return}. */
  TERMINATOR("(", ")"),
  /** The entry of a function used as the program's starting point. */
  SUBROUTINE("[[", "]]"),
  /** A synthetic point where branches meet again, or where a loop exits. */
  JOINER("((", "))"),
  /** The Start and End markers present in every chart. */
  SENTINEL("((", "))");

  private final String open;
  private final String close;

  Shape(String open, String close) {
    this.open = open;
    this.close = close;
  }

  public String getOpen() {
    return open;
  }

  public String getClose() {
    return close;
  }
}
