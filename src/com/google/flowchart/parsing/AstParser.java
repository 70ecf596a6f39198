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

import com.google.flowchart.ast.Node;

/**
 * Turns program input into a syntax tree whose root is a {@link
 * com.google.flowchart.ast.Token#MODULE} node.
 */
public interface AstParser {

  /**
   * Parses one input.
   *
   * @param sourceName name of the input, used in error messages
   * @param input the text to parse
   * @return the module node
   * @throws AstParseException if the input cannot be turned into a tree
   */
  Node parse(String sourceName, String input) throws AstParseException;
}
