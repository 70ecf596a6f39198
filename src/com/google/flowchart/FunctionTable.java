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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.flowchart.ast.Node;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * Indexes the top-level function definitions of a module by name, so that calls can be inlined no
 * matter whether the function is defined before or after the call.
 *
 * <p>When a name is defined more than once, the last definition wins but the name keeps the
 * position of its first definition.
 */
public final class FunctionTable {

  /**
   * A function definition.
   *
   * @param name Name of the function.
   * @param body Statements of the function body, in order.
   * @param parameterNames Formal parameter names. Inlining does not bind them.
   * @param definition The defining node.
   */
  public record FunctionRecord(
      String name,
      ImmutableList<Node> body,
      ImmutableList<String> parameterNames,
      Node definition) {
    public FunctionRecord {
      requireNonNull(name, "name");
      requireNonNull(body, "body");
      requireNonNull(parameterNames, "parameterNames");
      requireNonNull(definition, "definition");
    }

    static FunctionRecord of(Node function) {
      checkArgument(function.isFunctionDef(), function);
      Node params = function.getFirstChild();
      Node body = function.getSecondChild();
      ImmutableList.Builder<String> names = ImmutableList.builder();
      if (params != null) {
        for (Node param : params.children()) {
          names.add(param.getString());
        }
      }
      return new FunctionRecord(
          function.getString(),
          body == null ? ImmutableList.of() : body.childList(),
          names.build(),
          function);
    }
  }

  private final ImmutableMap<String, FunctionRecord> functions;

  private FunctionTable(ImmutableMap<String, FunctionRecord> functions) {
    this.functions = functions;
  }

  /** Builds the table from a module's top-level statements. */
  public static FunctionTable index(Node module) {
    checkArgument(module.isModule(), "Expected a module, found %s", module);
    return index(module.children());
  }

  /** Builds the table from a sequence of top-level statements. Other statements are ignored. */
  public static FunctionTable index(Iterable<Node> statements) {
    Map<String, FunctionRecord> functions = new LinkedHashMap<>();
    for (Node statement : statements) {
      if (statement.isFunctionDef()) {
        // Re-putting an existing key keeps its original position.
        functions.put(statement.getString(), FunctionRecord.of(statement));
      }
    }
    return new FunctionTable(ImmutableMap.copyOf(functions));
  }

  public boolean contains(String name) {
    return functions.containsKey(name);
  }

  public @Nullable FunctionRecord get(String name) {
    return functions.get(name);
  }

  /** Gets the function that was defined first in source order. */
  public Optional<FunctionRecord> first() {
    return functions.values().stream().findFirst();
  }

  public int size() {
    return functions.size();
  }
}
