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
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.flowchart.FunctionTable.FunctionRecord;
import com.google.flowchart.ast.Node;
import com.google.flowchart.graph.FlowGraph;
import com.google.flowchart.parsing.AstParseException;
import com.google.flowchart.parsing.AstParser;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns a program into a Mermaid flowchart.
 *
 * <p>A build indexes the function definitions, draws a Start marker, walks the remaining
 * top-level statements (or, when there are none, the first defined function) and finishes with an
 * End marker. The {@code generate} methods never throw: any failure yields a one-node error
 * diagram and is reported to the {@link ErrorManager}. Callers decide when to call {@link
 * ErrorManager#generateReport()}.
 */
public class FlowchartGenerator {

  private static final Logger logger = Logger.getLogger(FlowchartGenerator.class.getName());

  static final DiagnosticType PARSE_ERROR =
      DiagnosticType.error("FLOWCHART_PARSE_ERROR", "Could not parse code: {0}");

  static final DiagnosticType INTERNAL_ERROR =
      DiagnosticType.error("FLOWCHART_INTERNAL_ERROR", "Internal error: {0}");

  static final String TOO_DEEP_MESSAGE = "program is nested too deeply to draw";

  static final String START_LABEL = "Start";
  static final String END_LABEL = "End";

  private final FlowchartOptions options;
  private final ErrorManager errorManager;

  public FlowchartGenerator(FlowchartOptions options, ErrorManager errorManager) {
    this.options = checkNotNull(options);
    this.errorManager = checkNotNull(errorManager);
  }

  /**
   * Builds the flowchart of a module.
   *
   * @throws FlowchartException if the program cannot be drawn, e.g. a function inlines itself
   */
  public FlowGraph buildGraph(Node module) {
    checkArgument(module.isModule(), "Expected a module, found %s", module);
    FunctionTable functions = FunctionTable.index(module);
    FlowGraphBuilder builder = new FlowGraphBuilder(functions, options, errorManager);

    ImmutableList.Builder<Node> mainBody = ImmutableList.builder();
    for (Node statement : module.children()) {
      if (!statement.isFunctionDef()) {
        mainBody.add(statement);
      }
    }
    ImmutableList<Node> statements = mainBody.build();

    String start = builder.addSentinel(START_LABEL);
    Optional<String> last;
    if (!statements.isEmpty()) {
      last = builder.visitSequence(statements, start, null);
    } else {
      Optional<FunctionRecord> entry = functions.first();
      last =
          entry.isPresent()
              ? builder.visitEntryFunction(entry.get(), start)
              : Optional.of(start);
    }
    String end = builder.addSentinel(END_LABEL);
    if (last.isPresent()) {
      builder.connect(last.get(), end);
    }

    FlowGraph graph = builder.getGraph();
    logger.log(
        Level.FINE,
        "Built flowchart with {0} node(s) and {1} edge(s) from {2} function(s)",
        new Object[] {graph.getNodeCount(), graph.getEdgeCount(), functions.size()});
    return graph;
  }

  /** Draws a module as Mermaid markup, or the error diagram if that fails. */
  public String generate(Node module) {
    try {
      return MermaidFormatter.toMermaid(buildGraph(module));
    } catch (FlowchartException e) {
      return fail(e.getError(), e);
    } catch (RuntimeException e) {
      return fail(FlowchartError.make(INTERNAL_ERROR, String.valueOf(e.getMessage())), e);
    } catch (StackOverflowError e) {
      return fail(FlowchartError.make(INTERNAL_ERROR, TOO_DEEP_MESSAGE), e);
    }
  }

  /**
   * Parses the input and draws it as Mermaid markup. Parse failures produce the error diagram.
   *
   * @param sourceName name of the input, used in diagnostics
   */
  public String generate(String sourceName, String input, AstParser parser) {
    Node module;
    try {
      module = parser.parse(sourceName, input);
    } catch (AstParseException e) {
      return fail(
          FlowchartError.make(e.getSourceName(), e.getLineno(), PARSE_ERROR, e.getMessage()), e);
    } catch (RuntimeException e) {
      return fail(
          FlowchartError.make(sourceName, -1, INTERNAL_ERROR, String.valueOf(e.getMessage())), e);
    } catch (StackOverflowError e) {
      return fail(FlowchartError.make(sourceName, -1, INTERNAL_ERROR, TOO_DEEP_MESSAGE), e);
    }
    return generate(module);
  }

  private String fail(FlowchartError error, Throwable cause) {
    logger.log(Level.WARNING, "Flowchart generation failed: " + error.description(), cause);
    errorManager.report(CheckLevel.ERROR, error);
    return MermaidFormatter.errorDiagram(error.description());
  }
}
