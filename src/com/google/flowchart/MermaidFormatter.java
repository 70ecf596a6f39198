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

import com.google.flowchart.graph.FlowEdge;
import com.google.flowchart.graph.FlowGraph;
import com.google.flowchart.graph.FlowNode;
import com.google.flowchart.graph.Shape;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * MermaidFormatter prints a {@link FlowGraph} as a Mermaid flowchart.
 *
 * <p>Typical usage of this class
 *
 * <pre>{@code
 * System.out.println(MermaidFormatter.toMermaid(graph));
 * }</pre>
 *
 * <p>Nodes are printed in creation order, then edges in insertion order, so the same graph always
 * yields the same text.
 */
public final class MermaidFormatter {
  static final String HEADER = "graph TD";
  private static final String INDENT = "    ";
  private static final String ARROW = " --> ";

  /** Id of the single node of the error diagram. */
  static final String ERROR_NODE_ID = "A";

  private MermaidFormatter() {}

  /**
   * Converts a flowchart to Mermaid markup.
   *
   * @param graph the populated flowchart
   * @return the Mermaid representation of the flowchart
   */
  public static String toMermaid(FlowGraph graph) {
    return toMermaid(graph.getNodes(), graph.getEdges());
  }

  /** Converts nodes and edges to Mermaid markup. Edges missing an endpoint are skipped. */
  public static String toMermaid(Iterable<FlowNode> nodes, Iterable<FlowEdge> edges) {
    StringBuilder builder = new StringBuilder();
    try {
      appendMermaid(nodes, edges, builder);
    } catch (IOException e) {
      // StringBuilder does not throw.
      throw new UncheckedIOException(e);
    }
    return builder.toString();
  }

  /**
   * Converts nodes and edges to Mermaid markup and appends it to the given buffer.
   *
   * @param builder A place to dump the graph.
   */
  public static void appendMermaid(
      Iterable<FlowNode> nodes, Iterable<FlowEdge> edges, Appendable builder) throws IOException {
    builder.append(HEADER).append('\n');
    for (FlowNode node : nodes) {
      appendNode(node.id(), node.label(), node.shape(), builder);
    }
    for (FlowEdge edge : edges) {
      if (!edge.isWellFormed()) {
        continue;
      }
      builder.append(INDENT).append(edge.source());
      if (edge.hasLabel()) {
        builder.append(" -->|").append(edge.label()).append("| ");
      } else {
        builder.append(ARROW);
      }
      builder.append(edge.target()).append('\n');
    }
  }

  /** Builds the one-node diagram shown instead of a flowchart when the build failed. */
  public static String errorDiagram(String message) {
    StringBuilder builder = new StringBuilder();
    builder.append(HEADER).append('\n');
    try {
      appendNode(ERROR_NODE_ID, "Error: " + message, Shape.PROCESS, builder);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return builder.toString();
  }

  private static void appendNode(String id, String label, Shape shape, Appendable builder)
      throws IOException {
    builder
        .append(INDENT)
        .append(id)
        .append(shape.getOpen())
        .append('"')
        .append(escapeLabel(label))
        .append('"')
        .append(shape.getClose())
        .append('\n');
  }

  /** Escapes a label so that it can sit inside double quotes. */
  static String escapeLabel(String label) {
    return label.replace("\"", "&quot;");
  }
}
