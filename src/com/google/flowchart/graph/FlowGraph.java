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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * The flowchart under construction: nodes in creation order plus edges in insertion order.
 *
 * <p>Node ids are {@code N0}, {@code N1}, ... and are never reused or renumbered. Edges may only
 * connect nodes that already exist.
 *
 * <p>This class is <b>not</b> thread safe. A graph is owned by the single build that fills it.
 */
public final class FlowGraph {
  private static final String ID_PREFIX = "N";

  private final Map<String, FlowNode> nodes = new LinkedHashMap<>();
  private final List<FlowEdge> edges = new ArrayList<>();

  // key count in order to assign a unique id to each node
  private int idCount = 0;

  /** Creates a node with the next free id. */
  @CanIgnoreReturnValue
  public FlowNode createNode(String label, Shape shape) {
    FlowNode node = new FlowNode(ID_PREFIX + idCount++, label, shape);
    nodes.put(node.id(), node);
    return node;
  }

  @CanIgnoreReturnValue
  public FlowEdge connect(String source, String target) {
    return connect(source, target, "");
  }

  @CanIgnoreReturnValue
  public FlowEdge connect(String source, String target, String label) {
    checkArgument(hasNode(source), "Unknown edge source %s", source);
    checkArgument(hasNode(target), "Unknown edge target %s", target);
    FlowEdge edge = new FlowEdge(source, target, checkNotNull(label));
    edges.add(edge);
    return edge;
  }

  public boolean hasNode(@Nullable String id) {
    return id != null && nodes.containsKey(id);
  }

  public @Nullable FlowNode getNode(String id) {
    return nodes.get(id);
  }

  public ImmutableList<FlowNode> getNodes() {
    return ImmutableList.copyOf(nodes.values());
  }

  public ImmutableList<FlowEdge> getEdges() {
    return ImmutableList.copyOf(edges);
  }

  public int getNodeCount() {
    return nodes.size();
  }

  public int getEdgeCount() {
    return edges.size();
  }

  @Override
  public String toString() {
    StringBuilder s = new StringBuilder("FlowGraph:\n");
    for (FlowNode node : nodes.values()) {
      s.append(node).append('\n');
    }
    for (FlowEdge edge : edges) {
      s.append(edge).append('\n');
    }
    return s.toString();
  }
}
