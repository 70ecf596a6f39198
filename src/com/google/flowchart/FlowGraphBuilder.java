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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.flowchart.FunctionTable.FunctionRecord;
import com.google.flowchart.ast.Node;
import com.google.flowchart.ast.Token;
import com.google.flowchart.graph.FlowEdge;
import com.google.flowchart.graph.FlowGraph;
import com.google.flowchart.graph.Shape;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * Builds a {@link FlowGraph} from statements by a single recursive walk.
 *
 * <p>Every visit is given the id of the node the statement follows and answers the id that the
 * next statement should follow, or {@link Optional#empty()} once the path has ended (after a
 * {@code return}, {@code break} or {@code continue}). Statements after the end of a path are not
 * drawn.
 *
 * <p>Calls to functions from the {@link FunctionTable} are inlined: a call-site node is drawn and
 * the callee's body continues from it. Control simply falls through to whatever follows the
 * call; there is no call/return modelling, and parameters are not bound to arguments.
 *
 * <p>An instance owns its graph and may only be used for one build.
 */
public final class FlowGraphBuilder {

  static final DiagnosticType RECURSIVE_INLINING =
      DiagnosticType.error(
          "FLOWCHART_RECURSIVE_INLINING", "Cannot inline recursive call to {0} (call path: {1})");

  static final DiagnosticType INLINE_DEPTH_EXCEEDED =
      DiagnosticType.error(
          "FLOWCHART_INLINE_DEPTH_EXCEEDED",
          "Inlining {0} exceeds the maximum inline depth of {1} (call path: {2})");

  static final DiagnosticType ORPHAN_BREAK =
      DiagnosticType.warning("FLOWCHART_ORPHAN_BREAK", "break outside of a loop is ignored");

  static final DiagnosticType ORPHAN_CONTINUE =
      DiagnosticType.warning("FLOWCHART_ORPHAN_CONTINUE", "continue outside of a loop is ignored");

  static final String MERGE_LABEL = " ";

  /**
   * The innermost loop enclosing a statement.
   *
   * @param headerId Target of {@code continue}.
   * @param exitId Target of {@code break}.
   */
  public record LoopContext(String headerId, String exitId) {
    public LoopContext {
      checkNotNull(headerId, "headerId");
      checkNotNull(exitId, "exitId");
    }
  }

  private final FlowGraph graph = new FlowGraph();
  private final FunctionTable functions;
  private final FlowchartOptions options;
  private final ErrorManager errorManager;

  // Names of the functions currently being inlined, outermost first.
  private final Deque<String> inlineStack = new ArrayDeque<>();

  public FlowGraphBuilder(
      FunctionTable functions, FlowchartOptions options, ErrorManager errorManager) {
    this.functions = checkNotNull(functions);
    this.options = checkNotNull(options);
    this.errorManager = checkNotNull(errorManager);
  }

  public FlowGraph getGraph() {
    return graph;
  }

  /** Adds a Start or End marker. */
  public String addSentinel(String label) {
    return graph.createNode(label, Shape.SENTINEL).id();
  }

  public void connect(String source, String target) {
    graph.connect(source, target);
  }

  /**
   * Draws the first function of a program that has no other top-level statements: a subroutine
   * node naming the function, followed by its inlined body.
   */
  public Optional<String> visitEntryFunction(FunctionRecord function, String predecessor) {
    String entry = addNode("def " + function.name() + "(...)", Shape.SUBROUTINE, predecessor);
    return inline(function, function.definition(), entry, null);
  }

  /**
   * Visits statements in order, chaining each from the previous one. Stops at the first
   * statement that ends the path.
   */
  public Optional<String> visitSequence(
      Iterable<Node> statements, String predecessor, @Nullable LoopContext loop) {
    Optional<String> current = Optional.of(predecessor);
    for (Node statement : statements) {
      if (current.isEmpty()) {
        break;
      }
      current = visit(statement, current.get(), loop);
    }
    return current;
  }

  /**
   * Visits one node.
   *
   * @param n the node to draw
   * @param predecessor id of the node that control comes from
   * @param loop the innermost enclosing loop, or null outside of loops
   * @return the id that following statements chain from, or empty when the path has ended
   */
  public Optional<String> visit(Node n, String predecessor, @Nullable LoopContext loop) {
    switch (n.getToken()) {
      case ASSIGN, AUG_ASSIGN -> {
        return Optional.of(addNode(CodePrinter.print(n), Shape.PROCESS, predecessor));
      }
      case EXPR_STMT -> {
        return visitExpressionStatement(n, predecessor, loop);
      }
      case RETURN -> {
        addNode(CodePrinter.print(n), Shape.TERMINATOR, predecessor);
        return Optional.empty();
      }
      case IF -> {
        return visitIf(n, predecessor, loop);
      }
      case FOR, WHILE -> {
        return visitLoop(n, predecessor);
      }
      case BREAK -> {
        if (loop != null) {
          graph.connect(predecessor, loop.exitId(), FlowEdge.BREAK);
        } else {
          reportOrphanJump(n, ORPHAN_BREAK);
        }
        return Optional.empty();
      }
      case CONTINUE -> {
        if (loop != null) {
          graph.connect(predecessor, loop.headerId(), FlowEdge.CONTINUE);
        } else {
          reportOrphanJump(n, ORPHAN_CONTINUE);
        }
        return Optional.empty();
      }
      default -> {
        // Anything else is drawn through whatever it contains.
        return visitSequence(n.children(), predecessor, loop);
      }
    }
  }

  private Optional<String> visitExpressionStatement(
      Node n, String predecessor, @Nullable LoopContext loop) {
    Node expr = n.getFirstChild();
    String label = CodePrinter.print(n);
    Shape shape = Shape.PROCESS;
    if (expr != null && expr.isCall() && expr.getFirstChild().isName()) {
      String callee = expr.getFirstChild().getString();
      if (options.isIoFunction(callee)) {
        shape = Shape.INPUT_OUTPUT;
      } else if (functions.contains(callee)) {
        String callSite = addNode(label, Shape.PROCESS, predecessor);
        return inline(functions.get(callee), n, callSite, loop);
      }
    }
    return Optional.of(addNode(label, shape, predecessor));
  }

  private Optional<String> inline(
      FunctionRecord function, Node site, String predecessor, @Nullable LoopContext loop) {
    String name = function.name();
    if (inlineStack.contains(name)) {
      throw new FlowchartException(
          FlowchartError.make(site, RECURSIVE_INLINING, name, callPath(name)));
    }
    if (inlineStack.size() >= options.getMaxInlineDepth()) {
      throw new FlowchartException(
          FlowchartError.make(
              site,
              INLINE_DEPTH_EXCEEDED,
              name,
              String.valueOf(options.getMaxInlineDepth()),
              callPath(name)));
    }
    inlineStack.addLast(name);
    try {
      return visitSequence(function.body(), predecessor, loop);
    } finally {
      inlineStack.removeLast();
    }
  }

  private String callPath(String next) {
    return Joiner.on(" -> ")
        .join(ImmutableList.<String>builder().addAll(inlineStack).add(next).build());
  }

  private Optional<String> visitIf(Node n, String predecessor, @Nullable LoopContext loop) {
    Node test = n.getFirstChild();
    Node thenBlock = n.getSecondChild();
    Node elseBlock = n.getChildAtIndex(2);

    String cond = addNode("if " + CodePrinter.print(test), Shape.DECISION, predecessor);
    Optional<String> trueEnd = visitBranch(thenBlock, cond, loop);
    Optional<String> falseEnd = visitBranch(elseBlock, cond, loop);

    if (trueEnd.isEmpty() && falseEnd.isEmpty()) {
      return Optional.empty();
    }

    // An empty branch ends at the decision itself, which then links straight to the merge.
    String merge = graph.createNode(MERGE_LABEL, Shape.JOINER).id();
    if (trueEnd.isPresent()) {
      graph.connect(trueEnd.get(), merge, FlowEdge.YES);
    }
    if (falseEnd.isPresent()) {
      graph.connect(falseEnd.get(), merge, FlowEdge.NO);
    }
    return Optional.of(merge);
  }

  private Optional<String> visitBranch(
      @Nullable Node block, String predecessor, @Nullable LoopContext loop) {
    if (block == null) {
      return Optional.of(predecessor);
    }
    return visitSequence(block.children(), predecessor, loop);
  }

  private Optional<String> visitLoop(Node n, String predecessor) {
    String label;
    Node body;
    if (n.getToken() == Token.FOR) {
      label = "For " + CodePrinter.printTarget(n.getFirstChild());
      body = n.getChildAtIndex(2);
    } else {
      label = "While " + CodePrinter.print(n.getFirstChild());
      body = n.getSecondChild();
    }

    String header = addNode(label, Shape.LOOP_HEADER, predecessor);
    // The exit exists before the body so that break statements inside it can target it.
    String exit = graph.createNode(MERGE_LABEL, Shape.JOINER).id();

    Optional<String> bodyEnd = visitBranch(body, header, new LoopContext(header, exit));
    if (bodyEnd.isPresent()) {
      graph.connect(bodyEnd.get(), header, FlowEdge.LOOP);
    }
    // Always present, even when the body can never fall out of the loop.
    graph.connect(header, exit, FlowEdge.END_LOOP);
    return Optional.of(exit);
  }

  private void reportOrphanJump(Node n, DiagnosticType type) {
    CheckLevel level = options.getOrphanJumpLevel();
    switch (level) {
      case ERROR -> throw new FlowchartException(FlowchartError.make(n, type));
      case WARNING -> errorManager.report(level, FlowchartError.make(n, type));
      case OFF -> {}
    }
  }

  private String addNode(String label, Shape shape, String predecessor) {
    String id = graph.createNode(label, shape).id();
    graph.connect(predecessor, id);
    return id;
  }
}
