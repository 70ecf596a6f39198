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

package com.google.flowchart.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** An AST construction helper class. */
public class IR {

  private IR() {}

  public static Node module(Node... stmts) {
    return module(ImmutableList.copyOf(stmts));
  }

  public static Node module(List<Node> stmts) {
    Node module = new Node(Token.MODULE);
    for (Node stmt : stmts) {
      checkState(stmt.isStatement(), "Module cannot contain %s", stmt.getToken());
      module.addChildToBack(stmt);
    }
    return module;
  }

  public static Node block(Node... stmts) {
    return block(ImmutableList.copyOf(stmts));
  }

  public static Node block(List<Node> stmts) {
    Node block = new Node(Token.BLOCK);
    for (Node stmt : stmts) {
      checkState(stmt.isStatement(), "Block cannot contain %s", stmt.getToken());
      block.addChildToBack(stmt);
    }
    return block;
  }

  public static Node function(String name, Node params, Node body) {
    checkState(params.isParamList());
    checkState(body.isBlock());
    Node function = Node.newString(Token.FUNCTION_DEF, name);
    function.addChildToBack(params);
    function.addChildToBack(body);
    return function;
  }

  public static Node paramList(String... names) {
    return paramList(ImmutableList.copyOf(names));
  }

  public static Node paramList(List<String> names) {
    Node params = new Node(Token.PARAM_LIST);
    for (String name : names) {
      params.addChildToBack(Node.newString(Token.PARAM, name));
    }
    return params;
  }

  public static Node assign(Node target, Node value) {
    return assign(ImmutableList.of(target), value);
  }

  /** Creates a chained assignment such as {@code a = b = value}. */
  public static Node assign(List<Node> targets, Node value) {
    checkArgument(!targets.isEmpty(), "Assignment needs a target");
    Node assign = new Node(Token.ASSIGN);
    for (Node target : targets) {
      checkState(mayBeTarget(target), target);
      assign.addChildToBack(target);
    }
    checkState(value.isExpression(), value);
    assign.addChildToBack(value);
    return assign;
  }

  public static Node augAssign(String operator, Node target, Node value) {
    checkState(mayBeTarget(target), target);
    checkState(value.isExpression(), value);
    Node assign = Node.newString(Token.AUG_ASSIGN, operator);
    assign.addChildToBack(target);
    assign.addChildToBack(value);
    return assign;
  }

  public static Node exprStmt(Node expr) {
    checkState(expr.isExpression(), expr);
    return new Node(Token.EXPR_STMT, expr);
  }

  public static Node returnNode() {
    return new Node(Token.RETURN);
  }

  public static Node returnNode(Node value) {
    checkState(value.isExpression(), value);
    return new Node(Token.RETURN, value);
  }

  public static Node ifNode(Node cond, Node then) {
    return ifNode(cond, then, block());
  }

  public static Node ifNode(Node cond, Node then, Node elseNode) {
    checkState(cond.isExpression(), cond);
    checkState(then.isBlock());
    checkState(elseNode.isBlock());
    return new Node(Token.IF, cond, then, elseNode);
  }

  public static Node forNode(Node target, Node iterable, Node body) {
    return forNode(target, iterable, body, block());
  }

  public static Node forNode(Node target, Node iterable, Node body, Node elseNode) {
    checkState(mayBeTarget(target), target);
    checkState(iterable.isExpression(), iterable);
    checkState(body.isBlock());
    checkState(elseNode.isBlock());
    return new Node(Token.FOR, target, iterable, body, elseNode);
  }

  public static Node whileNode(Node cond, Node body) {
    return whileNode(cond, body, block());
  }

  public static Node whileNode(Node cond, Node body, Node elseNode) {
    checkState(cond.isExpression(), cond);
    checkState(body.isBlock());
    checkState(elseNode.isBlock());
    return new Node(Token.WHILE, cond, body, elseNode);
  }

  public static Node breakNode() {
    return new Node(Token.BREAK);
  }

  public static Node continueNode() {
    return new Node(Token.CONTINUE);
  }

  public static Node pass() {
    return new Node(Token.PASS);
  }

  public static Node name(String name) {
    return Node.newString(Token.NAME, name);
  }

  public static Node number(long value) {
    return Node.newString(Token.NUMBER, Long.toString(value));
  }

  /** Creates a number literal from its source text, e.g. {@code "1.5"} or {@code "0x1f"}. */
  public static Node number(String text) {
    return Node.newString(Token.NUMBER, text);
  }

  public static Node string(String value) {
    return Node.newString(Token.STRING, value);
  }

  public static Node trueNode() {
    return Node.newString(Token.CONSTANT, "True");
  }

  public static Node falseNode() {
    return Node.newString(Token.CONSTANT, "False");
  }

  public static Node none() {
    return Node.newString(Token.CONSTANT, "None");
  }

  public static Node binaryOp(String operator, Node left, Node right) {
    checkState(left.isExpression(), left);
    checkState(right.isExpression(), right);
    Node op = Node.newString(Token.BINARY_OP, operator);
    op.addChildToBack(left);
    op.addChildToBack(right);
    return op;
  }

  public static Node add(Node left, Node right) {
    return binaryOp("+", left, right);
  }

  public static Node sub(Node left, Node right) {
    return binaryOp("-", left, right);
  }

  public static Node mul(Node left, Node right) {
    return binaryOp("*", left, right);
  }

  public static Node compare(String operator, Node left, Node right) {
    return compare(left, ImmutableList.of(operator), ImmutableList.of(right));
  }

  /** Creates a comparison chain such as {@code a < b <= c}. */
  public static Node compare(Node left, List<String> operators, List<Node> comparators) {
    checkArgument(!operators.isEmpty(), "Comparison needs an operator");
    checkArgument(
        operators.size() == comparators.size(),
        "%s operators for %s comparators",
        operators.size(),
        comparators.size());
    checkState(left.isExpression(), left);
    Node compare = new Node(Token.COMPARE, left);
    for (Node comparator : comparators) {
      checkState(comparator.isExpression(), comparator);
      compare.addChildToBack(comparator);
    }
    compare.putProp(Node.Prop.OPERATORS, ImmutableList.copyOf(operators));
    return compare;
  }

  public static Node eq(Node left, Node right) {
    return compare("==", left, right);
  }

  public static Node lt(Node left, Node right) {
    return compare("<", left, right);
  }

  public static Node gt(Node left, Node right) {
    return compare(">", left, right);
  }

  /** Creates an {@code and}/{@code or} over two or more operands. */
  public static Node boolOp(String operator, Node... values) {
    checkArgument(operator.equals("and") || operator.equals("or"), operator);
    checkArgument(values.length >= 2, "Boolean operator needs two operands");
    Node op = Node.newString(Token.BOOL_OP, operator);
    for (Node value : values) {
      checkState(value.isExpression(), value);
      op.addChildToBack(value);
    }
    return op;
  }

  public static Node unaryOp(String operator, Node operand) {
    checkState(operand.isExpression(), operand);
    Node op = Node.newString(Token.UNARY_OP, operator);
    op.addChildToBack(operand);
    return op;
  }

  public static Node not(Node operand) {
    return unaryOp("not", operand);
  }

  public static Node neg(Node operand) {
    return unaryOp("-", operand);
  }

  /** Creates a call; arguments are positional expressions followed by {@link #keyword}s. */
  public static Node call(Node callee, Node... args) {
    checkState(callee.isExpression(), callee);
    Node call = new Node(Token.CALL, callee);
    boolean seenKeyword = false;
    for (Node arg : args) {
      if (arg.getToken() == Token.KEYWORD) {
        seenKeyword = true;
      } else {
        checkState(arg.isExpression(), arg);
        checkState(!seenKeyword, "Positional argument %s follows keyword argument", arg);
      }
      call.addChildToBack(arg);
    }
    return call;
  }

  /** Creates a keyword argument. A null name stands for {@code **value}. */
  public static Node keyword(@Nullable String name, Node value) {
    checkState(value.isExpression(), value);
    Node keyword = Node.newString(Token.KEYWORD, name == null ? "" : name);
    keyword.addChildToBack(value);
    return keyword;
  }

  public static Node attribute(Node receiver, String attribute) {
    checkState(receiver.isExpression(), receiver);
    Node attr = Node.newString(Token.ATTRIBUTE, attribute);
    attr.addChildToBack(receiver);
    return attr;
  }

  public static Node subscript(Node receiver, Node index) {
    checkState(receiver.isExpression(), receiver);
    checkState(index.isExpression(), index);
    return new Node(Token.SUBSCRIPT, receiver, index);
  }

  public static Node list(Node... elements) {
    return sequence(Token.LIST, elements);
  }

  public static Node tuple(Node... elements) {
    return sequence(Token.TUPLE, elements);
  }

  private static Node sequence(Token token, Node... elements) {
    Node seq = new Node(token);
    for (Node element : elements) {
      checkState(element.isExpression(), element);
      seq.addChildToBack(element);
    }
    return seq;
  }

  /**
   * Creates a node for a construct outside the known vocabulary.
   *
   * @param kind the parser's name for the construct, e.g. {@code "With"}
   * @param children the nested nodes in source order
   */
  public static Node other(String kind, Node... children) {
    Node other = Node.newString(Token.OTHER, kind);
    for (Node child : children) {
      other.addChildToBack(child);
    }
    return other;
  }

  private static boolean mayBeTarget(Node n) {
    switch (n.getToken()) {
      case NAME:
      case ATTRIBUTE:
      case SUBSCRIPT:
      case LIST:
      case TUPLE:
      case OTHER:
        return true;
      default:
        return false;
    }
  }
}
