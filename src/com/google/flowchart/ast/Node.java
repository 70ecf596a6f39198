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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.NoSuchElementException;
import org.jspecify.annotations.Nullable;

/**
 * A node in the syntax tree.
 *
 * <p>Children are kept as a singly linked sibling list. The first child's {@code previous} pointer
 * refers to the last child, so appending is constant time.
 */
public class Node {

  /** Optional properties that only some kinds of node carry. */
  public enum Prop {
    /** {@code ImmutableList<String>} of comparison operators on a {@link Token#COMPARE}. */
    OPERATORS,
    /** The original source text of the node, when the parser supplied it. */
    SOURCE
  }

  private final Token token;
  private final @Nullable String string;

  private @Nullable Node parent;
  private @Nullable Node first;
  private @Nullable Node next;
  private @Nullable Node previous;

  private int lineno = -1;
  private @Nullable EnumMap<Prop, Object> props;

  public Node(Token token) {
    this(token, (String) null);
  }

  public Node(Token token, Node... children) {
    this(token, (String) null);
    for (Node child : children) {
      addChildToBack(child);
    }
  }

  private Node(Token token, @Nullable String string) {
    this.token = checkNotNull(token);
    this.string = string;
  }

  public static Node newString(Token token, String str) {
    return new Node(token, checkNotNull(str));
  }

  public final Token getToken() {
    return token;
  }

  /** Returns the string payload: a name, an operator symbol or literal text. */
  public final String getString() {
    checkState(string != null, "%s has no string value", token);
    return string;
  }

  public final boolean hasString() {
    return string != null;
  }

  public final @Nullable Node getParent() {
    return parent;
  }

  public final boolean hasChildren() {
    return first != null;
  }

  public final @Nullable Node getFirstChild() {
    return first;
  }

  public final @Nullable Node getSecondChild() {
    return first == null ? null : first.next;
  }

  public final @Nullable Node getLastChild() {
    return first != null ? first.previous : null;
  }

  public final @Nullable Node getNext() {
    return next;
  }

  public final int getChildCount() {
    int count = 0;
    for (Node n = first; n != null; n = n.next) {
      count++;
    }
    return count;
  }

  /**
   * Gets the ith child, note that this is O(N) where N is the number of children.
   *
   * @return the child, or null when there are not that many children
   */
  public final @Nullable Node getChildAtIndex(int i) {
    Node n = first;
    while (n != null && i > 0) {
      n = n.next;
      i--;
    }
    return n;
  }

  public final void addChildToBack(Node child) {
    checkArgument(
        child.parent == null,
        "Cannot add already-owned child node.\nChild: %s\nExisting parent: %s\nNew parent: %s",
        child,
        child.parent,
        this);
    checkArgument(child.next == null);
    checkArgument(child.previous == null);

    if (first == null) {
      // NOTE: child.next remains null
      child.previous = child;
      first = child;
    } else {
      Node last = first.previous;
      last.next = child;
      child.previous = last;
      first.previous = child;
    }
    child.parent = this;
  }

  /** Iterates over the direct children in source order. */
  public final Iterable<Node> children() {
    return () ->
        new Iterator<Node>() {
          private @Nullable Node current = first;

          @Override
          public boolean hasNext() {
            return current != null;
          }

          @Override
          public Node next() {
            if (current == null) {
              throw new NoSuchElementException();
            }
            Node result = current;
            current = current.next;
            return result;
          }
        };
  }

  public final ImmutableList<Node> childList() {
    return ImmutableList.copyOf(children());
  }

  /** One-based source line, or -1 when unknown. */
  public final int getLineno() {
    return lineno;
  }

  public final Node setLineno(int lineno) {
    this.lineno = lineno;
    return this;
  }

  public final @Nullable Object getProp(Prop prop) {
    return props == null ? null : props.get(prop);
  }

  public final Node putProp(Prop prop, @Nullable Object value) {
    if (value == null) {
      if (props != null) {
        props.remove(prop);
      }
      return this;
    }
    if (props == null) {
      props = new EnumMap<>(Prop.class);
    }
    props.put(prop, value);
    return this;
  }

  public final @Nullable String getSourceText() {
    return (String) getProp(Prop.SOURCE);
  }

  @SuppressWarnings("unchecked")
  public final ImmutableList<String> getOperators() {
    checkState(token == Token.COMPARE, "%s has no comparison operators", token);
    return (ImmutableList<String>) checkNotNull(getProp(Prop.OPERATORS));
  }

  public final boolean isModule() {
    return token == Token.MODULE;
  }

  public final boolean isFunctionDef() {
    return token == Token.FUNCTION_DEF;
  }

  public final boolean isBlock() {
    return token == Token.BLOCK;
  }

  public final boolean isName() {
    return token == Token.NAME;
  }

  public final boolean isCall() {
    return token == Token.CALL;
  }

  public final boolean isTuple() {
    return token == Token.TUPLE;
  }

  public final boolean isParamList() {
    return token == Token.PARAM_LIST;
  }

  public final boolean isStatement() {
    return token.isStatement();
  }

  public final boolean isExpression() {
    return token.isExpression();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(token.name());
    if (string != null) {
      sb.append('(').append(string).append(')');
    }
    if (lineno != -1) {
      sb.append(" @").append(lineno);
    }
    return sb.toString();
  }

  /** Prints the subtree rooted at this node, one node per line, for debugging and tests. */
  public String toStringTree() {
    StringBuilder sb = new StringBuilder();
    appendTree(sb, 0);
    return sb.toString();
  }

  private void appendTree(StringBuilder sb, int level) {
    for (int i = 0; i < level; i++) {
      sb.append("    ");
    }
    sb.append(this).append('\n');
    for (Node child = first; child != null; child = child.next) {
      child.appendTree(sb, level + 1);
    }
  }
}
