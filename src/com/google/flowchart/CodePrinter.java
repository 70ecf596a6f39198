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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.flowchart.ast.Node;
import org.jspecify.annotations.Nullable;

/**
 * Prints AST nodes back to Python source text, one line per statement.
 *
 * <p>Parentheses are emitted only where operator precedence requires them, the same way Python's
 * own unparser does. Only simple statements are printed; compound statements are labelled by
 * printing their parts.
 */
public final class CodePrinter {

  // Operator precedence, lowest binding first.
  static final int TUPLE = 0;
  static final int TEST = 1;
  static final int OR = 2;
  static final int AND = 3;
  static final int NOT = 4;
  static final int CMP = 5;
  static final int BOR = 6;
  static final int BXOR = 7;
  static final int BAND = 8;
  static final int SHIFT = 9;
  static final int ARITH = 10;
  static final int TERM = 11;
  static final int FACTOR = 12;
  static final int POWER = 13;
  static final int ATOM = 14;

  private static final ImmutableMap<String, Integer> BINARY_PRECEDENCE =
      ImmutableMap.<String, Integer>builder()
          .put("|", BOR)
          .put("^", BXOR)
          .put("&", BAND)
          .put("<<", SHIFT)
          .put(">>", SHIFT)
          .put("+", ARITH)
          .put("-", ARITH)
          .put("*", TERM)
          .put("/", TERM)
          .put("//", TERM)
          .put("%", TERM)
          .put("@", TERM)
          .put("**", POWER)
          .buildOrThrow();

  private static final String UNKNOWN_TEXT = "...";

  private final StringBuilder sb = new StringBuilder();

  private CodePrinter() {}

  /** Prints a simple statement such as an assignment, or an expression. */
  public static String print(Node n) {
    CodePrinter printer = new CodePrinter();
    if (n.isStatement() && !n.isExpression()) {
      printer.addStatement(n);
    } else {
      printer.addExpr(n, TEST);
    }
    return printer.sb.toString();
  }

  /** Prints an expression in a position where a bare tuple needs no parentheses. */
  public static String printTarget(Node n) {
    CodePrinter printer = new CodePrinter();
    printer.addExpr(n, TUPLE);
    return printer.sb.toString();
  }

  private void add(String s) {
    sb.append(s);
  }

  private void addStatement(Node n) {
    switch (n.getToken()) {
      case ASSIGN -> {
        for (Node child = n.getFirstChild(); child != null; child = child.getNext()) {
          if (child.getNext() == null) {
            addExpr(child, TEST);
          } else {
            addExpr(child, TUPLE);
            add(" = ");
          }
        }
      }
      case AUG_ASSIGN -> {
        addExpr(n.getFirstChild(), TEST);
        add(" " + n.getString() + "= ");
        addExpr(n.getSecondChild(), TEST);
      }
      case EXPR_STMT -> addExpr(n.getFirstChild(), TEST);
      case RETURN -> {
        add("return");
        if (n.hasChildren()) {
          add(" ");
          addExpr(n.getFirstChild(), TEST);
        }
      }
      default -> throw new IllegalArgumentException("Not a simple statement: " + n);
    }
  }

  private void addExpr(@Nullable Node n, int minPrecedence) {
    if (n == null) {
      add(UNKNOWN_TEXT);
      return;
    }
    if (n.isTuple()) {
      boolean parenthesize = !n.hasChildren() || minPrecedence > TUPLE;
      if (parenthesize) {
        add("(");
      }
      addTupleElements(n);
      if (parenthesize) {
        add(")");
      }
    } else if (precedence(n) < minPrecedence) {
      add("(");
      addExpression(n);
      add(")");
    } else {
      addExpression(n);
    }
  }

  private void addExpression(Node n) {
    switch (n.getToken()) {
      case NAME, NUMBER, CONSTANT -> add(n.getString());
      case STRING -> add(quote(n.getString()));
      case BINARY_OP -> {
        int p = precedence(n);
        // ** is the only right-associative operator.
        boolean rightAssociative = n.getString().equals("**");
        addExpr(n.getFirstChild(), rightAssociative ? p + 1 : p);
        add(" " + n.getString() + " ");
        addExpr(n.getSecondChild(), rightAssociative ? p : p + 1);
      }
      case UNARY_OP -> {
        String op = n.getString();
        add(op.equals("not") ? "not " : op);
        addExpr(n.getFirstChild(), precedence(n));
      }
      case BOOL_OP -> {
        int p = precedence(n);
        for (Node child = n.getFirstChild(); child != null; child = child.getNext()) {
          if (child != n.getFirstChild()) {
            add(" " + n.getString() + " ");
          }
          addExpr(child, p + 1);
        }
      }
      case COMPARE -> {
        ImmutableList<String> operators = n.getOperators();
        addExpr(n.getFirstChild(), CMP + 1);
        int i = 0;
        for (Node comparator = n.getSecondChild();
            comparator != null;
            comparator = comparator.getNext()) {
          add(" " + operators.get(i++) + " ");
          addExpr(comparator, CMP + 1);
        }
      }
      case CALL -> {
        addExpr(n.getFirstChild(), ATOM);
        add("(");
        for (Node arg = n.getSecondChild(); arg != null; arg = arg.getNext()) {
          if (arg != n.getSecondChild()) {
            add(", ");
          }
          addExpression(arg);
        }
        add(")");
      }
      case KEYWORD -> {
        String name = n.getString();
        add(name.isEmpty() ? "**" : name + "=");
        addExpr(n.getFirstChild(), TEST);
      }
      case ATTRIBUTE -> {
        addExpr(n.getFirstChild(), ATOM);
        add("." + n.getString());
      }
      case SUBSCRIPT -> {
        addExpr(n.getFirstChild(), ATOM);
        add("[");
        Node index = n.getSecondChild();
        if (index != null && index.isTuple() && index.hasChildren()) {
          addTupleElements(index);
        } else {
          addExpr(index, TEST);
        }
        add("]");
      }
      case LIST -> {
        add("[");
        addElements(n);
        add("]");
      }
      case TUPLE -> addExpr(n, TEST);
      case OTHER -> {
        String source = n.getSourceText();
        add(source != null ? source : UNKNOWN_TEXT);
      }
      default -> add(UNKNOWN_TEXT);
    }
  }

  private void addElements(Node n) {
    for (Node child = n.getFirstChild(); child != null; child = child.getNext()) {
      if (child != n.getFirstChild()) {
        add(", ");
      }
      addExpr(child, TEST);
    }
  }

  private void addTupleElements(Node tuple) {
    addElements(tuple);
    if (tuple.getChildCount() == 1) {
      add(",");
    }
  }

  static int precedence(Node n) {
    switch (n.getToken()) {
      case TUPLE:
        return TUPLE;
      case OTHER:
        return TEST;
      case BOOL_OP:
        return n.getString().equals("or") ? OR : AND;
      case UNARY_OP:
        return n.getString().equals("not") ? NOT : FACTOR;
      case COMPARE:
        return CMP;
      case BINARY_OP:
        Integer p = BINARY_PRECEDENCE.get(n.getString());
        return p != null ? p : TEST;
      default:
        return ATOM;
    }
  }

  /** Quotes a string the way Python's {@code repr} does. */
  static String quote(String s) {
    char quote = s.indexOf('\'') >= 0 && s.indexOf('"') < 0 ? '"' : '\'';
    StringBuilder sb = new StringBuilder(s.length() + 2);
    sb.append(quote);
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c == quote || c == '\\') {
        sb.append('\\').append(c);
      } else if (c == '\n') {
        sb.append("\\n");
      } else if (c == '\r') {
        sb.append("\\r");
      } else if (c == '\t') {
        sb.append("\\t");
      } else if (c < 0x20 || c == 0x7f) {
        sb.append(String.format("\\x%02x", (int) c));
      } else {
        sb.append(c);
      }
    }
    sb.append(quote);
    return sb.toString();
  }
}
