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

/**
 * The kinds of node in the syntax tree handed over by the parser.
 *
 * <p>Anything the parser produces that has no dedicated kind is carried as {@link #OTHER} with its
 * children intact, so that later passes can still walk into it.
 */
public enum Token {
  MODULE,

  // Statements.
  FUNCTION_DEF, // string: function name; children: PARAM_LIST, BLOCK
  ASSIGN, // children: one or more targets, then the value
  AUG_ASSIGN, // string: operator, e.g. "+"; children: target, value
  EXPR_STMT,
  RETURN, // optional value
  IF, // test, then-BLOCK, else-BLOCK (empty when absent)
  FOR, // target, iterable, body BLOCK, else-BLOCK
  WHILE, // test, body BLOCK, else-BLOCK
  BREAK,
  CONTINUE,
  PASS,

  // Expressions.
  NAME,
  NUMBER, // string: literal text as written
  STRING,
  CONSTANT, // True, False, None
  BINARY_OP,
  COMPARE, // children: left, comparators...; Prop.OPERATORS holds one operator per comparator
  BOOL_OP,
  UNARY_OP,
  CALL, // callee, then arguments
  KEYWORD, // string: argument name, empty for **kwargs; child: value
  ATTRIBUTE, // string: attribute name; child: receiver
  SUBSCRIPT, // receiver, index
  LIST,
  TUPLE,

  // Structure.
  BLOCK,
  PARAM_LIST,
  PARAM,

  /** A construct outside the known vocabulary. The string holds the parser's kind name. */
  OTHER;

  /** Whether nodes of this kind appear in statement position. */
  public boolean isStatement() {
    switch (this) {
      case FUNCTION_DEF:
      case ASSIGN:
      case AUG_ASSIGN:
      case EXPR_STMT:
      case RETURN:
      case IF:
      case FOR:
      case WHILE:
      case BREAK:
      case CONTINUE:
      case PASS:
      case OTHER:
        return true;
      default:
        return false;
    }
  }

  /** Whether nodes of this kind appear in expression position. */
  public boolean isExpression() {
    switch (this) {
      case NAME:
      case NUMBER:
      case STRING:
      case CONSTANT:
      case BINARY_OP:
      case COMPARE:
      case BOOL_OP:
      case UNARY_OP:
      case CALL:
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
