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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.flowchart.ast.IR;
import com.google.flowchart.ast.Node;
import com.google.flowchart.ast.Token;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CodePrinterTest {

  @Test
  public void testAssignments() {
    assertPrint("x = 1", IR.assign(IR.name("x"), IR.number(1)));
    assertPrint(
        "a = b = 0", IR.assign(ImmutableList.of(IR.name("a"), IR.name("b")), IR.number(0)));
    assertPrint(
        "a, b = (b, a)",
        IR.assign(IR.tuple(IR.name("a"), IR.name("b")), IR.tuple(IR.name("b"), IR.name("a"))));
    assertPrint("count += 1", IR.augAssign("+", IR.name("count"), IR.number(1)));
    assertPrint(
        "self.items[i] //= 2",
        IR.augAssign(
            "//",
            IR.subscript(IR.attribute(IR.name("self"), "items"), IR.name("i")),
            IR.number(2)));
  }

  @Test
  public void testReturn() {
    assertPrint("return", IR.returnNode());
    assertPrint("return x * 2", IR.returnNode(IR.mul(IR.name("x"), IR.number(2))));
  }

  @Test
  public void testCompoundStatementsAreNotPrinted() {
    assertThrows(
        IllegalArgumentException.class,
        () -> CodePrinter.print(IR.ifNode(IR.name("done"), IR.block(IR.pass()))));
    assertThrows(IllegalArgumentException.class, () -> CodePrinter.print(IR.breakNode()));
  }

  @Test
  public void testPrecedence() {
    Node a = IR.name("a");
    Node b = IR.name("b");
    Node c = IR.name("c");
    assertPrint("(a + b) * c", IR.mul(IR.add(a, b), c));
    assertPrint("a - (b - c)", IR.sub(IR.name("a"), IR.sub(IR.name("b"), IR.name("c"))));
    assertPrint("a - b - c", IR.sub(IR.sub(IR.name("a"), IR.name("b")), IR.name("c")));
    assertPrint(
        "a ** b ** c",
        IR.binaryOp("**", IR.name("a"), IR.binaryOp("**", IR.name("b"), IR.name("c"))));
    assertPrint(
        "(a ** b) ** c",
        IR.binaryOp("**", IR.binaryOp("**", IR.name("a"), IR.name("b")), IR.name("c")));
    assertPrint("-(a + b)", IR.neg(IR.add(IR.name("a"), IR.name("b"))));
    assertPrint("-a ** 2", IR.neg(IR.binaryOp("**", IR.name("a"), IR.number(2))));
    assertPrint("not a == b", IR.not(IR.eq(IR.name("a"), IR.name("b"))));
  }

  @Test
  public void testBooleanOperators() {
    assertPrint(
        "a and b or c",
        IR.boolOp("or", IR.boolOp("and", IR.name("a"), IR.name("b")), IR.name("c")));
    assertPrint(
        "a and (b or c)",
        IR.boolOp("and", IR.name("a"), IR.boolOp("or", IR.name("b"), IR.name("c"))));
    assertPrint(
        "(a or b) or c",
        IR.boolOp("or", IR.boolOp("or", IR.name("a"), IR.name("b")), IR.name("c")));
    assertPrint("x and y and z", IR.boolOp("and", IR.name("x"), IR.name("y"), IR.name("z")));
  }

  @Test
  public void testComparisonChain() {
    assertPrint(
        "0 <= i < n",
        IR.compare(
            IR.number(0),
            ImmutableList.of("<=", "<"),
            ImmutableList.of(IR.name("i"), IR.name("n"))));
    assertPrint("x not in seen", IR.compare("not in", IR.name("x"), IR.name("seen")));
    assertPrint(
        "(a < b) == c",
        IR.eq(IR.lt(IR.name("a"), IR.name("b")), IR.name("c")));
  }

  @Test
  public void testCalls() {
    assertPrint("f()", IR.call(IR.name("f")));
    assertPrint(
        "print(x, sep='', **opts)",
        IR.call(
            IR.name("print"),
            IR.name("x"),
            IR.keyword("sep", IR.string("")),
            IR.keyword(null, IR.name("opts"))));
    assertPrint(
        "(a + b).bit_length()",
        IR.call(IR.attribute(IR.add(IR.name("a"), IR.name("b")), "bit_length")));
    assertPrint("f((1, 2))", IR.call(IR.name("f"), IR.tuple(IR.number(1), IR.number(2))));
  }

  @Test
  public void testContainers() {
    assertPrint("[]", IR.list());
    assertPrint("[1, 'a', None]", IR.list(IR.number(1), IR.string("a"), IR.none()));
    assertPrint("()", IR.tuple());
    assertPrint("(1,)", IR.tuple(IR.number(1)));
    assertPrint("m[i, j]", IR.subscript(IR.name("m"), IR.tuple(IR.name("i"), IR.name("j"))));
    assertPrint("flags[True]", IR.subscript(IR.name("flags"), IR.trueNode()));
  }

  @Test
  public void testStringQuoting() {
    assertThat(CodePrinter.quote("hi")).isEqualTo("'hi'");
    assertThat(CodePrinter.quote("it's")).isEqualTo("\"it's\"");
    assertThat(CodePrinter.quote("say \"hi\"")).isEqualTo("'say \"hi\"'");
    assertThat(CodePrinter.quote("both ' and \"")).isEqualTo("'both \\' and \"'");
    assertThat(CodePrinter.quote("a\nb\\")).isEqualTo("'a\\nb\\\\'");
    assertThat(CodePrinter.quote("\u0001")).isEqualTo("'\\x01'");
  }

  @Test
  public void testUnknownExpressions() {
    Node lambda = IR.other("Lambda", IR.name("x"));
    assertPrint("...", lambda);
    Node withSource = IR.other("Lambda", IR.name("x"));
    withSource.putProp(Node.Prop.SOURCE, "lambda x: x");
    assertPrint("f(lambda x: x)", IR.call(IR.name("f"), withSource));
  }

  @Test
  public void testPrintTarget() {
    assertThat(CodePrinter.printTarget(IR.tuple(IR.name("i"), IR.name("x")))).isEqualTo("i, x");
    assertThat(CodePrinter.print(IR.tuple(IR.name("i"), IR.name("x")))).isEqualTo("(i, x)");
    assertThat(
            CodePrinter.printTarget(
                IR.tuple(IR.name("k"), IR.call(IR.attribute(IR.name("d"), "items")))))
        .isEqualTo("k, d.items()");
  }

  @Test
  public void testPrecedenceValues() {
    assertThat(CodePrinter.precedence(IR.name("a"))).isEqualTo(CodePrinter.ATOM);
    assertThat(CodePrinter.precedence(IR.add(IR.name("a"), IR.name("b"))))
        .isEqualTo(CodePrinter.ARITH);
    assertThat(CodePrinter.precedence(IR.not(IR.name("a")))).isEqualTo(CodePrinter.NOT);
    assertThat(CodePrinter.precedence(IR.neg(IR.name("a")))).isEqualTo(CodePrinter.FACTOR);
    assertThat(CodePrinter.precedence(IR.other("Lambda"))).isEqualTo(CodePrinter.TEST);
    assertThat(IR.other("Lambda").getToken()).isEqualTo(Token.OTHER);
  }

  private static void assertPrint(String expected, Node n) {
    assertThat(CodePrinter.print(n)).isEqualTo(expected);
  }
}
