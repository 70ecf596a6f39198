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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class IRTest {

  @Test
  public void testIfAlwaysHasElseBlock() {
    Node n = IR.ifNode(IR.name("x"), IR.block(IR.pass()));
    assertThat(n.getChildCount()).isEqualTo(3);
    assertThat(n.getChildAtIndex(2).isBlock()).isTrue();
    assertThat(n.getChildAtIndex(2).hasChildren()).isFalse();
  }

  @Test
  public void testLoops() {
    Node loop = IR.forNode(IR.name("i"), IR.name("xs"), IR.block(IR.pass()));
    assertThat(loop.getToken()).isEqualTo(Token.FOR);
    assertThat(loop.getChildCount()).isEqualTo(4);
    assertThat(IR.whileNode(IR.trueNode(), IR.block()).getChildCount()).isEqualTo(3);
  }

  @Test
  public void testFunction() {
    Node f = IR.function("f", IR.paramList("a", "**kw"), IR.block(IR.returnNode()));
    assertThat(f.isFunctionDef()).isTrue();
    assertThat(f.getString()).isEqualTo("f");
    assertThat(f.getFirstChild().getChildAtIndex(1).getString()).isEqualTo("**kw");
  }

  @Test
  public void testStatementsOnlyInBlocks() {
    assertThrows(IllegalStateException.class, () -> IR.block(IR.name("x")));
    assertThrows(IllegalStateException.class, () -> IR.module(IR.number(1)));
    // Foreign constructs are allowed anywhere.
    assertThat(IR.block(IR.other("Try")).getChildCount()).isEqualTo(1);
  }

  @Test
  public void testAssignmentTargets() {
    assertThrows(IllegalStateException.class, () -> IR.assign(IR.number(1), IR.number(2)));
    assertThrows(
        IllegalArgumentException.class, () -> IR.assign(ImmutableList.of(), IR.number(2)));
    assertThat(
            IR.assign(IR.subscript(IR.name("a"), IR.number(0)), IR.number(1)).getChildCount())
        .isEqualTo(2);
  }

  @Test
  public void testCallArguments() {
    assertThrows(
        IllegalStateException.class,
        () -> IR.call(IR.name("f"), IR.keyword("k", IR.number(1)), IR.number(2)));
    Node kw = IR.keyword(null, IR.name("opts"));
    assertThat(kw.getString()).isEmpty();
  }

  @Test
  public void testOperatorArity() {
    assertThrows(IllegalArgumentException.class, () -> IR.boolOp("and", IR.name("a")));
    assertThrows(
        IllegalArgumentException.class, () -> IR.boolOp("xor", IR.name("a"), IR.name("b")));
    assertThrows(
        IllegalArgumentException.class,
        () -> IR.compare(IR.name("a"), ImmutableList.of("<"), ImmutableList.of()));
  }

  @Test
  public void testConstants() {
    assertThat(IR.trueNode().getString()).isEqualTo("True");
    assertThat(IR.falseNode().getString()).isEqualTo("False");
    assertThat(IR.none().getToken()).isEqualTo(Token.CONSTANT);
    assertThat(IR.number("1.5").getString()).isEqualTo("1.5");
  }
}
