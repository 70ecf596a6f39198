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

package com.google.flowchart.parsing;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.flowchart.ast.Node;
import com.google.flowchart.ast.Token;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class JsonAstParserTest {

  private final JsonAstParser parser = new JsonAstParser();

  @Test
  public void testAssignment() throws Exception {
    Node module =
        parse(
            "{'_type': 'Module', 'body': [",
            "  {'_type': 'Assign', 'lineno': 3,",
            "   'targets': [{'_type': 'Name', 'id': 'x', 'ctx': {'_type': 'Store'}}],",
            "   'value': {'_type': 'Constant', 'value': 1}}]}");

    assertThat(module.toStringTree())
        .isEqualTo("MODULE\n    ASSIGN @3\n        NAME(x)\n        NUMBER(1)\n");
  }

  @Test
  public void testConstants() throws Exception {
    Node list =
        parseExpression(
            "{'_type': 'List', 'elts': [",
            "  {'_type': 'Constant', 'value': 2.5},",
            "  {'_type': 'Constant', 'value': 'hi'},",
            "  {'_type': 'Constant', 'value': true},",
            "  {'_type': 'Constant', 'value': null}]}");

    assertThat(list.getToken()).isEqualTo(Token.LIST);
    assertThat(list.getChildAtIndex(0).getString()).isEqualTo("2.5");
    assertThat(list.getChildAtIndex(1).getToken()).isEqualTo(Token.STRING);
    assertThat(list.getChildAtIndex(1).getString()).isEqualTo("hi");
    assertThat(list.getChildAtIndex(2).getString()).isEqualTo("True");
    assertThat(list.getChildAtIndex(3).getString()).isEqualTo("None");
  }

  @Test
  public void testFunctionDefinition() throws Exception {
    Node module =
        parse(
            "{'_type': 'Module', 'body': [",
            "  {'_type': 'FunctionDef', 'name': 'f',",
            "   'args': {'_type': 'arguments',",
            "            'posonlyargs': [],",
            "            'args': [{'_type': 'arg', 'arg': 'a'}],",
            "            'vararg': {'_type': 'arg', 'arg': 'rest'},",
            "            'kwonlyargs': [{'_type': 'arg', 'arg': 'k'}],",
            "            'kwarg': null},",
            "   'body': [{'_type': 'Return', 'value': null}]}]}");

    Node f = module.getFirstChild();
    assertThat(f.getToken()).isEqualTo(Token.FUNCTION_DEF);
    assertThat(f.getString()).isEqualTo("f");
    assertThat(f.getFirstChild().getChildCount()).isEqualTo(3);
    assertThat(f.getFirstChild().getChildAtIndex(1).getString()).isEqualTo("*rest");
    assertThat(f.getSecondChild().getFirstChild().getToken()).isEqualTo(Token.RETURN);
    assertThat(f.getSecondChild().getFirstChild().hasChildren()).isFalse();
  }

  @Test
  public void testControlFlow() throws Exception {
    Node module =
        parse(
            "{'_type': 'Module', 'body': [",
            "  {'_type': 'While', 'test': {'_type': 'Name', 'id': 'go'}, 'orelse': [],",
            "   'body': [",
            "     {'_type': 'If', 'test': {'_type': 'Name', 'id': 'done'},",
            "      'body': [{'_type': 'Break'}], 'orelse': [{'_type': 'Continue'}]}]},",
            "  {'_type': 'For', 'target': {'_type': 'Name', 'id': 'i'},",
            "   'iter': {'_type': 'Name', 'id': 'xs'},",
            "   'body': [{'_type': 'Pass'}], 'orelse': []}]}");

    Node loop = module.getFirstChild();
    assertThat(loop.getToken()).isEqualTo(Token.WHILE);
    Node ifNode = loop.getSecondChild().getFirstChild();
    assertThat(ifNode.getToken()).isEqualTo(Token.IF);
    assertThat(ifNode.getSecondChild().getFirstChild().getToken()).isEqualTo(Token.BREAK);
    assertThat(ifNode.getChildAtIndex(2).getFirstChild().getToken()).isEqualTo(Token.CONTINUE);
    assertThat(module.getSecondChild().getToken()).isEqualTo(Token.FOR);
  }

  @Test
  public void testOperators() throws Exception {
    Node module =
        parse(
            "{'_type': 'Module', 'body': [",
            "  {'_type': 'AugAssign', 'target': {'_type': 'Name', 'id': 'x'},",
            "   'op': {'_type': 'FloorDiv'}, 'value': {'_type': 'Constant', 'value': 2}},",
            "  {'_type': 'Expr', 'value':",
            "    {'_type': 'BoolOp', 'op': {'_type': 'Or'}, 'values': [",
            "      {'_type': 'UnaryOp', 'op': {'_type': 'Not'},",
            "       'operand': {'_type': 'Name', 'id': 'a'}},",
            "      {'_type': 'Compare', 'left': {'_type': 'Name', 'id': 'b'},",
            "       'ops': [{'_type': 'Lt'}, {'_type': 'NotIn'}],",
            "       'comparators': [{'_type': 'Name', 'id': 'c'}, {'_type': 'Name', 'id': 'd'}]}",
            "    ]}}]}");

    assertThat(module.getFirstChild().getString()).isEqualTo("//");
    Node boolOp = module.getSecondChild().getFirstChild();
    assertThat(boolOp.getString()).isEqualTo("or");
    assertThat(boolOp.getFirstChild().getString()).isEqualTo("not");
    assertThat(boolOp.getSecondChild().getOperators()).containsExactly("<", "not in").inOrder();
  }

  @Test
  public void testCallAndSubscript() throws Exception {
    Node call =
        parseExpression(
            "{'_type': 'Call', 'func': {'_type': 'Attribute', 'attr': 'get',",
            "                           'value': {'_type': 'Name', 'id': 'd'}},",
            " 'args': [{'_type': 'Subscript', 'value': {'_type': 'Name', 'id': 'k'},",
            "           'slice': {'_type': 'Index', 'value': {'_type': 'Constant', 'value': 0}}}],",
            " 'keywords': [{'_type': 'keyword', 'arg': 'default',",
            "               'value': {'_type': 'Constant', 'value': null}},",
            "              {'_type': 'keyword', 'arg': null,",
            "               'value': {'_type': 'Name', 'id': 'kw'}}]}");

    assertThat(call.getToken()).isEqualTo(Token.CALL);
    assertThat(call.getFirstChild().getToken()).isEqualTo(Token.ATTRIBUTE);
    Node subscript = call.getSecondChild();
    assertThat(subscript.getToken()).isEqualTo(Token.SUBSCRIPT);
    assertThat(subscript.getSecondChild().getToken()).isEqualTo(Token.NUMBER);
    assertThat(call.getChildAtIndex(2).getString()).isEqualTo("default");
    assertThat(call.getChildAtIndex(3).getString()).isEmpty();
  }

  @Test
  public void testUnknownNodesKeepNestedNodes() throws Exception {
    Node module =
        parse(
            "{'_type': 'Module', 'body': [",
            "  {'_type': 'With', 'source': 'with open(f) as fh:',",
            "   'items': [{'_type': 'withitem',",
            "              'context_expr':",
            "                {'_type': 'Name', 'id': 'ctx', 'ctx': {'_type': 'Load'}},",
            "              'optional_vars': null}],",
            "   'body': [{'_type': 'Pass'}], 'type_comment': null}]}");

    Node with = module.getFirstChild();
    assertThat(with.getToken()).isEqualTo(Token.OTHER);
    assertThat(with.getString()).isEqualTo("With");
    assertThat(with.getSourceText()).isEqualTo("with open(f) as fh:");
    assertThat(with.getChildCount()).isEqualTo(2);
    Node item = with.getFirstChild();
    assertThat(item.getString()).isEqualTo("withitem");
    // The Load context is not a child.
    assertThat(item.getFirstChild().getChildCount()).isEqualTo(0);
    assertThat(with.getSecondChild().getToken()).isEqualTo(Token.PASS);
  }

  @Test
  public void testMalformedJson() {
    AstParseException e =
        assertThrows(AstParseException.class, () -> parser.parse("in.json", "{\"_type\": "));
    assertThat(e.getSourceName()).isEqualTo("in.json");
    assertThat(e).hasMessageThat().startsWith("Malformed JSON");
  }

  @Test
  public void testMissingType() {
    AstParseException e =
        assertThrows(AstParseException.class, () -> parser.parse("in.json", "{\"body\": []}"));
    assertThat(e).hasMessageThat().contains("_type");
  }

  @Test
  public void testRootMustBeModule() {
    AstParseException e =
        assertThrows(
            AstParseException.class,
            () -> parser.parse("in.json", "{\"_type\": \"Name\", \"id\": \"x\"}"));
    assertThat(e).hasMessageThat().contains("Module");
  }

  @Test
  public void testExpressionWhereStatementBelongs() {
    AstParseException e =
        assertThrows(
            AstParseException.class,
            () ->
                parser.parse(
                    "in.json",
                    "{\"_type\": \"Module\", \"body\": [{\"_type\": \"Name\", \"id\": \"x\","
                        + " \"lineno\": 4}]}"));
    assertThat(e).hasMessageThat().startsWith("Invalid syntax tree");
    assertThat(e.getLineno()).isEqualTo(-1);
  }

  @Test
  public void testUnknownOperator() {
    AstParseException e =
        assertThrows(
            AstParseException.class,
            () ->
                parse(
                    "{'_type': 'Module', 'body': [{'_type': 'Expr', 'lineno': 2, 'value':",
                    "  {'_type': 'BinOp', 'op': {'_type': 'Spaceship'},",
                    "   'left': {'_type': 'Name', 'id': 'a'},",
                    "   'right': {'_type': 'Name', 'id': 'b'}}}]}"));
    assertThat(e).hasMessageThat().contains("Unknown operator");
    assertThat(e.getLineno()).isEqualTo(2);
  }

  /** Parses a document written with single quotes for readability. */
  private Node parse(String... lines) throws AstParseException {
    return parser.parse("test.json", String.join("\n", lines).replace('\'', '"'));
  }

  private Node parseExpression(String... lines) throws AstParseException {
    String expression = String.join("\n", lines);
    Node module =
        parse("{'_type': 'Module', 'body': [{'_type': 'Expr', 'value': " + expression + "}]}");
    return module.getFirstChild().getFirstChild();
  }

  @Test
  public void testDeepNestingIsRejected() {
    StringBuilder sum = new StringBuilder();
    for (int i = 1; i < 3000; i++) {
      sum.append("{'_type': 'BinOp', 'op': {'_type': 'Add'}, 'left': ");
    }
    sum.append("{'_type': 'Name', 'id': 'a'}");
    for (int i = 1; i < 3000; i++) {
      sum.append(", 'right': {'_type': 'Name', 'id': 'a'}}");
    }
    String json =
        "{'_type': 'Module', 'body': [{'_type': 'Assign', 'lineno': 1,"
            + " 'targets': [{'_type': 'Name', 'id': 'x'}], 'value': "
            + sum
            + "}]}";

    AstParseException e =
        assertThrows(AstParseException.class, () -> parser.parse("deep.json", json));
    assertThat(e).hasMessageThat().contains("nested more than");
    assertThat(e.getLineno()).isEqualTo(1);
  }
}
