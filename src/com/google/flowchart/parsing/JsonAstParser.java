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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.flowchart.ast.IR;
import com.google.flowchart.ast.Node;
import com.google.flowchart.ast.Token;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Reads a syntax tree from the JSON form of Python's {@code ast} module.
 *
 * <p>Every node is an object whose {@code _type} names the node class and whose other members are
 * the node's fields, for example:
 *
 * <pre>{@code
 * {"_type": "Assign",
 *  "targets": [{"_type": "Name", "id": "x"}],
 *  "value": {"_type": "Constant", "value": 1}}
 * }</pre>
 *
 * <p>Node classes without a dedicated {@link Token} become {@link Token#OTHER} nodes holding every
 * nested node found in their fields, in field order. An optional {@code source} string member is
 * kept as the node's source text and an optional {@code lineno} as its line.
 */
public final class JsonAstParser implements AstParser {

  private static final String TYPE = "_type";

  /** Deepest node nesting accepted. Later passes recurse once per level. */
  static final int MAX_NESTING_DEPTH = 1000;

  private static final ImmutableMap<String, String> BINARY_OPERATORS =
      ImmutableMap.<String, String>builder()
          .put("Add", "+")
          .put("Sub", "-")
          .put("Mult", "*")
          .put("MatMult", "@")
          .put("Div", "/")
          .put("FloorDiv", "//")
          .put("Mod", "%")
          .put("Pow", "**")
          .put("LShift", "<<")
          .put("RShift", ">>")
          .put("BitOr", "|")
          .put("BitXor", "^")
          .put("BitAnd", "&")
          .buildOrThrow();

  private static final ImmutableMap<String, String> COMPARE_OPERATORS =
      ImmutableMap.<String, String>builder()
          .put("Eq", "==")
          .put("NotEq", "!=")
          .put("Lt", "<")
          .put("LtE", "<=")
          .put("Gt", ">")
          .put("GtE", ">=")
          .put("Is", "is")
          .put("IsNot", "is not")
          .put("In", "in")
          .put("NotIn", "not in")
          .buildOrThrow();

  private static final ImmutableMap<String, String> UNARY_OPERATORS =
      ImmutableMap.of("UAdd", "+", "USub", "-", "Not", "not", "Invert", "~");

  private static final ImmutableMap<String, String> BOOL_OPERATORS =
      ImmutableMap.of("And", "and", "Or", "or");

  // Load/Store/Del markers carry nothing worth walking into.
  private static final ImmutableSet<String> EXPRESSION_CONTEXTS =
      ImmutableSet.of("Load", "Store", "Del");

  @Override
  public Node parse(String sourceName, String input) throws AstParseException {
    JsonElement root;
    try {
      root = JsonParser.parseString(input);
    } catch (JsonParseException e) {
      throw new AstParseException(sourceName, -1, "Malformed JSON: " + e.getMessage(), e);
    }
    Converter converter = new Converter(sourceName);
    Node module;
    try {
      module = converter.convert(root);
    } catch (IllegalStateException | IllegalArgumentException e) {
      // Thrown by IR when a node sits where it cannot appear.
      throw new AstParseException(
          sourceName, converter.lineno, "Invalid syntax tree: " + e.getMessage(), e);
    }
    if (!module.isModule()) {
      throw new AstParseException(
          sourceName, -1, "Expected a Module at the root, found " + module.getToken());
    }
    return module;
  }

  /** Converts one document. Not reusable. */
  private static final class Converter {
    private final String sourceName;

    // Line of the innermost node being converted, for error messages.
    private int lineno = -1;

    private int depth = 0;

    Converter(String sourceName) {
      this.sourceName = sourceName;
    }

    Node convert(JsonElement element) throws AstParseException {
      if (!element.isJsonObject()) {
        throw error("Expected a node object, found " + element);
      }
      JsonObject obj = element.getAsJsonObject();
      JsonElement type = obj.get(TYPE);
      if (type == null || !type.isJsonPrimitive() || !type.getAsJsonPrimitive().isString()) {
        throw error("Node object without " + TYPE + ": " + abbreviate(obj));
      }
      if (++depth > MAX_NESTING_DEPTH) {
        throw error("Syntax tree is nested more than " + MAX_NESTING_DEPTH + " levels deep");
      }
      int outerLineno = lineno;
      JsonElement line = obj.get("lineno");
      if (line != null && line.isJsonPrimitive() && line.getAsJsonPrimitive().isNumber()) {
        lineno = line.getAsInt();
      }
      Node n = convertNode(type.getAsString(), obj);
      if (line != null && lineno > 0) {
        n.setLineno(lineno);
      }
      JsonElement source = obj.get("source");
      if (source != null && source.isJsonPrimitive() && source.getAsJsonPrimitive().isString()) {
        n.putProp(Node.Prop.SOURCE, source.getAsString());
      }
      lineno = outerLineno;
      depth--;
      return n;
    }

    private Node convertNode(String type, JsonObject obj) throws AstParseException {
      switch (type) {
        case "Module":
          return IR.module(statements(obj, "body"));
        case "FunctionDef":
        case "AsyncFunctionDef":
          return IR.function(
              string(obj, "name"),
              IR.paramList(parameterNames(obj.get("args"))),
              IR.block(statements(obj, "body")));
        case "Assign":
          return IR.assign(expressions(obj, "targets"), expression(obj, "value"));
        case "AugAssign":
          return IR.augAssign(
              operator(obj, BINARY_OPERATORS), expression(obj, "target"), expression(obj, "value"));
        case "Expr":
          return IR.exprStmt(expression(obj, "value"));
        case "Return":
          return isAbsent(obj.get("value"))
              ? IR.returnNode()
              : IR.returnNode(expression(obj, "value"));
        case "If":
          return IR.ifNode(
              expression(obj, "test"),
              IR.block(statements(obj, "body")),
              IR.block(statements(obj, "orelse")));
        case "While":
          return IR.whileNode(
              expression(obj, "test"),
              IR.block(statements(obj, "body")),
              IR.block(statements(obj, "orelse")));
        case "For":
        case "AsyncFor":
          return IR.forNode(
              expression(obj, "target"),
              expression(obj, "iter"),
              IR.block(statements(obj, "body")),
              IR.block(statements(obj, "orelse")));
        case "Break":
          return IR.breakNode();
        case "Continue":
          return IR.continueNode();
        case "Pass":
          return IR.pass();
        case "Name":
          return IR.name(string(obj, "id"));
        case "Constant":
          return constant(obj.get("value"));
        case "BinOp":
          return IR.binaryOp(
              operator(obj, BINARY_OPERATORS), expression(obj, "left"), expression(obj, "right"));
        case "BoolOp":
          return IR.boolOp(
              operator(obj, BOOL_OPERATORS), expressions(obj, "values").toArray(new Node[0]));
        case "UnaryOp":
          return IR.unaryOp(operator(obj, UNARY_OPERATORS), expression(obj, "operand"));
        case "Compare":
          return IR.compare(
              expression(obj, "left"), compareOperators(obj), expressions(obj, "comparators"));
        case "Call":
          return call(obj);
        case "Attribute":
          return IR.attribute(expression(obj, "value"), string(obj, "attr"));
        case "Subscript":
          return IR.subscript(expression(obj, "value"), index(obj));
        case "List":
          return IR.list(expressions(obj, "elts").toArray(new Node[0]));
        case "Tuple":
          return IR.tuple(expressions(obj, "elts").toArray(new Node[0]));
        default:
          return other(type, obj);
      }
    }

    private Node call(JsonObject obj) throws AstParseException {
      ImmutableList.Builder<Node> args = ImmutableList.builder();
      args.addAll(expressions(obj, "args"));
      for (JsonElement keyword : array(obj, "keywords")) {
        if (!keyword.isJsonObject()) {
          throw error("Expected a keyword object, found " + keyword);
        }
        JsonObject kw = keyword.getAsJsonObject();
        JsonElement arg = kw.get("arg");
        args.add(IR.keyword(isAbsent(arg) ? null : arg.getAsString(), expression(kw, "value")));
      }
      return IR.call(expression(obj, "func"), args.build().toArray(new Node[0]));
    }

    private Node index(JsonObject subscript) throws AstParseException {
      Node slice = expression(subscript, "slice");
      // Before Python 3.9 a plain index is wrapped in an Index node.
      if (slice.getToken() == Token.OTHER
          && slice.getString().equals("Index")
          && slice.getChildCount() == 1) {
        JsonObject wrapper = subscript.getAsJsonObject("slice");
        return expression(wrapper, "value");
      }
      return slice;
    }

    private Node other(String type, JsonObject obj) throws AstParseException {
      ImmutableList.Builder<Node> children = ImmutableList.builder();
      for (Map.Entry<String, JsonElement> field : obj.entrySet()) {
        if (field.getKey().equals(TYPE)) {
          continue;
        }
        JsonElement value = field.getValue();
        if (value.isJsonArray()) {
          for (JsonElement element : value.getAsJsonArray()) {
            if (isNodeObject(element)) {
              children.add(convert(element));
            }
          }
        } else if (isNodeObject(value)) {
          children.add(convert(value));
        }
      }
      return IR.other(type, children.build().toArray(new Node[0]));
    }

    private boolean isNodeObject(JsonElement element) {
      if (!element.isJsonObject()) {
        return false;
      }
      JsonElement type = element.getAsJsonObject().get(TYPE);
      return type != null
          && type.isJsonPrimitive()
          && !EXPRESSION_CONTEXTS.contains(type.getAsString());
    }

    private Node constant(@Nullable JsonElement value) throws AstParseException {
      if (isAbsent(value)) {
        return IR.none();
      }
      if (!value.isJsonPrimitive()) {
        throw error("Unsupported constant " + value);
      }
      JsonPrimitive primitive = value.getAsJsonPrimitive();
      if (primitive.isBoolean()) {
        return primitive.getAsBoolean() ? IR.trueNode() : IR.falseNode();
      } else if (primitive.isNumber()) {
        return IR.number(primitive.getAsString());
      } else {
        return IR.string(primitive.getAsString());
      }
    }

    private ImmutableList<String> parameterNames(@Nullable JsonElement arguments)
        throws AstParseException {
      ImmutableList.Builder<String> names = ImmutableList.builder();
      if (isAbsent(arguments) || !arguments.isJsonObject()) {
        return names.build();
      }
      JsonObject args = arguments.getAsJsonObject();
      for (JsonElement arg : array(args, "posonlyargs")) {
        names.add(string(arg.getAsJsonObject(), "arg"));
      }
      for (JsonElement arg : array(args, "args")) {
        names.add(string(arg.getAsJsonObject(), "arg"));
      }
      if (!isAbsent(args.get("vararg"))) {
        names.add("*" + string(args.getAsJsonObject("vararg"), "arg"));
      }
      for (JsonElement arg : array(args, "kwonlyargs")) {
        names.add(string(arg.getAsJsonObject(), "arg"));
      }
      if (!isAbsent(args.get("kwarg"))) {
        names.add("**" + string(args.getAsJsonObject("kwarg"), "arg"));
      }
      return names.build();
    }

    private ImmutableList<String> compareOperators(JsonObject obj) throws AstParseException {
      ImmutableList.Builder<String> operators = ImmutableList.builder();
      for (JsonElement op : array(obj, "ops")) {
        operators.add(operatorSymbol(op, COMPARE_OPERATORS));
      }
      return operators.build();
    }

    private String operator(JsonObject obj, ImmutableMap<String, String> symbols)
        throws AstParseException {
      return operatorSymbol(obj.get("op"), symbols);
    }

    private String operatorSymbol(@Nullable JsonElement op, ImmutableMap<String, String> symbols)
        throws AstParseException {
      String name = null;
      if (op != null && op.isJsonObject() && op.getAsJsonObject().has(TYPE)) {
        name = op.getAsJsonObject().get(TYPE).getAsString();
      } else if (op != null && op.isJsonPrimitive()) {
        name = op.getAsString();
      }
      String symbol = name == null ? null : symbols.get(name);
      if (symbol == null) {
        throw error("Unknown operator " + op);
      }
      return symbol;
    }

    private ImmutableList<Node> statements(JsonObject obj, String field)
        throws AstParseException {
      return nodes(obj, field);
    }

    private ImmutableList<Node> expressions(JsonObject obj, String field)
        throws AstParseException {
      return nodes(obj, field);
    }

    private ImmutableList<Node> nodes(JsonObject obj, String field) throws AstParseException {
      ImmutableList.Builder<Node> nodes = ImmutableList.builder();
      for (JsonElement element : array(obj, field)) {
        nodes.add(convert(element));
      }
      return nodes.build();
    }

    private Node expression(JsonObject obj, String field) throws AstParseException {
      JsonElement value = obj.get(field);
      if (isAbsent(value)) {
        throw error("Missing field " + field + " in " + abbreviate(obj));
      }
      return convert(value);
    }

    private JsonArray array(JsonObject obj, String field) throws AstParseException {
      JsonElement value = obj.get(field);
      if (isAbsent(value)) {
        return new JsonArray();
      }
      if (!value.isJsonArray()) {
        throw error("Field " + field + " must be a list in " + abbreviate(obj));
      }
      return value.getAsJsonArray();
    }

    private String string(JsonObject obj, String field) throws AstParseException {
      JsonElement value = obj.get(field);
      if (isAbsent(value)
          || !value.isJsonPrimitive()
          || !value.getAsJsonPrimitive().isString()) {
        throw error("Field " + field + " must be a string in " + abbreviate(obj));
      }
      return value.getAsString();
    }

    private AstParseException error(String message) {
      return new AstParseException(sourceName, lineno, message);
    }
  }

  private static boolean isAbsent(@Nullable JsonElement element) {
    return element == null || element.isJsonNull();
  }

  private static String abbreviate(JsonObject obj) {
    String text = obj.toString();
    return text.length() <= 80 ? text : text.substring(0, 77) + "...";
  }
}
