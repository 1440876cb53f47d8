/*
 * Copyright © 2022,2023 James Crawford
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
 *
 */

package io.puffs;

import java.util.List;
import java.util.Set;

/**
 * Produces an indented, one node per line, dump of a parse tree. Used for debug
 * output and for comparing trees in tests.
 * <pre>
 *   FUNC pub foo.bar! @3
 *     IN
 *       FIELD x u32 @3
 *     ...
 * </pre>
 */
public class AstDumper implements Node.Visitor<Void> {
  private final IdMap         idMap;
  private final StringBuilder sb     = new StringBuilder();
  private       int           indent = 0;

  private AstDumper(IdMap idMap) {
    this.idMap = idMap;
  }

  public static String dump(SourceUnit unit, IdMap idMap) {
    AstDumper dumper = new AstDumper(idMap);
    dumper.sb.append("FILE ").append(unit.getFilename()).append('\n');
    dumper.indent++;
    unit.getTopLevelDecls().forEach(dumper::node);
    return dumper.sb.toString();
  }

  public static String dump(Node node, IdMap idMap) {
    AstDumper dumper = new AstDumper(idMap);
    dumper.node(node);
    return dumper.sb.toString();
  }

  @Override public Void visitPackageId(Node.PackageId node) {
    line(node, "PACKAGEID " + text(node.path));
    return null;
  }

  @Override public Void visitUse(Node.Use node) {
    line(node, "USE " + text(node.path));
    return null;
  }

  @Override public Void visitConst(Node.Const node) {
    line(node, "CONST" + flags(node.flags) + " " + text(node.name) + " " + type(node.type));
    nested(node.value);
    return null;
  }

  @Override public Void visitFunc(Node.Func node) {
    String name = node.receiver == null ? text(node.name) : text(node.receiver) + "." + text(node.name);
    line(node, "FUNC" + flags(node.flags) + " " + name);
    nested(node.in);
    nested(node.out);
    nested(node.asserts);
    block("BODY", node.body);
    return null;
  }

  @Override public Void visitStatus(Node.Status node) {
    line(node, "STATUS" + flags(node.flags) + " " + text(node.keyword) + " " + text(node.message));
    return null;
  }

  @Override public Void visitStruct(Node.Struct node) {
    line(node, "STRUCT" + flags(node.flags) + " " + text(node.name));
    nested(node.fields);
    return null;
  }

  @Override public Void visitField(Node.Field node) {
    line(node, "FIELD " + text(node.name) + " " + type(node.type));
    nested(node.defaultValue);
    return null;
  }

  @Override public Void visitTypeExpr(Node.TypeExpr node) {
    line(node, "TYPE " + type(node));
    return null;
  }

  @Override public Void visitExpr(Node.Expr node) {
    line(node, "EXPR" + flags(node.flags) + " " + ExprFormatter.format(node, idMap));
    return null;
  }

  @Override public Void visitAssert(Node.Assert node) {
    String via = node.reason == null ? "" : " via " + text(node.reason);
    line(node, text(node.keyword).toUpperCase() + " " + ExprFormatter.format(node.condition, idMap) + via);
    nested(node.args);
    return null;
  }

  @Override public Void visitArg(Node.Arg node) {
    line(node, "ARG " + ExprFormatter.format(node, idMap));
    return null;
  }

  @Override public Void visitVar(Node.Var node) {
    String op = node.op == null ? "" : " " + idMap.byType(node.op);
    line(node, "VAR " + text(node.name) + " " + type(node.type) + op);
    nested(node.value);
    return null;
  }

  @Override public Void visitAssign(Node.Assign node) {
    line(node, "ASSIGN " + ExprFormatter.format(node.lhs, idMap) + " " + text(node.operator) + " " + ExprFormatter.format(node.rhs, idMap));
    return null;
  }

  @Override public Void visitJump(Node.Jump node) {
    String label = node.label == null ? "" : ":" + text(node.label);
    line(node, text(node.keyword).toUpperCase() + label);
    return null;
  }

  @Override public Void visitIf(Node.If node) {
    line(node, "IF " + ExprFormatter.format(node.condition, idMap));
    block("THEN", node.bodyIfTrue);
    if (node.elseIf != null) {
      block("ELSE", List.of(node.elseIf));
    }
    else
    if (!node.bodyIfFalse.isEmpty()) {
      block("ELSE", node.bodyIfFalse);
    }
    return null;
  }

  @Override public Void visitIterate(Node.Iterate node) {
    String label = node.label == null ? "" : ":" + text(node.label);
    line(node, "ITERATE." + ExprFormatter.format(node.unroll, idMap) + label);
    nested(node.variables);
    nested(node.asserts);
    block("BODY", node.body);
    return null;
  }

  @Override public Void visitWhile(Node.While node) {
    String label = node.label == null ? "" : ":" + text(node.label);
    line(node, "WHILE" + label + " " + ExprFormatter.format(node.condition, idMap));
    nested(node.asserts);
    block("BODY", node.body);
    return null;
  }

  @Override public Void visitReturn(Node.Return node) {
    line(node, "RETURN");
    nested(node.value);
    return null;
  }

  //////////////////////////////////////

  private void node(Node node) {
    node.accept(this);
  }

  private void nested(Node node) {
    if (node != null) {
      indent++;
      node(node);
      indent--;
    }
  }

  private void nested(List<? extends Node> nodes) {
    indent++;
    nodes.forEach(this::node);
    indent--;
  }

  private void block(String label, List<Node> body) {
    indent++;
    indent();
    sb.append(label).append('\n');
    nested(body);
    indent--;
  }

  private void line(Node node, String text) {
    indent();
    sb.append(text).append(" @").append(node.getLine()).append('\n');
  }

  private void indent() {
    sb.append("  ".repeat(indent));
  }

  private String type(Node.TypeExpr type) {
    return ExprFormatter.format(type, idMap);
  }

  private String text(Token token) {
    return idMap.byToken(token);
  }

  private static String flags(Set<Node.Flag> flags) {
    StringBuilder result = new StringBuilder();
    for (Node.Flag flag: flags) {
      result.append(' ').append(flag.name().toLowerCase());
    }
    return result.toString();
  }
}
