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
import java.util.stream.Collectors;

/**
 * Renders expressions and type expressions back to Puffs source text. Every binary
 * and associative expression is wrapped in parens so the output parses back to the
 * same tree.
 */
public class ExprFormatter implements Node.Visitor<String> {
  private final IdMap idMap;

  private ExprFormatter(IdMap idMap) {
    this.idMap = idMap;
  }

  /**
   * Format an Expr, TypeExpr or Arg node
   * @param node   the node
   * @param idMap  the ids the node's tokens refer to
   * @return the source text
   * @throws IllegalArgumentException for any other kind of node
   */
  public static String format(Node node, IdMap idMap) {
    return node.accept(new ExprFormatter(idMap));
  }

  @Override public String visitExpr(Node.Expr expr) {
    switch (expr.op) {
      case NONE:
        return text(expr.token);
      case UNARY_PLUS:
      case UNARY_MINUS:
        return expr.op.asString + fmt(expr.rhs);
      case UNARY_NOT:
        return "not " + fmt(expr.rhs);
      case CALL:
        return call(expr);
      case TRY:
        return "try " + call(expr);
      case INDEX:
        return fmt(expr.lhs) + "[" + fmt(expr.rhs) + "]";
      case SLICE:
        return fmt(expr.lhs) + "[" + fmt(expr.mhs) + ":" + fmt(expr.rhs) + "]";
      case SELECTOR:
        return fmt(expr.lhs) + "." + text(expr.token);
      case DOLLAR:
        return "$(" + join(expr.args, ", ") + ")";
      case ERROR:
      case STATUS:
      case SUSPENSION:
        return expr.op.asString + " " + text(expr.token);
      default:
        break;
    }
    if (expr.op.isBinary()) {
      return "(" + fmt(expr.lhs) + " " + expr.op.asString + " " + fmt(expr.rhs) + ")";
    }
    if (expr.op.isAssociative()) {
      return "(" + join(expr.args, " " + expr.op.asString + " ") + ")";
    }
    throw new IllegalArgumentException("Unexpected operator " + expr.op.name());
  }

  @Override public String visitTypeExpr(Node.TypeExpr type) {
    switch (type.decorator) {
      case PTR:    return "ptr " + fmt(type.inner);
      case SLICE:  return "[] " + fmt(type.inner);
      case ARRAY:  return "[" + fmt(type.lhs) + "] " + fmt(type.inner);
      case RANGED: return "[" + fmt(type.lhs) + ":" + fmt(type.mhs) + "] " + fmt(type.inner);
      default:     break;
    }
    String name = type.pkg == null ? text(type.name) : text(type.pkg) + "." + text(type.name);
    if (type.isRefined()) {
      name += "[" + fmt(type.lhs) + ".." + fmt(type.mhs) + "]";
    }
    return name;
  }

  @Override public String visitArg(Node.Arg arg) {
    return arg.isNamed() ? text(arg.name) + ": " + fmt(arg.value) : fmt(arg.value);
  }

  private String call(Node.Expr expr) {
    String marker = expr.flags.contains(Node.Flag.CALL_SUSPENDIBLE) ? "?"
                  : expr.flags.contains(Node.Flag.CALL_IMPURE)      ? "!"
                  : "";
    return fmt(expr.lhs) + marker + "(" + join(expr.args, ", ") + ")";
  }

  private String fmt(Node node) {
    return node == null ? "" : node.accept(this);
  }

  private String join(List<Node> nodes, String sep) {
    return nodes.stream().map(this::fmt).collect(Collectors.joining(sep));
  }

  private String text(Token token) {
    return idMap.byToken(token);
  }

  private static String unsupported(Node node) {
    throw new IllegalArgumentException("Cannot format " + node.kind() + " as an expression");
  }

  @Override public String visitPackageId(Node.PackageId node) { return unsupported(node); }
  @Override public String visitUse(Node.Use node)             { return unsupported(node); }
  @Override public String visitConst(Node.Const node)         { return unsupported(node); }
  @Override public String visitFunc(Node.Func node)           { return unsupported(node); }
  @Override public String visitStatus(Node.Status node)       { return unsupported(node); }
  @Override public String visitStruct(Node.Struct node)       { return unsupported(node); }
  @Override public String visitField(Node.Field node)         { return unsupported(node); }
  @Override public String visitAssert(Node.Assert node)       { return unsupported(node); }
  @Override public String visitVar(Node.Var node)             { return unsupported(node); }
  @Override public String visitAssign(Node.Assign node)       { return unsupported(node); }
  @Override public String visitJump(Node.Jump node)           { return unsupported(node); }
  @Override public String visitIf(Node.If node)               { return unsupported(node); }
  @Override public String visitIterate(Node.Iterate node)     { return unsupported(node); }
  @Override public String visitWhile(Node.While node)         { return unsupported(node); }
  @Override public String visitReturn(Node.Return node)       { return unsupported(node); }
}
