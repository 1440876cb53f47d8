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

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExprTest extends BaseTest {

  private Node.Expr expr(Node node) {
    assertTrue(node instanceof Node.Expr, "Expected EXPR but got " + node);
    return (Node.Expr) node;
  }

  @Test public void leaves() {
    Node.Expr e = parseExpr("abc");
    assertTrue(e.isLeaf());
    assertEquals(Operator.NONE, e.op);
    assertEquals("abc", text(e.token));

    assertEquals("0x1F", format(parseExpr("0x1F")));
    assertEquals(TokenType.TRUE, parseExpr("true").token.getType());
    assertEquals("\"abc\"", format(parseExpr("\"abc\"")));
  }

  @Test public void binary() {
    Node.Expr e = parseExpr("a + b");
    assertEquals(Operator.BINARY_PLUS, e.op);
    assertEquals("a", format(e.lhs));
    assertEquals("b", format(e.rhs));
    assertNull(e.mhs);
    assertTrue(e.args.isEmpty());

    assertEquals(Operator.BINARY_MINUS,     parseExpr("a - b").op);
    assertEquals(Operator.BINARY_AMP_HAT,   parseExpr("a &^ b").op);
    assertEquals(Operator.BINARY_SHIFT_L,   parseExpr("a << 2").op);
    assertEquals(Operator.BINARY_NOT_EQ,    parseExpr("a != b").op);
    assertEquals(Operator.BINARY_LESS_EQ,   parseExpr("a <= b").op);
    assertEquals(Operator.BINARY_EQ_EQ,     parseExpr("a == b").op);
    assertEquals(Operator.BINARY_AND,       parseExpr("a and b").op);
    assertEquals(Operator.BINARY_OR,        parseExpr("a or b").op);
  }

  @Test public void associativeFolding() {
    Node.Expr e = parseExpr("a and b and c");
    assertEquals(Operator.ASSOCIATIVE_AND, e.op);
    assertEquals(3, e.args.size());
    assertEquals("a", format(e.args.get(0)));
    assertEquals("b", format(e.args.get(1)));
    assertEquals("c", format(e.args.get(2)));
    assertNull(e.lhs);
    assertNull(e.rhs);

    e = parseExpr("1 + 2 + 3 + 4");
    assertEquals(Operator.ASSOCIATIVE_PLUS, e.op);
    assertEquals(4, e.args.size());
    assertEquals("(1 + 2 + 3 + 4)", format(e));

    assertEquals(Operator.ASSOCIATIVE_PIPE, parseExpr("a | b | c").op);
    assertEquals(Operator.ASSOCIATIVE_HAT,  parseExpr("a ^ b ^ c").op);
  }

  @Test public void nonAssociativeDoesNotChain() {
    // parseExpr stops after the single binary combination
    assertEquals("(a - b)", format(parseExpr("a - b - c")));
    assertEquals("(a + b)", format(parseExpr("a + b - c")));
    parseError("pri const x u32 = a - b - c", "expected (implicit) \";\", got \"-\"");
    parseError("pri const x u32 = a + b - c", "expected (implicit) \";\", got \"-\"");
  }

  @Test public void noPrecedence() {
    parseError("pub func f()() {\n var x T = 1 + 2 * 3\n}", "expected (implicit) \";\", got \"*\"");
    List<Node> body = parseBody("var x T = 1 + (2 * 3)");
    Node.Var var = (Node.Var) body.get(0);
    assertEquals("(1 + (2 * 3))", format(var.value));
    assertEquals(Operator.BINARY_PLUS, var.value.op);
    assertEquals(Operator.BINARY_STAR, ((Node.Expr) var.value.rhs).op);
  }

  @Test public void as() {
    Node.Expr e = parseExpr("x as base.u32");
    assertEquals(Operator.BINARY_AS, e.op);
    assertTrue(e.rhs instanceof Node.TypeExpr);
    assertEquals("(x as base.u32)", format(e));
  }

  @Test public void unary() {
    Node.Expr e = parseExpr("-x");
    assertEquals(Operator.UNARY_MINUS, e.op);
    assertEquals("x", format(e.rhs));
    assertNull(e.lhs);

    assertEquals(Operator.UNARY_PLUS, parseExpr("+x").op);
    e = parseExpr("not not a");
    assertEquals(Operator.UNARY_NOT, e.op);
    assertEquals(Operator.UNARY_NOT, expr(e.rhs).op);
    assertEquals("not not a", format(e));

    // Unary binds tighter than binary
    e = parseExpr("-a + b");
    assertEquals(Operator.BINARY_PLUS, e.op);
    assertEquals(Operator.UNARY_MINUS, expr(e.lhs).op);
  }

  @Test public void postfix() {
    Node.Expr e = parseExpr("a.b[i].c(x: 1)");
    assertEquals(Operator.CALL, e.op);
    assertEquals("a.b[i].c(x: 1)", format(e));
    Node.Expr selector = expr(e.lhs);
    assertEquals(Operator.SELECTOR, selector.op);
    assertEquals("c", text(selector.token));
    Node.Expr index = expr(selector.lhs);
    assertEquals(Operator.INDEX, index.op);
    assertEquals("i", format(index.rhs));
    assertNull(index.mhs);
  }

  @Test public void slices() {
    Node.Expr e = parseExpr("a[i:j]");
    assertEquals(Operator.SLICE, e.op);
    assertEquals("i", format(e.mhs));
    assertEquals("j", format(e.rhs));

    e = parseExpr("a[i:]");
    assertEquals("i", format(e.mhs));
    assertNull(e.rhs);

    e = parseExpr("a[:j]");
    assertNull(e.mhs);
    assertEquals("j", format(e.rhs));

    e = parseExpr("a[:]");
    assertEquals(Operator.SLICE, e.op);
    assertNull(e.mhs);
    assertNull(e.rhs);
    assertEquals("a[:]", format(e));

    exprError("a[i j]", "expected \":\" or \"]\", got \"j\"");
    exprError("a[i:j", "expected \"]\", got \";\"");
  }

  @Test public void calls() {
    Node.Expr e = parseExpr("f()");
    assertTrue(e.isCall());
    assertFalse(e.isImpure());
    assertTrue(e.args.isEmpty());

    e = parseExpr("f!(1)");
    assertTrue(e.isImpure());
    assertTrue(e.flags.contains(Node.Flag.CALL_IMPURE));
    assertFalse(e.flags.contains(Node.Flag.SUSPENDIBLE));
    assertEquals("f!(1)", format(e));

    e = parseExpr("f?()");
    assertTrue(e.flags.contains(Node.Flag.SUSPENDIBLE));
    assertTrue(e.flags.contains(Node.Flag.CALL_SUSPENDIBLE));
    assertEquals("f?()", format(e));

    exprError("f!x", "expected \"(\", got \"x\"");
    exprError("f(1 2)", "expected \")\", got \"2\"");
  }

  @Test public void namedAndPositionalArgs() {
    Node.Expr e = parseExpr("f(1, y: 2, z,)");
    assertEquals(3, e.args.size());
    Node.Arg first = (Node.Arg) e.args.get(0);
    assertFalse(first.isNamed());
    assertEquals("1", format(first.value));
    Node.Arg second = (Node.Arg) e.args.get(1);
    assertTrue(second.isNamed());
    assertEquals("y", text(second.name));
    assertEquals("2", format(second.value));
    assertFalse(((Node.Arg) e.args.get(2)).isNamed());
    assertEquals("f(1, y: 2, z)", format(e));
  }

  @Test public void parenthesisedIdentIsNotArgName() {
    exprError("f((x): 1)", "expected \")\", got \":\"");
    Node.Arg arg = (Node.Arg) parseExpr("f((x))").args.get(0);
    assertFalse(arg.isNamed());
    assertEquals("x", format(arg.value));
  }

  @Test public void dollarListOnlyInConst() {
    exprError("$(1)", "expected identifier, got \"$\"");
    parseError("pub func f()() {\n var x T = $(1, 2)\n}", "expected identifier, got \"$\"");
    parseError("pub func f()() {\n x = $(1, 2)\n}", "expected identifier, got \"$\"");
    parseError("pub struct s(a [2] u8 = $(1, 2))", "expected identifier, got \"$\"");
  }

  @Test public void parens() {
    Node.Expr e = parseExpr("((a + b))");
    assertEquals(Operator.BINARY_PLUS, e.op);
    exprError("(a + b", "expected \")\", got \";\"");
  }

  @Test public void statusLiterals() {
    Node.Expr e = parseExpr("error \"bad header\"");
    assertEquals(Operator.ERROR, e.op);
    assertEquals("\"bad header\"", text(e.token));
    assertEquals("error \"bad header\"", format(e));
    assertEquals(Operator.STATUS,     parseExpr("status \"ok\"").op);
    assertEquals(Operator.SUSPENSION, parseExpr("suspension \"short read\"").op);
    exprError("error bad", "expected string literal, got \"bad\"");
  }

  @Test public void tryExpressions() {
    Node.Var var = (Node.Var) parseBody("var x T = try f(1, 2)").get(0);
    assertEquals(Operator.TRY, var.value.op);
    assertEquals("f", format(var.value.lhs));
    assertEquals(2, var.value.args.size());
    assertEquals("try f(1, 2)", format(var.value));

    var = (Node.Var) parseBody("var x T = try g?(a: 1)").get(0);
    assertTrue(var.value.flags.contains(Node.Flag.SUSPENDIBLE));

    ParseError e = parseError("pub func f()() {\n var x T = try (1 + 2)\n}",
                              "expected function call after \"try\", got \"(1 + 2)\"");
    assertEquals(ParseError.Category.SEMANTIC, e.getCategory());
    parseError("pub func f()() {\n var x T = try a.b\n}", "expected function call after \"try\", got \"a.b\"");
    parseError("pub func f()() {\n var x T = try f(1).y\n}", "expected function call after \"try\"");
  }

  @Test public void tryOnlyInVar() {
    parseError("pub func f()() {\n x = try f()\n}", "expected identifier, got \"try\"");
  }

  @Test public void errors() {
    ParseError e = exprError(")", "expected identifier, got \")\"");
    assertEquals(ParseError.Category.SYNTAX, e.getCategory());
    assertEquals(1, e.getLine());
    exprError("", "expected identifier");
    exprError("a.", "expected identifier");
    exprError("a + ", "expected identifier");
  }

  @Test public void exprLines() {
    Node.Expr e = parseExpr("\n\na +\n b");
    assertEquals(3, e.getLine());
    assertEquals(4, expr(e.rhs).getLine());
  }
}
