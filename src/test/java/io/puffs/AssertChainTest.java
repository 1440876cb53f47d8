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

import static org.junit.jupiter.api.Assertions.*;

class AssertChainTest extends BaseTest {

  private static final String ORDER_ERROR = "assertion chain not in \"pre\", \"inv\", \"post\" order";

  @Test public void orderedChain() {
    Node.Func func = parseDecl("pub func f()(), pre a, inv b, post c {}", Node.Func.class);
    assertEquals(3, func.asserts.size());
    assertEquals(TokenType.PRE,  func.asserts.get(0).keyword.getType());
    assertEquals(TokenType.INV,  func.asserts.get(1).keyword.getType());
    assertEquals(TokenType.POST, func.asserts.get(2).keyword.getType());
  }

  @Test public void repeatsAndGaps() {
    assertEquals(4, parseDecl("pub func f()(), pre a, pre b, post c, post d {}", Node.Func.class).asserts.size());
    assertEquals(1, parseDecl("pub func f()(), post a {}", Node.Func.class).asserts.size());
    assertEquals(2, parseDecl("pub func f()(), inv a, inv b {}", Node.Func.class).asserts.size());
    // Trailing comma before the body
    assertEquals(1, parseDecl("pub func f()(), pre a, {}", Node.Func.class).asserts.size());
  }

  @Test public void outOfOrder() {
    ParseError e = parseError("pub func f()(), pre a, post b, inv c {}", ORDER_ERROR);
    assertEquals(ParseError.Category.SEMANTIC, e.getCategory());
    parseError("pub func f()(), post a, pre b {}", ORDER_ERROR);
    parseError("pub func f()(), inv a, pre b {}", ORDER_ERROR);
    parseError("pub func f()() {\n while x, inv a, pre b {}\n}", ORDER_ERROR);
    parseError("pub func f()() {\n iterate.4 (), post a, inv b {}\n}", ORDER_ERROR);
  }

  @Test public void bareAssertInChain() {
    ParseError e = parseError("pub func f()(), pre a, assert b {}",
                              "assertion chain cannot contain \"assert\", only \"pre\", \"inv\" and \"post\"");
    assertEquals(ParseError.Category.SEMANTIC, e.getCategory());
    parseError("pub func f()() {\n while x, assert a {}\n}", "assertion chain cannot contain \"assert\"");
  }

  @Test public void errorLineIsOffendingAssert() {
    ParseError e = parseError("pub func f()(),\n" +
                              "    pre a,\n" +
                              "    post b,\n" +
                              "    inv c,\n" +
                              "{\n" +
                              "}", ORDER_ERROR);
    assertEquals(4, e.getLine());
    assertEquals("parse: " + ORDER_ERROR + " at test.puffs:4", e.getMessage());
  }

  @Test public void via() {
    Node.Func func = parseDecl("pub func f()(), pre a < b via \"a < b: c\"(c: x), post d {}", Node.Func.class);
    Node.Assert pre = func.asserts.get(0);
    assertEquals("\"a < b: c\"", text(pre.reason));
    assertEquals(1, pre.args.size());
    assertTrue(pre.args.get(0).isNamed());
    assertEquals("x", format(pre.args.get(0).value));
  }

  @Test public void notAnAssertion() {
    parseError("pub func f()(), a {}", "expected \"assert\", \"pre\", \"inv\" or \"post\", got \"a\"");
    parseError("pub func f()(), pre a post b {}", "expected \"{\", got \"post\"");
  }
}
