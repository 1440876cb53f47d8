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

class AstDumperTest extends BaseTest {

  @Test public void dumpFile() {
    SourceUnit unit = parse("packageid \"test\"\n" +
                            "pub struct s?(a u32 = 1)\n" +
                            "pri func s.f()(), pre a > 0 {\n" +
                            "  var x u32\n" +
                            "  if x == 0 {\n" +
                            "    x = 1\n" +
                            "  } else {\n" +
                            "    break :l\n" +
                            "  }\n" +
                            "}");
    String expected = "FILE test.puffs\n" +
                      "  PACKAGEID \"test\" @1\n" +
                      "  STRUCT public suspendible s @2\n" +
                      "    FIELD a u32 @2\n" +
                      "      EXPR 1 @2\n" +
                      "  FUNC s.f @3\n" +
                      "    STRUCT in @3\n" +
                      "    STRUCT out @3\n" +
                      "    PRE (a > 0) @3\n" +
                      "    BODY\n" +
                      "      VAR x u32 @4\n" +
                      "      IF (x == 0) @5\n" +
                      "        THEN\n" +
                      "          ASSIGN x = 1 @6\n" +
                      "        ELSE\n" +
                      "          BREAK:l @8\n";
    assertEquals(expected, AstDumper.dump(unit, idMap));
  }

  @Test public void dumpVarOperators() {
    String dump = AstDumper.dump(parse("pub func f()() {\n" +
                                       "  var x u32 = 1\n" +
                                       "  iterate.4 (i u32: 0) {}\n" +
                                       "}"), idMap);
    assertTrue(dump.contains("VAR x u32 = @2\n"), dump);
    assertTrue(dump.contains("VAR i u32 : @3\n"), dump);
  }

  @Test public void dumpNode() {
    Node.Expr expr = parseExpr("f?(x: 1)");
    assertEquals("EXPR impure suspendible call_impure call_suspendible f?(x: 1) @1\n", AstDumper.dump(expr, idMap));
  }

  @Test public void formatterRejectsStatements() {
    Node.Func func = parseDecl("pub func f()() {}", Node.Func.class);
    assertThrows(IllegalArgumentException.class, () -> ExprFormatter.format(func, idMap));
  }

  @Test public void formatterOutputReparses() {
    for (String source: new String[] { "a.b[i:j].c!(x: 1, 2)", "(not a and b and c)", "(x as ptr [4] u8)",
                                       "-(a + b)", "suspension \"x\"", "(a &^ b)", "f()[0][:n]" }) {
      String formatted = format(parseExpr(source));
      assertEquals(formatted, format(parseExpr(formatted)), source);
    }
  }
}
