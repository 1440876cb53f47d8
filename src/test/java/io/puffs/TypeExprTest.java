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

import static io.puffs.Node.TypeExpr.Decorator.*;
import static org.junit.jupiter.api.Assertions.*;

class TypeExprTest extends BaseTest {

  @Test public void names() {
    Node.TypeExpr type = parseType("u32");
    assertEquals(NONE, type.decorator);
    assertNull(type.pkg);
    assertEquals("u32", text(type.name));
    assertFalse(type.isRefined());
    assertNull(type.inner);

    type = parseType("base.u32");
    assertEquals("base", text(type.pkg));
    assertEquals("u32", text(type.name));
    assertEquals("base.u32", format(type));
  }

  @Test public void refinements() {
    Node.TypeExpr type = parseType("u32[0..15]");
    assertEquals(NONE, type.decorator);
    assertTrue(type.isRefined());
    assertEquals("0", format(type.lhs));
    assertEquals("15", format(type.mhs));

    type = parseType("u32[..15]");
    assertNull(type.lhs);
    assertEquals("15", format(type.mhs));

    type = parseType("u32[1..]");
    assertEquals("1", format(type.lhs));
    assertNull(type.mhs);

    assertEquals("base.u8[0..(max - 1)]", format(parseType("base.u8[0..max - 1]")));
  }

  @Test public void badRefinements() {
    parseError("pri const x u32[0] = 0", "expected \"..\", got \"]\"");
    parseError("pri const x u32[0:1] = 0", "expected \"..\", got \":\"");
    parseError("pri const x u32[0..1 = 0", "expected \"]\", got \"=\"");
  }

  @Test public void pointers() {
    Node.TypeExpr type = parseType("ptr u8");
    assertEquals(PTR, type.decorator);
    assertEquals(NONE, type.inner.decorator);
    assertEquals("u8", text(type.inner.name));
    assertEquals("ptr ptr u8", format(parseType("ptr ptr u8")));
  }

  @Test public void arrays() {
    Node.TypeExpr type = parseType("[] u8");
    assertEquals(SLICE, type.decorator);
    assertNull(type.lhs);
    assertEquals("u8", format(type.inner));

    type = parseType("[4] u8");
    assertEquals(ARRAY, type.decorator);
    assertEquals("4", format(type.lhs));
    assertNull(type.mhs);

    type = parseType("[0:4] u8");
    assertEquals(RANGED, type.decorator);
    assertEquals("0", format(type.lhs));
    assertEquals("4", format(type.mhs));

    type = parseType("[:] u8");
    assertEquals(RANGED, type.decorator);
    assertNull(type.lhs);
    assertNull(type.mhs);

    type = parseType("[n:] u8");
    assertEquals("n", format(type.lhs));
    assertNull(type.mhs);

    assertEquals("ptr [] base.u8[0..9]", format(parseType("ptr [] base.u8[0..9]")));
    assertEquals("[4] [2] u8", format(parseType("[4][2] u8")));
  }

  @Test public void badArrays() {
    parseError("pri const x [4 u8 = 0", "expected \"]\", got \"u8\"");
    parseError("pri const x [] = 0", "expected identifier, got \"=\"");
    parseError("pri const x ptr = 0", "expected identifier, got \"=\"");
  }

  @Test public void fieldTypes() {
    Node.Struct struct = parseDecl("pub struct s(a ptr u8, b [4] base.u16[0..8])", Node.Struct.class);
    assertEquals(PTR, struct.fields.get(0).type.decorator);
    assertEquals("[4] base.u16[0..8]", format(struct.fields.get(1).type));
  }

  @Test public void nestingLimit() {
    maxDepth = 3;
    ParseError e = parseError("pri const x ptr ptr ptr ptr u8 = 0", "nesting too deep");
    assertEquals(ParseError.Category.SEMANTIC, e.getCategory());
    maxDepth = 4;
    assertEquals("ptr ptr ptr u8", format(parseType("ptr ptr ptr u8")));
  }
}
