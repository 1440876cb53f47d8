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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Interning table that maps the text of identifiers and literals to small integer ids
 * and back again. The lexer interns while tokenising; parsers only ever look things up,
 * so one table can be shared by parses running on different threads.
 *
 * Id 0 is reserved to mean "no id". The built-in identifiers are interned first so
 * that {@link #isBuiltIn(int)} is a range check.
 */
public class IdMap {

  public static final List<String> BUILT_INS = List.of(
    // Names given to the synthetic parameter structs of a func
    "in", "out", "this",
    "bool",
    "i8", "i16", "i32", "i64",
    "u8", "u16", "u32", "u64",
    "usize",
    "buf1", "buf2",
    "reader1", "writer1"
  );

  public static final String IN  = "in";
  public static final String OUT = "out";

  private final Map<String,Integer> byName = new ConcurrentHashMap<>();
  private final List<String>        byId   = new ArrayList<>();
  private final int                 builtInLimit;

  public IdMap() {
    byId.add("");    // id 0
    BUILT_INS.forEach(this::intern);
    builtInLimit = byId.size();
  }

  /**
   * Return the id for the given text, allocating a new one if not already interned
   * @param name  the identifier or literal text
   * @return the id (never 0)
   */
  public synchronized int intern(String name) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("Cannot intern empty name");
    }
    Integer id = byName.get(name);
    if (id != null) {
      return id;
    }
    int newId = byId.size();
    byId.add(name);
    byName.put(name, newId);
    return newId;
  }

  /**
   * Look up the id of already interned text
   * @param name  the text
   * @return the id or 0 if never interned
   */
  public int lookup(String name) {
    Integer id = byName.get(name);
    return id == null ? 0 : id;
  }

  public synchronized String byId(int id) {
    return id > 0 && id < byId.size() ? byId.get(id) : "";
  }

  /**
   * Get the display text for a token: the interned text if it has an id, otherwise
   * the fixed text of its type.
   * @param token  the token
   * @return the display text
   */
  public String byToken(Token token) {
    if (token.getId() != 0) {
      return byId(token.getId());
    }
    return byType(token.getType());
  }

  public String byType(TokenType type) {
    return type.asString == null ? type.name() : type.asString;
  }

  public boolean isBuiltIn(int id) {
    return id > 0 && id < builtInLimit;
  }

  public boolean isBuiltIn(Token token) {
    return token != null && token.isIdent() && isBuiltIn(token.getId());
  }

  /**
   * Create an identifier token for the given name, interning it if necessary
   * @param name  the identifier
   * @param line  the source line
   * @return the token
   */
  public Token ident(String name, int line) {
    return new Token(TokenType.IDENTIFIER, intern(name), line);
  }
}
