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

/**
 * Entry points for parsing Puffs source that has already been tokenised.
 * <p>For example:</p>
 * <pre>
 *   SourceUnit unit = Puffs.parseFile(idMap, "foo.puffs", tokens);
 *   for (Node.Func func: unit.getDecls(Node.Kind.FUNC, Node.Func.class)) {
 *     ...
 *   }
 * </pre>
 * <p>The {@link IdMap} must be the one the tokens were interned with. It is only read
 * during parsing so one map can be shared by parses running concurrently.</p>
 */
public class Puffs {

  private Puffs() {}

  /**
   * Parse a whole source file
   * @param idMap     the ids for the tokens
   * @param filename  the name of the file (used in errors and on every node)
   * @param tokens    the tokens, including statement terminators
   * @return the top level declarations of the file
   * @throws ParseError on the first error found
   */
  public static SourceUnit parseFile(IdMap idMap, String filename, List<Token> tokens) {
    return parseFile(idMap, filename, tokens, ParserContext.defaults());
  }

  /**
   * Parse a whole source file
   * @param idMap     the ids for the tokens
   * @param filename  the name of the file (used in errors and on every node)
   * @param tokens    the tokens, including statement terminators
   * @param context   the parser configuration
   * @return the top level declarations of the file
   * @throws ParseError on the first error found
   */
  public static SourceUnit parseFile(IdMap idMap, String filename, List<Token> tokens, ParserContext context) {
    return new Parser(idMap, filename, tokens, context).parseFile();
  }

  /**
   * Parse a single expression. Any tokens after the expression are ignored.
   * @param idMap     the ids for the tokens
   * @param filename  the name of the file
   * @param tokens    the tokens
   * @return the expression
   * @throws ParseError on the first error found
   */
  public static Node.Expr parseExpr(IdMap idMap, String filename, List<Token> tokens) {
    return parseExpr(idMap, filename, tokens, ParserContext.defaults());
  }

  public static Node.Expr parseExpr(IdMap idMap, String filename, List<Token> tokens, ParserContext context) {
    return new Parser(idMap, filename, tokens, context).parseExpr();
  }
}
