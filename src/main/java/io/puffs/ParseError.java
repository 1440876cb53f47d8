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

/**
 * Error thrown by the {@link Parser}. The first error aborts the parse so there is only
 * ever one of these per parse and no partial tree.
 */
public class ParseError extends PuffsError {

  public enum Category {
    SYNTAX,           // Wrong token at a grammar position
    LEXICAL_VALUE,    // Malformed string literal content or package id
    SEMANTIC,         // Grammar is fine but a rule enforced during parsing is not
    INTERNAL          // Token tables are inconsistent
  }

  private final Category category;

  /**
   * Create a parse error
   * @param category  kind of problem
   * @param error     the error message
   * @param filename  the file being parsed
   * @param line      the line where error occurred
   */
  public ParseError(Category category, String error, String filename, int line) {
    super("parse", error, filename, line, true);
    this.category = category;
  }

  public Category getCategory() {
    return category;
  }
}
