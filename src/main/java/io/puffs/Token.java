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
import java.util.Objects;

import static io.puffs.TokenType.*;

/**
 * This class represents a single token handed to the parser by the lexer.
 * A token is a classification key (its {@link TokenType}), an interned id and
 * the source line it came from.
 *
 * The id indexes the {@link IdMap} for tokens whose text is not implied by their
 * type (identifiers, number and string literals). For every other token the id is 0.
 *
 * Tokens are immutable and compare by value so that two parses of the same token
 * sequence produce equal trees.
 */
public final class Token {
  private final TokenType type;    // Token type
  private final int       id;      // Interned id (0 if text is implied by type)
  private final int       line;    // Source line

  /**
   * Construct a token whose text is implied by its type
   * @param type  the token type
   * @param line  the source line
   */
  public Token(TokenType type, int line) {
    this(type, 0, line);
  }

  /**
   * Construct a token
   * @param type  the token type
   * @param id    the interned id from the {@link IdMap} (0 for none)
   * @param line  the source line
   */
  public Token(TokenType type, int id, int line) {
    this.type = Objects.requireNonNull(type, "type");
    this.id   = id;
    this.line = line;
  }

  /**
   * Get the type of the token
   * @return the TokenType for the token
   */
  public TokenType getType() { return type; }
  public int       getId()   { return id;   }
  public int       getLine() { return line; }

  /**
   * Check if type of token matches any of types passed in
   * @param types  the types to check
   * @return true if type matches one of the supplied types
   */
  public boolean is(TokenType... types) {
    for (TokenType type: types) {
      if (type == this.type) {
        return true;
      }
    }
    return false;
  }

  public boolean is(List<TokenType> types) {
    return is(types.toArray(new TokenType[types.size()]));
  }

  public boolean isIdent()      { return type == IDENTIFIER;     }
  public boolean isStrLiteral() { return type == STRING_LITERAL; }
  public boolean isLiteral()    { return type.isLiteral();       }
  public boolean isUnaryOp()    { return type.isUnaryOp();       }
  public boolean isBinaryOp()   { return type.isBinaryOp();      }
  public boolean isAssign()     { return type.isAssign();        }

  public boolean isAssociativeOp() {
    return type.isAssociativeOp();
  }

  public Operator unaryForm()       { return type.unaryForm();       }
  public Operator binaryForm()      { return type.binaryForm();      }
  public Operator associativeForm() { return type.associativeForm(); }

  /**
   * Tokens are the same "ID" if they have the same type and interned id, regardless
   * of where they occur in the source.
   * @param other  the token to compare with
   * @return true if same type and id
   */
  public boolean sameId(Token other) {
    return other != null && type == other.type && id == other.id;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Token)) {
      return false;
    }
    Token token = (Token) o;
    return id == token.id && line == token.line && type == token.type;
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, id, line);
  }

  @Override
  public String toString() {
    return "Token{" +
           "type='" + type.name() +
           "', id=" + id +
           ", line=" + line +
           '}';
  }

}
