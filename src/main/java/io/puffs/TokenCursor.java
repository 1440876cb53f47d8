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
 * Forward only view over a finished token sequence with a single token of lookahead.
 * Once the tokens run out {@link #peek()} keeps returning an EOF token tagged with
 * the line of the last real token so that errors at end of input still have a position.
 */
public class TokenCursor {
  private final List<Token> tokens;
  private final int         lastLine;
  private final Token       eof;
  private       int         current  = 0;
  private       Token       previous = null;

  public TokenCursor(List<Token> tokens) {
    this.tokens   = List.copyOf(tokens);
    this.lastLine = this.tokens.isEmpty() ? 0 : this.tokens.get(this.tokens.size() - 1).getLine();
    this.eof      = new Token(TokenType.EOF, lastLine);
  }

  public boolean isEmpty() {
    return current >= tokens.size();
  }

  /**
   * Return the next token without consuming it
   * @return the next token or an EOF token if there are no more
   */
  public Token peek() {
    return isEmpty() ? eof : tokens.get(current);
  }

  /**
   * Consume and return the next token
   * @return the token consumed (EOF if there were none left)
   */
  public Token next() {
    Token token = peek();
    if (!isEmpty()) {
      current++;
      previous = token;
    }
    return token;
  }

  public Token previous() {
    return previous;
  }

  /**
   * Line of the next token or, if exhausted, of the last token in the stream
   * @return the current line
   */
  public int line() {
    return isEmpty() ? lastLine : tokens.get(current).getLine();
  }
}
