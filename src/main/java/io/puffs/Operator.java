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
 * Operator tag carried by every {@link Node.Expr}. Tokens map to these through the
 * form lookups on {@link TokenType} so that the same "+" token can become a unary,
 * binary or associative node depending on where it appears.
 */
public enum Operator {
  //= Leaf (identifier or literal)
  NONE(""),

  //= Unary forms
  UNARY_PLUS("+"),
  UNARY_MINUS("-"),
  UNARY_NOT("not"),

  //= Binary forms
  BINARY_PLUS("+"),
  BINARY_MINUS("-"),
  BINARY_STAR("*"),
  BINARY_SLASH("/"),
  BINARY_PERCENT("%"),
  BINARY_SHIFT_L("<<"),
  BINARY_SHIFT_R(">>"),
  BINARY_AMP("&"),
  BINARY_AMP_HAT("&^"),
  BINARY_PIPE("|"),
  BINARY_HAT("^"),
  BINARY_NOT_EQ("!="),
  BINARY_LESS_THAN("<"),
  BINARY_LESS_EQ("<="),
  BINARY_EQ_EQ("=="),
  BINARY_GREATER_EQ(">="),
  BINARY_GREATER_THAN(">"),
  BINARY_AND("and"),
  BINARY_OR("or"),
  BINARY_AS("as"),

  //= Associative forms
  ASSOCIATIVE_PLUS("+"),
  ASSOCIATIVE_STAR("*"),
  ASSOCIATIVE_AMP("&"),
  ASSOCIATIVE_PIPE("|"),
  ASSOCIATIVE_HAT("^"),
  ASSOCIATIVE_AND("and"),
  ASSOCIATIVE_OR("or"),

  //= Structural forms
  CALL("("),
  INDEX("["),
  SLICE(":"),
  SELECTOR("."),
  TRY("try"),
  DOLLAR("$"),
  ERROR("error"),
  STATUS("status"),
  SUSPENSION("suspension");

  public final String asString;

  Operator(String str) {
    this.asString = str;
  }

  public boolean is(Operator... ops) {
    for (Operator op: ops) {
      if (this == op) {
        return true;
      }
    }
    return false;
  }

  public boolean isUnary() {
    return is(UNARY_PLUS, UNARY_MINUS, UNARY_NOT);
  }

  public boolean isBinary() {
    return ordinal() >= BINARY_PLUS.ordinal() && ordinal() <= BINARY_AS.ordinal();
  }

  public boolean isAssociative() {
    return ordinal() >= ASSOCIATIVE_PLUS.ordinal() && ordinal() <= ASSOCIATIVE_OR.ordinal();
  }

  @Override
  public String toString() {
    return asString.isEmpty() ? name() : asString;
  }
}
