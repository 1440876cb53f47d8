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
 * Enum for the classification keys of Puffs tokens. Besides naming the key, each
 * type answers the classification predicates the parser relies on and maps operator
 * tokens to their unary, binary and associative {@link Operator} forms. The parser
 * never computes precedence itself: everything it needs is table driven from here.
 */
public enum TokenType {
  //= Punctuation
  OPEN_PAREN("("),
  CLOSE_PAREN(")"),
  OPEN_BRACKET("["),
  CLOSE_BRACKET("]"),
  OPEN_CURLY("{"),
  CLOSE_CURLY("}"),
  DOT("."),
  DOT_DOT(".."),
  COMMA(","),
  EXCLAM("!"),
  QUESTION("?"),
  COLON(":"),
  SEMICOLON(";"),
  DOLLAR("$"),

  //= Assignment operators
  EQ("="),
  PLUS_EQ("+="),
  MINUS_EQ("-="),
  STAR_EQ("*="),
  SLASH_EQ("/="),
  PERCENT_EQ("%="),
  SHIFT_L_EQ("<<="),
  SHIFT_R_EQ(">>="),
  AMP_EQ("&="),
  AMP_HAT_EQ("&^="),
  PIPE_EQ("|="),
  HAT_EQ("^="),

  //= Operators
  PLUS("+"),
  MINUS("-"),
  STAR("*"),
  SLASH("/"),
  PERCENT("%"),
  SHIFT_L("<<"),
  SHIFT_R(">>"),
  AMP("&"),
  AMP_HAT("&^"),
  PIPE("|"),
  HAT("^"),
  NOT_EQ("!="),
  LESS_THAN("<"),
  LESS_EQ("<="),
  EQ_EQ("=="),
  GREATER_EQ(">="),
  GREATER_THAN(">"),
  AND("and"),
  OR("or"),
  NOT("not"),
  AS("as"),

  //= Literals
  IDENTIFIER(),
  NUMBER_LITERAL(),
  STRING_LITERAL(),
  TRUE("true"),
  FALSE("false"),

  //= Keywords
  PACKAGEID("packageid"),
  USE("use"),
  PUB("pub"),
  PRI("pri"),
  CONST("const"),
  FUNC("func"),
  STRUCT("struct"),
  PTR("ptr"),
  ERROR("error"),
  STATUS("status"),
  SUSPENSION("suspension"),
  ASSERT("assert"),
  PRE("pre"),
  INV("inv"),
  POST("post"),
  VIA("via"),
  BREAK("break"),
  CONTINUE("continue"),
  IF("if"),
  ELSE("else"),
  ITERATE("iterate"),
  RETURN("return"),
  VAR("var"),
  WHILE("while"),
  TRY("try"),

  //= Special
  EOF("");

  public final String asString;

  TokenType(String str) {
    this.asString = str;
  }
  TokenType()           { this.asString = null; }

  public boolean is(TokenType... types) {
    for (TokenType type: types) {
      if (this == type) {
        return true;
      }
    }
    return false;
  }

  /**
   * Keywords are the types with fixed alphabetic text (and, or, not and as are operators
   * but are spelled like keywords so the tokeniser treats them the same way).
   * @return true if this type is spelled as a word
   */
  public boolean isKeyword() {
    return asString != null && !asString.isEmpty() && Character.isLetter(asString.charAt(0));
  }

  public boolean isLiteral() {
    return is(NUMBER_LITERAL, STRING_LITERAL, TRUE, FALSE);
  }

  public boolean isUnaryOp() {
    return unaryForm() != null;
  }

  public boolean isBinaryOp() {
    return binaryForm() != null;
  }

  public boolean isAssociativeOp() {
    return associativeForm() != null;
  }

  /**
   * Check if type is an assignment operator: "=" or one of the compound forms such as "+=".
   * @return true if assignment operator
   */
  public boolean isAssign() {
    return this.is(EQ, PLUS_EQ, MINUS_EQ, STAR_EQ, SLASH_EQ, PERCENT_EQ, SHIFT_L_EQ, SHIFT_R_EQ,
                   AMP_EQ, AMP_HAT_EQ, PIPE_EQ, HAT_EQ);
  }

  public Operator unaryForm() {
    switch (this) {
      case PLUS:  return Operator.UNARY_PLUS;
      case MINUS: return Operator.UNARY_MINUS;
      case NOT:   return Operator.UNARY_NOT;
      default:    return null;
    }
  }

  public Operator binaryForm() {
    switch (this) {
      case PLUS:         return Operator.BINARY_PLUS;
      case MINUS:        return Operator.BINARY_MINUS;
      case STAR:         return Operator.BINARY_STAR;
      case SLASH:        return Operator.BINARY_SLASH;
      case PERCENT:      return Operator.BINARY_PERCENT;
      case SHIFT_L:      return Operator.BINARY_SHIFT_L;
      case SHIFT_R:      return Operator.BINARY_SHIFT_R;
      case AMP:          return Operator.BINARY_AMP;
      case AMP_HAT:      return Operator.BINARY_AMP_HAT;
      case PIPE:         return Operator.BINARY_PIPE;
      case HAT:          return Operator.BINARY_HAT;
      case NOT_EQ:       return Operator.BINARY_NOT_EQ;
      case LESS_THAN:    return Operator.BINARY_LESS_THAN;
      case LESS_EQ:      return Operator.BINARY_LESS_EQ;
      case EQ_EQ:        return Operator.BINARY_EQ_EQ;
      case GREATER_EQ:   return Operator.BINARY_GREATER_EQ;
      case GREATER_THAN: return Operator.BINARY_GREATER_THAN;
      case AND:          return Operator.BINARY_AND;
      case OR:           return Operator.BINARY_OR;
      case AS:           return Operator.BINARY_AS;
      default:           return null;
    }
  }

  public Operator associativeForm() {
    switch (this) {
      case PLUS: return Operator.ASSOCIATIVE_PLUS;
      case STAR: return Operator.ASSOCIATIVE_STAR;
      case AMP:  return Operator.ASSOCIATIVE_AMP;
      case PIPE: return Operator.ASSOCIATIVE_PIPE;
      case HAT:  return Operator.ASSOCIATIVE_HAT;
      case AND:  return Operator.ASSOCIATIVE_AND;
      case OR:   return Operator.ASSOCIATIVE_OR;
      default:   return null;
    }
  }

  @Override
  public String toString() {
    return asString != null ? asString : super.toString();
  }

}
