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
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

import static io.puffs.ParseError.Category.*;
import static io.puffs.TokenType.*;
import static io.puffs.Utils.quote;

/**
 * Recursive descent parser for the Puffs language.
 * <p>
 * The parser works on a finished token sequence (statement terminators included) and
 * needs only a single token of lookahead. It never backtracks and never recovers: the
 * first problem found is thrown as a {@link ParseError} and no partial tree is returned.
 * </p><p>
 * Binary expressions are only one level deep. There is no operator
 * precedence: {@code a + b * c} is an error and must be written {@code a + (b * c)}.
 * Repeating the same associative operator ({@code a + b + c}) is allowed and folds
 * into a single n-ary node.
 * </p>
 * A parser instance is used for a single parse.
 * To extract the EBNF grammar from the comments grep out lines starting with '  *#'
 */
public class Parser {
  private final IdMap         idMap;
  private final String        filename;
  private final TokenCursor   tokens;
  private final ParserContext context;

  private int     depth = 0;       // Current nesting of expressions/types/blocks
  private boolean used  = false;

  public Parser(IdMap idMap, String filename, List<Token> tokens) {
    this(idMap, filename, tokens, ParserContext.defaults());
  }

  public Parser(IdMap idMap, String filename, List<Token> tokens, ParserContext context) {
    this.idMap    = idMap;
    this.filename = filename;
    this.tokens   = new TokenCursor(tokens);
    this.context  = context;
  }

  /**
   * <pre>
   *# parseFile ::= topLevelDecl* EOF
   * </pre>
   * @return the parsed file with its declarations in source order
   * @throws ParseError on the first error
   */
  public SourceUnit parseFile() {
    startParse();
    List<Node> topLevelDecls = new ArrayList<>();
    while (!tokens.isEmpty()) {
      topLevelDecls.add(topLevelDecl());
    }
    SourceUnit unit = new SourceUnit(filename, topLevelDecls);
    if (context.debug(1)) {
      context.output().println(AstDumper.dump(unit, idMap));
    }
    return unit;
  }

  /**
   * Parse a single expression. Tokens after the expression are not looked at.
   * @return the expression
   * @throws ParseError on the first error
   */
  public Node.Expr parseExpr() {
    startParse();
    Node.Expr expr = expression();
    if (context.debug(1)) {
      context.output().println(AstDumper.dump(expr, idMap));
    }
    return expr;
  }

  private void startParse() {
    if (used) {
      throw new IllegalStateException("Parser for " + filename + " has already been used");
    }
    used = true;
  }

  ////////////////////////////////////////////

  // = Declarations

  /**
   * <pre>
   *# topLevelDecl ::= PACKAGEID STRING_LITERAL SEMICOLON
   *#                | USE STRING_LITERAL SEMICOLON
   *#                | (PUB | PRI) ( constDecl | funcDecl | statusDecl | structDecl )
   * </pre>
   */
  private Node topLevelDecl() {
    int                line  = tokens.line();
    EnumSet<Node.Flag> flags = EnumSet.noneOf(Node.Flag.class);
    Token              start = peek();
    if (start.is(PACKAGEID, USE)) {
      advance();
      Token path = stringLiteral();
      expectSemicolon();
      if (start.is(PACKAGEID)) {
        checkPackageId(path);
        return new Node.PackageId(filename, line, path);
      }
      return new Node.Use(filename, line, path);
    }

    if (start.is(PUB, PRI)) {
      if (start.is(PUB)) {
        flags.add(Node.Flag.PUBLIC);
      }
      advance();
      switch (peek().getType()) {
        case CONST:            return constDecl(flags, line);
        case FUNC:             return funcDecl(flags, line);
        case ERROR:
        case SUSPENSION:       return statusDecl(flags, line);
        case STRUCT:           return structDecl(flags, line);
        default:               break;
      }
    }
    throw new ParseError(SYNTAX, "unrecognized top level declaration", filename, line);
  }

  private void checkPackageId(Token path) {
    String raw = idMap.byToken(path);
    String s   = Utils.unescape(raw);
    if (s == null) {
      throw error(LEXICAL_VALUE, quote(raw) + " is not a valid packageid");
    }
    if (!Base38.isValidPackageId(s)) {
      throw error(LEXICAL_VALUE, quote(s) + " is not a valid packageid");
    }
  }

  /**
   * <pre>
   *# constDecl ::= CONST IDENTIFIER typeExpr EQ ( dollarExpr | expression ) SEMICOLON
   * </pre>
   */
  private Node.Const constDecl(Set<Node.Flag> flags, int line) {
    expect(CONST);
    Token         name = ident();
    Node.TypeExpr type = typeExpr();
    if (!peek().is(EQ)) {
      throw error(SYNTAX, "const " + quote(idMap.byToken(name)) + " has no value");
    }
    advance();
    Node.Expr value = peek().is(DOLLAR) ? dollarExpr() : expression();
    expectSemicolon();
    return new Node.Const(flags, filename, line, name, type, value);
  }

  /**
   * <pre>
   *# funcDecl ::= FUNC qualifiedIdent ( EXCLAM | QUESTION )? fieldList fieldList
   *#              ( COMMA assertList )? block SEMICOLON
   * </pre>
   */
  private Node.Func funcDecl(EnumSet<Node.Flag> flags, int line) {
    expect(FUNC);
    Token[] qualified = qualifiedIdent();
    Token   receiver  = qualified[0];
    Token   name      = qualified[1];
    if (receiver != null && idMap.isBuiltIn(receiver)) {
      throw error(SEMANTIC, "built-in " + quote(idMap.byToken(receiver)) + " used for func receiver");
    }
    if (idMap.isBuiltIn(name)) {
      throw error(SEMANTIC, "built-in " + quote(idMap.byToken(name)) + " used for func name");
    }
    if (matchAny(EXCLAM)) {
      flags.add(Node.Flag.IMPURE);
    }
    else
    if (matchAny(QUESTION)) {
      flags.add(Node.Flag.IMPURE);
      flags.add(Node.Flag.SUSPENDIBLE);
    }
    List<Node.Field>  inFields  = list(CLOSE_PAREN, this::field);
    List<Node.Field>  outFields = list(CLOSE_PAREN, this::field);
    List<Node.Assert> asserts   = asserts();
    List<Node>        body      = block();
    expectSemicolon();
    Node.Struct in  = new Node.Struct(null, filename, line, builtInIdent(IdMap.IN, line), inFields);
    Node.Struct out = new Node.Struct(null, filename, line, builtInIdent(IdMap.OUT, line), outFields);
    return new Node.Func(flags, filename, line, receiver, name, in, out, asserts, body);
  }

  /**
   * <pre>
   *# statusDecl ::= ( ERROR | SUSPENSION ) STRING_LITERAL SEMICOLON
   * </pre>
   */
  private Node.Status statusDecl(Set<Node.Flag> flags, int line) {
    Token keyword = advance();
    Token message = stringLiteral();
    expectSemicolon();
    return new Node.Status(flags, filename, line, keyword, message);
  }

  /**
   * <pre>
   *# structDecl ::= STRUCT IDENTIFIER QUESTION? fieldList SEMICOLON
   * </pre>
   */
  private Node.Struct structDecl(EnumSet<Node.Flag> flags, int line) {
    expect(STRUCT);
    Token name = ident();
    if (idMap.isBuiltIn(name)) {
      throw error(SEMANTIC, "built-in " + quote(idMap.byToken(name)) + " used for struct name");
    }
    if (matchAny(QUESTION)) {
      flags.add(Node.Flag.SUSPENDIBLE);
    }
    List<Node.Field> fields = list(CLOSE_PAREN, this::field);
    expectSemicolon();
    return new Node.Struct(flags, filename, line, name, fields);
  }

  /**
   * <pre>
   *# field ::= IDENTIFIER typeExpr ( EQ expression )?
   * </pre>
   */
  private Node.Field field() {
    int           line         = tokens.line();
    Token         name         = ident();
    Node.TypeExpr type         = typeExpr();
    Node.Expr     defaultValue = null;
    if (matchAny(EQ)) {
      defaultValue = expression();
    }
    return new Node.Field(filename, line, name, type, defaultValue);
  }

  /**
   * <pre>
   *# qualifiedIdent ::= IDENTIFIER ( DOT IDENTIFIER )?
   * </pre>
   * @return array of two tokens: the qualifier (null if none) and the name
   */
  private Token[] qualifiedIdent() {
    Token x = ident();
    if (!matchAny(DOT)) {
      return new Token[] { null, x };
    }
    Token y = ident();
    return new Token[] { x, y };
  }

  private Token ident() {
    if (tokens.isEmpty()) {
      throw error(SYNTAX, "expected identifier");
    }
    Token x = peek();
    if (!x.isIdent()) {
      throw error(SYNTAX, "expected identifier, got " + got(x));
    }
    return advance();
  }

  private Token stringLiteral() {
    Token x = peek();
    if (!x.isStrLiteral()) {
      throw error(SYNTAX, "expected string literal, got " + got(x));
    }
    return advance();
  }

  private Token builtInIdent(String name, int line) {
    return new Token(IDENTIFIER, idMap.lookup(name), line);
  }

  ////////////////////////////////////////////

  // = Lists and brackets

  /**
   * Parse a comma separated list of elements up to the given stop token. If the stop
   * token is a close paren then the list must start with an open paren and the close
   * paren is consumed. Otherwise the caller has already consumed whatever started the
   * list and the stop token is left for the caller.
   * A trailing comma before the stop token is allowed.
   * <pre>
   *# list ::= ( element ( COMMA element )* COMMA? )? stop
   * </pre>
   */
  private <T extends Node> List<T> list(TokenType stop, Supplier<T> element) {
    boolean parens = stop == CLOSE_PAREN;
    if (parens) {
      if (!peek().is(OPEN_PAREN)) {
        throw error(SYNTAX, "expected \"(\", got " + got(peek()));
      }
      advance();
    }

    List<T> result = new ArrayList<>();
    while (!tokens.isEmpty()) {
      if (peek().is(stop)) {
        if (parens) {
          advance();
        }
        return result;
      }

      result.add(element.get());

      Token x = peek();
      if (x.is(stop)) {
        if (parens) {
          advance();
        }
        return result;
      }
      if (!x.is(COMMA)) {
        throw error(SYNTAX, "expected " + quote(stop.asString) + ", got " + got(x));
      }
      advance();
    }
    throw error(SYNTAX, "expected " + quote(stop.asString));
  }

  /**
   * Result of parsing a bracket: either an index ({@code [i]}) with the index in low,
   * or a range/refinement ({@code [i:j]}) with optional low and high bounds.
   */
  private static class Bracket {
    final boolean   isIndex;
    final Node.Expr low;
    final Node.Expr high;

    Bracket(boolean isIndex, Node.Expr low, Node.Expr high) {
      this.isIndex = isIndex;
      this.low     = low;
      this.high    = high;
    }
  }

  /**
   * Parse "[i:j]", "[i:]", "[:j]" and "[:]". A double dot replaces the colon if sep is
   * DOT_DOT instead of COLON. If sep is COLON it also parses the index form "[i]".
   * <pre>
   *# bracket ::= OPEN_BRACKET expression? sep expression? CLOSE_BRACKET
   *#           | OPEN_BRACKET expression CLOSE_BRACKET          // only when sep is COLON
   * </pre>
   */
  private Bracket bracket(TokenType sep) {
    if (!peek().is(OPEN_BRACKET)) {
      throw error(SYNTAX, "expected \"[\", got " + got(peek()));
    }
    advance();

    Node.Expr low = null;
    if (!peek().is(sep)) {
      low = expression();
    }

    Token x = peek();
    if (x.is(sep)) {
      advance();
    }
    else
    if (x.is(CLOSE_BRACKET) && sep == COLON) {
      advance();
      return new Bracket(true, low, null);
    }
    else {
      String extra = sep == COLON ? " or \"]\"" : "";
      throw error(SYNTAX, "expected " + quote(sep.asString) + extra + ", got " + got(x));
    }

    Node.Expr high = null;
    if (!peek().is(CLOSE_BRACKET)) {
      high = expression();
    }
    expectCloseBracket();
    return new Bracket(false, low, high);
  }

  ////////////////////////////////////////////

  // = Types

  /**
   * <pre>
   *# typeExpr ::= PTR typeExpr
   *#            | OPEN_BRACKET ( expression? ( COLON expression? )? ) CLOSE_BRACKET typeExpr
   *#            | qualifiedIdent bracket?         // bracket with ".." separator
   * </pre>
   */
  private Node.TypeExpr typeExpr() {
    enter();
    try {
      int line = tokens.line();
      if (matchAny(PTR)) {
        Node.TypeExpr inner = typeExpr();
        return new Node.TypeExpr(filename, line, Node.TypeExpr.Decorator.PTR, null, null, null, null, inner);
      }

      if (matchAny(OPEN_BRACKET)) {
        Node.TypeExpr.Decorator decorator = Node.TypeExpr.Decorator.SLICE;
        Node.Expr               lhs       = null;
        Node.Expr               mhs       = null;
        if (!peek().is(CLOSE_BRACKET)) {
          decorator = Node.TypeExpr.Decorator.ARRAY;
          if (!peek().is(COLON)) {
            lhs = expression();
          }
          if (matchAny(COLON)) {
            decorator = Node.TypeExpr.Decorator.RANGED;
            if (!peek().is(CLOSE_BRACKET)) {
              mhs = expression();
            }
          }
        }
        expectCloseBracket();
        Node.TypeExpr inner = typeExpr();
        return new Node.TypeExpr(filename, line, decorator, null, null, lhs, mhs, inner);
      }

      Token[]   qualified = qualifiedIdent();
      Node.Expr lhs       = null;
      Node.Expr mhs       = null;
      if (peek().is(OPEN_BRACKET)) {
        Bracket refinement = bracket(DOT_DOT);
        lhs = refinement.low;
        mhs = refinement.high;
      }
      return new Node.TypeExpr(filename, line, Node.TypeExpr.Decorator.NONE, qualified[0], qualified[1], lhs, mhs, null);
    }
    finally {
      exit();
    }
  }

  ////////////////////////////////////////////

  // = Stmt

  /**
   * <pre>
   *# block ::= OPEN_CURLY ( statement SEMICOLON )* CLOSE_CURLY
   * </pre>
   */
  private List<Node> block() {
    enter();
    try {
      if (!peek().is(OPEN_CURLY)) {
        throw error(SYNTAX, "expected \"{\", got " + got(peek()));
      }
      advance();

      List<Node> block = new ArrayList<>();
      while (!tokens.isEmpty()) {
        if (matchAny(CLOSE_CURLY)) {
          return block;
        }
        block.add(statement());
        expectSemicolon();
      }
      throw error(SYNTAX, "expected \"}\"");
    }
    finally {
      exit();
    }
  }

  /**
   * Parse a statement and stamp it (and any iterate variables) with the line it started on.
   */
  private Node statement() {
    int  line = tokens.isEmpty() ? 0 : peek().getLine();
    Node node = doStatement();
    node.setFilenameLine(filename, line);
    if (node instanceof Node.Iterate) {
      for (Node.Var variable: ((Node.Iterate) node).variables) {
        variable.setFilenameLine(filename, line);
      }
    }
    return node;
  }

  /**
   * <pre>
   *# statement ::= ( ASSERT | PRE | POST ) assertBody
   *#             | ( BREAK | CONTINUE ) label?
   *#             | ifStmt
   *#             | iterateStmt
   *#             | RETURN expression?
   *#             | VAR varDecl
   *#             | whileStmt
   *#             | expression ( assignOp expression )?
   * </pre>
   */
  private Node doStatement() {
    Token x = peek();
    switch (x.getType()) {
      case ASSERT:
      case PRE:
      case POST:
        return assertNode();

      case BREAK:
      case CONTINUE: {
        advance();
        Token label = label();
        return new Node.Jump(filename, x.getLine(), x, label);
      }

      case IF:
        return ifStmt();

      case ITERATE:
        return iterateStmt();

      case RETURN: {
        advance();
        Node.Expr value = peek().is(SEMICOLON) ? null : expression();
        return new Node.Return(filename, x.getLine(), value);
      }

      case VAR:
        advance();
        return varDecl(false);

      case WHILE:
        return whileStmt();

      default:
        break;
    }

    Node.Expr lhs = expression();
    Token     op  = peek();
    if (op.isAssign()) {
      advance();
      Node.Expr rhs = expression();
      return new Node.Assign(filename, x.getLine(), op, lhs, rhs);
    }
    return lhs;
  }

  /**
   * <pre>
   *# label ::= COLON IDENTIFIER
   * </pre>
   */
  private Token label() {
    if (matchAny(COLON)) {
      return ident();
    }
    return null;
  }

  /**
   * <pre>
   *# ifStmt ::= IF expression block ( ELSE ( ifStmt | block ) )?
   * </pre>
   */
  private Node.If ifStmt() {
    Token           ifToken     = expect(IF);
    Node.Expr       condition   = expression();
    List<Node>      bodyIfTrue  = block();
    Node.If         elseIf      = null;
    List<Node>      bodyIfFalse = null;
    if (matchAny(ELSE)) {
      if (peek().is(IF)) {
        elseIf = ifStmt();
      }
      else {
        bodyIfFalse = block();
      }
    }
    return new Node.If(filename, ifToken.getLine(), condition, elseIf, bodyIfTrue, bodyIfFalse);
  }

  /**
   * <pre>
   *# iterateStmt ::= ITERATE DOT literal label? iterateVarList ( COMMA assertList )? block
   * </pre>
   * The literal unroll count must be a power of 2 between 1 and 256.
   */
  private Node.Iterate iterateStmt() {
    Token iterate = expect(ITERATE);
    if (!peek().is(DOT)) {
      throw error(SYNTAX, "expected \".\", got " + got(peek()));
    }
    advance();

    Token  unrollToken = peek();
    String unrollStr   = idMap.byToken(unrollToken);
    if (!unrollToken.isLiteral()) {
      throw error(SYNTAX, "expected literal unroll count, got " + quote(unrollStr));
    }
    if (!Utils.UNROLL_COUNTS.contains(unrollStr)) {
      throw error(SEMANTIC, "expected power-of-2 unroll count in [1..256], got " + quote(unrollStr));
    }
    advance();
    Node.Expr unroll = leaf(unrollToken);

    Token             label     = label();
    List<Node.Var>    variables = list(CLOSE_PAREN, () -> varDecl(true));
    List<Node.Assert> asserts   = asserts();
    List<Node>        body      = block();
    return new Node.Iterate(filename, iterate.getLine(), label, unroll, variables, asserts, body);
  }

  /**
   * <pre>
   *# whileStmt ::= WHILE label? expression ( COMMA assertList )? block
   * </pre>
   */
  private Node.While whileStmt() {
    Token             whileToken = expect(WHILE);
    Token             label      = label();
    Node.Expr         condition  = expression();
    List<Node.Assert> asserts    = asserts();
    List<Node>        body       = block();
    return new Node.While(filename, whileToken.getLine(), label, condition, asserts, body);
  }

  /**
   * Parse a variable declaration after the "var" keyword, or an iterate variable where
   * the initialiser is mandatory and follows a colon.
   * <pre>
   *# varDecl        ::= IDENTIFIER typeExpr ( EQ ( tryExpr | expression ) )?
   *# iterateVarDecl ::= IDENTIFIER typeExpr COLON expression
   * </pre>
   */
  private Node.Var varDecl(boolean inIterate) {
    int           line  = tokens.line();
    Token         name  = ident();
    Node.TypeExpr type  = typeExpr();
    Node.Expr     value = null;
    TokenType     op    = null;

    if (inIterate) {
      op = COLON;
      if (!peek().is(COLON)) {
        throw error(SYNTAX, "expected \":\", got " + got(peek()));
      }
      advance();
      value = expression();
    }
    else
    if (matchAny(EQ)) {
      op    = EQ;
      value = peek().is(TRY) ? tryExpr() : expression();
    }
    return new Node.Var(filename, line, op, name, type, value);
  }

  ////////////////////////////////////////////

  // = Assertions

  /**
   * <pre>
   *# assertList ::= assertNode ( COMMA assertNode )* COMMA?     // stops at OPEN_CURLY
   * </pre>
   */
  private List<Node.Assert> asserts() {
    if (!matchAny(COMMA)) {
      return List.of();
    }
    List<Node.Assert> asserts = list(OPEN_CURLY, this::assertNode);
    assertsSorted(asserts);
    return asserts;
  }

  /**
   * An assertion chain on a func, while or iterate must be in "pre", "inv", "post" order
   * and cannot contain a plain "assert".
   */
  private void assertsSorted(List<Node.Assert> asserts) {
    boolean seenInv  = false;
    boolean seenPost = false;
    for (Node.Assert a: asserts) {
      switch (a.keyword.getType()) {
        case ASSERT:
          throw new ParseError(SEMANTIC, "assertion chain cannot contain \"assert\", only \"pre\", \"inv\" and \"post\"",
                               filename, a.getLine());
        case PRE:
          if (seenPost || seenInv) {
            throw assertOrderError(a);
          }
          break;
        case INV:
          if (seenPost) {
            throw assertOrderError(a);
          }
          seenInv = true;
          break;
        default:
          seenPost = true;
          break;
      }
    }
  }

  private ParseError assertOrderError(Node.Assert a) {
    return new ParseError(SEMANTIC, "assertion chain not in \"pre\", \"inv\", \"post\" order", filename, a.getLine());
  }

  /**
   * <pre>
   *# assertNode ::= ( ASSERT | PRE | INV | POST ) expression ( VIA STRING_LITERAL argList )?
   * </pre>
   */
  private Node.Assert assertNode() {
    Token x = peek();
    if (!x.is(ASSERT, PRE, INV, POST)) {
      throw error(SYNTAX, "expected \"assert\", \"pre\", \"inv\" or \"post\", got " + got(x));
    }
    advance();
    Node.Expr      condition = expression();
    Token          reason    = null;
    List<Node.Arg> args      = null;
    if (matchAny(VIA)) {
      reason = stringLiteral();
      args   = list(CLOSE_PAREN, this::namedArg);
    }
    return new Node.Assert(filename, x.getLine(), x, condition, reason, args);
  }

  /**
   * <pre>
   *# namedArg ::= IDENTIFIER COLON expression
   * </pre>
   */
  private Node.Arg namedArg() {
    int   line = tokens.line();
    Token name = ident();
    if (!peek().is(COLON)) {
      throw error(SYNTAX, "expected \":\", got " + got(peek()));
    }
    advance();
    Node.Expr value = expression();
    return new Node.Arg(filename, line, name, value);
  }

  /**
   * A call argument is either named or positional. We only know it is named once we
   * have parsed a bare identifier and see a colon after it. An identifier in parens
   * ends with ")" rather than the identifier so it is never taken as a name.
   * <pre>
   *# callArg ::= IDENTIFIER COLON expression
   *#           | expression
   * </pre>
   */
  private Node.Arg callArg() {
    int       line  = tokens.line();
    Node.Expr value = expression();
    if (value.isLeaf() && value.token.isIdent() && tokens.previous() == value.token && matchAny(COLON)) {
      return new Node.Arg(filename, line, value.token, expression());
    }
    return new Node.Arg(filename, line, null, value);
  }

  ////////////////////////////////////////////

  // = Expr

  /**
   * <pre>
   *# dollarExpr ::= DOLLAR OPEN_PAREN ( expression ( COMMA expression )* COMMA? )? CLOSE_PAREN
   * </pre>
   */
  private Node.Expr dollarExpr() {
    Token dollar = peek();
    if (!dollar.is(DOLLAR)) {
      throw error(SYNTAX, "expected \"$\", got " + got(dollar));
    }
    advance();
    List<Node.Expr> elems = list(CLOSE_PAREN, this::expression);
    return new Node.Expr(null, filename, dollar.getLine(), Operator.DOLLAR, null, null, null, null, new ArrayList<>(elems));
  }

  /**
   * <pre>
   *# tryExpr ::= TRY expression       // expression must be a call
   * </pre>
   */
  private Node.Expr tryExpr() {
    Token tryToken = expect(TRY);
    Node.Expr call = expression();
    if (!call.isCall()) {
      throw error(SEMANTIC, "expected function call after \"try\", got " + quote(ExprFormatter.format(call, idMap)));
    }
    return new Node.Expr(call.flags, filename, tryToken.getLine(), Operator.TRY, call.token,
                         call.lhs, call.mhs, call.rhs, call.args);
  }

  /**
   * There is no precedence climbing: an operand, optionally followed by one binary
   * operator and a second operand. The only way to chain is to repeat the same
   * associative operator.
   * <pre>
   *# expression ::= operand ( binaryOp operand | AS typeExpr | assocOp operand ( assocOp operand )+ )?
   * </pre>
   */
  private Node.Expr expression() {
    enter();
    try {
      Node.Expr lhs = operand();
      Token     x   = peek();
      if (!x.isBinaryOp()) {
        return lhs;
      }
      advance();
      Node rhs = x.is(AS) ? typeExpr() : operand();

      if (!x.isAssociativeOp() || !peek().sameId(x)) {
        Operator op = x.binaryForm();
        if (op == null) {
          throw error(INTERNAL, "internal error: no binary form for token " + x.getType().name());
        }
        return new Node.Expr(null, filename, lhs.getLine(), op, null, lhs, null, rhs, null);
      }

      List<Node> args = new ArrayList<>(List.of(lhs, rhs));
      while (peek().sameId(x)) {
        advance();
        args.add(operand());
      }
      Operator op = x.associativeForm();
      if (op == null) {
        throw error(INTERNAL, "internal error: no associative form for token " + x.getType().name());
      }
      return new Node.Expr(null, filename, lhs.getLine(), op, null, null, null, null, args);
    }
    finally {
      exit();
    }
  }

  /**
   * <pre>
   *# operand ::= unaryOp operand
   *#           | literal
   *#           | OPEN_PAREN expression CLOSE_PAREN
   *#           | ( ERROR | STATUS | SUSPENSION ) STRING_LITERAL
   *#           | IDENTIFIER postfix*
   *# postfix ::= ( EXCLAM | QUESTION )? OPEN_PAREN callArgs CLOSE_PAREN
   *#           | bracket                        // bracket with ":" separator
   *#           | DOT IDENTIFIER
   * </pre>
   */
  private Node.Expr operand() {
    enter();
    try {
      Token x = peek();
      if (x.isUnaryOp()) {
        advance();
        Node.Expr rhs = operand();
        Operator  op  = x.unaryForm();
        if (op == null) {
          throw error(INTERNAL, "internal error: no unary form for token " + x.getType().name());
        }
        return new Node.Expr(null, filename, x.getLine(), op, null, null, null, rhs, null);
      }

      if (x.isLiteral()) {
        advance();
        return leaf(x);
      }

      if (matchAny(OPEN_PAREN)) {
        Node.Expr expr = expression();
        if (!peek().is(CLOSE_PAREN)) {
          throw error(SYNTAX, "expected \")\", got " + got(peek()));
        }
        advance();
        return expr;
      }

      if (x.is(ERROR, STATUS, SUSPENSION)) {
        advance();
        Token    message = stringLiteral();
        Operator op      = x.is(ERROR) ? Operator.ERROR : x.is(STATUS) ? Operator.STATUS : Operator.SUSPENSION;
        return new Node.Expr(null, filename, x.getLine(), op, message, null, null, null, null);
      }

      Node.Expr lhs = leaf(ident());
      while (true) {
        EnumSet<Node.Flag> flags = EnumSet.noneOf(Node.Flag.class);
        Token              next  = peek();
        switch (next.getType()) {
          case EXCLAM:
          case QUESTION:
            flags.add(Node.Flag.IMPURE);
            flags.add(Node.Flag.CALL_IMPURE);
            if (next.is(QUESTION)) {
              flags.add(Node.Flag.SUSPENDIBLE);
              flags.add(Node.Flag.CALL_SUSPENDIBLE);
            }
            advance();
            // fall through
          case OPEN_PAREN: {
            List<Node.Arg> args = list(CLOSE_PAREN, this::callArg);
            lhs = new Node.Expr(flags, filename, lhs.getLine(), Operator.CALL, null, lhs, null, null, new ArrayList<>(args));
            break;
          }
          case OPEN_BRACKET: {
            Bracket b = bracket(COLON);
            lhs = b.isIndex ? new Node.Expr(null, filename, lhs.getLine(), Operator.INDEX, null, lhs, null, b.low, null)
                            : new Node.Expr(null, filename, lhs.getLine(), Operator.SLICE, null, lhs, b.low, b.high, null);
            break;
          }
          case DOT: {
            advance();
            Token selector = ident();
            lhs = new Node.Expr(null, filename, lhs.getLine(), Operator.SELECTOR, selector, lhs, null, null, null);
            break;
          }
          default:
            return lhs;
        }
      }
    }
    finally {
      exit();
    }
  }

  private Node.Expr leaf(Token token) {
    return new Node.Expr(null, filename, token.getLine(), Operator.NONE, token, null, null, null, null);
  }

  /////////////////////////////////////////////////

  private Token peek() {
    return tokens.peek();
  }

  private Token advance() {
    return tokens.next();
  }

  /**
   * Check if next token matches any of the given types. If it matches then consume the token and return true.
   * If it does not match one of the types then return false and stay in current position in stream of tokens.
   *
   * @param types the types to match against
   * @return true if next token matches, false is not
   */
  private boolean matchAny(TokenType... types) {
    if (peek().is(types)) {
      advance();
      return true;
    }
    return false;
  }

  /**
   * Expect the given type, consuming it, or throw an error
   * @param type  the expected type
   * @return the token consumed
   */
  private Token expect(TokenType type) {
    if (!peek().is(type)) {
      throw error(SYNTAX, "expected " + quote(type.asString) + ", got " + got(peek()));
    }
    return advance();
  }

  private void expectSemicolon() {
    if (!peek().is(SEMICOLON)) {
      throw error(SYNTAX, "expected (implicit) \";\", got " + got(peek()));
    }
    advance();
  }

  private void expectCloseBracket() {
    if (!peek().is(CLOSE_BRACKET)) {
      throw error(SYNTAX, "expected \"]\", got " + got(peek()));
    }
    advance();
  }

  private String got(Token token) {
    return quote(idMap.byToken(token));
  }

  private ParseError error(ParseError.Category category, String msg) {
    return new ParseError(category, msg, filename, tokens.line());
  }

  private void enter() {
    if (++depth > context.maxDepth()) {
      throw error(SEMANTIC, "nesting too deep: limit is " + context.maxDepth());
    }
  }

  private void exit() {
    depth--;
  }
}
