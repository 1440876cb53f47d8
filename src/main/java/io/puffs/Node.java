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

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Node classes for our AST.
 * <p>
 * The set of node kinds is closed: the constructor is private so the only subclasses
 * are the ones nested here. Code that needs to handle every kind should implement
 * {@link Visitor} so that adding a kind fails to compile until every visitor copes with it.
 * </p><p>
 * Nodes are built bottom up by the {@link Parser} and are not modified afterwards except
 * that statements have their filename and line stamped once parsed.
 * </p>
 */
public abstract class Node {

  public enum Kind {
    PACKAGE_ID, USE, CONST, FUNC, STATUS, STRUCT, FIELD, TYPE_EXPR, EXPR,
    ASSERT, ARG, VAR, ASSIGN, JUMP, IF, ITERATE, WHILE, RETURN
  }

  public enum Flag {
    PUBLIC,
    IMPURE,
    SUSPENDIBLE,
    CALL_IMPURE,         // Call site marked with "!" or "?"
    CALL_SUSPENDIBLE     // Call site marked with "?"
  }

  private String filename;
  private int    line;

  private Node(String filename, int line) {
    this.filename = filename;
    this.line     = line;
  }

  public String getFilename() { return filename; }
  public int    getLine()     { return line;     }

  void setFilenameLine(String filename, int line) {
    this.filename = filename;
    this.line     = line;
  }

  public abstract Kind kind();

  public abstract <T> T accept(Visitor<T> visitor);

  // Values that make up this node (excluding filename and line) for equals/hashCode
  abstract List<Object> fields();

  public boolean is(Kind... kinds) {
    for (Kind kind: kinds) {
      if (kind() == kind) {
        return true;
      }
    }
    return false;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Node node = (Node) o;
    return line == node.line && Objects.equals(filename, node.filename) && fields().equals(node.fields());
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind(), filename, line, fields());
  }

  @Override
  public String toString() {
    return kind() + "@" + filename + ":" + line;
  }

  private static Set<Flag> flags(Set<Flag> flags) {
    if (flags == null || flags.isEmpty()) {
      return Collections.unmodifiableSet(EnumSet.noneOf(Flag.class));
    }
    return Collections.unmodifiableSet(EnumSet.copyOf(flags));
  }

  private static <T> List<T> list(List<T> nodes) {
    return nodes == null ? List.of() : List.copyOf(nodes);
  }

  // Arrays.asList since fields can be null
  private static List<Object> values(Object... values) {
    return Arrays.asList(values);
  }

  //////////////////////////////////////

  /**
   * The {@code packageid "xxxx"} declaration.
   */
  public static final class PackageId extends Node {
    public final Token path;

    PackageId(String filename, int line, Token path) {
      super(filename, line);
      this.path = path;
    }
    @Override public Kind kind() { return Kind.PACKAGE_ID; }
    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitPackageId(this); }
    @Override List<Object> fields() { return values(path); }
  }

  /**
   * The {@code use "path"} declaration.
   */
  public static final class Use extends Node {
    public final Token path;

    Use(String filename, int line, Token path) {
      super(filename, line);
      this.path = path;
    }
    @Override public Kind kind() { return Kind.USE; }
    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitUse(this); }
    @Override List<Object> fields() { return values(path); }
  }

  public static final class Const extends Node {
    public final Set<Flag> flags;
    public final Token     name;
    public final TypeExpr  type;
    public final Expr      value;

    Const(Set<Flag> flags, String filename, int line, Token name, TypeExpr type, Expr value) {
      super(filename, line);
      this.flags = flags(flags);
      this.name  = name;
      this.type  = type;
      this.value = value;
    }
    public boolean isPublic() { return flags.contains(Flag.PUBLIC); }
    @Override public Kind kind() { return Kind.CONST; }
    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitConst(this); }
    @Override List<Object> fields() { return values(flags, name, type, value); }
  }

  /**
   * A function or method. The parameters and results are held as two synthetic
   * structs named "in" and "out". The receiver is null for a plain function.
   */
  public static final class Func extends Node {
    public final Set<Flag>    flags;
    public final Token        receiver;
    public final Token        name;
    public final Struct       in;
    public final Struct       out;
    public final List<Assert> asserts;
    public final List<Node>   body;

    Func(Set<Flag> flags, String filename, int line, Token receiver, Token name, Struct in, Struct out,
         List<Assert> asserts, List<Node> body) {
      super(filename, line);
      this.flags    = flags(flags);
      this.receiver = receiver;
      this.name     = name;
      this.in       = in;
      this.out      = out;
      this.asserts  = list(asserts);
      this.body     = list(body);
    }
    public boolean isPublic()      { return flags.contains(Flag.PUBLIC);      }
    public boolean isImpure()      { return flags.contains(Flag.IMPURE);      }
    public boolean isSuspendible() { return flags.contains(Flag.SUSPENDIBLE); }
    @Override public Kind kind() { return Kind.FUNC; }
    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitFunc(this); }
    @Override List<Object> fields() { return values(flags, receiver, name, in, out, asserts, body); }
  }

  /**
   * A status declaration: {@code pub error "msg"} or {@code pri suspension "msg"}.
   */
  public static final class Status extends Node {
    public final Set<Flag> flags;
    public final Token     keyword;
    public final Token     message;

    Status(Set<Flag> flags, String filename, int line, Token keyword, Token message) {
      super(filename, line);
      this.flags   = flags(flags);
      this.keyword = keyword;
      this.message = message;
    }
    public boolean isPublic() { return flags.contains(Flag.PUBLIC); }
    @Override public Kind kind() { return Kind.STATUS; }
    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitStatus(this); }
    @Override List<Object> fields() { return values(flags, keyword, message); }
  }

  public static final class Struct extends Node {
    public final Set<Flag>   flags;
    public final Token       name;
    public final List<Field> fields;

    Struct(Set<Flag> flags, String filename, int line, Token name, List<Field> fields) {
      super(filename, line);
      this.flags  = flags(flags);
      this.name   = name;
      this.fields = list(fields);
    }
    public boolean isPublic()      { return flags.contains(Flag.PUBLIC);      }
    public boolean isSuspendible() { return flags.contains(Flag.SUSPENDIBLE); }
    @Override public Kind kind() { return Kind.STRUCT; }
    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitStruct(this); }
    @Override List<Object> fields() { return values(flags, name, fields); }
  }

  public static final class Field extends Node {
    public final Token    name;
    public final TypeExpr type;
    public final Expr     defaultValue;

    Field(String filename, int line, Token name, TypeExpr type, Expr defaultValue) {
      super(filename, line);
      this.name         = name;
      this.type         = type;
      this.defaultValue = defaultValue;
    }
    @Override public Kind kind() { return Kind.FIELD; }
    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitField(this); }
    @Override List<Object> fields() { return values(name, type, defaultValue); }
  }

  /**
   * A type expression. Depending on the decorator:
   * <ul>
   *   <li>NONE: {@code pkg.name[lhs..mhs]} with optional package and refinement</li>
   *   <li>PTR: {@code ptr inner}</li>
   *   <li>SLICE: {@code []inner}</li>
   *   <li>ARRAY: {@code [lhs]inner}</li>
   *   <li>RANGED: {@code [lhs:mhs]inner} with either bound optional</li>
   * </ul>
   */
  public static final class TypeExpr extends Node {
    public enum Decorator { NONE, PTR, SLICE, ARRAY, RANGED }

    public final Decorator decorator;
    public final Token     pkg;
    public final Token     name;
    public final Expr      lhs;
    public final Expr      mhs;
    public final TypeExpr  inner;

    TypeExpr(String filename, int line, Decorator decorator, Token pkg, Token name, Expr lhs, Expr mhs, TypeExpr inner) {
      super(filename, line);
      this.decorator = decorator;
      this.pkg       = pkg;
      this.name      = name;
      this.lhs       = lhs;
      this.mhs       = mhs;
      this.inner     = inner;
    }
    public boolean isRefined() { return decorator == Decorator.NONE && (lhs != null || mhs != null); }
    @Override public Kind kind() { return Kind.TYPE_EXPR; }
    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitTypeExpr(this); }
    @Override List<Object> fields() { return values(decorator, pkg, name, lhs, mhs, inner); }
  }

  /**
   * An expression. What the children mean depends on the operator:
   * <ul>
   *   <li>NONE: identifier or literal held in token</li>
   *   <li>unary: operand in rhs</li>
   *   <li>binary: lhs and rhs (rhs is a TypeExpr for "as")</li>
   *   <li>associative: two or more operands in args</li>
   *   <li>CALL/TRY: callee in lhs, Arg nodes in args</li>
   *   <li>INDEX: base in lhs, index in rhs</li>
   *   <li>SLICE: base in lhs, optional bounds in mhs and rhs</li>
   *   <li>SELECTOR: base in lhs, field name in token</li>
   *   <li>DOLLAR: list elements in args</li>
   *   <li>ERROR/STATUS/SUSPENSION: message string literal in token</li>
   * </ul>
   */
  public static final class Expr extends Node {
    public final Set<Flag>  flags;
    public final Operator   op;
    public final Token      token;
    public final Node       lhs;
    public final Node       mhs;
    public final Node       rhs;
    public final List<Node> args;

    Expr(Set<Flag> flags, String filename, int line, Operator op, Token token, Node lhs, Node mhs, Node rhs, List<Node> args) {
      super(filename, line);
      this.flags = flags(flags);
      this.op    = op;
      this.token = token;
      this.lhs   = lhs;
      this.mhs   = mhs;
      this.rhs   = rhs;
      this.args  = list(args);
    }
    public boolean isCall()    { return op == Operator.CALL; }
    public boolean isLeaf()    { return op == Operator.NONE; }
    public boolean isImpure()  { return flags.contains(Flag.IMPURE); }
    @Override public Kind kind() { return Kind.EXPR; }
    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitExpr(this); }
    @Override List<Object> fields() { return values(flags, op, token, lhs, mhs, rhs, args); }
  }

  /**
   * An assertion. The keyword is one of assert, pre, inv or post. The reason and args
   * come from an optional {@code via "reason"(name: value, ...)} clause.
   */
  public static final class Assert extends Node {
    public final Token     keyword;
    public final Expr      condition;
    public final Token     reason;
    public final List<Arg> args;

    Assert(String filename, int line, Token keyword, Expr condition, Token reason, List<Arg> args) {
      super(filename, line);
      this.keyword   = keyword;
      this.condition = condition;
      this.reason    = reason;
      this.args      = list(args);
    }
    @Override public Kind kind() { return Kind.ASSERT; }
    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitAssert(this); }
    @Override List<Object> fields() { return values(keyword, condition, reason, args); }
  }

  /**
   * Argument to a call or to a via clause. Name is null for positional call arguments.
   */
  public static final class Arg extends Node {
    public final Token name;
    public final Expr  value;

    Arg(String filename, int line, Token name, Expr value) {
      super(filename, line);
      this.name  = name;
      this.value = value;
    }
    public boolean isNamed() { return name != null; }
    @Override public Kind kind() { return Kind.ARG; }
    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitArg(this); }
    @Override List<Object> fields() { return values(name, value); }
  }

  /**
   * Variable declaration. The op is EQ for {@code var x T = v}, COLON for an iterate
   * variable {@code x T: v} and null when there is no initialiser.
   */
  public static final class Var extends Node {
    public final TokenType op;
    public final Token     name;
    public final TypeExpr  type;
    public final Expr      value;

    Var(String filename, int line, TokenType op, Token name, TypeExpr type, Expr value) {
      super(filename, line);
      this.op    = op;
      this.name  = name;
      this.type  = type;
      this.value = value;
    }
    @Override public Kind kind() { return Kind.VAR; }
    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitVar(this); }
    @Override List<Object> fields() { return values(op, name, type, value); }
  }

  public static final class Assign extends Node {
    public final Token operator;
    public final Expr  lhs;
    public final Expr  rhs;

    Assign(String filename, int line, Token operator, Expr lhs, Expr rhs) {
      super(filename, line);
      this.operator = operator;
      this.lhs      = lhs;
      this.rhs      = rhs;
    }
    @Override public Kind kind() { return Kind.ASSIGN; }
    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitAssign(this); }
    @Override List<Object> fields() { return values(operator, lhs, rhs); }
  }

  /**
   * A break or continue with optional label.
   */
  public static final class Jump extends Node {
    public final Token keyword;
    public final Token label;

    Jump(String filename, int line, Token keyword, Token label) {
      super(filename, line);
      this.keyword = keyword;
      this.label   = label;
    }
    @Override public Kind kind() { return Kind.JUMP; }
    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitJump(this); }
    @Override List<Object> fields() { return values(keyword, label); }
  }

  /**
   * If statement. An "else if" is held in elseIf rather than as a nested statement in
   * bodyIfFalse; at most one of elseIf and bodyIfFalse is present.
   */
  public static final class If extends Node {
    public final Expr       condition;
    public final If         elseIf;
    public final List<Node> bodyIfTrue;
    public final List<Node> bodyIfFalse;

    If(String filename, int line, Expr condition, If elseIf, List<Node> bodyIfTrue, List<Node> bodyIfFalse) {
      super(filename, line);
      this.condition   = condition;
      this.elseIf      = elseIf;
      this.bodyIfTrue  = list(bodyIfTrue);
      this.bodyIfFalse = list(bodyIfFalse);
    }
    @Override public Kind kind() { return Kind.IF; }
    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitIf(this); }
    @Override List<Object> fields() { return values(condition, elseIf, bodyIfTrue, bodyIfFalse); }
  }

  public static final class Iterate extends Node {
    public final Token        label;
    public final Expr         unroll;
    public final List<Var>    variables;
    public final List<Assert> asserts;
    public final List<Node>   body;

    Iterate(String filename, int line, Token label, Expr unroll, List<Var> variables, List<Assert> asserts, List<Node> body) {
      super(filename, line);
      this.label     = label;
      this.unroll    = unroll;
      this.variables = list(variables);
      this.asserts   = list(asserts);
      this.body      = list(body);
    }
    @Override public Kind kind() { return Kind.ITERATE; }
    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitIterate(this); }
    @Override List<Object> fields() { return values(label, unroll, variables, asserts, body); }
  }

  public static final class While extends Node {
    public final Token        label;
    public final Expr         condition;
    public final List<Assert> asserts;
    public final List<Node>   body;

    While(String filename, int line, Token label, Expr condition, List<Assert> asserts, List<Node> body) {
      super(filename, line);
      this.label     = label;
      this.condition = condition;
      this.asserts   = list(asserts);
      this.body      = list(body);
    }
    @Override public Kind kind() { return Kind.WHILE; }
    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitWhile(this); }
    @Override List<Object> fields() { return values(label, condition, asserts, body); }
  }

  public static final class Return extends Node {
    public final Expr value;

    Return(String filename, int line, Expr value) {
      super(filename, line);
      this.value = value;
    }
    @Override public Kind kind() { return Kind.RETURN; }
    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitReturn(this); }
    @Override List<Object> fields() { return values(value); }
  }

  //////////////////////////////////////

  public interface Visitor<T> {
    T visitPackageId(PackageId node);
    T visitUse(Use node);
    T visitConst(Const node);
    T visitFunc(Func node);
    T visitStatus(Status node);
    T visitStruct(Struct node);
    T visitField(Field node);
    T visitTypeExpr(TypeExpr node);
    T visitExpr(Expr node);
    T visitAssert(Assert node);
    T visitArg(Arg node);
    T visitVar(Var node);
    T visitAssign(Assign node);
    T visitJump(Jump node);
    T visitIf(If node);
    T visitIterate(Iterate node);
    T visitWhile(While node);
    T visitReturn(Return node);
  }
}
