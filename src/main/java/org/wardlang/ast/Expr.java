/*
 * Copyright 2025 The Ward Authors
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
 */

package org.wardlang.ast;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;
import org.jspecify.annotations.Nullable;
import org.wardlang.token.Key;
import org.wardlang.token.TokenId;
import org.wardlang.token.TokenMap;

/**
 * An immutable expression tree node.
 *
 * <p>Exprs compare by structure (ignoring source position), so that two occurrences of "{@code x +
 * 1}" are equal; the verifier relies on this to match facts against expressions.
 */
public final class Expr {

  public enum Kind {
    /** A numeric literal, {@code true} or {@code false}; {@link #id} is the literal's token. */
    LITERAL,
    /** A name; {@link #id} is the identifier's token. */
    IDENT,
    /** A status literal such as {@code "#bad input"}, optionally qualified by {@link #pkg}. */
    STATUS,
    /** {@link #op} applied to {@link #rhs}. */
    UNARY,
    /** {@link #lhs} {@link #op} {@link #rhs}. */
    BINARY,
    /** {@link #op} applied to two or more {@link #args}, e.g. {@code a + b + c}. */
    ASSOCIATIVE,
    /** {@link #lhs} {@code as} {@link #type}. */
    AS,
    /** {@link #lhs}({@link #args}) with call marker {@link #effect}. */
    CALL,
    /** {@link #lhs}[{@link #rhs}]. */
    INDEX,
    /** {@link #lhs}[{@link #mhs} .. {@link #rhs}]; either bound may be null. */
    SLICE,
    /** {@link #lhs}.{@link #id}. */
    SELECT
  }

  /** A call argument; {@link #name} is zero for a positional argument. */
  public record Arg(int name, Expr value) {}

  public final Kind kind;

  /** The X form key of a UNARY, BINARY or ASSOCIATIVE operator; otherwise zero. */
  public final int op;

  public final int id;

  /** For a qualified STATUS, the package name's token; otherwise zero. */
  public final int pkg;

  public final Effect effect;
  public final @Nullable Expr lhs;
  public final @Nullable Expr mhs;
  public final @Nullable Expr rhs;
  public final ImmutableList<Arg> args;
  public final @Nullable TypeExpr type;

  private Expr(
      Kind kind,
      int op,
      int id,
      int pkg,
      Effect effect,
      @Nullable Expr lhs,
      @Nullable Expr mhs,
      @Nullable Expr rhs,
      ImmutableList<Arg> args,
      @Nullable TypeExpr type) {
    this.kind = kind;
    this.op = op;
    this.id = id;
    this.pkg = pkg;
    this.effect = effect;
    this.lhs = lhs;
    this.mhs = mhs;
    this.rhs = rhs;
    this.args = args;
    this.type = type;
  }

  private static Expr simple(Kind kind, int op, int id, @Nullable Expr lhs, @Nullable Expr rhs) {
    return new Expr(kind, op, id, 0, Effect.PURE, lhs, null, rhs, ImmutableList.of(), null);
  }

  public static Expr literal(int id) {
    Preconditions.checkArgument(TokenId.isLiteral(id));
    return simple(Kind.LITERAL, 0, id, null, null);
  }

  public static Expr ident(int id) {
    return simple(Kind.IDENT, 0, id, null, null);
  }

  public static Expr status(int pkg, int literalId) {
    return new Expr(
        Kind.STATUS, 0, literalId, pkg, Effect.PURE, null, null, null, ImmutableList.of(), null);
  }

  public static Expr unary(int xOp, Expr operand) {
    Preconditions.checkArgument(xOp >= Key.X_UNARY_PLUS && xOp <= Key.X_UNARY_NOT);
    return simple(Kind.UNARY, xOp, 0, null, operand);
  }

  public static Expr binary(int xOp, Expr lhs, Expr rhs) {
    Preconditions.checkArgument(xOp >= Key.X_BINARY_PLUS && xOp < Key.X_BINARY_AS);
    return simple(Kind.BINARY, xOp, 0, lhs, rhs);
  }

  public static Expr associative(int xOp, ImmutableList<Expr> operands) {
    Preconditions.checkArgument(xOp >= Key.X_ASSOC_PLUS && xOp <= Key.X_ASSOC_OR);
    Preconditions.checkArgument(operands.size() >= 2);
    ImmutableList<Arg> args =
        operands.stream().map(e -> new Arg(0, e)).collect(ImmutableList.toImmutableList());
    return new Expr(Kind.ASSOCIATIVE, xOp, 0, 0, Effect.PURE, null, null, null, args, null);
  }

  public static Expr as(Expr lhs, TypeExpr type) {
    return new Expr(
        Kind.AS, Key.X_BINARY_AS, 0, 0, Effect.PURE, lhs, null, null, ImmutableList.of(), type);
  }

  public static Expr call(Expr callee, Effect effect, ImmutableList<Arg> args) {
    return new Expr(Kind.CALL, 0, 0, 0, effect, callee, null, null, args, null);
  }

  public static Expr index(Expr container, Expr index) {
    return simple(Kind.INDEX, 0, 0, container, index);
  }

  public static Expr slice(Expr container, @Nullable Expr lo, @Nullable Expr hi) {
    return new Expr(Kind.SLICE, 0, 0, 0, Effect.PURE, container, lo, hi, ImmutableList.of(), null);
  }

  public static Expr select(Expr lhs, int field) {
    return simple(Kind.SELECT, 0, field, lhs, null);
  }

  public boolean isIdent(int key) {
    return kind == Kind.IDENT && TokenId.key(id) == key;
  }

  public boolean isComparison() {
    return kind == Kind.BINARY && Key.isComparison(op);
  }

  /** The operands of an ASSOCIATIVE expression, in order. */
  public ImmutableList<Expr> operands() {
    return args.stream().map(Arg::value).collect(ImmutableList.toImmutableList());
  }

  /** Returns true if this Expr has a call (with any effect) as a sub-expression. */
  public boolean hasCall() {
    if (kind == Kind.CALL) {
      return true;
    }
    return anyChild(Expr::hasCall);
  }

  /** Returns true if the given Expr is equal to this one or to any of its sub-expressions. */
  public boolean mentions(Expr x) {
    return anyMatch(x::equals);
  }

  /** Returns true if this Expr or any of its sub-expressions satisfies {@code test}. */
  public boolean anyMatch(Predicate<Expr> test) {
    return test.test(this) || anyChild(c -> c.anyMatch(test));
  }

  private boolean anyChild(Predicate<Expr> test) {
    if ((lhs != null && test.test(lhs))
        || (mhs != null && test.test(mhs))
        || (rhs != null && test.test(rhs))) {
      return true;
    }
    for (Arg arg : args) {
      if (test.test(arg.value)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns a copy of this Expr with each IDENT whose token is a key of {@code bindings} replaced
   * by the corresponding value. SELECT field names and call argument names are not replaced.
   */
  public Expr substitute(Map<Integer, Expr> bindings) {
    return transform(
        e -> (e.kind == Kind.IDENT && bindings.containsKey(e.id)) ? bindings.get(e.id) : null);
  }

  /**
   * Returns a copy of this Expr in which each sub-expression for which {@code fn} returns non-null
   * has been replaced by that result. {@code fn} sees each node before its children, and
   * replacements are not themselves transformed.
   */
  public Expr transform(Function<Expr, @Nullable Expr> fn) {
    Expr replacement = fn.apply(this);
    if (replacement != null) {
      return replacement;
    }
    Expr newLhs = (lhs == null) ? null : lhs.transform(fn);
    Expr newMhs = (mhs == null) ? null : mhs.transform(fn);
    Expr newRhs = (rhs == null) ? null : rhs.transform(fn);
    ImmutableList<Arg> newArgs = args;
    if (!args.isEmpty()) {
      newArgs =
          args.stream()
              .map(a -> new Arg(a.name, a.value.transform(fn)))
              .collect(ImmutableList.toImmutableList());
    }
    if (newLhs == lhs && newMhs == mhs && newRhs == rhs && newArgs.equals(args)) {
      return this;
    }
    return new Expr(kind, op, id, pkg, effect, newLhs, newMhs, newRhs, newArgs, type);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    return obj instanceof Expr other
        && kind == other.kind
        && op == other.op
        && id == other.id
        && pkg == other.pkg
        && effect == other.effect
        && Objects.equals(lhs, other.lhs)
        && Objects.equals(mhs, other.mhs)
        && Objects.equals(rhs, other.rhs)
        && args.equals(other.args)
        && Objects.equals(type, other.type);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, op, id, pkg, lhs, mhs, rhs, args);
  }

  /** Returns the source form of this Expr. */
  public String str(TokenMap map) {
    StringBuilder sb = new StringBuilder();
    appendTo(sb, map);
    return sb.toString();
  }

  void appendTo(StringBuilder sb, TokenMap map) {
    switch (kind) {
      case LITERAL, IDENT -> sb.append(map.name(id));
      case STATUS -> {
        if (pkg != 0) {
          sb.append(map.name(pkg)).append('.');
        }
        sb.append(map.name(id));
      }
      case UNARY -> {
        sb.append(map.name(TokenId.of(op, TokenId.FLAG_OTHER)));
        if (op == Key.X_UNARY_NOT) {
          sb.append(' ');
        }
        rhs.appendOperand(sb, map);
      }
      case BINARY -> {
        lhs.appendOperand(sb, map);
        sb.append(' ').append(map.name(TokenId.of(op, TokenId.FLAG_OTHER))).append(' ');
        rhs.appendOperand(sb, map);
      }
      case ASSOCIATIVE -> {
        String opName = map.name(TokenId.of(op, TokenId.FLAG_OTHER));
        for (int i = 0; i < args.size(); i++) {
          if (i != 0) {
            sb.append(' ').append(opName).append(' ');
          }
          args.get(i).value.appendOperand(sb, map);
        }
      }
      case AS -> {
        lhs.appendOperand(sb, map);
        sb.append(" as ").append(type.str(map));
      }
      case CALL -> {
        lhs.appendTo(sb, map);
        sb.append(effect.marker).append('(');
        for (int i = 0; i < args.size(); i++) {
          if (i != 0) {
            sb.append(", ");
          }
          Arg arg = args.get(i);
          if (arg.name != 0) {
            sb.append(map.name(arg.name)).append(": ");
          }
          arg.value.appendTo(sb, map);
        }
        sb.append(')');
      }
      case INDEX -> {
        lhs.appendTo(sb, map);
        sb.append('[');
        rhs.appendTo(sb, map);
        sb.append(']');
      }
      case SLICE -> {
        lhs.appendTo(sb, map);
        sb.append('[');
        if (mhs != null) {
          mhs.appendTo(sb, map);
          sb.append(' ');
        }
        sb.append("..");
        if (rhs != null) {
          sb.append(' ');
          rhs.appendTo(sb, map);
        }
        sb.append(']');
      }
      case SELECT -> {
        lhs.appendTo(sb, map);
        sb.append('.').append(map.name(id));
      }
    }
  }

  /** Appends this Expr, parenthesized if it is an operator expression. */
  private void appendOperand(StringBuilder sb, TokenMap map) {
    if (kind == Kind.BINARY || kind == Kind.ASSOCIATIVE || kind == Kind.AS) {
      sb.append('(');
      appendTo(sb, map);
      sb.append(')');
    } else {
      appendTo(sb, map);
    }
  }

  @Override
  public String toString() {
    return String.format("Expr(%s, op=0x%02X, id=0x%X)", kind, op, id);
  }
}
