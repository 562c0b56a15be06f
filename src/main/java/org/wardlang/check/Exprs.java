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

package org.wardlang.check;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.wardlang.ast.Effect;
import org.wardlang.ast.Expr;
import org.wardlang.token.Key;
import org.wardlang.token.TokenId;
import org.wardlang.token.TokenMap;

/** Static helpers for building and rewriting the Exprs used as facts. */
public class Exprs {

  /** The length of a container: {@code x.length()}. */
  static Expr length(Expr container) {
    return Expr.call(
        Expr.select(container, TokenId.builtIn(Key.LENGTH)), Effect.PURE, ImmutableList.of());
  }

  /** Returns true if {@code e} has the form {@code x.length()}. */
  static boolean isLength(Expr e) {
    return e.kind == Expr.Kind.CALL
        && e.args.isEmpty()
        && e.lhs.kind == Expr.Kind.SELECT
        && TokenId.key(e.lhs.id) == Key.LENGTH;
  }

  static Expr compare(int xOp, Expr lhs, Expr rhs) {
    return Expr.binary(xOp, lhs, rhs);
  }

  /** Returns the value of a numeric literal token, which may be hex and may contain underscores. */
  public static BigInteger literalValue(TokenMap map, int id) {
    String s = map.name(id).replace("_", "");
    if (s.startsWith("0x") || s.startsWith("0X")) {
      return new BigInteger(s.substring(2), 16);
    }
    return new BigInteger(s);
  }

  /**
   * Returns an Expr denoting the given value: a literal, or a negated literal if the value is
   * negative (matching how the parser represents {@code -3}).
   */
  public static Expr constant(TokenMap map, BigInteger value) {
    if (value.signum() < 0) {
      return Expr.unary(Key.X_UNARY_MINUS, constant(map, value.negate()));
    }
    return Expr.literal(map.intern(value.toString()));
  }

  /** Returns the boolean literal {@code true} or {@code false}. */
  static Expr bool(boolean value) {
    return Expr.literal(TokenId.builtIn(value ? Key.TRUE : Key.FALSE));
  }

  /** Returns true if {@code e} is the literal {@code true}. */
  static boolean isTrue(Expr e) {
    return e.kind == Expr.Kind.LITERAL && TokenId.key(e.id) == Key.TRUE;
  }

  /** Returns true if {@code e} is the literal {@code false}. */
  static boolean isFalse(Expr e) {
    return e.kind == Expr.Kind.LITERAL && TokenId.key(e.id) == Key.FALSE;
  }

  /** True if e is a binary or associative {@code and}. */
  static boolean isAnd(Expr e) {
    return (e.kind == Expr.Kind.BINARY && e.op == Key.X_BINARY_AND)
        || (e.kind == Expr.Kind.ASSOCIATIVE && e.op == Key.X_ASSOC_AND);
  }

  /** True if e is a binary or associative {@code or}. */
  static boolean isOr(Expr e) {
    return (e.kind == Expr.Kind.BINARY && e.op == Key.X_BINARY_OR)
        || (e.kind == Expr.Kind.ASSOCIATIVE && e.op == Key.X_ASSOC_OR);
  }

  /** The operands of an {@code and} or {@code or}. */
  static ImmutableList<Expr> boolOperands(Expr e) {
    return (e.kind == Expr.Kind.BINARY) ? ImmutableList.of(e.lhs, e.rhs) : e.operands();
  }

  /** Adds the conjuncts of {@code e} (splitting nested {@code and}s) to {@code result}. */
  static void addConjuncts(Expr e, List<Expr> result) {
    if (isAnd(e)) {
      for (Expr operand : boolOperands(e)) {
        addConjuncts(operand, result);
      }
    } else {
      result.add(e);
    }
  }

  /**
   * Returns an Expr that is true exactly when {@code e} is false. Comparisons are inverted in
   * place, double negations removed, and {@code and}/{@code or} rewritten by De Morgan's laws.
   */
  static Expr invert(Expr e) {
    if (e.isComparison()) {
      return Expr.binary(Key.invertComparison(e.op), e.lhs, e.rhs);
    } else if (e.kind == Expr.Kind.UNARY && e.op == Key.X_UNARY_NOT) {
      return e.rhs;
    } else if (isTrue(e)) {
      return bool(false);
    } else if (isFalse(e)) {
      return bool(true);
    } else if (isAnd(e) || isOr(e)) {
      ImmutableList<Expr> inverted =
          boolOperands(e).stream().map(Exprs::invert).collect(ImmutableList.toImmutableList());
      return Expr.associative(isAnd(e) ? Key.X_ASSOC_OR : Key.X_ASSOC_AND, inverted);
    }
    return Expr.unary(Key.X_UNARY_NOT, e);
  }

  /**
   * Returns the same comparison with {@code >} and {@code >=} rewritten as {@code <} and {@code
   * <=} by swapping the operands; other Exprs are returned unchanged.
   */
  static Expr canonical(Expr e) {
    if (e.isComparison()
        && (e.op == Key.X_BINARY_GREATER_THAN || e.op == Key.X_BINARY_GREATER_EQ)) {
      return Expr.binary(Key.swapComparison(e.op), e.rhs, e.lhs);
    }
    return e;
  }

  /**
   * Returns true if {@code fact} implies the comparison {@code goal} purely by their shape (both
   * sides matched structurally). For example {@code a < b} implies {@code a <= b}, {@code b > a}
   * and {@code a != b}.
   */
  static boolean implies(Expr fact, Expr goal) {
    if (!fact.isComparison() || !goal.isComparison()) {
      return fact.equals(goal);
    }
    fact = canonical(fact);
    goal = canonical(goal);
    if (fact.equals(goal)) {
      return true;
    }
    boolean same = fact.lhs.equals(goal.lhs) && fact.rhs.equals(goal.rhs);
    boolean swapped = fact.lhs.equals(goal.rhs) && fact.rhs.equals(goal.lhs);
    return switch (goal.op) {
      case Key.X_BINARY_LESS_EQ ->
          (same && fact.op == Key.X_BINARY_LESS_THAN)
              || ((same || swapped) && fact.op == Key.X_BINARY_EQ_EQ);
      case Key.X_BINARY_NOT_EQ ->
          (same || swapped)
              && (fact.op == Key.X_BINARY_LESS_THAN || fact.op == Key.X_BINARY_NOT_EQ);
      case Key.X_BINARY_EQ_EQ -> swapped && fact.op == Key.X_BINARY_EQ_EQ;
      default -> false;
    };
  }

  /**
   * If {@code fact} is a comparison with {@code e} as one operand, returns the fact rewritten so
   * that {@code e} is its left operand; otherwise returns null.
   */
  static @Nullable Expr orientedFact(Expr fact, Expr e) {
    if (!fact.isComparison()) {
      return null;
    } else if (fact.lhs.equals(e)) {
      return fact;
    } else if (fact.rhs.equals(e)) {
      return Expr.binary(Key.swapComparison(fact.op), fact.rhs, fact.lhs);
    }
    return null;
  }

  private Exprs() {}
}
