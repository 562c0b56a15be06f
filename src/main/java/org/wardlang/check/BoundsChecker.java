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
import org.jspecify.annotations.Nullable;
import org.wardlang.ast.Expr;
import org.wardlang.ast.TypeExpr;
import org.wardlang.compiler.CompileError;
import org.wardlang.token.Key;

/**
 * Computes the Range of values each expression may take, given the current facts, and discharges
 * the obligations that make an expression safe to evaluate: arithmetic stays within its type,
 * divisors are non-zero, shift amounts are in range and indices are within their container.
 */
final class BoundsChecker {

  /** Shift amounts beyond this are never given a precise range. */
  private static final int MAX_SHIFT = 64;

  private static final Range U64_RANGE = Range.forNumType(Key.U64);

  private final FuncChecker fc;

  BoundsChecker(FuncChecker fc) {
    this.fc = fc;
  }

  // Ranges

  /** Returns the values {@code e} may have, refined by the current facts. */
  Range rangeOf(Expr e) {
    return rangeOf(e, true);
  }

  private Range rangeOf(Expr e, boolean useFacts) {
    BigInteger c = fc.constValue(e);
    if (c != null) {
      return Range.constant(c);
    }
    Range result = structuralRange(e, useFacts);
    return useFacts ? refine(e, result) : result;
  }

  /**
   * Narrows {@code r} using each fact that compares {@code e} with something else. The other
   * side's range is computed without consulting the facts, which keeps this from recursing.
   */
  private Range refine(Expr e, Range r) {
    for (Expr fact : fc.facts.facts()) {
      Expr f = Exprs.orientedFact(fact, e);
      if (f == null || f.rhs.mentions(e)) {
        continue;
      }
      Range other = rangeOf(f.rhs, false);
      Range narrowed =
          switch (f.op) {
            case Key.X_BINARY_LESS_THAN ->
                (other.hi == null) ? r : r.withHiAtMost(other.hi.subtract(BigInteger.ONE));
            case Key.X_BINARY_LESS_EQ -> (other.hi == null) ? r : r.withHiAtMost(other.hi);
            case Key.X_BINARY_GREATER_THAN ->
                (other.lo == null) ? r : r.withLoAtLeast(other.lo.add(BigInteger.ONE));
            case Key.X_BINARY_GREATER_EQ -> (other.lo == null) ? r : r.withLoAtLeast(other.lo);
            case Key.X_BINARY_EQ_EQ -> r.intersect(other);
            case Key.X_BINARY_NOT_EQ -> excludeEndpoint(r, other);
            default -> r;
          };
      // Contradictory facts mean this point is unreachable; keep the weaker range.
      if (narrowed != null) {
        r = narrowed;
      }
    }
    return r;
  }

  private static Range excludeEndpoint(Range r, Range excluded) {
    if (!excluded.isConstant()) {
      return r;
    }
    BigInteger x = excluded.lo;
    if (x.equals(r.lo)) {
      return r.withLoAtLeast(x.add(BigInteger.ONE));
    } else if (x.equals(r.hi)) {
      return r.withHiAtMost(x.subtract(BigInteger.ONE));
    }
    return r;
  }

  private Range structuralRange(Expr e, boolean useFacts) {
    switch (e.kind) {
      case UNARY -> {
        if (e.op == Key.X_UNARY_NOT) {
          return Range.BOOL;
        }
        Range r = rangeOf(e.rhs, useFacts);
        return (e.op == Key.X_UNARY_MINUS) ? r.negate() : r;
      }
      case BINARY -> {
        if (Key.isComparison(e.op) || e.op == Key.X_BINARY_AND || e.op == Key.X_BINARY_OR) {
          return Range.BOOL;
        }
        return opRange(
            e.op, rangeOf(e.lhs, useFacts), rangeOf(e.rhs, useFacts), typeBounds(e));
      }
      case ASSOCIATIVE -> {
        int op = Checker.assocToBinary(e.op);
        if (op == Key.X_BINARY_AND || op == Key.X_BINARY_OR) {
          return Range.BOOL;
        }
        Range bounds = typeBounds(e);
        ImmutableList<Expr> operands = e.operands();
        Range result = rangeOf(operands.get(0), useFacts);
        for (int i = 1; i < operands.size(); i++) {
          result = opRange(op, result, rangeOf(operands.get(i), useFacts), bounds);
        }
        return result;
      }
      case AS -> {
        return rangeOf(e.lhs, useFacts);
      }
      case CALL -> {
        if (Exprs.isLength(e)) {
          TypeExpr t = FuncChecker.deref(fc.typeOf(e.lhs.lhs));
          if (t.kind == TypeExpr.Kind.ARRAY) {
            BigInteger n = fc.constValue(t.length);
            if (n != null) {
              return Range.constant(n);
            }
          }
          return U64_RANGE;
        }
        return typeBounds(e);
      }
      case SLICE, STATUS -> {
        return Range.IDEAL;
      }
      default -> {
        return typeBounds(e);
      }
    }
  }

  /** The range of {@code e}'s type. */
  private Range typeBounds(Expr e) {
    return fc.checker.typeRange(fc.typeOf(e));
  }

  /**
   * Returns the range of applying a binary operator to operands in the given ranges. If the
   * operator's result cannot be bounded (or wraps) the result is {@code bounds}, the range of
   * the expression's type.
   */
  static Range opRange(int op, Range lhs, Range rhs, Range bounds) {
    switch (op) {
      case Key.X_BINARY_PLUS -> {
        return lhs.add(rhs);
      }
      case Key.X_BINARY_MINUS -> {
        return lhs.subtract(rhs);
      }
      case Key.X_BINARY_STAR -> {
        return lhs.multiply(rhs);
      }
      case Key.X_BINARY_SLASH -> {
        return rhs.contains(BigInteger.ZERO) ? bounds : lhs.divide(rhs);
      }
      case Key.X_BINARY_PERCENT -> {
        return (rhs.lo == null || rhs.lo.signum() <= 0) ? bounds : lhs.remainder(rhs);
      }
      case Key.X_BINARY_SHIFT_L -> {
        return (lhs.isNonNegative() && isShiftRange(rhs)) ? lhs.shiftLeft(rhs) : bounds;
      }
      case Key.X_BINARY_SHIFT_R -> {
        return isShiftRange(rhs) ? lhs.shiftRight(rhs) : bounds;
      }
      case Key.X_BINARY_AMP -> {
        return lhs.and(rhs, bounds);
      }
      case Key.X_BINARY_PIPE, Key.X_BINARY_HAT -> {
        return lhs.orXor(rhs, bounds);
      }
      case Key.X_BINARY_AMP_HAT -> {
        return lhs.andNot(bounds);
      }
      case Key.X_BINARY_MOD_PLUS -> {
        return wrapped(lhs.add(rhs), bounds);
      }
      case Key.X_BINARY_MOD_MINUS -> {
        return wrapped(lhs.subtract(rhs), bounds);
      }
      case Key.X_BINARY_MOD_STAR -> {
        return wrapped(lhs.multiply(rhs), bounds);
      }
      case Key.X_BINARY_MOD_SHIFT_L -> {
        return (lhs.isNonNegative() && isShiftRange(rhs))
            ? wrapped(lhs.shiftLeft(rhs), bounds)
            : bounds;
      }
      case Key.X_BINARY_SAT_PLUS -> {
        return lhs.add(rhs).saturate(bounds);
      }
      case Key.X_BINARY_SAT_MINUS -> {
        return lhs.subtract(rhs).saturate(bounds);
      }
      default -> {
        return bounds;
      }
    }
  }

  private static boolean isShiftRange(Range r) {
    return r.isNonNegative()
        && r.isBounded()
        && r.hi.compareTo(BigInteger.valueOf(MAX_SHIFT)) <= 0;
  }

  /** Modular arithmetic is exact when it doesn't wrap. */
  private static Range wrapped(Range exact, Range bounds) {
    return bounds.containsAll(exact) ? exact : bounds;
  }

  // Proofs

  /** Returns true if {@code goal} follows from the current facts. */
  boolean prove(Expr goal) {
    BigInteger c = fc.constValue(goal);
    if (c != null) {
      return c.signum() != 0;
    } else if (fc.facts.contains(goal)) {
      return true;
    } else if (Exprs.isAnd(goal)) {
      return Exprs.boolOperands(goal).stream().allMatch(this::prove);
    } else if (Exprs.isOr(goal)) {
      return Exprs.boolOperands(goal).stream().anyMatch(this::prove);
    } else if (goal.kind == Expr.Kind.UNARY && goal.op == Key.X_UNARY_NOT) {
      Expr inverted = Exprs.invert(goal.rhs);
      return !inverted.equals(goal) && prove(inverted);
    } else if (goal.isComparison()) {
      return proveComparison(goal) || proveByChain(Exprs.canonical(goal));
    }
    return false;
  }

  private boolean proveComparison(Expr goal) {
    for (Expr fact : fc.facts.facts()) {
      if (Exprs.implies(fact, goal)) {
        return true;
      }
    }
    return proveByRange(goal);
  }

  /** Proves a comparison by comparing the ranges of its two sides. */
  private boolean proveByRange(Expr goal) {
    goal = Exprs.canonical(goal);
    Range lhs = rangeOf(goal.lhs);
    Range rhs = rangeOf(goal.rhs);
    return switch (goal.op) {
      case Key.X_BINARY_LESS_THAN ->
          lhs.hi != null && rhs.lo != null && lhs.hi.compareTo(rhs.lo) < 0;
      case Key.X_BINARY_LESS_EQ ->
          lhs.hi != null && rhs.lo != null && lhs.hi.compareTo(rhs.lo) <= 0;
      case Key.X_BINARY_EQ_EQ -> lhs.isConstant() && lhs.equals(rhs);
      case Key.X_BINARY_NOT_EQ -> lhs.intersect(rhs) == null;
      default -> false;
    };
  }

  /**
   * Proves {@code a < c} or {@code a <= c} from a fact relating {@code a} to some {@code b} and a
   * proof that {@code b} is suitably related to {@code c}. Only one intermediate step is tried.
   */
  private boolean proveByChain(Expr goal) {
    if (goal.op != Key.X_BINARY_LESS_THAN && goal.op != Key.X_BINARY_LESS_EQ) {
      return false;
    }
    for (Expr fact : fc.facts.facts()) {
      Expr f = Exprs.orientedFact(fact, goal.lhs);
      if (f == null || f.rhs.equals(goal.rhs)) {
        continue;
      }
      int nextOp;
      if (f.op == Key.X_BINARY_LESS_THAN) {
        nextOp = Key.X_BINARY_LESS_EQ;
      } else if (f.op == Key.X_BINARY_LESS_EQ || f.op == Key.X_BINARY_EQ_EQ) {
        nextOp = goal.op;
      } else {
        continue;
      }
      if (proveComparison(Exprs.compare(nextOp, f.rhs, goal.rhs))) {
        return true;
      }
    }
    return false;
  }

  /** Throws a CompileError unless {@code goal} can be proved. */
  void require(Expr goal, String context) {
    if (!prove(goal)) {
      throw cannotProve(goal, context);
    }
  }

  CompileError cannotProve(Expr goal, String context) {
    return fc.error(
        "cannot prove \"%s\"%s%s",
        goal.str(fc.map),
        context.isEmpty() ? "" : " (" + context + ")",
        factsSuffix());
  }

  /** Describes the current facts, for error messages. */
  String factsSuffix() {
    return fc.facts.isEmpty() ? "" : "; facts: " + fc.facts.str(fc.map);
  }

  /** Throws a CompileError unless every possible value of {@code e} is within {@code bounds}. */
  void requireWithin(Expr e, Range bounds) {
    Range r = rangeOf(e);
    if (!bounds.containsAll(r)) {
      throw fc.error(
          "expression \"%s\" bounds %s is not within bounds %s", e.str(fc.map), r, bounds);
    }
  }

  // Obligations

  /** Checks that evaluating {@code e} is safe, given the current facts. */
  void checkExpr(Expr e) {
    if (fc.constValue(e) != null) {
      return;
    }
    switch (e.kind) {
      case UNARY -> {
        checkExpr(e.rhs);
        if (e.op == Key.X_UNARY_MINUS) {
          requireFits(e);
        }
      }
      case BINARY -> checkBinary(e);
      case ASSOCIATIVE -> checkAssociative(e);
      case AS -> {
        checkExpr(e.lhs);
        requireWithin(e.lhs, typeBounds(e));
      }
      case CALL -> fc.checkCall(e);
      case SELECT -> checkExpr(e.lhs);
      case INDEX -> {
        checkExpr(e.lhs);
        checkExpr(e.rhs);
        Expr zero = Exprs.constant(fc.map, BigInteger.ZERO);
        require(Exprs.compare(Key.X_BINARY_LESS_EQ, zero, e.rhs), "index of " + e.str(fc.map));
        require(
            Exprs.compare(Key.X_BINARY_LESS_THAN, e.rhs, Exprs.length(e.lhs)),
            "index of " + e.str(fc.map));
      }
      case SLICE -> checkSlice(e);
      default -> {}
    }
  }

  private void checkSlice(Expr e) {
    checkExpr(e.lhs);
    String context = "slice " + e.str(fc.map);
    Expr zero = Exprs.constant(fc.map, BigInteger.ZERO);
    Expr lo = (e.mhs == null) ? zero : e.mhs;
    Expr hi = (e.rhs == null) ? Exprs.length(e.lhs) : e.rhs;
    if (e.mhs != null) {
      checkExpr(e.mhs);
      require(Exprs.compare(Key.X_BINARY_LESS_EQ, zero, lo), context);
    }
    if (e.rhs != null) {
      checkExpr(e.rhs);
      require(Exprs.compare(Key.X_BINARY_LESS_EQ, hi, Exprs.length(e.lhs)), context);
    }
    if (e.mhs != null || e.rhs != null) {
      require(Exprs.compare(Key.X_BINARY_LESS_EQ, lo, hi), context);
    }
  }

  private void checkBinary(Expr e) {
    if (e.op == Key.X_BINARY_AND || e.op == Key.X_BINARY_OR) {
      checkExpr(e.lhs);
      checkConditionally(e.rhs, (e.op == Key.X_BINARY_AND) ? e.lhs : Exprs.invert(e.lhs));
      return;
    }
    checkExpr(e.lhs);
    checkExpr(e.rhs);
    if (Key.isComparison(e.op)) {
      return;
    }
    switch (e.op) {
      case Key.X_BINARY_SLASH -> {
        Range r = rangeOf(e.rhs);
        if (r.contains(BigInteger.ZERO)) {
          throw fc.error("divisor \"%s\" bounds %s may be zero", e.rhs.str(fc.map), r);
        }
      }
      case Key.X_BINARY_PERCENT -> {
        Range r = rangeOf(e.rhs);
        if (r.lo == null || r.lo.signum() <= 0) {
          throw fc.error("divisor \"%s\" bounds %s is not positive", e.rhs.str(fc.map), r);
        }
      }
      case Key.X_BINARY_SHIFT_L, Key.X_BINARY_SHIFT_R, Key.X_BINARY_MOD_SHIFT_L -> checkShift(e);
      default -> {}
    }
    if (e.op < Key.X_BINARY_MOD_PLUS || e.op > Key.X_BINARY_SAT_MINUS) {
      requireFits(e);
    }
  }

  private void checkShift(Expr e) {
    TypeExpr t = fc.typeOf(e.lhs);
    int width = t.isNumType() ? Range.bitWidth(t.nameKey()) : MAX_SHIFT;
    Range allowed = Range.of(0, width - 1);
    Range amount = rangeOf(e.rhs);
    if (!allowed.containsAll(amount)) {
      throw fc.error(
          "shift amount \"%s\" bounds %s is not within bounds %s",
          e.rhs.str(fc.map),
          amount,
          allowed);
    }
    if (e.op != Key.X_BINARY_SHIFT_R) {
      Range value = rangeOf(e.lhs);
      if (!value.isNonNegative()) {
        throw fc.error("shifted value \"%s\" bounds %s may be negative", e.lhs.str(fc.map), value);
      }
    }
  }

  private void checkAssociative(Expr e) {
    int op = Checker.assocToBinary(e.op);
    ImmutableList<Expr> operands = e.operands();
    if (op == Key.X_BINARY_AND || op == Key.X_BINARY_OR) {
      checkExpr(operands.get(0));
      for (int i = 1; i < operands.size(); i++) {
        Expr prefix = operands.get(i - 1);
        Expr condition = (op == Key.X_BINARY_AND) ? prefix : Exprs.invert(prefix);
        checkConditionally(operands.get(i), condition);
      }
      return;
    }
    operands.forEach(this::checkExpr);
    Range bounds = typeBounds(e);
    Expr partial = operands.get(0);
    Range acc = rangeOf(partial);
    for (int i = 1; i < operands.size(); i++) {
      partial = Expr.binary(op, partial, operands.get(i));
      acc = opRange(op, acc, rangeOf(operands.get(i)), bounds);
      if (!bounds.containsAll(acc)) {
        throw fc.error(
            "expression \"%s\" bounds %s is not within bounds %s",
            partial.str(fc.map),
            acc,
            bounds);
      }
    }
  }

  /**
   * Checks {@code e}, which is only evaluated when {@code condition} holds (the right operand of
   * {@code and} or {@code or}).
   */
  private void checkConditionally(Expr e, Expr condition) {
    FactSet saved = fc.facts.copy();
    fc.facts.add(condition);
    checkExpr(e);
    fc.facts = saved;
  }

  /** Arithmetic on a number type must not overflow it. */
  private void requireFits(Expr e) {
    TypeExpr t = fc.typeOf(e);
    if (t.isNumType()) {
      requireWithin(e, fc.checker.typeRange(t.unrefined()));
    }
  }

  // Simplification

  /**
   * Returns an equivalent Expr with constant arithmetic sub-expressions replaced by their values
   * and nested constant offsets combined, e.g. {@code (n + 1) + 2} becomes {@code n + 3}.
   */
  Expr simplify(Expr e) {
    return combineOffsets(e.transform(this::foldConstant));
  }

  private @Nullable Expr foldConstant(Expr e) {
    boolean arithmetic =
        switch (e.kind) {
          case UNARY -> e.op != Key.X_UNARY_NOT;
          case BINARY -> !Key.isComparison(e.op)
              && e.op != Key.X_BINARY_AND
              && e.op != Key.X_BINARY_OR;
          case ASSOCIATIVE -> e.op != Key.X_ASSOC_AND && e.op != Key.X_ASSOC_OR;
          default -> false;
        };
    if (!arithmetic) {
      return null;
    }
    BigInteger value = fc.constValue(e);
    return (value == null) ? null : Exprs.constant(fc.map, value);
  }

  private Expr combineOffsets(Expr e) {
    BigInteger c2 = offset(e);
    if (c2 == null) {
      return e;
    }
    Expr base = e.lhs;
    BigInteger c1 = offset(base);
    if (c1 != null) {
      base = base.lhs;
      c2 = c2.add(c1);
    }
    if (c2.signum() == 0) {
      return base;
    } else if (c2.signum() > 0) {
      return Expr.binary(Key.X_BINARY_PLUS, base, Exprs.constant(fc.map, c2));
    }
    return Expr.binary(Key.X_BINARY_MINUS, base, Exprs.constant(fc.map, c2.negate()));
  }

  /** If {@code e} is {@code x + c} or {@code x - c} for a constant c, returns c or -c. */
  private @Nullable BigInteger offset(Expr e) {
    if (e.kind != Expr.Kind.BINARY
        || (e.op != Key.X_BINARY_PLUS && e.op != Key.X_BINARY_MINUS)) {
      return null;
    }
    BigInteger c = fc.constValue(e.rhs);
    if (c == null) {
      return null;
    }
    return (e.op == Key.X_BINARY_PLUS) ? c : c.negate();
  }
}
