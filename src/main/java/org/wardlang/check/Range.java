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

import com.google.common.base.Preconditions;
import java.math.BigInteger;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.wardlang.token.Key;

/**
 * A closed interval of (mathematical) integers. Either bound may be null, meaning that the range is
 * unbounded in that direction; the fully unbounded range is the domain of ideal integers.
 *
 * <p>The arithmetic methods return the smallest Range containing every result of applying the
 * operation to members of the operand Ranges, computed with unbounded precision (so they never
 * overflow); whether that result fits a machine type is the caller's concern.
 */
public final class Range {

  public static final Range IDEAL = new Range(null, null);
  public static final Range BOOL = of(0, 1);

  /** The (inclusive) lower bound, or null if unbounded below. */
  public final @Nullable BigInteger lo;

  /** The (inclusive) upper bound, or null if unbounded above. */
  public final @Nullable BigInteger hi;

  private Range(@Nullable BigInteger lo, @Nullable BigInteger hi) {
    this.lo = lo;
    this.hi = hi;
  }

  /** Returns the range {@code [lo, hi]}; requires {@code lo <= hi} if both are non-null. */
  public static Range of(@Nullable BigInteger lo, @Nullable BigInteger hi) {
    Preconditions.checkArgument(lo == null || hi == null || lo.compareTo(hi) <= 0, "empty range");
    return new Range(lo, hi);
  }

  public static Range of(long lo, long hi) {
    return of(BigInteger.valueOf(lo), BigInteger.valueOf(hi));
  }

  public static Range constant(BigInteger value) {
    return new Range(value, value);
  }

  /**
   * Returns the range of the given built-in number type key (e.g. {@link Key#U8} is {@code [0,
   * 255]}), or {@link #BOOL} for {@link Key#BOOL}.
   */
  public static Range forNumType(int key) {
    if (key == Key.BOOL) {
      return BOOL;
    }
    Preconditions.checkArgument(key >= Key.MIN_NUM_TYPE && key <= Key.MAX_NUM_TYPE);
    int bits = bitWidth(key);
    if (key >= Key.U8) {
      return of(BigInteger.ZERO, BigInteger.ONE.shiftLeft(bits).subtract(BigInteger.ONE));
    }
    BigInteger half = BigInteger.ONE.shiftLeft(bits - 1);
    return of(half.negate(), half.subtract(BigInteger.ONE));
  }

  /** The number of bits in a built-in number type. */
  public static int bitWidth(int numTypeKey) {
    return 8 << ((numTypeKey - Key.MIN_NUM_TYPE) & 3);
  }

  /** Returns {@code 2**bitLength - 1}, the smallest all-ones value with that many bits. */
  public static BigInteger bitMask(int bitLength) {
    return BigInteger.ONE.shiftLeft(bitLength).subtract(BigInteger.ONE);
  }

  public boolean isBounded() {
    return lo != null && hi != null;
  }

  public boolean isConstant() {
    return isBounded() && lo.equals(hi);
  }

  /** True if every member of this range is at least zero. */
  public boolean isNonNegative() {
    return lo != null && lo.signum() >= 0;
  }

  public boolean contains(BigInteger x) {
    return (lo == null || lo.compareTo(x) <= 0) && (hi == null || hi.compareTo(x) >= 0);
  }

  /** Returns true if every member of {@code other} is a member of this range. */
  public boolean containsAll(Range other) {
    boolean loOk = (lo == null) || (other.lo != null && lo.compareTo(other.lo) <= 0);
    boolean hiOk = (hi == null) || (other.hi != null && hi.compareTo(other.hi) >= 0);
    return loOk && hiOk;
  }

  /**
   * Returns the intersection of this range and {@code other}, or null if they do not intersect.
   */
  public @Nullable Range intersect(Range other) {
    BigInteger newLo = max(lo, other.lo);
    BigInteger newHi = min(hi, other.hi);
    if (newLo != null && newHi != null && newLo.compareTo(newHi) > 0) {
      return null;
    }
    return new Range(newLo, newHi);
  }

  /** Returns the smallest range containing both this range and {@code other}. */
  public Range union(Range other) {
    BigInteger newLo = (lo == null || other.lo == null) ? null : lo.min(other.lo);
    BigInteger newHi = (hi == null || other.hi == null) ? null : hi.max(other.hi);
    return new Range(newLo, newHi);
  }

  /** Returns this range with its upper bound lowered to at most {@code bound}, or null if empty. */
  @Nullable Range withHiAtMost(BigInteger bound) {
    return intersect(new Range(null, bound));
  }

  /** Returns this range with its lower bound raised to at least {@code bound}, or null if empty. */
  @Nullable Range withLoAtLeast(BigInteger bound) {
    return intersect(new Range(bound, null));
  }

  /** Returns the nearest member of this range to {@code x}. */
  BigInteger clamp(BigInteger x) {
    if (lo != null && x.compareTo(lo) < 0) {
      return lo;
    } else if (hi != null && x.compareTo(hi) > 0) {
      return hi;
    }
    return x;
  }

  public Range negate() {
    return new Range(hi == null ? null : hi.negate(), lo == null ? null : lo.negate());
  }

  public Range add(Range other) {
    return new Range(
        (lo == null || other.lo == null) ? null : lo.add(other.lo),
        (hi == null || other.hi == null) ? null : hi.add(other.hi));
  }

  public Range subtract(Range other) {
    return add(other.negate());
  }

  /** Multiplication takes the extremes of the four cross products. */
  public Range multiply(Range other) {
    if (isZero() || other.isZero()) {
      return constant(BigInteger.ZERO);
    } else if (!isBounded() || !other.isBounded()) {
      return IDEAL;
    }
    BigInteger a = lo.multiply(other.lo);
    BigInteger b = lo.multiply(other.hi);
    BigInteger c = hi.multiply(other.lo);
    BigInteger d = hi.multiply(other.hi);
    return new Range(a.min(b).min(c.min(d)), a.max(b).max(c.max(d)));
  }

  /**
   * Truncating division. The divisor must not contain zero, so each quotient is monotonic in both
   * operands and the extremes are among the four corner quotients.
   */
  public Range divide(Range divisor) {
    Preconditions.checkArgument(!divisor.contains(BigInteger.ZERO), "division by zero");
    if (!isBounded() || !divisor.isBounded()) {
      return IDEAL;
    }
    BigInteger a = lo.divide(divisor.lo);
    BigInteger b = lo.divide(divisor.hi);
    BigInteger c = hi.divide(divisor.lo);
    BigInteger d = hi.divide(divisor.hi);
    return new Range(a.min(b).min(c.min(d)), a.max(b).max(c.max(d)));
  }

  /** Remainder with a positive divisor; the result has the sign of the dividend. */
  public Range remainder(Range divisor) {
    Preconditions.checkArgument(divisor.lo != null && divisor.lo.signum() > 0);
    if (divisor.hi == null) {
      return isNonNegative() ? new Range(BigInteger.ZERO, hi) : this;
    }
    BigInteger maxAbs = divisor.hi.subtract(BigInteger.ONE);
    if (isNonNegative()) {
      return new Range(BigInteger.ZERO, min(hi, maxAbs));
    }
    return new Range(maxAbs.negate(), maxAbs);
  }

  /** Left shift of a non-negative range by a non-negative, bounded shift amount. */
  public Range shiftLeft(Range shift) {
    Preconditions.checkArgument(isNonNegative() && shift.isNonNegative() && shift.isBounded());
    return new Range(
        lo.shiftLeft(shift.lo.intValueExact()),
        (hi == null) ? null : hi.shiftLeft(shift.hi.intValueExact()));
  }

  /** Arithmetic (flooring) right shift by a non-negative, bounded shift amount. */
  public Range shiftRight(Range shift) {
    Preconditions.checkArgument(shift.isNonNegative() && shift.isBounded());
    int sLo = shift.lo.intValueExact();
    int sHi = shift.hi.intValueExact();
    BigInteger newLo = (lo == null) ? null : lo.shiftRight(lo.signum() < 0 ? sLo : sHi);
    BigInteger newHi = (hi == null) ? null : hi.shiftRight(hi.signum() < 0 ? sHi : sLo);
    return new Range(newLo, newHi);
  }

  /**
   * Bitwise and. Only non-negative operands give a useful bound; otherwise the result is the given
   * fallback (the operand type's range).
   */
  public Range and(Range other, Range fallback) {
    if (isNonNegative() && other.isNonNegative()) {
      return new Range(BigInteger.ZERO, min(hi, other.hi));
    } else if (isNonNegative()) {
      return new Range(BigInteger.ZERO, hi);
    } else if (other.isNonNegative()) {
      return new Range(BigInteger.ZERO, other.hi);
    }
    return fallback;
  }

  /** Bitwise or or xor: both bounded by the all-ones value as wide as the wider operand. */
  public Range orXor(Range other, Range fallback) {
    if (isNonNegative() && other.isNonNegative() && hi != null && other.hi != null) {
      int bits = Math.max(hi.bitLength(), other.hi.bitLength());
      return new Range(BigInteger.ZERO, bitMask(bits));
    }
    return fallback;
  }

  /** Bitwise and-not ({@code &^}): never larger than a non-negative left operand. */
  public Range andNot(Range fallback) {
    return isNonNegative() ? new Range(BigInteger.ZERO, hi) : fallback;
  }

  /** Saturating arithmetic: the exact result range clamped to {@code bounds}. */
  public Range saturate(Range bounds) {
    BigInteger newLo = (lo == null) ? bounds.lo : bounds.clamp(lo);
    BigInteger newHi = (hi == null) ? bounds.hi : bounds.clamp(hi);
    return new Range(newLo, newHi);
  }

  private boolean isZero() {
    return isConstant() && lo.signum() == 0;
  }

  private static @Nullable BigInteger max(@Nullable BigInteger x, @Nullable BigInteger y) {
    return (x == null) ? y : (y == null) ? x : x.max(y);
  }

  private static @Nullable BigInteger min(@Nullable BigInteger x, @Nullable BigInteger y) {
    return (x == null) ? y : (y == null) ? x : x.min(y);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Range other
        && Objects.equals(lo, other.lo)
        && Objects.equals(hi, other.hi);
  }

  @Override
  public int hashCode() {
    return Objects.hash(lo, hi);
  }

  /** Returns e.g. "[0 ..= 20]"; unbounded ends are omitted. */
  @Override
  public String toString() {
    return "["
        + (lo == null ? "" : lo + " ")
        + "..="
        + (hi == null ? "" : " " + hi)
        + "]";
  }
}
