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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.math.BigInteger;
import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.wardlang.token.Key;

@RunWith(JUnitParamsRunner.class)
public class RangeTest {

  private static final Range U8 = Range.forNumType(Key.U8);

  private static BigInteger big(long x) {
    return BigInteger.valueOf(x);
  }

  @Test
  public void numTypes() {
    assertThat(U8).isEqualTo(Range.of(0, 255));
    assertThat(Range.forNumType(Key.I8)).isEqualTo(Range.of(-128, 127));
    assertThat(Range.forNumType(Key.U64).hi).isEqualTo(Range.bitMask(64));
    assertThat(Range.forNumType(Key.BOOL)).isEqualTo(Range.BOOL);
    assertThat(Range.bitWidth(Key.U32)).isEqualTo(32);
    assertThat(Range.bitWidth(Key.I16)).isEqualTo(16);
  }

  @Test
  public void containment() {
    assertThat(U8.contains(big(255))).isTrue();
    assertThat(U8.contains(big(256))).isFalse();
    assertThat(U8.containsAll(Range.of(3, 7))).isTrue();
    assertThat(U8.containsAll(Range.of(3, 700))).isFalse();
    assertThat(U8.containsAll(Range.IDEAL)).isFalse();
    assertThat(Range.IDEAL.containsAll(U8)).isTrue();
    assertThat(Range.of(0, 3).intersect(Range.of(5, 7))).isNull();
    assertThat(Range.of(0, 5).intersect(Range.of(3, 7))).isEqualTo(Range.of(3, 5));
    assertThat(Range.of(0, 1).union(Range.of(5, 7))).isEqualTo(Range.of(0, 7));
  }

  private static Object[] sums() {
    return new Object[] {
      new Object[] {0, 10, 0, 10, 0, 20},
      new Object[] {-5, 5, 1, 1, -4, 6},
      new Object[] {0, 200, 0, 200, 0, 400},
    };
  }

  @Test
  @Parameters(method = "sums")
  public void add(int lo1, int hi1, int lo2, int hi2, int lo, int hi) {
    assertThat(Range.of(lo1, hi1).add(Range.of(lo2, hi2))).isEqualTo(Range.of(lo, hi));
  }

  private static Object[] products() {
    return new Object[] {
      new Object[] {0, 10, 0, 10, 0, 100},
      new Object[] {-3, 2, -5, 4, -12, 15},
      new Object[] {-3, -2, 4, 5, -15, -8},
    };
  }

  @Test
  @Parameters(method = "products")
  public void multiply(int lo1, int hi1, int lo2, int hi2, int lo, int hi) {
    assertThat(Range.of(lo1, hi1).multiply(Range.of(lo2, hi2))).isEqualTo(Range.of(lo, hi));
  }

  @Test
  public void multiplyByZeroIsZero() {
    assertThat(Range.IDEAL.multiply(Range.of(0, 0))).isEqualTo(Range.of(0, 0));
    assertThat(Range.IDEAL.multiply(Range.of(1, 2))).isEqualTo(Range.IDEAL);
  }

  @Test
  public void subtract() {
    assertThat(Range.of(0, 10).subtract(Range.of(1, 3))).isEqualTo(Range.of(-3, 9));
    assertThat(Range.of(2, 4).negate()).isEqualTo(Range.of(-4, -2));
  }

  @Test
  public void divide() {
    assertThat(Range.of(0, 100).divide(Range.of(3, 5))).isEqualTo(Range.of(0, 33));
    assertThat(Range.of(-7, 7).divide(Range.of(2, 2))).isEqualTo(Range.of(-3, 3));
    assertThrows(IllegalArgumentException.class, () -> U8.divide(Range.of(0, 4)));
  }

  @Test
  public void remainder() {
    assertThat(U8.remainder(Range.of(1, 16))).isEqualTo(Range.of(0, 15));
    assertThat(Range.of(0, 4).remainder(Range.of(10, 10))).isEqualTo(Range.of(0, 4));
    assertThat(Range.of(-9, 9).remainder(Range.of(4, 4))).isEqualTo(Range.of(-3, 3));
  }

  @Test
  public void shifts() {
    assertThat(Range.of(1, 3).shiftLeft(Range.of(0, 2))).isEqualTo(Range.of(1, 12));
    assertThat(Range.of(300, 300).shiftRight(Range.of(6, 6))).isEqualTo(Range.of(4, 4));
    assertThat(Range.of(-8, 8).shiftRight(Range.of(1, 2))).isEqualTo(Range.of(-4, 4));
  }

  @Test
  public void bitwise() {
    Range u16 = Range.forNumType(Key.U16);
    assertThat(Range.of(0, 300).and(Range.of(0, 15), u16)).isEqualTo(Range.of(0, 15));
    assertThat(Range.of(-1, 1).and(Range.of(-1, 1), u16)).isEqualTo(u16);
    assertThat(Range.of(0, 5).orXor(Range.of(0, 16), u16)).isEqualTo(Range.of(0, 31));
    assertThat(Range.of(0, 9).andNot(u16)).isEqualTo(Range.of(0, 9));
  }

  @Test
  public void saturate() {
    assertThat(Range.of(100, 400).saturate(U8)).isEqualTo(Range.of(100, 255));
    assertThat(Range.of(-5, 10).saturate(U8)).isEqualTo(Range.of(0, 10));
  }

  @Test
  public void render() {
    assertThat(Range.of(0, 20).toString()).isEqualTo("[0 ..= 20]");
    assertThat(Range.of(null, big(3)).toString()).isEqualTo("[..= 3]");
    assertThat(Range.IDEAL.toString()).isEqualTo("[..=]");
  }
}
