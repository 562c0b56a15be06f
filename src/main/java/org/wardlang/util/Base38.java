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

package org.wardlang.util;

/**
 * Converts a 4-character package id, each character one of {@code ' '}, {@code '0'-'9'}, {@code
 * '?'} or {@code 'a'-'z'}, to a number in {@code [0, MAX]}.
 */
public class Base38 {
  // Statics only
  private Base38() {}

  /** The largest encoded value, {@code 38**4 - 1}. */
  public static final int MAX = 38 * 38 * 38 * 38 - 1;

  /** The number of bits needed to represent {@link #MAX}. */
  public static final int MAX_BITS = 21;

  /** Returns the encoding of {@code s}, or -1 if it is not 4 valid characters. */
  public static int encode(String s) {
    if (s.length() != 4) {
      return -1;
    }
    int result = 0;
    for (int i = 0; i < 4; i++) {
      int digit = digit(s.charAt(i));
      if (digit < 0) {
        return -1;
      }
      result = result * 38 + digit;
    }
    return result;
  }

  private static int digit(char c) {
    if (c == ' ') {
      return 0;
    } else if (c >= '0' && c <= '9') {
      return 1 + (c - '0');
    } else if (c == '?') {
      return 11;
    } else if (c >= 'a' && c <= 'z') {
      return 12 + (c - 'a');
    }
    return -1;
  }
}
