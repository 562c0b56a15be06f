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

package org.wardlang.token;

/**
 * A statics-only class for manipulating token ids.
 *
 * <p>A token id is an int that packs a <i>key</i> (the high 16 bits, identifying which token this
 * is) and a set of <i>flags</i> (the low 16 bits, classifying it). Keys below {@link
 * Key#NUM_BUILT_IN} are fixed by {@link Key}; larger keys are assigned by a {@link TokenMap} as
 * names are interned.
 *
 * <p>A valid id always has at least one flag set; if no other class applies, {@link #FLAG_OTHER} is
 * used. Zero is never a valid id.
 */
public final class TokenId {

  // Statics only
  private TokenId() {}

  public static final int FLAG_OTHER = 0x0001;
  public static final int FLAG_LITERAL = 0x0010;
  public static final int FLAG_NUM_LITERAL = 0x0020;
  public static final int FLAG_STR_LITERAL = 0x0040;
  public static final int FLAG_IDENT = 0x0080;

  public static final int FLAG_BITS = 16;
  public static final int FLAG_MASK = (1 << FLAG_BITS) - 1;
  public static final int MAX_KEY = (1 << (32 - FLAG_BITS)) - 1;

  /** Returns the id with the given key and flags. */
  public static int of(int key, int flags) {
    assert key > 0 && key <= MAX_KEY && flags != 0 && (flags & ~FLAG_MASK) == 0;
    return (key << FLAG_BITS) | flags;
  }

  public static int key(int id) {
    return id >>> FLAG_BITS;
  }

  public static int flags(int id) {
    return id & FLAG_MASK;
  }

  public static boolean isBuiltIn(int id) {
    return key(id) < Key.NUM_BUILT_IN;
  }

  public static boolean isLiteral(int id) {
    return (id & FLAG_LITERAL) != 0;
  }

  public static boolean isNumLiteral(int id) {
    return (id & FLAG_NUM_LITERAL) != 0;
  }

  public static boolean isStrLiteral(int id) {
    return (id & FLAG_STR_LITERAL) != 0;
  }

  public static boolean isIdent(int id) {
    return (id & FLAG_IDENT) != 0;
  }

  public static boolean isOpen(int id) {
    return Key.isOpen(key(id));
  }

  public static boolean isClose(int id) {
    return Key.isClose(key(id));
  }

  public static boolean isTightLeft(int id) {
    return Key.isTightLeft(key(id));
  }

  public static boolean isTightRight(int id) {
    return Key.isTightRight(key(id));
  }

  public static boolean isAssign(int id) {
    int k = key(id);
    return k >= Key.MIN_ASSIGN && k <= Key.MAX_ASSIGN;
  }

  public static boolean isNumType(int id) {
    int k = key(id);
    return k >= Key.MIN_NUM_TYPE && k <= Key.MAX_NUM_TYPE;
  }

  /**
   * Returns true if a newline immediately following this token should be treated as the end of a
   * statement.
   */
  public static boolean isImplicitSemicolon(int id) {
    return isLiteral(id) || isIdent(id) || Key.isImplicitSemicolon(key(id));
  }

  /**
   * Returns true if this token can start a unary operator expression (such as {@code -x}), i.e. if
   * it has a unary form.
   */
  public static boolean isUnaryOp(int id) {
    return Key.unaryForm(key(id)) != 0 && !Key.isXForm(key(id));
  }

  public static boolean isBinaryOp(int id) {
    int k = key(id);
    return k >= Key.MIN_OP && k <= Key.MAX_OP && Key.binaryForm(k) != 0;
  }

  public static boolean isAssociativeOp(int id) {
    int k = key(id);
    return k >= Key.MIN_OP && k <= Key.MAX_OP && Key.associativeForm(k) != 0;
  }

  /** Returns the built-in id for the given key; {@code key} must be a built-in key. */
  public static int builtIn(int key) {
    int id = Key.builtInId(key);
    assert id != 0 : key;
    return id;
  }
}
