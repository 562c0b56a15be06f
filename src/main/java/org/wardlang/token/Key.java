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

import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;

/**
 * A statics-only class defining the built-in token keys and the tables that classify them.
 *
 * <p>The built-in keys are packed into fixed ranges:
 *
 * <ul>
 *   <li>0x01 is the internal "ideal integer" type, which has no source syntax.
 *   <li>0x10-0x1F are punctuation, such as "(" and ";".
 *   <li>0x20-0x3F are assignment operators, such as "=" and "+=".
 *   <li>0x40-0x5F are operators, such as "+", "&lt;=" and "and".
 *   <li>0x60-0x7F are keywords and type constructors.
 *   <li>0x80-0x87 are literals, 0x88-0x8F built-in identifiers and 0x90-0x9F built-in types.
 *   <li>0xC0-0xFF are the disambiguated ("X") operator forms, which are never produced by the
 *       lexer; the parser chooses one once it knows whether an operator is unary, binary or
 *       associative.
 * </ul>
 */
public final class Key {

  // Statics only
  private Key() {}

  /** User-defined names are assigned keys starting at this value. */
  public static final int NUM_BUILT_IN = 0x100;

  public static final int IDEAL = 0x01;

  public static final int OPEN_PAREN = 0x10;
  public static final int CLOSE_PAREN = 0x11;
  public static final int OPEN_BRACKET = 0x12;
  public static final int CLOSE_BRACKET = 0x13;
  public static final int OPEN_CURLY = 0x14;
  public static final int CLOSE_CURLY = 0x15;
  public static final int DOT = 0x16;
  public static final int DOT_DOT = 0x17;
  public static final int DOT_DOT_EQ = 0x18;
  public static final int COMMA = 0x19;
  public static final int EXCLAM = 0x1A;
  public static final int QUESTION = 0x1B;
  public static final int COLON = 0x1C;
  public static final int SEMICOLON = 0x1D;

  public static final int MIN_ASSIGN = 0x20;
  public static final int EQ = 0x20;
  public static final int PLUS_EQ = 0x21;
  public static final int MINUS_EQ = 0x22;
  public static final int STAR_EQ = 0x23;
  public static final int SLASH_EQ = 0x24;
  public static final int SHIFT_L_EQ = 0x25;
  public static final int SHIFT_R_EQ = 0x26;
  public static final int AMP_EQ = 0x27;
  public static final int AMP_HAT_EQ = 0x28;
  public static final int PIPE_EQ = 0x29;
  public static final int HAT_EQ = 0x2A;
  public static final int PERCENT_EQ = 0x2B;
  public static final int MOD_PLUS_EQ = 0x2C;
  public static final int MOD_MINUS_EQ = 0x2D;
  public static final int MOD_STAR_EQ = 0x2E;
  public static final int MOD_SHIFT_L_EQ = 0x2F;
  public static final int SAT_PLUS_EQ = 0x30;
  public static final int SAT_MINUS_EQ = 0x31;
  public static final int MAX_ASSIGN = 0x31;

  public static final int MIN_OP = 0x40;
  public static final int PLUS = 0x40;
  public static final int MINUS = 0x41;
  public static final int STAR = 0x42;
  public static final int SLASH = 0x43;
  public static final int SHIFT_L = 0x44;
  public static final int SHIFT_R = 0x45;
  public static final int AMP = 0x46;
  public static final int AMP_HAT = 0x47;
  public static final int PIPE = 0x48;
  public static final int HAT = 0x49;
  public static final int PERCENT = 0x4A;
  public static final int MOD_PLUS = 0x4B;
  public static final int MOD_MINUS = 0x4C;
  public static final int MOD_STAR = 0x4D;
  public static final int MOD_SHIFT_L = 0x4E;
  public static final int SAT_PLUS = 0x4F;
  public static final int SAT_MINUS = 0x50;
  public static final int NOT_EQ = 0x51;
  public static final int LESS_THAN = 0x52;
  public static final int LESS_EQ = 0x53;
  public static final int EQ_EQ = 0x54;
  public static final int GREATER_EQ = 0x55;
  public static final int GREATER_THAN = 0x56;
  public static final int AND = 0x57;
  public static final int OR = 0x58;
  public static final int NOT = 0x59;
  public static final int AS = 0x5A;
  public static final int MAX_OP = 0x5A;

  public static final int FUNC = 0x60;
  public static final int ASSERT = 0x61;
  public static final int WHILE = 0x62;
  public static final int IF = 0x63;
  public static final int ELSE = 0x64;
  public static final int RETURN = 0x65;
  public static final int BREAK = 0x66;
  public static final int CONTINUE = 0x67;
  public static final int STRUCT = 0x68;
  public static final int USE = 0x69;
  public static final int VAR = 0x6A;
  public static final int PRE = 0x6B;
  public static final int INV = 0x6C;
  public static final int POST = 0x6D;
  public static final int VIA = 0x6E;
  public static final int PUB = 0x6F;
  public static final int PRI = 0x70;
  public static final int PACKAGEID = 0x71;
  public static final int CONST = 0x72;
  public static final int YIELD = 0x73;

  public static final int ARRAY = 0x78;
  public static final int NPTR = 0x79;
  public static final int PTR = 0x7A;
  public static final int SLICE = 0x7B;
  public static final int TABLE = 0x7C;

  public static final int FALSE = 0x80;
  public static final int TRUE = 0x81;
  public static final int ZERO = 0x82;

  public static final int UNDERSCORE = 0x88;
  public static final int THIS = 0x89;
  public static final int BASE = 0x8A;
  public static final int LENGTH = 0x8B;

  public static final int MIN_NUM_TYPE = 0x90;
  public static final int I8 = 0x90;
  public static final int I16 = 0x91;
  public static final int I32 = 0x92;
  public static final int I64 = 0x93;
  public static final int U8 = 0x94;
  public static final int U16 = 0x95;
  public static final int U32 = 0x96;
  public static final int U64 = 0x97;
  public static final int MAX_NUM_TYPE = 0x97;
  public static final int BOOL = 0x98;
  public static final int STATUS = 0x99;

  public static final int MIN_X = 0xC0;
  public static final int X_UNARY_PLUS = 0xC0;
  public static final int X_UNARY_MINUS = 0xC1;
  public static final int X_UNARY_NOT = 0xC2;

  public static final int X_BINARY_PLUS = 0xC3;
  public static final int X_BINARY_MINUS = 0xC4;
  public static final int X_BINARY_STAR = 0xC5;
  public static final int X_BINARY_SLASH = 0xC6;
  public static final int X_BINARY_SHIFT_L = 0xC7;
  public static final int X_BINARY_SHIFT_R = 0xC8;
  public static final int X_BINARY_AMP = 0xC9;
  public static final int X_BINARY_AMP_HAT = 0xCA;
  public static final int X_BINARY_PIPE = 0xCB;
  public static final int X_BINARY_HAT = 0xCC;
  public static final int X_BINARY_PERCENT = 0xCD;
  public static final int X_BINARY_MOD_PLUS = 0xCE;
  public static final int X_BINARY_MOD_MINUS = 0xCF;
  public static final int X_BINARY_MOD_STAR = 0xD0;
  public static final int X_BINARY_MOD_SHIFT_L = 0xD1;
  public static final int X_BINARY_SAT_PLUS = 0xD2;
  public static final int X_BINARY_SAT_MINUS = 0xD3;
  public static final int X_BINARY_NOT_EQ = 0xD4;
  public static final int X_BINARY_LESS_THAN = 0xD5;
  public static final int X_BINARY_LESS_EQ = 0xD6;
  public static final int X_BINARY_EQ_EQ = 0xD7;
  public static final int X_BINARY_GREATER_EQ = 0xD8;
  public static final int X_BINARY_GREATER_THAN = 0xD9;
  public static final int X_BINARY_AND = 0xDA;
  public static final int X_BINARY_OR = 0xDB;
  public static final int X_BINARY_AS = 0xDC;

  public static final int X_ASSOC_PLUS = 0xDD;
  public static final int X_ASSOC_STAR = 0xDE;
  public static final int X_ASSOC_AMP = 0xDF;
  public static final int X_ASSOC_PIPE = 0xE0;
  public static final int X_ASSOC_HAT = 0xE1;
  public static final int X_ASSOC_AND = 0xE2;
  public static final int X_ASSOC_OR = 0xE3;
  public static final int MAX_X = 0xE3;

  private static final String[] NAMES = new String[NUM_BUILT_IN];
  private static final int[] BUILT_IN_IDS = new int[NUM_BUILT_IN];
  private static final int[] UNARY_FORMS = new int[NUM_BUILT_IN];
  private static final int[] BINARY_FORMS = new int[NUM_BUILT_IN];
  private static final int[] ASSOCIATIVE_FORMS = new int[NUM_BUILT_IN];
  private static final boolean[] IMPLICIT_SEMICOLON = new boolean[NUM_BUILT_IN];

  /** Maps the source text of every built-in token to its id. */
  static final ImmutableMap<String, Integer> BY_NAME;

  static {
    ImmutableMap.Builder<String, Integer> builder = ImmutableMap.builder();
    name(builder, IDEAL, "<ideal>", TokenId.FLAG_OTHER);

    String punct = "( ) [ ] { } . .. ..= , ! ? : ;";
    names(builder, OPEN_PAREN, punct, TokenId.FLAG_OTHER);
    String assign =
        "= += -= *= /= <<= >>= &= &^= |= ^= %= ~mod+= ~mod-= ~mod*= ~mod<<= ~sat+= ~sat-=";
    names(builder, MIN_ASSIGN, assign, TokenId.FLAG_OTHER);
    String ops =
        "+ - * / << >> & &^ | ^ % ~mod+ ~mod- ~mod* ~mod<< ~sat+ ~sat-"
            + " != < <= == >= > and or not as";
    names(builder, MIN_OP, ops, TokenId.FLAG_OTHER);
    String keywords =
        "func assert while if else return break continue struct use var pre inv post via pub pri"
            + " packageid const yield";
    names(builder, FUNC, keywords, TokenId.FLAG_OTHER);
    names(builder, ARRAY, "array nptr ptr slice table", TokenId.FLAG_OTHER);
    names(builder, FALSE, "false true", TokenId.FLAG_LITERAL);
    name(builder, ZERO, "0", TokenId.FLAG_LITERAL | TokenId.FLAG_NUM_LITERAL);
    names(builder, UNDERSCORE, "_ this base length", TokenId.FLAG_IDENT);
    names(builder, I8, "i8 i16 i32 i64 u8 u16 u32 u64 bool status", TokenId.FLAG_IDENT);
    BY_NAME = builder.buildOrThrow();

    // The X forms print the same as the operators they were derived from, but are not in BY_NAME.
    xNames(X_UNARY_PLUS, "+ - not");
    xNames(X_BINARY_PLUS, ops.substring(0, ops.indexOf(" not")) + " as");
    xNames(X_ASSOC_PLUS, "+ * & | ^ and or");

    unary(PLUS, X_UNARY_PLUS);
    unary(MINUS, X_UNARY_MINUS);
    unary(NOT, X_UNARY_NOT);
    for (int k = PLUS; k <= OR; k++) {
      binary(k, X_BINARY_PLUS + (k - PLUS));
    }
    binary(AS, X_BINARY_AS);
    // Each compound assignment operator shares the binary form of its operator.
    binary(PLUS_EQ, X_BINARY_PLUS);
    binary(MINUS_EQ, X_BINARY_MINUS);
    binary(STAR_EQ, X_BINARY_STAR);
    binary(SLASH_EQ, X_BINARY_SLASH);
    binary(SHIFT_L_EQ, X_BINARY_SHIFT_L);
    binary(SHIFT_R_EQ, X_BINARY_SHIFT_R);
    binary(AMP_EQ, X_BINARY_AMP);
    binary(AMP_HAT_EQ, X_BINARY_AMP_HAT);
    binary(PIPE_EQ, X_BINARY_PIPE);
    binary(HAT_EQ, X_BINARY_HAT);
    binary(PERCENT_EQ, X_BINARY_PERCENT);
    binary(MOD_PLUS_EQ, X_BINARY_MOD_PLUS);
    binary(MOD_MINUS_EQ, X_BINARY_MOD_MINUS);
    binary(MOD_STAR_EQ, X_BINARY_MOD_STAR);
    binary(MOD_SHIFT_L_EQ, X_BINARY_MOD_SHIFT_L);
    binary(SAT_PLUS_EQ, X_BINARY_SAT_PLUS);
    binary(SAT_MINUS_EQ, X_BINARY_SAT_MINUS);
    associative(PLUS, X_ASSOC_PLUS);
    associative(STAR, X_ASSOC_STAR);
    associative(AMP, X_ASSOC_AMP);
    associative(PIPE, X_ASSOC_PIPE);
    associative(HAT, X_ASSOC_HAT);
    associative(AND, X_ASSOC_AND);
    associative(OR, X_ASSOC_OR);

    for (int k : new int[] {CLOSE_PAREN, CLOSE_BRACKET, CLOSE_CURLY, RETURN, BREAK, CONTINUE}) {
      IMPLICIT_SEMICOLON[k] = true;
    }
  }

  private static void name(
      ImmutableMap.Builder<String, Integer> builder, int key, String name, int flags) {
    NAMES[key] = name;
    BUILT_IN_IDS[key] = TokenId.of(key, flags);
    builder.put(name, BUILT_IN_IDS[key]);
  }

  private static void names(
      ImmutableMap.Builder<String, Integer> builder, int firstKey, String names, int flags) {
    int key = firstKey;
    for (String name : names.split(" ")) {
      name(builder, key++, name, flags);
    }
  }

  private static void xNames(int firstKey, String names) {
    int key = firstKey;
    for (String name : names.split(" ")) {
      NAMES[key] = name;
      BUILT_IN_IDS[key] = TokenId.of(key, TokenId.FLAG_OTHER);
      key++;
    }
  }

  // Each X form is also its own form, so that re-parsing a disambiguated tree is a no-op.

  private static void unary(int key, int xKey) {
    UNARY_FORMS[key] = xKey;
    UNARY_FORMS[xKey] = xKey;
  }

  private static void binary(int key, int xKey) {
    BINARY_FORMS[key] = xKey;
    BINARY_FORMS[xKey] = xKey;
  }

  private static void associative(int key, int xKey) {
    ASSOCIATIVE_FORMS[key] = xKey;
    ASSOCIATIVE_FORMS[xKey] = xKey;
  }

  /** Returns the source text of a built-in key, or null if the key is not built in. */
  static @Nullable String name(int key) {
    return (key > 0 && key < NUM_BUILT_IN) ? NAMES[key] : null;
  }

  static int builtInId(int key) {
    return (key > 0 && key < NUM_BUILT_IN) ? BUILT_IN_IDS[key] : 0;
  }

  /** Returns the unary X form of the given operator key, or zero if it has none. */
  public static int unaryForm(int key) {
    return (key > 0 && key < NUM_BUILT_IN) ? UNARY_FORMS[key] : 0;
  }

  /** Returns the binary X form of the given operator or assignment key, or zero if it has none. */
  public static int binaryForm(int key) {
    return (key > 0 && key < NUM_BUILT_IN) ? BINARY_FORMS[key] : 0;
  }

  /** Returns the associative X form of the given operator key, or zero if it has none. */
  public static int associativeForm(int key) {
    return (key > 0 && key < NUM_BUILT_IN) ? ASSOCIATIVE_FORMS[key] : 0;
  }

  public static boolean isXForm(int key) {
    return key >= MIN_X && key <= MAX_X;
  }

  public static boolean isOpen(int key) {
    return key == OPEN_PAREN || key == OPEN_BRACKET || key == OPEN_CURLY;
  }

  public static boolean isClose(int key) {
    return key == CLOSE_PAREN || key == CLOSE_BRACKET || key == CLOSE_CURLY;
  }

  /** Returns the close key matching an open key. */
  public static int closeFor(int openKey) {
    assert isOpen(openKey);
    return openKey + 1;
  }

  /** True for tokens that are rendered without a space before them. */
  public static boolean isTightLeft(int key) {
    return key == CLOSE_PAREN
        || key == CLOSE_BRACKET
        || key == DOT
        || key == DOT_DOT
        || key == COMMA
        || key == EXCLAM
        || key == QUESTION
        || key == COLON
        || key == SEMICOLON;
  }

  /** True for tokens that are rendered without a space after them. */
  public static boolean isTightRight(int key) {
    return key == OPEN_PAREN || key == OPEN_BRACKET || key == DOT || key == DOT_DOT;
  }

  static boolean isImplicitSemicolon(int key) {
    return key > 0 && key < NUM_BUILT_IN && IMPLICIT_SEMICOLON[key];
  }

  /** Returns true if the given X form key is one of the six comparison operators. */
  public static boolean isComparison(int xKey) {
    return xKey >= X_BINARY_NOT_EQ && xKey <= X_BINARY_GREATER_THAN;
  }

  /**
   * Returns the comparison that holds exactly when the given one does not, e.g. "&lt;" for
   * "&gt;=".
   */
  public static int invertComparison(int xKey) {
    return switch (xKey) {
      case X_BINARY_NOT_EQ -> X_BINARY_EQ_EQ;
      case X_BINARY_LESS_THAN -> X_BINARY_GREATER_EQ;
      case X_BINARY_LESS_EQ -> X_BINARY_GREATER_THAN;
      case X_BINARY_EQ_EQ -> X_BINARY_NOT_EQ;
      case X_BINARY_GREATER_EQ -> X_BINARY_LESS_THAN;
      case X_BINARY_GREATER_THAN -> X_BINARY_LESS_EQ;
      default -> throw new IllegalArgumentException("Not a comparison: " + xKey);
    };
  }

  /** Returns the comparison obtained by swapping its operands (e.g. "&gt;" for "&lt;"). */
  public static int swapComparison(int xKey) {
    return switch (xKey) {
      case X_BINARY_LESS_THAN -> X_BINARY_GREATER_THAN;
      case X_BINARY_LESS_EQ -> X_BINARY_GREATER_EQ;
      case X_BINARY_GREATER_EQ -> X_BINARY_LESS_EQ;
      case X_BINARY_GREATER_THAN -> X_BINARY_LESS_THAN;
      case X_BINARY_NOT_EQ, X_BINARY_EQ_EQ -> xKey;
      default -> throw new IllegalArgumentException("Not a comparison: " + xKey);
    };
  }
}
