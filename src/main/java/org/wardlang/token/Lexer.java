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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.FormatMethod;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import org.wardlang.compiler.CompileError;

/** Turns Ward source bytes into a sequence of Tokens. */
public final class Lexer {

  // Static methods only
  private Lexer() {}

  static final int MAX_TOKEN_SIZE = 1023;
  static final int MAX_LINE = 1048575;

  /** Punctuation that is always a single byte. */
  private static final ImmutableMap<Byte, Integer> SINGLE_BYTE =
      ImmutableMap.<Byte, Integer>builder()
          .put((byte) '(', Key.OPEN_PAREN)
          .put((byte) ')', Key.CLOSE_PAREN)
          .put((byte) '[', Key.OPEN_BRACKET)
          .put((byte) ']', Key.CLOSE_BRACKET)
          .put((byte) '{', Key.OPEN_CURLY)
          .put((byte) '}', Key.CLOSE_CURLY)
          .put((byte) ',', Key.COMMA)
          .put((byte) '?', Key.QUESTION)
          .put((byte) ':', Key.COLON)
          .put((byte) ';', Key.SEMICOLON)
          .buildOrThrow();

  /**
   * For each byte that may start a multi-byte operator, the candidate operators in the order they
   * are tried. The first match wins, so each list puts longer operators before their prefixes.
   */
  private static final ImmutableMap<Byte, ImmutableList<String>> SQUIGGLES =
      ImmutableMap.<Byte, ImmutableList<String>>builder()
          .put((byte) '.', ImmutableList.of("..=", "..", "."))
          .put((byte) '!', ImmutableList.of("!=", "!"))
          .put((byte) '&', ImmutableList.of("&^=", "&^", "&=", "&"))
          .put((byte) '|', ImmutableList.of("|=", "|"))
          .put((byte) '^', ImmutableList.of("^=", "^"))
          .put((byte) '+', ImmutableList.of("+=", "+"))
          .put((byte) '-', ImmutableList.of("-=", "-"))
          .put((byte) '*', ImmutableList.of("*=", "*"))
          .put((byte) '/', ImmutableList.of("/=", "/"))
          .put((byte) '%', ImmutableList.of("%=", "%"))
          .put((byte) '=', ImmutableList.of("==", "="))
          .put((byte) '<', ImmutableList.of("<<=", "<<", "<=", "<"))
          .put((byte) '>', ImmutableList.of(">>=", ">>", ">=", ">"))
          .put(
              (byte) '~',
              ImmutableList.of(
                  "~mod<<=", "~mod<<", "~mod+=", "~mod+", "~mod-=", "~mod-", "~mod*=", "~mod*",
                  "~sat+=", "~sat+", "~sat-=", "~sat-"))
          .buildOrThrow();

  /**
   * Tokenizes the given source. An implicit semicolon is inserted at each newline (and at the end
   * of the input) that follows a token for which {@link TokenId#isImplicitSemicolon} is true.
   *
   * @param map the shared intern table; new identifiers and literals are added to it
   * @param filename used only in error messages
   */
  public static ImmutableList<Token> tokenize(TokenMap map, String filename, byte[] src) {
    return new Lexer.State(map, filename, src).run();
  }

  private static class State {
    final TokenMap map;
    final String filename;
    final byte[] src;
    final ImmutableList.Builder<Token> tokens = ImmutableList.builder();
    final Deque<Token> open = new ArrayDeque<>();
    int line = 1;
    int lastId;

    State(TokenMap map, String filename, byte[] src) {
      this.map = map;
      this.filename = filename;
      this.src = src;
    }

    ImmutableList<Token> run() {
      int i = 0;
      while (i < src.length) {
        byte c = src[i];
        if (c == ' ' || c == '\t' || c == '\r') {
          i++;
        } else if (c == '\n') {
          implicitSemicolon();
          if (++line > MAX_LINE) {
            throw error("too many lines in one source file");
          }
          i++;
        } else if (c == '"' || c == '\'') {
          i = string(i);
        } else if (isAlpha(c)) {
          int j = i + 1;
          while (j < src.length && isAlphaNumeric(src[j])) {
            j++;
          }
          emit(map.intern(text(i, j)));
          i = j;
        } else if (isDigit(c)) {
          i = number(i);
        } else if (c == '/' && i + 1 < src.length && src[i + 1] == '/') {
          while (i < src.length && src[i] != '\n') {
            i++;
          }
        } else {
          i = squiggle(i);
        }
      }
      implicitSemicolon();
      if (!open.isEmpty()) {
        Token unclosed = open.peek();
        line = unclosed.line();
        throw error("unclosed \"%s\"", map.name(unclosed.id()));
      }
      return tokens.build();
    }

    private void implicitSemicolon() {
      if (lastId != 0 && TokenId.isImplicitSemicolon(lastId)) {
        emit(TokenId.builtIn(Key.SEMICOLON));
      }
    }

    private void emit(int id) {
      Token token = new Token(id, line);
      int key = token.key();
      if (Key.isOpen(key)) {
        open.push(token);
      } else if (Key.isClose(key)) {
        Token opener = open.poll();
        if (opener == null || Key.closeFor(opener.key()) != key) {
          throw error("unbalanced \"%s\"", map.name(id));
        }
      }
      tokens.add(token);
      lastId = id;
    }

    private int string(int start) {
      byte quote = src[start];
      int i = start + 1;
      for (; ; i++) {
        if (i >= src.length || src[i] == '\n') {
          throw error("unterminated string literal");
        }
        byte c = src[i];
        if (c == quote) {
          break;
        } else if (c == '\\') {
          if (quote == '"') {
            throw error("backslash in \"-string; use a '-string for escapes");
          }
          i++;
          if (i >= src.length) {
            throw error("unterminated string literal");
          }
        } else if ((c & 0xFF) < ' ' && c != '\t') {
          throw error("control character in string literal");
        }
      }
      int end = i + 1;
      emit(map.intern(text(start, end)));
      return end;
    }

    private int number(int start) {
      int i = start;
      boolean hex = false;
      if (src[i] == '0' && i + 1 < src.length) {
        byte next = src[i + 1];
        if (next == 'x' || next == 'X') {
          hex = true;
          i += 2;
          if (i >= src.length || !isHexDigit(src[i])) {
            throw error("bad hexadecimal literal");
          }
        } else if (isDigit(next)) {
          throw error("legacy octal syntax; leading zeroes are not allowed");
        }
      }
      boolean lastUnderscore = false;
      for (; i < src.length; i++) {
        byte c = src[i];
        if (c == '_') {
          if (lastUnderscore) {
            throw error("consecutive underscores in numeric literal");
          }
          lastUnderscore = true;
        } else if (hex ? isHexDigit(c) : isDigit(c)) {
          lastUnderscore = false;
        } else {
          break;
        }
      }
      if (lastUnderscore) {
        throw error("trailing underscore in numeric literal");
      }
      emit(map.intern(text(start, i)));
      return i;
    }

    private int squiggle(int start) {
      byte c = src[start];
      Integer single = SINGLE_BYTE.get(c);
      if (single != null) {
        emit(TokenId.builtIn(single));
        return start + 1;
      }
      ImmutableList<String> candidates = SQUIGGLES.get(c);
      if (candidates != null) {
        for (String candidate : candidates) {
          if (matches(start, candidate)) {
            emit(map.intern(candidate));
            return start + candidate.length();
          }
        }
      }
      if (c >= ' ' && c < 0x7F) {
        throw error("unrecognized byte '%c'", (char) c);
      }
      throw error("unrecognized byte 0x%02X", c & 0xFF);
    }

    private boolean matches(int start, String s) {
      if (start + s.length() > src.length) {
        return false;
      }
      for (int j = 0; j < s.length(); j++) {
        if (src[start + j] != s.charAt(j)) {
          return false;
        }
      }
      return true;
    }

    private String text(int start, int end) {
      if (end - start > MAX_TOKEN_SIZE) {
        throw error("token too long");
      }
      return new String(src, start, end - start, StandardCharsets.UTF_8);
    }

    @FormatMethod
    private CompileError error(String fmt, Object... args) {
      return new CompileError(
          CompileError.Phase.TOKEN, String.format(fmt, args), filename, line);
    }
  }

  private static boolean isAlpha(byte c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
  }

  private static boolean isDigit(byte c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isHexDigit(byte c) {
    return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
  }

  private static boolean isAlphaNumeric(byte c) {
    return isAlpha(c) || isDigit(c);
  }
}
