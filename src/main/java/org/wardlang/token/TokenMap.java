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

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Interns token names, assigning each distinct name a token id.
 *
 * <p>A TokenMap is shared by every file of a compilation, so that the same identifier in two files
 * (or two packages) has the same id. Built-in names always map to their fixed ids; other names are
 * given keys in the order they are first seen. A TokenMap is not thread-safe.
 */
public class TokenMap {
  private final Map<String, Integer> byName = new HashMap<>();
  private final List<String> byKey = new ArrayList<>();

  /**
   * Returns the id for the given name, allocating a new key if it has not been seen before. The
   * flags of a new id are determined by the first character of the name.
   */
  public int intern(String name) {
    Preconditions.checkArgument(!name.isEmpty());
    Integer id = find(name);
    if (id != null) {
      return id;
    }
    int key = Key.NUM_BUILT_IN + byKey.size();
    if (key > TokenId.MAX_KEY) {
      throw new IllegalStateException("too many distinct tokens");
    }
    int result = TokenId.of(key, flagsFor(name));
    byKey.add(name);
    byName.put(name, result);
    return result;
  }

  /** Returns the id for the given name, or zero if it has not been interned. */
  public int lookup(String name) {
    Integer id = find(name);
    return (id == null) ? 0 : id;
  }

  private @Nullable Integer find(String name) {
    Integer id = Key.BY_NAME.get(name);
    return (id != null) ? id : byName.get(name);
  }

  /** Returns the source text of the given id. */
  public String name(int id) {
    int key = TokenId.key(id);
    if (key < Key.NUM_BUILT_IN) {
      String result = Key.name(key);
      return (result == null) ? String.format("<key 0x%02X>", key) : result;
    }
    int i = key - Key.NUM_BUILT_IN;
    return (i < byKey.size()) ? byKey.get(i) : String.format("<key 0x%04X>", key);
  }

  /**
   * Returns the contents of a string literal, without its quotes. Escapes ({@code \\}, {@code \'},
   * {@code \"}, {@code \n}, {@code \t} and {@code \xHH}) are only possible in '-quoted strings.
   */
  public String unquote(int id) {
    Preconditions.checkArgument(TokenId.isStrLiteral(id), "not a string literal");
    String s = name(id);
    String body = s.substring(1, s.length() - 1);
    if (s.charAt(0) == '"' || body.indexOf('\\') < 0) {
      return body;
    }
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < body.length(); i++) {
      char c = body.charAt(i);
      if (c != '\\' || i + 1 == body.length()) {
        sb.append(c);
        continue;
      }
      char e = body.charAt(++i);
      switch (e) {
        case 'n' -> sb.append('\n');
        case 't' -> sb.append('\t');
        case 'x' -> {
          Preconditions.checkArgument(i + 2 < body.length(), "bad \\x escape in %s", s);
          sb.append((char) Integer.parseInt(body.substring(i + 1, i + 3), 16));
          i += 2;
        }
        default -> sb.append(e);
      }
    }
    return sb.toString();
  }

  /** The number of user-defined names that have been interned. */
  public int size() {
    return byKey.size();
  }

  /**
   * Renders a token sequence as source text with canonical spacing: a single space between tokens,
   * except before tight-left and after tight-right tokens.
   */
  public String render(List<Token> tokens) {
    StringBuilder sb = new StringBuilder();
    int prevKey = 0;
    for (Token token : tokens) {
      int key = TokenId.key(token.id());
      if (sb.length() != 0 && !Key.isTightLeft(key) && !Key.isTightRight(prevKey)) {
        sb.append(' ');
      }
      sb.append(name(token.id()));
      prevKey = key;
    }
    return sb.toString();
  }

  private static int flagsFor(String name) {
    char c = name.charAt(0);
    if (c == '"' || c == '\'') {
      return TokenId.FLAG_LITERAL | TokenId.FLAG_STR_LITERAL;
    } else if (c >= '0' && c <= '9') {
      return TokenId.FLAG_LITERAL | TokenId.FLAG_NUM_LITERAL;
    } else if (c == '_' || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z')) {
      return TokenId.FLAG_IDENT;
    }
    return TokenId.FLAG_OTHER;
  }
}
