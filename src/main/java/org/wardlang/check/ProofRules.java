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

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.wardlang.ast.Expr;
import org.wardlang.parse.Parser;
import org.wardlang.token.Lexer;
import org.wardlang.token.Token;
import org.wardlang.token.TokenId;
import org.wardlang.token.TokenMap;

/**
 * The versioned table of proof rules that {@code via} clauses may cite.
 *
 * <p>Each version's table is fixed: rules may be added in a new version, but a rule's text and
 * meaning never change once published. A ProofRules instance holds one version's rules parsed
 * against a particular TokenMap.
 */
public final class ProofRules {

  public static final int CURRENT_VERSION = 1;

  private static final ImmutableList<String> VERSION_1 =
      ImmutableList.of(
          "a < b: a < c; c <= b",
          "a < b: a <= c; c < b",
          "a <= b: a <= c; c <= b",
          "a < (b + c): a < c; 0 <= b",
          "a <= (b + c): a <= c; 0 <= b",
          "(a + b) <= c: a <= (c - b)",
          "(a - b) <= c: a <= (c + b)",
          "a < (b + c): a < (b0 + c0); b0 <= b; c0 <= c");

  private static final ImmutableMap<Integer, ImmutableList<String>> VERSIONS =
      ImmutableMap.of(1, VERSION_1);

  private static final String RULE_FILENAME = "<rule>";

  public final int version;

  /** Keyed by {@link #key}. */
  private final ImmutableMap<String, ProofRule> rules;

  private ProofRules(int version, ImmutableMap<String, ProofRule> rules) {
    this.version = version;
    this.rules = rules;
  }

  /** Parses the rules of the given version. */
  public static ProofRules create(TokenMap map, int version) {
    ImmutableList<String> texts = VERSIONS.get(version);
    Preconditions.checkArgument(texts != null, "no proof rules version %s", version);
    ImmutableMap.Builder<String, ProofRule> builder = ImmutableMap.builder();
    for (String text : texts) {
      builder.put(key(text), parse(map, text));
    }
    return new ProofRules(version, builder.buildOrThrow());
  }

  /**
   * Returns the rule with the given text, or null if there is none. Differences in whitespace are
   * ignored.
   */
  public @Nullable ProofRule lookup(String text) {
    return rules.get(key(text));
  }

  public ImmutableList<ProofRule> all() {
    return rules.values().asList();
  }

  private static String key(String text) {
    return CharMatcher.whitespace().removeFrom(text);
  }

  private static ProofRule parse(TokenMap map, String text) {
    int colon = text.indexOf(':');
    Preconditions.checkArgument(colon > 0, "bad rule %s", text);
    Expr conclusion = parseExpr(map, text.substring(0, colon));
    ImmutableList.Builder<Expr> hypotheses = ImmutableList.builder();
    for (String h : Splitter.on(';').trimResults().split(text.substring(colon + 1))) {
      hypotheses.add(parseExpr(map, h));
    }
    ImmutableList<Expr> hs = hypotheses.build();
    ImmutableSet.Builder<Integer> placeholders = ImmutableSet.builder();
    collectPlaceholders(conclusion, placeholders);
    hs.forEach(h -> collectPlaceholders(h, placeholders));
    return new ProofRule(text, conclusion, hs, placeholders.build());
  }

  private static Expr parseExpr(TokenMap map, String text) {
    List<Token> tokens =
        Lexer.tokenize(map, RULE_FILENAME, text.trim().getBytes(StandardCharsets.UTF_8));
    return Parser.parseExpression(map, RULE_FILENAME, ImmutableList.copyOf(tokens));
  }

  /** Every identifier in a rule is a placeholder. */
  private static void collectPlaceholders(Expr e, ImmutableSet.Builder<Integer> placeholders) {
    e.transform(
        x -> {
          if (x.kind == Expr.Kind.IDENT && TokenId.isIdent(x.id)) {
            placeholders.add(x.id);
          }
          return null;
        });
  }
}
