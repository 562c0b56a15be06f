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

import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.wardlang.ast.Expr;
import org.wardlang.parse.Parser;
import org.wardlang.token.Lexer;
import org.wardlang.token.TokenMap;

@RunWith(JUnit4.class)
public class ProofRulesTest {

  private final TokenMap map = new TokenMap();
  private final ProofRules rules = ProofRules.create(map, ProofRules.CURRENT_VERSION);

  private Expr expr(String src) {
    return Parser.parseExpression(
        map, "test.ward", Lexer.tokenize(map, "test.ward", src.getBytes(StandardCharsets.UTF_8)));
  }

  @Test
  public void lookupIgnoresWhitespace() {
    ProofRule rule = rules.lookup("a<b:a<c;c<=b");
    assertThat(rule).isNotNull();
    assertThat(rule.name).isEqualTo("a < b: a < c; c <= b");
    assertThat(rule.hypotheses).hasSize(2);
    assertThat(rules.lookup("a < b: a < c")).isNull();
    assertThat(rules.all()).contains(rule);
  }

  @Test
  public void match() {
    ProofRule rule = rules.lookup("a < b: a < c; c <= b");
    Map<Integer, Expr> bindings = rule.match(expr("x[i] < (n + 1)"));
    assertThat(bindings).isNotNull();
    assertThat(bindings.get(map.lookup("a")).str(map)).isEqualTo("x[i]");
    assertThat(bindings.get(map.lookup("b")).str(map)).isEqualTo("n + 1");
    // c appears only in the hypotheses, so the conclusion does not bind it.
    assertThat(bindings).doesNotContainKey(map.lookup("c"));
    assertThat(rule.match(expr("x <= y"))).isNull();
  }

  @Test
  public void matchNestedOperands() {
    ProofRule rule = rules.lookup("a <= (b + c): a <= c; 0 <= b");
    Map<Integer, Expr> bindings = rule.match(expr("n <= (m + n)"));
    assertThat(bindings.get(map.lookup("a"))).isEqualTo(bindings.get(map.lookup("c")));
    assertThat(rule.match(expr("n <= m"))).isNull();
    ProofRule offset = rules.lookup("(a + b) <= c: a <= (c - b)");
    assertThat(offset.match(expr("(x + 1) <= y"))).isNotNull();
    assertThat(offset.match(expr("(x - 1) <= y"))).isNull();
  }

  @Test
  public void unknownVersion() {
    assertThrows(IllegalArgumentException.class, () -> ProofRules.create(map, 99));
  }
}
