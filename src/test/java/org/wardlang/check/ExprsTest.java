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

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.wardlang.ast.Expr;
import org.wardlang.parse.Parser;
import org.wardlang.token.Lexer;
import org.wardlang.token.TokenMap;

@RunWith(JUnit4.class)
public class ExprsTest {

  private final TokenMap map = new TokenMap();

  private Expr expr(String src) {
    return Parser.parseExpression(
        map, "test.ward", Lexer.tokenize(map, "test.ward", src.getBytes(StandardCharsets.UTF_8)));
  }

  private String inverted(String src) {
    return Exprs.invert(expr(src)).str(map);
  }

  @Test
  public void invert() {
    assertThat(inverted("a < b")).isEqualTo("a >= b");
    assertThat(inverted("a == b")).isEqualTo("a != b");
    assertThat(inverted("not x")).isEqualTo("x");
    assertThat(inverted("(a < b) and (c <= d)")).isEqualTo("(a >= b) or (c > d)");
    assertThat(inverted("x")).isEqualTo("not x");
  }

  @Test
  public void implies() {
    assertThat(Exprs.implies(expr("a < b"), expr("a <= b"))).isTrue();
    assertThat(Exprs.implies(expr("a < b"), expr("b > a"))).isTrue();
    assertThat(Exprs.implies(expr("a < b"), expr("b != a"))).isTrue();
    assertThat(Exprs.implies(expr("a == b"), expr("b <= a"))).isTrue();
    assertThat(Exprs.implies(expr("a <= b"), expr("a < b"))).isFalse();
    assertThat(Exprs.implies(expr("a < b"), expr("a < c"))).isFalse();
  }

  @Test
  public void orientedFact() {
    Expr x = expr("x");
    assertThat(Exprs.orientedFact(expr("3 < x"), x).str(map)).isEqualTo("x > 3");
    assertThat(Exprs.orientedFact(expr("x <= n"), x).str(map)).isEqualTo("x <= n");
    assertThat(Exprs.orientedFact(expr("y <= n"), x)).isNull();
  }

  @Test
  public void constants() {
    assertThat(Exprs.constant(map, BigInteger.valueOf(42))).isEqualTo(expr("42"));
    assertThat(Exprs.constant(map, BigInteger.valueOf(-3))).isEqualTo(expr("-3"));
    assertThat(Exprs.literalValue(map, map.intern("0x1_F"))).isEqualTo(BigInteger.valueOf(31));
  }

  @Test
  public void factSets() {
    FactSet facts = new FactSet();
    facts.add(expr("(a < b) and (b < c) and true"));
    facts.add(expr("a < b"));
    assertThat(facts.str(map)).isEqualTo("a < b; b < c");

    FactSet branch = facts.copy();
    branch.removeMentioning(expr("c"));
    branch.add(expr("d == 0"));
    assertThat(facts.facts()).hasSize(2);

    facts.retainAll(branch);
    assertThat(facts.str(map)).isEqualTo("a < b");
    facts.setTo(branch);
    assertThat(facts.contains(expr("d == 0"))).isTrue();
  }
}
