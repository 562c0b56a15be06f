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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.nio.charset.StandardCharsets;
import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.wardlang.compiler.CompileError;

@RunWith(JUnitParamsRunner.class)
public class LexerTest {

  private final TokenMap map = new TokenMap();

  private ImmutableList<Token> tokenize(String src) {
    return Lexer.tokenize(map, "test.ward", src.getBytes(StandardCharsets.UTF_8));
  }

  private ImmutableList<Integer> keys(String src) {
    return tokenize(src).stream().map(Token::key).collect(ImmutableList.toImmutableList());
  }

  @Test
  public void longestOperatorWins() {
    ImmutableList<Token> tokens = tokenize("x <<= 3");
    assertThat(tokens).hasSize(4);
    assertThat(tokens.get(1).key()).isEqualTo(Key.SHIFT_L_EQ);
    assertThat(map.name(tokens.get(1).id())).isEqualTo("<<=");
    assertThat(keys("a ~mod+ b").get(1)).isEqualTo(Key.MOD_PLUS);
    assertThat(keys("a < -b").subList(1, 3)).containsExactly(Key.LESS_THAN, Key.MINUS).inOrder();
  }

  @Test
  public void implicitSemicolons() {
    ImmutableList<Token> tokens = tokenize("var x\nx = 1\n\nif x {\n}\n");
    assertThat(map.render(tokens)).isEqualTo("var x; x = 1; if x { };");
    // Lines run from 1; the closing brace is on line 5.
    assertThat(tokens.get(tokens.size() - 2).line()).isEqualTo(5);
  }

  @Test
  public void noSemicolonAfterOperator() {
    assertThat(keys("a +\nb")).containsExactly(
        TokenId.key(map.lookup("a")), Key.PLUS, TokenId.key(map.lookup("b")), Key.SEMICOLON)
        .inOrder();
  }

  @Test
  public void commentsAreSkipped() {
    assertThat(map.render(tokenize("x = 1 // one\n// nothing\ny = 2"))).isEqualTo("x = 1; y = 2;");
  }

  @Test
  public void builtInNamesShareIds() {
    ImmutableList<Token> tokens = tokenize("0 if");
    assertThat(tokens.get(0).id()).isEqualTo(map.intern("0"));
    assertThat(tokens.get(1).key()).isEqualTo(Key.IF);
    assertThat(TokenId.isBuiltIn(tokens.get(1).id())).isTrue();
  }

  @Test
  public void literals() {
    ImmutableList<Token> tokens = tokenize("0x1F 1_000 \"#bad\" 'a\\n'");
    assertThat(TokenId.isNumLiteral(tokens.get(0).id())).isTrue();
    assertThat(TokenId.isNumLiteral(tokens.get(1).id())).isTrue();
    assertThat(TokenId.isStrLiteral(tokens.get(2).id())).isTrue();
    assertThat(map.unquote(tokens.get(2).id())).isEqualTo("#bad");
    assertThat(TokenId.isStrLiteral(tokens.get(3).id())).isTrue();
  }

  private static Object[] badSources() {
    return new Object[] {
      new Object[] {"x = 007", "legacy octal syntax; leading zeroes are not allowed"},
      new Object[] {"x = 0x", "bad hexadecimal literal"},
      new Object[] {"x = 1__0", "consecutive underscores in numeric literal"},
      new Object[] {"x = 10_", "trailing underscore in numeric literal"},
      new Object[] {"x = \"abc", "unterminated string literal"},
      new Object[] {"x = \"a\\n\"", "backslash in \"-string; use a '-string for escapes"},
      new Object[] {"x = $", "unrecognized byte '$'"},
      new Object[] {"f(x]", "unbalanced \"]\""},
      new Object[] {"f(x", "unclosed \"(\""},
    };
  }

  @Test
  @Parameters(method = "badSources")
  public void errors(String src, String expected) {
    CompileError e = assertThrows(CompileError.class, () -> tokenize(src));
    assertThat(e.phase).isEqualTo(CompileError.Phase.TOKEN);
    assertThat(e.msg).isEqualTo(expected);
    assertThat(e.filename).isEqualTo("test.ward");
    assertThat(e.getMessage()).endsWith(" at test.ward:1");
  }

  @Test
  public void errorLine() {
    CompileError e = assertThrows(CompileError.class, () -> tokenize("x = 1\ny = 2\nz = @"));
    assertThat(e.lineNum).isEqualTo(3);
  }
}
