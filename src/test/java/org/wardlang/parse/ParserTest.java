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

package org.wardlang.parse;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.nio.charset.StandardCharsets;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.wardlang.ast.Decl;
import org.wardlang.ast.Effect;
import org.wardlang.ast.Expr;
import org.wardlang.ast.SourceFile;
import org.wardlang.ast.Stmt;
import org.wardlang.compiler.CompileError;
import org.wardlang.token.Key;
import org.wardlang.token.Lexer;
import org.wardlang.token.TokenMap;

@RunWith(JUnit4.class)
public class ParserTest {

  private final TokenMap map = new TokenMap();

  private Expr expr(String src) {
    return Parser.parseExpression(
        map, "test.ward", Lexer.tokenize(map, "test.ward", src.getBytes(StandardCharsets.UTF_8)));
  }

  private SourceFile file(String src) {
    return Parser.parse(
        map, "test.ward", Lexer.tokenize(map, "test.ward", src.getBytes(StandardCharsets.UTF_8)));
  }

  @Test
  public void unaryAndBinaryMinus() {
    Expr neg = expr("-x");
    assertThat(neg.kind).isEqualTo(Expr.Kind.UNARY);
    assertThat(neg.op).isEqualTo(Key.X_UNARY_MINUS);
    Expr diff = expr("a - b");
    assertThat(diff.kind).isEqualTo(Expr.Kind.BINARY);
    assertThat(diff.op).isEqualTo(Key.X_BINARY_MINUS);
    assertThat(expr("a - -b").str(map)).isEqualTo("a - -b");
  }

  @Test
  public void repeatedOperatorIsAssociative() {
    Expr sum = expr("a + b + c");
    assertThat(sum.kind).isEqualTo(Expr.Kind.ASSOCIATIVE);
    assertThat(sum.op).isEqualTo(Key.X_ASSOC_PLUS);
    assertThat(sum.operands()).hasSize(3);
    assertThat(sum.str(map)).isEqualTo("a + b + c");
    // Subtraction has no associative form.
    CompileError e = assertThrows(CompileError.class, () -> expr("a - b - c"));
    assertThat(e.msg).isEqualTo("combining \"-\" and \"-\" requires parentheses");
  }

  @Test
  public void mixingOperatorsNeedsParentheses() {
    CompileError e = assertThrows(CompileError.class, () -> expr("a + b * c"));
    assertThat(e.phase).isEqualTo(CompileError.Phase.PARSE);
    assertThat(e.msg).isEqualTo("combining \"+\" and \"*\" requires parentheses");
    Expr ok = expr("(a + b) * c");
    assertThat(ok.kind).isEqualTo(Expr.Kind.BINARY);
    assertThat(ok.op).isEqualTo(Key.X_BINARY_STAR);
    assertThat(ok.str(map)).isEqualTo("(a + b) * c");
  }

  @Test
  public void postfixForms() {
    assertThat(expr("a[i]").kind).isEqualTo(Expr.Kind.INDEX);
    assertThat(expr("a[i ..]").kind).isEqualTo(Expr.Kind.SLICE);
    assertThat(expr("a.b.c").kind).isEqualTo(Expr.Kind.SELECT);
    Expr call = expr("this.f!(x: 1)");
    assertThat(call.kind).isEqualTo(Expr.Kind.CALL);
    assertThat(call.effect).isEqualTo(Effect.IMPURE);
    assertThat(call.args).hasSize(1);
    assertThat(call.str(map)).isEqualTo("this.f!(x: 1)");
    assertThat(expr("x as base.u8").kind).isEqualTo(Expr.Kind.AS);
  }

  @Test
  public void statuses() {
    Expr local = expr("\"#bad\"");
    assertThat(local.kind).isEqualTo(Expr.Kind.STATUS);
    assertThat(local.pkg).isEqualTo(0);
    Expr qualified = expr("base.\"#short read\"");
    assertThat(qualified.kind).isEqualTo(Expr.Kind.STATUS);
    assertThat(map.name(qualified.pkg)).isEqualTo("base");
  }

  @Test
  public void declarations() {
    SourceFile f =
        file(
            "packageid \"test\"\n"
                + "use \"std/crc32\"\n"
                + "pub const N base.u32 = 4\n"
                + "pub status \"#oops\"\n"
                + "pri struct T?(x: base.u8[..= 9], y: array[N] base.u16)\n"
                + "pub func T.f?(a: base.u32)(b: base.u8) base.u32,\n"
                + "    pre a < 4,\n"
                + "    post b < 9,\n"
                + "{\n"
                + "  return a\n"
                + "}\n");
    assertThat(f.decls).hasSize(6);
    assertThat(f.declsOf(Decl.Use.class).get(0).path(map)).isEqualTo("std/crc32");
    Decl.Struct struct = f.declsOf(Decl.Struct.class).get(0);
    assertThat(struct.isPublic).isFalse();
    assertThat(struct.suspendible).isTrue();
    assertThat(struct.fields).hasSize(2);
    Decl.Func func = f.declsOf(Decl.Func.class).get(0);
    assertThat(func.qualifiedName(map)).isEqualTo("T.f");
    assertThat(func.effect).isEqualTo(Effect.SUSPENDIBLE);
    assertThat(func.in).hasSize(1);
    assertThat(func.out).hasSize(1);
    assertThat(func.returnType.str(map)).isEqualTo("base.u32");
    assertThat(func.asserts).hasSize(2);
    assertThat(func.body.get(0)).isInstanceOf(Stmt.Return.class);
  }

  @Test
  public void statements() {
    SourceFile f =
        file(
            "pub func f!() {\n"
                + "  var i: base.u32\n"
                + "  while.loop i < 10,\n"
                + "      inv i <= 10,\n"
                + "  {\n"
                + "    if i == 3 {\n"
                + "      break.loop\n"
                + "    } else if i == 4 {\n"
                + "      continue\n"
                + "    } else {\n"
                + "      i += 1\n"
                + "    }\n"
                + "  }\n"
                + "  assert i <= 10\n"
                + "}\n");
    Decl.Func func = f.declsOf(Decl.Func.class).get(0);
    assertThat(func.receiver).isEqualTo(0);
    assertThat(func.body).hasSize(3);
    Stmt.While loop = (Stmt.While) func.body.get(1);
    assertThat(map.name(loop.label)).isEqualTo("loop");
    assertThat(loop.asserts).hasSize(1);
    Stmt.If ifStmt = (Stmt.If) loop.body.get(0);
    assertThat(((Stmt.Jump) ifStmt.then.get(0)).isBreak()).isTrue();
    Stmt.If elseIf = (Stmt.If) ifStmt.orElse.get(0);
    Stmt.Assign increment = (Stmt.Assign) elseIf.orElse.get(0);
    assertThat(increment.op).isEqualTo(Key.PLUS_EQ);
    assertThat(func.body.get(2)).isInstanceOf(Stmt.AssertStmt.class);
  }

  @Test
  public void clausesMustBeOrdered() {
    CompileError e =
        assertThrows(
            CompileError.class,
            () -> file("pub func f(a: base.u32), post a < 2, pre a < 1 {\n}\n"));
    assertThat(e.msg).isEqualTo("pre, inv and post clauses must appear in that order");
  }

  @Test
  public void expressionStatementMustBeACall() {
    CompileError e = assertThrows(CompileError.class, () -> file("pub func f() {\n  x + 1\n}\n"));
    assertThat(e.msg).isEqualTo("expected assignment, got \";\"");
    assertThat(e.lineNum).isEqualTo(2);
  }
}
