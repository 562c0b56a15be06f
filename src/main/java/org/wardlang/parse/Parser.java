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

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.FormatMethod;
import org.wardlang.ast.Assert;
import org.wardlang.ast.Decl;
import org.wardlang.ast.Effect;
import org.wardlang.ast.Expr;
import org.wardlang.ast.Field;
import org.wardlang.ast.SourceFile;
import org.wardlang.ast.Stmt;
import org.wardlang.ast.TypeExpr;
import org.wardlang.compiler.CompileError;
import org.wardlang.token.Key;
import org.wardlang.token.Token;
import org.wardlang.token.TokenId;
import org.wardlang.token.TokenMap;

/**
 * A recursive-descent parser from a token sequence to a {@link SourceFile}.
 *
 * <p>Operators are disambiguated here: an operator token seen where an operand is expected gets its
 * unary form, one seen after an operand gets its binary form, and a run of the same associative
 * operator (e.g. {@code a + b + c}) becomes a single node with the associative form. Different
 * binary operators may not be combined without parentheses, so there is no precedence table.
 */
public final class Parser {
  private final TokenMap map;
  private final String filename;
  private final ImmutableList<Token> tokens;
  private int pos;

  private Parser(TokenMap map, String filename, ImmutableList<Token> tokens) {
    this.map = map;
    this.filename = filename;
    this.tokens = tokens;
  }

  /** Parses a complete source file. */
  public static SourceFile parse(TokenMap map, String filename, ImmutableList<Token> tokens) {
    return new Parser(map, filename, tokens).parseFile();
  }

  /**
   * Parses a token sequence that holds exactly one expression (optionally followed by a
   * semicolon).
   */
  public static Expr parseExpression(TokenMap map, String filename, ImmutableList<Token> tokens) {
    Parser parser = new Parser(map, filename, tokens);
    Expr result = parser.parseExpr();
    if (parser.peek() == Key.SEMICOLON) {
      parser.pos++;
    }
    if (parser.pos != tokens.size()) {
      throw parser.expected("end of expression");
    }
    return result;
  }

  // Token access

  private int peekId() {
    return (pos < tokens.size()) ? tokens.get(pos).id() : 0;
  }

  private int peek() {
    return TokenId.key(peekId());
  }

  private int peek2() {
    return (pos + 1 < tokens.size()) ? tokens.get(pos + 1).key() : 0;
  }

  private int line() {
    if (tokens.isEmpty()) {
      return 1;
    }
    return tokens.get(Math.min(pos, tokens.size() - 1)).line();
  }

  private int next() {
    return tokens.get(pos++).id();
  }

  private void expect(int key) {
    if (peek() != key) {
      throw expected("\"" + map.name(TokenId.builtIn(key)) + "\"");
    }
    pos++;
  }

  private boolean accept(int key) {
    if (peek() == key) {
      pos++;
      return true;
    }
    return false;
  }

  private int parseIdent() {
    int id = peekId();
    if (!TokenId.isIdent(id)) {
      throw expected("identifier");
    }
    pos++;
    return id;
  }

  private int parseStringLiteral() {
    int id = peekId();
    if (!TokenId.isStrLiteral(id)) {
      throw expected("string literal");
    }
    pos++;
    return id;
  }

  private CompileError expected(String what) {
    String got = (pos < tokens.size()) ? "\"" + map.name(peekId()) + "\"" : "end of file";
    return error("expected %s, got %s", what, got);
  }

  @FormatMethod
  private CompileError error(String fmt, Object... args) {
    return new CompileError(CompileError.Phase.PARSE, String.format(fmt, args), filename, line());
  }

  // Declarations

  private SourceFile parseFile() {
    ImmutableList.Builder<Decl> decls = ImmutableList.builder();
    while (pos < tokens.size()) {
      if (accept(Key.SEMICOLON)) {
        continue;
      }
      decls.add(parseTopLevelDecl());
      if (pos < tokens.size()) {
        expect(Key.SEMICOLON);
      }
    }
    return new SourceFile(filename, decls.build());
  }

  private Decl parseTopLevelDecl() {
    int line = line();
    switch (peek()) {
      case Key.USE -> {
        pos++;
        return new Decl.Use(filename, line, parseStringLiteral());
      }
      case Key.PACKAGEID -> {
        pos++;
        return new Decl.PackageId(filename, line, parseStringLiteral());
      }
      case Key.PUB, Key.PRI -> {
        boolean isPublic = (next() == TokenId.builtIn(Key.PUB));
        switch (peek()) {
          case Key.CONST -> {
            pos++;
            return parseConst(line, isPublic);
          }
          case Key.FUNC -> {
            pos++;
            return parseFunc(line, isPublic);
          }
          case Key.STATUS -> {
            pos++;
            return new Decl.StatusDecl(filename, line, isPublic, parseStringLiteral());
          }
          case Key.STRUCT -> {
            pos++;
            return parseStruct(line, isPublic);
          }
          default -> throw expected("const, func, status or struct");
        }
      }
      default -> throw expected("top-level declaration");
    }
  }

  private Decl.Const parseConst(int line, boolean isPublic) {
    int name = parseIdent();
    accept(Key.COLON);
    TypeExpr type = parseType();
    expect(Key.EQ);
    Expr value = parseExpr();
    return new Decl.Const(filename, line, isPublic, name, type, value);
  }

  private Decl.Struct parseStruct(int line, boolean isPublic) {
    int name = parseIdent();
    boolean suspendible = accept(Key.QUESTION);
    ImmutableList<Field> fields = parseFields();
    return new Decl.Struct(filename, line, isPublic, name, suspendible, fields);
  }

  private Decl.Func parseFunc(int line, boolean isPublic) {
    int receiver = 0;
    int name = parseIdent();
    if (accept(Key.DOT)) {
      receiver = name;
      name = parseIdent();
    }
    Effect effect = parseEffect();
    ImmutableList<Field> in = parseFields();
    ImmutableList<Field> out = (peek() == Key.OPEN_PAREN) ? parseFields() : ImmutableList.of();
    TypeExpr returnType = null;
    if (peek() != Key.OPEN_CURLY && peek() != Key.COMMA) {
      returnType = parseType();
    }
    ImmutableList<Assert> asserts = parseAssertClauses();
    ImmutableList<Stmt> body = parseBlock();
    return new Decl.Func(
        filename, line, isPublic, receiver, name, effect, in, out, returnType, asserts, body);
  }

  private Effect parseEffect() {
    if (accept(Key.EXCLAM)) {
      return Effect.IMPURE;
    } else if (accept(Key.QUESTION)) {
      return Effect.SUSPENDIBLE;
    }
    return Effect.PURE;
  }

  /** Parses a parenthesized, comma-separated list of {@code name: Type} fields. */
  private ImmutableList<Field> parseFields() {
    expect(Key.OPEN_PAREN);
    ImmutableList.Builder<Field> fields = ImmutableList.builder();
    while (!accept(Key.CLOSE_PAREN)) {
      int line = line();
      int name = parseIdent();
      expect(Key.COLON);
      fields.add(new Field(name, parseType(), line));
      if (peek() != Key.CLOSE_PAREN) {
        expect(Key.COMMA);
      }
    }
    return fields.build();
  }

  /**
   * Parses zero or more {@code , pre|inv|post cond [via ...]} clauses preceding a block. The
   * clauses must be in pre, inv, post order; a trailing comma before the block is allowed.
   */
  private ImmutableList<Assert> parseAssertClauses() {
    ImmutableList.Builder<Assert> asserts = ImmutableList.builder();
    int prevKeyword = Key.PRE;
    while (accept(Key.COMMA)) {
      if (peek() == Key.OPEN_CURLY) {
        break;
      }
      int keyword = peek();
      if (keyword != Key.PRE && keyword != Key.INV && keyword != Key.POST) {
        throw expected("pre, inv or post");
      } else if (keyword < prevKeyword) {
        throw error("pre, inv and post clauses must appear in that order");
      }
      prevKeyword = keyword;
      asserts.add(parseAssert());
    }
    return asserts.build();
  }

  /** Parses {@code assert|pre|inv|post cond [via "rule"(name: expr, ...)]}. */
  private Assert parseAssert() {
    int line = line();
    int keyword = TokenId.key(next());
    Expr condition = parseExpr();
    int reason = 0;
    ImmutableList<Expr.Arg> args = ImmutableList.of();
    if (accept(Key.VIA)) {
      reason = parseStringLiteral();
      args = parseArgs(true);
    }
    return new Assert(keyword, condition, reason, args, line);
  }

  // Types

  private TypeExpr parseType() {
    switch (peek()) {
      case Key.PTR, Key.NPTR, Key.SLICE, Key.TABLE -> {
        TypeExpr.Kind kind =
            switch (TokenId.key(next())) {
              case Key.PTR -> TypeExpr.Kind.PTR;
              case Key.NPTR -> TypeExpr.Kind.NPTR;
              case Key.SLICE -> TypeExpr.Kind.SLICE;
              default -> TypeExpr.Kind.TABLE;
            };
        return TypeExpr.of(kind, parseType());
      }
      case Key.ARRAY -> {
        pos++;
        expect(Key.OPEN_BRACKET);
        Expr length = parseExpr();
        expect(Key.CLOSE_BRACKET);
        return TypeExpr.array(length, parseType());
      }
      default -> {
        int pkg = 0;
        int name = parseIdent();
        if (accept(Key.DOT)) {
          pkg = name;
          name = parseIdent();
        }
        Expr lo = null;
        Expr hi = null;
        if (accept(Key.OPEN_BRACKET)) {
          if (peek() != Key.DOT_DOT_EQ) {
            lo = parseExpr();
          }
          expect(Key.DOT_DOT_EQ);
          if (peek() != Key.CLOSE_BRACKET) {
            hi = parseExpr();
          }
          expect(Key.CLOSE_BRACKET);
          if (lo == null && hi == null) {
            throw error("empty type refinement");
          }
        }
        return TypeExpr.named(pkg, name, lo, hi);
      }
    }
  }

  // Statements

  private ImmutableList<Stmt> parseBlock() {
    expect(Key.OPEN_CURLY);
    ImmutableList.Builder<Stmt> stmts = ImmutableList.builder();
    while (!accept(Key.CLOSE_CURLY)) {
      if (accept(Key.SEMICOLON)) {
        continue;
      }
      stmts.add(parseStatement());
      if (peek() != Key.CLOSE_CURLY) {
        expect(Key.SEMICOLON);
      }
    }
    return stmts.build();
  }

  private Stmt parseStatement() {
    int line = line();
    switch (peek()) {
      case Key.VAR -> {
        pos++;
        int name = parseIdent();
        accept(Key.COLON);
        TypeExpr type = parseType();
        Expr value = accept(Key.EQ) ? parseExpr() : null;
        return new Stmt.Var(line, name, type, value);
      }
      case Key.ASSERT -> {
        return new Stmt.AssertStmt(parseAssert());
      }
      case Key.BREAK, Key.CONTINUE -> {
        int keyword = TokenId.key(next());
        int label = accept(Key.DOT) ? parseIdent() : 0;
        return new Stmt.Jump(line, keyword, label);
      }
      case Key.IF -> {
        return parseIf();
      }
      case Key.WHILE -> {
        pos++;
        int label = accept(Key.DOT) ? parseIdent() : 0;
        Expr condition = parseExpr();
        ImmutableList<Assert> asserts = parseAssertClauses();
        return new Stmt.While(line, label, condition, asserts, parseBlock());
      }
      case Key.RETURN -> {
        pos++;
        Expr value = null;
        if (peek() != Key.SEMICOLON && peek() != Key.CLOSE_CURLY) {
          value = parseExpr();
        }
        return new Stmt.Return(line, value);
      }
      case Key.YIELD -> {
        pos++;
        return new Stmt.Yield(line, parseExpr());
      }
      default -> {
        Expr lhs = parseExpr();
        int op = peekId();
        if (TokenId.isAssign(op)) {
          pos++;
          return new Stmt.Assign(line, TokenId.key(op), lhs, parseExpr());
        } else if (lhs.kind != Expr.Kind.CALL) {
          throw expected("assignment");
        }
        return new Stmt.ExprStmt(line, lhs);
      }
    }
  }

  private Stmt.If parseIf() {
    int line = line();
    expect(Key.IF);
    Expr condition = parseExpr();
    ImmutableList<Stmt> then = parseBlock();
    ImmutableList<Stmt> orElse = ImmutableList.of();
    if (accept(Key.ELSE)) {
      orElse = (peek() == Key.IF) ? ImmutableList.of(parseIf()) : parseBlock();
    }
    return new Stmt.If(line, condition, then, orElse);
  }

  // Expressions

  /** Parses an operand, optionally followed by one binary operator or a run of one. */
  private Expr parseExpr() {
    Expr lhs = parseOperand();
    int op = peekId();
    if (!TokenId.isBinaryOp(op)) {
      return lhs;
    }
    pos++;
    int key = TokenId.key(op);
    Expr result;
    if (key == Key.AS) {
      result = Expr.as(lhs, parseType());
    } else {
      Expr rhs = parseOperand();
      int assocForm = Key.associativeForm(key);
      if (assocForm != 0 && peek() == key) {
        ImmutableList.Builder<Expr> operands = ImmutableList.builder();
        operands.add(lhs, rhs);
        while (accept(key)) {
          operands.add(parseOperand());
        }
        result = Expr.associative(assocForm, operands.build());
      } else {
        result = Expr.binary(Key.binaryForm(key), lhs, rhs);
      }
    }
    int following = peekId();
    if (TokenId.isBinaryOp(following)) {
      throw error(
          "combining \"%s\" and \"%s\" requires parentheses",
          map.name(op),
          map.name(following));
    }
    return result;
  }

  private Expr parseOperand() {
    int id = peekId();
    if (TokenId.isUnaryOp(id)) {
      pos++;
      return Expr.unary(Key.unaryForm(TokenId.key(id)), parseOperand());
    } else if (TokenId.isStrLiteral(id)) {
      pos++;
      return Expr.status(0, id);
    } else if (TokenId.isLiteral(id)) {
      pos++;
      return Expr.literal(id);
    } else if (accept(Key.OPEN_PAREN)) {
      Expr result = parseExpr();
      expect(Key.CLOSE_PAREN);
      return result;
    } else if (!TokenId.isIdent(id)) {
      throw expected("expression");
    }
    pos++;
    Expr lhs = Expr.ident(id);
    for (boolean first = true; ; first = false) {
      switch (peek()) {
        case Key.EXCLAM, Key.QUESTION, Key.OPEN_PAREN -> {
          Effect effect = parseEffect();
          lhs = Expr.call(lhs, effect, parseArgs(false));
        }
        case Key.OPEN_BRACKET -> lhs = parseIndexOrSlice(lhs);
        case Key.DOT -> {
          pos++;
          int next = peekId();
          if (TokenId.isStrLiteral(next)) {
            if (!first) {
              throw error("status %s has too many qualifiers", map.name(next));
            }
            pos++;
            return Expr.status(id, next);
          }
          lhs = Expr.select(lhs, parseIdent());
        }
        default -> {
          return lhs;
        }
      }
    }
  }

  private Expr parseIndexOrSlice(Expr container) {
    expect(Key.OPEN_BRACKET);
    Expr lo = null;
    if (peek() != Key.DOT_DOT) {
      lo = parseExpr();
      if (accept(Key.CLOSE_BRACKET)) {
        return Expr.index(container, lo);
      }
    }
    expect(Key.DOT_DOT);
    Expr hi = (peek() == Key.CLOSE_BRACKET) ? null : parseExpr();
    expect(Key.CLOSE_BRACKET);
    return Expr.slice(container, lo, hi);
  }

  /**
   * Parses a parenthesized argument list. Each argument is either {@code name: expr} or (unless
   * {@code namesRequired}) a bare expression.
   */
  private ImmutableList<Expr.Arg> parseArgs(boolean namesRequired) {
    expect(Key.OPEN_PAREN);
    ImmutableList.Builder<Expr.Arg> args = ImmutableList.builder();
    while (!accept(Key.CLOSE_PAREN)) {
      int name = 0;
      if (TokenId.isIdent(peekId()) && peek2() == Key.COLON) {
        name = next();
        pos++;
      } else if (namesRequired) {
        throw expected("argument name");
      }
      args.add(new Expr.Arg(name, parseExpr()));
      if (peek() != Key.CLOSE_PAREN) {
        expect(Key.COMMA);
      }
    }
    return args.build();
  }
}
