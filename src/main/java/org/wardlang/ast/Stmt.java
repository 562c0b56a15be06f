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

package org.wardlang.ast;

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;
import org.wardlang.token.Key;

/** A statement in a function body. */
public abstract class Stmt {
  public final int line;

  private Stmt(int line) {
    this.line = line;
  }

  /** {@code var name: Type = value}; a missing value means zero. */
  public static final class Var extends Stmt {
    public final int name;
    public final TypeExpr type;
    public final @Nullable Expr value;

    public Var(int line, int name, TypeExpr type, @Nullable Expr value) {
      super(line);
      this.name = name;
      this.type = type;
      this.value = value;
    }
  }

  /** {@code lhs op rhs}, where op is "=" or a compound assignment operator such as "+=". */
  public static final class Assign extends Stmt {
    /** An assignment key, e.g. {@link Key#EQ} or {@link Key#PLUS_EQ}. */
    public final int op;

    public final Expr lhs;
    public final Expr rhs;

    public Assign(int line, int op, Expr lhs, Expr rhs) {
      super(line);
      this.op = op;
      this.lhs = lhs;
      this.rhs = rhs;
    }
  }

  /** A call evaluated for its effect. */
  public static final class ExprStmt extends Stmt {
    public final Expr expr;

    public ExprStmt(int line, Expr expr) {
      super(line);
      this.expr = expr;
    }
  }

  public static final class AssertStmt extends Stmt {
    public final Assert assertion;

    public AssertStmt(Assert assertion) {
      super(assertion.line);
      this.assertion = assertion;
    }
  }

  /** {@code if cond { then } else { orElse }}; "else if" is an If as the only orElse statement. */
  public static final class If extends Stmt {
    public final Expr condition;
    public final ImmutableList<Stmt> then;
    public final ImmutableList<Stmt> orElse;

    public If(int line, Expr condition, ImmutableList<Stmt> then, ImmutableList<Stmt> orElse) {
      super(line);
      this.condition = condition;
      this.then = then;
      this.orElse = orElse;
    }
  }

  /** {@code while.label cond, pre ..., inv ..., post ... { body }}. */
  public static final class While extends Stmt {
    /** The label's token, or zero if unlabeled. */
    public final int label;

    public final Expr condition;
    public final ImmutableList<Assert> asserts;
    public final ImmutableList<Stmt> body;

    public While(
        int line,
        int label,
        Expr condition,
        ImmutableList<Assert> asserts,
        ImmutableList<Stmt> body) {
      super(line);
      this.label = label;
      this.condition = condition;
      this.asserts = asserts;
      this.body = body;
    }
  }

  /** {@code break.label} or {@code continue.label}. */
  public static final class Jump extends Stmt {
    /** {@link Key#BREAK} or {@link Key#CONTINUE}. */
    public final int keyword;

    /** The label's token, or zero for the innermost loop. */
    public final int label;

    public Jump(int line, int keyword, int label) {
      super(line);
      this.keyword = keyword;
      this.label = label;
    }

    public boolean isBreak() {
      return keyword == Key.BREAK;
    }
  }

  /** {@code return value}; the value may be absent, a number, or a status. */
  public static final class Return extends Stmt {
    public final @Nullable Expr value;

    public Return(int line, @Nullable Expr value) {
      super(line);
      this.value = value;
    }
  }

  /** {@code yield "@status"}: suspends, then resumes at the next statement. */
  public static final class Yield extends Stmt {
    public final Expr status;

    public Yield(int line, Expr status) {
      super(line);
      this.status = status;
    }
  }
}
