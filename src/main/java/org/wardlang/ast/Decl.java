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
import org.wardlang.token.TokenMap;

/**
 * A top-level declaration. The subclasses are a closed set: {@link Use}, {@link PackageId}, {@link
 * Const}, {@link StatusDecl}, {@link Struct} and {@link Func}.
 */
public abstract class Decl {
  public final String filename;
  public final int line;

  /** True for {@code pub} declarations; {@code use} and {@code packageid} are never public. */
  public final boolean isPublic;

  private Decl(String filename, int line, boolean isPublic) {
    this.filename = filename;
    this.line = line;
    this.isPublic = isPublic;
  }

  /**
   * The token of the name this declaration defines in its package's namespace, or zero if it
   * defines none.
   */
  public int name() {
    return 0;
  }

  /** {@code use "path"}. */
  public static final class Use extends Decl {
    /** The string literal token holding the path. */
    public final int path;

    public Use(String filename, int line, int path) {
      super(filename, line, false);
      this.path = path;
    }

    /** Returns the used package's path, without quotes. */
    public String path(TokenMap map) {
      return map.unquote(path);
    }
  }

  /** {@code packageid "abcd"}. */
  public static final class PackageId extends Decl {
    public final int id;

    public PackageId(String filename, int line, int id) {
      super(filename, line, false);
      this.id = id;
    }
  }

  /** {@code pub const NAME TYPE = VALUE}. */
  public static final class Const extends Decl {
    public final int constName;
    public final TypeExpr type;
    public final Expr value;

    public Const(
        String filename, int line, boolean isPublic, int constName, TypeExpr type, Expr value) {
      super(filename, line, isPublic);
      this.constName = constName;
      this.type = type;
      this.value = value;
    }

    @Override
    public int name() {
      return constName;
    }
  }

  /** {@code pub status "#message"}. Its name is the string literal itself. */
  public static final class StatusDecl extends Decl {
    public final int literal;

    public StatusDecl(String filename, int line, boolean isPublic, int literal) {
      super(filename, line, isPublic);
      this.literal = literal;
    }

    @Override
    public int name() {
      return literal;
    }

    /** Returns the declared status, or null if the literal has no valid sigil. */
    public @Nullable Status status(TokenMap map) {
      return Status.parse(map.unquote(literal));
    }
  }

  /** {@code pub struct Name?(fields)}. */
  public static final class Struct extends Decl {
    public final int structName;
    public final boolean suspendible;
    public final ImmutableList<Field> fields;

    public Struct(
        String filename,
        int line,
        boolean isPublic,
        int structName,
        boolean suspendible,
        ImmutableList<Field> fields) {
      super(filename, line, isPublic);
      this.structName = structName;
      this.suspendible = suspendible;
      this.fields = fields;
    }

    @Override
    public int name() {
      return structName;
    }
  }

  /** A function or method declaration. */
  public static final class Func extends Decl {
    /** The receiver struct's name, or zero for a free function. */
    public final int receiver;

    public final int funcName;
    public final Effect effect;
    public final ImmutableList<Field> in;
    public final ImmutableList<Field> out;

    /** The declared result type, or null if the function returns nothing. */
    public final @Nullable TypeExpr returnType;

    /** The {@code pre}, {@code inv} and {@code post} clauses, in that order. */
    public final ImmutableList<Assert> asserts;

    public final ImmutableList<Stmt> body;

    public Func(
        String filename,
        int line,
        boolean isPublic,
        int receiver,
        int funcName,
        Effect effect,
        ImmutableList<Field> in,
        ImmutableList<Field> out,
        @Nullable TypeExpr returnType,
        ImmutableList<Assert> asserts,
        ImmutableList<Stmt> body) {
      super(filename, line, isPublic);
      this.receiver = receiver;
      this.funcName = funcName;
      this.effect = effect;
      this.in = in;
      this.out = out;
      this.returnType = returnType;
      this.asserts = asserts;
      this.body = body;
    }

    /** Free functions share the package namespace; methods are keyed by receiver instead. */
    @Override
    public int name() {
      return (receiver == 0) ? funcName : 0;
    }

    /** Returns "Recv.name" or "name". */
    public String qualifiedName(TokenMap map) {
      String name = map.name(funcName);
      return (receiver == 0) ? name : map.name(receiver) + "." + name;
    }
  }
}
