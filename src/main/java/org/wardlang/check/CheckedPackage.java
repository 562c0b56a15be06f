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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import java.util.IdentityHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.wardlang.ast.Decl;
import org.wardlang.ast.SourceFile;
import org.wardlang.ast.TypeExpr;

/**
 * A package whose declarations have been resolved and whose function bodies have been verified.
 *
 * <p>A CheckedPackage is what dependent packages see: its declarations (public and private, though
 * only public ones are visible to other packages) and the canonical form of each declared type.
 */
public final class CheckedPackage {

  /** Methods are keyed by their receiver struct's name; free functions have receiver zero. */
  public record FuncKey(int receiver, int name) {}

  /** The package path, e.g. "std/deflate". */
  public final String path;

  /** The token of the last path segment, which is how other packages refer to this one. */
  public final int qualifier;

  /** The contents of the package's {@code packageid} declaration. */
  public final String packageId;

  /** The package's source files, sorted by filename. */
  public final ImmutableList<SourceFile> files;

  /** The paths of the packages named by {@code use} declarations. */
  public final ImmutableList<String> uses;

  final ImmutableMap<Integer, Decl.Const> consts;
  final ImmutableMap<Integer, Decl.StatusDecl> statuses;
  final ImmutableMap<Integer, Decl.Struct> structs;
  final ImmutableMap<FuncKey, Decl.Func> funcs;

  /** The value of each const, keyed by name. */
  final Map<Integer, BigInteger> constValues;

  /**
   * The canonical form of each type that appears in a declaration (keyed by identity): refinement
   * bounds and array lengths are reduced to literals, and built-in types are unqualified.
   */
  final IdentityHashMap<TypeExpr, TypeExpr> canonical;

  CheckedPackage(
      String path,
      int qualifier,
      String packageId,
      ImmutableList<SourceFile> files,
      ImmutableList<String> uses,
      ImmutableMap<Integer, Decl.Const> consts,
      ImmutableMap<Integer, Decl.StatusDecl> statuses,
      ImmutableMap<Integer, Decl.Struct> structs,
      ImmutableMap<FuncKey, Decl.Func> funcs,
      Map<Integer, BigInteger> constValues,
      IdentityHashMap<TypeExpr, TypeExpr> canonical) {
    this.path = path;
    this.qualifier = qualifier;
    this.packageId = packageId;
    this.files = files;
    this.uses = uses;
    this.consts = consts;
    this.statuses = statuses;
    this.structs = structs;
    this.funcs = funcs;
    this.constValues = constValues;
    this.canonical = canonical;
  }

  public Decl.@Nullable Func func(int receiver, int name) {
    return funcs.get(new FuncKey(receiver, name));
  }

  public Decl.@Nullable Struct struct(int name) {
    return structs.get(name);
  }

  public Decl.@Nullable Const constDecl(int name) {
    return consts.get(name);
  }

  public Decl.@Nullable StatusDecl status(int literal) {
    return statuses.get(literal);
  }

  /** Returns the value of the named const, or null if there is no such const. */
  public @Nullable BigInteger constValue(int name) {
    return constValues.get(name);
  }

  /** Returns the public declarations of the given class, in file and then source order. */
  public <T extends Decl> ImmutableList<T> publicDecls(Class<T> kind) {
    return files.stream()
        .flatMap(f -> f.declsOf(kind).stream())
        .filter(d -> d.isPublic)
        .collect(ImmutableList.toImmutableList());
  }

  /** Returns the canonical form of a type that appears in one of this package's declarations. */
  TypeExpr canonicalType(TypeExpr declared) {
    TypeExpr result = canonical.get(declared);
    if (result == null) {
      throw new IllegalArgumentException("type not declared in " + path);
    }
    return result;
  }

  @Override
  public String toString() {
    return path;
  }
}
