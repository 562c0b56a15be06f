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

import com.google.common.base.Preconditions;
import java.util.Objects;
import java.util.function.UnaryOperator;
import org.jspecify.annotations.Nullable;
import org.wardlang.token.Key;
import org.wardlang.token.TokenId;
import org.wardlang.token.TokenMap;

/**
 * An immutable type expression, such as {@code base.u32[..= 10]}, {@code array[4] u8} or {@code
 * slice u8}.
 */
public final class TypeExpr {

  public enum Kind {
    /** A (possibly package-qualified, possibly refined) named type. */
    NAMED,
    ARRAY,
    SLICE,
    TABLE,
    PTR,
    NPTR
  }

  /** The type of integer constants that have not (yet) been given a machine type. */
  public static final TypeExpr IDEAL =
      named(0, TokenId.of(Key.IDEAL, TokenId.FLAG_OTHER), null, null);

  public final Kind kind;

  /** For a qualified NAMED type, the package's token; otherwise zero. */
  public final int pkg;

  /** For a NAMED type, the name's token; otherwise zero. */
  public final int name;

  /** The inclusive lower bound of a refined NAMED type, or null if unrefined below. */
  public final @Nullable Expr lo;

  /** The inclusive upper bound of a refined NAMED type, or null if unrefined above. */
  public final @Nullable Expr hi;

  /** The length of an ARRAY. */
  public final @Nullable Expr length;

  /** The element type of an ARRAY, SLICE or TABLE, or the target of a PTR or NPTR. */
  public final @Nullable TypeExpr inner;

  private TypeExpr(
      Kind kind,
      int pkg,
      int name,
      @Nullable Expr lo,
      @Nullable Expr hi,
      @Nullable Expr length,
      @Nullable TypeExpr inner) {
    this.kind = kind;
    this.pkg = pkg;
    this.name = name;
    this.lo = lo;
    this.hi = hi;
    this.length = length;
    this.inner = inner;
  }

  public static TypeExpr named(int pkg, int name, @Nullable Expr lo, @Nullable Expr hi) {
    return new TypeExpr(Kind.NAMED, pkg, name, lo, hi, null, null);
  }

  public static TypeExpr array(Expr length, TypeExpr element) {
    return new TypeExpr(Kind.ARRAY, 0, 0, null, null, length, element);
  }

  /** Returns a SLICE, TABLE, PTR or NPTR type. */
  public static TypeExpr of(Kind kind, TypeExpr inner) {
    Preconditions.checkArgument(kind != Kind.NAMED && kind != Kind.ARRAY);
    return new TypeExpr(kind, 0, 0, null, null, null, inner);
  }

  /** The key of a NAMED type's name, or zero for other kinds. */
  public int nameKey() {
    return (kind == Kind.NAMED) ? TokenId.key(name) : 0;
  }

  /** True if this names a built-in type, i.e. is unqualified or qualified by {@code base}. */
  public boolean isBuiltIn() {
    return kind == Kind.NAMED
        && (pkg == 0 || TokenId.key(pkg) == Key.BASE)
        && TokenId.isBuiltIn(name);
  }

  public boolean isNumType() {
    return isBuiltIn() && TokenId.isNumType(name);
  }

  public boolean isIdeal() {
    return kind == Kind.NAMED && nameKey() == Key.IDEAL;
  }

  /** True for a machine number type or the ideal type. */
  public boolean isNumeric() {
    return isNumType() || isIdeal();
  }

  public boolean isBool() {
    return isBuiltIn() && nameKey() == Key.BOOL;
  }

  public boolean isStatus() {
    return isBuiltIn() && nameKey() == Key.STATUS;
  }

  public boolean isContainer() {
    return kind == Kind.ARRAY || kind == Kind.SLICE || kind == Kind.TABLE;
  }

  public boolean isRefined() {
    return lo != null || hi != null;
  }

  /** Returns this type without its refinement; other kinds are returned unchanged. */
  public TypeExpr unrefined() {
    if (!isRefined()) {
      return this;
    }
    return named(pkg, name, null, null);
  }

  /** Returns true if this and {@code other} are the same type, ignoring refinements. */
  public boolean sameBase(TypeExpr other) {
    if (kind != other.kind) {
      return false;
    } else if (kind == Kind.NAMED) {
      // "u32" and "base.u32" are the same type.
      if (isBuiltIn() || other.isBuiltIn()) {
        return isBuiltIn() && other.isBuiltIn() && name == other.name;
      }
      return pkg == other.pkg && name == other.name;
    }
    return Objects.equals(length, other.length) && inner.sameBase(other.inner);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof TypeExpr other
        && kind == other.kind
        && pkg == other.pkg
        && name == other.name
        && Objects.equals(lo, other.lo)
        && Objects.equals(hi, other.hi)
        && Objects.equals(length, other.length)
        && Objects.equals(inner, other.inner);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, pkg, name, lo, hi, length, inner);
  }

  /** Returns the source form of this type. */
  public String str(TokenMap map) {
    return str(map, UnaryOperator.identity());
  }

  /**
   * Returns the source form of this type, with the name of each type declared in the current
   * package (unqualified and not built in) replaced by {@code localName}.
   */
  public String str(TokenMap map, UnaryOperator<String> localName) {
    return switch (kind) {
      case NAMED -> {
        StringBuilder sb = new StringBuilder();
        if (pkg != 0) {
          sb.append(map.name(pkg)).append('.');
        }
        sb.append(
            (pkg == 0 && !isBuiltIn()) ? localName.apply(map.name(name)) : map.name(name));
        if (isRefined()) {
          sb.append('[');
          if (lo != null) {
            sb.append(lo.str(map)).append(' ');
          }
          sb.append("..=");
          if (hi != null) {
            sb.append(' ').append(hi.str(map));
          }
          sb.append(']');
        }
        yield sb.toString();
      }
      case ARRAY -> "array[" + length.str(map) + "] " + inner.str(map, localName);
      case SLICE -> "slice " + inner.str(map, localName);
      case TABLE -> "table " + inner.str(map, localName);
      case PTR -> "ptr " + inner.str(map, localName);
      case NPTR -> "nptr " + inner.str(map, localName);
    };
  }
}
