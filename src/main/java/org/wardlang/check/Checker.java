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
import com.google.errorprone.annotations.FormatMethod;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.IntPredicate;
import org.jspecify.annotations.Nullable;
import org.wardlang.ast.Decl;
import org.wardlang.ast.Expr;
import org.wardlang.ast.Field;
import org.wardlang.ast.SourceFile;
import org.wardlang.ast.Status;
import org.wardlang.ast.TypeExpr;
import org.wardlang.compiler.CompileError;
import org.wardlang.compiler.Context;
import org.wardlang.token.Key;
import org.wardlang.token.TokenId;
import org.wardlang.token.TokenMap;
import org.wardlang.util.Base38;

/**
 * Checks one package: resolves its declarations, checks its types and verifies each function
 * body (see {@link FuncChecker}). Packages must be checked in dependency order, since each {@code
 * use} must name a package that has already been checked in the same {@link Context}.
 *
 * <p>The package-level checks run in a fixed order (packageid, uses, names, statuses, consts,
 * structs, function signatures, function bodies), and the first error found is thrown as a {@link
 * CompileError}.
 */
public final class Checker {

  /** A struct declaration and the package that declares it. */
  record StructRef(CheckedPackage owner, Decl.Struct decl) {}

  private static final IntPredicate NO_LOCALS = id -> false;

  final Context ctx;
  final TokenMap map;
  private final String path;
  private final int qualifier;
  private final ImmutableList<SourceFile> files;

  private String packageId;
  private final List<String> uses = new ArrayList<>();

  /** The packages this one may refer to, keyed by qualifier token. */
  private final Map<Integer, CheckedPackage> qualifiers = new HashMap<>();

  /** Consts, statuses, structs and free functions share a single namespace. */
  private final Map<Integer, Decl> names = new HashMap<>();

  private final Map<Integer, Decl.Const> consts = new LinkedHashMap<>();
  private final Map<Integer, Decl.StatusDecl> statuses = new LinkedHashMap<>();
  private final Map<Integer, Decl.Struct> structs = new LinkedHashMap<>();
  private final Map<CheckedPackage.FuncKey, Decl.Func> funcs = new LinkedHashMap<>();
  private final Map<Integer, BigInteger> constValues = new HashMap<>();
  private final Set<Integer> constsInProgress = new HashSet<>();
  private final IdentityHashMap<TypeExpr, TypeExpr> canonical = new IdentityHashMap<>();

  /** Set once all declarations have been checked, before function bodies are verified. */
  CheckedPackage self;

  private Checker(Context ctx, String path, ImmutableList<SourceFile> files) {
    this.ctx = ctx;
    this.map = ctx.tokenMap;
    this.path = path;
    this.qualifier = map.intern(path.substring(path.lastIndexOf('/') + 1));
    this.files = files;
  }

  /**
   * Checks the given files as the package with the given path, adds the result to {@code ctx},
   * and returns it.
   */
  public static CheckedPackage check(Context ctx, String path, ImmutableList<SourceFile> files) {
    Checker checker = new Checker(ctx, path, files);
    checker.checkPackageId();
    checker.checkUses();
    checker.collectNames();
    checker.checkStatuses();
    checker.checkConsts();
    checker.checkStructs();
    checker.checkSignatures();
    checker.self =
        new CheckedPackage(
            path,
            checker.qualifier,
            checker.packageId,
            files,
            ImmutableList.copyOf(checker.uses),
            ImmutableMap.copyOf(checker.consts),
            ImmutableMap.copyOf(checker.statuses),
            ImmutableMap.copyOf(checker.structs),
            ImmutableMap.copyOf(checker.funcs),
            checker.constValues,
            checker.canonical);
    for (Decl.Func func : checker.funcs.values()) {
      new FuncChecker(checker, func).check();
    }
    ctx.add(checker.self);
    return checker.self;
  }

  @FormatMethod
  CompileError error(String filename, int line, String fmt, Object... args) {
    return new CompileError(CompileError.Phase.CHECK, String.format(fmt, args), filename, line);
  }

  @FormatMethod
  CompileError error(Decl decl, String fmt, Object... args) {
    return error(decl.filename, decl.line, fmt, args);
  }

  private <T extends Decl> List<T> allDecls(Class<T> kind) {
    List<T> result = new ArrayList<>();
    files.forEach(f -> result.addAll(f.declsOf(kind)));
    return result;
  }

  // Package-level phases

  private void checkPackageId() {
    Decl.PackageId prev = null;
    for (Decl.PackageId decl : allDecls(Decl.PackageId.class)) {
      if (prev != null) {
        throw error(
            decl, "duplicate packageid (previous declaration at %s:%s)", prev.filename, prev.line);
      }
      String id = map.unquote(decl.id);
      if (Base38.encode(id) < 0) {
        throw error(decl, "\"%s\" is not a valid packageid", id);
      }
      packageId = id;
      prev = decl;
    }
    if (prev == null) {
      throw new CompileError(
          CompileError.Phase.CHECK, "missing packageid declaration in " + path, null, 0);
    }
  }

  private void checkUses() {
    // The base package, if there is one, can always be referred to.
    CheckedPackage base = ctx.checked("base");
    if (base != null && !path.equals("base")) {
      qualifiers.put(base.qualifier, base);
    }
    for (Decl.Use decl : allDecls(Decl.Use.class)) {
      String usePath = decl.path(map);
      CheckedPackage used = ctx.checked(usePath);
      if (used == null) {
        throw error(decl, "cannot resolve `use \"%s\"`", usePath);
      }
      CheckedPackage prev = qualifiers.put(used.qualifier, used);
      if (prev != null && prev != used) {
        throw error(decl, "\"%s\" conflicts with package \"%s\"", usePath, prev.path);
      }
      if (!uses.contains(usePath)) {
        uses.add(usePath);
      }
    }
  }

  private void collectNames() {
    for (SourceFile file : files) {
      for (Decl decl : file.decls) {
        if (decl instanceof Decl.Func func && func.receiver != 0) {
          Decl.Func prev =
              funcs.putIfAbsent(new CheckedPackage.FuncKey(func.receiver, func.funcName), func);
          if (prev != null) {
            throw redefined(func, func.qualifiedName(map), prev);
          }
          continue;
        }
        int name = decl.name();
        if (name == 0) {
          continue;
        }
        Decl prev = names.putIfAbsent(name, decl);
        if (prev != null) {
          throw redefined(decl, map.name(name), prev);
        }
        if (decl instanceof Decl.Const c) {
          consts.put(name, c);
        } else if (decl instanceof Decl.StatusDecl s) {
          statuses.put(name, s);
        } else if (decl instanceof Decl.Struct s) {
          structs.put(name, s);
        } else if (decl instanceof Decl.Func f) {
          funcs.put(new CheckedPackage.FuncKey(0, f.funcName), f);
        }
      }
    }
  }

  private CompileError redefined(Decl decl, String name, Decl prev) {
    String quoted = name.startsWith("\"") ? name : "\"" + name + "\"";
    return error(
        decl, "%s redefined (previous declaration at %s:%s)", quoted, prev.filename, prev.line);
  }

  private void checkStatuses() {
    for (Decl.StatusDecl decl : statuses.values()) {
      if (decl.status(map) == null) {
        throw error(
            decl,
            "status %s must start with \"#\" (error) or \"@\" (suspension)",
            map.name(decl.literal));
      }
    }
  }

  private void checkConsts() {
    for (Decl.Const decl : consts.values()) {
      ownConstValue(decl);
    }
  }

  private BigInteger ownConstValue(Decl.Const decl) {
    BigInteger result = constValues.get(decl.constName);
    if (result != null) {
      return result;
    }
    String name = map.name(decl.constName);
    if (!constsInProgress.add(decl.constName)) {
      throw error(decl, "const \"%s\" refers to itself", name);
    }
    TypeExpr type = canonicalize(decl.type, decl.filename, decl.line, NO_LOCALS);
    canonical.put(decl.type, type);
    if (!type.isNumType() && !type.isBool()) {
      throw error(decl, "const \"%s\" must have a number or bool type", name);
    }
    result = constValue(decl.value, NO_LOCALS);
    if (result == null) {
      throw error(decl, "const \"%s\" value %s is not constant", name, decl.value.str(map));
    }
    Range bounds = typeRange(type);
    if (!bounds.contains(result)) {
      throw error(decl, "const \"%s\" value %s is not within bounds %s", name, result, bounds);
    }
    constsInProgress.remove(decl.constName);
    constValues.put(decl.constName, result);
    return result;
  }

  private void checkStructs() {
    for (Decl.Struct decl : structs.values()) {
      Set<Integer> fieldNames = new HashSet<>();
      for (Field field : decl.fields) {
        if (!fieldNames.add(field.name)) {
          throw error(decl.filename, field.line, "duplicate field \"%s\"", map.name(field.name));
        }
        canonical.put(field.type, canonicalize(field.type, decl.filename, field.line, NO_LOCALS));
      }
    }
    // Depth-first search for containment cycles; pointers do not count as containment.
    Map<Integer, Boolean> done = new HashMap<>();
    for (Decl.Struct decl : structs.values()) {
      checkAcyclic(decl, done);
    }
  }

  /** {@code done} maps each visited struct to true once all its dependencies have been checked. */
  private void checkAcyclic(Decl.Struct decl, Map<Integer, Boolean> done) {
    Boolean state = done.putIfAbsent(decl.structName, false);
    if (state != null) {
      if (!state) {
        throw error(decl, "cyclical struct definition \"%s\"", map.name(decl.structName));
      }
      return;
    }
    for (Field field : decl.fields) {
      TypeExpr t = canonical.get(field.type);
      while (t.kind == TypeExpr.Kind.ARRAY) {
        t = t.inner;
      }
      if (t.kind == TypeExpr.Kind.NAMED && t.pkg == 0 && !t.isBuiltIn()) {
        checkAcyclic(structs.get(t.name), done);
      }
    }
    done.put(decl.structName, true);
  }

  private void checkSignatures() {
    for (Decl.Func func : funcs.values()) {
      if (func.receiver != 0 && !structs.containsKey(func.receiver)) {
        throw error(func, "unknown receiver type \"%s\"", map.name(func.receiver));
      }
      Set<Integer> paramNames = new HashSet<>();
      for (Field field : func.in) {
        checkParam(func, field, paramNames);
      }
      for (Field field : func.out) {
        checkParam(func, field, paramNames);
      }
      if (func.returnType != null) {
        canonical.put(
            func.returnType, canonicalize(func.returnType, func.filename, func.line, NO_LOCALS));
      }
    }
  }

  private void checkParam(Decl.Func func, Field field, Set<Integer> paramNames) {
    if (TokenId.key(field.name) == Key.THIS || !paramNames.add(field.name)) {
      throw error(
          func.filename, field.line, "duplicate parameter \"%s\" in %s", map.name(field.name),
          func.qualifiedName(map));
    }
    canonical.put(field.type, canonicalize(field.type, func.filename, field.line, NO_LOCALS));
  }

  // Types

  /**
   * Returns the canonical form of a type written in this package: refinement bounds and array
   * lengths are evaluated to literals, and {@code base.T} is written {@code T}. Throws a
   * CompileError if the type is not valid.
   *
   * @param isLocal identifies names that are local variables (and so not constants)
   */
  TypeExpr canonicalize(TypeExpr t, String filename, int line, IntPredicate isLocal) {
    switch (t.kind) {
      case NAMED -> {
        if (t.isBuiltIn()) {
          return canonicalBuiltIn(t, filename, line, isLocal);
        } else if (t.isRefined()) {
          throw error(filename, line, "type %s cannot be refined", t.str(map));
        } else if (t.pkg == 0) {
          if (!structs.containsKey(t.name)) {
            throw error(filename, line, "unknown type \"%s\"", t.str(map));
          }
          return t;
        }
        CheckedPackage owner = qualifiers.get(t.pkg);
        if (owner == null) {
          throw error(filename, line, "unknown package \"%s\"", map.name(t.pkg));
        }
        Decl.Struct decl = owner.struct(t.name);
        if (decl == null || !decl.isPublic) {
          throw error(filename, line, "unknown type \"%s\"", t.str(map));
        }
        return t;
      }
      case ARRAY -> {
        BigInteger length = constValue(t.length, isLocal);
        if (length == null || length.signum() <= 0) {
          throw error(
              filename, line, "array length %s is not a positive constant", t.length.str(map));
        }
        return TypeExpr.array(
            Exprs.constant(map, length), canonicalize(t.inner, filename, line, isLocal));
      }
      default -> {
        return TypeExpr.of(t.kind, canonicalize(t.inner, filename, line, isLocal));
      }
    }
  }

  private TypeExpr canonicalBuiltIn(TypeExpr t, String filename, int line, IntPredicate isLocal) {
    int key = t.nameKey();
    if (!t.isNumType()) {
      if (key != Key.BOOL && key != Key.STATUS) {
        throw error(filename, line, "unknown type \"%s\"", t.str(map));
      } else if (t.isRefined()) {
        throw error(filename, line, "type %s cannot be refined", t.str(map));
      }
      return TypeExpr.named(0, t.name, null, null);
    }
    if (!t.isRefined()) {
      return TypeExpr.named(0, t.name, null, null);
    }
    Range base = Range.forNumType(key);
    BigInteger lo = (t.lo == null) ? base.lo : refinementBound(t, t.lo, filename, line, isLocal);
    BigInteger hi = (t.hi == null) ? base.hi : refinementBound(t, t.hi, filename, line, isLocal);
    if (lo.compareTo(hi) > 0 || !base.containsAll(Range.of(lo, hi))) {
      throw error(filename, line, "type refinement %s is out of bounds %s", t.str(map), base);
    }
    return TypeExpr.named(
        0,
        t.name,
        (t.lo == null) ? null : Exprs.constant(map, lo),
        (t.hi == null) ? null : Exprs.constant(map, hi));
  }

  private BigInteger refinementBound(
      TypeExpr t, Expr bound, String filename, int line, IntPredicate isLocal) {
    BigInteger result = constValue(bound, isLocal);
    if (result == null) {
      throw error(
          filename, line, "type refinement bound %s of %s is not constant", bound.str(map),
          t.str(map));
    }
    return result;
  }

  /** Returns the values that a canonical type can hold; non-numeric types are unbounded. */
  Range typeRange(TypeExpr t) {
    if (t.isBool()) {
      return Range.BOOL;
    } else if (!t.isNumType()) {
      return Range.IDEAL;
    }
    Range base = Range.forNumType(t.nameKey());
    if (!t.isRefined()) {
      return base;
    }
    return Range.of(
        (t.lo == null) ? base.lo : constValue(t.lo, NO_LOCALS),
        (t.hi == null) ? base.hi : constValue(t.hi, NO_LOCALS));
  }

  /**
   * Returns a type from one of {@code owner}'s declarations as it would be written in this
   * package, i.e. with {@code owner}'s own types qualified by its name.
   */
  TypeExpr exportType(CheckedPackage owner, TypeExpr declared) {
    TypeExpr t = owner.canonicalType(declared);
    return (owner == self) ? t : qualify(t, owner.qualifier);
  }

  private static TypeExpr qualify(TypeExpr t, int pkg) {
    return switch (t.kind) {
      case NAMED -> (t.isBuiltIn() || t.pkg != 0) ? t : TypeExpr.named(pkg, t.name, null, null);
      case ARRAY -> TypeExpr.array(t.length, qualify(t.inner, pkg));
      default -> TypeExpr.of(t.kind, qualify(t.inner, pkg));
    };
  }

  /** Returns the package that the given qualifier refers to, or null if there is none. */
  @Nullable CheckedPackage packageFor(int pkg) {
    if (pkg == 0) {
      return self;
    }
    CheckedPackage result = qualifiers.get(pkg);
    if (result != null) {
      return result;
    }
    // Types exported from a used package may name packages that this one does not use.
    return ctx.packages().stream().filter(p -> p.qualifier == pkg).findFirst().orElse(null);
  }

  /** True if {@code id} names a package that this one uses. */
  boolean isQualifier(int id) {
    return qualifiers.containsKey(id);
  }

  /** Returns the struct named by a canonical type, or null if it does not name a struct. */
  @Nullable StructRef structOf(TypeExpr t) {
    if (t.kind != TypeExpr.Kind.NAMED || t.isBuiltIn()) {
      return null;
    }
    CheckedPackage owner = packageFor(t.pkg);
    Decl.Struct decl = (owner == null) ? null : owner.struct(t.name);
    return (decl == null) ? null : new StructRef(owner, decl);
  }

  /** Returns the status denoted by a STATUS Expr, or null if it is not declared. */
  @Nullable Status lookupStatus(Expr e) {
    Decl.StatusDecl decl;
    if (e.pkg == 0) {
      decl = statuses.get(e.id);
      if (decl == null) {
        CheckedPackage base = qualifiers.get(TokenId.builtIn(Key.BASE));
        decl = (base == null) ? null : base.status(e.id);
      }
    } else {
      CheckedPackage owner = qualifiers.get(e.pkg);
      decl = (owner == null) ? null : owner.status(e.id);
      if (decl != null && !decl.isPublic) {
        decl = null;
      }
    }
    return (decl == null) ? null : decl.status(map);
  }

  // Constants

  /**
   * Returns the value of a constant expression, or null if {@code e} is not constant. Boolean
   * constants are represented as 0 and 1.
   *
   * @param isLocal identifies names that are local variables (and so not constants)
   */
  @Nullable BigInteger constValue(Expr e, IntPredicate isLocal) {
    switch (e.kind) {
      case LITERAL -> {
        int key = TokenId.key(e.id);
        if (key == Key.TRUE) {
          return BigInteger.ONE;
        } else if (key == Key.FALSE) {
          return BigInteger.ZERO;
        }
        return TokenId.isNumLiteral(e.id) ? Exprs.literalValue(map, e.id) : null;
      }
      case IDENT -> {
        if (isLocal.test(e.id)) {
          return null;
        }
        Decl.Const decl = consts.get(e.id);
        return (decl == null) ? null : ownConstValue(decl);
      }
      case SELECT -> {
        if (e.lhs.kind != Expr.Kind.IDENT || isLocal.test(e.lhs.id) || !isQualifier(e.lhs.id)) {
          return null;
        }
        CheckedPackage owner = qualifiers.get(e.lhs.id);
        Decl.Const decl = owner.constDecl(e.id);
        return (decl == null || !decl.isPublic) ? null : owner.constValue(e.id);
      }
      case UNARY -> {
        BigInteger v = constValue(e.rhs, isLocal);
        if (v == null) {
          return null;
        }
        return switch (e.op) {
          case Key.X_UNARY_MINUS -> v.negate();
          case Key.X_UNARY_NOT -> bool(v.signum() == 0);
          default -> v;
        };
      }
      case BINARY -> {
        BigInteger lhs = constValue(e.lhs, isLocal);
        BigInteger rhs = (lhs == null) ? null : constValue(e.rhs, isLocal);
        return (rhs == null) ? null : constBinary(e.op, lhs, rhs);
      }
      case ASSOCIATIVE -> {
        int binaryOp = assocToBinary(e.op);
        BigInteger result = null;
        for (Expr operand : e.operands()) {
          BigInteger v = constValue(operand, isLocal);
          if (v == null) {
            return null;
          }
          result = (result == null) ? v : constBinary(binaryOp, result, v);
          if (result == null) {
            return null;
          }
        }
        return result;
      }
      case AS -> {
        return constValue(e.lhs, isLocal);
      }
      default -> {
        return null;
      }
    }
  }

  /** Returns the binary X form corresponding to an associative X form. */
  static int assocToBinary(int assocOp) {
    return switch (assocOp) {
      case Key.X_ASSOC_PLUS -> Key.X_BINARY_PLUS;
      case Key.X_ASSOC_STAR -> Key.X_BINARY_STAR;
      case Key.X_ASSOC_AMP -> Key.X_BINARY_AMP;
      case Key.X_ASSOC_PIPE -> Key.X_BINARY_PIPE;
      case Key.X_ASSOC_HAT -> Key.X_BINARY_HAT;
      case Key.X_ASSOC_AND -> Key.X_BINARY_AND;
      case Key.X_ASSOC_OR -> Key.X_BINARY_OR;
      default -> throw new IllegalArgumentException("Not associative: " + assocOp);
    };
  }

  /** The largest shift applied to an ideal constant. */
  private static final int MAX_CONST_SHIFT = 1 << 12;

  /**
   * Evaluates a binary operator on ideal integers; returns null for operations that are undefined
   * (e.g. division by zero) or only defined for machine types (modular and saturating arithmetic).
   */
  private static @Nullable BigInteger constBinary(int op, BigInteger lhs, BigInteger rhs) {
    return switch (op) {
      case Key.X_BINARY_PLUS -> lhs.add(rhs);
      case Key.X_BINARY_MINUS -> lhs.subtract(rhs);
      case Key.X_BINARY_STAR -> lhs.multiply(rhs);
      case Key.X_BINARY_SLASH -> (rhs.signum() == 0) ? null : lhs.divide(rhs);
      case Key.X_BINARY_PERCENT -> (rhs.signum() == 0) ? null : lhs.remainder(rhs);
      case Key.X_BINARY_SHIFT_L -> isShift(rhs) ? lhs.shiftLeft(rhs.intValue()) : null;
      case Key.X_BINARY_SHIFT_R -> isShift(rhs) ? lhs.shiftRight(rhs.intValue()) : null;
      case Key.X_BINARY_AMP -> lhs.and(rhs);
      case Key.X_BINARY_AMP_HAT -> lhs.andNot(rhs);
      case Key.X_BINARY_PIPE -> lhs.or(rhs);
      case Key.X_BINARY_HAT -> lhs.xor(rhs);
      case Key.X_BINARY_NOT_EQ -> bool(lhs.compareTo(rhs) != 0);
      case Key.X_BINARY_LESS_THAN -> bool(lhs.compareTo(rhs) < 0);
      case Key.X_BINARY_LESS_EQ -> bool(lhs.compareTo(rhs) <= 0);
      case Key.X_BINARY_EQ_EQ -> bool(lhs.compareTo(rhs) == 0);
      case Key.X_BINARY_GREATER_EQ -> bool(lhs.compareTo(rhs) >= 0);
      case Key.X_BINARY_GREATER_THAN -> bool(lhs.compareTo(rhs) > 0);
      case Key.X_BINARY_AND -> bool(lhs.signum() != 0 && rhs.signum() != 0);
      case Key.X_BINARY_OR -> bool(lhs.signum() != 0 || rhs.signum() != 0);
      default -> null;
    };
  }

  private static boolean isShift(BigInteger amount) {
    return amount.signum() >= 0 && amount.compareTo(BigInteger.valueOf(MAX_CONST_SHIFT)) <= 0;
  }

  private static BigInteger bool(boolean b) {
    return b ? BigInteger.ONE : BigInteger.ZERO;
  }
}
