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
import com.google.errorprone.annotations.FormatMethod;
import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import org.jspecify.annotations.Nullable;
import org.wardlang.ast.Assert;
import org.wardlang.ast.Decl;
import org.wardlang.ast.Effect;
import org.wardlang.ast.Expr;
import org.wardlang.ast.Field;
import org.wardlang.ast.Status;
import org.wardlang.ast.Stmt;
import org.wardlang.ast.TypeExpr;
import org.wardlang.compiler.CompileError;
import org.wardlang.token.Key;
import org.wardlang.token.TokenId;
import org.wardlang.token.TokenMap;

/**
 * Type-checks and verifies the body of one function.
 *
 * <p>Statements are visited in order while maintaining a {@link FactSet} of conditions known to
 * hold. Conditions of {@code if} and {@code while} statements, {@code assert}s and assignments add
 * facts; assignments and calls that may change state remove the facts they could invalidate. Each
 * operation with a precondition (arithmetic that must not overflow, indexing, division, shifts,
 * calls with {@code pre} clauses) is discharged against the current facts by a {@link
 * BoundsChecker}.
 */
final class FuncChecker {

  static final TypeExpr BOOL = TypeExpr.named(0, TokenId.builtIn(Key.BOOL), null, null);
  static final TypeExpr STATUS = TypeExpr.named(0, TokenId.builtIn(Key.STATUS), null, null);
  static final TypeExpr U64 = TypeExpr.named(0, TokenId.builtIn(Key.U64), null, null);

  static final Expr THIS = Expr.ident(TokenId.builtIn(Key.THIS));

  /** A local variable or parameter. */
  private record Local(TypeExpr type, boolean readOnly) {}

  /** The target of a call. */
  private record Callee(
      @Nullable CheckedPackage owner,
      Decl.@Nullable Func decl,
      @Nullable Expr receiver,
      @Nullable Expr container) {

    boolean isLength() {
      return decl == null;
    }
  }

  /**
   * Something a statement may change. If {@code elementsOnly} is true only the elements of the
   * {@code target} container change, not (for example) its length.
   */
  private record Mutation(Expr target, boolean elementsOnly) {
    boolean affects(Expr fact) {
      if (!elementsOnly) {
        return fact.mentions(target);
      }
      return fact.anyMatch(
          e -> (e.kind == Expr.Kind.INDEX || e.kind == Expr.Kind.SLICE) && e.lhs.equals(target));
    }
  }

  /** An enclosing {@code while} loop. */
  private static class Loop {
    final Stmt.While stmt;
    boolean hasBreak;

    Loop(Stmt.While stmt) {
      this.stmt = stmt;
    }
  }

  final Checker checker;
  final TokenMap map;
  private final Decl.Func func;
  private final Map<Integer, Local> locals = new HashMap<>();
  private final Map<Expr, TypeExpr> types = new HashMap<>();
  private final Deque<Loop> loops = new ArrayDeque<>();
  private final BoundsChecker bounds;

  /** The facts known at the current point of the function. */
  FactSet facts = new FactSet();

  /** The line of the statement being checked, for error messages. */
  private int line;

  FuncChecker(Checker checker, Decl.Func func) {
    this.checker = checker;
    this.map = checker.map;
    this.func = func;
    this.bounds = new BoundsChecker(this);
    this.line = func.line;
  }

  @FormatMethod
  CompileError error(String fmt, Object... args) {
    return checker.error(func.filename, line, fmt, args);
  }

  boolean isLocal(int id) {
    return locals.containsKey(id);
  }

  @Nullable BigInteger constValue(Expr e) {
    return checker.constValue(e, this::isLocal);
  }

  void check() {
    if (func.receiver != 0) {
      TypeExpr recv = TypeExpr.named(0, func.receiver, null, null);
      locals.put(THIS.id, new Local(TypeExpr.of(TypeExpr.Kind.PTR, recv), true));
    }
    for (Field f : func.in) {
      locals.put(f.name, new Local(checker.exportType(checker.self, f.type), true));
    }
    for (Field f : func.out) {
      locals.put(f.name, new Local(checker.exportType(checker.self, f.type), false));
    }
    for (Assert a : func.asserts) {
      line = a.line;
      requireBool(a.condition);
      bounds.checkExpr(a.condition);
      if (!a.isPost()) {
        facts.add(a.condition);
      }
    }
    line = func.line;
    if (!checkBlock(func.body)) {
      if (func.returnType != null) {
        throw error("missing return at end of %s", func.qualifiedName(map));
      }
      proveExit("at end of " + func.qualifiedName(map));
    }
  }

  // Statements

  /** Checks a list of statements; returns true if control never reaches the end of the list. */
  private boolean checkBlock(List<Stmt> stmts) {
    boolean terminated = false;
    for (Stmt stmt : stmts) {
      line = stmt.line;
      if (terminated) {
        throw error("unreachable code");
      }
      terminated = checkStmt(stmt);
    }
    return terminated;
  }

  private boolean checkStmt(Stmt stmt) {
    if (stmt instanceof Stmt.Var var) {
      checkVar(var);
    } else if (stmt instanceof Stmt.Assign assign) {
      checkAssign(assign);
    } else if (stmt instanceof Stmt.ExprStmt exprStmt) {
      if (exprStmt.expr.kind != Expr.Kind.CALL) {
        throw error("%s is not a call", exprStmt.expr.str(map));
      }
      checkCall(exprStmt.expr);
    } else if (stmt instanceof Stmt.AssertStmt assertStmt) {
      Assert a = assertStmt.assertion;
      requireBool(a.condition);
      bounds.checkExpr(a.condition);
      proveAssert(a, Map.of(), "");
      facts.add(a.condition);
    } else if (stmt instanceof Stmt.If ifStmt) {
      return checkIf(ifStmt);
    } else if (stmt instanceof Stmt.While whileStmt) {
      return checkWhile(whileStmt);
    } else if (stmt instanceof Stmt.Jump jump) {
      checkJump(jump);
      return true;
    } else if (stmt instanceof Stmt.Return ret) {
      checkReturn(ret);
      return true;
    } else if (stmt instanceof Stmt.Yield yield) {
      checkYield(yield);
    } else {
      throw new AssertionError(stmt);
    }
    return false;
  }

  private void checkVar(Stmt.Var var) {
    String name = map.name(var.name);
    if (isLocal(var.name) || TokenId.key(var.name) == Key.THIS) {
      throw error("duplicate variable \"%s\"", name);
    }
    TypeExpr type = checker.canonicalize(var.type, func.filename, line, this::isLocal);
    Expr value = var.value;
    if (value != null) {
      requireAssignable(type, value);
      bounds.checkExpr(value);
    } else if (type.isNumType()) {
      value = Exprs.constant(map, BigInteger.ZERO);
    } else if (type.isBool()) {
      value = Exprs.bool(false);
    }
    locals.put(var.name, new Local(type, false));
    Expr lhs = Expr.ident(var.name);
    if (value != null && type.isNumType()) {
      bounds.requireWithin(value, checker.typeRange(type));
    }
    facts.removeMentioning(lhs);
    if (value != null && (type.isNumType() || type.isBool()) && !value.mentions(lhs)) {
      facts.add(Exprs.compare(Key.X_BINARY_EQ_EQ, lhs, value));
    }
  }

  private void checkAssign(Stmt.Assign assign) {
    Expr lhs = assign.lhs;
    TypeExpr lhsType = typeOf(lhs);
    checkLocation(lhs);
    bounds.checkExpr(lhs);
    Range lhsRange = checker.typeRange(lhsType);
    if (assign.op == Key.EQ) {
      requireAssignable(lhsType, assign.rhs);
      bounds.checkExpr(assign.rhs);
      if (lhsType.isNumType()) {
        bounds.requireWithin(assign.rhs, lhsRange);
      }
      Mutation m = mutationOf(lhs);
      removeFacts(m);
      if (!m.elementsOnly
          && (lhsType.isNumType() || lhsType.isBool())
          && !assign.rhs.mentions(lhs)) {
        facts.add(Exprs.compare(Key.X_BINARY_EQ_EQ, lhs, assign.rhs));
      }
      return;
    }
    if (!lhsType.isNumType()) {
      throw error("%s is not a number", lhs.str(map));
    }
    Expr combined = Expr.binary(Key.binaryForm(assign.op), lhs, assign.rhs);
    typeOf(combined);
    bounds.checkExpr(combined);
    bounds.requireWithin(combined, lhsRange);
    if (lhs.kind != Expr.Kind.INDEX
        && (assign.op == Key.PLUS_EQ || assign.op == Key.MINUS_EQ)
        && !assign.rhs.mentions(lhs)) {
      updateFactsForIncrement(lhs, assign.op == Key.PLUS_EQ, assign.rhs);
    } else {
      removeFacts(mutationOf(lhs));
    }
  }

  /**
   * After {@code x += e} (or {@code x -= e}) each fact {@code x op R} becomes {@code x op (R + e)}
   * (or {@code x op (R - e)}); other facts mentioning {@code x} are dropped.
   */
  private void updateFactsForIncrement(Expr x, boolean plus, Expr e) {
    FactSet updated = new FactSet();
    for (Expr fact : facts.facts()) {
      if (!fact.mentions(x)) {
        updated.add(fact);
        continue;
      }
      Expr oriented = Exprs.orientedFact(fact, x);
      if (oriented != null && !oriented.rhs.mentions(x)) {
        Expr newRhs =
            Expr.binary(plus ? Key.X_BINARY_PLUS : Key.X_BINARY_MINUS, oriented.rhs, e);
        updated.add(Exprs.compare(oriented.op, x, bounds.simplify(newRhs)));
      }
    }
    facts = updated;
  }

  private boolean checkIf(Stmt.If ifStmt) {
    requireBool(ifStmt.condition);
    bounds.checkExpr(ifStmt.condition);
    FactSet before = facts.copy();
    facts.add(ifStmt.condition);
    boolean thenTerminates = checkBlock(ifStmt.then);
    FactSet afterThen = facts;
    facts = before;
    facts.add(Exprs.invert(ifStmt.condition));
    boolean elseTerminates = checkBlock(ifStmt.orElse);
    if (thenTerminates) {
      return elseTerminates;
    } else if (elseTerminates) {
      facts = afterThen;
    } else {
      afterThen.retainAll(facts);
      facts = afterThen;
    }
    return false;
  }

  private boolean checkWhile(Stmt.While w) {
    line = w.line;
    for (Loop loop : loops) {
      if (w.label != 0 && loop.stmt.label == w.label) {
        throw error("duplicate loop label \"%s\"", map.name(w.label));
      }
    }
    requireBool(w.condition);
    for (Assert a : w.asserts) {
      requireBool(a.condition);
    }
    // The pre and inv clauses must hold on entry.
    proveLoopAsserts(w, a -> !a.isPost(), "on entry to loop");

    // Facts about anything the body may change do not hold at the top of the loop.
    Set<Mutation> mutated = new LinkedHashSet<>();
    collectMutations(w.body, mutated);
    mutated.forEach(this::removeFacts);
    FactSet exitFacts = facts.copy();
    for (Assert a : w.asserts) {
      if (!a.isPost()) {
        bounds.checkExpr(a.condition);
        facts.add(a.condition);
      }
    }
    bounds.checkExpr(w.condition);
    FactSet headFacts = facts.copy();
    facts.add(w.condition);

    Loop loop = new Loop(w);
    loops.push(loop);
    if (!checkBlock(w.body)) {
      line = w.line;
      proveLoopAsserts(w, a -> !a.isPost(), "at end of loop body");
    }
    loops.pop();
    line = w.line;

    // Leaving the loop because its condition is false.
    facts = headFacts;
    facts.add(Exprs.invert(w.condition));
    proveLoopAsserts(w, Assert::isPost, "on exit from loop");
    if (loop.hasBreak) {
      // Only the inv and post clauses are known at a break.
      facts = exitFacts;
      for (Assert a : w.asserts) {
        if (a.isInv()) {
          facts.add(a.condition);
        }
      }
    }
    for (Assert a : w.asserts) {
      if (a.isPost()) {
        facts.add(a.condition);
      }
    }
    return Exprs.isTrue(w.condition) && !loop.hasBreak;
  }

  /** Checks and proves the clauses of a loop selected by {@code which}. */
  private void proveLoopAsserts(Stmt.While w, Predicate<Assert> which, String context) {
    for (Assert a : w.asserts) {
      if (which.test(a)) {
        bounds.checkExpr(a.condition);
        proveAssert(a, Map.of(), context);
      }
    }
  }

  private void checkJump(Stmt.Jump jump) {
    Loop target = null;
    for (Loop loop : loops) {
      if (jump.label == 0 || loop.stmt.label == jump.label) {
        target = loop;
        break;
      }
    }
    String keyword = map.name(TokenId.builtIn(jump.keyword));
    if (target == null) {
      if (jump.label == 0) {
        throw error("%s outside of a loop", keyword);
      }
      throw error("no enclosing loop labeled \"%s\"", map.name(jump.label));
    }
    if (jump.isBreak()) {
      target.hasBreak = true;
      proveLoopAsserts(target.stmt, a -> !a.isPre(), "at break");
    } else {
      proveLoopAsserts(target.stmt, a -> !a.isPost(), "at continue");
    }
  }

  private void checkReturn(Stmt.Return ret) {
    String name = func.qualifiedName(map);
    Expr value = ret.value;
    TypeExpr returnType =
        (func.returnType == null) ? null : checker.exportType(checker.self, func.returnType);
    if (value == null) {
      if (returnType != null) {
        throw error("missing return value in %s", name);
      }
    } else if (value.kind == Expr.Kind.STATUS && (returnType == null || !returnType.isStatus())) {
      Status status = statusOf(value);
      if (func.effect == Effect.PURE) {
        throw error("pure function %s cannot return a status", name);
      } else if (!status.isError()) {
        throw error("return of non-error status %s", value.str(map));
      }
      // An error return is exempt from the function's post conditions.
      return;
    } else if (returnType == null) {
      throw error("%s does not return a value", name);
    } else {
      requireAssignable(returnType, value);
      bounds.checkExpr(value);
      if (returnType.isNumType()) {
        bounds.requireWithin(value, checker.typeRange(returnType));
      }
    }
    proveExit("at return");
  }

  /** Proves the function's post and inv clauses. */
  private void proveExit(String context) {
    for (Assert a : func.asserts) {
      if (a.isPost() || a.isInv()) {
        proveAssert(a, Map.of(), context);
      }
    }
  }

  private void checkYield(Stmt.Yield yield) {
    if (func.effect != Effect.SUSPENDIBLE) {
      throw error("yield in non-suspendible function %s", func.qualifiedName(map));
    } else if (yield.status.kind != Expr.Kind.STATUS || !statusOf(yield.status).isSuspension()) {
      throw error("yield of non-suspension status %s", yield.status.str(map));
    }
    // The receiver may change while suspended.
    facts.removeMentioning(THIS);
  }

  // Asserts

  /**
   * Proves an assertion, substituting {@code bindings} into its condition and arguments. An
   * assertion with a {@code via} clause is proved by its rule, otherwise directly from the facts.
   */
  private void proveAssert(Assert a, Map<Integer, Expr> bindings, String context) {
    Expr cond = a.condition.substitute(bindings);
    if (a.reason == 0) {
      bounds.require(cond, context);
      return;
    }
    String ruleName = map.unquote(a.reason);
    ProofRule rule = checker.ctx.proofRules.lookup(ruleName);
    if (rule == null) {
      throw error("no such rule \"%s\"", ruleName);
    }
    Map<Integer, Expr> ruleBindings = rule.match(cond);
    if (ruleBindings == null) {
      throw error("\"%s\" does not match rule \"%s\"", cond.str(map), rule.name);
    }
    for (Expr.Arg arg : a.args) {
      if (!rule.placeholders.contains(arg.name())) {
        throw error("rule \"%s\" has no argument \"%s\"", rule.name, map.name(arg.name()));
      }
      Expr value = arg.value().substitute(bindings);
      typeOf(value);
      Expr prev = ruleBindings.putIfAbsent(arg.name(), value);
      if (prev != null && !prev.equals(value)) {
        throw error(
            "argument \"%s\" of rule \"%s\" is %s but the condition requires %s",
            map.name(arg.name()),
            rule.name,
            value.str(map),
            prev.str(map));
      }
    }
    for (Expr hypothesis : rule.hypotheses) {
      for (int placeholder : rule.placeholders) {
        if (hypothesis.mentions(Expr.ident(placeholder))
            && !ruleBindings.containsKey(placeholder)) {
          throw error("rule \"%s\" needs argument \"%s\"", rule.name, map.name(placeholder));
        }
      }
      Expr h = bounds.simplify(hypothesis.substitute(ruleBindings));
      if (!bounds.prove(h)) {
        throw error(
            "cannot prove \"%s\": rule \"%s\" hypothesis \"%s\" is not satisfied%s",
            cond.str(map),
            rule.name,
            h.str(map),
            bounds.factsSuffix());
      }
    }
  }

  // Mutations

  private static Mutation mutationOf(Expr lhs) {
    return (lhs.kind == Expr.Kind.INDEX)
        ? new Mutation(lhs.lhs, true)
        : new Mutation(lhs, false);
  }

  private void removeFacts(Mutation m) {
    FactSet kept = new FactSet();
    facts.facts().stream().filter(f -> !m.affects(f)).forEach(kept::add);
    facts = kept;
  }

  /** Collects everything that executing {@code stmts} may change. */
  private void collectMutations(List<Stmt> stmts, Set<Mutation> result) {
    for (Stmt stmt : stmts) {
      if (stmt instanceof Stmt.Assign assign) {
        result.add(mutationOf(assign.lhs));
        collectCallMutations(assign.rhs, result);
      } else if (stmt instanceof Stmt.Var var) {
        result.add(new Mutation(Expr.ident(var.name), false));
        if (var.value != null) {
          collectCallMutations(var.value, result);
        }
      } else if (stmt instanceof Stmt.ExprStmt exprStmt) {
        collectCallMutations(exprStmt.expr, result);
      } else if (stmt instanceof Stmt.If ifStmt) {
        collectCallMutations(ifStmt.condition, result);
        collectMutations(ifStmt.then, result);
        collectMutations(ifStmt.orElse, result);
      } else if (stmt instanceof Stmt.While w) {
        collectCallMutations(w.condition, result);
        collectMutations(w.body, result);
      } else if (stmt instanceof Stmt.Yield) {
        result.add(new Mutation(THIS, false));
      }
    }
  }

  /** A call to an impure function may change the receiver and anything reachable from this. */
  private static void collectCallMutations(Expr e, Set<Mutation> result) {
    e.anyMatch(
        x -> {
          if (x.kind == Expr.Kind.CALL && x.effect != Effect.PURE) {
            result.add(new Mutation(THIS, false));
            if (x.lhs.kind == Expr.Kind.SELECT) {
              result.add(new Mutation(x.lhs.lhs, false));
            }
          }
          return false;
        });
  }

  /** Checks that {@code lhs} may be assigned to. */
  private void checkLocation(Expr lhs) {
    switch (lhs.kind) {
      case IDENT -> {
        Local local = locals.get(lhs.id);
        if (local == null) {
          throw error("cannot assign to %s", lhs.str(map));
        } else if (local.readOnly) {
          throw error("cannot assign to parameter %s", lhs.str(map));
        }
      }
      case SELECT, INDEX -> {
        TypeExpr containerType = typeOf(lhs.lhs);
        switch (containerType.kind) {
          case PTR, NPTR, SLICE, TABLE -> {
            if (func.effect == Effect.PURE) {
              throw error(
                  "pure function %s cannot assign to %s", func.qualifiedName(map), lhs.str(map));
            }
          }
          default -> checkLocation(lhs.lhs);
        }
      }
      default -> throw error("cannot assign to %s", lhs.str(map));
    }
  }

  // Calls

  /**
   * Checks a call: its callee, effect marker, arguments and the callee's preconditions. Returns
   * the callee's result type, or null if it returns nothing.
   */
  @Nullable TypeExpr checkCall(Expr call) {
    Callee callee = resolveCallee(call);
    if (callee.isLength()) {
      if (!call.args.isEmpty() || call.effect != Effect.PURE) {
        throw error("%s takes no arguments and no effect marker", call.str(map));
      }
      bounds.checkExpr(callee.container);
      return U64;
    }
    Decl.Func decl = callee.decl;
    String name = decl.qualifiedName(map);
    if (call.effect != decl.effect) {
      throw error(
          "call %s must use effect marker \"%s\" to match %s",
          call.str(map),
          decl.effect.marker,
          name);
    } else if (!func.effect.mayCall(decl.effect)) {
      throw error(
          "%s function %s cannot call %s function %s",
          effectName(func.effect),
          func.qualifiedName(map),
          effectName(decl.effect),
          name);
    } else if (call.args.size() != decl.in.size()) {
      throw error(
          "%s takes %s arguments, got %s", name, decl.in.size(), call.args.size());
    }
    if (callee.receiver != null) {
      bounds.checkExpr(callee.receiver);
    }
    Map<Integer, Expr> bindings = new HashMap<>();
    for (int i = 0; i < decl.in.size(); i++) {
      Field param = decl.in.get(i);
      Expr.Arg arg = call.args.get(i);
      if (arg.name() != 0 && arg.name() != param.name) {
        throw error(
            "argument %s of %s should be named \"%s\"", i + 1, name, map.name(param.name));
      }
      TypeExpr paramType = checker.exportType(callee.owner, param.type);
      requireAssignable(paramType, arg.value());
      bounds.checkExpr(arg.value());
      if (paramType.isNumType()) {
        bounds.requireWithin(arg.value(), checker.typeRange(paramType));
      }
      bindings.put(param.name, arg.value());
    }
    bindings.put(THIS.id, (callee.receiver == null) ? THIS : callee.receiver);
    if (callee.owner != checker.self) {
      callee.owner.constValues.forEach((k, v) -> bindings.put(k, Exprs.constant(map, v)));
    }
    for (Assert a : decl.asserts) {
      if (!a.isPost()) {
        proveAssert(a, bindings, "precondition of " + name);
      }
    }
    if (decl.effect != Effect.PURE) {
      facts.removeMentioning(THIS);
      if (callee.receiver != null) {
        facts.removeMentioning(callee.receiver);
      }
    }
    // The callee's post conditions hold afterwards, unless they refer to its outputs.
    for (Assert a : decl.asserts) {
      if (a.isPost()
          && decl.out.stream().noneMatch(f -> a.condition.mentions(Expr.ident(f.name)))) {
        facts.add(a.condition.substitute(bindings));
      }
    }
    return (decl.returnType == null) ? null : checker.exportType(callee.owner, decl.returnType);
  }

  private static String effectName(Effect effect) {
    return switch (effect) {
      case PURE -> "pure";
      case IMPURE -> "impure";
      case SUSPENDIBLE -> "suspendible";
    };
  }

  private Callee resolveCallee(Expr call) {
    Expr target = call.lhs;
    if (target.kind == Expr.Kind.IDENT && !isLocal(target.id)) {
      Decl.Func decl = checker.self.func(0, target.id);
      if (decl == null) {
        throw error("unknown function \"%s\"", target.str(map));
      }
      return new Callee(checker.self, decl, null, null);
    } else if (target.kind != Expr.Kind.SELECT) {
      throw error("cannot call %s", target.str(map));
    }
    Expr base = target.lhs;
    if (base.kind == Expr.Kind.IDENT && !isLocal(base.id) && checker.isQualifier(base.id)) {
      CheckedPackage owner = checker.packageFor(base.id);
      Decl.Func decl = owner.func(0, target.id);
      if (decl == null || !decl.isPublic) {
        throw error("unknown function \"%s\"", target.str(map));
      }
      return new Callee(owner, decl, null, null);
    }
    TypeExpr baseType = deref(typeOf(base));
    if (TokenId.key(target.id) == Key.LENGTH && baseType.isContainer()) {
      return new Callee(null, null, null, base);
    }
    Checker.StructRef struct = checker.structOf(baseType);
    Decl.Func decl =
        (struct == null) ? null : struct.owner().func(struct.decl().structName, target.id);
    if (decl == null || (struct.owner() != checker.self && !decl.isPublic)) {
      throw error("unknown method \"%s\"", target.str(map));
    }
    return new Callee(struct.owner(), decl, base, null);
  }

  // Types

  /** Strips any pointer type constructors. */
  static TypeExpr deref(TypeExpr t) {
    while (t.kind == TypeExpr.Kind.PTR || t.kind == TypeExpr.Kind.NPTR) {
      t = t.inner;
    }
    return t;
  }

  private Status statusOf(Expr e) {
    Status status = checker.lookupStatus(e);
    if (status == null) {
      throw error("unknown status %s", e.str(map));
    }
    return status;
  }

  private void requireBool(Expr e) {
    if (!typeOf(e).isBool()) {
      throw error("%s is not a bool", e.str(map));
    }
  }

  /** Checks that {@code value} has a type that can be assigned to {@code dst}. */
  private void requireAssignable(TypeExpr dst, Expr value) {
    TypeExpr src = typeOf(value);
    boolean ok = dst.isNumType() ? (src.isIdeal() || dst.sameBase(src)) : dst.sameBase(src);
    if (!ok) {
      throw error(
          "cannot assign %s of type %s to type %s", value.str(map), src.str(map), dst.str(map));
    }
  }

  /** Returns the type of an expression, throwing a CompileError if it is not well-typed. */
  TypeExpr typeOf(Expr e) {
    TypeExpr result = types.get(e);
    if (result == null) {
      result = computeType(e);
      types.put(e, result);
    }
    return result;
  }

  private TypeExpr computeType(Expr e) {
    switch (e.kind) {
      case LITERAL -> {
        return TokenId.isNumLiteral(e.id) ? TypeExpr.IDEAL : BOOL;
      }
      case IDENT -> {
        Local local = locals.get(e.id);
        if (local != null) {
          return local.type;
        }
        Decl.Const decl = checker.self.constDecl(e.id);
        if (decl != null) {
          return checker.exportType(checker.self, decl.type);
        } else if (checker.isQualifier(e.id)) {
          throw error("package \"%s\" is not a value", e.str(map));
        }
        throw error("unknown identifier \"%s\"", e.str(map));
      }
      case STATUS -> {
        statusOf(e);
        return STATUS;
      }
      case UNARY -> {
        TypeExpr t = typeOf(e.rhs);
        if (e.op == Key.X_UNARY_NOT) {
          requireBool(e.rhs);
          return BOOL;
        }
        return requireNumeric(e.rhs, t).unrefined();
      }
      case BINARY -> {
        return binaryType(e, e.op, e.lhs, e.rhs);
      }
      case ASSOCIATIVE -> {
        int op = Checker.assocToBinary(e.op);
        ImmutableList<Expr> operands = e.operands();
        TypeExpr result = typeOf(operands.get(0));
        for (int i = 1; i < operands.size(); i++) {
          result = binaryResult(e, op, operands.get(0), result, operands.get(i));
        }
        return result;
      }
      case AS -> {
        requireNumeric(e.lhs, typeOf(e.lhs));
        TypeExpr target = checker.canonicalize(e.type, func.filename, line, this::isLocal);
        if (!target.isNumType()) {
          throw error("cannot convert %s to %s", e.lhs.str(map), target.str(map));
        }
        return target;
      }
      case CALL -> {
        TypeExpr result = returnTypeOf(e);
        if (result == null) {
          throw error("%s does not return a value", e.str(map));
        }
        return result;
      }
      case INDEX -> {
        TypeExpr t = deref(typeOf(e.lhs));
        if (!t.isContainer()) {
          throw error("%s cannot be indexed", e.lhs.str(map));
        }
        requireNumeric(e.rhs, typeOf(e.rhs));
        return t.inner;
      }
      case SLICE -> {
        TypeExpr t = deref(typeOf(e.lhs));
        if (t.kind != TypeExpr.Kind.ARRAY && t.kind != TypeExpr.Kind.SLICE) {
          throw error("%s cannot be sliced", e.lhs.str(map));
        }
        for (Expr bound : new Expr[] {e.mhs, e.rhs}) {
          if (bound != null) {
            requireNumeric(bound, typeOf(bound));
          }
        }
        return TypeExpr.of(TypeExpr.Kind.SLICE, t.inner);
      }
      case SELECT -> {
        return selectType(e);
      }
    }
    throw new AssertionError(e.kind);
  }

  /** The type of a call's result, without checking the call's arguments. */
  private @Nullable TypeExpr returnTypeOf(Expr call) {
    Callee callee = resolveCallee(call);
    if (callee.isLength()) {
      return U64;
    }
    Decl.Func decl = callee.decl;
    return (decl.returnType == null) ? null : checker.exportType(callee.owner, decl.returnType);
  }

  private TypeExpr selectType(Expr e) {
    Expr base = e.lhs;
    if (base.kind == Expr.Kind.IDENT && !isLocal(base.id) && checker.isQualifier(base.id)) {
      CheckedPackage owner = checker.packageFor(base.id);
      Decl.Const decl = owner.constDecl(e.id);
      if (decl == null || !decl.isPublic) {
        throw error("unknown constant %s", e.str(map));
      }
      return checker.exportType(owner, decl.type);
    }
    Checker.StructRef struct = checker.structOf(deref(typeOf(base)));
    if (struct == null) {
      throw error("%s has no fields", base.str(map));
    } else if (struct.owner() != checker.self) {
      throw error("cannot access field %s of another package's struct", e.str(map));
    }
    for (Field field : struct.decl().fields) {
      if (field.name == e.id) {
        return checker.exportType(struct.owner(), field.type);
      }
    }
    throw error("no field \"%s\" in %s", map.name(e.id), map.name(struct.decl().structName));
  }

  private TypeExpr binaryType(Expr e, int op, Expr lhs, Expr rhs) {
    TypeExpr lt = typeOf(lhs);
    TypeExpr rt = typeOf(rhs);
    if (op == Key.X_BINARY_AND || op == Key.X_BINARY_OR) {
      requireBool(lhs);
      requireBool(rhs);
      return BOOL;
    } else if (op == Key.X_BINARY_EQ_EQ || op == Key.X_BINARY_NOT_EQ) {
      if ((lt.isBool() && rt.isBool()) || (lt.isStatus() && rt.isStatus())) {
        return BOOL;
      }
      binaryResult(e, op, lhs, lt, rhs);
      return BOOL;
    } else if (Key.isComparison(op)) {
      binaryResult(e, op, lhs, lt, rhs);
      return BOOL;
    } else if (op == Key.X_BINARY_SHIFT_L
        || op == Key.X_BINARY_SHIFT_R
        || op == Key.X_BINARY_MOD_SHIFT_L) {
      requireNumeric(rhs, rt);
      TypeExpr result = requireNumeric(lhs, lt).unrefined();
      requireMachineType(e, op, result);
      return result;
    }
    TypeExpr result = binaryResult(e, op, lhs, lt, rhs);
    requireMachineType(e, op, result);
    return result;
  }

  /** Modular and saturating arithmetic are defined by the bounds of a machine type. */
  private void requireMachineType(Expr e, int op, TypeExpr type) {
    if (op >= Key.X_BINARY_MOD_PLUS && op <= Key.X_BINARY_SAT_MINUS && !type.isNumType()) {
      throw error("%s needs an operand with a number type", e.str(map));
    }
  }

  /**
   * Returns the type of combining numeric operands of types {@code lt} and the type of {@code
   * rhs}: the ideal type adapts to the other operand, and otherwise both must have the same base.
   */
  private TypeExpr binaryResult(Expr e, int op, Expr lhs, TypeExpr lt, Expr rhs) {
    TypeExpr rt = typeOf(rhs);
    requireNumeric(lhs, lt);
    requireNumeric(rhs, rt);
    if (lt.isIdeal()) {
      return rt.unrefined();
    } else if (rt.isIdeal() || lt.sameBase(rt)) {
      return lt.unrefined();
    }
    throw error(
        "type mismatch in %s: %s vs %s",
        e.str(map),
        lt.unrefined().str(map),
        rt.unrefined().str(map));
  }

  private TypeExpr requireNumeric(Expr e, TypeExpr t) {
    if (!t.isNumeric()) {
      throw error("%s is not a number", e.str(map));
    }
    return t;
  }
}
