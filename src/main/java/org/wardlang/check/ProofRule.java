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
import com.google.common.collect.ImmutableSet;
import java.util.HashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.wardlang.ast.Expr;

/**
 * A named inference rule that an {@code assert ... via "rule"} can cite. A rule such as "{@code a
 * < b: a < c; c <= b}" has a conclusion ({@code a < b}) and hypotheses ({@code a < c} and {@code
 * c <= b}); each single-letter identifier is a placeholder for an arbitrary expression.
 *
 * <p>To use a rule, each placeholder is bound, either by matching the conclusion against the
 * asserted condition or by a named argument of the {@code via} clause; the rule then establishes
 * the condition if each hypothesis (with placeholders replaced) can be proved.
 */
public final class ProofRule {
  /** The rule's text, exactly as it must be cited. */
  public final String name;

  public final Expr conclusion;
  public final ImmutableList<Expr> hypotheses;

  /** The tokens of the placeholder identifiers. */
  public final ImmutableSet<Integer> placeholders;

  ProofRule(
      String name,
      Expr conclusion,
      ImmutableList<Expr> hypotheses,
      ImmutableSet<Integer> placeholders) {
    this.name = name;
    this.conclusion = conclusion;
    this.hypotheses = hypotheses;
    this.placeholders = placeholders;
  }

  /**
   * Matches {@code condition} against the conclusion. Returns the resulting placeholder bindings,
   * or null if the condition does not have the conclusion's shape.
   */
  public @Nullable Map<Integer, Expr> match(Expr condition) {
    Map<Integer, Expr> bindings = new HashMap<>();
    return unify(conclusion, condition, bindings) ? bindings : null;
  }

  private boolean unify(Expr pattern, Expr target, Map<Integer, Expr> bindings) {
    if (pattern.kind == Expr.Kind.IDENT && placeholders.contains(pattern.id)) {
      Expr prev = bindings.putIfAbsent(pattern.id, target);
      return prev == null || prev.equals(target);
    }
    if (pattern.kind != target.kind
        || pattern.op != target.op
        || pattern.id != target.id
        || pattern.args.size() != target.args.size()) {
      return false;
    }
    for (int i = 0; i < pattern.args.size(); i++) {
      if (!unify(pattern.args.get(i).value(), target.args.get(i).value(), bindings)) {
        return false;
      }
    }
    return unifyNullable(pattern.lhs, target.lhs, bindings)
        && unifyNullable(pattern.mhs, target.mhs, bindings)
        && unifyNullable(pattern.rhs, target.rhs, bindings);
  }

  private boolean unifyNullable(
      @Nullable Expr pattern, @Nullable Expr target, Map<Integer, Expr> bindings) {
    if (pattern == null || target == null) {
      return pattern == target;
    }
    return unify(pattern, target, bindings);
  }

  @Override
  public String toString() {
    return name;
  }
}
