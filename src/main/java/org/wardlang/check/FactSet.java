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
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.wardlang.ast.Expr;
import org.wardlang.token.TokenMap;

/**
 * The boolean expressions known to be true at a point in a function body.
 *
 * <p>Facts are kept in the order they were learned, without duplicates; a conjunction is stored as
 * its separate conjuncts. A FactSet is mutable; branches of control flow work on {@link #copy}s and
 * are combined with {@link #retainAll}.
 */
public class FactSet {
  private final List<Expr> facts;

  public FactSet() {
    this.facts = new ArrayList<>();
  }

  private FactSet(List<Expr> facts) {
    this.facts = new ArrayList<>(facts);
  }

  public FactSet copy() {
    return new FactSet(facts);
  }

  /** Adds each conjunct of {@code fact} that is not already present (or trivially true). */
  public void add(Expr fact) {
    List<Expr> conjuncts = new ArrayList<>();
    Exprs.addConjuncts(fact, conjuncts);
    for (Expr conjunct : conjuncts) {
      if (!Exprs.isTrue(conjunct) && !facts.contains(conjunct)) {
        facts.add(conjunct);
      }
    }
  }

  public boolean contains(Expr fact) {
    return facts.contains(fact);
  }

  /** Removes every fact that mentions {@code e}, e.g. because the value of {@code e} changed. */
  public void removeMentioning(Expr e) {
    facts.removeIf(f -> f.mentions(e));
  }

  /** Removes every fact not also in {@code other}; used where two control flow paths join. */
  public void retainAll(FactSet other) {
    facts.retainAll(other.facts);
  }

  /** Replaces the contents of this FactSet with those of {@code other}. */
  public void setTo(FactSet other) {
    facts.clear();
    facts.addAll(other.facts);
  }

  public ImmutableList<Expr> facts() {
    return ImmutableList.copyOf(facts);
  }

  public boolean isEmpty() {
    return facts.isEmpty();
  }

  /** Returns the facts in source form, separated by semicolons. */
  public String str(TokenMap map) {
    return facts.stream().map(f -> f.str(map)).collect(Collectors.joining("; "));
  }
}
