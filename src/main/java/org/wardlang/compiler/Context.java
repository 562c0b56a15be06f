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

package org.wardlang.compiler;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.wardlang.check.CheckedPackage;
import org.wardlang.check.ProofRules;
import org.wardlang.token.TokenMap;

/**
 * The state shared by every step of one compilation: the token intern table, the proof rules in
 * effect, and the packages that have been checked so far.
 *
 * <p>Each compilation (and each test) creates its own Context; nothing is shared between Contexts.
 */
public class Context {
  public final TokenMap tokenMap;
  public final ProofRules proofRules;

  /** Keyed by package path, in the order the packages were checked. */
  private final Map<String, CheckedPackage> packages = new LinkedHashMap<>();

  public Context() {
    this(ProofRules.CURRENT_VERSION);
  }

  public Context(int proofRulesVersion) {
    this.tokenMap = new TokenMap();
    this.proofRules = ProofRules.create(tokenMap, proofRulesVersion);
  }

  /** Returns the checked package with the given path, or null if it has not been checked. */
  public @Nullable CheckedPackage checked(String path) {
    return packages.get(path);
  }

  /** Records a newly-checked package. */
  public void add(CheckedPackage pkg) {
    Preconditions.checkState(
        packages.putIfAbsent(pkg.path, pkg) == null, "package %s checked twice", pkg.path);
  }

  /** Returns all checked packages, in the order they were checked. */
  public ImmutableList<CheckedPackage> packages() {
    return ImmutableList.copyOf(packages.values());
  }
}
