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
import org.wardlang.token.Key;

/**
 * An {@code assert}, {@code pre}, {@code inv} or {@code post} clause, with an optional proof hint
 * ({@code via "rule"(name: expr, ...)}).
 */
public final class Assert {
  /** One of {@link Key#ASSERT}, {@link Key#PRE}, {@link Key#INV} or {@link Key#POST}. */
  public final int keyword;

  public final Expr condition;

  /** The string literal token naming the proof rule, or zero if there is no {@code via}. */
  public final int reason;

  /** The rule arguments; each has a non-zero name. */
  public final ImmutableList<Expr.Arg> args;

  public final int line;

  public Assert(int keyword, Expr condition, int reason, ImmutableList<Expr.Arg> args, int line) {
    this.keyword = keyword;
    this.condition = condition;
    this.reason = reason;
    this.args = args;
    this.line = line;
  }

  public boolean isPre() {
    return keyword == Key.PRE;
  }

  public boolean isInv() {
    return keyword == Key.INV;
  }

  public boolean isPost() {
    return keyword == Key.POST;
  }
}
