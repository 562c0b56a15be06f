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

/**
 * The effect marker on a function signature or call. The constants are ordered so that a function
 * may only call functions whose effect is no greater than its own.
 */
public enum Effect {
  /** No marker: the function neither mutates its receiver nor suspends. */
  PURE(""),
  /** "{@code !}": the function may mutate state but never suspends. */
  IMPURE("!"),
  /** "{@code ?}": the function may mutate state and may suspend, e.g. to request more input. */
  SUSPENDIBLE("?");

  public final String marker;

  Effect(String marker) {
    this.marker = marker;
  }

  /** Returns true if a function with this effect may call one with the given effect. */
  public boolean mayCall(Effect callee) {
    return callee.compareTo(this) <= 0;
  }
}
