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

/** The parsed form of one source file: its top-level declarations in source order. */
public final class SourceFile {
  public final String filename;
  public final ImmutableList<Decl> decls;

  public SourceFile(String filename, ImmutableList<Decl> decls) {
    this.filename = filename;
    this.decls = decls;
  }

  /** Returns the declarations of the given class, in source order. */
  public <T extends Decl> ImmutableList<T> declsOf(Class<T> kind) {
    return decls.stream()
        .filter(kind::isInstance)
        .map(kind::cast)
        .collect(ImmutableList.toImmutableList());
  }
}
