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

import java.util.function.UnaryOperator;
import org.wardlang.token.TokenMap;

/** A {@code name: Type} pair, used for struct fields and function parameters. */
public final class Field {
  public final int name;
  public final TypeExpr type;
  public final int line;

  public Field(int name, TypeExpr type, int line) {
    this.name = name;
    this.type = type;
    this.line = line;
  }

  public String str(TokenMap map) {
    return str(map, UnaryOperator.identity());
  }

  /** See {@link TypeExpr#str(TokenMap, UnaryOperator)}. */
  public String str(TokenMap map, UnaryOperator<String> localTypeName) {
    return map.name(name) + ": " + type.str(map, localTypeName);
  }
}
