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

package org.wardlang.gen;

import com.google.common.collect.ImmutableList;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.function.UnaryOperator;
import org.wardlang.ast.Decl;
import org.wardlang.ast.Field;
import org.wardlang.ast.SourceFile;
import org.wardlang.check.CheckedPackage;
import org.wardlang.compiler.Context;
import org.wardlang.token.TokenMap;
import org.wardlang.util.Base38;

/**
 * Re-emits the public surface of a package as Ward source: its package id, public statuses, and
 * the signatures of its public structs and functions, with bodies, asserts and private
 * declarations erased. Structs and functions are renamed with a prefix derived from the package
 * id, so that stubs from different packages cannot collide.
 */
public class StubGenerator implements CodeGenerator {

  public static final String LANGUAGE = "ward";

  static final String HEADER = "// Code generated by running \"ward gen\". DO NOT EDIT.\n\n";

  @Override
  public String language() {
    return LANGUAGE;
  }

  @Override
  public byte[] generate(Context ctx, CheckedPackage pkg, ImmutableList<Path> files) {
    return render(ctx.tokenMap, pkg).getBytes(StandardCharsets.UTF_8);
  }

  /** Returns the prefix for a package id, e.g. "__pkg0002E0F4". */
  public static String prefix(String packageId) {
    int encoded = Base38.encode(packageId);
    if (encoded < 0) {
      throw new GenError("invalid packageid \"%s\"", packageId);
    }
    return String.format("__pkg%08X", encoded);
  }

  static String render(TokenMap map, CheckedPackage pkg) {
    String prefix = prefix(pkg.packageId);
    StringBuilder sb = new StringBuilder(HEADER);
    sb.append(String.format("packageid \"%s\"  // %s\n\n", pkg.packageId, prefix));
    for (SourceFile file : pkg.files) {
      for (Decl decl : file.decls) {
        if (!decl.isPublic) {
          continue;
        }
        if (decl instanceof Decl.StatusDecl status) {
          sb.append("pub status ").append(map.name(status.literal)).append('\n');
        } else if (decl instanceof Decl.Struct struct) {
          sb.append(
              String.format(
                  "pub struct %s_%s%s()\n",
                  prefix, map.name(struct.structName), struct.suspendible ? "?" : ""));
        } else if (decl instanceof Decl.Func func) {
          renderFunc(map, prefix, func, sb);
        }
      }
    }
    return sb.toString();
  }

  private static void renderFunc(TokenMap map, String prefix, Decl.Func func, StringBuilder sb) {
    // The package's own types are renamed along with its structs.
    UnaryOperator<String> local = name -> prefix + "_" + name;
    sb.append("pub func ").append(prefix).append('_');
    sb.append(func.qualifiedName(map)).append(func.effect.marker);
    sb.append('(');
    appendFields(map, func.in, local, sb);
    sb.append(")(");
    appendFields(map, func.out, local, sb);
    sb.append(')');
    if (func.returnType != null) {
      sb.append(' ').append(func.returnType.str(map, local));
    }
    sb.append(" { }\n");
  }

  private static void appendFields(
      TokenMap map, List<Field> fields, UnaryOperator<String> local, StringBuilder sb) {
    for (int i = 0; i < fields.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(fields.get(i).str(map, local));
    }
  }
}
