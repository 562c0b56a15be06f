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

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;
import org.wardlang.ast.SourceFile;
import org.wardlang.parse.Parser;
import org.wardlang.token.Lexer;
import org.wardlang.token.Token;

/** Static methods for reading and parsing Ward source. */
public class Compiler {
  // Statics only
  private Compiler() {}

  /** The extension of Ward source files. */
  public static final String EXTENSION = ".ward";

  /** The path of the implicit base package. */
  public static final String BASE = "base";

  /** Tokenizes and parses a single source file. */
  public static SourceFile parse(Context ctx, String filename, byte[] src) {
    ImmutableList<Token> tokens = Lexer.tokenize(ctx.tokenMap, filename, src);
    return Parser.parse(ctx.tokenMap, filename, tokens);
  }

  /** Tokenizes and parses a single source file, given as a string. */
  public static SourceFile parse(Context ctx, String filename, String src) {
    return parse(ctx, filename, src.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Returns the Ward source files directly in the directory for package {@code path} under
   * {@code root}, sorted by name; returns an empty list if there is no such directory.
   */
  public static ImmutableList<Path> sourceFiles(Path root, String path) throws IOException {
    Path dir = root.resolve(path);
    if (!Files.isDirectory(dir)) {
      return ImmutableList.of();
    }
    try (Stream<Path> files = Files.list(dir)) {
      return files
          .filter(f -> f.getFileName().toString().endsWith(EXTENSION) && Files.isRegularFile(f))
          .sorted()
          .collect(ImmutableList.toImmutableList());
    }
  }

  /**
   * Parses each of the given files. Each SourceFile is named by its package path and file name
   * (e.g. "std/adler32/adler32.ward"), which is how errors refer to it.
   */
  public static ImmutableList<SourceFile> parsePackage(
      Context ctx, String path, ImmutableList<Path> files) throws IOException {
    ImmutableList.Builder<SourceFile> result = ImmutableList.builder();
    for (Path file : files) {
      String filename = path + "/" + file.getFileName();
      result.add(parse(ctx, filename, Files.readAllBytes(file)));
    }
    return result.build();
  }
}
