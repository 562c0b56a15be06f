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
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.wardlang.ast.Decl;
import org.wardlang.ast.SourceFile;
import org.wardlang.check.CheckedPackage;
import org.wardlang.check.Checker;
import org.wardlang.resolve.DependencyResolver;
import org.wardlang.resolve.PackagePaths;

/**
 * Reads, parses and verifies the packages under a root directory. Each package is parsed at most
 * once and verified at most once; verification always follows the verification of everything the
 * package uses.
 */
public class PackageLoader implements DependencyResolver.UseReader {
  public final Context ctx;
  public final Path root;

  private final Map<String, ImmutableList<Path>> sources = new HashMap<>();
  private final Map<String, ImmutableList<SourceFile>> parsed = new HashMap<>();
  private final DependencyResolver resolver;

  public PackageLoader(Context ctx, Path root) {
    this.ctx = ctx;
    this.root = root;
    this.resolver = new DependencyResolver(this);
  }

  /** True if the base package has source files; otherwise it is entirely built in. */
  public boolean hasBaseSource() throws IOException {
    return !sourceFiles(Compiler.BASE).isEmpty();
  }

  /** True if {@code path} is the base package and has no source, so needs no checking. */
  public boolean isBuiltIn(String path) throws IOException {
    return path.equals(Compiler.BASE) && !hasBaseSource();
  }

  /** Returns the sorted source files of a package; may be empty. */
  public ImmutableList<Path> sourceFiles(String path) throws IOException {
    ImmutableList<Path> result = sources.get(path);
    if (result == null) {
      result = Compiler.sourceFiles(root, path);
      sources.put(path, result);
    }
    return result;
  }

  /** Returns the parsed source files of a package, which must have at least one. */
  public ImmutableList<SourceFile> parsed(String path) throws IOException {
    ImmutableList<SourceFile> result = parsed.get(path);
    if (result == null) {
      PackagePaths.validate(path);
      ImmutableList<Path> files = sourceFiles(path);
      if (files.isEmpty()) {
        throw new CompileError(
            CompileError.Phase.RESOLVE,
            String.format("no %s files in package \"%s\"", Compiler.EXTENSION, path),
            null,
            0);
      }
      result = Compiler.parsePackage(ctx, path, files);
      parsed.put(path, result);
    }
    return result;
  }

  @Override
  public ImmutableList<String> uses(String path) throws IOException {
    if (isBuiltIn(path)) {
      return ImmutableList.of();
    }
    ImmutableList.Builder<String> result = ImmutableList.builder();
    for (SourceFile file : parsed(path)) {
      for (Decl.Use use : file.declsOf(Decl.Use.class)) {
        result.add(use.path(ctx.tokenMap));
      }
    }
    return result.build();
  }

  /**
   * Returns {@code path} and every package it depends on, in the order they must be verified. The
   * base package always comes first, even when it is built in.
   */
  public ImmutableList<String> dependencyOrder(String path) throws IOException {
    return resolver.resolve(path);
  }

  /** Verifies {@code path} (after everything it depends on) if it has not already been verified. */
  public CheckedPackage check(String path) throws IOException {
    for (String p : dependencyOrder(path)) {
      if (!isBuiltIn(p) && ctx.checked(p) == null) {
        Checker.check(ctx, p, parsed(p));
      }
    }
    return ctx.checked(path);
  }
}
