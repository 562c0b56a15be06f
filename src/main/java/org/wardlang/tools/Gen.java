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

package org.wardlang.tools;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.wardlang.compiler.CompileError;
import org.wardlang.compiler.Context;
import org.wardlang.compiler.PackageLoader;
import org.wardlang.gen.CodeGenerator;
import org.wardlang.gen.CodegenDriver;
import org.wardlang.gen.GenError;
import org.wardlang.gen.ProcessCodeGenerator;
import org.wardlang.gen.StubGenerator;
import org.wardlang.resolve.PackagePaths;

/**
 * A command-line tool that verifies Ward packages and generates code for them.
 *
 * <p>The arguments are package paths (e.g. "std/adler32"), each optionally ending in "/..." to
 * include every package below it. Options are given as system properties:
 *
 * <ul>
 *   <li>{@code root}: the directory holding the packages (default ".")
 *   <li>{@code langs}: comma-separated target languages (default "c")
 *   <li>{@code skipgendeps}: if true, don't generate the packages that the named ones use
 *   <li>{@code genlib}: if true, build each language's library afterwards
 *   <li>{@code release}: if set, build a release with this version afterwards, using the {@code
 *       revision} and {@code commitdate} properties
 *   <li>{@code backendPrefix}: prefix of the backend command names (default "backend-")
 * </ul>
 */
public class Gen {
  private Gen() {}

  private static void checkUsage(boolean condition) {
    if (!condition) {
      System.err.println(
          "Use: gen [-Droot=<dir>] [-Dlangs=<lang>,...] [-Dskipgendeps=true] [-Dgenlib=true]"
              + " [-Drelease=<version>] <package>[/...] ...");
      System.exit(1);
    }
  }

  /** Parses a comma-separated list of language names. */
  static ImmutableList<String> parseLangs(String commaSeparated) {
    ImmutableList<String> langs =
        ImmutableList.copyOf(
            Splitter.on(',').trimResults().omitEmptyStrings().split(commaSeparated));
    for (String lang : langs) {
      if (!PackagePaths.isValidName(lang)) {
        throw new GenError("invalid lang \"%s\", not in [a-z0-9]+", lang);
      }
    }
    return langs;
  }

  static List<CodeGenerator> generators(List<String> langs, String backendPrefix) {
    List<CodeGenerator> result = new ArrayList<>();
    for (String lang : langs) {
      result.add(
          lang.equals(StubGenerator.LANGUAGE)
              ? new StubGenerator()
              : ProcessCodeGenerator.forLanguage(backendPrefix, lang));
    }
    return result;
  }

  public static void main(String[] args) {
    checkUsage(args.length != 0 && Arrays.stream(args).noneMatch(a -> a.startsWith("-")));
    Path root = Path.of(System.getProperty("root", "."));
    boolean skipGenDeps = Boolean.parseBoolean(System.getProperty("skipgendeps", "false"));
    boolean genlib = Boolean.parseBoolean(System.getProperty("genlib", "false"));
    String release = System.getProperty("release");
    String backendPrefix = System.getProperty("backendPrefix", ProcessCodeGenerator.DEFAULT_PREFIX);
    try {
      List<String> langs = parseLangs(System.getProperty("langs", "c"));
      PackageLoader loader = new PackageLoader(new Context(), root);
      CodegenDriver driver =
          new CodegenDriver(loader, generators(langs, backendPrefix), skipGenDeps, System.out);
      for (String arg : args) {
        driver.gen(arg);
      }
      if (genlib) {
        driver.genlib();
      }
      if (release != null) {
        driver.genRelease(
            System.getProperty("revision", ""), System.getProperty("commitdate", ""), release);
      }
    } catch (CompileError | GenError | IOException e) {
      System.err.println("** " + e.getMessage());
      System.exit(1);
    }
  }
}
