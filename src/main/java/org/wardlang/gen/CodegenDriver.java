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
import com.google.common.primitives.Bytes;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.jspecify.annotations.Nullable;
import org.wardlang.check.CheckedPackage;
import org.wardlang.compiler.Compiler;
import org.wardlang.compiler.Context;
import org.wardlang.compiler.PackageLoader;
import org.wardlang.resolve.PackagePaths;

/**
 * Verifies packages and writes the code generated for them.
 *
 * <p>Generated code for package {@code p} in language {@code L} is written to {@code
 * <root>/gen/<L>/<p>.<ext>}. A file whose current contents already match is left untouched, so
 * running the driver twice on unchanged input writes nothing the second time. Each decision is
 * reported as one line on the driver's PrintStream.
 *
 * <p>Whenever any language is requested, a Ward stub (see {@link StubGenerator}) is written as
 * well.
 */
public class CodegenDriver {

  private static final Pattern VERSION =
      Pattern.compile("(\\d+)\\.(\\d+)\\.(\\d+)(-[A-Za-z0-9.]+)?");

  private final PackageLoader loader;
  private final Context ctx;
  private final Path root;
  private final ImmutableList<CodeGenerator> generators;
  private final @Nullable StubGenerator stub;
  private final boolean skipGenDeps;
  private final PrintStream out;

  /** The packages that have been generated, in order. */
  private final List<String> affected = new ArrayList<>();

  private final Set<String> generated = new HashSet<>();
  private int writeCount;

  /**
   * @param generators the requested target languages
   * @param skipGenDeps if true, only the named packages are generated (their dependencies are
   *     still verified)
   * @param out where each write decision is reported
   */
  public CodegenDriver(
      PackageLoader loader,
      List<CodeGenerator> generators,
      boolean skipGenDeps,
      PrintStream out) {
    this.loader = loader;
    this.ctx = loader.ctx;
    this.root = loader.root;
    this.generators = ImmutableList.copyOf(generators);
    boolean stubRequested =
        generators.stream().anyMatch(g -> g.language().equals(StubGenerator.LANGUAGE));
    this.stub = (generators.isEmpty() || stubRequested) ? null : new StubGenerator();
    this.skipGenDeps = skipGenDeps;
    this.out = out;
  }

  /** The packages generated so far, in the order they were generated. */
  public ImmutableList<String> affected() {
    return ImmutableList.copyOf(affected);
  }

  /** The number of files written (not counting those left unchanged). */
  public int writeCount() {
    return writeCount;
  }

  /**
   * Verifies and generates the package(s) named by {@code arg}: a package path, or a path ending
   * in "/..." for every package at or below it.
   */
  public void gen(String arg) throws IOException {
    boolean recursive = arg.endsWith("/...");
    if (recursive) {
      arg = arg.substring(0, arg.length() - 4);
    }
    if (arg.isEmpty()) {
      return;
    }
    for (String path : recursive ? packagesUnder(arg) : List.of(arg)) {
      genPackage(path);
    }
  }

  /** Returns the paths of the directories at or below {@code dir} that hold Ward source. */
  private List<String> packagesUnder(String dir) throws IOException {
    PackagePaths.validate(dir);
    Path top = root.resolve(dir);
    if (!Files.isDirectory(top)) {
      return List.of(dir);
    }
    List<String> result = new ArrayList<>();
    try (Stream<Path> dirs = Files.walk(top)) {
      for (Path d : (Iterable<Path>) dirs.filter(Files::isDirectory).sorted()::iterator) {
        String path = root.relativize(d).toString().replace(File.separatorChar, '/');
        if (!Compiler.sourceFiles(root, path).isEmpty()) {
          result.add(path);
        }
      }
    }
    return result;
  }

  private void genPackage(String path) throws IOException {
    loader.check(path);
    List<String> toGenerate = skipGenDeps ? List.of(path) : loader.dependencyOrder(path);
    for (String p : toGenerate) {
      if (!loader.isBuiltIn(p) && generated.add(p)) {
        generatePackage(p);
        affected.add(p);
      }
    }
  }

  private void generatePackage(String path) throws IOException {
    CheckedPackage pkg = ctx.checked(path);
    ImmutableList<Path> files = loader.sourceFiles(path);
    for (CodeGenerator generator : generators) {
      byte[] output = generator.generate(ctx, pkg, files);
      write(outputFile(generator.language(), path, generator.extension()), output, "gen");
      byte[] sentinel = generator.headerSentinel();
      if (sentinel != null) {
        int i = Bytes.indexOf(output, sentinel);
        if (i < 0) {
          throw new GenError(
              "%s: output did not contain \"%s\"",
              generator.language(),
              new String(sentinel, StandardCharsets.UTF_8).strip());
        }
        write(
            outputFile(generator.language(), path, generator.headerExtension()),
            Arrays.copyOf(output, i),
            "gen");
      }
    }
    if (stub != null) {
      write(
          outputFile(stub.language(), path, stub.extension()),
          stub.generate(ctx, pkg, files),
          "gen");
    }
  }

  private Path outputFile(String language, String path, String extension) {
    return root.resolve("gen").resolve(language).resolve(path + "." + extension);
  }

  /**
   * Asks each requested backend to build its library from the packages generated so far, writing
   * under {@code <root>/gen/lib/<language>}.
   */
  public void genlib() throws IOException {
    for (CodeGenerator generator : generators) {
      String language = generator.language();
      out.println("genlib " + language);
      generator.generateLibrary(
          root.resolve("gen").resolve("lib").resolve(language),
          root.resolve("gen").resolve(language),
          affected);
    }
  }

  /**
   * Builds a single-file release for each requested language from the files previously generated
   * under {@code <root>/gen/<language>}, written to {@code <root>/release/<language>}.
   *
   * @param version "MAJOR.MINOR.PATCH", optionally followed by "-" and an extension
   */
  public void genRelease(String revision, String commitDate, String version) throws IOException {
    Matcher m = VERSION.matcher(version);
    if (!m.matches()) {
      throw new GenError("bad version \"%s\"", version);
    }
    int major = Integer.parseInt(m.group(1));
    int minor = Integer.parseInt(m.group(2));
    String base =
        (major == 0 && minor == 0) ? "unsupported-snapshot" : "ward-v" + major + "." + minor;
    for (CodeGenerator generator : generators) {
      String language = generator.language();
      String extension = generator.releaseExtension();
      List<Path> inputs = filesWithExtension(root.resolve("gen").resolve(language), extension);
      byte[] bundle = generator.generateRelease(revision, commitDate, version, inputs);
      write(
          root.resolve("release").resolve(language).resolve(base + "." + extension),
          bundle,
          "genrelease");
    }
  }

  private static List<Path> filesWithExtension(Path dir, String extension) throws IOException {
    if (!Files.isDirectory(dir)) {
      return List.of();
    }
    try (Stream<Path> files = Files.walk(dir)) {
      return files
          .filter(Files::isRegularFile)
          .filter(f -> f.getFileName().toString().endsWith("." + extension))
          .sorted()
          .collect(ImmutableList.toImmutableList());
    }
  }

  /** Writes {@code content} to {@code file} unless the file already has exactly that content. */
  private void write(Path file, byte[] content, String label) throws IOException {
    if (Files.isRegularFile(file) && Arrays.equals(Files.readAllBytes(file), content)) {
      out.println(label + " unchanged:  " + file);
      return;
    }
    Files.createDirectories(file.getParent());
    Files.write(file, content);
    writeCount++;
    out.println(label + " wrote:      " + file);
  }
}
