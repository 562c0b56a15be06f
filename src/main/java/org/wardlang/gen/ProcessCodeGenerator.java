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
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.wardlang.check.CheckedPackage;
import org.wardlang.compiler.Context;
import org.wardlang.resolve.PackagePaths;

/**
 * A CodeGenerator that runs an external backend program, one blocking child process per request.
 *
 * <p>The backend is invoked as
 *
 * <ul>
 *   <li>{@code <command> gen -package_name <name> <file>...}, writing the generated code to its
 *       standard output;
 *   <li>{@code <command> genlib -dstdir <dir> -srcdir <dir> <package path>...}; and
 *   <li>{@code <command> genrelease -revision <r> -commitdate <d> -version <v> <file>...},
 *       writing the release bundle to its standard output.
 * </ul>
 *
 * A non-zero exit status is reported as a {@link GenError} naming the command; failing to start
 * the command at all (e.g. because it is not installed) is an IOException.
 */
public class ProcessCodeGenerator implements CodeGenerator {

  /** The default prefix of backend command names; the language name is appended. */
  public static final String DEFAULT_PREFIX = "backend-";

  /** Separates the header from the rest of the C backend's output. */
  public static final byte[] C_HEADER_ENDS_HERE =
      "\n// C HEADER ENDS HERE.\n\n".getBytes(StandardCharsets.UTF_8);

  private final String language;
  private final String command;
  private final byte @Nullable [] headerSentinel;

  public ProcessCodeGenerator(String language, String command, byte @Nullable [] headerSentinel) {
    this.language = language;
    this.command = command;
    this.headerSentinel = headerSentinel;
  }

  /**
   * Returns a generator for the given language that runs {@code commandPrefix + language}. The C
   * backend's output is split into a header and an implementation.
   */
  public static ProcessCodeGenerator forLanguage(String commandPrefix, String language) {
    return new ProcessCodeGenerator(
        language, commandPrefix + language, language.equals("c") ? C_HEADER_ENDS_HERE : null);
  }

  @Override
  public String language() {
    return language;
  }

  public String command() {
    return command;
  }

  @Override
  public byte @Nullable [] headerSentinel() {
    return headerSentinel;
  }

  @Override
  public byte[] generate(Context ctx, CheckedPackage pkg, ImmutableList<Path> files)
      throws IOException {
    ImmutableList.Builder<String> args = ImmutableList.builder();
    args.add(command, "gen", "-package_name", PackagePaths.name(pkg.path));
    files.forEach(f -> args.add(f.toString()));
    return run(args.build(), true);
  }

  @Override
  public void generateLibrary(Path dstDir, Path srcDir, List<String> affected)
      throws IOException {
    ImmutableList.Builder<String> args = ImmutableList.builder();
    args.add(command, "genlib", "-dstdir", dstDir.toString(), "-srcdir", srcDir.toString());
    args.addAll(affected);
    run(args.build(), false);
  }

  @Override
  public byte[] generateRelease(
      String revision, String commitDate, String version, List<Path> files) throws IOException {
    ImmutableList.Builder<String> args = ImmutableList.builder();
    args.add(command, "genrelease", "-revision", revision, "-commitdate", commitDate);
    args.add("-version", version);
    files.forEach(f -> args.add(f.toString()));
    return run(args.build(), true);
  }

  /**
   * Runs the backend and waits for it to exit. Its standard error is passed through; its standard
   * output is either returned (if {@code captureOutput}) or passed through.
   */
  private byte[] run(List<String> args, boolean captureOutput) throws IOException {
    ProcessBuilder builder =
        new ProcessBuilder(args).redirectError(ProcessBuilder.Redirect.INHERIT);
    if (!captureOutput) {
      builder.redirectOutput(ProcessBuilder.Redirect.INHERIT);
    }
    Process process = builder.start();
    process.getOutputStream().close();
    byte[] output = captureOutput ? process.getInputStream().readAllBytes() : new byte[0];
    int exitCode;
    try {
      exitCode = process.waitFor();
    } catch (InterruptedException e) {
      process.destroy();
      Thread.currentThread().interrupt();
      throw new InterruptedIOException(command + ": interrupted");
    }
    if (exitCode != 0) {
      throw new GenError("%s: failed", command);
    }
    return output;
  }
}
