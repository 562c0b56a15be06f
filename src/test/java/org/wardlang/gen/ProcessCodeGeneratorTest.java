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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.junit.Assume.assumeTrue;

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.wardlang.check.CheckedPackage;
import org.wardlang.check.Checker;
import org.wardlang.compiler.Compiler;
import org.wardlang.compiler.Context;

/** Runs small shell scripts as backends. */
@RunWith(JUnit4.class)
public class ProcessCodeGeneratorTest {

  @Rule public final TemporaryFolder tmp = new TemporaryFolder();

  @Before
  public void needsShell() {
    assumeTrue(Files.isExecutable(Path.of("/bin/sh")));
  }

  private String script(String name, String body) throws IOException {
    Path file = tmp.getRoot().toPath().resolve(name);
    Files.writeString(file, "#!/bin/sh\n" + body + "\n");
    Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rwxr-xr-x"));
    return file.toString();
  }

  private static CheckedPackage checked(Context ctx) {
    return Checker.check(
        ctx,
        "std/adler32",
        ImmutableList.of(Compiler.parse(ctx, "std/adler32/a.ward", "packageid \"adlr\"\n")));
  }

  @Test
  public void forLanguage() {
    ProcessCodeGenerator c = ProcessCodeGenerator.forLanguage("wardc-", "c");
    assertThat(c.command()).isEqualTo("wardc-c");
    assertThat(c.headerSentinel()).isEqualTo(ProcessCodeGenerator.C_HEADER_ENDS_HERE);
    assertThat(c.releaseExtension()).isEqualTo("h");
    ProcessCodeGenerator rust = ProcessCodeGenerator.forLanguage("wardc-", "rust");
    assertThat(rust.headerSentinel()).isNull();
    assertThat(rust.releaseExtension()).isEqualTo("rust");
  }

  @Test
  public void genPassesPackageNameAndFiles() throws IOException {
    String echo = script("echo", "echo \"$@\"");
    ProcessCodeGenerator gen = new ProcessCodeGenerator("x", echo, null);
    Context ctx = new Context();
    byte[] output =
        gen.generate(ctx, checked(ctx), ImmutableList.of(Path.of("a.ward"), Path.of("b.ward")));
    assertThat(new String(output, StandardCharsets.UTF_8))
        .isEqualTo("gen -package_name adler32 a.ward b.ward\n");
  }

  @Test
  public void genrelease() throws IOException {
    String echo = script("echo", "echo \"$@\"");
    ProcessCodeGenerator gen = new ProcessCodeGenerator("x", echo, null);
    byte[] output = gen.generateRelease("r1", "2024-05-06", "0.4.0", List.of(Path.of("a.h")));
    assertThat(new String(output, StandardCharsets.UTF_8))
        .isEqualTo("genrelease -revision r1 -commitdate 2024-05-06 -version 0.4.0 a.h\n");
  }

  @Test
  public void failureNamesCommand() throws IOException {
    String fail = script("fail", "exit 3");
    ProcessCodeGenerator gen = new ProcessCodeGenerator("x", fail, null);
    Context ctx = new Context();
    GenError e =
        assertThrows(GenError.class, () -> gen.generate(ctx, checked(ctx), ImmutableList.of()));
    assertThat(e).hasMessageThat().isEqualTo(fail + ": failed");
  }

  @Test
  public void missingCommand() {
    ProcessCodeGenerator gen =
        new ProcessCodeGenerator("x", tmp.getRoot().toPath().resolve("nope").toString(), null);
    assertThrows(
        IOException.class,
        () -> gen.generateLibrary(Path.of("dst"), Path.of("src"), List.of("std/a")));
  }
}
