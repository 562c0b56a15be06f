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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.wardlang.check.CheckedPackage;

@RunWith(JUnit4.class)
public class PackageLoaderTest {

  @Rule public final TemporaryFolder tmp = new TemporaryFolder();

  private Path root;

  private static final String Q =
      String.join(
          "\n",
          "packageid \"qqqq\"",
          "",
          "pub const LIMIT base.u32 = 10",
          "",
          "pub status \"#too big\"",
          "",
          "pub struct Hasher(state: base.u32)",
          "",
          "pub func Hasher.update!(x: base.u32[..= LIMIT]) {",
          "}",
          "");

  @Before
  public void setUp() throws IOException {
    root = tmp.getRoot().toPath();
    write("std/q/q.ward", Q);
  }

  private void write(String path, String content) throws IOException {
    Path file = root.resolve(path);
    Files.createDirectories(file.getParent());
    Files.writeString(file, content);
  }

  private void writeP(String body) throws IOException {
    write(
        "std/p/p.ward",
        "packageid \"pppp\"\n\nuse \"std/q\"\n\npub struct P(h: q.Hasher)\n\n" + body + "\n");
  }

  @Test
  public void usesAnotherPackage() throws IOException {
    writeP(
        String.join(
            "\n",
            "pub func P.run!(x: base.u32) {",
            "  if x <= q.LIMIT {",
            "    this.h.update!(x: x)",
            "  }",
            "}"));
    PackageLoader loader = new PackageLoader(new Context(), root);
    assertThat(loader.hasBaseSource()).isFalse();
    assertThat(loader.dependencyOrder("std/p")).containsExactly("base", "std/q", "std/p").inOrder();
    CheckedPackage p = loader.check("std/p");
    assertThat(p.packageId).isEqualTo("pppp");
    assertThat(p.uses).containsExactly("std/q");
    assertThat(loader.ctx.checked("std/q")).isNotNull();
    // A base with no source is built in and never checked.
    assertThat(loader.ctx.checked("base")).isNull();
    // Checking again reuses the earlier result.
    assertThat(loader.check("std/p")).isSameInstanceAs(p);
  }

  @Test
  public void foreignRefinementIsEnforced() throws IOException {
    writeP(
        String.join(
            "\n",
            "pub func P.run!(x: base.u32) {",
            "  this.h.update!(x: x)",
            "}"));
    PackageLoader loader = new PackageLoader(new Context(), root);
    CompileError e = assertThrows(CompileError.class, () -> loader.check("std/p"));
    assertThat(e.msg)
        .isEqualTo("expression \"x\" bounds [0 ..= 4294967295] is not within bounds [0 ..= 10]");
    assertThat(e.filename).isEqualTo("std/p/p.ward");
    assertThat(e.lineNum).isEqualTo(8);
  }

  @Test
  public void foreignFieldsArePrivate() throws IOException {
    writeP(
        String.join(
            "\n",
            "pub func P.peek() base.u32 {",
            "  return this.h.state",
            "}"));
    PackageLoader loader = new PackageLoader(new Context(), root);
    CompileError e = assertThrows(CompileError.class, () -> loader.check("std/p"));
    assertThat(e.msg).isEqualTo("cannot access field this.h.state of another package's struct");
  }

  @Test
  public void missingPackage() throws IOException {
    write("std/r/r.ward", "packageid \"rrrr\"\n\nuse \"std/none\"\n");
    PackageLoader loader = new PackageLoader(new Context(), root);
    CompileError e = assertThrows(CompileError.class, () -> loader.check("std/r"));
    assertThat(e.getMessage()).isEqualTo("resolve: no .ward files in package \"std/none\"");
  }

  @Test
  public void useCycle() throws IOException {
    write("std/x/x.ward", "packageid \"xxxx\"\n\nuse \"std/y\"\n");
    write("std/y/y.ward", "packageid \"yyyy\"\n\nuse \"std/x\"\n");
    PackageLoader loader = new PackageLoader(new Context(), root);
    CompileError e = assertThrows(CompileError.class, () -> loader.check("std/x"));
    assertThat(e.msg).isEqualTo("use cycle: std/x -> std/y -> std/x");
  }

  @Test
  public void baseWithSourceComesFirst() throws IOException {
    write("base/base.ward", "packageid \"base\"\n\npub status \"#bad argument\"\n");
    PackageLoader loader = new PackageLoader(new Context(), root);
    assertThat(loader.hasBaseSource()).isTrue();
    assertThat(loader.dependencyOrder("std/q")).containsExactly("base", "std/q").inOrder();
    loader.check("std/q");
    assertThat(loader.ctx.packages().get(0).path).isEqualTo("base");
  }

  @Test
  public void filesAreNamedByPackagePath() throws IOException {
    write("std/q/z.ward", "pri const EXTRA base.u8 = 1\n");
    PackageLoader loader = new PackageLoader(new Context(), root);
    assertThat(loader.parsed("std/q")).hasSize(2);
    assertThat(loader.parsed("std/q").get(1).filename).isEqualTo("std/q/z.ward");
  }
}
