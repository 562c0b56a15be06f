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

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.wardlang.ast.Decl;
import org.wardlang.ast.SourceFile;
import org.wardlang.check.CheckedPackage;
import org.wardlang.check.Checker;
import org.wardlang.compiler.Compiler;
import org.wardlang.compiler.Context;

@RunWith(JUnit4.class)
public class StubGeneratorTest {

  private static final String SOURCE =
      String.join(
          "\n",
          "packageid \"test\"",
          "",
          "pub status \"#bad input\"",
          "pri status \"#hidden\"",
          "",
          "pub struct Decoder?(x: base.u8)",
          "pri struct Helper()",
          "",
          "pub func Decoder.decode?(src: base.u32)(n: base.u8) base.u32,",
          "    pre src < 10,",
          "{",
          "  return src",
          "}",
          "",
          "pri func Decoder.help() {",
          "}",
          "",
          "pub func hash(x: base.u32) base.u32 {",
          "  return x",
          "}",
          "",
          "pub func Decoder.reset!(other: ptr Decoder)(last: slice Decoder) {",
          "}",
          "");

  @Test
  public void prefix() {
    assertThat(StubGenerator.prefix("test")).isEqualTo("__pkg001A537B");
    assertThat(StubGenerator.prefix("    ")).isEqualTo("__pkg00000000");
    GenError e = assertThrows(GenError.class, () -> StubGenerator.prefix("Test"));
    assertThat(e).hasMessageThat().isEqualTo("invalid packageid \"Test\"");
  }

  @Test
  public void publicSurfaceOnly() {
    Context ctx = new Context();
    CheckedPackage pkg =
        Checker.check(
            ctx, "test", ImmutableList.of(Compiler.parse(ctx, "test/test.ward", SOURCE)));
    String stub = StubGenerator.render(ctx.tokenMap, pkg);
    assertThat(stub)
        .isEqualTo(
            StubGenerator.HEADER
                + "packageid \"test\"  // __pkg001A537B\n"
                + "\n"
                + "pub status \"#bad input\"\n"
                + "pub struct __pkg001A537B_Decoder?()\n"
                + "pub func __pkg001A537B_Decoder.decode?(src: base.u32)(n: base.u8) base.u32 { }\n"
                + "pub func __pkg001A537B_hash(x: base.u32)() base.u32 { }\n"
                + "pub func __pkg001A537B_Decoder.reset!(other: ptr __pkg001A537B_Decoder)"
                + "(last: slice __pkg001A537B_Decoder) { }\n");

    // The stub is itself Ward source.
    SourceFile reparsed = Compiler.parse(new Context(), "stub.ward", stub);
    assertThat(reparsed.declsOf(Decl.Func.class)).hasSize(3);
    assertThat(reparsed.declsOf(Decl.Struct.class)).hasSize(1);
  }
}
