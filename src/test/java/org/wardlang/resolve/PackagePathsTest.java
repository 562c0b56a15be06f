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

package org.wardlang.resolve;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.wardlang.compiler.CompileError;

@RunWith(JUnitParamsRunner.class)
public class PackagePathsTest {

  @Test
  @Parameters({"std/deflate", "base", "a/b/c9", "x"})
  public void validPaths(String path) {
    assertThat(PackagePaths.isValidPath(path)).isTrue();
    PackagePaths.validate(path);
  }

  @Test
  @Parameters({"/std", "./std", "std//zlib", "std/../zlib", "std/", ".hidden"})
  public void invalidPaths(String path) {
    assertThat(PackagePaths.isValidPath(path)).isFalse();
    CompileError e = assertThrows(CompileError.class, () -> PackagePaths.validate(path));
    assertThat(e.msg).isEqualTo("invalid package path \"" + path + "\"");
  }

  @Test
  @Parameters({"std/Zlib", "std/z_lib", "std/z-lib"})
  public void invalidNames(String path) {
    CompileError e = assertThrows(CompileError.class, () -> PackagePaths.validate(path));
    assertThat(e.msg).startsWith("invalid package \"");
    assertThat(e.msg).endsWith("\", not in [a-z0-9]+");
  }

  @Test
  public void name() {
    assertThat(PackagePaths.name("std/deflate")).isEqualTo("deflate");
    assertThat(PackagePaths.name("base")).isEqualTo("base");
  }
}
