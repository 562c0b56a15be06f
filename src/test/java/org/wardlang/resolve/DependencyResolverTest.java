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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.wardlang.compiler.CompileError;

@RunWith(JUnit4.class)
public class DependencyResolverTest {

  /** A UseReader backed by a map, which records each package it is asked about. */
  private static class FakeReader implements DependencyResolver.UseReader {
    final ImmutableMap<String, ImmutableList<String>> uses;
    final List<String> reads = new ArrayList<>();

    FakeReader(ImmutableMap<String, ImmutableList<String>> uses) {
      this.uses = uses;
    }

    @Override
    public ImmutableList<String> uses(String path) throws IOException {
      reads.add(path);
      ImmutableList<String> result = uses.get(path);
      if (result == null) {
        throw new IOException("no package " + path);
      }
      return result;
    }
  }

  private static final ImmutableMap<String, ImmutableList<String>> DIAMOND =
      ImmutableMap.of(
          "base", ImmutableList.of(),
          "std/top", ImmutableList.of("std/left", "std/right"),
          "std/left", ImmutableList.of("std/bottom", "base"),
          "std/right", ImmutableList.of("std/bottom"),
          "std/bottom", ImmutableList.of("base"));

  @Test
  public void dependenciesComeFirst() throws IOException {
    FakeReader reader = new FakeReader(DIAMOND);
    ImmutableList<String> order = new DependencyResolver(reader).resolve("std/top");
    assertThat(order)
        .containsExactly("base", "std/bottom", "std/left", "std/right", "std/top")
        .inOrder();
    // Each package is read once, base included, though two packages use it.
    assertThat(reader.reads).containsNoDuplicates();
    assertThat(reader.reads).contains("base");
  }

  @Test
  public void baseComesFirstEvenWhenUnused() throws IOException {
    FakeReader reader =
        new FakeReader(ImmutableMap.of("base", ImmutableList.of(), "a", ImmutableList.of()));
    assertThat(new DependencyResolver(reader).resolve("a")).containsExactly("base", "a").inOrder();
  }

  @Test
  public void baseIsFirstAndOnlyOnce() throws IOException {
    FakeReader reader = new FakeReader(DIAMOND);
    ImmutableList<String> order =
        new DependencyResolver(reader).resolve(List.of("std/right", "std/left"));
    assertThat(order)
        .containsExactly("base", "std/bottom", "std/right", "std/left")
        .inOrder();
  }

  @Test
  public void cycle() {
    FakeReader reader =
        new FakeReader(
            ImmutableMap.of(
                "base", ImmutableList.of(),
                "a", ImmutableList.of("b"),
                "b", ImmutableList.of("c"),
                "c", ImmutableList.of("b")));
    CompileError e =
        assertThrows(CompileError.class, () -> new DependencyResolver(reader).resolve("a"));
    assertThat(e.phase).isEqualTo(CompileError.Phase.RESOLVE);
    assertThat(e.msg).isEqualTo("use cycle: b -> c -> b");
  }

  @Test
  public void selfUse() {
    FakeReader reader =
        new FakeReader(
            ImmutableMap.of("base", ImmutableList.of(), "a", ImmutableList.of("a")));
    CompileError e =
        assertThrows(CompileError.class, () -> new DependencyResolver(reader).resolve("a"));
    assertThat(e.msg).isEqualTo("use cycle: a -> a");
  }

  @Test
  public void invalidUsePath() {
    FakeReader reader =
        new FakeReader(
            ImmutableMap.of("base", ImmutableList.of(), "a", ImmutableList.of("../b")));
    CompileError e =
        assertThrows(CompileError.class, () -> new DependencyResolver(reader).resolve("a"));
    assertThat(e.msg).isEqualTo("invalid package path \"../b\"");
  }

  @Test
  public void readErrorsPropagate() {
    FakeReader reader =
        new FakeReader(
            ImmutableMap.of("base", ImmutableList.of(), "a", ImmutableList.of("missing")));
    IOException e =
        assertThrows(IOException.class, () -> new DependencyResolver(reader).resolve("a"));
    assertThat(e).hasMessageThat().isEqualTo("no package missing");
  }
}
