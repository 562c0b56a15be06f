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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.wardlang.gen.CodeGenerator;
import org.wardlang.gen.GenError;
import org.wardlang.gen.ProcessCodeGenerator;
import org.wardlang.gen.StubGenerator;

@RunWith(JUnit4.class)
public class GenTest {

  @Test
  public void parseLangs() {
    assertThat(Gen.parseLangs("c, ward,,rust")).containsExactly("c", "ward", "rust").inOrder();
    GenError e = assertThrows(GenError.class, () -> Gen.parseLangs("c,C++"));
    assertThat(e).hasMessageThat().isEqualTo("invalid lang \"C++\", not in [a-z0-9]+");
  }

  @Test
  public void generators() {
    List<CodeGenerator> generators = Gen.generators(List.of("c", "ward"), "be-");
    assertThat(generators).hasSize(2);
    assertThat(((ProcessCodeGenerator) generators.get(0)).command()).isEqualTo("be-c");
    assertThat(generators.get(1)).isInstanceOf(StubGenerator.class);
  }
}
