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

package org.wardlang.util;

import static com.google.common.truth.Truth.assertThat;

import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(JUnitParamsRunner.class)
public class Base38Test {

  @Test
  public void encode() {
    assertThat(Base38.encode("    ")).isEqualTo(0);
    assertThat(Base38.encode("   0")).isEqualTo(1);
    assertThat(Base38.encode("   ?")).isEqualTo(11);
    assertThat(Base38.encode("   a")).isEqualTo(12);
    assertThat(Base38.encode("  a ")).isEqualTo(12 * 38);
    assertThat(Base38.encode("zzzz")).isEqualTo(Base38.MAX);
    assertThat(Base38.MAX).isLessThan(1 << Base38.MAX_BITS);
  }

  @Test
  @Parameters({"abc", "abcde", "ABCD", "ab-d"})
  public void invalid(String s) {
    assertThat(Base38.encode(s)).isEqualTo(-1);
  }
}
