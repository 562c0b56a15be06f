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

import com.google.errorprone.annotations.FormatMethod;

/**
 * Thrown when code generation fails for a reason other than I/O: a backend exited with a non-zero
 * status, or its output did not have the expected form.
 */
public class GenError extends RuntimeException {

  @FormatMethod
  public GenError(String fmt, Object... args) {
    super(String.format(fmt, args));
  }
}
