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

import org.jspecify.annotations.Nullable;

/**
 * All Ward language errors detected at compile time (lexical, syntax, name resolution and
 * verification) throw a CompileError.
 */
public class CompileError extends RuntimeException {

  /** Which stage of compilation detected the error. */
  public enum Phase {
    TOKEN("token"),
    PARSE("parse"),
    CHECK("check"),
    RESOLVE("resolve");

    final String prefix;

    Phase(String prefix) {
      this.prefix = prefix;
    }
  }

  public final Phase phase;
  public final String msg;

  /** The file in which the error was detected, or null if it is not specific to a file. */
  public final @Nullable String filename;

  /** The 1-based line number, or zero if unknown. */
  public final int lineNum;

  public CompileError(Phase phase, String msg, @Nullable String filename, int lineNum) {
    super(msg);
    this.phase = phase;
    this.msg = msg;
    this.filename = filename;
    this.lineNum = lineNum;
  }

  @Override
  public String getMessage() {
    if (filename == null) {
      return String.format("%s: %s", phase.prefix, msg);
    }
    return String.format("%s: %s at %s:%s", phase.prefix, msg, filename, lineNum);
  }
}
