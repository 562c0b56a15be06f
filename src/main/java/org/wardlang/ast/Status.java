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

package org.wardlang.ast;

import com.google.common.base.Preconditions;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A status value: {@link #OK}, an error, or a suspension.
 *
 * <p>In source, a status is written as a string whose first character selects its kind: {@code
 * "#bad header"} is an error and {@code "@short read"} is a suspension.
 */
public final class Status {

  public enum Kind {
    OK(""),
    ERROR("#"),
    SUSPENSION("@");

    public final String sigil;

    Kind(String sigil) {
      this.sigil = sigil;
    }
  }

  public static final Status OK = new Status(Kind.OK, "");

  public final Kind kind;

  /** The message, without its sigil. */
  public final String message;

  private Status(Kind kind, String message) {
    this.kind = kind;
    this.message = message;
  }

  public static Status error(String message) {
    Preconditions.checkArgument(!message.isEmpty());
    return new Status(Kind.ERROR, message);
  }

  public static Status suspension(String message) {
    Preconditions.checkArgument(!message.isEmpty());
    return new Status(Kind.SUSPENSION, message);
  }

  /**
   * Returns the status denoted by the given string (without quotes), or null if it does not start
   * with a status sigil or has an empty message.
   */
  public static @Nullable Status parse(String s) {
    if (s.length() < 2) {
      return null;
    } else if (s.charAt(0) == '#') {
      return error(s.substring(1));
    } else if (s.charAt(0) == '@') {
      return suspension(s.substring(1));
    }
    return null;
  }

  public boolean isError() {
    return kind == Kind.ERROR;
  }

  public boolean isSuspension() {
    return kind == Kind.SUSPENSION;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Status other && kind == other.kind && message.equals(other.message);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, message);
  }

  @Override
  public String toString() {
    return (kind == Kind.OK) ? "ok" : kind.sigil + message;
  }
}
