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

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import java.util.List;
import org.wardlang.compiler.CompileError;

/**
 * Package paths are slash-separated, relative and clean (no empty, "." or ".." segments), e.g.
 * "std/deflate". The last segment is the package's name, which must match {@code [a-z0-9]+}.
 */
public class PackagePaths {
  // Statics only
  private PackagePaths() {}

  private static final CharMatcher NAME_CHARS =
      CharMatcher.inRange('a', 'z').or(CharMatcher.inRange('0', '9'));

  private static final Splitter SLASH = Splitter.on('/');

  /** True if {@code s} is a valid package or language name, i.e. matches {@code [a-z0-9]+}. */
  public static boolean isValidName(String s) {
    return !s.isEmpty() && NAME_CHARS.matchesAllOf(s);
  }

  /** True if {@code path} is clean, non-empty, and does not start with "." or "/". */
  public static boolean isValidPath(String path) {
    if (path.isEmpty() || path.startsWith(".") || path.startsWith("/")) {
      return false;
    }
    for (String segment : SLASH.split(path)) {
      if (segment.isEmpty() || segment.equals(".") || segment.equals("..")) {
        return false;
      }
    }
    return true;
  }

  /** Returns the last segment of a path. */
  public static String name(String path) {
    List<String> segments = SLASH.splitToList(path);
    return segments.get(segments.size() - 1);
  }

  /** Throws a CompileError unless {@code path} is a valid path with a valid package name. */
  public static void validate(String path) {
    if (!isValidPath(path)) {
      throw error("invalid package path \"%s\"", path);
    }
    String name = name(path);
    if (!isValidName(name)) {
      throw error("invalid package \"%s\", not in [a-z0-9]+", name);
    }
  }

  private static CompileError error(String fmt, String arg) {
    return new CompileError(CompileError.Phase.RESOLVE, String.format(fmt, arg), null, 0);
  }
}
