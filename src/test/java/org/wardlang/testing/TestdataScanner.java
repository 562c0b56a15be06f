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

package org.wardlang.testing;

import com.google.common.collect.ImmutableList;
import com.google.testing.junit.testparameterinjector.TestParameterValuesProvider;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.jspecify.annotations.Nullable;

/**
 * Provides the test programs found in the files of a testdata directory. Each file holds one or
 * more programs, each followed by a comment matching a test-specific pattern; group 1 of the
 * pattern is the program's comment.
 */
public abstract class TestdataScanner extends TestParameterValuesProvider {

  /**
   * A single test program.
   *
   * @param name the file name and the line on which the program starts, e.g. "loops.ward:12"
   * @param code the program's source, with the line numbers it has in the file
   * @param comment the body of the comment following the program, or null if there was none
   */
  public record TestProgram(String name, String code, @Nullable String comment) {
    @Override
    public String toString() {
      return name;
    }
  }

  private final Path dir;
  private final String extension;
  private final Pattern commentPattern;

  protected TestdataScanner(Path dir, String extension, Pattern commentPattern) {
    this.dir = dir;
    this.extension = extension;
    this.commentPattern = commentPattern;
  }

  @Override
  protected List<?> provideValues(Context context) {
    try (Stream<Path> files = Files.list(dir)) {
      ImmutableList.Builder<TestProgram> result = ImmutableList.builder();
      for (Path file : files.filter(f -> f.toString().endsWith(extension)).sorted().toList()) {
        scan(file.getFileName().toString(), Files.readString(file), result);
      }
      return result.build();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private void scan(String filename, String text, ImmutableList.Builder<TestProgram> result) {
    Matcher matcher = commentPattern.matcher(text);
    int start = 0;
    while (start < text.length()) {
      boolean found = matcher.find(start);
      int end = found ? matcher.start() : text.length();
      String code = text.substring(start, end);
      if (found || !code.isBlank()) {
        // Pad with newlines so that errors report the line numbers of the file.
        String prefix = "\n".repeat(lineOf(text, start) - 1);
        String name = filename + ":" + (lineOf(text, start) + leadingBlankLines(code));
        result.add(new TestProgram(name, prefix + code, found ? matcher.group(1) : null));
      }
      if (!found) {
        break;
      }
      start = matcher.end();
    }
  }

  private static int lineOf(String text, int offset) {
    int line = 1;
    for (int i = 0; i < offset; i++) {
      if (text.charAt(i) == '\n') {
        line++;
      }
    }
    return line;
  }

  private static int leadingBlankLines(String code) {
    int count = 0;
    for (int i = 0; i < code.length() && Character.isWhitespace(code.charAt(i)); i++) {
      if (code.charAt(i) == '\n') {
        count++;
      }
    }
    return count;
  }
}
