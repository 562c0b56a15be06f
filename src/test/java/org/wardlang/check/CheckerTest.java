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

package org.wardlang.check;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.truth.Truth.assertWithMessage;

import com.google.common.collect.ImmutableList;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.nio.file.Path;
import java.util.regex.Pattern;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.wardlang.ast.SourceFile;
import org.wardlang.compiler.CompileError;
import org.wardlang.compiler.Compiler;
import org.wardlang.compiler.Context;
import org.wardlang.testing.TestdataScanner;
import org.wardlang.testing.TestdataScanner.TestProgram;

/**
 * Parses and verifies Ward source code from each of the .ward files in the testdata directory,
 * based on comments in the files.
 */
@RunWith(TestParameterInjector.class)
public class CheckerTest {

  private static final Path TESTDATA = Path.of("src/test/java/org/wardlang/check/testdata");

  /**
   * Each program is followed by a comment that is either "{@code /* CHECK *}{@code /}" (the test
   * passes if the program verifies) or "{@code /* CHECK: msg *}{@code /}" (the test passes if
   * verification fails with an error whose message starts with {@code msg}).
   *
   * <p>Each program is verified independently, as the single file of a package named "test".
   */
  private static final Pattern COMMENT_PATTERN =
      Pattern.compile("\n/\\* CHECK(.*?)\\*/\\n*", Pattern.DOTALL);

  public static final class AllPrograms extends TestdataScanner {
    public AllPrograms() {
      super(TESTDATA, ".ward", COMMENT_PATTERN);
    }
  }

  @Test
  public void checkTestProgram(
      @TestParameter(valuesProvider = AllPrograms.class) TestProgram testProgram) {
    checkNotNull(testProgram.comment(), "No CHECK comment found");
    String comment = testProgram.comment().trim();
    String errMsg = null;
    if (!comment.isEmpty()) {
      assertWithMessage("Bad CHECK comment").that(comment).startsWith(":");
      errMsg = comment.substring(1).trim();
    }
    Context ctx = new Context();
    try {
      SourceFile file = Compiler.parse(ctx, testProgram.name(), testProgram.code());
      CheckedPackage pkg = Checker.check(ctx, "test", ImmutableList.of(file));
      assertWithMessage("Expected error, verified OK").that(errMsg).isNull();
      assertWithMessage("Not registered").that(ctx.checked("test")).isSameInstanceAs(pkg);
    } catch (CompileError e) {
      errMsg = (errMsg == null) ? "(no error expected)" : errMsg;
      assertWithMessage("Unexpected error %s", e).that(e.msg).startsWith(errMsg);
    }
  }
}
