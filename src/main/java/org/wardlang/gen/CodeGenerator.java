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

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.wardlang.check.CheckedPackage;
import org.wardlang.compiler.Context;

/**
 * Generates code in one target language from verified packages.
 *
 * <p>Implementations may run in the same process (see {@link StubGenerator}) or delegate to an
 * external backend program (see {@link ProcessCodeGenerator}).
 */
public interface CodeGenerator {

  /** The target language's name, e.g. "c"; always matches {@code [a-z0-9]+}. */
  String language();

  /** The extension (without a leading ".") of files generated for each package. */
  default String extension() {
    return language();
  }

  /**
   * If non-null, each package's generated output holds a header followed by this sentinel; the
   * part before the sentinel is also written to a file with the {@link #headerExtension}.
   */
  default byte @Nullable [] headerSentinel() {
    return null;
  }

  /** The extension of header files split from generated output. */
  default String headerExtension() {
    return "h";
  }

  /**
   * The extension of the files that make up a release: the headers, if this language has them,
   * otherwise the generated files.
   */
  default String releaseExtension() {
    return (headerSentinel() == null) ? extension() : headerExtension();
  }

  /**
   * Returns the generated code for a package.
   *
   * @param files the package's source files, in the order they were verified
   */
  byte[] generate(Context ctx, CheckedPackage pkg, ImmutableList<Path> files) throws IOException;

  /**
   * Builds library artifacts under {@code dstDir} from the code previously generated under {@code
   * srcDir} for each of {@code affected} (package paths).
   */
  default void generateLibrary(Path dstDir, Path srcDir, List<String> affected)
      throws IOException {
    throw new GenError("%s: genlib is not supported", language());
  }

  /** Returns a single-file release bundle built from the given generated files. */
  default byte[] generateRelease(
      String revision, String commitDate, String version, List<Path> files) throws IOException {
    throw new GenError("%s: genrelease is not supported", language());
  }
}
