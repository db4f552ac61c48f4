/*
 * Copyright 2016 Google Inc. All Rights Reserved.
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

package com.google.csyntax.main;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.io.MoreFiles;
import com.google.csyntax.diag.Diagnostic;
import com.google.csyntax.diag.SourceFile;
import com.google.csyntax.options.ParserOptions;
import com.google.csyntax.options.ParserOptionsParser;
import com.google.csyntax.parse.Parser;
import com.google.csyntax.parse.Parser.ParseResult;
import com.google.csyntax.tree.Pretty;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;

/** Main entry point for the csyntax CLI. */
public class Main {

  public static void main(String[] args) throws IOException {
    boolean ok;
    try {
      ok = parse(args);
    } catch (UsageException | IllegalArgumentException e) {
      System.err.println(e.getMessage());
      ok = false;
    } catch (Throwable crash) {
      crash.printStackTrace();
      ok = false;
    }
    System.exit(ok ? 0 : 1);
  }

  public static boolean parse(String[] args) throws IOException {
    ParserOptions options = ParserOptionsParser.parse(Arrays.asList(args));
    return parse(options, System.out, System.err);
  }

  /**
   * Parses each source file, printing its tree to {@code out} and its diagnostics to {@code err}.
   *
   * @return true if no file had diagnostics
   */
  public static boolean parse(ParserOptions options, PrintStream out, PrintStream err)
      throws IOException {
    usage(options);
    boolean ok = true;
    for (String source : options.sources()) {
      Path path = Paths.get(source);
      SourceFile file = new SourceFile(source, MoreFiles.asCharSource(path, UTF_8).read());
      ParseResult result = Parser.parseStrict(file, options);
      out.print(Pretty.pretty(result.compilationUnit()));
      if (!result.diagnostics().isEmpty()) {
        ok = false;
        if (options.printDiagnostics()) {
          for (Diagnostic diagnostic : result.diagnostics()) {
            err.println(diagnostic.diagnostic());
          }
        }
      }
    }
    return ok;
  }

  private static void usage(ParserOptions options) {
    if (options.help()) {
      throw new UsageException();
    }
    if (options.sources().isEmpty()) {
      throw new UsageException("no sources were provided");
    }
  }
}
