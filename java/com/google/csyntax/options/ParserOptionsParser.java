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

package com.google.csyntax.options;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayDeque;
import java.util.Deque;

/** A command line options parser for {@link ParserOptions}. */
public class ParserOptionsParser {

  /**
   * Parses command line options into {@link ParserOptions}, expanding any {@code @params} files.
   */
  public static ParserOptions parse(Iterable<String> args) throws IOException {
    ParserOptions.Builder builder = ParserOptions.builder();
    parse(builder, args);
    return builder.build();
  }

  /**
   * Parses command line options into a {@link ParserOptions.Builder}, expanding any
   * {@code @params} files.
   */
  public static void parse(ParserOptions.Builder builder, Iterable<String> args)
      throws IOException {
    Deque<String> argumentDeque = new ArrayDeque<>();
    expandParamsFiles(argumentDeque, args);
    parse(builder, argumentDeque);
  }

  private static void parse(ParserOptions.Builder builder, Deque<String> argumentDeque) {
    while (!argumentDeque.isEmpty()) {
      String next = argumentDeque.pollFirst();
      switch (next) {
        case "--langversion":
          builder.setLanguageVersion(LanguageVersion.fromString(readOne(next, argumentDeque)));
          break;
        case "--define":
          builder.addSymbols(SYMBOL_SPLITTER.split(readOne(next, argumentDeque)));
          break;
        case "--max_depth":
          {
            String value = readOne(next, argumentDeque);
            try {
              builder.setMaxDepth(Integer.parseInt(value));
            } catch (NumberFormatException e) {
              throw new IllegalArgumentException("invalid --max_depth: " + value, e);
            }
            break;
          }
        case "--diagnostics":
          builder.setPrintDiagnostics(true);
          break;
        case "--nodiagnostics":
          builder.setPrintDiagnostics(false);
          break;
        case "--help":
          builder.setHelp(true);
          break;
        case "--sources":
          builder.addSources(readList(argumentDeque));
          break;
        default:
          if (next.startsWith("-")) {
            throw new IllegalArgumentException("unknown option: " + next);
          }
          builder.addSources(ImmutableList.of(next));
      }
    }
  }

  private static final Splitter ARG_SPLITTER =
      Splitter.on(CharMatcher.breakingWhitespace()).omitEmptyStrings().trimResults();

  private static final Splitter SYMBOL_SPLITTER =
      Splitter.on(CharMatcher.anyOf(";,")).omitEmptyStrings().trimResults();

  /**
   * Pre-processes an argument list, expanding arguments of the form {@code @filename} by reading
   * the content of the file and appending whitespace-delimited options to {@code argumentDeque}.
   */
  private static void expandParamsFiles(Deque<String> argumentDeque, Iterable<String> args)
      throws IOException {
    for (String arg : args) {
      if (arg.isEmpty()) {
        continue;
      }
      if (arg.startsWith("@@")) {
        argumentDeque.addLast(arg.substring(1));
      } else if (arg.startsWith("@")) {
        Path paramsPath = Paths.get(arg.substring(1));
        if (!Files.exists(paramsPath)) {
          throw new IllegalArgumentException("params file does not exist: " + paramsPath);
        }
        Iterable<String> split =
            ARG_SPLITTER.split(new String(Files.readAllBytes(paramsPath), UTF_8));
        if (Iterables.isEmpty(split)) {
          throw new IllegalArgumentException("empty params file: " + paramsPath);
        }
        expandParamsFiles(argumentDeque, split);
      } else {
        argumentDeque.addLast(arg);
      }
    }
  }

  /** Returns the value of an option. */
  private static String readOne(String flag, Deque<String> argumentDeque) {
    if (argumentDeque.isEmpty() || argumentDeque.peekFirst().startsWith("--")) {
      throw new IllegalArgumentException(flag + " requires an argument");
    }
    return argumentDeque.pollFirst();
  }

  /** Returns a list of option values. */
  private static ImmutableList<String> readList(Deque<String> argumentDeque) {
    ImmutableList.Builder<String> result = ImmutableList.builder();
    while (!argumentDeque.isEmpty() && !argumentDeque.peekFirst().startsWith("--")) {
      result.add(argumentDeque.pollFirst());
    }
    return result.build();
  }
}
