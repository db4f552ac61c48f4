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

import static java.util.Objects.requireNonNull;

import com.google.auto.value.AutoBuilder;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * Parser options.
 *
 * @param sources Paths to the C# source files to parse.
 * @param languageVersion The language version.
 * @param symbols Preprocessor symbols defined before the start of each file.
 * @param maxDepth The maximum nesting depth of expressions, statements and types.
 * @param printDiagnostics Whether the command-line driver reports recovered errors.
 * @param help Print usage information.
 */
public record ParserOptions(
    ImmutableList<String> sources,
    LanguageVersion languageVersion,
    ImmutableSet<String> symbols,
    int maxDepth,
    boolean printDiagnostics,
    boolean help) {

  public static final int DEFAULT_MAX_DEPTH = 512;

  public ParserOptions {
    requireNonNull(sources, "sources");
    requireNonNull(languageVersion, "languageVersion");
    requireNonNull(symbols, "symbols");
    if (maxDepth <= 0) {
      throw new IllegalArgumentException("invalid --max_depth: " + maxDepth);
    }
  }

  /** Returns the default options. */
  public static ParserOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoBuilder_ParserOptions_Builder()
        .setLanguageVersion(LanguageVersion.createDefault())
        .setMaxDepth(DEFAULT_MAX_DEPTH)
        .setPrintDiagnostics(true)
        .setHelp(false);
  }

  /** A {@link Builder} for {@link ParserOptions}. */
  @AutoBuilder
  public abstract static class Builder {
    abstract ImmutableList.Builder<String> sourcesBuilder();

    public abstract Builder setLanguageVersion(LanguageVersion languageVersion);

    abstract ImmutableSet.Builder<String> symbolsBuilder();

    public abstract Builder setMaxDepth(int maxDepth);

    public abstract Builder setPrintDiagnostics(boolean printDiagnostics);

    public abstract Builder setHelp(boolean help);

    @CanIgnoreReturnValue
    public Builder addSources(Iterable<String> sources) {
      sourcesBuilder().addAll(sources);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addSymbols(Iterable<String> symbols) {
      symbolsBuilder().addAll(symbols);
      return this;
    }

    public abstract ParserOptions build();
  }
}
