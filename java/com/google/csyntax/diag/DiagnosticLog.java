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

package com.google.csyntax.diag;

import com.google.common.collect.ImmutableList;
import com.google.csyntax.diag.ParseError.ErrorKind;
import java.util.LinkedHashSet;
import java.util.Set;

/** A log that collects diagnostics. */
public class DiagnosticLog {

  private final Set<Diagnostic> errors = new LinkedHashSet<>();

  public DiagnosticLogWithSource withSource(SourceFile source) {
    return new DiagnosticLogWithSource(source);
  }

  /** Returns true if any errors have been reported. */
  public boolean anyErrors() {
    return !errors.isEmpty();
  }

  /** The reported diagnostics, in reporting order. */
  public ImmutableList<Diagnostic> diagnostics() {
    return ImmutableList.copyOf(errors);
  }

  /** Adds a diagnostic that was created elsewhere. */
  public void add(Diagnostic diagnostic) {
    errors.add(diagnostic);
  }

  /** A log for a specific source file. */
  public class DiagnosticLogWithSource {

    private final SourceFile source;

    private DiagnosticLogWithSource(SourceFile source) {
      this.source = source;
    }

    public void error(int position, ErrorKind kind, Object... args) {
      errors.add(Diagnostic.format(source, position, kind, args));
    }

    public void error(ParseError error) {
      errors.add(Diagnostic.of(source, error));
    }
  }
}
