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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.csyntax.diag.ParseError.ErrorKind;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/** A recovered syntax error. */
public class Diagnostic {

  private final ErrorKind kind;
  private final int position;
  private final String diagnostic;
  private final ImmutableList<Object> args;

  private Diagnostic(ErrorKind kind, int position, String diagnostic, ImmutableList<Object> args) {
    this.kind = requireNonNull(kind);
    this.position = position;
    this.diagnostic = requireNonNull(diagnostic);
    this.args = requireNonNull(args);
  }

  /** The diagnostic kind. */
  public ErrorKind kind() {
    return kind;
  }

  /** The source position. */
  public int position() {
    return position;
  }

  /** The diagnostic message. */
  public String diagnostic() {
    return diagnostic;
  }

  /** The diagnostic arguments. */
  public ImmutableList<Object> args() {
    return args;
  }

  /**
   * Formats a diagnostic.
   *
   * @param source the current source file
   * @param position the diagnostic position
   * @param kind the error kind
   * @param args format args
   */
  public static Diagnostic format(SourceFile source, int position, ErrorKind kind, Object... args) {
    return new Diagnostic(
        kind,
        position,
        ParseError.formatMessage(source, position, kind, args),
        ImmutableList.copyOf(args));
  }

  /** Records a thrown error as a diagnostic. */
  public static Diagnostic of(SourceFile source, ParseError error) {
    return format(source, error.position(), error.kind(), error.args().toArray());
  }

  @Override
  public int hashCode() {
    return Objects.hash(diagnostic, kind, position);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (!(obj instanceof Diagnostic)) {
      return false;
    }
    Diagnostic that = (Diagnostic) obj;
    return diagnostic.equals(that.diagnostic)
        && kind.equals(that.kind)
        && position == that.position;
  }

  @Override
  public String toString() {
    return diagnostic;
  }
}
