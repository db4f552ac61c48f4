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

import static com.google.common.base.MoreObjects.firstNonNull;
import static java.util.Objects.requireNonNull;

import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

/**
 * A syntax error.
 *
 * <p>Thrown by the lexer in strict mode, by fragment parsers, and by grammar alternatives that do
 * not match. The full-file parser never lets one escape; it records a {@link Diagnostic} instead.
 */
public class ParseError extends RuntimeException {

  /** A diagnostic kind. */
  public enum ErrorKind {
    UNEXPECTED_INPUT("unexpected input: %c"),
    UNTERMINATED_STRING("unterminated string literal"),
    UNTERMINATED_CHARACTER_LITERAL("unterminated char literal"),
    EMPTY_CHARACTER_LITERAL("empty char literal"),
    UNCLOSED_COMMENT("unclosed comment"),
    INVALID_LITERAL("invalid literal: %s"),
    INVALID_DIRECTIVE("invalid preprocessor directive: %s"),
    EXPECTED_TOKEN("expected %s"),
    UNEXPECTED_TOKEN("unexpected token: %s"),
    EXPECTED_EXPRESSION("expected expression, found %s"),
    EXPECTED_TYPE("expected type, found %s"),
    EXPECTED_IDENTIFIER("expected identifier, found %s"),
    INVALID_STACKALLOC("invalid stackalloc expression: %s"),
    FEATURE_UNAVAILABLE("%s requires language version %s or later"),
    INCOMPLETE_MEMBER("incomplete member"),
    SKIPPED_TOKENS("skipped unexpected tokens: %s"),
    NESTING_TOO_DEEP("nesting exceeds the maximum depth of %s");

    private final String message;

    ErrorKind(String message) {
      this.message = message;
    }

    String format(Object... args) {
      return String.format(message, args);
    }
  }

  /**
   * Formats a diagnostic.
   *
   * @param source the current source file
   * @param position the diagnostic position
   * @param kind the error kind
   * @param args format args
   */
  public static ParseError format(SourceFile source, int position, ErrorKind kind, Object... args) {
    return new ParseError(kind, position, formatMessage(source, position, kind, args), args);
  }

  static String formatMessage(SourceFile source, int position, ErrorKind kind, Object... args) {
    String path = firstNonNull(source.path(), "<>");
    LineMap lineMap = source.lineMap();
    int lineNumber = lineMap.lineNumber(position);
    int column = lineMap.column(position);
    String message = kind.format(args);

    StringBuilder sb = new StringBuilder(path).append(":");
    sb.append(lineNumber).append(": error: ");
    sb.append(message.trim()).append(System.lineSeparator());
    sb.append(CharMatcher.breakingWhitespace().trimTrailingFrom(lineMap.line(position)))
        .append(System.lineSeparator());
    sb.append(Strings.repeat(" ", column)).append('^');
    return sb.toString();
  }

  private final ErrorKind kind;
  private final int position;
  private final ImmutableList<Object> args;

  private ParseError(ErrorKind kind, int position, String diagnostic, Object... args) {
    // Stack traces are not captured: errors drive backtracking and are thrown very often.
    super(diagnostic, null, false, false);
    this.kind = requireNonNull(kind);
    this.position = position;
    this.args = ImmutableList.copyOf(args);
  }

  /** The diagnostic kind. */
  public ErrorKind kind() {
    return kind;
  }

  /** The source position of the error. */
  public int position() {
    return position;
  }

  /** The diagnostic arguments. */
  public ImmutableList<Object> args() {
    return args;
  }
}
