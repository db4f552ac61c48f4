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

package com.google.csyntax.parse;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;

/**
 * A lexed token.
 *
 * @param token the token kind
 * @param text the raw source text of the token
 * @param position the start position of the token
 * @param end the end position of the token, exclusive
 * @param leadingTrivia the whitespace, comments and directives before the token
 */
public record SavedToken(
    Token token, String text, int position, int end, ImmutableList<Trivia> leadingTrivia) {

  public SavedToken {
    requireNonNull(token);
    requireNonNull(text);
    requireNonNull(leadingTrivia);
  }

  /** The token's value: its raw source text. A verbatim identifier keeps its {@code @}. */
  public String value() {
    return text;
  }

  /** Returns true if the token is the contextual keyword {@code word}. */
  public boolean is(String word) {
    // `@record` is always an identifier
    return token == Token.IDENT && text.equals(word);
  }

  /** Returns true if a line break separates this token from the previous one. */
  public boolean precededByNewline() {
    for (Trivia trivia : leadingTrivia) {
      if (trivia.kind() == Trivia.Kind.END_OF_LINE) {
        return true;
      }
    }
    return false;
  }

  /** Returns true if this token has no trivia in front of it. */
  public boolean adjacent() {
    return leadingTrivia.isEmpty();
  }

  @Override
  public String toString() {
    switch (token) {
      case IDENT:
      case INT_LITERAL:
      case UINT_LITERAL:
      case LONG_LITERAL:
      case ULONG_LITERAL:
      case FLOAT_LITERAL:
      case DOUBLE_LITERAL:
      case DECIMAL_LITERAL:
      case CHAR_LITERAL:
      case STRING_LITERAL:
      case RAW_STRING_LITERAL:
      case UTF8_STRING_LITERAL:
      case INTERPOLATED_STRING:
        return String.format("%s(%s)", token.name(), text);
      default:
        return token.name();
    }
  }
}
