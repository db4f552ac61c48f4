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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;

/**
 * An immutable position in a lexed token sequence.
 *
 * <p>Copying a cursor is keeping a reference to it, which makes saving and restoring the parser's
 * position for backtracking constant-time.
 */
public final class TokenCursor {

  private final ImmutableList<SavedToken> tokens;
  private final int index;

  private TokenCursor(ImmutableList<SavedToken> tokens, int index) {
    this.tokens = tokens;
    this.index = index;
  }

  /** Returns a cursor at the first of {@code tokens}, which must end with {@link Token#EOF}. */
  public static TokenCursor of(ImmutableList<SavedToken> tokens) {
    checkArgument(
        !tokens.isEmpty() && Iterables.getLast(tokens).token() == Token.EOF, "missing EOF");
    return new TokenCursor(tokens, 0);
  }

  /** The current token. */
  public SavedToken current() {
    return tokens.get(index);
  }

  /** The kind of the current token. */
  public Token token() {
    return tokens.get(index).token();
  }

  /** The token {@code n} positions ahead; positions past the end are the end-of-input token. */
  public SavedToken peek(int n) {
    return tokens.get(Math.min(index + n, tokens.size() - 1));
  }

  /** The token before the current one, or the current one at the start of input. */
  public SavedToken previous() {
    return tokens.get(Math.max(index - 1, 0));
  }

  /** Returns a cursor at the next token, or this cursor at the end of input. */
  public TokenCursor advance() {
    if (atEnd()) {
      return this;
    }
    return new TokenCursor(tokens, index + 1);
  }

  public boolean atEnd() {
    return token() == Token.EOF;
  }

  /** The index of the current token. */
  public int index() {
    return index;
  }

  /** The source text from the current token to the end of input, or empty at the end of input. */
  public String remainingText(String source) {
    if (atEnd()) {
      return "";
    }
    return source.substring(current().position());
  }

  @Override
  public String toString() {
    return String.format("TokenCursor{%d: %s}", index, current());
  }
}
