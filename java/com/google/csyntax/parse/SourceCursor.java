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
import static java.util.Objects.requireNonNull;

/** An immutable view of the source text from a given offset to the end of input. */
public final class SourceCursor {

  /** The value returned by {@link #peek} past the end of input. */
  public static final int EOF = -1;

  private final String text;
  private final int offset;

  private SourceCursor(String text, int offset) {
    this.text = text;
    this.offset = offset;
  }

  /** Returns a cursor at the start of {@code text}. */
  public static SourceCursor of(String text) {
    return new SourceCursor(requireNonNull(text), 0);
  }

  /** The offset of the cursor in the source text. */
  public int position() {
    return offset;
  }

  /** The current character, or {@link #EOF}. */
  public int peek() {
    return peek(0);
  }

  /** The character {@code n} positions ahead, or {@link #EOF}. */
  public int peek(int n) {
    int idx = offset + n;
    return idx < text.length() ? text.charAt(idx) : EOF;
  }

  public SourceCursor advance() {
    return advance(1);
  }

  /** Returns a cursor {@code n} characters further along, clamped to the end of input. */
  public SourceCursor advance(int n) {
    checkArgument(n >= 0, "%s", n);
    return new SourceCursor(text, Math.min(text.length(), offset + n));
  }

  /** The text between this cursor and {@code end}. */
  public String sliceTo(SourceCursor end) {
    checkArgument(end.text == text && end.offset >= offset, "%s", end.offset);
    return text.substring(offset, end.offset);
  }

  @Override
  public String toString() {
    return String.format("SourceCursor{%d}", offset);
  }
}
