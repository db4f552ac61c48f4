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

import com.google.common.collect.ImmutableList;

/**
 * Splits interpolated string literals into text and interpolation holes.
 *
 * <p>The lexer uses the scan to find the end of the literal; the expression parser rescans the
 * token to parse the holes. All positions are offsets into the full source text.
 */
final class InterpolatedStrings {

  /** A piece of an interpolated string. */
  interface Part {}

  /** Literal text between interpolations, with escapes left as written. */
  record Text(int start, int end) implements Part {}

  /**
   * An interpolation hole {@code {expression,alignment:format}}.
   *
   * @param start the start of the expression, after the opening brace
   * @param expressionEnd the end of the expression and alignment, before the format colon
   * @param formatStart the start of the format text after the colon, or -1 if there is none
   * @param end the end of the hole, before the closing brace
   */
  record Hole(int start, int expressionEnd, int formatStart, int end) implements Part {}

  /**
   * The result of scanning one literal.
   *
   * @param end the position after the closing quote
   * @param terminated false if the input ended before the closing quote
   */
  record Scan(int end, ImmutableList<Part> parts, boolean terminated) {}

  /**
   * Scans the interpolated string literal whose prefix ({@code $} or {@code @}) is at {@code
   * start}.
   */
  static Scan scan(String s, int start) {
    int i = start;
    int dollars = 0;
    boolean verbatim = false;
    while (i < s.length()) {
      char c = s.charAt(i);
      if (c == '$') {
        dollars++;
      } else if (c == '@' && !verbatim) {
        verbatim = true;
      } else {
        break;
      }
      i++;
    }
    int quotes = run(s, i, '"');
    boolean raw = quotes >= 3;
    if (!raw) {
      quotes = 1;
    }
    i += quotes;
    int closers = raw ? Math.max(dollars, 1) : 1;
    ImmutableList.Builder<Part> parts = ImmutableList.builder();
    int textStart = i;
    while (true) {
      if (i >= s.length()) {
        text(parts, textStart, s.length());
        return new Scan(s.length(), parts.build(), false);
      }
      char c = s.charAt(i);
      if (raw) {
        if (c == '"') {
          int r = run(s, i, '"');
          if (r >= quotes) {
            text(parts, textStart, i);
            return new Scan(i + r, parts.build(), true);
          }
          i += r;
        } else if (c == '{') {
          int r = run(s, i, '{');
          if (r >= closers) {
            text(parts, textStart, i + r - closers);
            i = hole(s, i + r, closers, parts);
            textStart = i;
          } else {
            i += r;
          }
        } else {
          i++;
        }
        continue;
      }
      switch (c) {
        case '"' -> {
          if (verbatim && peek(s, i + 1) == '"') {
            i += 2;
          } else {
            text(parts, textStart, i);
            return new Scan(i + 1, parts.build(), true);
          }
        }
        case '\\' -> i += verbatim ? 1 : 2;
        case '\n', '\r' -> {
          if (!verbatim) {
            text(parts, textStart, i);
            return new Scan(i, parts.build(), false);
          }
          i++;
        }
        case '{' -> {
          if (peek(s, i + 1) == '{') {
            i += 2;
          } else {
            text(parts, textStart, i);
            i = hole(s, i + 1, 1, parts);
            textStart = i;
          }
        }
        default -> i++;
      }
    }
  }

  private static void text(ImmutableList.Builder<Part> parts, int start, int end) {
    if (end > start) {
      parts.add(new Text(start, end));
    }
  }

  /** Scans a hole starting after its opening braces, and returns the position after it. */
  private static int hole(String s, int start, int closers, ImmutableList.Builder<Part> parts) {
    int i = start;
    int depth = 0;
    int colon = -1;
    while (i < s.length()) {
      char c = s.charAt(i);
      if (colon != -1) {
        // format text runs up to the closing brace
        if (c == '}' && run(s, i, '}') >= closers) {
          parts.add(new Hole(start, colon, colon + 1, i));
          return i + closers;
        }
        if (c == '\n' || c == '\r' || c == '"') {
          break;
        }
        i++;
        continue;
      }
      switch (c) {
        case '(', '[', '{' -> {
          depth++;
          i++;
        }
        case ')', ']' -> {
          depth--;
          i++;
        }
        case '}' -> {
          if (depth <= 0) {
            if (run(s, i, '}') >= closers) {
              parts.add(new Hole(start, i, -1, i));
              return i + closers;
            }
            i += run(s, i, '}');
          } else {
            depth--;
            i++;
          }
        }
        case ':' -> {
          if (peek(s, i + 1) == ':') {
            i += 2;
          } else {
            if (depth <= 0) {
              colon = i;
            }
            i++;
          }
        }
        case '"' -> i = skipString(s, i);
        case '\'' -> i = skipChar(s, i);
        case '@' -> {
          if (peek(s, i + 1) == '"') {
            i = skipVerbatim(s, i + 1);
          } else if (peek(s, i + 1) == '$') {
            i = scan(s, i).end();
          } else {
            i++;
          }
        }
        case '$' -> {
          int next = peek(s, i + 1);
          if (next == '"' || next == '@' || next == '$') {
            i = scan(s, i).end();
          } else {
            i++;
          }
        }
        case '/' -> {
          if (peek(s, i + 1) == '*') {
            int close = s.indexOf("*/", i + 2);
            i = close == -1 ? s.length() : close + 2;
          } else {
            i++;
          }
        }
        default -> i++;
      }
    }
    int end = Math.min(i, s.length());
    parts.add(new Hole(start, colon == -1 ? end : colon, colon == -1 ? -1 : colon + 1, end));
    return end;
  }

  private static int skipString(String s, int start) {
    int quotes = run(s, start, '"');
    if (quotes >= 3) {
      int i = start + quotes;
      while (i < s.length()) {
        int r = run(s, i, '"');
        if (r >= quotes) {
          return i + r;
        }
        i += Math.max(r, 1);
      }
      return s.length();
    }
    if (quotes == 2) {
      return start + 2;
    }
    int i = start + 1;
    while (i < s.length()) {
      char c = s.charAt(i);
      if (c == '\\') {
        i += 2;
      } else if (c == '"') {
        return i + 1;
      } else if (c == '\n' || c == '\r') {
        return i;
      } else {
        i++;
      }
    }
    return s.length();
  }

  private static int skipVerbatim(String s, int quote) {
    int i = quote + 1;
    while (i < s.length()) {
      if (s.charAt(i) == '"') {
        if (peek(s, i + 1) != '"') {
          return i + 1;
        }
        i += 2;
      } else {
        i++;
      }
    }
    return s.length();
  }

  private static int skipChar(String s, int start) {
    int i = start + 1;
    while (i < s.length()) {
      char c = s.charAt(i);
      if (c == '\\') {
        i += 2;
      } else if (c == '\'') {
        return i + 1;
      } else if (c == '\n' || c == '\r') {
        return i;
      } else {
        i++;
      }
    }
    return s.length();
  }

  /** The number of consecutive {@code c} characters at {@code start}. */
  static int run(String s, int start, char c) {
    int i = start;
    while (i < s.length() && s.charAt(i) == c) {
      i++;
    }
    return i - start;
  }

  private static int peek(String s, int i) {
    return i < s.length() ? s.charAt(i) : -1;
  }

  private InterpolatedStrings() {}
}
