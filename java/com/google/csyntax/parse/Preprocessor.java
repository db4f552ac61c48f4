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

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableSet;
import com.google.csyntax.diag.ParseError;
import com.google.csyntax.diag.ParseError.ErrorKind;
import com.google.csyntax.diag.SourceFile;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Evaluates preprocessor directives.
 *
 * <p>Conditional directives decide which regions of the source are lexed; every other directive
 * ({@code #region}, {@code #pragma}, {@code #nullable}, ...) is accepted and ignored.
 */
final class Preprocessor {

  private static final ImmutableSet<String> IGNORED =
      ImmutableSet.of(
          "region", "endregion", "pragma", "nullable", "line", "error", "warning", "r", "load");

  /** The state of one {@code #if} ... {@code #endif} group. */
  private static class Conditional {
    final boolean enclosingActive;
    boolean taken;
    boolean active;
    boolean sawElse;

    Conditional(boolean enclosingActive, boolean condition) {
      this.enclosingActive = enclosingActive;
      this.taken = condition;
      this.active = enclosingActive && condition;
    }
  }

  private final SourceFile source;
  private final Set<String> symbols;
  private final Deque<Conditional> conditionals = new ArrayDeque<>();

  Preprocessor(SourceFile source, ImmutableSet<String> symbols) {
    this.source = source;
    this.symbols = new HashSet<>(symbols);
  }

  /** Returns true if tokens at the current position are compiled. */
  boolean active() {
    Conditional top = conditionals.peek();
    return top == null || top.active;
  }

  /**
   * Processes one directive.
   *
   * @param text the directive line, from the {@code #} to the end of the line
   * @param position the source position of the {@code #}
   */
  void directive(String text, int position) {
    String line = stripComment(text.substring(1));
    line = CharMatcher.whitespace().trimFrom(line);
    int nameEnd = 0;
    while (nameEnd < line.length() && Character.isLetter(line.charAt(nameEnd))) {
      nameEnd++;
    }
    String name = line.substring(0, nameEnd);
    String rest = CharMatcher.whitespace().trimFrom(line.substring(nameEnd));
    switch (name) {
      case "if" -> conditionals.push(new Conditional(active(), evaluate(rest, position)));
      case "elif" -> {
        Conditional top = current(text, position);
        if (top.taken) {
          top.active = false;
        } else {
          boolean condition = evaluate(rest, position);
          top.taken = condition;
          top.active = top.enclosingActive && condition;
        }
      }
      case "else" -> {
        Conditional top = current(text, position);
        if (top.sawElse) {
          throw ParseError.format(source, position, ErrorKind.INVALID_DIRECTIVE, text.trim());
        }
        top.sawElse = true;
        top.active = top.enclosingActive && !top.taken;
        top.taken = true;
      }
      case "endif" -> {
        current(text, position);
        conditionals.pop();
      }
      case "define", "undef" -> {
        if (!active()) {
          return;
        }
        if (!isIdentifier(rest)) {
          throw ParseError.format(source, position, ErrorKind.INVALID_DIRECTIVE, text.trim());
        }
        if (name.equals("define")) {
          symbols.add(rest);
        } else {
          symbols.remove(rest);
        }
      }
      default -> {
        if (active() && !IGNORED.contains(name)) {
          throw ParseError.format(source, position, ErrorKind.INVALID_DIRECTIVE, text.trim());
        }
      }
    }
  }

  /** Returns true if a conditional directive is still open. */
  boolean unterminated() {
    return !conditionals.isEmpty();
  }

  private Conditional current(String text, int position) {
    Conditional top = conditionals.peek();
    if (top == null) {
      throw ParseError.format(source, position, ErrorKind.INVALID_DIRECTIVE, text.trim());
    }
    return top;
  }

  private static String stripComment(String line) {
    int idx = line.indexOf("//");
    return idx == -1 ? line : line.substring(0, idx);
  }

  private static boolean isIdentifier(String text) {
    if (text.isEmpty() || !(Character.isLetter(text.charAt(0)) || text.charAt(0) == '_')) {
      return false;
    }
    for (int i = 1; i < text.length(); i++) {
      char c = text.charAt(i);
      if (!Character.isLetterOrDigit(c) && c != '_') {
        return false;
      }
    }
    return true;
  }

  private boolean evaluate(String expression, int position) {
    ConditionParser parser = new ConditionParser(expression, position);
    boolean result = parser.or();
    parser.skipWhitespace();
    if (!parser.done()) {
      throw parser.error();
    }
    return result;
  }

  /** A recursive descent parser for {@code #if} conditions. */
  private class ConditionParser {

    private final String text;
    private final int position;
    private int idx;

    ConditionParser(String text, int position) {
      this.text = text;
      this.position = position;
    }

    boolean done() {
      return idx >= text.length();
    }

    void skipWhitespace() {
      while (idx < text.length() && Character.isWhitespace(text.charAt(idx))) {
        idx++;
      }
    }

    boolean maybe(String operator) {
      skipWhitespace();
      if (text.startsWith(operator, idx)) {
        idx += operator.length();
        return true;
      }
      return false;
    }

    ParseError error() {
      return ParseError.format(source, position, ErrorKind.INVALID_DIRECTIVE, "#if " + text);
    }

    boolean or() {
      boolean result = and();
      while (maybe("||")) {
        // evaluate both sides so that syntax errors are always reported
        boolean rhs = and();
        result = result || rhs;
      }
      return result;
    }

    boolean and() {
      boolean result = equality();
      while (maybe("&&")) {
        boolean rhs = equality();
        result = result && rhs;
      }
      return result;
    }

    boolean equality() {
      boolean result = unary();
      while (true) {
        if (maybe("==")) {
          result = result == unary();
        } else if (maybe("!=")) {
          result = result != unary();
        } else {
          return result;
        }
      }
    }

    boolean unary() {
      if (maybe("!")) {
        return !unary();
      }
      if (maybe("(")) {
        boolean result = or();
        if (!maybe(")")) {
          throw error();
        }
        return result;
      }
      skipWhitespace();
      int start = idx;
      while (idx < text.length()
          && (Character.isLetterOrDigit(text.charAt(idx)) || text.charAt(idx) == '_')) {
        idx++;
      }
      String symbol = text.substring(start, idx);
      if (!isIdentifier(symbol)) {
        throw error();
      }
      return switch (symbol) {
        case "true" -> true;
        case "false" -> false;
        default -> symbols.contains(symbol);
      };
    }
  }
}
