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
import com.google.csyntax.diag.Diagnostic;
import com.google.csyntax.diag.ParseError;
import com.google.csyntax.diag.ParseError.ErrorKind;
import com.google.csyntax.diag.SourceFile;
import com.google.csyntax.options.LanguageVersion;
import com.google.csyntax.options.ParserOptions;
import com.google.csyntax.tree.SyntaxNode;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;

/**
 * Token access, backtracking and error-handling primitives shared by the grammar layers.
 *
 * <p>The parser's only position state is a reference to an immutable {@link TokenCursor}, together
 * with the chain of diagnostics recorded so far. Both are saved and restored as a {@link Mark}, so
 * an abandoned alternative leaves no trace.
 *
 * <p>In recovering mode (full-file parses), a missing token is recorded as a diagnostic and parsing
 * continues as if it had been present. Fragment parses, and any rule running under {@link
 * #speculate}, throw a {@link ParseError} instead so that the caller can try the next alternative.
 */
abstract class AbstractParser {

  /** A saved parser position. */
  static final class Mark {
    private final TokenCursor cursor;
    private final @Nullable DiagnosticChain diagnostics;

    private Mark(TokenCursor cursor, @Nullable DiagnosticChain diagnostics) {
      this.cursor = cursor;
      this.diagnostics = diagnostics;
    }

    int index() {
      return cursor.index();
    }
  }

  /** A persistent list of diagnostics, newest first. */
  private static final class DiagnosticChain {
    final Diagnostic head;
    final @Nullable DiagnosticChain tail;

    DiagnosticChain(Diagnostic head, @Nullable DiagnosticChain tail) {
      this.head = head;
      this.tail = tail;
    }
  }

  final SourceFile source;
  final ParserOptions options;
  final LanguageVersion version;
  private final boolean recovering;

  /** For each opening brace, the index of its matching closing brace, or -1. */
  private int[] braceMatch;

  private TokenCursor cursor;
  private @Nullable DiagnosticChain diagnostics;
  private int depth;
  private int speculating;

  AbstractParser(
      SourceFile source,
      ImmutableList<SavedToken> tokens,
      ParserOptions options,
      boolean recovering) {
    this.source = source;
    this.options = options;
    this.version = options.languageVersion();
    this.recovering = recovering;
    this.cursor = TokenCursor.of(tokens);
    this.braceMatch = matchBraces(tokens);
  }

  private static int[] matchBraces(ImmutableList<SavedToken> tokens) {
    int[] result = new int[tokens.size()];
    Deque<Integer> open = new ArrayDeque<>();
    for (int i = 0; i < tokens.size(); i++) {
      result[i] = -1;
      switch (tokens.get(i).token()) {
        case LBRACE -> open.push(i);
        case RBRACE -> {
          if (!open.isEmpty()) {
            result[open.pop()] = i;
          }
        }
        default -> {}
      }
    }
    return result;
  }

  // Hooks into the higher grammar layers.

  abstract SyntaxNode expression();

  abstract SyntaxNode block();

  abstract ImmutableList<SyntaxNode> attributeLists();

  // Token access.

  final TokenCursor cursor() {
    return cursor;
  }

  final SavedToken current() {
    return cursor.current();
  }

  /** Returns the last consumed token. */
  final SavedToken previous() {
    return cursor.previous();
  }

  final Token token() {
    return cursor.token();
  }

  final SavedToken peek(int n) {
    return cursor.peek(n);
  }

  final Token peekToken(int n) {
    return cursor.peek(n).token();
  }

  final boolean at(Token token) {
    return cursor.token() == token;
  }

  /** Returns true if the current token is the contextual keyword {@code word}. */
  final boolean atWord(String word) {
    return cursor.current().is(word);
  }

  final boolean peekIs(int n, String word) {
    return cursor.peek(n).is(word);
  }

  final void next() {
    cursor = cursor.advance();
  }

  /** Consumes the current token if it is {@code token}. */
  final boolean maybe(Token token) {
    if (at(token)) {
      next();
      return true;
    }
    return false;
  }

  /** Consumes the current token if it is the contextual keyword {@code word}. */
  final boolean maybeWord(String word) {
    if (atWord(word)) {
      next();
      return true;
    }
    return false;
  }

  /** Consumes {@code token}, or reports it as missing. */
  final void expect(Token token) {
    if (!maybe(token)) {
      reportMissing(token.spelling() != null ? "'" + token.spelling() + "'" : token.name());
    }
  }

  /** Reports a missing token at the end of the previous token. */
  final void reportMissing(String what) {
    int position = cursor.index() == 0 ? current().position() : cursor.previous().end();
    report(position, ErrorKind.EXPECTED_TOKEN, what);
  }

  /** Consumes an identifier and returns its value, or reports it as missing and returns null. */
  final @Nullable String identifier() {
    if (at(Token.IDENT)) {
      String value = current().value();
      next();
      return value;
    }
    report(ErrorKind.EXPECTED_IDENTIFIER, describe(current()));
    return null;
  }

  /** Returns a description of a token for diagnostics. */
  static String describe(SavedToken token) {
    if (token.token() == Token.EOF) {
      return "end of input";
    }
    return "'" + token.text() + "'";
  }

  // Errors.

  /** Returns true if problems are recorded rather than thrown. */
  final boolean recovering() {
    return recovering && speculating == 0;
  }

  final ParseError error(ErrorKind kind, Object... args) {
    return error(current().position(), kind, args);
  }

  final ParseError error(int position, ErrorKind kind, Object... args) {
    return ParseError.format(source, position, kind, args);
  }

  /** Records a problem at the current token, or throws it outside of recovering mode. */
  final void report(ErrorKind kind, Object... args) {
    report(current().position(), kind, args);
  }

  final void report(int position, ErrorKind kind, Object... args) {
    if (!recovering()) {
      throw error(position, kind, args);
    }
    record(Diagnostic.format(source, position, kind, args));
  }

  /** Records that the current token is being skipped. */
  final void recordSkipped() {
    record(
        Diagnostic.format(
            source, current().position(), ErrorKind.SKIPPED_TOKENS, describe(current())));
  }

  /** Records a diagnostic even while speculating; it is discarded if the speculation fails. */
  final void record(Diagnostic diagnostic) {
    diagnostics = new DiagnosticChain(diagnostic, diagnostics);
  }

  /** The diagnostics recorded so far, oldest first. */
  final ImmutableList<Diagnostic> diagnostics() {
    Deque<Diagnostic> result = new ArrayDeque<>();
    for (DiagnosticChain chain = diagnostics; chain != null; chain = chain.tail) {
      result.push(chain.head);
    }
    return ImmutableList.copyOf(result);
  }

  // Backtracking.

  final Mark mark() {
    return new Mark(cursor, diagnostics);
  }

  final void reset(Mark mark) {
    cursor = mark.cursor;
    diagnostics = mark.diagnostics;
  }

  /** Returns true if the parser has moved past {@code mark}. */
  final boolean progressed(Mark mark) {
    return cursor.index() > mark.cursor.index();
  }

  /**
   * Runs {@code rule} as a tentative alternative. If it throws or returns {@code null}, the
   * position is restored and {@code null} is returned.
   */
  final <T> @Nullable T speculate(Supplier<@Nullable T> rule) {
    Mark mark = mark();
    speculating++;
    try {
      T result = rule.get();
      if (result == null) {
        reset(mark);
      }
      return result;
    } catch (ParseError e) {
      if (e.kind() == ErrorKind.NESTING_TOO_DEEP) {
        throw e;
      }
      reset(mark);
      return null;
    } finally {
      speculating--;
    }
  }

  /** Runs {@code rule} and restores the position afterwards, returning whether it succeeded. */
  final boolean lookahead(BooleanSupplier rule) {
    Mark mark = mark();
    speculating++;
    try {
      return rule.getAsBoolean();
    } catch (ParseError e) {
      if (e.kind() == ErrorKind.NESTING_TOO_DEEP) {
        throw e;
      }
      return false;
    } finally {
      speculating--;
      reset(mark);
    }
  }

  /** Runs a recursive rule, failing once nesting exceeds the configured maximum depth. */
  final <T> T nested(Supplier<T> rule) {
    if (depth >= options.maxDepth()) {
      throw error(ErrorKind.NESTING_TOO_DEEP, options.maxDepth());
    }
    depth++;
    try {
      return rule.get();
    } finally {
      depth--;
    }
  }

  // Bracket scanning.

  /**
   * Given the offset of an opening bracket relative to the current token, returns the offset just
   * past its matching closing bracket, or -1 if the input ends first. All bracket kinds nest.
   */
  final int skipBalanced(int offset) {
    int nesting = 0;
    for (int i = offset; ; i++) {
      switch (peekToken(i)) {
        case LPAREN, LBRACK, LBRACE -> nesting++;
        case RPAREN, RBRACK, RBRACE -> {
          nesting--;
          if (nesting == 0) {
            return i + 1;
          }
          if (nesting < 0) {
            return -1;
          }
        }
        case EOF -> {
          return -1;
        }
        default -> {}
      }
    }
  }

  /** Returns true if the opening brace at the current position has a matching closing brace. */
  final boolean braceTerminated() {
    return braceMatch[cursor.index()] != -1;
  }

  /** Runs {@code rule} over a separately lexed token sequence, such as an interpolation hole. */
  final <T> T withTokens(ImmutableList<SavedToken> tokens, Supplier<T> rule) {
    TokenCursor savedCursor = cursor;
    int[] savedBraces = braceMatch;
    cursor = TokenCursor.of(tokens);
    braceMatch = matchBraces(tokens);
    try {
      return rule.get();
    } finally {
      cursor = savedCursor;
      braceMatch = savedBraces;
    }
  }
}
