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

import static com.google.csyntax.parse.SourceCursor.EOF;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.csyntax.diag.DiagnosticLog.DiagnosticLogWithSource;
import com.google.csyntax.diag.ParseError;
import com.google.csyntax.diag.ParseError.ErrorKind;
import com.google.csyntax.diag.SourceFile;
import org.jspecify.annotations.Nullable;

/**
 * A C# lexer.
 *
 * <p>Without a diagnostic log the lexer is strict, and malformed input is a {@link ParseError}.
 * With a log it is lenient: problems are recorded, and a best-effort token is produced so that the
 * parser can continue.
 */
public class Lexer {

  /** Lexes a whole file in strict mode. */
  public static ImmutableList<SavedToken> tokenize(SourceFile source) {
    return tokenize(source, ImmutableSet.of(), null);
  }

  /**
   * Lexes a whole file.
   *
   * @param source the source file
   * @param symbols the preprocessor symbols defined before the start of the file
   * @param log where to record problems, or {@code null} to throw them
   */
  public static ImmutableList<SavedToken> tokenize(
      SourceFile source, ImmutableSet<String> symbols, @Nullable DiagnosticLogWithSource log) {
    return new Lexer(source, 0, source.source().length(), symbols, log).tokenize();
  }

  /** Lexes the region {@code [start, end)} of a file, without preprocessing. */
  static ImmutableList<SavedToken> tokenize(
      SourceFile source, int start, int end, @Nullable DiagnosticLogWithSource log) {
    Lexer lexer = new Lexer(source, start, end, ImmutableSet.of(), log);
    lexer.lineStart = false;
    return lexer.tokenize();
  }

  private final SourceFile source;
  private final String text;
  private final Preprocessor preprocessor;
  private final @Nullable DiagnosticLogWithSource log;

  /** The current position. */
  private SourceCursor cursor;

  /** True if only trivia precedes the current position on its line. */
  private boolean lineStart = true;

  private Lexer(
      SourceFile source,
      int start,
      int end,
      ImmutableSet<String> symbols,
      @Nullable DiagnosticLogWithSource log) {
    this.source = source;
    this.text = source.source().substring(0, end);
    this.cursor = SourceCursor.of(text).advance(start);
    this.preprocessor = new Preprocessor(source, symbols);
    this.log = log;
  }

  private ImmutableList<SavedToken> tokenize() {
    ImmutableList.Builder<SavedToken> tokens = ImmutableList.builder();
    while (true) {
      SavedToken token = next();
      tokens.add(token);
      if (token.token() == Token.EOF) {
        break;
      }
    }
    if (preprocessor.unterminated()) {
      error(text.length(), ErrorKind.EXPECTED_TOKEN, "#endif");
    }
    return tokens.build();
  }

  private void error(int position, ErrorKind kind, Object... args) {
    error(ParseError.format(source, position, kind, args));
  }

  private void error(ParseError error) {
    if (log == null) {
      throw error;
    }
    log.error(error);
  }

  private int peek() {
    return cursor.peek();
  }

  private int peek(int n) {
    return cursor.peek(n);
  }

  private void eat() {
    cursor = cursor.advance();
  }

  private void eat(int n) {
    cursor = cursor.advance(n);
  }

  private SavedToken next() {
    ImmutableList.Builder<Trivia> trivia = ImmutableList.builder();
    while (true) {
      SourceCursor start = cursor;
      int c = peek();
      if (c == EOF) {
        return new SavedToken(
            Token.EOF, "", cursor.position(), cursor.position(), trivia.build());
      }
      if (isNewline(c)) {
        eat(c == '\r' && peek(1) == '\n' ? 2 : 1);
        trivia.add(new Trivia(Trivia.Kind.END_OF_LINE, start.sliceTo(cursor)));
        lineStart = true;
        continue;
      }
      if (!preprocessor.active()) {
        disabledLine(trivia);
        continue;
      }
      if (isWhitespace(c)) {
        while (isWhitespace(peek())) {
          eat();
        }
        trivia.add(new Trivia(Trivia.Kind.WHITESPACE, start.sliceTo(cursor)));
        continue;
      }
      if (c == '/' && peek(1) == '/') {
        skipLine();
        trivia.add(new Trivia(Trivia.Kind.COMMENT, start.sliceTo(cursor)));
        continue;
      }
      if (c == '/' && peek(1) == '*') {
        blockComment();
        trivia.add(new Trivia(Trivia.Kind.COMMENT, start.sliceTo(cursor)));
        continue;
      }
      if (c == '#' && lineStart) {
        directive(trivia);
        continue;
      }
      lineStart = false;
      Token token = scan();
      if (token == null) {
        trivia.add(new Trivia(Trivia.Kind.SKIPPED_TEXT, start.sliceTo(cursor)));
        continue;
      }
      return new SavedToken(
          token, start.sliceTo(cursor), start.position(), cursor.position(), trivia.build());
    }
  }

  /** Consumes one line of a region excluded by a conditional directive. */
  private void disabledLine(ImmutableList.Builder<Trivia> trivia) {
    SourceCursor start = cursor;
    while (isWhitespace(peek())) {
      eat();
    }
    if (peek() == '#') {
      if (cursor.position() > start.position()) {
        trivia.add(new Trivia(Trivia.Kind.WHITESPACE, start.sliceTo(cursor)));
      }
      directive(trivia);
      return;
    }
    skipLine();
    trivia.add(new Trivia(Trivia.Kind.DISABLED_TEXT, start.sliceTo(cursor)));
  }

  private void directive(ImmutableList.Builder<Trivia> trivia) {
    SourceCursor start = cursor;
    skipLine();
    String line = start.sliceTo(cursor);
    trivia.add(new Trivia(Trivia.Kind.DIRECTIVE, line));
    try {
      preprocessor.directive(line, start.position());
    } catch (ParseError e) {
      error(e);
    }
  }

  private void skipLine() {
    while (peek() != EOF && !isNewline(peek())) {
      eat();
    }
  }

  private void blockComment() {
    int start = cursor.position();
    eat(2);
    while (true) {
      int c = peek();
      if (c == EOF) {
        error(start, ErrorKind.UNCLOSED_COMMENT);
        return;
      }
      if (c == '*' && peek(1) == '/') {
        eat(2);
        return;
      }
      eat();
    }
  }

  /** Scans one token, or returns {@code null} if the current character was skipped. */
  private @Nullable Token scan() {
    int c = peek();
    switch (c) {
      case '(' -> {
        return single(Token.LPAREN);
      }
      case ')' -> {
        return single(Token.RPAREN);
      }
      case '{' -> {
        return single(Token.LBRACE);
      }
      case '}' -> {
        return single(Token.RBRACE);
      }
      case '[' -> {
        return single(Token.LBRACK);
      }
      case ']' -> {
        return single(Token.RBRACK);
      }
      case ';' -> {
        return single(Token.SEMI);
      }
      case ',' -> {
        return single(Token.COMMA);
      }
      case '~' -> {
        return single(Token.TILDE);
      }
      case '.' -> {
        if (isDigit(peek(1))) {
          return number();
        }
        if (peek(1) == '.') {
          eat(2);
          return Token.DOTDOT;
        }
        return single(Token.DOT);
      }
      case '0', '1', '2', '3', '4', '5', '6', '7', '8', '9' -> {
        return number();
      }
      case '"' -> {
        return string();
      }
      case '\'' -> {
        return character();
      }
      case '@' -> {
        int next = peek(1);
        if (next == '"') {
          return verbatimString();
        }
        if (next == '$') {
          return interpolatedString();
        }
        if (isIdentifierStart(next)) {
          return identifier();
        }
        return unexpected();
      }
      case '$' -> {
        int next = peek(1);
        if (next == '"' || next == '@' || next == '$') {
          return interpolatedString();
        }
        return unexpected();
      }
      case '=', '>', '<', '!', '?', ':', '-', '&', '|', '+', '*', '/', '%', '^' -> {
        return operator();
      }
      default -> {
        if (isIdentifierStart(c)) {
          return identifier();
        }
        return unexpected();
      }
    }
  }

  private @Nullable Token unexpected() {
    error(cursor.position(), ErrorKind.UNEXPECTED_INPUT, (char) peek());
    eat();
    return null;
  }

  private Token single(Token token) {
    eat();
    return token;
  }

  private Token op(Token token, int length) {
    eat(length);
    return token;
  }

  private Token operator() {
    int c = peek();
    int next = peek(1);
    return switch (c) {
      case '=' ->
          switch (next) {
            case '=' -> op(Token.EQ, 2);
            case '>' -> op(Token.LAMBDA, 2);
            default -> op(Token.ASSIGN, 1);
          };
      // `>>` and `>>=` are assembled by the parser, so that `A<B<C>>` closes two argument lists
      case '>' -> next == '=' ? op(Token.GTE, 2) : op(Token.GT, 1);
      case '<' -> {
        if (next == '<') {
          yield peek(2) == '=' ? op(Token.LTLTE, 3) : op(Token.LTLT, 2);
        }
        yield next == '=' ? op(Token.LTE, 2) : op(Token.LT, 1);
      }
      case '!' -> next == '=' ? op(Token.NOTEQ, 2) : op(Token.NOT, 1);
      case '?' -> {
        if (next == '?') {
          yield peek(2) == '=' ? op(Token.QUESTIONQUESTIONEQ, 3) : op(Token.QUESTIONQUESTION, 2);
        }
        yield op(Token.COND, 1);
      }
      case ':' -> next == ':' ? op(Token.COLONCOLON, 2) : op(Token.COLON, 1);
      case '-' ->
          switch (next) {
            case '-' -> op(Token.DECR, 2);
            case '=' -> op(Token.MINUSEQ, 2);
            case '>' -> op(Token.ARROW, 2);
            default -> op(Token.MINUS, 1);
          };
      case '&' ->
          switch (next) {
            case '&' -> op(Token.ANDAND, 2);
            case '=' -> op(Token.ANDEQ, 2);
            default -> op(Token.AND, 1);
          };
      case '|' ->
          switch (next) {
            case '|' -> op(Token.OROR, 2);
            case '=' -> op(Token.OREQ, 2);
            default -> op(Token.OR, 1);
          };
      case '+' ->
          switch (next) {
            case '+' -> op(Token.INCR, 2);
            case '=' -> op(Token.PLUSEQ, 2);
            default -> op(Token.PLUS, 1);
          };
      case '*' -> next == '=' ? op(Token.MULTEQ, 2) : op(Token.MULT, 1);
      case '/' -> next == '=' ? op(Token.DIVEQ, 2) : op(Token.DIV, 1);
      case '%' -> next == '=' ? op(Token.MODEQ, 2) : op(Token.MOD, 1);
      case '^' -> next == '=' ? op(Token.XOREQ, 2) : op(Token.XOR, 1);
      default -> throw new AssertionError((char) c);
    };
  }

  private Token identifier() {
    boolean verbatim = peek() == '@';
    SourceCursor start = cursor;
    if (verbatim) {
      eat();
    }
    eat();
    while (isIdentifierPart(peek())) {
      eat();
    }
    if (verbatim) {
      return Token.IDENT;
    }
    Token keyword = Token.keyword(start.sliceTo(cursor));
    return keyword != null ? keyword : Token.IDENT;
  }

  private Token number() {
    int start = cursor.position();
    if (peek() == '0' && (peek(1) == 'x' || peek(1) == 'X')) {
      eat(2);
      if (!digits(Lexer::isHexDigit)) {
        error(start, ErrorKind.INVALID_LITERAL, text.substring(start, cursor.position()));
      }
      return integerSuffix();
    }
    if (peek() == '0' && (peek(1) == 'b' || peek(1) == 'B')) {
      eat(2);
      if (!digits(ch -> ch == '0' || ch == '1')) {
        error(start, ErrorKind.INVALID_LITERAL, text.substring(start, cursor.position()));
      }
      return integerSuffix();
    }
    digits(Lexer::isDigit);
    boolean real = false;
    if (peek() == '.' && isDigit(peek(1))) {
      eat();
      digits(Lexer::isDigit);
      real = true;
    }
    if (peek() == 'e' || peek() == 'E') {
      int sign = peek(1) == '+' || peek(1) == '-' ? 1 : 0;
      if (isDigit(peek(1 + sign))) {
        eat(1 + sign);
        digits(Lexer::isDigit);
        real = true;
      }
    }
    switch (peek()) {
      case 'f', 'F' -> {
        eat();
        return Token.FLOAT_LITERAL;
      }
      case 'd', 'D' -> {
        eat();
        return Token.DOUBLE_LITERAL;
      }
      case 'm', 'M' -> {
        eat();
        return Token.DECIMAL_LITERAL;
      }
      default -> {}
    }
    return real ? Token.DOUBLE_LITERAL : integerSuffix();
  }

  private interface CharPredicate {
    boolean test(int c);
  }

  /** Consumes digits and separators, and returns true if at least one digit was consumed. */
  private boolean digits(CharPredicate digit) {
    boolean any = false;
    while (true) {
      int c = peek();
      if (digit.test(c)) {
        any = true;
      } else if (c != '_') {
        return any;
      }
      eat();
    }
  }

  private Token integerSuffix() {
    switch (peek()) {
      case 'u', 'U' -> {
        eat();
        if (peek() == 'l' || peek() == 'L') {
          eat();
          return Token.ULONG_LITERAL;
        }
        return Token.UINT_LITERAL;
      }
      case 'l', 'L' -> {
        eat();
        if (peek() == 'u' || peek() == 'U') {
          eat();
          return Token.ULONG_LITERAL;
        }
        return Token.LONG_LITERAL;
      }
      default -> {
        return Token.INT_LITERAL;
      }
    }
  }

  private Token character() {
    int start = cursor.position();
    eat();
    int c = peek();
    if (c == '\'') {
      error(start, ErrorKind.EMPTY_CHARACTER_LITERAL);
      eat();
      return Token.CHAR_LITERAL;
    }
    if (c == EOF || isNewline(c)) {
      error(start, ErrorKind.UNTERMINATED_CHARACTER_LITERAL);
      return Token.CHAR_LITERAL;
    }
    if (c == '\\') {
      escape();
    } else {
      eat();
    }
    if (peek() == '\'') {
      eat();
      return Token.CHAR_LITERAL;
    }
    error(start, ErrorKind.UNTERMINATED_CHARACTER_LITERAL);
    while (peek() != EOF && !isNewline(peek()) && peek() != '\'') {
      eat();
    }
    if (peek() == '\'') {
      eat();
    }
    return Token.CHAR_LITERAL;
  }

  private void escape() {
    int start = cursor.position();
    eat();
    int c = peek();
    switch (c) {
      case '\'', '"', '\\', '0', 'a', 'b', 'f', 'n', 'r', 't', 'v' -> eat();
      case 'x' -> {
        eat();
        int count = 0;
        while (count < 4 && isHexDigit(peek())) {
          eat();
          count++;
        }
        if (count == 0) {
          error(start, ErrorKind.INVALID_LITERAL, text.substring(start, cursor.position()));
        }
      }
      case 'u', 'U' -> {
        eat();
        int length = c == 'u' ? 4 : 8;
        for (int i = 0; i < length; i++) {
          if (!isHexDigit(peek())) {
            error(start, ErrorKind.INVALID_LITERAL, text.substring(start, cursor.position()));
            return;
          }
          eat();
        }
      }
      default -> {
        if (c == EOF || isNewline(c)) {
          return;
        }
        eat();
        error(start, ErrorKind.INVALID_LITERAL, text.substring(start, cursor.position()));
      }
    }
  }

  private Token string() {
    int start = cursor.position();
    int quotes = InterpolatedStrings.run(text, start, '"');
    if (quotes >= 3) {
      return rawString(start, quotes);
    }
    if (quotes == 2) {
      eat(2);
      return utf8(Token.STRING_LITERAL);
    }
    eat();
    while (true) {
      int c = peek();
      if (c == EOF || isNewline(c)) {
        error(start, ErrorKind.UNTERMINATED_STRING);
        return Token.STRING_LITERAL;
      }
      if (c == '\\') {
        escape();
      } else if (c == '"') {
        eat();
        return utf8(Token.STRING_LITERAL);
      } else {
        eat();
      }
    }
  }

  private Token verbatimString() {
    int start = cursor.position();
    eat(2);
    while (true) {
      int c = peek();
      if (c == EOF) {
        error(start, ErrorKind.UNTERMINATED_STRING);
        return Token.STRING_LITERAL;
      }
      if (c == '"') {
        if (peek(1) != '"') {
          eat();
          return utf8(Token.STRING_LITERAL);
        }
        eat(2);
      } else {
        eat();
      }
    }
  }

  private Token rawString(int start, int quotes) {
    eat(quotes);
    while (true) {
      int c = peek();
      if (c == EOF) {
        error(start, ErrorKind.UNTERMINATED_STRING);
        return Token.RAW_STRING_LITERAL;
      }
      if (c == '"') {
        int run = InterpolatedStrings.run(text, cursor.position(), '"');
        eat(run);
        if (run >= quotes) {
          return utf8(Token.RAW_STRING_LITERAL);
        }
      } else {
        eat();
      }
    }
  }

  private Token interpolatedString() {
    int start = cursor.position();
    InterpolatedStrings.Scan scan = InterpolatedStrings.scan(text, start);
    eat(scan.end() - start);
    if (!scan.terminated()) {
      error(start, ErrorKind.UNTERMINATED_STRING);
    }
    return Token.INTERPOLATED_STRING;
  }

  /** Consumes a {@code u8} suffix. */
  private Token utf8(Token token) {
    if ((peek() == 'u' || peek() == 'U') && peek(1) == '8') {
      eat(2);
      return Token.UTF8_STRING_LITERAL;
    }
    return token;
  }

  private static boolean isNewline(int c) {
    return c == '\n' || c == '\r' || c == '\u0085' || c == '\u2028' || c == '\u2029';
  }

  private static boolean isWhitespace(int c) {
    return switch (c) {
      case ' ', '\t', '\u000B', '\f' -> true;
      default -> c > 0x7f && Character.getType(c) == Character.SPACE_SEPARATOR;
    };
  }

  private static boolean isDigit(int c) {
    return '0' <= c && c <= '9';
  }

  private static boolean isHexDigit(int c) {
    return isDigit(c) || ('a' <= c && c <= 'f') || ('A' <= c && c <= 'F');
  }

  private static boolean isIdentifierStart(int c) {
    return c != EOF && (c == '_' || Character.isLetter(c));
  }

  private static boolean isIdentifierPart(int c) {
    if (c == EOF) {
      return false;
    }
    if (c == '_' || Character.isLetterOrDigit(c)) {
      return true;
    }
    return switch (Character.getType(c)) {
      case Character.NON_SPACING_MARK,
          Character.COMBINING_SPACING_MARK,
          Character.CONNECTOR_PUNCTUATION,
          Character.FORMAT ->
          true;
      default -> false;
    };
  }
}
