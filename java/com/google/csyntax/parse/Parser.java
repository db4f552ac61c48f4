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
import com.google.csyntax.diag.DiagnosticLog;
import com.google.csyntax.diag.ParseError;
import com.google.csyntax.diag.SourceFile;
import com.google.csyntax.options.ParserOptions;
import com.google.csyntax.tree.SyntaxNode;
import java.util.function.Function;

/**
 * The entry points of the C# parser.
 *
 * <p>{@link #parseStrict} parses a whole file and never fails: syntax errors are recovered from
 * and returned as diagnostics next to a best-effort tree. The fragment parsers, such as {@link
 * #parseExpression}, parse a single production and throw {@link ParseError} on the first error.
 */
public final class Parser {

  /**
   * The result of parsing a whole file.
   *
   * @param remaining the unparsed source text, empty once the whole input is consumed
   * @param compilationUnit the root of the tree
   * @param diagnostics the lexical and syntax errors that were recovered from, in source order
   *     within each phase
   */
  public record ParseResult(
      String remaining, SyntaxNode compilationUnit, ImmutableList<Diagnostic> diagnostics) {}

  /**
   * A parsed fragment.
   *
   * @param node the fragment's tree
   * @param remaining the source text after the fragment
   */
  public record Parsed(SyntaxNode node, String remaining) {}

  /** Parses a compilation unit with the default options, and returns its tree. */
  public static SyntaxNode parse(String source) {
    return parseStrict(new SourceFile(null, source), ParserOptions.defaults()).compilationUnit();
  }

  /** Parses a compilation unit, recovering from any syntax errors. */
  public static ParseResult parseStrict(SourceFile source, ParserOptions options) {
    DiagnosticLog log = new DiagnosticLog();
    ImmutableList<SavedToken> tokens =
        Lexer.tokenize(source, options.symbols(), log.withSource(source));
    DeclarationParser parser = new DeclarationParser(source, tokens, options, true);
    SyntaxNode unit = parser.compilationUnit();
    for (Diagnostic diagnostic : parser.diagnostics()) {
      log.add(diagnostic);
    }
    return new ParseResult(
        parser.cursor().remainingText(source.source()), unit, log.diagnostics());
  }

  public static Parsed parseExpression(String source) {
    return parseExpression(source, ParserOptions.defaults());
  }

  public static Parsed parseExpression(String source, ParserOptions options) {
    return parseFragment(source, options, DeclarationParser::expression);
  }

  public static Parsed parseStatement(String source) {
    return parseStatement(source, ParserOptions.defaults());
  }

  public static Parsed parseStatement(String source, ParserOptions options) {
    return parseFragment(source, options, DeclarationParser::statement);
  }

  public static Parsed parseType(String source) {
    return parseType(source, ParserOptions.defaults());
  }

  public static Parsed parseType(String source, ParserOptions options) {
    return parseFragment(source, options, DeclarationParser::type);
  }

  /** Parses an expression that must be a {@code stackalloc} expression. */
  public static Parsed parseStackAlloc(String source) {
    return parseFragment(
        source, ParserOptions.defaults(), DeclarationParser::stackAllocExpression);
  }

  /** Parses a single member of a class, struct, interface or record body. */
  public static Parsed parseMember(String source) {
    return parseMember(source, ParserOptions.defaults());
  }

  public static Parsed parseMember(String source, ParserOptions options) {
    return parseFragment(source, options, DeclarationParser::typeMember);
  }

  private static Parsed parseFragment(
      String text, ParserOptions options, Function<DeclarationParser, SyntaxNode> rule) {
    SourceFile source = new SourceFile(null, text);
    DeclarationParser parser =
        new DeclarationParser(
            source, Lexer.tokenize(source, options.symbols(), null), options, false);
    SyntaxNode node = rule.apply(parser);
    return new Parsed(node, parser.cursor().remainingText(text));
  }

  private Parser() {}
}
