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
import com.google.csyntax.diag.ParseError.ErrorKind;
import com.google.csyntax.diag.SourceFile;
import com.google.csyntax.options.ParserOptions;
import com.google.csyntax.tree.SyntaxKind;
import com.google.csyntax.tree.SyntaxNode;
import org.jspecify.annotations.Nullable;

/** Parses types and names. */
abstract class TypeParser extends AbstractParser {

  /** The syntactic context of a type, which decides how ambiguous suffixes are read. */
  enum TypeMode {
    /** A declaration: {@code ?}, {@code *} and omitted ranks always belong to the type. */
    NORMAL,
    /**
     * An expression context ({@code is}, {@code as}, casts): {@code ?} is read as the conditional
     * operator when an expression follows it.
     */
    EXPRESSION,
    /** The type of an object or array creation; array ranks are left to the caller. */
    NEW
  }

  TypeParser(
      SourceFile source,
      ImmutableList<SavedToken> tokens,
      ParserOptions options,
      boolean recovering) {
    super(source, tokens, options, recovering);
  }

  /** Returns true if a type can start at the current token. */
  final boolean atTypeStart() {
    Token token = token();
    return token == Token.IDENT
        || token.isPredefinedType()
        || token == Token.LPAREN
        || token == Token.REF
        || (token == Token.DELEGATE && peekToken(1) == Token.MULT);
  }

  /** Parses a type in a declaration context, including {@code ref} and {@code ref readonly}. */
  final SyntaxNode type() {
    return type(TypeMode.NORMAL);
  }

  final SyntaxNode type(TypeMode mode) {
    return nested(
        () -> {
          if (at(Token.REF)) {
            next();
            maybe(Token.READONLY);
            return SyntaxNode.of(SyntaxKind.REF_TYPE, nonRefType(mode));
          }
          return nonRefType(mode);
        });
  }

  /** Parses a type without a {@code ref} prefix. */
  final SyntaxNode nonRefType(TypeMode mode) {
    SyntaxNode type = underlyingType(mode);
    while (true) {
      switch (token()) {
        case COND -> {
          if (!nullableSuffix(mode)) {
            return type;
          }
          next();
          type = SyntaxNode.of(SyntaxKind.NULLABLE_TYPE, type);
        }
        case MULT -> {
          if (!pointerSuffix(mode)) {
            return type;
          }
          next();
          type = SyntaxNode.of(SyntaxKind.POINTER_TYPE, type);
        }
        case LBRACK -> {
          if (mode == TypeMode.NEW || !atOmittedRank()) {
            return type;
          }
          SyntaxNode.Builder array = SyntaxNode.builder(SyntaxKind.ARRAY_TYPE).add(type);
          while (at(Token.LBRACK) && atOmittedRank()) {
            array.add(omittedRank());
          }
          type = array.build();
        }
        default -> {
          return type;
        }
      }
    }
  }

  private boolean nullableSuffix(TypeMode mode) {
    Token next = peekToken(1);
    return switch (mode) {
      case NORMAL -> true;
      case NEW -> next == Token.LPAREN || next == Token.LBRACK || next == Token.LBRACE;
      case EXPRESSION -> !canFollowNullableAsExpression(next);
    };
  }

  /** Returns true if {@code token} after a {@code ?} makes it a conditional operator. */
  private static boolean canFollowNullableAsExpression(Token token) {
    return switch (token) {
      case IDENT, LPAREN, NOT, TILDE, MINUS, PLUS, INCR, DECR, NEW, THIS, BASE, TYPEOF, DEFAULT,
          SIZEOF, CHECKED, UNCHECKED, STACKALLOC, DELEGATE, THROW, REF ->
          true;
      default -> token.isLiteral() || token.isPredefinedType();
    };
  }

  private boolean pointerSuffix(TypeMode mode) {
    if (mode == TypeMode.NORMAL) {
      return true;
    }
    return switch (peekToken(1)) {
      case RPAREN, MULT, COMMA, GT, LBRACK, RBRACK -> true;
      default -> false;
    };
  }

  /** Returns true at a rank specifier with no sizes, {@code []} or {@code [,]}. */
  final boolean atOmittedRank() {
    int i = 1;
    while (peekToken(i) == Token.COMMA) {
      i++;
    }
    return peekToken(i) == Token.RBRACK;
  }

  /** Parses a rank specifier with no sizes. */
  final SyntaxNode omittedRank() {
    expect(Token.LBRACK);
    SyntaxNode.Builder rank = SyntaxNode.builder(SyntaxKind.ARRAY_RANK_SPECIFIER);
    rank.add(SyntaxNode.of(SyntaxKind.OMITTED_ARRAY_SIZE_EXPRESSION));
    while (maybe(Token.COMMA)) {
      rank.add(SyntaxNode.of(SyntaxKind.OMITTED_ARRAY_SIZE_EXPRESSION));
    }
    expect(Token.RBRACK);
    return rank.build();
  }

  private SyntaxNode underlyingType(TypeMode mode) {
    Token token = token();
    if (token.isPredefinedType()) {
      return predefinedType();
    }
    switch (token) {
      case IDENT:
        return name();
      case LPAREN:
        return tupleType();
      case DELEGATE:
        if (peekToken(1) == Token.MULT) {
          return functionPointerType();
        }
        break;
      default:
        break;
    }
    throw error(ErrorKind.EXPECTED_TYPE, describe(current()));
  }

  final SyntaxNode predefinedType() {
    String text = current().text();
    next();
    return SyntaxNode.named(SyntaxKind.PREDEFINED_TYPE, text);
  }

  /** Parses a possibly qualified, possibly generic name. */
  final SyntaxNode name() {
    SyntaxNode name = simpleName();
    if (at(Token.COLONCOLON) && name.kind() == SyntaxKind.IDENTIFIER_NAME) {
      next();
      name = SyntaxNode.of(SyntaxKind.ALIAS_QUALIFIED_NAME, name, simpleName());
    }
    while (at(Token.DOT) && peekToken(1) == Token.IDENT) {
      next();
      name = SyntaxNode.of(SyntaxKind.QUALIFIED_NAME, name, simpleName());
    }
    return name;
  }

  /**
   * Parses an identifier, with a type argument list if one follows and parses as one. A {@code <}
   * that does not start a type argument list is left for the caller.
   */
  final SyntaxNode simpleName() {
    if (!at(Token.IDENT)) {
      throw error(ErrorKind.EXPECTED_IDENTIFIER, describe(current()));
    }
    String value = current().value();
    next();
    if (at(Token.LT)) {
      SyntaxNode arguments = speculate(this::typeArgumentList);
      if (arguments != null) {
        return SyntaxNode.named(SyntaxKind.GENERIC_NAME, value, arguments);
      }
    }
    return SyntaxNode.named(SyntaxKind.IDENTIFIER_NAME, value);
  }

  /** Parses {@code <T1, T2>}, or {@code <,>} with omitted arguments. */
  final SyntaxNode typeArgumentList() {
    expect(Token.LT);
    SyntaxNode.Builder list = SyntaxNode.builder(SyntaxKind.TYPE_ARGUMENT_LIST);
    if (at(Token.GT) || at(Token.COMMA)) {
      list.add(SyntaxNode.of(SyntaxKind.OMITTED_TYPE_ARGUMENT));
      while (maybe(Token.COMMA)) {
        list.add(SyntaxNode.of(SyntaxKind.OMITTED_TYPE_ARGUMENT));
      }
    } else {
      do {
        list.add(typeArgument());
      } while (maybe(Token.COMMA));
    }
    if (!at(Token.GT)) {
      throw error(ErrorKind.EXPECTED_TOKEN, "'>'");
    }
    next();
    return list.build();
  }

  private SyntaxNode typeArgument() {
    // attributes on type arguments are an error, but are accepted and dropped
    if (at(Token.LBRACK)) {
      attributeLists();
    }
    return type();
  }

  private SyntaxNode tupleType() {
    expect(Token.LPAREN);
    SyntaxNode.Builder tuple = SyntaxNode.builder(SyntaxKind.TUPLE_TYPE);
    int elements = 0;
    do {
      SyntaxNode type = type();
      String name = null;
      if (at(Token.IDENT)) {
        name = current().value();
        next();
      }
      tuple.add(SyntaxNode.named(SyntaxKind.TUPLE_ELEMENT, name, type));
      elements++;
    } while (maybe(Token.COMMA));
    if (elements < 2 || !at(Token.RPAREN)) {
      throw error(ErrorKind.EXPECTED_TYPE, describe(current()));
    }
    next();
    return tuple.build();
  }

  /** Parses {@code delegate* managed<int, void>} and its unmanaged forms. */
  private SyntaxNode functionPointerType() {
    expect(Token.DELEGATE);
    expect(Token.MULT);
    SyntaxNode.Builder pointer = SyntaxNode.builder(SyntaxKind.FUNCTION_POINTER_TYPE);
    if (atWord("managed") || atWord("unmanaged")) {
      String convention = current().text();
      next();
      SyntaxNode.Builder callingConvention =
          SyntaxNode.builder(SyntaxKind.FUNCTION_POINTER_CALLING_CONVENTION)
              .tokenValue(convention);
      if (at(Token.LBRACK)) {
        next();
        SyntaxNode.Builder list =
            SyntaxNode.builder(SyntaxKind.FUNCTION_POINTER_UNMANAGED_CALLING_CONVENTION_LIST);
        do {
          String name = identifier();
          list.add(
              SyntaxNode.named(SyntaxKind.FUNCTION_POINTER_UNMANAGED_CALLING_CONVENTION, name));
        } while (maybe(Token.COMMA));
        expect(Token.RBRACK);
        callingConvention.add(list.build());
      }
      pointer.add(callingConvention.build());
    }
    if (!at(Token.LT)) {
      throw error(ErrorKind.EXPECTED_TOKEN, "'<'");
    }
    next();
    SyntaxNode.Builder parameters =
        SyntaxNode.builder(SyntaxKind.FUNCTION_POINTER_PARAMETER_LIST);
    do {
      while (at(Token.REF) || at(Token.IN) || at(Token.OUT) || at(Token.READONLY)) {
        next();
      }
      parameters.add(
          SyntaxNode.of(SyntaxKind.FUNCTION_POINTER_PARAMETER, nonRefType(TypeMode.NORMAL)));
    } while (maybe(Token.COMMA));
    if (!at(Token.GT)) {
      throw error(ErrorKind.EXPECTED_TOKEN, "'>'");
    }
    next();
    return pointer.add(parameters.build()).build();
  }

  /**
   * Parses the explicit interface prefix of a member name, such as {@code N.I.} in {@code void
   * N.I.M()} or {@code N.I.operator +}, and returns null if there is none. The last identifier
   * before {@code (}, {@code operator}, {@code this} or the member body is left for the caller.
   */
  final @Nullable SyntaxNode explicitInterfaceSpecifier() {
    SyntaxNode name = null;
    while (at(Token.IDENT)) {
      boolean alias = name == null && peekToken(1) == Token.COLONCOLON;
      boolean qualifier =
          switch (peekToken(1)) {
            case DOT -> true;
            case COLONCOLON, LT ->
                (alias || peekToken(1) == Token.LT)
                    && lookahead(
                        () -> {
                          if (alias) {
                            next();
                            next();
                          }
                          simpleName();
                          return at(Token.DOT);
                        });
            default -> false;
          };
      if (!qualifier) {
        break;
      }
      SyntaxNode part;
      if (alias) {
        String value = current().value();
        next();
        next();
        part =
            SyntaxNode.of(
                SyntaxKind.ALIAS_QUALIFIED_NAME,
                SyntaxNode.named(SyntaxKind.IDENTIFIER_NAME, value),
                simpleName());
      } else {
        part = simpleName();
      }
      expect(Token.DOT);
      name = name == null ? part : SyntaxNode.of(SyntaxKind.QUALIFIED_NAME, name, part);
    }
    return name == null ? null : SyntaxNode.of(SyntaxKind.EXPLICIT_INTERFACE_SPECIFIER, name);
  }
}
