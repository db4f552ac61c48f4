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
import com.google.csyntax.options.ParserOptions;
import com.google.csyntax.tree.SyntaxKind;
import com.google.csyntax.tree.SyntaxNode;
import org.jspecify.annotations.Nullable;

/**
 * Parses expressions, patterns, query expressions, attribute lists and parameter lists.
 *
 * <p>Binary operators are parsed by precedence climbing. The ambiguities between casts and
 * parenthesized expressions, and between generic names and the less-than operator, are resolved by
 * speculatively parsing the type reading and checking the token that follows it.
 */
abstract class ExpressionParser extends TypeParser {

  /** A binary operator, with its precedence and the number of tokens that spell it. */
  private record Operator(SyntaxKind kind, int precedence, int width) {}

  private static final int LOGICAL_OR = 1;
  private static final int LOGICAL_AND = 2;
  private static final int BITWISE_OR = 3;
  private static final int EXCLUSIVE_OR = 4;
  private static final int BITWISE_AND = 5;
  private static final int EQUALITY = 6;
  private static final int RELATIONAL = 7;
  private static final int SHIFT = 8;
  private static final int ADDITIVE = 9;
  private static final int MULTIPLICATIVE = 10;

  ExpressionParser(
      SourceFile source,
      ImmutableList<SavedToken> tokens,
      ParserOptions options,
      boolean recovering) {
    super(source, tokens, options, recovering);
  }

  @Override
  final SyntaxNode expression() {
    return nested(this::assignmentExpression);
  }

  /** Parses an expression, or reports a missing one and returns null. */
  final @Nullable SyntaxNode expressionOrMissing() {
    if (atExpressionStart()) {
      return expression();
    }
    report(ErrorKind.EXPECTED_EXPRESSION, describe(current()));
    return null;
  }

  /** Returns true if an expression can start at the current token. */
  final boolean atExpressionStart() {
    Token token = token();
    switch (token) {
      case IDENT, LPAREN, PLUS, MINUS, NOT, TILDE, INCR, DECR, XOR, AND, MULT, DOTDOT, NEW, THIS,
          BASE, TYPEOF, SIZEOF, DEFAULT, CHECKED, UNCHECKED, DELEGATE, STACKALLOC, THROW, REF,
          STATIC -> {
        return true;
      }
      case LBRACK -> {
        return version.supportsCollectionExpressions();
      }
      default -> {
        return token.isLiteral() || token.isPredefinedType();
      }
    }
  }

  private SyntaxNode assignmentExpression() {
    if (atLambda()) {
      return lambda();
    }
    SyntaxNode left = conditionalExpression();
    SyntaxKind assignment = assignmentOperator();
    if (assignment == null) {
      return left;
    }
    SyntaxNode right = expression();
    return SyntaxNode.of(assignment, left, right);
  }

  /** Consumes an assignment operator and returns the kind of assignment, or returns null. */
  private @Nullable SyntaxKind assignmentOperator() {
    SyntaxKind kind =
        switch (token()) {
          case ASSIGN -> SyntaxKind.SIMPLE_ASSIGNMENT_EXPRESSION;
          case PLUSEQ -> SyntaxKind.ADD_ASSIGNMENT_EXPRESSION;
          case MINUSEQ -> SyntaxKind.SUBTRACT_ASSIGNMENT_EXPRESSION;
          case MULTEQ -> SyntaxKind.MULTIPLY_ASSIGNMENT_EXPRESSION;
          case DIVEQ -> SyntaxKind.DIVIDE_ASSIGNMENT_EXPRESSION;
          case MODEQ -> SyntaxKind.MODULO_ASSIGNMENT_EXPRESSION;
          case ANDEQ -> SyntaxKind.AND_ASSIGNMENT_EXPRESSION;
          case OREQ -> SyntaxKind.OR_ASSIGNMENT_EXPRESSION;
          case XOREQ -> SyntaxKind.EXCLUSIVE_OR_ASSIGNMENT_EXPRESSION;
          case LTLTE -> SyntaxKind.LEFT_SHIFT_ASSIGNMENT_EXPRESSION;
          case QUESTIONQUESTIONEQ -> SyntaxKind.COALESCE_ASSIGNMENT_EXPRESSION;
          default -> null;
        };
    if (kind != null) {
      next();
      return kind;
    }
    if (!at(Token.GT)) {
      return null;
    }
    // '>>=' and '>>>=' are lexed as separate '>' tokens
    if (adjacent(1, Token.GTE)) {
      next();
      next();
      return SyntaxKind.RIGHT_SHIFT_ASSIGNMENT_EXPRESSION;
    }
    if (adjacent(1, Token.GT) && adjacent(2, Token.GTE)) {
      next();
      next();
      next();
      return SyntaxKind.UNSIGNED_RIGHT_SHIFT_ASSIGNMENT_EXPRESSION;
    }
    return null;
  }

  /** Returns true if the token {@code n} ahead is {@code token} with no trivia before it. */
  private boolean adjacent(int n, Token token) {
    SavedToken next = peek(n);
    return next.token() == token && next.adjacent();
  }

  private SyntaxNode conditionalExpression() {
    SyntaxNode condition = coalesceExpression();
    if (!at(Token.COND)) {
      return condition;
    }
    next();
    SyntaxNode whenTrue = expression();
    expect(Token.COLON);
    SyntaxNode whenFalse = expression();
    return SyntaxNode.of(SyntaxKind.CONDITIONAL_EXPRESSION, condition, whenTrue, whenFalse);
  }

  private SyntaxNode coalesceExpression() {
    SyntaxNode left = binary(LOGICAL_OR);
    if (!at(Token.QUESTIONQUESTION)) {
      return left;
    }
    next();
    return SyntaxNode.of(SyntaxKind.COALESCE_EXPRESSION, left, coalesceExpression());
  }

  /**
   * Parses a left-associative binary expression whose operators bind at least as tightly as
   * {@code minPrecedence}.
   */
  final SyntaxNode binary(int minPrecedence) {
    SyntaxNode left = switchOrWithExpression();
    while (true) {
      Operator operator = binaryOperator();
      if (operator == null || operator.precedence() < minPrecedence) {
        return left;
      }
      for (int i = 0; i < operator.width(); i++) {
        next();
      }
      left =
          switch (operator.kind()) {
            case IS_EXPRESSION -> isExpression(left);
            case AS_EXPRESSION ->
                SyntaxNode.of(SyntaxKind.AS_EXPRESSION, left, type(TypeMode.EXPRESSION));
            default ->
                SyntaxNode.of(operator.kind(), left, binary(operator.precedence() + 1));
          };
    }
  }

  private @Nullable Operator binaryOperator() {
    return switch (token()) {
      case OROR -> new Operator(SyntaxKind.LOGICAL_OR_EXPRESSION, LOGICAL_OR, 1);
      case ANDAND -> new Operator(SyntaxKind.LOGICAL_AND_EXPRESSION, LOGICAL_AND, 1);
      case OR -> new Operator(SyntaxKind.BITWISE_OR_EXPRESSION, BITWISE_OR, 1);
      case XOR -> new Operator(SyntaxKind.EXCLUSIVE_OR_EXPRESSION, EXCLUSIVE_OR, 1);
      case AND -> new Operator(SyntaxKind.BITWISE_AND_EXPRESSION, BITWISE_AND, 1);
      case EQ -> new Operator(SyntaxKind.EQUALS_EXPRESSION, EQUALITY, 1);
      case NOTEQ -> new Operator(SyntaxKind.NOT_EQUALS_EXPRESSION, EQUALITY, 1);
      case LT -> new Operator(SyntaxKind.LESS_THAN_EXPRESSION, RELATIONAL, 1);
      case LTE -> new Operator(SyntaxKind.LESS_THAN_OR_EQUAL_EXPRESSION, RELATIONAL, 1);
      case GTE -> new Operator(SyntaxKind.GREATER_THAN_OR_EQUAL_EXPRESSION, RELATIONAL, 1);
      case IS -> new Operator(SyntaxKind.IS_EXPRESSION, RELATIONAL, 1);
      case AS -> new Operator(SyntaxKind.AS_EXPRESSION, RELATIONAL, 1);
      case LTLT -> new Operator(SyntaxKind.LEFT_SHIFT_EXPRESSION, SHIFT, 1);
      case PLUS -> new Operator(SyntaxKind.ADD_EXPRESSION, ADDITIVE, 1);
      case MINUS -> new Operator(SyntaxKind.SUBTRACT_EXPRESSION, ADDITIVE, 1);
      case MULT -> new Operator(SyntaxKind.MULTIPLY_EXPRESSION, MULTIPLICATIVE, 1);
      case DIV -> new Operator(SyntaxKind.DIVIDE_EXPRESSION, MULTIPLICATIVE, 1);
      case MOD -> new Operator(SyntaxKind.MODULO_EXPRESSION, MULTIPLICATIVE, 1);
      case GT -> greaterThanOperator();
      default -> null;
    };
  }

  /** Merges adjacent {@code >} tokens into shift operators. */
  private @Nullable Operator greaterThanOperator() {
    if (adjacent(1, Token.GTE)) {
      return null;
    }
    if (adjacent(1, Token.GT)) {
      if (adjacent(2, Token.GTE)) {
        return null;
      }
      if (adjacent(2, Token.GT)) {
        return new Operator(SyntaxKind.UNSIGNED_RIGHT_SHIFT_EXPRESSION, SHIFT, 3);
      }
      return new Operator(SyntaxKind.RIGHT_SHIFT_EXPRESSION, SHIFT, 2);
    }
    return new Operator(SyntaxKind.GREATER_THAN_EXPRESSION, RELATIONAL, 1);
  }

  /**
   * Parses the right-hand side of {@code is}. A bare type yields an {@code IsExpression}; anything
   * else is a pattern.
   */
  private SyntaxNode isExpression(SyntaxNode left) {
    Mark start = mark();
    SyntaxNode type = speculate(() -> type(TypeMode.EXPRESSION));
    if (type != null && !continuesPattern(type)) {
      return SyntaxNode.of(SyntaxKind.IS_EXPRESSION, left, type);
    }
    reset(start);
    return SyntaxNode.of(SyntaxKind.IS_PATTERN_EXPRESSION, left, pattern());
  }

  /** Returns true if the tokens after {@code type} continue a pattern. */
  private boolean continuesPattern(SyntaxNode type) {
    if (at(Token.IDENT) || at(Token.LPAREN) || at(Token.LBRACE)) {
      return true;
    }
    if (type.kind() == SyntaxKind.IDENTIFIER_NAME && "not".equals(type.tokenValue())) {
      return atPatternStart();
    }
    return false;
  }

  private SyntaxNode switchOrWithExpression() {
    SyntaxNode expression = rangeExpression();
    while (true) {
      if (at(Token.SWITCH) && peekToken(1) == Token.LBRACE) {
        expression = switchExpression(expression);
      } else if (atWord("with") && peekToken(1) == Token.LBRACE) {
        next();
        expression =
            SyntaxNode.of(
                SyntaxKind.WITH_EXPRESSION,
                expression,
                initializer(SyntaxKind.WITH_INITIALIZER_EXPRESSION));
      } else {
        return expression;
      }
    }
  }

  private SyntaxNode rangeExpression() {
    SyntaxNode left = null;
    if (!at(Token.DOTDOT)) {
      left = unaryExpression();
      if (!at(Token.DOTDOT)) {
        return left;
      }
    }
    next();
    SyntaxNode right = atExpressionStart() && !at(Token.DOTDOT) ? unaryExpression() : null;
    return SyntaxNode.of(SyntaxKind.RANGE_EXPRESSION, left, right);
  }

  final SyntaxNode unaryExpression() {
    return nested(this::unary);
  }

  private SyntaxNode unary() {
    SyntaxKind prefix =
        switch (token()) {
          case PLUS -> SyntaxKind.UNARY_PLUS_EXPRESSION;
          case MINUS -> SyntaxKind.UNARY_MINUS_EXPRESSION;
          case NOT -> SyntaxKind.LOGICAL_NOT_EXPRESSION;
          case TILDE -> SyntaxKind.BITWISE_NOT_EXPRESSION;
          case INCR -> SyntaxKind.PRE_INCREMENT_EXPRESSION;
          case DECR -> SyntaxKind.PRE_DECREMENT_EXPRESSION;
          case XOR -> SyntaxKind.INDEX_EXPRESSION;
          case AND -> SyntaxKind.ADDRESS_OF_EXPRESSION;
          case MULT -> SyntaxKind.POINTER_INDIRECTION_EXPRESSION;
          case REF -> SyntaxKind.REF_EXPRESSION;
          default -> null;
        };
    if (prefix != null) {
      next();
      return SyntaxNode.of(prefix, unaryExpression());
    }
    if (atWord("await") && awaitOperand()) {
      next();
      return SyntaxNode.of(SyntaxKind.AWAIT_EXPRESSION, unaryExpression());
    }
    if (at(Token.LPAREN)) {
      SyntaxNode cast = speculate(this::castExpression);
      if (cast != null) {
        return cast;
      }
    }
    return postfix(primary());
  }

  /** Returns true if {@code await} is followed by an operand rather than used as a name. */
  private boolean awaitOperand() {
    Token next = peekToken(1);
    return switch (next) {
      case IDENT, LPAREN, LBRACK, NEW, THIS, BASE, TYPEOF, DEFAULT, CHECKED, UNCHECKED, NOT,
          MINUS, TILDE, INCR, DECR ->
          true;
      default -> next.isLiteral() || next.isPredefinedType();
    };
  }

  private @Nullable SyntaxNode castExpression() {
    expect(Token.LPAREN);
    SyntaxNode type = type(TypeMode.EXPRESSION);
    if (!at(Token.RPAREN)) {
      return null;
    }
    next();
    if (!castOperandFollows(type)) {
      return null;
    }
    return SyntaxNode.of(SyntaxKind.CAST_EXPRESSION, type, unaryExpression());
  }

  /**
   * Returns true if the token after {@code (type)} starts the operand of a cast. After a name the
   * operand must not look like the rest of a binary expression, so {@code (a) - b} stays a
   * subtraction.
   */
  private boolean castOperandFollows(SyntaxNode type) {
    switch (type.kind()) {
      case IDENTIFIER_NAME, GENERIC_NAME, QUALIFIED_NAME, ALIAS_QUALIFIED_NAME -> {
        Token token = token();
        return switch (token) {
          case TILDE, NOT, LPAREN, IDENT, THIS, BASE, NEW, TYPEOF, SIZEOF, DEFAULT, CHECKED,
              UNCHECKED, DELEGATE, STACKALLOC ->
              true;
          default -> token.isLiteral() || token.isPredefinedType();
        };
      }
      default -> {
        return atExpressionStart() && !at(Token.DOTDOT);
      }
    }
  }

  private SyntaxNode postfix(SyntaxNode expression) {
    while (true) {
      switch (token()) {
        case DOT -> {
          next();
          expression =
              SyntaxNode.of(
                  SyntaxKind.SIMPLE_MEMBER_ACCESS_EXPRESSION, expression, memberName());
        }
        case ARROW -> {
          next();
          expression =
              SyntaxNode.of(
                  SyntaxKind.POINTER_MEMBER_ACCESS_EXPRESSION, expression, memberName());
        }
        case COLONCOLON -> {
          if (expression.kind() != SyntaxKind.IDENTIFIER_NAME) {
            return expression;
          }
          next();
          expression =
              SyntaxNode.of(SyntaxKind.ALIAS_QUALIFIED_NAME, expression, memberName());
        }
        case LPAREN ->
            expression =
                SyntaxNode.of(SyntaxKind.INVOCATION_EXPRESSION, expression, argumentList());
        case LBRACK ->
            expression =
                SyntaxNode.of(
                    SyntaxKind.ELEMENT_ACCESS_EXPRESSION, expression, bracketedArgumentList());
        case INCR -> {
          next();
          expression = SyntaxNode.of(SyntaxKind.POST_INCREMENT_EXPRESSION, expression);
        }
        case DECR -> {
          next();
          expression = SyntaxNode.of(SyntaxKind.POST_DECREMENT_EXPRESSION, expression);
        }
        case NOT -> {
          next();
          expression = SyntaxNode.of(SyntaxKind.SUPPRESS_NULLABLE_WARNING_EXPRESSION, expression);
        }
        case COND -> {
          if (!atConditionalAccess()) {
            return expression;
          }
          next();
          return SyntaxNode.of(SyntaxKind.CONDITIONAL_ACCESS_EXPRESSION, expression, whenNotNull());
        }
        default -> {
          return expression;
        }
      }
    }
  }

  /**
   * Returns true at {@code ?.} or {@code ?[}. A {@code ?[...]} followed by a colon is the start of
   * a conditional expression whose branch is a collection expression.
   */
  private boolean atConditionalAccess() {
    switch (peekToken(1)) {
      case DOT -> {
        return true;
      }
      case LBRACK -> {
        int end = skipBalanced(1);
        return end != -1 && peekToken(end) != Token.COLON;
      }
      default -> {
        return false;
      }
    }
  }

  /** Parses the member or element binding after {@code ?}, and the accesses that follow it. */
  private SyntaxNode whenNotNull() {
    SyntaxNode binding;
    if (maybe(Token.DOT)) {
      binding = SyntaxNode.of(SyntaxKind.MEMBER_BINDING_EXPRESSION, memberName());
    } else {
      binding = SyntaxNode.of(SyntaxKind.ELEMENT_BINDING_EXPRESSION, bracketedArgumentList());
    }
    return nested(() -> postfix(binding));
  }

  /** Parses the name after {@code .}, {@code ->} or {@code ::}. */
  private @Nullable SyntaxNode memberName() {
    if (token().isPredefinedType()) {
      // e.g. `x.int`, which is an error but has a tree
      return predefinedType();
    }
    if (!at(Token.IDENT)) {
      report(ErrorKind.EXPECTED_IDENTIFIER, describe(current()));
      return null;
    }
    return genericOrIdentifier();
  }

  /**
   * Parses an identifier in an expression. A following {@code <...>} is read as a type argument
   * list only if it parses as one and the next token can follow a generic name; otherwise the
   * {@code <} is left to be parsed as the less-than operator.
   */
  private SyntaxNode genericOrIdentifier() {
    String value = current().value();
    next();
    if (at(Token.LT)) {
      Mark mark = mark();
      SyntaxNode arguments = speculate(this::typeArgumentList);
      if (arguments != null) {
        if (canFollowTypeArgumentList()) {
          return SyntaxNode.named(SyntaxKind.GENERIC_NAME, value, arguments);
        }
        reset(mark);
      }
    }
    return SyntaxNode.named(SyntaxKind.IDENTIFIER_NAME, value);
  }

  private boolean canFollowTypeArgumentList() {
    return switch (token()) {
      case LPAREN, RPAREN, RBRACK, RBRACE, COLON, SEMI, COMMA, DOT, COND, EQ, NOTEQ, OR, XOR,
          ANDAND, OROR, AND, LBRACK, EOF ->
          true;
      default -> false;
    };
  }

  private SyntaxNode primary() {
    Token token = token();
    if (token.isPredefinedType()) {
      return predefinedType();
    }
    switch (token) {
      case IDENT:
        return identifierPrimary();
      case INT_LITERAL:
      case UINT_LITERAL:
      case LONG_LITERAL:
      case ULONG_LITERAL:
      case FLOAT_LITERAL:
      case DOUBLE_LITERAL:
      case DECIMAL_LITERAL:
        return literal(SyntaxKind.NUMERIC_LITERAL_EXPRESSION);
      case CHAR_LITERAL:
        return literal(SyntaxKind.CHARACTER_LITERAL_EXPRESSION);
      case STRING_LITERAL:
      case RAW_STRING_LITERAL:
        return literal(SyntaxKind.STRING_LITERAL_EXPRESSION);
      case UTF8_STRING_LITERAL:
        return literal(SyntaxKind.UTF8_STRING_LITERAL_EXPRESSION);
      case TRUE:
        return literal(SyntaxKind.TRUE_LITERAL_EXPRESSION);
      case FALSE:
        return literal(SyntaxKind.FALSE_LITERAL_EXPRESSION);
      case NULL:
        return literal(SyntaxKind.NULL_LITERAL_EXPRESSION);
      case INTERPOLATED_STRING:
        return interpolatedString();
      case THIS:
        next();
        return SyntaxNode.of(SyntaxKind.THIS_EXPRESSION);
      case BASE:
        next();
        return SyntaxNode.of(SyntaxKind.BASE_EXPRESSION);
      case DEFAULT:
        if (peekToken(1) == Token.LPAREN) {
          return parenthesizedType(SyntaxKind.DEFAULT_EXPRESSION);
        }
        return literal(SyntaxKind.DEFAULT_LITERAL_EXPRESSION);
      case TYPEOF:
        return parenthesizedType(SyntaxKind.TYPE_OF_EXPRESSION);
      case SIZEOF:
        return parenthesizedType(SyntaxKind.SIZE_OF_EXPRESSION);
      case CHECKED:
        return parenthesizedExpression(SyntaxKind.CHECKED_EXPRESSION);
      case UNCHECKED:
        return parenthesizedExpression(SyntaxKind.UNCHECKED_EXPRESSION);
      case LPAREN:
        return parenthesizedOrTuple();
      case LBRACK:
        return collectionExpression();
      case NEW:
        return creationExpression();
      case STACKALLOC:
        return stackAllocExpression();
      case DELEGATE:
        return anonymousMethod();
      case STATIC:
        if (peekToken(1) == Token.DELEGATE) {
          next();
          return anonymousMethod();
        }
        break;
      case THROW:
        next();
        return SyntaxNode.of(SyntaxKind.THROW_EXPRESSION, expression());
      default:
        break;
    }
    throw error(ErrorKind.EXPECTED_EXPRESSION, describe(current()));
  }

  private SyntaxNode identifierPrimary() {
    if (atWord("async") && peekToken(1) == Token.DELEGATE) {
      next();
      return anonymousMethod();
    }
    if (atWord("from") && atQueryExpression()) {
      return queryExpression();
    }
    if (atWord("var") && peekToken(1) == Token.LPAREN && atDeconstruction()) {
      next();
      return SyntaxNode.of(
          SyntaxKind.DECLARATION_EXPRESSION,
          SyntaxNode.named(SyntaxKind.IDENTIFIER_NAME, "var"),
          designation());
    }
    return genericOrIdentifier();
  }

  /** Returns true at {@code var (a, b) =}, a deconstructing declaration. */
  private boolean atDeconstruction() {
    return lookahead(
        () -> {
          next();
          designation();
          return at(Token.ASSIGN) || at(Token.IN);
        });
  }

  private SyntaxNode literal(SyntaxKind kind) {
    String text = current().text();
    next();
    return SyntaxNode.named(kind, text);
  }

  /** Parses {@code typeof(T)}, {@code sizeof(T)} and {@code default(T)}. */
  private SyntaxNode parenthesizedType(SyntaxKind kind) {
    next();
    expect(Token.LPAREN);
    SyntaxNode type = type();
    expect(Token.RPAREN);
    return SyntaxNode.of(kind, type);
  }

  /** Parses {@code checked(e)} and {@code unchecked(e)}. */
  private SyntaxNode parenthesizedExpression(SyntaxKind kind) {
    next();
    expect(Token.LPAREN);
    SyntaxNode expression = expression();
    expect(Token.RPAREN);
    return SyntaxNode.of(kind, expression);
  }

  /** Parses a parenthesized expression or a tuple expression. */
  private SyntaxNode parenthesizedOrTuple() {
    expect(Token.LPAREN);
    SyntaxNode first = tupleElement();
    if (!at(Token.COMMA)
        && first.children().size() == 1
        && first.child(0).kind() != SyntaxKind.DECLARATION_EXPRESSION) {
      // a single unnamed element is parenthesized, even when the ')' is missing
      expect(Token.RPAREN);
      return SyntaxNode.of(SyntaxKind.PARENTHESIZED_EXPRESSION, first.child(0));
    }
    SyntaxNode.Builder tuple = SyntaxNode.builder(SyntaxKind.TUPLE_EXPRESSION).add(first);
    while (maybe(Token.COMMA)) {
      tuple.add(tupleElement());
    }
    expect(Token.RPAREN);
    return tuple.build();
  }

  /** Parses one element of a tuple expression, as an {@code Argument}. */
  private SyntaxNode tupleElement() {
    SyntaxNode nameColon = null;
    if (at(Token.IDENT) && peekToken(1) == Token.COLON) {
      nameColon = nameColon();
    }
    SyntaxNode expression;
    if (atDeclarationExpression(true)) {
      expression = declarationExpression();
    } else {
      expression = expression();
    }
    return SyntaxNode.of(SyntaxKind.ARGUMENT, nameColon, expression);
  }

  private SyntaxNode nameColon() {
    String name = current().value();
    next();
    expect(Token.COLON);
    return SyntaxNode.of(
        SyntaxKind.NAME_COLON, SyntaxNode.named(SyntaxKind.IDENTIFIER_NAME, name));
  }

  /**
   * Returns true at a declaration expression such as {@code int x} or {@code var (a, b)}.
   *
   * @param delimited if true, the declaration must be followed by {@code ,} or {@code )}
   */
  private boolean atDeclarationExpression(boolean delimited) {
    if (!atTypeStart() || at(Token.REF)) {
      return false;
    }
    return lookahead(
        () -> {
          SyntaxNode type = type();
          if (at(Token.LPAREN)) {
            if (type.kind() != SyntaxKind.IDENTIFIER_NAME || !"var".equals(type.tokenValue())) {
              return false;
            }
          } else if (!at(Token.IDENT)) {
            return false;
          }
          designation();
          return !delimited || at(Token.COMMA) || at(Token.RPAREN);
        });
  }

  final SyntaxNode declarationExpression() {
    SyntaxNode type = type();
    return SyntaxNode.of(SyntaxKind.DECLARATION_EXPRESSION, type, designation());
  }

  /** Parses a variable designation: {@code x}, {@code _} or {@code (a, (b, _))}. */
  final SyntaxNode designation() {
    if (at(Token.LPAREN)) {
      next();
      SyntaxNode.Builder designations =
          SyntaxNode.builder(SyntaxKind.PARENTHESIZED_VARIABLE_DESIGNATION);
      if (!at(Token.RPAREN)) {
        do {
          designations.add(nested(this::designation));
        } while (maybe(Token.COMMA));
      }
      expect(Token.RPAREN);
      return designations.build();
    }
    if (!at(Token.IDENT)) {
      throw error(ErrorKind.EXPECTED_IDENTIFIER, describe(current()));
    }
    String name = current().value();
    next();
    if (name.equals("_")) {
      return SyntaxNode.of(SyntaxKind.DISCARD_DESIGNATION);
    }
    return SyntaxNode.named(SyntaxKind.SINGLE_VARIABLE_DESIGNATION, name);
  }

  final SyntaxNode argumentList() {
    expect(Token.LPAREN);
    SyntaxNode.Builder arguments = SyntaxNode.builder(SyntaxKind.ARGUMENT_LIST);
    arguments(Token.RPAREN, arguments);
    return arguments.build();
  }

  final SyntaxNode bracketedArgumentList() {
    expect(Token.LBRACK);
    SyntaxNode.Builder arguments = SyntaxNode.builder(SyntaxKind.BRACKETED_ARGUMENT_LIST);
    arguments(Token.RBRACK, arguments);
    return arguments.build();
  }

  /**
   * Parses comma-separated arguments up to {@code close}. While recovering, a missing comma
   * between two arguments is reported and the next argument is parsed anyway.
   */
  private void arguments(Token close, SyntaxNode.Builder arguments) {
    if (!at(close)) {
      while (true) {
        arguments.add(argument());
        if (maybe(Token.COMMA)) {
          continue;
        }
        if (at(close) || !recovering() || !atExpressionStart()) {
          break;
        }
        reportMissing("','");
      }
    }
    expect(close);
  }

  private SyntaxNode argument() {
    SyntaxNode nameColon = null;
    if (at(Token.IDENT) && peekToken(1) == Token.COLON) {
      nameColon = nameColon();
    }
    boolean byReference = at(Token.OUT) || at(Token.REF) || at(Token.IN);
    if (byReference) {
      next();
    }
    SyntaxNode expression;
    if (byReference && atDeclarationExpression(false)) {
      expression = declarationExpression();
    } else {
      expression = expression();
    }
    return SyntaxNode.of(SyntaxKind.ARGUMENT, nameColon, expression);
  }

  /** Parses the expressions that start with {@code new}. */
  private SyntaxNode creationExpression() {
    expect(Token.NEW);
    switch (token()) {
      case LBRACK -> {
        // new[] { ... }
        omittedRank();
        return SyntaxNode.of(
            SyntaxKind.IMPLICIT_ARRAY_CREATION_EXPRESSION,
            initializer(SyntaxKind.ARRAY_INITIALIZER_EXPRESSION));
      }
      case LPAREN -> {
        SyntaxNode arguments = argumentList();
        SyntaxNode initializer = at(Token.LBRACE) ? objectOrCollectionInitializer() : null;
        return SyntaxNode.of(
            SyntaxKind.IMPLICIT_OBJECT_CREATION_EXPRESSION, arguments, initializer);
      }
      case LBRACE -> {
        return anonymousObjectCreation();
      }
      default -> {}
    }
    SyntaxNode type = type(TypeMode.NEW);
    if (at(Token.LBRACK)) {
      SyntaxNode.Builder arrayType = SyntaxNode.builder(SyntaxKind.ARRAY_TYPE).add(type);
      arrayType.add(sizedRank());
      while (at(Token.LBRACK) && atOmittedRank()) {
        arrayType.add(omittedRank());
      }
      SyntaxNode initializer =
          at(Token.LBRACE) ? initializer(SyntaxKind.ARRAY_INITIALIZER_EXPRESSION) : null;
      return SyntaxNode.of(
          SyntaxKind.ARRAY_CREATION_EXPRESSION, arrayType.build(), initializer);
    }
    SyntaxNode arguments = at(Token.LPAREN) ? argumentList() : null;
    SyntaxNode initializer = at(Token.LBRACE) ? objectOrCollectionInitializer() : null;
    if (arguments == null && initializer == null) {
      reportMissing("'('");
    }
    return SyntaxNode.of(SyntaxKind.OBJECT_CREATION_EXPRESSION, type, arguments, initializer);
  }

  /** Parses the first rank of an array creation, which may carry sizes. */
  private SyntaxNode sizedRank() {
    if (atOmittedRank()) {
      return omittedRank();
    }
    expect(Token.LBRACK);
    SyntaxNode.Builder rank = SyntaxNode.builder(SyntaxKind.ARRAY_RANK_SPECIFIER);
    do {
      rank.add(at(Token.COMMA) || at(Token.RBRACK)
          ? SyntaxNode.of(SyntaxKind.OMITTED_ARRAY_SIZE_EXPRESSION)
          : expression());
    } while (maybe(Token.COMMA));
    expect(Token.RBRACK);
    return rank.build();
  }

  private SyntaxNode anonymousObjectCreation() {
    expect(Token.LBRACE);
    SyntaxNode.Builder creation =
        SyntaxNode.builder(SyntaxKind.ANONYMOUS_OBJECT_CREATION_EXPRESSION);
    while (!at(Token.RBRACE) && !at(Token.EOF)) {
      SyntaxNode nameEquals = null;
      if (at(Token.IDENT) && peekToken(1) == Token.ASSIGN) {
        String name = current().value();
        next();
        next();
        nameEquals =
            SyntaxNode.of(
                SyntaxKind.NAME_EQUALS, SyntaxNode.named(SyntaxKind.IDENTIFIER_NAME, name));
      }
      creation.add(
          SyntaxNode.of(
              SyntaxKind.ANONYMOUS_OBJECT_MEMBER_DECLARATOR, nameEquals, expression()));
      if (!maybe(Token.COMMA)) {
        break;
      }
    }
    expect(Token.RBRACE);
    return creation.build();
  }

  /**
   * Parses the initializer after an object creation. It is an object initializer if it is empty
   * or its first element assigns a member or an index, and a collection initializer otherwise.
   */
  private SyntaxNode objectOrCollectionInitializer() {
    int indexEnd = peekToken(1) == Token.LBRACK ? skipBalanced(1) : -1;
    boolean object =
        peekToken(1) == Token.RBRACE
            || (peekToken(1) == Token.IDENT && peekToken(2) == Token.ASSIGN)
            || (indexEnd != -1 && peekToken(indexEnd) == Token.ASSIGN);
    return initializer(
        object
            ? SyntaxKind.OBJECT_INITIALIZER_EXPRESSION
            : SyntaxKind.COLLECTION_INITIALIZER_EXPRESSION);
  }

  /** Parses a braced initializer of the given kind, allowing a trailing comma. */
  final SyntaxNode initializer(SyntaxKind kind) {
    expect(Token.LBRACE);
    SyntaxNode.Builder initializer = SyntaxNode.builder(kind);
    while (!at(Token.RBRACE) && !at(Token.EOF)) {
      initializer.add(nested(() -> initializerElement(kind)));
      if (recovering() && at(Token.SEMI) && peekToken(1) == Token.RBRACE) {
        // a statement terminator before the closing brace
        recordSkipped();
        next();
        break;
      }
      if (!maybe(Token.COMMA)) {
        break;
      }
    }
    expect(Token.RBRACE);
    return initializer.build();
  }

  private SyntaxNode initializerElement(SyntaxKind kind) {
    switch (kind) {
      case ARRAY_INITIALIZER_EXPRESSION:
        if (at(Token.LBRACE)) {
          return initializer(SyntaxKind.ARRAY_INITIALIZER_EXPRESSION);
        }
        return expression();
      case COLLECTION_INITIALIZER_EXPRESSION:
        if (at(Token.LBRACE)) {
          return initializer(SyntaxKind.COMPLEX_ELEMENT_INITIALIZER_EXPRESSION);
        }
        return expression();
      case OBJECT_INITIALIZER_EXPRESSION:
        {
          SyntaxNode target;
          if (at(Token.LBRACK)) {
            target = SyntaxNode.of(SyntaxKind.IMPLICIT_ELEMENT_ACCESS, bracketedArgumentList());
          } else if (at(Token.IDENT) && peekToken(1) == Token.ASSIGN) {
            target = SyntaxNode.named(SyntaxKind.IDENTIFIER_NAME, current().value());
            next();
          } else {
            return expression();
          }
          expect(Token.ASSIGN);
          SyntaxNode value = at(Token.LBRACE) ? objectOrCollectionInitializer() : expression();
          return SyntaxNode.of(SyntaxKind.SIMPLE_ASSIGNMENT_EXPRESSION, target, value);
        }
      default:
        return expression();
    }
  }

  /**
   * Parses a {@code stackalloc} expression. Exactly one of a size and an initializer must be
   * given, and the element type may only be omitted when an initializer is.
   */
  final SyntaxNode stackAllocExpression() {
    int start = current().position();
    expect(Token.STACKALLOC);
    if (at(Token.LBRACK)) {
      next();
      if (!at(Token.RBRACK)) {
        report(ErrorKind.INVALID_STACKALLOC, "an implicitly typed stackalloc cannot have a size");
        expression();
      }
      expect(Token.RBRACK);
      if (!at(Token.LBRACE)) {
        report(start, ErrorKind.INVALID_STACKALLOC, "missing initializer");
        return SyntaxNode.of(SyntaxKind.IMPLICIT_STACK_ALLOC_ARRAY_CREATION_EXPRESSION);
      }
      return SyntaxNode.of(
          SyntaxKind.IMPLICIT_STACK_ALLOC_ARRAY_CREATION_EXPRESSION,
          initializer(SyntaxKind.ARRAY_INITIALIZER_EXPRESSION));
    }
    SyntaxNode elementType = type(TypeMode.NEW);
    if (!at(Token.LBRACK)) {
      throw error(ErrorKind.EXPECTED_TOKEN, "'['");
    }
    next();
    SyntaxNode size = null;
    if (!at(Token.RBRACK)) {
      size = expression();
    }
    expect(Token.RBRACK);
    SyntaxNode rank =
        SyntaxNode.of(
            SyntaxKind.ARRAY_RANK_SPECIFIER,
            size != null ? size : SyntaxNode.of(SyntaxKind.OMITTED_ARRAY_SIZE_EXPRESSION));
    SyntaxNode arrayType = SyntaxNode.of(SyntaxKind.ARRAY_TYPE, elementType, rank);
    SyntaxNode initializer = null;
    if (at(Token.LBRACE)) {
      if (size != null) {
        report(ErrorKind.INVALID_STACKALLOC, "both a size and an initializer");
      }
      initializer = initializer(SyntaxKind.ARRAY_INITIALIZER_EXPRESSION);
    } else if (size == null) {
      report(start, ErrorKind.INVALID_STACKALLOC, "neither a size nor an initializer");
    }
    return SyntaxNode.of(SyntaxKind.STACK_ALLOC_ARRAY_CREATION_EXPRESSION, arrayType, initializer);
  }

  /** Parses a collection expression, {@code [a, ..b]}. */
  private SyntaxNode collectionExpression() {
    if (!version.supportsCollectionExpressions()) {
      throw error(ErrorKind.EXPECTED_EXPRESSION, describe(current()));
    }
    expect(Token.LBRACK);
    SyntaxNode.Builder collection = SyntaxNode.builder(SyntaxKind.COLLECTION_EXPRESSION);
    while (!at(Token.RBRACK) && !at(Token.EOF)) {
      if (maybe(Token.DOTDOT)) {
        collection.add(SyntaxNode.of(SyntaxKind.SPREAD_ELEMENT, expression()));
      } else {
        collection.add(SyntaxNode.of(SyntaxKind.EXPRESSION_ELEMENT, expression()));
      }
      if (!maybe(Token.COMMA)) {
        break;
      }
    }
    expect(Token.RBRACK);
    return collection.build();
  }

  /** Parses {@code delegate (params) { ... }}; the parameter list is optional. */
  private SyntaxNode anonymousMethod() {
    expect(Token.DELEGATE);
    SyntaxNode parameters = at(Token.LPAREN) ? parameterList() : null;
    return SyntaxNode.of(SyntaxKind.ANONYMOUS_METHOD_EXPRESSION, parameters, block());
  }

  /** Parses an expression that is not an assignment or a lambda, such as a {@code when} filter. */
  final SyntaxNode nonAssignmentExpression() {
    return nested(this::conditionalExpression);
  }

  /**
   * Returns true at the start of a lambda: {@code x =>}, {@code (...) =>}, or either of those after
   * attributes, {@code async}/{@code static} modifiers or an explicit return type.
   */
  final boolean atLambda() {
    int i = 0;
    while (peekToken(i) == Token.LBRACK) {
      i = skipBalanced(i);
      if (i == -1) {
        return false;
      }
    }
    while (true) {
      SavedToken token = peek(i);
      Token next = peekToken(i + 1);
      boolean modifier =
          token.token() == Token.STATIC
              || (token.is("async")
                  && (next == Token.IDENT || next == Token.LPAREN || next == Token.STATIC));
      if (!modifier) {
        break;
      }
      i++;
    }
    switch (peekToken(i)) {
      case IDENT -> {
        if (peekToken(i + 1) == Token.LAMBDA) {
          return true;
        }
        if (peekToken(i + 1) == Token.LPAREN) {
          // an invocation, not a lambda with an explicit return type
          return false;
        }
      }
      case LPAREN -> {
        int end = skipBalanced(i);
        return end != -1 && peekToken(end) == Token.LAMBDA;
      }
      default -> {
        if (!peekToken(i).isPredefinedType() && peekToken(i) != Token.REF) {
          return false;
        }
      }
    }
    int offset = i;
    return lookahead(
        () -> {
          for (int j = 0; j < offset; j++) {
            next();
          }
          type();
          if (!at(Token.LPAREN)) {
            return false;
          }
          int end = skipBalanced(0);
          return end != -1 && peekToken(end) == Token.LAMBDA;
        });
  }

  private SyntaxNode lambda() {
    ImmutableList<SyntaxNode> attributes = attributeLists();
    while (at(Token.STATIC) || (atWord("async") && peekToken(1) != Token.LAMBDA)) {
      next();
    }
    if (at(Token.IDENT) && peekToken(1) == Token.LAMBDA) {
      SyntaxNode parameter = SyntaxNode.named(SyntaxKind.PARAMETER, current().value());
      next();
      next();
      return SyntaxNode.builder(SyntaxKind.SIMPLE_LAMBDA_EXPRESSION)
          .addAll(attributes)
          .add(parameter)
          .add(lambdaBody())
          .build();
    }
    SyntaxNode returnType = at(Token.LPAREN) ? null : type();
    SyntaxNode parameters = parameterList();
    expect(Token.LAMBDA);
    return SyntaxNode.builder(SyntaxKind.PARENTHESIZED_LAMBDA_EXPRESSION)
        .addAll(attributes)
        .add(returnType)
        .add(parameters)
        .add(lambdaBody())
        .build();
  }

  private SyntaxNode lambdaBody() {
    return at(Token.LBRACE) ? block() : expression();
  }

  /** Rescans an interpolated string token and parses the expressions in its holes. */
  private SyntaxNode interpolatedString() {
    SavedToken token = current();
    next();
    String text = source.source();
    InterpolatedStrings.Scan scan = InterpolatedStrings.scan(text, token.position());
    SyntaxNode.Builder string = SyntaxNode.builder(SyntaxKind.INTERPOLATED_STRING_EXPRESSION);
    for (InterpolatedStrings.Part part : scan.parts()) {
      if (part instanceof InterpolatedStrings.Text literal) {
        string.add(
            SyntaxNode.named(
                SyntaxKind.INTERPOLATED_STRING_TEXT,
                text.substring(literal.start(), literal.end())));
      } else if (part instanceof InterpolatedStrings.Hole hole) {
        string.add(interpolation(hole));
      }
    }
    return string.build();
  }

  private SyntaxNode interpolation(InterpolatedStrings.Hole hole) {
    ImmutableList<SavedToken> tokens;
    try {
      tokens = Lexer.tokenize(source, hole.start(), hole.expressionEnd(), null);
    } catch (ParseError e) {
      if (!recovering()) {
        throw e;
      }
      record(Diagnostic.of(source, e));
      return SyntaxNode.of(SyntaxKind.INTERPOLATION);
    }
    SyntaxNode interpolation =
        withTokens(
            tokens,
            () -> {
              SyntaxNode expression = expressionOrMissing();
              SyntaxNode alignment = null;
              if (maybe(Token.COMMA)) {
                alignment =
                    SyntaxNode.of(SyntaxKind.INTERPOLATION_ALIGNMENT_CLAUSE, expression());
              }
              if (!at(Token.EOF)) {
                report(ErrorKind.UNEXPECTED_TOKEN, describe(current()));
              }
              return SyntaxNode.of(SyntaxKind.INTERPOLATION, expression, alignment);
            });
    if (hole.formatStart() != -1) {
      interpolation =
          interpolation.withChild(
              SyntaxNode.named(
                  SyntaxKind.INTERPOLATION_FORMAT_CLAUSE,
                  source.source().substring(hole.formatStart(), hole.end())));
    }
    return interpolation;
  }

  private SyntaxNode switchExpression(SyntaxNode governing) {
    expect(Token.SWITCH);
    expect(Token.LBRACE);
    SyntaxNode.Builder switchExpression =
        SyntaxNode.builder(SyntaxKind.SWITCH_EXPRESSION).add(governing);
    while (!at(Token.RBRACE) && !at(Token.EOF)) {
      SyntaxNode pattern = pattern();
      SyntaxNode whenClause = atWord("when") ? whenClause() : null;
      expect(Token.LAMBDA);
      SyntaxNode result = expression();
      switchExpression.add(
          SyntaxNode.of(SyntaxKind.SWITCH_EXPRESSION_ARM, pattern, whenClause, result));
      if (!maybe(Token.COMMA)) {
        break;
      }
    }
    expect(Token.RBRACE);
    return switchExpression.build();
  }

  final SyntaxNode whenClause() {
    next();
    return SyntaxNode.of(SyntaxKind.WHEN_CLAUSE, nonAssignmentExpression());
  }

  // Patterns

  final SyntaxNode pattern() {
    return nested(this::orPattern);
  }

  private SyntaxNode orPattern() {
    SyntaxNode left = andPattern();
    while (atWord("or") && atPatternStart(1)) {
      next();
      left = SyntaxNode.of(SyntaxKind.OR_PATTERN, left, andPattern());
    }
    return left;
  }

  private SyntaxNode andPattern() {
    SyntaxNode left = notPattern();
    while (atWord("and") && atPatternStart(1)) {
      next();
      left = SyntaxNode.of(SyntaxKind.AND_PATTERN, left, notPattern());
    }
    return left;
  }

  private SyntaxNode notPattern() {
    if (atWord("not") && atPatternStart(1)) {
      next();
      return SyntaxNode.of(SyntaxKind.NOT_PATTERN, nested(this::notPattern));
    }
    return primaryPattern();
  }

  private boolean atPatternStart() {
    return atPatternStart(0);
  }

  /** Returns true if the token {@code n} ahead can start a pattern. */
  private boolean atPatternStart(int n) {
    Token token = peekToken(n);
    return switch (token) {
      case IDENT, LPAREN, LBRACE, LBRACK, LT, LTE, GT, GTE, MINUS, PLUS, TILDE, NOT, DOTDOT,
          DEFAULT, TYPEOF, SIZEOF, THIS, BASE, NEW, CHECKED, UNCHECKED ->
          true;
      default -> token.isLiteral() || token.isPredefinedType();
    };
  }

  private SyntaxNode primaryPattern() {
    switch (token()) {
      case LPAREN -> {
        if (atPositionalPattern()) {
          return recursivePattern(null);
        }
        next();
        SyntaxNode pattern = pattern();
        expect(Token.RPAREN);
        return SyntaxNode.of(SyntaxKind.PARENTHESIZED_PATTERN, pattern);
      }
      case LBRACE -> {
        return recursivePattern(null);
      }
      case LBRACK -> {
        return listPattern();
      }
      case DOTDOT -> {
        next();
        return SyntaxNode.of(SyntaxKind.SLICE_PATTERN, atPatternStart() ? pattern() : null);
      }
      case LT, LTE, GT, GTE -> {
        next();
        return SyntaxNode.of(SyntaxKind.RELATIONAL_PATTERN, binary(SHIFT));
      }
      default -> {}
    }
    if (atWord("var") && (peekToken(1) == Token.IDENT || peekToken(1) == Token.LPAREN)) {
      next();
      return SyntaxNode.of(SyntaxKind.VAR_PATTERN, designation());
    }
    if (atWord("_") && !atDesignation(1) && peekToken(1) != Token.LPAREN
        && peekToken(1) != Token.LBRACE) {
      next();
      return SyntaxNode.of(SyntaxKind.DISCARD_PATTERN);
    }
    return typeOrConstantPattern();
  }

  /**
   * Returns true at a parenthesized positional pattern, {@code ()} or {@code (a, b)}, or at a
   * one-element one followed by a property clause or designation.
   */
  private boolean atPositionalPattern() {
    int end = skipBalanced(0);
    if (end == -1 || end == 2) {
      return true;
    }
    int nesting = 0;
    for (int i = 1; i < end - 1; i++) {
      switch (peekToken(i)) {
        case LPAREN, LBRACK, LBRACE -> nesting++;
        case RPAREN, RBRACK, RBRACE -> nesting--;
        case COMMA -> {
          if (nesting == 0) {
            return true;
          }
        }
        default -> {}
      }
    }
    return peekToken(end) == Token.LBRACE || atDesignation(end);
  }

  /** Returns true if the token {@code n} ahead is a designation rather than a combinator. */
  private boolean atDesignation(int n) {
    SavedToken token = peek(n);
    return token.token() == Token.IDENT
        && !token.is("and")
        && !token.is("or")
        && !token.is("when");
  }

  private SyntaxNode recursivePattern(@Nullable SyntaxNode type) {
    SyntaxNode.Builder pattern = SyntaxNode.builder(SyntaxKind.RECURSIVE_PATTERN).add(type);
    if (at(Token.LPAREN)) {
      pattern.add(subpatterns(Token.LPAREN, Token.RPAREN, SyntaxKind.POSITIONAL_PATTERN_CLAUSE));
    }
    if (at(Token.LBRACE)) {
      pattern.add(subpatterns(Token.LBRACE, Token.RBRACE, SyntaxKind.PROPERTY_PATTERN_CLAUSE));
    }
    if (atDesignation(0)) {
      pattern.add(designation());
    }
    return pattern.build();
  }

  private SyntaxNode subpatterns(Token open, Token close, SyntaxKind kind) {
    expect(open);
    SyntaxNode.Builder clause = SyntaxNode.builder(kind);
    while (!at(close) && !at(Token.EOF)) {
      clause.add(subpattern());
      if (!maybe(Token.COMMA)) {
        break;
      }
    }
    expect(close);
    return clause.build();
  }

  private SyntaxNode subpattern() {
    SyntaxNode name = null;
    if (at(Token.IDENT) && peekToken(1) == Token.COLON) {
      name = nameColon();
    } else if (at(Token.IDENT) && peekToken(1) == Token.DOT && atExtendedPropertyName()) {
      SyntaxNode expression = binary(SHIFT);
      expect(Token.COLON);
      name = SyntaxNode.of(SyntaxKind.EXPRESSION_COLON, expression);
    }
    return SyntaxNode.of(SyntaxKind.SUBPATTERN, name, pattern());
  }

  /** Returns true at {@code a.b.c:} in a property pattern. */
  private boolean atExtendedPropertyName() {
    int i = 0;
    while (peekToken(i) == Token.IDENT && peekToken(i + 1) == Token.DOT) {
      i += 2;
    }
    return peekToken(i) == Token.IDENT && peekToken(i + 1) == Token.COLON;
  }

  private SyntaxNode listPattern() {
    expect(Token.LBRACK);
    SyntaxNode.Builder pattern = SyntaxNode.builder(SyntaxKind.LIST_PATTERN);
    while (!at(Token.RBRACK) && !at(Token.EOF)) {
      pattern.add(pattern());
      if (!maybe(Token.COMMA)) {
        break;
      }
    }
    expect(Token.RBRACK);
    if (atDesignation(0)) {
      pattern.add(designation());
    }
    return pattern.build();
  }

  /**
   * Parses a pattern that starts with a type or an expression. A name alone is a constant
   * pattern, since it may refer to a constant; other types alone are type patterns.
   */
  private SyntaxNode typeOrConstantPattern() {
    Mark start = mark();
    SyntaxNode type =
        atTypeStart() && !at(Token.REF) ? speculate(() -> type(TypeMode.EXPRESSION)) : null;
    if (type != null && !at(Token.DOT)) {
      boolean name = isName(type);
      if ((name || type.kind() == SyntaxKind.PREDEFINED_TYPE)
          && (at(Token.LPAREN) || at(Token.LBRACE))) {
        return recursivePattern(type);
      }
      if (atDesignation(0)) {
        return SyntaxNode.of(SyntaxKind.DECLARATION_PATTERN, type, designation());
      }
      if (!name && !atBinaryOperatorToken()) {
        return SyntaxNode.of(SyntaxKind.TYPE_PATTERN, type);
      }
    }
    reset(start);
    return SyntaxNode.of(SyntaxKind.CONSTANT_PATTERN, binary(SHIFT));
  }

  private static boolean isName(SyntaxNode type) {
    return switch (type.kind()) {
      case IDENTIFIER_NAME, GENERIC_NAME, QUALIFIED_NAME, ALIAS_QUALIFIED_NAME -> true;
      default -> false;
    };
  }

  private boolean atBinaryOperatorToken() {
    return switch (token()) {
      case PLUS, MINUS, MULT, DIV, MOD, LTLT -> true;
      default -> false;
    };
  }

  // Query expressions

  /** Returns true at {@code from x in} or {@code from T x in}. */
  private boolean atQueryExpression() {
    if (peekToken(1) == Token.IDENT && peekToken(2) == Token.IN) {
      return true;
    }
    return lookahead(
        () -> {
          next();
          if (!atTypeStart() || at(Token.REF)) {
            return false;
          }
          type();
          return at(Token.IDENT) && peekToken(1) == Token.IN;
        });
  }

  private SyntaxNode queryExpression() {
    SyntaxNode from = fromClause();
    return SyntaxNode.of(SyntaxKind.QUERY_EXPRESSION, from, queryBody());
  }

  private SyntaxNode fromClause() {
    next();
    SyntaxNode type = at(Token.IDENT) && peekToken(1) == Token.IN ? null : type();
    String name = identifier();
    expect(Token.IN);
    return SyntaxNode.named(SyntaxKind.FROM_CLAUSE, name, type, expression());
  }

  private SyntaxNode queryBody() {
    SyntaxNode.Builder body = SyntaxNode.builder(SyntaxKind.QUERY_BODY);
    while (true) {
      if (atWord("from")) {
        body.add(fromClause());
      } else if (atWord("let")) {
        next();
        String name = identifier();
        expect(Token.ASSIGN);
        body.add(SyntaxNode.named(SyntaxKind.LET_CLAUSE, name, expression()));
      } else if (atWord("where")) {
        next();
        body.add(SyntaxNode.of(SyntaxKind.WHERE_CLAUSE, expression()));
      } else if (atWord("join")) {
        body.add(joinClause());
      } else if (atWord("orderby")) {
        body.add(orderByClause());
      } else {
        break;
      }
    }
    if (maybeWord("select")) {
      body.add(SyntaxNode.of(SyntaxKind.SELECT_CLAUSE, expression()));
    } else if (maybeWord("group")) {
      SyntaxNode group = expression();
      expectWord("by");
      body.add(SyntaxNode.of(SyntaxKind.GROUP_CLAUSE, group, expression()));
    } else {
      reportMissing("'select' or 'group'");
    }
    if (maybeWord("into")) {
      String name = identifier();
      body.add(SyntaxNode.named(SyntaxKind.QUERY_CONTINUATION, name, nested(this::queryBody)));
    }
    return body.build();
  }

  private SyntaxNode joinClause() {
    next();
    SyntaxNode type = at(Token.IDENT) && peekToken(1) == Token.IN ? null : type();
    String name = identifier();
    expect(Token.IN);
    SyntaxNode source = expression();
    expectWord("on");
    SyntaxNode left = expression();
    expectWord("equals");
    SyntaxNode right = expression();
    SyntaxNode into = null;
    if (maybeWord("into")) {
      into = SyntaxNode.named(SyntaxKind.JOIN_INTO_CLAUSE, identifier());
    }
    return SyntaxNode.named(SyntaxKind.JOIN_CLAUSE, name, type, source, left, right, into);
  }

  private SyntaxNode orderByClause() {
    next();
    SyntaxNode.Builder orderBy = SyntaxNode.builder(SyntaxKind.ORDER_BY_CLAUSE);
    do {
      SyntaxNode key = expression();
      SyntaxKind direction = SyntaxKind.ASCENDING_ORDERING;
      if (maybeWord("descending")) {
        direction = SyntaxKind.DESCENDING_ORDERING;
      } else {
        maybeWord("ascending");
      }
      orderBy.add(SyntaxNode.of(direction, key));
    } while (maybe(Token.COMMA));
    return orderBy.build();
  }

  private void expectWord(String word) {
    if (!maybeWord(word)) {
      reportMissing("'" + word + "'");
    }
  }

  // Attributes

  @Override
  final ImmutableList<SyntaxNode> attributeLists() {
    ImmutableList.Builder<SyntaxNode> lists = ImmutableList.builder();
    while (at(Token.LBRACK)) {
      lists.add(attributeList());
    }
    return lists.build();
  }

  /** Parses {@code [target: A(x), B]}. */
  final SyntaxNode attributeList() {
    expect(Token.LBRACK);
    SyntaxNode.Builder list = SyntaxNode.builder(SyntaxKind.ATTRIBUTE_LIST);
    if ((at(Token.IDENT) || token().isKeyword()) && peekToken(1) == Token.COLON) {
      list.add(SyntaxNode.named(SyntaxKind.ATTRIBUTE_TARGET_SPECIFIER, current().value()));
      next();
      next();
    }
    while (!at(Token.RBRACK) && !at(Token.EOF)) {
      SyntaxNode name = name();
      SyntaxNode arguments = at(Token.LPAREN) ? attributeArgumentList() : null;
      list.add(SyntaxNode.of(SyntaxKind.ATTRIBUTE, name, arguments));
      if (!maybe(Token.COMMA)) {
        break;
      }
    }
    expect(Token.RBRACK);
    return list.build();
  }

  private SyntaxNode attributeArgumentList() {
    expect(Token.LPAREN);
    SyntaxNode.Builder arguments = SyntaxNode.builder(SyntaxKind.ATTRIBUTE_ARGUMENT_LIST);
    while (!at(Token.RPAREN) && !at(Token.EOF)) {
      SyntaxNode name = null;
      if (at(Token.IDENT) && peekToken(1) == Token.ASSIGN) {
        name =
            SyntaxNode.of(
                SyntaxKind.NAME_EQUALS,
                SyntaxNode.named(SyntaxKind.IDENTIFIER_NAME, current().value()));
        next();
        next();
      } else if (at(Token.IDENT) && peekToken(1) == Token.COLON) {
        name = nameColon();
      }
      arguments.add(SyntaxNode.of(SyntaxKind.ATTRIBUTE_ARGUMENT, name, expression()));
      if (!maybe(Token.COMMA)) {
        break;
      }
    }
    expect(Token.RPAREN);
    return arguments.build();
  }

  // Parameters

  final SyntaxNode parameterList() {
    return parameters(Token.LPAREN, Token.RPAREN, SyntaxKind.PARAMETER_LIST);
  }

  final SyntaxNode bracketedParameterList() {
    return parameters(Token.LBRACK, Token.RBRACK, SyntaxKind.BRACKETED_PARAMETER_LIST);
  }

  private SyntaxNode parameters(Token open, Token close, SyntaxKind kind) {
    expect(open);
    SyntaxNode.Builder parameters = SyntaxNode.builder(kind);
    while (!at(close) && !at(Token.EOF)) {
      parameters.add(nested(() -> parameter(close)));
      if (!maybe(Token.COMMA)) {
        break;
      }
    }
    expect(close);
    return parameters.build();
  }

  private SyntaxNode parameter(Token close) {
    ImmutableList<SyntaxNode> attributes = attributeLists();
    while (atParameterModifier()) {
      next();
    }
    SyntaxNode.Builder parameter = SyntaxNode.builder(SyntaxKind.PARAMETER);
    if (at(Token.IDENT) && (peekToken(1) == Token.COMMA || peekToken(1) == close)) {
      // an implicitly typed lambda parameter
      parameter.tokenValue(current().value());
      next();
      return parameter.addAll(attributes).build();
    }
    parameter.addAll(attributes);
    parameter.add(type());
    if (at(Token.IDENT)) {
      parameter.tokenValue(current().value());
      next();
    } else {
      report(ErrorKind.EXPECTED_IDENTIFIER, describe(current()));
    }
    if (maybe(Token.ASSIGN)) {
      parameter.add(SyntaxNode.of(SyntaxKind.EQUALS_VALUE_CLAUSE, expression()));
    }
    return parameter.build();
  }

  private boolean atParameterModifier() {
    switch (token()) {
      case REF, OUT, IN, PARAMS, THIS, READONLY -> {
        return true;
      }
      case IDENT -> {
        if (!atWord("scoped")) {
          return false;
        }
        Token next = peekToken(1);
        if (next == Token.REF || next == Token.IN || next == Token.OUT) {
          return true;
        }
        if (next != Token.IDENT && !next.isPredefinedType()) {
          return false;
        }
        return switch (peekToken(2)) {
          case COMMA, RPAREN, RBRACK, ASSIGN -> false;
          default -> true;
        };
      }
      default -> {
        return false;
      }
    }
  }
}
