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

/** Parses statements, local declarations and local functions. */
abstract class StatementParser extends ExpressionParser {

  /** The number of blocks so far that ended without a closing brace. */
  private int unclosedBlocks;

  StatementParser(
      SourceFile source,
      ImmutableList<SavedToken> tokens,
      ParserOptions options,
      boolean recovering) {
    super(source, tokens, options, recovering);
  }

  @Override
  final SyntaxNode block() {
    expect(Token.LBRACE);
    SyntaxNode.Builder block = SyntaxNode.builder(SyntaxKind.BLOCK);
    while (true) {
      if (maybe(Token.RBRACE)) {
        break;
      }
      if (at(Token.EOF) || atMemberOnlyToken()) {
        // leave the token to the enclosing member
        reportMissing("'}'");
        unclosedBlocks++;
        break;
      }
      block.add(statementOrSkip());
    }
    return block.build();
  }

  final int unclosedBlocks() {
    return unclosedBlocks;
  }

  /** Returns true at a token that can start a type member but never a statement. */
  final boolean atMemberOnlyToken() {
    return switch (token()) {
      case PUBLIC, PRIVATE, PROTECTED, INTERNAL, CLASS, STRUCT, INTERFACE, ENUM, NAMESPACE,
          ABSTRACT, OVERRIDE, VIRTUAL, SEALED, EVENT, IMPLICIT, EXPLICIT ->
          true;
      default -> false;
    };
  }

  /**
   * Parses a statement. While recovering, a statement that fails to parse is reported, and its
   * tokens are skipped up to the next {@code ;} or {@code }}; null is returned.
   */
  final @Nullable SyntaxNode statementOrSkip() {
    Mark start = mark();
    try {
      return statement();
    } catch (ParseError e) {
      if (!recovering()) {
        throw e;
      }
      reset(start);
      record(Diagnostic.of(source, e));
      skipStatement();
      return null;
    }
  }

  /** Skips tokens up to and including the next {@code ;}, stopping before braces. */
  private void skipStatement() {
    while (true) {
      switch (token()) {
        case SEMI -> {
          next();
          return;
        }
        case EOF, RBRACE -> {
          return;
        }
        case LBRACE -> {
          int end = skipBalanced(0);
          if (end == -1) {
            next();
          } else {
            for (int i = 0; i < end; i++) {
              next();
            }
          }
          return;
        }
        default -> {
          if (atMemberOnlyToken()) {
            return;
          }
          next();
        }
      }
    }
  }

  final SyntaxNode statement() {
    return nested(this::statementWithAttributes);
  }

  private SyntaxNode statementWithAttributes() {
    if (!at(Token.LBRACK)) {
      return unattributedStatement();
    }
    ImmutableList<SyntaxNode> attributes = statementAttributes();
    SyntaxNode statement = unattributedStatement();
    if (attributes.isEmpty()) {
      return statement;
    }
    return SyntaxNode.builder(statement.kind())
        .tokenValue(statement.tokenValue())
        .addAll(attributes)
        .addAll(statement.children())
        .build();
  }

  /**
   * Parses the attribute lists in front of a statement. A {@code [} that starts an expression, such
   * as a collection expression, yields no attributes.
   */
  private ImmutableList<SyntaxNode> statementAttributes() {
    ImmutableList<SyntaxNode> attributes =
        speculate(
            () -> {
              ImmutableList<SyntaxNode> lists = attributeLists();
              return continuesAfterAttributes() ? lists : null;
            });
    return attributes != null ? attributes : ImmutableList.of();
  }

  /** Returns true if the token after attribute lists can continue a declaration or statement. */
  final boolean continuesAfterAttributes() {
    return switch (token()) {
      case DOT, SEMI, EOF, ASSIGN, COMMA, RPAREN, RBRACK, COND, PLUS, MINUS, MULT, DIV, MOD,
          EQ, NOTEQ, LT, GT, LTE, GTE, ANDAND, OROR, AND, OR, XOR, QUESTIONQUESTION, INCR,
          DECR, ARROW, LAMBDA ->
          false;
      default -> true;
    };
  }

  private SyntaxNode unattributedStatement() {
    switch (token()) {
      case LBRACE:
        return block();
      case SEMI:
        next();
        return SyntaxNode.of(SyntaxKind.EMPTY_STATEMENT);
      case IF:
        return ifStatement();
      case WHILE:
        return whileStatement();
      case DO:
        return doStatement();
      case FOR:
        return forStatement();
      case FOREACH:
        return forEachStatement();
      case SWITCH:
        return switchStatement();
      case TRY:
        return tryStatement();
      case LOCK:
        return lockStatement();
      case RETURN:
        return jumpWithExpression(SyntaxKind.RETURN_STATEMENT);
      case THROW:
        return jumpWithExpression(SyntaxKind.THROW_STATEMENT);
      case BREAK:
        return jump(SyntaxKind.BREAK_STATEMENT);
      case CONTINUE:
        return jump(SyntaxKind.CONTINUE_STATEMENT);
      case GOTO:
        return gotoStatement();
      case USING:
        return usingStatement();
      case CONST:
        {
          next();
          SyntaxNode declaration = variableDeclaration();
          expect(Token.SEMI);
          return SyntaxNode.of(SyntaxKind.LOCAL_DECLARATION_STATEMENT, declaration);
        }
      case FIXED:
        return fixedStatement();
      case CHECKED:
        if (peekToken(1) == Token.LBRACE) {
          next();
          return SyntaxNode.of(SyntaxKind.CHECKED_STATEMENT, block());
        }
        break;
      case UNCHECKED:
        if (peekToken(1) == Token.LBRACE) {
          next();
          return SyntaxNode.of(SyntaxKind.UNCHECKED_STATEMENT, block());
        }
        break;
      case UNSAFE:
        if (peekToken(1) == Token.LBRACE) {
          next();
          return SyntaxNode.of(SyntaxKind.UNSAFE_STATEMENT, block());
        }
        break;
      case IDENT:
        {
          SyntaxNode statement = contextualStatement();
          if (statement != null) {
            return statement;
          }
          break;
        }
      default:
        break;
    }
    return declarationOrExpressionStatement();
  }

  /** Parses the statements that start with a contextual keyword or a label. */
  private @Nullable SyntaxNode contextualStatement() {
    if (atWord("yield")) {
      if (peekToken(1) == Token.RETURN) {
        next();
        return jumpWithExpression(SyntaxKind.YIELD_RETURN_STATEMENT);
      }
      if (peekToken(1) == Token.BREAK) {
        next();
        return jump(SyntaxKind.YIELD_BREAK_STATEMENT);
      }
    }
    if (atWord("await")) {
      if (peekToken(1) == Token.FOREACH) {
        next();
        return forEachStatement();
      }
      if (peekToken(1) == Token.USING) {
        next();
        return usingStatement();
      }
    }
    if (peekToken(1) == Token.COLON) {
      String label = current().value();
      next();
      next();
      return SyntaxNode.named(SyntaxKind.LABELED_STATEMENT, label, statement());
    }
    return null;
  }

  /** Parses a local function, a local declaration, or an expression statement. */
  final SyntaxNode declarationOrExpressionStatement() {
    if (atLocalFunction()) {
      return localFunction();
    }
    if (atLocalDeclaration()) {
      SyntaxNode declaration = variableDeclaration();
      expectStatementEnd();
      return SyntaxNode.of(SyntaxKind.LOCAL_DECLARATION_STATEMENT, declaration);
    }
    return expressionStatement();
  }

  final SyntaxNode expressionStatement() {
    SyntaxNode expression = expression();
    expectStatementEnd();
    return SyntaxNode.of(SyntaxKind.EXPRESSION_STATEMENT, expression);
  }

  /**
   * Consumes the {@code ;} that ends a statement. When the statement ended with the name {@code
   * with} before a brace, that is a {@code with { ... }} with no receiver, and its braces are
   * skipped.
   */
  private void expectStatementEnd() {
    if (maybe(Token.SEMI)) {
      return;
    }
    reportMissing("';'");
    if (at(Token.LBRACE) && previous().is("with")) {
      recordSkipped();
      int end = skipBalanced(0);
      for (int i = end == -1 ? 1 : end; i > 0; i--) {
        next();
      }
    }
  }

  private boolean atLocalFunctionModifier() {
    return switch (token()) {
      case STATIC, EXTERN -> true;
      case UNSAFE -> peekToken(1) != Token.LBRACE;
      case IDENT -> atWord("async") && peekToken(1) != Token.LPAREN && peekToken(1) != Token.LAMBDA;
      default -> false;
    };
  }

  /**
   * Returns true at {@code Type Name(parameters)} followed by a body, {@code =>}, {@code ;} or a
   * constraint clause.
   */
  final boolean atLocalFunction() {
    return lookahead(
        () -> {
          while (atLocalFunctionModifier()) {
            next();
          }
          if (!atTypeStart()) {
            return false;
          }
          type();
          if (!at(Token.IDENT) || !atFunctionNameFollower(1)) {
            return false;
          }
          next();
          if (at(Token.LT)) {
            typeParameterList();
          }
          parameterList();
          return at(Token.LBRACE) || at(Token.LAMBDA) || at(Token.SEMI) || atWord("where");
        });
  }

  private boolean atFunctionNameFollower(int n) {
    return peekToken(n) == Token.LPAREN || peekToken(n) == Token.LT;
  }

  private SyntaxNode localFunction() {
    while (atLocalFunctionModifier()) {
      next();
    }
    SyntaxNode returnType = type();
    String name = identifier();
    SyntaxNode typeParameters = at(Token.LT) ? typeParameterList() : null;
    SyntaxNode parameters = parameterList();
    ImmutableList<SyntaxNode> constraints = constraintClauses();
    return SyntaxNode.builder(SyntaxKind.LOCAL_FUNCTION_STATEMENT)
        .tokenValue(name)
        .add(returnType)
        .add(typeParameters)
        .add(parameters)
        .addAll(constraints)
        .add(functionBody())
        .build();
  }

  /** Parses a block body, an expression body followed by {@code ;}, or a lone {@code ;}. */
  final @Nullable SyntaxNode functionBody() {
    if (at(Token.LBRACE)) {
      return block();
    }
    if (at(Token.LAMBDA)) {
      SyntaxNode arrow = arrowExpressionClause();
      expect(Token.SEMI);
      return arrow;
    }
    expect(Token.SEMI);
    return null;
  }

  final SyntaxNode arrowExpressionClause() {
    expect(Token.LAMBDA);
    return SyntaxNode.of(SyntaxKind.ARROW_EXPRESSION_CLAUSE, expression());
  }

  /**
   * Returns true at a local variable declaration: a type followed by a declarator, or a name
   * followed by a type declaration keyword (a declaration whose name is missing).
   */
  final boolean atLocalDeclaration() {
    if (atWord("await") || (atWord("with") && peekToken(1) == Token.LBRACE)) {
      return false;
    }
    return lookahead(
        () -> {
          skipLocalTypePrefix();
          if (!atTypeStart()) {
            return false;
          }
          SyntaxNode type = type();
          if (atTypeDeclarationKeyword()) {
            return type.kind() == SyntaxKind.IDENTIFIER_NAME;
          }
          if (!at(Token.IDENT)) {
            return false;
          }
          SavedToken next = peek(1);
          return switch (next.token()) {
            case ASSIGN, SEMI, COMMA, LBRACK, EOF, RBRACE -> true;
            case LBRACE, LAMBDA, LPAREN, LT, DOT -> false;
            default -> next.precededByNewline();
          };
        });
  }

  /** Returns true at {@code class}, {@code struct}, {@code interface}, {@code enum}. */
  final boolean atTypeDeclarationKeyword() {
    return switch (token()) {
      case CLASS, STRUCT, INTERFACE, ENUM -> true;
      default -> false;
    };
  }

  private void skipLocalTypePrefix() {
    if (atWord("scoped") && atScopedModifier()) {
      next();
    }
  }

  private boolean atScopedModifier() {
    Token next = peekToken(1);
    if (next == Token.REF) {
      return true;
    }
    if (next != Token.IDENT && !next.isPredefinedType()) {
      return false;
    }
    return switch (peekToken(2)) {
      case SEMI, ASSIGN, COMMA -> false;
      default -> true;
    };
  }

  /** Parses a type followed by comma-separated variable declarators. */
  final SyntaxNode variableDeclaration() {
    SyntaxNode type;
    if (atWord("scoped") && atScopedModifier()) {
      next();
      type = SyntaxNode.of(SyntaxKind.SCOPED_TYPE, type());
    } else {
      type = type();
    }
    SyntaxNode.Builder declaration =
        SyntaxNode.builder(SyntaxKind.VARIABLE_DECLARATION).add(type);
    if (!at(Token.IDENT)) {
      report(ErrorKind.EXPECTED_IDENTIFIER, describe(current()));
      return declaration.build();
    }
    do {
      declaration.add(variableDeclarator());
    } while (maybe(Token.COMMA));
    return declaration.build();
  }

  final SyntaxNode variableDeclarator() {
    String name = identifier();
    SyntaxNode.Builder declarator =
        SyntaxNode.builder(SyntaxKind.VARIABLE_DECLARATOR).tokenValue(name);
    if (at(Token.LBRACK)) {
      declarator.add(bracketedArgumentList());
    }
    if (maybe(Token.ASSIGN)) {
      declarator.add(equalsValue());
    }
    return declarator.build();
  }

  /** Parses the value after {@code =} in a variable or field initializer. */
  final SyntaxNode equalsValue() {
    SyntaxNode value =
        at(Token.LBRACE)
            ? initializer(SyntaxKind.ARRAY_INITIALIZER_EXPRESSION)
            : expressionOrMissing();
    return SyntaxNode.of(SyntaxKind.EQUALS_VALUE_CLAUSE, value);
  }

  private SyntaxNode ifStatement() {
    expect(Token.IF);
    SyntaxNode condition = parenthesizedCondition();
    SyntaxNode statement = statement();
    SyntaxNode elseClause = null;
    if (maybe(Token.ELSE)) {
      elseClause = SyntaxNode.of(SyntaxKind.ELSE_CLAUSE, statement());
    }
    return SyntaxNode.of(SyntaxKind.IF_STATEMENT, condition, statement, elseClause);
  }

  private @Nullable SyntaxNode parenthesizedCondition() {
    expect(Token.LPAREN);
    SyntaxNode condition = expressionOrMissing();
    expect(Token.RPAREN);
    return condition;
  }

  private SyntaxNode whileStatement() {
    expect(Token.WHILE);
    SyntaxNode condition = parenthesizedCondition();
    return SyntaxNode.of(SyntaxKind.WHILE_STATEMENT, condition, statement());
  }

  private SyntaxNode doStatement() {
    expect(Token.DO);
    SyntaxNode statement = statement();
    expect(Token.WHILE);
    SyntaxNode condition = parenthesizedCondition();
    expect(Token.SEMI);
    return SyntaxNode.of(SyntaxKind.DO_STATEMENT, statement, condition);
  }

  private SyntaxNode forStatement() {
    expect(Token.FOR);
    expect(Token.LPAREN);
    SyntaxNode.Builder statement = SyntaxNode.builder(SyntaxKind.FOR_STATEMENT);
    if (atForDeclaration()) {
      statement.add(variableDeclaration());
    } else if (!at(Token.SEMI)) {
      do {
        statement.add(expression());
      } while (maybe(Token.COMMA));
    }
    expect(Token.SEMI);
    if (!at(Token.SEMI)) {
      statement.add(expression());
    }
    expect(Token.SEMI);
    if (!at(Token.RPAREN)) {
      do {
        statement.add(expression());
      } while (maybe(Token.COMMA));
    }
    expect(Token.RPAREN);
    return statement.add(statement()).build();
  }

  private boolean atForDeclaration() {
    return lookahead(
        () -> {
          skipLocalTypePrefix();
          if (!atTypeStart()) {
            return false;
          }
          type();
          return at(Token.IDENT);
        });
  }

  private SyntaxNode forEachStatement() {
    expect(Token.FOREACH);
    expect(Token.LPAREN);
    boolean simple =
        lookahead(
            () -> {
              skipLocalTypePrefix();
              type();
              return at(Token.IDENT) && peekToken(1) == Token.IN;
            });
    if (simple) {
      skipLocalTypePrefix();
      SyntaxNode type = type();
      String name = identifier();
      expect(Token.IN);
      SyntaxNode collection = expression();
      expect(Token.RPAREN);
      return SyntaxNode.named(SyntaxKind.FOR_EACH_STATEMENT, name, type, collection, statement());
    }
    SyntaxNode variable = expression();
    expect(Token.IN);
    SyntaxNode collection = expression();
    expect(Token.RPAREN);
    return SyntaxNode.of(
        SyntaxKind.FOR_EACH_VARIABLE_STATEMENT, variable, collection, statement());
  }

  private SyntaxNode switchStatement() {
    expect(Token.SWITCH);
    SyntaxNode governing;
    if (at(Token.LPAREN)) {
      // the parentheses belong to the statement, unless they hold a tuple
      governing = expression();
      if (governing.kind() == SyntaxKind.PARENTHESIZED_EXPRESSION) {
        governing = governing.child(0);
      }
    } else {
      reportMissing("'('");
      governing = expression();
    }
    expect(Token.LBRACE);
    SyntaxNode.Builder statement = SyntaxNode.builder(SyntaxKind.SWITCH_STATEMENT).add(governing);
    while (atSwitchLabel()) {
      statement.add(switchSection());
    }
    expect(Token.RBRACE);
    return statement.build();
  }

  private boolean atSwitchLabel() {
    return at(Token.CASE) || (at(Token.DEFAULT) && peekToken(1) == Token.COLON);
  }

  private SyntaxNode switchSection() {
    SyntaxNode.Builder section = SyntaxNode.builder(SyntaxKind.SWITCH_SECTION);
    while (atSwitchLabel()) {
      section.add(switchLabel());
    }
    while (!atSwitchLabel() && !at(Token.RBRACE) && !at(Token.EOF) && !atMemberOnlyToken()) {
      section.add(statementOrSkip());
    }
    return section.build();
  }

  private SyntaxNode switchLabel() {
    if (maybe(Token.DEFAULT)) {
      expect(Token.COLON);
      return SyntaxNode.of(SyntaxKind.DEFAULT_SWITCH_LABEL);
    }
    expect(Token.CASE);
    SyntaxNode pattern = pattern();
    SyntaxNode whenClause = atWord("when") ? whenClause() : null;
    expect(Token.COLON);
    if (pattern.kind() == SyntaxKind.CONSTANT_PATTERN && whenClause == null) {
      return SyntaxNode.of(SyntaxKind.CASE_SWITCH_LABEL, pattern.child(0));
    }
    return SyntaxNode.of(SyntaxKind.CASE_PATTERN_SWITCH_LABEL, pattern, whenClause);
  }

  private SyntaxNode tryStatement() {
    expect(Token.TRY);
    SyntaxNode.Builder statement = SyntaxNode.builder(SyntaxKind.TRY_STATEMENT).add(block());
    boolean handled = false;
    while (at(Token.CATCH)) {
      statement.add(catchClause());
      handled = true;
    }
    if (maybe(Token.FINALLY)) {
      statement.add(SyntaxNode.of(SyntaxKind.FINALLY_CLAUSE, block()));
    } else if (!handled) {
      reportMissing("'catch' or 'finally'");
    }
    return statement.build();
  }

  private SyntaxNode catchClause() {
    expect(Token.CATCH);
    SyntaxNode declaration = null;
    if (maybe(Token.LPAREN)) {
      SyntaxNode type = type();
      String name = null;
      if (at(Token.IDENT)) {
        name = current().value();
        next();
      }
      expect(Token.RPAREN);
      declaration = SyntaxNode.named(SyntaxKind.CATCH_DECLARATION, name, type);
    }
    SyntaxNode filter = null;
    if (maybeWord("when")) {
      filter = SyntaxNode.of(SyntaxKind.CATCH_FILTER_CLAUSE, parenthesizedCondition());
    }
    return SyntaxNode.of(SyntaxKind.CATCH_CLAUSE, declaration, filter, block());
  }

  private SyntaxNode lockStatement() {
    expect(Token.LOCK);
    SyntaxNode lock = parenthesizedCondition();
    return SyntaxNode.of(SyntaxKind.LOCK_STATEMENT, lock, statement());
  }

  private SyntaxNode fixedStatement() {
    expect(Token.FIXED);
    expect(Token.LPAREN);
    SyntaxNode declaration = variableDeclaration();
    expect(Token.RPAREN);
    return SyntaxNode.of(SyntaxKind.FIXED_STATEMENT, declaration, statement());
  }

  /**
   * Parses {@code using (...) statement} or a using declaration, {@code using var x = ...;}. Any
   * other use of {@code using} in a statement yields an empty local declaration.
   */
  private SyntaxNode usingStatement() {
    expect(Token.USING);
    if (maybe(Token.LPAREN)) {
      SyntaxNode resource = atForDeclaration() ? variableDeclaration() : expression();
      expect(Token.RPAREN);
      return SyntaxNode.of(SyntaxKind.USING_STATEMENT, resource, statement());
    }
    if (atLocalDeclaration()) {
      SyntaxNode declaration = variableDeclaration();
      expect(Token.SEMI);
      return SyntaxNode.of(SyntaxKind.LOCAL_DECLARATION_STATEMENT, declaration);
    }
    report(ErrorKind.EXPECTED_TOKEN, "'('");
    return SyntaxNode.of(SyntaxKind.LOCAL_DECLARATION_STATEMENT);
  }

  private SyntaxNode jump(SyntaxKind kind) {
    next();
    expect(Token.SEMI);
    return SyntaxNode.of(kind);
  }

  private SyntaxNode jumpWithExpression(SyntaxKind kind) {
    next();
    SyntaxNode expression = at(Token.SEMI) ? null : expressionOrMissing();
    expect(Token.SEMI);
    return SyntaxNode.of(kind, expression);
  }

  private SyntaxNode gotoStatement() {
    expect(Token.GOTO);
    SyntaxNode statement;
    if (maybe(Token.CASE)) {
      statement = SyntaxNode.of(SyntaxKind.GOTO_CASE_STATEMENT, expression());
    } else if (maybe(Token.DEFAULT)) {
      statement = SyntaxNode.of(SyntaxKind.GOTO_DEFAULT_STATEMENT);
    } else {
      String label = identifier();
      statement =
          SyntaxNode.of(
              SyntaxKind.GOTO_STATEMENT, SyntaxNode.named(SyntaxKind.IDENTIFIER_NAME, label));
    }
    expect(Token.SEMI);
    return statement;
  }

  // Type parameters and constraints, shared by local functions and declarations.

  /** Parses {@code <in T, [A] U>}. */
  final SyntaxNode typeParameterList() {
    expect(Token.LT);
    SyntaxNode.Builder list = SyntaxNode.builder(SyntaxKind.TYPE_PARAMETER_LIST);
    do {
      ImmutableList<SyntaxNode> attributes = attributeLists();
      if (at(Token.IN) || at(Token.OUT)) {
        next();
      }
      String name = identifier();
      list.add(
          SyntaxNode.builder(SyntaxKind.TYPE_PARAMETER)
              .tokenValue(name)
              .addAll(attributes)
              .build());
    } while (maybe(Token.COMMA));
    expect(Token.GT);
    return list.build();
  }

  /** Parses any number of {@code where T : ...} clauses. */
  final ImmutableList<SyntaxNode> constraintClauses() {
    ImmutableList.Builder<SyntaxNode> clauses = ImmutableList.builder();
    while (atWord("where")) {
      clauses.add(constraintClause());
    }
    return clauses.build();
  }

  /**
   * Parses one constraint clause. A missing colon is reported, and the constraints that follow are
   * still parsed; the clause holds only the parameter name if the declaration continues instead.
   */
  private SyntaxNode constraintClause() {
    next();
    SyntaxNode.Builder clause = SyntaxNode.builder(SyntaxKind.TYPE_PARAMETER_CONSTRAINT_CLAUSE);
    if (!at(Token.IDENT)) {
      report(ErrorKind.EXPECTED_IDENTIFIER, describe(current()));
      return clause.build();
    }
    clause.add(SyntaxNode.named(SyntaxKind.IDENTIFIER_NAME, current().value()));
    next();
    if (!maybe(Token.COLON)) {
      reportMissing("':'");
      if (at(Token.LBRACE)
          || at(Token.SEMI)
          || at(Token.LAMBDA)
          || at(Token.EOF)
          || atWord("where")) {
        return clause.build();
      }
    }
    while (true) {
      clause.add(constraint());
      if (!maybe(Token.COMMA)) {
        break;
      }
      if (at(Token.SEMI) || at(Token.LBRACE) || at(Token.EOF) || atWord("where")) {
        report(ErrorKind.EXPECTED_TYPE, describe(current()));
        break;
      }
    }
    return clause.build();
  }

  private SyntaxNode constraint() {
    switch (token()) {
      case CLASS -> {
        next();
        maybe(Token.COND);
        return SyntaxNode.of(SyntaxKind.CLASS_CONSTRAINT);
      }
      case STRUCT -> {
        next();
        return SyntaxNode.of(SyntaxKind.STRUCT_CONSTRAINT);
      }
      case NEW -> {
        next();
        expect(Token.LPAREN);
        expect(Token.RPAREN);
        return SyntaxNode.of(SyntaxKind.CONSTRUCTOR_CONSTRAINT);
      }
      case DEFAULT -> {
        next();
        return SyntaxNode.of(SyntaxKind.DEFAULT_CONSTRAINT);
      }
      default -> {}
    }
    if (atWord("allows") && peekToken(1) == Token.REF) {
      next();
      SyntaxNode.Builder allows = SyntaxNode.builder(SyntaxKind.ALLOWS_CONSTRAINT_CLAUSE);
      do {
        expect(Token.REF);
        expect(Token.STRUCT);
        allows.add(SyntaxNode.of(SyntaxKind.REF_STRUCT_CONSTRAINT));
      } while (at(Token.COMMA) && peekToken(1) == Token.REF && maybe(Token.COMMA));
      return allows.build();
    }
    return SyntaxNode.of(SyntaxKind.TYPE_CONSTRAINT, type());
  }
}
