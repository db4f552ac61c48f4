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
import com.google.common.collect.Iterables;
import com.google.csyntax.diag.Diagnostic;
import com.google.csyntax.diag.ParseError;
import com.google.csyntax.diag.ParseError.ErrorKind;
import com.google.csyntax.diag.SourceFile;
import com.google.csyntax.options.ParserOptions;
import com.google.csyntax.tree.SyntaxKind;
import com.google.csyntax.tree.SyntaxNode;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Parses compilation units, namespaces, type declarations and their members.
 *
 * <p>Every declaration-level rule ends in an {@code IncompleteMember} alternative, and the member
 * loops skip tokens that cannot start a member, so a full-file parse always completes.
 */
final class DeclarationParser extends StatementParser {

  /** Where a member appears. */
  private enum Scope {
    COMPILATION_UNIT,
    NAMESPACE,
    TYPE
  }

  /** The modifiers in front of a member. */
  private record Modifiers(boolean any, boolean recordKeyword, boolean fixed) {}

  /** Whether the last type declaration ended with {@code }} and no {@code ;}. */
  private boolean closedByBrace;

  /** Whether a bare statement at the top level becomes a global statement. */
  private boolean topLevelStatements = true;

  DeclarationParser(
      SourceFile source,
      ImmutableList<SavedToken> tokens,
      ParserOptions options,
      boolean recovering) {
    super(source, tokens, options, recovering);
  }

  SyntaxNode compilationUnit() {
    List<SyntaxNode> members = new ArrayList<>();
    namespaceMembers(members, Scope.COMPILATION_UNIT, /* braced= */ false);
    return SyntaxNode.of(SyntaxKind.COMPILATION_UNIT, null, members);
  }

  /**
   * Parses members up to the end of input, or up to {@code }} if the members are {@code braced}.
   * Inside a namespace, a non-type member that follows a type declaration closed by a brace is
   * added to that declaration.
   */
  private void namespaceMembers(List<SyntaxNode> members, Scope scope, boolean braced) {
    boolean pullable = false;
    while (!at(Token.EOF)) {
      if (at(Token.RBRACE)) {
        if (braced) {
          return;
        }
        skipMember();
        continue;
      }
      Mark before = mark();
      SyntaxNode member = memberOrSkip(scope);
      if (!progressed(before)) {
        skipMember();
      }
      if (member == null) {
        continue;
      }
      if (isTypeDeclaration(member.kind())) {
        members.add(member);
        pullable =
            scope == Scope.NAMESPACE
                && closedByBrace
                && member.kind() != SyntaxKind.ENUM_DECLARATION
                && member.kind() != SyntaxKind.DELEGATE_DECLARATION;
      } else if (pullable && isTypeMember(member.kind())) {
        int last = members.size() - 1;
        members.set(last, members.get(last).withChild(member));
      } else {
        members.add(member);
        pullable = false;
        if (scope == Scope.COMPILATION_UNIT && at(Token.SEMI) && endsWithAccessorList(member)) {
          // the semicolon belongs to no statement
          skipMember();
        }
      }
    }
  }

  private static boolean endsWithAccessorList(SyntaxNode member) {
    SyntaxNode last = Iterables.getLast(member.children(), null);
    return isTypeMember(member.kind())
        && last != null
        && last.kind() == SyntaxKind.ACCESSOR_LIST;
  }

  private static boolean isTypeDeclaration(SyntaxKind kind) {
    return switch (kind) {
      case CLASS_DECLARATION, STRUCT_DECLARATION, INTERFACE_DECLARATION, RECORD_DECLARATION,
          RECORD_STRUCT_DECLARATION, ENUM_DECLARATION, DELEGATE_DECLARATION ->
          true;
      default -> false;
    };
  }

  private static boolean isTypeMember(SyntaxKind kind) {
    return switch (kind) {
      case FIELD_DECLARATION, EVENT_FIELD_DECLARATION, METHOD_DECLARATION,
          CONSTRUCTOR_DECLARATION, DESTRUCTOR_DECLARATION, PROPERTY_DECLARATION,
          INDEXER_DECLARATION, EVENT_DECLARATION, OPERATOR_DECLARATION,
          CONVERSION_OPERATOR_DECLARATION ->
          true;
      default -> false;
    };
  }

  /**
   * Parses a member. While recovering, a member that fails to parse is reported and skipped, and
   * null is returned.
   */
  private @Nullable SyntaxNode memberOrSkip(Scope scope) {
    Mark start = mark();
    try {
      return nested(() -> scope == Scope.TYPE ? member(scope) : namespaceMember(scope));
    } catch (ParseError e) {
      if (!recovering()) {
        throw e;
      }
      reset(start);
      record(Diagnostic.of(source, e));
      skipMember();
      return null;
    }
  }

  /**
   * Skips at least one token, and then every token up to one that can start a member. A skipped
   * {@code ;} ends the run.
   */
  private void skipMember() {
    if (at(Token.EOF)) {
      return;
    }
    recordSkipped();
    while (true) {
      Token skipped = token();
      next();
      if (skipped == Token.SEMI || at(Token.EOF) || at(Token.RBRACE) || atMemberStartToken()) {
        return;
      }
    }
  }

  private boolean atMemberStartToken() {
    Token token = token();
    if (token.isPredefinedType() || atModifierKeyword(0)) {
      return true;
    }
    return switch (token) {
      case IDENT, LBRACK, LPAREN, TILDE, CLASS, STRUCT, INTERFACE, ENUM, DELEGATE, EVENT,
          IMPLICIT, EXPLICIT, NAMESPACE, USING, REF ->
          true;
      default -> false;
    };
  }

  /** Returns true if the token at offset {@code n} is a modifier keyword. */
  private boolean atModifierKeyword(int n) {
    return switch (peekToken(n)) {
      case PUBLIC, PRIVATE, PROTECTED, INTERNAL, STATIC, ABSTRACT, SEALED, VIRTUAL, OVERRIDE,
          READONLY, EXTERN, VOLATILE, UNSAFE, CONST, FIXED, NEW ->
          true;
      default -> false;
    };
  }

  // Namespaces and directives.

  private @Nullable SyntaxNode namespaceMember(Scope scope) {
    switch (token()) {
      case EXTERN:
        if (peekIs(1, "alias")) {
          return externAlias();
        }
        break;
      case USING:
        if (scope != Scope.COMPILATION_UNIT || !topLevelStatements || atUsingDirective()) {
          return usingDirective();
        }
        break;
      case NAMESPACE:
        return namespaceDeclaration(scope);
      case LBRACK:
        if (peekToken(1) == Token.IDENT
            && (peekIs(1, "assembly") || peekIs(1, "module"))
            && peekToken(2) == Token.COLON) {
          return attributeList();
        }
        break;
      case IDENT:
        if (atWord("global") && peekToken(1) == Token.USING) {
          return usingDirective();
        }
        break;
      default:
        break;
    }
    return member(scope);
  }

  private SyntaxNode externAlias() {
    expect(Token.EXTERN);
    next();
    String name = identifier();
    expect(Token.SEMI);
    return SyntaxNode.named(SyntaxKind.EXTERN_ALIAS_DIRECTIVE, name);
  }

  /** Returns true at a using directive, as opposed to a using statement or declaration. */
  private boolean atUsingDirective() {
    return lookahead(
        () -> {
          expect(Token.USING);
          if (at(Token.STATIC)
              || at(Token.UNSAFE)
              || (at(Token.IDENT) && peekToken(1) == Token.ASSIGN)) {
            return true;
          }
          name();
          return at(Token.SEMI);
        });
  }

  private SyntaxNode usingDirective() {
    maybeWord("global");
    expect(Token.USING);
    // static and unsafe may come in either order
    if (maybe(Token.STATIC)) {
      maybe(Token.UNSAFE);
    } else if (maybe(Token.UNSAFE)) {
      maybe(Token.STATIC);
    }
    SyntaxNode alias = null;
    if (at(Token.IDENT) && peekToken(1) == Token.ASSIGN) {
      alias =
          SyntaxNode.of(
              SyntaxKind.NAME_EQUALS,
              SyntaxNode.named(SyntaxKind.IDENTIFIER_NAME, current().value()));
      next();
      next();
    }
    SyntaxNode target = alias != null ? type() : name();
    expect(Token.SEMI);
    return SyntaxNode.of(SyntaxKind.USING_DIRECTIVE, alias, target);
  }

  private SyntaxNode namespaceDeclaration(Scope scope) {
    if (scope == Scope.COMPILATION_UNIT) {
      topLevelStatements = false;
    }
    int start = current().position();
    expect(Token.NAMESPACE);
    SyntaxNode name = name();
    List<SyntaxNode> members = new ArrayList<>();
    members.add(name);
    if (maybe(Token.SEMI)) {
      if (!version.supportsFileScopedNamespaces()) {
        report(start, ErrorKind.FEATURE_UNAVAILABLE, "a file-scoped namespace", "10");
      }
      namespaceMembers(members, Scope.NAMESPACE, /* braced= */ false);
      return SyntaxNode.of(SyntaxKind.FILE_SCOPED_NAMESPACE_DECLARATION, null, members);
    }
    expect(Token.LBRACE);
    namespaceMembers(members, Scope.NAMESPACE, /* braced= */ true);
    expect(Token.RBRACE);
    maybe(Token.SEMI);
    return SyntaxNode.of(SyntaxKind.NAMESPACE_DECLARATION, null, members);
  }

  // Members.

  private @Nullable SyntaxNode member(Scope scope) {
    if (scope == Scope.COMPILATION_UNIT && topLevelStatements && atGlobalStatement()) {
      SyntaxNode statement = statementOrSkip();
      return statement != null ? SyntaxNode.of(SyntaxKind.GLOBAL_STATEMENT, statement) : null;
    }
    int start = current().position();
    ImmutableList<SyntaxNode> attributes = attributeLists();
    Modifiers modifiers = modifiers();
    switch (token()) {
      case CLASS:
      case STRUCT:
      case INTERFACE:
        return typeDeclaration(start, attributes);
      case ENUM:
        return enumDeclaration(attributes);
      case DELEGATE:
        if (peekToken(1) != Token.MULT) {
          return delegateDeclaration(attributes);
        }
        break;
      case NAMESPACE:
        return namespaceDeclaration(scope);
      case EVENT:
        return eventDeclaration(attributes);
      case TILDE:
        return destructorDeclaration(attributes);
      case IMPLICIT:
      case EXPLICIT:
        return conversionOperatorDeclaration(attributes);
      default:
        break;
    }
    if (modifiers.recordKeyword() && atRecordDeclaration()) {
      return recordDeclaration(start, attributes);
    }
    if (at(Token.IDENT) && peekToken(1) == Token.LPAREN) {
      return constructorDeclaration(attributes);
    }
    if (!atTypeStart()) {
      return incompleteMember(attributes, null, modifiers);
    }
    return typedMember(attributes, modifiers, type());
  }

  /** Returns an {@code IncompleteMember} holding what was salvaged, or null if nothing was. */
  private @Nullable SyntaxNode incompleteMember(
      ImmutableList<SyntaxNode> attributes, @Nullable SyntaxNode type, Modifiers modifiers) {
    if (attributes.isEmpty() && type == null && !modifiers.any()) {
      return null;
    }
    report(ErrorKind.INCOMPLETE_MEMBER);
    return SyntaxNode.builder(SyntaxKind.INCOMPLETE_MEMBER).addAll(attributes).add(type).build();
  }

  /**
   * Parses modifiers in any order. {@code partial}, {@code ref} and the other contextual modifiers
   * count only where the rest of the member can follow them.
   */
  private Modifiers modifiers() {
    boolean any = false;
    boolean recordKeyword = true;
    boolean fixed = false;
    while (true) {
      switch (token()) {
        case NEW:
        case CONST:
          recordKeyword = false;
          break;
        case FIXED:
          recordKeyword = false;
          fixed = true;
          break;
        case PUBLIC:
        case PRIVATE:
        case PROTECTED:
        case INTERNAL:
        case STATIC:
        case ABSTRACT:
        case SEALED:
        case VIRTUAL:
        case OVERRIDE:
        case READONLY:
        case EXTERN:
        case VOLATILE:
        case UNSAFE:
          break;
        case REF:
          if (!atRefModifier()) {
            return new Modifiers(any, recordKeyword, fixed);
          }
          break;
        case IDENT:
          if (!atContextualModifier()) {
            return new Modifiers(any, recordKeyword, fixed);
          }
          break;
        default:
          return new Modifiers(any, recordKeyword, fixed);
      }
      next();
      any = true;
    }
  }

  /** {@code ref} modifies a type declaration, and is otherwise part of a ref type. */
  private boolean atRefModifier() {
    return switch (peekToken(1)) {
      case STRUCT -> true;
      case READONLY -> peekToken(2) == Token.STRUCT || peekIs(2, "partial");
      case IDENT ->
          peekIs(1, "partial") || (peekIs(1, "record") && version.supportsRefRecords());
      default -> false;
    };
  }

  private boolean atContextualModifier() {
    if (atWord("partial")) {
      return atPartialModifier();
    }
    if (!atWord("async") && !atWord("required") && !atWord("file")) {
      return false;
    }
    Token next = peekToken(1);
    if (atModifierKeyword(1) || next.isPredefinedType()) {
      return true;
    }
    return switch (next) {
      case CLASS, STRUCT, INTERFACE, ENUM, DELEGATE, EVENT, REF -> true;
      case IDENT ->
          switch (peekToken(2)) {
            case SEMI, ASSIGN, COMMA, LPAREN, LBRACE, LAMBDA -> false;
            default -> true;
          };
      default -> false;
    };
  }

  /**
   * {@code partial} is a modifier before a type keyword, {@code record}, {@code void} or a member
   * shape such as {@code partial int P}.
   */
  private boolean atPartialModifier() {
    switch (peekToken(1)) {
      case CLASS, STRUCT, INTERFACE, ENUM, VOID -> {
        return true;
      }
      default -> {}
    }
    if (peekIs(1, "record")) {
      return true;
    }
    return lookahead(
        () -> {
          next();
          if (!atTypeStart()) {
            return false;
          }
          type();
          return at(Token.IDENT) || at(Token.THIS);
        });
  }

  /**
   * Returns true at a statement in a position where a member could also appear. Declarations and
   * calls without modifiers are statements; a name followed by a member keyword is a member.
   */
  private boolean atGlobalStatement() {
    return lookahead(
        () -> {
          if (at(Token.LBRACK)) {
            // brackets that do not close as attributes, or that are followed by an operator, are a
            // collection expression
            if (speculate(this::attributeLists) == null || !continuesAfterAttributes()) {
              return true;
            }
          }
          return atStatementRatherThanMember();
        });
  }

  private boolean atStatementRatherThanMember() {
    Token token = token();
    if (token.isLiteral() || token == Token.INTERPOLATED_STRING) {
      return true;
    }
    switch (token) {
      case IF, WHILE, DO, FOR, FOREACH, SWITCH, TRY, LOCK, RETURN, THROW, BREAK, CONTINUE, GOTO,
          LBRACE, SEMI, CONST, CHECKED, UNCHECKED, USING, THIS, BASE, TYPEOF, SIZEOF, DEFAULT,
          LPAREN, PLUS, MINUS, NOT, INCR, DECR, AND, MULT, STACKALLOC -> {
        return true;
      }
      case UNSAFE -> {
        return peekToken(1) == Token.LBRACE || atLocalFunction();
      }
      case FIXED -> {
        return peekToken(1) == Token.LPAREN;
      }
      case NEW -> {
        return !atModifierKeyword(1) && !atTypeKeyword(1);
      }
      case STATIC, EXTERN -> {
        return atLocalFunction();
      }
      case DELEGATE -> {
        return peekToken(1) == Token.LPAREN || peekToken(1) == Token.LBRACE;
      }
      case REF -> {
        return !atRefModifier() && (atLocalDeclaration() || atLocalFunction());
      }
      case IDENT -> {
        return atIdentifierStatement();
      }
      default -> {
        return token.isPredefinedType() && atIdentifierStatement();
      }
    }
  }

  private boolean atIdentifierStatement() {
    if (atRecordDeclaration()) {
      return false;
    }
    if ((atWord("yield") && (peekToken(1) == Token.RETURN || peekToken(1) == Token.BREAK))
        || (atWord("await") && (peekToken(1) == Token.FOREACH || peekToken(1) == Token.USING))
        || (at(Token.IDENT) && peekToken(1) == Token.COLON)) {
      return true;
    }
    if (atWord("await") || atLocalFunction() || atLocalDeclaration()) {
      return true;
    }
    if (at(Token.IDENT) && atContextualModifier()) {
      return false;
    }
    if (atMemberShape()) {
      return false;
    }
    return !atModifierKeyword(1) && !atTypeKeyword(1) && peekToken(1) != Token.EVENT;
  }

  private boolean atTypeKeyword(int n) {
    return switch (peekToken(n)) {
      case CLASS, STRUCT, INTERFACE, ENUM, DELEGATE -> true;
      default -> false;
    };
  }

  /**
   * Returns true at a type followed by a member name, {@code this}, {@code operator} or a
   * conversion keyword.
   */
  private boolean atMemberShape() {
    return lookahead(
        () -> {
          type();
          explicitInterfaceSpecifier();
          return switch (token()) {
            case IDENT, THIS, OPERATOR, IMPLICIT, EXPLICIT -> true;
            default -> false;
          };
        });
  }

  /** Returns true at the start of a type declaration, looking past attributes and modifiers. */
  private boolean atTypeDeclarationStart() {
    return lookahead(
        () -> {
          attributeLists();
          Modifiers modifiers = modifiers();
          return switch (token()) {
            case CLASS, STRUCT, INTERFACE, ENUM -> true;
            case DELEGATE -> peekToken(1) != Token.LPAREN && peekToken(1) != Token.LBRACE;
            default -> modifiers.recordKeyword() && atRecordDeclaration();
          };
        });
  }

  /**
   * Returns true where {@code record} is the record keyword: before a name (C# 9), or before
   * {@code struct} or {@code class} (C# 10). Before another type keyword, it starts a record
   * whose name is missing.
   */
  private boolean atRecordDeclaration() {
    if (!atWord("record") || !version.supportsRecords()) {
      return false;
    }
    return switch (peekToken(1)) {
      case IDENT, INTERFACE, ENUM -> true;
      case STRUCT, CLASS -> version.supportsRecordStructs();
      default -> false;
    };
  }

  /** Parses a member that starts with a type. */
  private @Nullable SyntaxNode typedMember(
      ImmutableList<SyntaxNode> attributes, Modifiers modifiers, SyntaxNode type) {
    if (at(Token.OPERATOR)) {
      return operatorDeclaration(attributes, type, null);
    }
    SyntaxNode explicitInterface = operatorInterfaceSpecifier(/* conversion= */ false);
    switch (token()) {
      case OPERATOR:
        return operatorDeclaration(attributes, type, explicitInterface);
      case IMPLICIT:
      case EXPLICIT:
        return misplacedConversionOperator(attributes, type, explicitInterface);
      case THIS:
        return indexerDeclaration(attributes, type, explicitInterface);
      case IDENT:
        break;
      default:
        if (modifiers.fixed()) {
          return fieldDeclaration(attributes, modifiers, type);
        }
        return incompleteMember(attributes, type, modifiers);
    }
    switch (peekToken(1)) {
      case LPAREN:
      case LT:
        return methodDeclaration(attributes, type, explicitInterface);
      case LBRACE:
      case LAMBDA:
        return propertyDeclaration(attributes, type, explicitInterface);
      case SEMI:
        if (!modifiers.fixed()
            && (peekToken(2) == Token.LBRACE || peekToken(2) == Token.LAMBDA)) {
          return propertyDeclaration(attributes, type, explicitInterface);
        }
        break;
      default:
        break;
    }
    return fieldDeclaration(attributes, modifiers, type);
  }

  private SyntaxNode fieldDeclaration(
      ImmutableList<SyntaxNode> attributes, Modifiers modifiers, SyntaxNode type) {
    SyntaxNode.Builder declaration =
        SyntaxNode.builder(SyntaxKind.VARIABLE_DECLARATION).add(type);
    do {
      declaration.add(modifiers.fixed() ? fixedBufferDeclarator() : variableDeclarator());
    } while (maybe(Token.COMMA));
    expect(Token.SEMI);
    return SyntaxNode.builder(SyntaxKind.FIELD_DECLARATION)
        .addAll(attributes)
        .add(declaration.build())
        .build();
  }

  /** Parses {@code name[size]}. A missing size is an omitted array size. */
  private SyntaxNode fixedBufferDeclarator() {
    String name = identifier();
    SyntaxNode size;
    if (at(Token.LBRACK)) {
      size = bracketedArgumentList();
    } else {
      reportMissing("'['");
      size =
          SyntaxNode.of(
              SyntaxKind.BRACKETED_ARGUMENT_LIST,
              SyntaxNode.of(
                  SyntaxKind.ARGUMENT, SyntaxNode.of(SyntaxKind.OMITTED_ARRAY_SIZE_EXPRESSION)));
    }
    SyntaxNode initializer = maybe(Token.ASSIGN) ? equalsValue() : null;
    return SyntaxNode.named(SyntaxKind.VARIABLE_DECLARATOR, name, size, initializer);
  }

  private SyntaxNode methodDeclaration(
      ImmutableList<SyntaxNode> attributes,
      SyntaxNode returnType,
      @Nullable SyntaxNode explicitInterface) {
    String name = identifier();
    SyntaxNode typeParameters = at(Token.LT) ? typeParameterList() : null;
    SyntaxNode parameters = parameterList();
    ImmutableList<SyntaxNode> constraints = constraintClauses();
    return SyntaxNode.builder(SyntaxKind.METHOD_DECLARATION)
        .tokenValue(name)
        .addAll(attributes)
        .add(returnType)
        .add(explicitInterface)
        .add(typeParameters)
        .add(parameters)
        .addAll(constraints)
        .add(functionBody())
        .build();
  }

  /**
   * Parses a property with an accessor list or an expression body. A {@code ;} between the name
   * and the body is reported and skipped.
   */
  private SyntaxNode propertyDeclaration(
      ImmutableList<SyntaxNode> attributes,
      SyntaxNode type,
      @Nullable SyntaxNode explicitInterface) {
    String name = identifier();
    if (at(Token.SEMI)) {
      report(ErrorKind.UNEXPECTED_TOKEN, "';'");
      next();
    }
    SyntaxNode.Builder property =
        SyntaxNode.builder(SyntaxKind.PROPERTY_DECLARATION)
            .tokenValue(name)
            .addAll(attributes)
            .add(type)
            .add(explicitInterface);
    if (at(Token.LAMBDA)) {
      property.add(arrowExpressionClause());
      expect(Token.SEMI);
      return property.build();
    }
    property.add(accessorList());
    if (maybe(Token.ASSIGN)) {
      property.add(equalsValue());
      expect(Token.SEMI);
    }
    return property.build();
  }

  private SyntaxNode indexerDeclaration(
      ImmutableList<SyntaxNode> attributes,
      SyntaxNode type,
      @Nullable SyntaxNode explicitInterface) {
    expect(Token.THIS);
    SyntaxNode.Builder indexer =
        SyntaxNode.builder(SyntaxKind.INDEXER_DECLARATION)
            .addAll(attributes)
            .add(type)
            .add(explicitInterface)
            .add(bracketedParameterList());
    if (at(Token.LAMBDA)) {
      indexer.add(arrowExpressionClause());
      expect(Token.SEMI);
    } else {
      indexer.add(accessorList());
    }
    return indexer.build();
  }

  /** Parses {@code { get; set; }}. Unknown accessor names are kept as unknown accessors. */
  private SyntaxNode accessorList() {
    expect(Token.LBRACE);
    SyntaxNode.Builder accessors = SyntaxNode.builder(SyntaxKind.ACCESSOR_LIST);
    while (!at(Token.RBRACE) && !at(Token.EOF)) {
      ImmutableList<SyntaxNode> attributes = attributeLists();
      while (atModifierKeyword(0)) {
        next();
      }
      if (at(Token.SEMI) && attributes.isEmpty()) {
        recordSkipped();
        next();
        continue;
      }
      if (!at(Token.IDENT)) {
        report(ErrorKind.EXPECTED_TOKEN, "accessor");
        break;
      }
      SyntaxKind kind =
          switch (current().text()) {
            case "get" -> SyntaxKind.GET_ACCESSOR_DECLARATION;
            case "set" -> SyntaxKind.SET_ACCESSOR_DECLARATION;
            case "init" -> SyntaxKind.INIT_ACCESSOR_DECLARATION;
            case "add" -> SyntaxKind.ADD_ACCESSOR_DECLARATION;
            case "remove" -> SyntaxKind.REMOVE_ACCESSOR_DECLARATION;
            default -> SyntaxKind.UNKNOWN_ACCESSOR_DECLARATION;
          };
      next();
      accessors.add(
          SyntaxNode.builder(kind).addAll(attributes).add(functionBody()).build());
    }
    expect(Token.RBRACE);
    return accessors.build();
  }

  private SyntaxNode eventDeclaration(ImmutableList<SyntaxNode> attributes) {
    expect(Token.EVENT);
    SyntaxNode type = type();
    SyntaxNode explicitInterface = explicitInterfaceSpecifier();
    if (at(Token.IDENT) && peekToken(1) == Token.LBRACE) {
      String name = current().value();
      next();
      return SyntaxNode.builder(SyntaxKind.EVENT_DECLARATION)
          .tokenValue(name)
          .addAll(attributes)
          .add(type)
          .add(explicitInterface)
          .add(accessorList())
          .build();
    }
    SyntaxNode.Builder declaration =
        SyntaxNode.builder(SyntaxKind.VARIABLE_DECLARATION).add(type);
    do {
      declaration.add(variableDeclarator());
    } while (maybe(Token.COMMA));
    expect(Token.SEMI);
    return SyntaxNode.builder(SyntaxKind.EVENT_FIELD_DECLARATION)
        .addAll(attributes)
        .add(declaration.build())
        .build();
  }

  private SyntaxNode constructorDeclaration(ImmutableList<SyntaxNode> attributes) {
    String name = identifier();
    SyntaxNode parameters = parameterList();
    SyntaxNode initializer = null;
    if (maybe(Token.COLON)) {
      SyntaxKind kind;
      if (at(Token.BASE)) {
        kind = SyntaxKind.BASE_CONSTRUCTOR_INITIALIZER;
      } else if (at(Token.THIS)) {
        kind = SyntaxKind.THIS_CONSTRUCTOR_INITIALIZER;
      } else {
        throw error(ErrorKind.EXPECTED_TOKEN, "'base' or 'this'");
      }
      next();
      initializer = SyntaxNode.of(kind, argumentList());
    }
    return SyntaxNode.builder(SyntaxKind.CONSTRUCTOR_DECLARATION)
        .tokenValue(name)
        .addAll(attributes)
        .add(parameters)
        .add(initializer)
        .add(functionBody())
        .build();
  }

  private SyntaxNode destructorDeclaration(ImmutableList<SyntaxNode> attributes) {
    expect(Token.TILDE);
    String name = identifier();
    SyntaxNode parameters = parameterList();
    return SyntaxNode.builder(SyntaxKind.DESTRUCTOR_DECLARATION)
        .tokenValue(name)
        .addAll(attributes)
        .add(parameters)
        .add(functionBody())
        .build();
  }

  private SyntaxNode operatorDeclaration(
      ImmutableList<SyntaxNode> attributes,
      SyntaxNode returnType,
      @Nullable SyntaxNode explicitInterface) {
    expect(Token.OPERATOR);
    maybe(Token.CHECKED);
    String operator = overloadableOperator();
    SyntaxNode parameters = parameterList();
    return SyntaxNode.builder(SyntaxKind.OPERATOR_DECLARATION)
        .tokenValue(operator)
        .addAll(attributes)
        .add(returnType)
        .add(explicitInterface)
        .add(parameters)
        .add(functionBody())
        .build();
  }

  /**
   * Parses {@code int I.implicit (int x) => x}, where a conversion keyword stands in place of
   * {@code operator} and the operator. The result is an operator declaration without an operator,
   * and its parameters and body are only parsed if they are present.
   */
  private SyntaxNode misplacedConversionOperator(
      ImmutableList<SyntaxNode> attributes,
      SyntaxNode returnType,
      @Nullable SyntaxNode explicitInterface) {
    report(ErrorKind.EXPECTED_TOKEN, "'operator'");
    next();
    SyntaxNode.Builder declaration =
        SyntaxNode.builder(SyntaxKind.OPERATOR_DECLARATION)
            .addAll(attributes)
            .add(returnType)
            .add(explicitInterface);
    if (!at(Token.LPAREN)) {
      reportMissing("'('");
      return declaration.build();
    }
    declaration.add(parameterList());
    if (at(Token.LBRACE) || at(Token.LAMBDA) || at(Token.SEMI)) {
      declaration.add(functionBody());
    } else {
      reportMissing("'{'");
    }
    return declaration.build();
  }

  /**
   * Parses the explicit interface specifier of an operator. The last name before {@code operator}
   * joins the specifier when its dot is missing, as in {@code int N.I operator +}; in a conversion
   * operator, it also joins when the converted type follows it directly.
   */
  private @Nullable SyntaxNode operatorInterfaceSpecifier(boolean conversion) {
    SyntaxNode explicitInterface = explicitInterfaceSpecifier();
    if (!at(Token.IDENT)) {
      return explicitInterface;
    }
    Token following = peekToken(1);
    boolean missingDot =
        following == Token.OPERATOR
            || (conversion
                && explicitInterface != null
                && (following == Token.IDENT || following.isPredefinedType()));
    if (!missingDot) {
      return explicitInterface;
    }
    SyntaxNode last = SyntaxNode.named(SyntaxKind.IDENTIFIER_NAME, current().value());
    next();
    reportMissing("'.'");
    return SyntaxNode.of(
        SyntaxKind.EXPLICIT_INTERFACE_SPECIFIER,
        explicitInterface == null
            ? last
            : SyntaxNode.of(SyntaxKind.QUALIFIED_NAME, explicitInterface.child(0), last));
  }

  /** Consumes an overloadable operator and returns its text; {@code >>} is two adjacent tokens. */
  private @Nullable String overloadableOperator() {
    switch (token()) {
      case GT:
        next();
        if (at(Token.GT) && current().adjacent()) {
          next();
          if (at(Token.GT) && current().adjacent()) {
            next();
            return ">>>";
          }
          return ">>";
        }
        return ">";
      case PLUS, MINUS, NOT, TILDE, INCR, DECR, MULT, DIV, MOD, AND, OR, XOR, LTLT, EQ, NOTEQ,
          LT, LTE, GTE, TRUE, FALSE:
        String text = current().text();
        next();
        return text;
      default:
        report(ErrorKind.EXPECTED_TOKEN, "overloadable operator");
        return null;
    }
  }

  private SyntaxNode conversionOperatorDeclaration(ImmutableList<SyntaxNode> attributes) {
    String kind = current().text();
    next();
    SyntaxNode explicitInterface = operatorInterfaceSpecifier(/* conversion= */ true);
    expect(Token.OPERATOR);
    maybe(Token.CHECKED);
    SyntaxNode type = type();
    SyntaxNode parameters = parameterList();
    return SyntaxNode.builder(SyntaxKind.CONVERSION_OPERATOR_DECLARATION)
        .tokenValue(kind)
        .addAll(attributes)
        .add(explicitInterface)
        .add(type)
        .add(parameters)
        .add(functionBody())
        .build();
  }

  // Type declarations.

  private SyntaxNode typeDeclaration(int start, ImmutableList<SyntaxNode> attributes) {
    SyntaxKind kind =
        switch (token()) {
          case CLASS -> SyntaxKind.CLASS_DECLARATION;
          case STRUCT -> SyntaxKind.STRUCT_DECLARATION;
          default -> SyntaxKind.INTERFACE_DECLARATION;
        };
    next();
    // class record C and struct record C are records named C
    if (kind != SyntaxKind.INTERFACE_DECLARATION
        && atWord("record")
        && peekToken(1) == Token.IDENT) {
      next();
      kind =
          kind == SyntaxKind.CLASS_DECLARATION
              ? SyntaxKind.RECORD_DECLARATION
              : SyntaxKind.RECORD_STRUCT_DECLARATION;
    }
    return typeDeclarationRest(kind, start, attributes);
  }

  private SyntaxNode recordDeclaration(int start, ImmutableList<SyntaxNode> attributes) {
    next();
    SyntaxKind kind = SyntaxKind.RECORD_DECLARATION;
    if (maybe(Token.STRUCT)) {
      kind = SyntaxKind.RECORD_STRUCT_DECLARATION;
    } else {
      maybe(Token.CLASS);
    }
    return typeDeclarationRest(kind, start, attributes);
  }

  /**
   * Parses the part of a class, struct, interface or record declaration after its keywords: name,
   * type parameters, primary constructor parameters, base list, constraints and body.
   */
  private SyntaxNode typeDeclarationRest(
      SyntaxKind kind, int start, ImmutableList<SyntaxNode> attributes) {
    String name = identifier();
    SyntaxNode.Builder declaration =
        SyntaxNode.builder(kind).tokenValue(name).addAll(attributes);
    if (kind == SyntaxKind.CLASS_DECLARATION && name != null) {
      // classes also carry their name as a leading identifier
      declaration.add(SyntaxNode.named(SyntaxKind.IDENTIFIER_NAME, name));
    }
    if (at(Token.LT)) {
      declaration.add(typeParameterList());
    }
    if (at(Token.LPAREN)) {
      declaration.add(parameterList());
    }
    if (at(Token.COLON)) {
      declaration.add(baseList());
    }
    declaration.addAll(constraintClauses());
    if (at(Token.LBRACE)) {
      typeBody(declaration, start);
    } else {
      if (!maybe(Token.SEMI)) {
        reportMissing("'{' or ';'");
      }
      closedByBrace = false;
    }
    return declaration.build();
  }

  /**
   * Parses a base list. Only the first base type takes primary constructor arguments; while
   * recovering, parentheses after later entries are skipped and a missing comma is reported.
   */
  private SyntaxNode baseList() {
    expect(Token.COLON);
    SyntaxNode.Builder bases = SyntaxNode.builder(SyntaxKind.BASE_LIST);
    boolean first = true;
    while (true) {
      SyntaxNode type = type();
      if (first && at(Token.LPAREN)) {
        bases.add(
            SyntaxNode.of(SyntaxKind.PRIMARY_CONSTRUCTOR_BASE_TYPE, type, argumentList()));
      } else {
        bases.add(SyntaxNode.of(SyntaxKind.SIMPLE_BASE_TYPE, type));
      }
      first = false;
      if (maybe(Token.COMMA)) {
        continue;
      }
      if (!recovering()) {
        break;
      }
      boolean skipped = false;
      while (at(Token.LPAREN) || at(Token.RPAREN)) {
        recordSkipped();
        next();
        skipped = true;
      }
      if (maybe(Token.COMMA)) {
        continue;
      }
      if (!at(Token.IDENT) || atConstraintClauseStart()) {
        break;
      }
      if (!skipped) {
        reportMissing("','");
      }
    }
    return bases.build();
  }

  private boolean atConstraintClauseStart() {
    return atWord("where") && peekToken(1) == Token.IDENT && peekToken(2) == Token.COLON;
  }

  /**
   * Parses a type body. If the body's closing brace is missing, the following members are
   * absorbed, until a type declaration that starts a line at or left of the declaration's own
   * column, or that follows a member whose body was left open.
   */
  private void typeBody(SyntaxNode.Builder declaration, int start) {
    boolean terminated = braceTerminated();
    int column = source.lineMap().column(start);
    int unclosed = unclosedBlocks();
    expect(Token.LBRACE);
    boolean closed = false;
    while (true) {
      if (maybe(Token.RBRACE)) {
        closed = true;
        break;
      }
      if (at(Token.EOF)) {
        reportMissing("'}'");
        break;
      }
      if (!terminated
          && (unclosedBlocks() > unclosed || startsLineAtOrLeftOf(column))
          && atTypeDeclarationStart()) {
        reportMissing("'}'");
        break;
      }
      Mark before = mark();
      declaration.add(memberOrSkip(Scope.TYPE));
      if (!progressed(before)) {
        skipMember();
      }
    }
    closedByBrace = closed && !maybe(Token.SEMI);
  }

  private boolean startsLineAtOrLeftOf(int column) {
    return current().precededByNewline()
        && source.lineMap().column(current().position()) <= column;
  }

  private SyntaxNode enumDeclaration(ImmutableList<SyntaxNode> attributes) {
    expect(Token.ENUM);
    String name = identifier();
    SyntaxNode.Builder declaration =
        SyntaxNode.builder(SyntaxKind.ENUM_DECLARATION).tokenValue(name).addAll(attributes);
    if (maybe(Token.COLON)) {
      declaration.add(
          SyntaxNode.of(
              SyntaxKind.BASE_LIST, SyntaxNode.of(SyntaxKind.SIMPLE_BASE_TYPE, type())));
    }
    expect(Token.LBRACE);
    while (!maybe(Token.RBRACE)) {
      if (!at(Token.IDENT) && !at(Token.LBRACK)) {
        // the body ends at the first token that cannot start an enum member
        reportMissing("'}'");
        break;
      }
      ImmutableList<SyntaxNode> memberAttributes = attributeLists();
      String memberName = identifier();
      SyntaxNode value = maybe(Token.ASSIGN) ? equalsValue() : null;
      declaration.add(
          SyntaxNode.builder(SyntaxKind.ENUM_MEMBER_DECLARATION)
              .tokenValue(memberName)
              .addAll(memberAttributes)
              .add(value)
              .build());
      if (!maybe(Token.COMMA) && !at(Token.RBRACE)) {
        reportMissing("'}'");
        break;
      }
    }
    maybe(Token.SEMI);
    closedByBrace = false;
    return declaration.build();
  }

  private SyntaxNode delegateDeclaration(ImmutableList<SyntaxNode> attributes) {
    expect(Token.DELEGATE);
    SyntaxNode returnType = type();
    String name = identifier();
    SyntaxNode typeParameters = at(Token.LT) ? typeParameterList() : null;
    SyntaxNode parameters = parameterList();
    ImmutableList<SyntaxNode> constraints = constraintClauses();
    expect(Token.SEMI);
    closedByBrace = false;
    return SyntaxNode.builder(SyntaxKind.DELEGATE_DECLARATION)
        .tokenValue(name)
        .addAll(attributes)
        .add(returnType)
        .add(typeParameters)
        .add(parameters)
        .addAll(constraints)
        .build();
  }

  // Entry points for single members.

  /** Parses one type member, failing if none can be parsed. */
  SyntaxNode typeMember() {
    SyntaxNode member = nested(() -> member(Scope.TYPE));
    if (member == null) {
      throw error(ErrorKind.UNEXPECTED_TOKEN, describe(current()));
    }
    return member;
  }
}
