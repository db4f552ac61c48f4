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

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.collect.Iterables.getOnlyElement;
import static com.google.common.truth.Truth.assertThat;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.csyntax.diag.Diagnostic;
import com.google.csyntax.diag.ParseError.ErrorKind;
import com.google.csyntax.diag.SourceFile;
import com.google.csyntax.options.ParserOptions;
import com.google.csyntax.parse.Parser.ParseResult;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class RecoveryTest {

  private static final String QUALIFIED_INTERFACE =
      "ExplicitInterfaceSpecifier(QualifiedName(IdentifierName[\"N\"] IdentifierName[\"I\"]))";

  private static final String INT_PARAMETER_AND_BODY =
      "ParameterList(Parameter[\"x\"](PredefinedType[\"int\"]))"
          + " ArrowExpressionClause(IdentifierName[\"x\"])";

  private static ParseResult parse(String source) {
    return Parser.parseStrict(new SourceFile("Test.cs", source), ParserOptions.defaults());
  }

  private static ImmutableList<ErrorKind> kinds(ParseResult result) {
    return result.diagnostics().stream().map(Diagnostic::kind).collect(toImmutableList());
  }

  @Test
  public void missingCloseBrace() {
    ParseResult result = parse("class C {");
    assertThat(result.compilationUnit().toString())
        .isEqualTo("CompilationUnit(ClassDeclaration[\"C\"](IdentifierName[\"C\"]))");
    Diagnostic diagnostic = getOnlyElement(result.diagnostics());
    assertThat(diagnostic.kind()).isEqualTo(ErrorKind.EXPECTED_TOKEN);
    assertThat(diagnostic.position()).isEqualTo(9);
    assertThat(diagnostic.diagnostic()).contains("expected '}'");
  }

  @Test
  public void semicolonBeforeAccessors() {
    ParseResult result = parse("class C { int P; { get; set; } }");
    assertThat(result.compilationUnit().toString())
        .isEqualTo(
            "CompilationUnit(ClassDeclaration[\"C\"](IdentifierName[\"C\"]"
                + " PropertyDeclaration[\"P\"]("
                + "PredefinedType[\"int\"]"
                + " AccessorList(GetAccessorDeclaration SetAccessorDeclaration))))");
    assertThat(kinds(result)).containsExactly(ErrorKind.UNEXPECTED_TOKEN);
  }

  @Test
  public void incompleteMember() {
    ParseResult result = parse("class C { public }");
    assertThat(result.compilationUnit().toString())
        .isEqualTo(
            "CompilationUnit(ClassDeclaration[\"C\"](IdentifierName[\"C\"] IncompleteMember))");
    assertThat(kinds(result)).contains(ErrorKind.INCOMPLETE_MEMBER);
  }

  @Test
  public void skippedTokens() {
    ParseResult result = parse("class C { int x; ) int y; }");
    assertThat(result.compilationUnit().toString())
        .isEqualTo(
            "CompilationUnit(ClassDeclaration[\"C\"](IdentifierName[\"C\"] "
                + "FieldDeclaration(VariableDeclaration(PredefinedType[\"int\"]"
                + " VariableDeclarator[\"x\"]))"
                + " FieldDeclaration(VariableDeclaration(PredefinedType[\"int\"]"
                + " VariableDeclarator[\"y\"]))))");
    Diagnostic diagnostic = getOnlyElement(result.diagnostics());
    assertThat(diagnostic.kind()).isEqualTo(ErrorKind.SKIPPED_TOKENS);
    assertThat(diagnostic.args()).containsExactly("')'");
    assertThat(diagnostic.position()).isEqualTo(17);
  }

  @Test
  public void garbage() {
    ParseResult result = parse("} } ) ( class");
    assertThat(result.remaining()).isEmpty();
    assertThat(result.diagnostics()).isNotEmpty();
  }

  @Test
  public void lexicalErrorsAreReported() {
    ParseResult result = parse("class C { string s = \"abc; }");
    assertThat(kinds(result)).contains(ErrorKind.UNTERMINATED_STRING);
    assertThat(result.remaining()).isEmpty();
  }

  @Test
  public void deepNesting() {
    String source = "x = " + Strings.repeat("(", 100) + "1" + Strings.repeat(")", 100) + ";";
    ParseResult result =
        Parser.parseStrict(
            new SourceFile(null, source), ParserOptions.builder().setMaxDepth(64).build());
    assertThat(kinds(result)).contains(ErrorKind.NESTING_TOO_DEEP);
    assertThat(result.remaining()).isEmpty();
  }

  @Test
  public void semicolonBeforeInitializerBrace() {
    ParseResult result =
        parse("class c { void m() { var x = new C { a = b; }; if (true) return; } }");
    assertThat(result.compilationUnit().toString())
        .isEqualTo(
            "CompilationUnit(ClassDeclaration[\"c\"](IdentifierName[\"c\"]"
                + " MethodDeclaration[\"m\"](PredefinedType[\"void\"] ParameterList"
                + " Block(LocalDeclarationStatement(VariableDeclaration(IdentifierName[\"var\"]"
                + " VariableDeclarator[\"x\"](EqualsValueClause(ObjectCreationExpression("
                + "IdentifierName[\"C\"] ObjectInitializerExpression(SimpleAssignmentExpression("
                + "IdentifierName[\"a\"] IdentifierName[\"b\"])))))))"
                + " IfStatement(TrueLiteralExpression[\"true\"] ReturnStatement)))))");
    Diagnostic diagnostic = getOnlyElement(result.diagnostics());
    assertThat(diagnostic.kind()).isEqualTo(ErrorKind.SKIPPED_TOKENS);
    assertThat(diagnostic.position()).isEqualTo(42);
  }

  @Test
  public void semicolonBeforeInitializerBraceKeepsLocals() {
    String unit =
        parse("class c { void m() { var x = new C { a = b; }; var y = 5; } }")
            .compilationUnit()
            .toString();
    assertThat(unit).doesNotContain("FieldDeclaration");
    assertThat(unit)
        .endsWith(
            " LocalDeclarationStatement(VariableDeclaration(IdentifierName[\"var\"]"
                + " VariableDeclarator[\"y\"](EqualsValueClause("
                + "NumericLiteralExpression[\"5\"]))))))))");
  }

  @Test
  public void statementInsideInitializer() {
    // the initializer ends at the semicolon when a statement follows it
    String unit =
        parse("class c { void m() { var x = new C { a = b; return; }; var y = 5; } }")
            .compilationUnit()
            .toString();
    assertThat(unit).contains("ReturnStatement");
    assertThat(unit).contains("FieldDeclaration");
  }

  @Test
  public void constraintMissingColon() {
    ParseResult result = parse("class C<T> where T struct { int x; }");
    assertThat(result.compilationUnit().toString())
        .isEqualTo(
            "CompilationUnit(ClassDeclaration[\"C\"](IdentifierName[\"C\"]"
                + " TypeParameterList(TypeParameter[\"T\"])"
                + " TypeParameterConstraintClause(IdentifierName[\"T\"] StructConstraint)"
                + " FieldDeclaration(VariableDeclaration(PredefinedType[\"int\"]"
                + " VariableDeclarator[\"x\"]))))");
    Diagnostic diagnostic = getOnlyElement(result.diagnostics());
    assertThat(diagnostic.kind()).isEqualTo(ErrorKind.EXPECTED_TOKEN);
    assertThat(diagnostic.args()).containsExactly("':'");
  }

  @Test
  public void constraintMissingColonOnRecord() {
    ParseResult result = parse("class C { record R<T> where T class; }");
    assertThat(result.compilationUnit().toString())
        .isEqualTo(
            "CompilationUnit(ClassDeclaration[\"C\"](IdentifierName[\"C\"]"
                + " RecordDeclaration[\"R\"](TypeParameterList(TypeParameter[\"T\"])"
                + " TypeParameterConstraintClause(IdentifierName[\"T\"] ClassConstraint))))");
    assertThat(kinds(result)).containsExactly(ErrorKind.EXPECTED_TOKEN);
  }

  @Test
  public void constraintWithoutConstraints() {
    ParseResult result = parse("class C<T> where T { }");
    assertThat(result.compilationUnit().toString())
        .isEqualTo(
            "CompilationUnit(ClassDeclaration[\"C\"](IdentifierName[\"C\"]"
                + " TypeParameterList(TypeParameter[\"T\"])"
                + " TypeParameterConstraintClause(IdentifierName[\"T\"])))");
    assertThat(kinds(result)).containsExactly(ErrorKind.EXPECTED_TOKEN);
  }

  @Test
  public void conversionKeywordInPlaceOfOperator() {
    ParseResult result = parse("int N.I.implicit (int x) => x;");
    assertThat(result.compilationUnit().toString())
        .isEqualTo(
            "CompilationUnit(OperatorDeclaration(PredefinedType[\"int\"] "
                + QUALIFIED_INTERFACE
                + " "
                + INT_PARAMETER_AND_BODY
                + "))");
    assertThat(kinds(result)).containsExactly(ErrorKind.EXPECTED_TOKEN);
  }

  @Test
  public void operatorInterfaceMissingDot() {
    ParseResult result = parse("int N.I operator +(int x) => x;");
    assertThat(result.compilationUnit().toString())
        .isEqualTo(
            "CompilationUnit(OperatorDeclaration[\"+\"](PredefinedType[\"int\"] "
                + QUALIFIED_INTERFACE
                + " "
                + INT_PARAMETER_AND_BODY
                + "))");
    Diagnostic diagnostic = getOnlyElement(result.diagnostics());
    assertThat(diagnostic.args()).containsExactly("'.'");
  }

  @Test
  public void conversionOperatorInterfaceMissingDot() {
    String expected =
        "CompilationUnit(ConversionOperatorDeclaration[\"implicit\"]("
            + QUALIFIED_INTERFACE
            + " PredefinedType[\"int\"] "
            + INT_PARAMETER_AND_BODY
            + "))";
    ParseResult result = parse("implicit N.I operator int(int x) => x;");
    assertThat(result.compilationUnit().toString()).isEqualTo(expected);
    assertThat(kinds(result)).containsExactly(ErrorKind.EXPECTED_TOKEN);

    result = parse("implicit N.I int(int x) => x;");
    assertThat(result.compilationUnit().toString()).isEqualTo(expected);
    assertThat(kinds(result)).containsExactly(ErrorKind.EXPECTED_TOKEN, ErrorKind.EXPECTED_TOKEN);
  }

  @Test
  public void incompleteTopLevelOperator() {
    ParseResult result = parse("fg implicit\nclass C { }");
    assertThat(result.compilationUnit().toString())
        .isEqualTo(
            "CompilationUnit(OperatorDeclaration(IdentifierName[\"fg\"])"
                + " ClassDeclaration[\"C\"](IdentifierName[\"C\"]))");
    assertThat(kinds(result)).contains(ErrorKind.EXPECTED_TOKEN);
  }

  @Test
  public void withWithoutReceiver() {
    ParseResult result = parse("int x = with { };");
    assertThat(result.compilationUnit().toString())
        .isEqualTo(
            "CompilationUnit(GlobalStatement(LocalDeclarationStatement(VariableDeclaration("
                + "PredefinedType[\"int\"] VariableDeclarator[\"x\"](EqualsValueClause("
                + "IdentifierName[\"with\"])))))"
                + " GlobalStatement(EmptyStatement))");
    assertThat(kinds(result))
        .containsExactly(ErrorKind.EXPECTED_TOKEN, ErrorKind.SKIPPED_TOKENS)
        .inOrder();
  }

  @Test
  public void withStatementWithoutReceiver() {
    ParseResult result = parse("class C { void M() { with { }; } }");
    assertThat(result.compilationUnit().toString())
        .isEqualTo(
            "CompilationUnit(ClassDeclaration[\"C\"](IdentifierName[\"C\"]"
                + " MethodDeclaration[\"M\"](PredefinedType[\"void\"] ParameterList"
                + " Block(ExpressionStatement(IdentifierName[\"with\"]) EmptyStatement))))");
    assertThat(kinds(result))
        .containsExactly(ErrorKind.EXPECTED_TOKEN, ErrorKind.SKIPPED_TOKENS)
        .inOrder();
  }

  @Test
  public void semicolonAfterTopLevelAccessorList() {
    ParseResult result = parse("x with { };");
    assertThat(result.compilationUnit().toString())
        .isEqualTo(
            "CompilationUnit(PropertyDeclaration[\"with\"](IdentifierName[\"x\"] AccessorList))");
    assertThat(kinds(result)).contains(ErrorKind.SKIPPED_TOKENS);
  }

  @Test
  public void withRecoveryInAndAfterClass() {
    String unit =
        parse(
                Joiner.on('\n')
                    .join(
                        "class C",
                        "{",
                        "    with { };",
                        "    x with { };",
                        "    int x = with { };",
                        "    int x = 0 with { };",
                        "}"))
            .compilationUnit()
            .toString();
    assertThat(unit)
        .isEqualTo(
            "CompilationUnit(ClassDeclaration[\"C\"](IdentifierName[\"C\"]"
                + " IncompleteMember(IdentifierName[\"with\"]))"
                + " PropertyDeclaration[\"with\"](IdentifierName[\"x\"] AccessorList)"
                + " GlobalStatement(LocalDeclarationStatement(VariableDeclaration("
                + "PredefinedType[\"int\"] VariableDeclarator[\"x\"](EqualsValueClause("
                + "IdentifierName[\"with\"])))))"
                + " GlobalStatement(EmptyStatement)"
                + " GlobalStatement(LocalDeclarationStatement(VariableDeclaration("
                + "PredefinedType[\"int\"] VariableDeclarator[\"x\"](EqualsValueClause("
                + "WithExpression(NumericLiteralExpression[\"0\"]"
                + " WithInitializerExpression)))))))");
  }

  @Test
  public void semicolonBeforeExpressionBody() {
    ParseResult result = parse("class C { int P; => 0; }");
    assertThat(result.compilationUnit().toString())
        .isEqualTo(
            "CompilationUnit(ClassDeclaration[\"C\"](IdentifierName[\"C\"]"
                + " PropertyDeclaration[\"P\"](PredefinedType[\"int\"]"
                + " ArrowExpressionClause(NumericLiteralExpression[\"0\"]))))");
    assertThat(kinds(result)).containsExactly(ErrorKind.UNEXPECTED_TOKEN);
  }

  @Test
  public void membersAfterTypeJoinIt() {
    assertThat(
            parse("namespace N { class C { } void M() {} private class T { } void M2() {} }")
                .compilationUnit()
                .toString())
        .isEqualTo(
            "CompilationUnit(NamespaceDeclaration(IdentifierName[\"N\"]"
                + " ClassDeclaration[\"C\"](IdentifierName[\"C\"]"
                + " MethodDeclaration[\"M\"](PredefinedType[\"void\"] ParameterList Block))"
                + " ClassDeclaration[\"T\"](IdentifierName[\"T\"]"
                + " MethodDeclaration[\"M2\"](PredefinedType[\"void\"] ParameterList Block))))");
  }

  @Test
  public void membersDoNotJoinEnumsDelegatesOrTerminatedTypes() {
    String method = " MethodDeclaration[\"M\"](PredefinedType[\"void\"] ParameterList Block)))";
    assertThat(parse("namespace N { enum E { A } void M() {} }").compilationUnit().toString())
        .isEqualTo(
            "CompilationUnit(NamespaceDeclaration(IdentifierName[\"N\"]"
                + " EnumDeclaration[\"E\"](EnumMemberDeclaration[\"A\"])"
                + method);
    assertThat(
            parse("namespace N { delegate void D(); void M() {} }").compilationUnit().toString())
        .isEqualTo(
            "CompilationUnit(NamespaceDeclaration(IdentifierName[\"N\"]"
                + " DelegateDeclaration[\"D\"](PredefinedType[\"void\"] ParameterList)"
                + method);
    assertThat(parse("namespace N { class C { }; void M() {} }").compilationUnit().toString())
        .isEqualTo(
            "CompilationUnit(NamespaceDeclaration(IdentifierName[\"N\"]"
                + " ClassDeclaration[\"C\"](IdentifierName[\"C\"])"
                + method);
  }

  @Test
  public void unclosedParentheses() {
    ParseResult result = parse("x = ((a;");
    assertThat(result.compilationUnit().toString())
        .isEqualTo(
            "CompilationUnit(GlobalStatement(ExpressionStatement(SimpleAssignmentExpression("
                + "IdentifierName[\"x\"]"
                + " ParenthesizedExpression(ParenthesizedExpression(IdentifierName[\"a\"]))))))");
    assertThat(kinds(result)).containsExactly(ErrorKind.EXPECTED_TOKEN, ErrorKind.EXPECTED_TOKEN);
    assertThat(result.diagnostics().get(0).args()).containsExactly("')'");
  }

  @Test
  public void deterministic() {
    String source = "class C { void M( { } int x }";
    assertThat(parse(source).compilationUnit()).isEqualTo(parse(source).compilationUnit());
    assertThat(parse(source).diagnostics()).isEqualTo(parse(source).diagnostics());
  }
}
