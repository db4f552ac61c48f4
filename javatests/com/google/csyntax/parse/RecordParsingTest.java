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
import static com.google.common.truth.Truth.assertThat;

import com.google.csyntax.diag.ParseError.ErrorKind;
import com.google.csyntax.diag.SourceFile;
import com.google.csyntax.options.LanguageVersion;
import com.google.csyntax.options.ParserOptions;
import com.google.csyntax.parse.Parser.ParseResult;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Records, and the contextual keyword {@code record} used as an ordinary name. */
@RunWith(JUnit4.class)
public class RecordParsingTest {

  private static final String PARAMETERS =
      "ParameterList(Parameter[\"X\"](PredefinedType[\"int\"])"
          + " Parameter[\"Y\"](PredefinedType[\"int\"]))";

  private static final String ARGUMENTS =
      "ArgumentList(Argument(PredefinedType[\"int\"]) Argument(IdentifierName[\"X\"])"
          + " Argument(PredefinedType[\"int\"]) Argument(IdentifierName[\"Y\"]))";

  private static ParseResult parseResult(String source, LanguageVersion version) {
    ParserOptions options = ParserOptions.builder().setLanguageVersion(version).build();
    return Parser.parseStrict(new SourceFile(null, source), options);
  }

  private static String parse(String source, LanguageVersion version) {
    return parseResult(source, version).compilationUnit().toString();
  }

  private static String parse(String source) {
    return Parser.parse(source).toString();
  }

  @Test
  public void positionalRecord() {
    assertThat(parse("record C(int X, int Y);"))
        .isEqualTo("CompilationUnit(RecordDeclaration[\"C\"](" + PARAMETERS + "))");
  }

  @Test
  public void recordIsAMethodBeforeCSharp9() {
    assertThat(parse("record C(int X, int Y);", LanguageVersion.CSHARP_8))
        .isEqualTo(
            "CompilationUnit(GlobalStatement(LocalFunctionStatement[\"C\"]("
                + "IdentifierName[\"record\"] "
                + PARAMETERS
                + ")))");
  }

  @Test
  public void recordWithoutBody() {
    assertThat(parse("record C;")).isEqualTo("CompilationUnit(RecordDeclaration[\"C\"])");
  }

  @Test
  public void recordAsTypeName() {
    assertThat(parse("struct record { }"))
        .isEqualTo("CompilationUnit(StructDeclaration[\"record\"])");
    assertThat(parse("record record C(int X, int Y);"))
        .isEqualTo(
            "CompilationUnit(RecordDeclaration[\"record\"]"
                + " GlobalStatement(ExpressionStatement(InvocationExpression("
                + "IdentifierName[\"C\"] "
                + ARGUMENTS
                + "))))");
    assertThat(parse("interface record C(int X, int Y);"))
        .isEqualTo(
            "CompilationUnit(InterfaceDeclaration[\"record\"]"
                + " GlobalStatement(ExpressionStatement(InvocationExpression("
                + "IdentifierName[\"C\"] "
                + ARGUMENTS
                + "))))");
  }

  @Test
  public void recordAsFieldName() {
    assertThat(parse("record C { public int record; }"))
        .isEqualTo(
            "CompilationUnit(RecordDeclaration[\"C\"](FieldDeclaration(VariableDeclaration("
                + "PredefinedType[\"int\"] VariableDeclarator[\"record\"]))))");
  }

  @Test
  public void recordStructRequiresCSharp10() {
    ParseResult result = parseResult("record struct C(int X, int Y);", LanguageVersion.CSHARP_9);
    assertThat(result.compilationUnit().toString())
        .isEqualTo(
            "CompilationUnit(GlobalStatement(LocalDeclarationStatement(VariableDeclaration("
                + "IdentifierName[\"record\"]))) StructDeclaration[\"C\"]("
                + PARAMETERS
                + "))");
    assertThat(result.diagnostics()).isNotEmpty();

    result = parseResult("record class C(int X, int Y);", LanguageVersion.CSHARP_9);
    assertThat(result.compilationUnit().toString())
        .isEqualTo(
            "CompilationUnit(GlobalStatement(LocalDeclarationStatement(VariableDeclaration("
                + "IdentifierName[\"record\"]))) ClassDeclaration[\"C\"](IdentifierName[\"C\"] "
                + PARAMETERS
                + "))");
    assertThat(result.diagnostics()).isNotEmpty();
  }

  @Test
  public void recordInterface() {
    assertThat(parse("record interface C(int X, int Y);"))
        .isEqualTo(
            "CompilationUnit(RecordDeclaration InterfaceDeclaration[\"C\"](" + PARAMETERS + "))");
  }

  @Test
  public void recordStructs() {
    assertThat(parse("record struct(int X, int Y);"))
        .isEqualTo("CompilationUnit(RecordStructDeclaration(" + PARAMETERS + "))");
    assertThat(parse("struct record C(int X, int Y);"))
        .isEqualTo("CompilationUnit(RecordStructDeclaration[\"C\"](" + PARAMETERS + "))");
    assertThat(parse("class record C(int X, int Y);"))
        .isEqualTo("CompilationUnit(RecordDeclaration[\"C\"](" + PARAMETERS + "))");
    assertThat(parse("partial record struct S;"))
        .isEqualTo("CompilationUnit(RecordStructDeclaration[\"S\"])");
    assertThat(parse("readonly partial record struct S;"))
        .isEqualTo("CompilationUnit(RecordStructDeclaration[\"S\"])");
  }

  @Test
  public void modifierOrder() {
    assertThat(parse("partial readonly record struct S;"))
        .isEqualTo(
            "CompilationUnit(IncompleteMember(IdentifierName[\"partial\"])"
                + " RecordStructDeclaration[\"S\"])");
  }

  @Test
  public void misplacedModifiers() {
    assertThat(parse("new record struct S;"))
        .isEqualTo(
            "CompilationUnit(GlobalStatement(ExpressionStatement("
                + "ObjectCreationExpression(IdentifierName[\"record\"])))"
                + " StructDeclaration[\"S\"])");
    assertThat(parse("const record struct S;"))
        .isEqualTo(
            "CompilationUnit(GlobalStatement(LocalDeclarationStatement(VariableDeclaration("
                + "IdentifierName[\"record\"]))) StructDeclaration[\"S\"])");
    assertThat(parse("fixed record struct S;"))
        .isEqualTo(
            "CompilationUnit(FieldDeclaration(VariableDeclaration(IdentifierName[\"record\"]"
                + " VariableDeclarator(BracketedArgumentList("
                + "Argument(OmittedArraySizeExpression)))))"
                + " StructDeclaration[\"S\"])");
  }

  @Test
  public void refRecords() {
    assertThat(parse("ref record struct S;", LanguageVersion.CSHARP_10))
        .isEqualTo(
            "CompilationUnit(IncompleteMember(RefType(IdentifierName[\"record\"]))"
                + " StructDeclaration[\"S\"])");
    assertThat(parse("ref record struct S;", LanguageVersion.CSHARP_11))
        .isEqualTo("CompilationUnit(RecordStructDeclaration[\"S\"])");
    assertThat(parse("ref record R;", LanguageVersion.CSHARP_10))
        .isEqualTo(
            "CompilationUnit(GlobalStatement(LocalDeclarationStatement(VariableDeclaration("
                + "RefType(IdentifierName[\"record\"]) VariableDeclarator[\"R\"]))))");
    assertThat(parse("ref record R;", LanguageVersion.CSHARP_11))
        .isEqualTo("CompilationUnit(RecordDeclaration[\"R\"])");
  }

  @Test
  public void baseArguments() {
    assertThat(parse("record R(int X) : B(X);"))
        .isEqualTo(
            "CompilationUnit(RecordDeclaration[\"R\"](ParameterList("
                + "Parameter[\"X\"](PredefinedType[\"int\"]))"
                + " BaseList(PrimaryConstructorBaseType(IdentifierName[\"B\"]"
                + " ArgumentList(Argument(IdentifierName[\"X\"]))))))");
    assertThat(parse("record struct S : Base(1);"))
        .isEqualTo(
            "CompilationUnit(RecordStructDeclaration[\"S\"](BaseList(PrimaryConstructorBaseType("
                + "IdentifierName[\"Base\"]"
                + " ArgumentList(Argument(NumericLiteralExpression[\"1\"]))))))");
  }

  @Test
  public void nestedRecordsWithStatementBodies() {
    String source =
        String.join(
            "\n",
            "record R1() { return null; }",
            "abstract record D",
            "{",
            "    record R2() { return null; }",
            "    abstract record R3();",
            "}");
    ParseResult result = parseResult(source, LanguageVersion.latest());
    assertThat(result.compilationUnit().toString())
        .isEqualTo(
            "CompilationUnit(RecordDeclaration[\"R1\"](ParameterList)"
                + " RecordDeclaration[\"D\"](RecordDeclaration[\"R2\"](ParameterList)"
                + " RecordDeclaration[\"R3\"](ParameterList)))");
    assertThat(result.diagnostics().stream().map(d -> d.kind()).collect(toImmutableList()))
        .contains(ErrorKind.SKIPPED_TOKENS);
    assertThat(result.remaining()).isEmpty();
  }
}
