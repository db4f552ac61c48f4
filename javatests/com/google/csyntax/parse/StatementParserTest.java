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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.csyntax.diag.ParseError;
import com.google.csyntax.diag.ParseError.ErrorKind;
import com.google.csyntax.parse.Parser.Parsed;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class StatementParserTest {

  private static String parse(String input) {
    Parsed parsed = Parser.parseStatement(input);
    assertThat(parsed.remaining()).isEmpty();
    return parsed.node().toString();
  }

  @Test
  public void localDeclaration() {
    assertThat(parse("int x = 1;"))
        .isEqualTo(
            "LocalDeclarationStatement(VariableDeclaration(PredefinedType[\"int\"]"
                + " VariableDeclarator[\"x\"](EqualsValueClause("
                + "NumericLiteralExpression[\"1\"]))))");
  }

  @Test
  public void deconstruction() {
    assertThat(parse("var (a, b) = t;"))
        .isEqualTo(
            "ExpressionStatement(SimpleAssignmentExpression(DeclarationExpression("
                + "IdentifierName[\"var\"] ParenthesizedVariableDesignation("
                + "SingleVariableDesignation[\"a\"] SingleVariableDesignation[\"b\"]))"
                + " IdentifierName[\"t\"]))");
  }

  @Test
  public void ifElse() {
    assertThat(parse("if (a) b(); else { }"))
        .isEqualTo(
            "IfStatement(IdentifierName[\"a\"]"
                + " ExpressionStatement(InvocationExpression(IdentifierName[\"b\"] ArgumentList))"
                + " ElseClause(Block))");
  }

  @Test
  public void empty() {
    assertThat(parse(";")).isEqualTo("EmptyStatement");
  }

  @Test
  public void loops() {
    assertThat(parse("foreach (var x in xs) { }"))
        .isEqualTo("ForEachStatement[\"x\"](IdentifierName[\"var\"] IdentifierName[\"xs\"] Block)");
    assertThat(parse("for (int i = 0; i < n; i++) { }"))
        .isEqualTo(
            "ForStatement(VariableDeclaration(PredefinedType[\"int\"]"
                + " VariableDeclarator[\"i\"](EqualsValueClause(NumericLiteralExpression[\"0\"])))"
                + " LessThanExpression(IdentifierName[\"i\"] IdentifierName[\"n\"])"
                + " PostIncrementExpression(IdentifierName[\"i\"]) Block)");
    assertThat(parse("for (;;) { }")).isEqualTo("ForStatement(Block)");
    assertThat(parse("do x++; while (x < 10);"))
        .isEqualTo(
            "DoStatement(ExpressionStatement(PostIncrementExpression(IdentifierName[\"x\"]))"
                + " LessThanExpression(IdentifierName[\"x\"] NumericLiteralExpression[\"10\"]))");
    assertThat(parse("while (x) { }")).isEqualTo("WhileStatement(IdentifierName[\"x\"] Block)");
  }

  @Test
  public void switchStatement() {
    assertThat(parse("switch (x) { case 1: break; default: return; }"))
        .isEqualTo(
            "SwitchStatement(IdentifierName[\"x\"]"
                + " SwitchSection(CaseSwitchLabel(NumericLiteralExpression[\"1\"]) BreakStatement)"
                + " SwitchSection(DefaultSwitchLabel ReturnStatement))");
  }

  @Test
  public void switchSharedSection() {
    assertThat(parse("switch (x) { case 1: case 2: return; }"))
        .isEqualTo(
            "SwitchStatement(IdentifierName[\"x\"]"
                + " SwitchSection(CaseSwitchLabel(NumericLiteralExpression[\"1\"])"
                + " CaseSwitchLabel(NumericLiteralExpression[\"2\"]) ReturnStatement))");
  }

  @Test
  public void tryCatchFinally() {
    assertThat(parse("try { } catch (Exception e) when (e != null) { } finally { }"))
        .isEqualTo(
            "TryStatement(Block CatchClause(CatchDeclaration[\"e\"](IdentifierName[\"Exception\"])"
                + " CatchFilterClause(NotEqualsExpression(IdentifierName[\"e\"]"
                + " NullLiteralExpression[\"null\"])) Block) FinallyClause(Block))");
    assertThat(parse("try { } catch { }")).isEqualTo("TryStatement(Block CatchClause(Block))");
  }

  @Test
  public void tryWithoutHandler() {
    ParseError e = assertThrows(ParseError.class, () -> Parser.parseStatement("try { }"));
    assertThat(e.kind()).isEqualTo(ErrorKind.EXPECTED_TOKEN);
  }

  @Test
  public void using() {
    assertThat(parse("using (var f = Open()) { }"))
        .isEqualTo(
            "UsingStatement(VariableDeclaration(IdentifierName[\"var\"]"
                + " VariableDeclarator[\"f\"](EqualsValueClause("
                + "InvocationExpression(IdentifierName[\"Open\"] ArgumentList)))) Block)");
    assertThat(parse("using var f = Open();"))
        .isEqualTo(
            "LocalDeclarationStatement(VariableDeclaration(IdentifierName[\"var\"]"
                + " VariableDeclarator[\"f\"](EqualsValueClause("
                + "InvocationExpression(IdentifierName[\"Open\"] ArgumentList)))))");
  }

  @Test
  public void jumps() {
    assertThat(parse("yield return x;"))
        .isEqualTo("YieldReturnStatement(IdentifierName[\"x\"])");
    assertThat(parse("yield break;")).isEqualTo("YieldBreakStatement");
    assertThat(parse("return;")).isEqualTo("ReturnStatement");
    assertThat(parse("throw;")).isEqualTo("ThrowStatement");
    assertThat(parse("continue;")).isEqualTo("ContinueStatement");
    assertThat(parse("goto case 1;"))
        .isEqualTo("GotoCaseStatement(NumericLiteralExpression[\"1\"])");
    assertThat(parse("goto default;")).isEqualTo("GotoDefaultStatement");
    assertThat(parse("goto end;")).isEqualTo("GotoStatement(IdentifierName[\"end\"])");
  }

  @Test
  public void labeled() {
    assertThat(parse("label: x++;"))
        .isEqualTo(
            "LabeledStatement[\"label\"](ExpressionStatement("
                + "PostIncrementExpression(IdentifierName[\"x\"])))");
  }

  @Test
  public void blocks() {
    assertThat(parse("checked { }")).isEqualTo("CheckedStatement(Block)");
    assertThat(parse("unsafe { }")).isEqualTo("UnsafeStatement(Block)");
    assertThat(parse("lock (o) { }")).isEqualTo("LockStatement(IdentifierName[\"o\"] Block)");
    assertThat(parse("{ ; ; }")).isEqualTo("Block(EmptyStatement EmptyStatement)");
  }

  @Test
  public void fixed() {
    assertThat(parse("fixed (int* p = &x) { }"))
        .isEqualTo(
            "FixedStatement(VariableDeclaration(PointerType(PredefinedType[\"int\"])"
                + " VariableDeclarator[\"p\"](EqualsValueClause("
                + "AddressOfExpression(IdentifierName[\"x\"])))) Block)");
  }

  @Test
  public void localFunctions() {
    assertThat(parse("int Add(int a, int b) => a + b;"))
        .isEqualTo(
            "LocalFunctionStatement[\"Add\"](PredefinedType[\"int\"]"
                + " ParameterList(Parameter[\"a\"](PredefinedType[\"int\"])"
                + " Parameter[\"b\"](PredefinedType[\"int\"]))"
                + " ArrowExpressionClause(AddExpression(IdentifierName[\"a\"]"
                + " IdentifierName[\"b\"])))");
    assertThat(parse("static void F<T>() where T : class { }"))
        .isEqualTo(
            "LocalFunctionStatement[\"F\"](PredefinedType[\"void\"]"
                + " TypeParameterList(TypeParameter[\"T\"]) ParameterList"
                + " TypeParameterConstraintClause(IdentifierName[\"T\"] ClassConstraint) Block)");
  }

  @Test
  public void invocationIsNotLocalFunction() {
    assertThat(parse("F(a);"))
        .isEqualTo(
            "ExpressionStatement(InvocationExpression(IdentifierName[\"F\"]"
                + " ArgumentList(Argument(IdentifierName[\"a\"]))))");
  }

  @Test
  public void missingSemicolon() {
    ParseError e = assertThrows(ParseError.class, () -> Parser.parseStatement("x = 1"));
    assertThat(e.kind()).isEqualTo(ErrorKind.EXPECTED_TOKEN);
  }

  @Test
  public void remaining() {
    Parsed parsed = Parser.parseStatement("x++; y++;");
    assertThat(parsed.node().toString())
        .isEqualTo("ExpressionStatement(PostIncrementExpression(IdentifierName[\"x\"]))");
    assertThat(parsed.remaining()).isEqualTo("y++;");
  }
}
