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

import com.google.common.base.Strings;
import com.google.csyntax.diag.ParseError;
import com.google.csyntax.diag.ParseError.ErrorKind;
import com.google.csyntax.options.LanguageVersion;
import com.google.csyntax.options.ParserOptions;
import com.google.csyntax.parse.Parser.Parsed;
import com.google.csyntax.tree.SyntaxKind;
import com.google.csyntax.tree.SyntaxNode;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ExpressionParserTest {

  private static String parse(String input) {
    Parsed parsed = Parser.parseExpression(input);
    assertThat(parsed.remaining()).isEmpty();
    return parsed.node().toString();
  }

  @Test
  public void precedence() {
    assertThat(parse("a + b * c"))
        .isEqualTo(
            "AddExpression(IdentifierName[\"a\"]"
                + " MultiplyExpression(IdentifierName[\"b\"] IdentifierName[\"c\"]))");
    assertThat(parse("!a && b"))
        .isEqualTo(
            "LogicalAndExpression(LogicalNotExpression(IdentifierName[\"a\"])"
                + " IdentifierName[\"b\"])");
  }

  @Test
  public void leftAssociative() {
    assertThat(parse("a - b - c"))
        .isEqualTo(
            "SubtractExpression(SubtractExpression(IdentifierName[\"a\"] IdentifierName[\"b\"])"
                + " IdentifierName[\"c\"])");
  }

  @Test
  public void rightAssociative() {
    assertThat(parse("a = b = c"))
        .isEqualTo(
            "SimpleAssignmentExpression(IdentifierName[\"a\"]"
                + " SimpleAssignmentExpression(IdentifierName[\"b\"] IdentifierName[\"c\"]))");
    assertThat(parse("a ?? b ?? c"))
        .isEqualTo(
            "CoalesceExpression(IdentifierName[\"a\"]"
                + " CoalesceExpression(IdentifierName[\"b\"] IdentifierName[\"c\"]))");
  }

  @Test
  public void shifts() {
    assertThat(parse("x >> 2"))
        .isEqualTo("RightShiftExpression(IdentifierName[\"x\"] NumericLiteralExpression[\"2\"])");
    assertThat(parse("x >>= 1"))
        .isEqualTo(
            "RightShiftAssignmentExpression(IdentifierName[\"x\"]"
                + " NumericLiteralExpression[\"1\"])");
    assertThat(parse("x >>> 1").toString()).startsWith("UnsignedRightShiftExpression(");
    assertThat(parse("x << 1").toString()).startsWith("LeftShiftExpression(");
  }

  @Test
  public void unary() {
    assertThat(parse("-x")).isEqualTo("UnaryMinusExpression(IdentifierName[\"x\"])");
    assertThat(parse("^1")).isEqualTo("IndexExpression(NumericLiteralExpression[\"1\"])");
    assertThat(parse("x!")).isEqualTo("SuppressNullableWarningExpression(IdentifierName[\"x\"])");
    assertThat(parse("await x")).isEqualTo("AwaitExpression(IdentifierName[\"x\"])");
    assertThat(parse("x++")).isEqualTo("PostIncrementExpression(IdentifierName[\"x\"])");
    assertThat(parse("--x")).isEqualTo("PreDecrementExpression(IdentifierName[\"x\"])");
  }

  @Test
  public void awaitAsName() {
    assertThat(parse("await")).isEqualTo("IdentifierName[\"await\"]");
  }

  @Test
  public void range() {
    assertThat(parse("1..^1"))
        .isEqualTo(
            "RangeExpression(NumericLiteralExpression[\"1\"]"
                + " IndexExpression(NumericLiteralExpression[\"1\"]))");
    assertThat(parse("..")).isEqualTo("RangeExpression");
  }

  @Test
  public void cast() {
    assertThat(parse("(int)x"))
        .isEqualTo("CastExpression(PredefinedType[\"int\"] IdentifierName[\"x\"])");
    assertThat(parse("(T)x"))
        .isEqualTo("CastExpression(IdentifierName[\"T\"] IdentifierName[\"x\"])");
  }

  @Test
  public void parenthesizedNotCast() {
    assertThat(parse("(a) - b"))
        .isEqualTo(
            "SubtractExpression(ParenthesizedExpression(IdentifierName[\"a\"])"
                + " IdentifierName[\"b\"])");
  }

  @Test
  public void tuple() {
    assertThat(parse("(a, b)"))
        .isEqualTo(
            "TupleExpression(Argument(IdentifierName[\"a\"]) Argument(IdentifierName[\"b\"]))");
    assertThat(parse("(x: 1, y: 2)"))
        .isEqualTo(
            "TupleExpression("
                + "Argument(NameColon(IdentifierName[\"x\"]) NumericLiteralExpression[\"1\"]) "
                + "Argument(NameColon(IdentifierName[\"y\"]) NumericLiteralExpression[\"2\"]))");
  }

  @Test
  public void lessThanIsNotGeneric() {
    assertThat(parse("a < b"))
        .isEqualTo("LessThanExpression(IdentifierName[\"a\"] IdentifierName[\"b\"])");
    assertThat(parse("a < b > c"))
        .isEqualTo(
            "GreaterThanExpression(LessThanExpression(IdentifierName[\"a\"]"
                + " IdentifierName[\"b\"]) IdentifierName[\"c\"])");
  }

  @Test
  public void genericInvocation() {
    assertThat(parse("A<int>.Parse(s)"))
        .isEqualTo(
            "InvocationExpression(SimpleMemberAccessExpression("
                + "GenericName[\"A\"](TypeArgumentList(PredefinedType[\"int\"]))"
                + " IdentifierName[\"Parse\"])"
                + " ArgumentList(Argument(IdentifierName[\"s\"])))");
  }

  @Test
  public void memberAccess() {
    assertThat(parse("a.b.c"))
        .isEqualTo(
            "SimpleMemberAccessExpression(SimpleMemberAccessExpression(IdentifierName[\"a\"]"
                + " IdentifierName[\"b\"]) IdentifierName[\"c\"])");
    assertThat(parse("a[1]"))
        .isEqualTo(
            "ElementAccessExpression(IdentifierName[\"a\"]"
                + " BracketedArgumentList(Argument(NumericLiteralExpression[\"1\"])))");
    assertThat(parse("p->x"))
        .isEqualTo(
            "PointerMemberAccessExpression(IdentifierName[\"p\"] IdentifierName[\"x\"])");
  }

  @Test
  public void arguments() {
    assertThat(parse("f(out var x, ref y)"))
        .isEqualTo(
            "InvocationExpression(IdentifierName[\"f\"] ArgumentList("
                + "Argument(DeclarationExpression(IdentifierName[\"var\"]"
                + " SingleVariableDesignation[\"x\"]))"
                + " Argument(IdentifierName[\"y\"])))");
    assertThat(parse("f(x: 1)"))
        .isEqualTo(
            "InvocationExpression(IdentifierName[\"f\"] ArgumentList("
                + "Argument(NameColon(IdentifierName[\"x\"]) NumericLiteralExpression[\"1\"])))");
  }

  @Test
  public void lambdas() {
    assertThat(parse("x => x + 1"))
        .isEqualTo(
            "SimpleLambdaExpression(Parameter[\"x\"]"
                + " AddExpression(IdentifierName[\"x\"] NumericLiteralExpression[\"1\"]))");
    assertThat(parse("(a, b) => a"))
        .isEqualTo(
            "ParenthesizedLambdaExpression(ParameterList(Parameter[\"a\"] Parameter[\"b\"])"
                + " IdentifierName[\"a\"])");
    assertThat(parse("(int x) => x"))
        .isEqualTo(
            "ParenthesizedLambdaExpression("
                + "ParameterList(Parameter[\"x\"](PredefinedType[\"int\"]))"
                + " IdentifierName[\"x\"])");
    assertThat(parse("() => { }")).isEqualTo("ParenthesizedLambdaExpression(ParameterList Block)");
    assertThat(parse("async x => x"))
        .isEqualTo("SimpleLambdaExpression(Parameter[\"x\"] IdentifierName[\"x\"])");
  }

  @Test
  public void anonymousMethod() {
    assertThat(parse("delegate (int x) { }"))
        .isEqualTo(
            "AnonymousMethodExpression("
                + "ParameterList(Parameter[\"x\"](PredefinedType[\"int\"])) Block)");
  }

  @Test
  public void conditional() {
    assertThat(parse("a ? b : c"))
        .isEqualTo(
            "ConditionalExpression(IdentifierName[\"a\"] IdentifierName[\"b\"]"
                + " IdentifierName[\"c\"])");
    assertThat(parse("a?.b"))
        .isEqualTo(
            "ConditionalAccessExpression(IdentifierName[\"a\"]"
                + " MemberBindingExpression(IdentifierName[\"b\"]))");
    assertThat(parse("x?[0]"))
        .isEqualTo(
            "ConditionalAccessExpression(IdentifierName[\"x\"] ElementBindingExpression("
                + "BracketedArgumentList(Argument(NumericLiteralExpression[\"0\"]))))");
  }

  @Test
  public void isAndAs() {
    assertThat(parse("x is int"))
        .isEqualTo("IsExpression(IdentifierName[\"x\"] PredefinedType[\"int\"])");
    assertThat(parse("a as string"))
        .isEqualTo("AsExpression(IdentifierName[\"a\"] PredefinedType[\"string\"])");
  }

  @Test
  public void patterns() {
    assertThat(parse("x is int i"))
        .isEqualTo(
            "IsPatternExpression(IdentifierName[\"x\"]"
                + " DeclarationPattern(PredefinedType[\"int\"] SingleVariableDesignation[\"i\"]))");
    assertThat(parse("x is not null"))
        .isEqualTo(
            "IsPatternExpression(IdentifierName[\"x\"]"
                + " NotPattern(ConstantPattern(NullLiteralExpression[\"null\"])))");
    assertThat(parse("x is > 0 and < 10"))
        .isEqualTo(
            "IsPatternExpression(IdentifierName[\"x\"]"
                + " AndPattern(RelationalPattern(NumericLiteralExpression[\"0\"])"
                + " RelationalPattern(NumericLiteralExpression[\"10\"])))");
    assertThat(parse("o is Point { X: 0 } p"))
        .isEqualTo(
            "IsPatternExpression(IdentifierName[\"o\"] RecursivePattern(IdentifierName[\"Point\"]"
                + " PropertyPatternClause(Subpattern(NameColon(IdentifierName[\"X\"])"
                + " ConstantPattern(NumericLiteralExpression[\"0\"])))"
                + " SingleVariableDesignation[\"p\"]))");
    assertThat(parse("x is [1, ..]"))
        .isEqualTo(
            "IsPatternExpression(IdentifierName[\"x\"]"
                + " ListPattern(ConstantPattern(NumericLiteralExpression[\"1\"]) SlicePattern))");
  }

  @Test
  public void switchExpression() {
    assertThat(parse("x switch { 1 => a, _ => b }"))
        .isEqualTo(
            "SwitchExpression(IdentifierName[\"x\"]"
                + " SwitchExpressionArm(ConstantPattern(NumericLiteralExpression[\"1\"])"
                + " IdentifierName[\"a\"])"
                + " SwitchExpressionArm(DiscardPattern IdentifierName[\"b\"]))");
    assertThat(parse("x switch { > 0 => 1, _ => 0, }"))
        .isEqualTo(
            "SwitchExpression(IdentifierName[\"x\"]"
                + " SwitchExpressionArm(RelationalPattern(NumericLiteralExpression[\"0\"])"
                + " NumericLiteralExpression[\"1\"])"
                + " SwitchExpressionArm(DiscardPattern NumericLiteralExpression[\"0\"]))");
  }

  @Test
  public void withExpression() {
    assertThat(parse("p with { X = 1 }"))
        .isEqualTo(
            "WithExpression(IdentifierName[\"p\"]"
                + " WithInitializerExpression(SimpleAssignmentExpression(IdentifierName[\"X\"]"
                + " NumericLiteralExpression[\"1\"])))");
  }

  @Test
  public void objectCreation() {
    assertThat(parse("new List<int> { 1, 2 }"))
        .isEqualTo(
            "ObjectCreationExpression("
                + "GenericName[\"List\"](TypeArgumentList(PredefinedType[\"int\"]))"
                + " CollectionInitializerExpression(NumericLiteralExpression[\"1\"]"
                + " NumericLiteralExpression[\"2\"]))");
    assertThat(parse("new() { X = 1 }"))
        .isEqualTo(
            "ImplicitObjectCreationExpression(ArgumentList"
                + " ObjectInitializerExpression(SimpleAssignmentExpression(IdentifierName[\"X\"]"
                + " NumericLiteralExpression[\"1\"])))");
    assertThat(parse("new { A = 1, b }"))
        .isEqualTo(
            "AnonymousObjectCreationExpression(AnonymousObjectMemberDeclarator("
                + "NameEquals(IdentifierName[\"A\"]) NumericLiteralExpression[\"1\"])"
                + " AnonymousObjectMemberDeclarator(IdentifierName[\"b\"]))");
  }

  @Test
  public void arrayCreation() {
    assertThat(parse("new int[3]"))
        .isEqualTo(
            "ArrayCreationExpression(ArrayType(PredefinedType[\"int\"]"
                + " ArrayRankSpecifier(NumericLiteralExpression[\"3\"])))");
    assertThat(parse("new[] { 1 }"))
        .isEqualTo(
            "ImplicitArrayCreationExpression("
                + "ArrayInitializerExpression(NumericLiteralExpression[\"1\"]))");
  }

  @Test
  public void collectionExpression() {
    assertThat(parse("[1, ..xs]"))
        .isEqualTo(
            "CollectionExpression(ExpressionElement(NumericLiteralExpression[\"1\"])"
                + " SpreadElement(IdentifierName[\"xs\"]))");
  }

  @Test
  public void collectionExpressionRequiresVersion() {
    ParserOptions options =
        ParserOptions.builder().setLanguageVersion(LanguageVersion.CSHARP_11).build();
    ParseError e =
        assertThrows(ParseError.class, () -> Parser.parseExpression("[1, 2]", options));
    assertThat(e.kind()).isEqualTo(ErrorKind.EXPECTED_EXPRESSION);
  }

  @Test
  public void query() {
    assertThat(parse("from x in xs where x > 1 select x"))
        .isEqualTo(
            "QueryExpression(FromClause[\"x\"](IdentifierName[\"xs\"])"
                + " QueryBody(WhereClause(GreaterThanExpression(IdentifierName[\"x\"]"
                + " NumericLiteralExpression[\"1\"])) SelectClause(IdentifierName[\"x\"])))");
    assertThat(parse("from x in xs orderby x descending select x"))
        .isEqualTo(
            "QueryExpression(FromClause[\"x\"](IdentifierName[\"xs\"])"
                + " QueryBody(OrderByClause(DescendingOrdering(IdentifierName[\"x\"]))"
                + " SelectClause(IdentifierName[\"x\"])))");
  }

  @Test
  public void fromAsName() {
    assertThat(parse("from + 1"))
        .isEqualTo("AddExpression(IdentifierName[\"from\"] NumericLiteralExpression[\"1\"])");
  }

  @Test
  public void interpolatedString() {
    assertThat(parse("$\"a{b}c\""))
        .isEqualTo(
            "InterpolatedStringExpression(InterpolatedStringText[\"a\"]"
                + " Interpolation(IdentifierName[\"b\"]) InterpolatedStringText[\"c\"])");
    assertThat(parse("$\"{x:N2}\""))
        .isEqualTo(
            "InterpolatedStringExpression(Interpolation(IdentifierName[\"x\"]"
                + " InterpolationFormatClause[\"N2\"]))");
    assertThat(parse("$\"{x,5}\""))
        .isEqualTo(
            "InterpolatedStringExpression(Interpolation(IdentifierName[\"x\"]"
                + " InterpolationAlignmentClause(NumericLiteralExpression[\"5\"])))");
  }

  @Test
  public void literals() {
    SyntaxNode string = Parser.parseExpression("\"s\"").node();
    assertThat(string.kind()).isEqualTo(SyntaxKind.STRING_LITERAL_EXPRESSION);
    assertThat(string.tokenValue()).isEqualTo("\"s\"");
    assertThat(parse("1.5f")).isEqualTo("NumericLiteralExpression[\"1.5f\"]");
    assertThat(parse("true")).isEqualTo("TrueLiteralExpression[\"true\"]");
    assertThat(parse("default")).isEqualTo("DefaultLiteralExpression[\"default\"]");
    assertThat(parse("'c'").toString()).startsWith("CharacterLiteralExpression");
  }

  @Test
  public void typeOperators() {
    assertThat(parse("typeof(int)")).isEqualTo("TypeOfExpression(PredefinedType[\"int\"])");
    assertThat(parse("default(T)")).isEqualTo("DefaultExpression(IdentifierName[\"T\"])");
    assertThat(parse("checked(x + 1)"))
        .isEqualTo(
            "CheckedExpression(AddExpression(IdentifierName[\"x\"]"
                + " NumericLiteralExpression[\"1\"]))");
  }

  @Test
  public void remaining() {
    Parsed parsed = Parser.parseExpression("a + b; c");
    assertThat(parsed.node().kind()).isEqualTo(SyntaxKind.ADD_EXPRESSION);
    assertThat(parsed.remaining()).isEqualTo("; c");
  }

  @Test
  public void missingOperand() {
    ParseError e = assertThrows(ParseError.class, () -> Parser.parseExpression("a +"));
    assertThat(e.kind()).isEqualTo(ErrorKind.EXPECTED_EXPRESSION);
    assertThat(e.position()).isEqualTo(3);
  }

  @Test
  public void deepNesting() {
    ParserOptions options = ParserOptions.builder().setMaxDepth(32).build();
    String input = Strings.repeat("(", 100) + "x" + Strings.repeat(")", 100);
    ParseError e = assertThrows(ParseError.class, () -> Parser.parseExpression(input, options));
    assertThat(e.kind()).isEqualTo(ErrorKind.NESTING_TOO_DEEP);
  }

  @Test
  public void nestingWithinLimit() {
    String input = Strings.repeat("(", 20) + "x" + Strings.repeat(")", 20);
    SyntaxNode node = Parser.parseExpression(input).node();
    assertThat(node.kind()).isEqualTo(SyntaxKind.PARENTHESIZED_EXPRESSION);
  }
}
