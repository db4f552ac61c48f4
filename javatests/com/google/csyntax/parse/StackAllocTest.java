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
import com.google.csyntax.tree.SyntaxKind;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class StackAllocTest {

  @Test
  public void sized() {
    assertThat(Parser.parseStackAlloc("stackalloc int[10]").node().toString())
        .isEqualTo(
            "StackAllocArrayCreationExpression(ArrayType(PredefinedType[\"int\"]"
                + " ArrayRankSpecifier(NumericLiteralExpression[\"10\"])))");
  }

  @Test
  public void initialized() {
    assertThat(Parser.parseStackAlloc("stackalloc int[] { 1 }").node().toString())
        .isEqualTo(
            "StackAllocArrayCreationExpression(ArrayType(PredefinedType[\"int\"]"
                + " ArrayRankSpecifier(OmittedArraySizeExpression))"
                + " ArrayInitializerExpression(NumericLiteralExpression[\"1\"]))");
  }

  @Test
  public void implicitlyTyped() {
    assertThat(Parser.parseStackAlloc("stackalloc[] { 1, 2, 3 }").node().toString())
        .isEqualTo(
            "ImplicitStackAllocArrayCreationExpression(ArrayInitializerExpression("
                + "NumericLiteralExpression[\"1\"] NumericLiteralExpression[\"2\"]"
                + " NumericLiteralExpression[\"3\"]))");
  }

  @Test
  public void sizeExpression() {
    assertThat(Parser.parseStackAlloc("stackalloc byte[n * 2]").node().toString())
        .isEqualTo(
            "StackAllocArrayCreationExpression(ArrayType(PredefinedType[\"byte\"]"
                + " ArrayRankSpecifier(MultiplyExpression(IdentifierName[\"n\"]"
                + " NumericLiteralExpression[\"2\"]))))");
  }

  @Test
  public void insideExpression() {
    assertThat(Parser.parseExpression("stackalloc int[2]").node().kind())
        .isEqualTo(SyntaxKind.STACK_ALLOC_ARRAY_CREATION_EXPRESSION);
  }

  @Test
  public void neitherSizeNorInitializer() {
    assertInvalid("stackalloc int[]");
  }

  @Test
  public void sizeAndInitializer() {
    assertInvalid("stackalloc int[3] { 1 }");
  }

  @Test
  public void implicitWithSize() {
    assertInvalid("stackalloc[3] { 1 }");
  }

  @Test
  public void implicitWithoutInitializer() {
    assertInvalid("stackalloc[]");
  }

  @Test
  public void missingRank() {
    ParseError e = assertThrows(ParseError.class, () -> Parser.parseStackAlloc("stackalloc int"));
    assertThat(e.kind()).isEqualTo(ErrorKind.EXPECTED_TOKEN);
  }

  @Test
  public void notStackAlloc() {
    assertThrows(ParseError.class, () -> Parser.parseStackAlloc("new int[3]"));
  }

  private static void assertInvalid(String input) {
    ParseError e = assertThrows(ParseError.class, () -> Parser.parseStackAlloc(input));
    assertThat(e.kind()).isEqualTo(ErrorKind.INVALID_STACKALLOC);
  }
}
