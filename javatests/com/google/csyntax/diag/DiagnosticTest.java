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

package com.google.csyntax.diag;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.testing.EqualsTester;
import com.google.csyntax.diag.ParseError.ErrorKind;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class DiagnosticTest {

  private static final SourceFile SOURCE = new SourceFile("Test.cs", "class C {\n  int x\n}\n");

  @Test
  public void message() {
    Diagnostic diagnostic =
        Diagnostic.format(SOURCE, SOURCE.source().indexOf("x"), ErrorKind.EXPECTED_TOKEN, "';'");

    assertThat(diagnostic.kind()).isEqualTo(ErrorKind.EXPECTED_TOKEN);
    assertThat(diagnostic.position()).isEqualTo(16);
    assertThat(diagnostic.args()).containsExactly("';'");
    assertThat(diagnostic.diagnostic())
        .isEqualTo(
            String.join(
                System.lineSeparator(),
                "Test.cs:2: error: expected ';'",
                "  int x",
                "      ^"));
  }

  @Test
  public void defaultPath() {
    SourceFile source = new SourceFile(null, "x");
    Diagnostic diagnostic = Diagnostic.format(source, 0, ErrorKind.INCOMPLETE_MEMBER);

    assertThat(diagnostic.diagnostic()).startsWith("<>:1: error: incomplete member");
  }

  @Test
  public void fromParseError() {
    ParseError error = ParseError.format(SOURCE, 0, ErrorKind.UNEXPECTED_TOKEN, "'class'");

    assertThat(error).hasMessageThat().startsWith("Test.cs:1: error: unexpected token: 'class'");
    assertThat(Diagnostic.of(SOURCE, error))
        .isEqualTo(Diagnostic.format(SOURCE, 0, ErrorKind.UNEXPECTED_TOKEN, "'class'"));
  }

  @Test
  public void equality() {
    new EqualsTester()
        .addEqualityGroup(
            Diagnostic.format(SOURCE, 0, ErrorKind.INCOMPLETE_MEMBER),
            Diagnostic.format(SOURCE, 0, ErrorKind.INCOMPLETE_MEMBER))
        .addEqualityGroup(Diagnostic.format(SOURCE, 1, ErrorKind.INCOMPLETE_MEMBER))
        .addEqualityGroup(Diagnostic.format(SOURCE, 0, ErrorKind.SKIPPED_TOKENS, "'class'"))
        .testEquals();
  }

  @Test
  public void log() {
    DiagnosticLog log = new DiagnosticLog();
    assertThat(log.anyErrors()).isFalse();

    log.withSource(SOURCE).error(0, ErrorKind.INCOMPLETE_MEMBER);
    log.withSource(SOURCE)
        .error(ParseError.format(SOURCE, 6, ErrorKind.EXPECTED_IDENTIFIER, "'C'"));

    assertThat(log.anyErrors()).isTrue();
    assertThat(log.diagnostics()).hasSize(2);
    assertThat(log.diagnostics().get(1).kind()).isEqualTo(ErrorKind.EXPECTED_IDENTIFIER);
  }
}
