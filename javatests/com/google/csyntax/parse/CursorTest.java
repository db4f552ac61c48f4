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

import com.google.common.collect.ImmutableList;
import com.google.csyntax.diag.SourceFile;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CursorTest {

  @Test
  public void sourceCursor() {
    SourceCursor start = SourceCursor.of("abc");
    SourceCursor next = start.advance();

    assertThat(start.position()).isEqualTo(0);
    assertThat(start.peek()).isEqualTo((int) 'a');
    assertThat(next.peek()).isEqualTo((int) 'b');
    assertThat(next.peek(1)).isEqualTo((int) 'c');
    assertThat(next.peek(2)).isEqualTo(SourceCursor.EOF);
    assertThat(start.sliceTo(next.advance())).isEqualTo("ab");
  }

  @Test
  public void sourceCursorAdvanceIsClamped() {
    SourceCursor end = SourceCursor.of("abc").advance(10);

    assertThat(end.position()).isEqualTo(3);
    assertThat(end.peek()).isEqualTo(SourceCursor.EOF);
  }

  @Test
  public void sliceBackwardsFails() {
    SourceCursor start = SourceCursor.of("abc");
    SourceCursor next = start.advance();

    assertThrows(IllegalArgumentException.class, () -> next.sliceTo(start));
  }

  @Test
  public void tokenCursorIsPersistent() {
    String source = "a + b";
    ImmutableList<SavedToken> tokens = Lexer.tokenize(new SourceFile(null, source));
    TokenCursor start = TokenCursor.of(tokens);
    TokenCursor next = start.advance();

    assertThat(start.token()).isEqualTo(Token.IDENT);
    assertThat(next.token()).isEqualTo(Token.PLUS);
    assertThat(next.previous().text()).isEqualTo("a");
    assertThat(start.peek(10).token()).isEqualTo(Token.EOF);
    assertThat(next.remainingText(source)).isEqualTo("+ b");
  }

  @Test
  public void tokenCursorStopsAtEof() {
    String source = "a";
    TokenCursor end = TokenCursor.of(Lexer.tokenize(new SourceFile(null, source))).advance();

    assertThat(end.atEnd()).isTrue();
    assertThat(end.advance()).isSameInstanceAs(end);
    assertThat(end.remainingText(source)).isEmpty();
  }

  @Test
  public void tokenCursorRequiresEof() {
    assertThrows(IllegalArgumentException.class, () -> TokenCursor.of(ImmutableList.of()));
  }
}
