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

import static java.util.Objects.requireNonNull;

/** Source text attached to a token that does not contribute to the syntax tree. */
public record Trivia(Trivia.Kind kind, String text) {

  /** The kind of trivia. */
  public enum Kind {
    WHITESPACE,
    END_OF_LINE,
    COMMENT,
    DIRECTIVE,
    DISABLED_TEXT,
    SKIPPED_TEXT
  }

  public Trivia {
    requireNonNull(kind);
    requireNonNull(text);
  }
}
