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

package com.google.csyntax.tree;

import com.google.common.base.Strings;
import com.google.common.escape.Escaper;
import com.google.common.escape.Escapers;

/** A pretty-printer for {@link SyntaxNode}s. */
public class Pretty {

  private static final Escaper ESCAPER =
      Escapers.builder()
          .addEscape('\\', "\\\\")
          .addEscape('\n', "\\n")
          .addEscape('\r', "\\r")
          .addEscape('\t', "\\t")
          .addEscape('"', "\\\"")
          .build();

  /**
   * Renders a tree with one node per line, children indented below their parent:
   *
   * <pre>{@code
   * CompilationUnit
   *   RecordDeclaration "C"
   *     ParameterList
   * }</pre>
   */
  public static String pretty(SyntaxNode node) {
    Pretty pretty = new Pretty();
    pretty.printTree(node);
    return pretty.sb.toString();
  }

  /**
   * Renders a tree on a single line, e.g. {@code
   * RecordDeclaration["C"](ParameterList(Parameter["X"](PredefinedType["int"])))}.
   */
  public static String compact(SyntaxNode node) {
    Pretty pretty = new Pretty();
    pretty.printCompact(node);
    return pretty.sb.toString();
  }

  private final StringBuilder sb = new StringBuilder();
  private int indent = 0;

  private void printTree(SyntaxNode node) {
    sb.append(Strings.repeat(" ", indent * 2)).append(node.kind());
    String value = node.tokenValue();
    if (value != null) {
      sb.append(' ');
      quote(value);
    }
    sb.append('\n');
    indent++;
    for (SyntaxNode child : node.children()) {
      printTree(child);
    }
    indent--;
  }

  private void printCompact(SyntaxNode node) {
    sb.append(node.kind());
    String value = node.tokenValue();
    if (value != null) {
      sb.append('[');
      quote(value);
      sb.append(']');
    }
    if (node.children().isEmpty()) {
      return;
    }
    sb.append('(');
    boolean first = true;
    for (SyntaxNode child : node.children()) {
      if (!first) {
        sb.append(' ');
      }
      first = false;
      printCompact(child);
    }
    sb.append(')');
  }

  private void quote(String value) {
    sb.append('"').append(ESCAPER.escape(value)).append('"');
  }
}
