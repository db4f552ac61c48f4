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

import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;

/**
 * C# tokens.
 *
 * <p>Only reserved keywords have their own token kind. Contextual keywords ({@code record}, {@code
 * var}, {@code where}, ...) are lexed as {@link #IDENT}; the grammar decides their role.
 */
public enum Token {
  IDENT,
  LPAREN("("),
  RPAREN(")"),
  LBRACE("{"),
  RBRACE("}"),
  LBRACK("["),
  RBRACK("]"),
  EOF,
  SEMI(";"),
  COMMA(","),
  DOT("."),
  DOTDOT(".."),
  INT_LITERAL,
  UINT_LITERAL,
  LONG_LITERAL,
  ULONG_LITERAL,
  FLOAT_LITERAL,
  DOUBLE_LITERAL,
  DECIMAL_LITERAL,
  CHAR_LITERAL,
  STRING_LITERAL,
  RAW_STRING_LITERAL,
  UTF8_STRING_LITERAL,
  INTERPOLATED_STRING,
  EQ("=="),
  ASSIGN("="),
  LAMBDA("=>"),
  GT(">"),
  GTE(">="),
  LTLT("<<"),
  LTLTE("<<="),
  LT("<"),
  LTE("<="),
  NOT("!"),
  NOTEQ("!="),
  TILDE("~"),
  COND("?"),
  QUESTIONQUESTION("??"),
  QUESTIONQUESTIONEQ("??="),
  COLON(":"),
  COLONCOLON("::"),
  MINUS("-"),
  DECR("--"),
  MINUSEQ("-="),
  ARROW("->"),
  ANDAND("&&"),
  ANDEQ("&="),
  AND("&"),
  OR("|"),
  OROR("||"),
  OREQ("|="),
  PLUS("+"),
  INCR("++"),
  PLUSEQ("+="),
  MULT("*"),
  MULTEQ("*="),
  DIV("/"),
  DIVEQ("/="),
  MOD("%"),
  MODEQ("%="),
  XOR("^"),
  XOREQ("^="),
  ABSTRACT("abstract"),
  AS("as"),
  BASE("base"),
  BOOL("bool"),
  BREAK("break"),
  BYTE("byte"),
  CASE("case"),
  CATCH("catch"),
  CHAR("char"),
  CHECKED("checked"),
  CLASS("class"),
  CONST("const"),
  CONTINUE("continue"),
  DECIMAL("decimal"),
  DEFAULT("default"),
  DELEGATE("delegate"),
  DO("do"),
  DOUBLE("double"),
  ELSE("else"),
  ENUM("enum"),
  EVENT("event"),
  EXPLICIT("explicit"),
  EXTERN("extern"),
  FALSE("false"),
  FINALLY("finally"),
  FIXED("fixed"),
  FLOAT("float"),
  FOR("for"),
  FOREACH("foreach"),
  GOTO("goto"),
  IF("if"),
  IMPLICIT("implicit"),
  IN("in"),
  INT("int"),
  INTERFACE("interface"),
  INTERNAL("internal"),
  IS("is"),
  LOCK("lock"),
  LONG("long"),
  NAMESPACE("namespace"),
  NEW("new"),
  NULL("null"),
  OBJECT("object"),
  OPERATOR("operator"),
  OUT("out"),
  OVERRIDE("override"),
  PARAMS("params"),
  PRIVATE("private"),
  PROTECTED("protected"),
  PUBLIC("public"),
  READONLY("readonly"),
  REF("ref"),
  RETURN("return"),
  SBYTE("sbyte"),
  SEALED("sealed"),
  SHORT("short"),
  SIZEOF("sizeof"),
  STACKALLOC("stackalloc"),
  STATIC("static"),
  STRING("string"),
  STRUCT("struct"),
  SWITCH("switch"),
  THIS("this"),
  THROW("throw"),
  TRUE("true"),
  TRY("try"),
  TYPEOF("typeof"),
  UINT("uint"),
  ULONG("ulong"),
  UNCHECKED("unchecked"),
  UNSAFE("unsafe"),
  USHORT("ushort"),
  USING("using"),
  VIRTUAL("virtual"),
  VOID("void"),
  VOLATILE("volatile"),
  WHILE("while");

  private static final ImmutableMap<String, Token> KEYWORDS;

  static {
    ImmutableMap.Builder<String, Token> keywords = ImmutableMap.builder();
    for (Token token : values()) {
      if (token.value != null && Character.isLetter(token.value.charAt(0))) {
        keywords.put(token.value, token);
      }
    }
    KEYWORDS = keywords.buildOrThrow();
  }

  /** Returns the keyword token spelled by {@code text}, or {@code null} for non-keywords. */
  static @Nullable Token keyword(String text) {
    return KEYWORDS.get(text);
  }

  private final @Nullable String value;

  Token() {
    this(null);
  }

  Token(@Nullable String value) {
    this.value = value;
  }

  /** The fixed spelling of the token, or {@code null} for identifiers, literals and EOF. */
  public @Nullable String spelling() {
    return value;
  }

  /** Returns true for reserved keywords. */
  public boolean isKeyword() {
    return value != null && Character.isLetter(value.charAt(0));
  }

  /** Returns true for literal tokens. */
  public boolean isLiteral() {
    switch (this) {
      case INT_LITERAL:
      case UINT_LITERAL:
      case LONG_LITERAL:
      case ULONG_LITERAL:
      case FLOAT_LITERAL:
      case DOUBLE_LITERAL:
      case DECIMAL_LITERAL:
      case CHAR_LITERAL:
      case STRING_LITERAL:
      case RAW_STRING_LITERAL:
      case UTF8_STRING_LITERAL:
      case INTERPOLATED_STRING:
      case TRUE:
      case FALSE:
      case NULL:
        return true;
      default:
        return false;
    }
  }

  /** Returns true for the keywords that name predefined types. */
  public boolean isPredefinedType() {
    switch (this) {
      case BOOL:
      case BYTE:
      case SBYTE:
      case SHORT:
      case USHORT:
      case INT:
      case UINT:
      case LONG:
      case ULONG:
      case CHAR:
      case FLOAT:
      case DOUBLE:
      case DECIMAL:
      case STRING:
      case OBJECT:
      case VOID:
        return true;
      default:
        return false;
    }
  }

  @Override
  public String toString() {
    if (value != null) {
      return String.format("%s(%s)", name(), value);
    }
    return name();
  }
}
