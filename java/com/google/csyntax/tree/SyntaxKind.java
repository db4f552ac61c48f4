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

import com.google.common.base.CaseFormat;

/**
 * The kind of a {@link SyntaxNode}.
 *
 * <p>Kinds are named after the productions of the C# grammar; {@link #toString} returns the
 * conventional Roslyn spelling, e.g. {@code RecordStructDeclaration}.
 */
public enum SyntaxKind {
  // Compilation units and namespaces
  COMPILATION_UNIT,
  EXTERN_ALIAS_DIRECTIVE,
  USING_DIRECTIVE,
  NAMESPACE_DECLARATION,
  FILE_SCOPED_NAMESPACE_DECLARATION,
  GLOBAL_STATEMENT,
  NAME_EQUALS,
  NAME_COLON,
  EXPRESSION_COLON,

  // Attributes
  ATTRIBUTE_LIST,
  ATTRIBUTE_TARGET_SPECIFIER,
  ATTRIBUTE,
  ATTRIBUTE_ARGUMENT_LIST,
  ATTRIBUTE_ARGUMENT,

  // Type declarations
  CLASS_DECLARATION,
  STRUCT_DECLARATION,
  INTERFACE_DECLARATION,
  RECORD_DECLARATION,
  RECORD_STRUCT_DECLARATION,
  ENUM_DECLARATION,
  ENUM_MEMBER_DECLARATION,
  DELEGATE_DECLARATION,
  BASE_LIST,
  SIMPLE_BASE_TYPE,
  PRIMARY_CONSTRUCTOR_BASE_TYPE,
  TYPE_PARAMETER_LIST,
  TYPE_PARAMETER,
  TYPE_PARAMETER_CONSTRAINT_CLAUSE,
  CLASS_CONSTRAINT,
  STRUCT_CONSTRAINT,
  CONSTRUCTOR_CONSTRAINT,
  TYPE_CONSTRAINT,
  DEFAULT_CONSTRAINT,
  ALLOWS_CONSTRAINT_CLAUSE,
  REF_STRUCT_CONSTRAINT,

  // Members
  FIELD_DECLARATION,
  EVENT_FIELD_DECLARATION,
  METHOD_DECLARATION,
  CONSTRUCTOR_DECLARATION,
  DESTRUCTOR_DECLARATION,
  PROPERTY_DECLARATION,
  INDEXER_DECLARATION,
  EVENT_DECLARATION,
  OPERATOR_DECLARATION,
  CONVERSION_OPERATOR_DECLARATION,
  INCOMPLETE_MEMBER,
  EXPLICIT_INTERFACE_SPECIFIER,
  BASE_CONSTRUCTOR_INITIALIZER,
  THIS_CONSTRUCTOR_INITIALIZER,
  ACCESSOR_LIST,
  GET_ACCESSOR_DECLARATION,
  SET_ACCESSOR_DECLARATION,
  INIT_ACCESSOR_DECLARATION,
  ADD_ACCESSOR_DECLARATION,
  REMOVE_ACCESSOR_DECLARATION,
  UNKNOWN_ACCESSOR_DECLARATION,
  ARROW_EXPRESSION_CLAUSE,
  EQUALS_VALUE_CLAUSE,
  PARAMETER_LIST,
  BRACKETED_PARAMETER_LIST,
  PARAMETER,
  VARIABLE_DECLARATION,
  VARIABLE_DECLARATOR,

  // Statements
  BLOCK,
  LOCAL_DECLARATION_STATEMENT,
  LOCAL_FUNCTION_STATEMENT,
  EXPRESSION_STATEMENT,
  EMPTY_STATEMENT,
  LABELED_STATEMENT,
  IF_STATEMENT,
  ELSE_CLAUSE,
  WHILE_STATEMENT,
  DO_STATEMENT,
  FOR_STATEMENT,
  FOR_EACH_STATEMENT,
  FOR_EACH_VARIABLE_STATEMENT,
  USING_STATEMENT,
  FIXED_STATEMENT,
  LOCK_STATEMENT,
  CHECKED_STATEMENT,
  UNCHECKED_STATEMENT,
  UNSAFE_STATEMENT,
  RETURN_STATEMENT,
  THROW_STATEMENT,
  BREAK_STATEMENT,
  CONTINUE_STATEMENT,
  GOTO_STATEMENT,
  GOTO_CASE_STATEMENT,
  GOTO_DEFAULT_STATEMENT,
  YIELD_RETURN_STATEMENT,
  YIELD_BREAK_STATEMENT,
  TRY_STATEMENT,
  CATCH_CLAUSE,
  CATCH_DECLARATION,
  CATCH_FILTER_CLAUSE,
  FINALLY_CLAUSE,
  SWITCH_STATEMENT,
  SWITCH_SECTION,
  CASE_SWITCH_LABEL,
  CASE_PATTERN_SWITCH_LABEL,
  DEFAULT_SWITCH_LABEL,
  WHEN_CLAUSE,

  // Types
  IDENTIFIER_NAME,
  GENERIC_NAME,
  TYPE_ARGUMENT_LIST,
  QUALIFIED_NAME,
  ALIAS_QUALIFIED_NAME,
  PREDEFINED_TYPE,
  ARRAY_TYPE,
  ARRAY_RANK_SPECIFIER,
  OMITTED_ARRAY_SIZE_EXPRESSION,
  OMITTED_TYPE_ARGUMENT,
  POINTER_TYPE,
  NULLABLE_TYPE,
  TUPLE_TYPE,
  TUPLE_ELEMENT,
  REF_TYPE,
  SCOPED_TYPE,
  FUNCTION_POINTER_TYPE,
  FUNCTION_POINTER_CALLING_CONVENTION,
  FUNCTION_POINTER_UNMANAGED_CALLING_CONVENTION_LIST,
  FUNCTION_POINTER_UNMANAGED_CALLING_CONVENTION,
  FUNCTION_POINTER_PARAMETER_LIST,
  FUNCTION_POINTER_PARAMETER,

  // Literals
  NUMERIC_LITERAL_EXPRESSION,
  STRING_LITERAL_EXPRESSION,
  UTF8_STRING_LITERAL_EXPRESSION,
  CHARACTER_LITERAL_EXPRESSION,
  TRUE_LITERAL_EXPRESSION,
  FALSE_LITERAL_EXPRESSION,
  NULL_LITERAL_EXPRESSION,
  DEFAULT_LITERAL_EXPRESSION,
  INTERPOLATED_STRING_EXPRESSION,
  INTERPOLATED_STRING_TEXT,
  INTERPOLATION,
  INTERPOLATION_ALIGNMENT_CLAUSE,
  INTERPOLATION_FORMAT_CLAUSE,

  // Primary expressions
  THIS_EXPRESSION,
  BASE_EXPRESSION,
  PARENTHESIZED_EXPRESSION,
  TUPLE_EXPRESSION,
  CAST_EXPRESSION,
  SIMPLE_MEMBER_ACCESS_EXPRESSION,
  POINTER_MEMBER_ACCESS_EXPRESSION,
  CONDITIONAL_ACCESS_EXPRESSION,
  MEMBER_BINDING_EXPRESSION,
  ELEMENT_BINDING_EXPRESSION,
  IMPLICIT_ELEMENT_ACCESS,
  INVOCATION_EXPRESSION,
  ELEMENT_ACCESS_EXPRESSION,
  ARGUMENT_LIST,
  BRACKETED_ARGUMENT_LIST,
  ARGUMENT,
  DECLARATION_EXPRESSION,
  SINGLE_VARIABLE_DESIGNATION,
  PARENTHESIZED_VARIABLE_DESIGNATION,
  DISCARD_DESIGNATION,
  TYPE_OF_EXPRESSION,
  SIZE_OF_EXPRESSION,
  DEFAULT_EXPRESSION,
  CHECKED_EXPRESSION,
  UNCHECKED_EXPRESSION,
  REF_EXPRESSION,
  THROW_EXPRESSION,
  WITH_EXPRESSION,
  SWITCH_EXPRESSION,
  SWITCH_EXPRESSION_ARM,

  // Creation expressions
  OBJECT_CREATION_EXPRESSION,
  IMPLICIT_OBJECT_CREATION_EXPRESSION,
  ARRAY_CREATION_EXPRESSION,
  IMPLICIT_ARRAY_CREATION_EXPRESSION,
  ANONYMOUS_OBJECT_CREATION_EXPRESSION,
  ANONYMOUS_OBJECT_MEMBER_DECLARATOR,
  OBJECT_INITIALIZER_EXPRESSION,
  COLLECTION_INITIALIZER_EXPRESSION,
  ARRAY_INITIALIZER_EXPRESSION,
  COMPLEX_ELEMENT_INITIALIZER_EXPRESSION,
  WITH_INITIALIZER_EXPRESSION,
  STACK_ALLOC_ARRAY_CREATION_EXPRESSION,
  IMPLICIT_STACK_ALLOC_ARRAY_CREATION_EXPRESSION,
  COLLECTION_EXPRESSION,
  EXPRESSION_ELEMENT,
  SPREAD_ELEMENT,

  // Anonymous functions
  SIMPLE_LAMBDA_EXPRESSION,
  PARENTHESIZED_LAMBDA_EXPRESSION,
  ANONYMOUS_METHOD_EXPRESSION,

  // Unary expressions
  POST_INCREMENT_EXPRESSION,
  POST_DECREMENT_EXPRESSION,
  SUPPRESS_NULLABLE_WARNING_EXPRESSION,
  PRE_INCREMENT_EXPRESSION,
  PRE_DECREMENT_EXPRESSION,
  UNARY_PLUS_EXPRESSION,
  UNARY_MINUS_EXPRESSION,
  LOGICAL_NOT_EXPRESSION,
  BITWISE_NOT_EXPRESSION,
  ADDRESS_OF_EXPRESSION,
  POINTER_INDIRECTION_EXPRESSION,
  INDEX_EXPRESSION,
  RANGE_EXPRESSION,
  AWAIT_EXPRESSION,

  // Binary expressions
  ADD_EXPRESSION,
  SUBTRACT_EXPRESSION,
  MULTIPLY_EXPRESSION,
  DIVIDE_EXPRESSION,
  MODULO_EXPRESSION,
  LEFT_SHIFT_EXPRESSION,
  RIGHT_SHIFT_EXPRESSION,
  UNSIGNED_RIGHT_SHIFT_EXPRESSION,
  LOGICAL_OR_EXPRESSION,
  LOGICAL_AND_EXPRESSION,
  BITWISE_OR_EXPRESSION,
  BITWISE_AND_EXPRESSION,
  EXCLUSIVE_OR_EXPRESSION,
  EQUALS_EXPRESSION,
  NOT_EQUALS_EXPRESSION,
  LESS_THAN_EXPRESSION,
  LESS_THAN_OR_EQUAL_EXPRESSION,
  GREATER_THAN_EXPRESSION,
  GREATER_THAN_OR_EQUAL_EXPRESSION,
  IS_EXPRESSION,
  AS_EXPRESSION,
  COALESCE_EXPRESSION,
  IS_PATTERN_EXPRESSION,
  CONDITIONAL_EXPRESSION,

  // Assignments
  SIMPLE_ASSIGNMENT_EXPRESSION,
  ADD_ASSIGNMENT_EXPRESSION,
  SUBTRACT_ASSIGNMENT_EXPRESSION,
  MULTIPLY_ASSIGNMENT_EXPRESSION,
  DIVIDE_ASSIGNMENT_EXPRESSION,
  MODULO_ASSIGNMENT_EXPRESSION,
  AND_ASSIGNMENT_EXPRESSION,
  EXCLUSIVE_OR_ASSIGNMENT_EXPRESSION,
  OR_ASSIGNMENT_EXPRESSION,
  LEFT_SHIFT_ASSIGNMENT_EXPRESSION,
  RIGHT_SHIFT_ASSIGNMENT_EXPRESSION,
  UNSIGNED_RIGHT_SHIFT_ASSIGNMENT_EXPRESSION,
  COALESCE_ASSIGNMENT_EXPRESSION,

  // Query expressions
  QUERY_EXPRESSION,
  FROM_CLAUSE,
  QUERY_BODY,
  WHERE_CLAUSE,
  SELECT_CLAUSE,
  LET_CLAUSE,
  JOIN_CLAUSE,
  JOIN_INTO_CLAUSE,
  ORDER_BY_CLAUSE,
  ASCENDING_ORDERING,
  DESCENDING_ORDERING,
  GROUP_CLAUSE,
  QUERY_CONTINUATION,

  // Patterns
  DECLARATION_PATTERN,
  CONSTANT_PATTERN,
  VAR_PATTERN,
  DISCARD_PATTERN,
  TYPE_PATTERN,
  RECURSIVE_PATTERN,
  POSITIONAL_PATTERN_CLAUSE,
  PROPERTY_PATTERN_CLAUSE,
  SUBPATTERN,
  PARENTHESIZED_PATTERN,
  RELATIONAL_PATTERN,
  NOT_PATTERN,
  AND_PATTERN,
  OR_PATTERN,
  LIST_PATTERN,
  SLICE_PATTERN;

  private final String displayName =
      CaseFormat.UPPER_UNDERSCORE.to(CaseFormat.UPPER_CAMEL, name());

  @Override
  public String toString() {
    return displayName;
  }
}
