/*
 * Copyright 2026 The Closure Compiler Authors.
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

package com.google.javascript.gas.ast;

/** The kind tag of an AST {@link Node}. */
public enum Token {
  SCRIPT,
  BLOCK,
  EXPR_RESULT,
  EMPTY,

  VAR,
  LET,
  CONST,
  DESTRUCTURING_LHS,

  IF,
  FOR,
  FOR_IN,
  FOR_OF,
  FOR_AWAIT_OF,
  DO,
  WHILE,
  SWITCH,
  CASE,
  DEFAULT_CASE,
  BREAK,
  CONTINUE,
  RETURN,
  THROW,
  TRY,
  CATCH,
  LABEL,
  LABEL_NAME,
  DEBUGGER,
  WITH,

  FUNCTION,
  PARAM_LIST,
  CLASS,
  CLASS_MEMBERS,
  MEMBER_FUNCTION_DEF,
  MEMBER_FIELD_DEF,
  GETTER_DEF,
  SETTER_DEF,
  COMPUTED_PROP,

  IMPORT,
  IMPORT_SPECS,
  IMPORT_SPEC,
  IMPORT_STAR,
  EXPORT,
  EXPORT_SPECS,
  EXPORT_SPEC,

  NAME,
  STRINGLIT,
  NUMBER,
  BIGINT,
  TRUE,
  FALSE,
  NULL,
  THIS,
  SUPER,
  REGEXP,
  ARRAYLIT,
  OBJECTLIT,
  STRING_KEY,
  TEMPLATELIT, // template literal, e.g: `bar`
  TEMPLATELIT_SUB, // template literal substitution
  TEMPLATELIT_STRING, // template literal string
  TAGGED_TEMPLATELIT, // tagged template literal, e.g. foo`bar`
  NEW_TARGET, // new.target
  IMPORT_META, // import.meta
  DYNAMIC_IMPORT,

  GETPROP,
  GETELEM,
  OPTCHAIN_GETPROP,
  OPTCHAIN_GETELEM,
  OPTCHAIN_CALL,
  CALL,
  NEW,
  HOOK,
  COMMA,
  YIELD,
  AWAIT,

  ASSIGN,
  ASSIGN_BITOR,
  ASSIGN_BITXOR,
  ASSIGN_BITAND,
  ASSIGN_LSH,
  ASSIGN_RSH,
  ASSIGN_URSH,
  ASSIGN_ADD,
  ASSIGN_SUB,
  ASSIGN_MUL,
  ASSIGN_DIV,
  ASSIGN_MOD,
  ASSIGN_EXPONENT,
  ASSIGN_OR,
  ASSIGN_AND,
  ASSIGN_COALESCE,

  OR,
  AND,
  COALESCE,
  BITOR,
  BITXOR,
  BITAND,
  EQ,
  NE,
  SHEQ,
  SHNE,
  LT,
  GT,
  LE,
  GE,
  INSTANCEOF,
  IN,
  LSH,
  RSH,
  URSH,
  ADD,
  SUB,
  MUL,
  DIV,
  MOD,
  EXPONENT,

  NOT,
  BITNOT,
  POS,
  NEG,
  TYPEOF,
  VOID,
  DELPROP,
  INC,
  DEC,

  ITER_SPREAD, // Spreads that use the iterator protocol.
  ITER_REST,
  OBJECT_SPREAD, // Spreads that get object properties.
  OBJECT_REST,
  DEFAULT_VALUE, // Formal parameter or destructuring element with a default value
  OBJECT_PATTERN,
  ARRAY_PATTERN,

  // TypeScript
  ENUM,
  ENUM_MEMBERS,
  NAMESPACE,
  NAMESPACE_ELEMENTS,
  IMPORT_EQUALS, // import x = A.B; import x = require("m");
  EXPORT_ASSIGN, // export = x;
  DECORATOR,

  // Emits nothing but the comments attached to it.
  NOT_EMITTED;

  /** If the arity isn't always the same, this function returns -1 */
  public static int arity(Token token) {
    return switch (token) {
      case ARRAYLIT,
          BLOCK,
          BREAK,
          CALL,
          CLASS_MEMBERS,
          CONST,
          CONTINUE,
          DEBUGGER,
          DESTRUCTURING_LHS,
          ENUM_MEMBERS,
          EXPORT,
          EXPORT_SPECS,
          FOR,
          IF,
          IMPORT_SPECS,
          LET,
          MEMBER_FIELD_DEF,
          NAMESPACE_ELEMENTS,
          NEW,
          OBJECTLIT,
          OBJECT_PATTERN,
          ARRAY_PATTERN,
          OPTCHAIN_CALL,
          PARAM_LIST,
          RETURN,
          SCRIPT,
          STRING_KEY,
          SWITCH,
          TEMPLATELIT,
          TRY,
          VAR,
          YIELD ->
          -1;
      case EMPTY,
          FALSE,
          IMPORT_META,
          IMPORT_STAR,
          LABEL_NAME,
          NAME,
          NEW_TARGET,
          NOT_EMITTED,
          NULL,
          NUMBER,
          BIGINT,
          REGEXP,
          STRINGLIT,
          SUPER,
          TEMPLATELIT_STRING,
          THIS,
          TRUE ->
          0;
      case AWAIT,
          BITNOT,
          DEC,
          DECORATOR,
          DEFAULT_CASE,
          DELPROP,
          DYNAMIC_IMPORT,
          EXPORT_ASSIGN,
          EXPR_RESULT,
          GETPROP,
          GETTER_DEF,
          INC,
          ITER_REST,
          ITER_SPREAD,
          MEMBER_FUNCTION_DEF,
          NEG,
          NOT,
          OBJECT_REST,
          OBJECT_SPREAD,
          OPTCHAIN_GETPROP,
          POS,
          SETTER_DEF,
          TEMPLATELIT_SUB,
          THROW,
          TYPEOF,
          VOID ->
          1;
      case ADD,
          AND,
          ASSIGN,
          ASSIGN_ADD,
          ASSIGN_BITAND,
          ASSIGN_BITOR,
          ASSIGN_BITXOR,
          ASSIGN_DIV,
          ASSIGN_LSH,
          ASSIGN_MOD,
          ASSIGN_MUL,
          ASSIGN_EXPONENT,
          ASSIGN_RSH,
          ASSIGN_SUB,
          ASSIGN_URSH,
          ASSIGN_OR,
          ASSIGN_AND,
          ASSIGN_COALESCE,
          BITAND,
          BITOR,
          BITXOR,
          CASE,
          CATCH,
          COALESCE,
          COMMA,
          COMPUTED_PROP,
          DEFAULT_VALUE,
          DIV,
          DO,
          ENUM,
          EQ,
          EXPONENT,
          EXPORT_SPEC,
          GE,
          GETELEM,
          GT,
          IMPORT_EQUALS,
          IMPORT_SPEC,
          IN,
          INSTANCEOF,
          LABEL,
          LE,
          LSH,
          LT,
          MOD,
          MUL,
          NAMESPACE,
          NE,
          OPTCHAIN_GETELEM,
          OR,
          RSH,
          SHEQ,
          SHNE,
          SUB,
          TAGGED_TEMPLATELIT,
          URSH,
          WHILE,
          WITH ->
          2;
      case CLASS, FOR_IN, FOR_OF, FOR_AWAIT_OF, FUNCTION, HOOK, IMPORT -> 3;
    };
  }
}
