/*
 * Copyright 2026 The JsCrunch Authors.
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

package org.jscrunch.ast;

/** The node kinds of a syntax tree. */
public enum Token {
  // Statements and structure.
  SCRIPT,
  BLOCK,
  EXPR_RESULT,
  VAR,
  IF,
  WHILE,
  DO,
  FOR,
  RETURN,
  THROW,
  TRY,
  CATCH,
  SWITCH,
  CASE,
  DEFAULT_CASE,
  BREAK,
  CONTINUE,
  EMPTY,
  FUNCTION,
  PARAM_LIST,

  // Binary operators.
  COMMA,
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
  OR,
  AND,
  BITOR,
  BITXOR,
  BITAND,
  EQ,
  NE,
  SHEQ,
  SHNE,
  LT,
  LE,
  GT,
  GE,
  IN,
  INSTANCEOF,
  LSH,
  RSH,
  URSH,
  ADD,
  SUB,
  MUL,
  DIV,
  MOD,

  // Unary operators.
  NOT,
  BITNOT,
  POS,
  NEG,
  TYPEOF,
  VOID,
  DELPROP,
  INC,
  DEC,

  // Other expressions.
  HOOK,
  PAREN,
  EXPR_LIST,
  CALL,
  NEW,
  GETPROP,
  GETELEM,
  NAME,
  THIS,
  NUMBER,
  STRINGLIT,
  TRUE,
  FALSE,
  NULL,
  REGEXP,
  ARRAYLIT,
  OBJECTLIT,
  STRING_KEY;

  /** If the arity isn't always the same, this function returns -1 */
  public static int arity(Token token) {
    return switch (token) {
      case SCRIPT,
          BLOCK,
          VAR,
          IF,
          FOR,
          RETURN,
          TRY,
          SWITCH,
          PARAM_LIST,
          EXPR_LIST,
          CALL,
          NEW,
          ARRAYLIT,
          OBJECTLIT,
          REGEXP ->
          -1;
      case EMPTY, BREAK, CONTINUE, NAME, THIS, NUMBER, STRINGLIT, TRUE, FALSE, NULL -> 0;
      case EXPR_RESULT,
          THROW,
          DEFAULT_CASE,
          NOT,
          BITNOT,
          POS,
          NEG,
          TYPEOF,
          VOID,
          DELPROP,
          INC,
          DEC,
          PAREN,
          GETPROP,
          STRING_KEY ->
          1;
      case HOOK, FUNCTION -> 3;
      default -> 2;
    };
  }

  /** Whether this token is a binary operator, assignments and the comma included. */
  public boolean isBinaryOperator() {
    return compareTo(COMMA) >= 0 && compareTo(MOD) <= 0;
  }

  /** Whether this token is a simple or compound assignment. */
  public boolean isAssignment() {
    return compareTo(ASSIGN) >= 0 && compareTo(ASSIGN_MOD) <= 0;
  }

  public boolean isUnaryOperator() {
    return compareTo(NOT) >= 0 && compareTo(DEC) <= 0;
  }
}
