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

package org.jscrunch.compiler;

/**
 * The independently switchable categories of tree rewrites.
 *
 * @see CrunchOptions#isModificationAllowed(TreeModification)
 */
public enum TreeModification {
  /** Fold arithmetic, comparison, bitwise and logical operators over literals. */
  EVALUATE_NUMERIC_EXPRESSIONS,

  /** Concatenate adjacent string literals joined by {@code +}. */
  COMBINE_ADJACENT_STRING_LITERALS,

  /** {@code [1,2].join("-")} to {@code "1-2"}. */
  EVALUATE_LITERAL_JOINS,

  /** {@code "abc".length} to {@code 3}. */
  EVALUATE_LITERAL_LENGTHS,

  /** {@code true} to {@code !0} and {@code false} to {@code !1}. */
  BOOLEAN_LITERALS_TO_NOT_OPERATORS,

  /** Split comma expression statements where a statement separator is needed anyway. */
  UNFOLD_COMMA_EXPRESSION_STATEMENTS,

  /** Apply the manual property rename table to bracketed member names. */
  PROPERTY_RENAMING,

  /** {@code obj["name"]} to {@code obj.name}. */
  BRACKET_MEMBER_TO_DOT_MEMBER,

  /** {@code x - 0} to {@code +x}. */
  SIMPLIFY_STRING_TO_NUMERIC_CONVERSION,

  /** {@code while(1)} to {@code for(;;)}. */
  CHANGE_WHILE_TO_FOR,

  /** Move a {@code var} right before a new {@code for(;;)} into its initializer. */
  MOVE_VAR_INTO_FOR,

  /** Fuse runs of adjacent expression statements into one comma expression. */
  COMBINE_ADJACENT_EXPRESSION_STATEMENTS,

  /** Push logical negations into conditions when that shortens the output. */
  MINIMIZE_CONDITIONS
}
