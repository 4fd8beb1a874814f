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

import org.jscrunch.ast.Node;

/**
 * Decides whether an expression can begin an expression statement. Printed first in a statement,
 * {@code function} and <code>{</code> would start a declaration and a block instead.
 */
final class StatementStartCheck {

  private StatementStartCheck() {}

  /** Whether the leftmost token of {@code n} is safe at the start of a statement. */
  static boolean isSafeAtStatementStart(Node n) {
    Node current = n;
    while (true) {
      switch (current.getToken()) {
        case FUNCTION:
        case OBJECTLIT:
          return false;
        case CALL:
        case GETPROP:
        case GETELEM:
        case HOOK:
        case COMMA:
          current = current.getFirstChild();
          break;
        case EXPR_LIST:
          if (!current.hasChildren()) {
            return true;
          }
          current = current.getFirstChild();
          break;
        case INC:
        case DEC:
          if (!current.isPostfix()) {
            return true;
          }
          current = current.getFirstChild();
          break;
        default:
          if (current.getToken().isBinaryOperator()) {
            current = current.getFirstChild();
            break;
          }
          return true;
      }
    }
  }
}
