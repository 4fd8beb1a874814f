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

import java.util.ArrayList;
import java.util.List;
import org.jscrunch.ast.IR;
import org.jscrunch.ast.Node;
import org.jspecify.annotations.Nullable;

/**
 * Splits a comma expression statement into several statements where a statement separator can
 * not be avoided anyway: {@code a(), b(); --> a(); b();}. Operands that can not start a statement
 * stay with the operand before them. Statements that would consist of a single literal are
 * dropped.
 */
class UnfoldCommaStatements extends AbstractPeepholeOptimization {

  @Override
  @Nullable Node optimizeSubtree(Node n) {
    if (!n.isExprResult()
        || !n.getFirstChild().isComma()
        || !isAllowed(TreeModification.UNFOLD_COMMA_EXPRESSION_STATEMENTS)
        || !isSeparatorNeeded(n)) {
      return n;
    }
    List<List<Node>> groups = splitIntoStatements(n.getFirstChild());
    if (groups.size() < 2) {
      return n;
    }

    @Nullable Node last = null;
    for (List<Node> group : groups) {
      if (group.size() == 1 && NodeUtil.isLiteral(group.get(0))) {
        // A literal statement does nothing.
        continue;
      }
      List<Node> detached = new ArrayList<>();
      for (Node item : group) {
        detached.add(item.detach());
      }
      last = IR.exprResult(CommaExpressions.build(detached));
      last.insertBefore(n);
    }
    n.detach();
    reportChange();
    return last;
  }

  /**
   * Groups the operands of {@code comma}. Each operand that may start a statement begins a new
   * group.
   */
  private static List<List<Node>> splitIntoStatements(Node comma) {
    List<List<Node>> groups = new ArrayList<>();
    List<Node> current = null;
    for (Node item : CommaExpressions.flatten(comma)) {
      if (current == null || StatementStartCheck.isSafeAtStatementStart(item)) {
        current = new ArrayList<>();
        groups.add(current);
      }
      current.add(item);
    }
    return groups;
  }

  /**
   * Whether the statement {@code n} needs a separator of its own wherever it is: at the top level,
   * in a function, try, catch or case body, or in a block holding other statements.
   */
  private static boolean isSeparatorNeeded(Node n) {
    Node block = n.getParent();
    if (block == null) {
      return false;
    }
    if (block.isScript()) {
      return true;
    }
    if (!block.isBlock()) {
      return false;
    }
    if (block.getChildCount() > 1) {
      return true;
    }
    Node owner = block.getParent();
    if (owner == null) {
      return true;
    }
    switch (owner.getToken()) {
      case FUNCTION:
      case TRY:
      case CATCH:
      case CASE:
      case DEFAULT_CASE:
        return true;
      default:
        return false;
    }
  }
}
