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

/**
 * Tries to fuse all the statements in a block into a one statement by using COMMAs.
 *
 * <p>Only the bodies of {@code if} and loop statements are fused: there a single statement lets
 * the printer drop the braces. Elsewhere a statement separator is needed anyway and the final
 * pass would split the expression again.
 */
class StatementFusion extends AbstractPeepholeOptimization {

  @Override
  Node optimizeSubtree(Node n) {
    if (!n.isBlock()
        || !isAllowed(TreeModification.COMBINE_ADJACENT_EXPRESSION_STATEMENTS)
        || !isFusableBlock(n)) {
      return n;
    }
    fuseBlock(n);
    reportChange();
    return n;
  }

  private static boolean isFusableBlock(Node block) {
    Node parent = block.getParent();
    if (parent == null) {
      return false;
    }
    switch (parent.getToken()) {
      case IF:
      case WHILE:
      case DO:
      case FOR:
        break;
      default:
        return false;
    }
    if (block.getChildCount() < 2) {
      return false;
    }
    for (Node c = block.getFirstChild(); c != null; c = c.getNext()) {
      if (!c.isExprResult()) {
        return false;
      }
    }
    return true;
  }

  /** Replaces the statements of {@code block} by one expression statement. */
  private static void fuseBlock(Node block) {
    List<Node> exprs = new ArrayList<>();
    while (block.hasChildren()) {
      Node statement = block.removeFirstChild();
      exprs.add(statement.removeFirstChild());
    }
    block.addChildToBack(IR.exprResult(CommaExpressions.combineWithComma(exprs)));
  }
}
