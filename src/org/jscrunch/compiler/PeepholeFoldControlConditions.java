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

import org.jscrunch.ast.IR;
import org.jscrunch.ast.Node;
import org.jscrunch.base.Tri;

/**
 * Shortens literal loop and branch conditions. A condition only matters for its truth value, so
 * any literal is written as {@code 1} or {@code 0}; a {@code for} loop drops a true condition and
 * {@code while(1)} becomes {@code for(;;)}.
 */
class PeepholeFoldControlConditions extends AbstractPeepholeOptimization {

  @Override
  Node optimizeSubtree(Node subtree) {
    switch (subtree.getToken()) {
      case IF:
        tryFoldCondition(subtree.getFirstChild());
        return subtree;
      case DO:
        tryFoldCondition(subtree.getLastChild());
        return subtree;
      case FOR:
        tryFoldForCondition(subtree);
        return subtree;
      case WHILE:
        return tryFoldWhile(subtree);
      default:
        return subtree;
    }
  }

  private boolean isConditionFoldingAllowed() {
    return isAllowed(TreeModification.EVALUATE_NUMERIC_EXPRESSIONS);
  }

  /** Rewrites a literal condition as 1 or 0. */
  private void tryFoldCondition(Node cond) {
    if (!isConditionFoldingAllowed()
        || !NodeUtil.isLiteral(cond)
        || !NodeUtil.isNotOneOrPositiveZero(cond)) {
      return;
    }
    Tri value = LiteralCoercion.toBoolean(cond);
    if (value != Tri.UNKNOWN) {
      cond.replaceWith(IR.number(value == Tri.TRUE ? 1 : 0));
      reportChange();
    }
  }

  private void tryFoldForCondition(Node forNode) {
    Node cond = forNode.getSecondChild();
    if (!isConditionFoldingAllowed() || !NodeUtil.isLiteral(cond)) {
      return;
    }
    Tri value = LiteralCoercion.toBoolean(cond);
    if (value == Tri.TRUE) {
      // for(;1;) --> for(;;)
      cond.replaceWith(IR.empty());
      reportChange();
    } else if (value == Tri.FALSE && NodeUtil.isNotOneOrPositiveZero(cond)) {
      cond.replaceWith(IR.number(0));
      reportChange();
    }
  }

  private Node tryFoldWhile(Node n) {
    Node cond = n.getFirstChild();
    if (!NodeUtil.isLiteral(cond)) {
      return n;
    }
    Tri value = LiteralCoercion.toBoolean(cond);
    if (value == Tri.TRUE && isAllowed(TreeModification.CHANGE_WHILE_TO_FOR)) {
      // while(1) --> for(;;)
      Node init = IR.empty();
      Node previous = n.getPrevious();
      if (previous != null
          && previous.isVar()
          && isAllowed(TreeModification.MOVE_VAR_INTO_FOR)) {
        // var i; for(;;) --> for(var i;;)
        init = previous.detach();
      }
      Node body = n.getLastChild().detach();
      Node forNode = IR.forNode(init, IR.empty(), IR.empty(), body);
      n.replaceWith(forNode);
      reportChange();
      return forNode;
    }
    tryFoldCondition(cond);
    return n;
  }
}
