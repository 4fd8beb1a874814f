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
import org.jscrunch.ast.Token;

/**
 * A peephole optimization that minimizes conditional expressions according to De Morgan's laws.
 * Also rewrites conditional statements and expressions with negated conditions to swap their
 * branches.
 *
 * <p>Examples: {@code if(!a)b();else c(); --> if(a)c();else b();}, {@code !(a==b) --> a!=b},
 * {@code if(!(a&&b))c(); --> if(!a||!b)c();}
 */
class PeepholeMinimizeConditions extends AbstractPeepholeOptimization {

  @Override
  Node optimizeSubtree(Node node) {
    if (!isAllowed(TreeModification.MINIMIZE_CONDITIONS)) {
      return node;
    }
    switch (node.getToken()) {
      case IF:
        if (node.getChildCount() == 3) {
          tryMinimizeCondition(node);
        }
        return node;
      case HOOK:
        tryMinimizeCondition(node);
        return node;
      case NOT:
        return tryPushDownNot(node);
      default:
        return node;
    }
  }

  /**
   * Negates the condition of an if/else statement or a conditional expression and swaps the two
   * branches, when the negated condition prints shorter.
   */
  private void tryMinimizeCondition(Node n) {
    Node cond = n.getFirstChild();
    if (LogicalNot.measure(cond, getOptions()) >= 0) {
      return;
    }
    LogicalNot.apply(cond, getOptions());
    Node thenBranch = n.getSecondChild();
    Node elseBranch = n.getLastChild().detach();
    thenBranch.replaceWith(elseBranch);
    n.addChildToBack(thenBranch);
    reportChange();
  }

  /** !(a==b) --> a!=b, and in a condition also !(a&&b) --> !a||!b and the like. */
  private Node tryPushDownNot(Node not) {
    Node operand = not.getOnlyChild();
    boolean parens = operand.isParen() || LogicalNot.needsParensUnderNot(operand);
    if (operand.isParen()) {
      operand = operand.getOnlyChild();
    }
    if (!isComparison(operand) && !isInBooleanContext(not)) {
      // Anywhere else the value must stay a boolean.
      return not;
    }
    boolean discarded = NodeUtil.isValueDiscarded(not);
    int delta = LogicalNot.measure(operand, discarded, getOptions()) - (parens ? 3 : 1);
    if (delta >= 0) {
      return not;
    }
    operand.detach();
    NodeUtil.replaceCheckParens(not, operand);
    Node result = LogicalNot.apply(operand, discarded, getOptions());
    reportChange();
    return result;
  }

  private static boolean isComparison(Node n) {
    Token type = n.getToken();
    return type == Token.EQ || type == Token.NE || type == Token.SHEQ || type == Token.SHNE;
  }

  /** Whether only the truthiness of the value of {@code n} is used. */
  private static boolean isInBooleanContext(Node n) {
    Node current = n;
    while (true) {
      if (NodeUtil.isValueDiscarded(current)) {
        return true;
      }
      Node parent = current.getParent();
      if (parent == null) {
        return false;
      }
      switch (parent.getToken()) {
        case IF:
        case WHILE:
        case HOOK:
          return current == parent.getFirstChild();
        case DO:
          return current == parent.getLastChild();
        case FOR:
          return current == parent.getSecondChild();
        case NOT:
          return true;
        case AND:
        case OR:
        case PAREN:
        case COMMA:
        case EXPR_LIST:
          // The value flows on to the parent. Non-trailing comma operands were handled above.
          current = parent.isExprList() ? parent.getParent() : parent;
          break;
        default:
          return false;
      }
    }
  }
}
