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

import static com.google.common.base.Preconditions.checkArgument;

import org.jscrunch.ast.Node;
import org.jscrunch.ast.Token;

/**
 * Negates an expression by pushing the negation as far down as it pays off.
 *
 * <p>{@link #measure} returns how many characters the printed output grows (negative: shrinks)
 * when {@link #apply} negates the same expression. Both walk the expression the same way; only
 * {@code apply} changes the tree. Negating {@code a && b} gives {@code !a || !b}, negating {@code
 * a == b} gives {@code a != b}, and so on.
 *
 * <p>The value of an expression statement is never read, so a logical operator there only needs
 * its left operand negated: {@code a && b;} becomes {@code !a || b;}.
 */
public final class LogicalNot {

  /** Cost of wrapping an expression that needs parentheses after a {@code !}. */
  private static final int WRAP_WITH_PARENS_COST = 3;

  /** Cost of a bare {@code !}. */
  private static final int WRAP_COST = 1;

  private LogicalNot() {}

  /** The change in printed size if {@code n} is negated by {@link #apply}. */
  public static int measure(Node n, CrunchOptions options) {
    return measure(n, NodeUtil.isValueDiscarded(n), options);
  }

  /**
   * Replaces {@code n} by its logical negation.
   *
   * @return the node that took the place of {@code n}, or {@code n} if it was changed in place
   */
  public static Node apply(Node n, CrunchOptions options) {
    checkArgument(n.hasParent(), "detached: %s", n);
    return apply(n, NodeUtil.isValueDiscarded(n), options);
  }

  /**
   * Like {@link #measure(Node, CrunchOptions)}, for an expression that is about to be moved to a
   * position where its value is or is not {@code discarded}.
   */
  static int measure(Node n, boolean discarded, CrunchOptions options) {
    switch (n.getToken()) {
      case EQ:
      case NE:
      case SHEQ:
      case SHNE:
        return 0;

      case COMMA:
        return measure(CommaExpressions.lastValue(n), discarded, options);

      case AND:
      case OR:
        {
          int cost = measure(n.getFirstChild(), false, options);
          if (!discarded) {
            cost += measure(n.getLastChild(), false, options);
          }
          return cost;
        }

      case HOOK:
        {
          Node thenBranch = n.getSecondChild();
          int branches =
              measure(thenBranch, discarded, options)
                  + measure(thenBranch.getNext(), discarded, options);
          return Math.min(WRAP_WITH_PARENS_COST, branches);
        }

      case TRUE:
      case FALSE:
        if (printsAsNot(options)) {
          return 0;
        }
        // "true" <--> "false"
        return n.isTrue() ? 1 : -1;

      case PAREN:
        return Math.min(WRAP_COST, measure(n.getOnlyChild(), discarded, options));

      case NOT:
        {
          // The parentheses around the operand go with the "!".
          Node operand = n.getOnlyChild();
          boolean parens = operand.isParen() || needsParensUnderNot(operand);
          return -(parens ? WRAP_WITH_PARENS_COST : WRAP_COST);
        }

      default:
        return needsParensUnderNot(n) ? WRAP_WITH_PARENS_COST : WRAP_COST;
    }
  }

  static Node apply(Node n, boolean discarded, CrunchOptions options) {
    switch (n.getToken()) {
      case EQ:
        n.setToken(Token.NE);
        return n;
      case NE:
        n.setToken(Token.EQ);
        return n;
      case SHEQ:
        n.setToken(Token.SHNE);
        return n;
      case SHNE:
        n.setToken(Token.SHEQ);
        return n;

      case COMMA:
        apply(CommaExpressions.lastValue(n), discarded, options);
        return n;

      case AND:
      case OR:
        {
          Node right = n.getLastChild();
          apply(n.getFirstChild(), false, options);
          if (!discarded) {
            apply(right, false, options);
          }
          n.setToken(n.isAnd() ? Token.OR : Token.AND);
          return n;
        }

      case HOOK:
        {
          Node thenBranch = n.getSecondChild();
          Node elseBranch = thenBranch.getNext();
          int branches =
              measure(thenBranch, discarded, options) + measure(elseBranch, discarded, options);
          if (branches > WRAP_WITH_PARENS_COST) {
            return wrap(n);
          }
          apply(thenBranch, discarded, options);
          apply(elseBranch, discarded, options);
          return n;
        }

      case TRUE:
        n.setToken(Token.FALSE);
        return n;
      case FALSE:
        n.setToken(Token.TRUE);
        return n;

      case PAREN:
        {
          Node inner = n.getOnlyChild();
          if (measure(inner, discarded, options) > WRAP_COST) {
            return wrap(n);
          }
          Node negated = apply(inner, discarded, options);
          if (NodeUtil.precedence(negated) >= NodeUtil.targetPrecedence(n)) {
            negated.detach();
            n.replaceWith(negated);
            return negated;
          }
          return n;
        }

      case NOT:
        {
          Node operand = n.getOnlyChild();
          if (operand.isParen()) {
            operand = operand.getOnlyChild();
          }
          operand.detach();
          n.replaceWith(operand);
          return operand;
        }

      default:
        return wrap(n);
    }
  }

  /** Whether boolean literals are printed as {@code !0} and {@code !1}. */
  private static boolean printsAsNot(CrunchOptions options) {
    return options.getMinifyCode()
        && options.isModificationAllowed(TreeModification.BOOLEAN_LITERALS_TO_NOT_OPERATORS);
  }

  static boolean needsParensUnderNot(Node n) {
    return !n.isParen() && NodeUtil.precedence(n) < NodeUtil.UNARY_PRECEDENCE;
  }

  /** Puts {@code n} under a new {@code !}. */
  private static Node wrap(Node n) {
    Node not = new Node(Token.NOT);
    n.replaceWith(not);
    not.addChildToBack(n);
    return not;
  }
}
