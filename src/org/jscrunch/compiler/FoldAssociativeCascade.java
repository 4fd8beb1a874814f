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

import com.google.common.annotations.VisibleForTesting;
import org.jscrunch.ast.Node;
import org.jscrunch.ast.Token;
import org.jspecify.annotations.Nullable;

/**
 * Brings two literals separated by one level of operators together and folds them, e.g. {@code
 * (x * 2) * 3 --> x * 6} and {@code a + "x" + "y" --> a + "xy"}.
 *
 * <p>The operator with one literal operand is the outer node; its other operand is an inner
 * binary operator with a literal on the side next to the outer literal ("near") or on the side
 * away from it ("far"). Each rotation removes one literal, so repeated rotations end.
 *
 * <p>Two inner operators each holding a literal, as in {@code (a * 6) * (5 * b)}, are not
 * combined.
 */
class FoldAssociativeCascade extends AbstractLiteralFolding {

  @Override
  Node optimizeSubtree(Node n) {
    if (!isRotatable(n)) {
      return n;
    }
    Node left = n.getFirstChild();
    Node right = n.getLastChild();
    Node result = null;
    if (NodeUtil.isLiteral(left) && isRotatable(right)) {
      if (NodeUtil.isLiteral(right.getFirstChild())) {
        result = evalToTheRight(n, right, left);
      } else if (NodeUtil.isLiteral(right.getLastChild())) {
        result = evalFarToTheRight(n, right, left);
      }
    } else if (NodeUtil.isLiteral(right) && isRotatable(left)) {
      if (NodeUtil.isLiteral(left.getLastChild())) {
        result = evalToTheLeft(n, left, right);
      } else if (NodeUtil.isLiteral(left.getFirstChild())) {
        result = evalFarToTheLeft(n, left, right);
      }
    }
    return result != null ? result : n;
  }

  private static boolean isRotatable(Node n) {
    switch (n.getToken()) {
      case ADD:
      case SUB:
      case MUL:
      case DIV:
      case BITAND:
      case BITOR:
      case BITXOR:
        return true;
      default:
        return false;
    }
  }

  /** (x op other) op this */
  private @Nullable Node evalToTheLeft(Node n, Node binOp, Node thisLit) {
    Node other = binOp.getLastChild();
    Token outer = n.getToken();
    Token inner = binOp.getToken();
    Node combined = null;
    boolean tryFar = false;

    if (outer == Token.ADD && inner == Token.ADD) {
      if (other.isStringLit()) {
        // x + "a" is a string whatever x is.
        combined = stringConcat(other, thisLit);
      }
    } else if (outer == Token.ADD && inner == Token.SUB) {
      // (x - 5) + 2 --> x - 3
      if (!thisLit.isStringLit()) {
        combined = noOverflow(minus(other, thisLit));
      }
      tryFar = combined == null;
    } else if (outer == Token.SUB && inner == Token.SUB) {
      // (x - 5) - 2 --> x - 7
      combined = noOverflow(numericAddition(other, thisLit));
      tryFar = combined == null;
    } else if ((outer == Token.MUL && inner == Token.MUL)
        || (outer == Token.DIV && inner == Token.DIV)) {
      // (x * 2) * 3 --> x * 6, (x / 2) / 3 --> x / 6
      combined = noMultiplicativeOverOrUnderflow(multiply(other, thisLit), other, thisLit);
    } else if ((outer == Token.MUL && inner == Token.DIV)
        || (outer == Token.DIV && inner == Token.MUL)) {
      // (x / 2) * 6 --> x * 3, (x * 6) / 2 --> x * 3
      Node keep = safeQuotient(other, thisLit);
      Node flip = safeQuotient(thisLit, other);
      int choice = chooseQuotient(keep, flip, other, thisLit);
      if (choice == KEEP) {
        combined = keep;
      } else if (choice == FLIP) {
        binOp.setToken(inner == Token.DIV ? Token.MUL : Token.DIV);
        combined = flip;
      }
    } else if (outer == inner && isBitwise(outer)) {
      combined = evaluateDetached(outer, other, thisLit);
    }

    if (combined != null) {
      return rotateFromLeft(n, binOp, combined);
    }
    if (tryFar && NodeUtil.isLiteral(binOp.getFirstChild())) {
      return evalFarToTheLeft(n, binOp, thisLit);
    }
    return null;
  }

  /** (other op x) op this */
  private @Nullable Node evalFarToTheLeft(Node n, Node binOp, Node thisLit) {
    Node other = binOp.getFirstChild();
    Token outer = n.getToken();
    Token inner = binOp.getToken();
    PrimitiveType thisType = NodeUtil.getLiteralType(thisLit);

    if (outer == Token.ADD && inner == Token.SUB) {
      // (5 - x) + 2 --> 7 - x
      if (thisType != PrimitiveType.STRING && thisType != PrimitiveType.OTHER) {
        return rotateFromRight(n, binOp, noOverflow(numericAddition(other, thisLit)));
      }
    } else if (outer == Token.SUB && inner == Token.SUB) {
      // (5 - x) - 2 --> 3 - x
      return rotateFromRight(n, binOp, noOverflow(minus(other, thisLit)));
    } else if (outer == Token.MUL && (inner == Token.MUL || inner == Token.DIV)) {
      // (2 * x) * 3 --> 6 * x, (2 / x) * 3 --> 6 / x
      return rotateFromRight(
          n, binOp, noMultiplicativeOverOrUnderflow(multiply(other, thisLit), other, thisLit));
    } else if (outer == Token.DIV && inner == Token.DIV) {
      // (6 / x) / 2 --> 3 / x
      Node quotient = safeQuotient(other, thisLit);
      if (quotient != null && isShortEnough(quotient, other, thisLit, false)) {
        return rotateFromRight(n, binOp, quotient);
      }
    } else if (outer == Token.DIV && inner == Token.MUL) {
      // (6 * x) / 2 --> 3 * x, (2 * x) / 6 --> x / 3
      Node keep = safeQuotient(other, thisLit);
      Node flip = safeQuotient(thisLit, other);
      int choice = chooseQuotient(keep, flip, other, thisLit);
      if (choice == KEEP) {
        return rotateFromRight(n, binOp, keep);
      } else if (choice == FLIP) {
        swapOperands(binOp);
        binOp.setToken(Token.DIV);
        return rotateFromLeft(n, binOp, flip);
      }
    }
    return null;
  }

  /** this op (other op x) */
  private @Nullable Node evalToTheRight(Node n, Node binOp, Node thisLit) {
    Node other = binOp.getFirstChild();
    Token outer = n.getToken();
    Token inner = binOp.getToken();
    Node combined = null;
    boolean tryFar = false;

    if (outer == Token.ADD && inner == Token.ADD) {
      // "a" + ("b" + x) --> "ab" + x
      if (other.isStringLit()) {
        return rotateFromRight(n, binOp, stringConcat(thisLit, other));
      }
    } else if (outer == Token.ADD && inner == Token.SUB) {
      // 2 + (5 - x) --> 7 - x
      if (!thisLit.isStringLit()) {
        combined = noOverflow(numericAddition(thisLit, other));
        if (combined != null) {
          return rotateFromRight(n, binOp, combined);
        }
      }
      tryFar = true;
    } else if (outer == Token.SUB && inner == Token.SUB) {
      // 2 - (5 - x) --> x - 3
      combined = noOverflow(minus(other, thisLit));
      if (combined != null) {
        swapOperands(binOp);
        return rotateFromLeft(n, binOp, combined);
      }
      tryFar = true;
    } else if (outer == Token.MUL && (inner == Token.MUL || inner == Token.DIV)) {
      // 2 * (3 * x) --> 6 * x, 2 * (3 / x) --> 6 / x
      return rotateFromRight(
          n, binOp, noMultiplicativeOverOrUnderflow(multiply(thisLit, other), thisLit, other));
    } else if (outer == Token.DIV && inner == Token.MUL) {
      // 6 / (2 * x) --> 3 / x
      Node quotient = safeQuotient(thisLit, other);
      if (quotient != null && isShortEnough(quotient, other, thisLit, true)) {
        binOp.setToken(Token.DIV);
        return rotateFromRight(n, binOp, quotient);
      }
    } else if (outer == Token.DIV && inner == Token.DIV) {
      // 6 / (2 / x) --> 3 * x, 2 / (6 / x) --> x / 3
      Node leftOverRight = safeQuotient(thisLit, other);
      Node rightOverLeft = safeQuotient(other, thisLit);
      int choice = chooseQuotient(leftOverRight, rightOverLeft, other, thisLit);
      if (choice == KEEP) {
        binOp.setToken(Token.MUL);
        return rotateFromRight(n, binOp, leftOverRight);
      } else if (choice == FLIP) {
        swapOperands(binOp);
        return rotateFromLeft(n, binOp, rightOverLeft);
      }
    }

    if (tryFar && NodeUtil.isLiteral(binOp.getLastChild())) {
      return evalFarToTheRight(n, binOp, thisLit);
    }
    return null;
  }

  /** this op (x op other) */
  private @Nullable Node evalFarToTheRight(Node n, Node binOp, Node thisLit) {
    Node other = binOp.getLastChild();
    Token outer = n.getToken();
    Token inner = binOp.getToken();

    if (outer == Token.ADD && inner == Token.SUB) {
      // 2 + (x - 5) --> x - 3
      if (!thisLit.isStringLit()) {
        return rotateFromLeft(n, binOp, noOverflow(minus(other, thisLit)));
      }
    } else if (outer == Token.SUB && inner == Token.SUB) {
      // 2 - (x - 5) --> 7 - x
      Node sum = noOverflow(numericAddition(thisLit, other));
      if (sum != null) {
        swapOperands(binOp);
        return rotateFromRight(n, binOp, sum);
      }
    } else if (outer == Token.MUL && inner == Token.MUL) {
      // 2 * (x * 3) --> x * 6
      return rotateFromLeft(
          n, binOp, noMultiplicativeOverOrUnderflow(multiply(thisLit, other), thisLit, other));
    } else if (outer == Token.MUL && inner == Token.DIV) {
      // 2 * (x / 6) --> x / 3, 6 * (x / 2) --> 3 * x
      Node otherOverThis = safeQuotient(other, thisLit);
      Node thisOverOther = safeQuotient(thisLit, other);
      int choice = chooseQuotient(otherOverThis, thisOverOther, other, thisLit);
      if (choice == KEEP) {
        return rotateFromLeft(n, binOp, otherOverThis);
      } else if (choice == FLIP) {
        swapOperands(binOp);
        binOp.setToken(Token.MUL);
        return rotateFromRight(n, binOp, thisOverOther);
      }
    } else if (outer == Token.DIV && inner == Token.MUL) {
      // 6 / (x * 2) --> 3 / x
      Node quotient = safeQuotient(thisLit, other);
      if (quotient != null && isShortEnough(quotient, other, thisLit, false)) {
        swapOperands(binOp);
        binOp.setToken(Token.DIV);
        return rotateFromRight(n, binOp, quotient);
      }
    } else if (outer == Token.DIV && inner == Token.DIV) {
      // 6 / (x / 2) --> 12 / x
      Node product = noMultiplicativeOverOrUnderflow(multiply(thisLit, other), thisLit, other);
      if (product != null) {
        swapOperands(binOp);
        return rotateFromRight(n, binOp, product);
      }
    }
    return null;
  }

  /** Makes {@code literal} the right operand of {@code binOp} and puts binOp in place of n. */
  private @Nullable Node rotateFromLeft(Node n, Node binOp, @Nullable Node literal) {
    if (literal == null) {
      return null;
    }
    binOp.getLastChild().replaceWith(literal);
    binOp.detach();
    n.replaceWith(binOp);
    reportChange();
    return foldAgain(binOp, binOp.getFirstChild());
  }

  /** Makes {@code literal} the left operand of {@code binOp} and puts binOp in place of n. */
  private @Nullable Node rotateFromRight(Node n, Node binOp, @Nullable Node literal) {
    if (literal == null) {
      return null;
    }
    binOp.getFirstChild().replaceWith(literal);
    binOp.detach();
    n.replaceWith(binOp);
    reportChange();
    return foldAgain(binOp, binOp.getLastChild());
  }

  private Node foldAgain(Node binOp, Node otherOperand) {
    if (NodeUtil.isLiteral(otherOperand)) {
      Node result = evalThisOperator(binOp);
      if (result != null) {
        return result;
      }
    }
    return binOp;
  }

  private static void swapOperands(Node binOp) {
    Node first = binOp.removeFirstChild();
    binOp.addChildToBack(first);
  }

  private static boolean isBitwise(Token type) {
    return type == Token.BITAND || type == Token.BITOR || type == Token.BITXOR;
  }

  /** Applies a bitwise operator to two literals without touching the tree. */
  private @Nullable Node evaluateDetached(Token type, Node left, Node right) {
    Node probe = new Node(type, left.cloneTree(), right.cloneTree());
    return evaluate(probe);
  }

  private static @Nullable Node noOverflow(@Nullable Node result) {
    return result != null && !Double.isInfinite(result.getDouble()) ? result : null;
  }

  /** Rejects infinities, and zero unless an operand is zero. */
  private static @Nullable Node noMultiplicativeOverOrUnderflow(
      @Nullable Node result, Node left, Node right) {
    if (result == null || Double.isInfinite(result.getDouble())) {
      return null;
    }
    if (result.getDouble() == 0 && !isZero(left) && !isZero(right)) {
      return null;
    }
    return result;
  }

  private static boolean isZero(Node literal) {
    Double value = LiteralCoercion.toNumber(literal);
    return value != null && value == 0;
  }

  private @Nullable Node safeQuotient(Node dividend, Node divisor) {
    return noMultiplicativeOverOrUnderflow(divide(dividend, divisor), dividend, divisor);
  }

  static final int NEITHER = 0;
  static final int KEEP = 1;
  static final int FLIP = 2;

  /**
   * Picks between two candidate quotients. The kept form wins only when it is strictly shorter
   * than the flipped one; a tie goes to the flipped form. Whichever wins must not be longer than
   * the two literals it replaces with an operator between them, or nothing is folded.
   */
  @VisibleForTesting
  static int chooseQuotient(@Nullable Node keep, @Nullable Node flip, Node other, Node thisLit) {
    int keepSize = keep == null ? Integer.MAX_VALUE : CodeGenerator.size(keep);
    int flipSize = flip == null ? Integer.MAX_VALUE : CodeGenerator.size(flip);
    int limit = CodeGenerator.size(other) + CodeGenerator.size(thisLit) + 1;
    if (keep != null && (flip == null || keepSize < flipSize)) {
      return keepSize <= limit ? KEEP : NEITHER;
    }
    if (flip != null && flipSize <= limit) {
      return FLIP;
    }
    return NEITHER;
  }

  private static boolean isShortEnough(Node quotient, Node other, Node thisLit, boolean strict) {
    int size = CodeGenerator.size(quotient);
    int limit = CodeGenerator.size(other) + CodeGenerator.size(thisLit) + 1;
    return strict ? size < limit : size <= limit;
  }
}
