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

import java.util.function.DoubleBinaryOperator;
import org.jscrunch.ast.IR;
import org.jscrunch.ast.Node;
import org.jscrunch.ast.Token;
import org.jscrunch.base.Tri;
import org.jspecify.annotations.Nullable;

/**
 * Evaluation of binary operators over two literal operands, shared by the constant folder and
 * the associative cascade rotator.
 *
 * <p>Every helper returns a new literal, or null when the value cannot be computed safely or
 * folding it is not allowed. A returned literal is detached, except for {@code &&} and {@code
 * ||}, which produce one of their own operands.
 */
abstract class AbstractLiteralFolding extends AbstractPeepholeOptimization {

  /**
   * Folds the binary operator {@code n}, whose operands are both literals, and puts the result in
   * its place.
   *
   * @return the node now standing in place of {@code n}, or null if it was not folded
   */
  protected final @Nullable Node evalThisOperator(Node n) {
    Node literal = evaluate(n);
    if (literal == null) {
      return null;
    }
    Token type = n.getToken();
    if ((type == Token.DIV || type == Token.MOD)
        && CodeGenerator.size(literal) > CodeGenerator.size(n)) {
      // 1/3 is shorter than .3333333333333333
      return null;
    }
    return replaceWithLiteral(n, literal);
  }

  /** Computes the value of the binary operator {@code n} over its two literal operands. */
  final @Nullable Node evaluate(Node n) {
    checkArgument(n.getToken().isBinaryOperator(), n);
    Node left = n.getFirstChild();
    Node right = n.getLastChild();
    switch (n.getToken()) {
      case MUL:
        return multiply(left, right);
      case DIV:
        return divide(left, right);
      case MOD:
        return modulo(left, right);
      case SUB:
        return minus(left, right);
      case ADD:
        return plus(left, right);
      case LSH:
      case RSH:
      case URSH:
        return shift(n.getToken(), left, right);
      case LT:
      case LE:
      case GT:
      case GE:
        return relational(n.getToken(), left, right);
      case EQ:
      case NE:
      case SHEQ:
      case SHNE:
        return equality(n.getToken(), left, right);
      case BITAND:
      case BITOR:
      case BITXOR:
        return bitwise(n.getToken(), left, right);
      case AND:
      case OR:
        return logical(n.getToken(), left, right);
      default:
        return null;
    }
  }

  private boolean isNumericFoldingAllowed() {
    return isAllowed(TreeModification.EVALUATE_NUMERIC_EXPRESSIONS);
  }

  final @Nullable Node multiply(Node left, Node right) {
    return numericFold(left, right, (l, r) -> l * r);
  }

  final @Nullable Node divide(Node left, Node right) {
    return numericFold(left, right, (l, r) -> l / r);
  }

  final @Nullable Node modulo(Node left, Node right) {
    return numericFold(left, right, (l, r) -> l % r);
  }

  final @Nullable Node numericAddition(Node left, Node right) {
    return numericFold(left, right, (l, r) -> l + r);
  }

  final @Nullable Node minus(Node left, Node right) {
    return numericFold(left, right, (l, r) -> l - r);
  }

  /** {@code +}: concatenation when either operand is a string, otherwise addition. */
  final @Nullable Node plus(Node left, Node right) {
    if (left.isStringLit() || right.isStringLit()) {
      return stringConcat(left, right);
    }
    return numericAddition(left, right);
  }

  final @Nullable Node stringConcat(Node left, Node right) {
    if (!isAllowed(TreeModification.COMBINE_ADJACENT_STRING_LITERALS)) {
      return null;
    }
    if (!(left.isStringLit() && right.isStringLit()) && !isNumericFoldingAllowed()) {
      // Turning a number into text is numeric evaluation too.
      return null;
    }
    if (!LiteralCoercion.isOkayToCombine(left) || !LiteralCoercion.isOkayToCombine(right)) {
      return null;
    }
    String l = LiteralCoercion.toDisplayString(left);
    String r = LiteralCoercion.toDisplayString(right);
    if (l == null || r == null) {
      return null;
    }
    return IR.string(l + r);
  }

  /**
   * Applies a numeric operator. When the result cannot be used, operands that are not number
   * literals but have a usable number value are still rewritten as number literals.
   */
  private @Nullable Node numericFold(Node left, Node right, DoubleBinaryOperator op) {
    if (!isNumericFoldingAllowed()) {
      return null;
    }
    if (!LiteralCoercion.isOkayToCombine(left) || !LiteralCoercion.isOkayToCombine(right)) {
      return null;
    }
    Double l = LiteralCoercion.toNumber(left);
    Double r = LiteralCoercion.toNumber(right);
    if (l == null || r == null) {
      return null;
    }
    double result = op.applyAsDouble(l, r);
    if (LiteralCoercion.numberIsOkayToCombine(result)) {
      return IR.number(result);
    }
    normalizeOperand(left, l);
    normalizeOperand(right, r);
    return null;
  }

  private void normalizeOperand(Node operand, double value) {
    if (!operand.isNumber()
        && operand.hasParent()
        && LiteralCoercion.numberIsOkayToCombine(value)) {
      operand.replaceWith(IR.number(value));
      reportChange();
    }
  }

  private @Nullable Node shift(Token type, Node left, Node right) {
    if (!isNumericFoldingAllowed()) {
      return null;
    }
    Long shiftCount = LiteralCoercion.toUint32(right);
    if (shiftCount == null) {
      return null;
    }
    // Only the low five bits count.
    int bits = (int) (shiftCount & 0x1F);
    if (type == Token.URSH) {
      Long lhs = LiteralCoercion.toUint32(left);
      return lhs == null ? null : IR.number(lhs >>> bits);
    }
    Integer lhs = LiteralCoercion.toInt32(left);
    if (lhs == null) {
      return null;
    }
    return IR.number(type == Token.LSH ? lhs << bits : lhs >> bits);
  }

  private @Nullable Node relational(Token type, Node left, Node right) {
    if (!isNumericFoldingAllowed()) {
      return null;
    }
    if (!LiteralCoercion.isOkayToCombine(left) || !LiteralCoercion.isOkayToCombine(right)) {
      return null;
    }
    boolean result;
    if (left.isStringLit() && right.isStringLit()) {
      // Code unit order.
      int c = left.getString().compareTo(right.getString());
      result = compare(type, c < 0, c == 0, c > 0);
    } else {
      Double l = LiteralCoercion.toNumber(left);
      Double r = LiteralCoercion.toNumber(right);
      if (l == null || r == null) {
        return null;
      }
      // Every comparison with NaN is false.
      result = compare(type, l < r, l.doubleValue() == r.doubleValue(), l > r);
    }
    return booleanLiteral(result);
  }

  private static boolean compare(Token type, boolean less, boolean equal, boolean greater) {
    switch (type) {
      case LT:
        return less;
      case LE:
        return less || equal;
      case GT:
        return greater;
      case GE:
        return greater || equal;
      default:
        throw new IllegalArgumentException("Not a relational operator: " + type);
    }
  }

  private @Nullable Node equality(Token type, Node left, Node right) {
    if (!isNumericFoldingAllowed()) {
      return null;
    }
    PrimitiveType leftType = NodeUtil.getLiteralType(left);
    PrimitiveType rightType = NodeUtil.getLiteralType(right);
    boolean strict = type == Token.SHEQ || type == Token.SHNE;
    boolean negate = type == Token.NE || type == Token.SHNE;

    Tri equal;
    if (leftType == rightType) {
      equal = sameTypeEquals(left, right);
    } else if (strict) {
      equal = Tri.FALSE;
    } else if (leftType == PrimitiveType.NULL || rightType == PrimitiveType.NULL) {
      // null is loosely equal only to null and undefined.
      equal = Tri.FALSE;
    } else {
      equal = numericEquals(left, right);
    }
    if (equal == Tri.UNKNOWN) {
      return null;
    }
    return booleanLiteral(negate ? equal == Tri.FALSE : equal == Tri.TRUE);
  }

  private static Tri sameTypeEquals(Node left, Node right) {
    switch (left.getToken()) {
      case NULL:
        return Tri.TRUE;
      case TRUE:
      case FALSE:
        return Tri.forBoolean(left.getToken() == right.getToken());
      case STRINGLIT:
        if (!LiteralCoercion.isOkayToCombine(left) || !LiteralCoercion.isOkayToCombine(right)) {
          return Tri.UNKNOWN;
        }
        return Tri.forBoolean(left.getString().equals(right.getString()));
      case NUMBER:
        return numericEquals(left, right);
      default:
        return Tri.UNKNOWN;
    }
  }

  private static Tri numericEquals(Node left, Node right) {
    if (!LiteralCoercion.isOkayToCombine(left) || !LiteralCoercion.isOkayToCombine(right)) {
      return Tri.UNKNOWN;
    }
    Double l = LiteralCoercion.toNumber(left);
    Double r = LiteralCoercion.toNumber(right);
    if (l == null || r == null) {
      return Tri.UNKNOWN;
    }
    // NaN is unequal to itself; the two zeros are equal.
    return Tri.forBoolean(l.doubleValue() == r.doubleValue());
  }

  private @Nullable Node bitwise(Token type, Node left, Node right) {
    if (!isNumericFoldingAllowed()) {
      return null;
    }
    Integer l = LiteralCoercion.toInt32(left);
    Integer r = LiteralCoercion.toInt32(right);
    if (l == null || r == null) {
      return null;
    }
    switch (type) {
      case BITAND:
        return IR.number(l & r);
      case BITOR:
        return IR.number(l | r);
      case BITXOR:
        return IR.number(l ^ r);
      default:
        throw new IllegalArgumentException("Not a bitwise operator: " + type);
    }
  }

  /** {@code &&} and {@code ||} yield one of their operands, picked by the left one. */
  private @Nullable Node logical(Token type, Node left, Node right) {
    if (!isNumericFoldingAllowed()) {
      return null;
    }
    Tri leftValue = LiteralCoercion.toBoolean(left);
    if (leftValue == Tri.UNKNOWN) {
      return null;
    }
    boolean pickLeft = type == Token.AND ? leftValue == Tri.FALSE : leftValue == Tri.TRUE;
    return pickLeft ? left : right;
  }

  static Node booleanLiteral(boolean value) {
    return value ? IR.trueNode() : IR.falseNode();
  }
}
