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
import org.jscrunch.ast.Token;
import org.jscrunch.base.JsDoubles;
import org.jscrunch.base.Tri;
import org.jspecify.annotations.Nullable;

/**
 * Peephole optimization to fold constants (e.g. 1 + 7 --> 8, "a" === 1 --> false).
 *
 * <p>Operators whose operands are not both literals are left to {@link FoldAssociativeCascade}.
 */
class PeepholeFoldConstants extends AbstractLiteralFolding {

  @Override
  @Nullable Node optimizeSubtree(Node subtree) {
    Token type = subtree.getToken();
    switch (type) {
      case EXPR_LIST:
        return tryRemoveDeadLiterals(subtree);

      case HOOK:
        return tryFoldHook(subtree);

      case VOID:
        return tryReduceVoid(subtree);

      case TYPEOF:
        return tryFoldTypeof(subtree);

      case NOT:
      case POS:
      case NEG:
      case BITNOT:
        return tryFoldUnaryOperator(subtree);

      default:
        if (type.isBinaryOperator()) {
          return tryFoldBinaryOperator(subtree);
        }
        return subtree;
    }
  }

  private @Nullable Node tryFoldBinaryOperator(Node n) {
    Token type = n.getToken();
    if (type.isAssignment() || type == Token.IN || type == Token.INSTANCEOF) {
      return n;
    }

    if (type == Token.SHEQ || type == Token.SHNE) {
      Node folded = tryFoldStrictEquality(n);
      if (folded != n) {
        return folded;
      }
    }

    Node left = n.getFirstChild();
    Node right = n.getLastChild();
    if (type == Token.COMMA) {
      return tryFoldComma(n, left, right);
    }

    if (NodeUtil.isLiteral(left) && NodeUtil.isLiteral(right)) {
      Node result = evalThisOperator(n);
      return result != null ? result : n;
    }

    if (type == Token.SUB
        && left.isName()
        && right.isNumber()
        && JsDoubles.isPositiveZero(right.getDouble())
        && isAllowed(TreeModification.SIMPLIFY_STRING_TO_NUMERIC_CONVERSION)) {
      // lookup - 0 --> +lookup
      Node pos = IR.pos(left.detach());
      NodeUtil.replaceCheckParens(n, pos);
      reportChange();
      return pos;
    }
    return n;
  }

  /**
   * When the primitive types of both operands are known, a strict comparison either has a known
   * result (different types) or means the same as the loose one (same types), which is shorter.
   */
  private Node tryFoldStrictEquality(Node n) {
    if (!isAllowed(TreeModification.EVALUATE_NUMERIC_EXPRESSIONS)) {
      return n;
    }
    Node left = n.getFirstChild();
    Node right = n.getLastChild();
    PrimitiveType leftType = NodeUtil.getPrimitiveType(left);
    PrimitiveType rightType = NodeUtil.getPrimitiveType(right);
    if (leftType == PrimitiveType.OTHER || rightType == PrimitiveType.OTHER) {
      return n;
    }
    if (leftType != rightType) {
      if (NodeUtil.mayHaveSideEffects(left) || NodeUtil.mayHaveSideEffects(right)) {
        return n;
      }
      return replaceWithLiteral(n, booleanLiteral(n.getToken() == Token.SHNE));
    }
    n.setToken(n.getToken() == Token.SHEQ ? Token.EQ : Token.NE);
    reportChange();
    return n;
  }

  private @Nullable Node tryFoldComma(Node n, Node left, Node right) {
    if (!NodeUtil.isLiteral(left)) {
      if (NodeUtil.isLiteral(right) && NodeUtil.isValueDiscarded(n)) {
        // f(), 1; --> f();
        NodeUtil.replaceCheckParens(n, left);
        reportChange();
        return left;
      }
      return n;
    }
    if (isCallTarget(n)) {
      // (0, obj.method)() calls without a receiver.
      return n;
    }

    if (NodeUtil.isLiteral(right)) {
      return replaceWithLiteral(n, right);
    }

    if (right.isExprList()) {
      if (!right.hasChildren()) {
        NodeUtil.replaceCheckParens(n, null);
        reportChange();
        return null;
      } else if (right.hasOneChild()) {
        Node only = right.getOnlyChild();
        NodeUtil.replaceCheckParens(n, only);
        reportChange();
        return only;
      }
      // 1, a, b --> a, b
      left.replaceWith(right.removeFirstChild());
      if (right.hasOneChild()) {
        right.replaceWith(right.removeFirstChild());
      }
      reportChange();
      return n;
    }

    NodeUtil.replaceCheckParens(n, right);
    reportChange();
    return right;
  }

  private static boolean isCallTarget(Node n) {
    Node parent = n.getParent();
    Node child = n;
    if (parent != null && parent.isParen()) {
      child = parent;
      parent = parent.getParent();
    }
    return parent != null
        && (parent.isCall() || parent.getToken() == Token.DELPROP)
        && parent.getFirstChild() == child;
  }

  private @Nullable Node tryRemoveDeadLiterals(Node list) {
    if (!list.hasParent() || CommaExpressions.removeDeadLiterals(list) == 0) {
      return list;
    }
    reportChange();
    return CommaExpressions.collapseList(list);
  }

  /** lit ? a : b --> a or b */
  private Node tryFoldHook(Node n) {
    Node cond = n.getFirstChild();
    if (!NodeUtil.isLiteral(cond)
        || !isAllowed(TreeModification.EVALUATE_NUMERIC_EXPRESSIONS)) {
      return n;
    }
    Tri value = LiteralCoercion.toBoolean(cond);
    if (value == Tri.UNKNOWN) {
      return n;
    }
    Node branch = value == Tri.TRUE ? cond.getNext() : n.getLastChild();
    NodeUtil.replaceCheckParens(n, branch);
    reportChange();
    return branch;
  }

  /** void lit --> void 0 */
  private Node tryReduceVoid(Node n) {
    Node child = n.getFirstChild();
    if (NodeUtil.isLiteral(child)
        && !(child.isNumber() && JsDoubles.isPositiveZero(child.getDouble()))
        && isAllowed(TreeModification.EVALUATE_NUMERIC_EXPRESSIONS)) {
      child.replaceWith(IR.number(0));
      reportChange();
    }
    return n;
  }

  /** Folds "typeof" of literals: typeof "a" --> "string". */
  private Node tryFoldTypeof(Node n) {
    if (!isAllowed(TreeModification.EVALUATE_NUMERIC_EXPRESSIONS)) {
      return n;
    }
    String typeName;
    switch (n.getFirstChild().getToken()) {
      case STRINGLIT:
        typeName = "string";
        break;
      case NUMBER:
        typeName = "number";
        break;
      case TRUE:
      case FALSE:
        typeName = "boolean";
        break;
      case NULL:
      case OBJECTLIT:
        typeName = "object";
        break;
      default:
        return n;
    }
    if (n.getFirstChild().isObjectLit() && NodeUtil.mayHaveSideEffects(n.getFirstChild())) {
      return n;
    }
    return replaceWithLiteral(n, IR.string(typeName));
  }

  private Node tryFoldUnaryOperator(Node n) {
    Node operand = n.getFirstChild();
    if (!NodeUtil.isLiteral(operand)
        || !isAllowed(TreeModification.EVALUATE_NUMERIC_EXPRESSIONS)) {
      return n;
    }

    Node result;
    switch (n.getToken()) {
      case NOT:
        {
          if (isAllowed(TreeModification.BOOLEAN_LITERALS_TO_NOT_OPERATORS)
              && operand.isNumber()
              && (operand.getDouble() == 1 || JsDoubles.isPositiveZero(operand.getDouble()))) {
            // !0 and !1 are how boolean literals are printed.
            return n;
          }
          Tri value = LiteralCoercion.toBoolean(operand);
          if (value == Tri.UNKNOWN) {
            return n;
          }
          result = booleanLiteral(value == Tri.FALSE);
          break;
        }
      case POS:
        {
          Double value = LiteralCoercion.toNumber(operand);
          if (value == null || !LiteralCoercion.numberIsOkayToCombine(value)) {
            return n;
          }
          result = IR.number(value);
          break;
        }
      case NEG:
        {
          Double value = LiteralCoercion.toNumber(operand);
          if (value == null || !LiteralCoercion.numberIsOkayToCombine(value)) {
            return n;
          }
          result = IR.number(-value);
          break;
        }
      case BITNOT:
        {
          Integer value = LiteralCoercion.toInt32(operand);
          if (value == null) {
            return n;
          }
          result = IR.number(~value);
          break;
        }
      default:
        return n;
    }
    return replaceWithLiteral(n, result);
  }
}
