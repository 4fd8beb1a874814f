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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import org.jscrunch.ast.IR;
import org.jscrunch.ast.Node;
import org.jscrunch.ast.Token;
import org.jscrunch.base.JsDoubles;
import org.jspecify.annotations.Nullable;

/** NodeUtil contains generally useful AST utilities. */
public final class NodeUtil {

  /** Precedence of a comma expression. */
  static final int COMMA_PRECEDENCE = 0;

  /** Precedence of assignments; the lowest an argument or list element may have. */
  static final int ASSIGNMENT_PRECEDENCE = 1;

  static final int HOOK_PRECEDENCE = 3;

  static final int OR_PRECEDENCE = 4;

  static final int UNARY_PRECEDENCE = 16;

  static final int UPDATE_PRECEDENCE = 17;

  /** Precedence of member accesses, calls and primary expressions. */
  static final int PRIMARY_PRECEDENCE = 18;

  // Non-instantiable
  private NodeUtil() {}

  /**
   * The precedence of an operator token. Higher binds tighter. Tokens that are not expressions
   * have the precedence of a primary expression.
   */
  public static int precedence(Token type) {
    switch (type) {
      case COMMA:
        return COMMA_PRECEDENCE;
      case ASSIGN:
      case ASSIGN_BITOR:
      case ASSIGN_BITXOR:
      case ASSIGN_BITAND:
      case ASSIGN_LSH:
      case ASSIGN_RSH:
      case ASSIGN_URSH:
      case ASSIGN_ADD:
      case ASSIGN_SUB:
      case ASSIGN_MUL:
      case ASSIGN_DIV:
      case ASSIGN_MOD:
        return ASSIGNMENT_PRECEDENCE;
      case HOOK:
        return HOOK_PRECEDENCE; // ?: operator
      case OR:
        return OR_PRECEDENCE;
      case AND:
        return 5;
      case BITOR:
        return 7;
      case BITXOR:
        return 8;
      case BITAND:
        return 9;
      case EQ:
      case NE:
      case SHEQ:
      case SHNE:
        return 10;
      case LT:
      case GT:
      case LE:
      case GE:
      case INSTANCEOF:
      case IN:
        return 11;
      case LSH:
      case RSH:
      case URSH:
        return 12;
      case SUB:
      case ADD:
        return 13;
      case MUL:
      case MOD:
      case DIV:
        return 14;

      case DELPROP:
      case TYPEOF:
      case VOID:
      case NOT:
      case BITNOT:
      case POS:
      case NEG:
        return UNARY_PRECEDENCE;

      case INC:
      case DEC:
        return UPDATE_PRECEDENCE;

      default:
        return PRIMARY_PRECEDENCE;
    }
  }

  /** Converts an operator's token value to its source text, or null if it is not an operator. */
  static @Nullable String opToStr(Token operator) {
    switch (operator) {
      case BITOR:
        return "|";
      case OR:
        return "||";
      case BITXOR:
        return "^";
      case AND:
        return "&&";
      case BITAND:
        return "&";
      case SHEQ:
        return "===";
      case EQ:
        return "==";
      case NOT:
        return "!";
      case NE:
        return "!=";
      case SHNE:
        return "!==";
      case LSH:
        return "<<";
      case IN:
        return "in";
      case LE:
        return "<=";
      case LT:
        return "<";
      case URSH:
        return ">>>";
      case RSH:
        return ">>";
      case GE:
        return ">=";
      case GT:
        return ">";
      case MUL:
        return "*";
      case DIV:
        return "/";
      case MOD:
        return "%";
      case BITNOT:
        return "~";
      case ADD:
      case POS:
        return "+";
      case SUB:
      case NEG:
        return "-";
      case ASSIGN:
        return "=";
      case ASSIGN_BITOR:
        return "|=";
      case ASSIGN_BITXOR:
        return "^=";
      case ASSIGN_BITAND:
        return "&=";
      case ASSIGN_LSH:
        return "<<=";
      case ASSIGN_RSH:
        return ">>=";
      case ASSIGN_URSH:
        return ">>>=";
      case ASSIGN_ADD:
        return "+=";
      case ASSIGN_SUB:
        return "-=";
      case ASSIGN_MUL:
        return "*=";
      case ASSIGN_DIV:
        return "/=";
      case ASSIGN_MOD:
        return "%=";
      case VOID:
        return "void";
      case TYPEOF:
        return "typeof";
      case INSTANCEOF:
        return "instanceof";
      case DELPROP:
        return "delete";
      case INC:
        return "++";
      case DEC:
        return "--";
      case COMMA:
        return ",";
      default:
        return null;
    }
  }

  /**
   * The precedence of an expression as printed. A negative number literal prints with a leading
   * minus sign and so behaves like a unary expression.
   */
  public static int precedence(Node n) {
    if (n.isNumber() && isNegative(n.getDouble())) {
      return UNARY_PRECEDENCE;
    }
    return precedence(n.getToken());
  }

  private static boolean isNegative(double d) {
    return d < 0 || (d == 0 && 1 / d < 0);
  }

  /**
   * The lowest precedence {@code child} may have in its current position without needing
   * parentheses.
   */
  public static int targetPrecedence(Node child) {
    Node parent = checkNotNull(child.getParent(), "detached: %s", child);
    Token type = parent.getToken();
    if (type.isAssignment()) {
      return child == parent.getFirstChild() ? UPDATE_PRECEDENCE : ASSIGNMENT_PRECEDENCE;
    }
    if (type == Token.COMMA) {
      return child == parent.getFirstChild() ? COMMA_PRECEDENCE : ASSIGNMENT_PRECEDENCE;
    }
    if (type.isBinaryOperator()) {
      // Left associative: the right operand must bind tighter than the operator.
      int p = precedence(type);
      return child == parent.getFirstChild() ? p : p + 1;
    }
    if (type.isUnaryOperator()) {
      return parent.isPostfix() ? UPDATE_PRECEDENCE : UNARY_PRECEDENCE;
    }
    switch (type) {
      case HOOK:
        return child == parent.getFirstChild() ? OR_PRECEDENCE : ASSIGNMENT_PRECEDENCE;
      case CALL:
      case NEW:
      case GETPROP:
      case GETELEM:
        return child == parent.getFirstChild() ? PRIMARY_PRECEDENCE : ASSIGNMENT_PRECEDENCE;
      case EXPR_LIST:
      case ARRAYLIT:
      case STRING_KEY:
      case NAME:
      case CASE:
        return ASSIGNMENT_PRECEDENCE;
      default:
        // Statements, grouping parentheses and brackets.
        return COMMA_PRECEDENCE;
    }
  }

  /** Whether {@code n} would need parentheses if printed where it stands. */
  static boolean needsParentheses(Node n) {
    return n.hasParent() && precedence(n) < targetPrecedence(n);
  }

  /** Whether {@code n} is a number, string, boolean or null literal. */
  public static boolean isLiteral(Node n) {
    switch (n.getToken()) {
      case NUMBER:
      case STRINGLIT:
      case TRUE:
      case FALSE:
      case NULL:
        return true;
      default:
        return false;
    }
  }

  static boolean isStringLiteral(Node n) {
    return n.isStringLit();
  }

  static boolean isBooleanLiteral(Node n) {
    return n.isTrue() || n.isFalse();
  }

  /** A literal that is a number with an integral value that a double represents exactly. */
  static boolean isIntegerLiteral(Node n) {
    if (!n.isNumber()) {
      return false;
    }
    double d = n.getDouble();
    return d == Math.rint(d) && Math.abs(d) <= JsDoubles.MAX_EXACT_INTEGER;
  }

  /**
   * Whether {@code n} is a literal other than the numbers one and positive zero. Control
   * conditions are only rewritten to one of those two when they are not already.
   */
  static boolean isNotOneOrPositiveZero(Node n) {
    if (!n.isNumber()) {
      return true;
    }
    double d = n.getDouble();
    return d != 1 && !JsDoubles.isPositiveZero(d);
  }

  /** The primitive type of a literal; {@link PrimitiveType#OTHER} for anything else. */
  static PrimitiveType getLiteralType(Node n) {
    switch (n.getToken()) {
      case NUMBER:
        return PrimitiveType.NUMBER;
      case STRINGLIT:
        return PrimitiveType.STRING;
      case TRUE:
      case FALSE:
        return PrimitiveType.BOOLEAN;
      case NULL:
        return PrimitiveType.NULL;
      default:
        return PrimitiveType.OTHER;
    }
  }

  /**
   * Determines the primitive type an expression always evaluates to, without any knowledge of
   * variable values.
   */
  public static PrimitiveType getPrimitiveType(Node n) {
    Token type = n.getToken();
    switch (type) {
      case NUMBER:
      case STRINGLIT:
      case TRUE:
      case FALSE:
      case NULL:
        return getLiteralType(n);

      case PAREN:
        return getPrimitiveType(n.getOnlyChild());

      case EXPR_LIST:
        return n.hasChildren() ? getPrimitiveType(n.getLastChild()) : PrimitiveType.OTHER;

      case ASSIGN:
      case COMMA:
        return getPrimitiveType(n.getLastChild());

      case BITAND:
      case ASSIGN_BITAND:
      case BITOR:
      case ASSIGN_BITOR:
      case BITXOR:
      case ASSIGN_BITXOR:
      case DIV:
      case ASSIGN_DIV:
      case LSH:
      case ASSIGN_LSH:
      case SUB:
      case ASSIGN_SUB:
      case MOD:
      case ASSIGN_MOD:
      case MUL:
      case ASSIGN_MUL:
      case RSH:
      case ASSIGN_RSH:
      case URSH:
      case ASSIGN_URSH:
        return PrimitiveType.NUMBER;

      case EQ:
      case NE:
      case SHEQ:
      case SHNE:
      case LT:
      case LE:
      case GT:
      case GE:
      case IN:
      case INSTANCEOF:
        return PrimitiveType.BOOLEAN;

      case ADD:
      case ASSIGN_ADD:
        {
          PrimitiveType left = getPrimitiveType(n.getFirstChild());
          PrimitiveType right = getPrimitiveType(n.getLastChild());
          if (left == PrimitiveType.STRING || right == PrimitiveType.STRING) {
            return PrimitiveType.STRING;
          }
          return left != PrimitiveType.OTHER && right != PrimitiveType.OTHER
              ? PrimitiveType.NUMBER
              : PrimitiveType.OTHER;
        }

      case AND:
      case OR:
        {
          // The result is one of the operands.
          PrimitiveType left = getPrimitiveType(n.getFirstChild());
          if (left != PrimitiveType.OTHER && left == getPrimitiveType(n.getLastChild())) {
            return left;
          }
          return PrimitiveType.OTHER;
        }

      case HOOK:
        {
          PrimitiveType trueType = getPrimitiveType(n.getSecondChild());
          return trueType == getPrimitiveType(n.getLastChild()) ? trueType : PrimitiveType.OTHER;
        }

      case TYPEOF:
        return PrimitiveType.STRING;
      case NOT:
        return PrimitiveType.BOOLEAN;
      case VOID:
      case DELPROP:
        return PrimitiveType.OTHER;
      case BITNOT:
      case POS:
      case NEG:
      case INC:
      case DEC:
        return PrimitiveType.NUMBER;

      default:
        return PrimitiveType.OTHER;
    }
  }

  /**
   * Whether the value {@code n} produces is thrown away: it is an expression statement, or the
   * trailing value of a comma expression whose own value is thrown away, or any non-trailing
   * operand of a comma expression.
   */
  public static boolean isValueDiscarded(Node n) {
    Node parent = n.getParent();
    if (parent == null) {
      return false;
    }
    switch (parent.getToken()) {
      case EXPR_RESULT:
        return true;
      case COMMA:
      case EXPR_LIST:
        if (n != parent.getLastChild()) {
          return true;
        }
        if (parent.isExprList()) {
          Node comma = parent.getParent();
          return comma != null && isValueDiscarded(comma);
        }
        return isValueDiscarded(parent);
      default:
        return false;
    }
  }

  /**
   * Returns true if evaluating {@code n} may change program state. Calls, constructions,
   * assignments, increments and deletes are assumed to; property reads are not.
   */
  static boolean mayHaveSideEffects(Node n) {
    Token type = n.getToken();
    if (type.isAssignment()) {
      return true;
    }
    switch (type) {
      case CALL:
      case NEW:
      case DELPROP:
      case INC:
      case DEC:
        return true;
      case FUNCTION:
        // Creating a function object has no visible effect.
        return false;
      default:
        break;
    }
    for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
      if (mayHaveSideEffects(c)) {
        return true;
      }
    }
    return false;
  }

  /** Whether {@code n} is a statement container: a script or a block. */
  static boolean isStatementBlock(Node n) {
    return n.isScript() || n.isBlock();
  }

  /**
   * Replaces {@code n} by a literal. When {@code n} was the only content of grouping parentheses
   * the parentheses go too, since a literal never needs them.
   */
  static void replaceWithLiteral(Node n, Node literal) {
    checkState(n.hasParent(), "detached: %s", n);
    Node parent = n.getParent();
    if (parent.isParen() && parent.hasParent()) {
      parent.replaceWith(detachIfAttached(literal));
    } else {
      n.replaceWith(detachIfAttached(literal));
    }
  }

  /**
   * Replaces {@code oldNode} by {@code newNode}, also removing enclosing grouping parentheses
   * when the new node does not need them. A null {@code newNode} removes the value altogether.
   */
  static void replaceCheckParens(Node oldNode, @Nullable Node newNode) {
    checkState(oldNode.hasParent(), "detached: %s", oldNode);
    Node target = oldNode;
    Node grouping = oldNode.getParent();
    if (grouping.isParen() && grouping.hasParent()) {
      if (newNode == null || precedence(newNode) >= targetPrecedence(grouping)) {
        target = grouping;
      }
    }
    if (newNode == null) {
      removeExpression(target);
    } else {
      target.replaceWith(detachIfAttached(newNode));
    }
  }

  /**
   * Removes an expression whose evaluation has no effect. An expression statement goes
   * entirely; a value anywhere else becomes {@code void 0}.
   */
  static void removeExpression(Node n) {
    Node parent = n.getParent();
    if (parent.isExprResult()) {
      Node statementParent = parent.getParent();
      if (statementParent != null && isStatementBlock(statementParent)) {
        parent.detach();
      } else {
        parent.replaceWith(IR.empty());
      }
    } else if (parent.isExprList()) {
      n.detach();
    } else {
      n.replaceWith(IR.voidNode(IR.number(0)));
    }
  }

  private static Node detachIfAttached(Node n) {
    return n.hasParent() ? n.detach() : n;
  }
}
