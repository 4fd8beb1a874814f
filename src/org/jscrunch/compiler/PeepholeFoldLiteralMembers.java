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

/**
 * Folds member reads on array and string literals: {@code "abc".length --> 3}, {@code
 * [1,2].length --> 2} and {@code ["a","b"].join("-") --> "a-b"}.
 */
class PeepholeFoldLiteralMembers extends AbstractPeepholeOptimization {

  @Override
  Node optimizeSubtree(Node subtree) {
    switch (subtree.getToken()) {
      case CALL:
        return tryFoldArrayJoin(subtree);
      case GETPROP:
        return tryFoldLength(subtree);
      default:
        return subtree;
    }
  }

  private Node tryFoldArrayJoin(Node n) {
    if (!isAllowed(TreeModification.EVALUATE_LITERAL_JOINS)) {
      return n;
    }
    Node callTarget = n.getFirstChild();
    if (!callTarget.isGetProp() || !callTarget.getString().equals("join")) {
      return n;
    }
    Node arrayNode = callTarget.getFirstChild();
    if (!arrayNode.isArrayLit() || arrayNode.mayHaveIssues()) {
      return n;
    }

    Node right = callTarget.getNext();
    String joinString = ",";
    if (right != null) {
      if (right.getNext() != null || !NodeUtil.isLiteral(right)) {
        return n;
      }
      joinString = LiteralCoercion.toDisplayString(right);
      if (joinString == null) {
        return n;
      }
    }

    StringBuilder sb = new StringBuilder();
    for (Node elem = arrayNode.getFirstChild(); elem != null; elem = elem.getNext()) {
      if (!LiteralCoercion.isOkayToCombine(elem)) {
        return n;
      }
      if (elem != arrayNode.getFirstChild()) {
        sb.append(joinString);
      }
      // null and undefined elements join as empty strings.
      if (!elem.isNull()) {
        String text = LiteralCoercion.toDisplayString(elem);
        if (text == null) {
          return n;
        }
        sb.append(text);
      }
    }

    Node joined = IR.string(sb.toString());
    if (CodeGenerator.size(joined) >= CodeGenerator.size(n)) {
      return n;
    }
    return replaceWithLiteral(n, joined);
  }

  private Node tryFoldLength(Node n) {
    if (!n.getString().equals("length")
        || !isAllowed(TreeModification.EVALUATE_LITERAL_LENGTHS)
        || isAssignmentTarget(n)) {
      return n;
    }
    Node target = n.getFirstChild();
    int length;
    if (target.isStringLit() && !target.mayHaveIssues()) {
      length = target.getString().length();
    } else if (target.isArrayLit()
        && !target.mayHaveIssues()
        && !NodeUtil.mayHaveSideEffects(target)) {
      length = target.getChildCount();
    } else {
      return n;
    }
    return replaceWithLiteral(n, IR.number(length));
  }

  private static boolean isAssignmentTarget(Node n) {
    Node parent = n.getParent();
    if (parent == null || parent.getFirstChild() != n) {
      return false;
    }
    Token type = parent.getToken();
    return type.isAssignment()
        || type == Token.INC
        || type == Token.DEC
        || type == Token.DELPROP;
  }
}
