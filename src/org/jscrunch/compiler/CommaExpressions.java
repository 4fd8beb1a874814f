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

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.jscrunch.ast.IR;
import org.jscrunch.ast.Node;
import org.jspecify.annotations.Nullable;

/**
 * Helpers for the flattened comma form {@code COMMA(first, EXPR_LIST(rest...))}.
 *
 * <p>A chain of any length is one comma node and one list, so walking it never recurses once per
 * operand.
 */
public final class CommaExpressions {

  private CommaExpressions() {}

  /**
   * Joins detached expressions into one comma expression, in order. Operands that are comma
   * expressions themselves are spliced in.
   *
   * @return the only expression, {@code COMMA(a, b)} for two, or {@code COMMA(a, EXPR_LIST(...))}
   */
  public static Node combineWithComma(List<Node> exprs) {
    checkArgument(!exprs.isEmpty(), "Nothing to combine");
    List<Node> items = new ArrayList<>();
    for (Node expr : exprs) {
      checkArgument(expr.getParent() == null, "Expected detached node, got %s", expr);
      for (Node item : flatten(expr)) {
        items.add(item.hasParent() ? item.detach() : item);
      }
    }
    return build(items);
  }

  /** @see #combineWithComma(List) */
  public static Node combineWithComma(Node... exprs) {
    return combineWithComma(ImmutableList.copyOf(exprs));
  }

  /** Builds the flattened form from detached items. */
  static Node build(List<Node> items) {
    if (items.size() == 1) {
      return items.get(0);
    } else if (items.size() == 2) {
      return IR.comma(items.get(0), items.get(1));
    }
    Node list = IR.exprList();
    for (Node item : items.subList(1, items.size())) {
      list.addChildToBack(item);
    }
    return IR.comma(items.get(0), list);
  }

  /**
   * Returns the operands of a comma expression in evaluation order. The nodes stay attached. Any
   * node that is not a comma expression is its own single operand.
   */
  public static ImmutableList<Node> flatten(Node n) {
    ImmutableList.Builder<Node> items = ImmutableList.builder();
    Deque<Node> stack = new ArrayDeque<>();
    stack.push(n);
    while (!stack.isEmpty()) {
      Node current = stack.pop();
      if (current.isComma() || current.isExprList()) {
        for (Node c = current.getLastChild(); c != null; c = c.getPrevious()) {
          stack.push(c);
        }
      } else {
        items.add(current);
      }
    }
    return items.build();
  }

  /** The operand whose value a comma expression produces. */
  static @Nullable Node lastValue(Node comma) {
    Node last = comma.getLastChild();
    while (last != null && (last.isExprList() || last.isComma())) {
      last = last.getLastChild();
    }
    return last;
  }

  /**
   * Deletes the literal operands of a comma list whose values are thrown away. Evaluating a
   * literal has no effect.
   *
   * @return the number of operands deleted
   */
  static int removeDeadLiterals(Node list) {
    checkArgument(list.isExprList(), list);
    List<Node> dead = new ArrayList<>();
    for (Node item = list.getFirstChild(); item != null; item = item.getNext()) {
      if (NodeUtil.isLiteral(item) && NodeUtil.isValueDiscarded(item)) {
        dead.add(item);
      }
    }
    for (Node item : dead) {
      item.detach();
    }
    return dead.size();
  }

  /**
   * Simplifies a comma list that has lost operands. An empty list leaves only the first operand
   * of its comma expression; a single operand takes the place of the list.
   *
   * @return the node now standing where the list or its comma expression stood, or {@code list}
   *     itself when it still has two or more operands
   */
  static Node collapseList(Node list) {
    checkArgument(list.isExprList() && list.hasParent(), list);
    Node comma = list.getParent();
    if (!list.hasChildren() && comma.isComma()) {
      Node first = comma.getFirstChild();
      NodeUtil.replaceCheckParens(comma, first.detach());
      return first;
    } else if (list.hasOneChild()) {
      Node only = list.getOnlyChild().detach();
      list.replaceWith(only);
      return only;
    }
    return list;
  }
}
