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

package org.jscrunch.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A node of the syntax tree.
 *
 * <p>Children form a doubly linked list. The {@code previous} link of the first child points to
 * the last child, which makes appending constant time; the {@code next} link of the last child is
 * null. Every mutation keeps the parent and sibling links consistent.
 */
public class Node {

  private Token token;

  private @Nullable Node parent;
  private @Nullable Node first;
  private @Nullable Node next;
  private @Nullable Node previous;

  private double number;
  private @Nullable String string;

  /** Set on literals whose textual form should not be duplicated or merged. */
  private boolean mayHaveIssues;

  /** Set on INC and DEC nodes that appear after their operand. */
  private boolean postfix;

  public Node(Token token) {
    this.token = token;
  }

  public Node(Token token, Node child) {
    this(token);
    addChildToBack(child);
  }

  public Node(Token token, Node left, Node right) {
    this(token);
    addChildToBack(left);
    addChildToBack(right);
  }

  public Node(Token token, Node left, Node mid, Node right) {
    this(token);
    addChildToBack(left);
    addChildToBack(mid);
    addChildToBack(right);
  }

  public static Node newNumber(double value) {
    Node n = new Node(Token.NUMBER);
    n.number = value;
    return n;
  }

  public static Node newString(String str) {
    return newString(Token.STRINGLIT, str);
  }

  public static Node newString(Token token, String str) {
    Node n = new Node(token);
    n.string = checkNotNull(str);
    return n;
  }

  public final Token getToken() {
    return token;
  }

  public final void setToken(Token token) {
    this.token = token;
  }

  public final double getDouble() {
    checkState(token == Token.NUMBER, "not a number: %s", this);
    return number;
  }

  public final void setDouble(double value) {
    checkState(token == Token.NUMBER, "not a number: %s", this);
    this.number = value;
  }

  public final String getString() {
    checkState(string != null, "no string on %s", token);
    return string;
  }

  public final boolean mayHaveIssues() {
    return mayHaveIssues;
  }

  @CanIgnoreReturnValue
  public final Node setMayHaveIssues(boolean value) {
    this.mayHaveIssues = value;
    return this;
  }

  public final boolean isPostfix() {
    return postfix;
  }

  @CanIgnoreReturnValue
  public final Node setPostfix(boolean value) {
    this.postfix = value;
    return this;
  }

  // Tree structure.

  public final @Nullable Node getParent() {
    return parent;
  }

  public final boolean hasParent() {
    return parent != null;
  }

  public final boolean hasChildren() {
    return first != null;
  }

  public final boolean hasOneChild() {
    return first != null && first.next == null;
  }

  public final boolean hasTwoChildren() {
    return first != null && first.next != null && first.next.next == null;
  }

  public final int getChildCount() {
    int c = 0;
    for (Node n = first; n != null; n = n.next) {
      c++;
    }
    return c;
  }

  public final Node getOnlyChild() {
    checkState(hasOneChild(), "expected one child: %s", this);
    return first;
  }

  public final @Nullable Node getFirstChild() {
    return first;
  }

  public final @Nullable Node getSecondChild() {
    return first == null ? null : first.next;
  }

  public final @Nullable Node getLastChild() {
    return first != null ? first.previous : null;
  }

  public final @Nullable Node getNext() {
    return next;
  }

  public final @Nullable Node getPrevious() {
    return (parent == null || this == parent.first) ? null : previous;
  }

  /** Iterates over the children. The iteration tolerates detaching the current child. */
  public final Iterable<Node> children() {
    return () ->
        new Iterator<Node>() {
          private @Nullable Node cursor = first;

          @Override
          public boolean hasNext() {
            return cursor != null;
          }

          @Override
          public Node next() {
            if (cursor == null) {
              throw new NoSuchElementException();
            }
            Node result = cursor;
            cursor = cursor.next;
            return result;
          }
        };
  }

  public final void addChildToBack(Node child) {
    checkArgument(
        child.parent == null,
        "Cannot add already-owned child node.\nChild: %s\nExisting parent: %s\nNew parent: %s",
        child,
        child.parent,
        this);
    child.checkDetached();

    if (first == null) {
      child.previous = child;
      first = child;
    } else {
      Node last = first.previous;
      last.next = child;
      child.previous = last;
      first.previous = child;
    }
    child.parent = this;
  }

  /** Inserts this detached node as the next sibling of {@code existing}. */
  public final void insertAfter(Node existing) {
    existing.checkAttached();
    this.checkDetached();

    final Node existingParent = existing.parent;
    final Node existingNext = existing.next;

    this.parent = existingParent;
    existing.next = this;
    this.previous = existing;

    if (existingNext == null) {
      existingParent.first.previous = this;
    } else {
      existingNext.previous = this;
      this.next = existingNext;
    }
  }

  /** Inserts this detached node as the previous sibling of {@code existing}. */
  public final void insertBefore(Node existing) {
    existing.checkAttached();
    this.checkDetached();

    final Node existingParent = existing.parent;
    final Node existingPrevious = existing.previous;

    this.parent = existingParent;
    this.next = existing;
    existing.previous = this;

    this.previous = existingPrevious;
    if (existingPrevious.next == null) {
      existingParent.first = this;
    } else {
      existingPrevious.next = this;
    }
  }

  /** Swaps {@code replacement} and its subtree into the position of {@code this}. */
  public final void replaceWith(Node replacement) {
    this.checkAttached();
    replacement.checkDetached();

    final Node existingParent = this.parent;
    final Node existingNext = this.next;
    final Node existingPrevious = this.previous;

    // Also has to work when this is an only child, where several of the links alias.
    this.parent = null;
    replacement.parent = existingParent;

    this.previous = null;
    replacement.previous = existingPrevious;
    if (existingPrevious.next == null) {
      existingParent.first = replacement;
    } else {
      existingPrevious.next = replacement;
    }

    if (existingNext == null) {
      existingParent.first.previous = replacement;
    } else {
      this.next = null;
      existingNext.previous = replacement;
      replacement.next = existingNext;
    }
  }

  /** Removes this node from its parent, but retains its subtree. */
  @CanIgnoreReturnValue
  public final Node detach() {
    this.checkAttached();

    final Node existingParent = this.parent;
    final Node existingNext = this.next;
    final Node existingPrevious = this.previous;

    this.parent = null;

    if (existingNext == null) {
      existingParent.first.previous = existingPrevious;
    } else {
      this.next = null;
      existingNext.previous = existingPrevious;
    }

    this.previous = null;
    if (existingPrevious.next == null) {
      existingParent.first = existingNext;
    } else {
      existingPrevious.next = existingNext;
    }

    return this;
  }

  /**
   * Replaces {@code child} with {@code newChild}. The new child is detached from its current
   * parent first, so a grandchild can be promoted into its grandparent's slot. A null {@code
   * newChild} removes {@code child}.
   *
   * @return whether {@code child} was a child of this node
   */
  @CanIgnoreReturnValue
  public final boolean replaceChild(Node child, @Nullable Node newChild) {
    if (child.parent != this) {
      return false;
    }
    if (newChild == child) {
      return true;
    }
    if (newChild == null) {
      child.detach();
      return true;
    }
    if (newChild.parent != null) {
      newChild.detach();
    }
    child.replaceWith(newChild);
    return true;
  }

  @CanIgnoreReturnValue
  public final Node removeFirstChild() {
    return checkNotNull(first, "no children: %s", this).detach();
  }

  private void checkAttached() {
    checkState(this.parent != null, "Has no parent: %s", this);
  }

  private void checkDetached() {
    checkState(this.parent == null, "Has parent: %s", this);
    checkState(this.next == null, "Has next: %s", this);
    checkState(this.previous == null, "Has previous: %s", this);
  }

  // Copies.

  /** Copies this node without its children. */
  public final Node cloneNode() {
    Node n = new Node(token);
    n.number = number;
    n.string = string;
    n.mayHaveIssues = mayHaveIssues;
    n.postfix = postfix;
    return n;
  }

  public final Node cloneTree() {
    Node result = cloneNode();
    for (Node c = first; c != null; c = c.next) {
      result.addChildToBack(c.cloneTree());
    }
    return result;
  }

  /** Returns true if this node is structurally equal to {@code other}, children included. */
  public final boolean isEquivalentTo(@Nullable Node other) {
    if (other == null || token != other.token || postfix != other.postfix) {
      return false;
    }
    if (token == Token.NUMBER
        && Double.doubleToLongBits(number) != Double.doubleToLongBits(other.number)) {
      return false;
    }
    if (!Objects.equals(string, other.string)) {
      return false;
    }
    Node a = first;
    Node b = other.first;
    while (a != null && b != null) {
      if (!a.isEquivalentTo(b)) {
        return false;
      }
      a = a.next;
      b = b.next;
    }
    return a == null && b == null;
  }

  // Predicates.

  public final boolean isScript() {
    return token == Token.SCRIPT;
  }

  public final boolean isBlock() {
    return token == Token.BLOCK;
  }

  public final boolean isExprResult() {
    return token == Token.EXPR_RESULT;
  }

  public final boolean isVar() {
    return token == Token.VAR;
  }

  public final boolean isFunction() {
    return token == Token.FUNCTION;
  }

  public final boolean isEmpty() {
    return token == Token.EMPTY;
  }

  public final boolean isComma() {
    return token == Token.COMMA;
  }

  public final boolean isExprList() {
    return token == Token.EXPR_LIST;
  }

  public final boolean isParen() {
    return token == Token.PAREN;
  }

  public final boolean isAnd() {
    return token == Token.AND;
  }

  public final boolean isCall() {
    return token == Token.CALL;
  }

  public final boolean isGetProp() {
    return token == Token.GETPROP;
  }

  public final boolean isGetElem() {
    return token == Token.GETELEM;
  }

  public final boolean isName() {
    return token == Token.NAME;
  }

  public final boolean isNumber() {
    return token == Token.NUMBER;
  }

  public final boolean isStringLit() {
    return token == Token.STRINGLIT;
  }

  public final boolean isTrue() {
    return token == Token.TRUE;
  }

  public final boolean isFalse() {
    return token == Token.FALSE;
  }

  public final boolean isNull() {
    return token == Token.NULL;
  }

  public final boolean isArrayLit() {
    return token == Token.ARRAYLIT;
  }

  public final boolean isObjectLit() {
    return token == Token.OBJECTLIT;
  }

  // Debugging.

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    appendNodeLabel(sb);
    return sb.toString();
  }

  /** Prints the subtree, one node per line, indented by depth. */
  public final String toStringTree() {
    StringBuilder sb = new StringBuilder();
    appendStringTree(sb, 0);
    return sb.toString();
  }

  private void appendStringTree(StringBuilder sb, int level) {
    for (int i = 0; i < level; i++) {
      sb.append("    ");
    }
    appendNodeLabel(sb);
    sb.append('\n');
    for (Node c = first; c != null; c = c.next) {
      c.appendStringTree(sb, level + 1);
    }
  }

  private void appendNodeLabel(StringBuilder sb) {
    sb.append(token);
    if (token == Token.NUMBER) {
      sb.append(' ').append(number);
    } else if (string != null) {
      sb.append(' ').append(string);
    }
    if (postfix) {
      sb.append(" [postfix]");
    }
    if (mayHaveIssues) {
      sb.append(" [may_have_issues]");
    }
  }
}
