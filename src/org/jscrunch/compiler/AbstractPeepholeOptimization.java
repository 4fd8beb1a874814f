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

import org.jscrunch.ast.Node;
import org.jspecify.annotations.Nullable;

/**
 * An abstract class whose implementations run peephole optimizations: optimizations that look at
 * a small section of code and either remove that code (if it is not needed) or replaces it with
 * smaller code.
 */
abstract class AbstractPeepholeOptimization {

  /** Intentionally not exposed to subclasses */
  private CrunchOptions options;

  private int changeCount;

  /**
   * Given a node to optimize, optimize the node. Subclasses should override to provide their own
   * peephole optimization.
   *
   * @param subtree The subtree that will be optimized. Its children have already been optimized.
   * @return The node that now stands in place of the subtree, which may be the replacement of
   *     one of its ancestors, or null if the subtree was removed from the AST. If the subtree has
   *     not changed, this method must return {@code subtree}.
   */
  abstract @Nullable Node optimizeSubtree(Node subtree);

  /** Informs the optimization that a traversal will begin. */
  void beginTraversal(CrunchOptions options) {
    this.options = checkNotNull(options);
    changeCount = 0;
  }

  protected final CrunchOptions getOptions() {
    checkNotNull(options);
    return options;
  }

  protected final boolean isAllowed(TreeModification modification) {
    return getOptions().isModificationAllowed(modification);
  }

  /** Records one rewrite of the tree. */
  protected final void reportChange() {
    changeCount++;
  }

  /** The number of rewrites made since the traversal began. */
  final int getChangeCount() {
    return changeCount;
  }

  /**
   * Replaces {@code n} by a literal value computed from it. A string that becomes a bracketed
   * member name may turn the member access into a dotted one; in that case the new member access
   * is returned.
   */
  protected final Node replaceWithLiteral(Node n, Node literal) {
    Node dotted = ConvertToDottedProperties.replaceBracketMember(n, literal, getOptions());
    reportChange();
    if (dotted != null) {
      return dotted;
    }
    NodeUtil.replaceWithLiteral(n, literal);
    return literal;
  }
}
