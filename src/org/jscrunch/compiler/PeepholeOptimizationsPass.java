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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jscrunch.ast.Node;
import org.jspecify.annotations.Nullable;

/**
 * A compiler pass to run various peephole optimizations (e.g. constant folding, some useless code
 * removal, some minimizations).
 *
 * <p>The tree is walked once, post-order. When an optimization replaces a node, the replacement
 * is sent through the whole list of optimizations again right away, so that a value produced by
 * one fold is folded further without a second walk.
 */
class PeepholeOptimizationsPass {

  private static final Logger logger = Logger.getLogger(PeepholeOptimizationsPass.class.getName());

  private final CrunchOptions options;
  private final String passName;
  private final ImmutableList<AbstractPeepholeOptimization> peepholeOptimizations;

  private Node root;

  /** Creates a peephole optimization pass that runs the given optimizations. */
  PeepholeOptimizationsPass(
      CrunchOptions options, String passName, AbstractPeepholeOptimization... optimizations) {
    this(options, passName, ImmutableList.copyOf(optimizations));
  }

  PeepholeOptimizationsPass(
      CrunchOptions options, String passName, List<AbstractPeepholeOptimization> optimizations) {
    this.options = options;
    this.passName = passName;
    this.peepholeOptimizations = ImmutableList.copyOf(optimizations);
  }

  /** Optimizes the tree under {@code root} and returns the number of rewrites made. */
  int process(Node root) {
    beginTraversal();
    this.root = root;
    traverse(root);
    this.root = null;

    int changes = 0;
    for (AbstractPeepholeOptimization optimization : peepholeOptimizations) {
      changes += optimization.getChangeCount();
    }
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(passName + ": " + changes + " change(s)");
    }
    return changes;
  }

  /**
   * Visits the children of {@code n}, then {@code n} itself.
   *
   * @return the node standing where {@code n} stood, or null if it was removed.
   */
  private @Nullable Node traverse(Node n) {
    Node parent = n.getParent();
    Node previous = n.getPrevious();
    Node next = n.getNext();

    Node child = n.getFirstChild();
    while (child != null) {
      Node nextChild = child.getNext();
      Node result = traverse(child);

      if (n != root && !n.hasParent()) {
        // A rewrite below replaced n itself.
        if (parent.getParent() == null && parent != root) {
          // So far up that the caller has to deal with it.
          return null;
        }
        Node occupant = previous == null ? parent.getFirstChild() : previous.getNext();
        if (occupant == null || occupant == next) {
          return null;
        }
        return visit(occupant);
      }

      child = (result != null && result.getParent() == n) ? result.getNext() : nextChild;
    }
    return visit(n);
  }

  private @Nullable Node visit(Node n) {
    if (!n.hasParent() && !NodeUtil.isStatementBlock(n)) {
      // Expressions are rewritten in place; a detached one has no place.
      return n;
    }
    Node currentNode = n;
    int i = 0;
    while (i < peepholeOptimizations.size()) {
      Node result = peepholeOptimizations.get(i).optimizeSubtree(currentNode);
      if (result == null) {
        return null;
      }
      if (result != currentNode) {
        // Start over with the replacement.
        currentNode = result;
        i = 0;
      } else {
        i++;
      }
    }
    return currentNode;
  }

  /** Make sure that all the optimizations have the current options. */
  private void beginTraversal() {
    for (AbstractPeepholeOptimization optimization : peepholeOptimizations) {
      optimization.beginTraversal(options);
    }
  }
}
