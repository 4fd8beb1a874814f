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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jscrunch.ast.Node;
import org.jspecify.annotations.Nullable;

/**
 * Entry point of the optimizer. Rewrites a parsed script into an equivalent one that prints
 * shorter.
 *
 * <p>Two passes run over the tree. The first evaluates literal expressions and minimizes
 * conditions; the second splits comma statements and shortens boolean literals, which would only
 * get in the way of the first.
 */
public final class Crunch {

  private static final Logger logger = Logger.getLogger(Crunch.class.getName());

  private final CrunchOptions options;

  public Crunch(CrunchOptions options) {
    this.options = checkNotNull(options);
  }

  public CrunchOptions getOptions() {
    return options;
  }

  /**
   * Optimizes {@code root} in place.
   *
   * @return the number of rewrites made; zero for a null root
   */
  public int process(@Nullable Node root) {
    if (root == null) {
      return 0;
    }
    int changes = 0;
    for (PeepholeOptimizationsPass pass : createPasses()) {
      changes += pass.process(root);
    }
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("crunch: " + changes + " change(s) in total");
    }
    return changes;
  }

  @VisibleForTesting
  ImmutableList<PeepholeOptimizationsPass> createPasses() {
    ImmutableList.Builder<PeepholeOptimizationsPass> passes = ImmutableList.builder();
    if (options.getEvalLiteralExpressions()) {
      passes.add(
          new PeepholeOptimizationsPass(
              options,
              "evalLiteralExpressions",
              new StatementFusion(),
              new PeepholeFoldConstants(),
              new FoldAssociativeCascade(),
              new ConvertToDottedProperties(),
              new PeepholeFoldLiteralMembers(),
              new PeepholeFoldControlConditions(),
              new PeepholeMinimizeConditions()));
    }
    passes.add(
        new PeepholeOptimizationsPass(
            options, "finalPass", new UnfoldCommaStatements(), new BooleanLiteralsToNot()));
    return passes.build();
  }
}
