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

/** Replaces {@code true} with {@code !0} and {@code false} with {@code !1}. */
class BooleanLiteralsToNot extends AbstractPeepholeOptimization {

  @Override
  Node optimizeSubtree(Node n) {
    if ((!n.isTrue() && !n.isFalse())
        || !getOptions().getMinifyCode()
        || !isAllowed(TreeModification.BOOLEAN_LITERALS_TO_NOT_OPERATORS)) {
      return n;
    }
    Node not = IR.not(IR.number(n.isTrue() ? 0 : 1));
    NodeUtil.replaceCheckParens(n, not);
    reportChange();
    return not;
  }
}
