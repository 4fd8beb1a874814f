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
import org.jscrunch.ast.IR;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link BooleanLiteralsToNot}. */
@RunWith(JUnit4.class)
public final class BooleanLiteralsToNotTest extends CrunchTestBase {

  @Override
  protected ImmutableList<AbstractPeepholeOptimization> getOptimizations() {
    return ImmutableList.of(new BooleanLiteralsToNot());
  }

  @Test
  public void testBooleanLiterals() {
    test(assignX(IR.trueNode()), "x=!0");
    test(assignX(IR.falseNode()), "x=!1");
    test(statement(IR.trueNode()), "!0");
    test(assignX(IR.not(IR.trueNode())), "x=!!0");
  }

  @Test
  public void testParenthesesAddedWhereNeeded() {
    test(assignX(IR.getprop(IR.trueNode(), "toString")), "x=(!0).toString");
    test(assignX(IR.paren(IR.falseNode())), "x=!1");
  }

  @Test
  public void testOtherLiteralsUntouched() {
    testSame(assignX(num(1)));
    testSame(assignX(IR.nullNode()));
    testSame(assignX(str("true")));
  }

  @Test
  public void testNotMinified() {
    options = options.toBuilder().setMinifyCode(false).build();
    testSame(assignX(IR.trueNode()));
  }

  @Test
  public void testRewriteDisallowed() {
    options =
        options.toBuilder().disallow(TreeModification.BOOLEAN_LITERALS_TO_NOT_OPERATORS).build();
    testSame(assignX(IR.trueNode()));
    testSame(assignX(IR.falseNode()));
  }
}
