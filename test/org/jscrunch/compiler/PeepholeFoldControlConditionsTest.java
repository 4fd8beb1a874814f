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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import org.jscrunch.ast.IR;
import org.jscrunch.ast.Node;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link PeepholeFoldControlConditions}. */
@RunWith(JUnit4.class)
public final class PeepholeFoldControlConditionsTest extends CrunchTestBase {

  @Override
  protected ImmutableList<AbstractPeepholeOptimization> getOptimizations() {
    return ImmutableList.of(new PeepholeFoldControlConditions());
  }

  private static Node body() {
    return IR.block(IR.exprResult(call("f")));
  }

  private static Node ifWith(Node cond) {
    return IR.script(IR.ifNode(cond, body()));
  }

  private static Node whileWith(Node cond) {
    return IR.script(IR.whileNode(cond, body()));
  }

  private static Node forWith(Node cond) {
    return IR.script(IR.forNode(IR.empty(), cond, IR.empty(), body()));
  }

  @Test
  public void testIfConditions() {
    test(ifWith(IR.trueNode()), "if(1)f()");
    test(ifWith(str("a")), "if(1)f()");
    test(ifWith(IR.nullNode()), "if(0)f()");
    test(ifWith(num(Double.NaN)), "if(0)f()");
    testSame(ifWith(num(1)));
    testSame(ifWith(num(0)));
    testSame(ifWith(name("a")));
  }

  @Test
  public void testDoConditions() {
    Node script = IR.script(IR.doNode(body(), IR.falseNode()));
    process(script);
    Node cond = script.getFirstChild().getLastChild();
    assertThat(cond.isNumber()).isTrue();
    assertThat(cond.getDouble()).isEqualTo(0.0);
  }

  @Test
  public void testForConditions() {
    test(forWith(IR.trueNode()), "for(;;)f()");
    test(forWith(num(5)), "for(;;)f()");
    test(forWith(str("")), "for(;0;)f()");
    testSame(forWith(num(0)));
    testSame(forWith(name("a")));
  }

  @Test
  public void testWhileBecomesFor() {
    test(whileWith(IR.trueNode()), "for(;;)f()");
    test(whileWith(num(1)), "for(;;)f()");
    test(whileWith(IR.falseNode()), "while(0)f()");
    testSame(whileWith(name("a")));
  }

  @Test
  public void testVarMovesIntoFor() {
    Node script =
        IR.script(IR.var(name("i")), IR.whileNode(IR.trueNode(), body()));
    test(script, "for(var i;;)f()");

    options = options.toBuilder().disallow(TreeModification.MOVE_VAR_INTO_FOR).build();
    script = IR.script(IR.var(name("i")), IR.whileNode(IR.trueNode(), body()));
    test(script, "var i;for(;;)f()");
  }

  @Test
  public void testWhileToForDisallowed() {
    options = options.toBuilder().disallow(TreeModification.CHANGE_WHILE_TO_FOR).build();
    test(whileWith(IR.trueNode()), "while(1)f()");
    testSame(whileWith(num(1)));
  }

  @Test
  public void testNumericEvaluationDisallowed() {
    options =
        options.toBuilder().disallow(TreeModification.EVALUATE_NUMERIC_EXPRESSIONS).build();
    testSame(ifWith(IR.trueNode()));
    testSame(forWith(IR.trueNode()));
    test(whileWith(IR.trueNode()), "for(;;)f()");
  }
}
