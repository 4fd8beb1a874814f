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

import org.jscrunch.ast.IR;
import org.jscrunch.ast.Node;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link LogicalNot}. */
@RunWith(JUnit4.class)
public final class LogicalNotTest {

  private CrunchOptions options;

  @Before
  public void setUp() {
    options = CrunchOptions.defaults();
  }

  /**
   * Negates {@code value} in {@code x = value} and checks the predicted and the printed result.
   */
  private void assertNegation(Node value, int expectedCost, String expected) {
    Node script = IR.script(IR.exprResult(IR.assign(IR.name("x"), value)));
    assertNegationOf(script, value, expectedCost, expected);
  }

  private void assertNegationOf(Node script, Node n, int expectedCost, String expected) {
    int cost = LogicalNot.measure(n, options);
    LogicalNot.apply(n, options);
    assertThat(CodeGenerator.print(script)).isEqualTo(expected);
    assertThat(cost).isEqualTo(expectedCost);
  }

  /** Asserts that the measured cost of negating {@code value} is the change in printed length. */
  private void assertCostIsExact(Node value) {
    Node script = IR.script(IR.exprResult(IR.assign(IR.name("x"), value)));
    int before = CodeGenerator.size(script);
    int cost = LogicalNot.measure(value, options);
    LogicalNot.apply(value, options);
    assertThat(CodeGenerator.size(script) - before).isEqualTo(cost);
  }

  private static Node name(String name) {
    return IR.name(name);
  }

  @Test
  public void testEqualityOperatorsFlip() {
    assertNegation(IR.eq(name("a"), name("b")), 0, "x=a!=b");
    assertNegation(IR.ne(name("a"), name("b")), 0, "x=a==b");
    assertNegation(IR.sheq(name("a"), name("b")), 0, "x=a!==b");
    assertNegation(IR.shne(name("a"), name("b")), 0, "x=a===b");
  }

  @Test
  public void testOtherBinaryOperatorsAreWrapped() {
    assertNegation(IR.lt(name("a"), name("b")), 3, "x=!(a<b)");
    assertNegation(IR.add(name("a"), name("b")), 3, "x=!(a+b)");
    assertNegation(IR.assign(name("y"), IR.number(1)), 3, "x=!(y=1)");
  }

  @Test
  public void testDeMorgan() {
    assertNegation(IR.and(name("a"), name("b")), 2, "x=!a||!b");
    assertNegation(
        IR.or(IR.eq(name("a"), name("b")), IR.not(name("c"))), -1, "x=a!=b&&c");
  }

  @Test
  public void testDiscardedLogicalOperatorNegatesLeftOperandOnly() {
    Node and = IR.and(name("a"), IR.call(name("b")));
    Node script = IR.script(IR.exprResult(and));
    assertNegationOf(script, and, 1, "!a||b()");
  }

  @Test
  public void testCommaNegatesItsValue() {
    assertNegation(
        IR.comma(IR.call(name("f")), IR.eq(name("a"), name("b"))), 0, "x=(f(),a!=b)");
  }

  @Test
  public void testHook() {
    assertNegation(
        IR.hook(name("c"), IR.eq(name("a"), name("b")), IR.ne(name("d"), name("e"))),
        0,
        "x=c?a!=b:d==e");
    assertNegation(IR.hook(name("c"), name("a"), name("b")), 2, "x=c?!a:!b");
    assertNegation(
        IR.hook(name("c"), IR.lt(name("a"), name("b")), IR.lt(name("d"), name("e"))),
        3,
        "x=!(c?a<b:d<e)");
  }

  @Test
  public void testBooleanLiterals() {
    // Printed as !0 and !1 either way.
    assertNegation(IR.trueNode(), 0, "x=false");

    options =
        options.toBuilder().disallow(TreeModification.BOOLEAN_LITERALS_TO_NOT_OPERATORS).build();
    assertNegation(IR.trueNode(), 1, "x=false");
    assertNegation(IR.falseNode(), -1, "x=true");
  }

  @Test
  public void testParentheses() {
    assertNegation(IR.paren(IR.eq(name("a"), name("b"))), 0, "x=a!=b");
    assertNegation(IR.paren(IR.lt(name("a"), name("b"))), 1, "x=!(a<b)");
  }

  @Test
  public void testExistingNotCancels() {
    assertNegation(IR.not(name("a")), -1, "x=a");
    assertNegation(IR.not(IR.lt(name("a"), name("b"))), -3, "x=a<b");
    assertNegation(IR.not(IR.paren(name("a"))), -3, "x=a");
  }

  @Test
  public void testOtherExpressionsAreWrapped() {
    assertNegation(name("a"), 1, "x=!a");
    assertNegation(IR.call(name("f")), 1, "x=!f()");
    assertNegation(IR.getprop(name("a"), "b"), 1, "x=!a.b");
    assertNegation(IR.number(-1), 1, "x=!-1");
  }

  @Test
  public void testCostIsChangeInLength() {
    assertCostIsExact(IR.eq(name("a"), name("b")));
    assertCostIsExact(IR.lt(name("a"), name("b")));
    assertCostIsExact(IR.and(name("a"), name("b")));
    assertCostIsExact(IR.or(IR.eq(name("a"), name("b")), IR.not(name("c"))));
    assertCostIsExact(IR.not(IR.lt(name("a"), name("b"))));
    assertCostIsExact(IR.call(name("f")));
  }
}
