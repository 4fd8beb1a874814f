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
import org.jscrunch.ast.Token;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link PeepholeFoldConstants} in isolation. */
@RunWith(JUnit4.class)
public final class PeepholeFoldConstantsTest extends CrunchTestBase {

  @Override
  protected ImmutableList<AbstractPeepholeOptimization> getOptimizations() {
    return ImmutableList.of(new PeepholeFoldConstants());
  }

  private static Node op(Token type, Node left, Node right) {
    return IR.binaryOp(type, left, right);
  }

  @Test
  public void testArithmetic() {
    test(assignX(IR.add(num(1), num(2))), "x=3");
    test(assignX(IR.sub(num(10), num(3))), "x=7");
    test(assignX(IR.mul(num(2), num(3))), "x=6");
    test(assignX(IR.div(num(6), num(3))), "x=2");
    test(assignX(op(Token.MOD, num(7), num(4))), "x=3");
    test(assignX(IR.sub(num(1), num(3))), "x=-2");
    test(assignX(IR.mul(num(1000), num(1000))), "x=1E6");
  }

  @Test
  public void testFoldingMustNotGrowTheOutput() {
    testSame(assignX(IR.div(num(1), num(3))));
    testSame(assignX(op(Token.MOD, num(46.5), num(6.3))));
  }

  @Test
  public void testRejectedFoldStillNormalizesOperands() {
    test(assignX(IR.div(num(1), str("3"))), "x=1/3");
    assertThat(lastChangeCount).isEqualTo(1);
  }

  @Test
  public void testPrefixedStringsConvertWithTheirRadix() {
    test(assignX(IR.mul(str("0b11"), num(1))), "x=3");
    test(assignX(IR.mul(str("0B11"), num(1))), "x=3");
    test(assignX(IR.mul(str("0o17"), num(1))), "x=15");
    test(assignX(IR.mul(str("0O17"), num(1))), "x=15");
    test(assignX(IR.neg(str("0x10"))), "x=-16");
  }

  @Test
  public void testNumbersBeyondExactIntegersAreNotFolded() {
    testSame(assignX(IR.mul(num(9007199254740992.0), num(3))));
  }

  @Test
  public void testAddition() {
    test(assignX(IR.add(str("a"), str("b"))), "x=\"ab\"");
    test(assignX(IR.add(str("a"), num(1))), "x=\"a1\"");
    test(assignX(IR.add(num(1), str("a"))), "x=\"1a\"");
    test(assignX(IR.add(str("a"), IR.nullNode())), "x=\"anull\"");
    test(assignX(IR.add(IR.trueNode(), num(1))), "x=2");
    testSame(assignX(IR.add(str("a"), num(0.5))));
  }

  @Test
  public void testShifts() {
    test(assignX(op(Token.LSH, num(1), num(3))), "x=8");
    test(assignX(op(Token.RSH, num(-8), num(1))), "x=-4");
    test(assignX(op(Token.URSH, num(-1), num(0))), "x=4294967295");
    // Only the low five bits of the count are used.
    test(assignX(op(Token.LSH, num(1), num(32))), "x=1");
  }

  @Test
  public void testRelational() {
    test(assignX(IR.lt(num(1), num(2))), "x=true");
    test(assignX(op(Token.GE, num(1), num(2))), "x=false");
    test(assignX(IR.lt(str("a"), str("b"))), "x=true");
    test(assignX(op(Token.GT, str("10"), num(9))), "x=true");
    test(assignX(IR.lt(num(Double.NaN), num(1))), "x=false");
    test(assignX(op(Token.GE, num(Double.NaN), num(Double.NaN))), "x=false");
  }

  @Test
  public void testLooseEquality() {
    test(assignX(IR.eq(str("1"), num(1))), "x=true");
    test(assignX(IR.eq(IR.nullNode(), IR.nullNode())), "x=true");
    test(assignX(IR.eq(IR.nullNode(), num(0))), "x=false");
    test(assignX(IR.ne(IR.trueNode(), num(1))), "x=false");
    test(assignX(IR.eq(num(0), num(-0.0))), "x=true");
    test(assignX(IR.ne(num(Double.NaN), num(Double.NaN))), "x=true");
  }

  @Test
  public void testStrictEqualityOfDifferentTypes() {
    test(assignX(IR.sheq(str("x"), num(5))), "x=false");
    test(assignX(IR.shne(str("x"), num(5))), "x=true");
    test(assignX(IR.sheq(IR.nullNode(), IR.falseNode())), "x=false");
  }

  @Test
  public void testStrictEqualityOfSameTypes() {
    test(assignX(IR.sheq(num(1), num(1))), "x=true");
    test(assignX(IR.shne(str("a"), str("b"))), "x=true");
    // Known types make the loose comparison equivalent and shorter.
    test(assignX(IR.sheq(IR.typeof(name("a")), str("string"))), "x=typeof a==\"string\"");
    testSame(assignX(IR.sheq(name("a"), str("string"))));
  }

  @Test
  public void testStrictEqualityKeepsSideEffects() {
    testSame(assignX(IR.sheq(IR.typeof(call("f")), num(5))));
  }

  @Test
  public void testBitwise() {
    test(assignX(op(Token.BITAND, num(5), num(3))), "x=1");
    test(assignX(op(Token.BITOR, num(5), num(3))), "x=7");
    test(assignX(op(Token.BITXOR, num(5), num(3))), "x=6");
    test(assignX(op(Token.BITOR, num(4294967296.0 + 1), num(0))), "x=1");
  }

  @Test
  public void testLogicalOperatorsYieldAnOperand() {
    test(assignX(IR.and(num(0), num(1))), "x=0");
    test(assignX(IR.and(num(1), str("a"))), "x=\"a\"");
    test(assignX(IR.or(str(""), num(2))), "x=2");
    test(assignX(IR.or(str("b"), num(2))), "x=\"b\"");
    testSame(assignX(IR.and(num(0), call("f"))));
  }

  @Test
  public void testAssignmentsAreNotFolded() {
    testSame(statement(op(Token.ASSIGN_ADD, name("a"), num(1))));
    testSame(assignX(op(Token.IN, str("a"), name("b"))));
  }

  @Test
  public void testComma() {
    test(assignX(IR.comma(num(1), num(2))), "x=2");
    test(assignX(IR.comma(num(1), call("f"))), "x=f()");
    testSame(assignX(IR.comma(call("f"), num(1))));
    test(statement(IR.comma(call("f"), num(1))), "f()");
  }

  @Test
  public void testCommaKeepsCallWithoutReceiver() {
    testSame(statement(IR.call(IR.comma(num(0), IR.getprop(name("a"), "b")))));
  }

  @Test
  public void testDeadLiteralsInCommaLists() {
    Node chain = CommaExpressions.combineWithComma(call("f"), num(1), call("g"), num(2));
    test(statement(chain), "f(),g()");

    chain = CommaExpressions.combineWithComma(call("f"), num(1), call("g"), num(2));
    test(assignX(chain), "x=(f(),g(),2)");

    chain = CommaExpressions.combineWithComma(call("f"), num(1), str("a"));
    test(statement(chain), "f()");
  }

  @Test
  public void testHook() {
    test(assignX(IR.hook(num(1), name("a"), name("b"))), "x=a");
    test(assignX(IR.hook(str(""), name("a"), name("b"))), "x=b");
    test(assignX(IR.hook(IR.nullNode(), name("a"), IR.comma(name("b"), name("c")))), "x=(b,c)");
    testSame(assignX(IR.hook(name("c"), name("a"), name("b"))));
  }

  @Test
  public void testVoid() {
    test(assignX(IR.voidNode(str("a"))), "x=void 0");
    testSame(assignX(IR.voidNode(num(0))));
    testSame(assignX(IR.voidNode(call("f"))));
  }

  @Test
  public void testTypeof() {
    test(assignX(IR.typeof(str("a"))), "x=\"string\"");
    test(assignX(IR.typeof(num(1))), "x=\"number\"");
    test(assignX(IR.typeof(IR.trueNode())), "x=\"boolean\"");
    test(assignX(IR.typeof(IR.nullNode())), "x=\"object\"");
    test(assignX(IR.typeof(IR.objectlit())), "x=\"object\"");
    testSame(assignX(IR.typeof(IR.objectlit(IR.stringKey("a", call("f"))))));
    testSame(assignX(IR.typeof(name("a"))));
  }

  @Test
  public void testUnaryOperators() {
    test(assignX(IR.not(str("a"))), "x=false");
    test(assignX(IR.not(IR.nullNode())), "x=true");
    test(assignX(IR.neg(str("5"))), "x=-5");
    test(assignX(IR.pos(IR.trueNode())), "x=1");
    test(assignX(IR.unaryOp(Token.BITNOT, num(5))), "x=-6");
    testSame(assignX(IR.neg(num(0.5))));
  }

  @Test
  public void testNotOfZeroAndOneStaysWhenBooleansPrintThatWay() {
    testSame(assignX(IR.not(num(0))));
    testSame(assignX(IR.not(num(1))));

    options =
        options.toBuilder().disallow(TreeModification.BOOLEAN_LITERALS_TO_NOT_OPERATORS).build();
    test(assignX(IR.not(num(0))), "x=true");
  }

  @Test
  public void testSubtractZero() {
    test(assignX(IR.sub(name("a"), num(0))), "x=+a");

    options =
        options.toBuilder()
            .disallow(TreeModification.SIMPLIFY_STRING_TO_NUMERIC_CONVERSION)
            .build();
    testSame(assignX(IR.sub(name("a"), num(0))));
  }

  @Test
  public void testNumericEvaluationDisallowed() {
    options =
        options.toBuilder().disallow(TreeModification.EVALUATE_NUMERIC_EXPRESSIONS).build();
    testSame(assignX(IR.add(num(1), num(2))));
    testSame(assignX(IR.add(str("a"), num(1))));
    test(assignX(IR.add(str("a"), str("b"))), "x=\"ab\"");
  }

  @Test
  public void testStringCombinationDisallowed() {
    options =
        options.toBuilder().disallow(TreeModification.COMBINE_ADJACENT_STRING_LITERALS).build();
    testSame(assignX(IR.add(str("a"), str("b"))));
    test(assignX(IR.add(num(1), num(2))), "x=3");
  }

  @Test
  public void testLiteralsWithIssuesAreNotCombined() {
    Node octal = num(8).setMayHaveIssues(true);
    testSame(assignX(IR.add(octal, num(1))));
  }

  @Test
  public void testParenthesesAroundFoldedValueGo() {
    test(assignX(IR.mul(IR.paren(IR.add(num(1), num(2))), name("a"))), "x=3*a");
  }
}
