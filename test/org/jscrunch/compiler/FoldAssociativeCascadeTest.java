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
import org.jscrunch.ast.Token;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link FoldAssociativeCascade}. */
@RunWith(JUnit4.class)
public final class FoldAssociativeCascadeTest extends CrunchTestBase {

  @Override
  protected ImmutableList<AbstractPeepholeOptimization> getOptimizations() {
    return ImmutableList.of(new PeepholeFoldConstants(), new FoldAssociativeCascade());
  }

  @Test
  public void testStringLiteralsAcrossAnOperand() {
    test(assignX(IR.add(IR.add(name("a"), str("x")), str("y"))), "x=a+\"xy\"");
    test(assignX(IR.add(str("a"), IR.add(str("b"), name("c")))), "x=\"ab\"+c");
    test(assignX(IR.add(IR.add(name("a"), str("x")), num(1))), "x=a+\"x1\"");
  }

  @Test
  public void testAdditionWithUnknownOperandIsNotFolded() {
    // a may be a string.
    testSame(assignX(IR.add(IR.add(name("a"), num(1)), num(2))));
    testSame(assignX(IR.add(IR.add(name("a"), num(1)), str("b"))));
  }

  @Test
  public void testSubtraction() {
    test(assignX(IR.add(IR.sub(name("a"), num(5)), num(2))), "x=a-3");
    test(assignX(IR.sub(IR.sub(name("a"), num(5)), num(2))), "x=a-7");
    test(assignX(IR.add(IR.sub(num(5), name("a")), num(2))), "x=7-a");
    test(assignX(IR.sub(num(2), IR.sub(num(5), name("a")))), "x=a-3");
    test(assignX(IR.add(num(1), IR.sub(num(2), name("a")))), "x=3-a");
    test(assignX(IR.sub(num(2), IR.sub(name("a"), num(5)))), "x=7-a");
  }

  @Test
  public void testMultiplication() {
    test(assignX(IR.mul(IR.mul(name("a"), num(2)), num(3))), "x=a*6");
    test(assignX(IR.mul(IR.mul(num(2), name("a")), num(3))), "x=6*a");
    test(assignX(IR.mul(num(2), IR.mul(name("a"), num(3)))), "x=a*6");
    test(assignX(IR.div(IR.div(name("a"), num(2)), num(3))), "x=a/6");
  }

  @Test
  public void testMixedMultiplicationAndDivision() {
    test(assignX(IR.div(IR.mul(name("a"), num(6)), num(2))), "x=a*3");
    test(assignX(IR.mul(IR.div(name("a"), num(2)), num(6))), "x=a*3");
    test(assignX(IR.div(IR.mul(name("a"), num(2)), num(6))), "x=a/3");
    test(assignX(IR.div(num(6), IR.mul(num(2), name("a")))), "x=3/a");
  }

  @Test
  public void testEquallyShortQuotientsPreferTheFlippedOperator() {
    // (a * 2) / 2: both quotients are 1, and the flipped form wins the tie.
    test(assignX(IR.div(IR.mul(name("a"), num(2)), num(2))), "x=a/1");
  }

  @Test
  public void testChooseQuotient() {
    assertThat(FoldAssociativeCascade.chooseQuotient(num(3), num(1000), num(6), num(2)))
        .isEqualTo(FoldAssociativeCascade.KEEP);
    assertThat(FoldAssociativeCascade.chooseQuotient(num(1), num(1), num(2), num(2)))
        .isEqualTo(FoldAssociativeCascade.FLIP);
    assertThat(FoldAssociativeCascade.chooseQuotient(null, num(3), num(2), num(6)))
        .isEqualTo(FoldAssociativeCascade.FLIP);
    assertThat(FoldAssociativeCascade.chooseQuotient(num(123456), null, num(2), num(3)))
        .isEqualTo(FoldAssociativeCascade.NEITHER);
    assertThat(FoldAssociativeCascade.chooseQuotient(null, null, num(2), num(3)))
        .isEqualTo(FoldAssociativeCascade.NEITHER);
  }

  @Test
  public void testQuotientThatIsNotExactIsNotUsed() {
    testSame(assignX(IR.div(IR.mul(name("a"), num(2)), num(3))));
  }

  @Test
  public void testBitwise() {
    test(
        assignX(IR.binaryOp(Token.BITAND, IR.binaryOp(Token.BITAND, name("a"), num(6)), num(3))),
        "x=a&2");
    test(
        assignX(IR.binaryOp(Token.BITOR, IR.binaryOp(Token.BITOR, name("a"), num(1)), num(2))),
        "x=a|3");
  }

  @Test
  public void testLiteralsOnBothInnerOperatorsAreLeftAlone() {
    testSame(assignX(IR.mul(IR.mul(name("a"), num(6)), IR.mul(num(5), name("b")))));
  }

  @Test
  public void testRotationIsFollowedByAnotherFold() {
    // ((a + "x") + "y") + "z"
    test(
        assignX(IR.add(IR.add(IR.add(name("a"), str("x")), str("y")), str("z"))),
        "x=a+\"xyz\"");
  }
}
