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
import org.jscrunch.ast.Node;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link PeepholeFoldLiteralMembers}. */
@RunWith(JUnit4.class)
public final class PeepholeFoldLiteralMembersTest extends CrunchTestBase {

  @Override
  protected ImmutableList<AbstractPeepholeOptimization> getOptimizations() {
    return ImmutableList.of(new PeepholeFoldLiteralMembers());
  }

  private static Node length(Node target) {
    return IR.getprop(target, "length");
  }

  private static Node join(Node array, Node... separator) {
    return IR.call(IR.getprop(array, "join"), separator);
  }

  @Test
  public void testStringLength() {
    test(assignX(length(str("abc"))), "x=3");
    test(assignX(length(str(""))), "x=0");
    testSame(assignX(length(str("abc").setMayHaveIssues(true))));
  }

  @Test
  public void testArrayLength() {
    test(assignX(length(IR.arraylit(num(1), num(2)))), "x=2");
    test(assignX(length(IR.arraylit(name("a"), name("b"), name("c")))), "x=3");
    testSame(assignX(length(IR.arraylit(call("f")))));
  }

  @Test
  public void testLengthAsTargetIsKept() {
    testSame(statement(IR.assign(length(IR.arraylit(num(1))), num(3))));
    testSame(statement(IR.inc(length(str("ab")), true)));
  }

  @Test
  public void testLengthDisallowed() {
    options = options.toBuilder().disallow(TreeModification.EVALUATE_LITERAL_LENGTHS).build();
    testSame(assignX(length(str("abc"))));
  }

  @Test
  public void testJoin() {
    test(assignX(join(IR.arraylit(str("a"), str("b")), str("-"))), "x=\"a-b\"");
    test(assignX(join(IR.arraylit(num(1), num(2)))), "x=\"1,2\"");
    test(assignX(join(IR.arraylit(IR.nullNode(), str("a")), str(""))), "x=\"a\"");
    test(assignX(join(IR.arraylit(IR.trueNode(), num(2)), num(0))), "x=\"true02\"");
  }

  @Test
  public void testJoinNotFolded() {
    testSame(assignX(join(IR.arraylit(name("a"), str("b")))));
    testSame(assignX(join(IR.arraylit(num(1.5)))));
    testSame(assignX(join(IR.arraylit(str("a")), name("sep"))));
    testSame(assignX(join(IR.arraylit(str("a")), str("-"), str("+"))));
    testSame(assignX(IR.call(IR.getprop(name("a"), "join"))));
  }

  @Test
  public void testJoinDisallowed() {
    options = options.toBuilder().disallow(TreeModification.EVALUATE_LITERAL_JOINS).build();
    testSame(assignX(join(IR.arraylit(str("a"), str("b")), str("-"))));
  }
}
