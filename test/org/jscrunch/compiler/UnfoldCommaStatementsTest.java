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

/** Tests for {@link UnfoldCommaStatements}. */
@RunWith(JUnit4.class)
public final class UnfoldCommaStatementsTest extends CrunchTestBase {

  @Override
  protected ImmutableList<AbstractPeepholeOptimization> getOptimizations() {
    return ImmutableList.of(new UnfoldCommaStatements());
  }

  private static Node commaStatement(Node... exprs) {
    return IR.exprResult(CommaExpressions.combineWithComma(exprs));
  }

  private static Node functionExpressionCall() {
    Node fn = IR.function(IR.name(""), IR.paramList(), IR.block());
    return IR.call(fn);
  }

  @Test
  public void testSplitInFunctionBodyDropsLiterals() {
    test(
        IR.script(function("h", commaStatement(call("f"), num(1), num(2)))),
        "function h(){f()}");
  }

  @Test
  public void testSplitAtTopLevel() {
    test(IR.script(commaStatement(call("a"), call("b"))), "a();b()");
    test(IR.script(commaStatement(call("a"), num(1), call("b"))), "a();b()");
  }

  @Test
  public void testSplitLongChain() {
    Node[] calls = new Node[1000];
    for (int i = 0; i < calls.length; i++) {
      calls[i] = call("f" + i);
    }
    Node script = IR.script(commaStatement(calls));
    process(script);
    assertThat(script.getChildCount()).isEqualTo(1000);
    assertThat(CodeGenerator.print(script.getLastChild())).isEqualTo("f999()");
  }

  @Test
  public void testUnsafeStatementStartStaysAttached() {
    testSame(IR.script(commaStatement(call("a"), functionExpressionCall())));
    test(
        IR.script(commaStatement(call("a"), functionExpressionCall(), call("b"))),
        "a(),function(){}();b()");
    test(
        IR.script(
            commaStatement(
                call("a"), IR.getprop(IR.objectlit(), "b"), IR.assign(name("c"), num(1)))),
        "a(),{}.b;c=1");
  }

  @Test
  public void testNoSplitInSingleStatementBranch() {
    testSame(IR.script(IR.ifNode(name("c"), IR.block(commaStatement(call("a"), call("b"))))));
  }

  @Test
  public void testSplitInBlockWithOtherStatements() {
    test(
        IR.script(
            IR.ifNode(
                name("c"),
                IR.block(commaStatement(call("a"), call("b")), IR.exprResult(call("d"))))),
        "if(c){a();b();d()}");
  }

  @Test
  public void testSplitInTryAndCatch() {
    Node tryCatch =
        IR.tryCatch(
            IR.block(commaStatement(call("a"), call("b"))),
            IR.catchNode(name("e"), IR.block(commaStatement(call("c"), call("d")))));
    test(IR.script(tryCatch), "try{a();b()}catch(e){c();d()}");
  }

  @Test
  public void testSplitInSwitchCase() {
    Node switchNode =
        IR.switchNode(
            name("x"),
            IR.caseNode(num(1), IR.block(commaStatement(call("a"), call("b")))),
            IR.defaultCase(IR.block(commaStatement(call("c"), call("d")))));
    Node script = IR.script(switchNode);
    process(script);
    Node caseBody = switchNode.getSecondChild().getLastChild();
    assertThat(caseBody.getChildCount()).isEqualTo(2);
    Node defaultBody = switchNode.getLastChild().getFirstChild();
    assertThat(defaultBody.getChildCount()).isEqualTo(2);
    assertThat(defaultBody.getFirstChild().getFirstChild().getToken()).isEqualTo(Token.CALL);
  }

  @Test
  public void testUnfoldDisallowed() {
    options =
        options.toBuilder().disallow(TreeModification.UNFOLD_COMMA_EXPRESSION_STATEMENTS).build();
    testSame(IR.script(commaStatement(call("a"), call("b"))));
  }
}
