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

package org.jscrunch.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/** A syntax tree construction helper class. */
public class IR {

  private IR() {}

  public static Node empty() {
    return new Node(Token.EMPTY);
  }

  public static Node script(Node... stmts) {
    Node script = new Node(Token.SCRIPT);
    for (Node stmt : stmts) {
      checkState(mayBeStatement(stmt), "Script cannot contain %s", stmt.getToken());
      script.addChildToBack(stmt);
    }
    return script;
  }

  public static Node block(Node... stmts) {
    Node block = new Node(Token.BLOCK);
    for (Node stmt : stmts) {
      checkState(mayBeStatement(stmt), "Block node cannot contain %s", stmt.getToken());
      block.addChildToBack(stmt);
    }
    return block;
  }

  public static Node function(Node name, Node params, Node body) {
    checkState(name.isName());
    checkState(params.getToken() == Token.PARAM_LIST);
    checkState(body.isBlock());
    return new Node(Token.FUNCTION, name, params, body);
  }

  public static Node paramList(String... names) {
    Node params = new Node(Token.PARAM_LIST);
    for (String name : names) {
      params.addChildToBack(name(name));
    }
    return params;
  }

  public static Node var(Node name) {
    checkState(name.isName());
    return new Node(Token.VAR, name);
  }

  public static Node var(Node name, Node value) {
    checkState(name.isName() && !name.hasChildren());
    checkState(mayBeExpression(value), value);
    name.addChildToBack(value);
    return new Node(Token.VAR, name);
  }

  public static Node exprResult(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.EXPR_RESULT, expr);
  }

  public static Node returnNode() {
    return new Node(Token.RETURN);
  }

  public static Node returnNode(Node expr) {
    checkState(mayBeExpression(expr));
    return new Node(Token.RETURN, expr);
  }

  public static Node ifNode(Node cond, Node then) {
    checkState(mayBeExpression(cond));
    checkState(then.isBlock());
    return new Node(Token.IF, cond, then);
  }

  public static Node ifNode(Node cond, Node then, Node elseNode) {
    checkState(mayBeExpression(cond));
    checkState(then.isBlock());
    checkState(elseNode.isBlock());
    return new Node(Token.IF, cond, then, elseNode);
  }

  public static Node whileNode(Node cond, Node body) {
    checkState(mayBeExpression(cond));
    checkState(body.isBlock());
    return new Node(Token.WHILE, cond, body);
  }

  public static Node doNode(Node body, Node cond) {
    checkState(body.isBlock());
    checkState(mayBeExpression(cond));
    return new Node(Token.DO, body, cond);
  }

  /** A for loop; pass {@link #empty()} for any clause that is absent. */
  public static Node forNode(Node init, Node cond, Node incr, Node body) {
    checkState(init.isVar() || init.isEmpty() || mayBeExpression(init));
    checkState(cond.isEmpty() || mayBeExpression(cond));
    checkState(incr.isEmpty() || mayBeExpression(incr));
    checkState(body.isBlock());
    Node forNode = new Node(Token.FOR, init, cond, incr);
    forNode.addChildToBack(body);
    return forNode;
  }

  public static Node tryCatch(Node tryBody, Node catchNode) {
    checkState(tryBody.isBlock());
    checkState(catchNode.getToken() == Token.CATCH);
    return new Node(Token.TRY, tryBody, catchNode);
  }

  public static Node catchNode(Node name, Node body) {
    checkState(name.isName());
    checkState(body.isBlock());
    return new Node(Token.CATCH, name, body);
  }

  public static Node switchNode(Node cond, Node... cases) {
    checkState(mayBeExpression(cond));
    Node switchNode = new Node(Token.SWITCH, cond);
    for (Node caseNode : cases) {
      checkState(
          caseNode.getToken() == Token.CASE || caseNode.getToken() == Token.DEFAULT_CASE);
      switchNode.addChildToBack(caseNode);
    }
    return switchNode;
  }

  public static Node caseNode(Node expr, Node body) {
    checkState(mayBeExpression(expr));
    checkState(body.isBlock());
    return new Node(Token.CASE, expr, body);
  }

  public static Node defaultCase(Node body) {
    checkState(body.isBlock());
    return new Node(Token.DEFAULT_CASE, body);
  }

  public static Node breakNode() {
    return new Node(Token.BREAK);
  }

  // Expressions.

  public static Node name(String name) {
    return Node.newString(Token.NAME, name);
  }

  public static Node call(Node target, Node... args) {
    checkState(mayBeExpression(target));
    Node call = new Node(Token.CALL, target);
    for (Node arg : args) {
      checkState(mayBeExpression(arg), arg);
      call.addChildToBack(arg);
    }
    return call;
  }

  /** {@code target.prop}; the property name is the string of the GETPROP node itself. */
  public static Node getprop(Node target, String prop) {
    checkState(mayBeExpression(target));
    Node getprop = Node.newString(Token.GETPROP, prop);
    getprop.addChildToBack(target);
    return getprop;
  }

  public static Node getelem(Node target, Node elem) {
    checkState(mayBeExpression(target));
    checkState(mayBeExpression(elem));
    return new Node(Token.GETELEM, target, elem);
  }

  public static Node assign(Node target, Node expr) {
    return binaryOp(Token.ASSIGN, target, expr);
  }

  public static Node hook(Node cond, Node trueval, Node falseval) {
    checkState(mayBeExpression(cond));
    checkState(mayBeExpression(trueval));
    checkState(mayBeExpression(falseval));
    return new Node(Token.HOOK, cond, trueval, falseval);
  }

  public static Node paren(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.PAREN, expr);
  }

  public static Node comma(Node expr1, Node expr2) {
    return binaryOp(Token.COMMA, expr1, expr2);
  }

  /** The list form used for the tail of a flattened comma chain. */
  public static Node exprList(Node... exprs) {
    Node list = new Node(Token.EXPR_LIST);
    for (Node expr : exprs) {
      checkState(mayBeExpression(expr), expr);
      list.addChildToBack(expr);
    }
    return list;
  }

  public static Node and(Node expr1, Node expr2) {
    return binaryOp(Token.AND, expr1, expr2);
  }

  public static Node or(Node expr1, Node expr2) {
    return binaryOp(Token.OR, expr1, expr2);
  }

  public static Node not(Node expr) {
    return unaryOp(Token.NOT, expr);
  }

  public static Node eq(Node expr1, Node expr2) {
    return binaryOp(Token.EQ, expr1, expr2);
  }

  public static Node ne(Node expr1, Node expr2) {
    return binaryOp(Token.NE, expr1, expr2);
  }

  public static Node sheq(Node expr1, Node expr2) {
    return binaryOp(Token.SHEQ, expr1, expr2);
  }

  public static Node shne(Node expr1, Node expr2) {
    return binaryOp(Token.SHNE, expr1, expr2);
  }

  public static Node lt(Node expr1, Node expr2) {
    return binaryOp(Token.LT, expr1, expr2);
  }

  public static Node add(Node expr1, Node expr2) {
    return binaryOp(Token.ADD, expr1, expr2);
  }

  public static Node sub(Node expr1, Node expr2) {
    return binaryOp(Token.SUB, expr1, expr2);
  }

  public static Node mul(Node expr1, Node expr2) {
    return binaryOp(Token.MUL, expr1, expr2);
  }

  public static Node div(Node expr1, Node expr2) {
    return binaryOp(Token.DIV, expr1, expr2);
  }

  public static Node mod(Node expr1, Node expr2) {
    return binaryOp(Token.MOD, expr1, expr2);
  }

  public static Node voidNode(Node expr) {
    return unaryOp(Token.VOID, expr);
  }

  public static Node typeof(Node expr) {
    return unaryOp(Token.TYPEOF, expr);
  }

  public static Node neg(Node expr) {
    return unaryOp(Token.NEG, expr);
  }

  public static Node pos(Node expr) {
    return unaryOp(Token.POS, expr);
  }

  public static Node inc(Node expr, boolean isPost) {
    return unaryOp(Token.INC, expr).setPostfix(isPost);
  }

  public static Node dec(Node expr, boolean isPost) {
    return unaryOp(Token.DEC, expr).setPostfix(isPost);
  }

  /** Any binary operator, assignments and the comma included. */
  public static Node binaryOp(Token token, Node expr1, Node expr2) {
    checkArgument(token.isBinaryOperator(), token);
    checkState(mayBeExpression(expr1), expr1);
    checkState(mayBeExpression(expr2) || expr2.isExprList(), expr2);
    return new Node(token, expr1, expr2);
  }

  /** Any prefix unary operator. */
  public static Node unaryOp(Token token, Node expr) {
    checkArgument(token.isUnaryOperator(), token);
    checkState(mayBeExpression(expr), expr);
    return new Node(token, expr);
  }

  // Literals.

  public static Node number(double d) {
    return Node.newNumber(d);
  }

  public static Node string(String s) {
    return Node.newString(s);
  }

  public static Node trueNode() {
    return new Node(Token.TRUE);
  }

  public static Node falseNode() {
    return new Node(Token.FALSE);
  }

  public static Node nullNode() {
    return new Node(Token.NULL);
  }

  /** A regular expression literal; the string holds the full source, slashes and flags. */
  public static Node regexp(String source) {
    return Node.newString(Token.REGEXP, source);
  }

  public static Node arraylit(Node... exprs) {
    Node arraylit = new Node(Token.ARRAYLIT);
    for (Node expr : exprs) {
      checkState(expr.isEmpty() || mayBeExpression(expr));
      arraylit.addChildToBack(expr);
    }
    return arraylit;
  }

  public static Node objectlit(Node... propdefs) {
    Node objectlit = new Node(Token.OBJECTLIT);
    for (Node propdef : propdefs) {
      checkState(propdef.getToken() == Token.STRING_KEY && propdef.hasOneChild());
      objectlit.addChildToBack(propdef);
    }
    return objectlit;
  }

  public static Node stringKey(String s, Node value) {
    checkState(mayBeExpression(value));
    Node stringKey = Node.newString(Token.STRING_KEY, s);
    stringKey.addChildToBack(value);
    return stringKey;
  }

  /** It isn't possible to always determine if a detached node is a statement; best guess. */
  public static boolean mayBeStatement(Node n) {
    switch (n.getToken()) {
      case EMPTY:
      case FUNCTION:
      case BLOCK:
      case BREAK:
      case CONTINUE:
      case DO:
      case EXPR_RESULT:
      case FOR:
      case IF:
      case RETURN:
      case SWITCH:
      case THROW:
      case TRY:
      case VAR:
      case WHILE:
        return true;
      default:
        return false;
    }
  }

  /** It isn't possible to always determine if a detached node is an expression; best guess. */
  public static boolean mayBeExpression(Node n) {
    Token token = n.getToken();
    if (token.isBinaryOperator() || token.isUnaryOperator()) {
      return true;
    }
    switch (token) {
      case FUNCTION:
      case HOOK:
      case PAREN:
      case CALL:
      case NEW:
      case GETPROP:
      case GETELEM:
      case NAME:
      case THIS:
      case NUMBER:
      case STRINGLIT:
      case TRUE:
      case FALSE:
      case NULL:
      case REGEXP:
      case ARRAYLIT:
      case OBJECTLIT:
        return true;
      default:
        return false;
    }
  }
}
