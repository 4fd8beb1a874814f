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

import static com.google.common.base.Preconditions.checkState;

import org.jscrunch.ast.Node;
import org.jscrunch.ast.Token;
import org.jscrunch.ast.TokenUtil;

/**
 * CodeGenerator generates compact JavaScript source for an AST.
 *
 * <p>The printed length of a subtree is the size measure every never-larger rewrite decision is
 * based on.
 */
public class CodeGenerator {

  private final CodeConsumer cc;

  private CodeGenerator(CodeConsumer consumer) {
    cc = consumer;
  }

  /** Prints {@code n} as compact source text. */
  public static String print(Node n) {
    CompactCodeConsumer consumer = new CompactCodeConsumer();
    new CodeGenerator(consumer).add(n, isStatementLike(n) ? Context.STATEMENT : Context.OTHER);
    return consumer.toString();
  }

  /** The length of the text {@code n} prints as. */
  public static int size(Node n) {
    return print(n).length();
  }

  private static boolean isStatementLike(Node n) {
    Node parent = n.getParent();
    return n.isScript() || (parent != null && NodeUtil.isStatementBlock(parent));
  }

  private void add(String str) {
    cc.add(str);
  }

  private void add(Node n) {
    add(n, Context.OTHER);
  }

  private void add(Node n, Context context) {
    Token type = n.getToken();
    String opstr = NodeUtil.opToStr(type);
    Node first = n.getFirstChild();
    Node last = n.getLastChild();

    // Handle all binary operators
    if (type.isBinaryOperator()) {
      checkState(n.hasTwoChildren(), "Bad binary operator \"%s\": %s", opstr, n);
      int p = NodeUtil.precedence(type);

      // For right-hand-side of operations, only pass context if it's
      // the IN_FOR_INIT_CLAUSE one.
      Context rhsContext = getContextForNoInOperator(context);

      if (type.isAssignment()) {
        // Assignment operators are the only right-associative binary operators
        addExpr(first, NodeUtil.UPDATE_PRECEDENCE, context);
        cc.addOp(opstr);
        addExpr(last, p, rhsContext);
      } else if (type == Token.COMMA) {
        addExpr(first, p, context);
        cc.listSeparator();
        addExpr(last, p + 1, rhsContext);
      } else {
        addExpr(first, p, context);
        cc.addOp(opstr);
        addExpr(last, p + 1, rhsContext);
      }
      return;
    }

    switch (type) {
      case SCRIPT:
        for (Node c = first; c != null; c = c.getNext()) {
          add(c, Context.STATEMENT);
        }
        break;

      case BLOCK:
        cc.beginBlock();
        for (Node c = first; c != null; c = c.getNext()) {
          add(c, Context.STATEMENT);
        }
        cc.endBlock();
        break;

      case EXPR_RESULT:
        addExpr(first, NodeUtil.COMMA_PRECEDENCE, Context.START_OF_EXPR);
        cc.endStatement();
        break;

      case EMPTY:
        if (context == Context.STATEMENT) {
          cc.endStatement(true);
        }
        break;

      case VAR:
        add("var");
        addList(first, getContextForNoInOperator(context));
        if (context != Context.IN_FOR_INIT_CLAUSE) {
          cc.endStatement();
        }
        break;

      case NAME:
        cc.addIdentifier(n.getString());
        if (first != null) {
          // Declared with an initial value.
          cc.addOp("=");
          addExpr(first, NodeUtil.ASSIGNMENT_PRECEDENCE, getContextForNoInOperator(context));
        }
        break;

      case IF:
        {
          boolean hasElse = n.getChildCount() == 3;
          boolean ambiguousElseClause = context == Context.BEFORE_DANGLING_ELSE && !hasElse;
          if (ambiguousElseClause) {
            cc.beginBlock();
          }

          add("if(");
          add(first);
          add(")");

          if (hasElse) {
            addNonEmptyStatement(first.getNext(), Context.BEFORE_DANGLING_ELSE);
            add("else");
            addNonEmptyStatement(last, getContextForNonEmptyExpression(context));
          } else {
            addNonEmptyStatement(first.getNext(), Context.OTHER);
          }

          if (ambiguousElseClause) {
            cc.endBlock();
          }
          break;
        }

      case WHILE:
        add("while(");
        add(first);
        add(")");
        addNonEmptyStatement(last, getContextForNonEmptyExpression(context));
        break;

      case DO:
        add("do");
        addNonEmptyStatement(first, Context.OTHER);
        add("while(");
        add(last);
        add(")");
        cc.endStatement();
        break;

      case FOR:
        {
          add("for(");
          if (first.isVar()) {
            add(first, Context.IN_FOR_INIT_CLAUSE);
          } else {
            addExpr(first, NodeUtil.COMMA_PRECEDENCE, Context.IN_FOR_INIT_CLAUSE);
          }
          add(";");
          add(first.getNext());
          add(";");
          add(first.getNext().getNext());
          add(")");
          addNonEmptyStatement(last, getContextForNonEmptyExpression(context));
          break;
        }

      case RETURN:
        add("return");
        if (first != null) {
          add(first);
        }
        cc.endStatement();
        break;

      case THROW:
        add("throw");
        add(first);
        cc.endStatement();
        break;

      case BREAK:
        add("break");
        cc.endStatement();
        break;

      case CONTINUE:
        add("continue");
        cc.endStatement();
        break;

      case TRY:
        {
          add("try");
          add(first);
          Node catchNode = first.getNext();
          if (catchNode.getToken() == Token.CATCH) {
            add(catchNode);
          }
          if (n.getChildCount() == 3) {
            add("finally");
            add(last);
          }
          break;
        }

      case CATCH:
        add("catch(");
        add(first);
        add(")");
        add(last);
        break;

      case SWITCH:
        add("switch(");
        add(first);
        add(")");
        cc.beginBlock();
        for (Node c = first.getNext(); c != null; c = c.getNext()) {
          add(c);
        }
        cc.endBlock();
        break;

      case CASE:
        add("case");
        add(first);
        cc.beginCaseBody();
        addCaseBody(last);
        break;

      case DEFAULT_CASE:
        add("default");
        cc.beginCaseBody();
        addCaseBody(first);
        break;

      case FUNCTION:
        {
          boolean funcNeedsParens = context == Context.START_OF_EXPR;
          if (funcNeedsParens) {
            add("(");
          }
          add("function");
          String name = first.getString();
          if (!name.isEmpty()) {
            cc.addIdentifier(name);
          }
          add(first.getNext());
          add(last);
          if (funcNeedsParens) {
            add(")");
          }
          break;
        }

      case PARAM_LIST:
        add("(");
        addList(first, Context.OTHER);
        add(")");
        break;

      case PAREN:
        add("(");
        add(first);
        add(")");
        break;

      case EXPR_LIST:
        addList(first, getContextForNoInOperator(context));
        break;

      case HOOK:
        {
          int p = NodeUtil.precedence(type);
          Context rhsContext = getContextForNoInOperator(context);
          addExpr(first, p + 1, context);
          cc.addOp("?");
          addExpr(first.getNext(), NodeUtil.ASSIGNMENT_PRECEDENCE, rhsContext);
          cc.addOp(":");
          addExpr(last, NodeUtil.ASSIGNMENT_PRECEDENCE, rhsContext);
          break;
        }

      case TYPEOF:
      case VOID:
      case DELPROP:
      case NOT:
      case BITNOT:
      case POS:
      case NEG:
        cc.addOp(opstr);
        addExpr(first, NodeUtil.UNARY_PRECEDENCE, Context.OTHER);
        break;

      case INC:
      case DEC:
        if (n.isPostfix()) {
          addExpr(first, NodeUtil.UPDATE_PRECEDENCE, context);
          cc.addOp(opstr);
        } else {
          cc.addOp(opstr);
          addExpr(first, NodeUtil.UNARY_PRECEDENCE, Context.OTHER);
        }
        break;

      case CALL:
        addExpr(first, NodeUtil.PRIMARY_PRECEDENCE, context);
        add("(");
        addList(first.getNext(), Context.OTHER);
        add(")");
        break;

      case NEW:
        add("new");
        // A call in the constructor position would take the argument list of the new.
        if (first.isCall()) {
          add("(");
          add(first);
          add(")");
        } else {
          addExpr(first, NodeUtil.PRIMARY_PRECEDENCE, Context.OTHER);
        }
        add("(");
        addList(first.getNext(), Context.OTHER);
        add(")");
        break;

      case GETPROP:
        {
          boolean needsParens = first.isNumber();
          if (needsParens) {
            add("(");
            add(first);
            add(")");
          } else {
            addExpr(first, NodeUtil.PRIMARY_PRECEDENCE, context);
          }
          add(".");
          cc.addIdentifier(n.getString());
          break;
        }

      case GETELEM:
        addExpr(first, NodeUtil.PRIMARY_PRECEDENCE, context);
        add("[");
        add(last);
        add("]");
        break;

      case THIS:
        add("this");
        break;

      case NULL:
        add("null");
        break;

      case TRUE:
        add("true");
        break;

      case FALSE:
        add("false");
        break;

      case NUMBER:
        cc.addNumber(n.getDouble());
        break;

      case STRINGLIT:
        add(jsString(n.getString()));
        break;

      case REGEXP:
        add(n.getString());
        break;

      case ARRAYLIT:
        add("[");
        addArrayList(first);
        add("]");
        break;

      case OBJECTLIT:
        {
          boolean needsParens = context == Context.START_OF_EXPR;
          if (needsParens) {
            add("(");
          }
          add("{");
          for (Node c = first; c != null; c = c.getNext()) {
            if (c != first) {
              cc.listSeparator();
            }
            add(c);
          }
          add("}");
          if (needsParens) {
            add(")");
          }
          break;
        }

      case STRING_KEY:
        {
          String key = n.getString();
          // Object literal property names don't have to be quoted if they are not JavaScript
          // keywords.
          if (TokenUtil.isSafePropertyName(key)) {
            cc.addIdentifier(key);
          } else {
            add(jsString(key));
          }
          add(":");
          addExpr(first, NodeUtil.ASSIGNMENT_PRECEDENCE, Context.OTHER);
          break;
        }

      default:
        throw new IllegalStateException("Unknown token " + type + "\n" + n.toStringTree());
    }
  }

  /** Prints a loop or branch body, dropping braces that are not needed. */
  private void addNonEmptyStatement(Node n, Context context) {
    Node nodeToProcess = n;

    // Strip unneeded blocks, that is blocks with <2 children.
    if (n.isBlock()) {
      int count = n.getChildCount();
      if (count == 0) {
        cc.endStatement(true);
        return;
      }

      if (count == 1) {
        // Function declarations are not allowed by themselves in "if" and other structures.
        // Also, hack around a IE6/7 browser bug that needs a block around DOs.
        Node firstAndOnlyChild = n.getFirstChild();
        if (firstAndOnlyChild.isFunction() || firstAndOnlyChild.getToken() == Token.DO) {
          add(n);
          return;
        }
        nodeToProcess = firstAndOnlyChild;
      } else {
        add(n);
        return;
      }
    }

    if (nodeToProcess.isEmpty()) {
      cc.endStatement(true);
    } else if (nodeToProcess.isBlock()) {
      add(nodeToProcess);
    } else {
      add(nodeToProcess, context == Context.BEFORE_DANGLING_ELSE ? context : Context.STATEMENT);
    }
  }

  private void addCaseBody(Node body) {
    for (Node c = body.getFirstChild(); c != null; c = c.getNext()) {
      add(c, Context.STATEMENT);
    }
  }

  private void addExpr(Node n, int minPrecedence, Context context) {
    if (opRequiresParentheses(n, minPrecedence, context)) {
      add("(");
      add(n, Context.OTHER);
      add(")");
    } else {
      add(n, context);
    }
  }

  private static boolean opRequiresParentheses(Node n, int minPrecedence, Context context) {
    if (context == Context.IN_FOR_INIT_CLAUSE && n.getToken() == Token.IN) {
      // make sure this operator 'in' isn't confused with the for-loop 'in'
      return true;
    }
    return NodeUtil.precedence(n) < minPrecedence;
  }

  private void addList(Node firstInList, Context lhsContext) {
    for (Node n = firstInList; n != null; n = n.getNext()) {
      if (n != firstInList) {
        cc.listSeparator();
      }
      addExpr(n, NodeUtil.ASSIGNMENT_PRECEDENCE, lhsContext);
    }
  }

  private void addArrayList(Node firstInList) {
    boolean lastWasEmpty = false;
    for (Node n = firstInList; n != null; n = n.getNext()) {
      if (n != firstInList) {
        cc.listSeparator();
      }
      addExpr(n, NodeUtil.ASSIGNMENT_PRECEDENCE, Context.OTHER);
      lastWasEmpty = n.isEmpty();
    }

    if (lastWasEmpty) {
      cc.listSeparator();
    }
  }

  /** Outputs a JS string, using the optimal (single/double) quote character. */
  static String jsString(String s) {
    int singleq = 0;
    int doubleq = 0;

    // could count the quotes and pick the optimal quote character
    for (int i = 0; i < s.length(); i++) {
      switch (s.charAt(i)) {
        case '"':
          doubleq++;
          break;
        case '\'':
          singleq++;
          break;
        default: // skip non-quote characters
      }
    }

    String doublequote;
    String singlequote;
    char quote;
    if (singleq < doubleq) {
      // more double quotes so enclose in single quotes.
      quote = '\'';
      doublequote = "\"";
      singlequote = "\\'";
    } else {
      // more single quotes so escape the doubles
      quote = '"';
      doublequote = "\\\"";
      singlequote = "'";
    }

    return quote + strEscape(s, doublequote, singlequote) + quote;
  }

  private static String strEscape(String s, String doublequoteEscape, String singlequoteEscape) {
    StringBuilder sb = new StringBuilder(s.length() + 2);
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '\0':
          sb.append("\\x00");
          break;
        case '\u000B':
          sb.append("\\x0B");
          break;
        // From the SingleEscapeCharacter grammar production.
        case '\b':
          sb.append("\\b");
          break;
        case '\f':
          sb.append("\\f");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '"':
          sb.append(doublequoteEscape);
          break;
        case '\'':
          sb.append(singlequoteEscape);
          break;
        default:
          if (c >= 0x20 && c < 0x7f) {
            sb.append(c);
          } else {
            appendHexJavaScriptRepresentation(sb, c);
          }
      }
    }
    return sb.toString();
  }

  /** Outputs a non-ASCII or control character as an escape sequence. */
  private static void appendHexJavaScriptRepresentation(StringBuilder sb, char c) {
    if (c < 0x100) {
      sb.append(String.format("\\x%02x", (int) c));
    } else {
      sb.append(String.format("\\u%04x", (int) c));
    }
  }

  /** Where in the output the node being printed appears. */
  enum Context {
    STATEMENT,
    BEFORE_DANGLING_ELSE, // a hack to resolve the else-clause ambiguity
    START_OF_EXPR,
    IN_FOR_INIT_CLAUSE, // pass this context to prevent 'in' operators being printed unguarded
    OTHER
  }

  private static Context getContextForNonEmptyExpression(Context currentContext) {
    return currentContext == Context.BEFORE_DANGLING_ELSE
        ? Context.BEFORE_DANGLING_ELSE
        : Context.OTHER;
  }

  /**
   * If we're in a IN_FOR_INIT_CLAUSE, we can't permit in operators in the expression. Pass on
   * the IN_FOR_INIT_CLAUSE flag through subexpressions.
   */
  private static Context getContextForNoInOperator(Context context) {
    return context == Context.IN_FOR_INIT_CLAUSE ? context : Context.OTHER;
  }

  /** Writes into a single buffer with no formatting. */
  private static final class CompactCodeConsumer extends CodeConsumer {
    private final StringBuilder sb = new StringBuilder();

    @Override
    char getLastChar() {
      return sb.length() > 0 ? sb.charAt(sb.length() - 1) : '\0';
    }

    @Override
    void append(String str) {
      sb.append(str);
    }

    @Override
    public String toString() {
      return sb.toString();
    }
  }
}
