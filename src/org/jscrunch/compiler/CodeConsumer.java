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

/**
 * Abstracted consumer of the CodeGenerator output.
 *
 * @see CodeGenerator
 */
abstract class CodeConsumer {
  boolean statementNeedsEnded = false;
  boolean statementStarted = false;

  /** Retrieve the last character of the last string sent to append. */
  abstract char getLastChar();

  /**
   * Appends a string to the code.
   *
   * <p>NOTE: the string must be a complete token.
   */
  abstract void append(String str);

  void addIdentifier(String identifier) {
    add(identifier);
  }

  void beginBlock() {
    if (statementNeedsEnded) {
      append(";");
    }
    append("{");
    statementNeedsEnded = false;
  }

  void endBlock() {
    append("}");
    statementNeedsEnded = false;
  }

  void listSeparator() {
    add(",");
  }

  /**
   * Indicates the end of a statement and a ';' may need to be added. But we don't add it now, in
   * case we're at the end of a block (in which case we don't have to add the ';').
   *
   * @see #maybeEndStatement()
   */
  void endStatement() {
    endStatement(false);
  }

  void endStatement(boolean needSemiColon) {
    if (needSemiColon) {
      append(";");
      statementNeedsEnded = false;
    } else if (statementStarted) {
      statementNeedsEnded = true;
    }
  }

  /**
   * This is to be called when we're in a statement. If the prev statement needs to be ended, add
   * a ';'.
   */
  void maybeEndStatement() {
    if (statementNeedsEnded) {
      append(";");
      statementNeedsEnded = false;
    }
    statementStarted = true;
  }

  void beginCaseBody() {
    append(":");
  }

  void add(String newcode) {
    maybeEndStatement();

    if (newcode.isEmpty()) {
      return;
    }

    char c = newcode.charAt(0);
    if ((isWordChar(c) || c == '\\') && isWordChar(getLastChar())) {
      // need space to separate. This is not pretty printing.
      // For example: "return foo;"
      append(" ");
    } else if (c == '.' && isDigit(getLastChar()) && !newcode.equals(".")) {
      // "1 .5" would otherwise print as the number 1.5
      append(" ");
    }

    append(newcode);
  }

  void addOp(String op) {
    maybeEndStatement();

    char first = op.charAt(0);
    char prev = getLastChar();

    if ((first == '+' || first == '-') && prev == first) {
      // This is not pretty printing. This is to prevent misparsing of
      // things like "x + ++y" or "x++ + ++y"
      append(" ");
    } else if (Character.isLetter(first) && isWordChar(prev)) {
      // Make sure there is a space after e.g. instanceof , typeof
      append(" ");
    } else if (prev == '-' && first == '>') {
      // Make sure that we don't emit -->
      append(" ");
    }

    append(op);
  }

  void addNumber(double x) {
    String text = formatNumber(x);
    // This is not pretty printing. This is to prevent misparsing of x- -4 as
    // x--4 (which is a syntax error).
    if (text.charAt(0) == '-' && getLastChar() == '-') {
      add(" ");
    }
    add(text);
  }

  /** The shortest source text this printer uses for a number literal. */
  static String formatNumber(double x) {
    if (Double.isNaN(x)) {
      return "NaN";
    } else if (Double.isInfinite(x)) {
      return x < 0 ? "-Infinity" : "Infinity";
    } else if (x == 0 && 1 / x < 0) {
      return "-0";
    } else if ((long) x == x) {
      long value = (long) x;
      long mantissa = value;
      int exp = 0;
      if (Math.abs(x) >= 100) {
        while (mantissa / 10 * Math.pow(10, exp + 1) == value) {
          mantissa /= 10;
          exp++;
        }
      }
      if (exp > 2) {
        return mantissa + "E" + exp;
      } else {
        return Long.toString(value);
      }
    } else {
      String text = String.valueOf(x);
      if (text.startsWith("0.")) {
        return text.substring(1);
      } else if (text.startsWith("-0.")) {
        return "-" + text.substring(2);
      }
      return text;
    }
  }

  static boolean isWordChar(char ch) {
    return ch == '_' || ch == '$' || Character.isLetterOrDigit(ch);
  }

  private static boolean isDigit(char ch) {
    return ch >= '0' && ch <= '9';
  }
}
