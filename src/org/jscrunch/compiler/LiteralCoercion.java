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

import com.google.common.annotations.VisibleForTesting;
import java.math.BigInteger;
import java.util.regex.Pattern;
import org.jscrunch.ast.Node;
import org.jscrunch.ast.TokenUtil;
import org.jscrunch.base.JsDoubles;
import org.jscrunch.base.Tri;
import org.jspecify.annotations.Nullable;

/**
 * The language's implicit conversions applied to literal nodes at compile time.
 *
 * <p>Every conversion may fail. A null result (or {@link Tri#UNKNOWN}) means the value cannot be
 * computed safely and the caller must leave the code as it is.
 */
public final class LiteralCoercion {

  private static final Pattern DECIMAL_LITERAL =
      Pattern.compile("[+-]?(?:[0-9]+\\.?[0-9]*|\\.[0-9]+)(?:[eE][+-]?[0-9]+)?");

  private static final Pattern HEX_LITERAL = Pattern.compile("0[xX][0-9a-fA-F]+");

  private static final Pattern OCTAL_LITERAL = Pattern.compile("0[oO][0-7]+");

  private static final Pattern BINARY_LITERAL = Pattern.compile("0[bB][01]+");

  private LiteralCoercion() {}

  /**
   * Whether a number can take part in a fold. NaN and the infinities always can. Otherwise only
   * integers up to 2^53 in magnitude: their text is the same in every engine.
   */
  public static boolean numberIsOkayToCombine(double x) {
    return Double.isNaN(x)
        || Double.isInfinite(x)
        || (JsDoubles.isMathematicalInteger(x) && Math.abs(x) <= JsDoubles.MAX_EXACT_INTEGER);
  }

  /** Whether a literal may be combined with another into a new literal. */
  public static boolean isOkayToCombine(Node literal) {
    if (!NodeUtil.isLiteral(literal) || literal.mayHaveIssues()) {
      return false;
    }
    return !literal.isNumber() || numberIsOkayToCombine(literal.getDouble());
  }

  /** ToNumber of a literal, or null if it cannot be computed. */
  public static @Nullable Double toNumber(Node literal) {
    if (literal.mayHaveIssues()) {
      return null;
    }
    switch (literal.getToken()) {
      case NUMBER:
        return literal.getDouble();
      case TRUE:
        return 1.0;
      case FALSE:
      case NULL:
        return 0.0;
      case STRINGLIT:
        return stringToNumber(literal.getString());
      default:
        return null;
    }
  }

  /** ToNumber applied to a string value, or null if engines disagree on the result. */
  @VisibleForTesting
  static @Nullable Double stringToNumber(String rawJsString) {
    int start = 0;
    int end = rawJsString.length();
    while (start < end) {
      Tri isWhite = TokenUtil.isStrWhiteSpaceChar(rawJsString.charAt(start));
      if (isWhite == Tri.UNKNOWN) {
        return null;
      } else if (isWhite == Tri.FALSE) {
        break;
      }
      start++;
    }
    while (end > start) {
      Tri isWhite = TokenUtil.isStrWhiteSpaceChar(rawJsString.charAt(end - 1));
      if (isWhite == Tri.UNKNOWN) {
        return null;
      } else if (isWhite == Tri.FALSE) {
        break;
      }
      end--;
    }

    String s = rawJsString.substring(start, end);
    if (s.isEmpty()) {
      return 0.0;
    }
    if (HEX_LITERAL.matcher(s).matches()) {
      return new BigInteger(s.substring(2), 16).doubleValue();
    }
    if (OCTAL_LITERAL.matcher(s).matches()) {
      return new BigInteger(s.substring(2), 8).doubleValue();
    }
    if (BINARY_LITERAL.matcher(s).matches()) {
      return new BigInteger(s.substring(2), 2).doubleValue();
    }
    switch (s) {
      case "Infinity":
      case "+Infinity":
        return Double.POSITIVE_INFINITY;
      case "-Infinity":
        return Double.NEGATIVE_INFINITY;
      default:
        break;
    }
    if (DECIMAL_LITERAL.matcher(s).matches()) {
      return Double.parseDouble(s);
    }
    return Double.NaN;
  }

  /** ToInt32 of a literal, or null if its number value is unknown. */
  public static @Nullable Integer toInt32(Node literal) {
    Double d = toNumber(literal);
    return d == null ? null : JsDoubles.ecmascriptToInt32(d);
  }

  /** ToUint32 of a literal, or null if its number value is unknown. */
  public static @Nullable Long toUint32(Node literal) {
    Double d = toNumber(literal);
    return d == null ? null : JsDoubles.ecmascriptToUint32(d);
  }

  /** ToBoolean of a literal. */
  public static Tri toBoolean(Node literal) {
    switch (literal.getToken()) {
      case NUMBER:
        {
          double d = literal.getDouble();
          return Tri.forBoolean(!Double.isNaN(d) && d != 0);
        }
      case STRINGLIT:
        return Tri.forBoolean(!literal.getString().isEmpty());
      case TRUE:
        return Tri.TRUE;
      case FALSE:
      case NULL:
        return Tri.FALSE;
      default:
        return Tri.UNKNOWN;
    }
  }

  /**
   * ToString of a literal, or null when the text is not reliably the same in every engine
   * (fractional numbers, and literals flagged as having issues).
   */
  public static @Nullable String toDisplayString(Node literal) {
    if (literal.mayHaveIssues()) {
      return null;
    }
    switch (literal.getToken()) {
      case STRINGLIT:
        return literal.getString();
      case TRUE:
        return "true";
      case FALSE:
        return "false";
      case NULL:
        return "null";
      case NUMBER:
        return numberToString(literal.getDouble());
      default:
        return null;
    }
  }

  /** ToString of a number that is okay to combine; null for any other number. */
  static @Nullable String numberToString(double d) {
    if (!numberIsOkayToCombine(d)) {
      return null;
    }
    if (Double.isNaN(d)) {
      return "NaN";
    }
    if (Double.isInfinite(d)) {
      return d > 0 ? "Infinity" : "-Infinity";
    }
    // Integers up to 2^53 print without exponent; negative zero prints as "0".
    return Long.toString((long) d);
  }
}
