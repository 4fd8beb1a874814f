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

import com.google.common.collect.ImmutableSet;
import org.jscrunch.base.Tri;

/** Lexical helpers: identifiers, reserved words and white space. */
public final class TokenUtil {

  /** Keywords, literal names and future reserved words of every language level. */
  private static final ImmutableSet<String> RESERVED_WORDS =
      ImmutableSet.of(
          "break", "case", "catch", "class", "const", "continue", "debugger", "default",
          "delete", "do", "else", "enum", "export", "extends", "false", "finally", "for",
          "function", "if", "implements", "import", "in", "instanceof", "interface", "let",
          "new", "null", "package", "private", "protected", "public", "return", "static",
          "super", "switch", "this", "throw", "true", "try", "typeof", "var", "void",
          "while", "with", "yield",
          // Reserved in the third edition only.
          "abstract", "boolean", "byte", "char", "double", "final", "float", "goto", "int",
          "long", "native", "short", "synchronized", "throws", "transient", "volatile");

  private TokenUtil() {}

  public static boolean isKeyword(String name) {
    return RESERVED_WORDS.contains(name);
  }

  /**
   * Whether {@code s} is an identifier made only of basic Latin letters, digits, {@code $} and
   * {@code _}. Identifiers outside that set are legal but some engines mishandle them.
   */
  public static boolean isJSIdentifier(String s) {
    int length = s.length();
    if (length == 0) {
      return false;
    }
    if (!isIdentifierStart(s.charAt(0))) {
      return false;
    }
    for (int i = 1; i < length; i++) {
      char c = s.charAt(i);
      if (!isIdentifierStart(c) && !(c >= '0' && c <= '9')) {
        return false;
      }
    }
    return true;
  }

  private static boolean isIdentifierStart(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c == '$';
  }

  /** Whether {@code name} can be written after a dot: a safe identifier that is not reserved. */
  public static boolean isSafePropertyName(String name) {
    return isJSIdentifier(name) && !isKeyword(name);
  }

  /**
   * The StrWhiteSpaceChar production used when converting strings to numbers. The vertical tab
   * is {@link Tri#UNKNOWN}: older engines do not treat it as white space.
   */
  public static Tri isStrWhiteSpaceChar(int c) {
    return switch (c) {
      case '\u000B' -> Tri.UNKNOWN;
      case ' ', '\n', '\r', '\t', '\u00A0', '\u000C', '\u2028', '\u2029', '\uFEFF' -> Tri.TRUE;
      default -> (Character.getType(c) == Character.SPACE_SEPARATOR) ? Tri.TRUE : Tri.FALSE;
    };
  }
}
