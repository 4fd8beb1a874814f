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

package org.jscrunch.base;

/** Double arithmetic with ECMAScript semantics. */
public final class JsDoubles {

  /** The largest integer magnitude a double holds without losing precision: 2^53. */
  public static final double MAX_EXACT_INTEGER = 9007199254740992.0;

  private JsDoubles() {}

  public static boolean isPositiveZero(double x) {
    return x == 0.0 && 1 / x > 0;
  }

  public static boolean isNegativeZero(double x) {
    return x == 0.0 && 1 / x < 0;
  }

  public static boolean isEitherZero(double x) {
    return x == 0.0;
  }

  /** Whether {@code x} is a finite double with no fractional part. */
  public static boolean isMathematicalInteger(double x) {
    return !Double.isNaN(x) && !Double.isInfinite(x) && Math.floor(x) == x;
  }

  /**
   * The ToInt32 abstract operation: NaN and the infinities map to zero; everything else is
   * truncated and wrapped modulo 2^32 into the signed range.
   */
  public static int ecmascriptToInt32(double number) {
    return (int) ecmascriptToUint32(number);
  }

  /** The ToUint32 abstract operation. */
  public static long ecmascriptToUint32(double number) {
    if (Double.isNaN(number) || Double.isInfinite(number)) {
      return 0;
    }
    double truncated = number < 0 ? Math.ceil(number) : Math.floor(number);
    double modulo = truncated % 4294967296.0;
    if (modulo < 0) {
      modulo += 4294967296.0;
    }
    return (long) modulo;
  }
}
