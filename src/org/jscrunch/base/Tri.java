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

/**
 * A three-valued boolean: true, false or "cannot be determined statically".
 *
 * <p>Coercions that may fail report {@link #UNKNOWN} rather than throwing.
 */
public enum Tri {
  FALSE,
  TRUE,
  UNKNOWN;

  public static Tri forBoolean(boolean value) {
    return value ? TRUE : FALSE;
  }

  public Tri not() {
    switch (this) {
      case TRUE:
        return FALSE;
      case FALSE:
        return TRUE;
      default:
        return UNKNOWN;
    }
  }

  public Tri and(Tri other) {
    if (this == FALSE || other == FALSE) {
      return FALSE;
    }
    return (this == TRUE && other == TRUE) ? TRUE : UNKNOWN;
  }

  public Tri or(Tri other) {
    if (this == TRUE || other == TRUE) {
      return TRUE;
    }
    return (this == FALSE && other == FALSE) ? FALSE : UNKNOWN;
  }

  public boolean isKnown() {
    return this != UNKNOWN;
  }

  /** Returns the boolean value, or {@code defaultValue} when unknown. */
  public boolean toBoolean(boolean defaultValue) {
    switch (this) {
      case TRUE:
        return true;
      case FALSE:
        return false;
      default:
        return defaultValue;
    }
  }
}
