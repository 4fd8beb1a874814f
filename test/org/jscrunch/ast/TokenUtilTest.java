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

import static com.google.common.truth.Truth.assertThat;

import org.jscrunch.base.Tri;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class TokenUtilTest {

  @Test
  public void testIsJSIdentifier() {
    assertThat(TokenUtil.isJSIdentifier("a")).isTrue();
    assertThat(TokenUtil.isJSIdentifier("$_a1")).isTrue();
    assertThat(TokenUtil.isJSIdentifier("")).isFalse();
    assertThat(TokenUtil.isJSIdentifier("1a")).isFalse();
    assertThat(TokenUtil.isJSIdentifier("a-b")).isFalse();
    assertThat(TokenUtil.isJSIdentifier("\u00e9t\u00e9")).isFalse();
  }

  @Test
  public void testIsSafePropertyName() {
    assertThat(TokenUtil.isSafePropertyName("length")).isTrue();
    assertThat(TokenUtil.isSafePropertyName("class")).isFalse();
    assertThat(TokenUtil.isSafePropertyName("int")).isFalse();
    assertThat(TokenUtil.isSafePropertyName("a b")).isFalse();
  }

  @Test
  public void testIsStrWhiteSpaceChar() {
    assertThat(TokenUtil.isStrWhiteSpaceChar(' ')).isEqualTo(Tri.TRUE);
    assertThat(TokenUtil.isStrWhiteSpaceChar(0xA0)).isEqualTo(Tri.TRUE);
    assertThat(TokenUtil.isStrWhiteSpaceChar(0x2003)).isEqualTo(Tri.TRUE);
    assertThat(TokenUtil.isStrWhiteSpaceChar('\u000B')).isEqualTo(Tri.UNKNOWN);
    assertThat(TokenUtil.isStrWhiteSpaceChar('x')).isEqualTo(Tri.FALSE);
  }
}
