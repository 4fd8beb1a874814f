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

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class TriTest {

  @Test
  public void testNot() {
    assertThat(Tri.TRUE.not()).isEqualTo(Tri.FALSE);
    assertThat(Tri.FALSE.not()).isEqualTo(Tri.TRUE);
    assertThat(Tri.UNKNOWN.not()).isEqualTo(Tri.UNKNOWN);
  }

  @Test
  public void testAndOr() {
    assertThat(Tri.FALSE.and(Tri.UNKNOWN)).isEqualTo(Tri.FALSE);
    assertThat(Tri.TRUE.and(Tri.UNKNOWN)).isEqualTo(Tri.UNKNOWN);
    assertThat(Tri.TRUE.and(Tri.TRUE)).isEqualTo(Tri.TRUE);
    assertThat(Tri.UNKNOWN.or(Tri.TRUE)).isEqualTo(Tri.TRUE);
    assertThat(Tri.FALSE.or(Tri.UNKNOWN)).isEqualTo(Tri.UNKNOWN);
    assertThat(Tri.FALSE.or(Tri.FALSE)).isEqualTo(Tri.FALSE);
  }

  @Test
  public void testToBoolean() {
    assertThat(Tri.forBoolean(true).toBoolean(false)).isTrue();
    assertThat(Tri.UNKNOWN.toBoolean(true)).isTrue();
    assertThat(Tri.UNKNOWN.isKnown()).isFalse();
  }
}
