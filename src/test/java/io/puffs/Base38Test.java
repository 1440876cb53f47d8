/*
 * Copyright © 2022,2023 James Crawford
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
 *
 */

package io.puffs;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class Base38Test {

  @Test public void encode() {
    assertEquals(0, Base38.encode("    "));
    assertEquals(1, Base38.encode("   0"));
    assertEquals(11, Base38.encode("   ?"));
    assertEquals(12, Base38.encode("   a"));
    assertEquals(38, Base38.encode("  0 "));
    assertEquals(Base38.MAX, Base38.encode("zzzz"));
    assertTrue(Base38.MAX < (1 << Base38.MAX_BITS));
  }

  @Test public void invalid() {
    assertEquals(Base38.INVALID, Base38.encode(null));
    assertEquals(Base38.INVALID, Base38.encode(""));
    assertEquals(Base38.INVALID, Base38.encode("abc"));
    assertEquals(Base38.INVALID, Base38.encode("abcde"));
    assertEquals(Base38.INVALID, Base38.encode("abcD"));
    assertEquals(Base38.INVALID, Base38.encode("ab-d"));
  }

  @Test public void packageIds() {
    assertTrue(Base38.isValidPackageId("defl"));
    assertTrue(Base38.isValidPackageId("gif "));
    assertFalse(Base38.isValidPackageId("    "));
    assertFalse(Base38.isValidPackageId("GIF "));
  }
}
