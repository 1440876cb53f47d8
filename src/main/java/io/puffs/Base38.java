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

/**
 * Converts a 4 character package id, each character one of ' ', '0'-'9', '?' or 'a'-'z',
 * to a number in base 38. The string "    " maps to 0 which is not a legal package id.
 */
public class Base38 {

  /** Largest value returned by {@link #encode(String)}: 38^4 - 1 */
  public static final int MAX      = 38 * 38 * 38 * 38 - 1;
  public static final int MAX_BITS = 21;

  public static final int INVALID  = -1;

  private Base38() {}

  /**
   * Encode a package id
   * @param s  the 4 character string
   * @return the value in [0, MAX] or {@link #INVALID} if s is not encodable
   */
  public static int encode(String s) {
    if (s == null || s.length() != 4) {
      return INVALID;
    }
    int u = 0;
    for (int i = 0; i < 4; i++) {
      int x = digit(s.charAt(i));
      if (x < 0) {
        return INVALID;
      }
      u = u * 38 + x;
    }
    return u;
  }

  /**
   * Check that the string is a legal package id: encodable and not all spaces
   * @param s  the package id text
   * @return true if legal
   */
  public static boolean isValidPackageId(String s) {
    return encode(s) > 0;
  }

  private static int digit(char c) {
    if (c == ' ')             { return 0;            }
    if (c >= '0' && c <= '9') { return c - '0' + 1;  }
    if (c == '?')             { return 11;           }
    if (c >= 'a' && c <= 'z') { return c - 'a' + 12; }
    return -1;
  }
}
