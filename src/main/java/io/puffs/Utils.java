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

import java.util.Set;

public class Utils {

  public static final Set<String> UNROLL_COUNTS = Set.of("1", "2", "4", "8", "16", "32", "64", "128", "256");

  /**
   * Unescape a double quoted string literal as it appears in source (quotes included).
   * Supported escapes are \\, \", \n, \r, \t, \0 and \xHH.
   * @param raw  the literal text including surrounding quotes
   * @return the unescaped contents or null if the literal is malformed
   */
  public static String unescape(String raw) {
    if (raw == null || raw.length() < 2 || raw.charAt(0) != '"' || raw.charAt(raw.length() - 1) != '"') {
      return null;
    }
    String        body = raw.substring(1, raw.length() - 1);
    StringBuilder sb   = new StringBuilder(body.length());
    for (int i = 0; i < body.length(); i++) {
      char c = body.charAt(i);
      if (c == '"') {
        return null;     // Unescaped quote inside literal
      }
      if (c != '\\') {
        sb.append(c);
        continue;
      }
      if (++i >= body.length()) {
        return null;
      }
      switch (body.charAt(i)) {
        case '\\': sb.append('\\'); break;
        case '"':  sb.append('"');  break;
        case 'n':  sb.append('\n'); break;
        case 'r':  sb.append('\r'); break;
        case 't':  sb.append('\t'); break;
        case '0':  sb.append('\0'); break;
        case 'x': {
          if (i + 2 >= body.length()) {
            return null;
          }
          int hi = Character.digit(body.charAt(i + 1), 16);
          int lo = Character.digit(body.charAt(i + 2), 16);
          if (hi < 0 || lo < 0) {
            return null;
          }
          sb.append((char)(hi * 16 + lo));
          i += 2;
          break;
        }
        default:
          return null;
      }
    }
    return sb.toString();
  }

  /**
   * Quote a string for use in an error message
   * @param s  the string
   * @return the string in double quotes with quotes and backslashes escaped
   */
  public static String quote(String s) {
    return '"' + s.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
  }
}
