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

public class PuffsError extends RuntimeException {

  private final String phase;
  private final String errorMessage;
  private final String filename;
  private final int    line;

  /**
   * Constructor
   * @param phase              the compiler phase reporting the error (e.g. "parse")
   * @param error              the error message
   * @param filename           the file where the error occurred
   * @param line               the line where the error occurred
   * @param captureStackTrace  whether to get stack trace or not
   */
  public PuffsError(String phase, String error, String filename, int line, boolean captureStackTrace) {
    super(null, null, false, captureStackTrace);
    this.phase        = phase;
    this.errorMessage = error;
    this.filename     = filename;
    this.line         = line;
  }

  public String getFilename() {
    return filename;
  }

  public int getLine() {
    return line;
  }

  @Override
  public String getMessage() {
    return String.format("%s: %s at %s:%d", phase, errorMessage, filename, line);
  }

  /**
   * Get the problem description without the phase prefix or position
   * @return the bare error message
   */
  public String getErrorMessage() {
    return errorMessage;
  }
}
