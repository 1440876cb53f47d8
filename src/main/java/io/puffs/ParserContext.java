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

import java.io.PrintStream;
import java.util.Objects;

/**
 * Settings shared by parses. A context is immutable once built so one instance can be
 * used by any number of parsers, including ones on different threads.
 * <pre>
 *   ParserContext context = ParserContext.create()
 *                                        .maxDepth(200)
 *                                        .debug(1)
 *                                        .build();
 * </pre>
 */
public class ParserContext {

  public static final int DEFAULT_MAX_DEPTH = 1000;

  private final int         maxDepth;     // Max nesting of expressions, types and blocks
  private final int         debugLevel;   // 1 or more: dump tree after parsing
  private final PrintStream output;       // Where debug output goes

  ///////////////////////////////

  public static ParserContextBuilder create() {
    return new ParserContextBuilder();
  }

  /**
   * Context with all settings at their defaults
   * @return a default context
   */
  public static ParserContext defaults() {
    return create().build();
  }

  private ParserContext(ParserContextBuilder builder) {
    this.maxDepth   = builder.maxDepth;
    this.debugLevel = builder.debugLevel;
    this.output     = builder.output;
  }

  /**
   * Collects settings for a context. Each call to {@link #build()} takes a copy of the
   * current settings so later changes to the builder do not affect contexts already built.
   */
  public static class ParserContextBuilder {
    private int         maxDepth   = DEFAULT_MAX_DEPTH;
    private int         debugLevel = 0;
    private PrintStream output     = System.out;

    private ParserContextBuilder() {}

    public ParserContextBuilder maxDepth(int value)         { maxDepth   = value; return this; }
    public ParserContextBuilder debug(int value)            { debugLevel = value; return this; }
    public ParserContextBuilder output(PrintStream stream)  { output     = Objects.requireNonNull(stream, "output"); return this; }

    public ParserContext build() {
      if (maxDepth < 1) {
        throw new IllegalArgumentException("maxDepth must be at least 1 but was " + maxDepth);
      }
      return new ParserContext(this);
    }
  }

  //////////////////////////////

  public int maxDepth()            { return maxDepth; }
  public int debugLevel()          { return debugLevel; }
  public PrintStream output()      { return output; }

  boolean debug(int level) {
    return debugLevel >= level;
  }
}
