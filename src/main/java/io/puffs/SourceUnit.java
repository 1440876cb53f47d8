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

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Result of parsing one source file: the top level declarations in the order they
 * were declared.
 */
public class SourceUnit {
  private final String     filename;
  private final List<Node> topLevelDecls;

  public SourceUnit(String filename, List<Node> topLevelDecls) {
    this.filename      = filename;
    this.topLevelDecls = List.copyOf(topLevelDecls);
  }

  public String getFilename() {
    return filename;
  }

  public List<Node> getTopLevelDecls() {
    return topLevelDecls;
  }

  /**
   * Get the top level declarations of the given kind, in declaration order
   * @param kind   the kind of node
   * @param clss   the node class for that kind
   * @param <T>    the node type
   * @return the matching declarations
   */
  public <T extends Node> List<T> getDecls(Node.Kind kind, Class<T> clss) {
    return topLevelDecls.stream()
                        .filter(node -> node.kind() == kind)
                        .map(clss::cast)
                        .collect(Collectors.toList());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SourceUnit)) {
      return false;
    }
    SourceUnit that = (SourceUnit) o;
    return Objects.equals(filename, that.filename) && topLevelDecls.equals(that.topLevelDecls);
  }

  @Override
  public int hashCode() {
    return Objects.hash(filename, topLevelDecls);
  }

  @Override
  public String toString() {
    return "SourceUnit{" + filename + ", " + topLevelDecls.size() + " decls}";
  }
}
