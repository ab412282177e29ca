/*
 * Copyright 2024 The Contrail Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 */
package contrail;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;

/** Utilities for reading a finished {@link Tree}, for example to render or export it. */
public final class Trees {

  /**
   * Returns the tree as nested maps: {@code {name, data, children: [...]}}. The result is
   * JSON-compatible, so it can be written with any JSON library.
   */
  public static Map<String, Object> toMap(Tree tree) {
    if (tree == null) throw new NullPointerException("tree == null");
    Map<String, Object> result = new LinkedHashMap<>();
    result.put("name", tree.name());
    result.put("data", tree.data());
    List<Object> children = new ArrayList<>();
    for (Tree child : tree.children()) {
      children.add(toMap(child));
    }
    result.put("children", children);
    return result;
  }

  /** Visits each node depth-first, parents before children, passing the depth of the node. */
  public static void walk(Tree tree, BiConsumer<Tree, Integer> visitor) {
    if (tree == null) throw new NullPointerException("tree == null");
    if (visitor == null) throw new NullPointerException("visitor == null");
    walk(tree, 0, visitor);
  }

  static void walk(Tree tree, int depth, BiConsumer<Tree, Integer> visitor) {
    visitor.accept(tree, depth);
    for (Tree child : tree.children()) {
      walk(child, depth + 1, visitor);
    }
  }

  Trees() {
  }
}
