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
package contrail.jsonlog;

import contrail.SpanId;
import contrail.Tree;
import contrail.internal.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/** A node parsed from a JSON log. The whole tree is read at once, so no accessor does I/O. */
public final class JsonLogTree implements Tree {
  final SpanId id;
  final String name;
  @Nullable final SpanId parentId;
  final List<JsonLogTree> children = new ArrayList<>();
  Map<String, Object> data;
  @Nullable JsonLogTree parent;

  JsonLogTree(SpanId id, String name, @Nullable SpanId parentId, Map<String, Object> data) {
    this.id = id;
    this.name = name;
    this.parentId = parentId;
    this.data = data;
  }

  @Override public SpanId id() {
    return id;
  }

  @Override public String name() {
    return name;
  }

  @Override public Map<String, Object> data() {
    return Collections.unmodifiableMap(data);
  }

  @Override public List<JsonLogTree> children() {
    return Collections.unmodifiableList(children);
  }

  @Override public @Nullable JsonLogTree parent() {
    return parent;
  }

  @Override public String toString() {
    return "JsonLogTree{id=" + id + ", name=" + name + ", children=" + children.size() + "}";
  }
}
