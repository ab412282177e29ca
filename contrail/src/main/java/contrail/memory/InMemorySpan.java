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
package contrail.memory;

import contrail.Span;
import contrail.SpanId;
import contrail.SpanReference;
import contrail.Tree;
import contrail.internal.MergePatch;
import contrail.internal.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A span held by strong reference, which is also its own tree node. Data values are kept as given
 * rather than converted to JSON.
 */
public final class InMemorySpan implements Span, Tree {
  final SpanId id;
  final String name;
  @Nullable final InMemorySpan parent;
  final List<InMemorySpan> children = new CopyOnWriteArrayList<>();
  volatile Map<String, Object> data; // replaced, never mutated

  InMemorySpan(String name, @Nullable InMemorySpan parent, Map<String, ?> data) {
    this.id = SpanId.next();
    this.name = name;
    this.parent = parent;
    this.data = MergePatch.applyToObject(null, data);
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

  @Override public InMemorySpan newChild(@Nullable String name, Map<String, ?> data) {
    if (data == null) throw new NullPointerException("data == null");
    InMemorySpan child = new InMemorySpan(name != null ? name : DEFAULT_NAME, this, data);
    children.add(child);
    return child;
  }

  @Override public void updateData(Map<String, ?> patch) {
    if (patch == null) throw new NullPointerException("patch == null");
    synchronized (this) {
      data = MergePatch.applyToObject(data, patch);
    }
  }

  /** @throws UnsupportedOperationException always, as this span is only in this JVM's memory */
  @Override public SpanReference reference() {
    throw new UnsupportedOperationException(
      "in-memory span " + id + " can't be resolved by another process");
  }

  @Override public List<InMemorySpan> children() {
    return Collections.unmodifiableList(children);
  }

  @Override public @Nullable InMemorySpan parent() {
    return parent;
  }

  @Override public String toString() {
    return "InMemorySpan{id=" + id + ", name=" + name + "}";
  }

  static InMemorySpan newRoot(String name) {
    return new InMemorySpan(name, null, new LinkedHashMap<>());
  }
}
