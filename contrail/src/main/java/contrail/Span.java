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

import contrail.internal.Nullable;
import java.util.Map;

/**
 * A unit of work in a trace. Spans form a tree: each span except the root has a parent, and the
 * current span is the parent of spans created while it is in scope.
 *
 * <p>The identifier, name and parent of a span never change. Only {@link #data()} changes, and
 * only by {@link #updateData(Map) merge patch}. Spans are never deleted.
 *
 * <p>Except for in-memory spans, a span is a lightweight handle: {@link #data()} reads the store
 * each time it is called, so it sees updates made by other threads and processes.
 */
public interface Span {
  /** Name used when a span is created without one. */
  String DEFAULT_NAME = "no-name";

  SpanId id();

  /** Human readable name, such as the traced operation. */
  String name();

  /** A snapshot of the data of this span, as a JSON-compatible map. */
  Map<String, Object> data();

  /**
   * Creates a span whose parent is this one.
   *
   * @param name the child's name, or null for {@link #DEFAULT_NAME}
   * @param data initial data, converted to JSON-compatible values
   */
  Span newChild(@Nullable String name, Map<String, ?> data);

  /**
   * Merges the patch into this span's data as a JSON merge patch: null values remove keys and
   * nested maps merge. This is valid after the span's scope exited.
   */
  void updateData(Map<String, ?> patch);

  /**
   * Returns a reference that resolves to this span in another process.
   *
   * @throws UnsupportedOperationException if this span only exists in this process's memory
   */
  SpanReference reference();
}
