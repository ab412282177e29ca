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

import contrail.Span;
import contrail.SpanId;
import contrail.SpanReference;
import contrail.internal.Json;
import contrail.internal.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Handle to a span in a JSON log. Creating a child or updating data appends a line; {@link
 * #data()} replays the log.
 */
public final class JsonLogSpan implements Span {
  static final String LOCATOR_PREFIX = "jsonlog:";

  final JsonLogFile file;
  final SpanId id;
  final String name;

  JsonLogSpan(JsonLogFile file, SpanId id, String name) {
    this.file = file;
    this.id = id;
    this.name = name;
  }

  static JsonLogSpan create(JsonLogFile file, @Nullable SpanId parentId, String name,
    Map<String, ?> data) {
    SpanId id = SpanId.next();
    Map<String, Object> line = new LinkedHashMap<>();
    line.put(JsonLogParser.ID, id.toString());
    line.put(JsonLogParser.PARENT_ID, parentId != null ? parentId.toString() : null);
    line.put(JsonLogParser.NAME, name);
    line.put(JsonLogParser.DATA, Json.toJsonObject(data));
    file.append(line);
    return new JsonLogSpan(file, id, name);
  }

  @Override public SpanId id() {
    return id;
  }

  @Override public String name() {
    return name;
  }

  /** @throws IllegalArgumentException if the log no longer contains this span */
  @Override public Map<String, Object> data() {
    JsonLogTree node = JsonLogParser.read(file).get(id);
    if (node == null) throw new IllegalArgumentException("span " + id + " is not in " + file);
    return Collections.unmodifiableMap(node.data);
  }

  @Override public JsonLogSpan newChild(@Nullable String name, Map<String, ?> data) {
    if (data == null) throw new NullPointerException("data == null");
    return create(file, id, name != null ? name : DEFAULT_NAME, data);
  }

  @Override public void updateData(Map<String, ?> patch) {
    if (patch == null) throw new NullPointerException("patch == null");
    Map<String, Object> line = new LinkedHashMap<>();
    line.put(JsonLogParser.ID, id.toString());
    line.put(JsonLogParser.DATA, Json.toJsonObject(patch));
    file.append(line);
  }

  @Override public SpanReference reference() {
    return SpanReference.create(LOCATOR_PREFIX + file.path, id);
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof JsonLogSpan)) return false;
    JsonLogSpan that = (JsonLogSpan) o;
    return file.path.equals(that.file.path) && id.equals(that.id);
  }

  @Override public int hashCode() {
    return file.path.hashCode() ^ id.hashCode();
  }

  @Override public String toString() {
    return "JsonLogSpan{id=" + id + ", name=" + name + "}";
  }
}
