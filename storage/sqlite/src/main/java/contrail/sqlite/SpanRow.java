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
package contrail.sqlite;

import contrail.SpanId;
import contrail.internal.Json;
import contrail.internal.Nullable;
import java.util.Map;

/** A row of the {@code trace_spans} table. */
public final class SpanRow {
  final SpanId id;
  @Nullable final SpanId parentId;
  final String name, dataJson;

  SpanRow(SpanId id, @Nullable SpanId parentId, String name, String dataJson) {
    this.id = id;
    this.parentId = parentId;
    this.name = name;
    this.dataJson = dataJson;
  }

  public SpanId id() {
    return id;
  }

  /** Null for a root span. */
  @Nullable public SpanId parentId() {
    return parentId;
  }

  public String name() {
    return name;
  }

  /** The data as stored: a JSON object. */
  public String dataJson() {
    return dataJson;
  }

  public Map<String, Object> data() {
    return Json.readObject(dataJson);
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof SpanRow)) return false;
    SpanRow that = (SpanRow) o;
    return id.equals(that.id)
      && (parentId == null ? that.parentId == null : parentId.equals(that.parentId))
      && name.equals(that.name)
      && dataJson.equals(that.dataJson);
  }

  @Override public int hashCode() {
    return id.hashCode();
  }

  @Override public String toString() {
    return "SpanRow{id=" + id + ", parentId=" + parentId + ", name=" + name
      + ", dataJson=" + dataJson + "}";
  }
}
