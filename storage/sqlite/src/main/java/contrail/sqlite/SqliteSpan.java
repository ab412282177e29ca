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

import contrail.Span;
import contrail.SpanId;
import contrail.SpanReference;
import contrail.internal.Json;
import contrail.internal.Nullable;
import java.util.Collections;
import java.util.Map;

/** Handle to a row of a {@link SpanDatabase}. Every call but {@link #name()} queries it. */
public final class SqliteSpan implements Span {
  static final String LOCATOR_PREFIX = "sqlite:";

  final SpanDatabase database;
  final SpanId id;
  final String name;

  SqliteSpan(SpanDatabase database, SpanId id, String name) {
    this.database = database;
    this.id = id;
    this.name = name;
  }

  @Override public SpanId id() {
    return id;
  }

  @Override public String name() {
    return name;
  }

  /** @throws IllegalArgumentException if the database no longer contains this span */
  @Override public Map<String, Object> data() {
    return Collections.unmodifiableMap(Json.readObject(database.getDataJson(id)));
  }

  @Override public SqliteSpan newChild(@Nullable String name, Map<String, ?> data) {
    if (data == null) throw new NullPointerException("data == null");
    String childName = name != null ? name : DEFAULT_NAME;
    SpanId childId = SpanId.next();
    database.insert(childId, id, childName, Json.write(Json.toJsonObject(data)));
    return new SqliteSpan(database, childId, childName);
  }

  @Override public void updateData(Map<String, ?> patch) {
    if (patch == null) throw new NullPointerException("patch == null");
    database.updateDataJson(id, Json.write(Json.toJsonObject(patch)));
  }

  @Override public SpanReference reference() {
    return SpanReference.create(LOCATOR_PREFIX + database.path(), id);
  }

  public SpanDatabase database() {
    return database;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof SqliteSpan)) return false;
    SqliteSpan that = (SqliteSpan) o;
    return database.equals(that.database) && id.equals(that.id);
  }

  @Override public int hashCode() {
    return database.hashCode() ^ id.hashCode();
  }

  @Override public String toString() {
    return "SqliteSpan{id=" + id + ", name=" + name + "}";
  }
}
