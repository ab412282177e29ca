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
import contrail.Tree;
import contrail.internal.Json;
import contrail.internal.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A node read from a {@link SpanDatabase}. The name is read once; data and children are queried on
 * each call, so a tree of a running trace shows its progress.
 */
public final class SqliteTree implements Tree {
  final SpanDatabase database;
  final SpanId id;
  final String name;
  @Nullable final SqliteTree parent;

  SqliteTree(SpanDatabase database, SpanId id, String name, @Nullable SqliteTree parent) {
    this.database = database;
    this.id = id;
    this.name = name;
    this.parent = parent;
  }

  @Override public SpanId id() {
    return id;
  }

  @Override public String name() {
    return name;
  }

  @Override public Map<String, Object> data() {
    return Collections.unmodifiableMap(Json.readObject(database.getDataJson(id)));
  }

  @Override public List<SqliteTree> children() {
    List<SqliteTree> result = new ArrayList<>();
    for (SpanId childId : database.getChildrenIds(id)) {
      result.add(new SqliteTree(database, childId, database.getName(childId), this));
    }
    return Collections.unmodifiableList(result);
  }

  @Override public @Nullable SqliteTree parent() {
    return parent;
  }

  @Override public String toString() {
    return "SqliteTree{id=" + id + ", name=" + name + "}";
  }
}
