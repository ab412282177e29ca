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
package contrail.remote;

import contrail.SpanId;
import contrail.Tree;
import contrail.internal.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/** A node read from a {@link SpanServer}. Data and children are requested on each call. */
public final class RemoteTree implements Tree {
  final SpanClient client;
  final SpanId id;
  final String name;
  @Nullable final RemoteTree parent;

  RemoteTree(SpanClient client, SpanId id, String name, @Nullable RemoteTree parent) {
    this.client = client;
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
    return Collections.unmodifiableMap(client.getSpan(id).data());
  }

  @Override public List<RemoteTree> children() {
    List<RemoteTree> result = new ArrayList<>();
    for (SpanId childId : client.getChildrenIds(id)) {
      result.add(new RemoteTree(client, childId, client.getSpan(childId).name(), this));
    }
    return Collections.unmodifiableList(result);
  }

  @Override public @Nullable RemoteTree parent() {
    return parent;
  }

  @Override public String toString() {
    return "RemoteTree{id=" + id + ", name=" + name + "}";
  }
}
