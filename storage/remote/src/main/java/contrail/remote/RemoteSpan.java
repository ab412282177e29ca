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

import contrail.Span;
import contrail.SpanId;
import contrail.SpanReference;
import contrail.internal.Nullable;
import java.util.Collections;
import java.util.Map;

/** Handle to a span on a {@link SpanServer}. Every call but {@link #name()} is a request. */
public final class RemoteSpan implements Span {
  final SpanClient client;
  final SpanId id;
  final String name;

  RemoteSpan(SpanClient client, SpanId id, String name) {
    this.client = client;
    this.id = id;
    this.name = name;
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

  @Override public RemoteSpan newChild(@Nullable String name, Map<String, ?> data) {
    if (data == null) throw new NullPointerException("data == null");
    String childName = name != null ? name : DEFAULT_NAME;
    SpanId childId = SpanId.next();
    client.putSpan(childId, childName, data, id);
    return new RemoteSpan(client, childId, childName);
  }

  @Override public void updateData(Map<String, ?> patch) {
    client.patchSpan(id, patch);
  }

  /** The locator is the server's base URL. */
  @Override public SpanReference reference() {
    return SpanReference.create(client.url(), id);
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof RemoteSpan)) return false;
    RemoteSpan that = (RemoteSpan) o;
    return client.url().equals(that.client.url()) && id.equals(that.id);
  }

  @Override public int hashCode() {
    return client.url().hashCode() ^ id.hashCode();
  }

  @Override public String toString() {
    return "RemoteSpan{id=" + id + ", name=" + name + "}";
  }
}
