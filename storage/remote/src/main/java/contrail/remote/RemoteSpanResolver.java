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

import contrail.SpanReference;
import contrail.SpanStoreException;
import contrail.concurrent.SpanResolver;

/** Resolves references whose locator is the {@code http} URL of a {@link SpanServer}. */
public final class RemoteSpanResolver implements SpanResolver {
  @Override public RemoteSpan resolve(SpanReference reference) {
    String locator = reference.locator();
    if (!locator.startsWith("http://") && !locator.startsWith("https://")) return null;
    SpanClient client = SpanClient.create(locator);
    String name;
    try {
      name = client.getSpan(reference.id()).name();
    } catch (SpanStoreException e) {
      throw new IllegalArgumentException("could not resolve " + reference, e);
    }
    return new RemoteSpan(client, reference.id(), name);
  }

  @Override public String toString() {
    return "RemoteSpanResolver{}";
  }
}
