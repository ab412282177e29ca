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
package contrail.concurrent;

import contrail.Span;
import contrail.SpanReference;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/** Resolves references with every {@link SpanResolver} on the class path. */
public final class SpanResolvers {
  static volatile List<SpanResolver> resolvers;

  /**
   * Returns the referenced span.
   *
   * @throws IllegalArgumentException if no resolver handles the locator or the span doesn't exist
   */
  public static Span resolve(SpanReference reference) {
    if (reference == null) throw new NullPointerException("reference == null");
    for (SpanResolver resolver : resolvers()) {
      Span result = resolver.resolve(reference);
      if (result != null) return result;
    }
    throw new IllegalArgumentException("no resolver for " + reference.locator()
      + "; is the store's module on the class path?");
  }

  static List<SpanResolver> resolvers() {
    List<SpanResolver> result = resolvers;
    if (result != null) return result;
    result = new ArrayList<>();
    for (SpanResolver resolver : ServiceLoader.load(SpanResolver.class)) {
      result.add(resolver);
    }
    return resolvers = result;
  }

  SpanResolvers() {
  }
}
