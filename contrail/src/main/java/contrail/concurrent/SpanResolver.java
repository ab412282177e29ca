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
import contrail.internal.Nullable;

/**
 * Turns a {@link SpanReference} back into a live span, usually in a child process. Stores register
 * an implementation under {@code META-INF/services/contrail.concurrent.SpanResolver}.
 */
public interface SpanResolver {
  /**
   * Returns the referenced span, or null if this resolver doesn't handle the reference's locator.
   *
   * @throws IllegalArgumentException if the locator is handled but the span doesn't exist
   */
  @Nullable Span resolve(SpanReference reference);
}
