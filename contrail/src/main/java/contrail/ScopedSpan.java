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
 * A span that is current from {@link Tracer#startScopedSpan(String)} until {@link #finish()}.
 *
 * <h3>Usage notes</h3>
 * All methods return {@linkplain ScopedSpan} for chaining, but the instance is always the same.
 * Also, this type is intended for in-process synchronous code. Do not leak this onto another
 * thread: it is not thread-safe.
 */
public abstract class ScopedSpan {
  /** When true, nothing is recorded: there was no current span to be a child of. */
  public abstract boolean isNoop();

  /** The recorded span, or null when {@link #isNoop()}. */
  public abstract @Nullable Span span();

  /** Merges the patch into the span data. See {@link Span#updateData(Map)}. */
  public abstract ScopedSpan updateData(Map<String, ?> patch);

  /**
   * Records {@code exception: {type, value, traceback}} for an error that impacted this
   * operation.
   *
   * <p><em>Note:</em> Calling this does not {@linkplain #finish() finish} the span.
   */
  public abstract ScopedSpan error(Throwable throwable);

  /** Records the end time and restores the span that was current before this one. */
  public abstract void finish();

  ScopedSpan() {
  }
}
