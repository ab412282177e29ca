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
import contrail.internal.Platform;
import contrail.propagation.CurrentSpanContext;
import contrail.propagation.CurrentSpanContext.Scope;
import contrail.propagation.ThreadLocalCurrentSpanContext;

/**
 * Carries the current span into a child process through the {@value #ENV_SPAN_REFERENCE}
 * environment variable.
 *
 * <p>In the parent:
 * <pre>{@code
 * ProcessBuilder builder = new ProcessBuilder("java", "-cp", classPath, "com.acme.Worker");
 * ProcessPropagation.inject(builder);
 * builder.start();
 * }</pre>
 *
 * <p>In the child:
 * <pre>{@code
 * try (Scope scope = ProcessPropagation.joinParent()) {
 *   work(); // spans created here are children of the parent's span
 * }
 * }</pre>
 */
public final class ProcessPropagation {
  /** Holds the {@link SpanReference#toString() text form} of the parent span. */
  public static final String ENV_SPAN_REFERENCE = "CONTRAIL_SPAN_REFERENCE";

  /**
   * Returns a reference to the current span, or null if there isn't one.
   *
   * @throws IllegalStateException if the current span can't leave this process, such as an
   * in-memory span
   */
  public static @Nullable SpanReference capture(CurrentSpanContext currentSpanContext) {
    Span span = currentSpanContext.get();
    if (span == null) return null;
    try {
      return span.reference();
    } catch (UnsupportedOperationException e) {
      throw new IllegalStateException(
        span + " can't cross a process boundary; trace with a persistent store", e);
    }
  }

  /**
   * Passes the current span of the default context to the process.
   *
   * @return the injected reference, or null if there is no current span
   */
  public static @Nullable SpanReference inject(ProcessBuilder builder) {
    SpanReference reference = capture(ThreadLocalCurrentSpanContext.create());
    inject(builder, reference);
    return reference;
  }

  /** Passes the reference to the process, or clears any inherited one when null. */
  public static void inject(ProcessBuilder builder, @Nullable SpanReference reference) {
    if (builder == null) throw new NullPointerException("builder == null");
    if (reference == null) {
      builder.environment().remove(ENV_SPAN_REFERENCE);
    } else {
      builder.environment().put(ENV_SPAN_REFERENCE, reference.toString());
    }
  }

  /** Like {@link #joinParent(CurrentSpanContext)} with the default context. */
  public static Scope joinParent() {
    return joinParent(ThreadLocalCurrentSpanContext.create());
  }

  /**
   * Makes the span passed by the parent process current until the result is closed. Returns
   * {@link Scope#NOOP} when this process was started without one.
   *
   * @throws IllegalArgumentException if the reference is malformed or can't be resolved
   */
  public static Scope joinParent(CurrentSpanContext currentSpanContext) {
    String value = System.getenv(ENV_SPAN_REFERENCE);
    if (value == null || value.isEmpty()) return Scope.NOOP;
    return join(currentSpanContext, SpanReference.parse(value));
  }

  /** Makes the referenced span current until the result is closed. */
  public static Scope join(CurrentSpanContext currentSpanContext,
    @Nullable SpanReference reference) {
    if (reference == null) return Scope.NOOP;
    Span span = SpanResolvers.resolve(reference);
    Platform.get().log("joined parent span {0}", reference, null);
    return currentSpanContext.newScope(span);
  }

  ProcessPropagation() {
  }
}
