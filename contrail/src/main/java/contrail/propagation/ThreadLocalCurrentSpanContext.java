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
package contrail.propagation;

import contrail.Span;
import contrail.internal.Nullable;

/**
 * In-process span propagation backed by a static thread local.
 *
 * <h3>Design notes</h3>
 *
 * <p>A static thread local ensures we have one current span per thread, as opposed to one per
 * tracer. This means every {@link contrail.Tracer} and {@link contrail.Tracing} sees the spans
 * placed in scope by any other.
 *
 * <p>The slot holds the {@link Span} handle itself, not an identifier or a reference. A handle is
 * bound to its store, so code on this thread can add children or update data without resolving
 * anything. Only a process boundary turns the handle into a {@link contrail.SpanReference}, which
 * the child resolves back into a handle before placing it in its own slot.
 *
 * <p>The thread local is not inheritable: threads only see a span when it is handed to them
 * explicitly, which keeps pooled threads from leaking the span of whoever grew the pool.
 */
public class ThreadLocalCurrentSpanContext extends CurrentSpanContext {
  public static CurrentSpanContext create() {
    return new Builder(DEFAULT).build();
  }

  public static Builder newBuilder() {
    return new Builder(DEFAULT);
  }

  /**
   * This component is backed by a possibly static shared thread local. Call this to clear the
   * reference when you are sure any residual state is due to a leak. This is generally only useful
   * in tests.
   */
  public void clear() {
    local.remove();
  }

  // overridden for covariance
  public static final class Builder extends CurrentSpanContext.Builder {
    final ThreadLocal<Span> local;

    Builder(ThreadLocal<Span> local) {
      this.local = local;
    }

    @Override public Builder addScopeDecorator(ScopeDecorator scopeDecorator) {
      return (Builder) super.addScopeDecorator(scopeDecorator);
    }

    @Override public ThreadLocalCurrentSpanContext build() {
      return new ThreadLocalCurrentSpanContext(this);
    }
  }

  static final ThreadLocal<Span> DEFAULT = new ThreadLocal<>();

  @SuppressWarnings("ThreadLocalUsage") // intentional: to support multiple Tracer instances
  final ThreadLocal<Span> local;
  final RevertToNullScope revertToNull;

  ThreadLocalCurrentSpanContext(Builder builder) {
    super(builder);
    if (builder.local == null) throw new NullPointerException("local == null");
    local = builder.local;
    revertToNull = new RevertToNullScope(local);
  }

  @Override public Span get() {
    return local.get();
  }

  @Override public Scope newScope(@Nullable Span currentSpan) {
    final Span previous = local.get();
    local.set(currentSpan);
    Scope result = previous != null ? new RevertToPreviousScope(local, previous) : revertToNull;
    return decorateScope(currentSpan, result);
  }

  static final class RevertToNullScope implements Scope {
    final ThreadLocal<Span> local;

    RevertToNullScope(ThreadLocal<Span> local) {
      this.local = local;
    }

    @Override public void close() {
      local.set(null);
    }
  }

  static final class RevertToPreviousScope implements Scope {
    final ThreadLocal<Span> local;
    final Span previous;

    RevertToPreviousScope(ThreadLocal<Span> local, Span previous) {
      this.local = local;
      this.previous = previous;
    }

    @Override public void close() {
      local.set(previous);
    }
  }
}
