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
import contrail.internal.Platform;
import contrail.propagation.CurrentSpanContext;
import contrail.propagation.CurrentSpanContext.Scope;
import contrail.propagation.ThreadLocalCurrentSpanContext;
import java.io.Closeable;
import java.time.Clock;
import java.util.Collections;

/**
 * Records one trace: a tree of spans under a single root, persisted to a store.
 *
 * <p>A tracing starts as new. {@link #start()} records the root's start time and makes the root
 * the current span, so that spans created by {@link Tracer} become its descendants. {@link
 * #close()} records the end time, restores whatever span was current before and releases the
 * store. Call both from the same thread, ideally with try-with-resources:
 * <pre>{@code
 * try (SqliteTracing tracing = SqliteTracing.newBuilder().path(db).build().start()) {
 *   tracing.tracer().trace("import", () -> importer.run());
 * }
 * }</pre>
 *
 * @param <S> the span type of this store
 * @param <T> the tree type of this store
 */
public abstract class Tracing<S extends Span, T extends Tree> implements Closeable {
  /** Name of the root span when none is configured. */
  public static final String DEFAULT_ROOT_NAME = "root";

  enum State {
    NEW, ACTIVE, CLOSED
  }

  /** Settings shared by all stores. Subtypes override setters for covariance. */
  public abstract static class Builder {
    CurrentSpanContext currentSpanContext;
    Clock clock = Clock.systemDefaultZone();
    String rootName = DEFAULT_ROOT_NAME;

    /** Where the root is placed in scope. Defaults to the shared thread local. */
    public Builder currentSpanContext(CurrentSpanContext currentSpanContext) {
      if (currentSpanContext == null) throw new NullPointerException("currentSpanContext == null");
      this.currentSpanContext = currentSpanContext;
      return this;
    }

    /** Source of {@link SpanKeys#START_TIME} and {@link SpanKeys#END_TIME} values. */
    public Builder clock(Clock clock) {
      if (clock == null) throw new NullPointerException("clock == null");
      this.clock = clock;
      return this;
    }

    /** Name of a root span created by this tracing. Defaults to {@value #DEFAULT_ROOT_NAME}. */
    public Builder rootName(String rootName) {
      if (rootName == null) throw new NullPointerException("rootName == null");
      this.rootName = rootName;
      return this;
    }

    public abstract Tracing<?, ?> build();
  }

  final CurrentSpanContext currentSpanContext;
  final Tracer tracer;
  final String rootName;
  State state = State.NEW; // guarded by this
  @Nullable Scope scope; // only touched by the thread that started this tracing

  protected Tracing(Builder builder) {
    this.currentSpanContext = builder.currentSpanContext != null
      ? builder.currentSpanContext
      : ThreadLocalCurrentSpanContext.create();
    this.tracer = new Tracer(currentSpanContext, builder.clock);
    this.rootName = builder.rootName;
  }

  /** The root of the trace. Available before {@link #start()}. */
  public abstract S rootSpan();

  /** A read view of the trace, from the root down. */
  public abstract T tree();

  /** Creates spans under whatever span is current, which is the root once started. */
  public Tracer tracer() {
    return tracer;
  }

  public CurrentSpanContext currentSpanContext() {
    return currentSpanContext;
  }

  protected final String rootName() {
    return rootName;
  }

  /**
   * Records the root start time and places it in scope.
   *
   * @throws IllegalStateException if this tracing was already started or closed
   */
  public Tracing<S, T> start() {
    synchronized (this) {
      if (state == State.ACTIVE) throw new IllegalStateException("tracing already started");
      if (state == State.CLOSED) throw new IllegalStateException("tracing is closed");
      state = State.ACTIVE;
    }
    S root;
    try {
      doStart();
      root = rootSpan();
      root.updateData(Collections.singletonMap(SpanKeys.START_TIME, tracer.timestamp()));
    } catch (RuntimeException | Error e) {
      synchronized (this) {
        state = State.CLOSED;
      }
      doClose();
      throw e;
    }
    scope = currentSpanContext.newScope(root);
    return this;
  }

  /**
   * Records the root end time, restores the span that was current before {@link #start()} and
   * releases the store. Closing twice has no effect.
   */
  @Override public void close() {
    State previous;
    synchronized (this) {
      previous = state;
      if (previous == State.CLOSED) return;
      state = State.CLOSED;
    }
    try {
      if (previous == State.ACTIVE) {
        rootSpan().updateData(Collections.singletonMap(SpanKeys.END_TIME, tracer.timestamp()));
      }
    } catch (RuntimeException e) {
      Platform.get().warn("could not record the end of " + this, e);
    } finally {
      try {
        if (scope != null) scope.close();
        scope = null;
      } finally {
        doClose();
      }
    }
  }

  /** Override to prepare the store when the tracing starts, before the root is placed in scope. */
  protected void doStart() {
  }

  /** Override to release resources such as connections or processes. */
  protected void doClose() {
  }
}
