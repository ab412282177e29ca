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

import contrail.internal.Json;
import contrail.internal.Nullable;
import contrail.internal.Throwables;
import contrail.propagation.CurrentSpanContext;
import contrail.propagation.CurrentSpanContext.Scope;
import contrail.propagation.ThreadLocalCurrentSpanContext;
import java.io.Closeable;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Creates spans under the current span.
 *
 * <p>Spans are only recorded inside a started {@link Tracing}. Outside one, {@link
 * #startScopedSpan(String)} returns a no-op and the {@code trace} methods just run the task, so
 * instrumented code works the same whether or not anyone is tracing it.
 *
 * <p>Here's a typical example:
 * <pre>{@code
 * Tracer tracer = Tracer.create();
 * int sum = tracer.trace("add", Map.of("a", 1, "b", 2), () -> add(1, 2));
 * }</pre>
 *
 * <p>The span for {@code add} records {@code trace_function: {name, arguments, returned}} plus
 * its start and end time. A thrown exception is recorded under {@code exception} and rethrown.
 */
public final class Tracer {
  static final DateTimeFormatter TIMESTAMP =
    DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSXXX");

  /** Uses the shared thread local and the system clock. */
  public static Tracer create() {
    return new Tracer(ThreadLocalCurrentSpanContext.create(), Clock.systemDefaultZone());
  }

  public static Tracer create(CurrentSpanContext currentSpanContext, Clock clock) {
    if (currentSpanContext == null) throw new NullPointerException("currentSpanContext == null");
    if (clock == null) throw new NullPointerException("clock == null");
    return new Tracer(currentSpanContext, clock);
  }

  final CurrentSpanContext currentSpanContext;
  final Clock clock;

  Tracer(CurrentSpanContext currentSpanContext, Clock clock) {
    this.currentSpanContext = currentSpanContext;
    this.clock = clock;
  }

  /** Returns the current span or null if no trace is running on this thread. */
  public @Nullable Span currentSpan() {
    return currentSpanContext.get();
  }

  /**
   * Returns the current span.
   *
   * @throws TraceException if no trace is running on this thread
   */
  public Span currentSpanOrThrow() {
    Span result = currentSpanContext.get();
    if (result == null) {
      throw new TraceException("No span is in scope. Run this inside a started Tracing.");
    }
    return result;
  }

  /**
   * Returns the current span as the given type.
   *
   * @throws TraceException if no trace is running or the current span has another type
   */
  public <S extends Span> S currentSpan(Class<S> type) {
    Span result = currentSpanOrThrow();
    if (!type.isInstance(result)) {
      throw new TraceException("Expected type " + type.getSimpleName()
        + ", got " + result.getClass().getSimpleName());
    }
    return type.cast(result);
  }

  /**
   * Makes the given span current until the result is closed. Passing null clears the current
   * span.
   */
  public SpanInScope withSpanInScope(@Nullable Span span) {
    return new SpanInScope(currentSpanContext.newScope(span));
  }

  /** Like {@link #startScopedSpan(String, Map)} with no initial data. */
  public ScopedSpan startScopedSpan(@Nullable String name) {
    return startScopedSpan(name, Collections.emptyMap());
  }

  /**
   * Creates a child of the current span, records its start time and places it in scope until
   * {@link ScopedSpan#finish()}. Returns a no-op when there is no current span.
   *
   * <p>Always finish in a {@code finally} block:
   * <pre>{@code
   * ScopedSpan span = tracer.startScopedSpan("encode");
   * try {
   *   return encoder.encode();
   * } catch (RuntimeException | Error e) {
   *   span.error(e);
   *   throw e;
   * } finally {
   *   span.finish();
   * }
   * }</pre>
   */
  public ScopedSpan startScopedSpan(@Nullable String name, Map<String, ?> data) {
    if (data == null) throw new NullPointerException("data == null");
    Span parent = currentSpanContext.get();
    if (parent == null) return NoopScopedSpan.INSTANCE;
    Map<String, Object> initial = new LinkedHashMap<>(data);
    initial.put(SpanKeys.START_TIME, timestamp());
    Span child = parent.newChild(name, initial);
    return new RealScopedSpan(child, currentSpanContext.newScope(child), this);
  }

  /** Like {@link #trace(String, Map, Callable)} with no recorded arguments. */
  public <V> V trace(@Nullable String name, Callable<V> task) throws Exception {
    return trace(name, Collections.emptyMap(), task);
  }

  /**
   * Runs the task in a new span under the current one, recording the arguments and the returned
   * value under {@link SpanKeys#TRACE_FUNCTION}. Exceptions are recorded and rethrown unchanged.
   * Virtual machine and linkage errors are rethrown without being recorded. A null result leaves
   * {@link SpanKeys#RETURNED} unset.
   */
  public <V> V trace(@Nullable String name, Map<String, ?> arguments, Callable<V> task)
    throws Exception {
    ScopedSpan span = startTraceFunction(name, arguments);
    try {
      V result = task.call();
      recordReturned(span, result);
      return result;
    } catch (Exception | Error e) {
      Throwables.propagateIfFatal(e);
      span.error(e);
      throw e;
    } finally {
      span.finish();
    }
  }

  /** Like {@link #trace(String, Callable)} for tasks that return nothing. */
  public void trace(@Nullable String name, Runnable task) {
    ScopedSpan span = startTraceFunction(name, Collections.emptyMap());
    try {
      task.run();
    } catch (RuntimeException | Error e) {
      Throwables.propagateIfFatal(e);
      span.error(e);
      throw e;
    } finally {
      span.finish();
    }
  }

  /** Records the data in a child span of the current one, which finishes immediately. */
  public void log(@Nullable String name, Map<String, ?> data) {
    startScopedSpan(name != null ? name : "log", data).finish();
  }

  ScopedSpan startTraceFunction(@Nullable String name, Map<String, ?> arguments) {
    if (arguments == null) throw new NullPointerException("arguments == null");
    ScopedSpan span = startScopedSpan(name);
    if (span.isNoop()) return span;
    Map<String, Object> function = new LinkedHashMap<>();
    function.put(SpanKeys.NAME, name != null ? name : Span.DEFAULT_NAME);
    function.put(SpanKeys.ARGUMENTS, Json.toJsonValue(arguments));
    span.updateData(Collections.singletonMap(SpanKeys.TRACE_FUNCTION, function));
    return span;
  }

  static void recordReturned(ScopedSpan span, @Nullable Object result) {
    if (span.isNoop() || result == null) return;
    Map<String, Object> returned =
      Collections.singletonMap(SpanKeys.RETURNED, Json.toJsonValue(result));
    span.updateData(Collections.singletonMap(SpanKeys.TRACE_FUNCTION, returned));
  }

  String timestamp() {
    return TIMESTAMP.format(OffsetDateTime.now(clock));
  }

  /** A span remains in scope until this is closed. */
  public static final class SpanInScope implements Closeable {
    final Scope scope;

    SpanInScope(Scope scope) {
      this.scope = scope;
    }

    /** No exceptions are thrown when unbinding a span scope. */
    @Override public void close() {
      scope.close();
    }

    @Override public String toString() {
      return "SpanInScope(" + scope + ")";
    }
  }

  @Override public String toString() {
    return "Tracer{currentSpan=" + currentSpanContext.get() + "}";
  }
}
