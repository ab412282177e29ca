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
package contrail.test;

import contrail.ScopedSpan;
import contrail.Span;
import contrail.SpanKeys;
import contrail.Tracer;
import contrail.Tracing;
import contrail.Tree;
import contrail.Trees;
import contrail.concurrent.TracingThread;
import contrail.propagation.ThreadLocalCurrentSpanContext;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

/**
 * Behavior every span store must have. Extend this in each store's tests, returning a builder that
 * writes to a fresh store.
 */
public abstract class ITTracing {
  protected static final String TIMESTAMP = "2024-05-01T10:00:00.000Z";

  protected final ThreadLocalCurrentSpanContext currentSpanContext =
    ThreadLocalCurrentSpanContext.newBuilder().build();
  protected final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
  final List<Tracing<?, ?>> tracings = new ArrayList<>();

  /** Returns a builder for a store no other test uses. */
  protected abstract Tracing.Builder newBuilder() throws Exception;

  protected Tracing<?, ?> newTracing() throws Exception {
    return build(newBuilder());
  }

  protected Tracing<?, ?> build(Tracing.Builder builder) {
    Tracing<?, ?> result = builder.currentSpanContext(currentSpanContext).clock(clock).build();
    tracings.add(result);
    return result;
  }

  @AfterEach public void closeTracings() {
    for (Tracing<?, ?> tracing : tracings) tracing.close();
    currentSpanContext.clear();
  }

  @Test public void rootSpan_defaultName() throws Exception {
    Tracing<?, ?> tracing = newTracing();

    assertThat(tracing.rootSpan().name()).isEqualTo(Tracing.DEFAULT_ROOT_NAME);
  }

  @Test public void start_placesRootInScope() throws Exception {
    Tracing<?, ?> tracing = newTracing();
    assertThat(currentSpanContext.get()).isNull();

    tracing.start();

    assertThat(currentSpanContext.get()).isEqualTo(tracing.rootSpan());
    assertThat(tracing.tracer().currentSpanOrThrow()).isEqualTo(tracing.rootSpan());
    assertThat(tracing.rootSpan().data()).containsEntry(SpanKeys.START_TIME, TIMESTAMP);
  }

  @Test public void start_twice() throws Exception {
    Tracing<?, ?> tracing = newTracing().start();

    assertThatThrownBy(tracing::start)
      .isInstanceOf(IllegalStateException.class)
      .hasMessage("tracing already started");
  }

  @Test public void start_afterClose() throws Exception {
    Tracing<?, ?> tracing = newTracing();
    tracing.start();
    tracing.close();

    assertThatThrownBy(tracing::start)
      .isInstanceOf(IllegalStateException.class)
      .hasMessage("tracing is closed");
  }

  @Test public void close_restoresScopeAndRecordsEndTime() throws Exception {
    Tracing<?, ?> tracing = newTracing().start();

    tracing.close();

    assertThat(currentSpanContext.get()).isNull();
    assertThat(tracing.tree().data())
      .containsEntry(SpanKeys.START_TIME, TIMESTAMP)
      .containsEntry(SpanKeys.END_TIME, TIMESTAMP);
  }

  @Test public void close_twice() throws Exception {
    Tracing<?, ?> tracing = newTracing().start();

    tracing.close();
    tracing.close(); // doesn't throw

    assertThat(currentSpanContext.get()).isNull();
  }

  @Test public void close_restoresPreviousSpan() throws Exception {
    Tracing<?, ?> outer = newTracing().start();
    Tracing<?, ?> inner = newTracing().start();

    assertThat(currentSpanContext.get()).isEqualTo(inner.rootSpan());
    inner.close();

    assertThat(currentSpanContext.get()).isEqualTo(outer.rootSpan());
  }

  @Test public void tree_nested() throws Exception {
    Tracing<?, ?> tracing = build(newBuilder().rootName("A")).start();
    Tracer tracer = tracing.tracer();

    tracer.trace("B", () -> {
      tracer.trace("C", () -> {
      });
      tracer.trace("D", () -> {
      });
    });

    Tree a = tracing.tree();
    assertThat(a.name()).isEqualTo("A");
    assertThat(a.id()).isEqualTo(tracing.rootSpan().id());
    assertThat(a.parent()).isNull();
    assertThat(names(a.children())).containsExactly("B");

    Tree b = a.children().get(0);
    assertThat(b.parent().id()).isEqualTo(a.id());
    assertThat(names(b.children())).containsExactly("C", "D");
    for (Tree leaf : b.children()) {
      assertThat(leaf.children()).isEmpty();
      assertThat(leaf.parent().id()).isEqualTo(b.id());
    }
  }

  @Test public void tree_toMap() throws Exception {
    Tracing<?, ?> tracing = newTracing().start();
    tracing.tracer().log("event", Collections.singletonMap("key", "value"));

    Map<String, Object> map = Trees.toMap(tracing.tree());

    assertThat(map).containsEntry("name", "root");
    assertThat((List<?>) map.get("children")).hasSize(1);
    @SuppressWarnings("unchecked")
    Map<String, Object> event = (Map<String, Object>) ((List<?>) map.get("children")).get(0);
    assertThat(event).containsEntry("name", "event").containsEntry("children", List.of());
    @SuppressWarnings("unchecked")
    Map<String, Object> data = (Map<String, Object>) event.get("data");
    assertThat(data).containsEntry("key", "value");
  }

  @Test public void startScopedSpan_recordsTimesAndRestoresScope() throws Exception {
    Tracing<?, ?> tracing = newTracing().start();

    ScopedSpan span = tracing.tracer().startScopedSpan("work", Map.of("size", 3));
    assertThat(currentSpanContext.get()).isEqualTo(span.span());
    span.finish();

    assertThat(currentSpanContext.get()).isEqualTo(tracing.rootSpan());
    assertThat(span.span().name()).isEqualTo("work");
    assertThat(span.span().data()).containsOnly(
      entry("size", 3),
      entry(SpanKeys.START_TIME, TIMESTAMP),
      entry(SpanKeys.END_TIME, TIMESTAMP)
    );
  }

  @Test public void startScopedSpan_defaultName() throws Exception {
    Tracing<?, ?> tracing = newTracing().start();

    tracing.tracer().startScopedSpan(null).finish();

    assertThat(names(tracing.tree().children())).containsExactly(Span.DEFAULT_NAME);
  }

  @Test public void trace_recordsArgumentsAndResult() throws Exception {
    Tracing<?, ?> tracing = newTracing().start();

    int sum = tracing.tracer().trace("add", Map.of("a", 1, "b", 2), () -> 3);

    assertThat(sum).isEqualTo(3);
    Map<String, Object> data = tracing.tree().children().get(0).data();
    assertThat(data.get(SpanKeys.TRACE_FUNCTION)).isEqualTo(Map.of(
      SpanKeys.NAME, "add",
      SpanKeys.ARGUMENTS, Map.of("a", 1, "b", 2),
      SpanKeys.RETURNED, 3
    ));
    assertThat(data).containsKeys(SpanKeys.START_TIME, SpanKeys.END_TIME);
  }

  @Test public void trace_recordsAndRethrowsException() throws Exception {
    Tracing<?, ?> tracing = newTracing().start();
    IllegalStateException error = new IllegalStateException("boom");

    assertThatThrownBy(() -> tracing.tracer().trace("fails", (Runnable) () -> {
      throw error;
    })).isSameAs(error);

    assertThat(currentSpanContext.get()).isEqualTo(tracing.rootSpan());
    Map<String, Object> data = tracing.tree().children().get(0).data();
    assertThat(data).containsKey(SpanKeys.END_TIME);
    @SuppressWarnings("unchecked")
    Map<String, Object> exception = (Map<String, Object>) data.get(SpanKeys.EXCEPTION);
    assertThat(exception)
      .containsEntry(SpanKeys.TYPE, "java.lang.IllegalStateException")
      .containsEntry(SpanKeys.VALUE, "boom");
    assertThat((String) exception.get(SpanKeys.TRACEBACK)).contains("boom");
  }

  @Test public void updateData_isMergePatch() throws Exception {
    Span span = newTracing().rootSpan().newChild("patched", Map.of());

    span.updateData(Map.of("a", Map.of("x", 1, "y", 2), "b", "keep"));
    span.updateData(Map.of("a", Collections.singletonMap("y", null), "c", true));

    assertThat(span.data()).containsOnly(
      entry("a", Map.of("x", 1)),
      entry("b", "keep"),
      entry("c", true)
    );
  }

  @Test public void updateData_afterScopeExited() throws Exception {
    Tracing<?, ?> tracing = newTracing().start();
    ScopedSpan scoped = tracing.tracer().startScopedSpan("late");
    scoped.finish();

    scoped.span().updateData(Map.of("result", "ok"));

    assertThat(tracing.tree().children().get(0).data()).containsEntry("result", "ok");
  }

  @Test public void tracingThread_propagatesCurrentSpan() throws Exception {
    Tracing<?, ?> tracing = newTracing().start();
    Tracer tracer = tracing.tracer();
    AtomicReference<Span> seen = new AtomicReference<>();

    ScopedSpan parent = tracer.startScopedSpan("parent");
    TracingThread thread = new TracingThread(currentSpanContext, () -> {
      seen.set(currentSpanContext.get());
      tracer.log("in-thread", Map.of());
    });
    thread.start();
    thread.join();
    parent.finish();

    assertThat(seen.get()).isEqualTo(parent.span());
    Tree parentTree = tracing.tree().children().get(0);
    assertThat(names(parentTree.children())).containsExactly("in-thread");
  }

  @Test public void plainThread_doesNotSeeCurrentSpan() throws Exception {
    newTracing().start();
    AtomicReference<Span> seen = new AtomicReference<>();

    Thread thread = new Thread(() -> seen.set(currentSpanContext.get()));
    thread.start();
    thread.join();

    assertThat(seen.get()).isNull();
  }

  @Test public void executorService_propagatesCurrentSpan() throws Exception {
    Tracing<?, ?> tracing = newTracing().start();
    ExecutorService executor =
      currentSpanContext.executorService(Executors.newSingleThreadExecutor());
    try {
      Future<Span> seen = executor.submit(() -> {
        tracing.tracer().log("pooled", Map.of());
        return currentSpanContext.get();
      });

      assertThat(seen.get()).isEqualTo(tracing.rootSpan());
      assertThat(names(tracing.tree().children())).containsExactly("pooled");
    } finally {
      executor.shutdownNow();
    }
  }

  @Test public void updateData_concurrentDisjointKeysSurvive() throws Exception {
    Span span = newTracing().rootSpan().newChild("shared", Map.of());
    ExecutorService executor = Executors.newFixedThreadPool(8);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int i = 0; i < 32; i++) {
        String key = "key" + i;
        int value = i;
        futures.add(executor.submit(() -> span.updateData(Map.of(key, value))));
      }
      for (Future<?> future : futures) future.get();
    } finally {
      executor.shutdownNow();
    }

    Map<String, Object> expected = new LinkedHashMap<>();
    for (int i = 0; i < 32; i++) expected.put("key" + i, i);
    assertThat(span.data()).isEqualTo(expected);
  }

  protected static List<String> names(List<? extends Tree> trees) {
    List<String> result = new ArrayList<>();
    for (Tree tree : trees) result.add(tree.name());
    return result;
  }
}
