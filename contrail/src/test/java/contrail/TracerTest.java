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

import contrail.memory.InMemorySpan;
import contrail.memory.InMemoryTracing;
import contrail.propagation.ThreadLocalCurrentSpanContext;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TracerTest {
  ThreadLocalCurrentSpanContext currentSpanContext =
    ThreadLocalCurrentSpanContext.newBuilder().build();
  Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00.123Z"), ZoneOffset.ofHours(2));
  Tracer tracer = Tracer.create(currentSpanContext, clock);
  InMemorySpan root = InMemoryTracing.create().rootSpan();

  @AfterEach void clear() {
    currentSpanContext.clear();
  }

  @Test void currentSpan_nullOutsideTrace() {
    assertThat(tracer.currentSpan()).isNull();
  }

  @Test void currentSpanOrThrow_outsideTrace() {
    assertThatThrownBy(tracer::currentSpanOrThrow)
      .isInstanceOf(TraceException.class)
      .hasMessageContaining("No span is in scope");
  }

  @Test void currentSpan_typed() {
    try (Tracer.SpanInScope ws = tracer.withSpanInScope(root)) {
      assertThat(tracer.currentSpan(InMemorySpan.class)).isSameAs(root);
    }
  }

  @Test void currentSpan_typeMismatch() {
    try (Tracer.SpanInScope ws = tracer.withSpanInScope(root)) {
      assertThatThrownBy(() -> tracer.currentSpan(OtherSpan.class))
        .isInstanceOf(TraceException.class)
        .hasMessage("Expected type OtherSpan, got InMemorySpan");
    }
  }

  @Test void withSpanInScope_null_clearsScope() {
    try (Tracer.SpanInScope ws = tracer.withSpanInScope(root)) {
      try (Tracer.SpanInScope cleared = tracer.withSpanInScope(null)) {
        assertThat(tracer.currentSpan()).isNull();
      }
      assertThat(tracer.currentSpan()).isSameAs(root);
    }
  }

  @Test void startScopedSpan_noopOutsideTrace() {
    ScopedSpan span = tracer.startScopedSpan("orphan");

    assertThat(span.isNoop()).isTrue();
    assertThat(span.span()).isNull();
    assertThat(tracer.currentSpan()).isNull();
    span.updateData(Map.of("ignored", true)).error(new RuntimeException()).finish();
  }

  @Test void trace_outsideTrace_justRunsTask() throws Exception {
    assertThat(tracer.trace("orphan", () -> "result")).isEqualTo("result");
  }

  @Test void startScopedSpan_timestampsUseClock() {
    try (Tracer.SpanInScope ws = tracer.withSpanInScope(root)) {
      ScopedSpan span = tracer.startScopedSpan("timed");
      span.finish();

      assertThat(span.span().data())
        .containsEntry(SpanKeys.START_TIME, "2024-05-01T12:00:00.123+02:00")
        .containsEntry(SpanKeys.END_TIME, "2024-05-01T12:00:00.123+02:00");
    }
  }

  @Test void startScopedSpan_finishRestoresParent() {
    try (Tracer.SpanInScope ws = tracer.withSpanInScope(root)) {
      ScopedSpan outer = tracer.startScopedSpan("outer");
      ScopedSpan inner = tracer.startScopedSpan("inner");
      assertThat(tracer.currentSpan()).isSameAs(inner.span());

      inner.finish();
      assertThat(tracer.currentSpan()).isSameAs(outer.span());
      outer.finish();
      assertThat(tracer.currentSpan()).isSameAs(root);
    }

    assertThat(root.children()).extracting(InMemorySpan::name).containsExactly("outer");
    assertThat(root.children().get(0).children()).extracting(InMemorySpan::name)
      .containsExactly("inner");
  }

  @Test void trace_nullResultLeavesReturnedUnset() throws Exception {
    try (Tracer.SpanInScope ws = tracer.withSpanInScope(root)) {
      tracer.trace("nothing", () -> null);
    }

    @SuppressWarnings("unchecked")
    Map<String, Object> function =
      (Map<String, Object>) root.children().get(0).data().get(SpanKeys.TRACE_FUNCTION);
    assertThat(function).containsOnlyKeys(SpanKeys.NAME, SpanKeys.ARGUMENTS);
  }

  @Test void trace_checkedExceptionRethrownUnchanged() {
    Exception error = new Exception("checked");

    try (Tracer.SpanInScope ws = tracer.withSpanInScope(root)) {
      assertThatThrownBy(() -> tracer.trace("fails", () -> {
        throw error;
      })).isSameAs(error);
      assertThat(tracer.currentSpan()).isSameAs(root);
    }

    assertThat(root.children().get(0).data()).containsKey(SpanKeys.EXCEPTION);
  }

  @Test void trace_virtualMachineErrorNotRecorded() {
    StackOverflowError error = new StackOverflowError();

    try (Tracer.SpanInScope ws = tracer.withSpanInScope(root)) {
      assertThatThrownBy(() -> tracer.trace("overflows", (Runnable) () -> {
        throw error;
      })).isSameAs(error);
      assertThat(tracer.currentSpan()).isSameAs(root);
    }

    assertThat(root.children().get(0).data())
      .doesNotContainKey(SpanKeys.EXCEPTION)
      .containsKey(SpanKeys.END_TIME);
  }

  @Test void trace_unserializableArgumentsRecordedAsString() throws Exception {
    Object argument = new Object() {
      @Override public String toString() {
        return "opaque";
      }
    };

    try (Tracer.SpanInScope ws = tracer.withSpanInScope(root)) {
      tracer.trace("opaque", Map.of("arg", argument), () -> 1);
    }

    @SuppressWarnings("unchecked")
    Map<String, Object> function =
      (Map<String, Object>) root.children().get(0).data().get(SpanKeys.TRACE_FUNCTION);
    assertThat(function.get(SpanKeys.ARGUMENTS)).isEqualTo(Map.of("arg", "opaque"));
  }

  @Test void log_createsFinishedChild() {
    try (Tracer.SpanInScope ws = tracer.withSpanInScope(root)) {
      tracer.log("event", Map.of("k", "v"));
      assertThat(tracer.currentSpan()).isSameAs(root);
    }

    InMemorySpan event = root.children().get(0);
    assertThat(event.name()).isEqualTo("event");
    assertThat(event.data()).containsEntry("k", "v")
      .containsKeys(SpanKeys.START_TIME, SpanKeys.END_TIME);
  }

  interface OtherSpan extends Span {
  }
}
