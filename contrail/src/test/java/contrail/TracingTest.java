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

import contrail.propagation.CurrentSpanContext;
import contrail.propagation.ThreadLocalCurrentSpanContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/** Lifecycle of {@link Tracing} when the store misbehaves. */
@ExtendWith(MockitoExtension.class)
class TracingTest {
  @Mock Span root;
  ThreadLocalCurrentSpanContext currentSpanContext =
    ThreadLocalCurrentSpanContext.newBuilder().build();

  @AfterEach void clear() {
    currentSpanContext.clear();
  }

  @Test void start_storeFailureClosesTracing() {
    SpanStoreException failure = new SpanStoreException("disk full");
    doThrow(failure).when(root).updateData(anyMap());
    FakeTracing tracing = new FakeTracing(root, currentSpanContext);

    assertThatThrownBy(tracing::start).isSameAs(failure);

    assertThat(tracing.closed).isEqualTo(1);
    assertThat(currentSpanContext.get()).isNull();
    assertThatThrownBy(tracing::start)
      .isInstanceOf(IllegalStateException.class)
      .hasMessage("tracing is closed");
  }

  @Test void close_endTimeFailureStillRestoresScope() {
    doNothing().doThrow(new SpanStoreException("disk full")).when(root).updateData(anyMap());
    FakeTracing tracing = new FakeTracing(root, currentSpanContext);
    tracing.start();
    assertThat(currentSpanContext.get()).isSameAs(root);

    tracing.close();

    verify(root, times(2)).updateData(anyMap());
    assertThat(currentSpanContext.get()).isNull();
    assertThat(tracing.closed).isEqualTo(1);
  }

  @Test void close_withoutStartSkipsEndTime() {
    FakeTracing tracing = new FakeTracing(root, currentSpanContext);

    tracing.close();
    tracing.close();

    verify(root, never()).updateData(anyMap());
    assertThat(tracing.closed).isEqualTo(1);
  }

  static final class FakeBuilder extends Tracing.Builder {
    @Override public Tracing<?, ?> build() {
      throw new UnsupportedOperationException();
    }
  }

  static final class FakeTracing extends Tracing<Span, Tree> {
    final Span root;
    int closed;

    FakeTracing(Span root, CurrentSpanContext currentSpanContext) {
      super(new FakeBuilder().currentSpanContext(currentSpanContext));
      this.root = root;
    }

    @Override public Span rootSpan() {
      return root;
    }

    @Override public Tree tree() {
      throw new UnsupportedOperationException();
    }

    @Override protected void doClose() {
      closed++;
    }
  }
}
