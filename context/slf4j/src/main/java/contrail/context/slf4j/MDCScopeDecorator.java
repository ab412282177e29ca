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
package contrail.context.slf4j;

import contrail.Span;
import contrail.internal.Nullable;
import contrail.propagation.CurrentSpanContext.Scope;
import contrail.propagation.CurrentSpanContext.ScopeDecorator;
import org.slf4j.MDC;

/**
 * Adds {@value #SPAN_ID} and {@value #SPAN_NAME} of the current span to the SLF4J {@linkplain MDC
 * Mapped Diagnostic Context (MDC)}, so log lines can be correlated with the trace.
 *
 * <p>Ex.
 * <pre>{@code
 * tracing = SqliteTracing.newBuilder()
 *                        .currentSpanContext(ThreadLocalCurrentSpanContext.newBuilder()
 *                          .addScopeDecorator(MDCScopeDecorator.get())
 *                          .build()
 *                        )
 *                        ...
 *                        .build();
 * }</pre>
 */
public final class MDCScopeDecorator implements ScopeDecorator {
  public static final String SPAN_ID = "spanId";
  public static final String SPAN_NAME = "spanName";

  static final ScopeDecorator INSTANCE = new MDCScopeDecorator();

  public static ScopeDecorator get() {
    return INSTANCE;
  }

  @Override public Scope decorateScope(@Nullable Span currentSpan, Scope scope) {
    String previousId = MDC.get(SPAN_ID), previousName = MDC.get(SPAN_NAME);
    String id = currentSpan != null ? currentSpan.id().toString() : null;
    String name = currentSpan != null ? currentSpan.name() : null;
    if (equal(previousId, id) && equal(previousName, name)) return scope;

    update(SPAN_ID, id);
    update(SPAN_NAME, name);

    class MDCScope implements Scope {
      @Override public void close() {
        scope.close();
        update(SPAN_ID, previousId);
        update(SPAN_NAME, previousName);
      }

      @Override public String toString() {
        return "MDCScope(" + scope + ")";
      }
    }
    return new MDCScope();
  }

  static void update(String key, @Nullable String value) {
    if (value != null) {
      MDC.put(key, value);
    } else {
      MDC.remove(key);
    }
  }

  static boolean equal(@Nullable Object a, @Nullable Object b) {
    return a == null ? b == null : a.equals(b);
  }

  @Override public String toString() {
    return "MDCScopeDecorator{}";
  }

  MDCScopeDecorator() {
  }
}
