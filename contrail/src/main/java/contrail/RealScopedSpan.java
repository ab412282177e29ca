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

import contrail.internal.Throwables;
import contrail.propagation.CurrentSpanContext.Scope;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** This wraps a span in scope and restores the previous span on finish. */
final class RealScopedSpan extends ScopedSpan {
  final Span span;
  final Scope scope;
  final Tracer tracer;

  RealScopedSpan(Span span, Scope scope, Tracer tracer) {
    this.span = span;
    this.scope = scope;
    this.tracer = tracer;
  }

  @Override public boolean isNoop() {
    return false;
  }

  @Override public Span span() {
    return span;
  }

  @Override public ScopedSpan updateData(Map<String, ?> patch) {
    span.updateData(patch);
    return this;
  }

  @Override public ScopedSpan error(Throwable throwable) {
    Map<String, Object> exception = new LinkedHashMap<>();
    exception.put(SpanKeys.TYPE, throwable.getClass().getName());
    if (throwable.getMessage() != null) exception.put(SpanKeys.VALUE, throwable.getMessage());
    exception.put(SpanKeys.TRACEBACK, Throwables.stackTrace(throwable));
    span.updateData(Collections.singletonMap(SpanKeys.EXCEPTION, exception));
    return this;
  }

  @Override public void finish() {
    try {
      span.updateData(Collections.singletonMap(SpanKeys.END_TIME, tracer.timestamp()));
    } finally {
      scope.close();
    }
  }

  @Override public String toString() {
    return "RealScopedSpan(" + span + ")";
  }
}
