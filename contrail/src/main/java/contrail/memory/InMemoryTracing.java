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
package contrail.memory;

import contrail.Tracing;
import contrail.propagation.CurrentSpanContext;
import java.time.Clock;

/**
 * Keeps the trace in memory. Mostly useful in tests and for short-lived programs that inspect the
 * trace before exiting. Spans can't cross a process boundary.
 */
public final class InMemoryTracing extends Tracing<InMemorySpan, InMemorySpan> {
  public static InMemoryTracing create() {
    return newBuilder().build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder extends Tracing.Builder {
    Builder() {
    }

    @Override public Builder currentSpanContext(CurrentSpanContext currentSpanContext) {
      return (Builder) super.currentSpanContext(currentSpanContext);
    }

    @Override public Builder clock(Clock clock) {
      return (Builder) super.clock(clock);
    }

    @Override public Builder rootName(String rootName) {
      return (Builder) super.rootName(rootName);
    }

    @Override public InMemoryTracing build() {
      return new InMemoryTracing(this);
    }
  }

  final InMemorySpan root;

  InMemoryTracing(Builder builder) {
    super(builder);
    root = InMemorySpan.newRoot(rootName());
  }

  @Override public InMemorySpan rootSpan() {
    return root;
  }

  @Override public InMemorySpan tree() {
    return root;
  }

  @Override public InMemoryTracing start() {
    super.start();
    return this;
  }

  @Override public String toString() {
    return "InMemoryTracing{root=" + root.id() + "}";
  }
}
