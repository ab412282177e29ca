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
import contrail.internal.Nullable;
import contrail.propagation.CurrentSpanContext;
import contrail.propagation.CurrentSpanContext.Scope;
import contrail.propagation.ThreadLocalCurrentSpanContext;

/**
 * A thread that runs its target with the span that was current when {@link #start()} was called.
 *
 * <p>The span is captured at start, not at construction, so a thread built ahead of time still
 * joins the trace that starts it. Pass the work as a target: subclasses that override {@link
 * #run()} must call {@code super.run()}.
 */
public class TracingThread extends Thread {
  final CurrentSpanContext currentSpanContext;
  volatile @Nullable Span parent;

  public TracingThread(Runnable target) {
    this(ThreadLocalCurrentSpanContext.create(), target);
  }

  public TracingThread(Runnable target, String name) {
    this(ThreadLocalCurrentSpanContext.create(), target, name);
  }

  public TracingThread(CurrentSpanContext currentSpanContext, Runnable target) {
    super(target);
    if (currentSpanContext == null) throw new NullPointerException("currentSpanContext == null");
    this.currentSpanContext = currentSpanContext;
  }

  public TracingThread(CurrentSpanContext currentSpanContext, Runnable target, String name) {
    super(target, name);
    if (currentSpanContext == null) throw new NullPointerException("currentSpanContext == null");
    this.currentSpanContext = currentSpanContext;
  }

  @Override public synchronized void start() {
    parent = currentSpanContext.get();
    super.start();
  }

  @Override public void run() {
    try (Scope scope = currentSpanContext.maybeScope(parent)) {
      super.run();
    }
  }
}
