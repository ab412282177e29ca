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

import contrail.SpanReference;
import contrail.internal.Nullable;
import contrail.propagation.CurrentSpanContext;
import contrail.propagation.ThreadLocalCurrentSpanContext;
import java.io.IOException;

/**
 * Runs a task in a new JVM, where the span that was current at {@link #start()} is current too.
 *
 * <p>The child is started from the {@code java} executable and class path of this JVM, so the
 * task's class must be on that class path. The current span must live in a store both processes
 * can reach, such as a JSON log or a SQLite database.
 *
 * <pre>{@code
 * TracingProcess process = TracingProcess.create(() -> tracer.log("child", Map.of())).start();
 * if (process.join() != 0) throw new IllegalStateException(process.failure());
 * }</pre>
 */
public final class TracingProcess {
  public static TracingProcess create(SerializableRunnable task) {
    return create(ThreadLocalCurrentSpanContext.create(), task);
  }

  public static TracingProcess create(CurrentSpanContext currentSpanContext,
    SerializableRunnable task) {
    if (currentSpanContext == null) throw new NullPointerException("currentSpanContext == null");
    if (task == null) throw new NullPointerException("task == null");
    return new TracingProcess(currentSpanContext, task);
  }

  final CurrentSpanContext currentSpanContext;
  final SerializableRunnable task;
  @Nullable ForkedProcess forked; // guarded by this

  TracingProcess(CurrentSpanContext currentSpanContext, SerializableRunnable task) {
    this.currentSpanContext = currentSpanContext;
    this.task = task;
  }

  /**
   * Captures the current span and launches the child process.
   *
   * @throws IllegalStateException if already started, or the current span can't leave this
   * process
   * @throws IOException if the child process could not be launched
   */
  public synchronized TracingProcess start() throws IOException {
    if (forked != null) throw new IllegalStateException("process already started");
    SpanReference parent = ProcessPropagation.capture(currentSpanContext);
    forked = ForkedProcess.start(task, parent);
    return this;
  }

  /** Waits for the child process to exit and returns its exit code. */
  public int join() throws InterruptedException {
    ForkedProcess forked = started();
    int exitCode = forked.waitFor();
    forked.result(); // clean up the temporary files
    return exitCode;
  }

  public boolean isAlive() {
    return started().isAlive();
  }

  /** Returns what the task threw, or null if it completed normally. Call after {@link #join()}. */
  public @Nullable Throwable failure() {
    ForkedProcess forked = started();
    if (forked.isAlive()) throw new IllegalStateException("process has not exited");
    return forked.result().error;
  }

  /** Kills the child process. Spans it didn't finish are left without an end time. */
  public void destroy() {
    started().destroy();
  }

  synchronized ForkedProcess started() {
    if (forked == null) throw new IllegalStateException("process not started");
    return forked;
  }

  @Override public String toString() {
    ForkedProcess forked;
    synchronized (this) {
      forked = this.forked;
    }
    return "TracingProcess{" + (forked != null ? forked : "new") + "}";
  }
}
