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
import java.io.Closeable;
import java.io.Serializable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs tasks in child JVMs, at most a fixed number at a time. Each task runs in its own process,
 * under the span that was current when it was submitted.
 *
 * <p>The returned futures complete with the task's result, which must be serializable. If the
 * task throws, {@link Future#get()} throws an {@link java.util.concurrent.ExecutionException}
 * whose cause is what the task threw. Cancelling a running task kills its process.
 */
public final class TracingProcessPool implements Closeable {
  public static TracingProcessPool create(int maxProcesses) {
    return create(ThreadLocalCurrentSpanContext.create(), maxProcesses);
  }

  public static TracingProcessPool create(CurrentSpanContext currentSpanContext,
    int maxProcesses) {
    if (currentSpanContext == null) throw new NullPointerException("currentSpanContext == null");
    if (maxProcesses < 1) throw new IllegalArgumentException("maxProcesses < 1");
    return new TracingProcessPool(currentSpanContext, maxProcesses);
  }

  final CurrentSpanContext currentSpanContext;
  final ExecutorService launchers;

  TracingProcessPool(CurrentSpanContext currentSpanContext, int maxProcesses) {
    this.currentSpanContext = currentSpanContext;
    this.launchers = Executors.newFixedThreadPool(maxProcesses, new LauncherThreadFactory());
  }

  /**
   * Captures the current span and queues the task.
   *
   * @throws IllegalStateException if the current span can't leave this process
   */
  public <V> Future<V> submit(SerializableCallable<V> task) {
    if (task == null) throw new NullPointerException("task == null");
    SpanReference parent = ProcessPropagation.capture(currentSpanContext);
    return launchers.submit(() -> runInChild(task, parent));
  }

  /** Like {@link #submit(SerializableCallable)} for tasks without a result. */
  public Future<?> submit(SerializableRunnable task) {
    if (task == null) throw new NullPointerException("task == null");
    SpanReference parent = ProcessPropagation.capture(currentSpanContext);
    return launchers.submit(() -> runInChild(task, parent));
  }

  /** Stops accepting tasks. Queued tasks still run. */
  public void shutdown() {
    launchers.shutdown();
  }

  public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
    return launchers.awaitTermination(timeout, unit);
  }

  /** Stops accepting tasks and waits for those already submitted. */
  @Override public void close() {
    launchers.shutdown();
    try {
      while (!launchers.awaitTermination(1, TimeUnit.MINUTES)) {
        // keep waiting: tasks are bounded by their own processes
      }
    } catch (InterruptedException e) {
      launchers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  @SuppressWarnings("unchecked")
  static <V> V runInChild(Serializable task, @Nullable SpanReference parent) throws Exception {
    ForkedProcess forked = ForkedProcess.start(task, parent);
    try {
      forked.waitFor();
    } catch (InterruptedException e) {
      forked.destroy();
      throw e;
    }
    return (V) forked.result().get();
  }

  static final class LauncherThreadFactory implements ThreadFactory {
    static final AtomicInteger POOL = new AtomicInteger();
    final int pool = POOL.incrementAndGet();
    final AtomicInteger thread = new AtomicInteger();

    @Override public Thread newThread(Runnable runnable) {
      Thread result = new Thread(runnable,
        "TracingProcessPool-" + pool + "-launcher-" + thread.incrementAndGet());
      result.setDaemon(true);
      return result;
    }
  }

  @Override public String toString() {
    return "TracingProcessPool{" + launchers + "}";
  }
}
