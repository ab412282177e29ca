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
package contrail.propagation;

import contrail.Span;
import contrail.internal.Nullable;
import contrail.internal.WrappingExecutorService;
import java.io.Closeable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;

/**
 * This makes a given span the current span by placing it in scope (usually but not always a thread
 * local scope).
 *
 * <p>This type is an SPI, and intended to be used by implementors looking to change thread-local
 * storage, or integrate with other contexts such as logging (MDC).
 *
 * <h3>Crossing threads</h3>
 * A thread started without help sees no current span. Use {@link #wrap(Runnable)}, {@link
 * #executorService(ExecutorService)} or {@link contrail.concurrent.TracingThread} so that work on
 * another thread sees the span that was current when the work was handed over.
 */
public abstract class CurrentSpanContext {

  /** Implementations of this allow standardized configuration, for example scope decoration. */
  public abstract static class Builder {
    ArrayList<ScopeDecorator> scopeDecorators = new ArrayList<>();

    /** Implementations call decorators in order to add features like log correlation to a scope. */
    public Builder addScopeDecorator(ScopeDecorator scopeDecorator) {
      if (scopeDecorator == null) throw new NullPointerException("scopeDecorator == null");
      if (scopeDecorator == ScopeDecorator.NOOP) return this;
      this.scopeDecorators.add(scopeDecorator);
      return this;
    }

    public abstract CurrentSpanContext build();
  }

  /** Returns the current span in scope or null if there isn't one. */
  public abstract @Nullable Span get();

  /**
   * Sets the current span in scope until the returned object is closed. It is a programming error
   * to drop or never close the result. Using try-with-resources is preferred for this reason.
   *
   * @param currentSpan span to place into scope or null to clear the scope
   */
  public abstract Scope newScope(@Nullable Span currentSpan);

  final List<ScopeDecorator> scopeDecorators;

  protected CurrentSpanContext() {
    this.scopeDecorators = Collections.emptyList();
  }

  protected CurrentSpanContext(Builder builder) {
    this.scopeDecorators = new ArrayList<>(builder.scopeDecorators);
  }

  /**
   * When implementing {@linkplain #newScope(Span)}, decorate the result before returning it.
   *
   * <p>Ex.
   * <pre>{@code
   *   @Override public Scope newScope(@Nullable Span currentSpan) {
   *     final Span previous = local.get();
   *     local.set(currentSpan);
   *     class ThreadLocalScope implements Scope {
   *       @Override public void close() {
   *         local.set(previous);
   *       }
   *     }
   *     Scope result = new ThreadLocalScope();
   *     // ensure scope hooks are attached to the result
   *     return decorateScope(currentSpan, result);
   *   }
   * }</pre>
   */
  protected Scope decorateScope(@Nullable Span currentSpan, Scope scope) {
    int length = scopeDecorators.size();
    for (int i = 0; i < length; i++) {
      scope = scopeDecorators.get(i).decorateScope(currentSpan, scope);
    }
    return scope;
  }

  /**
   * Like {@link #newScope(Span)}, except returns {@link Scope#NOOP} if the given span is already in
   * scope. This is mostly used by wrappers, such as executor services, which usually have no
   * current span when invoked.
   *
   * <p>Spans are compared with {@link Span#equals(Object)}. Store-backed spans are equal when they
   * name the same row, so two handles to one span are considered the same.
   *
   * @param currentSpan span to place into scope or null to clear the scope
   * @return a new scope object or {@link Scope#NOOP} if the input is already the case
   */
  public Scope maybeScope(@Nullable Span currentSpan) {
    Span currentScope = get();
    if (currentSpan == null) {
      if (currentScope == null) return Scope.NOOP;
      return newScope(null);
    }
    return currentSpan.equals(currentScope) ? Scope.NOOP : newScope(currentSpan);
  }

  /** A span remains in the scope it was bound to until close is called. */
  public interface Scope extends Closeable {
    /** Returned when {@link CurrentSpanContext#maybeScope(Span)} detected scope redundancy. */
    Scope NOOP = new Scope() {
      @Override public void close() {
      }

      @Override public String toString() {
        return "NoopScope";
      }
    };

    /** No exceptions are thrown when unbinding a span scope. */
    @Override void close();
  }

  /**
   * Use this to add features such as thread checks or log correlation fields when a scope is
   * created or closed.
   */
  public interface ScopeDecorator {
    /** Use this when configuration results in no decoration needed. */
    ScopeDecorator NOOP = new ScopeDecorator() {
      @Override public Scope decorateScope(@Nullable Span currentSpan, Scope scope) {
        return scope;
      }

      @Override public String toString() {
        return "NoopScopeDecorator";
      }
    };

    Scope decorateScope(@Nullable Span currentSpan, Scope scope);
  }

  /** Wraps the input so that it executes with the same span as now. */
  public <C> Callable<C> wrap(Callable<C> task) {
    final Span invocationSpan = get();
    class CurrentSpanContextCallable implements Callable<C> {
      @Override public C call() throws Exception {
        try (Scope scope = maybeScope(invocationSpan)) {
          return task.call();
        }
      }
    }
    return new CurrentSpanContextCallable();
  }

  /** Wraps the input so that it executes with the same span as now. */
  public Runnable wrap(Runnable task) {
    final Span invocationSpan = get();
    class CurrentSpanContextRunnable implements Runnable {
      @Override public void run() {
        try (Scope scope = maybeScope(invocationSpan)) {
          task.run();
        }
      }
    }
    return new CurrentSpanContextRunnable();
  }

  /**
   * Decorates the input such that the {@link #get() current span} at the time a task is scheduled
   * is made current when the task is executed.
   */
  public Executor executor(Executor delegate) {
    class CurrentSpanContextExecutor implements Executor {
      @Override public void execute(Runnable task) {
        delegate.execute(CurrentSpanContext.this.wrap(task));
      }
    }
    return new CurrentSpanContextExecutor();
  }

  /**
   * Decorates the input such that the {@link #get() current span} at the time a task is scheduled
   * is made current when the task is executed.
   */
  public ExecutorService executorService(ExecutorService delegate) {
    class CurrentSpanContextExecutorService extends WrappingExecutorService {

      @Override protected ExecutorService delegate() {
        return delegate;
      }

      @Override protected <C> Callable<C> wrap(Callable<C> task) {
        return CurrentSpanContext.this.wrap(task);
      }

      @Override protected Runnable wrap(Runnable task) {
        return CurrentSpanContext.this.wrap(task);
      }
    }
    return new CurrentSpanContextExecutorService();
  }
}
