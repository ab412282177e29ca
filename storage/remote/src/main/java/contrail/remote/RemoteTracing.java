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
package contrail.remote;

import contrail.SpanId;
import contrail.SpanStoreException;
import contrail.Tracing;
import contrail.internal.Nullable;
import contrail.internal.Platform;
import contrail.propagation.CurrentSpanContext;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.concurrent.TimeoutException;

/**
 * Records the trace through a {@link SpanServer}, so processes on other hosts can add spans.
 *
 * <p>Either attach to a running server with {@link Builder#url(String)}, or set {@link
 * Builder#databasePath(Path)} to run a server process for the duration of the tracing:
 * <pre>{@code
 * try (RemoteTracing tracing = RemoteTracing.newBuilder().databasePath(db).build().start()) {
 *   tracing.tracer().trace("import", () -> importer.run());
 * }
 * }</pre>
 *
 * <p>{@link #build()} returns once the server answers its readiness probe. The root span is
 * created by {@link #start()}.
 */
public final class RemoteTracing extends Tracing<RemoteSpan, RemoteTree> {
  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder extends Tracing.Builder {
    @Nullable Path databasePath;
    @Nullable String url;
    @Nullable SpanId rootId;
    Duration readinessTimeout = Duration.ofSeconds(30), pollInterval = Duration.ofMillis(500);

    Builder() {
    }

    /** Runs a server over this SQLite database, stopped when the tracing closes. */
    public Builder databasePath(Path databasePath) {
      if (databasePath == null) throw new NullPointerException("databasePath == null");
      this.databasePath = databasePath;
      return this;
    }

    /** Uses the server at this base URL, such as {@code http://127.0.0.1:9411}. */
    public Builder url(String url) {
      if (url == null) throw new NullPointerException("url == null");
      this.url = url;
      return this;
    }

    /** Continues the trace under this root, or creates it with this ID if the server lacks it. */
    public Builder rootId(SpanId rootId) {
      if (rootId == null) throw new NullPointerException("rootId == null");
      this.rootId = rootId;
      return this;
    }

    /**
     * How long to wait for the server to become ready, and for a server process to report its
     * port. Defaults to 30 seconds.
     */
    public Builder readinessTimeout(Duration readinessTimeout) {
      if (readinessTimeout == null) throw new NullPointerException("readinessTimeout == null");
      this.readinessTimeout = readinessTimeout;
      return this;
    }

    /** Delay between readiness probes. Defaults to half a second. */
    public Builder pollInterval(Duration pollInterval) {
      if (pollInterval == null) throw new NullPointerException("pollInterval == null");
      this.pollInterval = pollInterval;
      return this;
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

    /**
     * @throws IllegalStateException unless exactly one of the database path and URL is set
     * @throws SpanStoreException if the server could not be started or isn't ready in time
     */
    @Override public RemoteTracing build() {
      if ((databasePath == null) == (url == null)) {
        throw new IllegalStateException("set either databasePath or url");
      }
      return new RemoteTracing(this);
    }
  }

  @Nullable final SpanServerProcess serverProcess;
  final SpanClient client;
  final RemoteSpan root;
  final boolean joinedRoot, ensureRoot;

  RemoteTracing(Builder builder) {
    super(builder);
    if (builder.databasePath != null) {
      try {
        serverProcess = SpanServerProcess.start(builder.databasePath, builder.readinessTimeout);
      } catch (IOException e) {
        throw new SpanStoreException("could not launch a span server", e);
      }
      client = SpanClient.create(serverProcess.url());
    } else {
      serverProcess = null;
      client = SpanClient.create(builder.url);
    }
    try {
      client.awaitReady(builder.readinessTimeout, builder.pollInterval);
      SpanId rootId = builder.rootId;
      ensureRoot = rootId != null;
      if (rootId != null && client.hasSpan(rootId)) {
        root = new RemoteSpan(client, rootId, client.getSpan(rootId).name());
        joinedRoot = true;
      } else {
        root = new RemoteSpan(client, rootId != null ? rootId : SpanId.next(), rootName());
        joinedRoot = false;
      }
    } catch (TimeoutException e) {
      stopServer();
      throw new SpanStoreException(e.getMessage(), e);
    } catch (InterruptedException e) {
      stopServer();
      Thread.currentThread().interrupt();
      throw new SpanStoreException("interrupted waiting for " + client.url(), e);
    } catch (RuntimeException e) {
      stopServer();
      throw e;
    }
  }

  /** The client of the server, usable by other components of this process. */
  public SpanClient client() {
    return client;
  }

  @Override public RemoteSpan rootSpan() {
    return root;
  }

  @Override public RemoteTree tree() {
    return new RemoteTree(client, root.id, root.name, null);
  }

  @Override public RemoteTracing start() {
    super.start();
    return this;
  }

  @Override protected void doStart() {
    if (joinedRoot) return;
    if (!ensureRoot) {
      client.putSpan(root.id, root.name, Collections.emptyMap(), null);
    } else if (!client.ensureSpan(root.id, root.name, Collections.emptyMap(), null)) {
      // another process created the root after this one was built
      Platform.get().log("joined root {0} created by another process", root.id, null);
    }
  }

  @Override protected void doClose() {
    stopServer();
  }

  void stopServer() {
    if (serverProcess != null) serverProcess.close();
  }

  @Override public String toString() {
    return "RemoteTracing{url=" + client.url() + ", rootId=" + root.id + "}";
  }
}
