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
package contrail.sqlite;

import contrail.SpanId;
import contrail.SpanStoreException;
import contrail.Tracing;
import contrail.internal.Nullable;
import contrail.internal.Platform;
import contrail.propagation.CurrentSpanContext;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Records the trace in a SQLite database file. Threads and child processes write to the same
 * file, so their spans join one tree.
 *
 * <p>By default each tracing adds a new root to the database. Set {@link Builder#rootId(SpanId)}
 * to continue a trace recorded earlier.
 */
public final class SqliteTracing extends Tracing<SqliteSpan, SqliteTree> {
  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder extends Tracing.Builder {
    Path path;
    @Nullable SpanId rootId;

    Builder() {
    }

    /** The database file, created with its parent directories if missing. */
    public Builder path(Path path) {
      if (path == null) throw new NullPointerException("path == null");
      this.path = path;
      return this;
    }

    /**
     * Uses this span as the root. If the database has it, the tracing continues it. Otherwise it
     * is created with {@link #rootName(String)}.
     */
    public Builder rootId(SpanId rootId) {
      if (rootId == null) throw new NullPointerException("rootId == null");
      this.rootId = rootId;
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

    @Override public SqliteTracing build() {
      if (path == null) throw new NullPointerException("path == null");
      return new SqliteTracing(this);
    }
  }

  final SpanDatabase database;
  final SqliteSpan root;

  SqliteTracing(Builder builder) {
    super(builder);
    database = SpanDatabase.open(builder.path);
    SpanId rootId = builder.rootId;
    if (rootId == null) {
      rootId = SpanId.next();
      database.insert(rootId, null, rootName(), "{}");
      root = new SqliteSpan(database, rootId, rootName());
    } else if (database.insertIfAbsent(rootId, null, rootName(), "{}")) {
      root = new SqliteSpan(database, rootId, rootName());
    } else {
      root = new SqliteSpan(database, rootId, database.getName(rootId));
    }
  }

  public SpanDatabase database() {
    return database;
  }

  @Override public SqliteSpan rootSpan() {
    return root;
  }

  @Override public SqliteTree tree() {
    return new SqliteTree(database, root.id, root.name, null);
  }

  @Override public SqliteTracing start() {
    super.start();
    return this;
  }

  @Override protected void doClose() {
    try {
      database.checkpoint();
    } catch (SpanStoreException e) {
      Platform.get().warn("could not checkpoint " + database.path(), e);
    }
  }

  @Override public String toString() {
    return "SqliteTracing{path=" + database.path() + ", rootId=" + root.id + "}";
  }
}
