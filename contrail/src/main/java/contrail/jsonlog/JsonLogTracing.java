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
package contrail.jsonlog;

import contrail.SpanStoreException;
import contrail.Tracing;
import contrail.propagation.CurrentSpanContext;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Collections;
import java.util.UUID;

/**
 * Appends the trace to a file of JSON lines, one per span creation or data update. Several
 * processes can append to the same log, so spans created in child processes join the tree.
 *
 * @see JsonLogParser for the line format
 */
public final class JsonLogTracing extends Tracing<JsonLogSpan, JsonLogTree> {
  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder extends Tracing.Builder {
    Path path;

    Builder() {
    }

    /**
     * The log file to append to. If this is an existing directory, a new file named
     * {@code <uuid>.log} is created inside it. Missing parent directories are created.
     */
    public Builder path(Path path) {
      if (path == null) throw new NullPointerException("path == null");
      this.path = path;
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

    @Override public JsonLogTracing build() {
      if (path == null) throw new NullPointerException("path == null");
      return new JsonLogTracing(this);
    }
  }

  final JsonLogFile file;
  final JsonLogSpan root;

  JsonLogTracing(Builder builder) {
    super(builder);
    Path path = builder.path;
    if (Files.isDirectory(path)) path = path.resolve(UUID.randomUUID() + ".log");
    try {
      Path parent = path.toAbsolutePath().getParent();
      if (parent != null) Files.createDirectories(parent);
    } catch (IOException e) {
      throw new SpanStoreException("could not create the directory of " + path, e);
    }
    file = new JsonLogFile(path);
    root = JsonLogSpan.create(file, null, rootName(), Collections.emptyMap());
  }

  /** The absolute path of the log. */
  public Path path() {
    return file.path;
  }

  @Override public JsonLogSpan rootSpan() {
    return root;
  }

  @Override public JsonLogTree tree() {
    return JsonLogParser.parse(file.path);
  }

  @Override public JsonLogTracing start() {
    super.start();
    return this;
  }

  @Override public String toString() {
    return "JsonLogTracing{path=" + file.path + "}";
  }
}
