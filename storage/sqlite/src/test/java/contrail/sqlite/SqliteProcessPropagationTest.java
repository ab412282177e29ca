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

import contrail.Span;
import contrail.Tracer;
import contrail.Tree;
import contrail.concurrent.SerializableRunnable;
import contrail.concurrent.TracingProcess;
import contrail.concurrent.TracingProcessPool;
import contrail.propagation.ThreadLocalCurrentSpanContext;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Future;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;

class SqliteProcessPropagationTest {
  @TempDir Path tempDir;
  ThreadLocalCurrentSpanContext currentSpanContext =
    ThreadLocalCurrentSpanContext.newBuilder().build();

  @AfterEach void clear() {
    currentSpanContext.clear();
  }

  SqliteTracing newTracing() {
    return SqliteTracing.newBuilder()
      .path(tempDir.resolve("trace.db"))
      .currentSpanContext(currentSpanContext)
      .build();
  }

  @Test void childProcessSeesSameSpan() throws Exception {
    try (SqliteTracing tracing = newTracing().start()) {
      TracingProcess process = TracingProcess.create(currentSpanContext, () -> {
        Span current = Tracer.create().currentSpanOrThrow();
        current.newChild("child-process", Map.of("seen_id", current.id().toString()));
      }).start();

      assertThat(process.join()).isZero();

      Tree child = tracing.tree().children().get(0);
      assertThat(child.name()).isEqualTo("child-process");
      assertThat(child.data()).containsEntry("seen_id", tracing.rootSpan().id().toString());
    }
  }

  @Test void poolTasksUpdateSharedSpan() throws Exception {
    try (SqliteTracing tracing = newTracing().start();
         TracingProcessPool pool = TracingProcessPool.create(currentSpanContext, 2)) {
      List<Future<?>> futures = new ArrayList<>();
      for (int i = 0; i < 4; i++) {
        String key = "task" + i;
        futures.add(pool.submit((SerializableRunnable)
          () -> Tracer.create().currentSpanOrThrow().updateData(Map.of(key, true))));
      }
      for (Future<?> future : futures) future.get();

      assertThat(tracing.rootSpan().data())
        .containsEntry("task0", true)
        .containsEntry("task1", true)
        .containsEntry("task2", true)
        .containsEntry("task3", true);
    }
  }
}
